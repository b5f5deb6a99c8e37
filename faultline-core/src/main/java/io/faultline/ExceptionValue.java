package io.faultline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * A single exception within an event. A {@link Throwable} with causes becomes a list of
 * values ordered innermost cause first.
 *
 * @param type       exception class name
 * @param value      exception message, may be null
 * @param module     package of the exception class
 * @param frames     stack frames ordered oldest call first; empty when stack traces are off
 * @param mechanism  how the exception was captured
 */
public record ExceptionValue(String type, String value, String module, List<StackFrame> frames,
    Mechanism mechanism) {

  public ExceptionValue {
    Objects.requireNonNull(type, "type");
    frames = frames == null ? List.of() : List.copyOf(frames);
  }

  /**
   * Capture mechanism.
   *
   * @param type    {@code "generic"} for explicit captures, {@code "uncaught"} for the
   *                default uncaught-exception handler
   * @param handled whether the application handled the exception
   */
  public record Mechanism(String type, boolean handled) {
    public static final Mechanism GENERIC = new Mechanism("generic", true);
    public static final Mechanism UNCAUGHT = new Mechanism("uncaught", false);
  }

  /**
   * Converts a throwable and its cause chain.
   *
   * @param error            the throwable
   * @param attachStacktrace whether to include stack frames
   * @param inApp            in-app predicate over class names
   * @param mechanism        mechanism recorded on the outermost exception
   * @return values ordered innermost cause first
   */
  public static List<ExceptionValue> chainOf(Throwable error, boolean attachStacktrace,
      Predicate<String> inApp, Mechanism mechanism) {
    List<ExceptionValue> chain = new ArrayList<>();
    Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    Throwable current = error;
    boolean outermost = true;
    while (current != null && seen.add(current)) {
      chain.add(0, from(current, attachStacktrace, inApp, outermost ? mechanism : null));
      outermost = false;
      current = current.getCause();
    }
    return chain;
  }

  static ExceptionValue from(Throwable t, boolean attachStacktrace, Predicate<String> inApp,
      Mechanism mechanism) {
    List<StackFrame> frames = new ArrayList<>();
    if (attachStacktrace) {
      StackTraceElement[] trace = t.getStackTrace();
      for (int i = trace.length - 1; i >= 0; i--) {
        frames.add(StackFrame.from(trace[i], inApp));
      }
    }
    Package pkg = t.getClass().getPackage();
    return new ExceptionValue(t.getClass().getName(), t.getMessage(),
        pkg == null ? null : pkg.getName(), frames, mechanism);
  }
}
