package io.faultline;

import java.util.List;
import java.util.function.Predicate;

/**
 * One frame of a captured stack trace.
 *
 * @param function  method name
 * @param module    declaring class name
 * @param filename  source file name, or {@code null} if unknown
 * @param lineno    line number, or {@code null} if unknown
 * @param inApp     whether the frame belongs to application code
 */
public record StackFrame(String function, String module, String filename, Integer lineno, boolean inApp) {

  /** Class name prefixes treated as library code by default. */
  public static final List<String> DEFAULT_NOT_IN_APP = List.of(
      "java.", "javax.", "jakarta.", "jdk.", "sun.", "com.sun.", "kotlin.", "scala.",
      "org.junit.", "org.springframework.", "io.faultline.");

  /**
   * Builds a frame from a JVM stack trace element.
   *
   * @param element the element
   * @param inApp   decides, from the class name, whether the frame is application code
   * @return the frame
   */
  public static StackFrame from(StackTraceElement element, Predicate<String> inApp) {
    Integer line = element.getLineNumber() > 0 ? element.getLineNumber() : null;
    return new StackFrame(element.getMethodName(), element.getClassName(),
        element.getFileName(), line, inApp.test(element.getClassName()));
  }

  /**
   * Default in-app test: everything outside {@link #DEFAULT_NOT_IN_APP}.
   *
   * @param className fully qualified class name
   * @return {@code true} for application classes
   */
  public static boolean isInAppByDefault(String className) {
    for (String prefix : DEFAULT_NOT_IN_APP) {
      if (className.startsWith(prefix)) {
        return false;
      }
    }
    return true;
  }
}
