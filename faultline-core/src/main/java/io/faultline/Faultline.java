package io.faultline;

import io.faultline.scope.CaptureContext;
import io.faultline.scope.Scope;

import java.util.Map;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Process-wide entry point.
 *
 * <p>Call {@link #init(FaultlineOptions)} once at startup, then use the static helpers from
 * anywhere:
 *
 * <pre>{@code
 * Faultline.init(FaultlineOptions.builder(System.getenv("FAULTLINE_DSN"))
 *     .release(System.getenv("APP_VERSION"))
 *     .build());
 *
 * try {
 *   riskyOperation();
 * } catch (Exception e) {
 *   Faultline.captureException(e);
 * }
 *
 * Faultline.withScope(scope -> {
 *   scope.setTag("order_id", orderId);
 *   Faultline.captureMessage("Payment gateway timed out", Level.WARNING);
 * });
 *
 * Faultline.close();
 * }</pre>
 *
 * <p>Before {@code init} and after {@code close} every helper logs
 * {@value #NOT_INITIALIZED_MESSAGE} at {@code WARNING} and does nothing: captures return
 * {@code ""}, scope callbacks are not invoked.
 */
public final class Faultline {
  private static final Logger logger = Logger.getLogger(Faultline.class.getName());

  public static final String NOT_INITIALIZED_MESSAGE = "Error tracking client not initialized. Call init() first.";

  /** Timeout used by {@link #close()} and {@link #flush()}. */
  public static final long DEFAULT_TIMEOUT_MS = 2000L;

  private static volatile FaultlineClient instance;

  private Faultline() {
  }

  /**
   * Creates the process-wide client. A previous client is disabled and its transport closed
   * without waiting for pending events.
   *
   * @param options the configuration
   * @return the new client
   * @throws IllegalArgumentException if {@code options} is null
   */
  public static synchronized FaultlineClient init(FaultlineOptions options) {
    if (options == null) {
      throw new IllegalArgumentException("FaultlineOptions must not be null");
    }
    FaultlineClient previous = instance;
    if (previous != null) {
      logger.fine("Replacing the existing client");
      previous.closeNow();
    }
    instance = new FaultlineClient(options);
    return instance;
  }

  /**
   * @return the process-wide client, or {@code null} before {@link #init(FaultlineOptions)}
   */
  public static FaultlineClient getCurrentClient() {
    return instance;
  }

  public static boolean isEnabled() {
    FaultlineClient c = instance;
    return c != null && c.isEnabled();
  }

  public static String captureException(Throwable error) {
    FaultlineClient c = client();
    return c != null ? c.captureException(error) : "";
  }

  public static String captureException(Throwable error, CaptureContext captureContext) {
    FaultlineClient c = client();
    return c != null ? c.captureException(error, captureContext) : "";
  }

  public static String captureMessage(String message) {
    FaultlineClient c = client();
    return c != null ? c.captureMessage(message) : "";
  }

  public static String captureMessage(String message, Level level) {
    FaultlineClient c = client();
    return c != null ? c.captureMessage(message, level) : "";
  }

  public static String captureMessage(String message, Level level, CaptureContext captureContext) {
    FaultlineClient c = client();
    return c != null ? c.captureMessage(message, level, captureContext) : "";
  }

  public static String captureEvent(Event event) {
    FaultlineClient c = client();
    return c != null ? c.captureEvent(event) : "";
  }

  public static String captureEvent(Event event, CaptureContext captureContext) {
    FaultlineClient c = client();
    return c != null ? c.captureEvent(event, captureContext) : "";
  }

  public static void setUser(User user) {
    FaultlineClient c = client();
    if (c != null) c.setUser(user);
  }

  public static void setTag(String key, String value) {
    FaultlineClient c = client();
    if (c != null) c.setTag(key, value);
  }

  public static void setTags(Map<String, String> tags) {
    FaultlineClient c = client();
    if (c != null) c.setTags(tags);
  }

  public static void setExtra(String key, Object value) {
    FaultlineClient c = client();
    if (c != null) c.setExtra(key, value);
  }

  public static void setExtras(Map<String, ?> extras) {
    FaultlineClient c = client();
    if (c != null) c.setExtras(extras);
  }

  public static void setContext(String name, Map<String, ?> values) {
    FaultlineClient c = client();
    if (c != null) c.setContext(name, values);
  }

  public static void addBreadcrumb(Breadcrumb breadcrumb) {
    FaultlineClient c = client();
    if (c != null) c.addBreadcrumb(breadcrumb);
  }

  public static void clearBreadcrumbs() {
    FaultlineClient c = client();
    if (c != null) c.clearBreadcrumbs();
  }

  /**
   * Mutates the current scope in place.
   *
   * @param callback receives the current scope; not invoked without an enabled client
   */
  public static void configureScope(Consumer<Scope> callback) {
    FaultlineClient c = client();
    if (c != null) c.configureScope(callback);
  }

  /**
   * Runs {@code callback} with a pushed scope that is popped afterwards, also when the
   * callback throws.
   *
   * @param callback receives the pushed scope; not invoked without an enabled client
   */
  public static void withScope(Consumer<Scope> callback) {
    FaultlineClient c = client();
    if (c != null) c.withScope(callback);
  }

  /**
   * Runs {@code task} against a fork of the current hub, so its tags, user and breadcrumbs
   * stay out of other flows. Without a client the task still runs, unisolated.
   *
   * @param task the work to run
   */
  public static void runIsolated(Runnable task) {
    FaultlineClient c = client();
    if (c != null) {
      c.runIsolated(task);
    } else {
      task.run();
    }
  }

  public static boolean flush() {
    return flush(DEFAULT_TIMEOUT_MS);
  }

  /**
   * Waits for pending events; the client stays usable.
   *
   * @param timeoutMs maximum wait in milliseconds
   * @return {@code true} if everything pending was delivered or dropped before the timeout;
   *     {@code false} on timeout or without a client
   */
  public static boolean flush(long timeoutMs) {
    FaultlineClient c = instance;
    if (c == null) {
      logger.warning(NOT_INITIALIZED_MESSAGE);
      return false;
    }
    return c.flush(timeoutMs);
  }

  public static boolean close() {
    return close(DEFAULT_TIMEOUT_MS);
  }

  /**
   * Disables the client, then waits for pending events.
   *
   * @param timeoutMs maximum wait in milliseconds
   * @return {@code true} if everything pending finished before the timeout;
   *     {@code false} on timeout or without a client
   */
  public static boolean close(long timeoutMs) {
    FaultlineClient c = instance;
    if (c == null) {
      logger.warning(NOT_INITIALIZED_MESSAGE);
      return false;
    }
    return c.close(timeoutMs);
  }

  static synchronized void reset() {
    FaultlineClient c = instance;
    instance = null;
    if (c != null) {
      c.closeNow();
    }
  }

  private static FaultlineClient client() {
    FaultlineClient c = instance;
    if (c == null) {
      logger.warning(NOT_INITIALIZED_MESSAGE);
    }
    return c;
  }
}
