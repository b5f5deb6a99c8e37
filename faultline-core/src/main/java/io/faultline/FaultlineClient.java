package io.faultline;

import io.faultline.scope.CaptureContext;
import io.faultline.scope.Hub;
import io.faultline.scope.Scope;
import io.faultline.scope.ThreadLocalHubContext;
import io.faultline.spi.MetricsExporter;
import io.faultline.transport.AsyncTransport;
import io.faultline.transport.EventSender;
import io.faultline.transport.ExponentialBackoffRetryPolicy;
import io.faultline.transport.HttpEventSender;
import io.faultline.transport.LoggingEventSender;
import io.faultline.transport.Transport;
import io.faultline.util.EventIds;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.DoubleSupplier;
import java.util.logging.Logger;

/**
 * A configured error-tracking client: options, a {@link Hub} and a {@link Transport}.
 *
 * <p>Capture methods run the pipeline synchronously on the calling thread:
 * <ol>
 *   <li>generate a fresh event id;</li>
 *   <li>drop ignored errors and apply the sample rate;</li>
 *   <li>build the base event and stamp environment, release, server name and sdk;</li>
 *   <li>fold the current hub's scopes and the optional {@link CaptureContext} into it;</li>
 *   <li>run the before-send callback, which may drop the event;</li>
 *   <li>stamp the id and hand the event to the transport without waiting.</li>
 * </ol>
 * The id is returned whether or not the event survived. Capture methods never throw.
 *
 * <p>Most applications use the static {@link Faultline} facade instead of this class.
 */
public final class FaultlineClient implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(FaultlineClient.class.getName());

  private final FaultlineOptions options;
  private final Hub hub;
  private final Transport transport;
  private final MetricsExporter metrics;
  private final DoubleSupplier random;
  private final ThreadLocalHubContext hubContext = new ThreadLocalHubContext();
  private final AtomicBoolean enabled = new AtomicBoolean(true);

  private final Object uncaughtLock = new Object();
  private Thread.UncaughtExceptionHandler previousUncaughtHandler;
  private Thread.UncaughtExceptionHandler installedUncaughtHandler;

  /**
   * Creates a client with the transport the options describe: the one passed to
   * {@link FaultlineOptions.Builder#transport(Transport)}, or an {@link AsyncTransport} over
   * HTTP (or over the log in debug mode).
   *
   * @param options the configuration
   */
  public FaultlineClient(FaultlineOptions options) {
    this(options, createTransport(Objects.requireNonNull(options, "options")),
        () -> ThreadLocalRandom.current().nextDouble());
  }

  FaultlineClient(FaultlineOptions options, Transport transport, DoubleSupplier random) {
    this.options = Objects.requireNonNull(options, "options");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.random = random;
    this.metrics = options.metrics();
    this.hub = new Hub(options.maxBreadcrumbs());
    if (options.autoCaptureUncaught()) {
      installUncaughtHandler();
    }
    setupIntegrations();
  }

  private void setupIntegrations() {
    for (Integration integration : options.integrations()) {
      try {
        integration.setupOnce(this);
      } catch (RuntimeException e) {
        logger.log(java.util.logging.Level.WARNING, "Failed to set up integration " + integration.name(), e);
      }
    }
  }

  static Transport createTransport(FaultlineOptions options) {
    if (options.transport() != null) {
      return options.transport();
    }
    EventSender sender = options.debug()
        ? new LoggingEventSender()
        : new HttpEventSender(options.dsn(), FaultlineOptions.SDK_NAME + "/" + FaultlineOptions.SDK_VERSION);
    return AsyncTransport.builder()
        .sender(sender)
        .workerCount(options.workerCount())
        .queueCapacity(options.queueCapacity())
        .maxAttempts(options.maxAttempts())
        .retryPolicy(new ExponentialBackoffRetryPolicy(options.retryBaseDelayMs(), options.retryMaxDelayMs()))
        .metrics(options.metrics())
        .build();
  }

  public FaultlineOptions getOptions() {
    return options;
  }

  public Transport getTransport() {
    return transport;
  }

  /** The client's main hub, shared by every thread without an isolated hub. */
  public Hub getHub() {
    return hub;
  }

  /**
   * Hub used by captures and scope setters on the calling thread: the hub bound by
   * {@link #runIsolated(Runnable)} if any, otherwise {@link #getHub()}.
   *
   * @return the current hub
   */
  public Hub currentHub() {
    return hubContext.currentOr(hub);
  }

  public boolean isEnabled() {
    return enabled.get();
  }

  /**
   * Runs {@code task} on the calling thread against a fork of the current hub. Scope changes
   * made by the task stay in the fork.
   *
   * @param task the work to run
   */
  public void runIsolated(Runnable task) {
    hubContext.runWith(currentHub().fork(), task);
  }

  // --- capture ---------------------------------------------------------------

  public String captureException(Throwable error) {
    return captureException(error, null);
  }

  /**
   * Captures an exception and its cause chain at level {@link Level#ERROR}.
   *
   * @param error          the exception
   * @param captureContext one-shot scope overrides, may be null
   * @return the event id, or {@code ""} if the client is disabled or {@code error} is null
   */
  public String captureException(Throwable error, CaptureContext captureContext) {
    return captureThrowable(error, ExceptionValue.Mechanism.GENERIC, Level.ERROR, captureContext);
  }

  public String captureMessage(String message) {
    return captureMessage(message, Level.INFO, null);
  }

  public String captureMessage(String message, Level level) {
    return captureMessage(message, level, null);
  }

  /**
   * Captures a plain message.
   *
   * @param message        the message
   * @param level          severity; {@code null} means {@link Level#INFO}
   * @param captureContext one-shot scope overrides, may be null
   * @return the event id, or {@code ""} if the client is disabled
   */
  public String captureMessage(String message, Level level, CaptureContext captureContext) {
    if (!checkEnabled()) {
      return "";
    }
    Event base = Event.builder()
        .message(message)
        .level(level != null ? level : Level.INFO)
        .build();
    return process(base, captureContext);
  }

  public String captureEvent(Event event) {
    return captureEvent(event, null);
  }

  /**
   * Captures a caller-built event. Any id already on the event is replaced by a fresh one.
   *
   * @param event          the event
   * @param captureContext one-shot scope overrides, may be null
   * @return the event id, or {@code ""} if the client is disabled or {@code event} is null
   */
  public String captureEvent(Event event, CaptureContext captureContext) {
    if (!checkEnabled()) {
      return "";
    }
    if (event == null) {
      logger.warning("captureEvent called with a null event; nothing captured");
      return "";
    }
    return process(event, captureContext);
  }

  private String captureThrowable(Throwable error, ExceptionValue.Mechanism mechanism, Level level,
      CaptureContext captureContext) {
    if (!checkEnabled()) {
      return "";
    }
    if (error == null) {
      logger.warning("captureException called with a null exception; nothing captured");
      return "";
    }
    Event base;
    try {
      base = Event.builder()
          .exceptions(ExceptionValue.chainOf(error, options.attachStacktrace(), options::isInApp, mechanism))
          .level(level)
          .build();
    } catch (RuntimeException e) {
      logger.log(java.util.logging.Level.WARNING, "Failed to convert exception; capturing its message only", e);
      base = Event.builder().message(String.valueOf(error)).level(level).build();
    }
    return process(base, captureContext);
  }

  private String process(Event base, CaptureContext captureContext) {
    String eventId = EventIds.newEventId();
    try {
      if (isIgnored(base)) {
        dropped(eventId, "ignored");
        return eventId;
      }
      double rate = base.isTransaction() ? options.tracesSampleRate() : options.sampleRate();
      if (!sampled(rate)) {
        dropped(eventId, "sample_rate");
        return eventId;
      }
      Event event = currentHub().applyToEvent(withDefaults(base), captureContext);
      event = applyBeforeSend(event);
      if (event == null) {
        dropped(eventId, "before_send");
        return eventId;
      }
      transport.sendEvent(event.toBuilder().eventId(eventId).build());
    } catch (RuntimeException e) {
      logger.log(java.util.logging.Level.WARNING, "Failed to capture event " + eventId, e);
    }
    return eventId;
  }

  private boolean isIgnored(Event event) {
    List<ExceptionValue> exceptions = event.exceptions();
    if (exceptions.isEmpty()) {
      return false;
    }
    ExceptionValue outermost = exceptions.get(exceptions.size() - 1);
    return options.isIgnored(outermost.type(), outermost.value());
  }

  private boolean sampled(double rate) {
    if (rate >= 1.0) {
      return true;
    }
    return rate > 0.0 && random.getAsDouble() < rate;
  }

  private Event withDefaults(Event event) {
    Event.Builder builder = event.toBuilder();
    if (event.timestamp() == null) {
      builder.timestamp(Instant.now());
    }
    if (event.platform() == null) {
      builder.platform(Event.PLATFORM);
    }
    if (event.environment() == null) {
      builder.environment(options.environment());
    }
    if (event.release() == null) {
      builder.release(options.release());
    }
    if (event.serverName() == null) {
      builder.serverName(options.serverName());
    }
    if (event.sdkName() == null) {
      builder.sdk(FaultlineOptions.SDK_NAME, FaultlineOptions.SDK_VERSION);
    }
    return builder.build();
  }

  private Event applyBeforeSend(Event event) {
    try {
      if (event.isTransaction()) {
        BeforeSendTransactionCallback callback = options.beforeSendTransaction();
        return callback == null ? event : callback.beforeSendTransaction(event);
      }
      BeforeSendCallback callback = options.beforeSend();
      return callback == null ? event : callback.beforeSend(event);
    } catch (RuntimeException e) {
      logger.log(java.util.logging.Level.WARNING, "beforeSend callback failed; dropping event", e);
      return null;
    }
  }

  private void dropped(String eventId, String reason) {
    logger.fine("Event " + eventId + " dropped before transport: " + reason);
    metrics.incrementDroppedBeforeTransport(reason);
  }

  private boolean checkEnabled() {
    if (enabled.get()) {
      return true;
    }
    logger.warning(Faultline.NOT_INITIALIZED_MESSAGE);
    return false;
  }

  // --- scope proxies ---------------------------------------------------------

  private void updateScope(String operation, Consumer<Hub> update) {
    if (!checkEnabled()) {
      return;
    }
    try {
      update.accept(currentHub());
    } catch (RuntimeException e) {
      logger.log(java.util.logging.Level.WARNING, "Ignoring invalid " + operation + " call", e);
    }
  }

  public void setUser(User user) {
    updateScope("setUser", hub -> hub.setUser(user));
  }

  public void setTag(String key, String value) {
    updateScope("setTag", hub -> hub.setTag(key, value));
  }

  public void setTags(Map<String, String> tags) {
    updateScope("setTags", hub -> hub.setTags(tags));
  }

  public void setExtra(String key, Object value) {
    updateScope("setExtra", hub -> hub.setExtra(key, value));
  }

  public void setExtras(Map<String, ?> extras) {
    updateScope("setExtras", hub -> hub.setExtras(extras));
  }

  public void setContext(String name, Map<String, ?> values) {
    updateScope("setContext", hub -> hub.setContext(name, values));
  }

  public void setLevel(Level level) {
    updateScope("setLevel", hub -> hub.setLevel(level));
  }

  public void addBreadcrumb(Breadcrumb breadcrumb) {
    updateScope("addBreadcrumb", hub -> hub.addBreadcrumb(breadcrumb));
  }

  public void clearBreadcrumbs() {
    updateScope("clearBreadcrumbs", hub -> hub.clearBreadcrumbs());
  }

  public void configureScope(Consumer<Scope> callback) {
    if (checkEnabled()) {
      currentHub().configureScope(callback);
    }
  }

  public void withScope(Consumer<Scope> callback) {
    if (checkEnabled()) {
      currentHub().withScope(callback);
    }
  }

  // --- lifecycle -------------------------------------------------------------

  /**
   * Waits until every event handed to the transport reached a terminal outcome.
   *
   * @param timeoutMs maximum wait in milliseconds
   * @return {@code true} if nothing was pending at return
   */
  public boolean flush(long timeoutMs) {
    return transport.flush(timeoutMs);
  }

  /**
   * Disables the client, waits up to {@code timeoutMs} for pending events and closes the
   * transport. Later captures log a warning and return {@code ""}.
   *
   * @param timeoutMs maximum wait in milliseconds
   * @return {@code true} if every pending event finished before the timeout
   */
  public boolean close(long timeoutMs) {
    enabled.set(false);
    restoreUncaughtHandler();
    boolean drained = transport.flush(timeoutMs);
    if (!drained) {
      logger.warning("Timed out after " + timeoutMs + " ms waiting for pending events");
    }
    transport.close();
    return drained;
  }

  /**
   * Same as {@link #close(long)} with the configured
   * {@link FaultlineOptions#shutdownTimeoutMs() shutdown timeout}.
   */
  @Override
  public void close() {
    close(options.shutdownTimeoutMs());
  }

  /** Disables the client and closes the transport without waiting. */
  void closeNow() {
    enabled.set(false);
    restoreUncaughtHandler();
    transport.close();
  }

  // --- uncaught exceptions ---------------------------------------------------

  private void installUncaughtHandler() {
    synchronized (uncaughtLock) {
      previousUncaughtHandler = Thread.getDefaultUncaughtExceptionHandler();
      installedUncaughtHandler = new UncaughtHandler(previousUncaughtHandler);
      Thread.setDefaultUncaughtExceptionHandler(installedUncaughtHandler);
    }
  }

  private void restoreUncaughtHandler() {
    synchronized (uncaughtLock) {
      if (installedUncaughtHandler == null) {
        return;
      }
      if (Thread.getDefaultUncaughtExceptionHandler() == installedUncaughtHandler) {
        Thread.setDefaultUncaughtExceptionHandler(previousUncaughtHandler);
      }
      installedUncaughtHandler = null;
      previousUncaughtHandler = null;
    }
  }

  boolean hasInstalledUncaughtHandler() {
    synchronized (uncaughtLock) {
      return installedUncaughtHandler != null;
    }
  }

  private final class UncaughtHandler implements Thread.UncaughtExceptionHandler {
    private final Thread.UncaughtExceptionHandler previous;

    UncaughtHandler(Thread.UncaughtExceptionHandler previous) {
      this.previous = previous;
    }

    @Override
    public void uncaughtException(Thread thread, Throwable error) {
      try {
        if (enabled.get()) {
          captureThrowable(error, ExceptionValue.Mechanism.UNCAUGHT, Level.FATAL, null);
          transport.flush(options.shutdownTimeoutMs());
        }
      } catch (RuntimeException e) {
        logger.log(java.util.logging.Level.WARNING, "Failed to report uncaught exception", e);
      }
      if (previous != null) {
        previous.uncaughtException(thread, error);
      } else {
        System.err.print("Exception in thread \"" + thread.getName() + "\" ");
        error.printStackTrace(System.err);
      }
    }
  }
}
