package io.faultline;

import io.faultline.spi.MetricsExporter;
import io.faultline.transport.Transport;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Immutable client configuration.
 *
 * <pre>{@code
 * FaultlineOptions options = FaultlineOptions.builder("https://key@errors.example.com/42")
 *     .environment("staging")
 *     .release("shop@1.4.2")
 *     .sampleRate(0.5)
 *     .beforeSend(event -> event.tags().containsKey("synthetic") ? null : event)
 *     .build();
 * Faultline.init(options);
 * }</pre>
 *
 * @see Builder
 */
public final class FaultlineOptions {
  public static final String SDK_NAME = "faultline.java";
  public static final String SDK_VERSION = "0.1.0";

  private final Dsn dsn;
  private final String environment;
  private final String release;
  private final String serverName;
  private final boolean debug;
  private final double sampleRate;
  private final double tracesSampleRate;
  private final double profilesSampleRate;
  private final int maxBreadcrumbs;
  private final boolean attachStacktrace;
  private final List<Pattern> ignoreErrors;
  private final BeforeSendCallback beforeSend;
  private final BeforeSendTransactionCallback beforeSendTransaction;
  private final boolean autoCaptureUncaught;
  private final List<String> inAppIncludes;
  private final List<Integration> integrations;
  private final int workerCount;
  private final int queueCapacity;
  private final int maxAttempts;
  private final long retryBaseDelayMs;
  private final long retryMaxDelayMs;
  private final long shutdownTimeoutMs;
  private final MetricsExporter metrics;
  private final Transport transport;

  private FaultlineOptions(Builder builder) {
    this.dsn = builder.dsn;
    this.environment = builder.environment;
    this.release = builder.release;
    this.serverName = builder.serverName;
    this.debug = builder.debug;
    this.sampleRate = builder.sampleRate;
    this.tracesSampleRate = builder.tracesSampleRate;
    this.profilesSampleRate = builder.profilesSampleRate;
    this.maxBreadcrumbs = builder.maxBreadcrumbs;
    this.attachStacktrace = builder.attachStacktrace;
    this.ignoreErrors = List.copyOf(builder.ignoreErrors);
    this.beforeSend = builder.beforeSend;
    this.beforeSendTransaction = builder.beforeSendTransaction;
    this.autoCaptureUncaught = builder.autoCaptureUncaught;
    this.inAppIncludes = List.copyOf(builder.inAppIncludes);
    this.integrations = List.copyOf(builder.integrations);
    this.workerCount = builder.workerCount;
    this.queueCapacity = builder.queueCapacity;
    this.maxAttempts = builder.maxAttempts;
    this.retryBaseDelayMs = builder.retryBaseDelayMs;
    this.retryMaxDelayMs = builder.retryMaxDelayMs;
    this.shutdownTimeoutMs = builder.shutdownTimeoutMs;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.transport = builder.transport;
  }

  /**
   * Starts a builder for the given DSN.
   *
   * @param dsn data source name, see {@link Dsn}
   * @return a new builder
   * @throws IllegalArgumentException if the DSN is blank or malformed
   */
  public static Builder builder(String dsn) {
    return new Builder(dsn);
  }

  public Dsn dsn() {
    return dsn;
  }

  public String environment() {
    return environment;
  }

  public String release() {
    return release;
  }

  public String serverName() {
    return serverName;
  }

  /** When set, envelopes are logged instead of posted. */
  public boolean debug() {
    return debug;
  }

  public double sampleRate() {
    return sampleRate;
  }

  public double tracesSampleRate() {
    return tracesSampleRate;
  }

  /** Recorded for completeness; this client does not profile. */
  public double profilesSampleRate() {
    return profilesSampleRate;
  }

  public int maxBreadcrumbs() {
    return maxBreadcrumbs;
  }

  public boolean attachStacktrace() {
    return attachStacktrace;
  }

  public List<Pattern> ignoreErrors() {
    return ignoreErrors;
  }

  public BeforeSendCallback beforeSend() {
    return beforeSend;
  }

  public BeforeSendTransactionCallback beforeSendTransaction() {
    return beforeSendTransaction;
  }

  public boolean autoCaptureUncaught() {
    return autoCaptureUncaught;
  }

  public List<String> inAppIncludes() {
    return inAppIncludes;
  }

  public List<Integration> integrations() {
    return integrations;
  }

  public int workerCount() {
    return workerCount;
  }

  public int queueCapacity() {
    return queueCapacity;
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  public long retryBaseDelayMs() {
    return retryBaseDelayMs;
  }

  public long retryMaxDelayMs() {
    return retryMaxDelayMs;
  }

  public long shutdownTimeoutMs() {
    return shutdownTimeoutMs;
  }

  public MetricsExporter metrics() {
    return metrics;
  }

  /** Caller-supplied transport, or {@code null} to build the default one. */
  public Transport transport() {
    return transport;
  }

  /**
   * Whether frames of {@code className} belong to the application: classes under an
   * {@link Builder#inAppInclude(String) included} prefix always do, otherwise
   * {@link StackFrame#isInAppByDefault(String)} decides.
   *
   * @param className fully qualified class name
   * @return {@code true} for application classes
   */
  public boolean isInApp(String className) {
    for (String prefix : inAppIncludes) {
      if (className.startsWith(prefix)) {
        return true;
      }
    }
    return StackFrame.isInAppByDefault(className);
  }

  /**
   * Whether {@code error} matches one of the ignore patterns, tested against its message
   * and its class name.
   *
   * @param error the error, may be null
   * @return {@code true} if the error must not be reported
   */
  public boolean isIgnored(Throwable error) {
    return error != null && isIgnored(error.getClass().getName(), error.getMessage());
  }

  /**
   * Whether an exception with the given class name and message matches an ignore pattern.
   *
   * @param type    fully qualified exception class name
   * @param message exception message, may be null
   * @return {@code true} if the exception must not be reported
   */
  public boolean isIgnored(String type, String message) {
    if (type == null || ignoreErrors.isEmpty()) {
      return false;
    }
    for (Pattern pattern : ignoreErrors) {
      if ((message != null && pattern.matcher(message).find()) || pattern.matcher(type).find()) {
        return true;
      }
    }
    return false;
  }

  /** Builder for {@link FaultlineOptions}. */
  public static final class Builder {
    private final Dsn dsn;
    private String environment = "production";
    private String release;
    private String serverName;
    private boolean debug;
    private double sampleRate = 1.0;
    private double tracesSampleRate = 1.0;
    private double profilesSampleRate = 0.0;
    private int maxBreadcrumbs = 100;
    private boolean attachStacktrace = true;
    private final List<Pattern> ignoreErrors = new ArrayList<>();
    private BeforeSendCallback beforeSend;
    private BeforeSendTransactionCallback beforeSendTransaction;
    private boolean autoCaptureUncaught;
    private final List<String> inAppIncludes = new ArrayList<>();
    private final List<Integration> integrations = new ArrayList<>();
    private int workerCount = 1;
    private int queueCapacity = 100;
    private int maxAttempts = 3;
    private long retryBaseDelayMs = 200L;
    private long retryMaxDelayMs = 30_000L;
    private long shutdownTimeoutMs = 2_000L;
    private MetricsExporter metrics;
    private Transport transport;

    private Builder(String dsn) {
      this.dsn = Dsn.parse(dsn);
    }

    /**
     * Deployment environment attached to every event.
     *
     * <p>Optional. Defaults to {@code "production"}.
     *
     * @param environment the environment name
     * @return this builder
     */
    public Builder environment(String environment) {
      this.environment = environment;
      return this;
    }

    public Builder release(String release) {
      this.release = release;
      return this;
    }

    public Builder serverName(String serverName) {
      this.serverName = serverName;
      return this;
    }

    /**
     * Logs envelopes through {@code java.util.logging} instead of posting them.
     *
     * @param debug whether to enable debug mode
     * @return this builder
     */
    public Builder debug(boolean debug) {
      this.debug = debug;
      return this;
    }

    /**
     * Fraction of error and message events to keep.
     *
     * <p>Optional. Defaults to {@code 1.0}. Must be within [0, 1].
     *
     * @param sampleRate the rate
     * @return this builder
     */
    public Builder sampleRate(double sampleRate) {
      this.sampleRate = requireRate("sampleRate", sampleRate);
      return this;
    }

    /**
     * Fraction of transaction events to keep.
     *
     * <p>Optional. Defaults to {@code 1.0}. Must be within [0, 1].
     *
     * @param tracesSampleRate the rate
     * @return this builder
     */
    public Builder tracesSampleRate(double tracesSampleRate) {
      this.tracesSampleRate = requireRate("tracesSampleRate", tracesSampleRate);
      return this;
    }

    public Builder profilesSampleRate(double profilesSampleRate) {
      this.profilesSampleRate = requireRate("profilesSampleRate", profilesSampleRate);
      return this;
    }

    /**
     * Breadcrumb capacity of every scope.
     *
     * <p>Optional. Defaults to {@code 100}. {@code 0} disables breadcrumbs.
     *
     * @param maxBreadcrumbs the capacity
     * @return this builder
     */
    public Builder maxBreadcrumbs(int maxBreadcrumbs) {
      if (maxBreadcrumbs < 0) {
        throw new IllegalArgumentException("maxBreadcrumbs must be >= 0, got: " + maxBreadcrumbs);
      }
      this.maxBreadcrumbs = maxBreadcrumbs;
      return this;
    }

    public Builder attachStacktrace(boolean attachStacktrace) {
      this.attachStacktrace = attachStacktrace;
      return this;
    }

    /**
     * Drops exceptions whose message or class name contains {@code text}.
     *
     * @param text literal text to look for
     * @return this builder
     */
    public Builder ignoreError(String text) {
      Objects.requireNonNull(text, "text");
      this.ignoreErrors.add(Pattern.compile(Pattern.quote(text)));
      return this;
    }

    /**
     * Drops exceptions whose message or class name contains a match of {@code regex}.
     *
     * @param regex a {@link Pattern} expression
     * @return this builder
     * @throws java.util.regex.PatternSyntaxException if the expression is invalid
     */
    public Builder ignoreErrorPattern(String regex) {
      Objects.requireNonNull(regex, "regex");
      this.ignoreErrors.add(Pattern.compile(regex));
      return this;
    }

    public Builder beforeSend(BeforeSendCallback beforeSend) {
      this.beforeSend = beforeSend;
      return this;
    }

    public Builder beforeSendTransaction(BeforeSendTransactionCallback beforeSendTransaction) {
      this.beforeSendTransaction = beforeSendTransaction;
      return this;
    }

    /**
     * Installs a default uncaught-exception handler that reports crashes as fatal events.
     *
     * <p>Optional. Defaults to {@code false}.
     *
     * @param autoCaptureUncaught whether to install the handler
     * @return this builder
     */
    public Builder autoCaptureUncaught(boolean autoCaptureUncaught) {
      this.autoCaptureUncaught = autoCaptureUncaught;
      return this;
    }

    /**
     * Marks classes under {@code packagePrefix} as application code in stack frames.
     *
     * @param packagePrefix e.g. {@code "com.example."}
     * @return this builder
     */
    public Builder inAppInclude(String packagePrefix) {
      this.inAppIncludes.add(Objects.requireNonNull(packagePrefix, "packagePrefix"));
      return this;
    }

    /**
     * Adds an integration, set up when the client is created.
     *
     * @param integration the integration
     * @return this builder
     */
    public Builder integration(Integration integration) {
      this.integrations.add(Objects.requireNonNull(integration, "integration"));
      return this;
    }

    public Builder workerCount(int workerCount) {
      if (workerCount < 1) {
        throw new IllegalArgumentException("workerCount must be >= 1, got: " + workerCount);
      }
      this.workerCount = workerCount;
      return this;
    }

    public Builder queueCapacity(int queueCapacity) {
      if (queueCapacity < 1) {
        throw new IllegalArgumentException("queueCapacity must be >= 1, got: " + queueCapacity);
      }
      this.queueCapacity = queueCapacity;
      return this;
    }

    /**
     * Delivery attempts per event before it is dropped.
     *
     * <p>Optional. Defaults to {@code 3}. Must be &ge; 1.
     *
     * @param maxAttempts maximum attempts
     * @return this builder
     */
    public Builder maxAttempts(int maxAttempts) {
      if (maxAttempts < 1) {
        throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
      }
      this.maxAttempts = maxAttempts;
      return this;
    }

    public Builder retryBaseDelayMs(long retryBaseDelayMs) {
      if (retryBaseDelayMs <= 0) {
        throw new IllegalArgumentException("retryBaseDelayMs must be > 0, got: " + retryBaseDelayMs);
      }
      this.retryBaseDelayMs = retryBaseDelayMs;
      return this;
    }

    public Builder retryMaxDelayMs(long retryMaxDelayMs) {
      if (retryMaxDelayMs <= 0) {
        throw new IllegalArgumentException("retryMaxDelayMs must be > 0, got: " + retryMaxDelayMs);
      }
      this.retryMaxDelayMs = retryMaxDelayMs;
      return this;
    }

    /**
     * Default wait for {@link Faultline#close()} and {@link Faultline#flush()}.
     *
     * <p>Optional. Defaults to {@code 2000} ms.
     *
     * @param shutdownTimeoutMs timeout in milliseconds
     * @return this builder
     */
    public Builder shutdownTimeoutMs(long shutdownTimeoutMs) {
      if (shutdownTimeoutMs < 0) {
        throw new IllegalArgumentException("shutdownTimeoutMs must be >= 0, got: " + shutdownTimeoutMs);
      }
      this.shutdownTimeoutMs = shutdownTimeoutMs;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Replaces the default HTTP transport. The client takes ownership and closes it.
     *
     * @param transport the transport
     * @return this builder
     */
    public Builder transport(Transport transport) {
      this.transport = transport;
      return this;
    }

    /**
     * @return the options
     * @throws IllegalArgumentException if {@code retryMaxDelayMs < retryBaseDelayMs}
     */
    public FaultlineOptions build() {
      if (retryMaxDelayMs < retryBaseDelayMs) {
        throw new IllegalArgumentException("retryMaxDelayMs must be >= retryBaseDelayMs");
      }
      return new FaultlineOptions(this);
    }

    private static double requireRate(String name, double rate) {
      if (Double.isNaN(rate) || rate < 0.0 || rate > 1.0) {
        throw new IllegalArgumentException(name + " must be within [0, 1], got: " + rate);
      }
      return rate;
    }
  }
}
