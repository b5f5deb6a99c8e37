package io.faultline.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the faultline client.
 *
 * @see FaultlineAutoConfiguration
 */
@ConfigurationProperties(prefix = "faultline")
public class FaultlineProperties {

    /**
     * Data source name. The client is only configured when this is set.
     */
    private String dsn;

    private String environment = "production";
    private String release;
    private String serverName;

    /**
     * Log envelopes instead of posting them.
     */
    private boolean debug;

    private double sampleRate = 1.0;
    private double tracesSampleRate = 1.0;
    private double profilesSampleRate = 0.0;
    private int maxBreadcrumbs = 100;
    private boolean attachStacktrace = true;
    private boolean autoCaptureUncaught;

    /**
     * Exceptions whose message or class name contains one of these texts are not reported.
     */
    private List<String> ignoreErrors = new ArrayList<>();

    /**
     * Package prefixes whose stack frames count as application code.
     */
    private List<String> inAppIncludes = new ArrayList<>();

    /**
     * Wait for pending events when the application context shuts down.
     */
    private long shutdownTimeoutMs = 2000;

    private final Transport transport = new Transport();
    private final Retry retry = new Retry();
    private final Metrics metrics = new Metrics();

    public String getDsn() {
        return dsn;
    }

    public void setDsn(String dsn) {
        this.dsn = dsn;
    }

    public String getEnvironment() {
        return environment;
    }

    public void setEnvironment(String environment) {
        this.environment = environment;
    }

    public String getRelease() {
        return release;
    }

    public void setRelease(String release) {
        this.release = release;
    }

    public String getServerName() {
        return serverName;
    }

    public void setServerName(String serverName) {
        this.serverName = serverName;
    }

    public boolean isDebug() {
        return debug;
    }

    public void setDebug(boolean debug) {
        this.debug = debug;
    }

    public double getSampleRate() {
        return sampleRate;
    }

    public void setSampleRate(double sampleRate) {
        this.sampleRate = sampleRate;
    }

    public double getTracesSampleRate() {
        return tracesSampleRate;
    }

    public void setTracesSampleRate(double tracesSampleRate) {
        this.tracesSampleRate = tracesSampleRate;
    }

    public double getProfilesSampleRate() {
        return profilesSampleRate;
    }

    public void setProfilesSampleRate(double profilesSampleRate) {
        this.profilesSampleRate = profilesSampleRate;
    }

    public int getMaxBreadcrumbs() {
        return maxBreadcrumbs;
    }

    public void setMaxBreadcrumbs(int maxBreadcrumbs) {
        this.maxBreadcrumbs = maxBreadcrumbs;
    }

    public boolean isAttachStacktrace() {
        return attachStacktrace;
    }

    public void setAttachStacktrace(boolean attachStacktrace) {
        this.attachStacktrace = attachStacktrace;
    }

    public boolean isAutoCaptureUncaught() {
        return autoCaptureUncaught;
    }

    public void setAutoCaptureUncaught(boolean autoCaptureUncaught) {
        this.autoCaptureUncaught = autoCaptureUncaught;
    }

    public List<String> getIgnoreErrors() {
        return ignoreErrors;
    }

    public void setIgnoreErrors(List<String> ignoreErrors) {
        this.ignoreErrors = ignoreErrors;
    }

    public List<String> getInAppIncludes() {
        return inAppIncludes;
    }

    public void setInAppIncludes(List<String> inAppIncludes) {
        this.inAppIncludes = inAppIncludes;
    }

    public long getShutdownTimeoutMs() {
        return shutdownTimeoutMs;
    }

    public void setShutdownTimeoutMs(long shutdownTimeoutMs) {
        this.shutdownTimeoutMs = shutdownTimeoutMs;
    }

    public Transport getTransport() {
        return transport;
    }

    public Retry getRetry() {
        return retry;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Transport {
        private int workerCount = 1;
        private int queueCapacity = 100;
        private int maxAttempts = 3;

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }
    }

    public static class Retry {
        private long baseDelayMs = 200;
        private long maxDelayMs = 30000;

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "faultline";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
