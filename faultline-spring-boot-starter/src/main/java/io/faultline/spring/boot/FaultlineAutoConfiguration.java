package io.faultline.spring.boot;

import io.faultline.BeforeSendCallback;
import io.faultline.BeforeSendTransactionCallback;
import io.faultline.Faultline;
import io.faultline.FaultlineClient;
import io.faultline.FaultlineOptions;
import io.faultline.Integration;
import io.faultline.spi.MetricsExporter;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the faultline client.
 *
 * <p>Active when {@code faultline.dsn} is set. Builds {@link FaultlineOptions} from
 * {@link FaultlineProperties}, picks up {@link BeforeSendCallback},
 * {@link BeforeSendTransactionCallback}, {@link Integration} and {@link MetricsExporter} beans,
 * and registers the
 * result as the process-wide client via {@link Faultline#init(FaultlineOptions)}. The client
 * is closed, waiting up to {@code faultline.shutdown-timeout-ms}, when the context shuts
 * down.
 *
 * @see FaultlineProperties
 * @see FaultlineMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(Faultline.class)
@ConditionalOnProperty(prefix = "faultline", name = "dsn")
@EnableConfigurationProperties(FaultlineProperties.class)
public class FaultlineAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public FaultlineOptions faultlineOptions(FaultlineProperties props,
      ObjectProvider<BeforeSendCallback> beforeSendProvider,
      ObjectProvider<BeforeSendTransactionCallback> beforeSendTransactionProvider,
      ObjectProvider<Integration> integrationProvider,
      ObjectProvider<MetricsExporter> metricsProvider) {

    FaultlineOptions.Builder builder = FaultlineOptions.builder(props.getDsn())
        .environment(props.getEnvironment())
        .release(props.getRelease())
        .serverName(props.getServerName())
        .debug(props.isDebug())
        .sampleRate(props.getSampleRate())
        .tracesSampleRate(props.getTracesSampleRate())
        .profilesSampleRate(props.getProfilesSampleRate())
        .maxBreadcrumbs(props.getMaxBreadcrumbs())
        .attachStacktrace(props.isAttachStacktrace())
        .autoCaptureUncaught(props.isAutoCaptureUncaught())
        .workerCount(props.getTransport().getWorkerCount())
        .queueCapacity(props.getTransport().getQueueCapacity())
        .maxAttempts(props.getTransport().getMaxAttempts())
        .retryBaseDelayMs(props.getRetry().getBaseDelayMs())
        .retryMaxDelayMs(props.getRetry().getMaxDelayMs())
        .shutdownTimeoutMs(props.getShutdownTimeoutMs());
    props.getIgnoreErrors().forEach(builder::ignoreError);
    props.getInAppIncludes().forEach(builder::inAppInclude);
    integrationProvider.orderedStream().forEach(builder::integration);

    BeforeSendCallback beforeSend = beforeSendProvider.getIfUnique();
    if (beforeSend != null) {
      builder.beforeSend(beforeSend);
    }
    BeforeSendTransactionCallback beforeSendTransaction = beforeSendTransactionProvider.getIfUnique();
    if (beforeSendTransaction != null) {
      builder.beforeSendTransaction(beforeSendTransaction);
    }
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public FaultlineClient faultlineClient(FaultlineOptions options) {
    return Faultline.init(options);
  }
}
