package io.faultline;

/**
 * Hooks a source of events into a client, e.g. a framework's error callback or a logging
 * handler.
 *
 * <p>Integrations are registered with {@link FaultlineOptions.Builder#integration(Integration)}
 * and set up once, in registration order, when the client is created. One that throws from
 * {@link #setupOnce(FaultlineClient)} is logged and skipped.
 */
public interface Integration {

  /** Name used in log messages. */
  String name();

  /**
   * Wires this integration to {@code client}.
   *
   * @param client the client being created
   */
  void setupOnce(FaultlineClient client);
}
