/**
 * Root API for faultline, an embedded error and event tracking client.
 *
 * <h2>Core Design</h2>
 * <p>Context lives in {@linkplain io.faultline.scope.Scope scopes} stacked in a
 * {@linkplain io.faultline.scope.Hub hub}. A capture builds an {@link io.faultline.Event}
 * from an exception or message, folds the scope stack into it bottom to top, lets the
 * {@link io.faultline.BeforeSendCallback} veto it and hands it to a
 * {@linkplain io.faultline.transport.Transport transport} without blocking. The default
 * {@linkplain io.faultline.transport.AsyncTransport transport} retries server and network
 * errors with exponential backoff and honors the collector's rate limits.
 *
 * <p>Lifecycle: uninitialized, active after {@link io.faultline.Faultline#init}, closed
 * after {@link io.faultline.Faultline#close}. Outside the active state every capture logs
 * {@value io.faultline.Faultline#NOT_INITIALIZED_MESSAGE} and returns {@code ""}.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>faultline-core</b>: scopes, capture pipeline, transport (one external dependency,
 *       ulid-creator, for event ids)</li>
 *   <li><b>faultline-micrometer</b>: transport metrics exported to Micrometer</li>
 *   <li><b>faultline-spring-boot-starter</b>: {@code faultline.*} properties and
 *       auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * Faultline.init(FaultlineOptions.builder("https://public@errors.example.com/42")
 *     .environment("staging")
 *     .release("shop@1.4.2")
 *     .build());
 *
 * Faultline.setUser(User.ofId("u123"));
 * Faultline.addBreadcrumb(Breadcrumb.of("checkout started"));
 *
 * try {
 *   checkout(cart);
 * } catch (PaymentException e) {
 *   Faultline.captureException(e, scope -> scope.setTag("gateway", "acme"));
 * }
 *
 * Faultline.close();
 * }</pre>
 *
 * <h2>Per-request isolation</h2>
 * <pre>{@code
 * Faultline.runIsolated(() -> {
 *   Faultline.setTag("request_id", requestId);
 *   handle(request);
 * });
 * }</pre>
 *
 * @see io.faultline.Faultline
 * @see io.faultline.FaultlineClient
 * @see io.faultline.FaultlineOptions
 * @see io.faultline.Event
 */
package io.faultline;
