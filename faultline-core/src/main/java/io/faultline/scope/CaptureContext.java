package io.faultline.scope;

/**
 * One-shot enrichment applied to a single capture after the whole scope stack has been
 * folded, so it has the final word over every scope.
 *
 * <p>The callback form receives a fresh temporary {@link Scope} that is discarded after
 * the capture:
 * <pre>{@code
 * Faultline.captureException(e, scope -> scope.setTag("order", orderId));
 * }</pre>
 *
 * <p>The partial-scope form carries fixed values:
 * <pre>{@code
 * Faultline.captureMessage("Retrying payment", Level.WARNING,
 *     CaptureContext.partial().tag("attempt", "2").build());
 * }</pre>
 */
@FunctionalInterface
public interface CaptureContext {

  /**
   * Applies this context to the temporary scope of one capture.
   *
   * @param scope temporary scope; changes never reach the hub's scopes
   */
  void applyTo(Scope scope);

  /**
   * Starts a partial-scope capture context.
   *
   * @return a new builder
   */
  static PartialScope.Builder partial() {
    return PartialScope.builder();
  }
}
