/**
 * Context propagation: {@link io.faultline.scope.Scope} layers stacked in a
 * {@link io.faultline.scope.Hub}.
 *
 * <p>A scope holds user, tags, extra data, named contexts, breadcrumbs and a level override.
 * The hub keeps a stack of them with the global scope at the bottom; pushing clones the top,
 * popping never removes the global scope. At capture time the hub folds the stack bottom to
 * top into the event, then applies the optional {@link io.faultline.scope.CaptureContext}.
 *
 * <p>{@link io.faultline.scope.ThreadLocalHubContext} binds a forked hub to a thread for
 * flows that must not share scope state.
 *
 * @see io.faultline.scope.Hub
 * @see io.faultline.scope.Scope
 * @see io.faultline.scope.CaptureContext
 */
package io.faultline.scope;
