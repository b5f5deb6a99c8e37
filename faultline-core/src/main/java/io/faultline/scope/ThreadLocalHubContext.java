package io.faultline.scope;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Binds a {@link Hub} to the current thread so that one logical flow (a request, a job)
 * gets scopes of its own instead of sharing the process-wide stack.
 *
 * <p>Bindings nest: {@link #runWith(Hub, Runnable)} restores whatever hub was bound before
 * it, also when the task throws.
 *
 * <pre>{@code
 * hubContext.runWith(mainHub.fork(), () -> {
 *   Faultline.setTag("request_id", requestId);
 *   handle(request);
 * });
 * }</pre>
 */
public final class ThreadLocalHubContext {
  private final ThreadLocal<Hub> current = new ThreadLocal<>();

  /**
   * Returns the hub bound to the current thread.
   *
   * @return the bound hub, or {@code null} if none is bound
   */
  public Hub current() {
    return current.get();
  }

  /**
   * Returns the bound hub, or {@code fallback} when the thread has none.
   *
   * @param fallback hub to use for unbound threads
   * @return the hub to use
   */
  public Hub currentOr(Hub fallback) {
    Hub hub = current.get();
    return hub != null ? hub : fallback;
  }

  public boolean isBound() {
    return current.get() != null;
  }

  /**
   * Runs {@code task} with {@code hub} bound to the current thread.
   *
   * @param hub  the hub to bind
   * @param task the work to run
   */
  public void runWith(Hub hub, Runnable task) {
    Objects.requireNonNull(task, "task");
    callWith(hub, () -> {
      task.run();
      return null;
    });
  }

  /**
   * Calls {@code task} with {@code hub} bound to the current thread.
   *
   * @param hub  the hub to bind
   * @param task the work to run
   * @param <T>  result type
   * @return the task's result
   */
  public <T> T callWith(Hub hub, Supplier<T> task) {
    Objects.requireNonNull(hub, "hub");
    Objects.requireNonNull(task, "task");
    Hub previous = current.get();
    current.set(hub);
    try {
      return task.get();
    } finally {
      if (previous == null) {
        current.remove();
      } else {
        current.set(previous);
      }
    }
  }
}
