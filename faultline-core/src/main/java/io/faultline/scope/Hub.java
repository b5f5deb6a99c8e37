package io.faultline.scope;

import io.faultline.Breadcrumb;
import io.faultline.Event;
import io.faultline.Level;
import io.faultline.User;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Owner of a stack of {@link Scope}s and of the fold that merges them into an event.
 *
 * <p>The bottom of the stack is the global scope, created with the hub and never popped.
 * {@link #pushScope()} clones the current top, so a pushed scope starts with everything
 * its parent had and diverges from there. {@link #applyToEvent(Event, CaptureContext)}
 * overlays the scopes bottom to top, so nearer scopes win, and applies the optional
 * capture context last.
 *
 * <p>Stack operations are serialized on the hub's monitor. Flows that interleave on one
 * hub share its stack; give each flow its own hub via {@link #fork()} (see
 * {@link ThreadLocalHubContext}) to keep their tags and breadcrumbs apart.
 */
public final class Hub {
  private static final Logger logger = Logger.getLogger(Hub.class.getName());

  /** Breadcrumb capacity used when none is configured. */
  public static final int DEFAULT_MAX_BREADCRUMBS = 100;

  private final List<Scope> stack = new ArrayList<>();
  private final int maxBreadcrumbs;

  public Hub() {
    this(DEFAULT_MAX_BREADCRUMBS);
  }

  /**
   * Creates a hub whose stack holds one empty global scope.
   *
   * @param maxBreadcrumbs breadcrumb capacity of every scope on this hub
   */
  public Hub(int maxBreadcrumbs) {
    this(new Scope(maxBreadcrumbs));
  }

  private Hub(Scope globalScope) {
    this.maxBreadcrumbs = globalScope.getMaxBreadcrumbs();
    this.stack.add(globalScope);
  }

  /**
   * Returns the current (top) scope.
   *
   * @return the top scope, never null
   */
  public synchronized Scope getScope() {
    return stack.get(stack.size() - 1);
  }

  /**
   * Pushes a clone of the current scope.
   *
   * @return the new top scope
   */
  public synchronized Scope pushScope() {
    Scope pushed = getScope().clone();
    stack.add(pushed);
    return pushed;
  }

  /**
   * Pops the current scope unless it is the global scope.
   *
   * @return the removed scope, or {@code null} if only the global scope was left
   */
  public synchronized Scope popScope() {
    if (stack.size() <= 1) {
      return null;
    }
    return stack.remove(stack.size() - 1);
  }

  public synchronized int stackSize() {
    return stack.size();
  }

  public int getMaxBreadcrumbs() {
    return maxBreadcrumbs;
  }

  /**
   * Runs {@code callback} with a freshly pushed scope and pops it afterwards, also when the
   * callback throws. The exception reaches the caller after the pop.
   *
   * @param callback receives the pushed scope
   */
  public void withScope(Consumer<Scope> callback) {
    Objects.requireNonNull(callback, "callback");
    Scope pushed = pushScope();
    try {
      callback.accept(pushed);
    } finally {
      popScope();
    }
  }

  /**
   * Runs {@code callback} against the current scope, mutating it in place.
   *
   * @param callback receives the current scope
   */
  public void configureScope(Consumer<Scope> callback) {
    Objects.requireNonNull(callback, "callback");
    callback.accept(getScope());
  }

  public void setUser(User user) {
    getScope().setUser(user);
  }

  public void setTag(String key, String value) {
    getScope().setTag(key, value);
  }

  public void setTags(Map<String, String> tags) {
    getScope().setTags(tags);
  }

  public void setExtra(String key, Object value) {
    getScope().setExtra(key, value);
  }

  public void setExtras(Map<String, ?> extras) {
    getScope().setExtras(extras);
  }

  public void setContext(String name, Map<String, ?> values) {
    getScope().setContext(name, values);
  }

  public void setLevel(Level level) {
    getScope().setLevel(level);
  }

  public void addBreadcrumb(Breadcrumb breadcrumb) {
    getScope().addBreadcrumb(breadcrumb);
  }

  public void clearBreadcrumbs() {
    getScope().clearBreadcrumbs();
  }

  public Event applyToEvent(Event event) {
    return applyToEvent(event, null);
  }

  /**
   * Folds the whole stack, bottom to top, into {@code event}, then applies
   * {@code captureContext} on a temporary scope. No scope of this hub is modified.
   *
   * <p>A capture context that throws is logged and skipped; the stack fold is still
   * returned.
   *
   * @param event          the event to enrich
   * @param captureContext optional one-shot override, may be null
   * @return the merged event
   */
  public Event applyToEvent(Event event, CaptureContext captureContext) {
    List<Scope> snapshot;
    synchronized (this) {
      snapshot = new ArrayList<>(stack);
    }
    Event folded = event;
    for (Scope scope : snapshot) {
      folded = scope.applyToEvent(folded);
    }
    if (captureContext != null) {
      Scope temporary = new Scope(maxBreadcrumbs);
      try {
        captureContext.applyTo(temporary);
        folded = temporary.applyToEvent(folded);
      } catch (RuntimeException e) {
        logger.log(java.util.logging.Level.WARNING, "Capture context failed; event sent without it", e);
      }
    }
    return folded;
  }

  /**
   * Creates an independent hub whose global scope is a clone of this hub's current scope.
   * Changes on either hub are invisible to the other.
   *
   * @return the new hub
   */
  public Hub fork() {
    return new Hub(getScope().clone());
  }
}
