package io.faultline.scope;

import io.faultline.Breadcrumb;
import io.faultline.Event;
import io.faultline.Level;
import io.faultline.User;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One layer of contextual enrichment: user, tags, extra data, named contexts, breadcrumbs
 * and severity override.
 *
 * <p>Tag, extra and context setters merge key-wise into the existing maps; a {@code null}
 * value removes the key. User, level, fingerprint and transaction name are whole values: a
 * scope that has set one of them overrides whatever lower scopes folded, and a scope that
 * never set it leaves the folded value alone.
 *
 * <p>This class is thread-safe. {@link #clone()} returns an independent copy.
 *
 * @see Hub
 */
public final class Scope {
  private final Map<String, String> tags = new LinkedHashMap<>();
  private final Map<String, Object> extra = new LinkedHashMap<>();
  private final Map<String, Map<String, Object>> contexts = new LinkedHashMap<>();
  private final BreadcrumbRing breadcrumbs;

  private User user;
  private boolean userSet;
  private Level level;
  private boolean levelSet;
  private List<String> fingerprint;
  private String transactionName;

  /**
   * Creates an empty scope keeping at most {@link Hub#DEFAULT_MAX_BREADCRUMBS} breadcrumbs.
   */
  public Scope() {
    this(Hub.DEFAULT_MAX_BREADCRUMBS);
  }

  /**
   * Creates an empty scope.
   *
   * @param maxBreadcrumbs breadcrumb ring capacity; {@code 0} disables breadcrumbs
   */
  public Scope(int maxBreadcrumbs) {
    this.breadcrumbs = new BreadcrumbRing(maxBreadcrumbs);
  }

  private Scope(Scope source) {
    this.tags.putAll(source.tags);
    this.extra.putAll(source.extra);
    source.contexts.forEach((name, values) -> this.contexts.put(name, new LinkedHashMap<>(values)));
    this.breadcrumbs = source.breadcrumbs.copy();
    this.user = source.user;
    this.userSet = source.userSet;
    this.level = source.level;
    this.levelSet = source.levelSet;
    this.fingerprint = source.fingerprint;
    this.transactionName = source.transactionName;
  }

  public synchronized void setUser(User user) {
    this.user = user;
    this.userSet = true;
  }

  public synchronized User getUser() {
    return user;
  }

  public synchronized void setTag(String key, String value) {
    Objects.requireNonNull(key, "tag key");
    if (value == null) {
      tags.remove(key);
    } else {
      tags.put(key, value);
    }
  }

  public synchronized void setTags(Map<String, String> tags) {
    if (tags == null) {
      return;
    }
    tags.forEach(this::setTag);
  }

  public synchronized void removeTag(String key) {
    tags.remove(key);
  }

  public synchronized Map<String, String> getTags() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(tags));
  }

  public synchronized void setExtra(String key, Object value) {
    Objects.requireNonNull(key, "extra key");
    if (value == null) {
      extra.remove(key);
    } else {
      extra.put(key, value);
    }
  }

  public synchronized void setExtras(Map<String, ?> extras) {
    if (extras == null) {
      return;
    }
    extras.forEach(this::setExtra);
  }

  public synchronized void removeExtra(String key) {
    extra.remove(key);
  }

  public synchronized Map<String, Object> getExtras() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(extra));
  }

  /**
   * Sets a named context. The context replaces any previous context of the same name;
   * other contexts are kept.
   *
   * @param name   context name, e.g. {@code "device"}
   * @param values context values; {@code null} removes the context
   */
  public synchronized void setContext(String name, Map<String, ?> values) {
    Objects.requireNonNull(name, "context name");
    if (values == null) {
      contexts.remove(name);
    } else {
      contexts.put(name, new LinkedHashMap<>(values));
    }
  }

  public synchronized void removeContext(String name) {
    contexts.remove(name);
  }

  public synchronized Map<String, Map<String, Object>> getContexts() {
    Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
    contexts.forEach((name, values) -> copy.put(name, Collections.unmodifiableMap(new LinkedHashMap<>(values))));
    return Collections.unmodifiableMap(copy);
  }

  public synchronized void setLevel(Level level) {
    this.level = level;
    this.levelSet = true;
  }

  public synchronized Level getLevel() {
    return level;
  }

  public synchronized void setFingerprint(List<String> fingerprint) {
    this.fingerprint = fingerprint == null ? null : List.copyOf(fingerprint);
  }

  public synchronized void setTransactionName(String transactionName) {
    this.transactionName = transactionName;
  }

  /**
   * Records a breadcrumb, stamping the current time if it has none. When the ring is full
   * the oldest breadcrumb is evicted.
   *
   * @param breadcrumb the breadcrumb; {@code null} is ignored
   */
  public synchronized void addBreadcrumb(Breadcrumb breadcrumb) {
    if (breadcrumb == null) {
      return;
    }
    breadcrumbs.add(breadcrumb.timestamp() == null ? breadcrumb.withTimestamp(Instant.now()) : breadcrumb);
  }

  /** Empties this scope's breadcrumbs. Scopes below it in a hub keep theirs. */
  public synchronized void clearBreadcrumbs() {
    breadcrumbs.clear();
  }

  /** Breadcrumbs recorded on this scope, oldest first. */
  public synchronized List<Breadcrumb> getBreadcrumbs() {
    return Collections.unmodifiableList(breadcrumbs.toList());
  }

  public int getMaxBreadcrumbs() {
    return breadcrumbs.capacity();
  }

  /** Resets every field. The breadcrumb capacity is kept. */
  public synchronized void clear() {
    tags.clear();
    extra.clear();
    contexts.clear();
    breadcrumbs.clear();
    user = null;
    userSet = false;
    level = null;
    levelSet = false;
    fingerprint = null;
    transactionName = null;
  }

  /**
   * Returns an independent copy. Maps and the breadcrumb ring are copied; values inside
   * them (immutable breadcrumbs, users, extra objects) are shared.
   *
   * @return the copy
   */
  @Override
  public synchronized Scope clone() {
    return new Scope(this);
  }

  /**
   * Overlays this scope onto {@code event} and returns the merged event. The input is
   * not modified.
   *
   * <p>Breadcrumbs are merged with the event's own, skipping instances already present
   * (a pushed scope starts with its parent's breadcrumb instances), ordered by timestamp
   * and then trimmed to this scope's capacity keeping the most recent.
   *
   * @param event the event to enrich; {@code null} is treated as an empty event
   * @return a new event
   */
  public synchronized Event applyToEvent(Event event) {
    Event source = event == null ? Event.builder().build() : event;
    Event.Builder merged = source.toBuilder();
    tags.forEach(merged::tag);
    extra.forEach(merged::extra);
    contexts.forEach(merged::context);
    if (userSet) {
      merged.user(user);
    }
    if (levelSet) {
      merged.level(level);
    }
    if (fingerprint != null) {
      merged.fingerprint(fingerprint);
    }
    if (transactionName != null) {
      merged.transaction(transactionName);
    }
    merged.breadcrumbs(mergeBreadcrumbs(source.breadcrumbs()));
    return merged.build();
  }

  private List<Breadcrumb> mergeBreadcrumbs(List<Breadcrumb> existing) {
    if (breadcrumbs.size() == 0) {
      return existing;
    }
    Map<Breadcrumb, Integer> inherited = new IdentityHashMap<>();
    for (Breadcrumb breadcrumb : existing) {
      inherited.merge(breadcrumb, 1, Integer::sum);
    }
    List<Breadcrumb> result = new ArrayList<>(existing);
    for (Breadcrumb breadcrumb : breadcrumbs.toList()) {
      Integer remaining = inherited.get(breadcrumb);
      if (remaining == null) {
        result.add(breadcrumb);
      } else if (remaining == 1) {
        inherited.remove(breadcrumb);
      } else {
        inherited.put(breadcrumb, remaining - 1);
      }
    }
    result.sort(Comparator.comparing(Breadcrumb::timestamp, Comparator.nullsFirst(Comparator.naturalOrder())));
    int max = breadcrumbs.capacity();
    if (result.size() > max) {
      return new ArrayList<>(result.subList(result.size() - max, result.size()));
    }
    return result;
  }
}
