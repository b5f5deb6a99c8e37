package io.faultline.scope;

import io.faultline.Level;
import io.faultline.User;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable set of scope values usable as a {@link CaptureContext}. Only the fields that
 * were given to the builder are applied.
 */
public final class PartialScope implements CaptureContext {
  private final Map<String, String> tags;
  private final Map<String, Object> extra;
  private final Map<String, Map<String, Object>> contexts;
  private final User user;
  private final boolean userSet;
  private final Level level;
  private final List<String> fingerprint;

  private PartialScope(Builder builder) {
    this.tags = Collections.unmodifiableMap(new LinkedHashMap<>(builder.tags));
    this.extra = Collections.unmodifiableMap(new LinkedHashMap<>(builder.extra));
    this.contexts = Collections.unmodifiableMap(new LinkedHashMap<>(builder.contexts));
    this.user = builder.user;
    this.userSet = builder.userSet;
    this.level = builder.level;
    this.fingerprint = builder.fingerprint;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public void applyTo(Scope scope) {
    scope.setTags(tags);
    scope.setExtras(extra);
    contexts.forEach(scope::setContext);
    if (userSet) {
      scope.setUser(user);
    }
    if (level != null) {
      scope.setLevel(level);
    }
    if (fingerprint != null) {
      scope.setFingerprint(fingerprint);
    }
  }

  public static final class Builder {
    private final Map<String, String> tags = new LinkedHashMap<>();
    private final Map<String, Object> extra = new LinkedHashMap<>();
    private final Map<String, Map<String, Object>> contexts = new LinkedHashMap<>();
    private User user;
    private boolean userSet;
    private Level level;
    private List<String> fingerprint;

    private Builder() {
    }

    public Builder tag(String key, String value) {
      tags.put(Objects.requireNonNull(key, "key"), value);
      return this;
    }

    public Builder tags(Map<String, String> tags) {
      this.tags.putAll(tags);
      return this;
    }

    public Builder extra(String key, Object value) {
      extra.put(Objects.requireNonNull(key, "key"), value);
      return this;
    }

    public Builder extras(Map<String, ?> extras) {
      this.extra.putAll(extras);
      return this;
    }

    public Builder context(String name, Map<String, ?> values) {
      contexts.put(Objects.requireNonNull(name, "name"),
          values == null ? null : new LinkedHashMap<>(values));
      return this;
    }

    public Builder user(User user) {
      this.user = user;
      this.userSet = true;
      return this;
    }

    public Builder level(Level level) {
      this.level = level;
      return this;
    }

    public Builder fingerprint(List<String> fingerprint) {
      this.fingerprint = List.copyOf(fingerprint);
      return this;
    }

    public PartialScope build() {
      return new PartialScope(this);
    }
  }
}
