package io.faultline;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable captured occurrence: an exception, a message, or a caller-built event.
 *
 * <p>Every stage of the capture pipeline (scope fold, before-send callbacks, id stamping)
 * produces a new instance via {@link #toBuilder()}, so an event handed to a
 * {@link io.faultline.transport.Transport} can never change afterwards.
 *
 * <p>All collection accessors return unmodifiable, never-null views.
 */
public final class Event {
  public static final String TYPE_EVENT = "event";
  public static final String TYPE_TRANSACTION = "transaction";
  public static final String PLATFORM = "java";

  private final String eventId;
  private final String message;
  private final List<ExceptionValue> exceptions;
  private final Level level;
  private final Instant timestamp;
  private final String platform;
  private final String type;
  private final String transaction;
  private final String environment;
  private final String release;
  private final String serverName;
  private final Map<String, String> tags;
  private final Map<String, Object> extra;
  private final Map<String, Map<String, Object>> contexts;
  private final List<Breadcrumb> breadcrumbs;
  private final User user;
  private final List<String> fingerprint;
  private final String sdkName;
  private final String sdkVersion;

  private Event(Builder builder) {
    this.eventId = builder.eventId;
    this.message = builder.message;
    this.exceptions = List.copyOf(builder.exceptions);
    this.level = builder.level;
    this.timestamp = builder.timestamp;
    this.platform = builder.platform;
    this.type = builder.type == null ? TYPE_EVENT : builder.type;
    this.transaction = builder.transaction;
    this.environment = builder.environment;
    this.release = builder.release;
    this.serverName = builder.serverName;
    this.tags = Collections.unmodifiableMap(new LinkedHashMap<>(builder.tags));
    this.extra = Collections.unmodifiableMap(new LinkedHashMap<>(builder.extra));
    Map<String, Map<String, Object>> contextCopy = new LinkedHashMap<>();
    builder.contexts.forEach((name, values) ->
        contextCopy.put(name, Collections.unmodifiableMap(new LinkedHashMap<>(values))));
    this.contexts = Collections.unmodifiableMap(contextCopy);
    this.breadcrumbs = List.copyOf(builder.breadcrumbs);
    this.user = builder.user;
    this.fingerprint = List.copyOf(builder.fingerprint);
    this.sdkName = builder.sdkName;
    this.sdkVersion = builder.sdkVersion;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates an event carrying only a message.
   *
   * @param message the message
   * @return a new event
   */
  public static Event ofMessage(String message) {
    return builder().message(message).build();
  }

  /** 32-character hex id, or {@code null} until the pipeline stamps one. */
  public String eventId() {
    return eventId;
  }

  public String message() {
    return message;
  }

  /** Exception chain, innermost cause first. */
  public List<ExceptionValue> exceptions() {
    return exceptions;
  }

  public Level level() {
    return level;
  }

  public Instant timestamp() {
    return timestamp;
  }

  public String platform() {
    return platform;
  }

  /** {@link #TYPE_EVENT} or {@link #TYPE_TRANSACTION}. */
  public String type() {
    return type;
  }

  public boolean isTransaction() {
    return TYPE_TRANSACTION.equals(type);
  }

  public String transaction() {
    return transaction;
  }

  public String environment() {
    return environment;
  }

  public String release() {
    return release;
  }

  public String serverName() {
    return serverName;
  }

  public Map<String, String> tags() {
    return tags;
  }

  public Map<String, Object> extra() {
    return extra;
  }

  public Map<String, Map<String, Object>> contexts() {
    return contexts;
  }

  public List<Breadcrumb> breadcrumbs() {
    return breadcrumbs;
  }

  public User user() {
    return user;
  }

  public List<String> fingerprint() {
    return fingerprint;
  }

  public String sdkName() {
    return sdkName;
  }

  public String sdkVersion() {
    return sdkVersion;
  }

  /**
   * Returns a builder pre-populated with this event's fields.
   *
   * @return a new builder
   */
  public Builder toBuilder() {
    Builder b = new Builder();
    b.eventId = eventId;
    b.message = message;
    b.exceptions.addAll(exceptions);
    b.level = level;
    b.timestamp = timestamp;
    b.platform = platform;
    b.type = type;
    b.transaction = transaction;
    b.environment = environment;
    b.release = release;
    b.serverName = serverName;
    b.tags.putAll(tags);
    b.extra.putAll(extra);
    contexts.forEach((name, values) -> b.contexts.put(name, new LinkedHashMap<>(values)));
    b.breadcrumbs.addAll(breadcrumbs);
    b.user = user;
    b.fingerprint.addAll(fingerprint);
    b.sdkName = sdkName;
    b.sdkVersion = sdkVersion;
    return b;
  }

  @Override
  public String toString() {
    return "Event{eventId=" + eventId + ", type=" + type + ", level=" + level
        + ", message=" + message + ", exceptions=" + exceptions.size() + "}";
  }

  /** Builder for {@link Event}. Setters replace; the {@code tag}/{@code extra}/{@code context} singulars merge. */
  public static final class Builder {
    private String eventId;
    private String message;
    private final List<ExceptionValue> exceptions = new ArrayList<>();
    private Level level;
    private Instant timestamp;
    private String platform;
    private String type;
    private String transaction;
    private String environment;
    private String release;
    private String serverName;
    private final Map<String, String> tags = new LinkedHashMap<>();
    private final Map<String, Object> extra = new LinkedHashMap<>();
    private final Map<String, Map<String, Object>> contexts = new LinkedHashMap<>();
    private final List<Breadcrumb> breadcrumbs = new ArrayList<>();
    private User user;
    private final List<String> fingerprint = new ArrayList<>();
    private String sdkName;
    private String sdkVersion;

    private Builder() {
    }

    public Builder eventId(String eventId) {
      this.eventId = eventId;
      return this;
    }

    public Builder message(String message) {
      this.message = message;
      return this;
    }

    public Builder exceptions(List<ExceptionValue> exceptions) {
      this.exceptions.clear();
      if (exceptions != null) {
        this.exceptions.addAll(exceptions);
      }
      return this;
    }

    public Builder level(Level level) {
      this.level = level;
      return this;
    }

    public Builder timestamp(Instant timestamp) {
      this.timestamp = timestamp;
      return this;
    }

    public Builder platform(String platform) {
      this.platform = platform;
      return this;
    }

    public Builder type(String type) {
      this.type = type;
      return this;
    }

    public Builder transaction(String transaction) {
      this.transaction = transaction;
      return this;
    }

    public Builder environment(String environment) {
      this.environment = environment;
      return this;
    }

    public Builder release(String release) {
      this.release = release;
      return this;
    }

    public Builder serverName(String serverName) {
      this.serverName = serverName;
      return this;
    }

    public Builder tags(Map<String, String> tags) {
      this.tags.clear();
      if (tags != null) {
        tags.forEach(this::tag);
      }
      return this;
    }

    public Builder tag(String key, String value) {
      Objects.requireNonNull(key, "tag key");
      if (value == null) {
        this.tags.remove(key);
      } else {
        this.tags.put(key, value);
      }
      return this;
    }

    public Builder extra(Map<String, ?> extra) {
      this.extra.clear();
      if (extra != null) {
        extra.forEach(this::extra);
      }
      return this;
    }

    public Builder extra(String key, Object value) {
      this.extra.put(Objects.requireNonNull(key, "extra key"), value);
      return this;
    }

    public Builder contexts(Map<String, ? extends Map<String, ?>> contexts) {
      this.contexts.clear();
      if (contexts != null) {
        contexts.forEach(this::context);
      }
      return this;
    }

    public Builder context(String name, Map<String, ?> values) {
      Objects.requireNonNull(name, "context name");
      if (values == null) {
        this.contexts.remove(name);
      } else {
        this.contexts.put(name, new LinkedHashMap<>(values));
      }
      return this;
    }

    public Builder breadcrumbs(List<Breadcrumb> breadcrumbs) {
      this.breadcrumbs.clear();
      if (breadcrumbs != null) {
        breadcrumbs.forEach(this::breadcrumb);
      }
      return this;
    }

    public Builder breadcrumb(Breadcrumb breadcrumb) {
      this.breadcrumbs.add(Objects.requireNonNull(breadcrumb, "breadcrumb"));
      return this;
    }

    public Builder user(User user) {
      this.user = user;
      return this;
    }

    public Builder fingerprint(List<String> fingerprint) {
      this.fingerprint.clear();
      if (fingerprint != null) {
        this.fingerprint.addAll(fingerprint);
      }
      return this;
    }

    public Builder sdk(String name, String version) {
      this.sdkName = name;
      this.sdkVersion = version;
      return this;
    }

    public Event build() {
      return new Event(this);
    }
  }
}
