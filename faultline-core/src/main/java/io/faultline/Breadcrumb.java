package io.faultline;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A diagnostic note recording something that happened before an event.
 *
 * <p>Breadcrumbs are immutable. One built without a timestamp is stamped with the current
 * time when it is added to a {@link io.faultline.scope.Scope}.
 *
 * <pre>{@code
 * Faultline.addBreadcrumb(Breadcrumb.builder()
 *     .category("db.query")
 *     .message("SELECT * FROM orders WHERE id = ?")
 *     .build());
 * }</pre>
 */
public final class Breadcrumb {
  private final String message;
  private final String category;
  private final String type;
  private final Level level;
  private final Instant timestamp;
  private final Map<String, Object> data;

  private Breadcrumb(Builder builder) {
    this.message = builder.message;
    this.category = builder.category;
    this.type = builder.type;
    this.level = builder.level;
    this.timestamp = builder.timestamp;
    this.data = Collections.unmodifiableMap(new LinkedHashMap<>(builder.data));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a breadcrumb carrying only a message.
   *
   * @param message the message
   * @return a new breadcrumb without timestamp
   */
  public static Breadcrumb of(String message) {
    return builder().message(message).build();
  }

  public String message() {
    return message;
  }

  public String category() {
    return category;
  }

  public String type() {
    return type;
  }

  public Level level() {
    return level;
  }

  /** Recording time, or {@code null} if the breadcrumb has not been recorded yet. */
  public Instant timestamp() {
    return timestamp;
  }

  public Map<String, Object> data() {
    return data;
  }

  /**
   * Returns a copy of this breadcrumb with the given timestamp.
   *
   * @param timestamp the recording time
   * @return a new breadcrumb
   */
  public Breadcrumb withTimestamp(Instant timestamp) {
    return toBuilder().timestamp(Objects.requireNonNull(timestamp, "timestamp")).build();
  }

  public Builder toBuilder() {
    Builder builder = new Builder()
        .message(message)
        .category(category)
        .type(type)
        .level(level)
        .timestamp(timestamp);
    builder.data.putAll(data);
    return builder;
  }

  @Override
  public String toString() {
    return "Breadcrumb{category=" + category + ", message=" + message + ", timestamp=" + timestamp + "}";
  }

  public static final class Builder {
    private String message;
    private String category;
    private String type;
    private Level level;
    private Instant timestamp;
    private final Map<String, Object> data = new LinkedHashMap<>();

    private Builder() {
    }

    public Builder message(String message) {
      this.message = message;
      return this;
    }

    public Builder category(String category) {
      this.category = category;
      return this;
    }

    /** Breadcrumb type, e.g. {@code "http"}, {@code "query"}, {@code "default"}. */
    public Builder type(String type) {
      this.type = type;
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

    public Builder data(String key, Object value) {
      this.data.put(Objects.requireNonNull(key, "key"), value);
      return this;
    }

    public Builder data(Map<String, ?> data) {
      if (data != null) {
        this.data.putAll(data);
      }
      return this;
    }

    public Breadcrumb build() {
      return new Breadcrumb(this);
    }
  }
}
