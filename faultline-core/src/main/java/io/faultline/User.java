package io.faultline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Identity of the user affected by an event.
 *
 * <pre>{@code
 * Faultline.setUser(User.builder().id("u123").email("alice@example.com").build());
 * }</pre>
 */
public final class User {
  private final String id;
  private final String email;
  private final String username;
  private final String ipAddress;
  private final Map<String, Object> data;

  private User(Builder builder) {
    this.id = builder.id;
    this.email = builder.email;
    this.username = builder.username;
    this.ipAddress = builder.ipAddress;
    this.data = Collections.unmodifiableMap(new LinkedHashMap<>(builder.data));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Shorthand for a user identified only by id.
   *
   * @param id the user id
   * @return a new user
   */
  public static User ofId(String id) {
    return builder().id(id).build();
  }

  public String id() {
    return id;
  }

  public String email() {
    return email;
  }

  public String username() {
    return username;
  }

  public String ipAddress() {
    return ipAddress;
  }

  /** Additional user attributes; never null. */
  public Map<String, Object> data() {
    return data;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof User other)) return false;
    return Objects.equals(id, other.id)
        && Objects.equals(email, other.email)
        && Objects.equals(username, other.username)
        && Objects.equals(ipAddress, other.ipAddress)
        && data.equals(other.data);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, email, username, ipAddress, data);
  }

  @Override
  public String toString() {
    return "User{id=" + id + ", email=" + email + ", username=" + username + "}";
  }

  public static final class Builder {
    private String id;
    private String email;
    private String username;
    private String ipAddress;
    private final Map<String, Object> data = new LinkedHashMap<>();

    private Builder() {
    }

    public Builder id(String id) {
      this.id = id;
      return this;
    }

    public Builder email(String email) {
      this.email = email;
      return this;
    }

    public Builder username(String username) {
      this.username = username;
      return this;
    }

    public Builder ipAddress(String ipAddress) {
      this.ipAddress = ipAddress;
      return this;
    }

    public Builder data(String key, Object value) {
      this.data.put(Objects.requireNonNull(key, "key"), value);
      return this;
    }

    public User build() {
      return new User(this);
    }
  }
}
