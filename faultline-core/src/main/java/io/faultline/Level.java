package io.faultline;

import java.util.Locale;

/**
 * Severity of an event or breadcrumb.
 */
public enum Level {
  FATAL,
  ERROR,
  WARNING,
  INFO,
  DEBUG;

  /**
   * Returns the lowercase name used in the outbound envelope.
   *
   * @return e.g. {@code "warning"}
   */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Resolves a level from its wire name. {@code "warn"} is accepted as an alias of
   * {@code "warning"}.
   *
   * @param name the wire name, case-insensitive
   * @return the level
   * @throws IllegalArgumentException if the name is unknown
   */
  public static Level fromWireName(String name) {
    if (name == null) {
      throw new IllegalArgumentException("level name must not be null");
    }
    String normalized = name.trim().toUpperCase(Locale.ROOT);
    if ("WARN".equals(normalized)) {
      return WARNING;
    }
    return Level.valueOf(normalized);
  }
}
