package io.faultline.transport;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.EnumMap;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Per-category cooldowns learned from collector responses.
 *
 * <p>Sources, in order of precedence:
 * <ol>
 *   <li>{@code X-Faultline-Rate-Limits} on any response: comma-separated
 *       {@code seconds:categories:scope} entries, where {@code categories} is a
 *       {@code ;}-separated list and an empty list means every category;</li>
 *   <li>{@code Retry-After} on a 429, either delta-seconds or an HTTP date, applied to every
 *       category;</li>
 *   <li>a bare 429: {@link #DEFAULT_COOLDOWN} for every category.</li>
 * </ol>
 * A later cooldown never shortens an earlier, longer one. Cooldowns are capped at
 * {@link #MAX_COOLDOWN}.
 *
 * <p>This class is thread-safe.
 */
public final class RateLimiter {
  private static final Logger logger = Logger.getLogger(RateLimiter.class.getName());

  public static final Duration DEFAULT_COOLDOWN = Duration.ofSeconds(60);

  public static final Duration MAX_COOLDOWN = Duration.ofDays(1);

  private static final Pattern DELTA_SECONDS = Pattern.compile("\\d{1,18}");

  private final Clock clock;
  private final Map<DataCategory, Instant> limitedUntil = new EnumMap<>(DataCategory.class);

  public RateLimiter() {
    this(Clock.systemUTC());
  }

  public RateLimiter(Clock clock) {
    this.clock = clock;
  }

  /**
   * Whether events of {@code category} must currently be dropped.
   *
   * @param category the category
   * @return {@code true} while a cooldown is running
   */
  public synchronized boolean isLimited(DataCategory category) {
    Instant until = limitedUntil.get(category);
    if (until == null) {
      return false;
    }
    if (clock.instant().isBefore(until)) {
      return true;
    }
    limitedUntil.remove(category);
    return false;
  }

  /**
   * End of the running cooldown for {@code category}.
   *
   * @param category the category
   * @return the instant the cooldown ends, or {@code null} if none is running
   */
  public synchronized Instant limitedUntil(DataCategory category) {
    return isLimited(category) ? limitedUntil.get(category) : null;
  }

  /**
   * Learns cooldowns from a response.
   *
   * @param response the collector's answer
   */
  public void update(SendResponse response) {
    Instant now = clock.instant();
    String rateLimits = response.rateLimits();
    if (rateLimits != null && !rateLimits.isBlank()) {
      applyRateLimitsHeader(rateLimits, now);
      return;
    }
    if (!response.isRateLimited()) {
      return;
    }
    Duration cooldown = parseRetryAfter(response.retryAfter(), now);
    limitAll(now.plus(cooldown != null ? cooldown : DEFAULT_COOLDOWN));
  }

  private void applyRateLimitsHeader(String header, Instant now) {
    for (String entry : header.split(",")) {
      String trimmed = entry.trim();
      if (trimmed.isEmpty()) {
        continue;
      }
      String[] parts = trimmed.split(":", -1);
      long seconds;
      try {
        seconds = Long.parseLong(parts[0].trim());
      } catch (NumberFormatException e) {
        logger.fine("Ignoring malformed rate limit entry: " + trimmed);
        continue;
      }
      Instant until = now.plusSeconds(Math.min(Math.max(0L, seconds), MAX_COOLDOWN.getSeconds()));
      String categories = parts.length > 1 ? parts[1].trim() : "";
      if (categories.isEmpty()) {
        limitAll(until);
        continue;
      }
      for (String name : categories.split(";")) {
        DataCategory category = DataCategory.fromWireName(name);
        if (category != null) {
          limit(category, until);
        }
      }
    }
  }

  private synchronized void limitAll(Instant until) {
    for (DataCategory category : DataCategory.values()) {
      limit(category, until);
    }
  }

  private synchronized void limit(DataCategory category, Instant until) {
    limitedUntil.merge(category, until, (current, next) -> next.isAfter(current) ? next : current);
  }

  /**
   * Parses a {@code Retry-After} value.
   *
   * @param value delta-seconds or an RFC 1123 date, may be null
   * @param now   reference instant for dates
   * @return the wait, or {@code null} if absent or unparseable
   */
  static Duration parseRetryAfter(String value, Instant now) {
    if (value == null || value.isBlank()) {
      return null;
    }
    String trimmed = value.trim();
    if (DELTA_SECONDS.matcher(trimmed).matches()) {
      return capped(Duration.ofSeconds(Long.parseLong(trimmed)));
    }
    try {
      Instant at = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
      return at.isAfter(now) ? capped(Duration.between(now, at)) : Duration.ZERO;
    } catch (DateTimeParseException e) {
      logger.fine("Ignoring malformed Retry-After: " + trimmed);
      return null;
    }
  }

  private static Duration capped(Duration cooldown) {
    return cooldown.compareTo(MAX_COOLDOWN) > 0 ? MAX_COOLDOWN : cooldown;
  }
}
