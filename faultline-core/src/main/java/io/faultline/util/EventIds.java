package io.faultline.util;

import com.github.f4b6a3.ulid.UlidCreator;

import java.util.regex.Pattern;

/**
 * Generates event identifiers: 32 lowercase hexadecimal characters.
 *
 * <p>Ids come from a monotonic ULID rendered as the hex digits of its 128 bits, so two ids
 * generated in sequence by the same JVM are always distinct and sort by creation time.
 */
public final class EventIds {
  private static final Pattern FORMAT = Pattern.compile("^[a-f0-9]{32}$");

  private EventIds() {
  }

  /**
   * Returns a new event id.
   *
   * @return 32 lowercase hex characters
   */
  public static String newEventId() {
    return UlidCreator.getMonotonicUlid().toUuid().toString().replace("-", "");
  }

  /**
   * Checks whether {@code candidate} is a well-formed event id.
   *
   * @param candidate the string to check, may be null
   * @return {@code true} if it consists of exactly 32 lowercase hex characters
   */
  public static boolean isValid(String candidate) {
    return candidate != null && FORMAT.matcher(candidate).matches();
  }
}
