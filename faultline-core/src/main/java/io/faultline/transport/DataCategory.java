package io.faultline.transport;

import io.faultline.Event;

import java.util.Locale;

/**
 * Category an event is rate limited under.
 */
public enum DataCategory {
  ERROR("error"),
  TRANSACTION("transaction"),
  DEFAULT("default");

  private final String wireName;

  DataCategory(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  /**
   * Category of {@code event}: {@link #TRANSACTION} for transaction events, otherwise
   * {@link #ERROR}.
   *
   * @param event the event
   * @return its category
   */
  public static DataCategory of(Event event) {
    return event.isTransaction() ? TRANSACTION : ERROR;
  }

  /**
   * Looks up a category by wire name, ignoring case.
   *
   * @param name wire name as sent by the collector
   * @return the category, or {@code null} for names this client does not know
   */
  public static DataCategory fromWireName(String name) {
    if (name == null) {
      return null;
    }
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    for (DataCategory category : values()) {
      if (category.wireName.equals(normalized)) {
        return category;
      }
    }
    return null;
  }
}
