package io.faultline.util;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class EventIdsTest {

  @Test
  void idsAreThirtyTwoLowercaseHexCharacters() {
    String id = EventIds.newEventId();

    assertEquals(32, id.length());
    assertTrue(id.matches("[a-f0-9]{32}"), id);
    assertTrue(EventIds.isValid(id));
  }

  @Test
  void idsAreUnique() {
    Set<String> ids = new HashSet<>();
    for (int i = 0; i < 10_000; i++) {
      assertTrue(ids.add(EventIds.newEventId()));
    }
  }

  @Test
  void consecutiveIdsSortByCreation() {
    String first = EventIds.newEventId();
    String second = EventIds.newEventId();

    assertTrue(first.compareTo(second) < 0, first + " >= " + second);
  }

  @Test
  void isValidRejectsMalformedIds() {
    assertFalse(EventIds.isValid(null));
    assertFalse(EventIds.isValid(""));
    assertFalse(EventIds.isValid("ABCDEF0123456789ABCDEF0123456789"));
    assertFalse(EventIds.isValid("0123456789abcdef0123456789abcde"));
    assertFalse(EventIds.isValid("0123456789abcdef-0123456789abcde"));
  }
}
