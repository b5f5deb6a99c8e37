package io.faultline;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventTest {

  @Test
  void defaultsToPlainEventType() {
    Event event = Event.ofMessage("hello");

    assertEquals(Event.TYPE_EVENT, event.type());
    assertFalse(event.isTransaction());
    assertNull(event.eventId());
    assertTrue(event.tags().isEmpty());
    assertTrue(event.exceptions().isEmpty());
  }

  @Test
  void collectionsAreDefensiveCopies() {
    Map<String, String> tags = new HashMap<>();
    tags.put("k", "v");
    Event event = Event.builder().tags(tags).build();
    tags.put("late", "x");

    assertEquals(Map.of("k", "v"), event.tags());
    assertThrows(UnsupportedOperationException.class, () -> event.tags().put("x", "y"));
    assertThrows(UnsupportedOperationException.class, () -> event.breadcrumbs().add(Breadcrumb.of("b")));
  }

  @Test
  void toBuilderCopiesEveryField() {
    Event original = Event.builder()
        .eventId("id")
        .message("m")
        .level(Level.WARNING)
        .type(Event.TYPE_TRANSACTION)
        .transaction("GET /")
        .environment("qa")
        .release("r1")
        .serverName("host")
        .tag("t", "1")
        .extra("e", 2)
        .context("os", Map.of("name", "linux"))
        .breadcrumb(Breadcrumb.of("b"))
        .user(User.ofId("u"))
        .fingerprint(List.of("f"))
        .sdk("faultline.java", "0.1.0")
        .build();

    Event copy = original.toBuilder().message("changed").build();

    assertEquals("changed", copy.message());
    assertEquals("m", original.message());
    assertEquals(original.tags(), copy.tags());
    assertEquals(original.extra(), copy.extra());
    assertEquals(original.contexts(), copy.contexts());
    assertEquals(original.breadcrumbs(), copy.breadcrumbs());
    assertEquals(original.user(), copy.user());
    assertEquals(original.fingerprint(), copy.fingerprint());
    assertEquals("qa", copy.environment());
    assertEquals("faultline.java", copy.sdkName());
    assertTrue(copy.isTransaction());
  }

  @Test
  void nullTagValueRemovesKey() {
    Event event = Event.builder().tag("k", "v").tag("k", null).build();

    assertTrue(event.tags().isEmpty());
  }

  @Test
  void levelWireNames() {
    assertEquals("warning", Level.WARNING.wireName());
    assertEquals(Level.WARNING, Level.fromWireName("warn"));
    assertEquals(Level.FATAL, Level.fromWireName(" Fatal "));
    assertThrows(IllegalArgumentException.class, () -> Level.fromWireName("loud"));
    assertThrows(IllegalArgumentException.class, () -> Level.fromWireName(null));
  }
}
