package io.faultline.transport;

import io.faultline.Breadcrumb;
import io.faultline.Event;
import io.faultline.ExceptionValue;
import io.faultline.Level;
import io.faultline.StackFrame;
import io.faultline.User;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnvelopeSerializerTest {

  private final EnvelopeSerializer serializer = new EnvelopeSerializer();

  @Test
  void minimalEventOmitsEmptyFields() {
    Event event = Event.builder().eventId("abc").message("hi").build();

    Map<String, Object> tree = serializer.toTree(event);

    assertEquals("abc", tree.get("event_id"));
    assertEquals("hi", tree.get("message"));
    assertFalse(tree.containsKey("tags"));
    assertFalse(tree.containsKey("breadcrumbs"));
    assertFalse(tree.containsKey("user"));
    assertFalse(tree.containsKey("exception"));
    assertFalse(tree.containsKey("fingerprint"));
  }

  @Test
  @SuppressWarnings("unchecked")
  void exceptionUsesSnakeCaseShape() {
    ExceptionValue value = new ExceptionValue("java.lang.IllegalStateException", "boom", "java.lang",
        List.of(new StackFrame("checkout", "com.example.Cart", "Cart.java", 42, true)),
        ExceptionValue.Mechanism.GENERIC);
    Event event = Event.builder().eventId("abc").exceptions(List.of(value)).level(Level.ERROR).build();

    Map<String, Object> tree = serializer.toTree(event);

    assertEquals("error", tree.get("level"));
    Map<String, Object> exception = (Map<String, Object>) tree.get("exception");
    Map<String, Object> first = ((List<Map<String, Object>>) exception.get("values")).get(0);
    assertEquals("java.lang.IllegalStateException", first.get("type"));
    assertEquals(Map.of("type", "generic", "handled", true), first.get("mechanism"));
    Map<String, Object> frame = ((List<Map<String, Object>>) ((Map<String, Object>) first.get("stacktrace"))
        .get("frames")).get(0);
    assertEquals(42, frame.get("lineno"));
    assertEquals(true, frame.get("in_app"));
    assertEquals("Cart.java", frame.get("filename"));
  }

  @Test
  void serializesFullEventToJson() {
    Event event = Event.builder()
        .eventId("0123456789abcdef0123456789abcdef")
        .message("checkout failed")
        .level(Level.WARNING)
        .timestamp(Instant.parse("2024-05-01T12:00:00Z"))
        .platform(Event.PLATFORM)
        .environment("staging")
        .serverName("web-1")
        .tag("region", "eu")
        .user(User.builder().id("u1").ipAddress("10.0.0.1").build())
        .breadcrumb(Breadcrumb.builder().message("clicked").category("ui")
            .timestamp(Instant.parse("2024-05-01T11:59:00Z")).build())
        .fingerprint(List.of("checkout"))
        .sdk("faultline.java", "0.1.0")
        .build();

    String json = serializer.serialize(event);

    assertTrue(json.startsWith("{\"event_id\":\"0123456789abcdef0123456789abcdef\""), json);
    assertTrue(json.contains("\"level\":\"warning\""), json);
    assertTrue(json.contains("\"timestamp\":\"2024-05-01T12:00:00Z\""), json);
    assertTrue(json.contains("\"server_name\":\"web-1\""), json);
    assertTrue(json.contains("\"tags\":{\"region\":\"eu\"}"), json);
    assertTrue(json.contains("\"user\":{\"id\":\"u1\",\"ip_address\":\"10.0.0.1\"}"), json);
    assertTrue(json.contains("\"breadcrumbs\":[{\"timestamp\":\"2024-05-01T11:59:00Z\",\"category\":\"ui\",\"message\":\"clicked\"}]"), json);
    assertTrue(json.contains("\"fingerprint\":[\"checkout\"]"), json);
    assertTrue(json.endsWith("\"sdk\":{\"name\":\"faultline.java\",\"version\":\"0.1.0\"}}"), json);
  }

  @Test
  void unrepresentableValuesFail() {
    Event event = Event.builder().eventId("abc").extra("ratio", Double.POSITIVE_INFINITY).build();

    EnvelopeSerializationException e = assertThrows(EnvelopeSerializationException.class,
        () -> serializer.serialize(event));
    assertTrue(e.getMessage().contains("abc"));
  }
}
