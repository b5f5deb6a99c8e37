package io.faultline.transport;

import io.faultline.Breadcrumb;
import io.faultline.Event;
import io.faultline.ExceptionValue;
import io.faultline.StackFrame;
import io.faultline.User;
import io.faultline.util.JsonCodec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns an {@link Event} into the JSON envelope posted to the collector.
 *
 * <p>Keys use snake_case. Null values, empty maps and empty lists are omitted.
 */
public final class EnvelopeSerializer {
  private final JsonCodec codec;

  public EnvelopeSerializer() {
    this(JsonCodec.getDefault());
  }

  public EnvelopeSerializer(JsonCodec codec) {
    this.codec = codec;
  }

  /**
   * Serializes {@code event}.
   *
   * @param event the event
   * @return the JSON envelope
   * @throws EnvelopeSerializationException if a value cannot be represented as JSON
   */
  public String serialize(Event event) {
    try {
      return codec.toJson(toTree(event));
    } catch (RuntimeException e) {
      throw new EnvelopeSerializationException(
          "Cannot serialize event " + event.eventId() + ": " + e.getMessage(), e);
    }
  }

  Map<String, Object> toTree(Event event) {
    Map<String, Object> root = new LinkedHashMap<>();
    put(root, "event_id", event.eventId());
    put(root, "message", event.message());
    if (!event.exceptions().isEmpty()) {
      List<Object> values = new ArrayList<>();
      for (ExceptionValue value : event.exceptions()) {
        values.add(exceptionTree(value));
      }
      root.put("exception", Map.of("values", values));
    }
    put(root, "level", event.level() == null ? null : event.level().wireName());
    put(root, "timestamp", event.timestamp());
    put(root, "platform", event.platform());
    put(root, "type", event.type());
    put(root, "transaction", event.transaction());
    put(root, "environment", event.environment());
    put(root, "release", event.release());
    put(root, "server_name", event.serverName());
    put(root, "tags", event.tags());
    put(root, "extra", event.extra());
    put(root, "contexts", event.contexts());
    if (!event.breadcrumbs().isEmpty()) {
      List<Object> crumbs = new ArrayList<>();
      for (Breadcrumb breadcrumb : event.breadcrumbs()) {
        crumbs.add(breadcrumbTree(breadcrumb));
      }
      root.put("breadcrumbs", crumbs);
    }
    if (event.user() != null) {
      put(root, "user", userTree(event.user()));
    }
    put(root, "fingerprint", event.fingerprint());
    if (event.sdkName() != null) {
      Map<String, Object> sdk = new LinkedHashMap<>();
      put(sdk, "name", event.sdkName());
      put(sdk, "version", event.sdkVersion());
      root.put("sdk", sdk);
    }
    return root;
  }

  private static Map<String, Object> exceptionTree(ExceptionValue value) {
    Map<String, Object> tree = new LinkedHashMap<>();
    put(tree, "type", value.type());
    put(tree, "value", value.value());
    put(tree, "module", value.module());
    if (value.mechanism() != null) {
      Map<String, Object> mechanism = new LinkedHashMap<>();
      mechanism.put("type", value.mechanism().type());
      mechanism.put("handled", value.mechanism().handled());
      tree.put("mechanism", mechanism);
    }
    if (!value.frames().isEmpty()) {
      List<Object> frames = new ArrayList<>();
      for (StackFrame frame : value.frames()) {
        Map<String, Object> f = new LinkedHashMap<>();
        put(f, "function", frame.function());
        put(f, "module", frame.module());
        put(f, "filename", frame.filename());
        put(f, "lineno", frame.lineno());
        f.put("in_app", frame.inApp());
        frames.add(f);
      }
      tree.put("stacktrace", Map.of("frames", frames));
    }
    return tree;
  }

  private static Map<String, Object> breadcrumbTree(Breadcrumb breadcrumb) {
    Map<String, Object> tree = new LinkedHashMap<>();
    put(tree, "timestamp", breadcrumb.timestamp());
    put(tree, "type", breadcrumb.type());
    put(tree, "category", breadcrumb.category());
    put(tree, "message", breadcrumb.message());
    put(tree, "level", breadcrumb.level() == null ? null : breadcrumb.level().wireName());
    put(tree, "data", breadcrumb.data());
    return tree;
  }

  private static Map<String, Object> userTree(User user) {
    Map<String, Object> tree = new LinkedHashMap<>();
    put(tree, "id", user.id());
    put(tree, "email", user.email());
    put(tree, "username", user.username());
    put(tree, "ip_address", user.ipAddress());
    put(tree, "data", user.data());
    return tree;
  }

  private static void put(Map<String, Object> target, String key, Object value) {
    if (value == null) {
      return;
    }
    if (value instanceof Map<?, ?> map && map.isEmpty()) {
      return;
    }
    if (value instanceof List<?> list && list.isEmpty()) {
      return;
    }
    target.put(key, value);
  }
}
