package io.faultline.util;

/**
 * Encoder that turns the event envelope's object tree into JSON text.
 *
 * <p>The tree is built from {@code Map<String, ?>}, {@code Collection}, arrays,
 * {@code CharSequence}, {@code Number}, {@code Boolean}, {@code Enum}, {@code java.time}
 * temporals and {@code null}; other objects are written as their {@code toString()}.
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) has no dependencies. Applications
 * that already ship Jackson, Gson or another JSON library can implement this interface and
 * pass it to the transport builder.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

  /**
   * Returns the default singleton implementation.
   *
   * @return the default {@link JsonCodec}
   */
  static JsonCodec getDefault() {
    return DefaultJsonCodec.INSTANCE;
  }

  /**
   * Encodes an object tree as JSON.
   *
   * @param value the root value, usually a map
   * @return JSON text
   * @throws IllegalArgumentException if the tree cannot be represented as JSON
   *     (non-finite numbers, non-string map keys, nesting deeper than the codec allows)
   */
  String toJson(Object value);
}
