package io.faultline.util;

import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Dependency-free JSON writer for envelope object trees.
 *
 * <p>This is the default {@link JsonCodec} implementation, accessible via
 * {@link JsonCodec#getDefault()} or the singleton {@link #INSTANCE}. Map entries are written
 * in iteration order; entries with a {@code null} value are written as {@code null}.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  /** Trees nested deeper than this are rejected, which also catches self-referencing maps. */
  public static final int MAX_DEPTH = 64;

  DefaultJsonCodec() {
  }

  @Override
  public String toJson(Object value) {
    StringBuilder sb = new StringBuilder(256);
    write(sb, value, 0);
    return sb.toString();
  }

  private static void write(StringBuilder sb, Object value, int depth) {
    if (depth > MAX_DEPTH) {
      throw new IllegalArgumentException("JSON nesting exceeds " + MAX_DEPTH + " levels");
    }
    if (value == null) {
      sb.append("null");
    } else if (value instanceof CharSequence || value instanceof Character) {
      appendString(sb, value.toString());
    } else if (value instanceof Boolean) {
      sb.append(value);
    } else if (value instanceof Number number) {
      appendNumber(sb, number);
    } else if (value instanceof Enum<?> e) {
      appendString(sb, e.name().toLowerCase());
    } else if (value instanceof TemporalAccessor) {
      appendString(sb, value.toString());
    } else if (value instanceof Map<?, ?> map) {
      writeObject(sb, map, depth);
    } else if (value instanceof Collection<?> collection) {
      writeArray(sb, collection, depth);
    } else if (value.getClass().isArray()) {
      writeArray(sb, arrayElements(value), depth);
    } else {
      appendString(sb, String.valueOf(value));
    }
  }

  private static void writeArray(StringBuilder sb, Collection<?> elements, int depth) {
    sb.append('[');
    boolean first = true;
    for (Object element : elements) {
      if (!first) {
        sb.append(',');
      }
      first = false;
      write(sb, element, depth + 1);
    }
    sb.append(']');
  }

  private static List<?> arrayElements(Object array) {
    if (array instanceof Object[] objects) {
      return Arrays.asList(objects);
    }
    List<Object> elements = new ArrayList<>();
    if (array instanceof int[] ints) {
      for (int v : ints) elements.add(v);
    } else if (array instanceof long[] longs) {
      for (long v : longs) elements.add(v);
    } else if (array instanceof double[] doubles) {
      for (double v : doubles) elements.add(v);
    } else if (array instanceof float[] floats) {
      for (float v : floats) elements.add(v);
    } else if (array instanceof short[] shorts) {
      for (short v : shorts) elements.add(v);
    } else if (array instanceof byte[] bytes) {
      for (byte v : bytes) elements.add(v);
    } else if (array instanceof boolean[] booleans) {
      for (boolean v : booleans) elements.add(v);
    } else if (array instanceof char[] chars) {
      for (char v : chars) elements.add(v);
    }
    return elements;
  }

  private static void writeObject(StringBuilder sb, Map<?, ?> map, int depth) {
    sb.append('{');
    boolean first = true;
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException("JSON object keys must be strings, got: " + entry.getKey());
      }
      if (!first) {
        sb.append(',');
      }
      first = false;
      appendString(sb, key);
      sb.append(':');
      write(sb, entry.getValue(), depth + 1);
    }
    sb.append('}');
  }

  private static void appendNumber(StringBuilder sb, Number number) {
    if (number instanceof Double || number instanceof Float) {
      double d = number.doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        throw new IllegalArgumentException("JSON cannot represent " + d);
      }
    }
    sb.append(number);
  }

  private static void appendString(StringBuilder sb, String value) {
    sb.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\b':
          sb.append("\\b");
          break;
        case '\f':
          sb.append("\\f");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        default:
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
    sb.append('"');
  }
}
