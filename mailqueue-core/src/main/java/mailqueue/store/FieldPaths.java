package mailqueue.store;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Helpers for dotted field paths ({@code delivery.info.accepted}) over nested document maps.
 */
public final class FieldPaths {

  /**
   * Reads a value by dotted path.
   *
   * @return the value, or {@code null} if any segment is missing or not a map
   */
  public static Object get(Map<String, Object> data, String fieldPath) {
    Objects.requireNonNull(fieldPath, "fieldPath");
    Object current = data;
    for (String segment : split(fieldPath)) {
      if (!(current instanceof Map<?, ?> map)) {
        return null;
      }
      current = map.get(segment);
    }
    return current;
  }

  /**
   * Writes a value by dotted path, replacing non-map intermediates with new maps.
   * {@code data} must be mutable, as must any nested map along the path.
   */
  @SuppressWarnings("unchecked")
  public static void set(Map<String, Object> data, String fieldPath, Object value) {
    String[] segments = split(fieldPath);
    Map<String, Object> current = data;
    for (int i = 0; i < segments.length - 1; i++) {
      Object next = current.get(segments[i]);
      if (!(next instanceof Map)) {
        next = new LinkedHashMap<String, Object>();
        current.put(segments[i], next);
      }
      current = (Map<String, Object>) next;
    }
    current.put(segments[segments.length - 1], deepCopyValue(value));
  }

  /**
   * Returns a mutable deep copy of a document map. Nested maps and lists are copied;
   * other values are immutable and shared.
   */
  public static Map<String, Object> deepCopy(Map<String, Object> data) {
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : data.entrySet()) {
      copy.put(entry.getKey(), deepCopyValue(entry.getValue()));
    }
    return copy;
  }

  /**
   * Keeps only the given top-level fields.
   */
  public static Map<String, Object> project(Map<String, Object> data, Set<String> fieldMask) {
    if (fieldMask == null) {
      return data;
    }
    Map<String, Object> projected = new LinkedHashMap<>();
    for (String field : fieldMask) {
      if (data.containsKey(field)) {
        projected.put(field, data.get(field));
      }
    }
    return projected;
  }

  @SuppressWarnings("unchecked")
  private static Object deepCopyValue(Object value) {
    if (value instanceof Map<?, ?> map) {
      Map<String, Object> copy = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        copy.put(String.valueOf(entry.getKey()), deepCopyValue(entry.getValue()));
      }
      return copy;
    }
    if (value instanceof List<?> list) {
      List<Object> copy = new ArrayList<>(list.size());
      for (Object item : list) {
        copy.add(deepCopyValue(item));
      }
      return copy;
    }
    return value;
  }

  private static String[] split(String fieldPath) {
    if (fieldPath.isEmpty() || fieldPath.startsWith(".") || fieldPath.endsWith(".")
        || fieldPath.contains("..")) {
      throw new IllegalArgumentException("Invalid field path: " + fieldPath);
    }
    return fieldPath.split("\\.");
  }

  private FieldPaths() {}
}
