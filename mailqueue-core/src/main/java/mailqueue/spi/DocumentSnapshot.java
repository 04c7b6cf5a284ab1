package mailqueue.spi;

import mailqueue.store.FieldPaths;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable view of a document at a point in time.
 *
 * <p>A snapshot of a document that does not exist has {@code null} data and version {@code 0}.
 * Field values are JSON-like: {@code String}, {@code Number}, {@code Boolean}, {@code List},
 * {@code Map}, {@code null}, or {@link Instant} for timestamps.
 *
 * @param ref        the document address
 * @param data       document fields, or {@code null} if the document does not exist
 * @param version    store-assigned version, incremented on every committed write
 * @param updateTime time of the last committed write, or {@code null} if absent
 */
public record DocumentSnapshot(DocumentRef ref, Map<String, Object> data, long version, Instant updateTime) {

  public DocumentSnapshot {
    Objects.requireNonNull(ref, "ref");
    data = data == null ? null : Collections.unmodifiableMap(FieldPaths.deepCopy(data));
  }

  /**
   * Returns a snapshot representing a document that does not exist.
   */
  public static DocumentSnapshot missing(DocumentRef ref) {
    return new DocumentSnapshot(ref, null, 0L, null);
  }

  public boolean exists() {
    return data != null;
  }

  /**
   * Reads a field by dotted path (e.g. {@code delivery.state}).
   *
   * @param fieldPath dotted field path
   * @return the value, or {@code null} if the document or any path segment is absent
   */
  public Object get(String fieldPath) {
    if (data == null) {
      return null;
    }
    return FieldPaths.get(data, fieldPath);
  }
}
