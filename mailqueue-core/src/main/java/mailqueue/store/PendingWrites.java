package mailqueue.store;

import mailqueue.spi.DocumentRef;
import mailqueue.spi.DocumentStoreException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered buffer of the writes issued inside one transaction, grouped by document.
 *
 * <p>Shared by store implementations: they collect writes here, then at commit replay them
 * against the committed data of each document with {@link #apply}.
 */
public final class PendingWrites {

  /** Kind of buffered write. */
  public enum Kind { CREATE, SET, UPDATE, DELETE }

  private record Write(Kind kind, Map<String, Object> data) {}

  private final Map<DocumentRef, List<Write>> writes = new LinkedHashMap<>();

  public void add(DocumentRef ref, Kind kind, Map<String, Object> data) {
    Objects.requireNonNull(ref, "ref");
    Objects.requireNonNull(kind, "kind");
    if (kind != Kind.DELETE) {
      Objects.requireNonNull(data, "data");
    }
    Map<String, Object> copy = data == null ? null : FieldPaths.deepCopy(data);
    writes.computeIfAbsent(ref, r -> new ArrayList<>()).add(new Write(kind, copy));
  }

  public boolean isEmpty() {
    return writes.isEmpty();
  }

  /**
   * Documents written in this transaction, in first-write order.
   */
  public Set<DocumentRef> refs() {
    return writes.keySet();
  }

  /**
   * Replays the buffered writes for one document.
   *
   * @param ref     the document
   * @param current committed data, or {@code null} if the document does not exist
   * @return the resulting data, or {@code null} if the document ends up deleted
   * @throws DocumentStoreException if a create hits an existing document or an update a missing one
   */
  public Map<String, Object> apply(DocumentRef ref, Map<String, Object> current) {
    Map<String, Object> result = current == null ? null : FieldPaths.deepCopy(current);
    for (Write write : writes.getOrDefault(ref, List.of())) {
      switch (write.kind()) {
        case CREATE -> {
          if (result != null) {
            throw new DocumentStoreException("Document already exists: " + ref);
          }
          result = FieldPaths.deepCopy(write.data());
        }
        case SET -> result = FieldPaths.deepCopy(write.data());
        case UPDATE -> {
          if (result == null) {
            throw new DocumentStoreException("No document to update: " + ref);
          }
          for (Map.Entry<String, Object> entry : write.data().entrySet()) {
            FieldPaths.set(result, entry.getKey(), entry.getValue());
          }
        }
        case DELETE -> result = null;
      }
    }
    return result;
  }
}
