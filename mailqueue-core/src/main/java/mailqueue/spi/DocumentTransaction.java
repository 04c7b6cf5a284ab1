package mailqueue.spi;

import java.util.Map;

/**
 * Read-modify-write view handed to a {@link DocumentStore.TransactionFunction}.
 *
 * <p>Reads observe committed state. Writes are buffered and applied atomically at commit,
 * after the store has verified that no document read or written here was changed by
 * another transaction in the meantime.
 */
public interface DocumentTransaction {

  /**
   * Reads a document. The returned snapshot's version is checked again at commit.
   *
   * @param ref the document to read
   * @return the committed snapshot (possibly {@linkplain DocumentSnapshot#exists() non-existent})
   */
  DocumentSnapshot get(DocumentRef ref);

  /**
   * Creates a document; commit fails if it already exists.
   */
  void create(DocumentRef ref, Map<String, Object> data);

  /**
   * Creates or fully replaces a document.
   */
  void set(DocumentRef ref, Map<String, Object> data);

  /**
   * Updates individual fields addressed by dotted paths (e.g. {@code delivery.state}).
   * Missing intermediate maps are created. Commit fails if the document does not exist.
   *
   * @param ref     the document to update
   * @param updates field path to new value; a {@code null} value stores an explicit null
   */
  void update(DocumentRef ref, Map<String, Object> updates);

  /**
   * Deletes a document. Deleting a missing document is a no-op.
   */
  void delete(DocumentRef ref);
}
