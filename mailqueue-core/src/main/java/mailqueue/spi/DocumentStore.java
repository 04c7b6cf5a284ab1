package mailqueue.spi;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Persistence contract for the documents the mail queue reads and mutates.
 *
 * <p>The only mutation primitive is {@link #runTransaction}: an atomic compare-and-update over
 * any number of documents. Conflicting concurrent transactions are retried by the store, not
 * by the caller; the function may therefore run more than once and must not have side effects
 * beyond the transaction it is given.
 *
 * <p>After each commit the store reports every changed document to its registered
 * {@link ChangeHook}s.
 *
 * @see mailqueue.store.InMemoryDocumentStore
 */
public interface DocumentStore {

  /**
   * Executes a read-modify-write function atomically.
   *
   * @param function the transaction body
   * @param <T>      result type
   * @return the value returned by the last (committed) execution of {@code function}
   * @throws TransactionConflictException if the transaction could not commit within the
   *     store's retry budget
   * @throws DocumentStoreException       on any other store failure
   */
  <T> T runTransaction(TransactionFunction<T> function);

  /**
   * Reads several documents in one batch.
   *
   * @param refs      the documents to read
   * @param fieldMask top-level fields to return, or {@code null} for all fields
   * @return snapshots in the same order as {@code refs}
   */
  List<DocumentSnapshot> getAll(List<DocumentRef> refs, Set<String> fieldMask);

  /**
   * Returns every existing document in a collection, ordered by id.
   */
  List<DocumentSnapshot> list(String collection);

  /**
   * Registers a hook that is told about every committed change.
   */
  void addChangeHook(ChangeHook hook);

  /**
   * Removes a previously registered hook.
   */
  void removeChangeHook(ChangeHook hook);

  default DocumentSnapshot get(DocumentRef ref) {
    return getAll(List.of(ref), null).get(0);
  }

  default void create(DocumentRef ref, Map<String, Object> data) {
    runTransaction(tx -> {
      tx.create(ref, data);
      return null;
    });
  }

  default void set(DocumentRef ref, Map<String, Object> data) {
    runTransaction(tx -> {
      tx.set(ref, data);
      return null;
    });
  }

  default void update(DocumentRef ref, Map<String, Object> updates) {
    runTransaction(tx -> {
      tx.update(ref, updates);
      return null;
    });
  }

  default void delete(DocumentRef ref) {
    runTransaction(tx -> {
      tx.delete(ref);
      return null;
    });
  }

  /**
   * Convenience for reading documents by id from one collection.
   */
  default List<DocumentSnapshot> getAll(String collection, List<String> ids, Set<String> fieldMask) {
    List<DocumentRef> refs = new ArrayList<>(ids.size());
    for (String id : ids) {
      refs.add(new DocumentRef(collection, id));
    }
    return getAll(refs, fieldMask);
  }

  /**
   * Body of a {@link #runTransaction} call.
   *
   * @param <T> result type
   */
  @FunctionalInterface
  interface TransactionFunction<T> {
    T apply(DocumentTransaction tx);
  }
}
