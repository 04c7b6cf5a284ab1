package mailqueue.store;

import mailqueue.spi.DocumentChange;
import mailqueue.spi.DocumentRef;
import mailqueue.spi.DocumentSnapshot;
import mailqueue.spi.TransactionConflictException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe document store held in memory.
 *
 * <p>Transactions are optimistic: the function runs without holding the lock, and the commit
 * verifies under the lock that every document it read still has the version it saw.
 * Suitable for tests, local development and single-process deployments.
 */
public final class InMemoryDocumentStore extends AbstractDocumentStore {
  private final ReentrantLock lock = new ReentrantLock();
  private final Map<DocumentRef, DocumentSnapshot> documents = new HashMap<>();
  private final Clock clock;

  public InMemoryDocumentStore() {
    this(Clock.systemUTC());
  }

  public InMemoryDocumentStore(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public InMemoryDocumentStore(Clock clock, RetryPolicy retryPolicy, int maxAttempts) {
    super(retryPolicy, maxAttempts);
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  protected <T> Committed<T> attempt(TransactionFunction<T> function) {
    BufferedTransaction tx = new BufferedTransaction() {
      @Override
      protected DocumentSnapshot read(DocumentRef ref) {
        return current(ref);
      }
    };
    T value = function.apply(tx);
    if (tx.writes().isEmpty()) {
      return new Committed<>(value, List.of());
    }

    lock.lock();
    try {
      for (Map.Entry<DocumentRef, DocumentSnapshot> read : tx.reads().entrySet()) {
        DocumentSnapshot now = currentLocked(read.getKey());
        if (now.version() != read.getValue().version()) {
          throw new TransactionConflictException("Document changed during transaction: " + read.getKey());
        }
      }
      Instant commitTime = clock.instant();
      Map<DocumentRef, DocumentSnapshot> staged = new HashMap<>();
      List<DocumentChange> changes = new ArrayList<>();
      for (DocumentRef ref : tx.writes().refs()) {
        DocumentSnapshot before = currentLocked(ref);
        Map<String, Object> data = tx.writes().apply(ref, before.data());
        if (data == null && !before.exists()) {
          continue;
        }
        DocumentSnapshot after = data == null
            ? DocumentSnapshot.missing(ref)
            : new DocumentSnapshot(ref, data, before.version() + 1, commitTime);
        staged.put(ref, after);
        changes.add(new DocumentChange(before, after));
      }
      for (Map.Entry<DocumentRef, DocumentSnapshot> entry : staged.entrySet()) {
        if (entry.getValue().exists()) {
          documents.put(entry.getKey(), entry.getValue());
        } else {
          documents.remove(entry.getKey());
        }
      }
      return new Committed<>(value, changes);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public List<DocumentSnapshot> getAll(List<DocumentRef> refs, Set<String> fieldMask) {
    List<DocumentSnapshot> result = new ArrayList<>(refs.size());
    lock.lock();
    try {
      for (DocumentRef ref : refs) {
        DocumentSnapshot snapshot = currentLocked(ref);
        if (fieldMask != null && snapshot.exists()) {
          snapshot = new DocumentSnapshot(ref, FieldPaths.project(snapshot.data(), fieldMask),
              snapshot.version(), snapshot.updateTime());
        }
        result.add(snapshot);
      }
    } finally {
      lock.unlock();
    }
    return result;
  }

  @Override
  public List<DocumentSnapshot> list(String collection) {
    Objects.requireNonNull(collection, "collection");
    List<DocumentSnapshot> result = new ArrayList<>();
    lock.lock();
    try {
      for (DocumentSnapshot snapshot : documents.values()) {
        if (snapshot.ref().collection().equals(collection)) {
          result.add(snapshot);
        }
      }
    } finally {
      lock.unlock();
    }
    result.sort(Comparator.comparing(s -> s.ref().id()));
    return result;
  }

  /**
   * Number of stored documents across all collections.
   */
  public int size() {
    lock.lock();
    try {
      return documents.size();
    } finally {
      lock.unlock();
    }
  }

  private DocumentSnapshot current(DocumentRef ref) {
    lock.lock();
    try {
      return currentLocked(ref);
    } finally {
      lock.unlock();
    }
  }

  private DocumentSnapshot currentLocked(DocumentRef ref) {
    DocumentSnapshot snapshot = documents.get(ref);
    return snapshot != null ? snapshot : DocumentSnapshot.missing(ref);
  }
}
