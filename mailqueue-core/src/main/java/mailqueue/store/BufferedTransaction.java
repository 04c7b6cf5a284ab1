package mailqueue.store;

import mailqueue.spi.DocumentRef;
import mailqueue.spi.DocumentSnapshot;
import mailqueue.spi.DocumentTransaction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@link DocumentTransaction} that records what it read and buffers what it writes.
 *
 * <p>All reads must happen before the first write. A document read twice returns the
 * snapshot from the first read.
 */
public abstract class BufferedTransaction implements DocumentTransaction {
  private final Map<DocumentRef, DocumentSnapshot> reads = new LinkedHashMap<>();
  private final PendingWrites writes = new PendingWrites();

  /**
   * Reads the committed state of a document.
   */
  protected abstract DocumentSnapshot read(DocumentRef ref);

  @Override
  public DocumentSnapshot get(DocumentRef ref) {
    Objects.requireNonNull(ref, "ref");
    if (!writes.isEmpty()) {
      throw new IllegalStateException("Transactions must perform all reads before any writes");
    }
    return reads.computeIfAbsent(ref, this::read);
  }

  @Override
  public void create(DocumentRef ref, Map<String, Object> data) {
    writes.add(ref, PendingWrites.Kind.CREATE, data);
  }

  @Override
  public void set(DocumentRef ref, Map<String, Object> data) {
    writes.add(ref, PendingWrites.Kind.SET, data);
  }

  @Override
  public void update(DocumentRef ref, Map<String, Object> updates) {
    writes.add(ref, PendingWrites.Kind.UPDATE, updates);
  }

  @Override
  public void delete(DocumentRef ref) {
    writes.add(ref, PendingWrites.Kind.DELETE, null);
  }

  /**
   * Snapshots read so far, keyed by document.
   */
  public Map<DocumentRef, DocumentSnapshot> reads() {
    return Collections.unmodifiableMap(reads);
  }

  public PendingWrites writes() {
    return writes;
  }

  /**
   * Every document this transaction read or wrote, reads first.
   */
  public Set<DocumentRef> touched() {
    Set<DocumentRef> touched = new LinkedHashSet<>(reads.keySet());
    touched.addAll(writes.refs());
    return touched;
  }
}
