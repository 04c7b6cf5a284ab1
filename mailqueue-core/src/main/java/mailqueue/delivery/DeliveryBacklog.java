package mailqueue.delivery;

import mailqueue.model.Delivery;
import mailqueue.model.DeliveryState;
import mailqueue.spi.DocumentChange;
import mailqueue.spi.DocumentSnapshot;
import mailqueue.spi.DocumentStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Lists the message documents that still need a notification: those never initialized, as a
 * creation, and those waiting in {@code PENDING} or {@code RETRY}, as an update onto
 * themselves. Used to catch up after the trigger rejected changes.
 *
 * <p>Stale {@code PROCESSING} claims are not listed; lease expiry stays tied to an observed
 * update.
 */
public final class DeliveryBacklog implements Supplier<List<DocumentChange>> {
  private final DocumentStore store;
  private final String collection;

  public DeliveryBacklog(DocumentStore store, String collection) {
    this.store = Objects.requireNonNull(store, "store");
    this.collection = Objects.requireNonNull(collection, "collection");
  }

  @Override
  public List<DocumentChange> get() {
    List<DocumentChange> backlog = new ArrayList<>();
    for (DocumentSnapshot snapshot : store.list(collection)) {
      if (snapshot.get(Delivery.START_TIME) == null) {
        backlog.add(new DocumentChange(DocumentSnapshot.missing(snapshot.ref()), snapshot));
      } else {
        DeliveryState state = DeliveryState.parse(snapshot.get(Delivery.STATE));
        if (state != null && state.isClaimable()) {
          backlog.add(new DocumentChange(snapshot, snapshot));
        }
      }
    }
    return backlog;
  }
}
