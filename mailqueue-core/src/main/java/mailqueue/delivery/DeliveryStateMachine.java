package mailqueue.delivery;

import mailqueue.LeaseExpiredException;
import mailqueue.model.Delivery;
import mailqueue.model.DeliveryState;
import mailqueue.model.MessageFields;
import mailqueue.spi.DocumentRef;
import mailqueue.spi.DocumentSnapshot;
import mailqueue.spi.DocumentStore;
import mailqueue.spi.MetricsExporter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the {@code delivery} record of message documents.
 *
 * <p>Every transition is one store transaction that re-reads the document and checks the state
 * it expects before writing. Two concurrent claims of the same {@code PENDING} document
 * therefore cannot both succeed: the loser's transaction is re-run by the store, sees
 * {@code PROCESSING}, and backs off.
 *
 * <table>
 *   <caption>Transitions</caption>
 *   <tr><th>Method</th><th>From</th><th>To</th></tr>
 *   <tr><td>{@link #initialize}</td><td>not yet initialized</td><td>PENDING</td></tr>
 *   <tr><td>{@link #claim}</td><td>PENDING, RETRY</td><td>PROCESSING</td></tr>
 *   <tr><td>{@link #expireLease}</td><td>PROCESSING, lease elapsed</td><td>ERROR</td></tr>
 *   <tr><td>{@link #complete}</td><td>any</td><td>SUCCESS, ERROR</td></tr>
 * </table>
 *
 * <p>{@link #complete} does not check the state. The holder of a claim records its outcome even
 * if the lease ran out during a slow send and another invocation already moved the document to
 * {@code ERROR}; the late result then replaces that {@code ERROR}. This is the one way a
 * terminal state is left without an external {@code RETRY}.
 */
public final class DeliveryStateMachine {
  private static final Logger logger = Logger.getLogger(DeliveryStateMachine.class.getName());

  public static final Duration DEFAULT_LEASE_DURATION = Duration.ofSeconds(60);

  private final DocumentStore store;
  private final Clock clock;
  private final Duration leaseDuration;
  private final MetricsExporter metrics;

  public DeliveryStateMachine(DocumentStore store, Clock clock, Duration leaseDuration,
      MetricsExporter metrics) {
    this.store = Objects.requireNonNull(store, "store");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.leaseDuration = Objects.requireNonNull(leaseDuration, "leaseDuration");
    if (leaseDuration.isNegative() || leaseDuration.isZero()) {
      throw new IllegalArgumentException("leaseDuration must be positive, got: " + leaseDuration);
    }
    this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
  }

  public Clock clock() {
    return clock;
  }

  public Duration leaseDuration() {
    return leaseDuration;
  }

  /**
   * Moves a new document to {@code PENDING} with zero attempts, replacing any {@code delivery}
   * record the creator wrote. A record this method already wrote, recognized by its
   * {@code startTime}, is left alone so repeated creation notifications are harmless.
   *
   * @return {@code false} if the document is gone or was already initialized
   */
  public boolean initialize(DocumentRef ref) {
    boolean initialized = store.runTransaction(tx -> {
      DocumentSnapshot snapshot = tx.get(ref);
      if (!snapshot.exists() || snapshot.get(Delivery.START_TIME) != null) {
        return false;
      }
      Map<String, Object> delivery = new LinkedHashMap<>();
      delivery.put("startTime", clock.instant());
      delivery.put("state", DeliveryState.PENDING.name());
      delivery.put("attempts", 0);
      delivery.put("error", null);
      tx.update(ref, Map.of(Delivery.FIELD, delivery));
      return true;
    });
    if (initialized) {
      metrics.incrementInitialized();
    }
    return initialized;
  }

  /**
   * Moves a {@code PENDING} or {@code RETRY} document to {@code PROCESSING} with a fresh lease.
   *
   * @return the claim, or empty if the document is gone or no longer claimable
   */
  @SuppressWarnings("unchecked")
  public Optional<Claim> claim(DocumentRef ref) {
    Optional<Claim> claim = store.runTransaction(tx -> {
      DocumentSnapshot snapshot = tx.get(ref);
      DeliveryState state = DeliveryState.parse(snapshot.get(Delivery.STATE));
      if (!snapshot.exists() || state == null || !state.isClaimable()) {
        return Optional.empty();
      }
      Instant now = clock.instant();
      Instant leaseExpireTime = now.plus(leaseDuration);
      Map<String, Object> updates = new HashMap<>();
      updates.put(Delivery.STATE, DeliveryState.PROCESSING.name());
      updates.put(Delivery.LEASE_EXPIRE_TIME, leaseExpireTime);
      tx.update(ref, updates);
      Object message = snapshot.get(MessageFields.MESSAGE);
      return Optional.of(new Claim(ref,
          message instanceof Map ? (Map<String, Object>) message : null, now, leaseExpireTime));
    });
    if (claim.isPresent()) {
      metrics.incrementClaimed();
    } else {
      metrics.incrementClaimSkipped();
    }
    return claim;
  }

  /**
   * Moves a {@code PROCESSING} document whose lease has elapsed to {@code ERROR}. Attempts are
   * left unchanged; the message can be re-sent by setting the state to {@code RETRY}.
   *
   * @return {@code false} if the document is not processing or its lease is still valid
   */
  public boolean expireLease(DocumentRef ref) {
    Optional<LeaseExpiredException> expired = store.runTransaction(tx -> {
      DocumentSnapshot snapshot = tx.get(ref);
      Optional<Delivery> delivery = Delivery.fromDocument(snapshot);
      if (delivery.isEmpty()
          || delivery.get().state() != DeliveryState.PROCESSING
          || !delivery.get().leaseExpired(clock.instant())) {
        return Optional.empty();
      }
      Map<String, Object> updates = new HashMap<>();
      updates.put(Delivery.STATE, DeliveryState.ERROR.name());
      updates.put(Delivery.ERROR, LeaseExpiredException.MESSAGE);
      updates.put(Delivery.LEASE_EXPIRE_TIME, null);
      tx.update(ref, updates);
      return Optional.of(new LeaseExpiredException(ref, delivery.get().leaseExpireTime()));
    });
    if (expired.isEmpty()) {
      return false;
    }
    metrics.incrementLeaseExpired();
    logger.log(Level.WARNING, "Message " + ref + " moved to ERROR: " + expired.get().getMessage()
        + " Lease deadline was " + expired.get().leaseExpireTime());
    return true;
  }

  /**
   * Records the outcome of a claimed attempt: one more attempt, end time now, lease cleared,
   * and either {@code SUCCESS} with the transport info or {@code ERROR} with the description.
   *
   * @return {@code false} if the document was deleted while the attempt ran
   */
  public boolean complete(Claim claim, DeliveryOutcome outcome) {
    Objects.requireNonNull(claim, "claim");
    Objects.requireNonNull(outcome, "outcome");
    boolean completed = store.runTransaction(tx -> {
      DocumentSnapshot snapshot = tx.get(claim.ref());
      if (!snapshot.exists()) {
        return false;
      }
      int attempts = Delivery.fromDocument(snapshot).map(Delivery::attempts).orElse(0);
      Map<String, Object> updates = new HashMap<>();
      updates.put(Delivery.ATTEMPTS, attempts + 1);
      updates.put(Delivery.END_TIME, clock.instant());
      updates.put(Delivery.ERROR, null);
      updates.put(Delivery.LEASE_EXPIRE_TIME, null);
      if (outcome instanceof DeliveryOutcome.Delivered delivered) {
        updates.put(Delivery.STATE, DeliveryState.SUCCESS.name());
        updates.put(Delivery.INFO, delivered.info().toMap());
      } else if (outcome instanceof DeliveryOutcome.Failed failed) {
        updates.put(Delivery.STATE, DeliveryState.ERROR.name());
        updates.put(Delivery.ERROR, failed.error());
      }
      tx.update(claim.ref(), updates);
      return true;
    });
    if (!completed) {
      logger.log(Level.WARNING, "Message " + claim.ref() + " was deleted before its outcome could be recorded");
      return false;
    }
    if (outcome instanceof DeliveryOutcome.Delivered) {
      metrics.incrementDelivered();
    } else {
      metrics.incrementFailed();
    }
    return true;
  }
}
