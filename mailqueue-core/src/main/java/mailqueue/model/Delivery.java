package mailqueue.model;

import mailqueue.spi.DocumentSnapshot;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Read view of the {@code delivery} sub-record of a message document.
 *
 * <p>The record is written only by {@link mailqueue.delivery.DeliveryStateMachine}; this class
 * names its fields and decodes what is stored.
 *
 * @param state           current state, {@code null} if missing or unrecognized
 * @param startTime       when the queue first saw the document
 * @param endTime         when the last attempt completed
 * @param attempts        number of completed transport attempts
 * @param error           last error description, {@code null} if none
 * @param leaseExpireTime deadline of the current claim, {@code null} when not processing
 * @param info            acceptance detail of the successful attempt, {@code null} otherwise
 */
public record Delivery(
    DeliveryState state,
    Instant startTime,
    Instant endTime,
    int attempts,
    String error,
    Instant leaseExpireTime,
    DeliveryInfo info
) {
  public static final String FIELD = "delivery";
  public static final String STATE = "delivery.state";
  public static final String START_TIME = "delivery.startTime";
  public static final String END_TIME = "delivery.endTime";
  public static final String ATTEMPTS = "delivery.attempts";
  public static final String ERROR = "delivery.error";
  public static final String LEASE_EXPIRE_TIME = "delivery.leaseExpireTime";
  public static final String INFO = "delivery.info";

  /**
   * Decodes the {@code delivery} field of a document.
   *
   * @return the record, or empty if the document does not exist or has no {@code delivery} map
   */
  public static Optional<Delivery> fromDocument(DocumentSnapshot snapshot) {
    if (!(snapshot.get(FIELD) instanceof Map<?, ?> map)) {
      return Optional.empty();
    }
    return Optional.of(new Delivery(
        DeliveryState.parse(map.get("state")),
        asInstant(map.get("startTime")),
        asInstant(map.get("endTime")),
        map.get("attempts") instanceof Number n ? n.intValue() : 0,
        map.get("error") instanceof String s ? s : null,
        asInstant(map.get("leaseExpireTime")),
        map.get("info") instanceof Map<?, ?> info ? DeliveryInfo.fromMap(info) : null));
  }

  /**
   * Returns {@code true} if a {@link DeliveryState#PROCESSING} claim is stale at {@code now}.
   * A claim without a lease deadline is stale.
   */
  public boolean leaseExpired(Instant now) {
    return leaseExpireTime == null || leaseExpireTime.isBefore(now);
  }

  private static Instant asInstant(Object value) {
    return value instanceof Instant instant ? instant : null;
  }
}
