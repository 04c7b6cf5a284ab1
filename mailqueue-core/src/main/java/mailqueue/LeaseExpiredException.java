package mailqueue;

import mailqueue.spi.DocumentRef;

import java.time.Instant;

/**
 * Describes a {@code PROCESSING} claim whose lease ran out before the attempt completed.
 *
 * <p>Never thrown across the queue boundary; the state machine records its message on the
 * document so an operator can reset the state to {@code RETRY}.
 */
public final class LeaseExpiredException extends DeliveryException {
  public static final String MESSAGE = "Message processing lease expired.";

  private final DocumentRef ref;
  private final Instant leaseExpireTime;

  public LeaseExpiredException(DocumentRef ref, Instant leaseExpireTime) {
    super(MESSAGE);
    this.ref = ref;
    this.leaseExpireTime = leaseExpireTime;
  }

  public DocumentRef ref() {
    return ref;
  }

  /**
   * The lease deadline that was missed, or {@code null} if the claim carried none.
   */
  public Instant leaseExpireTime() {
    return leaseExpireTime;
  }
}
