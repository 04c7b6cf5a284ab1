package mailqueue.delivery;

import mailqueue.spi.DocumentRef;

import java.time.Instant;
import java.util.Map;

/**
 * A successful claim: the document is {@code PROCESSING} and this attempt owns it until
 * {@code leaseExpireTime}.
 *
 * @param ref             the claimed document
 * @param message         the {@code message} map as read by the claiming transaction
 * @param claimTime       when the claim committed
 * @param leaseExpireTime deadline of the claim
 */
public record Claim(DocumentRef ref, Map<String, Object> message, Instant claimTime, Instant leaseExpireTime) {
  public Claim {
    message = message == null ? Map.of() : message;
  }
}
