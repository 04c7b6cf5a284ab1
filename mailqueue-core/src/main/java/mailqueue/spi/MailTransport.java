package mailqueue.spi;

/**
 * Outbound mail capability.
 *
 * <p>One instance is shared by every delivery in the process, so implementations must be
 * thread-safe. The queue calls {@link #send} exactly once per successful claim.
 *
 * @see mailqueue.transport.InMemoryMailTransport
 */
@FunctionalInterface
public interface MailTransport {

  /**
   * Sends a composed message.
   *
   * @param mail the message with concrete recipients
   * @return per-recipient acceptance information
   * @throws TransportException if the message could not be sent to any recipient
   */
  SendResult send(OutgoingMail mail) throws TransportException;
}
