package mailqueue;

/**
 * Base class for failures of a single delivery attempt.
 *
 * <p>A {@code DeliveryException} never escapes the queue: the message it carries is recorded
 * as {@code delivery.error} and the document moves to {@code ERROR}. Re-delivery is an
 * explicit act of setting {@code delivery.state} to {@code RETRY}.
 *
 * @see InvalidMessageException
 * @see MissingConfigurationException
 * @see LeaseExpiredException
 * @see mailqueue.spi.TransportException
 * @see mailqueue.spi.TemplateException
 */
public abstract class DeliveryException extends Exception {

  protected DeliveryException(String message) {
    super(message);
  }

  protected DeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
