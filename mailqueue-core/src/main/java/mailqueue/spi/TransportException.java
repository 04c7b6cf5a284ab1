package mailqueue.spi;

import mailqueue.DeliveryException;

/**
 * Thrown by a {@link MailTransport} when a message could not be handed to the mail server.
 */
public class TransportException extends DeliveryException {

  public TransportException(String message) {
    super(message);
  }

  public TransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
