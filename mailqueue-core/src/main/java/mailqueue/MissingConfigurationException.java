package mailqueue;

/**
 * Thrown when a message asks for a feature the queue was not configured for, such as
 * uid-based addressing without a users collection.
 */
public final class MissingConfigurationException extends DeliveryException {

  public MissingConfigurationException(String message) {
    super(message);
  }
}
