package mailqueue;

/**
 * Thrown when a message document is malformed: a recipient field of the wrong type, a template
 * without a name, or no resolvable recipient at all.
 */
public final class InvalidMessageException extends DeliveryException {

  public InvalidMessageException(String message) {
    super(message);
  }
}
