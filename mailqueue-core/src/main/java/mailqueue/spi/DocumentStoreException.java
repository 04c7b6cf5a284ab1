package mailqueue.spi;

/**
 * Unchecked exception for document store failures (I/O, serialization, constraint violations).
 */
public class DocumentStoreException extends RuntimeException {
  public DocumentStoreException(String message) {
    super(message);
  }

  public DocumentStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
