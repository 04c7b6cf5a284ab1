package mailqueue.spi;

/**
 * Thrown when a transaction observed a document that another transaction changed before commit.
 *
 * <p>Stores catch this internally and re-run the transaction; callers only see it once the
 * retry budget is exhausted.
 */
public final class TransactionConflictException extends DocumentStoreException {
  public TransactionConflictException(String message) {
    super(message);
  }
}
