package mailqueue.store;

import mailqueue.spi.ChangeHook;
import mailqueue.spi.DocumentChange;
import mailqueue.spi.DocumentStore;
import mailqueue.spi.DocumentStoreException;
import mailqueue.spi.TransactionConflictException;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base class for document stores with optimistic transactions.
 *
 * <p>Subclasses implement a single {@link #attempt} that either commits or throws
 * {@link TransactionConflictException}. This class re-runs conflicting attempts with backoff
 * and, after a successful commit, reports the changes to the registered {@link ChangeHook}s
 * on the committing thread.
 */
public abstract class AbstractDocumentStore implements DocumentStore {
  private static final Logger logger = Logger.getLogger(AbstractDocumentStore.class.getName());

  public static final int DEFAULT_MAX_ATTEMPTS = 5;

  private final List<ChangeHook> hooks = new CopyOnWriteArrayList<>();
  private final RetryPolicy retryPolicy;
  private final int maxAttempts;

  protected AbstractDocumentStore() {
    this(new ExponentialBackoffRetryPolicy(20, 1000), DEFAULT_MAX_ATTEMPTS);
  }

  /**
   * @param retryPolicy delay between conflicting attempts
   * @param maxAttempts total attempts per transaction, at least 1
   */
  protected AbstractDocumentStore(RetryPolicy retryPolicy, int maxAttempts) {
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
    }
    this.maxAttempts = maxAttempts;
  }

  /**
   * Runs the function once and commits its writes.
   *
   * @throws TransactionConflictException if a document read or written was changed concurrently
   */
  protected abstract <T> Committed<T> attempt(TransactionFunction<T> function);

  @Override
  public final <T> T runTransaction(TransactionFunction<T> function) {
    Objects.requireNonNull(function, "function");
    for (int attempt = 1; ; attempt++) {
      Committed<T> committed;
      try {
        committed = attempt(function);
      } catch (TransactionConflictException e) {
        if (attempt >= maxAttempts) {
          throw e;
        }
        logger.log(Level.FINE, "Transaction conflict on attempt " + attempt + ": " + e.getMessage());
        backoff(attempt);
        continue;
      }
      notifyHooks(committed.changes());
      return committed.value();
    }
  }

  @Override
  public void addChangeHook(ChangeHook hook) {
    hooks.add(Objects.requireNonNull(hook, "hook"));
  }

  @Override
  public void removeChangeHook(ChangeHook hook) {
    hooks.remove(hook);
  }

  private void notifyHooks(List<DocumentChange> changes) {
    if (changes.isEmpty()) {
      return;
    }
    for (ChangeHook hook : hooks) {
      try {
        hook.afterCommit(changes);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Change hook failed after commit", e);
      }
    }
  }

  private void backoff(int attempt) {
    long delayMs = retryPolicy.computeDelayMs(attempt);
    if (delayMs <= 0) {
      return;
    }
    try {
      Thread.sleep(delayMs);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DocumentStoreException("Interrupted while retrying transaction", e);
    }
  }

  /**
   * Result of a committed attempt.
   *
   * @param value   what the transaction function returned
   * @param changes one entry per document the commit actually changed
   */
  protected record Committed<T>(T value, List<DocumentChange> changes) {
    public Committed {
      changes = List.copyOf(changes);
    }
  }
}
