package mailqueue.store;

/**
 * How long a document store waits before re-running a transaction that lost a write conflict.
 *
 * <p>Tests typically pass {@code attempts -> 0L} to retry immediately.
 *
 * @see ExponentialBackoffRetryPolicy
 */
@FunctionalInterface
public interface RetryPolicy {

  /**
   * @param attempts executions of the transaction so far, starting at 1
   * @return milliseconds to sleep before the next execution, never negative
   */
  long computeDelayMs(int attempts);
}
