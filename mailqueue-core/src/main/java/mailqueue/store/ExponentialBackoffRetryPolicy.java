package mailqueue.store;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Backoff between re-runs of a conflicting transaction.
 *
 * <p>The ceiling starts at {@code baseDelayMs} and doubles with each attempt up to
 * {@code maxDelayMs}. The delay is drawn uniformly from the upper half of the ceiling, so
 * attempt {@code n} waits between {@code ceiling/2} and {@code ceiling}.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;

  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    if (baseDelayMs <= 0 || maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException(
          "Expected 0 < baseDelayMs <= maxDelayMs, got: " + baseDelayMs + ", " + maxDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    long ceiling = ceilingMs(attempts);
    long floor = ceiling / 2;
    return floor + ThreadLocalRandom.current().nextLong(ceiling - floor + 1);
  }

  long ceilingMs(int attempts) {
    long ceiling = baseDelayMs;
    for (int i = 1; i < attempts && ceiling < maxDelayMs; i++) {
      ceiling = ceiling > maxDelayMs / 2 ? maxDelayMs : ceiling * 2;
    }
    return ceiling;
  }
}
