package mailqueue.spi;

/**
 * Observability hook for exporting mail queue counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of new documents moved to PENDING.
     */
    void incrementInitialized();

    /**
     * Increments the count of successful claims (PENDING/RETRY to PROCESSING).
     */
    void incrementClaimed();

    /**
     * Increments the count of claim attempts that found the document already claimed or finished.
     */
    void incrementClaimSkipped();

    /**
     * Increments the count of attempts that ended in SUCCESS.
     */
    void incrementDelivered();

    /**
     * Increments the count of attempts that ended in ERROR.
     */
    void incrementFailed();

    /**
     * Increments the count of stale PROCESSING claims moved to ERROR.
     */
    void incrementLeaseExpired();

    /**
     * Increments the count of change notifications dropped because the trigger queue was full.
     */
    default void incrementNotificationDropped() {
    }

    /**
     * Records the current depth of the change trigger queue.
     *
     * @param depth number of queued change notifications
     */
    void recordQueueDepth(int depth);

    /**
     * Records how long one attempt took, from claim to completion.
     *
     * @param durationMs attempt duration in milliseconds (always non-negative)
     */
    default void recordAttemptDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementInitialized() {
        }

        @Override
        public void incrementClaimed() {
        }

        @Override
        public void incrementClaimSkipped() {
        }

        @Override
        public void incrementDelivered() {
        }

        @Override
        public void incrementFailed() {
        }

        @Override
        public void incrementLeaseExpired() {
        }

        @Override
        public void recordQueueDepth(int depth) {
        }
    }
}
