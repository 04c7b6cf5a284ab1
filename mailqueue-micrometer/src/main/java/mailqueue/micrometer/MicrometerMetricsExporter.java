package mailqueue.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import mailqueue.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code mailqueue.delivery.initialized}: new documents moved to PENDING</li>
 *   <li>{@code mailqueue.delivery.claimed}: attempts started (moved to PROCESSING)</li>
 *   <li>{@code mailqueue.delivery.claim.skipped}: notifications that found nothing to claim</li>
 *   <li>{@code mailqueue.delivery.success}: attempts that ended in SUCCESS</li>
 *   <li>{@code mailqueue.delivery.error}: attempts that ended in ERROR</li>
 *   <li>{@code mailqueue.delivery.lease.expired}: stale PROCESSING claims moved to ERROR</li>
 *   <li>{@code mailqueue.trigger.dropped}: change notifications rejected by a full trigger queue and
 *       left to the overflow recovery</li>
 * </ul>
 *
 * <h3>Gauges and summaries</h3>
 * <ul>
 *   <li>{@code mailqueue.trigger.queue.depth}: pending change notifications</li>
 *   <li>{@code mailqueue.delivery.attempt.duration.ms}: time from claim to completion</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter initialized;
  private final Counter claimed;
  private final Counter claimSkipped;
  private final Counter delivered;
  private final Counter failed;
  private final Counter leaseExpired;
  private final Counter notificationDropped;
  private final Gauge queueDepthGauge;
  private final DistributionSummary attemptDuration;

  private final AtomicInteger queueDepth = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "mailqueue"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "mailqueue");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for running several queues in one
   * process.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "billing.mail"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    this(registry, namePrefix, Tags.empty());
  }

  /**
   * Creates an exporter whose meters all carry the given tags, so queues sharing one prefix
   * can still be told apart.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names
   * @param tags       tags added to every meter
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix, Iterable<Tag> tags) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    Objects.requireNonNull(tags, "tags");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.initialized = Counter.builder(namePrefix + ".delivery.initialized")
        .description("Messages moved to PENDING")
        .tags(tags)
        .register(registry);
    this.claimed = Counter.builder(namePrefix + ".delivery.claimed")
        .description("Delivery attempts started")
        .tags(tags)
        .register(registry);
    this.claimSkipped = Counter.builder(namePrefix + ".delivery.claim.skipped")
        .description("Notifications that found the message already claimed or finished")
        .tags(tags)
        .register(registry);
    this.delivered = Counter.builder(namePrefix + ".delivery.success")
        .description("Attempts that ended in SUCCESS")
        .tags(tags)
        .register(registry);
    this.failed = Counter.builder(namePrefix + ".delivery.error")
        .description("Attempts that ended in ERROR")
        .tags(tags)
        .register(registry);
    this.leaseExpired = Counter.builder(namePrefix + ".delivery.lease.expired")
        .description("Stale PROCESSING claims moved to ERROR")
        .tags(tags)
        .register(registry);
    this.notificationDropped = Counter.builder(namePrefix + ".trigger.dropped")
        .description("Change notifications rejected by a full trigger queue")
        .tags(tags)
        .register(registry);

    this.queueDepthGauge = Gauge.builder(namePrefix + ".trigger.queue.depth", queueDepth, AtomicInteger::get)
        .tags(tags)
        .register(registry);
    this.attemptDuration = DistributionSummary.builder(namePrefix + ".delivery.attempt.duration.ms")
        .description("Time from claim to completion in milliseconds")
        .tags(tags)
        .register(registry);
  }

  @Override
  public void incrementInitialized() {
    if (closed) return;
    initialized.increment();
  }

  @Override
  public void incrementClaimed() {
    if (closed) return;
    claimed.increment();
  }

  @Override
  public void incrementClaimSkipped() {
    if (closed) return;
    claimSkipped.increment();
  }

  @Override
  public void incrementDelivered() {
    if (closed) return;
    delivered.increment();
  }

  @Override
  public void incrementFailed() {
    if (closed) return;
    failed.increment();
  }

  @Override
  public void incrementLeaseExpired() {
    if (closed) return;
    leaseExpired.increment();
  }

  @Override
  public void incrementNotificationDropped() {
    if (closed) return;
    notificationDropped.increment();
  }

  @Override
  public void recordQueueDepth(int depth) {
    if (closed) return;
    queueDepth.set(depth);
  }

  @Override
  public void recordAttemptDurationMs(long durationMs) {
    if (closed) return;
    attemptDuration.record(durationMs);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the {@link mailqueue.MailQueue} it reports for is closed, so stale gauges
   * do not linger.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(initialized, claimed, claimSkipped, delivered, failed,
        leaseExpired, notificationDropped, queueDepthGauge, attemptDuration)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
