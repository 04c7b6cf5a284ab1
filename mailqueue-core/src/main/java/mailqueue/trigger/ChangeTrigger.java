package mailqueue.trigger;

import mailqueue.spi.DocumentChange;
import mailqueue.spi.MetricsExporter;
import mailqueue.util.DaemonThreadFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded queue of document changes drained by a fixed set of worker threads.
 *
 * <p>Each change is handed to every {@link ChangeListener} registered for its collection.
 * A listener that throws is logged and skipped; the change is not redelivered. Workers take
 * changes independently, so two changes of the same message can be handled at the same time.
 * Listeners rely on the store transaction, not on ordering, for exclusion.
 *
 * <p>A change offered to a full queue is rejected. Once that has happened, the next worker
 * that finds the queue idle asks the {@linkplain Builder#recovery recovery source} for the
 * changes still needing work and queues them, repeating until nothing is rejected. Without a
 * recovery source rejected changes are lost.
 *
 * <p>{@link #close()} stops intake and gives the workers the drain timeout to empty the
 * queue before interrupting them.
 *
 * @see TriggerChangeHook
 */
public final class ChangeTrigger implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ChangeTrigger.class.getName());

  private static final long IDLE_POLL_MS = 50;
  private static final long INTERRUPT_GRACE_MS = 5000;

  private final BlockingQueue<DocumentChange> pending;
  private final List<Thread> workers;
  private final AtomicBoolean closed = new AtomicBoolean();
  private final AtomicBoolean rejected = new AtomicBoolean();
  private volatile boolean draining;

  private final ChangeListenerRegistry listenerRegistry;
  private final MetricsExporter metrics;
  private final Supplier<List<DocumentChange>> recovery;
  private final long drainTimeoutMs;

  private ChangeTrigger(Builder builder) {
    this.listenerRegistry = Objects.requireNonNull(builder.listenerRegistry, "listenerRegistry");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.recovery = builder.recovery;
    this.drainTimeoutMs = builder.drainTimeoutMs;
    if (builder.workerCount < 0) {
      throw new IllegalArgumentException("workerCount must be >= 0, was " + builder.workerCount);
    }
    if (builder.queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be > 0, was " + builder.queueCapacity);
    }
    if (drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0, was " + drainTimeoutMs);
    }
    this.pending = new ArrayBlockingQueue<>(builder.queueCapacity);

    if (builder.workerCount == 0) {
      logger.warning("Change trigger started without workers; queued changes are never delivered");
    }
    DaemonThreadFactory threads = new DaemonThreadFactory("mailqueue-trigger-");
    List<Thread> started = new ArrayList<>(builder.workerCount);
    for (int i = 0; i < builder.workerCount; i++) {
      Thread worker = threads.newThread(this::drain);
      worker.start();
      started.add(worker);
    }
    this.workers = List.copyOf(started);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Queues a change for the listeners of its collection without blocking.
   *
   * @return {@code false} if the queue is full or the trigger is closed
   */
  public boolean enqueue(DocumentChange change) {
    Objects.requireNonNull(change, "change");
    if (closed.get()) {
      return false;
    }
    boolean accepted = pending.offer(change);
    if (!accepted) {
      rejected.set(true);
    }
    metrics.recordQueueDepth(pending.size());
    return accepted;
  }

  /** Whether a change was rejected and recovery has not caught up yet. */
  public boolean hasRejectedChanges() {
    return rejected.get();
  }

  public int queueDepth() {
    return pending.size();
  }

  private void drain() {
    try {
      while (true) {
        DocumentChange change = pending.poll(IDLE_POLL_MS, TimeUnit.MILLISECONDS);
        if (change != null) {
          deliver(change);
          metrics.recordQueueDepth(pending.size());
        } else if (draining) {
          return;
        } else if (recovery != null && rejected.compareAndSet(true, false)) {
          recover();
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private void recover() {
    List<DocumentChange> backlog;
    try {
      backlog = recovery.get();
    } catch (RuntimeException e) {
      rejected.set(true);
      logger.log(Level.SEVERE, "Recovery after rejected changes failed; retrying when idle", e);
      return;
    }
    int queued = 0;
    for (DocumentChange change : backlog) {
      if (closed.get() || !pending.offer(change)) {
        rejected.set(true);
        break;
      }
      queued++;
    }
    metrics.recordQueueDepth(pending.size());
    logger.log(Level.INFO, "Re-queued " + queued + " of " + backlog.size()
        + " change(s) after the trigger queue overflowed");
  }

  private void deliver(DocumentChange change) {
    String collection = change.ref().collection();
    List<ChangeListener> listeners = listenerRegistry.listenersFor(collection);
    if (listeners.isEmpty()) {
      logger.log(Level.FINE, "No listener for collection " + collection);
      return;
    }
    for (ChangeListener listener : listeners) {
      try {
        listener.onChange(change);
      } catch (Exception e) {
        logger.log(Level.SEVERE, "Change listener " + listener + " failed for " + change.ref(), e);
      }
    }
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    draining = true;
    long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(drainTimeoutMs);
    try {
      for (Thread worker : workers) {
        long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
        if (remainingMs > 0) {
          worker.join(remainingMs);
        }
      }
      if (workers.stream().anyMatch(Thread::isAlive)) {
        logger.log(Level.WARNING, "Drain timeout of " + drainTimeoutMs + " ms exceeded with "
            + pending.size() + " change(s) queued; interrupting workers");
        workers.forEach(Thread::interrupt);
        for (Thread worker : workers) {
          worker.join(INTERRUPT_GRACE_MS);
        }
      }
    } catch (InterruptedException e) {
      workers.forEach(Thread::interrupt);
      Thread.currentThread().interrupt();
    }
  }

  public static final class Builder {
    private ChangeListenerRegistry listenerRegistry;
    private int workerCount = 4;
    private int queueCapacity = 1000;
    private MetricsExporter metrics;
    private long drainTimeoutMs = 5000;
    private Supplier<List<DocumentChange>> recovery;

    private Builder() {}

    /** Required. */
    public Builder listenerRegistry(ChangeListenerRegistry listenerRegistry) {
      this.listenerRegistry = listenerRegistry;
      return this;
    }

    /** Defaults to 4. With 0 changes are queued but never delivered, which tests use. */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /** Defaults to 1000. Changes beyond it are rejected until {@link #recovery} catches up. */
    public Builder queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Source of the changes that still need work, consulted on an idle worker after the queue
     * rejected a change. Optional.
     */
    public Builder recovery(Supplier<List<DocumentChange>> recovery) {
      this.recovery = recovery;
      return this;
    }

    /** How long {@link ChangeTrigger#close()} waits for the queue to empty. Defaults to 5000. */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Starts the workers.
     *
     * @throws IllegalArgumentException if a size or timeout is negative
     */
    public ChangeTrigger build() {
      return new ChangeTrigger(this);
    }
  }
}
