package mailqueue.trigger;

import mailqueue.spi.ChangeHook;
import mailqueue.spi.DocumentChange;
import mailqueue.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bridges {@link mailqueue.spi.DocumentStore} commits into a {@link ChangeTrigger}. Each changed
 * document is offered individually and never blocks the committing thread. A change the
 * trigger rejects is counted and logged; the trigger's recovery source picks the document up
 * again.
 */
public final class TriggerChangeHook implements ChangeHook {
  private static final Logger logger = Logger.getLogger(TriggerChangeHook.class.getName());

  private final ChangeTrigger trigger;
  private final MetricsExporter metrics;

  public TriggerChangeHook(ChangeTrigger trigger) {
    this(trigger, null);
  }

  public TriggerChangeHook(ChangeTrigger trigger, MetricsExporter metrics) {
    this.trigger = Objects.requireNonNull(trigger, "trigger");
    this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
  }

  @Override
  public void afterCommit(List<DocumentChange> changes) {
    for (DocumentChange change : changes) {
      try {
        if (!trigger.enqueue(change)) {
          metrics.incrementNotificationDropped();
          logger.log(Level.WARNING, "Trigger queue full or closed, change of " + change.ref()
              + " left to recovery");
        }
      } catch (RuntimeException ex) {
        metrics.incrementNotificationDropped();
        logger.log(Level.WARNING, "Failed to enqueue change of " + change.ref(), ex);
      }
    }
  }
}
