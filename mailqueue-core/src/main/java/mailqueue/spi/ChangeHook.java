package mailqueue.spi;

import java.util.List;

/**
 * Callback invoked by a {@link DocumentStore} after a transaction commits.
 *
 * <p>Runs on the committing thread. Implementations should hand the changes off quickly;
 * exceptions are logged by the store and otherwise ignored.
 *
 * @see mailqueue.trigger.TriggerChangeHook
 */
@FunctionalInterface
public interface ChangeHook {

  /**
   * @param changes one entry per document written by the committed transaction
   */
  void afterCommit(List<DocumentChange> changes);
}
