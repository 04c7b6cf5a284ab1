package mailqueue.trigger;

import mailqueue.spi.DocumentChange;

/**
 * Reacts to a committed change of a document in the collection it is registered for.
 *
 * <p>Listeners run synchronously on {@link ChangeTrigger} worker threads. The same change may
 * be delivered more than once, and changes of one document may arrive out of order, so
 * listeners must decide what to do from the document state rather than from the
 * notification count.
 *
 * <p>An exception thrown here is logged by the trigger; the change is not redelivered.
 */
@FunctionalInterface
public interface ChangeListener {

  void onChange(DocumentChange change) throws Exception;
}
