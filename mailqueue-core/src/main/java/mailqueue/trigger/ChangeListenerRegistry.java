package mailqueue.trigger;

import java.util.List;

/**
 * Looks up the listeners for a collection.
 *
 * @see DefaultChangeListenerRegistry
 */
public interface ChangeListenerRegistry {

  /**
   * Returns the listeners registered for the collection, followed by the ones registered
   * for all collections.
   *
   * @param collection the collection path of the changed document
   * @return immutable list of matching listeners, may be empty
   */
  List<ChangeListener> listenersFor(String collection);
}
