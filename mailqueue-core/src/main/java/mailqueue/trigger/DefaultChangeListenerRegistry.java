package mailqueue.trigger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Thread-safe registry keyed by collection path, with {@code "*"} matching every collection.
 *
 * <pre>{@code
 * ChangeListenerRegistry registry = new DefaultChangeListenerRegistry()
 *     .register("mail", deliveryDispatcher)
 *     .register("mail_templates", templateRenderer);
 * }</pre>
 */
public final class DefaultChangeListenerRegistry implements ChangeListenerRegistry {
  public static final String ALL_COLLECTIONS = "*";

  private final Map<String, CopyOnWriteArrayList<ChangeListener>> listeners = new ConcurrentHashMap<>();

  public DefaultChangeListenerRegistry register(String collection, ChangeListener listener) {
    Objects.requireNonNull(collection, "collection");
    Objects.requireNonNull(listener, "listener");
    listeners.computeIfAbsent(collection, ignored -> new CopyOnWriteArrayList<>()).add(listener);
    return this;
  }

  public DefaultChangeListenerRegistry registerAll(ChangeListener listener) {
    return register(ALL_COLLECTIONS, listener);
  }

  @Override
  public List<ChangeListener> listenersFor(String collection) {
    List<ChangeListener> result = new ArrayList<>();
    CopyOnWriteArrayList<ChangeListener> specific = listeners.get(collection);
    if (specific != null) {
      result.addAll(specific);
    }
    CopyOnWriteArrayList<ChangeListener> all = listeners.get(ALL_COLLECTIONS);
    if (all != null) {
      result.addAll(all);
    }
    return Collections.unmodifiableList(result);
  }
}
