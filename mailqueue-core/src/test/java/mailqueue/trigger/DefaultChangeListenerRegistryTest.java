package mailqueue.trigger;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DefaultChangeListenerRegistryTest {

  @Test
  void returnsEmptyListForUnregisteredCollection() {
    assertTrue(new DefaultChangeListenerRegistry().listenersFor("mail").isEmpty());
  }

  @Test
  void specificListenersComeBeforeWildcardOnes() throws Exception {
    StringBuilder order = new StringBuilder();
    DefaultChangeListenerRegistry registry = new DefaultChangeListenerRegistry()
        .registerAll(change -> order.append("*"))
        .register("mail", change -> order.append("m"));

    for (ChangeListener listener : registry.listenersFor("mail")) {
      listener.onChange(null);
    }

    assertEquals("m*", order.toString());
  }

  @Test
  void listenersAreScopedToTheirCollection() {
    AtomicInteger calls = new AtomicInteger();
    DefaultChangeListenerRegistry registry = new DefaultChangeListenerRegistry()
        .register("templates", change -> calls.incrementAndGet());

    List<ChangeListener> listeners = registry.listenersFor("mail");

    assertTrue(listeners.isEmpty());
  }

  @Test
  void returnedListIsImmutable() {
    DefaultChangeListenerRegistry registry = new DefaultChangeListenerRegistry()
        .register("mail", change -> { });

    assertThrows(UnsupportedOperationException.class,
        () -> registry.listenersFor("mail").add(change -> { }));
  }

  @Test
  void rejectsNulls() {
    DefaultChangeListenerRegistry registry = new DefaultChangeListenerRegistry();

    assertThrows(NullPointerException.class, () -> registry.register(null, change -> { }));
    assertThrows(NullPointerException.class, () -> registry.register("mail", null));
  }
}
