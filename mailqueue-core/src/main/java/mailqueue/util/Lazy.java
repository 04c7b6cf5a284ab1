package mailqueue.util;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Thread-safe memoizing supplier: the delegate runs at most once successfully.
 *
 * <p>If the delegate throws, nothing is cached and the next {@link #get()} tries again.
 */
public final class Lazy<T> implements Supplier<T> {
  private final Supplier<? extends T> delegate;
  private volatile T value;

  private Lazy(Supplier<? extends T> delegate) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
  }

  public static <T> Lazy<T> of(Supplier<? extends T> delegate) {
    return new Lazy<>(delegate);
  }

  @Override
  public T get() {
    T result = value;
    if (result == null) {
      synchronized (this) {
        result = value;
        if (result == null) {
          result = Objects.requireNonNull(delegate.get(), "Lazy delegate returned null");
          value = result;
        }
      }
    }
    return result;
  }

  /**
   * Returns the value if it has been computed, without computing it.
   */
  public T getIfInitialized() {
    return value;
  }
}
