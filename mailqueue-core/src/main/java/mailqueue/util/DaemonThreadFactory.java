package mailqueue.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread factory for background workers: daemon threads named {@code <prefix><n>}, numbered
 * from 1, whose uncaught exceptions go to the log instead of stderr.
 */
public final class DaemonThreadFactory implements ThreadFactory {
  private static final Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());

  private final String prefix;
  private final AtomicInteger created = new AtomicInteger();

  public DaemonThreadFactory(String prefix) {
    this.prefix = Objects.requireNonNull(prefix, "prefix");
  }

  @Override
  public Thread newThread(Runnable task) {
    Thread worker = new Thread(task, prefix + created.incrementAndGet());
    worker.setDaemon(true);
    worker.setUncaughtExceptionHandler((thread, error) ->
        logger.log(Level.SEVERE, "Uncaught exception in " + thread.getName(), error));
    return worker;
  }

  public int createdCount() {
    return created.get();
  }
}
