package eventnative.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates named daemon threads for destination workers, e.g. {@code eventnative-stream-clicks-1}.
 *
 * <p>Uncaught exceptions are logged at SEVERE under the thread name so a dying worker is never
 * silent.
 */
public final class DaemonThreadFactory implements ThreadFactory {
  private static final Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());

  private final String prefix;
  private final AtomicInteger counter = new AtomicInteger(1);

  public DaemonThreadFactory(String prefix) {
    this.prefix = Objects.requireNonNull(prefix, "prefix");
  }

  /**
   * Factory for threads that serve a single destination.
   *
   * @param role        worker role, e.g. {@code "batch"} or {@code "stream"}
   * @param destination destination name
   */
  public static DaemonThreadFactory forDestination(String role, String destination) {
    return new DaemonThreadFactory("eventnative-" + role + "-" + destination + "-");
  }

  @Override
  public Thread newThread(Runnable runnable) {
    Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
    thread.setDaemon(true);
    thread.setUncaughtExceptionHandler((t, e) ->
        logger.log(Level.SEVERE, "Uncaught exception in " + t.getName(), e));
    return thread;
  }
}
