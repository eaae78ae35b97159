package eventnative.spi;

/**
 * Per-destination mutual exclusion around writes, possibly shared across processes
 * (e.g. backed by a coordination service).
 *
 * <p>The {@link #NOOP} instance grants every lock immediately.
 */
public interface MonitorKeeper {

  MonitorKeeper NOOP = destination -> () -> {
  };

  /**
   * Blocks until the destination's lock is held.
   *
   * @param destination destination name
   * @return the held lock; release it with {@link DestinationLock#close()}
   * @throws InterruptedException if interrupted while waiting
   */
  DestinationLock acquire(String destination) throws InterruptedException;
}
