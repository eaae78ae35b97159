package eventnative.monitor;

import eventnative.spi.DestinationLock;
import eventnative.spi.MonitorKeeper;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process {@link MonitorKeeper}: one fair lock per destination name.
 */
public final class LocalMonitorKeeper implements MonitorKeeper {
  private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

  @Override
  public DestinationLock acquire(String destination) throws InterruptedException {
    ReentrantLock lock = locks.computeIfAbsent(destination, d -> new ReentrantLock(true));
    lock.lockInterruptibly();
    AtomicBoolean released = new AtomicBoolean();
    return () -> {
      if (released.compareAndSet(false, true)) {
        lock.unlock();
      }
    };
  }

  /** Whether some thread currently holds the destination's lock. */
  public boolean isLocked(String destination) {
    ReentrantLock lock = locks.get(destination);
    return lock != null && lock.isLocked();
  }
}
