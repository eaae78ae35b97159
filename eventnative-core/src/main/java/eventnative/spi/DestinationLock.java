package eventnative.spi;

/**
 * A held destination lock. Closing releases it; closing twice is a no-op.
 */
public interface DestinationLock extends AutoCloseable {

  @Override
  void close();
}
