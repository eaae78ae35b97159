package eventnative.delivery;

import eventnative.DeliveryMode;
import eventnative.RawEvent;
import eventnative.queue.PersistentQueue;
import eventnative.schema.TransformException;

import java.util.Optional;

/**
 * Delivery orchestrator of one destination: transforms incoming events and delivers the rows
 * through the destination adapter in batch or stream mode.
 */
public interface StorageProxy extends AutoCloseable {

  /** Destination name. */
  String name();

  DeliveryMode mode();

  ProxyState state();

  /**
   * Transforms an event and hands the row over for delivery.
   *
   * @return {@code true} if the row was accepted, {@code false} if the event was skipped
   * @throws TransformException          if the event cannot be transformed and the destination
   *                                     has {@code break_on_error} set
   * @throws eventnative.BackpressureException if the buffer or queue is full
   * @throws IllegalStateException       if the proxy is closed
   */
  boolean consume(RawEvent event) throws TransformException;

  /** The durable queue of a stream destination. */
  Optional<PersistentQueue> queue();

  /**
   * Stops accepting events, drains within the drain timeout, then releases the queue and
   * adapter. Idempotent.
   */
  @Override
  void close();
}
