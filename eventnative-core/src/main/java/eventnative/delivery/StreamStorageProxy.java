package eventnative.delivery;

import eventnative.DeliveryMode;
import eventnative.ProcessedRow;
import eventnative.outcome.DeliveryOutcome;
import eventnative.queue.PersistentQueue;
import eventnative.queue.QueueDelivery;
import eventnative.queue.QueueEntry;
import eventnative.queue.QueueFullException;
import eventnative.schema.TransformPipeline;
import eventnative.spi.DeliveryException;
import eventnative.spi.DestinationAdapter;
import eventnative.util.DaemonThreadFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Stream-mode proxy: rows go to a {@link PersistentQueue} and a single worker thread writes
 * them one at a time.
 *
 * <p>On success the entry is acknowledged and recorded as
 * {@link eventnative.outcome.DeliveryStatus#SUCCESS}. A retryable failure re-queues the entry
 * at the tail, records {@code RETRYABLE_ERROR} and pauses the worker for the backoff delay.
 * A permanent failure, or a failure past the queue's retry cap, dead-letters the entry and
 * records {@code PERMANENT_ERROR}. The worker survives any adapter failure.
 */
public final class StreamStorageProxy extends AbstractStorageProxy {
  private static final Logger logger = Logger.getLogger(StreamStorageProxy.class.getName());

  private final PersistentQueue queue;
  private final ExecutorService worker;
  private final CountDownLatch stopSignal = new CountDownLatch(1);
  private final Object lifecycleLock = new Object();
  private boolean accepting = true;

  public StreamStorageProxy(String name, TransformPipeline pipeline, DestinationAdapter adapter,
                            PersistentQueue queue, DeliveryContext context) {
    super(name, pipeline, adapter, context);
    this.queue = Objects.requireNonNull(queue, "queue");
    if (!name.equals(queue.destination())) {
      throw new IllegalArgumentException("Queue of [" + queue.destination() + "] cannot serve [" + name + "]");
    }
    this.worker = Executors.newSingleThreadExecutor(DaemonThreadFactory.forDestination("stream", name));
    worker.submit(this::consumeLoop);
  }

  @Override
  public DeliveryMode mode() {
    return DeliveryMode.STREAM;
  }

  @Override
  public Optional<PersistentQueue> queue() {
    return Optional.of(queue);
  }

  @Override
  protected void accept(ProcessedRow row) {
    synchronized (lifecycleLock) {
      if (!accepting) {
        throw new IllegalStateException("Destination [" + name + "] is closed");
      }
      try {
        queue.enqueue(QueueEntry.of(name, row));
      } catch (QueueFullException e) {
        context.metrics().incrementBackpressure(name);
        throw e;
      }
    }
    context.metrics().incrementAccepted(name);
    context.metrics().recordQueueDepth(name, queue.size());
  }

  private void consumeLoop() {
    while (stopSignal.getCount() > 0 && !Thread.currentThread().isInterrupted()) {
      try {
        QueueDelivery delivery = queue.dequeue(context.settings().pollTimeoutMs(), TimeUnit.MILLISECONDS);
        if (delivery == null) {
          continue;
        }
        process(delivery);
        context.metrics().recordQueueDepth(name, queue.size());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "[" + name + "] Stream consumer loop error", t);
        pauseAfterError();
      }
    }
    transition(ProxyState.IDLE);
  }

  private void pauseAfterError() {
    try {
      stopSignal.await(context.settings().pollTimeoutMs(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private void process(QueueDelivery delivery) throws InterruptedException {
    QueueEntry entry = delivery.entry();
    ProcessedRow row = entry.row();
    transition(ProxyState.CONSUMING);
    try {
      write(List.of(row));
    } catch (InterruptedException e) {
      // left in flight: redelivered by the next queue owner
      throw e;
    } catch (Exception e) {
      handleFailure(delivery, entry, e);
      return;
    }
    delivery.ack();
    context.outcomes().record(DeliveryOutcome.success(name, row, entry.retryCount()));
    context.metrics().incrementDelivered(name, 1);
    transition(ProxyState.IDLE);
  }

  private void handleFailure(QueueDelivery delivery, QueueEntry entry, Exception failure)
      throws InterruptedException {
    ProcessedRow row = entry.row();
    String error = describe(failure);
    if (!DeliveryException.isRetryable(failure)) {
      delivery.deadLetter(error);
      context.outcomes().record(DeliveryOutcome.permanentError(name, row, entry.retryCount(), error));
      context.metrics().incrementFailed(name, 1);
      logger.log(Level.SEVERE, "[" + name + "] Event " + row.eventId() + " failed permanently", failure);
      transition(ProxyState.IDLE);
      return;
    }
    int retries = entry.retryCount() + 1;
    if (!delivery.nack(error)) {
      context.outcomes().record(DeliveryOutcome.permanentError(name, row, entry.retryCount(),
          "retries exhausted: " + error));
      context.metrics().incrementFailed(name, 1);
      transition(ProxyState.IDLE);
      return;
    }
    context.outcomes().record(DeliveryOutcome.retryableError(name, row, retries, error));
    context.metrics().incrementRetried(name);
    transition(ProxyState.RETRYING);
    long delayMs = context.settings().backoff().delayMs(retries);
    logger.log(Level.WARNING, "[{0}] Event {1} failed (retry {2}), next attempt in {3} ms: {4}",
        new Object[]{name, row.eventId(), retries, delayMs, error});
    stopSignal.await(delayMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Stops accepting rows, lets the worker finish its current entry within the drain timeout,
   * then closes the queue. Queued entries stay on disk for the next start.
   */
  @Override
  public void close() {
    synchronized (lifecycleLock) {
      if (!accepting) {
        return;
      }
      accepting = false;
    }
    stopSignal.countDown();
    worker.shutdown();
    try {
      if (!worker.awaitTermination(context.settings().drainTimeoutMs(), TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "[{0}] Drain timeout exceeded; interrupting worker. Queued entries: {1}",
            new Object[]{name, queue.size()});
        worker.shutdownNow();
        worker.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      worker.shutdownNow();
      Thread.currentThread().interrupt();
    } finally {
      markClosed();
      try {
        queue.close();
      } finally {
        closeAdapter();
      }
    }
  }
}
