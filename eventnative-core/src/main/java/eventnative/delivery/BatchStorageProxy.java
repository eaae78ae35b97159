package eventnative.delivery;

import eventnative.BackpressureException;
import eventnative.DeliveryMode;
import eventnative.ProcessedRow;
import eventnative.outcome.DeliveryOutcome;
import eventnative.queue.PersistentQueue;
import eventnative.schema.TransformPipeline;
import eventnative.spi.DeliveryException;
import eventnative.spi.DestinationAdapter;
import eventnative.util.DaemonThreadFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Batch-mode proxy: rows are buffered in memory and written in one adapter call when the
 * flush timer fires or {@code batchSize} rows are buffered.
 *
 * <p>The timer and every flush run on one scheduler thread, so flushes never overlap. A failed
 * flush is retried as a whole with backoff up to {@code maxAttempts}; a permanent failure stops
 * early. A batch that cannot be written is dropped, logged at SEVERE and every row recorded as
 * {@link eventnative.outcome.DeliveryStatus#PERMANENT_ERROR}.
 *
 * <p>The buffer is bounded by {@code bufferCapacity}; beyond it {@link #consume} throws
 * {@link BackpressureException}.
 */
public final class BatchStorageProxy extends AbstractStorageProxy {
  private static final Logger logger = Logger.getLogger(BatchStorageProxy.class.getName());

  private final Object bufferLock = new Object();
  private final ScheduledExecutorService scheduler;
  private final AtomicBoolean flushRequested = new AtomicBoolean();
  private final AtomicBoolean closed = new AtomicBoolean();
  private List<ProcessedRow> buffer = new ArrayList<>();
  private boolean accepting = true;

  public BatchStorageProxy(String name, TransformPipeline pipeline, DestinationAdapter adapter,
                           DeliveryContext context) {
    super(name, pipeline, adapter, context);
    long interval = context.settings().flushIntervalMs();
    this.scheduler = Executors.newSingleThreadScheduledExecutor(DaemonThreadFactory.forDestination("batch", name));
    scheduler.scheduleWithFixedDelay(this::timedFlush, interval, interval, TimeUnit.MILLISECONDS);
  }

  @Override
  public DeliveryMode mode() {
    return DeliveryMode.BATCH;
  }

  @Override
  public Optional<PersistentQueue> queue() {
    return Optional.empty();
  }

  /** Rows buffered and not yet handed to a flush. */
  public int buffered() {
    synchronized (bufferLock) {
      return buffer.size();
    }
  }

  @Override
  protected void accept(ProcessedRow row) {
    boolean full;
    synchronized (bufferLock) {
      if (!accepting) {
        throw new IllegalStateException("Destination [" + name + "] is closed");
      }
      if (buffer.size() >= context.settings().bufferCapacity()) {
        context.metrics().incrementBackpressure(name);
        throw new BackpressureException("Buffer of destination [" + name + "] is full ("
            + context.settings().bufferCapacity() + " rows)");
      }
      buffer.add(row);
      full = buffer.size() >= context.settings().batchSize();
    }
    context.metrics().incrementAccepted(name);
    if (full && flushRequested.compareAndSet(false, true)) {
      try {
        scheduler.execute(() -> {
          flushRequested.set(false);
          flushBuffer();
        });
      } catch (RejectedExecutionException e) {
        flushRequested.set(false);
      }
    }
  }

  /**
   * Flushes the buffer now and waits for the write, retries included, to finish.
   */
  public void flush() {
    Future<?> pending;
    try {
      pending = scheduler.submit(this::flushBuffer);
    } catch (RejectedExecutionException e) {
      return;
    }
    try {
      pending.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (ExecutionException e) {
      throw new IllegalStateException("Flush of destination [" + name + "] failed", e.getCause());
    }
  }

  private void timedFlush() {
    try {
      flushBuffer();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "[" + name + "] Batch flush error", t);
    }
  }

  private void flushBuffer() {
    List<ProcessedRow> batch;
    synchronized (bufferLock) {
      if (buffer.isEmpty()) {
        return;
      }
      batch = buffer;
      buffer = new ArrayList<>();
    }
    transition(ProxyState.FLUSHING);
    try {
      deliver(batch);
    } finally {
      transition(ProxyState.IDLE);
    }
  }

  private void deliver(List<ProcessedRow> batch) {
    int maxAttempts = context.settings().maxAttempts();
    Exception failure = null;
    int attempt = 0;
    while (attempt < maxAttempts) {
      attempt++;
      try {
        write(batch);
        for (ProcessedRow row : batch) {
          context.outcomes().record(DeliveryOutcome.success(name, row, attempt - 1));
        }
        context.metrics().incrementDelivered(name, batch.size());
        return;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        failure = e;
        break;
      } catch (Exception e) {
        failure = e;
        if (!DeliveryException.isRetryable(e) || attempt >= maxAttempts) {
          break;
        }
        context.metrics().incrementRetried(name);
        long delayMs = context.settings().backoff().delayMs(attempt);
        logger.log(Level.WARNING, "[{0}] Batch of {1} rows failed (attempt {2}/{3}), retrying in {4} ms: {5}",
            new Object[]{name, batch.size(), attempt, maxAttempts, delayMs, describe(e)});
        try {
          Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          break;
        }
      }
    }
    String error = describe(failure);
    for (ProcessedRow row : batch) {
      context.outcomes().record(DeliveryOutcome.permanentError(name, row, attempt - 1, error));
    }
    context.metrics().incrementFailed(name, batch.size());
    logger.log(Level.SEVERE, "[" + name + "] Dropped batch of " + batch.size() + " rows after "
        + attempt + " attempts", failure);
  }

  /**
   * Stops accepting rows, cancels the timer and runs a final flush within the drain timeout.
   * Rows the final flush could not reach are recorded as
   * {@link eventnative.outcome.DeliveryStatus#PERMANENT_ERROR}.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    synchronized (bufferLock) {
      accepting = false;
    }
    scheduler.execute(this::timedFlush);
    scheduler.shutdown();
    try {
      if (!scheduler.awaitTermination(context.settings().drainTimeoutMs(), TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "[{0}] Drain timeout exceeded; forcing shutdown. Buffered rows: {1}",
            new Object[]{name, buffered()});
        scheduler.shutdownNow();
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      scheduler.shutdownNow();
      Thread.currentThread().interrupt();
    } finally {
      dropUnflushed();
      markClosed();
      closeAdapter();
    }
  }

  /** Rows left in the buffer after a forced shutdown are recorded as failed. */
  private void dropUnflushed() {
    List<ProcessedRow> left;
    synchronized (bufferLock) {
      if (buffer.isEmpty()) {
        return;
      }
      left = buffer;
      buffer = new ArrayList<>();
    }
    String error = "Destination closed before the batch was flushed (drain timeout "
        + context.settings().drainTimeoutMs() + " ms)";
    for (ProcessedRow row : left) {
      context.outcomes().record(DeliveryOutcome.permanentError(name, row, 0, error));
    }
    context.metrics().incrementFailed(name, left.size());
    logger.log(Level.SEVERE, "[{0}] Dropped {1} buffered rows on shutdown: {2}",
        new Object[]{name, left.size(), error});
  }
}
