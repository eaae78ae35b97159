package eventnative.delivery;

import eventnative.ProcessedRow;
import eventnative.RawEvent;
import eventnative.outcome.DeliveryOutcome;
import eventnative.schema.TransformException;
import eventnative.schema.TransformPipeline;
import eventnative.spi.DestinationAdapter;
import eventnative.spi.DestinationLock;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Transform and write plumbing shared by the batch and stream proxies.
 */
abstract class AbstractStorageProxy implements StorageProxy {
  private static final Logger logger = Logger.getLogger(AbstractStorageProxy.class.getName());

  protected final String name;
  protected final TransformPipeline pipeline;
  protected final DestinationAdapter adapter;
  protected final DeliveryContext context;
  private final AtomicReference<ProxyState> state = new AtomicReference<>(ProxyState.IDLE);

  AbstractStorageProxy(String name, TransformPipeline pipeline, DestinationAdapter adapter,
                       DeliveryContext context) {
    this.name = Objects.requireNonNull(name, "name");
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    this.adapter = Objects.requireNonNull(adapter, "adapter");
    this.context = Objects.requireNonNull(context, "context");
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public ProxyState state() {
    return state.get();
  }

  @Override
  public final boolean consume(RawEvent event) throws TransformException {
    Objects.requireNonNull(event, "event");
    if (state.get() == ProxyState.CLOSED) {
      throw new IllegalStateException("Destination [" + name + "] is closed");
    }
    ProcessedRow row;
    try {
      row = pipeline.process(event);
    } catch (TransformException e) {
      context.outcomes().record(DeliveryOutcome.skipped(name, event.eventId(), e.getMessage()));
      context.metrics().incrementSkipped(name);
      if (pipeline.breakOnError()) {
        throw e;
      }
      logger.log(Level.WARNING, "[{0}] Event {1} skipped: {2}",
          new Object[]{name, event.eventId(), e.getMessage()});
      return false;
    }
    accept(row);
    return true;
  }

  /**
   * Hands a transformed row to the delivery path.
   *
   * @throws eventnative.BackpressureException if the row cannot be buffered or queued
   */
  protected abstract void accept(ProcessedRow row);

  /** Writes rows through the adapter while holding the destination's monitor lock. */
  protected final void write(List<ProcessedRow> rows) throws Exception {
    long start = System.nanoTime();
    try (DestinationLock ignored = context.monitorKeeper().acquire(name)) {
      adapter.write(rows);
    } finally {
      context.metrics().recordWriteDurationMs(name,
          TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
    }
  }

  /** Moves to {@code next} unless the proxy is already closed. */
  protected final void transition(ProxyState next) {
    state.updateAndGet(current -> current == ProxyState.CLOSED ? current : next);
  }

  protected final void markClosed() {
    state.set(ProxyState.CLOSED);
  }

  protected final void closeAdapter() {
    try {
      adapter.close();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "[" + name + "] Failed to close destination adapter", e);
    }
  }

  static String describe(Throwable failure) {
    String message = failure.getMessage();
    return message == null ? failure.getClass().getName() : message;
  }
}
