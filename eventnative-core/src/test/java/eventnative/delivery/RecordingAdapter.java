package eventnative.delivery;

import eventnative.ProcessedRow;
import eventnative.spi.DestinationAdapter;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Adapter stub that records successful writes and fails on demand.
 */
public final class RecordingAdapter implements DestinationAdapter {
    private final List<List<ProcessedRow>> writes = new CopyOnWriteArrayList<>();
    private final ConcurrentLinkedDeque<Exception> failures = new ConcurrentLinkedDeque<>();
    private final AtomicInteger attempts = new AtomicInteger();
    private volatile Exception alwaysFail;
    private volatile CountDownLatch gate;
    private volatile CountDownLatch entered;
    private volatile boolean closed;

    /** Makes the next write throw {@code failure}. Calls queue up. */
    public RecordingAdapter failNext(Exception failure) {
        failures.add(failure);
        return this;
    }

    /** Makes every write throw {@code failure} until {@link #recover()}. */
    public RecordingAdapter failAlways(Exception failure) {
        this.alwaysFail = failure;
        return this;
    }

    public RecordingAdapter recover() {
        this.alwaysFail = null;
        return this;
    }

    /** Blocks writes until {@code gate} opens; {@code entered} counts down when a write starts. */
    public RecordingAdapter blockOn(CountDownLatch gate, CountDownLatch entered) {
        this.gate = gate;
        this.entered = entered;
        return this;
    }

    @Override
    public void write(List<ProcessedRow> rows) throws Exception {
        attempts.incrementAndGet();
        CountDownLatch e = entered;
        if (e != null) {
            e.countDown();
        }
        CountDownLatch g = gate;
        if (g != null) {
            g.await(10, TimeUnit.SECONDS);
        }
        Exception always = alwaysFail;
        if (always != null) {
            throw always;
        }
        Exception next = failures.poll();
        if (next != null) {
            throw next;
        }
        writes.add(List.copyOf(rows));
    }

    public List<List<ProcessedRow>> writes() {
        return writes;
    }

    public List<ProcessedRow> rows() {
        List<ProcessedRow> rows = new ArrayList<>();
        writes.forEach(rows::addAll);
        return rows;
    }

    public int attempts() {
        return attempts.get();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
    }
}
