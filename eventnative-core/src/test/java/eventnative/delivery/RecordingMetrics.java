package eventnative.delivery;

import eventnative.spi.MetricsExporter;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics stub counting calls by {@code <metric>.<destination>}.
 */
public final class RecordingMetrics implements MetricsExporter {
    private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();

    private void add(String metric, String destination, long delta) {
        counters.computeIfAbsent(metric + "." + destination, k -> new AtomicLong()).addAndGet(delta);
    }

    public long get(String metric, String destination) {
        AtomicLong counter = counters.get(metric + "." + destination);
        return counter == null ? 0 : counter.get();
    }

    @Override
    public void incrementAccepted(String destination) {
        add("accepted", destination, 1);
    }

    @Override
    public void incrementBackpressure(String destination) {
        add("backpressure", destination, 1);
    }

    @Override
    public void incrementSkipped(String destination) {
        add("skipped", destination, 1);
    }

    @Override
    public void incrementDelivered(String destination, int rows) {
        add("delivered", destination, rows);
    }

    @Override
    public void incrementRetried(String destination) {
        add("retried", destination, 1);
    }

    @Override
    public void incrementFailed(String destination, int rows) {
        add("failed", destination, rows);
    }

    @Override
    public void recordQueueDepth(String destination, long depth) {
        counters.computeIfAbsent("depth." + destination, k -> new AtomicLong()).set(depth);
    }

    @Override
    public void recordWriteDurationMs(String destination, long durationMs) {
        add("writes", destination, 1);
    }
}
