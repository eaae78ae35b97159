package eventnative.delivery;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DeliverySettingsTest {

    @Test
    void defaults() {
        DeliverySettings settings = DeliverySettings.defaults();
        assertEquals(10, settings.maxAttempts());
        assertEquals(9, settings.maxRetries());
        assertEquals(1000, settings.batchSize());
        assertEquals(10_000, settings.bufferCapacity());
        assertInstanceOf(ExponentialBackoff.class, settings.backoff());
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> DeliverySettings.builder().maxAttempts(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> DeliverySettings.builder().batchSize(10).bufferCapacity(5).build());
        assertThrows(IllegalArgumentException.class, () -> DeliverySettings.builder().flushIntervalMs(0).build());
        assertThrows(IllegalArgumentException.class, () -> DeliverySettings.builder().pollTimeoutMs(0).build());
        assertThrows(IllegalArgumentException.class, () -> DeliverySettings.builder().queueMaxBytes(0).build());
    }
}
