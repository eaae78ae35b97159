package eventnative.outcome;

import eventnative.ProcessedRow;

import java.time.Instant;
import java.util.Objects;

/**
 * Delivery status of one event at one destination.
 *
 * @param eventId     event id
 * @param destination destination name
 * @param status      outcome
 * @param timestamp   when the outcome was recorded
 * @param error       failure description, {@code null} on success
 * @param tableName   target table, {@code null} if the event never became a row
 * @param retries     failed attempts before this outcome
 */
public record DeliveryOutcome(
    String eventId,
    String destination,
    DeliveryStatus status,
    Instant timestamp,
    String error,
    String tableName,
    int retries
) {
  public DeliveryOutcome {
    Objects.requireNonNull(eventId, "eventId");
    Objects.requireNonNull(destination, "destination");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(timestamp, "timestamp");
  }

  public static DeliveryOutcome success(String destination, ProcessedRow row, int retries) {
    return new DeliveryOutcome(row.eventId(), destination, DeliveryStatus.SUCCESS, Instant.now(),
        null, row.tableName(), retries);
  }

  public static DeliveryOutcome retryableError(String destination, ProcessedRow row, int retries, String error) {
    return new DeliveryOutcome(row.eventId(), destination, DeliveryStatus.RETRYABLE_ERROR, Instant.now(),
        error, row.tableName(), retries);
  }

  public static DeliveryOutcome permanentError(String destination, ProcessedRow row, int retries, String error) {
    return new DeliveryOutcome(row.eventId(), destination, DeliveryStatus.PERMANENT_ERROR, Instant.now(),
        error, row.tableName(), retries);
  }

  public static DeliveryOutcome skipped(String destination, String eventId, String error) {
    return new DeliveryOutcome(eventId, destination, DeliveryStatus.SKIPPED, Instant.now(),
        error, null, 0);
  }
}
