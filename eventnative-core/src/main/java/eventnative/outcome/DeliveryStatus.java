package eventnative.outcome;

/**
 * Result of delivering one event to one destination.
 */
public enum DeliveryStatus {
  /** Written by the destination adapter. */
  SUCCESS,
  /** The last attempt failed and the event will be retried. */
  RETRYABLE_ERROR,
  /** The event will not be delivered: permanent failure, exhausted retries or a dropped batch. */
  PERMANENT_ERROR,
  /** The event was dropped by the transform pipeline. */
  SKIPPED
}
