package eventnative.queue;

import eventnative.ProcessedRow;
import eventnative.util.JsonCodec;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * JSON records whose column values carry a type tag (see {@link TypedColumns}).
 */
final class JsonQueueEntryCodec implements QueueEntryCodec {
  private final JsonCodec json;

  JsonQueueEntryCodec(JsonCodec json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  @Override
  public byte[] encode(QueueEntry entry) {
    return json.toBytes(StoredEntry.of(entry, json));
  }

  @Override
  public QueueEntry decode(byte[] payload) {
    return decodeStored(json.fromBytes(payload, StoredEntry.class));
  }

  @Override
  public byte[] encodeDeadLetter(DeadLetter deadLetter) {
    StoredDeadLetter stored = new StoredDeadLetter(StoredEntry.of(deadLetter.entry(), json),
        deadLetter.error(), deadLetter.deadAt());
    return json.toBytes(stored);
  }

  @Override
  public DeadLetter decodeDeadLetter(byte[] payload) {
    StoredDeadLetter stored = json.fromBytes(payload, StoredDeadLetter.class);
    if (stored.entry() == null || stored.deadAt() == null) {
      throw new IllegalArgumentException("Incomplete dead letter record");
    }
    return new DeadLetter(decodeStored(stored.entry()), stored.error(), stored.deadAt());
  }

  private QueueEntry decodeStored(StoredEntry stored) {
    if (stored.destination() == null || stored.enqueuedAt() == null || stored.eventId() == null
        || stored.tableName() == null || stored.columns() == null) {
      throw new IllegalArgumentException("Incomplete queue record");
    }
    ProcessedRow row = new ProcessedRow(stored.eventId(), stored.tableName(),
        TypedColumns.decode(stored.columns(), json), stored.primaryKeyFields());
    return new QueueEntry(stored.destination(), stored.enqueuedAt(), stored.retryCount(), row);
  }

  record StoredEntry(
      String destination,
      Instant enqueuedAt,
      int retryCount,
      String eventId,
      String tableName,
      List<TypedColumns.Column> columns,
      Set<String> primaryKeyFields
  ) {
    static StoredEntry of(QueueEntry entry, JsonCodec json) {
      ProcessedRow row = entry.row();
      return new StoredEntry(entry.destination(), entry.enqueuedAt(), entry.retryCount(),
          row.eventId(), row.tableName(), TypedColumns.encode(row.columns(), json),
          row.primaryKeyFields());
    }
  }

  record StoredDeadLetter(StoredEntry entry, String error, Instant deadAt) {}
}
