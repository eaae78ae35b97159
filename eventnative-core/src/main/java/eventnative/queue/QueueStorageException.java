package eventnative.queue;

/**
 * Unchecked wrapper for I/O failures of the durable queue files.
 */
public class QueueStorageException extends RuntimeException {
  public QueueStorageException(String message) {
    super(message);
  }

  public QueueStorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
