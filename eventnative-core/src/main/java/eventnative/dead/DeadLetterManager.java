package eventnative.dead;

import eventnative.delivery.StorageProxy;
import eventnative.queue.DeadLetter;
import eventnative.queue.PersistentQueue;
import eventnative.queue.QueueStorageException;
import eventnative.storage.DestinationService;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Query and replay of dead-lettered entries of stream destinations.
 *
 * <p>Batch destinations have no dead letters: their failed batches are only reported through
 * the outcome cache and logs. Storage errors are logged and reported as empty results.
 */
public final class DeadLetterManager {
  private static final Logger logger = Logger.getLogger(DeadLetterManager.class.getName());

  private final DestinationService destinations;

  public DeadLetterManager(DestinationService destinations) {
    this.destinations = Objects.requireNonNull(destinations, "destinations");
  }

  /**
   * Dead letters of a destination, oldest first.
   *
   * @param destination destination name
   * @param limit       maximum number returned
   */
  public List<DeadLetter> query(String destination, int limit) {
    Optional<PersistentQueue> queue = queueOf(destination);
    if (queue.isEmpty()) {
      return List.of();
    }
    try {
      return queue.get().deadLetters(limit);
    } catch (QueueStorageException | IllegalStateException e) {
      logger.log(Level.SEVERE, "Failed to query dead letters of " + destination, e);
      return List.of();
    }
  }

  public long count(String destination) {
    return queueOf(destination).map(PersistentQueue::deadLetterCount).orElse(0L);
  }

  /**
   * Puts every dead letter of a destination back on its queue with a zero retry count.
   *
   * @return number of entries re-enqueued
   */
  public int replay(String destination) {
    Optional<PersistentQueue> queue = queueOf(destination);
    if (queue.isEmpty()) {
      return 0;
    }
    try {
      int replayed = queue.get().replayDeadLetters();
      logger.log(Level.INFO, "[{0}] Replayed {1} dead letters", new Object[]{destination, replayed});
      return replayed;
    } catch (QueueStorageException | IllegalStateException e) {
      logger.log(Level.SEVERE, "Failed to replay dead letters of " + destination, e);
      return 0;
    }
  }

  private Optional<PersistentQueue> queueOf(String destination) {
    return destinations.proxy(destination).flatMap(StorageProxy::queue);
  }
}
