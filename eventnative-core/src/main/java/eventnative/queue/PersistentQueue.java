package eventnative.queue;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;
import java.util.zip.CRC32;

/**
 * Durable FIFO queue of {@link QueueEntry}s for one stream-mode destination.
 *
 * <p>Entries live in {@code <dir>/queue.dst=<destination>/} as append-only segment files
 * ({@code segment-<n>.log}) of length-prefixed, CRC-checked records. Every enqueue is forced
 * to disk before it returns. A {@code cursor} file holds the position up to which every entry
 * has been resolved; it is replaced atomically. Entries past the cursor are redelivered after
 * a restart, so delivery is at-least-once.
 *
 * <p>Dequeued entries stay in flight until resolved through their {@link QueueDelivery}. The
 * cursor advances over the longest resolved prefix of in-flight entries. Segments behind the
 * cursor are deleted. Failed entries are re-appended at the tail with an incremented retry
 * count until {@code maxRetries}, then moved to {@code dead.log}.
 *
 * <p>The queue is bounded by {@code maxBytes} of unresolved record bytes; an enqueue beyond it
 * throws {@link QueueFullException}. Re-appends of failed entries are exempt so a retry never
 * loses an entry. A torn tail record left by a crash is truncated on open.
 *
 * <p>A file lock on the directory guarantees a single owner. Any thread may enqueue; a single
 * consumer is expected to dequeue. All state is guarded by one lock.
 *
 * @see Builder
 */
public final class PersistentQueue implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(PersistentQueue.class.getName());

  public static final String DIRECTORY_PREFIX = "queue.dst=";
  static final String SEGMENT_PREFIX = "segment-";
  static final String SEGMENT_SUFFIX = ".log";
  static final String CURSOR_FILE = "cursor";
  static final String DEAD_LETTER_FILE = "dead.log";
  static final String LOCK_FILE = ".lock";
  private static final int CURSOR_BYTES = 20;

  private final String destination;
  private final Path directory;
  private final long maxBytes;
  private final long segmentBytes;
  private final int maxRetries;
  private final QueueEntryCodec codec;

  private final FileChannel lockChannel;
  private final FileLock fileLock;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();

  private final TreeMap<Long, Long> segmentSizes = new TreeMap<>();
  private final ArrayDeque<InFlight> inFlight = new ArrayDeque<>();
  private FileChannel writeChannel;
  private long writeSegment;
  private FileChannel readChannel;
  private long readChannelSegment = -1;
  private FileChannel deadChannel;
  private long deadBytes;
  private long deadCount;
  private Position cursor;
  private Position readPosition;
  private long pendingEntries;
  private boolean closed;

  private PersistentQueue(Builder builder, Path directory, FileChannel lockChannel, FileLock fileLock) {
    this.destination = builder.destination;
    this.directory = directory;
    this.maxBytes = builder.maxBytes;
    this.segmentBytes = builder.segmentBytes;
    this.maxRetries = builder.maxRetries;
    this.codec = builder.codec != null ? builder.codec : QueueEntryCodec.json();
    this.lockChannel = lockChannel;
    this.fileLock = fileLock;
  }

  /**
   * @param directory   parent directory holding every destination's queue directory
   * @param destination destination that owns the queue
   */
  public static Builder builder(Path directory, String destination) {
    return new Builder(directory, destination);
  }

  /** Name of the directory holding a destination's queue files. */
  public static String directoryName(String destination) {
    return DIRECTORY_PREFIX + destination;
  }

  public String destination() {
    return destination;
  }

  public Path directory() {
    return directory;
  }

  public int maxRetries() {
    return maxRetries;
  }

  /**
   * Appends an entry and forces it to disk.
   *
   * @throws IllegalArgumentException if the entry belongs to another destination
   * @throws QueueFullException       if the entry would exceed {@code maxBytes}; nothing is stored
   * @throws IllegalStateException    if the queue is closed
   * @throws QueueStorageException    on I/O failure
   */
  public void enqueue(QueueEntry entry) {
    Objects.requireNonNull(entry, "entry");
    if (!destination.equals(entry.destination())) {
      throw new IllegalArgumentException("Entry for destination [" + entry.destination()
          + "] cannot be enqueued to [" + destination + "]");
    }
    byte[] payload = codec.encode(entry);
    lock.lock();
    try {
      ensureOpen();
      long recordBytes = RecordFormat.size(payload.length);
      long pending = pendingBytes();
      if (pending + recordBytes > maxBytes) {
        throw new QueueFullException(destination, pending, recordBytes, maxBytes);
      }
      append(payload);
      pendingEntries++;
      notEmpty.signal();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Takes the oldest undelivered entry, waiting up to {@code timeout} for one to arrive.
   *
   * @return the delivery, or {@code null} on timeout or once the queue is closed
   * @throws QueueStorageException on I/O failure or a corrupt record
   */
  public QueueDelivery dequeue(long timeout, TimeUnit unit) throws InterruptedException {
    long nanos = unit.toNanos(timeout);
    lock.lockInterruptibly();
    try {
      while (true) {
        if (closed) {
          return null;
        }
        if (advanceToReadable()) {
          Position start = readPosition;
          RecordFormat.Record record = readAt(start);
          readPosition = new Position(start.segment(), record.next());
          InFlight slot = new InFlight(readPosition);
          inFlight.addLast(slot);
          QueueEntry entry;
          try {
            entry = codec.decode(record.payload());
          } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "[" + destination + "] Undecodable queue record at " + start
                + " skipped", e);
            resolve(slot);
            continue;
          }
          return new QueueDelivery(this, entry, slot);
        }
        if (nanos <= 0) {
          return null;
        }
        nanos = notEmpty.awaitNanos(nanos);
      }
    } finally {
      lock.unlock();
    }
  }

  /** Number of entries enqueued and not yet resolved, in flight included. */
  public long size() {
    lock.lock();
    try {
      return pendingEntries;
    } finally {
      lock.unlock();
    }
  }

  /** Record bytes between the cursor and the tail. */
  public long bytes() {
    lock.lock();
    try {
      return pendingBytes();
    } finally {
      lock.unlock();
    }
  }

  public long deadLetterCount() {
    lock.lock();
    try {
      return deadCount;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Reads dead letters, oldest first.
   *
   * @param limit maximum number returned
   */
  public List<DeadLetter> deadLetters(int limit) {
    if (limit < 0) {
      throw new IllegalArgumentException("limit must be >= 0");
    }
    lock.lock();
    try {
      ensureOpen();
      List<DeadLetter> all = readDeadLetters();
      return List.copyOf(all.subList(0, Math.min(limit, all.size())));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Re-enqueues dead letters with a zero retry count, oldest first, and removes them from the
   * dead-letter log. Stops early when the queue is full; the rest stay dead-lettered.
   *
   * @return number of entries re-enqueued
   */
  public int replayDeadLetters() {
    lock.lock();
    try {
      ensureOpen();
      List<DeadLetter> all = readDeadLetters();
      int replayed = 0;
      for (DeadLetter deadLetter : all) {
        byte[] payload = codec.encode(deadLetter.entry().withRetryCount(0));
        if (pendingBytes() + RecordFormat.size(payload.length) > maxBytes) {
          logger.log(Level.WARNING, "[{0}] Queue full; replayed {1} of {2} dead letters",
              new Object[]{destination, replayed, all.size()});
          break;
        }
        append(payload);
        pendingEntries++;
        replayed++;
      }
      if (replayed > 0) {
        rewriteDeadLetters(all.subList(replayed, all.size()));
        notEmpty.signalAll();
      }
      return replayed;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Releases files and the directory lock. Unresolved entries stay on disk and are redelivered
   * by the next instance. Idempotent.
   */
  @Override
  public void close() {
    lock.lock();
    try {
      if (closed) {
        return;
      }
      closed = true;
      notEmpty.signalAll();
      IOException failure = null;
      try {
        if (fileLock.isValid()) {
          fileLock.release();
        }
      } catch (IOException e) {
        failure = e;
      }
      for (FileChannel channel : new FileChannel[]{readChannel, writeChannel, deadChannel, lockChannel}) {
        failure = closeChannel(channel, failure);
      }
      if (failure != null) {
        throw new QueueStorageException("Failed to close queue " + directory, failure);
      }
    } finally {
      lock.unlock();
    }
  }

  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  // ── Resolution (called through QueueDelivery) ──

  void acknowledge(InFlight slot) {
    lock.lock();
    try {
      if (checkResolvable(slot, "ack")) {
        resolve(slot);
      }
    } finally {
      lock.unlock();
    }
  }

  boolean retry(InFlight slot, QueueEntry entry, String error) {
    lock.lock();
    try {
      if (!checkResolvable(slot, "nack")) {
        return true;
      }
      if (entry.retryCount() >= maxRetries) {
        appendDeadLetter(new DeadLetter(entry, error, Instant.now()));
        resolve(slot);
        return false;
      }
      append(codec.encode(entry.withRetry()));
      pendingEntries++;
      resolve(slot);
      notEmpty.signal();
      return true;
    } finally {
      lock.unlock();
    }
  }

  void deadLetter(InFlight slot, QueueEntry entry, String error) {
    lock.lock();
    try {
      if (checkResolvable(slot, "dead-letter")) {
        appendDeadLetter(new DeadLetter(entry, error, Instant.now()));
        resolve(slot);
      }
    } finally {
      lock.unlock();
    }
  }

  private boolean checkResolvable(InFlight slot, String action) {
    if (slot.resolved) {
      throw new IllegalStateException("Queue delivery already resolved");
    }
    if (closed) {
      logger.log(Level.WARNING, "[{0}] {1} after close ignored; entry will be redelivered",
          new Object[]{destination, action});
      return false;
    }
    return true;
  }

  private void resolve(InFlight slot) {
    slot.resolved = true;
    pendingEntries--;
    Position advanced = null;
    while (!inFlight.isEmpty() && inFlight.peekFirst().resolved) {
      advanced = inFlight.pollFirst().end;
    }
    if (advanced != null) {
      cursor = advanced;
      writeCursor(cursor);
      compact();
    }
  }

  // ── Segments ──

  private long pendingBytes() {
    long total = 0;
    for (long size : segmentSizes.values()) {
      total += size;
    }
    return total - cursor.offset();
  }

  private void append(byte[] payload) {
    long recordBytes = RecordFormat.size(payload.length);
    long size = segmentSizes.get(writeSegment);
    if (size > 0 && size + recordBytes > segmentBytes) {
      rotate();
      size = 0;
    }
    try {
      RecordFormat.write(writeChannel, size, payload);
      writeChannel.force(false);
    } catch (IOException e) {
      try {
        writeChannel.truncate(size);
      } catch (IOException suppressed) {
        e.addSuppressed(suppressed);
      }
      throw new QueueStorageException("Failed to append to " + segmentPath(writeSegment), e);
    }
    segmentSizes.put(writeSegment, size + recordBytes);
  }

  private void rotate() {
    long next = writeSegment + 1;
    try {
      writeChannel.force(true);
      writeChannel.close();
      writeChannel = FileChannel.open(segmentPath(next),
          StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.READ);
      writeChannel.truncate(0);
    } catch (IOException e) {
      throw new QueueStorageException("Failed to rotate to " + segmentPath(next), e);
    }
    segmentSizes.put(next, 0L);
    writeSegment = next;
  }

  private boolean advanceToReadable() {
    while (true) {
      Long size = segmentSizes.get(readPosition.segment());
      if (size != null && readPosition.offset() < size) {
        return true;
      }
      Long next = segmentSizes.higherKey(readPosition.segment());
      if (next == null) {
        return false;
      }
      readPosition = new Position(next, 0);
    }
  }

  private RecordFormat.Record readAt(Position position) {
    try {
      if (readChannelSegment != position.segment()) {
        if (readChannel != null) {
          readChannel.close();
        }
        readChannel = FileChannel.open(segmentPath(position.segment()), StandardOpenOption.READ);
        readChannelSegment = position.segment();
      }
      RecordFormat.Record record = RecordFormat.read(readChannel, position.offset(),
          segmentSizes.get(position.segment()));
      if (record == null) {
        throw new QueueStorageException("Corrupt record at " + position + " in " + directory);
      }
      return record;
    } catch (IOException e) {
      throw new QueueStorageException("Failed to read " + segmentPath(position.segment()), e);
    }
  }

  private void compact() {
    // Out-of-order acks can move the cursor past whole segments at once.
    for (Long behind : new ArrayList<>(segmentSizes.headMap(cursor.segment()).keySet())) {
      deleteSegment(behind);
    }
    while (cursor.segment() != writeSegment && cursor.offset() >= segmentSizes.get(cursor.segment())) {
      Long next = segmentSizes.higherKey(cursor.segment());
      if (next == null) {
        break;
      }
      deleteSegment(cursor.segment());
      cursor = new Position(next, 0);
    }
    if (readPosition.segment() < cursor.segment()) {
      readPosition = cursor;
    }
  }

  private void deleteSegment(long segment) {
    segmentSizes.remove(segment);
    try {
      if (readChannelSegment == segment && readChannel != null) {
        readChannel.close();
        readChannel = null;
        readChannelSegment = -1;
      }
      Files.deleteIfExists(segmentPath(segment));
    } catch (IOException e) {
      logger.log(Level.WARNING, "[" + destination + "] Failed to delete acknowledged segment "
          + segmentPath(segment), e);
    }
  }

  private Path segmentPath(long segment) {
    return directory.resolve(SEGMENT_PREFIX + segment + SEGMENT_SUFFIX);
  }

  // ── Cursor ──

  private void writeCursor(Position position) {
    ByteBuffer buffer = ByteBuffer.allocate(CURSOR_BYTES);
    buffer.putLong(position.segment()).putLong(position.offset());
    CRC32 crc = new CRC32();
    crc.update(buffer.array(), 0, 16);
    buffer.putInt((int) crc.getValue()).flip();
    Path tmp = directory.resolve(CURSOR_FILE + ".tmp");
    try {
      try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.CREATE,
          StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
        while (buffer.hasRemaining()) {
          channel.write(buffer);
        }
        channel.force(true);
      }
      Files.move(tmp, directory.resolve(CURSOR_FILE),
          StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      throw new QueueStorageException("Failed to persist cursor in " + directory, e);
    }
  }

  private Position readCursor() throws IOException {
    Path path = directory.resolve(CURSOR_FILE);
    if (!Files.exists(path)) {
      return null;
    }
    byte[] bytes = Files.readAllBytes(path);
    if (bytes.length == CURSOR_BYTES) {
      ByteBuffer buffer = ByteBuffer.wrap(bytes);
      long segment = buffer.getLong();
      long offset = buffer.getLong();
      int checksum = buffer.getInt();
      CRC32 crc = new CRC32();
      crc.update(bytes, 0, 16);
      if ((int) crc.getValue() == checksum && segment > 0 && offset >= 0) {
        return new Position(segment, offset);
      }
    }
    logger.log(Level.WARNING, "[{0}] Corrupt cursor file; redelivering from the oldest segment",
        destination);
    return null;
  }

  // ── Dead letters ──

  private void appendDeadLetter(DeadLetter deadLetter) {
    byte[] payload = codec.encodeDeadLetter(deadLetter);
    try {
      RecordFormat.write(deadChannel, deadBytes, payload);
      deadChannel.force(false);
    } catch (IOException e) {
      throw new QueueStorageException("Failed to append to " + directory.resolve(DEAD_LETTER_FILE), e);
    }
    deadBytes += RecordFormat.size(payload.length);
    deadCount++;
    logger.log(Level.SEVERE, "[{0}] Event {1} moved to dead letters after {2} retries: {3}",
        new Object[]{destination, deadLetter.entry().row().eventId(),
            deadLetter.entry().retryCount(), deadLetter.error()});
  }

  private List<DeadLetter> readDeadLetters() {
    List<DeadLetter> result = new ArrayList<>();
    try {
      long position = 0;
      while (position < deadBytes) {
        RecordFormat.Record record = RecordFormat.read(deadChannel, position, deadBytes);
        if (record == null) {
          break;
        }
        try {
          result.add(codec.decodeDeadLetter(record.payload()));
        } catch (RuntimeException e) {
          logger.log(Level.WARNING, "[" + destination + "] Undecodable dead letter at offset "
              + position, e);
        }
        position = record.next();
      }
    } catch (IOException e) {
      throw new QueueStorageException("Failed to read " + directory.resolve(DEAD_LETTER_FILE), e);
    }
    return result;
  }

  private void rewriteDeadLetters(List<DeadLetter> remaining) {
    Path target = directory.resolve(DEAD_LETTER_FILE);
    Path tmp = directory.resolve(DEAD_LETTER_FILE + ".tmp");
    long size = 0;
    try {
      try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.CREATE,
          StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
        for (DeadLetter deadLetter : remaining) {
          size = RecordFormat.write(channel, size, codec.encodeDeadLetter(deadLetter));
        }
        channel.force(true);
      }
      deadChannel.close();
      Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      deadChannel = FileChannel.open(target, StandardOpenOption.CREATE,
          StandardOpenOption.WRITE, StandardOpenOption.READ);
    } catch (IOException e) {
      throw new QueueStorageException("Failed to rewrite " + target, e);
    }
    deadBytes = size;
    deadCount = remaining.size();
  }

  // ── Recovery ──

  private void recover() throws IOException {
    List<Long> segments = listSegments();
    if (segments.isEmpty()) {
      Files.createFile(segmentPath(1));
      segments = List.of(1L);
    }
    long first = segments.get(0);
    long last = segments.get(segments.size() - 1);

    Position stored = readCursor();
    Position start;
    if (stored == null || stored.segment() < first) {
      start = new Position(first, 0);
    } else if (!segments.contains(stored.segment())) {
      Long ceiling = null;
      for (long segment : segments) {
        if (segment > stored.segment()) {
          ceiling = segment;
          break;
        }
      }
      start = ceiling != null ? new Position(ceiling, 0) : new Position(last, Long.MAX_VALUE);
    } else {
      start = stored;
    }

    long pending = 0;
    for (long segment : segments) {
      if (segment < start.segment()) {
        Files.deleteIfExists(segmentPath(segment));
        continue;
      }
      long countFrom = segment == start.segment() ? start.offset() : 0;
      long[] scan = scanSegment(segment, countFrom, segment == last);
      segmentSizes.put(segment, scan[0]);
      pending += scan[1];
    }
    if (start.offset() > segmentSizes.get(start.segment())) {
      start = new Position(start.segment(), segmentSizes.get(start.segment()));
    }

    writeSegment = last;
    writeChannel = FileChannel.open(segmentPath(last), StandardOpenOption.WRITE, StandardOpenOption.READ);
    cursor = start;
    readPosition = start;
    pendingEntries = pending;

    Path deadPath = directory.resolve(DEAD_LETTER_FILE);
    deadChannel = FileChannel.open(deadPath, StandardOpenOption.CREATE,
        StandardOpenOption.WRITE, StandardOpenOption.READ);
    long[] dead = scanFile(deadChannel, 0, deadPath);
    deadBytes = dead[0];
    deadCount = dead[1];

    compact();
    logger.log(Level.INFO, "[{0}] Opened queue {1}: {2} pending entries, {3} dead letters",
        new Object[]{destination, directory, pendingEntries, deadCount});
  }

  /** Returns {@code [validBytes, recordsAtOrAfter(countFrom)]}, truncating an invalid tail. */
  private long[] scanSegment(long segment, long countFrom, boolean tail) throws IOException {
    Path path = segmentPath(segment);
    try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
      long sizeOnDisk = channel.size();
      long[] result = scanFile(channel, countFrom, path);
      if (!tail && result[0] < sizeOnDisk) {
        logger.log(Level.SEVERE, "[{0}] Corrupt record inside non-tail segment {1}; later records lost",
            new Object[]{destination, path});
      }
      return result;
    }
  }

  private long[] scanFile(FileChannel channel, long countFrom, Path path) throws IOException {
    long size = channel.size();
    long position = 0;
    long count = 0;
    while (position < size) {
      RecordFormat.Record record = RecordFormat.read(channel, position, size);
      if (record == null) {
        break;
      }
      if (position >= countFrom) {
        count++;
      }
      position = record.next();
    }
    if (position < size) {
      logger.log(Level.WARNING, "[{0}] Truncating {1} torn bytes at the end of {2}",
          new Object[]{destination, size - position, path});
      channel.truncate(position);
      channel.force(true);
    }
    return new long[]{position, count};
  }

  private List<Long> listSegments() throws IOException {
    List<Long> ids = new ArrayList<>();
    try (Stream<Path> files = Files.list(directory)) {
      files.forEach(file -> {
        String name = file.getFileName().toString();
        if (name.startsWith(SEGMENT_PREFIX) && name.endsWith(SEGMENT_SUFFIX)) {
          String id = name.substring(SEGMENT_PREFIX.length(), name.length() - SEGMENT_SUFFIX.length());
          try {
            ids.add(Long.parseLong(id));
          } catch (NumberFormatException e) {
            logger.log(Level.WARNING, "[{0}] Ignoring unexpected file {1}", new Object[]{destination, file});
          }
        }
      });
    }
    ids.sort(null);
    return ids;
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("Queue for destination [" + destination + "] is closed");
    }
  }

  private static IOException closeChannel(FileChannel channel, IOException failure) {
    if (channel == null) {
      return failure;
    }
    try {
      channel.close();
    } catch (IOException e) {
      if (failure == null) {
        return e;
      }
      failure.addSuppressed(e);
    }
    return failure;
  }

  record Position(long segment, long offset) {
    @Override
    public String toString() {
      return "segment " + segment + " offset " + offset;
    }
  }

  static final class InFlight {
    private final Position end;
    private boolean resolved;

    private InFlight(Position end) {
      this.end = end;
    }
  }

  /** Builder for {@link PersistentQueue}. */
  public static final class Builder {
    private final Path directory;
    private final String destination;
    private long maxBytes = 1L << 30;
    private long segmentBytes = 16L << 20;
    private int maxRetries = 9;
    private QueueEntryCodec codec;

    private Builder(Path directory, String destination) {
      this.directory = directory;
      this.destination = destination;
    }

    /**
     * Upper bound on unresolved record bytes.
     *
     * <p>Optional. Defaults to 1 GiB. Must be &gt; 0.
     *
     * @return this builder
     */
    public Builder maxBytes(long maxBytes) {
      this.maxBytes = maxBytes;
      return this;
    }

    /**
     * Size after which a new segment file is started.
     *
     * <p>Optional. Defaults to 16 MiB. Must be &gt; 0.
     *
     * @return this builder
     */
    public Builder segmentBytes(long segmentBytes) {
      this.segmentBytes = segmentBytes;
      return this;
    }

    /**
     * Number of redeliveries after the first failed attempt before an entry is dead-lettered.
     *
     * <p>Optional. Defaults to {@code 9}. Must be &ge; 0.
     *
     * @return this builder
     */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link QueueEntryCodec#json()}.
     *
     * @return this builder
     */
    public Builder codec(QueueEntryCodec codec) {
      this.codec = codec;
      return this;
    }

    /**
     * Locks the queue directory and recovers its state.
     *
     * @throws QueueStorageException if the directory is owned by another instance or cannot be
     *                               read
     */
    public PersistentQueue open() {
      Objects.requireNonNull(directory, "directory");
      Objects.requireNonNull(destination, "destination");
      if (destination.isEmpty()) {
        throw new IllegalArgumentException("destination must not be empty");
      }
      if (maxBytes <= 0) {
        throw new IllegalArgumentException("maxBytes must be > 0");
      }
      if (segmentBytes <= 0) {
        throw new IllegalArgumentException("segmentBytes must be > 0");
      }
      if (maxRetries < 0) {
        throw new IllegalArgumentException("maxRetries must be >= 0");
      }
      Path queueDirectory = directory.resolve(directoryName(destination));
      FileChannel lockChannel = null;
      PersistentQueue queue = null;
      try {
        Files.createDirectories(queueDirectory);
        lockChannel = FileChannel.open(queueDirectory.resolve(LOCK_FILE),
            StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        FileLock fileLock;
        try {
          fileLock = lockChannel.tryLock();
        } catch (OverlappingFileLockException e) {
          fileLock = null;
        }
        if (fileLock == null) {
          throw new QueueStorageException("Queue directory " + queueDirectory
              + " is already owned by another queue instance");
        }
        queue = new PersistentQueue(this, queueDirectory, lockChannel, fileLock);
        queue.recover();
        return queue;
      } catch (IOException | RuntimeException e) {
        if (queue != null) {
          try {
            queue.close();
          } catch (RuntimeException suppressed) {
            e.addSuppressed(suppressed);
          }
        } else if (lockChannel != null) {
          try {
            lockChannel.close();
          } catch (IOException suppressed) {
            e.addSuppressed(suppressed);
          }
        }
        if (e instanceof RuntimeException runtime) {
          throw runtime;
        }
        throw new QueueStorageException("Failed to open queue " + queueDirectory, e);
      }
    }
  }
}
