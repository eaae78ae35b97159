package eventnative.queue;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.util.zip.CRC32;

/**
 * On-disk record layout shared by segment files and the dead-letter log:
 * {@code [int payloadLength][int crc32(payload)][payload]}, big-endian.
 */
final class RecordFormat {
  static final int HEADER_BYTES = 8;

  private RecordFormat() {
  }

  static long size(int payloadLength) {
    return HEADER_BYTES + (long) payloadLength;
  }

  /** Writes one record at {@code position} and returns the position after it. */
  static long write(FileChannel channel, long position, byte[] payload) throws IOException {
    CRC32 crc = new CRC32();
    crc.update(payload);
    ByteBuffer buffer = ByteBuffer.allocate(HEADER_BYTES + payload.length);
    buffer.putInt(payload.length).putInt((int) crc.getValue()).put(payload).flip();
    long next = position;
    while (buffer.hasRemaining()) {
      next += channel.write(buffer, next);
    }
    return next;
  }

  /**
   * Reads the record at {@code position}.
   *
   * @param limit end of the readable region
   * @return the record, or {@code null} if no complete record with a valid checksum starts there
   */
  static Record read(FileChannel channel, long position, long limit) throws IOException {
    if (position + HEADER_BYTES > limit) {
      return null;
    }
    ByteBuffer header = ByteBuffer.allocate(HEADER_BYTES);
    if (!readFully(channel, header, position)) {
      return null;
    }
    header.flip();
    int length = header.getInt();
    int checksum = header.getInt();
    if (length < 0 || position + HEADER_BYTES + length > limit) {
      return null;
    }
    ByteBuffer body = ByteBuffer.allocate(length);
    if (!readFully(channel, body, position + HEADER_BYTES)) {
      return null;
    }
    byte[] payload = body.array();
    CRC32 crc = new CRC32();
    crc.update(payload);
    if ((int) crc.getValue() != checksum) {
      return null;
    }
    return new Record(payload, position + HEADER_BYTES + length);
  }

  private static boolean readFully(FileChannel channel, ByteBuffer buffer, long position) throws IOException {
    long at = position;
    while (buffer.hasRemaining()) {
      int read = channel.read(buffer, at);
      if (read < 0) {
        return false;
      }
      at += read;
    }
    return true;
  }

  record Record(byte[] payload, long next) {
  }
}
