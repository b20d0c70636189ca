package io.arrowsource.formats;

import io.arrowsource.formats.config.Framing;
import java.nio.ByteBuffer;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Splits one payload into logical records according to a {@link Framing}.
 *
 * <p>Records are returned as {@link ByteBuffer} views over the payload backed by the same array;
 * no bytes are copied and consumers must not write through them. Without framing the whole payload
 * is a single record. With newline framing each {@code '\n'}-terminated segment is a record,
 * truncated to the maximum line length if one is set, and a final delimiter does not produce an
 * empty trailing record.
 */
public final class FramingIterator implements Iterator<ByteBuffer> {
  private final Framing framing;
  private final byte[] buf;
  private int offset;

  /**
   * @param framing the framing policy, or null to treat the payload as one record
   * @param buf the payload
   */
  public FramingIterator(Framing framing, byte[] buf) {
    this.framing = framing;
    this.buf = buf;
    this.offset = 0;
  }

  @Override
  public boolean hasNext() {
    return offset < buf.length;
  }

  @Override
  public ByteBuffer next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    if (framing == null) {
      offset = buf.length;
      return ByteBuffer.wrap(buf);
    }
    Framing.Newline newline = (Framing.Newline) framing;
    int end = indexOf(buf, (byte) '\n', offset);
    if (end < 0) {
      end = buf.length;
    }
    int start = offset;
    offset = end + 1;

    int length = end - start;
    if (newline.maxLineLength() != null && newline.maxLineLength() < length) {
      length = newline.maxLineLength().intValue();
    }
    return ByteBuffer.wrap(buf, start, length).slice();
  }

  private static int indexOf(byte[] buf, byte b, int from) {
    for (int i = from; i < buf.length; i++) {
      if (buf[i] == b) {
        return i;
      }
    }
    return -1;
  }
}
