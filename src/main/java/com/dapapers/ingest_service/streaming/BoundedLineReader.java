package com.dapapers.ingest_service.streaming;

import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;

/**
 * Reads {@code \n}-terminated lines as raw bytes without ever holding more than {@code
 * maxLineBytes} of one line in memory. Longer lines are skipped up to their terminator and
 * reported as oversized.
 */
class BoundedLineReader implements Closeable {

  private static final int INITIAL_CAPACITY = 8 * 1024;

  private final InputStream in;
  private final int maxLineBytes;
  private byte[] buffer;

  BoundedLineReader(InputStream in, int maxLineBytes) {
    if (maxLineBytes <= 0) {
      throw new IllegalArgumentException("maxLineBytes must be positive: " + maxLineBytes);
    }
    this.in = in instanceof BufferedInputStream ? in : new BufferedInputStream(in, 64 * 1024);
    this.maxLineBytes = maxLineBytes;
    this.buffer = new byte[Math.min(INITIAL_CAPACITY, maxLineBytes)];
  }

  /**
   * Reads the next line.
   *
   * @return the line, or null at end of stream
   */
  Line next() throws IOException {
    int length = 0;
    boolean oversized = false;
    int b = in.read();
    if (b == -1) {
      return null;
    }
    while (b != -1 && b != '\n') {
      if (!oversized) {
        if (length == maxLineBytes) {
          oversized = true;
        } else {
          ensureCapacity(length + 1);
          buffer[length++] = (byte) b;
        }
      }
      b = in.read();
    }
    if (oversized) {
      return Line.OVERSIZED;
    }
    if (length > 0 && buffer[length - 1] == '\r') {
      length--;
    }
    return new Line(buffer, length, false);
  }

  private void ensureCapacity(int required) {
    if (required > buffer.length) {
      int grown = (int) Math.min((long) maxLineBytes, Math.max(required, (long) buffer.length * 2));
      buffer = Arrays.copyOf(buffer, grown);
    }
  }

  @Override
  public void close() throws IOException {
    in.close();
  }

  /**
   * One line. {@code bytes} is shared with the reader and overwritten by the next call.
   */
  record Line(byte[] bytes, int length, boolean oversized) {

    static final Line OVERSIZED = new Line(new byte[0], 0, true);

    boolean isBlank() {
      for (int i = 0; i < length; i++) {
        if (!Character.isWhitespace(bytes[i])) {
          return false;
        }
      }
      return true;
    }
  }
}
