/*
 * Copyright 2026 Yellowbrick Data, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.floedb.tracestats.parquet.io;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.parquet.io.InputFile;
import org.apache.parquet.io.SeekableInputStream;
import org.jboss.logging.Logger;

/**
 * {@link InputFile} that serves reads from a bounded set of fixed-size windows over another
 * input file.
 *
 * <p>Windows are aligned to multiples of the window size and shared by every stream opened from
 * this file; the least recently used window is evicted once {@code windowCount} are held. Reads
 * larger than one window go straight to the underlying file. Memory use is therefore bounded by
 * {@code windowSize * windowCount} whatever the size of the block.
 */
public final class BufferedBlockInputFile implements InputFile, Closeable {
  private static final Logger LOG = Logger.getLogger(BufferedBlockInputFile.class);

  private final InputFile delegate;
  private final long length;
  private final int windowSize;
  private final Map<Long, byte[]> windows;

  private SeekableInputStream source;
  private long hits;
  private long misses;

  public BufferedBlockInputFile(InputFile delegate, int windowSize, int windowCount)
      throws IOException {
    if (windowSize <= 0 || windowCount <= 0) {
      throw new IllegalArgumentException(
          "window size and count must be positive: " + windowSize + ", " + windowCount);
    }
    this.delegate = delegate;
    this.length = delegate.getLength();
    this.windowSize = windowSize;
    this.windows =
        new LinkedHashMap<>(windowCount * 2, 0.75f, true) {
          @Override
          protected boolean removeEldestEntry(Map.Entry<Long, byte[]> eldest) {
            return size() > windowCount;
          }
        };
  }

  @Override
  public long getLength() {
    return length;
  }

  @Override
  public SeekableInputStream newStream() {
    return new WindowedStream();
  }

  public synchronized long hits() {
    return hits;
  }

  public synchronized long misses() {
    return misses;
  }

  public synchronized int bufferedWindows() {
    return windows.size();
  }

  /** Copies up to {@code len} bytes at {@code pos}; returns -1 at end of file. */
  synchronized int readAt(long pos, byte[] dst, int off, int len) throws IOException {
    if (pos >= length) {
      return -1;
    }
    len = (int) Math.min(len, length - pos);
    if (len == 0) {
      return 0;
    }

    if (len > windowSize) {
      SeekableInputStream in = source();
      in.seek(pos);
      in.readFully(dst, off, len);
      return len;
    }

    int done = 0;
    while (done < len) {
      long p = pos + done;
      long start = p - (p % windowSize);
      byte[] window = window(start);
      int inWindow = (int) (p - start);
      int n = Math.min(len - done, window.length - inWindow);
      System.arraycopy(window, inWindow, dst, off + done, n);
      done += n;
    }
    return done;
  }

  private byte[] window(long start) throws IOException {
    byte[] w = windows.get(start);
    if (w != null) {
      hits++;
      return w;
    }
    misses++;
    w = new byte[(int) Math.min(windowSize, length - start)];
    SeekableInputStream in = source();
    in.seek(start);
    in.readFully(w);
    windows.put(start, w);
    return w;
  }

  private SeekableInputStream source() throws IOException {
    if (source == null) {
      source = delegate.newStream();
    }
    return source;
  }

  @Override
  public synchronized void close() throws IOException {
    LOG.debugf(
        "Closing buffered file %s: %d window hits, %d misses", delegate, hits, misses);
    windows.clear();
    if (source != null) {
      source.close();
      source = null;
    }
  }

  @Override
  public String toString() {
    return "buffered(" + delegate + ")";
  }

  private final class WindowedStream extends SeekableInputStream {
    private long pos;

    @Override
    public long getPos() {
      return pos;
    }

    @Override
    public void seek(long newPos) throws IOException {
      if (newPos < 0) {
        throw new IOException("negative seek");
      }
      pos = newPos;
    }

    @Override
    public int read() throws IOException {
      byte[] one = new byte[1];
      int n = read(one, 0, 1);
      return n <= 0 ? -1 : one[0] & 0xFF;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
      if (len == 0) {
        return 0;
      }
      int n = readAt(pos, b, off, len);
      if (n > 0) {
        pos += n;
      }
      return n;
    }

    @Override
    public int read(ByteBuffer dst) throws IOException {
      if (!dst.hasRemaining()) {
        return 0;
      }
      byte[] tmp = new byte[dst.remaining()];
      int n = read(tmp, 0, tmp.length);
      if (n > 0) {
        dst.put(tmp, 0, n);
      }
      return n;
    }

    @Override
    public void readFully(byte[] bytes) throws IOException {
      readFully(bytes, 0, bytes.length);
    }

    @Override
    public void readFully(byte[] bytes, int off, int len) throws IOException {
      int done = 0;
      while (done < len) {
        int n = read(bytes, off + done, len - done);
        if (n < 0) {
          throw new EOFException("EOF while reading fully");
        }
        done += n;
      }
    }

    @Override
    public void readFully(ByteBuffer dst) throws IOException {
      byte[] tmp = new byte[dst.remaining()];
      readFully(tmp, 0, tmp.length);
      dst.put(tmp);
    }

    @Override
    public void close() {}
  }
}
