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

import java.io.EOFException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.parquet.io.InputFile;
import org.apache.parquet.io.SeekableInputStream;

/** Parquet {@link InputFile} over a block data file on the local filesystem. */
public final class LocalBlockInputFile implements InputFile {
  private final Path path;

  public LocalBlockInputFile(Path path) {
    this.path = path;
  }

  public Path path() {
    return path;
  }

  @Override
  public long getLength() {
    try {
      return Files.size(path);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read size of " + path, e);
    }
  }

  @Override
  public SeekableInputStream newStream() throws IOException {
    SeekableByteChannel channel = Files.newByteChannel(path);
    return new ChannelSeekableInputStream(channel);
  }

  @Override
  public String toString() {
    return path.toString();
  }

  private static final class ChannelSeekableInputStream extends SeekableInputStream {
    private final SeekableByteChannel channel;

    private ChannelSeekableInputStream(SeekableByteChannel channel) {
      this.channel = channel;
    }

    @Override
    public long getPos() throws IOException {
      return channel.position();
    }

    @Override
    public void seek(long newPos) throws IOException {
      if (newPos < 0) {
        throw new IOException("negative seek");
      }
      channel.position(newPos);
    }

    @Override
    public int read() throws IOException {
      byte[] buf = new byte[1];
      int read = read(buf, 0, 1);
      return read == -1 ? -1 : buf[0] & 0xFF;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
      int read = channel.read(ByteBuffer.wrap(b, off, len));
      return read < 0 ? -1 : read;
    }

    @Override
    public int read(ByteBuffer dst) throws IOException {
      if (!dst.hasRemaining()) {
        return 0;
      }
      return channel.read(dst);
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
      while (dst.hasRemaining()) {
        if (channel.read(dst) < 0) {
          throw new EOFException("EOF while reading fully");
        }
      }
    }

    @Override
    public void close() throws IOException {
      channel.close();
    }
  }
}
