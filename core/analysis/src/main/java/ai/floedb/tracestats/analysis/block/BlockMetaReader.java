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

package ai.floedb.tracestats.analysis.block;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/** Reads {@code meta.json} next to a block's data file. */
public final class BlockMetaReader {

  public static final String META_FILE_NAME = "meta.json";

  private final ObjectMapper mapper;

  public BlockMetaReader() {
    this.mapper = new ObjectMapper().registerModule(new JavaTimeModule());
  }

  /**
   * Reads the metadata of the block stored in {@code blockDir}.
   *
   * @throws NoSuchFileException if the block has no metadata, e.g. because it was compacted away
   */
  public BlockMeta read(Path blockDir) throws IOException {
    Path file = blockDir.resolve(META_FILE_NAME);
    try (InputStream in = Files.newInputStream(file)) {
      return read(in);
    }
  }

  public BlockMeta read(InputStream in) throws IOException {
    return mapper.readValue(in, BlockMeta.class);
  }
}
