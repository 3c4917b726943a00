/*
 * Copyright 2010 Google Inc.
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

package constraintsystem;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.logging.Logger;

/**
 * Saves precomputed case distinctions to a file and loads them back, so that
 * they need not be recomputed for every proof of the same theory. Relative
 * paths are resolved against a base directory.
 */
public class CaseDistinctionStore {
  private static final Logger LOGGER =
      Logger.getLogger(CaseDistinctionStore.class.getName());

  private final File baseDir;

  /** Creates a store with the current directory as the base directory. */
  public CaseDistinctionStore() {
    this(new File("."));
  }

  public CaseDistinctionStore(File baseDir) {
    this.baseDir = baseDir.getAbsoluteFile();
  }

  /**
   * @return {@code filename}, if it is absolute; otherwise, {@code filename}
   *         resolved against the base directory
   */
  public File getFile(String filename) {
    File file = new File(filename);
    if (file.isAbsolute()) {
      return file;
    }
    return new File(baseDir, filename);
  }

  public void save(String filename, List<CaseDistinction> caseDistinctions)
      throws IOException {
    File file = getFile(filename);
    byte[] bytes =
        ConstraintSystemCodec.encodeCaseDistinctions(caseDistinctions);
    Files.write(bytes, file);
    LOGGER.info("Saved " + caseDistinctions.size()
        + " case distinctions (" + bytes.length + " bytes) to " + file);
  }

  /**
   * Loads the case distinctions stored in {@code filename}.
   * @throws IOException if the file cannot be read or was not written by
   *         {@link #save}
   */
  public ImmutableList<CaseDistinction> load(String filename)
      throws IOException {
    File file = getFile(filename);
    ImmutableList<CaseDistinction> result =
        ConstraintSystemCodec.decodeCaseDistinctions(Files.toByteArray(file));
    LOGGER.info("Loaded " + result.size() + " case distinctions from "
        + file);
    return result;
  }
}
