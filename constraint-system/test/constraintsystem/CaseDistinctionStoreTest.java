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

import static constraintsystem.TestSystems.J;
import static constraintsystem.TestSystems.K;
import static constraintsystem.TestSystems.chain;
import static constraintsystem.TestSystems.var;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

import junit.framework.TestCase;

import java.io.File;
import java.io.IOException;

public class CaseDistinctionStoreTest extends TestCase {
  private File dir;
  private CaseDistinctionStore store;

  @Override
  protected void setUp() throws IOException {
    dir = java.nio.file.Files.createTempDirectory("cases").toFile();
    store = new CaseDistinctionStore(dir);
  }

  @Override
  protected void tearDown() {
    for (File file : dir.listFiles()) {
      file.delete();
    }
    dir.delete();
  }

  public void testSaveAndLoad() throws IOException {
    ImmutableList<CaseDistinction> caseDistinctions = ImmutableList.of(
        CaseDistinction.create(
            ActionGoal.create(J, Fact.proto("Start", var(K))),
            ImmutableList.of(CaseDistinction.Case.create(
                ImmutableList.of("Init"), chain()))));
    store.save("theory.cases", caseDistinctions);
    assertTrue(new File(dir, "theory.cases").isFile());
    assertEquals(caseDistinctions, store.load("theory.cases"));
    assertEquals(caseDistinctions,
        new CaseDistinctionStore().load(
            new File(dir, "theory.cases").getAbsolutePath()));
  }

  public void testGetFile() {
    assertEquals(new File(dir, "a.cases"), store.getFile("a.cases"));
    File absolute = new File(dir, "b.cases").getAbsoluteFile();
    assertEquals(absolute, store.getFile(absolute.getPath()));
  }

  public void testMissingFile() {
    try {
      store.load("missing.cases");
      fail("Should have thrown an exception");
    } catch (IOException e) {
      // expected
    }
  }

  public void testCorruptFile() throws IOException {
    Files.write(new byte[] {ConstraintSystemCodec.VERSION, 'S'},
        new File(dir, "system.cases"));
    try {
      store.load("system.cases");
      fail("Should have thrown an exception");
    } catch (IOException e) {
      assertTrue(e.getMessage().contains("entity"));
    }
  }
}
