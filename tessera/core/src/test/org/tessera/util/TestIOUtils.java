/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.tessera.util;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.carrotsearch.randomizedtesting.RandomizedTest;
import org.junit.Test;

import static org.junit.Assert.*;

public class TestIOUtils extends RandomizedTest {

  private static final class Recorder implements Closeable {
    final String name;
    final IOException toThrow;
    final List<String> closed;

    Recorder(String name, IOException toThrow, List<String> closed) {
      this.name = name;
      this.toThrow = toThrow;
      this.closed = closed;
    }

    @Override
    public void close() throws IOException {
      closed.add(name);
      if (toThrow != null) {
        throw toThrow;
      }
    }
  }

  @Test
  public void testCloseClosesAllAndThrowsFirst() {
    List<String> closed = new ArrayList<>();
    IOException first = new IOException("first");
    IOException second = new IOException("second");
    IOException e = assertThrows(IOException.class, () -> IOUtils.close(
        new Recorder("a", first, closed), null, new Recorder("b", null, closed), new Recorder("c", second, closed)));
    assertSame(first, e);
    assertEquals(1, e.getSuppressed().length);
    assertSame(second, e.getSuppressed()[0]);
    assertEquals(Arrays.asList("a", "b", "c"), closed);
  }

  @Test
  public void testCloseWhileHandlingExceptionSwallows() {
    List<String> closed = new ArrayList<>();
    IOUtils.closeWhileHandlingException(new Recorder("a", new IOException("boom"), closed), new Recorder("b", null, closed));
    assertEquals(Arrays.asList("a", "b"), closed);
  }

  @Test
  public void testRethrowAlways() {
    IOException ioe = new IOException("io");
    assertSame(ioe, assertThrows(IOException.class, () -> { throw IOUtils.rethrowAlways(ioe); }));
    IllegalStateException ise = new IllegalStateException("state");
    assertSame(ise, assertThrows(IllegalStateException.class, () -> { throw IOUtils.rethrowAlways(ise); }));
    Exception checked = new Exception("checked");
    RuntimeException wrapped = assertThrows(RuntimeException.class, () -> { throw IOUtils.rethrowAlways(checked); });
    assertSame(checked, wrapped.getCause());
  }

  @Test
  public void testApplyToAll() {
    List<Integer> seen = new ArrayList<>();
    IOException e = assertThrows(IOException.class, () -> IOUtils.applyToAll(Arrays.asList(1, null, 2, 3), i -> {
      seen.add(i);
      if (i != 2) {
        throw new IOException("failed on " + i);
      }
    }));
    assertEquals("failed on 1", e.getMessage());
    assertEquals(1, e.getSuppressed().length);
    assertEquals(Arrays.asList(1, 2, 3), seen);
  }
}
