// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.packwerk.java.syntax;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link FileLocations}. */
@RunWith(JUnit4.class)
public final class FileLocationsTest {

  private static FileLocations create(String content) {
    return FileLocations.create(content.toCharArray(), "foo.rb");
  }

  @Test
  public void testOffsetsToLocations() {
    FileLocations locs = create("ab\ncd\n\nef");
    assertThat(locs.getLocation(0).toString()).isEqualTo("foo.rb:1:1");
    assertThat(locs.getLocation(2).toString()).isEqualTo("foo.rb:1:3");
    assertThat(locs.getLocation(3).toString()).isEqualTo("foo.rb:2:1");
    assertThat(locs.getLocation(6).toString()).isEqualTo("foo.rb:3:1");
    assertThat(locs.getLocation(8).toString()).isEqualTo("foo.rb:4:2");
  }

  @Test
  public void testEndOfFileIsAValidOffset() {
    FileLocations locs = create("ab\n");
    assertThat(locs.size()).isEqualTo(3);
    assertThat(locs.getLocation(3).toString()).isEqualTo("foo.rb:2:1");
  }

  @Test
  public void testColumnsCountChars() {
    // U+1F600 is a surrogate pair, so it occupies two columns.
    FileLocations locs = create("é😀X");
    assertThat(locs.getLocation(3).column()).isEqualTo(4);
  }

  @Test
  public void testOffsetOutOfRange() {
    FileLocations locs = create("abc");
    assertThrows(IllegalArgumentException.class, () -> locs.getLocation(4));
    assertThrows(IllegalArgumentException.class, () -> locs.getLocation(-1));
  }

  @Test
  public void testLocationOrdering() {
    FileLocations locs = create("a\nbc");
    assertThat(locs.getLocation(1)).isLessThan(locs.getLocation(2));
    assertThat(locs.getLocation(3)).isGreaterThan(locs.getLocation(2));
  }
}
