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

import com.google.common.base.Preconditions;
import java.util.Arrays;

/**
 * FileLocations maps char offsets within a file to {@link Location}s. Offsets are indices into the
 * decoded text, so a character outside the basic multilingual plane occupies two columns.
 */
final class FileLocations {

  private final int[] linestart; // maps line number (0-based) to offset of its first char
  private final String file;
  private final int size; // size of file in chars

  private FileLocations(int[] linestart, String file, int size) {
    this.linestart = linestart;
    this.file = file;
    this.size = size;
  }

  static FileLocations create(char[] buffer, String file) {
    return new FileLocations(computeLinestart(buffer), file, buffer.length);
  }

  private static int[] computeLinestart(char[] buffer) {
    int[] linestart = new int[8];
    int n = 0;
    linestart[n++] = 0;
    for (int i = 0; i < buffer.length; i++) {
      if (buffer[i] == '\n') {
        if (n == linestart.length) {
          linestart = Arrays.copyOf(linestart, n * 2);
        }
        linestart[n++] = i + 1;
      }
    }
    return Arrays.copyOf(linestart, n);
  }

  String file() {
    return file;
  }

  int size() {
    return size;
  }

  // Returns the 0-based index of the line containing the given offset.
  private int getLineAt(int offset) {
    Preconditions.checkArgument(
        offset >= 0 && offset <= size, "offset %s out of range [0, %s]", offset, size);
    int i = Arrays.binarySearch(linestart, offset);
    if (i < 0) {
      i = -i - 2;
    }
    return i;
  }

  /** Returns the 1-based line and column of the char at the given offset. */
  Location getLocation(int offset) {
    int line = getLineAt(offset);
    int column = offset - linestart[line];
    return Location.fromFileLineColumn(file, line + 1, column + 1);
  }
}
