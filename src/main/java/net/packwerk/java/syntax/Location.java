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

import com.google.auto.value.AutoValue;

/** A Location denotes a position within a Ruby source file: a file name, a line and a column. */
@AutoValue
public abstract class Location implements Comparable<Location> {

  /** The name of the file, or the empty string for in-memory input. */
  public abstract String file();

  /** 1-based line number. */
  public abstract int line();

  /** 1-based column number, counted in chars of the decoded text. */
  public abstract int column();

  public static Location fromFileLineColumn(String file, int line, int column) {
    return new AutoValue_Location(file, line, column);
  }

  @Override
  public final int compareTo(Location that) {
    int cmp = file().compareTo(that.file());
    if (cmp == 0) {
      cmp = Integer.compare(line(), that.line());
    }
    if (cmp == 0) {
      cmp = Integer.compare(column(), that.column());
    }
    return cmp;
  }

  /** Returns the location in the form "file:line:column". */
  @Override
  public final String toString() {
    return file() + ":" + line() + ":" + column();
  }
}
