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

package net.packwerk.java.references;

import com.google.auto.value.AutoValue;
import net.packwerk.java.syntax.Location;

/**
 * The source span of a reference. Rows and columns are 1-based; the end is the position of the
 * first character after the span.
 */
@AutoValue
public abstract class Range implements Comparable<Range> {

  public abstract int startRow();

  public abstract int startCol();

  public abstract int endRow();

  public abstract int endCol();

  public static Range create(int startRow, int startCol, int endRow, int endCol) {
    return new AutoValue_Range(startRow, startCol, endRow, endCol);
  }

  public static Range create(Location start, Location end) {
    return create(start.line(), start.column(), end.line(), end.column());
  }

  @Override
  public final int compareTo(Range that) {
    int cmp = Integer.compare(startRow(), that.startRow());
    if (cmp == 0) {
      cmp = Integer.compare(startCol(), that.startCol());
    }
    return cmp;
  }

  @Override
  public final String toString() {
    return startRow() + ":" + startCol() + "-" + endRow() + ":" + endCol();
  }
}
