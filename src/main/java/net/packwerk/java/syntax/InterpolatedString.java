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

import com.google.common.collect.ImmutableList;

/**
 * Syntax node for a string-like literal with {@code #{...}} interpolations: a string, symbol,
 * regexp, command or heredoc. Only the embedded code is retained.
 */
public final class InterpolatedString extends Expression {

  private final int startOffset;
  private final ImmutableList<Expression> parts;
  private final int endOffset;

  InterpolatedString(
      FileLocations locs, int startOffset, ImmutableList<Expression> parts, int endOffset) {
    super(locs);
    this.startOffset = startOffset;
    this.parts = parts;
    this.endOffset = endOffset;
  }

  /** Returns the statements of all interpolations, in order. */
  public ImmutableList<Expression> getParts() {
    return parts;
  }

  @Override
  public int getStartOffset() {
    return startOffset;
  }

  @Override
  public int getEndOffset() {
    return endOffset;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public Kind kind() {
    return Kind.INTERPOLATED_STRING;
  }
}
