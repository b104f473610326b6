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

/**
 * Syntax node for a literal without embedded code: a number, symbol, character, keyword constant
 * such as {@code nil}, or a string, regexp or heredoc without interpolation.
 */
public final class Literal extends Expression {

  private final TokenKind tokenKind;
  private final String raw;
  private final int startOffset;
  private final int endOffset;

  Literal(FileLocations locs, TokenKind tokenKind, String raw, int startOffset, int endOffset) {
    super(locs);
    this.tokenKind = tokenKind;
    this.raw = raw;
    this.startOffset = startOffset;
    this.endOffset = endOffset;
  }

  /** Returns the kind of the token from which the literal was scanned. */
  public TokenKind getTokenKind() {
    return tokenKind;
  }

  /** Returns the source text of the literal. */
  public String getRaw() {
    return raw;
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
    return Kind.LITERAL;
  }
}
