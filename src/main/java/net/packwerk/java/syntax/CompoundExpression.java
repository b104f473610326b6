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
 * Syntax node for every construct whose only interest is its subexpressions: operators, array and
 * hash literals, control flow and its clauses, assignments to non-constants and so on. The form
 * records which construct it was; the children are in source order.
 */
public final class CompoundExpression extends Expression {

  /** The construct that a compound expression represents. */
  public enum Form {
    ALIAS,
    ARRAY,
    ASSIGNMENT,
    BEGIN,
    CASE,
    DEFINED,
    ELSE,
    ELSIF,
    ENSURE,
    FOR,
    HASH,
    IF,
    IN,
    JUMP,
    MODIFIER,
    MULTIPLE_ASSIGNMENT,
    OPERATOR,
    PARENS,
    PATTERN_MATCH,
    POSTEXE,
    PREEXE,
    RESCUE,
    UNDEF,
    UNLESS,
    UNTIL,
    WHEN,
    WHILE,
  }

  private final Form form;
  private final int startOffset;
  private final ImmutableList<Expression> children;
  private final int endOffset;

  CompoundExpression(
      FileLocations locs,
      Form form,
      int startOffset,
      ImmutableList<Expression> children,
      int endOffset) {
    super(locs);
    this.form = form;
    this.startOffset = startOffset;
    this.children = children;
    this.endOffset = endOffset;
  }

  public Form getForm() {
    return form;
  }

  public ImmutableList<Expression> getChildren() {
    return children;
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
    return Kind.COMPOUND;
  }
}
