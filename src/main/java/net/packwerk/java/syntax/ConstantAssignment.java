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

import javax.annotation.Nullable;

/**
 * Syntax node for an assignment to a constant, such as {@code FOO = 1}, {@code Foo::BAR ||= x}, or
 * one target of a multiple assignment {@code A, B = 1, 2}.
 */
public final class ConstantAssignment extends Expression {

  private final ConstantExpression target;
  private final String operator;
  @Nullable private final Expression value;
  private final int endOffset;

  ConstantAssignment(
      FileLocations locs,
      ConstantExpression target,
      String operator,
      @Nullable Expression value,
      int endOffset) {
    super(locs);
    this.target = target;
    this.operator = operator;
    this.value = value;
    this.endOffset = endOffset;
  }

  public ConstantExpression getTarget() {
    return target;
  }

  /** Returns the assignment operator, such as {@code "="} or {@code "||="}. */
  public String getOperator() {
    return operator;
  }

  /**
   * Returns the assigned value, or null for a target of a multiple assignment, whose values belong
   * to the enclosing expression.
   */
  @Nullable
  public Expression getValue() {
    return value;
  }

  @Override
  public int getStartOffset() {
    return target.getStartOffset();
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
    return Kind.CONSTANT_ASSIGNMENT;
  }
}
