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
 * Syntax node for a constant: {@code Foo}, {@code Foo::Bar}, {@code ::Foo} or {@code expr::Foo}.
 */
public final class ConstantExpression extends Expression {

  @Nullable private final Expression scope;
  private final String name;
  private final int nameOffset;

  ConstantExpression(FileLocations locs, @Nullable Expression scope, String name, int nameOffset) {
    super(locs);
    this.scope = scope;
    this.name = name;
    this.nameOffset = nameOffset;
  }

  /**
   * Returns the expression to the left of {@code ::}, or null for an unscoped constant. A leading
   * {@code ::} is represented by a {@link TopLevelScope}.
   */
  @Nullable
  public Expression getScope() {
    return scope;
  }

  /** Returns the last segment of the constant path. */
  public String getName() {
    return name;
  }

  @Override
  public int getStartOffset() {
    return scope != null ? scope.getStartOffset() : nameOffset;
  }

  @Override
  public int getEndOffset() {
    return nameOffset + name.length();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public Kind kind() {
    return Kind.CONSTANT;
  }
}
