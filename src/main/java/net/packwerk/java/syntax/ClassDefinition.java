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
import javax.annotation.Nullable;

/** Syntax node for a class definition, {@code class Name < Superclass ... end}. */
public final class ClassDefinition extends Expression {

  private final int classOffset;
  private final Expression name;
  @Nullable private final Expression superclass;
  private final ImmutableList<Expression> body;
  private final int endOffset;

  ClassDefinition(
      FileLocations locs,
      int classOffset,
      Expression name,
      @Nullable Expression superclass,
      ImmutableList<Expression> body,
      int endOffset) {
    super(locs);
    this.classOffset = classOffset;
    this.name = name;
    this.superclass = superclass;
    this.body = body;
    this.endOffset = endOffset;
  }

  /**
   * Returns the name expression. It is always a {@link ConstantExpression}, whose scope may be an
   * arbitrary expression.
   */
  public Expression getName() {
    return name;
  }

  @Nullable
  public Expression getSuperclass() {
    return superclass;
  }

  public ImmutableList<Expression> getBody() {
    return body;
  }

  @Override
  public int getStartOffset() {
    return classOffset;
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
    return Kind.CLASS;
  }
}
