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

/** Syntax node for {@code class << target ... end}. It does not open a constant scope. */
public final class SingletonClassDefinition extends Expression {

  private final int classOffset;
  private final Expression target;
  private final ImmutableList<Expression> body;
  private final int endOffset;

  SingletonClassDefinition(
      FileLocations locs,
      int classOffset,
      Expression target,
      ImmutableList<Expression> body,
      int endOffset) {
    super(locs);
    this.classOffset = classOffset;
    this.target = target;
    this.body = body;
    this.endOffset = endOffset;
  }

  public Expression getTarget() {
    return target;
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
    return Kind.SINGLETON_CLASS;
  }
}
