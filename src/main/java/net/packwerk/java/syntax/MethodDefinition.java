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

/**
 * Syntax node for a method definition, {@code def name(params) ... end}, including singleton
 * methods ({@code def self.name}) and endless methods ({@code def name = expr}).
 */
public final class MethodDefinition extends Expression {

  private final int defOffset;
  @Nullable private final Expression receiver;
  private final String name;
  private final ImmutableList<Parameter> parameters;
  private final ImmutableList<Expression> body;
  private final int endOffset;

  MethodDefinition(
      FileLocations locs,
      int defOffset,
      @Nullable Expression receiver,
      String name,
      ImmutableList<Parameter> parameters,
      ImmutableList<Expression> body,
      int endOffset) {
    super(locs);
    this.defOffset = defOffset;
    this.receiver = receiver;
    this.name = name;
    this.parameters = parameters;
    this.body = body;
    this.endOffset = endOffset;
  }

  @Nullable
  public Expression getReceiver() {
    return receiver;
  }

  public String getName() {
    return name;
  }

  public ImmutableList<Parameter> getParameters() {
    return parameters;
  }

  public ImmutableList<Expression> getBody() {
    return body;
  }

  @Override
  public int getStartOffset() {
    return defOffset;
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
    return Kind.METHOD;
  }
}
