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
 * Syntax node for a method call, such as {@code foo(x)}, {@code a.b c}, {@code Foo::bar}, {@code
 * x[i]}, {@code super} or {@code yield}. Calls of the form {@code Foo(x)} are method calls, not
 * constant references.
 */
public final class CallExpression extends Expression {

  @Nullable private final Expression receiver;
  private final String methodName;
  private final int startOffset;
  private final ImmutableList<Expression> arguments;
  @Nullable private final BlockExpression block;
  private final int endOffset;

  CallExpression(
      FileLocations locs,
      @Nullable Expression receiver,
      String methodName,
      int startOffset,
      ImmutableList<Expression> arguments,
      @Nullable BlockExpression block,
      int endOffset) {
    super(locs);
    this.receiver = receiver;
    this.methodName = methodName;
    this.startOffset = startOffset;
    this.arguments = arguments;
    this.block = block;
    this.endOffset = endOffset;
  }

  /** Returns a copy of this call with the given block attached. */
  CallExpression withBlock(BlockExpression block) {
    return new CallExpression(
        locs, receiver, methodName, startOffset, arguments, block, block.getEndOffset());
  }

  @Nullable
  public Expression getReceiver() {
    return receiver;
  }

  public String getMethodName() {
    return methodName;
  }

  /** Returns the arguments, in source order. Keyword arguments appear as key/value pairs. */
  public ImmutableList<Expression> getArguments() {
    return arguments;
  }

  @Nullable
  public BlockExpression getBlock() {
    return block;
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
    return Kind.CALL;
  }
}
