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
 * Syntax node for a parameter of a method, block or lambda. A destructuring block parameter such as
 * {@code (a, b)} has no identifier but nested parameters.
 */
public final class Parameter extends Node {

  @Nullable private final Identifier identifier;
  @Nullable private final Expression defaultValue;
  private final ImmutableList<Parameter> nested;
  private final int startOffset;
  private final int endOffset;

  Parameter(
      FileLocations locs,
      int startOffset,
      @Nullable Identifier identifier,
      @Nullable Expression defaultValue,
      ImmutableList<Parameter> nested,
      int endOffset) {
    super(locs);
    this.startOffset = startOffset;
    this.identifier = identifier;
    this.defaultValue = defaultValue;
    this.nested = nested;
    this.endOffset = endOffset;
  }

  /** Returns the parameter name, or null for an anonymous or destructuring parameter. */
  @Nullable
  public Identifier getIdentifier() {
    return identifier;
  }

  /** Returns the default value of an optional positional or keyword parameter, if any. */
  @Nullable
  public Expression getDefaultValue() {
    return defaultValue;
  }

  public ImmutableList<Parameter> getNested() {
    return nested;
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
}
