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

/** Syntax node for an instance, class or global variable, such as {@code @foo}. */
public final class Variable extends Expression {

  /** The storage class of a variable, determined by its sigil. */
  public enum Scope {
    INSTANCE,
    CLASS,
    GLOBAL
  }

  private final Scope scope;
  private final String name; // including sigil
  private final int nameOffset;

  Variable(FileLocations locs, Scope scope, String name, int nameOffset) {
    super(locs);
    this.scope = scope;
    this.name = name;
    this.nameOffset = nameOffset;
  }

  public Scope getScope() {
    return scope;
  }

  /** Returns the name of the variable, including its sigil. */
  public String getName() {
    return name;
  }

  @Override
  public int getStartOffset() {
    return nameOffset;
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
    return Kind.VARIABLE;
  }
}
