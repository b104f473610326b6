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
 * Base class for all expression nodes in the AST. Everything in Ruby is an expression, including
 * class, module and method definitions.
 */
public abstract class Expression extends Node {

  /**
   * Kind of the expression. This is similar to using instanceof, except that it's more efficient
   * and can be used in a switch/case.
   */
  public enum Kind {
    BLOCK,
    CALL,
    CLASS,
    COMPOUND,
    CONSTANT,
    CONSTANT_ASSIGNMENT,
    IDENTIFIER,
    INTERPOLATED_STRING,
    LITERAL,
    METHOD,
    MODULE,
    SELF,
    SINGLETON_CLASS,
    TOP_LEVEL_SCOPE,
    VARIABLE,
  }

  Expression(FileLocations locs) {
    super(locs);
  }

  /**
   * Kind of the expression. This is similar to using instanceof, except that it's more efficient
   * and can be used in a switch/case.
   */
  public abstract Kind kind();
}
