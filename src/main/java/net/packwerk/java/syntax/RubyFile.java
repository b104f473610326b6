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
import java.util.List;

/**
 * Syntax tree for a Ruby file, together with any errors found while scanning and parsing it.
 *
 * <p>A file with errors has no statements: the parser gives up at the first error rather than
 * guessing at the structure of the rest of the file.
 */
public final class RubyFile extends Node {

  private final ImmutableList<Expression> statements;
  private final ImmutableList<SyntaxError> errors;

  private RubyFile(
      FileLocations locs, ImmutableList<Expression> statements, List<SyntaxError> errors) {
    super(locs);
    this.statements = statements;
    this.errors = ImmutableList.copyOf(errors);
  }

  /** Parses the input as a Ruby file. Syntax errors are recorded in the result. */
  public static RubyFile parse(ParserInput input) {
    Parser.ParseResult result = Parser.parseFile(input);
    return new RubyFile(result.locs, result.statements, result.errors);
  }

  /** Returns the top-level statements, or an empty list if the file has errors. */
  public ImmutableList<Expression> getStatements() {
    return statements;
  }

  /** Returns the errors found while scanning and parsing the file. */
  public ImmutableList<SyntaxError> errors() {
    return errors;
  }

  /** Reports whether the file parsed without errors. */
  public boolean ok() {
    return errors.isEmpty();
  }

  @Override
  public int getStartOffset() {
    return 0;
  }

  @Override
  public int getEndOffset() {
    return locs.size();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return "<RubyFile " + getFile() + ">";
  }
}
