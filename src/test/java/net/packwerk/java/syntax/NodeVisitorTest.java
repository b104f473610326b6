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

import static com.google.common.truth.Truth.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link NodeVisitor}. */
@RunWith(JUnit4.class)
public final class NodeVisitorTest {

  private static List<String> constantNames(String... lines) {
    RubyFile file = RubyFile.parse(ParserInput.fromLines(lines));
    assertThat(file.errors()).isEmpty();
    List<String> names = new ArrayList<>();
    new NodeVisitor() {
      @Override
      public void visit(ConstantExpression node) {
        super.visit(node);
        names.add(node.getName());
      }
    }.visit(file);
    return names;
  }

  @Test
  public void testVisitsConstantsInLexicalOrder() {
    assertThat(
            constantNames(
                "module A",
                "  class B < C",
                "    D = E",
                "    def f(x = F)",
                "      G.new { |y| H }",
                "    end",
                "  end",
                "end"))
        .containsExactly("A", "B", "C", "D", "E", "F", "G", "H")
        .inOrder();
  }

  @Test
  public void testScopeIsVisitedBeforeName() {
    assertThat(constantNames("A::B::C")).containsExactly("A", "B", "C").inOrder();
  }

  @Test
  public void testVisitsInterpolationsAndControlFlow() {
    assertThat(
            constantNames(
                "if A", //
                "  \"#{B}\"",
                "elsif C",
                "  [D, {k: E}]",
                "else",
                "  F rescue G",
                "end"))
        .containsExactly("A", "B", "C", "D", "E", "F", "G")
        .inOrder();
  }
}
