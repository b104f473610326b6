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

package net.packwerk.java.references;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import net.packwerk.java.syntax.ParserInput;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link ReferenceExtractor}. */
@RunWith(JUnit4.class)
public final class ReferenceExtractorTest {

  private static ImmutableList<Reference> extract(String... lines) {
    return ReferenceExtractor.extract(ParserInput.fromLines(lines));
  }

  private static Reference ref(
      String name, ImmutableList<String> nesting, int row, int startCol, int endCol) {
    return Reference.create("", name, nesting, Range.create(row, startCol, row, endCol));
  }

  private static Reference ref(String name, int row, int startCol, int endCol) {
    return ref(name, ImmutableList.of(), row, startCol, endCol);
  }

  @Test
  public void testTrivialCase() {
    assertThat(extract("Foo")).containsExactly(ref("Foo", 1, 1, 4));
  }

  @Test
  public void testScopedConstants() {
    assertThat(extract("Foo::Bar")).containsExactly(ref("Foo::Bar", 1, 1, 9));
    assertThat(extract("Foo::Bar::Baz")).containsExactly(ref("Foo::Bar::Baz", 1, 1, 14));
    assertThat(extract("Foo::Bar::Baz::Boo"))
        .containsExactly(ref("Foo::Bar::Baz::Boo", 1, 1, 19));
  }

  @Test
  public void testGloballyReferencedConstant() {
    assertThat(extract("::Foo")).containsExactly(ref("::Foo", 1, 1, 6));
  }

  @Test
  public void testDynamicScopeIsIgnored() {
    assertThat(extract("described_class::Foo")).isEmpty();
    assertThat(extract("self::Foo")).isEmpty();
  }

  @Test
  public void testEmptyClassDefinitionNameIsAReference() {
    assertThat(extract("class Foo", "end")).containsExactly(ref("Foo", 1, 7, 10));
    assertThat(extract("class Foo < Bar", "end"))
        .containsExactly(ref("Foo", 1, 7, 10), ref("Bar", 1, 13, 16))
        .inOrder();
  }

  @Test
  public void testClassNamespacedConstant() {
    assertThat(extract("class Foo", "  Bar", "end"))
        .containsExactly(ref("Bar", ImmutableList.of("Foo"), 2, 3, 6));
  }

  @Test
  public void testDeeplyClassNamespacedConstant() {
    assertThat(extract("class Foo", "  class Bar", "    Baz", "  end", "end"))
        .containsExactly(ref("Baz", ImmutableList.of("Foo::Bar", "Foo"), 3, 5, 8));
  }

  @Test
  public void testModuleNamespacedConstants() {
    assertThat(extract("module Foo", "  Bar", "end"))
        .containsExactly(ref("Bar", ImmutableList.of("Foo"), 2, 3, 6));
    assertThat(
            extract(
                "module Foo",
                "  module Bar",
                "    module Baz",
                "      Boo",
                "    end",
                "  end",
                "end"))
        .containsExactly(
            ref("Boo", ImmutableList.of("Foo::Bar::Baz", "Foo::Bar", "Foo"), 4, 7, 10));
  }

  @Test
  public void testMixedNamespacedConstant() {
    assertThat(
            extract(
                "class Foo",
                "  module Bar",
                "    class Baz",
                "      Boo",
                "    end",
                "  end",
                "end"))
        .containsExactly(
            ref("Boo", ImmutableList.of("Foo::Bar::Baz", "Foo::Bar", "Foo"), 4, 7, 10));
  }

  @Test
  public void testCompactStyleClassDefinition() {
    assertThat(extract("class Foo::Bar", "  Baz", "end"))
        .containsExactly(ref("Baz", ImmutableList.of("Foo::Bar"), 2, 3, 6));
    assertThat(extract("class Foo::Bar", "  module Baz", "    Baz", "  end", "end"))
        .containsExactly(ref("Baz", ImmutableList.of("Foo::Bar::Baz", "Foo::Bar"), 3, 5, 8));
  }

  @Test
  public void testArraysOfConstants() {
    assertThat(extract("[Foo]")).containsExactly(ref("Foo", 1, 2, 5));
    assertThat(extract("[Foo, Bar]"))
        .containsExactly(ref("Foo", 1, 2, 5), ref("Bar", 1, 7, 10))
        .inOrder();
    assertThat(extract("[Baz::Boo]")).containsExactly(ref("Baz::Boo", 1, 2, 10));
  }

  @Test
  public void testSuperclassIsResolvedOutsideTheClass() {
    assertThat(extract("module A", "  class B < C", "    D", "  end", "end"))
        .containsExactly(
            ref("C", ImmutableList.of("A"), 2, 13, 14),
            ref("D", ImmutableList.of("A::B", "A"), 3, 5, 6))
        .inOrder();
  }

  @Test
  public void testConstantDefinedInFileIsIgnored() {
    assertThat(
            extract(
                "class Foo",
                "  BAR = 1",
                "  def use_bar",
                "    puts BAR",
                "  end",
                "end"))
        .isEmpty();
  }

  @Test
  public void testMultipleAssignmentDefinesConstants() {
    assertThat(extract("module M", "  A, B = 1, 2", "  A", "end")).isEmpty();
  }

  @Test
  public void testAssignedValueIsVisited() {
    assertThat(extract("X = Foo")).containsExactly(ref("Foo", 1, 5, 8));
  }

  @Test
  public void testReferencesInMethodsAndBlocks() {
    assertThat(
            extract(
                "class Foo", //
                "  def bar",
                "    Baz.call { Qux }",
                "  end",
                "end"))
        .containsExactly(
            ref("Baz", ImmutableList.of("Foo"), 3, 5, 8),
            ref("Qux", ImmutableList.of("Foo"), 3, 16, 19))
        .inOrder();
  }

  @Test
  public void testInterpolatedHeredoc() {
    assertThat(extract("x = <<~SQL", "  select #{Foo}", "SQL"))
        .containsExactly(ref("Foo", 2, 12, 15));
  }

  @Test
  public void testCaseWithoutSubject() {
    assertThat(extract("case", "when x > 1 then Foo", "else Bar", "end"))
        .containsExactly(ref("Foo", 2, 17, 20), ref("Bar", 3, 6, 9))
        .inOrder();
  }

  @Test
  public void testPinnedPatterns() {
    assertThat(extract("case x", "in ^y then Foo", "in ^(1+1) then Bar", "end"))
        .containsExactly(ref("Foo", 2, 12, 15), ref("Bar", 3, 16, 19))
        .inOrder();
  }

  @Test
  public void testPreexeAndPostexeBlocks() {
    assertThat(extract("BEGIN { Foo }", "END { Bar }"))
        .containsExactly(ref("Foo", 1, 9, 12), ref("Bar", 2, 7, 10))
        .inOrder();
  }

  @Test
  public void testExtractDefinitions() {
    ImmutableList<Definition> definitions =
        ReferenceExtractor.extractDefinitions(
            ParserInput.fromLines(
                "module Foo", //
                "  class Bar < Base",
                "    LIMIT = 3",
                "  end",
                "end"));
    assertThat(definitions).hasSize(2);
    assertThat(definitions.get(0).fullyQualifiedName()).isEqualTo("Foo::Bar");
    assertThat(definitions.get(0).location()).isEqualTo(Range.create(2, 3, 4, 6));
    assertThat(definitions.get(1).fullyQualifiedName()).isEqualTo("Foo::Bar::LIMIT");
    assertThat(definitions.get(1).location()).isEqualTo(Range.create(3, 5, 3, 14));

    assertThat(ReferenceExtractor.extractDefinitions(ParserInput.fromLines("class Foo"))).isEmpty();
  }

  @Test
  public void testColumnsCountChars() {
    assertThat(extract("x = 'é😀'; Foo")).containsExactly(ref("Foo", 1, 12, 15));
  }

  @Test
  public void testDynamicClassNameSkipsBody() {
    assertThat(extract("class self::Foo", "  Bar", "end")).isEmpty();
  }

  @Test
  public void testUnresolvableModuleName() {
    IllegalStateException e =
        assertThrows(IllegalStateException.class, () -> extract("module foo::Bar", "end"));
    assertThat(e).hasMessageThat().isEqualTo(":1:8: cannot resolve module name");
  }

  @Test
  public void testSyntaxErrorYieldsNoReferences() {
    assertThat(extract("class Foo", "  Bar")).isEmpty();
    assertThat(extract("foo(Bar")).isEmpty();
  }

  @Test
  public void testEmptyFile() {
    assertThat(extract("")).isEmpty();
    assertThat(extract("# frozen_string_literal: true")).isEmpty();
  }
}
