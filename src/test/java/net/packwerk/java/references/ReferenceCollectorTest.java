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

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import net.packwerk.java.syntax.ParserInput;
import net.packwerk.java.syntax.RubyFile;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link ReferenceCollector}. */
@RunWith(JUnit4.class)
public final class ReferenceCollectorTest {

  private static ReferenceCollector collect(String... lines) {
    RubyFile file = RubyFile.parse(ParserInput.fromLines(lines));
    assertThat(file.errors()).isEmpty();
    ReferenceCollector collector = new ReferenceCollector("app/models/foo.rb");
    collector.visit(file);
    return collector;
  }

  @Test
  public void testModuleNesting() {
    assertThat(ReferenceCollector.moduleNesting(ImmutableList.of())).isEmpty();
    assertThat(ReferenceCollector.moduleNesting(ImmutableList.of("Foo")))
        .containsExactly("Foo");
    assertThat(ReferenceCollector.moduleNesting(ImmutableList.of("Foo", "Bar", "Baz")))
        .containsExactly("Foo::Bar::Baz", "Foo::Bar", "Foo")
        .inOrder();
    assertThat(ReferenceCollector.moduleNesting(ImmutableList.of("Foo::Bar", "Baz")))
        .containsExactly("Foo::Bar::Baz", "Foo::Bar")
        .inOrder();
  }

  @Test
  public void testDefinitions() {
    ReferenceCollector collector =
        collect(
            "module Foo", //
            "  class Bar",
            "    BAZ = 1",
            "  end",
            "  Qux::QUUX ||= 2",
            "end");
    assertThat(collector.definitions().stream()
                .map(Definition::fullyQualifiedName)
                .collect(toImmutableList()))
        .containsExactly("Foo::Bar", "Foo::Bar::BAZ", "Foo::Qux::QUUX")
        .inOrder();
    Definition bar = collector.definitions().get(0);
    assertThat(bar.startOffset()).isEqualTo(13);
    assertThat(bar.location()).isEqualTo(Range.create(2, 3, 4, 6));
    assertThat(collector.definitions().get(1).location()).isEqualTo(Range.create(3, 5, 3, 12));
  }

  @Test
  public void testReferencesCarryFileName() {
    ReferenceCollector collector = collect("Foo");
    assertThat(collector.references())
        .containsExactly(
            Reference.create(
                "app/models/foo.rb", "Foo", ImmutableList.of(), Range.create(1, 1, 1, 4)));
  }

  @Test
  public void testFilteringUsesEnclosingScopes() {
    ReferenceCollector collector =
        collect(
            "module Foo", //
            "  BAR = 1",
            "  class Baz",
            "    BAR",
            "    Other",
            "  end",
            "end");
    assertThat(collector.references().stream().map(Reference::name).collect(toImmutableList()))
        .containsExactly("BAR", "Other")
        .inOrder();
    assertThat(collector.filteredReferences().stream()
                .map(Reference::name)
                .collect(toImmutableList()))
        .containsExactly("Other");
  }
}
