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

import static com.google.common.base.Preconditions.checkState;
import static com.google.common.collect.ImmutableSet.toImmutableSet;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import net.packwerk.java.syntax.ClassDefinition;
import net.packwerk.java.syntax.ConstantAssignment;
import net.packwerk.java.syntax.ConstantExpression;
import net.packwerk.java.syntax.ModuleDefinition;
import net.packwerk.java.syntax.Node;
import net.packwerk.java.syntax.NodeVisitor;

/**
 * Collects the constant references and definitions of one file.
 *
 * <p>The collector tracks the class and module scopes enclosing the node being visited, so that
 * each reference carries the module nesting Ruby would use to resolve it. An instance holds the
 * state of a single traversal and must not be shared between files.
 */
final class ReferenceCollector extends NodeVisitor {

  private static final Joiner SCOPE_JOINER = Joiner.on("::");

  private final String file;
  // Names of the enclosing classes and modules, outermost first, as written.
  private final List<String> currentNamespaces = new ArrayList<>();
  private final ImmutableList.Builder<Reference> references = ImmutableList.builder();
  private final ImmutableList.Builder<Definition> definitions = ImmutableList.builder();

  ReferenceCollector(String file) {
    this.file = file;
  }

  @Override
  public void visit(ClassDefinition node) {
    ConstantName name = ConstantName.resolve(node.getName());
    if (name.isDynamic()) {
      return; // nothing inside a class with a computed name can be attributed to a scope
    }
    String namespace = name.asResolved().name();
    // "class Foo; end" counts as a reference to Foo; a class with a body does not.
    if (node.getBody().isEmpty()) {
      visit(node.getName());
    }
    if (node.getSuperclass() != null) {
      visit(node.getSuperclass());
    }
    recordDefinition(namespace, node);
    pushNamespace(namespace);
    visitAll(node.getBody());
    popNamespace();
  }

  @Override
  public void visit(ModuleDefinition node) {
    ConstantName name = ConstantName.resolve(node.getName());
    checkState(
        name.isResolved(), "%s: cannot resolve module name", node.getName().getStartLocation());
    pushNamespace(name.asResolved().name());
    visitAll(node.getBody());
    popNamespace();
  }

  @Override
  public void visit(ConstantAssignment node) {
    ConstantName name = ConstantName.resolve(node.getTarget());
    if (name.isResolved()) {
      recordDefinition(name.asResolved().name(), node);
    }
    if (node.getValue() != null) {
      visit(node.getValue());
    }
  }

  @Override
  public void visit(ConstantExpression node) {
    ConstantName name = ConstantName.resolve(node);
    if (name.isDynamic()) {
      return;
    }
    references.add(
        Reference.create(
            file,
            name.asResolved().name(),
            moduleNesting(currentNamespaces),
            Range.create(node.getStartLocation(), node.getEndLocation())));
  }

  private void pushNamespace(String namespace) {
    currentNamespaces.add(namespace);
  }

  private void popNamespace() {
    currentNamespaces.remove(currentNamespaces.size() - 1);
  }

  private void recordDefinition(String name, Node node) {
    List<String> components = new ArrayList<>(currentNamespaces);
    components.add(name);
    definitions.add(
        Definition.create(
            file,
            SCOPE_JOINER.join(components),
            Range.create(node.getStartLocation(), node.getEndLocation()),
            node.getStartOffset(),
            node.getEndOffset()));
  }

  /** Returns the definitions recorded so far, in traversal order. */
  ImmutableList<Definition> definitions() {
    return definitions.build();
  }

  /** Returns the references recorded so far, in traversal order. */
  ImmutableList<Reference> references() {
    return references.build();
  }

  /**
   * Returns the references that do not resolve, through any of their enclosing scopes, to a
   * constant defined in this file.
   */
  ImmutableList<Reference> filteredReferences() {
    ImmutableSet<String> defined =
        definitions().stream().map(Definition::fullyQualifiedName).collect(toImmutableSet());
    ImmutableList.Builder<Reference> result = ImmutableList.builder();
    for (Reference reference : references()) {
      if (reference.possibleFullyQualifiedConstants().stream().noneMatch(defined::contains)) {
        result.add(reference);
      }
    }
    return result.build();
  }

  /**
   * Computes {@code Module.nesting} from the enclosing scope names: {@code [Foo, Bar, Baz]} becomes
   * {@code [Foo::Bar::Baz, Foo::Bar, Foo]}.
   */
  @VisibleForTesting
  static ImmutableList<String> moduleNesting(List<String> namespaces) {
    List<String> nesting = new ArrayList<>(namespaces.size());
    String previous = "";
    for (String namespace : namespaces) {
      previous = previous.isEmpty() ? namespace : previous + "::" + namespace;
      nesting.add(previous);
    }
    return ImmutableList.copyOf(nesting).reverse();
  }
}
