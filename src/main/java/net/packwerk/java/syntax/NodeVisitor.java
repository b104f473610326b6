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

import java.util.List;

/**
 * A visitor for visiting the nodes of a syntax tree in lexical order (not evaluation order!).
 *
 * <p>Typical usage is for a subclass to just override the {@code visit()} method overloads for the
 * nodes that are relevant to its business logic, and to rely on the default implementations in this
 * class to ensure traversal over the remaining node types. Overriding implementations should
 * remember to traverse children using either {@code super.visit()} on the current node, or explicit
 * calls to {@link #visit(Node)} or {@link #visitAll} on child fields.
 */
public class NodeVisitor {

  /** Entrypoint for visiting a node. Clients should avoid calling node-specific overloads. */
  public void visit(Node node) {
    // Double-dispatch pattern.
    node.accept(this);
  }

  public void visitAll(List<? extends Node> nodes) {
    for (Node node : nodes) {
      visit(node);
    }
  }

  // ==== Miscellaneous node types ====

  public void visit(Parameter node) {
    if (node.getIdentifier() != null) {
      visit(node.getIdentifier());
    }
    visitAll(node.getNested());
    if (node.getDefaultValue() != null) {
      visit(node.getDefaultValue());
    }
  }

  public void visit(RubyFile node) {
    visitAll(node.getStatements());
  }

  // ==== Definitions ====

  public void visit(ClassDefinition node) {
    visit(node.getName());
    if (node.getSuperclass() != null) {
      visit(node.getSuperclass());
    }
    visitAll(node.getBody());
  }

  public void visit(ConstantAssignment node) {
    visit(node.getTarget());
    if (node.getValue() != null) {
      visit(node.getValue());
    }
  }

  public void visit(MethodDefinition node) {
    if (node.getReceiver() != null) {
      visit(node.getReceiver());
    }
    visitAll(node.getParameters());
    visitAll(node.getBody());
  }

  public void visit(ModuleDefinition node) {
    visit(node.getName());
    visitAll(node.getBody());
  }

  public void visit(SingletonClassDefinition node) {
    visit(node.getTarget());
    visitAll(node.getBody());
  }

  // ==== Other expressions ====

  public void visit(BlockExpression node) {
    visitAll(node.getParameters());
    visitAll(node.getBody());
  }

  public void visit(CallExpression node) {
    if (node.getReceiver() != null) {
      visit(node.getReceiver());
    }
    visitAll(node.getArguments());
    if (node.getBlock() != null) {
      visit(node.getBlock());
    }
  }

  public void visit(CompoundExpression node) {
    visitAll(node.getChildren());
  }

  public void visit(ConstantExpression node) {
    if (node.getScope() != null) {
      visit(node.getScope());
    }
  }

  public void visit(@SuppressWarnings("unused") Identifier node) {}

  public void visit(InterpolatedString node) {
    visitAll(node.getParts());
  }

  public void visit(@SuppressWarnings("unused") Literal node) {}

  public void visit(@SuppressWarnings("unused") SelfExpression node) {}

  public void visit(@SuppressWarnings("unused") TopLevelScope node) {}

  public void visit(@SuppressWarnings("unused") Variable node) {}
}
