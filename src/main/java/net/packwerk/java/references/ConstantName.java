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

import com.google.auto.value.AutoValue;
import net.packwerk.java.syntax.ConstantExpression;
import net.packwerk.java.syntax.Expression;

/**
 * The statically known name of a constant expression. A name can be
 *
 * <ul>
 *   <li>RESOLVED: the name is spelled out in the source, as in {@code Foo::Bar} or {@code ::Foo}.
 *   <li>DYNAMIC: the name depends on a runtime value, as in {@code described_class::Foo} or
 *       {@code self::Foo}.
 * </ul>
 */
public abstract class ConstantName {

  public boolean isResolved() {
    return this instanceof Resolved;
  }

  public Resolved asResolved() {
    throw new IllegalStateException("Not a resolved name " + this);
  }

  public boolean isDynamic() {
    return this instanceof Dynamic;
  }

  /**
   * Resolves a constant expression, or the scope of one. The top-level scope marker resolves to the
   * empty string, so {@code ::Foo} resolves to {@code "::Foo"}; any other expression in scope
   * position is dynamic.
   */
  public static ConstantName resolve(Expression expr) {
    switch (expr.kind()) {
      case CONSTANT:
        {
          ConstantExpression constant = (ConstantExpression) expr;
          if (constant.getScope() == null) {
            return Resolved.create(constant.getName());
          }
          ConstantName scope = resolve(constant.getScope());
          if (scope.isDynamic()) {
            return scope;
          }
          return Resolved.create(scope.asResolved().name() + "::" + constant.getName());
        }
      case TOP_LEVEL_SCOPE:
        return Resolved.create("");
      default:
        return Dynamic.singleton();
    }
  }

  /** A name spelled out in the source. */
  @AutoValue
  public abstract static class Resolved extends ConstantName {

    public static Resolved create(String name) {
      return new AutoValue_ConstantName_Resolved(name);
    }

    public abstract String name();

    @Override
    public Resolved asResolved() {
      return this;
    }
  }

  /** A name that cannot be known without running the program. */
  public static final class Dynamic extends ConstantName {

    private static final Dynamic SINGLETON = new Dynamic();

    public static Dynamic singleton() {
      return SINGLETON;
    }

    private Dynamic() {}

    @Override
    public String toString() {
      return "Dynamic";
    }
  }
}
