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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** A use of a constant at a specific source location. */
@AutoValue
public abstract class Reference {

  /** The project-relative path of the file containing the reference; empty for in-memory input. */
  public abstract String file();

  /** The constant as written, possibly scoped ({@code A::B}) or rooted ({@code ::A}). */
  public abstract String name();

  /**
   * The fully-qualified names of the enclosing class and module scopes, innermost first, as
   * {@code Module.nesting} would report them at the reference. Empty at top level.
   */
  public abstract ImmutableList<String> moduleNesting();

  public abstract Range location();

  public static Reference create(
      String file, String name, List<String> moduleNesting, Range location) {
    return new AutoValue_Reference(file, name, ImmutableList.copyOf(moduleNesting), location);
  }

  /** Returns the names this reference could resolve to through its lexical scopes. */
  public ImmutableList<String> possibleFullyQualifiedConstants() {
    return moduleNesting().stream().map(scope -> scope + "::" + name()).collect(toImmutableList());
  }
}
