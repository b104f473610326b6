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

/** A point in a file where a constant is declared, by a class or a constant assignment. */
@AutoValue
public abstract class Definition {

  /** The project-relative path of the defining file; empty for in-memory input. */
  public abstract String file();

  /** The name with all enclosing scopes, as in {@code Foo::Bar::BAZ}. */
  public abstract String fullyQualifiedName();

  /** The span of the whole class body or assignment. */
  public abstract Range location();

  // Char offsets of the defining node.
  abstract int startOffset();

  abstract int endOffset();

  static Definition create(
      String file, String fullyQualifiedName, Range location, int startOffset, int endOffset) {
    return new AutoValue_Definition(file, fullyQualifiedName, location, startOffset, endOffset);
  }
}
