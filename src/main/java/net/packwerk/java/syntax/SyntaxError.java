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

import com.google.common.base.Preconditions;
import java.util.List;

/** A SyntaxError represents a syntax error found by the lexer or parser. */
public final class SyntaxError {

  private final Location location;
  private final String message;

  SyntaxError(Location location, String message) {
    this.location = Preconditions.checkNotNull(location);
    this.message = Preconditions.checkNotNull(message);
  }

  /** Returns the location of the error. */
  public Location location() {
    return location;
  }

  /** Returns a description of the error. */
  public String message() {
    return message;
  }

  /** Returns a string of the form {@code "foo.rb:1:2: oops"}. */
  @Override
  public String toString() {
    return location + ": " + message;
  }

  /** Returns the first error of the list as a string, followed by a count of the remainder. */
  public static String summarize(List<SyntaxError> errors) {
    Preconditions.checkArgument(!errors.isEmpty());
    String first = errors.get(0).toString();
    return errors.size() == 1 ? first : first + " (and " + (errors.size() - 1) + " more)";
  }
}
