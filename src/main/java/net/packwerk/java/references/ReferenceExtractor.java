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

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import java.io.IOException;
import java.nio.file.Path;
import javax.annotation.Nullable;
import net.packwerk.java.syntax.ParserInput;
import net.packwerk.java.syntax.RubyFile;
import net.packwerk.java.syntax.SyntaxError;

/** Extracts the constant references of a single Ruby file. */
public final class ReferenceExtractor {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private ReferenceExtractor() {}

  /**
   * Returns the references in the input, in lexical order, without those that resolve to a constant
   * defined in the same file. A file that does not parse yields no references.
   *
   * @throws IllegalStateException if a module name cannot be resolved statically
   */
  public static ImmutableList<Reference> extract(ParserInput input) {
    ReferenceCollector collector = collect(input);
    return collector == null ? ImmutableList.of() : collector.filteredReferences();
  }

  /**
   * Returns the constants defined in the input by class definitions and constant assignments, in
   * lexical order. Modules are not definitions. A file that does not parse yields none.
   *
   * @throws IllegalStateException if a module name cannot be resolved statically
   */
  public static ImmutableList<Definition> extractDefinitions(ParserInput input) {
    ReferenceCollector collector = collect(input);
    return collector == null ? ImmutableList.of() : collector.definitions();
  }

  /** Returns the collector after visiting the file, or null if there is nothing to visit. */
  @Nullable
  private static ReferenceCollector collect(ParserInput input) {
    RubyFile file = RubyFile.parse(input);
    if (!file.ok()) {
      logger.atFine().log(
          "Nothing extracted from unparseable file: %s", SyntaxError.summarize(file.errors()));
      return null;
    }
    if (file.getStatements().isEmpty()) {
      return null;
    }
    ReferenceCollector collector = new ReferenceCollector(input.getFile());
    collector.visit(file);
    return collector;
  }

  /**
   * Reads and extracts the references of a file.
   *
   * @param path the file to read
   * @param file the name to record in the references, usually relative to the project root
   */
  public static ImmutableList<Reference> extract(Path path, String file) throws IOException {
    return extract(ParserInput.readFile(path, file));
  }

  /** Reads a file and extracts its definitions, like {@link #extract(Path, String)}. */
  public static ImmutableList<Definition> extractDefinitions(Path path, String file)
      throws IOException {
    return extractDefinitions(ParserInput.readFile(path, file));
  }
}
