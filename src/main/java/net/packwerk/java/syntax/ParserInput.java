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

import com.google.common.base.Joiner;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * The apparent name and contents of a source file, for consumption by the parser. The file name
 * appears in the {@link Location}s of the resulting syntax tree.
 */
public final class ParserInput {

  private final String file;
  private final char[] content;

  private ParserInput(char[] content, String file) {
    this.content = content;
    this.file = file;
  }

  /** Returns the content of the input source. Callers must not modify the result. */
  char[] getContent() {
    return content;
  }

  /** Returns the (non-null) file name of the input source. */
  public String getFile() {
    return file;
  }

  /**
   * Returns an input source that reads from a UTF-8-encoded file. A file that is not valid UTF-8
   * cannot be read.
   *
   * @param path the file to read
   * @param file the name by which the file is known in locations, typically relative to the
   *     project root
   * @throws IOException if the file cannot be read or is not valid UTF-8
   */
  public static ParserInput readFile(Path path, String file) throws IOException {
    String content = Files.readString(path, StandardCharsets.UTF_8);
    if (content.startsWith("\uFEFF")) {
      content = content.substring(1);
    }
    return fromString(content, file);
  }

  /** Returns an unnamed input source that reads from a list of strings, joined by newlines. */
  public static ParserInput fromLines(String... lines) {
    return fromString(Joiner.on('\n').join(lines), "");
  }

  /** Returns an input source that reads from the given string. */
  public static ParserInput fromString(String content, String file) {
    return new ParserInput(content.toCharArray(), file);
  }
}
