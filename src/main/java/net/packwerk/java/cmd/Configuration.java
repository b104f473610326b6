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

package net.packwerk.java.cmd;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import java.util.Optional;

/** The validated settings of one run of the tool. */
@AutoValue
public abstract class Configuration {

  static final String DEFAULT_INCLUDE = "packs/**/*.rb";

  public abstract Command command();

  /** The absolute, normalized project root. */
  public abstract Path projectRoot();

  /** Globs of the analyzed files, relative to the project root. */
  public abstract ImmutableList<String> includes();

  public abstract int jobs();

  public abstract boolean printFiles();

  public abstract boolean debug();

  /** Whether to list only constants defined in more than one place. */
  public abstract boolean ambiguous();

  /** The pack whose files are listed, if not all. */
  public abstract Optional<String> pack();

  public static Builder builder() {
    return new AutoValue_Configuration.Builder()
        .setIncludes(ImmutableList.of(DEFAULT_INCLUDE))
        .setJobs(Runtime.getRuntime().availableProcessors())
        .setPrintFiles(false)
        .setDebug(false)
        .setAmbiguous(false);
  }

  /** Builder for {@link Configuration}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setCommand(Command command);

    public abstract Builder setProjectRoot(Path projectRoot);

    public abstract Builder setIncludes(ImmutableList<String> includes);

    public abstract Builder setJobs(int jobs);

    public abstract Builder setPrintFiles(boolean printFiles);

    public abstract Builder setDebug(boolean debug);

    public abstract Builder setAmbiguous(boolean ambiguous);

    public abstract Builder setPack(String pack);

    abstract Path projectRoot();

    abstract Configuration autoBuild();

    public Configuration build() {
      setProjectRoot(projectRoot().toAbsolutePath().normalize());
      return autoBuild();
    }
  }
}
