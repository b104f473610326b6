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

package net.packwerk.java.packs;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableSet;
import java.nio.file.Path;
import java.util.Set;

/** A package of Ruby code, declared by a {@code package.yml} file. */
@AutoValue
public abstract class Pack {

  /** The name of the root pack, which owns files not claimed by any other pack. */
  public static final String ROOT_PACK_NAME = ".";

  /** The directory of the pack relative to the project root, or {@code .} for the root pack. */
  public abstract String name();

  /** The absolute path of the pack's {@code package.yml}. */
  public abstract Path yml();

  /** The violations recorded for this pack. */
  public abstract ImmutableSet<ViolationIdentifier> recordedViolations();

  public static Pack create(String name, Path yml) {
    return create(name, yml, ImmutableSet.of());
  }

  public static Pack create(String name, Path yml, Set<ViolationIdentifier> recordedViolations) {
    return new AutoValue_Pack(name, yml, ImmutableSet.copyOf(recordedViolations));
  }

  public boolean isRoot() {
    return name().equals(ROOT_PACK_NAME);
  }
}
