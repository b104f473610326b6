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

/** Identifies a recorded violation of a pack's boundaries. */
@AutoValue
public abstract class ViolationIdentifier {

  /** The kind of violation, such as {@code dependency} or {@code privacy}. */
  public abstract String violationType();

  public abstract String file();

  public abstract String constantName();

  public abstract String referencingPackName();

  public abstract String definingPackName();

  public static ViolationIdentifier create(
      String violationType,
      String file,
      String constantName,
      String referencingPackName,
      String definingPackName) {
    return new AutoValue_ViolationIdentifier(
        violationType, file, constantName, referencingPackName, definingPackName);
  }
}
