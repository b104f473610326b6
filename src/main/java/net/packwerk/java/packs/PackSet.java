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

import static com.google.common.base.Verify.verify;
import static com.google.common.base.Verify.verifyNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;

/**
 * The packs of a project, indexed by name and by the files they own. Instances are immutable.
 */
public final class PackSet {

  // Longer names first, so that nested packs precede the packs that contain them.
  private static final Comparator<Pack> PACK_ORDER =
      Comparator.comparingInt((Pack pack) -> pack.name().length())
          .reversed()
          .thenComparing(Pack::name);

  private final ImmutableList<Pack> packs;
  private final ImmutableMap<String, Pack> packsByName;
  private final ImmutableMap<Path, String> owningPackNameForFile;
  private final ImmutableSet<ViolationIdentifier> allViolations;

  private PackSet(
      ImmutableList<Pack> packs,
      ImmutableMap<String, Pack> packsByName,
      ImmutableMap<Path, String> owningPackNameForFile,
      ImmutableSet<ViolationIdentifier> allViolations) {
    this.packs = packs;
    this.packsByName = packsByName;
    this.owningPackNameForFile = owningPackNameForFile;
    this.allViolations = allViolations;
  }

  /**
   * Builds the pack set.
   *
   * @param packs the packs of the project; names must be unique
   * @param owningPackageYmlForFile maps absolute file paths to the {@code package.yml} of the pack
   *     that owns them. Files whose yml does not belong to any of the packs are left unowned.
   * @throws PackSetException if there is no root pack
   */
  public static PackSet build(Iterable<Pack> packs, Map<Path, Path> owningPackageYmlForFile)
      throws PackSetException {
    ImmutableList<Pack> sorted = ImmutableList.sortedCopyOf(PACK_ORDER, packs);
    ImmutableMap.Builder<String, Pack> byName = ImmutableMap.builder();
    ImmutableMap.Builder<Path, String> nameByYml = ImmutableMap.builder();
    ImmutableSet.Builder<ViolationIdentifier> allViolations = ImmutableSet.builder();
    for (Pack pack : sorted) {
      byName.put(pack.name(), pack);
      nameByYml.put(pack.yml(), pack.name());
      allViolations.addAll(pack.recordedViolations());
    }
    ImmutableMap<String, Pack> packsByName = byName.buildOrThrow();
    ImmutableMap<Path, String> packNameByYml = nameByYml.buildOrThrow();

    ImmutableMap.Builder<Path, String> owners = ImmutableMap.builder();
    for (Map.Entry<Path, Path> entry : owningPackageYmlForFile.entrySet()) {
      String packName = packNameByYml.get(entry.getValue());
      if (packName != null) {
        owners.put(entry.getKey(), packName);
      }
    }

    if (!packsByName.containsKey(Pack.ROOT_PACK_NAME)) {
      throw new PackSetException(
          "No root pack found. First double check a root pack exists (a package.yml file in the"
              + " application root). Secondly, double check your packwerk.yml `package_paths`"
              + " includes the root pack by using command packs list-packs.");
    }
    return new PackSet(sorted, packsByName, owners.buildOrThrow(), allViolations.build());
  }

  /** Returns the pack that owns the file at the given absolute path, if any. */
  public Optional<Pack> forFile(Path absoluteFilePath) {
    String packName = owningPackNameForFile.get(absoluteFilePath);
    if (packName == null) {
      return Optional.empty();
    }
    Optional<Pack> pack = forPack(packName);
    verify(
        pack.isPresent(),
        "Walking the directory identified that %s belongs to %s, but that pack cannot be found in"
            + " the pack set",
        absoluteFilePath,
        packName);
    return pack;
  }

  /**
   * Returns the pack with the given name. A trailing '/', as added by shell completion, is
   * ignored.
   */
  public Optional<Pack> forPack(String packName) {
    if (packName.endsWith("/")) {
      packName = packName.substring(0, packName.length() - 1);
    }
    return Optional.ofNullable(packsByName.get(packName));
  }

  public Pack rootPack() {
    return verifyNotNull(
        packsByName.get(Pack.ROOT_PACK_NAME),
        "No root pack found. This error should have been caught when building the pack set");
  }

  /** Returns the packs, longest name first, then by name. */
  public ImmutableList<Pack> packs() {
    return packs;
  }

  /** Returns the violations recorded by all packs. */
  public ImmutableSet<ViolationIdentifier> allViolations() {
    return allViolations;
  }
}
