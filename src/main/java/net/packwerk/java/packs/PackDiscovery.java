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

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.GoogleLogger;
import java.io.File;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;

/** Finds the packs of a project from the {@code package.yml} files in its directory tree. */
public final class PackDiscovery {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  static final String PACKAGE_YML = "package.yml";

  // Directories that never contain packs.
  private static final ImmutableSet<String> EXCLUDED_DIRECTORIES =
      ImmutableSet.of(".git", "node_modules", "tmp", "vendor", "log");

  private final Path projectRoot;

  public PackDiscovery(Path projectRoot) {
    this.projectRoot = projectRoot.toAbsolutePath().normalize();
  }

  /** Returns a pack for every {@code package.yml} under the project root, ordered by yml path. */
  public ImmutableList<Pack> discoverPacks() throws IOException {
    List<Path> ymls = new ArrayList<>();
    Files.walkFileTree(
        projectRoot,
        new SimpleFileVisitor<Path>() {
          @Override
          public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            if (!dir.equals(projectRoot)
                && EXCLUDED_DIRECTORIES.contains(dir.getFileName().toString())) {
              return FileVisitResult.SKIP_SUBTREE;
            }
            return FileVisitResult.CONTINUE;
          }

          @Override
          public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (file.getFileName().toString().equals(PACKAGE_YML)) {
              ymls.add(file);
            }
            return FileVisitResult.CONTINUE;
          }
        });
    ImmutableList<Pack> packs =
        ymls.stream()
            .sorted()
            .map(yml -> Pack.create(packName(yml), yml))
            .collect(toImmutableList());
    logger.atFine().log("Found %d packs under %s", packs.size(), projectRoot);
    return packs;
  }

  private String packName(Path yml) {
    Path dir = projectRoot.relativize(yml.getParent());
    String name = dir.toString().replace(File.separatorChar, '/');
    return name.isEmpty() ? Pack.ROOT_PACK_NAME : name;
  }

  /**
   * Maps each file to the {@code package.yml} of the closest pack directory containing it. Files
   * outside every pack are omitted.
   */
  public static ImmutableMap<Path, Path> owningPackageYmls(List<Path> files, List<Pack> packs) {
    ImmutableMap<Path, Path> ymlByDirectory =
        packs.stream()
            .collect(ImmutableMap.toImmutableMap(pack -> pack.yml().getParent(), Pack::yml));
    ImmutableMap.Builder<Path, Path> result = ImmutableMap.builder();
    for (Path file : files) {
      for (Path dir = file.getParent(); dir != null; dir = dir.getParent()) {
        Path yml = ymlByDirectory.get(dir);
        if (yml != null) {
          result.put(file, yml);
          break;
        }
      }
    }
    return result.buildKeepingLast();
  }
}
