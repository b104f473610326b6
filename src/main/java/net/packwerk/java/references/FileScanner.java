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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.Stopwatch;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import java.io.File;
import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.stream.Stream;

/**
 * Finds the Ruby files of a project and extracts their references, one file per task on a fixed
 * pool of threads.
 */
public final class FileScanner {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final Path projectRoot;
  private final ImmutableList<PathMatcher> includes;
  private final int jobs;
  private final boolean printFiles;

  /**
   * @param projectRoot the directory the include globs are relative to
   * @param includeGlobs globs such as {@code packs/**}{@code /*.rb}, matched against paths relative
   *     to the project root; {@code **}{@code /} also matches no directory at all, as in Ruby
   * @param jobs the number of files processed concurrently
   * @param printFiles whether to log each file as it is processed
   */
  public FileScanner(Path projectRoot, List<String> includeGlobs, int jobs, boolean printFiles) {
    checkArgument(jobs > 0, "jobs must be positive: %s", jobs);
    checkArgument(!includeGlobs.isEmpty(), "no include globs");
    this.projectRoot = projectRoot.toAbsolutePath().normalize();
    ImmutableList.Builder<PathMatcher> matchers = ImmutableList.builder();
    for (String glob : includeGlobs) {
      matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + glob));
      if (glob.contains("**/")) {
        matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + glob.replace("**/", "")));
      }
    }
    this.includes = matchers.build();
    this.jobs = jobs;
    this.printFiles = printFiles;
  }

  public Path projectRoot() {
    return projectRoot;
  }

  /** Returns the absolute paths of the included files, sorted. */
  public ImmutableList<Path> listIncludedFiles() throws IOException {
    try (Stream<Path> paths = Files.walk(projectRoot)) {
      return paths
          .filter(Files::isRegularFile)
          .filter(this::isIncluded)
          .sorted()
          .collect(toImmutableList());
    }
  }

  private boolean isIncluded(Path file) {
    Path relative = projectRoot.relativize(file);
    return includes.stream().anyMatch(matcher -> matcher.matches(relative));
  }

  /** Returns the path of the file relative to the project root, with '/' separators. */
  public String relativeName(Path file) {
    return projectRoot.relativize(file).toString().replace(File.separatorChar, '/');
  }

  /** Extracts the references of all included files. */
  public ImmutableList<Reference> scan() throws IOException, InterruptedException {
    return scan(listIncludedFiles());
  }

  /**
   * Extracts the references of the given files. The references of each file are in lexical order;
   * the order across files is unspecified.
   *
   * @throws IOException if any file cannot be read, in which case the remaining files are not
   *     processed
   */
  public ImmutableList<Reference> scan(List<Path> files) throws IOException, InterruptedException {
    return scanAll(files, "references", ReferenceExtractor::extract);
  }

  /**
   * Extracts the constant definitions of the given files, with the same ordering and failure
   * behavior as {@link #scan(List)}.
   */
  public ImmutableList<Definition> scanDefinitions(List<Path> files)
      throws IOException, InterruptedException {
    return scanAll(files, "definitions", ReferenceExtractor::extractDefinitions);
  }

  /** Extracts something from one file. */
  @FunctionalInterface
  private interface Extraction<T> {
    ImmutableList<T> extract(Path path, String file) throws IOException;
  }

  private <T> ImmutableList<T> scanAll(List<Path> files, String what, Extraction<T> extraction)
      throws IOException, InterruptedException {
    Stopwatch stopwatch = Stopwatch.createStarted();
    ListeningExecutorService executor =
        MoreExecutors.listeningDecorator(Executors.newFixedThreadPool(jobs));
    try {
      List<ListenableFuture<ImmutableList<T>>> futures = new ArrayList<>(files.size());
      for (Path file : files) {
        futures.add(executor.submit(() -> extract(file, what, extraction)));
      }
      List<ImmutableList<T>> results;
      try {
        results = Futures.allAsList(futures).get();
      } catch (ExecutionException e) {
        Throwable cause = e.getCause();
        Throwables.throwIfInstanceOf(cause, IOException.class);
        Throwables.throwIfUnchecked(cause);
        throw new IllegalStateException(cause);
      }
      ImmutableList.Builder<T> items = ImmutableList.builder();
      results.forEach(items::addAll);
      ImmutableList<T> all = items.build();
      logger.atFine().log(
          "Extracted %d %s from %d files in %s", all.size(), what, files.size(), stopwatch);
      return all;
    } finally {
      executor.shutdownNow();
    }
  }

  private <T> ImmutableList<T> extract(Path path, String what, Extraction<T> extraction)
      throws IOException {
    String file = relativeName(path);
    if (printFiles) {
      logger.atInfo().log("Started processing %s", file);
    }
    ImmutableList<T> items;
    try {
      items = extraction.extract(path, file);
    } catch (RuntimeException e) {
      logger.atSevere().withCause(e).log("Failed to extract %s from %s", what, file);
      throw e;
    }
    if (printFiles) {
      logger.atInfo().log("Finished processing %s: %d %s", file, items.size(), what);
    }
    return items;
  }
}
