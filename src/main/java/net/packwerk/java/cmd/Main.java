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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.collect.ImmutableListMultimap.toImmutableListMultimap;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.GoogleLogger;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.packwerk.java.packs.Pack;
import net.packwerk.java.packs.PackDiscovery;
import net.packwerk.java.packs.PackSet;
import net.packwerk.java.packs.PackSetException;
import net.packwerk.java.references.Definition;
import net.packwerk.java.references.FileScanner;
import net.packwerk.java.references.Reference;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.kohsuke.args4j.OptionDef;
import org.kohsuke.args4j.spi.PathOptionHandler;
import org.kohsuke.args4j.spi.Setter;

/**
 * Lists the packs, analyzed files, constant references and constant definitions of a modularized
 * Ruby project.
 *
 * <p>Usage: {@code Main [options] COMMAND}, where the command is one of {@code list_packs},
 * {@code list_included_files}, {@code list_references} and {@code list_definitions}.
 */
public class Main {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /** Command line options. */
  public static class Options {
    @Argument(required = true, metaVar = "COMMAND", usage = "The command to run.")
    public Command command;

    @Option(
        name = "--project_root",
        handler = ExistingPathOptionHandler.class,
        usage = "Path for the root of the project.")
    public Path projectRoot = Path.of(".");

    @Option(
        name = "--include",
        usage =
            "Glob of the files to analyze, relative to the project root. May be repeated."
                + " Defaults to " + Configuration.DEFAULT_INCLUDE + ".")
    public List<String> includes = new ArrayList<>();

    @Option(name = "--jobs", usage = "Number of files to process concurrently.")
    public int jobs = Runtime.getRuntime().availableProcessors();

    @Option(
        name = "--print_files",
        usage =
            "Log when each file begins and finishes processing, to identify files that fail when"
                + " processed concurrently.")
    public boolean printFiles = false;

    @Option(name = "--debug", usage = "Enable debug logging.")
    public boolean debug = false;

    @Option(name = "--pack", usage = "Only list references in files owned by this pack.")
    public String pack;

    @Option(
        name = "--ambiguous",
        usage = "With list_definitions, only list constants that are defined more than once.")
    public boolean ambiguous = false;
  }

  /** Exit code for configuration errors, such as a missing root pack. */
  private static final int ERROR_EXIT_CODE = 1;

  private static final Joiner NESTING_JOINER = Joiner.on(',');

  public static void main(String[] args) throws IOException, InterruptedException {
    System.exit(run(args, System.out, System.err));
  }

  @VisibleForTesting
  static int run(String[] args, PrintStream out, PrintStream err)
      throws IOException, InterruptedException {
    Configuration config = parseCommandLineOptions(args, err);
    if (config.debug()) {
      enableDebugLogging();
    }
    logger.atFine().log("Running with %s", config);

    FileScanner scanner =
        new FileScanner(
            config.projectRoot(), config.includes(), config.jobs(), config.printFiles());
    ImmutableList<Path> files = scanner.listIncludedFiles();
    ImmutableList<Pack> packs = new PackDiscovery(config.projectRoot()).discoverPacks();
    PackSet packSet;
    try {
      packSet = PackSet.build(packs, PackDiscovery.owningPackageYmls(files, packs));
    } catch (PackSetException e) {
      err.println("ERROR: " + e.getMessage());
      return ERROR_EXIT_CODE;
    }

    switch (config.command()) {
      case LIST_PACKS:
        packSet.packs().forEach(pack -> out.println(pack.name()));
        break;
      case LIST_INCLUDED_FILES:
        files.forEach(file -> out.println(scanner.relativeName(file)));
        break;
      case LIST_REFERENCES:
        {
          if (config.pack().isPresent()) {
            Optional<Pack> pack = packSet.forPack(config.pack().get());
            if (!pack.isPresent()) {
              err.println("ERROR: No pack found: " + config.pack().get());
              return ERROR_EXIT_CODE;
            }
            String packName = pack.get().name();
            files =
                files.stream()
                    .filter(
                        file ->
                            packSet.forFile(file).map(p -> p.name().equals(packName)).orElse(false))
                    .collect(toImmutableList());
          }
          printReferences(scanner.scan(files), packSet, config.projectRoot(), out);
          break;
        }
      case LIST_DEFINITIONS:
        printDefinitions(scanner.scanDefinitions(files), config.ambiguous(), out);
        break;
    }
    return 0;
  }

  private static void printReferences(
      List<Reference> references, PackSet packSet, Path projectRoot, PrintStream out) {
    List<Reference> sorted = new ArrayList<>(references);
    sorted.sort(Comparator.comparing(Reference::file).thenComparing(Reference::location));
    // Owners are looked up per file.
    ImmutableMap<String, String> ownerByFile =
        sorted.stream()
            .map(Reference::file)
            .distinct()
            .collect(
                ImmutableMap.toImmutableMap(
                    file -> file,
                    file ->
                        packSet.forFile(projectRoot.resolve(file)).map(Pack::name).orElse("-")));
    for (Reference reference : sorted) {
      out.printf(
          "%s:%d:%d %s [%s] %s%n",
          reference.file(),
          reference.location().startRow(),
          reference.location().startCol(),
          reference.name(),
          NESTING_JOINER.join(reference.moduleNesting()),
          ownerByFile.get(reference.file()));
    }
  }

  private static void printDefinitions(
      List<Definition> definitions, boolean ambiguousOnly, PrintStream out) {
    ImmutableListMultimap<String, Definition> byName =
        definitions.stream()
            .sorted(
                Comparator.comparing(Definition::fullyQualifiedName)
                    .thenComparing(Definition::file)
                    .thenComparing(Definition::location))
            .collect(toImmutableListMultimap(Definition::fullyQualifiedName, d -> d));
    for (String name : byName.keySet()) {
      ImmutableList<Definition> places = byName.get(name);
      if (ambiguousOnly && places.size() < 2) {
        continue;
      }
      for (Definition definition : places) {
        out.printf(
            "%s is defined at %s:%d:%d%n",
            name,
            definition.file(),
            definition.location().startRow(),
            definition.location().startCol());
      }
    }
  }

  private static void enableDebugLogging() {
    Logger root = Logger.getLogger("");
    root.setLevel(Level.FINE);
    for (Handler handler : root.getHandlers()) {
      handler.setLevel(Level.FINE);
    }
  }

  @VisibleForTesting
  static Configuration parseCommandLineOptions(String[] args, PrintStream err) {
    Options options = new Options();
    CmdLineParser parser = new CmdLineParser(options);
    try {
      parser.parseArgument(args);
    } catch (CmdLineException e) {
      err.println(e.getMessage());
      parser.printUsage(err);
      throw new IllegalArgumentException(e);
    }

    checkArgument(options.jobs > 0, "Invalid value of --jobs: %s", options.jobs);
    Configuration.Builder config =
        Configuration.builder()
            .setCommand(options.command)
            .setProjectRoot(options.projectRoot)
            .setJobs(options.jobs)
            .setPrintFiles(options.printFiles)
            .setDebug(options.debug)
            .setAmbiguous(options.ambiguous);
    if (!options.includes.isEmpty()) {
      config.setIncludes(ImmutableList.copyOf(options.includes));
    }
    if (options.pack != null) {
      config.setPack(options.pack);
    }
    return config.build();
  }

  /** Custom option handler for a path that must exist. */
  public static class ExistingPathOptionHandler extends PathOptionHandler {

    public ExistingPathOptionHandler(
        CmdLineParser parser, OptionDef option, Setter<? super Path> setter) {
      super(parser, option, setter);
    }

    @Override
    protected Path parse(String argument) throws CmdLineException {
      Path path = FileSystems.getDefault().getPath(argument);
      if (!Files.isDirectory(path)) {
        throw new CmdLineException(
            owner, String.format("Path %s for option %s is not a directory.", argument, option));
      }
      return path;
    }
  }
}
