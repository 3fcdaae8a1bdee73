package gox;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.io.CharStreams;
import com.google.common.io.Files;
import com.google.common.primitives.Ints;

/** Command line driver: {@code generate} writes Go files, {@code remap} rewrites diagnostics. */
public class GoxMain {
  private static final Logger log = LoggerFactory.getLogger(GoxMain.class);

  private static final ImmutableSet<String> SKIPPED_DIRS =
      ImmutableSet.of("vendor", "testdata", "node_modules");

  private static final String USAGE =
      String.join(
          "\n",
          "Usage:",
          "  gox generate [flags] [paths]   Generate .go files from .gox files",
          "  gox remap [files.gox]          Remap Go diagnostics read from stdin",
          "",
          "Paths are files, directories, or dir/... for a recursive search (default: .)",
          "",
          "Generate flags:",
          "  -o <dir>           Output directory (default: next to each input)",
          "  -runtime <pkg>     Runtime package path (default: "
              + Generator.DEFAULT_RUNTIME_PACKAGE
              + ")",
          "  -qualifier <name>  Identifier for runtime calls (default: "
              + Generator.DEFAULT_RUNTIME_QUALIFIER
              + ")",
          "  -parallel <n>      Number of parallel workers (default: 4)",
          "  -no-format         Do not run gofmt on the output",
          "  -v                 Verbose output");

  static final class UsageException extends Exception {
    private static final long serialVersionUID = 1L;

    UsageException(String message) {
      super(message);
    }
  }

  /** Parsed {@code generate}/{@code remap} flags. */
  static final class Config {
    File outputDir = null;
    Generator.Options.Builder options = Generator.Options.builder();
    int parallel = 4;
    boolean verbose = false;
    List<String> paths = new ArrayList<>();

    static Config parse(List<String> args) throws UsageException {
      Config config = new Config();
      for (int i = 0; i < args.size(); i++) {
        String arg = args.get(i);
        switch (arg) {
          case "-o":
            config.outputDir = new File(value(args, ++i, arg));
            break;
          case "-runtime":
            config.options.setRuntimePackage(value(args, ++i, arg));
            break;
          case "-qualifier":
            config.options.setRuntimeQualifier(value(args, ++i, arg));
            break;
          case "-parallel":
            {
              Integer n = Ints.tryParse(value(args, ++i, arg));
              if (n == null || n < 1) {
                throw new UsageException("-parallel needs a positive number");
              }
              config.parallel = n;
              break;
            }
          case "-no-format":
            config.options.setFormatter(SourceFormatter.identity());
            break;
          case "-v":
            config.verbose = true;
            break;
          default:
            if (arg.startsWith("-")) {
              throw new UsageException("unknown flag: " + arg);
            }
            config.paths.add(arg);
        }
      }
      if (config.paths.isEmpty()) {
        config.paths.add(".");
      }
      return config;
    }

    private static String value(List<String> args, int i, String flag) throws UsageException {
      if (i >= args.size()) {
        throw new UsageException(flag + " needs a value");
      }
      return args.get(i);
    }

    Generator.Options buildOptions() throws UsageException {
      try {
        return options.build();
      } catch (IllegalArgumentException ex) {
        throw new UsageException(ex.getMessage());
      }
    }
  }

  public static void main(String[] args) {
    System.exit(run(Arrays.asList(args), System.in, System.out, System.err));
  }

  static int run(List<String> args, InputStream stdin, PrintStream out, PrintStream err) {
    if (args.isEmpty()) {
      err.println(USAGE);
      return 1;
    }
    List<String> rest = args.subList(1, args.size());
    try {
      switch (args.get(0)) {
        case "generate":
          return generate(Config.parse(rest), out, err);
        case "remap":
          return remap(Config.parse(rest), stdin, out, err);
        case "help":
        case "-h":
        case "--help":
          out.println(USAGE);
          return 0;
        default:
          throw new UsageException("unknown command: " + args.get(0));
      }
    } catch (UsageException ex) {
      err.println("gox: " + ex.getMessage());
      err.println(USAGE);
      return 2;
    } catch (IOException ex) {
      err.println("gox: " + ex.getMessage());
      return 1;
    }
  }

  private static int generate(Config config, PrintStream out, PrintStream err)
      throws UsageException, IOException {
    Transpiler transpiler = new Transpiler(config.buildOptions());
    ImmutableList<File> files = findGoxFiles(config.paths);
    if (files.isEmpty()) {
      out.println("No .gox files found.");
      return 0;
    }

    ExecutorService pool = Executors.newFixedThreadPool(config.parallel);
    int failed = 0;
    try {
      List<Future<File>> results = new ArrayList<>();
      for (File file : files) {
        results.add(pool.submit(() -> transpiler.transpileFile(file, config.outputDir)));
      }
      for (int i = 0; i < files.size(); i++) {
        try {
          File written = results.get(i).get();
          if (config.verbose) {
            out.println(files.get(i) + " -> " + written);
          }
        } catch (ExecutionException ex) {
          failed++;
          Throwable cause = ex.getCause();
          if (cause instanceof CompilerException) {
            err.println(cause.getMessage());
          } else {
            err.println(files.get(i) + ": " + cause.getMessage());
            log.debug("Failed to transpile {}", files.get(i), cause);
          }
        }
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      err.println("gox: interrupted");
      return 1;
    } finally {
      pool.shutdownNow();
    }

    if (failed > 0) {
      err.println(String.format("Generation failed for %d of %d files.", failed, files.size()));
      return 1;
    }
    log.info("Generated {} files", files.size());
    if (config.verbose) {
      out.println(String.format("Generated %d files.", files.size()));
    }
    return 0;
  }

  private static int remap(Config config, InputStream stdin, PrintStream out, PrintStream err)
      throws UsageException, IOException {
    Transpiler transpiler = new Transpiler(config.buildOptions());
    SourceMapCache cache = new SourceMapCache();
    boolean success = true;
    for (File file : findGoxFiles(config.paths)) {
      String output = Transpiler.outputPath(file.getPath());
      if (config.outputDir != null) {
        output = new File(config.outputDir, new File(output).getName()).getPath();
      }
      try {
        String source = Files.asCharSource(file, StandardCharsets.UTF_8).read();
        cache.put(output, transpiler.transpile(file.getPath(), output, source).sourceMap());
      } catch (CompilerException ex) {
        err.println(ex.getMessage());
        success = false;
      }
    }

    String diagnostics =
        CharStreams.toString(new InputStreamReader(stdin, StandardCharsets.UTF_8));
    out.print(new DiagnosticRemapper(cache).remap(diagnostics));
    out.flush();
    return success ? 0 : 1;
  }

  static boolean skipDir(String name) {
    return name.startsWith(".") || name.startsWith("_") || SKIPPED_DIRS.contains(name);
  }

  /**
   * Expands paths: a {@code .gox} file is itself, a directory contributes its {@code .gox} files,
   * and {@code dir/...} searches {@code dir} recursively, skipping hidden and vendored dirs.
   */
  static ImmutableList<File> findGoxFiles(List<String> paths) throws IOException {
    ImmutableList.Builder<File> files = ImmutableList.builder();
    for (String path : paths) {
      if (path.equals("...") || path.endsWith("/...")) {
        String dir = path.length() > 4 ? path.substring(0, path.length() - 4) : ".";
        walk(new File(dir), files, true);
        continue;
      }
      File file = new File(path);
      if (file.isDirectory()) {
        walk(file, files, false);
      } else if (file.isFile()) {
        if (file.getName().endsWith(Transpiler.SOURCE_SUFFIX)) {
          files.add(file);
        }
      } else {
        throw new IOException("no such file or directory: " + path);
      }
    }
    return files.build();
  }

  private static void walk(File dir, ImmutableList.Builder<File> files, boolean recursive)
      throws IOException {
    File[] entries = dir.listFiles();
    if (entries == null) {
      throw new IOException("cannot read directory: " + dir);
    }
    Arrays.sort(entries);
    for (File entry : entries) {
      if (entry.isDirectory()) {
        if (recursive && !skipDir(entry.getName())) {
          walk(entry, files, true);
        }
      } else if (entry.getName().endsWith(Transpiler.SOURCE_SUFFIX)) {
        files.add(entry);
      }
    }
  }
}
