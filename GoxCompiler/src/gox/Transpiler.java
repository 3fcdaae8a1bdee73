package gox;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.io.Files;

/** Parses and generates one {@code .gox} file at a time; safe to share between threads. */
public final class Transpiler {
  private static final Logger log = LoggerFactory.getLogger(Transpiler.class);

  public static final String SOURCE_SUFFIX = ".gox";
  public static final String MAP_SUFFIX = ".map";

  private final Generator.Options options;

  public Transpiler(Generator.Options options) {
    this.options = options;
  }

  /**
   * The generated file for a {@code .gox} file: {@code foo.gox} becomes {@code foo_gox.go} and
   * {@code foo_test.gox} becomes {@code foo_gox_test.go}, keeping Go's test file convention.
   */
  public static String outputPath(String goxPath) {
    Preconditions.checkArgument(goxPath.endsWith(SOURCE_SUFFIX), "not a .gox file: %s", goxPath);
    String base = goxPath.substring(0, goxPath.length() - SOURCE_SUFFIX.length());
    if (base.endsWith("_test")) {
      return base.substring(0, base.length() - "_test".length()) + "_gox_test.go";
    }
    return base + "_gox.go";
  }

  public static String sourceMapPath(String outputPath) {
    return outputPath + MAP_SUFFIX;
  }

  /**
   * Transpiles {@code source}, read from {@code file}. The source map records {@code file} and
   * {@code outputFile}.
   *
   * @throws CompilerException the first syntax error, if there was any
   */
  public Generator.GeneratedFile transpile(String file, String outputFile, String source)
      throws CompilerException {
    AST ast = Parser.parse(file, source).astOrThrow();
    return new Generator(options).generate(ast, file, outputFile);
  }

  public Generator.GeneratedFile transpile(String file, String source) throws CompilerException {
    return transpile(file, outputPath(file), source);
  }

  /**
   * Transpiles a file on disk, writing the Go file and its source map into {@code outputDir}, or
   * next to the input when it is null.
   *
   * @return the written Go file
   */
  public File transpileFile(File input, File outputDir) throws IOException, CompilerException {
    String source = Files.asCharSource(input, StandardCharsets.UTF_8).read();
    File output = new File(outputPath(input.getPath()));
    if (outputDir != null) {
      output = new File(outputDir, output.getName());
    }

    Generator.GeneratedFile generated =
        transpile(input.getAbsolutePath(), output.getAbsolutePath(), source);

    if (output.getParentFile() != null) {
      Files.createParentDirs(output);
    }
    Files.asCharSink(output, StandardCharsets.UTF_8).write(generated.source());
    Files.asCharSink(new File(sourceMapPath(output.getPath())), StandardCharsets.UTF_8)
        .write(generated.sourceMap().toJson());
    log.debug("Wrote {}", output);
    return output;
  }
}
