package gox;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.google.common.base.Splitter;
import com.google.common.primitives.Ints;

/**
 * Rewrites Go toolchain diagnostics ({@code path:line:col: message}) that point into generated
 * files so they point at the {@code .gox} source instead. Other lines pass through unchanged.
 */
public final class DiagnosticRemapper {
  private static final Pattern DIAGNOSTIC = Pattern.compile("^(.+\\.go):(\\d+):(\\d+):(.*)$");

  private final SourceMapCache cache;

  public DiagnosticRemapper(SourceMapCache cache) {
    this.cache = cache;
  }

  static boolean isGeneratedFile(String path) {
    return path.endsWith("_gox.go") || path.endsWith("_gox_test.go");
  }

  public String remap(String output) {
    return Splitter.on('\n')
        .splitToStream(output)
        .map(this::remapLine)
        .collect(Collectors.joining("\n"));
  }

  public String remapLine(String line) {
    Matcher m = DIAGNOSTIC.matcher(line);
    if (!m.matches() || !isGeneratedFile(m.group(1))) {
      return line;
    }
    Integer lineNumber = Ints.tryParse(m.group(2));
    Integer column = Ints.tryParse(m.group(3));
    if (lineNumber == null || column == null || lineNumber < 1 || column < 1) {
      return line;
    }

    Optional<SourceMap> map = cache.get(m.group(1));
    if (map.isEmpty() || map.get().sourceFile().isEmpty()) {
      return line;
    }
    return map.get()
        .sourcePositionFromTarget(lineNumber - 1, column - 1)
        .map(
            pos ->
                String.format(
                    "%s:%d:%d:%s",
                    map.get().sourceFile(), pos.line() + 1, pos.column() + 1, m.group(4)))
        .orElse(line);
  }
}
