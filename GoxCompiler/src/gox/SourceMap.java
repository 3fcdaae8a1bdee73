package gox;

import java.io.IOException;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.SortedMap;
import java.util.TreeMap;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.Table;
import com.google.common.collect.TreeBasedTable;

/**
 * Bidirectional position index between a {@code .gox} file (source) and the Go file generated
 * from it (target). Lines and columns are 0-indexed; columns count UTF-16 units.
 *
 * <p>Every mapping is stored in both directions. A map is populated during generation and
 * {@link #seal() sealed} afterwards; lookups are safe from any thread once sealed.
 */
public final class SourceMap {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  // Forward lookups tolerate a cursor this many columns past the last mapped one.
  private static final int FORWARD_SEARCH_COLUMNS = 5;

  @AutoValue
  public abstract static class Position {
    public static Position of(int line, int column) {
      Preconditions.checkArgument(line >= 0 && column >= 0, "negative position");
      return new AutoValue_SourceMap_Position(line, column);
    }

    public abstract int line();

    public abstract int column();
  }

  private final TreeBasedTable<Integer, Integer, Position> sourceToTarget =
      TreeBasedTable.create();
  private final TreeBasedTable<Integer, Integer, Position> targetToSource =
      TreeBasedTable.create();

  private String sourceFile = "";
  private String targetFile = "";
  private boolean sealed = false;

  public void setFiles(String sourceFile, String targetFile) {
    Preconditions.checkState(!sealed, "source map is sealed");
    this.sourceFile = sourceFile;
    this.targetFile = targetFile;
  }

  public String sourceFile() {
    return sourceFile;
  }

  public String targetFile() {
    return targetFile;
  }

  /** Makes the mappings read-only. */
  public void seal() {
    sealed = true;
  }

  public boolean isSealed() {
    return sealed;
  }

  public boolean hasMappings() {
    return !sourceToTarget.isEmpty() || !targetToSource.isEmpty();
  }

  public void addMapping(int srcLine, int srcCol, int tgtLine, int tgtCol) {
    Preconditions.checkState(!sealed, "source map is sealed");
    sourceToTarget.put(srcLine, srcCol, Position.of(tgtLine, tgtCol));
    targetToSource.put(tgtLine, tgtCol, Position.of(srcLine, srcCol));
  }

  /**
   * Maps {@code text}, copied verbatim from {@code srcStart} to {@code tgtStart}, one mapping per
   * code point plus one at the end of every line. Newlines move both sides to column 0 of their
   * next line.
   */
  public void addExpression(String text, Position srcStart, Position tgtStart) {
    int srcLine = srcStart.line();
    int srcCol = srcStart.column();
    int tgtLine = tgtStart.line();
    int tgtCol = tgtStart.column();

    int i = 0;
    while (i < text.length()) {
      int cp = text.codePointAt(i);
      addMapping(srcLine, srcCol, tgtLine, tgtCol);
      if (cp == '\n') {
        srcLine++;
        tgtLine++;
        srcCol = 0;
        tgtCol = 0;
      } else {
        srcCol += Character.charCount(cp);
        tgtCol += Character.charCount(cp);
      }
      i += Character.charCount(cp);
    }
    addMapping(srcLine, srcCol, tgtLine, tgtCol);
  }

  /**
   * The target position of a source position. Misses fall back to a mapping at most a few columns
   * earlier on the same line, shifted by the distance.
   */
  public Optional<Position> targetPositionFromSource(int line, int column) {
    SortedMap<Integer, Position> row = sourceToTarget.row(line);
    Position exact = row.get(column);
    if (exact != null) {
      return Optional.of(exact);
    }
    for (int c = column - 1; c > 0 && column - c < FORWARD_SEARCH_COLUMNS; c--) {
      Position pos = row.get(c);
      if (pos != null) {
        return Optional.of(Position.of(pos.line(), pos.column() + (column - c)));
      }
    }
    return Optional.empty();
  }

  /**
   * The source position of a target position. Misses fall back to the nearest earlier column on
   * the line, then to the last mapping of the nearest earlier line that has any.
   */
  public Optional<Position> sourcePositionFromTarget(int line, int column) {
    SortedMap<Integer, Position> row = targetToSource.row(line);
    SortedMap<Integer, Position> upToColumn = row.headMap(column + 1);
    if (!upToColumn.isEmpty()) {
      return Optional.of(upToColumn.get(upToColumn.lastKey()));
    }

    SortedMap<Integer, Map<Integer, Position>> earlierLines =
        targetToSource.rowMap().headMap(line);
    if (earlierLines.isEmpty()) {
      return Optional.empty();
    }
    SortedMap<Integer, Position> previous = targetToSource.row(earlierLines.lastKey());
    return Optional.of(previous.get(previous.lastKey()));
  }

  /** The target line of the first mapped column on a source line. */
  public OptionalInt findTargetLine(int srcLine) {
    return firstLine(sourceToTarget, srcLine);
  }

  /** The source line of the first mapped column on a target line. */
  public OptionalInt findSourceLine(int tgtLine) {
    return firstLine(targetToSource, tgtLine);
  }

  private static OptionalInt firstLine(TreeBasedTable<Integer, Integer, Position> table, int line) {
    SortedMap<Integer, Position> row = table.row(line);
    return row.isEmpty() ? OptionalInt.empty() : OptionalInt.of(row.get(row.firstKey()).line());
  }

  /** Moves every target line at or after {@code fromLine} by {@code delta} lines. */
  public void shiftTargetLines(int fromLine, int delta) {
    Preconditions.checkState(!sealed, "source map is sealed");
    if (delta == 0) {
      return;
    }
    TreeBasedTable<Integer, Integer, Position> forward = TreeBasedTable.create();
    for (Table.Cell<Integer, Integer, Position> cell : sourceToTarget.cellSet()) {
      Position target = cell.getValue();
      if (target.line() >= fromLine) {
        target = Position.of(target.line() + delta, target.column());
      }
      forward.put(cell.getRowKey(), cell.getColumnKey(), target);
    }
    TreeBasedTable<Integer, Integer, Position> reverse = TreeBasedTable.create();
    for (Table.Cell<Integer, Integer, Position> cell : targetToSource.cellSet()) {
      int line = cell.getRowKey();
      reverse.put(line >= fromLine ? line + delta : line, cell.getColumnKey(), cell.getValue());
    }
    sourceToTarget.clear();
    sourceToTarget.putAll(forward);
    targetToSource.clear();
    targetToSource.putAll(reverse);
  }

  /**
   * Moves the target positions on {@code line} at or after {@code fromColumn} to {@code toLine},
   * keeping their distance from {@code toColumn}.
   */
  public void moveTargetColumns(int line, int fromColumn, int toLine, int toColumn) {
    Preconditions.checkState(!sealed, "source map is sealed");
    Map<Integer, Position> moved = new TreeMap<>(targetToSource.row(line).tailMap(fromColumn));
    for (Map.Entry<Integer, Position> cell : moved.entrySet()) {
      int column = toColumn + cell.getKey() - fromColumn;
      Position source = cell.getValue();
      targetToSource.remove(line, cell.getKey());
      targetToSource.put(toLine, column, source);
      if (Position.of(line, cell.getKey())
          .equals(sourceToTarget.get(source.line(), source.column()))) {
        sourceToTarget.put(source.line(), source.column(), Position.of(toLine, column));
      }
    }
  }

  /**
   * Serializes as {@code {sourceFile, targetFile, sourceToTarget, targetToSource}}, each table an
   * object keyed by line, then by column.
   */
  public String toJson() {
    ObjectNode root = MAPPER.createObjectNode();
    root.put("sourceFile", sourceFile);
    root.put("targetFile", targetFile);
    root.set("sourceToTarget", tableToJson(sourceToTarget));
    root.set("targetToSource", tableToJson(targetToSource));
    try {
      return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(root);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("cannot serialize source map", ex);
    }
  }

  private static ObjectNode tableToJson(TreeBasedTable<Integer, Integer, Position> table) {
    ObjectNode lines = MAPPER.createObjectNode();
    for (Map.Entry<Integer, Map<Integer, Position>> row : table.rowMap().entrySet()) {
      ObjectNode columns = lines.putObject(row.getKey().toString());
      for (Map.Entry<Integer, Position> cell : row.getValue().entrySet()) {
        columns
            .putObject(cell.getKey().toString())
            .put("line", cell.getValue().line())
            .put("column", cell.getValue().column());
      }
    }
    return lines;
  }

  /** Reads a map written by {@link #toJson()}. The result is sealed. */
  public static SourceMap fromJson(String json) throws IOException {
    JsonNode root = MAPPER.readTree(json);
    if (root == null || !root.isObject()) {
      throw new IOException("source map must be a JSON object");
    }
    SourceMap map = new SourceMap();
    map.setFiles(root.path("sourceFile").asText(""), root.path("targetFile").asText(""));
    tableFromJson(root.path("sourceToTarget"), map.sourceToTarget);
    tableFromJson(root.path("targetToSource"), map.targetToSource);
    map.seal();
    return map;
  }

  private static void tableFromJson(
      JsonNode lines, TreeBasedTable<Integer, Integer, Position> table) throws IOException {
    for (Iterator<Map.Entry<String, JsonNode>> rows = lines.fields(); rows.hasNext(); ) {
      Map.Entry<String, JsonNode> row = rows.next();
      int line = parseKey(row.getKey());
      for (Iterator<Map.Entry<String, JsonNode>> cells = row.getValue().fields();
          cells.hasNext(); ) {
        Map.Entry<String, JsonNode> cell = cells.next();
        JsonNode pos = cell.getValue();
        if (!pos.path("line").canConvertToInt() || !pos.path("column").canConvertToInt()) {
          throw new IOException("invalid position at " + row.getKey() + ":" + cell.getKey());
        }
        table.put(
            line,
            parseKey(cell.getKey()),
            Position.of(pos.path("line").asInt(), pos.path("column").asInt()));
      }
    }
  }

  private static int parseKey(String key) throws IOException {
    try {
      return Integer.parseInt(key);
    } catch (NumberFormatException ex) {
      throw new IOException("invalid source map key: " + key, ex);
    }
  }
}
