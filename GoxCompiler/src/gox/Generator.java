package gox;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.lang.model.SourceVersion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/**
 * Turns a parsed {@link AST} into Go source plus a {@link SourceMap}.
 *
 * <p>Markup becomes calls into the runtime package: intrinsic elements ({@code <div>}) call
 * {@code gox.Element("div", props, children...)}, components ({@code <Button>}) call {@code
 * Button(ButtonProps{...}, children...)}. Host code is copied through and mapped character by
 * character. A generator instance is single use.
 */
public final class Generator {
  private static final Logger log = LoggerFactory.getLogger(Generator.class);

  public static final String DEFAULT_RUNTIME_PACKAGE = "github.com/germtb/gox";
  public static final String DEFAULT_RUNTIME_QUALIFIER = "gox";

  private static final Pattern PACKAGE_LINE = Pattern.compile("(?m)^package\\s+\\w+[^\\n]*");
  private static final Pattern IMPORT_DECL = Pattern.compile("(?m)^import\\b");

  @AutoValue
  public abstract static class Options {
    public static Builder builder() {
      return new AutoValue_Generator_Options.Builder()
          .setRuntimePackage(DEFAULT_RUNTIME_PACKAGE)
          .setRuntimeQualifier(DEFAULT_RUNTIME_QUALIFIER)
          .setFormatter(new GofmtFormatter());
    }

    public static Options defaults() {
      return builder().build();
    }

    /** Import path of the runtime library. */
    public abstract String runtimePackage();

    /** Identifier the generated code uses to call into the runtime library. */
    public abstract String runtimeQualifier();

    public abstract SourceFormatter formatter();

    public abstract Builder toBuilder();

    /** The import spec for the runtime, aliased when the qualifier is not the path's last part. */
    String importSpec() {
      String quoted = GoLiterals.quote(runtimePackage());
      String lastSegment =
          runtimePackage().substring(runtimePackage().lastIndexOf('/') + 1);
      return lastSegment.equals(runtimeQualifier()) ? quoted : runtimeQualifier() + " " + quoted;
    }

    @AutoValue.Builder
    public abstract static class Builder {
      public abstract Builder setRuntimePackage(String runtimePackage);

      public abstract Builder setRuntimeQualifier(String runtimeQualifier);

      public abstract Builder setFormatter(SourceFormatter formatter);

      abstract Options autoBuild();

      public Options build() {
        Options options = autoBuild();
        Preconditions.checkArgument(
            !options.runtimePackage().isEmpty(), "runtime package must not be empty");
        Preconditions.checkArgument(
            SourceVersion.isIdentifier(options.runtimeQualifier()),
            "runtime qualifier is not an identifier: %s",
            options.runtimeQualifier());
        return options;
      }
    }
  }

  @AutoValue
  public abstract static class GeneratedFile {
    static GeneratedFile of(String source, SourceMap sourceMap) {
      return new AutoValue_Generator_GeneratedFile(source, sourceMap);
    }

    public abstract String source();

    public abstract SourceMap sourceMap();
  }

  private final Options options;
  private final String qualifier;
  private final StringBuilder out = new StringBuilder();
  private final SourceMap sourceMap = new SourceMap();

  // Cursor in the output, 0-indexed.
  private int outLine = 0;
  private int outColumn = 0;

  private boolean used = false;

  public Generator(Options options) {
    this.options = options;
    this.qualifier = options.runtimeQualifier() + ".";
  }

  public GeneratedFile generate(AST ast) {
    return generate(ast, "", "");
  }

  /** Generates {@code ast}, recording the file names in the source map before it is sealed. */
  public GeneratedFile generate(AST ast, String sourceFile, String targetFile) {
    Preconditions.checkState(!used, "a Generator can only be used once");
    used = true;
    sourceMap.setFiles(sourceFile, targetFile);

    boolean hasMarkup = MarkupDetector.containsMarkup(ast);
    ast.accept(new NodeWriter(), null);
    String code = out.toString();

    if (hasMarkup) {
      code = format(insertRuntimeImport(code));
    } else if (startsWithPackageClause(code)) {
      code = format(code);
    } else {
      code = normalizeWhitespace(code);
    }
    sourceMap.seal();
    return GeneratedFile.of(code, sourceMap);
  }

  private String format(String code) {
    try {
      return options.formatter().format(code);
    } catch (FormatterException ex) {
      log.warn("Formatting generated code failed, keeping it unformatted: {}", ex.getMessage());
      return code;
    }
  }

  private static boolean startsWithPackageClause(String code) {
    return findPackageClause(code).isPresent();
  }

  /** Matches the package clause, which may only follow whitespace and comments. */
  private static Optional<Matcher> findPackageClause(String code) {
    int i = 0;
    while (i < code.length()) {
      int skipped = i;
      if (Character.isWhitespace(code.charAt(i))) {
        skipped = i + 1;
      } else if (code.charAt(i) == '/') {
        skipped = MarkupScanner.skipLiteralOrComment(code, i, true);
      }
      if (skipped == i) {
        break;
      }
      i = skipped;
    }
    Matcher pkg = PACKAGE_LINE.matcher(code);
    pkg.region(i, code.length());
    return pkg.lookingAt() ? Optional.of(pkg) : Optional.empty();
  }

  // Partial snippets keep their indentation; only line endings and trailing blanks change.
  private static String normalizeWhitespace(String code) {
    List<String> lines = new ArrayList<>();
    for (String line : Splitter.on('\n').split(code.replace("\r\n", "\n"))) {
      lines.add(CharMatcher.whitespace().trimTrailingFrom(line));
    }
    return String.join("\n", lines);
  }

  private String insertRuntimeImport(String code) {
    if (code.contains(GoLiterals.quote(options.runtimePackage()))) {
      return code;
    }
    Optional<Matcher> clause = findPackageClause(code);
    if (!clause.isPresent()) {
      log.debug("No package clause; not adding an import for {}", options.runtimePackage());
      return code;
    }
    Matcher pkg = clause.get();
    if (pkg.end() == code.length()) {
      code = code + "\n";
    }
    int afterPackage = pkg.end() + 1;
    int packageLine = lineOf(code, pkg.start());
    String spec = options.importSpec();

    Matcher imports = IMPORT_DECL.matcher(code);
    // Imports must directly follow the package clause.
    if (imports.find(afterPackage)
        && MarkupScanner.stripComments(code.substring(afterPackage, imports.start()))
            .trim()
            .isEmpty()) {
      int importPos = imports.start();
      int importLine = lineOf(code, importPos);
      int afterKeyword = imports.end();
      String rest = code.substring(afterKeyword);
      String restTrimmed = rest.stripLeading();
      if (restTrimmed.startsWith("(")) {
        int paren = afterKeyword + (rest.length() - restTrimmed.length()) + 1;
        sourceMap.shiftTargetLines(lineOf(code, paren) + 1, 1);
        return code.substring(0, paren) + "\n\t" + spec + code.substring(paren);
      }
      int lineEnd = code.indexOf('\n', afterKeyword);
      if (lineEnd < 0) {
        lineEnd = code.length();
      }
      String single = code.substring(afterKeyword, lineEnd).trim();
      int singleStart = afterKeyword;
      while (singleStart < lineEnd && Character.isWhitespace(code.charAt(singleStart))) {
        singleStart++;
      }
      sourceMap.shiftTargetLines(importLine + 1, 3);
      // The old import path moves into the block, two lines down after a tab.
      sourceMap.moveTargetColumns(importLine, singleStart - importPos, importLine + 2, 1);
      return code.substring(0, importPos)
          + "import (\n\t"
          + spec
          + "\n\t"
          + single
          + "\n)"
          + code.substring(lineEnd);
    }

    sourceMap.shiftTargetLines(packageLine + 1, 2);
    return code.substring(0, afterPackage)
        + "\nimport "
        + spec
        + "\n"
        + code.substring(afterPackage);
  }

  private static int lineOf(String code, int index) {
    return CharMatcher.is('\n').countIn(code.subSequence(0, index));
  }

  private void write(String s) {
    out.append(s);
    for (int i = 0; i < s.length(); i++) {
      if (s.charAt(i) == '\n') {
        outLine++;
        outColumn = 0;
      } else {
        outColumn++;
      }
    }
  }

  private SourceMap.Position cursor() {
    return SourceMap.Position.of(outLine, outColumn);
  }

  private static SourceMap.Position toSourceMap(Lexer.Pos pos) {
    return SourceMap.Position.of(pos.line() - 1, pos.column() - 1);
  }

  private void writeMapped(String s, Lexer.Pos sourceStart) {
    sourceMap.addExpression(s, toSourceMap(sourceStart), cursor());
    write(s);
  }

  private void mapStart(AST.Range range) {
    SourceMap.Position source = toSourceMap(range.start());
    sourceMap.addMapping(source.line(), source.column(), outLine, outColumn);
  }

  /** Writes host expression code, expanding nested markup; verbatim code is mapped. */
  private void writeExpression(String code, Optional<Lexer.Pos> sourceStart) {
    String expanded = expandMarkup(code);
    if (expanded.equals(code) && sourceStart.isPresent()) {
      writeMapped(code, sourceStart.get());
    } else {
      write(expanded);
    }
  }

  /** Replaces each markup tree inside {@code code} with its generated Go. */
  private String expandMarkup(String code) {
    MarkupScanner.Spans spans = new MarkupScanner.Spans(code);
    StringBuilder result = new StringBuilder();
    int copied = 0;
    int i = 0;
    while (i < code.length()) {
      int skipped = MarkupScanner.skipLiteralOrComment(code, i, true);
      if (skipped != i) {
        i = skipped;
        continue;
      }
      if (MarkupScanner.isOpeningMarkupStart(code, i)) {
        int end = spans.markupEnd(i);
        if (end > 0) {
          Optional<String> generated = generateNested(code.substring(i, end));
          if (generated.isPresent()) {
            result.append(code, copied, i).append(generated.get());
            copied = end;
          }
          i = end;
          continue;
        }
      }
      i++;
    }
    return result.append(code, copied, code.length()).toString();
  }

  private Optional<String> generateNested(String markup) {
    Parser.ParseResult parsed = Parser.parse("<expr>", markup);
    if (!parsed.errors().isEmpty() || parsed.ast().nodes().isEmpty()) {
      log.debug(
          "Leaving unparseable markup in expression as is: {}",
          parsed.firstError().map(Throwable::getMessage).orElse(markup));
      return Optional.empty();
    }
    Generator nested = new Generator(options);
    parsed.ast().accept(nested.new NodeWriter(), null);
    return Optional.of(nested.out.toString());
  }

  private static boolean isDropped(AST.Child child) {
    if (child instanceof AST.Text) {
      return ((AST.Text) child).isBlank();
    }
    if (child instanceof AST.Expression) {
      return ((AST.Expression) child).isCommentOnly();
    }
    return false;
  }

  private static ImmutableList<AST.Child> emittedChildren(List<AST.Child> children) {
    return children.stream().filter(c -> !isDropped(c)).collect(ImmutableList.toImmutableList());
  }

  /**
   * Index of the {@code &&} that splits {@code cond && node}: the last one outside brackets,
   * literals and markup, or -1.
   */
  static int conditionalSplit(String code) {
    MarkupScanner.Spans spans = new MarkupScanner.Spans(code);
    int depth = 0;
    int split = -1;
    int i = 0;
    while (i < code.length()) {
      int skipped = MarkupScanner.skipLiteralOrComment(code, i, true);
      if (skipped != i) {
        i = skipped;
        continue;
      }
      if (MarkupScanner.isOpeningMarkupStart(code, i)) {
        int end = spans.markupEnd(i);
        if (end > 0) {
          i = end;
          continue;
        }
      }
      char c = code.charAt(i);
      if (c == '(' || c == '[' || c == '{') {
        depth++;
      } else if (c == ')' || c == ']' || c == '}') {
        depth--;
      } else if (depth == 0 && code.startsWith("&&", i)) {
        split = i;
        i += 2;
        continue;
      }
      i++;
    }
    return split;
  }

  /** Writes host code and markup nodes. */
  private final class NodeWriter extends VoidDefaultASTVisitor {
    @Override
    public void visitImpl(AST.HostCode node) {
      writeMapped(node.code(), node.range().start());
    }

    @Override
    public void visitImpl(AST.Element node) {
      mapStart(node.range());
      if (node.isComponent()) {
        write(node.tagName() + "(");
        writeTypedProps(node);
      } else {
        write(qualifier + "Element(" + GoLiterals.quote(node.tagName()) + ", ");
        writeProps(node.attributes());
      }
      for (AST.Child child : emittedChildren(node.children())) {
        write(",\n");
        child.accept(this, null);
      }
      write(")");
    }

    @Override
    public void visitImpl(AST.Fragment node) {
      mapStart(node.range());
      write(qualifier + "Fragment(");
      boolean first = true;
      for (AST.Child child : emittedChildren(node.children())) {
        if (!first) {
          write(",\n");
        }
        first = false;
        child.accept(this, null);
      }
      write(")");
    }

    @Override
    public void visitImpl(AST.Text node) {
      write(qualifier + "Text(" + GoLiterals.quote(node.text().trim()) + ")");
    }

    @Override
    public void visitImpl(AST.Expression node) {
      String code = node.expression();
      int split = conditionalSplit(code);
      if (split < 0) {
        write(qualifier + "V(");
        writeExpression(code, Optional.of(node.expressionStart()));
        write(")");
        return;
      }

      String condition = code.substring(0, split).trim();
      String rest = code.substring(split + 2);
      int restOffset = split + 2 + (rest.length() - rest.stripLeading().length());
      write(qualifier + "When(");
      writeExpression(condition, Optional.of(node.expressionStart()));
      write(", ");
      writeExpression(
          rest.trim(),
          Optional.of(node.expressionStart().advance(code.substring(0, restOffset))));
      write(")");
    }

    // Spreads have no struct-literal equivalent and are dropped from typed props.
    private void writeTypedProps(AST.Element node) {
      List<AST.Attribute> fields = new ArrayList<>();
      for (AST.Attribute attribute : node.attributes()) {
        if (attribute instanceof AST.SpreadAttribute) {
          log.debug("Dropping spread attribute on component <{}>", node.tagName());
        } else {
          fields.add(attribute);
        }
      }
      write(node.tagName() + "Props{");
      writeAttributes(fields, new PropWriter(true));
      write("}");
    }

    private void writeProps(List<AST.Attribute> attributes) {
      if (attributes.isEmpty()) {
        write("nil");
        return;
      }
      if (attributes.stream().noneMatch(a -> a instanceof AST.SpreadAttribute)) {
        writePropsLiteral(attributes);
        return;
      }

      // Consecutive plain attributes share one literal; order gives later entries precedence.
      write(qualifier + "MergeProps(");
      List<AST.Attribute> batch = new ArrayList<>();
      boolean first = true;
      for (AST.Attribute attribute : attributes) {
        if (!(attribute instanceof AST.SpreadAttribute)) {
          batch.add(attribute);
          continue;
        }
        if (!batch.isEmpty()) {
          first = separate(first);
          writePropsLiteral(batch);
          batch.clear();
        }
        first = separate(first);
        attribute.accept(new PropWriter(false), null);
      }
      if (!batch.isEmpty()) {
        separate(first);
        writePropsLiteral(batch);
      }
      write(")");
    }

    private boolean separate(boolean first) {
      if (!first) {
        write(", ");
      }
      return false;
    }

    private void writePropsLiteral(List<AST.Attribute> attributes) {
      write(qualifier + "Props{");
      writeAttributes(attributes, new PropWriter(false));
      write("}");
    }

    private void writeAttributes(List<AST.Attribute> attributes, PropWriter writer) {
      boolean first = true;
      for (AST.Attribute attribute : attributes) {
        first = separate(first);
        attribute.accept(writer, null);
      }
    }
  }

  /** Writes one attribute as a struct field ({@code typed}) or a props map entry. */
  private final class PropWriter extends VoidDefaultASTVisitor {
    private final boolean typed;

    PropWriter(boolean typed) {
      this.typed = typed;
    }

    private void writeKey(String key) {
      write((typed ? GoLiterals.capitalize(key) : GoLiterals.quote(key)) + ": ");
    }

    @Override
    public void visitImpl(AST.StringAttribute node) {
      writeKey(node.key());
      write(GoLiterals.quote(node.value()));
    }

    @Override
    public void visitImpl(AST.ExpressionAttribute node) {
      writeKey(node.key());
      String code = node.expression();
      if (!typed && code.length() >= 2 && code.startsWith("{") && code.endsWith("}")) {
        write("map[string]any");
      }
      writeExpression(code, node.expressionStart());
    }

    @Override
    public void visitImpl(AST.SpreadAttribute node) {
      writeExpression(node.expression(), Optional.of(node.expressionStart()));
    }
  }
}
