package gox;

import java.util.List;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import gox.processor.ASTChild;
import gox.processor.ASTNode;

/** The document tree of one {@code .gox} file: host code interleaved with markup trees. */
@ASTNode
public class AST implements AST_ASTNode {

  @AutoValue
  public abstract static class Range {
    public static Range of(Lexer.Pos start, Lexer.Pos end) {
      Preconditions.checkArgument(start.compareTo(end) <= 0, "range ends before it starts");
      return new AutoValue_AST_Range(start, end);
    }

    public abstract Lexer.Pos start();

    public abstract Lexer.Pos end();

    public boolean contains(Range range) {
      return start().compareTo(range.start()) <= 0 && end().compareTo(range.end()) >= 0;
    }
  }

  /** A top-level entry: {@link HostCode}, {@link Element} or {@link Fragment}. */
  public interface Node extends ASTNodeInterface {
    Range range();
  }

  /** Content of an element or fragment: {@link Text}, {@link Expression}, or nested markup. */
  public interface Child extends ASTNodeInterface {
    Range range();
  }

  /** {@link StringAttribute}, {@link ExpressionAttribute} or {@link SpreadAttribute}. */
  public interface Attribute extends ASTNodeInterface {
    Range range();
  }

  private final String file;
  private final ImmutableList<Node> nodes;

  public AST(String file, List<Node> nodes) {
    this.file = file;
    this.nodes = ImmutableList.copyOf(nodes);
  }

  public String file() {
    return file;
  }

  @ASTChild
  @Override
  public ImmutableList<Node> nodes() {
    return nodes;
  }

  /** Verbatim host-language source. */
  @ASTNode
  public static class HostCode implements AST_HostCode_ASTNode, Node {
    private final String code;
    private final Range range;

    public HostCode(String code, Range range) {
      this.code = code;
      this.range = range;
    }

    public String code() {
      return code;
    }

    @Override
    public Range range() {
      return range;
    }
  }

  @ASTNode
  public static class Element implements AST_Element_ASTNode, Node, Child {
    private final String tagName;
    private final ImmutableList<Attribute> attributes;
    private final ImmutableList<Child> children;
    private final boolean selfClosing;
    private final Range range;

    public Element(
        String tagName,
        List<Attribute> attributes,
        List<Child> children,
        boolean selfClosing,
        Range range) {
      Preconditions.checkArgument(!tagName.isEmpty(), "empty tag name");
      Preconditions.checkArgument(
          !selfClosing || children.isEmpty(), "self-closing <%s> has children", tagName);
      this.tagName = tagName;
      this.attributes = ImmutableList.copyOf(attributes);
      this.children = ImmutableList.copyOf(children);
      this.selfClosing = selfClosing;
      this.range = range;
    }

    public String tagName() {
      return tagName;
    }

    /** Components start with an upper-case letter and compile to a direct call. */
    public boolean isComponent() {
      return Character.isUpperCase(tagName.codePointAt(0));
    }

    @ASTChild
    @Override
    public ImmutableList<Attribute> attributes() {
      return attributes;
    }

    @ASTChild
    @Override
    public ImmutableList<Child> children() {
      return children;
    }

    public boolean selfClosing() {
      return selfClosing;
    }

    @Override
    public Range range() {
      return range;
    }
  }

  @ASTNode
  public static class Fragment implements AST_Fragment_ASTNode, Node, Child {
    private final ImmutableList<Child> children;
    private final Range range;

    public Fragment(List<Child> children, Range range) {
      this.children = ImmutableList.copyOf(children);
      this.range = range;
    }

    @ASTChild
    @Override
    public ImmutableList<Child> children() {
      return children;
    }

    @Override
    public Range range() {
      return range;
    }
  }

  @ASTNode
  public static class Text implements AST_Text_ASTNode, Child {
    private final String text;
    private final Range range;

    public Text(String text, Range range) {
      this.text = text;
      this.range = range;
    }

    /** The raw run, whitespace included. */
    public String text() {
      return text;
    }

    public boolean isBlank() {
      return text.trim().isEmpty();
    }

    @Override
    public Range range() {
      return range;
    }
  }

  /** A braced host expression in child position; the range includes the braces. */
  @ASTNode
  public static class Expression implements AST_Expression_ASTNode, Child {
    private final String expression;
    private final Lexer.Pos expressionStart;
    private final Range range;

    public Expression(String expression, Lexer.Pos expressionStart, Range range) {
      this.expression = expression;
      this.expressionStart = expressionStart;
      this.range = range;
    }

    /** The expression with surrounding whitespace removed. */
    public String expression() {
      return expression;
    }

    /** Where {@link #expression()} starts in the file. */
    public Lexer.Pos expressionStart() {
      return expressionStart;
    }

    public boolean isCommentOnly() {
      return MarkupScanner.stripComments(expression).trim().isEmpty();
    }

    @Override
    public Range range() {
      return range;
    }
  }

  /** {@code key="value"}; the value is kept raw, without escape processing. */
  @ASTNode
  public static class StringAttribute implements AST_StringAttribute_ASTNode, Attribute {
    private final String key;
    private final String value;
    private final Range range;

    public StringAttribute(String key, String value, Range range) {
      this.key = key;
      this.value = value;
      this.range = range;
    }

    public String key() {
      return key;
    }

    public String value() {
      return value;
    }

    @Override
    public Range range() {
      return range;
    }
  }

  /** {@code key={expression}}, or a bare {@code key} whose expression is {@code true}. */
  @ASTNode
  public static class ExpressionAttribute implements AST_ExpressionAttribute_ASTNode, Attribute {
    private final String key;
    private final String expression;
    private final Optional<Lexer.Pos> expressionStart;
    private final Range range;

    public ExpressionAttribute(
        String key, String expression, Optional<Lexer.Pos> expressionStart, Range range) {
      this.key = key;
      this.expression = expression;
      this.expressionStart = expressionStart;
      this.range = range;
    }

    public static ExpressionAttribute bool(String key, Range range) {
      return new ExpressionAttribute(key, "true", Optional.empty(), range);
    }

    public String key() {
      return key;
    }

    public String expression() {
      return expression;
    }

    /** Empty for boolean attributes, whose expression does not appear in the file. */
    public Optional<Lexer.Pos> expressionStart() {
      return expressionStart;
    }

    @Override
    public Range range() {
      return range;
    }
  }

  /** <code>{...expression}</code> in an attribute list. */
  @ASTNode
  public static class SpreadAttribute implements AST_SpreadAttribute_ASTNode, Attribute {
    private final String expression;
    private final Lexer.Pos expressionStart;
    private final Range range;

    public SpreadAttribute(String expression, Lexer.Pos expressionStart, Range range) {
      this.expression = expression;
      this.expressionStart = expressionStart;
      this.range = range;
    }

    public String expression() {
      return expression;
    }

    public Lexer.Pos expressionStart() {
      return expressionStart;
    }

    @Override
    public Range range() {
      return range;
    }
  }
}
