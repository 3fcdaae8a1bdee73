package gox;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/**
 * Recursive-descent parser over the {@link Lexer} token stream.
 *
 * <p>Errors never abort the parse. Each one is recorded and the offending token skipped, so the
 * result always carries a (possibly partial) tree.
 */
public class Parser {

  @AutoValue
  public abstract static class ParseResult {
    static ParseResult of(AST ast, List<CompilerException> errors) {
      return new AutoValue_Parser_ParseResult(ast, ImmutableList.copyOf(errors));
    }

    public abstract AST ast();

    public abstract ImmutableList<CompilerException> errors();

    public Optional<CompilerException> firstError() {
      return errors().stream().findFirst();
    }

    /** The tree, or the first recorded error if there was any. */
    public AST astOrThrow() throws CompilerException {
      if (!errors().isEmpty()) {
        throw errors().get(0);
      }
      return ast();
    }
  }

  public static ParseResult parse(String file, String source) {
    return new Parser(file, source).parse();
  }

  private final String file;
  private final Lexer lexer;
  private final List<CompilerException> errors = new ArrayList<>();

  private Lexer.Token tok;
  private Lexer.Pos prevEnd = Lexer.Pos.start();

  private Parser(String file, String source) {
    this.file = file;
    this.lexer = new Lexer(source);
    this.tok = lexer.nextToken();
  }

  private ParseResult parse() {
    List<AST.Node> nodes = new ArrayList<>();
    while (tok.kind() != Lexer.Kind.EOF) {
      parseNode().ifPresent(nodes::add);
    }
    return ParseResult.of(new AST(file, nodes), errors);
  }

  private void advance() {
    prevEnd = tok.end();
    tok = lexer.nextToken();
  }

  private void error(String msg) {
    errors.add(new CompilerException(file, tok.start(), msg));
  }

  private AST.Range tokenRange() {
    return AST.Range.of(tok.start(), tok.end());
  }

  private AST.Range rangeFrom(Lexer.Pos start) {
    return AST.Range.of(start, prevEnd);
  }

  private boolean isClosingTag() {
    return tok.is(Lexer.Kind.TAG_OPEN, "</");
  }

  private Optional<AST.Node> parseNode() {
    switch (tok.kind()) {
      case HOST_CODE:
        {
          AST.HostCode code = new AST.HostCode(tok.text(), tokenRange());
          advance();
          return Optional.of(code);
        }
      case TAG_OPEN:
        if (!isClosingTag()) {
          return parseElement().map(AST.Node.class::cast);
        }
        break;
      case FRAGMENT_OPEN:
        return Optional.of(parseFragment());
      default:
        break;
    }
    error("unexpected token: " + tok);
    advance();
    return Optional.empty();
  }

  // At the '<' of an opening tag.
  private Optional<AST.Element> parseElement() {
    Lexer.Pos start = tok.start();
    advance();

    if (tok.kind() != Lexer.Kind.TAG_NAME) {
      error("expected tag name, got " + tok);
      return Optional.empty();
    }
    String tagName = tok.text();
    advance();

    List<AST.Attribute> attributes = parseAttributes();

    if (tok.kind() == Lexer.Kind.SLASH) {
      advance();
      if (tok.kind() == Lexer.Kind.TAG_CLOSE) {
        advance();
      } else {
        error("expected '>' after '/', got " + tok);
      }
      return Optional.of(
          new AST.Element(tagName, attributes, ImmutableList.of(), true, rangeFrom(start)));
    }

    if (tok.kind() != Lexer.Kind.TAG_CLOSE) {
      error("expected '>' or '/>', got " + tok);
      return Optional.of(
          new AST.Element(tagName, attributes, ImmutableList.of(), false, rangeFrom(start)));
    }
    advance();

    List<AST.Child> children = parseChildren();

    if (isClosingTag()) {
      advance();
      if (tok.kind() == Lexer.Kind.TAG_NAME) {
        if (!tok.text().equals(tagName)) {
          error(
              String.format(
                  "mismatched closing tag: expected </%s>, got </%s>", tagName, tok.text()));
        }
        advance();
      }
      if (tok.kind() == Lexer.Kind.TAG_CLOSE) {
        advance();
      }
    } else {
      error(String.format("unclosed element: expected </%s>, got %s", tagName, tok));
    }

    return Optional.of(new AST.Element(tagName, attributes, children, false, rangeFrom(start)));
  }

  // At '<>'.
  private AST.Fragment parseFragment() {
    Lexer.Pos start = tok.start();
    advance();

    List<AST.Child> children = parseChildren();

    if (tok.kind() == Lexer.Kind.FRAGMENT_CLOSE) {
      advance();
    } else {
      error("unclosed fragment: expected </>, got " + tok);
    }
    return new AST.Fragment(children, rangeFrom(start));
  }

  private List<AST.Attribute> parseAttributes() {
    List<AST.Attribute> attributes = new ArrayList<>();
    while (true) {
      switch (tok.kind()) {
        case TAG_CLOSE:
        case SLASH:
        case EOF:
          return attributes;
        case ATTR_NAME:
          parseAttribute().ifPresent(attributes::add);
          break;
        case EXPRESSION:
          parseSpread().ifPresent(attributes::add);
          advance();
          break;
        default:
          error("unexpected token in attributes: " + tok);
          advance();
      }
    }
  }

  private Optional<AST.Attribute> parseSpread() {
    String raw = tok.text();
    int dots = leadingBlanks(raw);
    String expression =
        raw.startsWith("...", dots) ? raw.substring(dots + 3).trim() : "";
    if (expression.isEmpty()) {
      error("expected spread expression, got {" + raw + "}");
      return Optional.empty();
    }
    int leading = dots + 3 + leadingBlanks(raw.substring(dots + 3));
    Lexer.Pos expressionStart = tok.start().advance("{" + raw.substring(0, leading));
    return Optional.of(new AST.SpreadAttribute(expression, expressionStart, tokenRange()));
  }

  // At an attribute name.
  private Optional<AST.Attribute> parseAttribute() {
    String key = tok.text();
    Lexer.Pos start = tok.start();
    advance();

    if (tok.kind() != Lexer.Kind.EQUALS) {
      return Optional.of(AST.ExpressionAttribute.bool(key, rangeFrom(start)));
    }
    advance();

    switch (tok.kind()) {
      case STRING:
        {
          AST.StringAttribute attribute =
              new AST.StringAttribute(key, tok.text(), AST.Range.of(start, tok.end()));
          advance();
          return Optional.of(attribute);
        }
      case EXPRESSION:
        {
          AST.ExpressionAttribute attribute =
              new AST.ExpressionAttribute(
                  key,
                  tok.text().trim(),
                  Optional.of(expressionStart(tok)),
                  AST.Range.of(start, tok.end()));
          advance();
          return Optional.of(attribute);
        }
      default:
        error("expected string or expression for attribute value, got " + tok);
        return Optional.empty();
    }
  }

  // Position of the first non-blank character inside an expression token's braces.
  private static Lexer.Pos expressionStart(Lexer.Token token) {
    String raw = token.text();
    return token.start().advance("{" + raw.substring(0, leadingBlanks(raw)));
  }

  // Counts what String.trim() would strip from the front.
  private static int leadingBlanks(String s) {
    int i = 0;
    while (i < s.length() && s.charAt(i) <= ' ') {
      i++;
    }
    return i;
  }

  private List<AST.Child> parseChildren() {
    List<AST.Child> children = new ArrayList<>();
    while (true) {
      switch (tok.kind()) {
        case EOF:
        case FRAGMENT_CLOSE:
          return children;
        case TAG_OPEN:
          if (isClosingTag()) {
            return children;
          }
          parseElement().ifPresent(children::add);
          break;
        case FRAGMENT_OPEN:
          children.add(parseFragment());
          break;
        case TEXT:
          children.add(new AST.Text(tok.text(), tokenRange()));
          advance();
          break;
        case EXPRESSION:
          children.add(
              new AST.Expression(tok.text().trim(), expressionStart(tok), tokenRange()));
          advance();
          break;
        default:
          error("unexpected token in children: " + tok);
          advance();
      }
    }
  }
}
