package gox;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Splits a {@code .gox} file into tokens, switching between host code and markup.
 *
 * <p>Stateful and single use: call {@link #nextToken()} until it returns {@link Kind#EOF}. The
 * lexer never fails; malformed input degrades into best-effort tokens (and {@link Kind#ERROR} for
 * characters that fit nowhere), leaving all checking to the {@link Parser}.
 */
public class Lexer {

  public enum Kind {
    EOF,
    ERROR,
    HOST_CODE,
    /** {@code <} or {@code </}. */
    TAG_OPEN,
    TAG_CLOSE,
    SLASH,
    TAG_NAME,
    ATTR_NAME,
    EQUALS,
    STRING,
    SPREAD,
    TEXT,
    EXPRESSION,
    FRAGMENT_OPEN,
    FRAGMENT_CLOSE,
  }

  /** A position in the input. Lines and columns are 1-indexed; columns count UTF-16 units. */
  @AutoValue
  public abstract static class Pos implements Comparable<Pos> {
    private static final Pos START = of(0, 1, 1);

    public static Pos start() {
      return START;
    }

    public static Pos of(int offset, int line, int column) {
      Preconditions.checkArgument(offset >= 0 && line >= 1 && column >= 1);
      return new AutoValue_Lexer_Pos(offset, line, column);
    }

    public abstract int offset();

    public abstract int line();

    public abstract int column();

    /** The position reached after reading {@code text} starting here. */
    public Pos advance(CharSequence text) {
      int line = line();
      int column = column();
      for (int i = 0; i < text.length(); i++) {
        if (text.charAt(i) == '\n') {
          line++;
          column = 1;
        } else {
          column++;
        }
      }
      return of(offset() + text.length(), line, column);
    }

    @Override
    public int compareTo(Pos pos) {
      return Integer.compare(offset(), pos.offset());
    }
  }

  @AutoValue
  public abstract static class Token {
    public static Token of(Kind kind, String text, Pos start, Pos end) {
      return new AutoValue_Lexer_Token(kind, text, start, end);
    }

    public abstract Kind kind();

    /**
     * The token's value: raw code for host code and text, the contents without delimiters for
     * strings and expressions, the punctuation itself otherwise.
     */
    public abstract String text();

    public abstract Pos start();

    public abstract Pos end();

    public boolean is(Kind kind, String text) {
      return kind() == kind && text().equals(text);
    }

    @Override
    public final String toString() {
      String text = text();
      if (text.length() > 20) {
        text = text.substring(0, 20) + "...";
      }
      return kind() + "(\"" + text + "\")";
    }
  }

  private enum Mode {
    HOST_CODE,
    MARKUP,
  }

  // Exists only while in markup mode.
  private static final class MarkupState {
    int depth;
    boolean inTag;
    boolean inClosingTag;
    boolean sawSlash;
    boolean needTagName;
  }

  private final String input;
  private final MarkupScanner.Spans spans;

  private int offset = 0;
  private int line = 1;
  private int column = 1;

  private Mode mode = Mode.HOST_CODE;
  private MarkupState markup = null;

  public Lexer(String input) {
    this.input = input;
    this.spans = new MarkupScanner.Spans(input);
  }

  public ImmutableList<Token> tokenize() {
    ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    Token token;
    do {
      token = nextToken();
      tokens.add(token);
    } while (token.kind() != Kind.EOF);
    return tokens.build();
  }

  public Token nextToken() {
    if (mode == Mode.MARKUP) {
      return lexMarkup();
    }
    return lexHostCode();
  }

  private Pos here() {
    return Pos.of(offset, line, column);
  }

  private boolean atEnd() {
    return offset >= input.length();
  }

  private char peek(int ahead) {
    int i = offset + ahead;
    return i < input.length() ? input.charAt(i) : '\0';
  }

  private void advanceTo(int target) {
    for (; offset < target && offset < input.length(); offset++) {
      if (input.charAt(offset) == '\n') {
        line++;
        column = 1;
      } else {
        column++;
      }
    }
  }

  private void advance(int count) {
    advanceTo(offset + count);
  }

  private Token tokenFrom(Kind kind, Pos start) {
    return Token.of(kind, input.substring(start.offset(), offset), start, here());
  }

  private Token lexHostCode() {
    Pos start = here();
    while (!atEnd()) {
      if (MarkupScanner.isMarkupStart(input, offset)) {
        if (offset > start.offset()) {
          break;
        }
        mode = Mode.MARKUP;
        markup = new MarkupState();
        return lexTagOpen();
      }
      int skipped = MarkupScanner.skipLiteralOrComment(input, offset, true);
      advanceTo(skipped == offset ? offset + 1 : skipped);
    }
    if (offset == start.offset()) {
      return tokenFrom(Kind.EOF, start);
    }
    return tokenFrom(Kind.HOST_CODE, start);
  }

  private void leaveMarkupIfClosed() {
    if (markup.depth <= 0) {
      mode = Mode.HOST_CODE;
      markup = null;
    }
  }

  private Token lexMarkup() {
    if (markup.inTag) {
      while (!atEnd() && Character.isWhitespace(peek(0))) {
        advance(1);
      }
    }
    Pos start = here();
    if (atEnd()) {
      return tokenFrom(Kind.EOF, start);
    }

    char ch = peek(0);
    if (ch == '{') {
      return lexExpression();
    }
    if (ch == '}') {
      advance(1);
      return tokenFrom(Kind.ERROR, start);
    }
    if (!markup.inTag) {
      if (MarkupScanner.isMarkupStart(input, offset)) {
        return lexTagOpen();
      }
      return lexText();
    }

    switch (ch) {
      case '>':
        {
          advance(1);
          boolean closesElement = markup.inClosingTag || markup.sawSlash;
          markup.inTag = false;
          markup.inClosingTag = false;
          markup.sawSlash = false;
          markup.needTagName = false;
          if (closesElement) {
            markup.depth--;
            leaveMarkupIfClosed();
          }
          return tokenFrom(Kind.TAG_CLOSE, start);
        }
      case '/':
        advance(1);
        markup.sawSlash = true;
        return tokenFrom(Kind.SLASH, start);
      case '=':
        advance(1);
        return tokenFrom(Kind.EQUALS, start);
      case '"':
      case '\'':
        return lexString(ch);
      case '.':
        if (peek(1) == '.' && peek(2) == '.') {
          advance(3);
          return tokenFrom(Kind.SPREAD, start);
        }
        break;
      default:
        if (MarkupScanner.isIdentStart(input.codePointAt(offset))) {
          return lexIdentifier();
        }
    }

    advance(Character.charCount(input.codePointAt(offset)));
    return tokenFrom(Kind.ERROR, start);
  }

  // At a markup start ('<' of a tag, closing tag or fragment).
  private Token lexTagOpen() {
    Pos start = here();
    if (peek(1) == '>') {
      advance(2);
      markup.depth++;
      return tokenFrom(Kind.FRAGMENT_OPEN, start);
    }
    if (peek(1) == '/') {
      if (peek(2) == '>') {
        advance(3);
        markup.depth--;
        Token token = tokenFrom(Kind.FRAGMENT_CLOSE, start);
        leaveMarkupIfClosed();
        return token;
      }
      advance(2);
      markup.inTag = true;
      markup.inClosingTag = true;
      markup.needTagName = true;
      return tokenFrom(Kind.TAG_OPEN, start);
    }
    advance(1);
    markup.inTag = true;
    markup.needTagName = true;
    markup.depth++;
    return tokenFrom(Kind.TAG_OPEN, start);
  }

  private Token lexIdentifier() {
    Pos start = here();
    while (!atEnd() && MarkupScanner.isIdentPart(input.codePointAt(offset))) {
      advance(Character.charCount(input.codePointAt(offset)));
    }
    Kind kind = markup.needTagName ? Kind.TAG_NAME : Kind.ATTR_NAME;
    markup.needTagName = false;
    return tokenFrom(kind, start);
  }

  private Token lexString(char quote) {
    Pos start = here();
    int end = MarkupScanner.skipQuoted(input, offset, quote, true);
    boolean terminated = end > offset + 1 && input.charAt(end - 1) == quote;
    advanceTo(end);
    String value = input.substring(start.offset() + 1, terminated ? end - 1 : end);
    return Token.of(Kind.STRING, value, start, here());
  }

  private Token lexExpression() {
    Pos start = here();
    int end = spans.braceEnd(offset);
    String value;
    if (end < 0) {
      value = input.substring(offset + 1);
      advanceTo(input.length());
    } else {
      value = input.substring(offset + 1, end - 1);
      advanceTo(end);
    }
    return Token.of(Kind.EXPRESSION, value, start, here());
  }

  private Token lexText() {
    Pos start = here();
    do {
      advance(1);
    } while (!atEnd()
        && peek(0) != '{'
        && peek(0) != '}'
        && !MarkupScanner.isMarkupStart(input, offset));
    return tokenFrom(Kind.TEXT, start);
  }
}
