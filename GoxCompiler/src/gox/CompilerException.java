package gox;

/** A syntax error at a position of a {@code .gox} file. */
public class CompilerException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String file;
  private final Lexer.Pos pos;
  private final String errorMsg;

  public CompilerException(String file, Lexer.Pos pos, String errorMsg) {
    super(String.format("%s:%d:%d: %s", file, pos.line(), pos.column(), errorMsg));
    this.file = file;
    this.pos = pos;
    this.errorMsg = errorMsg;
  }

  public String file() {
    return file;
  }

  public Lexer.Pos pos() {
    return pos;
  }

  /** The message without the {@code file:line:col:} prefix. */
  public String errorMsg() {
    return errorMsg;
  }
}
