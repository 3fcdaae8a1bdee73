package gox;

/** Canonical formatting for generated Go source. */
public interface SourceFormatter {
  String format(String source) throws FormatterException;

  /** Returns sources unchanged. */
  static SourceFormatter identity() {
    return source -> source;
  }
}
