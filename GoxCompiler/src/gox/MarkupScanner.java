package gox;

import java.util.Arrays;

/**
 * Character-level scanning shared by the lexer and the generator: host literals and comments,
 * balanced braces, and balanced markup spans.
 *
 * <p>All methods work on char indices and never throw for malformed input; unterminated
 * constructs run to the end of the string.
 */
final class MarkupScanner {

  static boolean isIdentStart(int cp) {
    return Character.isLetter(cp) || cp == '_';
  }

  static boolean isIdentPart(int cp) {
    return Character.isLetterOrDigit(cp) || cp == '_' || cp == '-';
  }

  private static boolean identStartAt(String s, int i) {
    return i < s.length() && isIdentStart(s.codePointAt(i));
  }

  private static boolean charAt(String s, int i, char c) {
    return i < s.length() && s.charAt(i) == c;
  }

  /** {@code <tag}, {@code <>}, {@code </>} or {@code </tag}. */
  static boolean isMarkupStart(String s, int i) {
    if (!charAt(s, i, '<')) {
      return false;
    }
    if (charAt(s, i + 1, '/')) {
      return charAt(s, i + 2, '>') || identStartAt(s, i + 2);
    }
    return isOpeningMarkupStart(s, i);
  }

  /** {@code <tag} or {@code <>}: markup that can start a nested tree. */
  static boolean isOpeningMarkupStart(String s, int i) {
    return charAt(s, i, '<') && (charAt(s, i + 1, '>') || identStartAt(s, i + 1));
  }

  /**
   * If a host string, rune or raw string literal, or a comment, starts at {@code i}, returns the
   * index just past it. Otherwise returns {@code i}. Line comments are only recognized when
   * {@code lineComments} is set.
   */
  static int skipLiteralOrComment(String s, int i, boolean lineComments) {
    if (i >= s.length()) {
      return i;
    }
    char c = s.charAt(i);
    switch (c) {
      case '"':
      case '\'':
        return skipQuoted(s, i, c, true);
      case '`':
        return skipQuoted(s, i, '`', false);
      case '/':
        if (charAt(s, i + 1, '*')) {
          int end = s.indexOf("*/", i + 2);
          return end < 0 ? s.length() : end + 2;
        }
        if (lineComments && charAt(s, i + 1, '/')) {
          int end = s.indexOf('\n', i + 2);
          return end < 0 ? s.length() : end;
        }
        return i;
      default:
        return i;
    }
  }

  /** Skips a literal opened by {@code quote} at {@code i}; returns the index after the closer. */
  static int skipQuoted(String s, int i, char quote, boolean escapes) {
    int j = i + 1;
    while (j < s.length()) {
      char c = s.charAt(j);
      if (c == quote) {
        return j + 1;
      }
      if (escapes && c == '\\') {
        j++;
      }
      j++;
    }
    return s.length();
  }

  /**
   * {@code s.charAt(i)} must be <code>'{'</code>. Returns the index just past the matching
   * <code>'}'</code>, or -1 if the braces never balance. Host literals, block comments and nested
   * markup trees are skipped whole.
   */
  static int skipBraces(String s, int i) {
    return new Spans(s).braceEnd(i);
  }

  /**
   * {@code start} must be an opening markup start. Returns the index just past the element or
   * fragment that starts there, or -1 if its tags never balance.
   */
  static int findEnd(String s, int start) {
    return new Spans(s).markupEnd(start);
  }

  /**
   * Brace and markup span lookups over one string. Results are remembered per start index, so
   * scanning a string keeps polynomial cost however many unclosed spans it chains.
   */
  static final class Spans {
    private static final int UNKNOWN = -2;

    private final String s;
    private final int[] braceEnds;
    private final int[] markupEnds;

    Spans(String s) {
      this.s = s;
      this.braceEnds = new int[s.length()];
      this.markupEnds = new int[s.length()];
      Arrays.fill(braceEnds, UNKNOWN);
      Arrays.fill(markupEnds, UNKNOWN);
    }

    /** See {@link MarkupScanner#skipBraces}. */
    int braceEnd(int i) {
      if (i >= s.length()) {
        return -1;
      }
      if (braceEnds[i] == UNKNOWN) {
        braceEnds[i] = scanBraces(i);
      }
      return braceEnds[i];
    }

    /** See {@link MarkupScanner#findEnd}. */
    int markupEnd(int start) {
      if (start >= s.length()) {
        return -1;
      }
      if (markupEnds[start] == UNKNOWN) {
        markupEnds[start] = scanMarkup(start);
      }
      return markupEnds[start];
    }

    private int scanBraces(int i) {
      int depth = 0;
      int j = i;
      while (j < s.length()) {
        int skipped = skipLiteralOrComment(s, j, false);
        if (skipped != j) {
          j = skipped;
          continue;
        }
        char c = s.charAt(j);
        if (c == '{') {
          depth++;
        } else if (c == '}') {
          depth--;
          if (depth == 0) {
            return j + 1;
          }
        } else if (isOpeningMarkupStart(s, j)) {
          int end = markupEnd(j);
          if (end > 0) {
            j = end;
            continue;
          }
        }
        j++;
      }
      return -1;
    }

    private int scanMarkup(int start) {
      int depth = 0;
      int i = start;
      while (i < s.length()) {
        char c = s.charAt(i);
        if (c == '{') {
          int end = braceEnd(i);
          if (end < 0) {
            return -1;
          }
          i = end;
          continue;
        }
        if (c != '<') {
          i++;
          continue;
        }

        if (charAt(s, i + 1, '/')) {
          if (charAt(s, i + 2, '>')) {
            i += 3;
          } else {
            int close = s.indexOf('>', i + 2);
            if (close < 0) {
              return -1;
            }
            i = close + 1;
          }
          depth--;
        } else if (charAt(s, i + 1, '>')) {
          i += 2;
          depth++;
        } else if (identStartAt(s, i + 1)) {
          depth++;
          i = skipTag(i + 1);
          if (i < 0) {
            return -1;
          }
          if (s.charAt(i - 2) == '/') {
            depth--;
          }
        } else {
          i++;
          continue;
        }

        if (depth <= 0) {
          return i;
        }
      }
      return -1;
    }

    // Returns the index after the '>' that ends the tag whose name starts at i, or -1.
    private int skipTag(int i) {
      while (i < s.length()) {
        char c = s.charAt(i);
        if (c == '"' || c == '\'') {
          i = skipQuoted(s, i, c, true);
        } else if (c == '{') {
          i = braceEnd(i);
          if (i < 0) {
            return -1;
          }
        } else if (c == '>') {
          return i + 1;
        } else {
          i++;
        }
      }
      return -1;
    }
  }

  /** Removes block and line comments, leaving host literals intact. */
  static String stripComments(String s) {
    StringBuilder out = new StringBuilder(s.length());
    int i = 0;
    while (i < s.length()) {
      char c = s.charAt(i);
      int skipped = skipLiteralOrComment(s, i, true);
      if (skipped == i) {
        out.append(c);
        i++;
      } else {
        if (c != '/') {
          out.append(s, i, skipped);
        }
        i = skipped;
      }
    }
    return out.toString();
  }

  private MarkupScanner() {}
}
