package gox;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

import java.time.Duration;

import org.junit.jupiter.api.Test;

public class MarkupScannerTest {

  @Test
  public void markupStarts() {
    assertThat(MarkupScanner.isMarkupStart("<div", 0)).isTrue();
    assertThat(MarkupScanner.isMarkupStart("<>", 0)).isTrue();
    assertThat(MarkupScanner.isMarkupStart("</>", 0)).isTrue();
    assertThat(MarkupScanner.isMarkupStart("</a", 0)).isTrue();
    assertThat(MarkupScanner.isMarkupStart("x <_a", 2)).isTrue();
    assertThat(MarkupScanner.isMarkupStart("< a", 0)).isFalse();
    assertThat(MarkupScanner.isMarkupStart("<=", 0)).isFalse();
    assertThat(MarkupScanner.isMarkupStart("<1", 0)).isFalse();
    assertThat(MarkupScanner.isMarkupStart("<", 0)).isFalse();

    assertThat(MarkupScanner.isOpeningMarkupStart("</a", 0)).isFalse();
    assertThat(MarkupScanner.isOpeningMarkupStart("<a", 0)).isTrue();
  }

  @Test
  public void literalsAndComments() {
    assertThat(MarkupScanner.skipLiteralOrComment("\"a\\\"b\" x", 0, true)).isEqualTo(6);
    assertThat(MarkupScanner.skipLiteralOrComment("'\\''x", 0, true)).isEqualTo(4);
    // Raw strings have no escapes.
    assertThat(MarkupScanner.skipLiteralOrComment("`a\\`b", 0, true)).isEqualTo(4);
    assertThat(MarkupScanner.skipLiteralOrComment("/* c */x", 0, false)).isEqualTo(7);
    assertThat(MarkupScanner.skipLiteralOrComment("// c\nx", 0, true)).isEqualTo(4);
    assertThat(MarkupScanner.skipLiteralOrComment("// c\nx", 0, false)).isEqualTo(0);
    assertThat(MarkupScanner.skipLiteralOrComment("\"open", 0, true)).isEqualTo(5);
    assertThat(MarkupScanner.skipLiteralOrComment("x", 0, true)).isEqualTo(0);
    assertThat(MarkupScanner.skipLiteralOrComment("x", 1, true)).isEqualTo(1);
  }

  @Test
  public void braces() {
    assertThat(MarkupScanner.skipBraces("{a{b}c}d", 0)).isEqualTo(7);
    assertThat(MarkupScanner.skipBraces("{\"}\"}", 0)).isEqualTo(5);
    assertThat(MarkupScanner.skipBraces("{/* } */}", 0)).isEqualTo(9);
    assertThat(MarkupScanner.skipBraces("{<a>}</a>}", 0)).isEqualTo(10);
    assertThat(MarkupScanner.skipBraces("{", 0)).isEqualTo(-1);
    assertThat(MarkupScanner.skipBraces("{{}", 0)).isEqualTo(-1);
  }

  @Test
  public void markupEnds() {
    assertThat(MarkupScanner.findEnd("<a><b/></a>rest", 0)).isEqualTo(11);
    assertThat(MarkupScanner.findEnd("<a title=\">\"/>x", 0)).isEqualTo(14);
    assertThat(MarkupScanner.findEnd("<>x</>y", 0)).isEqualTo(6);
    assertThat(MarkupScanner.findEnd("<a>{\"</a>\"}</a>", 0)).isEqualTo(15);
    assertThat(MarkupScanner.findEnd("<a>", 0)).isEqualTo(-1);
    assertThat(MarkupScanner.findEnd("<a>{</a>", 0)).isEqualTo(-1);
  }

  @Test
  public void spansRememberResults() {
    MarkupScanner.Spans spans = new MarkupScanner.Spans("x{<a>}</a>}{");

    assertThat(spans.braceEnd(1)).isEqualTo(11);
    assertThat(spans.braceEnd(1)).isEqualTo(11);
    assertThat(spans.markupEnd(2)).isEqualTo(10);
    assertThat(spans.braceEnd(11)).isEqualTo(-1);
    assertThat(spans.braceEnd(12)).isEqualTo(-1);
  }

  @Test
  public void chainedUnclosedSpansScanQuickly() {
    String s = "{a<b ".repeat(400);

    int end =
        assertTimeoutPreemptively(Duration.ofSeconds(10), () -> MarkupScanner.skipBraces(s, 0));

    assertThat(end).isEqualTo(-1);
  }

  @Test
  public void stripsComments() {
    assertThat(MarkupScanner.stripComments("a /* b */ c // d\n\"//e\""))
        .isEqualTo("a  c \n\"//e\"");
    assertThat(MarkupScanner.stripComments("`/*`")).isEqualTo("`/*`");
  }
}
