package gox;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

public class GoLiteralsTest {

  @Test
  public void quotesPlainText() {
    assertThat(GoLiterals.quote("Hello World")).isEqualTo("\"Hello World\"");
    assertThat(GoLiterals.quote("")).isEqualTo("\"\"");
  }

  @Test
  public void escapes() {
    assertThat(GoLiterals.quote("a\"b\\c")).isEqualTo("\"a\\\"b\\\\c\"");
    assertThat(GoLiterals.quote("\n\r\t")).isEqualTo("\"\\n\\r\\t\"");
    assertThat(GoLiterals.quote("\u0007\b\f\u000b")).isEqualTo("\"\\a\\b\\f\\v\"");
    assertThat(GoLiterals.quote("\u0000\u001b\u007f")).isEqualTo("\"\\x00\\x1b\\x7f\"");
    assertThat(GoLiterals.quote("\u0085")).isEqualTo("\"\\u0085\"");
  }

  @Test
  public void keepsUnicode() {
    assertThat(GoLiterals.quote("héllo 世界 \uD83D\uDE00"))
        .isEqualTo("\"héllo 世界 \uD83D\uDE00\"");
  }

  @Test
  public void capitalizes() {
    assertThat(GoLiterals.capitalize("label")).isEqualTo("Label");
    assertThat(GoLiterals.capitalize("onClick")).isEqualTo("OnClick");
    assertThat(GoLiterals.capitalize("ID")).isEqualTo("ID");
    assertThat(GoLiterals.capitalize("élan")).isEqualTo("Élan");
    assertThat(GoLiterals.capitalize("")).isEmpty();
  }
}
