package gox;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.truth.Correspondence;

public class LexerTest {

  private StringBuilder file = new StringBuilder();

  private void println(String line) {
    file.append(line);
    file.append('\n');
  }

  private void print(String text) {
    file.append(text);
  }

  private ImmutableList<Lexer.Token> tokenize() {
    return new Lexer(file.toString()).tokenize();
  }

  @Test
  public void emptyFile() {
    assertThat(tokenize()).comparingElementsUsing(printsAs()).containsExactly("EOF(\"\")");
  }

  @Test
  public void hostCodeOnly() {
    println("package main");
    println("");
    println("func main() {}");

    ImmutableList<Lexer.Token> tokens = tokenize();

    assertThat(tokens).hasSize(2);
    assertThat(tokens.get(0).kind()).isEqualTo(Lexer.Kind.HOST_CODE);
    assertThat(tokens.get(0).text()).isEqualTo(file.toString());
    assertThat(tokens.get(1).kind()).isEqualTo(Lexer.Kind.EOF);
  }

  @Test
  public void lessThanIsNotMarkup() {
    println("if x < 10 {");
    println("  y := a <= b");
    println("}");

    assertThat(kinds(tokenize())).containsExactly(Lexer.Kind.HOST_CODE, Lexer.Kind.EOF).inOrder();
  }

  @Test
  public void markupInLiteralsAndCommentsIsHostCode() {
    println("s := \"<div>\" + `<span>` // <p>");
    println("r := '<' /* <b></b> */");
    println("t := \"escaped \\\" <i>\"");

    assertThat(kinds(tokenize())).containsExactly(Lexer.Kind.HOST_CODE, Lexer.Kind.EOF).inOrder();
  }

  @Test
  public void simpleElement() {
    print("x := <div class=\"a\">hi</div>\n");

    assertThat(tokenize())
        .comparingElementsUsing(printsAs())
        .containsExactly(
            "HOST_CODE(\"x := \")",
            "TAG_OPEN(\"<\")",
            "TAG_NAME(\"div\")",
            "ATTR_NAME(\"class\")",
            "EQUALS(\"=\")",
            "STRING(\"a\")",
            "TAG_CLOSE(\">\")",
            "TEXT(\"hi\")",
            "TAG_OPEN(\"</\")",
            "TAG_NAME(\"div\")",
            "TAG_CLOSE(\">\")",
            "HOST_CODE(\"\n\")",
            "EOF(\"\")")
        .inOrder();
  }

  @Test
  public void fragmentWithSelfClosingChild() {
    print("<><a/></>");

    assertThat(tokenize())
        .comparingElementsUsing(printsAs())
        .containsExactly(
            "FRAGMENT_OPEN(\"<>\")",
            "TAG_OPEN(\"<\")",
            "TAG_NAME(\"a\")",
            "SLASH(\"/\")",
            "TAG_CLOSE(\">\")",
            "FRAGMENT_CLOSE(\"</>\")",
            "EOF(\"\")")
        .inOrder();
  }

  @Test
  public void attributesOfEveryShape() {
    print("<input data-id='7' disabled value={v} {...props} />");

    assertThat(tokenize())
        .comparingElementsUsing(printsAs())
        .containsExactly(
            "TAG_OPEN(\"<\")",
            "TAG_NAME(\"input\")",
            "ATTR_NAME(\"data-id\")",
            "EQUALS(\"=\")",
            "STRING(\"7\")",
            "ATTR_NAME(\"disabled\")",
            "ATTR_NAME(\"value\")",
            "EQUALS(\"=\")",
            "EXPRESSION(\"v\")",
            "EXPRESSION(\"...props\")",
            "SLASH(\"/\")",
            "TAG_CLOSE(\">\")",
            "EOF(\"\")")
        .inOrder();
  }

  @Test
  public void expressionSkipsBracesInStrings() {
    print("<p>{fmt.Sprintf(\"}%d\", m{\"a\": 1}[`}`])}</p>");

    ImmutableList<Lexer.Token> tokens = tokenize();

    assertThat(tokens.get(3).kind()).isEqualTo(Lexer.Kind.EXPRESSION);
    assertThat(tokens.get(3).text()).isEqualTo("fmt.Sprintf(\"}%d\", m{\"a\": 1}[`}`])");
    assertThat(kinds(tokens.subList(4, tokens.size())))
        .containsExactly(
            Lexer.Kind.TAG_OPEN, Lexer.Kind.TAG_NAME, Lexer.Kind.TAG_CLOSE, Lexer.Kind.EOF)
        .inOrder();
  }

  @Test
  public void expressionContainsNestedMarkup() {
    print("<ul>{show && <li title=\"a>b}\">{name}</li>}</ul>");

    ImmutableList<Lexer.Token> tokens = tokenize();

    assertThat(tokens)
        .comparingElementsUsing(printsAs())
        .containsExactly(
            "TAG_OPEN(\"<\")",
            "TAG_NAME(\"ul\")",
            "TAG_CLOSE(\">\")",
            "EXPRESSION(\"show && <li title=\"a...\")",
            "TAG_OPEN(\"</\")",
            "TAG_NAME(\"ul\")",
            "TAG_CLOSE(\">\")",
            "EOF(\"\")")
        .inOrder();
    assertThat(tokens.get(3).text()).isEqualTo("show && <li title=\"a>b}\">{name}</li>");
  }

  @Test
  public void structuralCharactersAreTextInChildren() {
    print("<p>a > b / c = d < e</p>");

    ImmutableList<Lexer.Token> tokens = tokenize();

    assertThat(tokens.get(3).kind()).isEqualTo(Lexer.Kind.TEXT);
    assertThat(tokens.get(3).text()).isEqualTo("a > b / c = d < e");
    assertThat(tokens).hasSize(8);
  }

  @Test
  public void whitespaceIsKeptInText() {
    print("<p>  two  words </p>");

    assertThat(tokenize().get(3).text()).isEqualTo("  two  words ");
  }

  @Test
  public void strayClosingBraceIsAnError() {
    print("<p>a}b</p>");

    assertThat(tokenize())
        .comparingElementsUsing(printsAs())
        .containsExactly(
            "TAG_OPEN(\"<\")",
            "TAG_NAME(\"p\")",
            "TAG_CLOSE(\">\")",
            "TEXT(\"a\")",
            "ERROR(\"}\")",
            "TEXT(\"b\")",
            "TAG_OPEN(\"</\")",
            "TAG_NAME(\"p\")",
            "TAG_CLOSE(\">\")",
            "EOF(\"\")")
        .inOrder();
  }

  @Test
  public void unknownCharacterInTagIsAnError() {
    print("<a @>");

    assertThat(tokenize())
        .comparingElementsUsing(printsAs())
        .containsExactly(
            "TAG_OPEN(\"<\")",
            "TAG_NAME(\"a\")",
            "ERROR(\"@\")",
            "TAG_CLOSE(\">\")",
            "EOF(\"\")")
        .inOrder();
  }

  @Test
  public void strayClosingTagReturnsToHostCode() {
    print("</a> x");

    assertThat(tokenize())
        .comparingElementsUsing(printsAs())
        .containsExactly(
            "TAG_OPEN(\"</\")",
            "TAG_NAME(\"a\")",
            "TAG_CLOSE(\">\")",
            "HOST_CODE(\" x\")",
            "EOF(\"\")")
        .inOrder();
  }

  @Test
  public void markupEndsWhenOutermostElementCloses() {
    print("a := <b><c/></b>; d := x<y");

    ImmutableList<Lexer.Token> tokens = tokenize();
    Lexer.Token host = tokens.get(tokens.size() - 2);

    // "x<y" looks like markup again once back in host code.
    assertThat(tokens.get(11).kind()).isEqualTo(Lexer.Kind.HOST_CODE);
    assertThat(tokens.get(11).text()).isEqualTo("; d := x");
    assertThat(host.kind()).isEqualTo(Lexer.Kind.TAG_NAME);
  }

  @Test
  public void unterminatedStringRunsToEnd() {
    print("<div class=\"x");

    assertThat(tokenize())
        .comparingElementsUsing(printsAs())
        .containsExactly(
            "TAG_OPEN(\"<\")",
            "TAG_NAME(\"div\")",
            "ATTR_NAME(\"class\")",
            "EQUALS(\"=\")",
            "STRING(\"x\")",
            "EOF(\"\")")
        .inOrder();
  }

  @Test
  public void unterminatedExpressionRunsToEnd() {
    print("<p>{a(");

    ImmutableList<Lexer.Token> tokens = tokenize();

    assertThat(tokens).hasSize(5);
    assertThat(tokens.get(3).kind()).isEqualTo(Lexer.Kind.EXPRESSION);
    assertThat(tokens.get(3).text()).isEqualTo("a(");
  }

  @Test
  public void positionsAreOneIndexed() {
    println("ab");
    print("  <b/>");

    ImmutableList<Lexer.Token> tokens = tokenize();

    assertThat(tokens.get(0).start()).isEqualTo(Lexer.Pos.of(0, 1, 1));
    assertThat(tokens.get(0).end()).isEqualTo(Lexer.Pos.of(5, 2, 3));
    assertThat(tokens.get(1).start()).isEqualTo(Lexer.Pos.of(5, 2, 3));
    assertThat(tokens.get(2).start()).isEqualTo(Lexer.Pos.of(6, 2, 4));
  }

  @Test
  public void expressionTokenSpansItsBraces() {
    print("<p>{ x }</p>");

    Lexer.Token expr = tokenize().get(3);

    assertThat(expr.text()).isEqualTo(" x ");
    assertThat(expr.start().column()).isEqualTo(4);
    assertThat(expr.end().column()).isEqualTo(9);
  }

  @Test
  public void tokenStringIsTruncated() {
    Lexer.Token token =
        Lexer.Token.of(
            Lexer.Kind.TEXT, "abcdefghijklmnopqrstuvwxyz", Lexer.Pos.start(), Lexer.Pos.start());

    assertThat(token.toString()).isEqualTo("TEXT(\"abcdefghijklmnopqrst...\")");
  }

  private static ImmutableList<Lexer.Kind> kinds(Iterable<Lexer.Token> tokens) {
    ImmutableList.Builder<Lexer.Kind> kinds = ImmutableList.builder();
    tokens.forEach(t -> kinds.add(t.kind()));
    return kinds.build();
  }

  private static Correspondence<Lexer.Token, String> printsAs() {
    return Correspondence.from((t, s) -> t.toString().equals(s), "prints as");
  }
}
