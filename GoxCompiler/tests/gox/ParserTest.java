package gox;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

import java.time.Duration;

import org.junit.jupiter.api.Test;

public class ParserTest {

  private StringBuilder file = new StringBuilder();

  private void println(String line) {
    file.append(line);
    file.append('\n');
  }

  private void print(String text) {
    file.append(text);
  }

  private Parser.ParseResult parse() {
    return Parser.parse("test.gox", file.toString());
  }

  private AST parseOk() throws CompilerException {
    return parse().astOrThrow();
  }

  private void assertFirstError(String errorSubstr) {
    Parser.ParseResult result = parse();
    assertThat(result.errors()).isNotEmpty();
    assertThat(result.firstError().get()).hasMessageThat().contains(errorSubstr);
  }

  private static AST.Element element(AST.Node node) {
    assertThat(node).isInstanceOf(AST.Element.class);
    return (AST.Element) node;
  }

  @Test
  public void hostCodeOnly() throws CompilerException {
    println("package main");
    println("");
    println("func f() int { return 1 }");

    AST ast = parseOk();

    assertThat(ast.file()).isEqualTo("test.gox");
    assertThat(ast.nodes()).hasSize(1);
    assertThat(((AST.HostCode) ast.nodes().get(0)).code()).isEqualTo(file.toString());
  }

  @Test
  public void elementBetweenHostCode() throws CompilerException {
    println("x := <div class=\"a\" hidden>hi {name}</div>");

    AST ast = parseOk();

    assertThat(ast.nodes()).hasSize(3);
    assertThat(((AST.HostCode) ast.nodes().get(0)).code()).isEqualTo("x := ");
    assertThat(((AST.HostCode) ast.nodes().get(2)).code()).isEqualTo("\n");

    AST.Element div = element(ast.nodes().get(1));
    assertThat(div.tagName()).isEqualTo("div");
    assertThat(div.selfClosing()).isFalse();
    assertThat(div.isComponent()).isFalse();
    assertThat(div.attributes()).hasSize(2);

    AST.StringAttribute cls = (AST.StringAttribute) div.attributes().get(0);
    assertThat(cls.key()).isEqualTo("class");
    assertThat(cls.value()).isEqualTo("a");

    AST.ExpressionAttribute hidden = (AST.ExpressionAttribute) div.attributes().get(1);
    assertThat(hidden.key()).isEqualTo("hidden");
    assertThat(hidden.expression()).isEqualTo("true");
    assertThat(hidden.expressionStart()).isEmpty();

    assertThat(div.children()).hasSize(2);
    assertThat(((AST.Text) div.children().get(0)).text()).isEqualTo("hi ");
    assertThat(((AST.Expression) div.children().get(1)).expression()).isEqualTo("name");
  }

  @Test
  public void selfClosingElements() throws CompilerException {
    print("<><br/><input disabled /><Button label={l}/></>");

    AST.Fragment fragment = (AST.Fragment) parseOk().nodes().get(0);

    assertThat(fragment.children()).hasSize(3);
    for (AST.Child child : fragment.children()) {
      assertThat(((AST.Element) child).selfClosing()).isTrue();
      assertThat(((AST.Element) child).children()).isEmpty();
    }
    assertThat(((AST.Element) fragment.children().get(2)).isComponent()).isTrue();
  }

  @Test
  public void expressionAttributeKeepsItsPosition() throws CompilerException {
    print("<a href={  url }/>");

    AST.Element a = element(parseOk().nodes().get(0));
    AST.ExpressionAttribute href = (AST.ExpressionAttribute) a.attributes().get(0);

    assertThat(href.expression()).isEqualTo("url");
    assertThat(href.expressionStart()).hasValue(Lexer.Pos.of(11, 1, 12));
    assertThat(href.range().start()).isEqualTo(Lexer.Pos.of(3, 1, 4));
    assertThat(href.range().end()).isEqualTo(Lexer.Pos.of(16, 1, 17));
  }

  @Test
  public void spreadAttributes() throws CompilerException {
    print("<div {...props} id=\"x\" {... more } />");

    AST.Element div = element(parseOk().nodes().get(0));

    assertThat(div.attributes()).hasSize(3);
    AST.SpreadAttribute props = (AST.SpreadAttribute) div.attributes().get(0);
    assertThat(props.expression()).isEqualTo("props");
    assertThat(props.expressionStart()).isEqualTo(Lexer.Pos.of(9, 1, 10));
    assertThat(div.attributes().get(1)).isInstanceOf(AST.StringAttribute.class);
    assertThat(((AST.SpreadAttribute) div.attributes().get(2)).expression()).isEqualTo("more");
  }

  @Test
  public void childExpressionPosition() throws CompilerException {
    print("<p>{  name }</p>");

    AST.Expression expr = (AST.Expression) element(parseOk().nodes().get(0)).children().get(0);

    assertThat(expr.expression()).isEqualTo("name");
    assertThat(expr.expressionStart()).isEqualTo(Lexer.Pos.of(6, 1, 7));
    assertThat(expr.range().start()).isEqualTo(Lexer.Pos.of(3, 1, 4));
    assertThat(expr.isCommentOnly()).isFalse();
  }

  @Test
  public void commentOnlyExpression() throws CompilerException {
    print("<p>{/* nothing */}</p>");

    AST.Expression expr = (AST.Expression) element(parseOk().nodes().get(0)).children().get(0);

    assertThat(expr.isCommentOnly()).isTrue();
  }

  @Test
  public void nestedRanges() throws CompilerException {
    println("v := <ul>");
    println("  <li>a</li>");
    print("</ul>");

    AST.Element ul = element(parseOk().nodes().get(1));
    AST.Element li = (AST.Element) ul.children().get(1);

    assertThat(ul.children()).hasSize(3);
    assertThat(((AST.Text) ul.children().get(0)).isBlank()).isTrue();
    assertThat(li.tagName()).isEqualTo("li");
    assertThat(ul.range().contains(li.range())).isTrue();
    assertThat(li.range().contains(ul.range())).isFalse();
    assertThat(li.range().start()).isEqualTo(Lexer.Pos.of(12, 2, 3));
    assertThat(li.range().end()).isEqualTo(Lexer.Pos.of(22, 2, 13));
    assertThat(ul.range().end().offset()).isEqualTo(file.length());
  }

  @Test
  public void fragments() throws CompilerException {
    print("<><a/>text<>{x}</></>");

    AST.Fragment fragment = (AST.Fragment) parseOk().nodes().get(0);

    assertThat(fragment.children()).hasSize(3);
    assertThat(fragment.children().get(0)).isInstanceOf(AST.Element.class);
    assertThat(((AST.Text) fragment.children().get(1)).text()).isEqualTo("text");
    AST.Fragment inner = (AST.Fragment) fragment.children().get(2);
    assertThat(inner.children()).hasSize(1);
  }

  @Test
  public void mismatchedClosingTag() {
    print("<a></b>");

    Parser.ParseResult result = parse();

    assertThat(result.errors()).hasSize(1);
    assertThat(result.errors().get(0))
        .hasMessageThat()
        .isEqualTo("test.gox:1:6: mismatched closing tag: expected </a>, got </b>");
    assertThat(result.errors().get(0).errorMsg()).startsWith("mismatched");
    assertThat(result.errors().get(0).pos()).isEqualTo(Lexer.Pos.of(5, 1, 6));
    // The partial tree is still returned.
    assertThat(element(result.ast().nodes().get(0)).tagName()).isEqualTo("a");
  }

  @Test
  public void unclosedElement() {
    print("<a>hi");

    assertFirstError("test.gox:1:6: unclosed element: expected </a>, got EOF(\"\")");
  }

  @Test
  public void unclosedFragment() {
    print("<>x");

    assertFirstError("unclosed fragment: expected </>, got EOF");
  }

  @Test
  public void lessThanWithoutTagNameIsHostCode() {
    print("< a>");
    println("");
    print("x := <1>");

    // Neither is markup, so this is plain host code.
    assertThat(parse().errors()).isEmpty();
  }

  @Test
  public void slashWithoutClose() {
    print("<a / b>");

    assertFirstError("expected '>' after '/', got ATTR_NAME(\"b\")");
  }

  @Test
  public void badAttributeValue() {
    print("<a x=/>");

    Parser.ParseResult result = parse();

    assertThat(result.errors()).hasSize(1);
    assertThat(result.errors().get(0))
        .hasMessageThat()
        .contains("expected string or expression for attribute value, got SLASH(\"/\")");
  }

  @Test
  public void spreadWithoutDots() {
    print("<div {props} id=\"x\"/>");

    Parser.ParseResult result = parse();

    assertThat(result.errors()).hasSize(1);
    assertThat(result.errors().get(0))
        .hasMessageThat()
        .contains("expected spread expression, got {props}");
    assertThat(element(result.ast().nodes().get(0)).attributes()).hasSize(1);
  }

  @Test
  public void emptySpread() {
    print("<div {...} />");

    assertFirstError("expected spread expression, got {...}");
  }

  @Test
  public void unexpectedTokenInAttributes() {
    print("<a @ b=\"c\">x</a>");

    Parser.ParseResult result = parse();

    assertThat(result.errors()).hasSize(1);
    assertThat(result.errors().get(0))
        .hasMessageThat()
        .contains("unexpected token in attributes: ERROR(\"@\")");
    assertThat(element(result.ast().nodes().get(0)).attributes()).hasSize(1);
  }

  @Test
  public void strayBraceInChildren() {
    print("<p>a}b</p>");

    Parser.ParseResult result = parse();

    assertThat(result.errors()).hasSize(1);
    assertThat(result.errors().get(0))
        .hasMessageThat()
        .isEqualTo("test.gox:1:5: unexpected token in children: ERROR(\"}\")");
    assertThat(element(result.ast().nodes().get(0)).children()).hasSize(2);
  }

  @Test
  public void strayClosingTag() {
    print("</a>");

    Parser.ParseResult result = parse();

    assertThat(result.errors()).hasSize(3);
    assertThat(result.firstError().get())
        .hasMessageThat()
        .contains("unexpected token: TAG_OPEN(\"</\")");
    assertThat(result.ast().nodes()).isEmpty();
  }

  @Test
  public void chainedUnclosedExpressions() {
    print("x := <div>");
    print("{a<b ".repeat(400));

    Parser.ParseResult result = assertTimeoutPreemptively(Duration.ofSeconds(10), () -> parse());

    assertThat(result.firstError().get()).hasMessageThat().contains("unclosed element");
  }

  @Test
  public void astOrThrowThrowsFirstError() {
    println("a := <b>");
    print("c := <d></e>");

    CompilerException ex = assertThrows(CompilerException.class, () -> parseOk());

    assertThat(ex).hasMessageThat().contains("mismatched closing tag: expected </d>, got </e>");
  }
}
