// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.packwerk.java.syntax;

import static com.google.common.truth.Truth.assertThat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of tokenization behavior of the {@link Lexer}. */
@RunWith(JUnit4.class)
public class LexerTest {

  private final List<SyntaxError> errors = new ArrayList<>();

  private Lexer createLexer(String input) {
    errors.clear();
    return new Lexer(ParserInput.fromString(input, ""), errors);
  }

  private static class Token {
    TokenKind kind;
    int start;
    Object value;
  }

  private static List<Token> allTokens(Lexer lexer) {
    List<Token> result = new ArrayList<>();
    do {
      lexer.nextToken();
      Token tok = new Token();
      tok.kind = lexer.kind;
      tok.start = lexer.start;
      tok.value = lexer.value;
      result.add(tok);
    } while (lexer.kind != TokenKind.EOF);
    return result;
  }

  /**
   * Returns a string containing the names of the tokens and their names or operators, for example
   * {@code CONSTANT(Foo) COLON2 CONSTANT(Bar) EOF}.
   */
  private String values(String input) {
    StringBuilder buffer = new StringBuilder();
    for (Token token : allTokens(createLexer(input))) {
      if (buffer.length() > 0) {
        buffer.append(' ');
      }
      buffer.append(token.kind.name());
      if (token.value instanceof String) {
        buffer.append('(').append(token.value).append(')');
      }
    }
    return buffer.toString();
  }

  // Returns the line number of each token.
  private String linenums(String input) {
    Lexer lexer = createLexer(input);
    StringBuilder buf = new StringBuilder();
    for (Token tok : allTokens(lexer)) {
      if (buf.length() > 0) {
        buf.append(' ');
      }
      buf.append(lexer.locs.getLocation(tok.start).line());
    }
    return buf.toString();
  }

  // Scans src, and asserts that the tokens match wantTokens and that there are no errors.
  private void check(String src, String wantTokens) {
    assertThat(values(src)).isEqualTo(wantTokens);
    assertThat(errors).isEmpty();
  }

  // Scans src, and asserts that the tokens and errors match. Errors are formatted with a caret ^
  // under the errant column.
  private void checkErrors(String src, String wantTokens, String... wantErrors) {
    assertThat(values(src)).isEqualTo(wantTokens);
    List<String> gotErrors = new ArrayList<>();
    for (SyntaxError err : errors) {
      gotErrors.add(" ".repeat(err.location().column() - 1) + "^ " + err.message());
    }
    assertThat(gotErrors).isEqualTo(Arrays.asList(wantErrors));
  }

  @Test
  public void testConstantPaths() {
    check("Foo::Bar", "CONSTANT(Foo) COLON2 CONSTANT(Bar) EOF");
    check("::Foo", "COLON3 CONSTANT(Foo) EOF");
    check("foo::Bar", "IDENTIFIER(foo) COLON2 CONSTANT(Bar) EOF");
    // An argument of a call without parentheses.
    check("foo ::Bar", "IDENTIFIER(foo) COLON3 CONSTANT(Bar) EOF");
  }

  @Test
  public void testModifierKeywords() {
    check("x = 1 if y", "IDENTIFIER(x) EQUALS(=) NUMBER IF_MOD IDENTIFIER(y) EOF");
    check("if y\nend", "IF IDENTIFIER(y) NEWLINE END EOF");
    check("foo rescue nil", "IDENTIFIER(foo) RESCUE_MOD NIL EOF");
    check("return unless x", "RETURN UNLESS_MOD IDENTIFIER(x) EOF");
  }

  @Test
  public void testNewlines() {
    check(
        "foo(a,\n  b)\n",
        "IDENTIFIER(foo) LPAREN IDENTIFIER(a) COMMA IDENTIFIER(b) RPAREN NEWLINE EOF");
    check("a +\n b", "IDENTIFIER(a) OPERATOR(+) IDENTIFIER(b) EOF");
    check("foo\n  # comment\n  .bar\n", "IDENTIFIER(foo) DOT IDENTIFIER(bar) NEWLINE EOF");
    check("foo \\\n  bar", "IDENTIFIER(foo) IDENTIFIER(bar) EOF");
    check("a\n\n\nb", "IDENTIFIER(a) NEWLINE IDENTIFIER(b) EOF");
  }

  @Test
  public void testCommentsAndData() {
    check("Foo # Bar\n=begin\nBaz\n=end\nQux", "CONSTANT(Foo) NEWLINE CONSTANT(Qux) EOF");
    check("Foo\n__END__\nBar", "CONSTANT(Foo) NEWLINE EOF");
  }

  @Test
  public void testStrings() {
    check("'Foo' \"Bar\"", "STRING STRING EOF");
    check("\"a#{Foo}b\"", "STRING_BEGIN CONSTANT(Foo) STRING_END EOF");
    check("\"a#{x}b#{Y}c\"", "STRING_BEGIN IDENTIFIER(x) STRING_MID CONSTANT(Y) STRING_END EOF");
    check("'#{Foo}'", "STRING EOF");
    check("\"a\\\"#{Foo}\"", "STRING_BEGIN CONSTANT(Foo) STRING_END EOF");
  }

  @Test
  public void testNestedInterpolation() {
    check(
        "\"a#{\"b#{Foo}\"}c\"",
        "STRING_BEGIN STRING_BEGIN CONSTANT(Foo) STRING_END STRING_END EOF");
    check(
        "\"#{ {a: 1}[:a] }\"",
        "STRING_BEGIN LBRACE LABEL(a) NUMBER RBRACE LBRACKET SYMBOL RBRACKET STRING_END EOF");
  }

  @Test
  public void testLabelsAndSymbols() {
    check(
        "foo(a: :b, \"c\": 1)",
        "IDENTIFIER(foo) LPAREN LABEL(a) SYMBOL COMMA LABEL(c) NUMBER RPAREN EOF");
    check("{if: 1}", "LBRACE LABEL(if) NUMBER RBRACE EOF");
    check(":foo? :@bar :[]= :\"x\"", "SYMBOL SYMBOL SYMBOL STRING EOF");
  }

  @Test
  public void testTernary() {
    check("a ? b : c", "IDENTIFIER(a) QUESTION IDENTIFIER(b) COLON IDENTIFIER(c) EOF");
    check("a ? b: c", "IDENTIFIER(a) QUESTION IDENTIFIER(b) COLON IDENTIFIER(c) EOF");
    check(
        "x.empty? ? 1 : 2",
        "IDENTIFIER(x) DOT IDENTIFIER(empty?) QUESTION NUMBER COLON NUMBER EOF");
    check("x = ?a", "IDENTIFIER(x) EQUALS(=) CHAR EOF");
  }

  @Test
  public void testRegexpsAndDivision() {
    check("x = a / b", "IDENTIFIER(x) EQUALS(=) IDENTIFIER(a) OPERATOR(/) IDENTIFIER(b) EOF");
    check("x = /Foo/i", "IDENTIFIER(x) EQUALS(=) STRING EOF");
    check("puts /x/", "IDENTIFIER(puts) STRING EOF");
    check("x =~ /a#{B}c/", "IDENTIFIER(x) OPERATOR(=~) STRING_BEGIN CONSTANT(B) STRING_END EOF");
  }

  @Test
  public void testPercentLiterals() {
    check("%w[Foo Bar]", "STRING EOF");
    check("%i(a b) + %(c)", "STRING OPERATOR(+) STRING EOF");
    check("x % 2", "IDENTIFIER(x) OPERATOR(%) NUMBER EOF");
    check("%Q{a #{B} {c}}", "STRING_BEGIN CONSTANT(B) STRING_END EOF");
  }

  @Test
  public void testHeredocs() {
    check(
        "x = <<~EOS\n  Foo\nEOS\nBar\n",
        "IDENTIFIER(x) EQUALS(=) HEREDOC NEWLINE CONSTANT(Bar) NEWLINE EOF");
    check(
        "foo(<<-A, <<-'B')\n  a\n  A\n  b\n  B\nBaz",
        "IDENTIFIER(foo) LPAREN HEREDOC COMMA HEREDOC RPAREN NEWLINE CONSTANT(Baz) EOF");
    check("x << y", "IDENTIFIER(x) OPERATOR(<<) IDENTIFIER(y) EOF");
    check("class << self", "CLASS OPERATOR(<<) SELF EOF");
  }

  @Test
  public void testHeredocBody() {
    Lexer lexer = createLexer("x = <<~SQL\n  select #{Foo}\nSQL\n");
    lexer.nextToken(); // x
    lexer.nextToken(); // =
    lexer.nextToken();
    assertThat(lexer.kind).isEqualTo(TokenKind.HEREDOC);
    Lexer body = lexer.heredocLexer((Lexer.Heredoc) lexer.value);
    StringBuilder kinds = new StringBuilder();
    for (Token tok : allTokens(body)) {
      kinds.append(tok.kind.name()).append(' ');
    }
    assertThat(kinds.toString()).isEqualTo("STRING_BEGIN CONSTANT STRING_END EOF ");
    assertThat(errors).isEmpty();
  }

  @Test
  public void testPreexeAndPostexeKeywords() {
    check(
        "BEGIN { Foo }\nEND { Bar }",
        "PREEXE LBRACE CONSTANT(Foo) RBRACE NEWLINE POSTEXE LBRACE CONSTANT(Bar) RBRACE EOF");
    check("Foo::END", "CONSTANT(Foo) COLON2 CONSTANT(END) EOF");
  }

  @Test
  public void testKeywordsAsMethodNames() {
    check("foo.class.end", "IDENTIFIER(foo) DOT IDENTIFIER(class) DOT IDENTIFIER(end) EOF");
    check("Foo::new", "CONSTANT(Foo) COLON2 IDENTIFIER(new) EOF");
  }

  @Test
  public void testMethodDefinitionNames() {
    check(
        "def self.==(o)",
        "DEF SELF(self) DOT IDENTIFIER(==) LPAREN IDENTIFIER(o) RPAREN EOF");
    check("def name=(v)", "DEF IDENTIFIER(name=) LPAREN IDENTIFIER(v) RPAREN EOF");
    check("def end", "DEF IDENTIFIER(end) EOF");
    check("def [](i)", "DEF IDENTIFIER([]) LPAREN IDENTIFIER(i) RPAREN EOF");
  }

  @Test
  public void testVariables() {
    check("@a @@b $c $0 $!", "IVAR(@a) CVAR(@@b) GVAR($c) GVAR($0) GVAR($!) EOF");
  }

  @Test
  public void testOperators() {
    check("a ||= b", "IDENTIFIER(a) OP_ASSIGN(||=) IDENTIFIER(b) EOF");
    check("a&.b", "IDENTIFIER(a) AMPER_DOT IDENTIFIER(b) EOF");
    check("{ 1 => 2 }", "LBRACE NUMBER ASSOC(=>) NUMBER RBRACE EOF");
    check("-> { }", "LAMBDA LBRACE RBRACE EOF");
    check("x { |a| }", "IDENTIFIER(x) LBRACE PIPE(|) IDENTIFIER(a) PIPE(|) RBRACE EOF");
    check("1..2", "NUMBER OPERATOR(..) NUMBER EOF");
  }

  @Test
  public void testNumbers() {
    check("1_000 0x1F 1.5e3 3r 2i", "NUMBER NUMBER NUMBER NUMBER NUMBER EOF");
  }

  @Test
  public void testLineNumbers() {
    assertThat(linenums("foo\nbar\n\nbaz")).isEqualTo("1 1 2 2 4 4");
  }

  @Test
  public void testErrors() {
    checkErrors("\"abc", "STRING EOF", "^ unterminated string meets end of file");
    checkErrors("Foo\\ Bar", "CONSTANT(Foo) CONSTANT(Bar) EOF", "   ^ invalid character: '\\'");
    checkErrors("=begin\nfoo", "EOF", "^ embedded document meets end of file");
  }
}
