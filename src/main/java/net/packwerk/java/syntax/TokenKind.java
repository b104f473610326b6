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

/** A TokenKind represents the kind of a lexical token. */
public enum TokenKind {
  ALIAS("alias"),
  AMPER_DOT("&."),
  AND("and"),
  ASSOC("=>"),
  BEGIN("begin"),
  BREAK("break"),
  CASE("case"),
  CHAR("character literal"),
  CLASS("class"),
  COLON(":"),
  COLON2("::"), // scope resolution, as in A::B
  COLON3("::"), // top-level scope, as in ::A
  COMMA(","),
  CONSTANT("constant"),
  CVAR("class variable"),
  DEF("def"),
  DEFINED("defined?"),
  DO("do"),
  DOT("."),
  ELSE("else"),
  ELSIF("elsif"),
  END("end"),
  ENSURE("ensure"),
  EOF("EOF"),
  EQUALS("="),
  FALSE("false"),
  FOR("for"),
  GVAR("global variable"),
  HEREDOC("heredoc"),
  IDENTIFIER("identifier"),
  IF("if"),
  IF_MOD("if"),
  IN("in"),
  IVAR("instance variable"),
  KEYWORD_LITERAL("keyword"),
  LABEL("label"),
  LAMBDA("->"),
  LBRACE("{"),
  LBRACKET("["),
  LPAREN("("),
  MODULE("module"),
  NEWLINE("newline"),
  NEXT("next"),
  NIL("nil"),
  NOT("not"),
  NUMBER("number"),
  OP_ASSIGN("augmented assignment"),
  OPERATOR("operator"),
  OR("or"),
  PIPE("|"),
  POSTEXE("END"), // END { ... }, run at exit
  PREEXE("BEGIN"), // BEGIN { ... }, run before the program
  QUESTION("?"),
  RBRACE("}"),
  RBRACKET("]"),
  REDO("redo"),
  RESCUE("rescue"),
  RESCUE_MOD("rescue"),
  RETRY("retry"),
  RETURN("return"),
  RPAREN(")"),
  SELF("self"),
  SEMI(";"),
  STRING("string literal"),
  STRING_BEGIN("string literal"), // up to and including the first "#{"
  STRING_END("string literal"), // from a "}" closing an interpolation to the end of the literal
  STRING_MID("string literal"), // from a "}" to the next "#{"
  SUPER("super"),
  SYMBOL("symbol"),
  THEN("then"),
  TRUE("true"),
  UNDEF("undef"),
  UNLESS("unless"),
  UNLESS_MOD("unless"),
  UNTIL("until"),
  UNTIL_MOD("until"),
  WHEN("when"),
  WHILE("while"),
  WHILE_MOD("while"),
  YIELD("yield");

  private final String name;

  private TokenKind(String name) {
    this.name = name;
  }

  @Override
  public String toString() {
    return name;
  }
}
