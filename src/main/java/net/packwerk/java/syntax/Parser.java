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

import com.google.common.base.Preconditions;
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Parser is a recursive-descent parser for Ruby.
 *
 * <p>The parser recovers the structure that matters for constant resolution (class, module and
 * method definitions, constant paths and assignments, blocks) and represents everything else as
 * {@link CompoundExpression}s. It is lenient where leniency cannot change that structure, for
 * example it does not require separators between statements and does not check operator
 * precedence. It gives up at the first error.
 */
final class Parser {

  /** Combines the parser result into a single value object. */
  static final class ParseResult {
    // Maps char offsets in the file to Locations.
    final FileLocations locs;

    /** The top-level statements of the parsed file, or empty if there were errors. */
    final ImmutableList<Expression> statements;

    // Errors encountered during scanning or parsing.
    final List<SyntaxError> errors;

    private ParseResult(
        FileLocations locs, ImmutableList<Expression> statements, List<SyntaxError> errors) {
      this.locs = locs;
      this.statements = Preconditions.checkNotNull(statements);
      this.errors = errors;
    }
  }

  // Thrown to abandon parsing once an error has been recorded.
  private static final class ParseAbandoned extends RuntimeException {
    ParseAbandoned() {
      super(null, null, /* enableSuppression= */ false, /* writableStackTrace= */ false);
    }
  }

  private static final EnumSet<TokenKind> FILE_END = EnumSet.of(TokenKind.EOF);
  private static final EnumSet<TokenKind> BODY_END = EnumSet.of(TokenKind.END);
  private static final EnumSet<TokenKind> BRACE_END = EnumSet.of(TokenKind.RBRACE);
  private static final EnumSet<TokenKind> PAREN_END = EnumSet.of(TokenKind.RPAREN);
  private static final EnumSet<TokenKind> INTERPOLATION_END =
      EnumSet.of(TokenKind.STRING_MID, TokenKind.STRING_END);

  // Keywords that start a clause of an enclosing if, case, begin or definition body.
  private static final EnumSet<TokenKind> CLAUSE_KEYWORDS =
      EnumSet.of(
          TokenKind.RESCUE,
          TokenKind.ELSE,
          TokenKind.ELSIF,
          TokenKind.ENSURE,
          TokenKind.WHEN,
          TokenKind.IN);

  private static final EnumSet<TokenKind> MODIFIER_KEYWORDS =
      EnumSet.of(
          TokenKind.IF_MOD,
          TokenKind.UNLESS_MOD,
          TokenKind.WHILE_MOD,
          TokenKind.UNTIL_MOD,
          TokenKind.RESCUE_MOD);

  private static final EnumSet<TokenKind> EXPRESSION_START =
      EnumSet.of(
          TokenKind.IDENTIFIER,
          TokenKind.CONSTANT,
          TokenKind.IVAR,
          TokenKind.CVAR,
          TokenKind.GVAR,
          TokenKind.NUMBER,
          TokenKind.STRING,
          TokenKind.STRING_BEGIN,
          TokenKind.SYMBOL,
          TokenKind.CHAR,
          TokenKind.HEREDOC,
          TokenKind.COLON3,
          TokenKind.LBRACKET,
          TokenKind.LBRACE,
          TokenKind.LPAREN,
          TokenKind.LAMBDA,
          TokenKind.SELF,
          TokenKind.NIL,
          TokenKind.TRUE,
          TokenKind.FALSE,
          TokenKind.KEYWORD_LITERAL,
          TokenKind.NOT,
          TokenKind.DEFINED,
          TokenKind.DEF,
          TokenKind.CLASS,
          TokenKind.MODULE,
          TokenKind.IF,
          TokenKind.UNLESS,
          TokenKind.WHILE,
          TokenKind.UNTIL,
          TokenKind.CASE,
          TokenKind.BEGIN,
          TokenKind.PREEXE,
          TokenKind.POSTEXE,
          TokenKind.FOR,
          TokenKind.RETURN,
          TokenKind.BREAK,
          TokenKind.NEXT,
          TokenKind.REDO,
          TokenKind.RETRY,
          TokenKind.YIELD,
          TokenKind.SUPER);

  // Tokens that, preceded by a space, start the first argument of a call without parentheses,
  // as in "include Foo" or "private def bar".
  private static final EnumSet<TokenKind> COMMAND_ARGUMENT_START =
      EnumSet.of(
          TokenKind.IDENTIFIER,
          TokenKind.CONSTANT,
          TokenKind.IVAR,
          TokenKind.CVAR,
          TokenKind.GVAR,
          TokenKind.NUMBER,
          TokenKind.STRING,
          TokenKind.STRING_BEGIN,
          TokenKind.SYMBOL,
          TokenKind.CHAR,
          TokenKind.HEREDOC,
          TokenKind.LABEL,
          TokenKind.COLON3,
          TokenKind.LBRACKET,
          TokenKind.LPAREN,
          TokenKind.LAMBDA,
          TokenKind.SELF,
          TokenKind.NIL,
          TokenKind.TRUE,
          TokenKind.FALSE,
          TokenKind.KEYWORD_LITERAL,
          TokenKind.NOT,
          TokenKind.DEFINED,
          TokenKind.DEF,
          TokenKind.CASE,
          TokenKind.BEGIN,
          TokenKind.YIELD,
          TokenKind.SUPER);

  private static final ImmutableSet<String> PREFIX_OPERATORS =
      ImmutableSet.of("!", "-", "+", "~", "*", "**", "&", "..", "...");

  private static final ImmutableSet<String> PARAMETER_PREFIXES =
      ImmutableSet.of("*", "**", "&", "...");

  /** Current lookahead token. May be mutated by the parser. */
  private final Lexer token; // token.kind is a prettier alias for lexer.kind

  private final Lexer lexer;
  private final FileLocations locs;
  private final List<SyntaxError> errors;

  // End offset of the most recently consumed token.
  private int lastEnd;

  // When set, "do" ends an expression instead of opening a block, as in "while x do".
  private boolean noDoBlock;

  // When set, "|" ends an expression instead of being an operator, as in "{ |a = 1| }".
  private boolean noPipe;

  // When set, "^" pins a value, as in "in ^expected".
  private boolean inPattern;

  private Parser(Lexer lexer, List<SyntaxError> errors) {
    this.lexer = lexer;
    this.locs = lexer.locs;
    this.errors = errors;
    this.token = lexer;
    nextToken();
  }

  // Main entry point for parsing a file.
  static ParseResult parseFile(ParserInput input) {
    List<SyntaxError> errors = new ArrayList<>();
    Lexer lexer = new Lexer(input, errors);
    ImmutableList<Expression> statements = ImmutableList.of();
    try {
      Parser parser = new Parser(lexer, errors);
      statements = parser.parseBody(FILE_END);
      parser.expect(TokenKind.EOF);
    } catch (ParseAbandoned ex) {
      Verify.verify(!errors.isEmpty(), "parse abandoned without an error");
    } catch (StackOverflowError ex) {
      // Deeply nested input. Treat it like any other unparseable file.
      errors.add(
          new SyntaxError(
              lexer.locs.getLocation(lexer.start),
              "internal error: stack overflow while parsing " + input.getFile()));
    }
    if (!errors.isEmpty()) {
      statements = ImmutableList.of();
    }
    return new ParseResult(lexer.locs, statements, errors);
  }

  private void nextToken() {
    lastEnd = token.end;
    lexer.nextToken();
    if (!errors.isEmpty()) {
      throw new ParseAbandoned(); // the lexer reported an error
    }
  }

  // Records a syntax error at the current token and returns the exception that abandons the parse.
  private ParseAbandoned syntaxError(String message) {
    return syntaxError(token.start, message);
  }

  private ParseAbandoned syntaxError(int offset, String message) {
    String near = token.kind == TokenKind.EOF ? "end of file" : "'" + token.raw + "'";
    errors.add(
        new SyntaxError(locs.getLocation(offset), "syntax error at " + near + ": " + message));
    return new ParseAbandoned();
  }

  // Consumes a token of the given kind, and returns its end offset.
  @CanIgnoreReturnValue
  private int expect(TokenKind kind) {
    if (token.kind != kind) {
      throw syntaxError("expected " + kind);
    }
    int end = token.end;
    if (kind != TokenKind.EOF) {
      nextToken();
    }
    return end;
  }

  private void skipNewlines() {
    while (token.kind == TokenKind.NEWLINE) {
      nextToken();
    }
  }

  private boolean isOperator(String op) {
    return token.kind == TokenKind.OPERATOR && token.raw.equals(op);
  }

  private boolean canStartExpression() {
    if (token.kind == TokenKind.OPERATOR) {
      return PREFIX_OPERATORS.contains(token.raw) || (inPattern && token.raw.equals("^"));
    }
    return EXPRESSION_START.contains(token.kind);
  }

  // Reports whether the current token starts the arguments of a call without parentheses.
  private boolean startsCommandArgument() {
    if (!token.spaceBefore) {
      return false;
    }
    if (token.kind == TokenKind.OPERATOR) {
      return PREFIX_OPERATORS.contains(token.raw) && !token.spaceAfter;
    }
    return COMMAND_ARGUMENT_START.contains(token.kind);
  }

  // ---- Statements ----

  // Parses statements up to, but not including, one of the terminators or a clause keyword.
  private ImmutableList<Expression> parseStatements(EnumSet<TokenKind> terminators) {
    ImmutableList.Builder<Expression> list = ImmutableList.builder();
    while (true) {
      while (token.kind == TokenKind.NEWLINE || token.kind == TokenKind.SEMI) {
        nextToken();
      }
      if (token.kind == TokenKind.EOF
          || terminators.contains(token.kind)
          || CLAUSE_KEYWORDS.contains(token.kind)) {
        return list.build();
      }
      list.add(parseStatement());
    }
  }

  // Parses statements followed by any clauses (rescue, else, when and so on), each of which is
  // represented as a compound expression containing its header and its statements.
  private ImmutableList<Expression> parseBody(EnumSet<TokenKind> terminators) {
    boolean savedNoDoBlock = noDoBlock;
    boolean savedNoPipe = noPipe;
    boolean savedInPattern = inPattern;
    noDoBlock = false;
    noPipe = false;
    inPattern = false;
    try {
      ImmutableList.Builder<Expression> list = ImmutableList.builder();
      list.addAll(parseStatements(terminators));
      while (CLAUSE_KEYWORDS.contains(token.kind)) {
        list.add(parseClause(terminators));
      }
      return list.build();
    } finally {
      noDoBlock = savedNoDoBlock;
      noPipe = savedNoPipe;
      inPattern = savedInPattern;
    }
  }

  private CompoundExpression parseClause(EnumSet<TokenKind> terminators) {
    int start = token.start;
    TokenKind clause = token.kind;
    nextToken();
    ImmutableList.Builder<Expression> children = ImmutableList.builder();
    CompoundExpression.Form form;
    switch (clause) {
      case RESCUE:
        // rescue A, B => e
        form = CompoundExpression.Form.RESCUE;
        while (canStartExpression()) {
          children.add(parseBinary());
          if (token.kind != TokenKind.COMMA) {
            break;
          }
          nextToken();
        }
        if (token.kind == TokenKind.ASSOC) {
          nextToken();
          children.add(parseBinary());
        }
        break;
      case WHEN:
        form = CompoundExpression.Form.WHEN;
        do {
          children.add(parseBinary());
        } while (consume(TokenKind.COMMA));
        break;
      case IN:
        form = CompoundExpression.Form.IN;
        children.add(parsePattern());
        if (token.kind == TokenKind.IF_MOD || token.kind == TokenKind.UNLESS_MOD) {
          nextToken();
          children.add(parseExpression());
        }
        break;
      case ELSIF:
        form = CompoundExpression.Form.ELSIF;
        children.add(parseExpression());
        break;
      case ELSE:
        form = CompoundExpression.Form.ELSE;
        break;
      case ENSURE:
        form = CompoundExpression.Form.ENSURE;
        break;
      default:
        throw new IllegalStateException(clause.name());
    }
    consume(TokenKind.THEN);
    children.addAll(parseStatements(terminators));
    return new CompoundExpression(locs, form, start, children.build(), lastEnd);
  }

  // Consumes the current token if it has the given kind.
  @CanIgnoreReturnValue
  private boolean consume(TokenKind kind) {
    if (token.kind == kind) {
      nextToken();
      return true;
    }
    return false;
  }

  // stmt = expr_stmt {modifier expr_stmt}
  private Expression parseStatement() {
    int start = token.start;
    Expression e = parseExpressionStatement();
    while (MODIFIER_KEYWORDS.contains(token.kind)) {
      nextToken();
      Expression condition = parseExpressionStatement();
      e =
          new CompoundExpression(
              locs,
              CompoundExpression.Form.MODIFIER,
              start,
              ImmutableList.of(e, condition),
              lastEnd);
    }
    return e;
  }

  // Parses an expression, a multiple assignment, or a one-line pattern match.
  private Expression parseExpressionStatement() {
    int start = token.start;
    Expression e = parseExpression(/* allowMultipleValues= */ true);
    if (token.kind == TokenKind.COMMA && isAssignable(e)) {
      return parseMultipleAssignment(start, e);
    }
    if (token.kind == TokenKind.ASSOC || token.kind == TokenKind.IN) {
      nextToken();
      Expression pattern = parsePattern();
      return new CompoundExpression(
          locs,
          CompoundExpression.Form.PATTERN_MATCH,
          start,
          ImmutableList.of(e, pattern),
          lastEnd);
    }
    return e;
  }

  private static boolean isAssignable(Expression e) {
    switch (e.kind()) {
      case IDENTIFIER:
      case CONSTANT:
      case VARIABLE:
        return true;
      case CALL:
        return ((CallExpression) e).getBlock() == null;
      case COMPOUND:
        CompoundExpression.Form form = ((CompoundExpression) e).getForm();
        return form == CompoundExpression.Form.OPERATOR || form == CompoundExpression.Form.PARENS;
      default:
        return false;
    }
  }

  // a, B, *c = values
  private Expression parseMultipleAssignment(int start, Expression first) {
    ImmutableList.Builder<Expression> children = ImmutableList.builder();
    children.add(assignmentTarget(first));
    while (consume(TokenKind.COMMA)) {
      if (token.kind == TokenKind.EQUALS) {
        break; // trailing comma, as in "a, = list"
      }
      children.add(assignmentTarget(parseOperand()));
    }
    expect(TokenKind.EQUALS);
    do {
      children.add(parseExpression());
    } while (consume(TokenKind.COMMA));
    return new CompoundExpression(
        locs, CompoundExpression.Form.MULTIPLE_ASSIGNMENT, start, children.build(), lastEnd);
  }

  private Expression assignmentTarget(Expression e) {
    if (e instanceof ConstantExpression) {
      ConstantExpression constant = (ConstantExpression) e;
      return new ConstantAssignment(locs, constant, "=", null, constant.getEndOffset());
    }
    return e;
  }

  // Parses a pattern of a case/in clause or a one-line pattern match. Patterns are parsed as
  // expressions, which they resemble closely enough for our purposes.
  private Expression parsePattern() {
    boolean saved = inPattern;
    inPattern = true;
    try {
      return parsePatternItems();
    } finally {
      inPattern = saved;
    }
  }

  private Expression parsePatternItems() {
    int start = token.start;
    ImmutableList.Builder<Expression> items = ImmutableList.builder();
    do {
      if (token.kind == TokenKind.LABEL) {
        items.add(parseLabel());
        if (canStartExpression()) {
          items.add(parseBinary());
        }
        continue;
      }
      items.add(parseBinary());
      if (consume(TokenKind.ASSOC)) {
        items.add(parseBinary());
      }
    } while (consume(TokenKind.COMMA));
    ImmutableList<Expression> list = items.build();
    if (list.size() == 1) {
      return list.get(0);
    }
    return new CompoundExpression(locs, CompoundExpression.Form.ARRAY, start, list, lastEnd);
  }

  // ---- Expressions ----

  private Expression parseExpression() {
    return parseExpression(/* allowMultipleValues= */ false);
  }

  // expr = binary [assign_op expr {',' expr}]
  private Expression parseExpression(boolean allowMultipleValues) {
    int start = token.start;
    Expression lhs = parseBinary();
    if (token.kind != TokenKind.EQUALS && token.kind != TokenKind.OP_ASSIGN) {
      return lhs;
    }
    String op = token.raw;
    nextToken();
    Expression rhs = parseExpression(allowMultipleValues);
    if (allowMultipleValues && token.kind == TokenKind.COMMA) {
      // A = 1, 2
      int valuesStart = rhs.getStartOffset();
      ImmutableList.Builder<Expression> values = ImmutableList.builder();
      values.add(rhs);
      while (consume(TokenKind.COMMA)) {
        values.add(parseExpression());
      }
      rhs =
          new CompoundExpression(
              locs, CompoundExpression.Form.ARRAY, valuesStart, values.build(), lastEnd);
    }
    if (lhs instanceof ConstantExpression) {
      return new ConstantAssignment(locs, (ConstantExpression) lhs, op, rhs, lastEnd);
    }
    return new CompoundExpression(
        locs, CompoundExpression.Form.ASSIGNMENT, start, ImmutableList.of(lhs, rhs), lastEnd);
  }

  private boolean atBinaryOperator() {
    switch (token.kind) {
      case OPERATOR:
      case AND:
      case OR:
        return true;
      case PIPE:
        return !noPipe;
      default:
        return false;
    }
  }

  // binary = operand {binop operand | '?' expr ':' expr}
  // All binary operators are treated alike; precedence does not affect constant resolution.
  private Expression parseBinary() {
    int start = token.start;
    Expression e = parseOperand();
    while (true) {
      if (atBinaryOperator()) {
        boolean range = isOperator("..") || isOperator("...");
        nextToken();
        if (range && !canStartExpression()) {
          // endless range, as in "x[1..]"
          e =
              new CompoundExpression(
                  locs, CompoundExpression.Form.OPERATOR, start, ImmutableList.of(e), lastEnd);
          continue;
        }
        Expression rhs = parseOperand();
        e =
            new CompoundExpression(
                locs, CompoundExpression.Form.OPERATOR, start, ImmutableList.of(e, rhs), lastEnd);
      } else if (token.kind == TokenKind.QUESTION) {
        nextToken();
        Expression then = parseExpression();
        expect(TokenKind.COLON);
        Expression otherwise = parseExpression();
        e =
            new CompoundExpression(
                locs,
                CompoundExpression.Form.OPERATOR,
                start,
                ImmutableList.of(e, then, otherwise),
                lastEnd);
      } else {
        return e;
      }
    }
  }

  // operand = prefix_op operand | 'not' operand | 'defined?' operand | postfix
  private Expression parseOperand() {
    int start = token.start;
    if (inPattern && isOperator("^")) {
      // ^name, ^@ivar or ^(expr)
      nextToken();
      Expression pinned = parseOperand();
      return new CompoundExpression(
          locs, CompoundExpression.Form.OPERATOR, start, ImmutableList.of(pinned), lastEnd);
    }
    if (token.kind == TokenKind.OPERATOR && PREFIX_OPERATORS.contains(token.raw)) {
      nextToken();
      if (!canStartExpression()) {
        // anonymous splat or block argument, as in "foo(*)", or a beginless range end
        return new CompoundExpression(
            locs, CompoundExpression.Form.OPERATOR, start, ImmutableList.of(), lastEnd);
      }
      Expression operand = parseOperand();
      return new CompoundExpression(
          locs, CompoundExpression.Form.OPERATOR, start, ImmutableList.of(operand), lastEnd);
    }
    if (token.kind == TokenKind.NOT) {
      nextToken();
      Expression operand = parseOperand();
      return new CompoundExpression(
          locs, CompoundExpression.Form.OPERATOR, start, ImmutableList.of(operand), lastEnd);
    }
    if (token.kind == TokenKind.DEFINED) {
      nextToken();
      Expression operand = parseOperand();
      return new CompoundExpression(
          locs, CompoundExpression.Form.DEFINED, start, ImmutableList.of(operand), lastEnd);
    }
    return parsePostfix(parsePrimary());
  }

  private Expression parsePrimary() {
    int start = token.start;
    switch (token.kind) {
      case CONSTANT:
        {
          String name = (String) token.value;
          nextToken();
          if (token.kind == TokenKind.LPAREN && !token.spaceBefore) {
            return parseCallArguments(null, name, start); // a method such as Integer("1")
          }
          return new ConstantExpression(locs, null, name, start);
        }
      case COLON3:
        {
          nextToken();
          if (token.kind != TokenKind.CONSTANT) {
            throw syntaxError("expected constant after '::'");
          }
          String name = (String) token.value;
          int nameOffset = token.start;
          nextToken();
          return new ConstantExpression(locs, new TopLevelScope(locs, start), name, nameOffset);
        }
      case IDENTIFIER:
        {
          String name = (String) token.value;
          nextToken();
          return parseIdentifierRest(start, name, /* alwaysCall= */ false);
        }
      case YIELD:
      case SUPER:
        {
          String name = token.raw;
          nextToken();
          return parseIdentifierRest(start, name, /* alwaysCall= */ true);
        }
      case IVAR:
        return parseVariable(Variable.Scope.INSTANCE);
      case CVAR:
        return parseVariable(Variable.Scope.CLASS);
      case GVAR:
        return parseVariable(Variable.Scope.GLOBAL);
      case SELF:
        nextToken();
        return new SelfExpression(locs, start);
      case NUMBER:
      case SYMBOL:
      case CHAR:
      case NIL:
      case TRUE:
      case FALSE:
      case KEYWORD_LITERAL:
        {
          Literal literal = new Literal(locs, token.kind, token.raw, start, token.end);
          nextToken();
          return literal;
        }
      case STRING:
      case STRING_BEGIN:
        return parseStringLiterals();
      case HEREDOC:
        return parseHeredoc();
      case LPAREN:
        {
          nextToken();
          ImmutableList<Expression> statements = parseBody(PAREN_END);
          expect(TokenKind.RPAREN);
          return new CompoundExpression(
              locs, CompoundExpression.Form.PARENS, start, statements, lastEnd);
        }
      case LBRACKET:
        {
          nextToken();
          ImmutableList<Expression> elements = parseArguments(TokenKind.RBRACKET);
          expect(TokenKind.RBRACKET);
          return new CompoundExpression(
              locs, CompoundExpression.Form.ARRAY, start, elements, lastEnd);
        }
      case LBRACE:
        return parseHashLiteral();
      case LAMBDA:
        return parseLambda();
      case CLASS:
        return parseClass();
      case MODULE:
        return parseModule();
      case DEF:
        return parseDef();
      case IF:
      case UNLESS:
        return parseConditional();
      case WHILE:
      case UNTIL:
        return parseLoop();
      case FOR:
        return parseFor();
      case CASE:
        return parseCase();
      case BEGIN:
        {
          nextToken();
          ImmutableList<Expression> body = parseBody(BODY_END);
          expect(TokenKind.END);
          return new CompoundExpression(locs, CompoundExpression.Form.BEGIN, start, body, lastEnd);
        }
      case PREEXE:
      case POSTEXE:
        {
          // BEGIN { ... } and END { ... }
          CompoundExpression.Form form =
              token.kind == TokenKind.PREEXE
                  ? CompoundExpression.Form.PREEXE
                  : CompoundExpression.Form.POSTEXE;
          nextToken();
          BlockExpression block = parseBraceBlock();
          return new CompoundExpression(locs, form, start, ImmutableList.of(block), lastEnd);
        }
      case RETURN:
      case BREAK:
      case NEXT:
      case REDO:
      case RETRY:
        return parseJump();
      case ALIAS:
        {
          nextToken();
          Expression newName = parseMethodReference();
          Expression oldName = parseMethodReference();
          ImmutableList<Expression> names = ImmutableList.of(newName, oldName);
          return new CompoundExpression(locs, CompoundExpression.Form.ALIAS, start, names, lastEnd);
        }
      case UNDEF:
        {
          nextToken();
          ImmutableList.Builder<Expression> names = ImmutableList.builder();
          do {
            names.add(parseMethodReference());
          } while (consume(TokenKind.COMMA));
          return new CompoundExpression(
              locs, CompoundExpression.Form.UNDEF, start, names.build(), lastEnd);
        }
      default:
        throw syntaxError("expected expression");
    }
  }

  private Variable parseVariable(Variable.Scope scope) {
    Variable variable = new Variable(locs, scope, (String) token.value, token.start);
    nextToken();
    return variable;
  }

  // Parses what follows a method name without receiver: parenthesized arguments, arguments without
  // parentheses, or nothing.
  private Expression parseIdentifierRest(int start, String name, boolean alwaysCall) {
    if (token.kind == TokenKind.LPAREN && !token.spaceBefore) {
      return parseCallArguments(null, name, start);
    }
    if (startsCommandArgument()) {
      ImmutableList<Expression> args = parseCommandArguments();
      return new CallExpression(locs, null, name, start, args, null, lastEnd);
    }
    if (alwaysCall) {
      return new CallExpression(locs, null, name, start, ImmutableList.of(), null, lastEnd);
    }
    return new Identifier(locs, name, start);
  }

  // Parses "(args)" following a method name.
  private CallExpression parseCallArguments(
      @Nullable Expression receiver, String name, int start) {
    expect(TokenKind.LPAREN);
    ImmutableList<Expression> args = parseArguments(TokenKind.RPAREN);
    expect(TokenKind.RPAREN);
    return new CallExpression(locs, receiver, name, start, args, null, lastEnd);
  }

  // Parses a method name operand of alias or undef.
  private Expression parseMethodReference() {
    if (token.kind == TokenKind.SYMBOL || token.kind == TokenKind.STRING_BEGIN) {
      return parsePrimary();
    }
    if (token.kind == TokenKind.NEWLINE
        || token.kind == TokenKind.SEMI
        || token.kind == TokenKind.EOF) {
      throw syntaxError("expected method name");
    }
    Literal name = new Literal(locs, token.kind, token.raw, token.start, token.end);
    nextToken();
    return name;
  }

  // ---- Postfix operations: scope resolution, method calls, indexing and blocks ----

  private Expression parsePostfix(Expression e) {
    while (true) {
      switch (token.kind) {
        case COLON2:
          e = parseScopedName(e);
          break;
        case DOT:
        case AMPER_DOT:
          e = parseMethodCall(e);
          break;
        case LBRACKET:
          if (token.spaceBefore) {
            return e;
          }
          {
            int start = e.getStartOffset();
            nextToken();
            ImmutableList<Expression> args = parseArguments(TokenKind.RBRACKET);
            expect(TokenKind.RBRACKET);
            e = new CallExpression(locs, e, "[]", start, args, null, lastEnd);
          }
          break;
        case LBRACE:
          if (!acceptsBlock(e)) {
            return e;
          }
          e = attachBlock(e, parseBraceBlock());
          break;
        case DO:
          if (noDoBlock || !acceptsBlock(e)) {
            return e;
          }
          e = attachBlock(e, parseDoBlock());
          break;
        default:
          return e;
      }
    }
  }

  // expr '::' CONSTANT | expr '::' method
  private Expression parseScopedName(Expression scope) {
    nextToken();
    int start = scope.getStartOffset();
    if (token.kind == TokenKind.CONSTANT) {
      String name = (String) token.value;
      int nameOffset = token.start;
      nextToken();
      if (token.kind == TokenKind.LPAREN && !token.spaceBefore) {
        return parseCallArguments(scope, name, start);
      }
      return new ConstantExpression(locs, scope, name, nameOffset);
    }
    if (token.kind == TokenKind.IDENTIFIER) {
      String name = (String) token.value;
      nextToken();
      return parseMethodCallRest(scope, name, start);
    }
    throw syntaxError("expected constant or method name after '::'");
  }

  // expr '.' name [args]
  private Expression parseMethodCall(Expression receiver) {
    nextToken();
    int start = receiver.getStartOffset();
    String name;
    switch (token.kind) {
      case IDENTIFIER:
      case CONSTANT:
        name = (String) token.value;
        nextToken();
        break;
      case LPAREN:
        name = "call"; // foo.(x)
        break;
      case OPERATOR:
      case PIPE:
        name = token.raw;
        nextToken();
        break;
      default:
        throw syntaxError("expected method name after '.'");
    }
    return parseMethodCallRest(receiver, name, start);
  }

  private Expression parseMethodCallRest(Expression receiver, String name, int start) {
    if (token.kind == TokenKind.LPAREN && !token.spaceBefore) {
      return parseCallArguments(receiver, name, start);
    }
    if (startsCommandArgument()) {
      ImmutableList<Expression> args = parseCommandArguments();
      return new CallExpression(locs, receiver, name, start, args, null, lastEnd);
    }
    return new CallExpression(locs, receiver, name, start, ImmutableList.of(), null, lastEnd);
  }

  private static boolean acceptsBlock(Expression e) {
    return e instanceof Identifier
        || (e instanceof CallExpression && ((CallExpression) e).getBlock() == null);
  }

  private CallExpression attachBlock(Expression e, BlockExpression block) {
    if (e instanceof Identifier) {
      Identifier id = (Identifier) e;
      return new CallExpression(
          locs, null, id.getName(), id.getStartOffset(), ImmutableList.of(), block, lastEnd);
    }
    return ((CallExpression) e).withBlock(block);
  }

  // ---- Arguments and literals ----

  // Parses a comma-separated argument list up to, but not including, the closing token. Newlines
  // are insignificant inside the brackets.
  private ImmutableList<Expression> parseArguments(TokenKind closer) {
    boolean savedNoDoBlock = noDoBlock;
    boolean savedNoPipe = noPipe;
    noDoBlock = false;
    noPipe = false;
    try {
      ImmutableList.Builder<Expression> args = ImmutableList.builder();
      skipNewlines();
      while (token.kind != closer) {
        parseArgument(args);
        skipNewlines();
        if (!consume(TokenKind.COMMA)) {
          break;
        }
        skipNewlines();
      }
      return args.build();
    } finally {
      noDoBlock = savedNoDoBlock;
      noPipe = savedNoPipe;
    }
  }

  // Parses the arguments of a call without parentheses, as in "include Foo, Bar".
  private ImmutableList<Expression> parseCommandArguments() {
    ImmutableList.Builder<Expression> args = ImmutableList.builder();
    do {
      parseArgument(args);
    } while (consume(TokenKind.COMMA));
    return args.build();
  }

  // arg = (LABEL [expr] | expr) ['=>' expr]
  // The arrow after a label binds a variable in a hash pattern, as in "in {name: String => n}".
  private void parseArgument(ImmutableList.Builder<Expression> args) {
    if (token.kind == TokenKind.LABEL) {
      args.add(parseLabel());
      if (canStartExpression()) {
        args.add(parseExpression());
      }
    } else {
      args.add(parseExpression());
    }
    if (consume(TokenKind.ASSOC)) {
      args.add(parseExpression());
    }
  }

  private Literal parseLabel() {
    Literal label = new Literal(locs, TokenKind.LABEL, token.raw, token.start, token.end);
    nextToken();
    return label;
  }

  private Expression parseHashLiteral() {
    int start = token.start;
    expect(TokenKind.LBRACE);
    ImmutableList<Expression> entries = parseArguments(TokenKind.RBRACE);
    expect(TokenKind.RBRACE);
    return new CompoundExpression(locs, CompoundExpression.Form.HASH, start, entries, lastEnd);
  }

  // Parses adjacent string literals, which Ruby concatenates.
  private Expression parseStringLiterals() {
    int start = token.start;
    ImmutableList.Builder<Expression> parts = ImmutableList.builder();
    boolean interpolated = false;
    do {
      if (token.kind == TokenKind.STRING) {
        nextToken();
      } else {
        interpolated = true;
        parts.addAll(parseInterpolation());
      }
    } while (token.kind == TokenKind.STRING || token.kind == TokenKind.STRING_BEGIN);
    if (interpolated) {
      return new InterpolatedString(locs, start, parts.build(), lastEnd);
    }
    return new Literal(locs, TokenKind.STRING, lexer.bufferSlice(start, lastEnd), start, lastEnd);
  }

  // Parses STRING_BEGIN stmts {STRING_MID stmts} STRING_END, returning the statements.
  private ImmutableList<Expression> parseInterpolation() {
    ImmutableList.Builder<Expression> parts = ImmutableList.builder();
    expect(TokenKind.STRING_BEGIN);
    while (true) {
      parts.addAll(parseBody(INTERPOLATION_END));
      if (consume(TokenKind.STRING_MID)) {
        continue;
      }
      expect(TokenKind.STRING_END);
      return parts.build();
    }
  }

  // The body of an interpolating heredoc is parsed by a separate parser over the same buffer.
  private Expression parseHeredoc() {
    int start = token.start;
    int end = token.end;
    String raw = token.raw;
    Lexer.Heredoc heredoc = (Lexer.Heredoc) token.value;
    nextToken();
    if (!heredoc.interpolate) {
      return new Literal(locs, TokenKind.HEREDOC, raw, start, end);
    }
    Parser bodyParser = new Parser(lexer.heredocLexer(heredoc), errors);
    ImmutableList<Expression> parts = bodyParser.parseHeredocBody();
    return new InterpolatedString(locs, start, parts, end);
  }

  private ImmutableList<Expression> parseHeredocBody() {
    ImmutableList<Expression> parts = ImmutableList.of();
    if (token.kind == TokenKind.STRING_BEGIN) {
      parts = parseInterpolation();
    } else {
      expect(TokenKind.STRING);
    }
    expect(TokenKind.EOF);
    return parts;
  }

  // ---- Blocks and parameters ----

  private BlockExpression parseBraceBlock() {
    int start = token.start;
    expect(TokenKind.LBRACE);
    ImmutableList<Parameter> params = parseBlockParameters();
    ImmutableList<Expression> body = parseBody(BRACE_END);
    expect(TokenKind.RBRACE);
    return new BlockExpression(locs, start, params, body, lastEnd);
  }

  private BlockExpression parseDoBlock() {
    int start = token.start;
    expect(TokenKind.DO);
    ImmutableList<Parameter> params = parseBlockParameters();
    ImmutableList<Expression> body = parseBody(BODY_END);
    expect(TokenKind.END);
    return new BlockExpression(locs, start, params, body, lastEnd);
  }

  // Parses "|params|", if present.
  private ImmutableList<Parameter> parseBlockParameters() {
    skipNewlines();
    if (isOperator("||")) {
      nextToken();
      return ImmutableList.of();
    }
    if (token.kind != TokenKind.PIPE) {
      return ImmutableList.of();
    }
    nextToken();
    boolean savedNoPipe = noPipe;
    noPipe = true;
    try {
      ImmutableList<Parameter> params = parseParameterList(TokenKind.PIPE);
      expect(TokenKind.PIPE);
      return params;
    } finally {
      noPipe = savedNoPipe;
    }
  }

  // Parses parameters up to, but not including, the closing token. A semicolon introduces
  // block-local variables, which are treated as further parameters.
  private ImmutableList<Parameter> parseParameterList(TokenKind closer) {
    ImmutableList.Builder<Parameter> params = ImmutableList.builder();
    skipNewlines();
    while (token.kind != closer) {
      params.add(parseParameter());
      skipNewlines();
      if (!consume(TokenKind.COMMA) && !consume(TokenKind.SEMI)) {
        break;
      }
      skipNewlines();
    }
    return params.build();
  }

  // Parses parameters without parentheses, as in "def foo a, b".
  private ImmutableList<Parameter> parseBareParameters() {
    ImmutableList.Builder<Parameter> params = ImmutableList.builder();
    do {
      params.add(parseParameter());
    } while (consume(TokenKind.COMMA));
    return params.build();
  }

  // param = ('*' | '**' | '&') [IDENTIFIER] | '...' | '(' params ')' | LABEL [default]
  //       | IDENTIFIER ['=' default]
  private Parameter parseParameter() {
    int start = token.start;
    if (token.kind == TokenKind.OPERATOR && PARAMETER_PREFIXES.contains(token.raw)) {
      nextToken();
      Identifier id = null;
      if (token.kind == TokenKind.IDENTIFIER) {
        id = new Identifier(locs, (String) token.value, token.start);
        nextToken();
      } else {
        consume(TokenKind.NIL); // **nil
      }
      return new Parameter(locs, start, id, null, ImmutableList.of(), lastEnd);
    }
    if (token.kind == TokenKind.LPAREN) {
      nextToken();
      ImmutableList<Parameter> nested = parseParameterList(TokenKind.RPAREN);
      expect(TokenKind.RPAREN);
      return new Parameter(locs, start, null, null, nested, lastEnd);
    }
    if (token.kind == TokenKind.LABEL) {
      Identifier id = new Identifier(locs, (String) token.value, start);
      nextToken();
      Expression defaultValue = canStartExpression() ? parseBinary() : null;
      return new Parameter(locs, start, id, defaultValue, ImmutableList.of(), lastEnd);
    }
    if (token.kind == TokenKind.IDENTIFIER) {
      Identifier id = new Identifier(locs, (String) token.value, start);
      nextToken();
      Expression defaultValue = consume(TokenKind.EQUALS) ? parseBinary() : null;
      return new Parameter(locs, start, id, defaultValue, ImmutableList.of(), lastEnd);
    }
    throw syntaxError("expected parameter");
  }

  // lambda = '->' [params] ('{' body '}' | 'do' body 'end')
  private Expression parseLambda() {
    int start = token.start;
    expect(TokenKind.LAMBDA);
    ImmutableList<Parameter> params = ImmutableList.of();
    if (consume(TokenKind.LPAREN)) {
      params = parseParameterList(TokenKind.RPAREN);
      expect(TokenKind.RPAREN);
    } else if (token.kind != TokenKind.LBRACE && token.kind != TokenKind.DO) {
      params = parseBareParameters();
    }
    ImmutableList<Expression> body;
    if (consume(TokenKind.LBRACE)) {
      body = parseBody(BRACE_END);
      expect(TokenKind.RBRACE);
    } else {
      expect(TokenKind.DO);
      body = parseBody(BODY_END);
      expect(TokenKind.END);
    }
    return new BlockExpression(locs, start, params, body, lastEnd);
  }

  // ---- Definitions ----

  // class_def = 'class' cpath ['<' expr] body 'end' | 'class' '<<' expr body 'end'
  private Expression parseClass() {
    int start = token.start;
    expect(TokenKind.CLASS);
    if (isOperator("<<")) {
      nextToken();
      Expression target = parseExpression();
      ImmutableList<Expression> body = parseBody(BODY_END);
      expect(TokenKind.END);
      return new SingletonClassDefinition(locs, start, target, body, lastEnd);
    }
    Expression name = parseDefinedName("class");
    Expression superclass = null;
    if (isOperator("<")) {
      nextToken();
      superclass = parseExpression();
    }
    ImmutableList<Expression> body = parseBody(BODY_END);
    expect(TokenKind.END);
    return new ClassDefinition(locs, start, name, superclass, body, lastEnd);
  }

  // module_def = 'module' cpath body 'end'
  private Expression parseModule() {
    int start = token.start;
    expect(TokenKind.MODULE);
    Expression name = parseDefinedName("module");
    ImmutableList<Expression> body = parseBody(BODY_END);
    expect(TokenKind.END);
    return new ModuleDefinition(locs, start, name, body, lastEnd);
  }

  /**
   * Parses the name of a class or module: a constant path whose leftmost scope may be any primary
   * expression, as in {@code Foo::Bar}, {@code ::Foo} or {@code self::Foo}.
   */
  private Expression parseDefinedName(String keyword) {
    int start = token.start;
    Expression e;
    switch (token.kind) {
      case CONSTANT:
        e = new ConstantExpression(locs, null, (String) token.value, start);
        nextToken();
        break;
      case COLON3:
        {
          nextToken();
          if (token.kind != TokenKind.CONSTANT) {
            throw syntaxError("expected constant after '::'");
          }
          e =
              new ConstantExpression(
                  locs, new TopLevelScope(locs, start), (String) token.value, token.start);
          nextToken();
          break;
        }
      case IDENTIFIER:
        e = new Identifier(locs, (String) token.value, start);
        nextToken();
        break;
      case SELF:
        e = new SelfExpression(locs, start);
        nextToken();
        break;
      case IVAR:
        e = parseVariable(Variable.Scope.INSTANCE);
        break;
      case CVAR:
        e = parseVariable(Variable.Scope.CLASS);
        break;
      case GVAR:
        e = parseVariable(Variable.Scope.GLOBAL);
        break;
      case LPAREN:
        {
          nextToken();
          ImmutableList<Expression> statements = parseBody(PAREN_END);
          expect(TokenKind.RPAREN);
          e =
              new CompoundExpression(
                  locs, CompoundExpression.Form.PARENS, start, statements, lastEnd);
          break;
        }
      default:
        throw syntaxError("expected " + keyword + " name");
    }
    while (token.kind == TokenKind.COLON2 || token.kind == TokenKind.DOT) {
      boolean scope = token.kind == TokenKind.COLON2;
      nextToken();
      if (scope && token.kind == TokenKind.CONSTANT) {
        e = new ConstantExpression(locs, e, (String) token.value, token.start);
      } else if (token.kind == TokenKind.IDENTIFIER || token.kind == TokenKind.CONSTANT) {
        e =
            new CallExpression(
                locs, e, (String) token.value, start, ImmutableList.of(), null, token.end);
      } else {
        throw syntaxError("expected " + keyword + " name");
      }
      nextToken();
    }
    if (!(e instanceof ConstantExpression)) {
      throw syntaxError(start, keyword + " name must be a constant");
    }
    return e;
  }

  // def = 'def' [receiver '.'] name [params] (body 'end' | '=' stmt)
  private Expression parseDef() {
    int start = token.start;
    expect(TokenKind.DEF);
    Expression receiver = null;
    int nameStart = token.start;
    TokenKind nameKind = token.kind;
    if (nameKind != TokenKind.IDENTIFIER
        && nameKind != TokenKind.CONSTANT
        && nameKind != TokenKind.SELF) {
      throw syntaxError("expected method name");
    }
    String name = nameKind == TokenKind.SELF ? "self" : (String) token.value;
    nextToken();
    if (consume(TokenKind.DOT)) {
      switch (nameKind) {
        case SELF:
          receiver = new SelfExpression(locs, nameStart);
          break;
        case CONSTANT:
          receiver = new ConstantExpression(locs, null, name, nameStart);
          break;
        default:
          receiver = new Identifier(locs, name, nameStart);
          break;
      }
      if (token.kind != TokenKind.IDENTIFIER && token.kind != TokenKind.CONSTANT) {
        throw syntaxError("expected method name");
      }
      name = (String) token.value;
      nextToken();
    }

    ImmutableList<Parameter> params = ImmutableList.of();
    if (consume(TokenKind.LPAREN)) {
      params = parseParameterList(TokenKind.RPAREN);
      expect(TokenKind.RPAREN);
    } else if (token.kind != TokenKind.NEWLINE
        && token.kind != TokenKind.SEMI
        && token.kind != TokenKind.EQUALS) {
      params = parseBareParameters();
    }

    ImmutableList<Expression> body;
    if (consume(TokenKind.EQUALS)) {
      body = ImmutableList.of(parseStatement()); // endless method
    } else {
      body = parseBody(BODY_END);
      expect(TokenKind.END);
    }
    return new MethodDefinition(locs, start, receiver, name, params, body, lastEnd);
  }

  // ---- Control flow ----

  // if_expr = ('if' | 'unless') expr ['then'] body {elsif} [else] 'end'
  private Expression parseConditional() {
    int start = token.start;
    CompoundExpression.Form form =
        token.kind == TokenKind.IF ? CompoundExpression.Form.IF : CompoundExpression.Form.UNLESS;
    nextToken();
    ImmutableList.Builder<Expression> children = ImmutableList.builder();
    children.add(parseExpressionStatement());
    consume(TokenKind.THEN);
    children.addAll(parseBody(BODY_END));
    expect(TokenKind.END);
    return new CompoundExpression(locs, form, start, children.build(), lastEnd);
  }

  // loop = ('while' | 'until') expr ['do'] body 'end'
  private Expression parseLoop() {
    int start = token.start;
    CompoundExpression.Form form =
        token.kind == TokenKind.WHILE
            ? CompoundExpression.Form.WHILE
            : CompoundExpression.Form.UNTIL;
    nextToken();
    ImmutableList.Builder<Expression> children = ImmutableList.builder();
    children.add(parseLoopHeaderExpression());
    consume(TokenKind.DO);
    children.addAll(parseBody(BODY_END));
    expect(TokenKind.END);
    return new CompoundExpression(locs, form, start, children.build(), lastEnd);
  }

  // for = 'for' vars 'in' expr ['do'] body 'end'
  private Expression parseFor() {
    int start = token.start;
    expect(TokenKind.FOR);
    ImmutableList.Builder<Expression> children = ImmutableList.builder();
    do {
      children.add(parseOperand());
    } while (consume(TokenKind.COMMA));
    expect(TokenKind.IN);
    children.add(parseLoopHeaderExpression());
    consume(TokenKind.DO);
    children.addAll(parseBody(BODY_END));
    expect(TokenKind.END);
    return new CompoundExpression(
        locs, CompoundExpression.Form.FOR, start, children.build(), lastEnd);
  }

  // Parses a loop condition or collection, in which "do" introduces the body, not a block.
  private Expression parseLoopHeaderExpression() {
    boolean saved = noDoBlock;
    noDoBlock = true;
    try {
      return parseExpression();
    } finally {
      noDoBlock = saved;
    }
  }

  // case = 'case' [expr] {when | in} [else] 'end'
  private Expression parseCase() {
    int start = token.start;
    expect(TokenKind.CASE);
    ImmutableList.Builder<Expression> children = ImmutableList.builder();
    // The subject is optional, as in "case\nwhen x > 1 then ...".
    if (token.kind != TokenKind.NEWLINE
        && token.kind != TokenKind.SEMI
        && token.kind != TokenKind.WHEN
        && token.kind != TokenKind.IN) {
      children.add(parseExpression());
    }
    children.addAll(parseBody(BODY_END));
    expect(TokenKind.END);
    return new CompoundExpression(
        locs, CompoundExpression.Form.CASE, start, children.build(), lastEnd);
  }

  // jump = ('return' | 'break' | 'next' | 'redo' | 'retry') [args]
  private Expression parseJump() {
    int start = token.start;
    nextToken();
    ImmutableList<Expression> values = ImmutableList.of();
    if (canStartExpression() || token.kind == TokenKind.LABEL) {
      values = parseCommandArguments();
    }
    return new CompoundExpression(locs, CompoundExpression.Form.JUMP, start, values, lastEnd);
  }
}
