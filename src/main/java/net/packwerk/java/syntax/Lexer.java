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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayDeque;
import java.util.EnumSet;
import java.util.List;
import javax.annotation.Nullable;

/**
 * A scanner for Ruby.
 *
 * <p>Ruby's grammar is not context free at the lexical level: whether {@code /} starts a regular
 * expression, whether {@code ::} is a scope separator, whether a newline ends a statement and so
 * on depends on the preceding token. The lexer tracks just enough state for these decisions; it
 * does not attempt to validate the program.
 */
final class Lexer {

  // --- These fields are accessed directly by the parser: ---

  // Mapping from file offsets to Locations.
  final FileLocations locs;

  // Information about current token. Updated by nextToken.
  TokenKind kind;
  int start; // start offset
  int end; // end offset
  String raw; // source text of token
  Object value; // name of a word-like token, or a Heredoc

  // Whether whitespace immediately precedes or follows the current token.
  boolean spaceBefore;
  boolean spaceAfter;

  // --- end of parser-visible fields ---

  private final List<SyntaxError> errors;

  // Input buffer and position. Scanning stops at limit.
  private final char[] buffer;
  private int pos;
  private final int limit;

  // The kind of the previously returned token, or null at start of input.
  @Nullable private TokenKind lastKind;

  // Open string literals, innermost first.
  private final ArrayDeque<StringTerm> strings = new ArrayDeque<>();

  // Offset at which scanning resumes after the current line, when heredoc bodies follow it.
  private int heredocResume = -1;

  // True while scanning the name of a method definition.
  private boolean afterDef;

  // Number of '?' ternary operators awaiting their ':'.
  private int ternaryDepth;

  // Tokens after which an expression is complete.
  private static final EnumSet<TokenKind> VALUE_END =
      EnumSet.of(
          TokenKind.IDENTIFIER,
          TokenKind.CONSTANT,
          TokenKind.IVAR,
          TokenKind.CVAR,
          TokenKind.GVAR,
          TokenKind.NUMBER,
          TokenKind.STRING,
          TokenKind.STRING_END,
          TokenKind.SYMBOL,
          TokenKind.CHAR,
          TokenKind.HEREDOC,
          TokenKind.RPAREN,
          TokenKind.RBRACKET,
          TokenKind.RBRACE,
          TokenKind.END,
          TokenKind.SELF,
          TokenKind.NIL,
          TokenKind.TRUE,
          TokenKind.FALSE,
          TokenKind.KEYWORD_LITERAL);

  // Keywords that may end a statement without a value.
  private static final EnumSet<TokenKind> BARE_KEYWORDS =
      EnumSet.of(
          TokenKind.RETURN,
          TokenKind.BREAK,
          TokenKind.NEXT,
          TokenKind.REDO,
          TokenKind.RETRY,
          TokenKind.YIELD,
          TokenKind.SUPER);

  // Tokens after which "word:" is a label even inside a ternary expression.
  private static final EnumSet<TokenKind> LABEL_CONTEXT =
      EnumSet.of(TokenKind.LPAREN, TokenKind.COMMA, TokenKind.LBRACE, TokenKind.PIPE);

  private static final ImmutableMap<String, TokenKind> KEYWORDS =
      ImmutableMap.<String, TokenKind>builder()
          .put("alias", TokenKind.ALIAS)
          .put("and", TokenKind.AND)
          .put("begin", TokenKind.BEGIN)
          .put("break", TokenKind.BREAK)
          .put("case", TokenKind.CASE)
          .put("class", TokenKind.CLASS)
          .put("def", TokenKind.DEF)
          .put("defined?", TokenKind.DEFINED)
          .put("do", TokenKind.DO)
          .put("else", TokenKind.ELSE)
          .put("elsif", TokenKind.ELSIF)
          .put("end", TokenKind.END)
          .put("ensure", TokenKind.ENSURE)
          .put("false", TokenKind.FALSE)
          .put("for", TokenKind.FOR)
          .put("if", TokenKind.IF)
          .put("in", TokenKind.IN)
          .put("module", TokenKind.MODULE)
          .put("next", TokenKind.NEXT)
          .put("nil", TokenKind.NIL)
          .put("not", TokenKind.NOT)
          .put("or", TokenKind.OR)
          .put("redo", TokenKind.REDO)
          .put("rescue", TokenKind.RESCUE)
          .put("retry", TokenKind.RETRY)
          .put("return", TokenKind.RETURN)
          .put("self", TokenKind.SELF)
          .put("super", TokenKind.SUPER)
          .put("then", TokenKind.THEN)
          .put("true", TokenKind.TRUE)
          .put("undef", TokenKind.UNDEF)
          .put("unless", TokenKind.UNLESS)
          .put("until", TokenKind.UNTIL)
          .put("when", TokenKind.WHEN)
          .put("while", TokenKind.WHILE)
          .put("yield", TokenKind.YIELD)
          .put("__FILE__", TokenKind.KEYWORD_LITERAL)
          .put("__LINE__", TokenKind.KEYWORD_LITERAL)
          .put("__ENCODING__", TokenKind.KEYWORD_LITERAL)
          .put("BEGIN", TokenKind.PREEXE)
          .put("END", TokenKind.POSTEXE)
          .buildOrThrow();

  // Keywords that become statement modifiers when they follow a complete statement.
  private static final ImmutableMap<TokenKind, TokenKind> MODIFIERS =
      ImmutableMap.of(
          TokenKind.IF, TokenKind.IF_MOD,
          TokenKind.UNLESS, TokenKind.UNLESS_MOD,
          TokenKind.WHILE, TokenKind.WHILE_MOD,
          TokenKind.UNTIL, TokenKind.UNTIL_MOD,
          TokenKind.RESCUE, TokenKind.RESCUE_MOD);

  // Longest first.
  private static final ImmutableList<String> OPERATORS =
      ImmutableList.of(
          "**=", "<=>", "===", "<<=", ">>=", "&&=", "||=", "...", "**", "==", "=~", "=>", "!=",
          "!~", "<=", ">=", "<<", ">>", "&&", "||", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=",
          "..", "+", "-", "*", "/", "%", "=", "!", "<", ">", "&", "|", "^", "~");

  private static final ImmutableList<String> ASSIGNMENT_OPERATORS =
      ImmutableList.of(
          "**=", "<<=", ">>=", "&&=", "||=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=");

  // Operators that may name a method, as in "def <=>(other)" or ":[]". Longest first.
  private static final ImmutableList<String> OPERATOR_METHODS =
      ImmutableList.of(
          "[]=", "<=>", "===", "[]", "==", "=~", "!=", "!~", "<<", ">>", "<=", ">=", "+@", "-@",
          "**", "<", ">", "+", "-", "*", "/", "%", "!", "~", "&", "|", "^", "`");

  /** The body of a heredoc, which lies on the lines following the one that opens it. */
  static final class Heredoc {
    final int bodyStart;
    final int bodyEnd; // offset of the terminator line
    final boolean interpolate;

    Heredoc(int bodyStart, int bodyEnd, boolean interpolate) {
      this.bodyStart = bodyStart;
      this.bodyEnd = bodyEnd;
      this.interpolate = interpolate;
    }
  }

  // An open string-like literal: a string, symbol, regexp, percent literal or heredoc body.
  private static final class StringTerm {
    final char open;
    final char close;
    final boolean interpolate;
    final boolean regexp;
    final boolean heredoc; // ends at the lexer's limit rather than at a delimiter
    final boolean labelAllowed;
    final int start;

    boolean started;
    int nesting; // depth of nested open delimiters, for paired delimiters
    boolean inCode; // inside "#{...}"
    int braceDepth; // unclosed '{' inside the current "#{...}"

    StringTerm(
        int start,
        char open,
        char close,
        boolean interpolate,
        boolean regexp,
        boolean heredoc,
        boolean labelAllowed) {
      this.start = start;
      this.open = open;
      this.close = close;
      this.interpolate = interpolate;
      this.regexp = regexp;
      this.heredoc = heredoc;
      this.labelAllowed = labelAllowed;
    }
  }

  // Constructs a lexer which tokenizes the parser input.
  // Errors are appended to errors.
  Lexer(ParserInput input, List<SyntaxError> errors) {
    this.locs = FileLocations.create(input.getContent(), input.getFile());
    this.buffer = input.getContent();
    this.pos = 0;
    this.limit = buffer.length;
    this.errors = errors;
  }

  // Constructs a lexer for the body of an interpolating heredoc of the outer lexer's input.
  private Lexer(Lexer outer, Heredoc heredoc) {
    this.locs = outer.locs;
    this.buffer = outer.buffer;
    this.errors = outer.errors;
    this.pos = heredoc.bodyStart;
    this.limit = heredoc.bodyEnd;
    strings.push(
        new StringTerm(
            heredoc.bodyStart,
            (char) 0,
            (char) 0,
            /* interpolate= */ true,
            /* regexp= */ false,
            /* heredoc= */ true,
            /* labelAllowed= */ false));
  }

  /** Returns a lexer whose tokens are the string parts and interpolations of a heredoc body. */
  Lexer heredocLexer(Heredoc heredoc) {
    Preconditions.checkArgument(heredoc.interpolate);
    return new Lexer(this, heredoc);
  }

  /**
   * Reads the next token, updating the Lexer's token fields. It is an error to call nextToken after
   * an EOF token.
   */
  void nextToken() {
    lastKind = kind;
    tokenize();
    Preconditions.checkState(kind != null);
    spaceBefore = start > 0 && isSpace(buffer[start - 1]);
    spaceAfter = end < limit && isSpace(buffer[end]);
    if (kind == TokenKind.NEWLINE || kind == TokenKind.SEMI) {
      ternaryDepth = 0;
    } else if (kind == TokenKind.QUESTION) {
      ternaryDepth++;
    } else if (kind == TokenKind.COLON && ternaryDepth > 0) {
      ternaryDepth--;
    }
  }

  private void error(String message, int pos) {
    errors.add(new SyntaxError(locs.getLocation(pos), message));
  }

  private void setToken(TokenKind kind, int start, int end) {
    this.kind = kind;
    this.start = start;
    this.end = end;
    this.value = null;
    this.raw = bufferSlice(start, end);
  }

  private void setToken(TokenKind kind, int start, int end, Object value) {
    setToken(kind, start, end);
    this.value = value;
  }

  private boolean valueEnd() {
    return lastKind != null && VALUE_END.contains(lastKind);
  }

  private boolean statementMayEnd() {
    return valueEnd() || (lastKind != null && BARE_KEYWORDS.contains(lastKind));
  }

  // Reports whether an ambiguous character at tokStart begins an argument of a command call such
  // as "puts /x/" or "foo ::Bar", rather than acting as a binary operator.
  private boolean commandArgument(boolean spaceBefore, int next) {
    return lastKind == TokenKind.IDENTIFIER && spaceBefore && next != -1 && !isSpace((char) next);
  }

  /**
   * Performs tokenization of the character buffer of file contents provided to the constructor. At
   * least one token will be produced.
   */
  private void tokenize() {
    StringTerm term = strings.peek();
    if (term != null && !term.inCode) {
      boolean first = !term.started;
      term.started = true;
      scanStringContent(term, pos, first);
      return;
    }

    kind = null;
    while (pos < limit) {
      int tokStart = pos;
      char c = buffer[pos];
      boolean atLineStart = pos == 0 || buffer[pos - 1] == '\n';
      boolean spaceBefore = pos > 0 && isSpace(buffer[pos - 1]);
      pos++;

      if (afterDef && !isSpace(c) && c != '.' && c != '(' && !isIdentifierStart(c)) {
        afterDef = false;
        if (operatorMethodName(tokStart)) {
          return;
        }
      }

      switch (c) {
        case ' ':
        case '\t':
        case '\r':
        case '\f':
          break;
        case '\\':
          // Backslash is valid only at the end of a line (or in a string).
          if (peek(0) == '\n') {
            pos += 1;
          } else if (peek(0) == '\r' && peek(1) == '\n') {
            pos += 2;
          } else {
            error("invalid character: '\\'", tokStart);
          }
          break;
        case '\n':
          newline(tokStart);
          break;
        case '#':
          skipComment();
          break;
        case ';':
          setToken(TokenKind.SEMI, tokStart, pos);
          break;
        case ',':
          setToken(TokenKind.COMMA, tokStart, pos);
          break;
        case '(':
          setToken(TokenKind.LPAREN, tokStart, pos);
          break;
        case ')':
          setToken(TokenKind.RPAREN, tokStart, pos);
          break;
        case '[':
          setToken(TokenKind.LBRACKET, tokStart, pos);
          break;
        case ']':
          setToken(TokenKind.RBRACKET, tokStart, pos);
          break;
        case '{':
          if (term != null) {
            term.braceDepth++;
          }
          setToken(TokenKind.LBRACE, tokStart, pos);
          break;
        case '}':
          if (term != null && term.braceDepth == 0) {
            // closes "#{"
            term.inCode = false;
            scanStringContent(term, tokStart, /* first= */ false);
          } else {
            if (term != null) {
              term.braceDepth--;
            }
            setToken(TokenKind.RBRACE, tokStart, pos);
          }
          break;
        case '"':
        case '`':
          startString(tokStart, c, c, /* interpolate= */ true, /* regexp= */ false, c == '"');
          break;
        case '\'':
          startString(tokStart, c, c, /* interpolate= */ false, /* regexp= */ false, true);
          break;
        case ':':
          colon(tokStart, spaceBefore);
          break;
        case '?':
          questionMark(tokStart, spaceBefore);
          break;
        case '/':
          if (!valueEnd() || (commandArgument(spaceBefore, peek(0)) && peek(0) != '=')) {
            startString(tokStart, '/', '/', /* interpolate= */ true, /* regexp= */ true, false);
          } else {
            operator(tokStart);
          }
          break;
        case '%':
          if (!valueEnd() || (commandArgument(spaceBefore, peek(0)) && peek(0) != '=')) {
            if (percentLiteral(tokStart)) {
              break;
            }
          }
          operator(tokStart);
          break;
        case '<':
          if (peek(0) == '<'
              && lastKind != TokenKind.CLASS
              && (!valueEnd() || commandArgument(spaceBefore, peek(1)))
              && heredoc(tokStart)) {
            break;
          }
          operator(tokStart);
          break;
        case '@':
          variable(tokStart);
          break;
        case '$':
          globalVariable(tokStart);
          break;
        case '=':
          if (atLineStart && lookingAt(tokStart, "=begin")) {
            skipEmbeddedDocument(tokStart);
          } else {
            operator(tokStart);
          }
          break;
        case '.':
          if (peek(0) == '.') {
            operator(tokStart);
          } else {
            setToken(TokenKind.DOT, tokStart, pos);
          }
          break;
        case '&':
          if (peek(0) == '.') {
            pos++;
            setToken(TokenKind.AMPER_DOT, tokStart, pos);
          } else {
            operator(tokStart);
          }
          break;
        case '-':
          if (peek(0) == '>') {
            pos++;
            setToken(TokenKind.LAMBDA, tokStart, pos);
          } else {
            operator(tokStart);
          }
          break;
        default:
          if (isdigit(c)) {
            number(tokStart);
          } else if (isIdentifierStart(c)) {
            if (atLineStart && lookingAt(tokStart, "__END__") && endsLine(tokStart + 7)) {
              pos = limit; // the rest of the file is data
            } else {
              word(tokStart);
            }
          } else {
            operator(tokStart);
          }
          break;
      }
      if (kind != null) { // stop here if we scanned a token
        return;
      }
    }

    if (!strings.isEmpty()) {
      error("unterminated string meets end of file", strings.peek().start);
      strings.clear();
    }
    setToken(TokenKind.EOF, pos, pos);
  }

  /**
   * Handles an end of line. The newline is a statement terminator only if the statement so far is
   * complete and the next line does not continue it with a leading method call.
   */
  private void newline(int nlStart) {
    if (heredocResume >= 0) {
      pos = heredocResume; // skip the heredoc bodies that follow this line
      heredocResume = -1;
    }
    if (statementMayEnd() && !continuesOnNextLine(pos)) {
      setToken(TokenKind.NEWLINE, nlStart, nlStart + 1);
    }
  }

  // Reports whether the first significant text at or after p is a leading "." or "&." call.
  private boolean continuesOnNextLine(int p) {
    while (p < limit) {
      char c = buffer[p];
      if (isSpace(c)) {
        p++;
      } else if (c == '#') {
        while (p < limit && buffer[p] != '\n') {
          p++;
        }
      } else if (c == '.') {
        return p + 1 >= limit || buffer[p + 1] != '.';
      } else {
        return c == '&' && p + 1 < limit && buffer[p + 1] == '.';
      }
    }
    return false;
  }

  private void skipComment() {
    while (pos < limit && buffer[pos] != '\n') {
      pos++;
    }
  }

  // Skips "=begin" ... "=end", leaving pos at the newline that ends the "=end" line.
  private void skipEmbeddedDocument(int docStart) {
    int p = docStart;
    while (true) {
      while (p < limit && buffer[p] != '\n') {
        p++;
      }
      if (p >= limit) {
        error("embedded document meets end of file", docStart);
        pos = limit;
        return;
      }
      p++; // start of next line
      if (lookingAt(p, "=end") && (p + 4 >= limit || isSpace(buffer[p + 4]))) {
        pos = p + 4;
        skipComment();
        return;
      }
    }
  }

  private void startString(
      int tokStart,
      char open,
      char close,
      boolean interpolate,
      boolean regexp,
      boolean labelAllowed) {
    StringTerm term =
        new StringTerm(tokStart, open, close, interpolate, regexp, false, labelAllowed);
    term.started = true;
    strings.push(term);
    scanStringContent(term, tokStart, /* first= */ true);
  }

  /**
   * Scans string content up to the end of the literal or the next interpolation.
   *
   * <p>ON ENTRY: 'pos' is the index of the first content char.
   * ON EXIT: 'pos' is 1 + the index of the last char of the token.
   *
   * @param first whether the token starts the literal, as opposed to following a "}"
   */
  private void scanStringContent(StringTerm term, int tokStart, boolean first) {
    while (pos < limit) {
      char c = buffer[pos];
      if (c == '\\') {
        pos = Math.min(pos + 2, limit);
        continue;
      }
      if (term.interpolate && c == '#' && peek(1) == '{') {
        pos += 2;
        term.inCode = true;
        term.braceDepth = 0;
        setToken(first ? TokenKind.STRING_BEGIN : TokenKind.STRING_MID, tokStart, pos);
        return;
      }
      if (!term.heredoc) {
        if (term.open != term.close && c == term.open) {
          term.nesting++;
        } else if (c == term.close) {
          if (term.nesting > 0) {
            term.nesting--;
          } else {
            pos++;
            finishString(term, tokStart, first);
            return;
          }
        }
      }
      pos++;
    }
    strings.pop();
    if (!term.heredoc) {
      error("unterminated string meets end of file", term.start);
    }
    setToken(first ? TokenKind.STRING : TokenKind.STRING_END, tokStart, pos);
  }

  private void finishString(StringTerm term, int tokStart, boolean first) {
    strings.pop();
    if (term.regexp) {
      while (pos < limit && isLetter(buffer[pos])) {
        pos++; // options
      }
    }
    if (first && term.labelAllowed && peek(0) == ':' && peek(1) != ':' && labelAllowed()) {
      pos++;
      setToken(TokenKind.LABEL, tokStart, pos, bufferSlice(tokStart + 1, pos - 2));
      return;
    }
    setToken(first ? TokenKind.STRING : TokenKind.STRING_END, tokStart, pos);
  }

  private boolean labelAllowed() {
    return ternaryDepth == 0 || (lastKind != null && LABEL_CONTEXT.contains(lastKind));
  }

  // Scans a percent literal such as %w[a b] or %(text). Returns false if c is not one.
  private boolean percentLiteral(int tokStart) {
    int c1 = peek(0);
    if (c1 == -1) {
      return false;
    }
    char type;
    char open;
    if ("qQwWiIrsx".indexOf(c1) >= 0 && peek(1) != -1 && !isIdentifierChar((char) peek(1))
        && !isSpace((char) peek(1))) {
      type = (char) c1;
      open = (char) peek(1);
      pos += 2;
    } else if (!isIdentifierChar((char) c1) && !isSpace((char) c1)) {
      type = 'Q';
      open = (char) c1;
      pos += 1;
    } else {
      return false;
    }
    char close = closingDelimiter(open);
    boolean interpolate = "QWIrx".indexOf(type) >= 0;
    StringTerm term =
        new StringTerm(tokStart, open, close, interpolate, type == 'r', false, false);
    term.started = true;
    strings.push(term);
    scanStringContent(term, tokStart, /* first= */ true);
    return true;
  }

  private static char closingDelimiter(char open) {
    switch (open) {
      case '(':
        return ')';
      case '[':
        return ']';
      case '{':
        return '}';
      case '<':
        return '>';
      default:
        return open;
    }
  }

  /**
   * Scans the opening of a heredoc, such as {@code <<~SQL}, and records where its body ends. The
   * body itself is skipped when the scanner reaches the end of the current line. Returns false,
   * consuming nothing, if no terminator line is found.
   */
  private boolean heredoc(int tokStart) {
    int p = tokStart + 2;
    boolean indented = false;
    if (p < limit && (buffer[p] == '~' || buffer[p] == '-')) {
      indented = true;
      p++;
    }
    if (p >= limit) {
      return false;
    }
    String id;
    boolean interpolate = true;
    char quote = buffer[p];
    if (quote == '\'' || quote == '"' || quote == '`') {
      int idStart = ++p;
      while (p < limit && buffer[p] != quote && buffer[p] != '\n') {
        p++;
      }
      if (p >= limit || buffer[p] != quote) {
        return false;
      }
      id = bufferSlice(idStart, p);
      p++;
      interpolate = quote != '\'';
    } else {
      int idStart = p;
      while (p < limit && isIdentifierChar(buffer[p])) {
        p++;
      }
      if (p == idStart) {
        return false;
      }
      id = bufferSlice(idStart, p);
    }

    int bodyStart = heredocResume >= 0 ? heredocResume : afterLineEnd(p);
    if (bodyStart < 0) {
      return false;
    }
    int lineStart = bodyStart;
    while (lineStart < limit) {
      int lineEnd = lineStart;
      while (lineEnd < limit && buffer[lineEnd] != '\n') {
        lineEnd++;
      }
      String line = bufferSlice(lineStart, lineEnd);
      if (line.endsWith("\r")) {
        line = line.substring(0, line.length() - 1);
      }
      if ((indented ? line.strip() : line).equals(id)) {
        heredocResume = lineEnd < limit ? lineEnd + 1 : limit;
        pos = p;
        setToken(TokenKind.HEREDOC, tokStart, p, new Heredoc(bodyStart, lineStart, interpolate));
        return true;
      }
      lineStart = lineEnd + 1;
    }
    return false;
  }

  // Returns the offset after the newline that ends the line containing p, or -1 if none.
  private int afterLineEnd(int p) {
    while (p < limit && buffer[p] != '\n') {
      p++;
    }
    return p < limit ? p + 1 : -1;
  }

  private void colon(int tokStart, boolean spaceBefore) {
    if (peek(0) == ':') {
      pos++;
      boolean scope = valueEnd() && !commandArgument(spaceBefore, peek(0));
      setToken(scope ? TokenKind.COLON2 : TokenKind.COLON3, tokStart, pos);
      return;
    }
    int c1 = peek(0);
    boolean symbolAllowed = !valueEnd() || spaceBefore;
    if (symbolAllowed && c1 != -1) {
      if (c1 == '"' || c1 == '\'') {
        pos++;
        startString(tokStart, (char) c1, (char) c1, c1 == '"', false, false);
        return;
      }
      if (isIdentifierStart((char) c1)) {
        pos++;
        scanIdentifierChars();
        if ((peek(0) == '?' || peek(0) == '!' || peek(0) == '=') && !isOperatorChar(peek(1))) {
          pos++;
        }
        setToken(TokenKind.SYMBOL, tokStart, pos);
        return;
      }
      if (c1 == '@' || c1 == '$') {
        pos++;
        while (peek(0) == '@') {
          pos++;
        }
        scanIdentifierChars();
        setToken(TokenKind.SYMBOL, tokStart, pos);
        return;
      }
      for (String op : OPERATOR_METHODS) {
        if (lookingAt(pos, op)) {
          pos += op.length();
          setToken(TokenKind.SYMBOL, tokStart, pos);
          return;
        }
      }
    }
    setToken(TokenKind.COLON, tokStart, pos);
  }

  private void questionMark(int tokStart, boolean spaceBefore) {
    int c1 = peek(0);
    if ((!valueEnd() || commandArgument(spaceBefore, c1)) && c1 != -1 && !isSpace((char) c1)) {
      if (c1 == '\\') {
        pos = Math.min(pos + 2, limit);
        while (pos < limit && isIdentifierChar(buffer[pos])) {
          pos++; // ?A, ?\C-a
        }
        setToken(TokenKind.CHAR, tokStart, pos);
        return;
      }
      int c2 = peek(1);
      if (c2 == -1 || !isIdentifierChar((char) c2)) {
        pos++;
        setToken(TokenKind.CHAR, tokStart, pos);
        return;
      }
    }
    setToken(TokenKind.QUESTION, tokStart, pos);
  }

  private void variable(int tokStart) {
    if (peek(0) == '@') {
      pos++;
    }
    int nameStart = pos;
    scanIdentifierChars();
    if (pos == nameStart) {
      error("'@' without identifiers is not allowed as an instance variable name", tokStart);
    }
    setToken(
        pos - tokStart > 1 && buffer[tokStart + 1] == '@' ? TokenKind.CVAR : TokenKind.IVAR,
        tokStart,
        pos,
        bufferSlice(tokStart, pos));
  }

  private void globalVariable(int tokStart) {
    int c1 = peek(0);
    if (c1 != -1 && isIdentifierStart((char) c1)) {
      scanIdentifierChars();
    } else if (c1 != -1 && isdigit(c1)) {
      while (isdigit(peek(0))) {
        pos++;
      }
    } else if (c1 == '-') {
      pos = Math.min(pos + 2, limit);
    } else if (c1 != -1 && "~*$?!@/\\;,.=:<>\"&'`+".indexOf(c1) >= 0) {
      pos++;
    } else {
      error("'$' without identifiers is not allowed as a global variable name", tokStart);
    }
    setToken(TokenKind.GVAR, tokStart, pos, bufferSlice(tokStart, pos));
  }

  /**
   * Scans an identifier, constant, label or keyword.
   *
   * <p>ON ENTRY: 'pos' is 1 + the index of the first char in the word.
   * ON EXIT: 'pos' is 1 + the index of the last char of the token.
   */
  private void word(int tokStart) {
    scanIdentifierChars();
    boolean constant = Character.isUpperCase(buffer[tokStart]);
    if (!constant
        && (peek(0) == '?' || peek(0) == '!')
        && !(peek(1) == '=' && peek(2) != '=')) {
      pos++;
    }
    String id = bufferSlice(tokStart, pos);

    if (afterDef) {
      methodName(tokStart, id);
      return;
    }

    boolean afterCall =
        lastKind == TokenKind.DOT
            || lastKind == TokenKind.AMPER_DOT
            || lastKind == TokenKind.COLON2;
    if (!afterCall && peek(0) == ':' && peek(1) != ':' && labelAllowed()) {
      pos++;
      setToken(TokenKind.LABEL, tokStart, pos, id);
      return;
    }

    TokenKind keyword = afterCall ? null : KEYWORDS.get(id);
    if (keyword == null) {
      setToken(constant ? TokenKind.CONSTANT : TokenKind.IDENTIFIER, tokStart, pos, id);
      return;
    }
    if (MODIFIERS.containsKey(keyword) && statementMayEnd()) {
      keyword = MODIFIERS.get(keyword);
    }
    if (keyword == TokenKind.DEF) {
      afterDef = true;
    }
    setToken(keyword, tokStart, pos);
  }

  // Scans the name, or the receiver, of a method definition.
  private void methodName(int tokStart, String id) {
    if (peek(0) == '.') {
      // receiver, as in "def self.foo"; the name follows
      TokenKind receiver =
          id.equals("self")
              ? TokenKind.SELF
              : Character.isUpperCase(id.charAt(0)) ? TokenKind.CONSTANT : TokenKind.IDENTIFIER;
      setToken(receiver, tokStart, pos, id);
      return;
    }
    afterDef = false;
    if (peek(0) == '=' && peek(1) != '=' && peek(1) != '~' && peek(1) != '>') {
      pos++; // setter, as in "def foo=(value)"
      id = bufferSlice(tokStart, pos);
    }
    setToken(TokenKind.IDENTIFIER, tokStart, pos, id);
  }

  // Scans an operator used as the name of a method definition, as in "def ==(other)".
  private boolean operatorMethodName(int tokStart) {
    for (String op : OPERATOR_METHODS) {
      if (lookingAt(tokStart, op)) {
        pos = tokStart + op.length();
        setToken(TokenKind.IDENTIFIER, tokStart, pos, op);
        return true;
      }
    }
    return false;
  }

  private void operator(int tokStart) {
    for (String op : OPERATORS) {
      if (lookingAt(tokStart, op)) {
        pos = tokStart + op.length();
        TokenKind kind;
        if (op.equals("=")) {
          kind = TokenKind.EQUALS;
        } else if (op.equals("=>")) {
          kind = TokenKind.ASSOC;
        } else if (op.equals("|")) {
          kind = TokenKind.PIPE;
        } else if (ASSIGNMENT_OPERATORS.contains(op)) {
          kind = TokenKind.OP_ASSIGN;
        } else {
          kind = TokenKind.OPERATOR;
        }
        setToken(kind, tokStart, pos, op);
        return;
      }
    }
    error("invalid character: '" + buffer[tokStart] + "'", tokStart);
  }

  // Scans a numeric literal, including radix prefixes, underscores and rational/imaginary suffixes.
  private void number(int tokStart) {
    int c = buffer[tokStart];
    if (c == '0' && peek(0) != -1 && "xXbBoOdD".indexOf(peek(0)) >= 0) {
      pos++;
      while (peek(0) != -1 && (isIdentifierChar((char) peek(0)))) {
        pos++;
      }
    } else {
      while (isdigit(peek(0)) || peek(0) == '_') {
        pos++;
      }
      if (peek(0) == '.' && isdigit(peek(1))) {
        pos++;
        while (isdigit(peek(0)) || peek(0) == '_') {
          pos++;
        }
      }
      if ((peek(0) == 'e' || peek(0) == 'E')
          && (isdigit(peek(1)) || ((peek(1) == '+' || peek(1) == '-') && isdigit(peek(2))))) {
        pos += 2;
        while (isdigit(peek(0))) {
          pos++;
        }
      }
    }
    if (peek(0) == 'r') {
      pos++;
    }
    if (peek(0) == 'i') {
      pos++;
    }
    setToken(TokenKind.NUMBER, tokStart, pos);
  }

  private void scanIdentifierChars() {
    while (pos < limit && isIdentifierChar(buffer[pos])) {
      pos++;
    }
  }

  // Returns the ith unconsumed char, or -1 for EOF.
  private int peek(int i) {
    return pos + i < limit ? buffer[pos + i] : -1;
  }

  private boolean lookingAt(int p, String s) {
    if (p + s.length() > limit) {
      return false;
    }
    for (int i = 0; i < s.length(); i++) {
      if (buffer[p + i] != s.charAt(i)) {
        return false;
      }
    }
    return true;
  }

  private boolean endsLine(int p) {
    return p >= limit || buffer[p] == '\n' || buffer[p] == '\r';
  }

  private static boolean isSpace(char c) {
    return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f';
  }

  private static boolean isdigit(int c) {
    return '0' <= c && c <= '9';
  }

  private static boolean isLetter(char c) {
    return ('a' <= c && c <= 'z') || ('A' <= c && c <= 'Z');
  }

  private static boolean isOperatorChar(int c) {
    return c == '=' || c == '~' || c == '>' || c == ':';
  }

  // Non-ASCII chars are treated as letters, as Ruby does for UTF-8 source.
  private static boolean isIdentifierStart(char c) {
    return isLetter(c) || c == '_' || c >= 0x80;
  }

  private static boolean isIdentifierChar(char c) {
    return isIdentifierStart(c) || isdigit(c);
  }

  /**
   * Returns parts of the source buffer based on offsets
   *
   * @param start the beginning offset for the slice
   * @param end the offset immediately following the slice
   * @return the text at offset start with length end - start
   */
  String bufferSlice(int start, int end) {
    return new String(this.buffer, start, end - start);
  }
}
