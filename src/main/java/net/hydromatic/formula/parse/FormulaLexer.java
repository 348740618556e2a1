/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.formula.parse;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import net.hydromatic.formula.ast.Pos;
import net.hydromatic.formula.eval.Address;
import net.hydromatic.formula.eval.ErrorKind;

/**
 * Splits formula text into tokens.
 *
 * <p>Wildcard characters in string literals ({@code *}, {@code ?} and
 * {@code ~}) are not interpreted; they are the business of the functions
 * that match patterns.
 */
final class FormulaLexer {
  private final String text;
  private int i;

  FormulaLexer(String text, int start) {
    this.text = requireNonNull(text);
    this.i = start;
  }

  /** Tokenizes the whole text; the last token is {@link Token.Kind#EOF}. */
  ImmutableList<Token> tokenize() {
    final ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    for (;;) {
      final Token token = next();
      tokens.add(token);
      if (token.kind == Token.Kind.EOF) {
        return tokens.build();
      }
    }
  }

  private Token next() {
    while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
      ++i;
    }
    if (i >= text.length()) {
      return new Token(Token.Kind.EOF, "", new Pos(i, i));
    }
    final int start = i;
    final char c = text.charAt(i);
    switch (c) {
    case '(':
      return punct(Token.Kind.LPAREN);
    case ')':
      return punct(Token.Kind.RPAREN);
    case '{':
      return punct(Token.Kind.LBRACE);
    case '}':
      return punct(Token.Kind.RBRACE);
    case ',':
      return punct(Token.Kind.COMMA);
    case ';':
      return punct(Token.Kind.SEMICOLON);
    case ':':
      return punct(Token.Kind.COLON);
    case '%':
      return punct(Token.Kind.PERCENT);
    case '+':
    case '-':
    case '*':
    case '/':
    case '^':
    case '&':
    case '=':
      return punct(Token.Kind.OP);
    case '<':
      if (peek(1) == '=' || peek(1) == '>') {
        i += 2;
        return token(Token.Kind.OP, start);
      }
      return punct(Token.Kind.OP);
    case '>':
      if (peek(1) == '=') {
        i += 2;
        return token(Token.Kind.OP, start);
      }
      return punct(Token.Kind.OP);
    case '"':
      return string();
    case '#':
      return error();
    default:
      break;
    }
    if (isDigit(c) || c == '.' && isDigit(peek(1))) {
      return number();
    }
    if (isIdentifierStart(c)) {
      return identifier();
    }
    throw new FormulaParseException("unexpected character '" + c + "'",
        new Pos(start, start + 1));
  }

  private Token punct(Token.Kind kind) {
    ++i;
    return token(kind, i - 1);
  }

  private Token token(Token.Kind kind, int start) {
    return new Token(kind, text.substring(start, i), new Pos(start, i));
  }

  private char peek(int offset) {
    final int j = i + offset;
    return j < text.length() ? text.charAt(j) : '\0';
  }

  private Token number() {
    final int start = i;
    while (isDigit(peek(0))) {
      ++i;
    }
    if (peek(0) == '.') {
      ++i;
      while (isDigit(peek(0))) {
        ++i;
      }
    }
    if (peek(0) == 'e' || peek(0) == 'E') {
      int j = 1;
      if (peek(j) == '+' || peek(j) == '-') {
        ++j;
      }
      if (isDigit(peek(j))) {
        i += j;
        while (isDigit(peek(0))) {
          ++i;
        }
      }
    }
    return token(Token.Kind.NUMBER, start);
  }

  private Token string() {
    final int start = i;
    final StringBuilder b = new StringBuilder();
    ++i;
    for (;;) {
      if (i >= text.length()) {
        throw new FormulaParseException("unterminated string",
            new Pos(start, i));
      }
      final char c = text.charAt(i++);
      if (c == '"') {
        if (peek(0) == '"') {
          b.append('"');
          ++i;
        } else {
          break;
        }
      } else {
        b.append(c);
      }
    }
    return new Token(Token.Kind.STRING, b.toString(), new Pos(start, i));
  }

  private Token error() {
    final int start = i;
    for (String token : ErrorKind.tokens()) {
      if (text.regionMatches(true, start, token, 0, token.length())) {
        i += token.length();
        return new Token(Token.Kind.ERROR, token, new Pos(start, i));
      }
    }
    throw new FormulaParseException("unknown error value",
        new Pos(start, start + 1));
  }

  private Token identifier() {
    final int start = i;
    while (isIdentifierPart(peek(0))) {
      ++i;
    }
    final String word = text.substring(start, i);
    int j = i;
    while (j < text.length() && Character.isWhitespace(text.charAt(j))) {
      ++j;
    }
    final boolean call = j < text.length() && text.charAt(j) == '(';
    if (!call) {
      if (Address.parseOpt(word) != null) {
        return new Token(Token.Kind.REF, word, new Pos(start, i));
      }
      if (word.equalsIgnoreCase("TRUE") || word.equalsIgnoreCase("FALSE")) {
        return new Token(Token.Kind.BOOL, word, new Pos(start, i));
      }
    }
    if (word.indexOf('$') >= 0) {
      throw new FormulaParseException("invalid reference '" + word + "'",
          new Pos(start, i));
    }
    return new Token(Token.Kind.IDENT, word, new Pos(start, i));
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isIdentifierStart(char c) {
    return Character.isLetter(c) || c == '_' || c == '$' || c == '\\';
  }

  private static boolean isIdentifierPart(char c) {
    return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '$';
  }
}

// End FormulaLexer.java
