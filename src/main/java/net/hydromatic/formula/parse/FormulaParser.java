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

import static net.hydromatic.formula.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import net.hydromatic.formula.ast.Ast;
import net.hydromatic.formula.ast.AstNode;
import net.hydromatic.formula.ast.Op;
import net.hydromatic.formula.ast.Pos;
import net.hydromatic.formula.eval.Address;
import net.hydromatic.formula.eval.ErrorKind;
import net.hydromatic.formula.eval.Value;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Recursive-descent parser for formulas.
 *
 * <p>Precedence, from loosest to tightest: comparison ({@code = <> < <= >
 * >=}), concatenation ({@code &}), additive ({@code + -}), multiplicative
 * ({@code * /}), unary sign, exponentiation ({@code ^}), percent, range
 * ({@code :}). Binary operators are left-associative.
 *
 * <p>{@code LAMBDA} and {@code LET} are syntax, not functions; the parser
 * converts calls to them into {@link Ast.Lambda} and {@link Ast.Let}.
 */
public final class FormulaParser {
  private final ImmutableList<Token> tokens;
  private int i;

  private FormulaParser(ImmutableList<Token> tokens) {
    this.tokens = tokens;
  }

  /**
   * Parses formula text, which must start with "=".
   *
   * <p>Never throws; a malformed formula yields a result whose
   * {@link ParseResult#error()} describes the problem.
   */
  public static ParseResult parse(String text) {
    try {
      return ParseResult.success(parseOrThrow(text));
    } catch (FormulaParseException e) {
      return ParseResult.failure(
          new ParseResult.ParseError(e.getMessage(), e.pos()));
    }
  }

  /** Parses formula text, throwing if it is malformed. */
  public static AstNode parseOrThrow(String text) {
    int start = 0;
    while (start < text.length()
        && Character.isWhitespace(text.charAt(start))) {
      ++start;
    }
    if (start >= text.length() || text.charAt(start) != '=') {
      throw new FormulaParseException("formula must start with '='",
          new Pos(start, Math.min(start + 1, text.length())));
    }
    final ImmutableList<Token> tokens =
        new FormulaLexer(text, start + 1).tokenize();
    final FormulaParser parser = new FormulaParser(tokens);
    final AstNode node = parser.expression();
    // Unbalanced closing parentheses at the end are forgiven.
    while (parser.peek().kind == Token.Kind.RPAREN) {
      parser.advance();
    }
    parser.expect(Token.Kind.EOF);
    return node;
  }

  private Token peek() {
    return tokens.get(i);
  }

  private Token advance() {
    final Token token = tokens.get(i);
    if (token.kind != Token.Kind.EOF) {
      ++i;
    }
    return token;
  }

  private Token expect(Token.Kind kind) {
    final Token token = peek();
    if (token.kind != kind) {
      throw unexpected(token);
    }
    return advance();
  }

  private static FormulaParseException unexpected(Token token) {
    return new FormulaParseException("unexpected " + token, token.pos);
  }

  private @Nullable Op binaryOp(int level) {
    final Token token = peek();
    if (token.kind != Token.Kind.OP) {
      return null;
    }
    final Op op = Op.INFIX_BY_SYMBOL.get(token.text);
    if (op == null) {
      return null;
    }
    switch (level) {
    case 0:
      return op.isComparison() ? op : null;
    case 1:
      return op == Op.CONCAT ? op : null;
    case 2:
      return op == Op.PLUS || op == Op.MINUS ? op : null;
    default:
      return op == Op.TIMES || op == Op.DIVIDE ? op : null;
    }
  }

  AstNode expression() {
    return binary(0);
  }

  /** Parses a sequence of left-associative binary operators at a given
   * level; level 0 is comparison, level 3 is multiplicative. */
  private AstNode binary(int level) {
    AstNode left = level == 3 ? unary() : binary(level + 1);
    for (;;) {
      final Op op = binaryOp(level);
      if (op == null) {
        return left;
      }
      advance();
      final AstNode right = level == 3 ? unary() : binary(level + 1);
      left = ast.binary(op, left, right);
    }
  }

  private AstNode unary() {
    final Token token = peek();
    if (token.kind == Token.Kind.OP
        && (token.text.equals("-") || token.text.equals("+"))) {
      advance();
      final AstNode operand = unary();
      return ast.unary(token.pos.plus(operand.pos),
          token.text.equals("-") ? Op.NEGATE : Op.UNARY_PLUS, operand);
    }
    return power();
  }

  private AstNode power() {
    AstNode left = postfix();
    while (peek().is(Token.Kind.OP, "^")) {
      advance();
      left = ast.binary(Op.POWER, left, signedPostfix());
    }
    return left;
  }

  /** Parses the right operand of "^", which may have a sign, as in
   * "2^-1". */
  private AstNode signedPostfix() {
    final Token token = peek();
    if (token.kind == Token.Kind.OP
        && (token.text.equals("-") || token.text.equals("+"))) {
      advance();
      final AstNode operand = signedPostfix();
      return ast.unary(token.pos.plus(operand.pos),
          token.text.equals("-") ? Op.NEGATE : Op.UNARY_PLUS, operand);
    }
    return postfix();
  }

  private AstNode postfix() {
    AstNode node = range();
    while (peek().kind == Token.Kind.PERCENT) {
      final Token token = advance();
      node = ast.unary(node.pos.plus(token.pos), Op.PERCENT, node);
    }
    return node;
  }

  private AstNode range() {
    final AstNode node = primary();
    if (peek().kind != Token.Kind.COLON) {
      return node;
    }
    final Token colon = advance();
    if (!(node instanceof Ast.CellRef)) {
      throw unexpected(colon);
    }
    final Token endToken = expect(Token.Kind.REF);
    return ast.rangeRef((Ast.CellRef) node, cellRef(endToken));
  }

  private AstNode primary() {
    final Token token = advance();
    switch (token.kind) {
    case NUMBER:
      return ast.numberLiteral(token.pos, parseNumber(token));
    case STRING:
      return ast.stringLiteral(token.pos, token.text);
    case BOOL:
      return ast.literal(token.pos,
          Value.bool(token.text.equalsIgnoreCase("TRUE")));
    case ERROR:
      return ast.literal(token.pos, errorValue(token));
    case REF:
      return cellRef(token);
    case IDENT:
      if (peek().kind == Token.Kind.LPAREN) {
        return invocations(call(token));
      }
      return ast.name(token.pos, token.text.toUpperCase(Locale.ROOT));
    case LPAREN:
      final AstNode e = expression();
      expect(Token.Kind.RPAREN);
      return invocations(e);
    case LBRACE:
      return arrayLiteral(token);
    default:
      throw unexpected(token);
    }
  }

  /** Parses zero or more argument lists after a lambda-valued expression,
   * as in "LAMBDA(x, x + 1)(2)". */
  private AstNode invocations(AstNode node) {
    while (peek().kind == Token.Kind.LPAREN) {
      advance();
      final List<AstNode> args = arguments();
      final Token close = expect(Token.Kind.RPAREN);
      node = ast.invoke(node.pos.plus(close.pos), node, args);
    }
    return node;
  }

  private AstNode call(Token nameToken) {
    final String name = nameToken.text.toUpperCase(Locale.ROOT);
    expect(Token.Kind.LPAREN);
    final List<AstNode> args = arguments();
    final Token close = expect(Token.Kind.RPAREN);
    final Pos pos = nameToken.pos.plus(close.pos);
    switch (name) {
    case "LAMBDA":
      return lambda(pos, args);
    case "LET":
      return let(pos, args);
    default:
      return ast.call(pos, name, args);
    }
  }

  private List<AstNode> arguments() {
    final List<AstNode> args = new ArrayList<>();
    if (peek().kind == Token.Kind.RPAREN) {
      return args;
    }
    for (;;) {
      final Token token = peek();
      if (token.kind == Token.Kind.COMMA
          || token.kind == Token.Kind.RPAREN) {
        args.add(ast.missing(new Pos(token.pos.start, token.pos.start)));
      } else {
        args.add(expression());
      }
      if (peek().kind != Token.Kind.COMMA) {
        return args;
      }
      advance();
    }
  }

  private AstNode lambda(Pos pos, List<AstNode> args) {
    if (args.isEmpty()) {
      throw new FormulaParseException("LAMBDA requires a calculation", pos);
    }
    final List<String> params =
        names(args.subList(0, args.size() - 1), "LAMBDA parameter");
    return ast.lambda(pos, params, args.get(args.size() - 1));
  }

  private AstNode let(Pos pos, List<AstNode> args) {
    if (args.size() < 3 || args.size() % 2 == 0) {
      throw new FormulaParseException(
          "LET requires name-value pairs and a calculation", pos);
    }
    final List<AstNode> nameNodes = new ArrayList<>();
    final List<AstNode> values = new ArrayList<>();
    for (int j = 0; j < args.size() - 1; j += 2) {
      nameNodes.add(args.get(j));
      values.add(args.get(j + 1));
    }
    final List<String> names = names(nameNodes, "LET name");
    return ast.let(pos, names, values, args.get(args.size() - 1));
  }

  /** Checks that each node is a bare name, and that names are distinct. */
  private static List<String> names(List<AstNode> nodes, String what) {
    final List<String> names = new ArrayList<>();
    final Set<String> seen = new HashSet<>();
    for (AstNode node : nodes) {
      if (!(node instanceof Ast.Name)) {
        throw new FormulaParseException("invalid " + what, node.pos);
      }
      final String name = ((Ast.Name) node).name;
      if (!seen.add(name)) {
        throw new FormulaParseException("duplicate " + what + " " + name,
            node.pos);
      }
      names.add(name);
    }
    return names;
  }

  private AstNode arrayLiteral(Token open) {
    final List<Value.Scalar> elements = new ArrayList<>();
    int rows = 0;
    int cols = -1;
    for (;;) {
      int n = 0;
      for (;;) {
        elements.add(arrayElement());
        ++n;
        if (peek().kind != Token.Kind.COMMA) {
          break;
        }
        advance();
      }
      if (cols >= 0 && n != cols) {
        throw new FormulaParseException("array rows must have equal length",
            peek().pos);
      }
      cols = n;
      ++rows;
      if (peek().kind != Token.Kind.SEMICOLON) {
        break;
      }
      advance();
    }
    final Token close = expect(Token.Kind.RBRACE);
    return ast.array(open.pos.plus(close.pos), rows, cols, elements);
  }

  private Value.Scalar arrayElement() {
    final Token token = advance();
    switch (token.kind) {
    case NUMBER:
      return Value.number(parseNumber(token));
    case STRING:
      return Value.text(token.text);
    case BOOL:
      return Value.bool(token.text.equalsIgnoreCase("TRUE"));
    case ERROR:
      return errorValue(token);
    case OP:
      if (token.text.equals("-") || token.text.equals("+")) {
        final Token number = expect(Token.Kind.NUMBER);
        final double d = parseNumber(number);
        return Value.number(token.text.equals("-") ? -d : d);
      }
      throw unexpected(token);
    default:
      throw unexpected(token);
    }
  }

  private static Ast.CellRef cellRef(Token token) {
    final Address address = Address.parseOpt(token.text);
    if (address == null) {
      throw new FormulaParseException("invalid reference", token.pos);
    }
    final boolean colAbsolute = token.text.startsWith("$");
    final boolean rowAbsolute = token.text.indexOf('$', 1) > 0;
    return ast.cellRef(token.pos, address, colAbsolute, rowAbsolute);
  }

  private static double parseNumber(Token token) {
    try {
      return Double.parseDouble(token.text);
    } catch (NumberFormatException e) {
      throw new FormulaParseException("invalid number", token.pos);
    }
  }

  private static Value.Err errorValue(Token token) {
    final ErrorKind kind = ErrorKind.fromTokenOpt(token.text);
    if (kind == null) {
      throw new FormulaParseException("unknown error value", token.pos);
    }
    return Value.error(kind);
  }
}

// End FormulaParser.java
