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
package net.hydromatic.formula.ast;

import com.google.common.collect.ImmutableMap;

/**
 * Sub-types of {@link AstNode}.
 *
 * <p>Operators carry their symbol and a left and right precedence. Binary
 * operators are left-associative; unary minus binds less tightly than
 * {@code ^}, so "-2^2" is "-(2^2)".
 */
public enum Op {
  // atoms
  LITERAL(true),
  CELL_REF(true),
  RANGE_REF(true),
  NAME(true),
  CALL(true),
  INVOKE(true),
  LAMBDA(true),
  LET(true),
  ARRAY(true),
  MISSING(true),

  // postfix
  PERCENT("%", 7, Fixity.POSTFIX),

  POWER("^", 6, Fixity.INFIX),

  // prefix
  NEGATE("-", 5, Fixity.PREFIX),
  UNARY_PLUS("+", 5, Fixity.PREFIX),

  TIMES("*", 4, Fixity.INFIX),
  DIVIDE("/", 4, Fixity.INFIX),
  PLUS("+", 3, Fixity.INFIX),
  MINUS("-", 3, Fixity.INFIX),
  CONCAT("&", 2, Fixity.INFIX),
  EQ("=", 1, Fixity.INFIX),
  NE("<>", 1, Fixity.INFIX),
  LT("<", 1, Fixity.INFIX),
  LE("<=", 1, Fixity.INFIX),
  GT(">", 1, Fixity.INFIX),
  GE(">=", 1, Fixity.INFIX);

  /** Symbol, e.g. "&lt;=". Empty for atoms. */
  public final String symbol;
  /** Left precedence */
  public final int left;
  /** Right precedence */
  public final int right;
  public final Fixity fixity;

  /** Binary operators, keyed by symbol. */
  public static final ImmutableMap<String, Op> INFIX_BY_SYMBOL;

  static {
    final ImmutableMap.Builder<String, Op> b = ImmutableMap.builder();
    for (Op op : values()) {
      if (op.fixity == Fixity.INFIX) {
        b.put(op.symbol, op);
      }
    }
    INFIX_BY_SYMBOL = b.build();
  }

  Op(boolean atom) {
    this("", 99, 99, Fixity.ATOM);
    assert atom;
  }

  Op(String symbol, int precedence, Fixity fixity) {
    this(
        symbol,
        precedence * 2,
        precedence * 2 + (fixity == Fixity.INFIX ? 1 : 0),
        fixity);
  }

  Op(String symbol, int left, int right, Fixity fixity) {
    this.symbol = symbol;
    this.left = left;
    this.right = right;
    this.fixity = fixity;
  }

  /** Returns whether this operator compares its operands. */
  public boolean isComparison() {
    switch (this) {
    case EQ:
    case NE:
    case LT:
    case LE:
    case GT:
    case GE:
      return true;
    default:
      return false;
    }
  }

  /** Where an operator goes relative to its operands. */
  public enum Fixity {
    ATOM,
    PREFIX,
    INFIX,
    POSTFIX
  }
}

// End Op.java
