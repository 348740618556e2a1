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
package net.hydromatic.formula.eval;

import net.hydromatic.formula.ast.Op;

/**
 * Implementations of the arithmetic, concatenation and comparison
 * operators.
 *
 * <p>Each operator is defined on scalars and broadcast over arrays. If an
 * operand is an error, the result is that error; if both are errors, the
 * left one wins.
 */
public abstract class Operators {
  private Operators() {}

  /** Applies a prefix or postfix operator. */
  public static Value unary(Op op, Value operand) {
    if (operand instanceof Closure) {
      return Value.error(ErrorKind.VALUE);
    }
    switch (op) {
    case UNARY_PLUS:
      return operand;
    case NEGATE:
      return Broadcast.map(operand, Operators::negate);
    case PERCENT:
      return Broadcast.map(operand, Operators::percent);
    default:
      throw new AssertionError("not a unary operator: " + op);
    }
  }

  /** Applies an infix operator. */
  public static Value binary(Op op, Value left, Value right) {
    if (left instanceof Closure || right instanceof Closure) {
      return Value.error(ErrorKind.VALUE);
    }
    return Broadcast.zip(left, right, (a, b) -> scalar(op, a, b));
  }

  /** Applies an infix operator to two scalars. */
  public static Value.Scalar scalar(Op op, Value.Scalar a, Value.Scalar b) {
    if (a instanceof Value.Err) {
      return a;
    }
    if (b instanceof Value.Err) {
      return b;
    }
    switch (op) {
    case CONCAT:
      return Value.text(Values.toText(a).toString()
          + Values.toText(b).toString());
    case EQ:
      return Value.bool(Values.compare(a, b) == 0);
    case NE:
      return Value.bool(Values.compare(a, b) != 0);
    case LT:
      return Value.bool(Values.compare(a, b) < 0);
    case LE:
      return Value.bool(Values.compare(a, b) <= 0);
    case GT:
      return Value.bool(Values.compare(a, b) > 0);
    case GE:
      return Value.bool(Values.compare(a, b) >= 0);
    default:
      break;
    }
    final Value.Scalar na = Values.toNumber(a);
    if (na instanceof Value.Err) {
      return na;
    }
    final Value.Scalar nb = Values.toNumber(b);
    if (nb instanceof Value.Err) {
      return nb;
    }
    final double x = ((Value.Num) na).value;
    final double y = ((Value.Num) nb).value;
    switch (op) {
    case PLUS:
      return Value.number(x + y);
    case MINUS:
      return Value.number(x - y);
    case TIMES:
      return Value.number(x * y);
    case DIVIDE:
      return y == 0D ? Value.error(ErrorKind.DIV_BY_ZERO)
          : Value.number(x / y);
    case POWER:
      return power(x, y);
    default:
      throw new AssertionError("not a binary operator: " + op);
    }
  }

  /** Raises a number to a power. 0^0 is {@code #NUM!}; 0 to a negative
   * power is {@code #DIV/0!}. */
  public static Value.Scalar power(double x, double y) {
    if (x == 0D) {
      if (y == 0D) {
        return Value.error(ErrorKind.NUMBER);
      }
      if (y < 0D) {
        return Value.error(ErrorKind.DIV_BY_ZERO);
      }
    }
    return Value.number(Math.pow(x, y));
  }

  private static Value.Scalar negate(Value.Scalar s) {
    final Value.Scalar n = Values.toNumber(s);
    return n instanceof Value.Num ? Value.number(-((Value.Num) n).value) : n;
  }

  private static Value.Scalar percent(Value.Scalar s) {
    final Value.Scalar n = Values.toNumber(s);
    return n instanceof Value.Num
        ? Value.number(((Value.Num) n).value / 100D) : n;
  }
}

// End Operators.java
