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
package net.hydromatic.formula.fn;

import static java.util.Objects.requireNonNull;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import net.hydromatic.formula.eval.ArrayValue;
import net.hydromatic.formula.eval.Value;
import net.hydromatic.formula.eval.Values;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Criterion, such as {@code 5}, {@code ">5"}, {@code "<>apple"} or
 * {@code "a*"}, used by {@code COUNTIF}, {@code SUMIFS}, the database
 * functions and their kin.
 *
 * <p>A criterion is an optional comparison operator followed by an operand.
 * A numeric operand compares against numbers; other operands compare against
 * text, case-insensitively, and with wildcards if the operator is {@code =}
 * or {@code <>}.
 */
final class Criteria implements Predicate<Value.Scalar> {
  private final Op op;
  private final Value.Scalar operand;
  private final @Nullable Pattern pattern;

  private Criteria(Op op, Value.Scalar operand, @Nullable Pattern pattern) {
    this.op = requireNonNull(op);
    this.operand = requireNonNull(operand);
    this.pattern = pattern;
  }

  /** Parses a criterion. */
  static Criteria of(Value.Scalar criterion) {
    if (!(criterion instanceof Value.Text)) {
      return new Criteria(Op.EQ, criterion, null);
    }
    final String s = ((Value.Text) criterion).value;
    Op op = Op.EQ;
    String rest = s;
    for (Op o : Op.values()) {
      if (s.startsWith(o.symbol)) {
        op = o;
        rest = s.substring(o.symbol.length());
        break;
      }
    }
    final Double d = Values.parseNumberOpt(rest);
    if (d != null) {
      return new Criteria(op, Value.number(d), null);
    }
    if (rest.equalsIgnoreCase("TRUE") || rest.equalsIgnoreCase("FALSE")) {
      return new Criteria(op, Value.bool(rest.equalsIgnoreCase("TRUE")),
          null);
    }
    if ((op == Op.EQ || op == Op.NE) && Wildcards.hasWildcards(rest)) {
      return new Criteria(op, Value.text(rest), Wildcards.toPattern(rest));
    }
    return new Criteria(op, Value.text(Wildcards.unescape(rest)), null);
  }

  /**
   * Evaluates a list of (range, criterion) pairs against cells, and returns
   * a mask with one element per cell of {@code shape}, true if every
   * criterion holds for the corresponding cell of its range.
   *
   * <p>Returns null if any range has a different shape from
   * {@code shape}.
   */
  static boolean @Nullable [] mask(ArrayValue shape, List<Value> pairs) {
    final boolean[] mask = new boolean[shape.size()];
    Arrays.fill(mask, true);
    for (int i = 0; i + 1 < pairs.size(); i += 2) {
      final ArrayValue range = Values.toArray(pairs.get(i));
      if (!range.sameShape(shape)) {
        return null;
      }
      final Criteria criteria = of(Values.first(pairs.get(i + 1)));
      for (int j = 0; j < mask.length; j++) {
        mask[j] = mask[j] && criteria.test(range.get(j));
      }
    }
    return mask;
  }

  @Override
  public boolean test(Value.Scalar cell) {
    switch (op) {
    case EQ:
      return equal(cell);
    case NE:
      return !equal(cell);
    default:
      final int c = compare(cell);
      return c != Integer.MIN_VALUE && op.test(c);
    }
  }

  private boolean equal(Value.Scalar cell) {
    if (operand instanceof Value.Blank
        || operand instanceof Value.Text
            && ((Value.Text) operand).value.isEmpty()) {
      return cell instanceof Value.Blank
          || cell instanceof Value.Text && ((Value.Text) cell).value.isEmpty();
    }
    if (operand instanceof Value.Num) {
      final double d = ((Value.Num) operand).value;
      if (cell instanceof Value.Num) {
        return ((Value.Num) cell).value == d;
      }
      if (cell instanceof Value.Text) {
        final Double c = Values.parseNumberOpt(((Value.Text) cell).value);
        return c != null && c == d;
      }
      return false;
    }
    if (operand instanceof Value.Text) {
      if (!(cell instanceof Value.Text)) {
        return false;
      }
      final String text = ((Value.Text) cell).value;
      if (pattern != null) {
        return pattern.matcher(text).matches();
      }
      return text.toLowerCase(Locale.ROOT)
          .equals(((Value.Text) operand).value.toLowerCase(Locale.ROOT));
    }
    return Values.lookupEquals(operand, cell);
  }

  /** Compares a cell to the operand; returns {@link Integer#MIN_VALUE} if
   * they are of different types. */
  private int compare(Value.Scalar cell) {
    if (operand instanceof Value.Num && cell instanceof Value.Num
        || operand instanceof Value.Text && cell instanceof Value.Text
        || operand instanceof Value.Bool && cell instanceof Value.Bool) {
      return Values.compare(cell, operand);
    }
    return Integer.MIN_VALUE;
  }

  /** Comparison operator; longer symbols first, so that parsing finds
   * "&lt;=" before "&lt;". */
  private enum Op {
    LE("<="),
    GE(">="),
    NE("<>"),
    LT("<"),
    GT(">"),
    EQ("=");

    final String symbol;

    Op(String symbol) {
      this.symbol = symbol;
    }

    boolean test(int c) {
      switch (this) {
      case LE:
        return c <= 0;
      case GE:
        return c >= 0;
      case LT:
        return c < 0;
      case GT:
        return c > 0;
      default:
        throw new AssertionError(this);
      }
    }
  }
}

// End Criteria.java
