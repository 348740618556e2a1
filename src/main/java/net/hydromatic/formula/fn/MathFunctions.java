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

import static net.hydromatic.formula.eval.ErrorKind.DIV_BY_ZERO;
import static net.hydromatic.formula.eval.ErrorKind.NOT_AVAILABLE;
import static net.hydromatic.formula.eval.ErrorKind.NUMBER;
import static net.hydromatic.formula.eval.ErrorKind.VALUE;
import static net.hydromatic.formula.eval.Value.error;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;
import net.hydromatic.formula.compile.BuiltIn;
import net.hydromatic.formula.eval.Applicable;
import net.hydromatic.formula.eval.ArgList;
import net.hydromatic.formula.eval.ArrayValue;
import net.hydromatic.formula.eval.Operators;
import net.hydromatic.formula.eval.Session;
import net.hydromatic.formula.eval.Value;
import net.hydromatic.formula.eval.Values;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Math and trigonometry functions. */
abstract class MathFunctions {
  private static final int[] ROMAN_VALUES =
      {1000, 900, 500, 400, 100, 90, 50, 40, 10, 9, 5, 4, 1};
  private static final String[] ROMAN_SYMBOLS =
      {"M", "CM", "D", "CD", "C", "XC", "L", "XL", "X", "IX", "V", "IV", "I"};

  private MathFunctions() {}

  static void populate(Codes.Builder b) {
    b.put(BuiltIn.ABS, Codes.unary(Math::abs));
    b.put(BuiltIn.ACOS, Codes.unary(x -> x >= -1 && x <= 1, Math::acos));
    b.put(BuiltIn.ACOSH,
        Codes.unary(x -> x >= 1, x -> Math.log(x + Math.sqrt(x * x - 1))));
    b.put(BuiltIn.AGGREGATE, MathFunctions::aggregate);
    b.put(BuiltIn.ARABIC, MathFunctions::arabic);
    b.put(BuiltIn.ASIN, Codes.unary(x -> x >= -1 && x <= 1, Math::asin));
    b.put(BuiltIn.ASINH,
        Codes.unary(x -> Math.log(x + Math.sqrt(x * x + 1))));
    b.put(BuiltIn.ATAN, Codes.unary(Math::atan));
    b.put(BuiltIn.ATAN2, Codes.binary((x, y) ->
        x == 0 && y == 0 ? error(DIV_BY_ZERO)
            : Value.number(Math.atan2(y, x))));
    b.put(BuiltIn.ATANH,
        Codes.unary(x -> x > -1 && x < 1,
            x -> 0.5 * Math.log((1 + x) / (1 - x))));
    b.put(BuiltIn.BASE, MathFunctions::base);
    b.put(BuiltIn.CEILING, Codes.binary(MathFunctions::ceiling));
    b.put(BuiltIn.CEILING_MATH, (session, args) -> roundMath(args, true));
    b.put(BuiltIn.COMBIN, Codes.binary(MathFunctions::combin));
    b.put(BuiltIn.COMBINA, Codes.binary((n, k) -> {
      n = Math.floor(n);
      k = Math.floor(k);
      if (n < 0 || k < 0 || n < 1 && k > 0) {
        return error(NUMBER);
      }
      return k == 0 ? Value.number(1)
          : Value.number(SpecialFunctions.combin(n + k - 1, k));
    }));
    b.put(BuiltIn.COS, Codes.unary(Math::cos));
    b.put(BuiltIn.COSH, Codes.unary(Math::cosh));
    b.put(BuiltIn.COT, reciprocal(Math::tan));
    b.put(BuiltIn.CSC, reciprocal(Math::sin));
    b.put(BuiltIn.DECIMAL, MathFunctions::decimal);
    b.put(BuiltIn.DEGREES, Codes.unary(Math::toDegrees));
    b.put(BuiltIn.EVEN, Codes.unary(x -> {
      final double c = Math.ceil(fuzz(Math.abs(x) / 2D)) * 2D;
      return Math.copySign(c, x);
    }));
    b.put(BuiltIn.EXP, Codes.unary(Math::exp));
    b.put(BuiltIn.FACT, Codes.unary(x -> x >= 0, x -> {
      double f = 1D;
      for (int i = 2; i <= (int) Math.floor(x); i++) {
        f *= i;
      }
      return f;
    }));
    b.put(BuiltIn.FACTDOUBLE, Codes.unary(x -> x >= -1, x -> {
      double f = 1D;
      for (int i = (int) Math.floor(x); i > 1; i -= 2) {
        f *= i;
      }
      return f;
    }));
    b.put(BuiltIn.FLOOR, Codes.binary(MathFunctions::floor));
    b.put(BuiltIn.FLOOR_MATH, (session, args) -> roundMath(args, false));
    b.put(BuiltIn.GCD, (session, args) -> gcdLcm(args, true));
    b.put(BuiltIn.INT, Codes.unary(Math::floor));
    b.put(BuiltIn.LCM, (session, args) -> gcdLcm(args, false));
    b.put(BuiltIn.LN, Codes.unary(x -> x > 0, Math::log));
    b.put(BuiltIn.LOG, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double x = a.num(0);
      final double base = a.num(1, 10D);
      if (a.failed()) {
        return a.error();
      }
      if (x <= 0 || base <= 0) {
        return error(NUMBER);
      }
      if (base == 1) {
        return error(DIV_BY_ZERO);
      }
      return Value.number(Math.log(x) / Math.log(base));
    });
    b.put(BuiltIn.LOG10, Codes.unary(x -> x > 0, Math::log10));
    b.put(BuiltIn.MDETERM, MathFunctions::mdeterm);
    b.put(BuiltIn.MMULT, MathFunctions::mmult);
    b.put(BuiltIn.MOD, Codes.binary((n, d) -> {
      if (d == 0) {
        return error(DIV_BY_ZERO);
      }
      return Value.number(n - d * Math.floor(fuzz(n / d)));
    }));
    b.put(BuiltIn.MROUND, Codes.binary(MathFunctions::mround));
    b.put(BuiltIn.MULTINOMIAL, (session, args) -> {
      final Aggregates agg = Aggregates.of(args, Aggregates.Mode.NUMBERS);
      if (agg.failed()) {
        return agg.failure();
      }
      double sum = 0;
      double logDenominator = 0;
      for (double v : agg.values()) {
        if (v < 0) {
          return error(NUMBER);
        }
        final double n = Math.floor(v);
        sum += n;
        logDenominator += SpecialFunctions.lnGamma(n + 1);
      }
      return Value.number(
          Math.rint(Math.exp(SpecialFunctions.lnGamma(sum + 1)
              - logDenominator)));
    });
    b.put(BuiltIn.MUNIT, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final int n = a.integer(0);
      if (a.failed()) {
        return a.error();
      }
      if (n < 1) {
        return error(VALUE);
      }
      final Value.Scalar[] cells = new Value.Scalar[n * n];
      for (int i = 0; i < n * n; i++) {
        cells[i] = i / n == i % n ? Value.number(1) : Value.ZERO;
      }
      return ArrayValue.of(n, n, cells);
    });
    b.put(BuiltIn.ODD, Codes.unary(x -> {
      final double a = Math.abs(x);
      final double c = Math.ceil(fuzz((a + 1D) / 2D)) * 2D - 1D;
      return Math.copySign(Math.max(c, 1D), x == 0 ? 1D : x);
    }));
    b.put(BuiltIn.PERMUT, Codes.binary(MathFunctions::permut));
    b.put(BuiltIn.PI, (session, args) -> Value.number(Math.PI));
    b.put(BuiltIn.POWER, Codes.binary(Operators::power));
    b.put(BuiltIn.PRODUCT, (session, args) -> {
      final Aggregates agg = Aggregates.of(args, Aggregates.Mode.NUMBERS);
      if (agg.failed()) {
        return agg.failure();
      }
      return Value.number(agg.count() == 0 ? 0D : agg.product());
    });
    b.put(BuiltIn.QUOTIENT, Codes.binary((n, d) ->
        d == 0 ? error(DIV_BY_ZERO) : Value.number((long) (n / d))));
    b.put(BuiltIn.RADIANS, Codes.unary(Math::toRadians));
    b.put(BuiltIn.RAND,
        (session, args) -> Value.number(session.random().nextDouble()));
    b.put(BuiltIn.RANDBETWEEN, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double lo = Math.ceil(a.num(0));
      final double hi = Math.floor(a.num(1));
      if (a.failed()) {
        return a.error();
      }
      if (lo > hi) {
        return error(NUMBER);
      }
      final long range = (long) (hi - lo) + 1;
      return Value.number(lo
          + (long) Math.floor(session.random().nextDouble() * range));
    });
    b.put(BuiltIn.ROMAN, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final int n = a.integer(0);
      if (a.failed()) {
        return a.error();
      }
      if (n < 0 || n > 3999) {
        return error(VALUE);
      }
      return Value.text(roman(n));
    });
    b.put(BuiltIn.ROUND, round(RoundingMode.HALF_UP));
    b.put(BuiltIn.ROUNDDOWN, round(RoundingMode.DOWN));
    b.put(BuiltIn.ROUNDUP, round(RoundingMode.UP));
    b.put(BuiltIn.SEC, Codes.unary(x -> 1D / Math.cos(x)));
    b.put(BuiltIn.SIGN, Codes.unary(Math::signum));
    b.put(BuiltIn.SIN, Codes.unary(Math::sin));
    b.put(BuiltIn.SINH, Codes.unary(Math::sinh));
    b.put(BuiltIn.SQRT, Codes.unary(x -> x >= 0, Math::sqrt));
    b.put(BuiltIn.SQRTPI,
        Codes.unary(x -> x >= 0, x -> Math.sqrt(x * Math.PI)));
    b.put(BuiltIn.SUBTOTAL, MathFunctions::subtotal);
    b.put(BuiltIn.SUM, (session, args) -> {
      final Aggregates agg = Aggregates.of(args, Aggregates.Mode.NUMBERS);
      return agg.failed() ? agg.failure() : Value.number(agg.sum());
    });
    b.put(BuiltIn.SUMIF, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final ArrayValue range = a.array(0);
      final ArrayValue sumRange = a.isMissing(2) ? range : a.array(2);
      if (a.failed()) {
        return a.error();
      }
      return sumIfs(sumRange,
          ImmutableList.of(range, Values.first(args.get(1))));
    });
    b.put(BuiltIn.SUMIFS, (session, args) -> {
      if (args.size() % 2 == 0) {
        return error(VALUE);
      }
      return sumIfs(Values.toArray(args.get(0)),
          args.subList(1, args.size()));
    });
    b.put(BuiltIn.SUMPRODUCT, MathFunctions::sumProduct);
    b.put(BuiltIn.SUMSQ, (session, args) -> {
      final Aggregates agg = Aggregates.of(args, Aggregates.Mode.NUMBERS);
      if (agg.failed()) {
        return agg.failure();
      }
      double sum = 0;
      for (double v : agg.values()) {
        sum += v * v;
      }
      return Value.number(sum);
    });
    b.put(BuiltIn.SUMX2MY2, (session, args) ->
        sumPairs(args, (x, y) -> x * x - y * y));
    b.put(BuiltIn.SUMX2PY2, (session, args) ->
        sumPairs(args, (x, y) -> x * x + y * y));
    b.put(BuiltIn.SUMXMY2, (session, args) ->
        sumPairs(args, (x, y) -> (x - y) * (x - y)));
    b.put(BuiltIn.TAN, Codes.unary(Math::tan));
    b.put(BuiltIn.TANH, Codes.unary(Math::tanh));
    b.put(BuiltIn.TRUNC, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double x = a.num(0);
      final int digits = a.integer(1, 0);
      return a.failed() ? a.error()
          : Value.number(round(x, digits, RoundingMode.DOWN));
    });
  }

  /** Snaps a quotient that is within rounding error of an integer to that
   * integer, so that, say, 0.3 / 0.1 floors to 3, not 2. */
  static double fuzz(double q) {
    final double r = Math.rint(q);
    return Math.abs(q - r) < 1E-9 * Math.max(1D, Math.abs(q)) ? r : q;
  }

  /** Rounds a number to a number of decimal digits, which may be
   * negative. */
  static double round(double x, int digits, RoundingMode mode) {
    if (!Double.isFinite(x)) {
      return x;
    }
    return BigDecimal.valueOf(x).setScale(digits, mode).doubleValue();
  }

  /** Returns a function that computes 1 / f(x), or {@code #DIV/0!} if
   * f(x) is zero. */
  private static Applicable reciprocal(DoubleUnaryOperator f) {
    return (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double x = a.num(0);
      if (a.failed()) {
        return a.error();
      }
      final double y = f.applyAsDouble(x);
      return y == 0D ? error(DIV_BY_ZERO) : Value.number(1D / y);
    };
  }

  private static Applicable round(RoundingMode mode) {
    return (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double x = a.num(0);
      final int digits = a.integer(1);
      return a.failed() ? a.error() : Value.number(round(x, digits, mode));
    };
  }

  private static Value.Scalar ceiling(double n, double sig) {
    if (n == 0 || sig == 0) {
      return Value.ZERO;
    }
    if (n > 0 && sig < 0) {
      return error(NUMBER);
    }
    return Value.number(Math.ceil(fuzz(n / sig)) * sig);
  }

  private static Value.Scalar floor(double n, double sig) {
    if (sig == 0) {
      return n == 0 ? Value.ZERO : error(DIV_BY_ZERO);
    }
    if (n > 0 && sig < 0) {
      return error(NUMBER);
    }
    return Value.number(Math.floor(fuzz(n / sig)) * sig);
  }

  /** Implements CEILING.MATH and FLOOR.MATH. */
  private static Value roundMath(List<Value> args, boolean up) {
    final ArgList a = ArgList.of(args);
    final double n = a.num(0);
    final double sig = Math.abs(a.num(1, 1D));
    final double mode = a.num(2, 0D);
    if (a.failed()) {
      return a.error();
    }
    if (sig == 0) {
      return Value.ZERO;
    }
    final double q = fuzz(n / sig);
    if (n < 0 && mode != 0) {
      // Away from zero for CEILING.MATH, toward zero for FLOOR.MATH
      return Value.number((up ? -Math.ceil(-q) : -Math.floor(-q)) * sig);
    }
    return Value.number((up ? Math.ceil(q) : Math.floor(q)) * sig);
  }

  private static Value.Scalar mround(double n, double m) {
    if (m == 0) {
      return Value.ZERO;
    }
    if (n * m < 0) {
      return error(NUMBER);
    }
    final double q = round(n / m, 0, RoundingMode.HALF_UP);
    return Value.number(round(q * m, 12, RoundingMode.HALF_UP));
  }

  private static Value.Scalar combin(double n, double k) {
    n = Math.floor(n);
    k = Math.floor(k);
    if (n < 0 || k < 0 || k > n) {
      return error(NUMBER);
    }
    return Value.number(SpecialFunctions.combin(n, k));
  }

  private static Value.Scalar permut(double n, double k) {
    n = Math.floor(n);
    k = Math.floor(k);
    if (n < 0 || k < 0 || k > n) {
      return error(NUMBER);
    }
    double r = 1D;
    for (double i = n - k + 1D; i <= n && Double.isFinite(r); i++) {
      r *= i;
    }
    return Value.number(r);
  }

  private static Value gcdLcm(List<Value> args, boolean gcd) {
    final Aggregates agg = Aggregates.of(args, Aggregates.Mode.NUMBERS);
    if (agg.failed()) {
      return agg.failure();
    }
    double result = gcd ? 0 : 1;
    for (double v : agg.values()) {
      if (v < 0) {
        return error(NUMBER);
      }
      final double n = Math.floor(v);
      if (gcd) {
        result = gcd(result, n);
      } else {
        if (n == 0) {
          return Value.ZERO;
        }
        result = result / gcd(result, n) * n;
      }
    }
    return Value.number(result);
  }

  private static double gcd(double a, double b) {
    while (b != 0) {
      final double t = a % b;
      a = b;
      b = t;
    }
    return a;
  }

  static String roman(int n) {
    final StringBuilder b = new StringBuilder();
    for (int i = 0; i < ROMAN_VALUES.length; i++) {
      while (n >= ROMAN_VALUES[i]) {
        b.append(ROMAN_SYMBOLS[i]);
        n -= ROMAN_VALUES[i];
      }
    }
    return b.toString();
  }

  private static Value arabic(Session session, List<Value> args) {
    final ArgList a = ArgList.of(args);
    String s = a.text(0).trim().toUpperCase(Locale.ROOT);
    if (a.failed()) {
      return a.error();
    }
    boolean negative = false;
    if (s.startsWith("-")) {
      negative = true;
      s = s.substring(1);
    }
    int total = 0;
    int i = 0;
    for (int j = 0; j < ROMAN_SYMBOLS.length && i < s.length(); j++) {
      final String symbol = ROMAN_SYMBOLS[j];
      while (s.startsWith(symbol, i)) {
        total += ROMAN_VALUES[j];
        i += symbol.length();
      }
    }
    if (i < s.length()) {
      return error(VALUE);
    }
    return Value.number(negative ? -total : total);
  }

  private static Value base(Session session, List<Value> args) {
    final ArgList a = ArgList.of(args);
    final double n = Math.floor(a.num(0));
    final int radix = a.integer(1);
    final int minLength = a.integer(2, 0);
    if (a.failed()) {
      return a.error();
    }
    if (n < 0 || n >= 9007199254740992D || radix < 2 || radix > 36
        || minLength < 0 || minLength > 255) {
      return error(NUMBER);
    }
    final StringBuilder s = new StringBuilder(
        Long.toString((long) n, radix).toUpperCase(Locale.ROOT));
    while (s.length() < minLength) {
      s.insert(0, '0');
    }
    return Value.text(s.toString());
  }

  private static Value decimal(Session session, List<Value> args) {
    final ArgList a = ArgList.of(args);
    final String text = a.text(0).trim();
    final int radix = a.integer(1);
    if (a.failed()) {
      return a.error();
    }
    if (radix < 2 || radix > 36) {
      return error(NUMBER);
    }
    if (text.isEmpty()) {
      return Value.ZERO;
    }
    try {
      return Value.number(Long.parseLong(text, radix));
    } catch (NumberFormatException e) {
      return error(NUMBER);
    }
  }

  /** Converts an array to a matrix of numbers; returns null if any element
   * is not a number. */
  private static double @Nullable [][] matrix(ArrayValue a) {
    final double[][] m = new double[a.rows][a.cols];
    for (int r = 0; r < a.rows; r++) {
      for (int c = 0; c < a.cols; c++) {
        final Value.Scalar s = a.get(r, c);
        if (!(s instanceof Value.Num)) {
          return null;
        }
        m[r][c] = ((Value.Num) s).value;
      }
    }
    return m;
  }

  private static Value mdeterm(Session session, List<Value> args) {
    final ArgList a = ArgList.of(args);
    final ArrayValue array = a.array(0);
    if (a.failed()) {
      return a.error();
    }
    final Value.Err err = array.firstError();
    if (err != null) {
      return err;
    }
    final double[][] m = matrix(array);
    if (m == null || array.rows != array.cols) {
      return error(VALUE);
    }
    final int n = array.rows;
    double det = 1D;
    for (int col = 0; col < n; col++) {
      int pivot = col;
      for (int r = col + 1; r < n; r++) {
        if (Math.abs(m[r][col]) > Math.abs(m[pivot][col])) {
          pivot = r;
        }
      }
      if (m[pivot][col] == 0D) {
        return Value.ZERO;
      }
      if (pivot != col) {
        final double[] t = m[pivot];
        m[pivot] = m[col];
        m[col] = t;
        det = -det;
      }
      det *= m[col][col];
      for (int r = col + 1; r < n; r++) {
        final double f = m[r][col] / m[col][col];
        for (int c = col; c < n; c++) {
          m[r][c] -= f * m[col][c];
        }
      }
    }
    return Value.number(det);
  }

  private static Value mmult(Session session, List<Value> args) {
    final ArgList a = ArgList.of(args);
    final ArrayValue x = a.array(0);
    final ArrayValue y = a.array(1);
    if (a.failed()) {
      return a.error();
    }
    final double[][] mx = matrix(x);
    final double[][] my = matrix(y);
    if (mx == null || my == null || x.cols != y.rows) {
      return error(VALUE);
    }
    final Value.Scalar[] cells = new Value.Scalar[x.rows * y.cols];
    for (int r = 0; r < x.rows; r++) {
      for (int c = 0; c < y.cols; c++) {
        double sum = 0D;
        for (int k = 0; k < x.cols; k++) {
          sum += mx[r][k] * my[k][c];
        }
        cells[r * y.cols + c] = Value.number(sum);
      }
    }
    return ArrayValue.of(x.rows, y.cols, cells);
  }

  /** Sums the numbers in a range for which all criteria hold. */
  private static Value sumIfs(ArrayValue sumRange, List<Value> criteria) {
    final boolean[] mask = Criteria.mask(sumRange, criteria);
    if (mask == null) {
      return error(VALUE);
    }
    double sum = 0D;
    for (int i = 0; i < mask.length; i++) {
      if (mask[i]) {
        final Value.Scalar s = sumRange.get(i);
        if (s instanceof Value.Err) {
          return s;
        }
        if (s instanceof Value.Num) {
          sum += ((Value.Num) s).value;
        }
      }
    }
    return Value.number(sum);
  }

  private static Value sumProduct(Session session, List<Value> args) {
    final List<ArrayValue> arrays = new ArrayList<>();
    for (Value arg : args) {
      final ArrayValue array = Values.toArray(arg);
      if (!arrays.isEmpty() && !arrays.get(0).sameShape(array)) {
        return error(VALUE);
      }
      arrays.add(array);
    }
    final int n = arrays.get(0).size();
    double sum = 0D;
    for (int i = 0; i < n; i++) {
      double product = 1D;
      for (ArrayValue array : arrays) {
        final Value.Scalar s = array.get(i);
        if (s instanceof Value.Err) {
          return s;
        }
        product *= s instanceof Value.Num ? ((Value.Num) s).value : 0D;
      }
      sum += product;
    }
    return Value.number(sum);
  }

  private static Value sumPairs(List<Value> args, DoubleBinaryOperator f) {
    final ArrayValue x = Values.toArray(args.get(0));
    final ArrayValue y = Values.toArray(args.get(1));
    if (x.size() != y.size()) {
      return error(NOT_AVAILABLE);
    }
    double sum = 0D;
    for (int i = 0; i < x.size(); i++) {
      final Value.Scalar sx = x.get(i);
      final Value.Scalar sy = y.get(i);
      if (sx instanceof Value.Err) {
        return sx;
      }
      if (sy instanceof Value.Err) {
        return sy;
      }
      if (sx instanceof Value.Num && sy instanceof Value.Num) {
        sum += f.applyAsDouble(((Value.Num) sx).value,
            ((Value.Num) sy).value);
      }
    }
    return Value.number(sum);
  }

  private static Value subtotal(Session session, List<Value> args) {
    final ArgList a = ArgList.of(args);
    final int function = a.integer(0);
    if (a.failed()) {
      return a.error();
    }
    final int f = function > 100 ? function - 100 : function;
    if (f < 1 || f > 11) {
      return error(VALUE);
    }
    return StatisticalFunctions.aggregate(session, f,
        args.subList(1, args.size()));
  }

  private static Value aggregate(Session session, List<Value> args) {
    final ArgList a = ArgList.of(args);
    final int function = a.integer(0);
    final int options = a.integer(1);
    if (a.failed()) {
      return a.error();
    }
    if (function < 1 || function > 19 || options < 0 || options > 7) {
      return error(VALUE);
    }
    final boolean ignoreErrors =
        options == 2 || options == 3 || options == 6 || options == 7;
    final List<Value> rest = new ArrayList<>();
    for (Value arg : args.subList(2, args.size())) {
      rest.add(ignoreErrors ? withoutErrors(arg) : arg);
    }
    if (function >= 14) {
      // LARGE, SMALL, PERCENTILE.INC, QUARTILE.INC, PERCENTILE.EXC,
      // QUARTILE.EXC take (array, k)
      if (rest.size() != 2) {
        return error(VALUE);
      }
    }
    return StatisticalFunctions.aggregate(session, function, rest);
  }

  /** Replaces errors in an array with blanks. */
  private static Value withoutErrors(Value v) {
    if (v instanceof ArrayValue) {
      return ((ArrayValue) v)
          .map(s -> s instanceof Value.Err ? Value.BLANK : s);
    }
    return v instanceof Value.Err ? ArrayValue.of(Value.BLANK) : v;
  }
}

// End MathFunctions.java
