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
import static net.hydromatic.formula.eval.ErrorKind.NUMBER;
import static net.hydromatic.formula.eval.ErrorKind.VALUE;
import static net.hydromatic.formula.eval.Value.error;

import com.google.common.base.Strings;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.function.LongBinaryOperator;
import java.util.function.ToDoubleFunction;
import net.hydromatic.formula.compile.BuiltIn;
import net.hydromatic.formula.eval.Applicable;
import net.hydromatic.formula.eval.ArgList;
import net.hydromatic.formula.eval.ArrayValue;
import net.hydromatic.formula.eval.Value;
import net.hydromatic.formula.eval.Values;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Engineering functions: radix conversion, bitwise operations, the error
 * function, and complex numbers.
 *
 * <p>Binary, octal and hexadecimal numbers have at most 10 digits; a
 * 10-digit number whose top bit is set is negative, in two's complement.
 */
abstract class EngineeringFunctions {
  /** Bitwise functions accept integers below 2<sup>48</sup>. */
  private static final long MAX_BITS = 1L << 48;

  private static final Complex ONE = new Complex(1, 0);

  private EngineeringFunctions() {}

  static void populate(Codes.Builder b) {
    b.put(BuiltIn.BIN2DEC, toDecimal(2));
    b.put(BuiltIn.BIN2HEX, convert(2, 16));
    b.put(BuiltIn.BIN2OCT, convert(2, 8));
    b.put(BuiltIn.BITAND, bitwise((x, y) -> x & y));
    b.put(BuiltIn.BITLSHIFT, (session, args) -> shift(args, true));
    b.put(BuiltIn.BITOR, bitwise((x, y) -> x | y));
    b.put(BuiltIn.BITRSHIFT, (session, args) -> shift(args, false));
    b.put(BuiltIn.BITXOR, bitwise((x, y) -> x ^ y));
    b.put(BuiltIn.COMPLEX, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double re = a.num(0);
      final double im = a.num(1);
      final String suffix = a.text(2, "i");
      if (a.failed()) {
        return a.error();
      }
      switch (suffix) {
      case "":
      case "i":
        return complex(new Complex(re, im, 'i'));
      case "j":
        return complex(new Complex(re, im, 'j'));
      default:
        return error(VALUE);
      }
    });
    b.put(BuiltIn.DEC2BIN, fromDecimal(2));
    b.put(BuiltIn.DEC2HEX, fromDecimal(16));
    b.put(BuiltIn.DEC2OCT, fromDecimal(8));
    b.put(BuiltIn.DELTA, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double x = a.num(0);
      final double y = a.num(1, 0D);
      return a.failed() ? a.error() : Value.number(x == y ? 1 : 0);
    });
    b.put(BuiltIn.ERF, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double lower = a.num(0);
      final double upper = a.num(1, Double.NaN);
      if (a.failed()) {
        return a.error();
      }
      return Value.number(Double.isNaN(upper)
          ? SpecialFunctions.erf(lower)
          : SpecialFunctions.erf(upper) - SpecialFunctions.erf(lower));
    });
    b.put(BuiltIn.ERF_PRECISE, Codes.unary(SpecialFunctions::erf));
    b.put(BuiltIn.ERFC, Codes.unary(SpecialFunctions::erfc));
    b.put(BuiltIn.ERFC_PRECISE, Codes.unary(SpecialFunctions::erfc));
    b.put(BuiltIn.GESTEP, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double x = a.num(0);
      final double step = a.num(1, 0D);
      return a.failed() ? a.error() : Value.number(x >= step ? 1 : 0);
    });
    b.put(BuiltIn.HEX2BIN, convert(16, 2));
    b.put(BuiltIn.HEX2DEC, toDecimal(16));
    b.put(BuiltIn.HEX2OCT, convert(16, 8));
    b.put(BuiltIn.IMABS, imReal(Complex::abs));
    b.put(BuiltIn.IMAGINARY, imReal(z -> z.im));
    b.put(BuiltIn.IMARGUMENT, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final Complex z = complex(a, 0);
      if (a.failed() || z == null) {
        return a.error();
      }
      return z.isZero() ? error(DIV_BY_ZERO) : Value.number(z.arg());
    });
    b.put(BuiltIn.IMCONJUGATE, im(Complex::conjugate));
    b.put(BuiltIn.IMCOS, im(Complex::cos));
    b.put(BuiltIn.IMCOSH, im(Complex::cosh));
    b.put(BuiltIn.IMCOT, im(z -> z.cos().divideOpt(z.sin())));
    b.put(BuiltIn.IMCSC, im(z -> ONE.divideOpt(z.sin())));
    b.put(BuiltIn.IMDIV, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final Complex z1 = complex(a, 0);
      final Complex z2 = complex(a, 1);
      if (a.failed() || z1 == null || z2 == null) {
        return a.error();
      }
      if (!sameSuffix(z1, z2)) {
        return error(VALUE);
      }
      final Complex q = z1.withSuffix(suffix(z1, z2)).divideOpt(z2);
      return q == null ? error(NUMBER) : complex(q);
    });
    b.put(BuiltIn.IMEXP, im(Complex::exp));
    b.put(BuiltIn.IMLN, im(z -> z.isZero() ? null : z.ln()));
    b.put(BuiltIn.IMLOG10,
        im(z -> z.isZero() ? null : z.ln().scale(1 / Math.log(10))));
    b.put(BuiltIn.IMLOG2,
        im(z -> z.isZero() ? null : z.ln().scale(1 / Math.log(2))));
    b.put(BuiltIn.IMPOWER, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final Complex z = complex(a, 0);
      final double n = a.num(1);
      if (a.failed() || z == null) {
        return a.error();
      }
      if (z.isZero() && n <= 0) {
        return error(NUMBER);
      }
      return complex(z.pow(n));
    });
    b.put(BuiltIn.IMPRODUCT, (session, args) -> fold(args, false));
    b.put(BuiltIn.IMREAL, imReal(z -> z.re));
    b.put(BuiltIn.IMSEC, im(z -> ONE.divideOpt(z.cos())));
    b.put(BuiltIn.IMSIN, im(Complex::sin));
    b.put(BuiltIn.IMSINH, im(Complex::sinh));
    b.put(BuiltIn.IMSQRT, im(Complex::sqrt));
    b.put(BuiltIn.IMSUB, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final Complex z1 = complex(a, 0);
      final Complex z2 = complex(a, 1);
      if (a.failed() || z1 == null || z2 == null) {
        return a.error();
      }
      if (!sameSuffix(z1, z2)) {
        return error(VALUE);
      }
      return complex(z1.withSuffix(suffix(z1, z2)).minus(z2));
    });
    b.put(BuiltIn.IMSUM, (session, args) -> fold(args, true));
    b.put(BuiltIn.IMTAN, im(z -> z.sin().divideOpt(z.cos())));
    b.put(BuiltIn.OCT2BIN, convert(8, 2));
    b.put(BuiltIn.OCT2DEC, toDecimal(8));
    b.put(BuiltIn.OCT2HEX, convert(8, 16));
  }

  // Radix conversion

  /** Returns 10<sup>radix</sup>, the number of distinct 10-digit values in
   * a radix. */
  private static long modulus(int radix) {
    long m = 1;
    for (int i = 0; i < 10; i++) {
      m *= radix;
    }
    return m;
  }

  /** Parses a number of up to 10 digits in a radix, with negative numbers
   * in two's complement; returns null if invalid. */
  static @Nullable Long parseRadix(String text, int radix) {
    final String s = text.trim();
    if (s.length() > 10) {
      return null;
    }
    long n = 0;
    for (int i = 0; i < s.length(); i++) {
      final int digit = Character.digit(s.charAt(i), radix);
      if (digit < 0) {
        return null;
      }
      n = n * radix + digit;
    }
    final long modulus = modulus(radix);
    return n >= modulus / 2 ? n - modulus : n;
  }

  /** Formats a number in a radix, padded to {@code places} digits if
   * {@code places} is positive; returns null if the number is out of range
   * or does not fit. Negative numbers are 10 digits, in two's complement,
   * and ignore {@code places}. */
  static @Nullable String formatRadix(long n, int radix, int places) {
    final long modulus = modulus(radix);
    if (n < -modulus / 2 || n >= modulus / 2) {
      return null;
    }
    if (n < 0) {
      return Long.toString(n + modulus, radix).toUpperCase(Locale.ROOT);
    }
    final String s = Long.toString(n, radix).toUpperCase(Locale.ROOT);
    if (places == 0) {
      return s;
    }
    if (places < s.length() || places > 10) {
      return null;
    }
    return Strings.padStart(s, places, '0');
  }

  /** Reads the optional {@code places} argument; 0 if omitted. Records
   * {@code #NUM!} if it is not positive. */
  private static int places(ArgList a, int i) {
    if (a.isMissing(i)) {
      return 0;
    }
    final int places = a.integer(i);
    if (places <= 0) {
      a.fail(NUMBER);
    }
    return places;
  }

  private static Applicable toDecimal(int radix) {
    return (session, args) -> {
      final ArgList a = ArgList.of(args);
      final String text = a.text(0);
      if (a.failed()) {
        return a.error();
      }
      final Long n = parseRadix(text, radix);
      return n == null ? error(NUMBER) : Value.number(n);
    };
  }

  private static Applicable fromDecimal(int radix) {
    return (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double number = a.num(0);
      final int places = places(a, 1);
      if (a.failed()) {
        return a.error();
      }
      if (Math.abs(number) >= modulus(radix)) {
        return error(NUMBER);
      }
      final String s = formatRadix((long) number, radix, places);
      return s == null ? error(NUMBER) : Value.text(s);
    };
  }

  private static Applicable convert(int fromRadix, int toRadix) {
    return (session, args) -> {
      final ArgList a = ArgList.of(args);
      final String text = a.text(0);
      final int places = places(a, 1);
      if (a.failed()) {
        return a.error();
      }
      final Long n = parseRadix(text, fromRadix);
      final String s = n == null ? null : formatRadix(n, toRadix, places);
      return s == null ? error(NUMBER) : Value.text(s);
    };
  }

  // Bitwise operations

  /** Reads an argument of a bitwise function: an integer from 0 to
   * 2<sup>48</sup> - 1. */
  private static long bits(ArgList a, int i) {
    final double d = a.num(i);
    if (d < 0 || d >= MAX_BITS || d != Math.floor(d)) {
      a.fail(NUMBER);
      return 0L;
    }
    return (long) d;
  }

  private static Applicable bitwise(LongBinaryOperator op) {
    return (session, args) -> {
      final ArgList a = ArgList.of(args);
      final long x = bits(a, 0);
      final long y = bits(a, 1);
      return a.failed() ? a.error()
          : Value.number(op.applyAsLong(x, y));
    };
  }

  /** Implements {@code BITLSHIFT} and {@code BITRSHIFT}; a negative shift
   * amount shifts the other way. */
  private static Value shift(List<Value> args, boolean left) {
    final ArgList a = ArgList.of(args);
    final long x = bits(a, 0);
    final int amount = a.integer(1);
    if (a.failed()) {
      return a.error();
    }
    if (Math.abs(amount) > 53) {
      return error(NUMBER);
    }
    final int n = left ? amount : -amount;
    final long result = n >= 0 ? x << n : x >>> -n;
    if (n > 0 && (result >>> n != x || result >= MAX_BITS)) {
      return error(NUMBER);
    }
    return Value.number(result);
  }

  // Complex numbers

  /** Reads a complex argument: a number, or text such as "3+4i". Records
   * {@code #NUM!} and returns null if the text is not a complex number. */
  private static @Nullable Complex complex(ArgList a, int i) {
    final Value.Scalar s = a.scalar(i);
    if (s instanceof Value.Text) {
      final Complex z = Complex.parseOpt(((Value.Text) s).value);
      if (z == null) {
        a.fail(NUMBER);
      }
      return z;
    }
    final double re = a.num(i);
    return a.failed() ? null : new Complex(re, 0);
  }

  /** Converts a complex number to a text value; {@code #NUM!} if either
   * part is not finite. */
  private static Value complex(Complex z) {
    if (!Double.isFinite(z.re) || !Double.isFinite(z.im)) {
      return error(NUMBER);
    }
    return Value.text(z.toString());
  }

  /** Returns whether two complex numbers may be combined: a number with no
   * imaginary part has no suffix and combines with either. */
  private static boolean sameSuffix(Complex z1, Complex z2) {
    return z1.im == 0 || z2.im == 0 || z1.suffix == z2.suffix;
  }

  private static char suffix(Complex z1, Complex z2) {
    return z1.im == 0 ? z2.suffix : z1.suffix;
  }

  /** Returns a function of one complex number whose result is complex; a
   * null result (a pole or a logarithm of zero) is {@code #NUM!}. */
  private static Applicable im(Function<Complex, @Nullable Complex> f) {
    return (session, args) -> {
      final ArgList a = ArgList.of(args);
      final Complex z = complex(a, 0);
      if (a.failed() || z == null) {
        return a.error();
      }
      final Complex result = f.apply(z);
      return result == null ? error(NUMBER)
          : complex(result.withSuffix(z.suffix));
    };
  }

  /** Returns a function of one complex number whose result is real. */
  private static Applicable imReal(ToDoubleFunction<Complex> f) {
    return (session, args) -> {
      final ArgList a = ArgList.of(args);
      final Complex z = complex(a, 0);
      if (a.failed() || z == null) {
        return a.error();
      }
      return Value.number(f.applyAsDouble(z));
    };
  }

  /** Implements {@code IMSUM} and {@code IMPRODUCT}, whose arguments may be
   * ranges. Blank cells are skipped. */
  private static Value fold(List<Value> args, boolean sum) {
    Complex acc = sum ? new Complex(0, 0) : ONE;
    boolean first = true;
    for (int i = 0; i < args.size(); i++) {
      final ArrayValue array = Values.toArray(args.get(i));
      for (Value.Scalar cell : array.cells()) {
        if (cell instanceof Value.Blank && args.get(i) instanceof ArrayValue) {
          continue;
        }
        final ArgList a = ArgList.of(Collections.singletonList(cell));
        final Complex z = complex(a, 0);
        if (a.failed() || z == null) {
          return a.error();
        }
        if (!sameSuffix(acc, z)) {
          return error(VALUE);
        }
        final char suffix = first ? z.suffix : suffix(acc, z);
        acc = (sum ? acc.plus(z) : acc.times(z)).withSuffix(suffix);
        first = false;
      }
    }
    return complex(acc);
  }
}

// End EngineeringFunctions.java
