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

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.regex.Pattern;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Utilities for {@link Value}: coercion between types, comparison, and
 * conversion of numbers to text.
 */
public abstract class Values {
  /** Precision of numbers converted to text. */
  private static final MathContext GENERAL = new MathContext(15,
      RoundingMode.HALF_UP);

  private static final Pattern NUMBER =
      Pattern.compile("[0-9]*\\.?[0-9]*([eE][+-]?[0-9]+)?");

  private static final Pattern GROUPED =
      Pattern.compile("[0-9]{1,3}(,[0-9]{3})+(\\..*)?");

  private Values() {}

  /**
   * Converts a number to text in the "General" format: at most 15
   * significant digits, no trailing zeros, and scientific notation for very
   * large or very small magnitudes.
   */
  public static String formatNumber(double d) {
    if (d == 0D) {
      return "0";
    }
    final BigDecimal bd =
        new BigDecimal(d).round(GENERAL).stripTrailingZeros();
    final double abs = Math.abs(d);
    if (abs >= 1E21 || abs < 1E-9) {
      final int exponent = bd.precision() - bd.scale() - 1;
      final String mantissa =
          bd.movePointLeft(exponent).stripTrailingZeros().toPlainString();
      return mantissa + (exponent < 0 ? "E-" : "E+") + Math.abs(exponent);
    }
    return bd.toPlainString();
  }

  /** Appends a string in formula syntax, doubling embedded quotes. */
  public static StringBuilder quote(StringBuilder b, String s) {
    return b.append('"').append(s.replace("\"", "\"\"")).append('"');
  }

  /**
   * Parses text as a number. Accepts an optional sign, currency symbol,
   * thousands separators, exponent and trailing percent sign. Returns null if
   * the text is not numeric.
   */
  public static @Nullable Double parseNumberOpt(String text) {
    String s = text.trim();
    if (s.isEmpty()) {
      return null;
    }
    boolean negative = false;
    if (s.charAt(0) == '-' || s.charAt(0) == '+') {
      negative = s.charAt(0) == '-';
      s = s.substring(1).trim();
    }
    if (s.startsWith("$")) {
      s = s.substring(1);
    }
    boolean percent = false;
    if (s.endsWith("%")) {
      percent = true;
      s = s.substring(0, s.length() - 1).trim();
    }
    if (GROUPED.matcher(s).matches()) {
      s = s.replace(",", "");
    }
    if (!NUMBER.matcher(s).matches() || !containsDigit(s)) {
      return null;
    }
    double d = Double.parseDouble(s);
    if (percent) {
      d /= 100D;
    }
    return negative ? -d : d;
  }

  private static boolean containsDigit(String s) {
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      if (c >= '0' && c <= '9') {
        return true;
      }
      if (c == 'e' || c == 'E') {
        return false;
      }
    }
    return false;
  }

  /**
   * Returns the scalar that stands for a value in a scalar context: the value
   * itself if it is a scalar, the top-left element if it is an array,
   * {@code #VALUE!} if it is a lambda.
   */
  public static Value.Scalar first(Value value) {
    if (value instanceof Value.Scalar) {
      return (Value.Scalar) value;
    } else if (value instanceof ArrayValue) {
      return ((ArrayValue) value).get(0);
    } else {
      return Value.error(ErrorKind.VALUE);
    }
  }

  /** Returns a value as an array; a scalar becomes a 1 x 1 array. */
  public static ArrayValue toArray(Value value) {
    if (value instanceof ArrayValue) {
      return (ArrayValue) value;
    }
    return ArrayValue.of(first(value));
  }

  /**
   * Coerces a scalar to a number. Booleans become 1 or 0, blank becomes 0,
   * numeric text is parsed; other text yields {@code #VALUE!}. An error is
   * returned unchanged.
   */
  public static Value.Scalar toNumber(Value.Scalar s) {
    switch (s.kind()) {
    case NUMBER:
    case ERROR:
      return s;
    case BOOLEAN:
      return ((Value.Bool) s).value ? Value.number(1) : Value.ZERO;
    case BLANK:
      return Value.ZERO;
    case TEXT:
      final Double d = parseNumberOpt(((Value.Text) s).value);
      return d == null ? Value.error(ErrorKind.VALUE) : Value.number(d);
    default:
      throw new AssertionError(s.kind());
    }
  }

  /**
   * Coerces a scalar to text. Numbers use the "General" format; an error is
   * returned unchanged.
   */
  public static Value.Scalar toText(Value.Scalar s) {
    switch (s.kind()) {
    case TEXT:
    case ERROR:
      return s;
    case NUMBER:
      return Value.text(formatNumber(((Value.Num) s).value));
    case BOOLEAN:
    case BLANK:
      return Value.text(s.toString());
    default:
      throw new AssertionError(s.kind());
    }
  }

  /**
   * Coerces a scalar to a boolean. Non-zero numbers are true; blank is false;
   * text must be "TRUE" or "FALSE" (in any case), otherwise {@code #VALUE!}.
   */
  public static Value.Scalar toBool(Value.Scalar s) {
    switch (s.kind()) {
    case BOOLEAN:
    case ERROR:
      return s;
    case NUMBER:
      return Value.bool(((Value.Num) s).value != 0D);
    case BLANK:
      return Value.FALSE;
    case TEXT:
      final String text = ((Value.Text) s).value;
      if (text.equalsIgnoreCase("TRUE")) {
        return Value.TRUE;
      } else if (text.equalsIgnoreCase("FALSE")) {
        return Value.FALSE;
      }
      return Value.error(ErrorKind.VALUE);
    default:
      throw new AssertionError(s.kind());
    }
  }

  /**
   * Compares two non-error scalars in the order used by comparison operators
   * and by sorting: numbers before text before booleans; text compares
   * case-insensitively. Blank compares as zero against a number, as empty
   * text against text, and as FALSE against a boolean.
   */
  public static int compare(Value.Scalar a, Value.Scalar b) {
    if (a instanceof Value.Blank) {
      if (b instanceof Value.Blank) {
        return 0;
      }
      a = zeroOf(b);
    } else if (b instanceof Value.Blank) {
      b = zeroOf(a);
    }
    final int c = Integer.compare(rank(a), rank(b));
    if (c != 0) {
      return c;
    }
    switch (a.kind()) {
    case NUMBER:
      return Double.compare(((Value.Num) a).value, ((Value.Num) b).value);
    case TEXT:
      return compareText(((Value.Text) a).value, ((Value.Text) b).value);
    case BOOLEAN:
      return Boolean.compare(((Value.Bool) a).value, ((Value.Bool) b).value);
    default:
      return 0;
    }
  }

  /** Compares two strings case-insensitively. */
  public static int compareText(String a, String b) {
    return a.toLowerCase(Locale.ROOT).compareTo(b.toLowerCase(Locale.ROOT));
  }

  /**
   * Returns whether two scalars match for the purposes of an exact lookup:
   * same type and equal value, with text compared case-insensitively. Blank
   * matches only blank and empty text.
   */
  public static boolean lookupEquals(Value.Scalar a, Value.Scalar b) {
    if (a instanceof Value.Blank || b instanceof Value.Blank) {
      return toText(a).equals(toText(b))
          && !(a instanceof Value.Num) && !(b instanceof Value.Num)
          && !(a instanceof Value.Bool) && !(b instanceof Value.Bool);
    }
    if (a.kind() != b.kind()) {
      return false;
    }
    if (a instanceof Value.Err) {
      return ((Value.Err) a).error == ((Value.Err) b).error;
    }
    return compare(a, b) == 0;
  }

  private static int rank(Value.Scalar s) {
    switch (s.kind()) {
    case NUMBER:
      return 0;
    case TEXT:
      return 1;
    case BOOLEAN:
      return 2;
    default:
      return 3;
    }
  }

  private static Value.Scalar zeroOf(Value.Scalar s) {
    switch (s.kind()) {
    case TEXT:
      return Value.EMPTY;
    case BOOLEAN:
      return Value.FALSE;
    default:
      return Value.ZERO;
    }
  }
}

// End Values.java
