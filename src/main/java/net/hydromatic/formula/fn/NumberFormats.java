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

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Month;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import net.hydromatic.formula.eval.Values;

/**
 * Formats numbers as text using spreadsheet format codes, such as
 * {@code "#,##0.00"}, {@code "0%"}, {@code "0.00E+00"} and
 * {@code "yyyy-mm-dd"}.
 *
 * <p>A format code has up to four sections separated by semicolons: for
 * positive numbers, negative numbers, zero, and text.
 */
abstract class NumberFormats {
  private static final String[] DAY_NAMES = {
      "Sunday", "Monday", "Tuesday", "Wednesday", "Thursday", "Friday",
      "Saturday"
  };

  private NumberFormats() {}

  /** Formats a number using a format code. */
  static String format(double value, String format) {
    final List<String> sections = sections(format);
    String section = sections.get(0);
    double v = value;
    if (value < 0 && sections.size() > 1) {
      section = sections.get(1);
      v = -value;
    } else if (value == 0 && sections.size() > 2) {
      section = sections.get(2);
    }
    if (section.equalsIgnoreCase("General") || section.isEmpty()) {
      return Values.formatNumber(v);
    }
    if (isDateFormat(section)) {
      return formatDate(v, section);
    }
    return formatNumber(v, section);
  }

  /** Formats text using the text section of a format code, if it has
   * one. */
  static String formatText(String text, String format) {
    final List<String> sections = sections(format);
    if (sections.size() < 4 && !format.contains("@")) {
      return text;
    }
    final String section = sections.get(sections.size() < 4 ? 0 : 3);
    final StringBuilder b = new StringBuilder();
    for (int i = 0; i < section.length(); i++) {
      final char c = section.charAt(i);
      if (c == '@') {
        b.append(text);
      } else if (c == '"') {
        final int end = section.indexOf('"', i + 1);
        b.append(section, i + 1, end < 0 ? section.length() : end);
        i = end < 0 ? section.length() : end;
      } else if (c == '\\' && i + 1 < section.length()) {
        b.append(section.charAt(++i));
      } else {
        b.append(c);
      }
    }
    return b.toString();
  }

  /**
   * Formats a number with a fixed number of decimals, optionally with
   * thousands separators, as {@code FIXED} does. A negative number of
   * decimals rounds to the left of the decimal point.
   */
  static String fixed(double value, int decimals, boolean commas) {
    final BigDecimal rounded = BigDecimal.valueOf(value)
        .setScale(decimals, RoundingMode.HALF_UP);
    final BigDecimal abs = rounded.abs();
    final String plain = decimals >= 0
        ? abs.setScale(decimals, RoundingMode.HALF_UP).toPlainString()
        : abs.setScale(0, RoundingMode.HALF_UP).toPlainString();
    final int dot = plain.indexOf('.');
    final String intPart = dot < 0 ? plain : plain.substring(0, dot);
    final String fraction = dot < 0 ? "" : plain.substring(dot);
    final String grouped = commas ? group(intPart) : intPart;
    return (rounded.signum() < 0 ? "-" : "") + grouped + fraction;
  }

  /** Inserts a comma between each group of three digits. */
  static String group(String digits) {
    final StringBuilder b = new StringBuilder();
    final int n = digits.length();
    for (int i = 0; i < n; i++) {
      if (i > 0 && (n - i) % 3 == 0) {
        b.append(',');
      }
      b.append(digits.charAt(i));
    }
    return b.toString();
  }

  /** Splits a format code into sections, respecting quoted literals. */
  private static List<String> sections(String format) {
    final List<String> sections = new ArrayList<>();
    boolean quoted = false;
    int start = 0;
    for (int i = 0; i < format.length(); i++) {
      final char c = format.charAt(i);
      if (c == '"') {
        quoted = !quoted;
      } else if (c == '\\') {
        ++i;
      } else if (c == ';' && !quoted) {
        sections.add(format.substring(start, i));
        start = i + 1;
      }
    }
    sections.add(format.substring(start));
    return sections;
  }

  private static boolean isDateFormat(String section) {
    boolean quoted = false;
    for (int i = 0; i < section.length(); i++) {
      final char c = section.charAt(i);
      if (c == '"') {
        quoted = !quoted;
      } else if (c == '\\') {
        ++i;
      } else if (!quoted) {
        switch (Character.toLowerCase(c)) {
        case 'y':
        case 'd':
        case 'h':
        case 's':
        case 'm':
          return true;
        case 'e':
          // "E+" in scientific notation
          ++i;
          break;
        default:
          break;
        }
      }
    }
    return false;
  }

  private static String formatNumber(double value, String section) {
    // Separate the numeric part from literal prefix and suffix.
    final StringBuilder prefix = new StringBuilder();
    final StringBuilder core = new StringBuilder();
    final StringBuilder suffix = new StringBuilder();
    boolean percent = false;
    for (int i = 0; i < section.length(); i++) {
      final char c = section.charAt(i);
      final StringBuilder literal = core.length() == 0 ? prefix : suffix;
      switch (c) {
      case '"':
        final int end = section.indexOf('"', i + 1);
        literal.append(section, i + 1, end < 0 ? section.length() : end);
        i = end < 0 ? section.length() : end;
        break;
      case '\\':
        if (i + 1 < section.length()) {
          literal.append(section.charAt(++i));
        }
        break;
      case '%':
        percent = true;
        literal.append(c);
        break;
      case '0':
      case '#':
      case '?':
      case '.':
        if (suffix.length() > 0) {
          suffix.append(c);
        } else {
          core.append(c);
        }
        break;
      case ',':
        if (core.length() > 0 && suffix.length() == 0) {
          core.append(c);
        } else {
          literal.append(c);
        }
        break;
      case 'E':
      case 'e':
        if (core.length() > 0 && i + 1 < section.length()
            && (section.charAt(i + 1) == '+'
                || section.charAt(i + 1) == '-')) {
          core.append('E').append(section.charAt(++i));
          while (i + 1 < section.length() && section.charAt(i + 1) == '0') {
            core.append(section.charAt(++i));
          }
        } else {
          literal.append(c);
        }
        break;
      case '_':
        // Skip the width of the next character
        ++i;
        literal.append(' ');
        break;
      case '*':
        ++i;
        break;
      default:
        literal.append(c);
        break;
      }
    }
    double v = percent ? value * 100D : value;
    final String number;
    final int e = core.indexOf("E");
    if (e >= 0) {
      number = formatScientific(v, core.substring(0, e), core.substring(e));
    } else {
      String pattern = core.toString();
      // Trailing commas scale by a thousand each
      while (pattern.endsWith(",")) {
        v /= 1000D;
        pattern = pattern.substring(0, pattern.length() - 1);
      }
      number = formatDecimal(Math.abs(v), pattern);
    }
    final boolean negative = v < 0 && !isZero(number);
    return (negative ? "-" : "") + prefix + number + suffix;
  }

  private static boolean isZero(String number) {
    for (int i = 0; i < number.length(); i++) {
      final char c = number.charAt(i);
      if (c >= '1' && c <= '9') {
        return false;
      }
      if (c == 'E') {
        break;
      }
    }
    return true;
  }

  /** Formats a non-negative number using a pattern such as "#,##0.00". */
  private static String formatDecimal(double value, String pattern) {
    final int dot = pattern.indexOf('.');
    final String intPattern = dot < 0 ? pattern : pattern.substring(0, dot);
    final String fracPattern =
        dot < 0 ? "" : pattern.substring(dot + 1).replace(".", "");
    final boolean grouping = intPattern.contains(",");
    final int minInt = count(intPattern, '0');
    final int maxFrac = fracPattern.length() - count(fracPattern, ',');
    final int minFrac = count(fracPattern, '0');
    final String plain = BigDecimal.valueOf(value)
        .setScale(maxFrac, RoundingMode.HALF_UP).toPlainString();
    final int plainDot = plain.indexOf('.');
    String intDigits = plainDot < 0 ? plain : plain.substring(0, plainDot);
    String fracDigits = plainDot < 0 ? "" : plain.substring(plainDot + 1);
    if (intDigits.equals("0") && minInt == 0) {
      intDigits = "";
    }
    final StringBuilder intBuf = new StringBuilder(intDigits);
    while (intBuf.length() < minInt) {
      intBuf.insert(0, '0');
    }
    intDigits = grouping ? group(intBuf.toString()) : intBuf.toString();
    while (fracDigits.length() > minFrac && fracDigits.endsWith("0")) {
      fracDigits = fracDigits.substring(0, fracDigits.length() - 1);
    }
    return dot < 0 ? intDigits : intDigits + "." + fracDigits;
  }

  /** Formats a number in scientific notation, such as "1.23E+04". */
  private static String formatScientific(double value, String mantissaPattern,
      String exponentPattern) {
    final boolean plus = exponentPattern.charAt(1) == '+';
    final int minExponentDigits = exponentPattern.length() - 2;
    final int dot = mantissaPattern.indexOf('.');
    final int decimals = dot < 0 ? 0 : mantissaPattern.length() - dot - 1;
    int exponent = value == 0 ? 0
        : (int) Math.floor(Math.log10(Math.abs(value)));
    BigDecimal mantissa = value == 0 ? BigDecimal.ZERO
        : BigDecimal.valueOf(value).movePointLeft(exponent)
            .setScale(decimals, RoundingMode.HALF_UP);
    if (mantissa.abs().compareTo(BigDecimal.TEN) >= 0) {
      ++exponent;
      mantissa = BigDecimal.valueOf(value).movePointLeft(exponent)
          .setScale(decimals, RoundingMode.HALF_UP);
    }
    final StringBuilder b = new StringBuilder();
    b.append(formatDecimal(mantissa.abs().doubleValue(),
        dot < 0 ? "0" : "0" + mantissaPattern.substring(dot)));
    b.append('E').append(exponent < 0 ? "-" : plus ? "+" : "");
    final String digits = Integer.toString(Math.abs(exponent));
    for (int i = digits.length(); i < minExponentDigits; i++) {
      b.append('0');
    }
    return b.append(digits).toString();
  }

  private static int count(String s, char c) {
    int n = 0;
    for (int i = 0; i < s.length(); i++) {
      if (s.charAt(i) == c) {
        ++n;
      }
    }
    return n;
  }

  /** Formats a date serial using a date and time format code. */
  private static String formatDate(double serial, String section) {
    final int days = (int) Math.floor(serial);
    final int[] ymd = DateSerial.ymd(days);
    final int seconds = DateSerial.secondOfDay(serial);
    final int hour = seconds / 3600;
    final int minute = seconds / 60 % 60;
    final int second = seconds % 60;
    final String lower = section.toLowerCase(Locale.ROOT);
    final boolean twelveHour =
        lower.contains("am/pm") || lower.contains("a/p");
    final StringBuilder b = new StringBuilder();
    boolean afterHour = false;
    for (int i = 0; i < section.length();) {
      final char c = Character.toLowerCase(section.charAt(i));
      final int run = run(lower, i, c);
      switch (c) {
      case 'y':
        b.append(run <= 2 ? pad(ymd[0] % 100, 2) : pad(ymd[0], 4));
        break;
      case 'm':
        if (run <= 2 && (afterHour || nextIsSecond(lower, i + run))) {
          b.append(run == 1 ? Integer.toString(minute) : pad(minute, 2));
        } else if (run == 1) {
          b.append(ymd[1]);
        } else if (run == 2) {
          b.append(pad(ymd[1], 2));
        } else {
          final String name = Month.of(ymd[1])
              .getDisplayName(TextStyle.FULL, Locale.US);
          b.append(run == 3 ? name.substring(0, 3)
              : run == 5 ? name.substring(0, 1) : name);
        }
        afterHour = false;
        break;
      case 'd':
        if (run == 1) {
          b.append(ymd[2]);
        } else if (run == 2) {
          b.append(pad(ymd[2], 2));
        } else {
          final String name = DAY_NAMES[DateSerial.weekday(days) - 1];
          b.append(run == 3 ? name.substring(0, 3) : name);
        }
        break;
      case 'h':
        final int h = twelveHour ? (hour + 11) % 12 + 1 : hour;
        b.append(run == 1 ? Integer.toString(h) : pad(h, 2));
        afterHour = true;
        break;
      case 's':
        b.append(run == 1 ? Integer.toString(second) : pad(second, 2));
        afterHour = false;
        break;
      case 'a':
        if (lower.startsWith("am/pm", i)) {
          b.append(hour < 12 ? "AM" : "PM");
          i += 5;
          continue;
        }
        if (lower.startsWith("a/p", i)) {
          b.append(hour < 12 ? "A" : "P");
          i += 3;
          continue;
        }
        b.append(section.charAt(i));
        break;
      case '"':
        final int end = section.indexOf('"', i + 1);
        b.append(section, i + 1, end < 0 ? section.length() : end);
        i = end < 0 ? section.length() : end + 1;
        continue;
      case '\\':
        if (i + 1 < section.length()) {
          b.append(section.charAt(i + 1));
        }
        i += 2;
        continue;
      default:
        b.append(section, i, i + run);
        break;
      }
      i += run;
    }
    return b.toString();
  }

  /** Returns whether the next date token after position {@code i} is a
   * seconds token, in which case a preceding "m" means minutes. */
  private static boolean nextIsSecond(String lower, int i) {
    for (; i < lower.length(); i++) {
      final char c = lower.charAt(i);
      if (c == 's') {
        return true;
      }
      if (Character.isLetter(c)) {
        return false;
      }
    }
    return false;
  }

  /** Returns the length of the run of character {@code c} starting at
   * {@code i}. */
  private static int run(String s, int i, char c) {
    int j = i;
    while (j < s.length() && s.charAt(j) == c) {
      ++j;
    }
    return Math.max(j - i, 1);
  }

  private static String pad(int n, int width) {
    final StringBuilder b = new StringBuilder(Integer.toString(n));
    while (b.length() < width) {
      b.insert(0, '0');
    }
    return b.toString();
  }
}

// End NumberFormats.java
