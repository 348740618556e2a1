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

import static net.hydromatic.formula.eval.ErrorKind.NOT_AVAILABLE;
import static net.hydromatic.formula.eval.ErrorKind.VALUE;
import static net.hydromatic.formula.eval.Value.error;

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import net.hydromatic.formula.compile.BuiltIn;
import net.hydromatic.formula.eval.Applicable;
import net.hydromatic.formula.eval.ArgList;
import net.hydromatic.formula.eval.ArrayValue;
import net.hydromatic.formula.eval.Closure;
import net.hydromatic.formula.eval.Session;
import net.hydromatic.formula.eval.Value;
import net.hydromatic.formula.eval.Values;

/** Text functions. */
abstract class TextFunctions {
  /** Longest text a cell can hold. */
  static final int MAX_TEXT_LENGTH = 32_767;

  private TextFunctions() {}

  static void populate(Codes.Builder b) {
    b.put(BuiltIn.CHAR, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final int n = a.integer(0);
      if (a.failed()) {
        return a.error();
      }
      return n < 1 || n > 255 ? error(VALUE)
          : Value.text(String.valueOf((char) n));
    });
    b.put(BuiltIn.CLEAN,
        text(s -> CharMatcher.inRange('\0', '\u001f').removeFrom(s)));
    b.put(BuiltIn.CODE, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final String s = a.text(0);
      if (a.failed()) {
        return a.error();
      }
      return s.isEmpty() ? error(VALUE) : Value.number(s.charAt(0));
    });
    b.put(BuiltIn.CONCAT, (session, args) -> {
      final StringBuilder buf = new StringBuilder();
      for (Value arg : args) {
        for (Value.Scalar s : Values.toArray(arg).cells()) {
          final Value.Scalar t = Values.toText(s);
          if (t instanceof Value.Err) {
            return t;
          }
          buf.append(((Value.Text) t).value);
        }
      }
      return checkLength(buf.toString());
    });
    b.put(BuiltIn.CONCATENATE, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final StringBuilder buf = new StringBuilder();
      for (int i = 0; i < a.size(); i++) {
        buf.append(a.text(i));
      }
      return a.failed() ? a.error() : checkLength(buf.toString());
    });
    b.put(BuiltIn.DOLLAR, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double x = a.num(0);
      final int decimals = a.integer(1, 2);
      if (a.failed()) {
        return a.error();
      }
      if (decimals > 127) {
        return error(VALUE);
      }
      final String s = NumberFormats.fixed(Math.abs(x), decimals, true);
      final boolean negative =
          NumberFormats.fixed(x, decimals, false).startsWith("-");
      return Value.text(negative ? "($" + s + ")" : "$" + s);
    });
    b.put(BuiltIn.EXACT, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final String s0 = a.text(0);
      final String s1 = a.text(1);
      return a.failed() ? a.error() : Value.bool(s0.equals(s1));
    });
    b.put(BuiltIn.FIND, (session, args) -> find(args, false));
    b.put(BuiltIn.FIXED, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double x = a.num(0);
      final int decimals = a.integer(1, 2);
      final boolean noCommas = a.bool(2, false);
      if (a.failed()) {
        return a.error();
      }
      if (decimals > 127) {
        return error(VALUE);
      }
      return Value.text(NumberFormats.fixed(x, decimals, !noCommas));
    });
    b.put(BuiltIn.LEFT, TextFunctions::left);
    b.put(BuiltIn.LEFTB, TextFunctions::left);
    b.put(BuiltIn.LEN, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final String s = a.text(0);
      return a.failed() ? a.error() : Value.number(s.length());
    });
    b.put(BuiltIn.LENB, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final String s = a.text(0);
      return a.failed() ? a.error() : Value.number(s.length());
    });
    b.put(BuiltIn.LOWER, text(s -> s.toLowerCase(Locale.ROOT)));
    b.put(BuiltIn.MID, TextFunctions::mid);
    b.put(BuiltIn.MIDB, TextFunctions::mid);
    b.put(BuiltIn.NUMBERVALUE, TextFunctions::numberValue);
    b.put(BuiltIn.PROPER, text(TextFunctions::proper));
    b.put(BuiltIn.REPLACE, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final String s = a.text(0);
      final int start = a.integer(1);
      final int n = a.integer(2);
      final String replacement = a.text(3);
      if (a.failed()) {
        return a.error();
      }
      if (start < 1 || n < 0) {
        return error(VALUE);
      }
      final int from = Math.min(start - 1, s.length());
      final int to = (int) Math.min((long) from + n, s.length());
      return checkLength(s.substring(0, from) + replacement
          + s.substring(to));
    });
    b.put(BuiltIn.REPT, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final String s = a.text(0);
      final int n = a.integer(1);
      if (a.failed()) {
        return a.error();
      }
      if (n < 0 || (long) n * s.length() > MAX_TEXT_LENGTH) {
        return error(VALUE);
      }
      return Value.text(Strings.repeat(s, n));
    });
    b.put(BuiltIn.RIGHT, TextFunctions::right);
    b.put(BuiltIn.RIGHTB, TextFunctions::right);
    b.put(BuiltIn.SEARCH, (session, args) -> find(args, true));
    b.put(BuiltIn.SUBSTITUTE, TextFunctions::substitute);
    b.put(BuiltIn.T, (session, args) -> {
      final Value.Scalar s = Values.first(args.get(0));
      return s instanceof Value.Text || s instanceof Value.Err ? s
          : Value.EMPTY;
    });
    b.put(BuiltIn.TEXT_, TextFunctions::text);
    b.put(BuiltIn.TEXTAFTER, (session, args) -> textBeforeAfter(args, false));
    b.put(BuiltIn.TEXTBEFORE, (session, args) -> textBeforeAfter(args, true));
    b.put(BuiltIn.TEXTJOIN, TextFunctions::textJoin);
    b.put(BuiltIn.TEXTSPLIT, TextFunctions::textSplit);
    b.put(BuiltIn.TRIM,
        text(s -> CharMatcher.whitespace().trimAndCollapseFrom(s, ' ')));
    b.put(BuiltIn.UNICHAR, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final int n = a.integer(0);
      if (a.failed()) {
        return a.error();
      }
      if (n < 1 || n > Character.MAX_CODE_POINT) {
        return error(VALUE);
      }
      if (n >= Character.MIN_SURROGATE && n <= Character.MAX_SURROGATE) {
        return error(NOT_AVAILABLE);
      }
      return Value.text(new String(Character.toChars(n)));
    });
    b.put(BuiltIn.UNICODE, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final String s = a.text(0);
      if (a.failed()) {
        return a.error();
      }
      return s.isEmpty() ? error(VALUE) : Value.number(s.codePointAt(0));
    });
    b.put(BuiltIn.UPPER, text(s -> s.toUpperCase(Locale.ROOT)));
    b.put(BuiltIn.VALUE, (session, args) -> {
      final Value.Scalar s = Values.first(args.get(0));
      if (s instanceof Value.Text) {
        final String text = ((Value.Text) s).value;
        final Double d = Values.parseNumberOpt(text);
        if (d != null) {
          return Value.number(d);
        }
        final Double serial = DateTimeFunctions.parseOpt(text);
        return serial != null ? Value.number(serial) : error(VALUE);
      }
      return Values.toNumber(s);
    });
  }

  /** Returns an implementation of a function from text to text. */
  private static Applicable text(UnaryOperator<String> f) {
    return (session, args) -> {
      final ArgList a = ArgList.of(args);
      final String s = a.text(0);
      return a.failed() ? a.error() : Value.text(f.apply(s));
    };
  }

  /** Returns a text value, or {@code #VALUE!} if it is too long. */
  private static Value checkLength(String s) {
    return s.length() > MAX_TEXT_LENGTH ? error(VALUE) : Value.text(s);
  }

  private static Value left(Session session, List<Value> args) {
    final ArgList a = ArgList.of(args);
    final String s = a.text(0);
    final int n = a.integer(1, 1);
    if (a.failed()) {
      return a.error();
    }
    return n < 0 ? error(VALUE)
        : Value.text(s.substring(0, Math.min(n, s.length())));
  }

  private static Value right(Session session, List<Value> args) {
    final ArgList a = ArgList.of(args);
    final String s = a.text(0);
    final int n = a.integer(1, 1);
    if (a.failed()) {
      return a.error();
    }
    return n < 0 ? error(VALUE)
        : Value.text(s.substring(s.length() - Math.min(n, s.length())));
  }

  private static Value mid(Session session, List<Value> args) {
    final ArgList a = ArgList.of(args);
    final String s = a.text(0);
    final int start = a.integer(1);
    final int n = a.integer(2);
    if (a.failed()) {
      return a.error();
    }
    if (start < 1 || n < 0) {
      return error(VALUE);
    }
    if (start > s.length()) {
      return Value.EMPTY;
    }
    final int end = (int) Math.min((long) start - 1 + n, s.length());
    return Value.text(s.substring(start - 1, end));
  }

  /** Implements {@code FIND} (case-sensitive, no wildcards) and
   * {@code SEARCH} (case-insensitive, with wildcards). */
  private static Value find(List<Value> args, boolean search) {
    final ArgList a = ArgList.of(args);
    final String needle = a.text(0);
    final String haystack = a.text(1);
    final int start = a.integer(2, 1);
    if (a.failed()) {
      return a.error();
    }
    if (start < 1 || start > haystack.length() + 1) {
      return error(VALUE);
    }
    if (needle.isEmpty()) {
      return Value.number(start);
    }
    if (search) {
      final Matcher m = Wildcards.toPattern(needle).matcher(haystack);
      return m.find(start - 1) ? Value.number(m.start() + 1) : error(VALUE);
    }
    final int i = haystack.indexOf(needle, start - 1);
    return i < 0 ? error(VALUE) : Value.number(i + 1);
  }

  private static String proper(String s) {
    final StringBuilder b = new StringBuilder(s.length());
    boolean previousLetter = false;
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      b.append(previousLetter ? Character.toLowerCase(c)
          : Character.toUpperCase(c));
      previousLetter = Character.isLetter(c);
    }
    return b.toString();
  }

  private static Value numberValue(Session session, List<Value> args) {
    final ArgList a = ArgList.of(args);
    final String text = a.text(0);
    final String decimalSeparator = a.text(1, ".");
    final String groupSeparator = a.text(2, ",");
    if (a.failed()) {
      return a.error();
    }
    if (decimalSeparator.isEmpty() || groupSeparator.isEmpty()) {
      return error(VALUE);
    }
    final char decimal = decimalSeparator.charAt(0);
    final char group = groupSeparator.charAt(0);
    if (decimal == group) {
      return error(VALUE);
    }
    String s = CharMatcher.whitespace().removeFrom(text);
    if (s.isEmpty()) {
      return Value.ZERO;
    }
    int percents = 0;
    while (s.endsWith("%")) {
      ++percents;
      s = s.substring(0, s.length() - 1);
    }
    final int dot = s.indexOf(decimal);
    if (dot >= 0 && s.indexOf(group, dot) >= 0) {
      return error(VALUE);
    }
    s = s.replace(String.valueOf(group), "").replace(decimal, '.');
    final Double d = Values.parseNumberOpt(s);
    if (d == null) {
      return error(VALUE);
    }
    return Value.number(d / Math.pow(100D, percents));
  }

  private static Value substitute(Session session, List<Value> args) {
    final ArgList a = ArgList.of(args);
    final String s = a.text(0);
    final String old = a.text(1);
    final String replacement = a.text(2);
    final int instance = a.integer(3, 0);
    if (a.failed()) {
      return a.error();
    }
    if (!a.isMissing(3) && instance < 1) {
      return error(VALUE);
    }
    if (old.isEmpty()) {
      return Value.text(s);
    }
    if (a.isMissing(3)) {
      return checkLength(s.replace(old, replacement));
    }
    int i = -1;
    for (int k = 0; k < instance; k++) {
      i = s.indexOf(old, i + 1);
      if (i < 0) {
        return Value.text(s);
      }
    }
    return checkLength(s.substring(0, i) + replacement
        + s.substring(i + old.length()));
  }

  private static Value text(Session session, List<Value> args) {
    final ArgList a = ArgList.of(args);
    final Value.Scalar value = a.scalar(0);
    final String format = a.text(1);
    if (a.failed()) {
      return a.error();
    }
    switch (value.kind()) {
    case ERROR:
      return value;
    case BOOLEAN:
      return Value.text(value.toString());
    case TEXT:
      final String text = ((Value.Text) value).value;
      final Double d = Values.parseNumberOpt(text);
      if (d == null) {
        return Value.text(NumberFormats.formatText(text, format));
      }
      return Value.text(NumberFormats.format(d, format));
    default:
      final Value.Scalar n = Values.toNumber(value);
      return Value.text(NumberFormats.format(((Value.Num) n).value, format));
    }
  }

  /** Implements {@code TEXTBEFORE} and {@code TEXTAFTER}. */
  private static Value textBeforeAfter(List<Value> args, boolean before) {
    final ArgList a = ArgList.of(args);
    final String s = a.text(0);
    final String delimiter = a.text(1);
    final int instance = a.integer(2, 1);
    final boolean ignoreCase = a.integer(3, 0) == 1;
    final boolean matchEnd = a.integer(4, 0) == 1;
    if (a.failed()) {
      return a.error();
    }
    if (instance == 0 || Math.abs(instance) > s.length() + 1) {
      return error(VALUE);
    }
    final String haystack = ignoreCase ? s.toLowerCase(Locale.ROOT) : s;
    final String needle =
        ignoreCase ? delimiter.toLowerCase(Locale.ROOT) : delimiter;
    int position = -1;
    int length = needle.length();
    if (instance > 0) {
      int from = 0;
      for (int k = 0; k < instance; k++) {
        position = needle.isEmpty() ? (k == 0 ? 0 : -1)
            : haystack.indexOf(needle, from);
        if (position < 0) {
          break;
        }
        from = position + Math.max(length, 1);
      }
      if (position < 0 && matchEnd) {
        position = s.length();
        length = 0;
      }
    } else {
      int from = haystack.length();
      for (int k = 0; k < -instance; k++) {
        position = needle.isEmpty() ? (k == 0 ? s.length() : -1)
            : haystack.lastIndexOf(needle, from - length);
        if (position < 0) {
          break;
        }
        from = position;
      }
      if (position < 0 && matchEnd) {
        position = 0;
        length = 0;
      }
    }
    if (position < 0) {
      return a.isMissing(5) ? error(NOT_AVAILABLE) : a.scalar(5);
    }
    return Value.text(before ? s.substring(0, position)
        : s.substring(position + length));
  }

  private static Value textJoin(Session session, List<Value> args) {
    final ArgList a = ArgList.of(args);
    final List<String> delimiters = new ArrayList<>();
    for (Value.Scalar d : a.array(0).cells()) {
      final Value.Scalar t = Values.toText(d);
      if (t instanceof Value.Err) {
        return t;
      }
      delimiters.add(((Value.Text) t).value);
    }
    final boolean ignoreEmpty = a.bool(1);
    if (a.failed()) {
      return a.error();
    }
    final StringBuilder buf = new StringBuilder();
    int count = 0;
    for (Value arg : args.subList(2, args.size())) {
      if (arg instanceof Closure) {
        return error(VALUE);
      }
      for (Value.Scalar s : Values.toArray(arg).cells()) {
        final Value.Scalar t = Values.toText(s);
        if (t instanceof Value.Err) {
          return t;
        }
        final String text = ((Value.Text) t).value;
        if (ignoreEmpty && text.isEmpty()) {
          continue;
        }
        if (count > 0) {
          buf.append(delimiters.get((count - 1) % delimiters.size()));
        }
        buf.append(text);
        ++count;
      }
    }
    return checkLength(buf.toString());
  }

  private static Value textSplit(Session session, List<Value> args) {
    final ArgList a = ArgList.of(args);
    final String s = a.text(0);
    final List<String> colDelimiters =
        a.isMissing(1) ? new ArrayList<>() : delimiters(a, 1);
    final List<String> rowDelimiters =
        a.isMissing(2) ? new ArrayList<>() : delimiters(a, 2);
    final boolean ignoreEmpty = a.bool(3, false);
    final boolean ignoreCase = a.integer(4, 0) == 1;
    final Value.Scalar pad =
        a.isMissing(5) ? error(NOT_AVAILABLE) : a.scalar(5);
    if (a.failed()) {
      return a.error();
    }
    if (colDelimiters.isEmpty() && rowDelimiters.isEmpty()) {
      return error(VALUE);
    }
    final List<List<String>> rows = new ArrayList<>();
    int width = 0;
    for (String line : split(s, rowDelimiters, ignoreEmpty, ignoreCase)) {
      final List<String> row = split(line, colDelimiters, ignoreEmpty,
          ignoreCase);
      if (row.isEmpty()) {
        continue;
      }
      rows.add(row);
      width = Math.max(width, row.size());
    }
    if (rows.isEmpty()) {
      return error(VALUE);
    }
    final Value.Scalar[] cells = new Value.Scalar[rows.size() * width];
    for (int r = 0; r < rows.size(); r++) {
      final List<String> row = rows.get(r);
      for (int c = 0; c < width; c++) {
        cells[r * width + c] =
            c < row.size() ? Value.text(row.get(c)) : pad;
      }
    }
    return ArrayValue.of(rows.size(), width, cells);
  }

  /** Reads a list of delimiters from an argument that may be an array. */
  private static List<String> delimiters(ArgList a, int i) {
    final List<String> list = new ArrayList<>();
    for (Value.Scalar s : a.array(i).cells()) {
      final Value.Scalar t = Values.toText(s);
      if (t instanceof Value.Err) {
        a.fail(((Value.Err) t).error);
      } else if (!((Value.Text) t).value.isEmpty()) {
        list.add(((Value.Text) t).value);
      }
    }
    return list;
  }

  /** Splits text at any of several delimiters. */
  static List<String> split(String s, List<String> delimiters,
      boolean ignoreEmpty, boolean ignoreCase) {
    final List<String> tokens = new ArrayList<>();
    final String haystack = ignoreCase ? s.toLowerCase(Locale.ROOT) : s;
    int start = 0;
    int i = 0;
    while (i <= s.length()) {
      String match = null;
      for (String d : delimiters) {
        final String needle = ignoreCase ? d.toLowerCase(Locale.ROOT) : d;
        if (haystack.startsWith(needle, i)
            && (match == null || d.length() > match.length())) {
          match = d;
        }
      }
      if (match != null) {
        add(tokens, s.substring(start, i), ignoreEmpty);
        i += match.length();
        start = i;
      } else if (i == s.length()) {
        break;
      } else {
        ++i;
      }
    }
    add(tokens, s.substring(start), ignoreEmpty);
    return tokens;
  }

  private static void add(List<String> tokens, String token,
      boolean ignoreEmpty) {
    if (!ignoreEmpty || !token.isEmpty()) {
      tokens.add(token);
    }
  }
}

// End TextFunctions.java
