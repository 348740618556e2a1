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

import static net.hydromatic.formula.eval.ErrorKind.NUMBER;
import static net.hydromatic.formula.eval.ErrorKind.VALUE;
import static net.hydromatic.formula.eval.Value.error;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.time.temporal.IsoFields;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.IntUnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.hydromatic.formula.compile.BuiltIn;
import net.hydromatic.formula.eval.Applicable;
import net.hydromatic.formula.eval.ArgList;
import net.hydromatic.formula.eval.Session;
import net.hydromatic.formula.eval.Value;
import net.hydromatic.formula.eval.Values;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Date and time functions.
 *
 * <p>Dates are serial numbers in the 1900 date system; see
 * {@link DateSerial}. A date argument may also be text in one of the formats
 * that {@link #parseOpt(String)} recognizes.
 */
abstract class DateTimeFunctions {
  private static final Pattern ISO_DATE =
      Pattern.compile("(\\d{4})[-/](\\d{1,2})[-/](\\d{1,2})");
  private static final Pattern US_DATE =
      Pattern.compile("(\\d{1,2})[-/](\\d{1,2})[-/](\\d{2}|\\d{4})");
  private static final Pattern DAY_MONTH_YEAR =
      Pattern.compile("(\\d{1,2})[- ]([a-z]{3,9})\\.?[- ,]+(\\d{2}|\\d{4})",
          Pattern.CASE_INSENSITIVE);
  private static final Pattern MONTH_DAY_YEAR =
      Pattern.compile("([a-z]{3,9})\\.? +(\\d{1,2}),? +(\\d{4})",
          Pattern.CASE_INSENSITIVE);
  private static final Pattern TIME =
      Pattern.compile("(\\d{1,2}):(\\d{1,2})(?::(\\d{1,2}(?:\\.\\d+)?))?"
          + "(?: *([ap])m?)?", Pattern.CASE_INSENSITIVE);

  private static final String[] MONTHS = {
      "january", "february", "march", "april", "may", "june", "july",
      "august", "september", "october", "november", "december"
  };

  private DateTimeFunctions() {}

  static void populate(Codes.Builder b) {
    b.put(BuiltIn.DATE, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final int year = a.integer(0);
      final int month = a.integer(1);
      final int day = a.integer(2);
      if (a.failed()) {
        return a.error();
      }
      final int serial = DateSerial.serial(year, month, day);
      return serial < 0 ? error(NUMBER) : Value.number(serial);
    });
    b.put(BuiltIn.DATEDIF, (session, args) -> dateDif(args));
    b.put(BuiltIn.DATEVALUE, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final String text = a.text(0);
      if (a.failed()) {
        return a.error();
      }
      final Double serial = parseOpt(text);
      return serial == null ? error(VALUE) : Value.number(Math.floor(serial));
    });
    b.put(BuiltIn.DAY, datePart(DateSerial::day));
    b.put(BuiltIn.DAYS, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double end = date(a, 0);
      final double start = date(a, 1);
      return a.failed() ? a.error()
          : Value.number(Math.floor(end) - Math.floor(start));
    });
    b.put(BuiltIn.DAYS360, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final int start = (int) date(a, 0);
      final int end = (int) date(a, 1);
      final boolean european = a.bool(2, false);
      return a.failed() ? a.error()
          : Value.number(days360(start, end, european));
    });
    b.put(BuiltIn.EDATE, (session, args) -> addMonths(args, false));
    b.put(BuiltIn.EOMONTH, (session, args) -> addMonths(args, true));
    b.put(BuiltIn.HOUR, timePart(s -> s / 3600));
    b.put(BuiltIn.ISOWEEKNUM, datePart(serial ->
        DateSerial.toDate(serial).get(IsoFields.WEEK_OF_WEEK_BASED_YEAR)));
    b.put(BuiltIn.MINUTE, timePart(s -> s / 60 % 60));
    b.put(BuiltIn.MONTH, datePart(DateSerial::month));
    b.put(BuiltIn.NETWORKDAYS, (session, args) -> networkDays(args));
    b.put(BuiltIn.NOW, (session, args) ->
        Value.number(DateSerial.serial(session.now())));
    b.put(BuiltIn.SECOND, timePart(s -> s % 60));
    b.put(BuiltIn.TIME, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final long hour = a.integer(0);
      final long minute = a.integer(1);
      final long second = a.integer(2);
      if (a.failed()) {
        return a.error();
      }
      final long seconds = hour * 3600 + minute * 60 + second;
      return seconds < 0 ? error(NUMBER)
          : Value.number((seconds % 86400) / 86400D);
    });
    b.put(BuiltIn.TIMEVALUE, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final String text = a.text(0);
      if (a.failed()) {
        return a.error();
      }
      final Double serial = parseOpt(text);
      return serial == null ? error(VALUE)
          : Value.number(serial - Math.floor(serial));
    });
    b.put(BuiltIn.TODAY, (session, args) ->
        Value.number(DateSerial.serial(session.now().toLocalDate())));
    b.put(BuiltIn.WEEKDAY, DateTimeFunctions::weekday);
    b.put(BuiltIn.WEEKNUM, DateTimeFunctions::weekNum);
    b.put(BuiltIn.WORKDAY, (session, args) -> workday(args));
    b.put(BuiltIn.YEAR, datePart(DateSerial::year));
    b.put(BuiltIn.YEARFRAC, (session, args) -> yearFrac(args));
  }

  /**
   * Parses text as a date, a time, or a date followed by a time, returning a
   * serial number, or null if the text is not in a recognized format.
   *
   * <p>Recognized date formats are "2024-01-15", "1/15/2024" (month first),
   * "15-Jan-2024", "15 January 2024" and "January 15, 2024". Times are
   * "14:30", "14:30:15" and "2:30 PM".
   */
  static @Nullable Double parseOpt(String text) {
    String s = text.trim();
    double time = 0D;
    final int colon = s.indexOf(':');
    if (colon >= 0) {
      int start = colon;
      while (start > 0 && Character.isDigit(s.charAt(start - 1))) {
        --start;
      }
      final Double t = parseTimeOpt(s.substring(start));
      if (t == null) {
        return null;
      }
      time = t;
      s = s.substring(0, start).trim();
      if (s.endsWith("T")) {
        s = s.substring(0, s.length() - 1);
      }
      if (s.isEmpty()) {
        return time;
      }
    }
    final int date = parseDate(s);
    return date < 0 ? null : date + time;
  }

  /** Parses a time of day, returning a fraction of a day, or null. */
  private static @Nullable Double parseTimeOpt(String s) {
    final Matcher m = TIME.matcher(s);
    if (!m.matches()) {
      return null;
    }
    int hour = Integer.parseInt(m.group(1));
    final int minute = Integer.parseInt(m.group(2));
    final double second =
        m.group(3) == null ? 0D : Double.parseDouble(m.group(3));
    if (minute > 59 || second >= 60D) {
      return null;
    }
    if (m.group(4) != null) {
      if (hour < 1 || hour > 12) {
        return null;
      }
      hour = hour % 12 + (m.group(4).equalsIgnoreCase("p") ? 12 : 0);
    }
    return (hour * 3600 + minute * 60 + second) / 86400D;
  }

  /** Parses a date, returning its serial, or -1. */
  private static int parseDate(String s) {
    Matcher m = ISO_DATE.matcher(s);
    if (m.matches()) {
      return serialOf(m.group(1), Integer.parseInt(m.group(2)), m.group(3));
    }
    m = US_DATE.matcher(s);
    if (m.matches()) {
      return serialOf(m.group(3), Integer.parseInt(m.group(1)), m.group(2));
    }
    m = DAY_MONTH_YEAR.matcher(s);
    if (m.matches()) {
      return serialOf(m.group(3), monthOf(m.group(2)), m.group(1));
    }
    m = MONTH_DAY_YEAR.matcher(s);
    if (m.matches()) {
      return serialOf(m.group(3), monthOf(m.group(1)), m.group(2));
    }
    return -1;
  }

  /** Returns the 1-based month whose name starts with the given text (at
   * least three letters), or 0. */
  private static int monthOf(String name) {
    final String lower = name.toLowerCase(Locale.ROOT);
    for (int i = 0; i < MONTHS.length; i++) {
      if (MONTHS[i].startsWith(lower)) {
        return i + 1;
      }
    }
    return 0;
  }

  /** Returns the serial of a date whose parts are exact, or -1. A two-digit
   * year below 30 is in the 2000s. */
  private static int serialOf(String yearText, int month, String dayText) {
    int year = Integer.parseInt(yearText);
    if (yearText.length() == 2) {
      year += year < 30 ? 2000 : 1900;
    }
    final int day = Integer.parseInt(dayText);
    if (year < 1900 || month < 1 || month > 12 || day < 1
        || day > DateSerial.daysInMonth(year, month)) {
      return -1;
    }
    return DateSerial.serial(year, month, day);
  }

  /** Reads a date argument: a number, or text that parses as a date.
   * Records {@code #NUM!} if the serial is out of range. */
  static double date(ArgList a, int i) {
    final Value.Scalar s = a.scalar(i);
    if (s instanceof Value.Text
        && Values.parseNumberOpt(((Value.Text) s).value) == null) {
      final Double d = parseOpt(((Value.Text) s).value);
      if (d != null) {
        return d;
      }
    }
    final double d = a.num(i);
    if (!DateSerial.isValid(d)) {
      a.fail(NUMBER);
    }
    return d;
  }

  /** Returns a function of the integer part of a date. */
  private static Applicable datePart(IntUnaryOperator f) {
    return (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double d = date(a, 0);
      return a.failed() ? a.error()
          : Value.number(f.applyAsInt((int) Math.floor(d)));
    };
  }

  /** Returns a function of the number of seconds since midnight. */
  private static Applicable timePart(IntUnaryOperator f) {
    return (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double d = date(a, 0);
      return a.failed() ? a.error()
          : Value.number(f.applyAsInt(DateSerial.secondOfDay(d)));
    };
  }

  /** Returns the day of the week, 0 (Monday) to 6 (Sunday). */
  private static int mondayBased(int serial) {
    return Math.floorMod(DateSerial.weekday(serial) - 2, 7);
  }

  /** Returns the day, 0 (Monday) to 6 (Sunday), on which a week starts for
   * a {@code WEEKDAY} or {@code WEEKNUM} return type, or -1. */
  private static int weekStart(int returnType) {
    switch (returnType) {
    case 1:
    case 17:
      return 6;
    case 2:
    case 11:
      return 0;
    case 12:
    case 13:
    case 14:
    case 15:
    case 16:
      return returnType - 11;
    default:
      return -1;
    }
  }

  private static Value weekday(Session session, List<Value> args) {
    final ArgList a = ArgList.of(args);
    final int serial = (int) Math.floor(date(a, 0));
    final int returnType = a.integer(1, 1);
    if (a.failed()) {
      return a.error();
    }
    final int day = mondayBased(serial);
    if (returnType == 3) {
      return Value.number(day);
    }
    final int start = weekStart(returnType);
    if (start < 0) {
      return error(NUMBER);
    }
    return Value.number(Math.floorMod(day - start, 7) + 1);
  }

  /** Implements {@code WEEKNUM}. Week 1 is the week containing January 1,
   * except for return type 21, which uses ISO week numbers. */
  private static Value weekNum(Session session, List<Value> args) {
    final ArgList a = ArgList.of(args);
    final int serial = (int) Math.floor(date(a, 0));
    final int returnType = a.integer(1, 1);
    if (a.failed()) {
      return a.error();
    }
    if (returnType == 21) {
      return Value.number(
          DateSerial.toDate(serial).get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
    }
    final int start = weekStart(returnType);
    if (start < 0) {
      return error(NUMBER);
    }
    final int jan1 = DateSerial.serial(DateSerial.year(serial), 1, 1);
    final int offset = Math.floorMod(mondayBased(jan1) - start, 7);
    return Value.number((serial - jan1 + offset) / 7 + 1);
  }

  /**
   * Returns the number of days between two dates in a 360-day year.
   *
   * <p>The US (NASD) method moves a start date on the last day of a month
   * to the 30th, and an end date on the 31st to the 30th if the start date
   * is the 30th or later. The European method moves any 31st to the 30th.
   */
  static int days360(int start, int end, boolean european) {
    final int[] s = DateSerial.ymd(start);
    final int[] e = DateSerial.ymd(end);
    int d1 = s[2];
    int d2 = e[2];
    if (european) {
      d1 = Math.min(d1, 30);
      d2 = Math.min(d2, 30);
    } else {
      if (d1 == DateSerial.daysInMonth(s[0], s[1])) {
        d1 = 30;
      }
      if (d2 == 31 && d1 >= 30) {
        d2 = 30;
      }
    }
    return (e[0] - s[0]) * 360 + (e[1] - s[1]) * 30 + d2 - d1;
  }

  /** Implements {@code DATEDIF(start_date, end_date, unit)}. */
  private static Value dateDif(List<Value> args) {
    final ArgList a = ArgList.of(args);
    final int start = (int) Math.floor(date(a, 0));
    final int end = (int) Math.floor(date(a, 1));
    final String unit = a.text(2).toUpperCase(Locale.ROOT);
    if (a.failed()) {
      return a.error();
    }
    if (start > end) {
      return error(NUMBER);
    }
    final int[] s = DateSerial.ymd(start);
    final int[] e = DateSerial.ymd(end);
    final int months = (e[0] - s[0]) * 12 + e[1] - s[1]
        - (e[2] < s[2] ? 1 : 0);
    switch (unit) {
    case "Y":
      return Value.number(months / 12);
    case "M":
      return Value.number(months);
    case "D":
      return Value.number(end - start);
    case "YM":
      return Value.number(months % 12);
    case "MD":
      if (e[2] >= s[2]) {
        return Value.number(e[2] - s[2]);
      }
      final int prevYear = e[1] == 1 ? e[0] - 1 : e[0];
      final int prevMonth = e[1] == 1 ? 12 : e[1] - 1;
      return Value.number(
          DateSerial.daysInMonth(prevYear, prevMonth) - s[2] + e[2]);
    case "YD":
      final LocalDate startDate = DateSerial.toDate(start);
      final LocalDate endDate = DateSerial.toDate(end);
      LocalDate shifted = startDate.withYear(endDate.getYear());
      if (shifted.isAfter(endDate)) {
        shifted = startDate.withYear(endDate.getYear() - 1);
      }
      return Value.number(ChronoUnit.DAYS.between(shifted, endDate));
    default:
      return error(VALUE);
    }
  }

  /** Implements {@code EDATE} and {@code EOMONTH}. */
  private static Value addMonths(List<Value> args, boolean endOfMonth) {
    final ArgList a = ArgList.of(args);
    final int start = (int) Math.floor(date(a, 0));
    final int months = a.integer(1);
    if (a.failed()) {
      return a.error();
    }
    final int[] ymd = DateSerial.ymd(start);
    final long total = ymd[0] * 12L + ymd[1] - 1 + months;
    final long year = Math.floorDiv(total, 12);
    final int month = (int) Math.floorMod(total, 12) + 1;
    if (year < 1900 || year > 9999) {
      return error(NUMBER);
    }
    final int last = DateSerial.daysInMonth((int) year, month);
    final int day = endOfMonth ? last : Math.max(1, Math.min(ymd[2], last));
    return Value.number(DateSerial.serial((int) year, month, day));
  }

  /** Reads the optional holidays argument; records errors. */
  private static Set<Integer> holidays(ArgList a, int i) {
    final Set<Integer> set = new HashSet<>();
    if (a.isMissing(i)) {
      return set;
    }
    for (Value.Scalar cell : a.array(i).cells()) {
      if (cell instanceof Value.Err) {
        a.fail(((Value.Err) cell).error);
      } else if (cell instanceof Value.Num) {
        set.add((int) Math.floor(((Value.Num) cell).value));
      }
    }
    return set;
  }

  private static boolean isWorkday(int serial, Set<Integer> holidays) {
    return !DateSerial.isWeekend(serial) && !holidays.contains(serial);
  }

  /** Implements {@code NETWORKDAYS}; negative if the end date precedes the
   * start date. */
  private static Value networkDays(List<Value> args) {
    final ArgList a = ArgList.of(args);
    final int start = (int) Math.floor(date(a, 0));
    final int end = (int) Math.floor(date(a, 1));
    final Set<Integer> holidays = holidays(a, 2);
    if (a.failed()) {
      return a.error();
    }
    int count = 0;
    for (int d = Math.min(start, end); d <= Math.max(start, end); d++) {
      if (isWorkday(d, holidays)) {
        ++count;
      }
    }
    return Value.number(start <= end ? count : -count);
  }

  private static Value workday(List<Value> args) {
    final ArgList a = ArgList.of(args);
    int serial = (int) Math.floor(date(a, 0));
    final int days = a.integer(1);
    final Set<Integer> holidays = holidays(a, 2);
    if (a.failed()) {
      return a.error();
    }
    final int step = days >= 0 ? 1 : -1;
    for (int remaining = Math.abs(days); remaining > 0;) {
      serial += step;
      if (!DateSerial.isValid(serial)) {
        return error(NUMBER);
      }
      if (isWorkday(serial, holidays)) {
        --remaining;
      }
    }
    return Value.number(serial);
  }

  /** Implements {@code YEARFRAC(start_date, end_date, [basis])}. */
  private static Value yearFrac(List<Value> args) {
    final ArgList a = ArgList.of(args);
    final int d1 = (int) Math.floor(date(a, 0));
    final int d2 = (int) Math.floor(date(a, 1));
    final int basis = a.integer(2, 0);
    if (a.failed()) {
      return a.error();
    }
    final double fraction = yearFraction(d1, d2, basis);
    return Double.isNaN(fraction) ? error(NUMBER) : Value.number(fraction);
  }

  /** Returns the fraction of a year between two dates, using a day-count
   * basis from 0 to 4, or NaN if the basis is invalid. */
  static double yearFraction(int d1, int d2, int basis) {
    final int start = Math.min(d1, d2);
    final int end = Math.max(d1, d2);
    switch (basis) {
    case 0:
      return days360Us(start, end) / 360D;
    case 1:
      return actualActual(start, end);
    case 2:
      return (end - start) / 360D;
    case 3:
      return (end - start) / 365D;
    case 4:
      return days360(start, end, true) / 360D;
    default:
      return Double.NaN;
    }
  }

  /** 30/360 day count used by {@code YEARFRAC} basis 0, which also moves an
   * end date on the last day of February to the 30th if the start date is
   * the last day of February. */
  private static int days360Us(int start, int end) {
    final int[] s = DateSerial.ymd(start);
    final int[] e = DateSerial.ymd(end);
    int d1 = s[2];
    int d2 = e[2];
    final boolean startFebEnd =
        s[1] == 2 && d1 == DateSerial.daysInMonth(s[0], 2);
    final boolean endFebEnd =
        e[1] == 2 && d2 == DateSerial.daysInMonth(e[0], 2);
    if (startFebEnd && endFebEnd) {
      d2 = 30;
    }
    if (startFebEnd || d1 == 31) {
      d1 = 30;
    }
    if (d2 == 31 && d1 >= 30) {
      d2 = 30;
    }
    return (e[0] - s[0]) * 360 + (e[1] - s[1]) * 30 + d2 - d1;
  }

  /** Actual/actual year fraction. Within one year the denominator is 366
   * if the period includes a February 29, otherwise 365; over several years
   * it is the average length of the years spanned. */
  private static double actualActual(int start, int end) {
    final LocalDate s = DateSerial.toDate(start);
    final LocalDate e = DateSerial.toDate(end);
    final long days = ChronoUnit.DAYS.between(s, e);
    if (s.getYear() == e.getYear()) {
      return days / (double) s.lengthOfYear();
    }
    if (!e.isAfter(s.plusYears(1))) {
      final boolean leapDay = includesLeapDay(s, e);
      return days / (leapDay ? 366D : 365D);
    }
    long total = 0;
    for (int y = s.getYear(); y <= e.getYear(); y++) {
      total += LocalDate.of(y, 1, 1).lengthOfYear();
    }
    final double average = total / (double) (e.getYear() - s.getYear() + 1);
    return days / average;
  }

  private static boolean includesLeapDay(LocalDate s, LocalDate e) {
    for (int y = s.getYear(); y <= e.getYear(); y++) {
      if (LocalDate.of(y, 1, 1).isLeapYear()) {
        final LocalDate leapDay = LocalDate.of(y, 2, 29);
        if (!leapDay.isBefore(s) && !leapDay.isAfter(e)) {
          return true;
        }
      }
    }
    return false;
  }
}

// End DateTimeFunctions.java
