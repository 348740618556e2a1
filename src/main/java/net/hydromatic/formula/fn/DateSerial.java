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

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Serial dates.
 *
 * <p>A date is a count of days: serial 1 is 1900-01-01. As in the spreadsheet
 * whose behavior we follow, 1900 is treated as a leap year, so serial 60 is
 * the non-existent 1900-02-29, and serial 61 is 1900-03-01. The fractional
 * part of a serial is the time of day.
 */
abstract class DateSerial {
  /** Serial of 9999-12-31, the last valid date. */
  static final int MAX_SERIAL = 2_958_465;

  private static final long EPOCH = LocalDate.of(1899, 12, 30).toEpochDay();
  private static final LocalDate MARCH_1_1900 = LocalDate.of(1900, 3, 1);

  private DateSerial() {}

  /** Returns the serial of a date. */
  static int serial(LocalDate date) {
    final long days = date.toEpochDay() - EPOCH;
    return (int) (date.isBefore(MARCH_1_1900) ? days - 1 : days);
  }

  /** Returns the serial of a date and time, with the time as the fractional
   * part. */
  static double serial(LocalDateTime dateTime) {
    return serial(dateTime.toLocalDate())
        + dateTime.toLocalTime().toSecondOfDay() / 86400D
        + dateTime.toLocalTime().getNano() / 86400E9;
  }

  /**
   * Returns the serial for a year, month and day, rolling out-of-range months
   * and days into adjacent months and years. A year between 0 and 1899 is
   * taken as an offset from 1900. Returns -1 if the result is before serial
   * 0 or after 9999-12-31.
   */
  static int serial(int year, int month, int day) {
    if (year >= 0 && year < 1900) {
      year += 1900;
    }
    if (year < 0 || year > 9999) {
      return -1;
    }
    final int y = year + Math.floorDiv(month - 1, 12);
    final int m = Math.floorMod(month - 1, 12) + 1;
    if (y < 1900 || y > 9999) {
      return -1;
    }
    final long s = (long) serial(LocalDate.of(y, m, 1)) + day - 1;
    return s < 0 || s > MAX_SERIAL ? -1 : (int) s;
  }

  /** Returns whether a serial is a valid date. */
  static boolean isValid(double serial) {
    return serial >= 0 && serial < MAX_SERIAL + 1;
  }

  /**
   * Returns the year, month and day of a serial, as a 3-element array.
   * Serial 0 is "1900-01-00"; serial 60 is 1900-02-29.
   */
  static int[] ymd(int serial) {
    if (serial == 0) {
      return new int[] {1900, 1, 0};
    }
    if (serial == 60) {
      return new int[] {1900, 2, 29};
    }
    final LocalDate d = toDate(serial);
    return new int[] {d.getYear(), d.getMonthValue(), d.getDayOfMonth()};
  }

  /** Converts a serial to a date. Serial 60 becomes 1900-02-28. */
  static LocalDate toDate(int serial) {
    if (serial == 60) {
      return LocalDate.of(1900, 2, 28);
    }
    return serial < 60
        ? LocalDate.ofEpochDay(EPOCH + serial + 1)
        : LocalDate.ofEpochDay(EPOCH + serial);
  }

  static int year(int serial) {
    return ymd(serial)[0];
  }

  static int month(int serial) {
    return ymd(serial)[1];
  }

  static int day(int serial) {
    return ymd(serial)[2];
  }

  /** Returns the day of the week, 1 (Sunday) to 7 (Saturday). */
  static int weekday(int serial) {
    return Math.floorMod(serial - 1, 7) + 1;
  }

  /** Returns whether a serial is Saturday or Sunday. */
  static boolean isWeekend(int serial) {
    final int w = weekday(serial);
    return w == 1 || w == 7;
  }

  /** Returns the number of seconds since midnight, rounded to the nearest
   * second. */
  static int secondOfDay(double serial) {
    final double fraction = serial - Math.floor(serial);
    final long seconds = Math.round(fraction * 86400D);
    return (int) (seconds % 86400);
  }

  static boolean isLeapYear(int year) {
    return year % 4 == 0 && (year % 100 != 0 || year % 400 == 0)
        || year == 1900;
  }

  /** Returns the last day of a month. */
  static int daysInMonth(int year, int month) {
    switch (month) {
    case 2:
      return isLeapYear(year) ? 29 : 28;
    case 4:
    case 6:
    case 9:
    case 11:
      return 30;
    default:
      return 31;
    }
  }
}

// End DateSerial.java
