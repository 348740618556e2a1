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

import static net.hydromatic.formula.Fx.fx;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import net.hydromatic.formula.eval.ErrorKind;
import org.junit.jupiter.api.Test;

/** Tests for date and time functions. */
public class DateTimeFunctionsTest {
  /** Serial number of 2024-01-01, a Monday. */
  private static final int JAN_1_2024 = 45292;

  @Test void testDate() {
    fx("=DATE(2024, 1, 1)").assertNumber(JAN_1_2024);
    fx("=DATE(2024, 2, 29)").assertNumber(JAN_1_2024 + 59);
    fx("=DATE(2024, 13, 1)").assertNumber(JAN_1_2024 + 366);
    fx("=DATE(2024, 1, 0)").assertNumber(JAN_1_2024 - 1);
    fx("=DATE(1900, 1, 1)").assertNumber(1);
    fx("=DATE(1900, 3, 1)").assertNumber(61);
    fx("=DATE(124, 1, 1)").assertNumber(JAN_1_2024);
    fx("=DATE(-1, 1, 1)").assertError(ErrorKind.NUMBER);
    fx("=DATE(10000, 1, 1)").assertError(ErrorKind.NUMBER);
  }

  @Test void testDateParts() {
    fx("=YEAR(45292)").assertNumber(2024);
    fx("=MONTH(45292)").assertNumber(1);
    fx("=DAY(45292.75)").assertNumber(1);
    fx("=DAY(60)").assertNumber(29);
    fx("=DAY(0)").assertNumber(0);
    fx("=DAY(\"2024-03-15\")").assertNumber(15);
    fx("=MONTH(\"15-Mar-2024\")").assertNumber(3);
    fx("=YEAR(\"March 15, 2024\")").assertNumber(2024);
    fx("=YEAR(-1)").assertError(ErrorKind.NUMBER);
    fx("=YEAR(\"soon\")").assertError(ErrorKind.VALUE);
  }

  @Test void testDateValue() {
    fx("=DATEVALUE(\"2024-01-01\")").assertNumber(JAN_1_2024);
    fx("=DATEVALUE(\"1/15/2024\")").assertNumber(JAN_1_2024 + 14);
    fx("=DATEVALUE(\"15 January 2024\")").assertNumber(JAN_1_2024 + 14);
    fx("=DATEVALUE(\"2024-01-01 12:00\")").assertNumber(JAN_1_2024);
    fx("=DATEVALUE(\"2024-02-30\")").assertError(ErrorKind.VALUE);
    fx("=DATEVALUE(\"garbage\")").assertError(ErrorKind.VALUE);
  }

  @Test void testTime() {
    fx("=TIME(12, 0, 0)").assertNumber(0.5);
    fx("=TIME(6, 30, 0)").assertNumber(23400D / 86400D);
    fx("=TIME(25, 0, 0)").assertNumber(1D / 24D);
    fx("=TIME(-1, 0, 0)").assertError(ErrorKind.NUMBER);
    fx("=TIMEVALUE(\"6:00 PM\")").assertNumber(0.75);
    fx("=TIMEVALUE(\"2024-01-01 06:00\")").assertNumber(0.25);
    fx("=TIMEVALUE(\"25:99\")").assertError(ErrorKind.VALUE);
    fx("=HOUR(0.75)").assertNumber(18);
    fx("=HOUR(\"14:30\")").assertNumber(14);
    fx("=MINUTE(TIME(1, 2, 3))").assertNumber(2);
    fx("=SECOND(TIME(1, 2, 3))").assertNumber(3);
    fx("=HOUR(-1)").assertError(ErrorKind.NUMBER);
  }

  @Test void testTodayAndNow() {
    final Clock clock =
        Clock.fixed(Instant.parse("2024-01-01T18:00:00Z"), ZoneOffset.UTC);
    fx("=TODAY()").withClock(clock).assertNumber(JAN_1_2024);
    fx("=NOW()").withClock(clock).assertNumber(JAN_1_2024 + 0.75);
    fx("=TODAY() - DATE(2023, 12, 25)").withClock(clock).assertNumber(7);
  }

  @Test void testDifferences() {
    fx("=DAYS(DATE(2024, 3, 1), DATE(2024, 1, 1))").assertNumber(60);
    fx("=DAYS(\"2024-03-01\", \"2024-01-01\")").assertNumber(60);
    fx("=DAYS360(DATE(2024, 1, 31), DATE(2024, 3, 31))").assertNumber(60);
    fx("=DAYS360(DATE(2024, 2, 29), DATE(2024, 3, 31))").assertNumber(30);
    fx("=DAYS360(DATE(2024, 2, 29), DATE(2024, 3, 31), TRUE)")
        .assertNumber(31);
  }

  @Test void testDateDif() {
    final String start = "DATE(2020, 1, 15)";
    final String end = "DATE(2024, 3, 10)";
    fx("=DATEDIF(" + start + ", " + end + ", \"Y\")").assertNumber(4);
    fx("=DATEDIF(" + start + ", " + end + ", \"M\")").assertNumber(49);
    fx("=DATEDIF(" + start + ", " + end + ", \"D\")").assertNumber(1516);
    fx("=DATEDIF(" + start + ", " + end + ", \"YM\")").assertNumber(1);
    fx("=DATEDIF(" + start + ", " + end + ", \"MD\")").assertNumber(24);
    fx("=DATEDIF(" + start + ", " + end + ", \"yd\")").assertNumber(55);
    fx("=DATEDIF(" + end + ", " + start + ", \"D\")")
        .assertError(ErrorKind.NUMBER);
    fx("=DATEDIF(" + start + ", " + end + ", \"X\")")
        .assertError(ErrorKind.VALUE);
  }

  @Test void testMonths() {
    fx("=EDATE(DATE(2024, 1, 31), 1)").assertNumber(JAN_1_2024 + 59);
    fx("=EDATE(DATE(2024, 3, 31), -1)").assertNumber(JAN_1_2024 + 59);
    fx("=EOMONTH(DATE(2024, 1, 15), 1)").assertNumber(JAN_1_2024 + 59);
    fx("=EOMONTH(DATE(2024, 1, 15), -1)").assertNumber(JAN_1_2024 - 1);
    fx("=EDATE(DATE(9999, 12, 1), 1)").assertError(ErrorKind.NUMBER);
  }

  @Test void testWeekdays() {
    fx("=WEEKDAY(DATE(2024, 1, 1))").assertNumber(2);
    fx("=WEEKDAY(DATE(2024, 1, 1), 2)").assertNumber(1);
    fx("=WEEKDAY(DATE(2024, 1, 1), 3)").assertNumber(0);
    fx("=WEEKDAY(DATE(2024, 1, 7))").assertNumber(1);
    fx("=WEEKDAY(DATE(2024, 1, 7), 2)").assertNumber(7);
    fx("=WEEKDAY(DATE(2024, 1, 1), 0)").assertError(ErrorKind.NUMBER);
    fx("=WEEKNUM(DATE(2024, 1, 1))").assertNumber(1);
    fx("=WEEKNUM(DATE(2024, 1, 7))").assertNumber(2);
    fx("=WEEKNUM(DATE(2024, 1, 7), 2)").assertNumber(1);
    fx("=WEEKNUM(DATE(2024, 12, 30), 21)").assertNumber(1);
    fx("=ISOWEEKNUM(DATE(2024, 12, 30))").assertNumber(1);
    fx("=ISOWEEKNUM(DATE(2021, 1, 1))").assertNumber(53);
  }

  @Test void testWorkdays() {
    final String jan1 = "DATE(2024, 1, 1)";
    final String jan12 = "DATE(2024, 1, 12)";
    fx("=NETWORKDAYS(" + jan1 + ", " + jan12 + ")").assertNumber(10);
    fx("=NETWORKDAYS(" + jan1 + ", " + jan12 + ", " + jan1 + ")")
        .assertNumber(9);
    fx("=NETWORKDAYS(" + jan12 + ", " + jan1 + ")").assertNumber(-10);
    fx("=WORKDAY(DATE(2024, 1, 5), 1)").assertNumber(JAN_1_2024 + 7);
    fx("=WORKDAY(DATE(2024, 1, 8), -1)").assertNumber(JAN_1_2024 + 4);
    fx("=WORKDAY(DATE(2024, 1, 5), 1, {45299})")
        .assertNumber(JAN_1_2024 + 8);
    fx("=WORKDAY(DATE(2024, 1, 5), 1, {#N/A})")
        .assertError(ErrorKind.NOT_AVAILABLE);
  }

  @Test void testYearFrac() {
    final String args = "DATE(2024, 1, 1), DATE(2024, 7, 1)";
    fx("=YEARFRAC(" + args + ")").assertNumber(0.5);
    fx("=YEARFRAC(" + args + ", 1)").assertNumber(182D / 366D);
    fx("=YEARFRAC(" + args + ", 2)").assertNumber(182D / 360D);
    fx("=YEARFRAC(" + args + ", 3)").assertNumber(182D / 365D);
    fx("=YEARFRAC(" + args + ", 4)").assertNumber(0.5);
    fx("=YEARFRAC(DATE(2024, 7, 1), DATE(2024, 1, 1))").assertNumber(0.5);
    fx("=YEARFRAC(" + args + ", 5)").assertError(ErrorKind.NUMBER);
  }
}

// End DateTimeFunctionsTest.java
