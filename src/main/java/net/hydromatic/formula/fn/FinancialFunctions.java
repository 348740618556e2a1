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

import java.math.RoundingMode;
import java.util.List;
import java.util.function.DoubleUnaryOperator;
import net.hydromatic.formula.compile.BuiltIn;
import net.hydromatic.formula.eval.ArgList;
import net.hydromatic.formula.eval.ArrayValue;
import net.hydromatic.formula.eval.Session;
import net.hydromatic.formula.eval.Value;
import net.hydromatic.formula.eval.Values;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Financial functions.
 *
 * <p>The time-value-of-money functions ({@code PV}, {@code FV},
 * {@code PMT}, {@code NPER}, {@code RATE}) all solve
 *
 * <blockquote><pre>
 * pv * (1 + rate)^nper
 *   + pmt * (1 + rate * type) * ((1 + rate)^nper - 1) / rate
 *   + fv = 0
 * </pre></blockquote>
 *
 * <p>for one of the variables. Cash paid out is negative. {@code type} is 0
 * if payments are due at the end of each period, 1 if at the beginning.
 */
abstract class FinancialFunctions {
  /** Default guess for {@code IRR}, {@code XIRR} and {@code RATE}. */
  private static final double DEFAULT_GUESS = 0.1D;

  private FinancialFunctions() {}

  static void populate(Codes.Builder b) {
    b.put(BuiltIn.CUMIPMT, (session, args) -> cumulative(args, true));
    b.put(BuiltIn.CUMPRINC, (session, args) -> cumulative(args, false));
    b.put(BuiltIn.DB, (session, args) -> db(args));
    b.put(BuiltIn.DDB, (session, args) -> ddb(args));
    b.put(BuiltIn.DISC, (session, args) -> security(args, true));
    b.put(BuiltIn.DOLLARDE, (session, args) -> dollar(args, true));
    b.put(BuiltIn.DOLLARFR, (session, args) -> dollar(args, false));
    b.put(BuiltIn.EFFECT, Codes.binary((nominal, n) -> {
      final int npery = (int) n;
      if (nominal <= 0 || npery < 1) {
        return error(NUMBER);
      }
      return Value.number(Math.pow(1 + nominal / npery, npery) - 1);
    }));
    b.put(BuiltIn.FV, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double rate = a.num(0);
      final double nper = a.num(1);
      final double pmt = a.num(2);
      final double pv = a.num(3, 0D);
      final int type = type(a, 4);
      return a.failed() ? a.error()
          : Value.number(fv(rate, nper, pmt, pv, type));
    });
    b.put(BuiltIn.FVSCHEDULE, (session, args) -> fvSchedule(args));
    b.put(BuiltIn.INTRATE, (session, args) -> security(args, false));
    b.put(BuiltIn.IPMT, (session, args) -> ipmtPpmt(args, true));
    b.put(BuiltIn.IRR, FinancialFunctions::irr);
    b.put(BuiltIn.MIRR, (session, args) -> mirr(args));
    b.put(BuiltIn.NOMINAL, Codes.binary((effect, n) -> {
      final int npery = (int) n;
      if (effect <= 0 || npery < 1) {
        return error(NUMBER);
      }
      return Value.number((Math.pow(1 + effect, 1D / npery) - 1) * npery);
    }));
    b.put(BuiltIn.NPER, (session, args) -> nper(args));
    b.put(BuiltIn.NPV, (session, args) -> npv(args));
    b.put(BuiltIn.PDURATION, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double rate = a.num(0);
      final double pv = a.num(1);
      final double fv = a.num(2);
      if (a.failed()) {
        return a.error();
      }
      if (rate <= 0 || pv <= 0 || fv <= 0) {
        return error(NUMBER);
      }
      return Value.number((Math.log(fv) - Math.log(pv)) / Math.log1p(rate));
    });
    b.put(BuiltIn.PMT, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double rate = a.num(0);
      final double nper = a.num(1);
      final double pv = a.num(2);
      final double fv = a.num(3, 0D);
      final int type = type(a, 4);
      if (a.failed()) {
        return a.error();
      }
      return nper == 0 ? error(NUMBER)
          : Value.number(pmt(rate, nper, pv, fv, type));
    });
    b.put(BuiltIn.PPMT, (session, args) -> ipmtPpmt(args, false));
    b.put(BuiltIn.PV, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double rate = a.num(0);
      final double nper = a.num(1);
      final double pmt = a.num(2);
      final double fv = a.num(3, 0D);
      final int type = type(a, 4);
      if (a.failed()) {
        return a.error();
      }
      if (rate == 0) {
        return Value.number(-(fv + pmt * nper));
      }
      final double q = Math.pow(1 + rate, nper);
      return Value.number(
          -(fv + pmt * (1 + rate * type) * (q - 1) / rate) / q);
    });
    b.put(BuiltIn.RATE, FinancialFunctions::rate);
    b.put(BuiltIn.RRI, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double nper = a.num(0);
      final double pv = a.num(1);
      final double fv = a.num(2);
      if (a.failed()) {
        return a.error();
      }
      if (nper <= 0 || pv == 0) {
        return error(NUMBER);
      }
      return Value.number(Math.pow(fv / pv, 1D / nper) - 1);
    });
    b.put(BuiltIn.SLN, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double cost = a.num(0);
      final double salvage = a.num(1);
      final double life = a.num(2);
      if (a.failed()) {
        return a.error();
      }
      return life == 0 ? error(DIV_BY_ZERO)
          : Value.number((cost - salvage) / life);
    });
    b.put(BuiltIn.SYD, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double cost = a.num(0);
      final double salvage = a.num(1);
      final double life = a.num(2);
      final double per = a.num(3);
      if (a.failed()) {
        return a.error();
      }
      if (life <= 0 || per <= 0 || per > life) {
        return error(NUMBER);
      }
      return Value.number(
          (cost - salvage) * (life - per + 1) * 2 / (life * (life + 1)));
    });
    b.put(BuiltIn.VDB, (session, args) -> vdb(args));
    b.put(BuiltIn.XIRR, FinancialFunctions::xirr);
    b.put(BuiltIn.XNPV, (session, args) -> xnpv(args));
  }

  /** Reads a {@code type} argument, which must be 0 or 1 (any non-zero
   * value counts as 1). */
  private static int type(ArgList a, int i) {
    return a.num(i, 0D) == 0 ? 0 : 1;
  }

  static double fv(double rate, double nper, double pmt, double pv,
      int type) {
    if (rate == 0) {
      return -(pv + pmt * nper);
    }
    final double q = Math.pow(1 + rate, nper);
    return -(pv * q + pmt * (1 + rate * type) * (q - 1) / rate);
  }

  static double pmt(double rate, double nper, double pv, double fv,
      int type) {
    if (rate == 0) {
      return -(pv + fv) / nper;
    }
    final double q = Math.pow(1 + rate, nper);
    return -(pv * q + fv) * rate / ((1 + rate * type) * (q - 1));
  }

  /** Returns the interest part of the payment in period {@code per}. */
  static double ipmt(double rate, int per, double nper, double pv,
      double fv, int type) {
    final double pmt = pmt(rate, nper, pv, fv, type);
    if (type == 1) {
      return per == 1 ? 0D : (fv(rate, per - 2, pmt, pv, 1) - pmt) * rate;
    }
    return fv(rate, per - 1, pmt, pv, 0) * rate;
  }

  private static Value ipmtPpmt(List<Value> args, boolean interest) {
    final ArgList a = ArgList.of(args);
    final double rate = a.num(0);
    final int per = a.integer(1);
    final double nper = a.num(2);
    final double pv = a.num(3);
    final double fv = a.num(4, 0D);
    final int type = type(a, 5);
    if (a.failed()) {
      return a.error();
    }
    if (per < 1 || per > nper) {
      return error(NUMBER);
    }
    final double ipmt = ipmt(rate, per, nper, pv, fv, type);
    return Value.number(interest ? ipmt : pmt(rate, nper, pv, fv, type) - ipmt);
  }

  /** Implements {@code CUMIPMT} and {@code CUMPRINC}. */
  private static Value cumulative(List<Value> args, boolean interest) {
    final ArgList a = ArgList.of(args);
    final double rate = a.num(0);
    final double nper = a.num(1);
    final double pv = a.num(2);
    final int start = a.integer(3);
    final int end = a.integer(4);
    final double typeNum = a.num(5);
    if (a.failed()) {
      return a.error();
    }
    if (rate <= 0 || nper <= 0 || pv <= 0 || start < 1 || end < start
        || end > nper || typeNum != 0 && typeNum != 1) {
      return error(NUMBER);
    }
    final int type = (int) typeNum;
    final double pmt = pmt(rate, nper, pv, 0, type);
    double sum = 0;
    for (int per = start; per <= end; per++) {
      final double ipmt = ipmt(rate, per, nper, pv, 0, type);
      sum += interest ? ipmt : pmt - ipmt;
    }
    return Value.number(sum);
  }

  private static Value nper(List<Value> args) {
    final ArgList a = ArgList.of(args);
    final double rate = a.num(0);
    final double pmt = a.num(1);
    final double pv = a.num(2);
    final double fv = a.num(3, 0D);
    final int type = type(a, 4);
    if (a.failed()) {
      return a.error();
    }
    if (rate == 0) {
      return pmt == 0 ? error(NUMBER) : Value.number(-(pv + fv) / pmt);
    }
    final double x = pmt * (1 + rate * type) / rate;
    final double ratio = (x - fv) / (x + pv);
    if (ratio <= 0) {
      return error(NUMBER);
    }
    return Value.number(Math.log(ratio) / Math.log1p(rate));
  }

  /** Implements {@code RATE(nper, pmt, pv, [fv], [type], [guess])} by
   * solving for the rate numerically. */
  private static Value rate(Session session, List<Value> args) {
    final ArgList a = ArgList.of(args);
    final double nper = a.num(0);
    final double pmt = a.num(1);
    final double pv = a.num(2);
    final double fv = a.num(3, 0D);
    final int type = type(a, 4);
    final double guess = a.num(5, DEFAULT_GUESS);
    if (a.failed()) {
      return a.error();
    }
    if (nper <= 0) {
      return error(NUMBER);
    }
    final DoubleUnaryOperator f = rate -> {
      if (rate == 0) {
        return pv + pmt * nper + fv;
      }
      final double q = Math.pow(1 + rate, nper);
      return pv * q + pmt * (1 + rate * type) * (q - 1) / rate + fv;
    };
    return solution(
        RootFinder.solve(f, guess, session.iterationLimit()));
  }

  /** Converts the result of a root-finder to a value; a rate must be
   * greater than -1. */
  private static Value solution(double rate) {
    return Double.isNaN(rate) || rate <= -1D ? error(NUMBER)
        : Value.number(rate);
  }

  /** Collects cash flows from a range; only numbers count. Returns null and
   * records an error if there is an error among them. */
  private static double @Nullable [] flows(ArgList a, int i) {
    final Aggregates flows = Aggregates.ofArray(a.array(i));
    if (flows.failed()) {
      final Value.Scalar e = flows.failure();
      a.fail(e instanceof Value.Err ? ((Value.Err) e).error : VALUE);
      return null;
    }
    return flows.values();
  }

  /** Returns whether a series of cash flows has both a positive and a
   * negative flow. */
  private static boolean hasSignChange(double[] flows) {
    boolean positive = false;
    boolean negative = false;
    for (double flow : flows) {
      positive |= flow > 0;
      negative |= flow < 0;
    }
    return positive && negative;
  }

  /** Returns the net present value of flows at periods 0, 1, 2, .... */
  private static double npv0(double rate, double[] flows) {
    double sum = 0;
    for (int i = 0; i < flows.length; i++) {
      sum += flows[i] / Math.pow(1 + rate, i);
    }
    return sum;
  }

  /** Implements {@code NPV(rate, value1, ...)}; the first value is
   * discounted by one period. */
  private static Value npv(List<Value> args) {
    final ArgList a = ArgList.of(args);
    final double rate = a.num(0);
    if (a.failed()) {
      return a.error();
    }
    final Aggregates values =
        Aggregates.of(args.subList(1, args.size()), Aggregates.Mode.NUMBERS);
    if (values.failed()) {
      return values.failure();
    }
    if (rate == -1) {
      return error(DIV_BY_ZERO);
    }
    return Value.number(npv0(rate, values.values()) / (1 + rate));
  }

  private static Value irr(Session session, List<Value> args) {
    final ArgList a = ArgList.of(args);
    final double[] flows = flows(a, 0);
    final double guess = a.num(1, DEFAULT_GUESS);
    if (a.failed() || flows == null) {
      return a.error();
    }
    if (flows.length < 2 || !hasSignChange(flows)) {
      return error(NUMBER);
    }
    return solution(
        RootFinder.solve(rate -> npv0(rate, flows), guess,
            session.iterationLimit()));
  }

  private static Value mirr(List<Value> args) {
    final ArgList a = ArgList.of(args);
    final double[] flows = flows(a, 0);
    final double financeRate = a.num(1);
    final double reinvestRate = a.num(2);
    if (a.failed() || flows == null) {
      return a.error();
    }
    final int n = flows.length;
    if (n < 2 || !hasSignChange(flows)) {
      return error(NUMBER);
    }
    double pvNegative = 0;
    double fvPositive = 0;
    for (int i = 0; i < n; i++) {
      if (flows[i] < 0) {
        pvNegative += flows[i] / Math.pow(1 + financeRate, i);
      } else {
        fvPositive += flows[i] * Math.pow(1 + reinvestRate, n - 1 - i);
      }
    }
    return Value.number(
        Math.pow(-fvPositive / pvNegative, 1D / (n - 1)) - 1);
  }

  /**
   * Reads the values and dates of a schedule of cash flows. Both must be
   * numbers and have the same size; no date may precede the first.
   * Returns null and records an error otherwise.
   */
  private static double @Nullable [][] schedule(ArgList a, int valuesArg,
      int datesArg) {
    final ArrayValue values = a.array(valuesArg);
    final ArrayValue dates = a.array(datesArg);
    if (a.failed()) {
      return null;
    }
    if (values.size() != dates.size()) {
      a.fail(NUMBER);
      return null;
    }
    final double[] v = new double[values.size()];
    final double[] d = new double[values.size()];
    for (int i = 0; i < v.length; i++) {
      final Value.Scalar value = values.get(i);
      final Value.Scalar date = Values.toNumber(dates.get(i));
      if (value instanceof Value.Err) {
        a.fail(((Value.Err) value).error);
        return null;
      }
      if (date instanceof Value.Err) {
        a.fail(((Value.Err) date).error);
        return null;
      }
      if (!(value instanceof Value.Num)) {
        a.fail(VALUE);
        return null;
      }
      v[i] = ((Value.Num) value).value;
      d[i] = Math.floor(((Value.Num) date).value);
      if (!DateSerial.isValid(d[i]) || d[i] < d[0]) {
        a.fail(NUMBER);
        return null;
      }
    }
    return new double[][] {v, d};
  }

  private static double xnpv0(double rate, double[] values, double[] dates) {
    double sum = 0;
    for (int i = 0; i < values.length; i++) {
      sum += values[i] / Math.pow(1 + rate, (dates[i] - dates[0]) / 365D);
    }
    return sum;
  }

  /** Implements {@code XNPV(rate, values, dates)}. A rate of -1 or less
   * has no meaning as a discount rate. */
  private static Value xnpv(List<Value> args) {
    final ArgList a = ArgList.of(args);
    final double rate = a.num(0);
    final double[][] schedule = schedule(a, 1, 2);
    if (a.failed() || schedule == null) {
      return a.error();
    }
    if (rate <= -1) {
      return error(NUMBER);
    }
    return Value.number(xnpv0(rate, schedule[0], schedule[1]));
  }

  private static Value xirr(Session session, List<Value> args) {
    final ArgList a = ArgList.of(args);
    final double[][] schedule = schedule(a, 0, 1);
    final double guess = a.num(2, DEFAULT_GUESS);
    if (a.failed() || schedule == null) {
      return a.error();
    }
    final double[] values = schedule[0];
    final double[] dates = schedule[1];
    if (values.length < 2 || !hasSignChange(values)) {
      return error(NUMBER);
    }
    return solution(
        RootFinder.solve(rate -> xnpv0(rate, values, dates), guess,
            session.iterationLimit()));
  }

  private static Value fvSchedule(List<Value> args) {
    final ArgList a = ArgList.of(args);
    double fv = a.num(0);
    final ArrayValue schedule = a.array(1);
    if (a.failed()) {
      return a.error();
    }
    for (Value.Scalar s : schedule.cells()) {
      if (s instanceof Value.Blank) {
        continue;
      }
      final Value.Scalar rate = Values.toNumber(s);
      if (rate instanceof Value.Err) {
        return rate;
      }
      fv *= 1 + ((Value.Num) rate).value;
    }
    return Value.number(fv);
  }

  /**
   * Fixed-declining balance depreciation ({@code DB}). The rate is rounded
   * to three decimal places. The first and last periods are pro-rated when
   * the asset was bought part-way through a year.
   */
  private static Value db(List<Value> args) {
    final ArgList a = ArgList.of(args);
    final double cost = a.num(0);
    final double salvage = a.num(1);
    final double life = a.num(2);
    final int period = a.integer(3);
    final int month = a.integer(4, 12);
    if (a.failed()) {
      return a.error();
    }
    if (cost < 0 || salvage < 0 || life <= 0 || period <= 0 || month < 1
        || month > 12 || period > life + (month == 12 ? 0 : 1)) {
      return error(NUMBER);
    }
    if (cost == 0) {
      return Value.ZERO;
    }
    final double rate =
        MathFunctions.round(1 - Math.pow(salvage / cost, 1 / life), 3,
            RoundingMode.HALF_UP);
    double total = cost * rate * month / 12;
    double depreciation = total;
    for (int p = 2; p <= period; p++) {
      depreciation = (cost - total) * rate;
      if (p > life) {
        depreciation = depreciation * (12 - month) / 12;
      }
      total += depreciation;
    }
    return Value.number(depreciation);
  }

  /** Declining balance depreciation at a given factor ({@code DDB}); never
   * depreciates below the salvage value. */
  private static Value ddb(List<Value> args) {
    final ArgList a = ArgList.of(args);
    final double cost = a.num(0);
    final double salvage = a.num(1);
    final double life = a.num(2);
    final double period = a.num(3);
    final double factor = a.num(4, 2D);
    if (a.failed()) {
      return a.error();
    }
    if (cost < 0 || salvage < 0 || life <= 0 || period <= 0 || period > life
        || factor <= 0) {
      return error(NUMBER);
    }
    double total = 0;
    double depreciation = 0;
    for (int p = 1; p <= Math.ceil(period); p++) {
      depreciation = Math.min((cost - total) * factor / life,
          Math.max(0, cost - salvage - total));
      total += depreciation;
    }
    return Value.number(depreciation);
  }

  /**
   * Implements {@code VDB}, declining balance depreciation between two
   * points in an asset's life. Unless {@code no_switch}, switches to
   * straight-line depreciation of the remaining value in the first period
   * where that is larger. Depreciation accrues evenly within a period.
   */
  private static Value vdb(List<Value> args) {
    final ArgList a = ArgList.of(args);
    final double cost = a.num(0);
    final double salvage = a.num(1);
    final double life = a.num(2);
    final double start = a.num(3);
    final double end = a.num(4);
    final double factor = a.num(5, 2D);
    final boolean noSwitch = a.bool(6, false);
    if (a.failed()) {
      return a.error();
    }
    if (cost < 0 || salvage < 0 || life <= 0 || start < 0 || end < start
        || end > life || factor <= 0) {
      return error(NUMBER);
    }
    return Value.number(
        accumulated(cost, salvage, life, end, factor, noSwitch)
            - accumulated(cost, salvage, life, start, factor, noSwitch));
  }

  /** Returns the depreciation accumulated from the start of an asset's life
   * to a given time. */
  private static double accumulated(double cost, double salvage, double life,
      double time, double factor, boolean noSwitch) {
    double total = 0D;
    boolean straightLine = false;
    for (int p = 0; p < time; p++) {
      final double value = cost - total;
      double depreciation =
          Math.min(value * factor / life, Math.max(0D, value - salvage));
      if (!noSwitch) {
        final double sln = (value - salvage) / (life - p);
        if (straightLine || sln > depreciation) {
          straightLine = true;
          depreciation = sln;
        }
      }
      total += depreciation * Math.min(1D, time - p);
    }
    return total;
  }

  /** Implements {@code DISC} and {@code INTRATE}, which differ only in the
   * amount the gain is divided by. */
  private static Value security(List<Value> args, boolean discount) {
    final ArgList a = ArgList.of(args);
    final double settlement = DateTimeFunctions.date(a, 0);
    final double maturity = DateTimeFunctions.date(a, 1);
    final double price = a.num(2);
    final double redemption = a.num(3);
    final int basis = a.integer(4, 0);
    if (a.failed()) {
      return a.error();
    }
    if (settlement >= maturity || price <= 0 || redemption <= 0) {
      return error(NUMBER);
    }
    final double years =
        DateTimeFunctions.yearFraction((int) settlement, (int) maturity,
            basis);
    if (Double.isNaN(years) || years == 0) {
      return error(NUMBER);
    }
    final double gain = redemption - price;
    return Value.number(gain / (discount ? redemption : price) / years);
  }

  /** Implements {@code DOLLARDE} and {@code DOLLARFR}. The fractional part
   * is read as a number of 1/fraction units, written with as many decimal
   * digits as the fraction has. */
  private static Value dollar(List<Value> args, boolean toDecimal) {
    final ArgList a = ArgList.of(args);
    final double dollar = a.num(0);
    final int fraction = a.integer(1);
    if (a.failed()) {
      return a.error();
    }
    if (fraction < 0) {
      return error(NUMBER);
    }
    if (fraction == 0) {
      return error(DIV_BY_ZERO);
    }
    final double scale = Math.pow(10, Math.ceil(Math.log10(fraction)));
    final double whole = dollar < 0 ? Math.ceil(dollar) : Math.floor(dollar);
    final double part = dollar - whole;
    return Value.number(toDecimal ? whole + part * scale / fraction
        : whole + part * fraction / scale);
  }
}

// End FinancialFunctions.java
