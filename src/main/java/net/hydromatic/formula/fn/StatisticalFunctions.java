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
import static net.hydromatic.formula.eval.ErrorKind.REFERENCE;
import static net.hydromatic.formula.eval.ErrorKind.VALUE;
import static net.hydromatic.formula.eval.Value.error;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;
import java.util.function.Function;
import net.hydromatic.formula.compile.BuiltIn;
import net.hydromatic.formula.eval.Applicable;
import net.hydromatic.formula.eval.ArgList;
import net.hydromatic.formula.eval.ArrayValue;
import net.hydromatic.formula.eval.Closure;
import net.hydromatic.formula.eval.Session;
import net.hydromatic.formula.eval.Value;
import net.hydromatic.formula.eval.Values;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Statistical functions. */
abstract class StatisticalFunctions {
  /** Functions that {@code AGGREGATE} and {@code SUBTOTAL} can apply, by
   * function number minus one. */
  private static final List<BuiltIn> AGGREGATE_FUNCTIONS =
      ImmutableList.of(BuiltIn.AVERAGE, BuiltIn.COUNT, BuiltIn.COUNTA,
          BuiltIn.MAX, BuiltIn.MIN, BuiltIn.PRODUCT, BuiltIn.STDEV_S,
          BuiltIn.STDEV_P, BuiltIn.SUM, BuiltIn.VAR_S, BuiltIn.VAR_P,
          BuiltIn.MEDIAN, BuiltIn.MODE_SNGL, BuiltIn.LARGE, BuiltIn.SMALL,
          BuiltIn.PERCENTILE_INC, BuiltIn.QUARTILE_INC,
          BuiltIn.PERCENTILE_EXC, BuiltIn.QUARTILE_EXC);

  private StatisticalFunctions() {}

  static void populate(Codes.Builder b) {
    b.put(BuiltIn.AVEDEV, agg(Aggregates.Mode.NUMBERS, a -> {
      if (a.count() == 0) {
        return error(NUMBER);
      }
      final double mean = a.mean();
      double sum = 0D;
      for (double v : a.values()) {
        sum += Math.abs(v - mean);
      }
      return Value.number(sum / a.count());
    }));
    b.put(BuiltIn.AVERAGE, agg(Aggregates.Mode.NUMBERS,
        StatisticalFunctions::average));
    b.put(BuiltIn.AVERAGEA, agg(Aggregates.Mode.ALL,
        StatisticalFunctions::average));
    b.put(BuiltIn.AVERAGEIF, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final ArrayValue range = a.array(0);
      final ArrayValue averageRange = a.isMissing(2) ? range : a.array(2);
      if (a.failed()) {
        return a.error();
      }
      return ifs(averageRange,
          ImmutableList.of(range, Values.first(args.get(1))),
          StatisticalFunctions::average);
    });
    b.put(BuiltIn.AVERAGEIFS, (session, args) ->
        ifs(args, StatisticalFunctions::average));
    b.put(BuiltIn.BETA_DIST, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double x = a.num(0);
      final double alpha = a.num(1);
      final double beta = a.num(2);
      final boolean cumulative = a.bool(3);
      final double lo = a.num(4, 0D);
      final double hi = a.num(5, 1D);
      if (a.failed()) {
        return a.error();
      }
      if (alpha <= 0 || beta <= 0 || x < lo || x > hi || lo == hi) {
        return error(NUMBER);
      }
      final double z = (x - lo) / (hi - lo);
      return Value.number(cumulative
          ? SpecialFunctions.betaI(z, alpha, beta)
          : SpecialFunctions.betaPdf(z, alpha, beta) / (hi - lo));
    });
    b.put(BuiltIn.BETA_INV, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double p = a.num(0);
      final double alpha = a.num(1);
      final double beta = a.num(2);
      final double lo = a.num(3, 0D);
      final double hi = a.num(4, 1D);
      if (a.failed()) {
        return a.error();
      }
      if (p <= 0 || p > 1 || alpha <= 0 || beta <= 0 || lo >= hi) {
        return error(NUMBER);
      }
      final double z =
          RootFinder.bisect(x -> SpecialFunctions.betaI(x, alpha, beta) - p,
              0D, 1D, session.iterationLimit());
      return Value.number(lo + z * (hi - lo));
    });
    b.put(BuiltIn.BINOM_DIST, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double s = a.num(0);
      final double trials = a.num(1);
      final double p = a.num(2);
      final boolean cumulative = a.bool(3);
      if (a.failed()) {
        return a.error();
      }
      if (!isCount(trials) || !isCount(s) || s > trials || p < 0 || p > 1) {
        return error(NUMBER);
      }
      return Value.number(cumulative
          ? SpecialFunctions.binomCdf(s, trials, p)
          : SpecialFunctions.binomPmf(s, trials, p));
    });
    b.put(BuiltIn.BINOM_INV, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double trials = a.num(0);
      final double p = a.num(1);
      final double alpha = a.num(2);
      if (a.failed()) {
        return a.error();
      }
      if (!isCount(trials) || p < 0 || p > 1 || alpha <= 0 || alpha >= 1) {
        return error(NUMBER);
      }
      double cdf = 0D;
      for (double k = SpecialFunctions.binomLowest(trials, p); k < trials;
          k++) {
        cdf += SpecialFunctions.binomPmf(k, trials, p);
        if (cdf >= alpha - 1E-12) {
          return Value.number(k);
        }
      }
      return Value.number(trials);
    });
    b.put(BuiltIn.CHISQ_DIST, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double x = a.num(0);
      final double df = Math.floor(a.num(1));
      final boolean cumulative = a.bool(2);
      if (a.failed()) {
        return a.error();
      }
      if (x < 0 || df < 1) {
        return error(NUMBER);
      }
      return Value.number(cumulative ? SpecialFunctions.chiSqCdf(x, df)
          : SpecialFunctions.chiSqPdf(x, df));
    });
    b.put(BuiltIn.CHISQ_DIST_RT, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double x = a.num(0);
      final double df = Math.floor(a.num(1));
      if (a.failed()) {
        return a.error();
      }
      if (x < 0 || df < 1) {
        return error(NUMBER);
      }
      return Value.number(1D - SpecialFunctions.chiSqCdf(x, df));
    });
    b.put(BuiltIn.CHISQ_INV, (session, args) -> chiSqInv(session, args, false));
    b.put(BuiltIn.CHISQ_INV_RT,
        (session, args) -> chiSqInv(session, args, true));
    b.put(BuiltIn.CHISQ_TEST, (session, args) -> chiSqTest(args));
    b.put(BuiltIn.CONFIDENCE_NORM, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double alpha = a.num(0);
      final double sd = a.num(1);
      final double size = Math.floor(a.num(2));
      if (a.failed()) {
        return a.error();
      }
      if (alpha <= 0 || alpha >= 1 || sd <= 0 || size < 1) {
        return error(NUMBER);
      }
      return Value.number(normSInv(session, 1D - alpha / 2D) * sd
          / Math.sqrt(size));
    });
    b.put(BuiltIn.CORREL, (session, args) ->
        pairs(args, 2, StatisticalFunctions::correl));
    b.put(BuiltIn.COUNT, (session, args) -> Value.number(count(args, false)));
    b.put(BuiltIn.COUNTA, (session, args) -> Value.number(count(args, true)));
    b.put(BuiltIn.COUNTBLANK, (session, args) -> {
      int n = 0;
      for (Value.Scalar s : Values.toArray(args.get(0)).cells()) {
        if (s instanceof Value.Blank
            || s instanceof Value.Text && ((Value.Text) s).value.isEmpty()) {
          ++n;
        }
      }
      return Value.number(n);
    });
    b.put(BuiltIn.COUNTIF, (session, args) -> countIfs(args));
    b.put(BuiltIn.COUNTIFS, (session, args) -> {
      if (args.size() % 2 != 0) {
        return error(VALUE);
      }
      return countIfs(args);
    });
    b.put(BuiltIn.COVARIANCE_P, (session, args) ->
        pairs(args, 1, p -> Value.number(p.sxy() / p.n)));
    b.put(BuiltIn.COVARIANCE_S, (session, args) ->
        pairs(args, 2, p -> Value.number(p.sxy() / (p.n - 1))));
    b.put(BuiltIn.DEVSQ, agg(Aggregates.Mode.NUMBERS, a ->
        a.count() == 0 ? error(NUMBER) : Value.number(a.devSq())));
    b.put(BuiltIn.EXPON_DIST, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double x = a.num(0);
      final double lambda = a.num(1);
      final boolean cumulative = a.bool(2);
      if (a.failed()) {
        return a.error();
      }
      if (x < 0 || lambda <= 0) {
        return error(NUMBER);
      }
      return Value.number(cumulative ? 1D - Math.exp(-lambda * x)
          : lambda * Math.exp(-lambda * x));
    });
    b.put(BuiltIn.F_DIST, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double x = a.num(0);
      final double d1 = Math.floor(a.num(1));
      final double d2 = Math.floor(a.num(2));
      final boolean cumulative = a.bool(3);
      if (a.failed()) {
        return a.error();
      }
      if (x < 0 || d1 < 1 || d2 < 1) {
        return error(NUMBER);
      }
      return Value.number(cumulative ? SpecialFunctions.fCdf(x, d1, d2)
          : SpecialFunctions.fPdf(x, d1, d2));
    });
    b.put(BuiltIn.F_DIST_RT, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double x = a.num(0);
      final double d1 = Math.floor(a.num(1));
      final double d2 = Math.floor(a.num(2));
      if (a.failed()) {
        return a.error();
      }
      if (x < 0 || d1 < 1 || d2 < 1) {
        return error(NUMBER);
      }
      return Value.number(1D - SpecialFunctions.fCdf(x, d1, d2));
    });
    b.put(BuiltIn.F_INV, (session, args) -> fInv(session, args, false));
    b.put(BuiltIn.F_INV_RT, (session, args) -> fInv(session, args, true));
    b.put(BuiltIn.F_TEST, (session, args) -> fTest(args));
    b.put(BuiltIn.FISHER, Codes.unary(x -> x > -1 && x < 1,
        x -> 0.5 * Math.log((1D + x) / (1D - x))));
    b.put(BuiltIn.FISHERINV, Codes.unary(Math::tanh));
    b.put(BuiltIn.FORECAST_LINEAR, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double x = a.num(0);
      if (a.failed()) {
        return a.error();
      }
      return pairs(args.subList(1, 3), 2, p -> {
        if (p.sxx() == 0) {
          return error(DIV_BY_ZERO);
        }
        final double slope = p.sxy() / p.sxx();
        return Value.number(p.meanY() + slope * (x - p.meanX()));
      });
    });
    b.put(BuiltIn.FREQUENCY, StatisticalFunctions::frequency);
    b.put(BuiltIn.GAMMA, Codes.unary(SpecialFunctions::gamma));
    b.put(BuiltIn.GAMMA_DIST, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double x = a.num(0);
      final double alpha = a.num(1);
      final double beta = a.num(2);
      final boolean cumulative = a.bool(3);
      if (a.failed()) {
        return a.error();
      }
      if (x < 0 || alpha <= 0 || beta <= 0) {
        return error(NUMBER);
      }
      return Value.number(cumulative
          ? SpecialFunctions.gammaCdf(x, alpha, beta)
          : SpecialFunctions.gammaPdf(x, alpha, beta));
    });
    b.put(BuiltIn.GAMMA_INV, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double p = a.num(0);
      final double alpha = a.num(1);
      final double beta = a.num(2);
      if (a.failed()) {
        return a.error();
      }
      if (p < 0 || p >= 1 || alpha <= 0 || beta <= 0) {
        return error(NUMBER);
      }
      return inverse(session,
          x -> SpecialFunctions.gammaCdf(x, alpha, beta), p);
    });
    b.put(BuiltIn.GAMMALN,
        Codes.unary(x -> x > 0, SpecialFunctions::lnGamma));
    b.put(BuiltIn.GAUSS,
        Codes.unary(z -> SpecialFunctions.normCdf(z) - 0.5));
    b.put(BuiltIn.GEOMEAN, agg(Aggregates.Mode.NUMBERS, a -> {
      double sum = 0D;
      for (double v : a.values()) {
        if (v <= 0) {
          return error(NUMBER);
        }
        sum += Math.log(v);
      }
      return a.count() == 0 ? error(NUMBER)
          : Value.number(Math.exp(sum / a.count()));
    }));
    b.put(BuiltIn.GROWTH, (session, args) -> growth(args));
    b.put(BuiltIn.HARMEAN, agg(Aggregates.Mode.NUMBERS, a -> {
      double sum = 0D;
      for (double v : a.values()) {
        if (v <= 0) {
          return error(NUMBER);
        }
        sum += 1D / v;
      }
      return a.count() == 0 ? error(NUMBER)
          : Value.number(a.count() / sum);
    }));
    b.put(BuiltIn.HYPGEOM_DIST, StatisticalFunctions::hypGeomDist);
    b.put(BuiltIn.INTERCEPT, (session, args) -> pairs(args, 2, p ->
        p.sxx() == 0 ? error(DIV_BY_ZERO)
            : Value.number(p.meanY() - p.sxy() / p.sxx() * p.meanX())));
    b.put(BuiltIn.LARGE, (session, args) -> nth(args, true));
    b.put(BuiltIn.LINEST, (session, args) -> linest(args, false));
    b.put(BuiltIn.LOGEST, (session, args) -> linest(args, true));
    b.put(BuiltIn.LOGNORM_DIST, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double x = a.num(0);
      final double mean = a.num(1);
      final double sd = a.num(2);
      final boolean cumulative = a.bool(3);
      if (a.failed()) {
        return a.error();
      }
      if (x <= 0 || sd <= 0) {
        return error(NUMBER);
      }
      final double z = (Math.log(x) - mean) / sd;
      return Value.number(cumulative ? SpecialFunctions.normCdf(z)
          : SpecialFunctions.normPdf(z) / (x * sd));
    });
    b.put(BuiltIn.LOGNORM_INV, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double p = a.num(0);
      final double mean = a.num(1);
      final double sd = a.num(2);
      if (a.failed()) {
        return a.error();
      }
      if (p <= 0 || p >= 1 || sd <= 0) {
        return error(NUMBER);
      }
      return Value.number(Math.exp(mean + sd * normSInv(session, p)));
    });
    b.put(BuiltIn.MAX, agg(Aggregates.Mode.NUMBERS, a -> maxMin(a, true)));
    b.put(BuiltIn.MAXA, agg(Aggregates.Mode.ALL, a -> maxMin(a, true)));
    b.put(BuiltIn.MAXIFS, (session, args) -> ifs(args, a ->
        a.count() == 0 ? error(VALUE) : maxMin(a, true)));
    b.put(BuiltIn.MEDIAN, agg(Aggregates.Mode.NUMBERS, a ->
        a.count() == 0 ? error(NUMBER)
            : Value.number(Aggregates.median(a.sorted()))));
    b.put(BuiltIn.MIN, agg(Aggregates.Mode.NUMBERS, a -> maxMin(a, false)));
    b.put(BuiltIn.MINA, agg(Aggregates.Mode.ALL, a -> maxMin(a, false)));
    b.put(BuiltIn.MINIFS, (session, args) -> ifs(args, a ->
        a.count() == 0 ? error(VALUE) : maxMin(a, false)));
    b.put(BuiltIn.MODE_MULT, agg(Aggregates.Mode.NUMBERS, a -> {
      final List<Value.Scalar> modes = new ArrayList<>();
      for (double d : modes(a)) {
        modes.add(Value.number(d));
      }
      return modes.isEmpty() ? error(NOT_AVAILABLE)
          : ArrayValue.column(modes);
    }));
    b.put(BuiltIn.MODE_SNGL, agg(Aggregates.Mode.NUMBERS, a -> {
      final List<Double> modes = modes(a);
      return modes.isEmpty() ? error(NOT_AVAILABLE)
          : Value.number(modes.get(0));
    }));
    b.put(BuiltIn.NEGBINOM_DIST, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double f = Math.floor(a.num(0));
      final double s = Math.floor(a.num(1));
      final double p = a.num(2);
      final boolean cumulative = a.bool(3);
      if (a.failed()) {
        return a.error();
      }
      if (f < 0 || s < 1 || p < 0 || p > 1
          || f > SpecialFunctions.MAX_TRIALS
          || s > SpecialFunctions.MAX_TRIALS) {
        return error(NUMBER);
      }
      if (cumulative) {
        // P(X <= f) = I_p(s, f + 1)
        return Value.number(SpecialFunctions.betaI(p, s, f + 1D));
      }
      if (p == 0D || p == 1D) {
        return Value.number(p == 1D && f == 0D ? 1D : 0D);
      }
      return Value.number(
          Math.exp(SpecialFunctions.lnCombin(f + s - 1D, s - 1D)
              + s * Math.log(p) + f * Math.log1p(-p)));
    });
    b.put(BuiltIn.NORM_DIST, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double x = a.num(0);
      final double mean = a.num(1);
      final double sd = a.num(2);
      final boolean cumulative = a.bool(3);
      if (a.failed()) {
        return a.error();
      }
      if (sd <= 0) {
        return error(NUMBER);
      }
      final double z = (x - mean) / sd;
      return Value.number(cumulative ? SpecialFunctions.normCdf(z)
          : SpecialFunctions.normPdf(z) / sd);
    });
    b.put(BuiltIn.NORM_INV, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double p = a.num(0);
      final double mean = a.num(1);
      final double sd = a.num(2);
      if (a.failed()) {
        return a.error();
      }
      if (p <= 0 || p >= 1 || sd <= 0) {
        return error(NUMBER);
      }
      return Value.number(mean + sd * normSInv(session, p));
    });
    b.put(BuiltIn.NORM_S_DIST, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double z = a.num(0);
      final boolean cumulative = a.bool(1);
      if (a.failed()) {
        return a.error();
      }
      return Value.number(cumulative ? SpecialFunctions.normCdf(z)
          : SpecialFunctions.normPdf(z));
    });
    b.put(BuiltIn.NORM_S_INV, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double p = a.num(0);
      if (a.failed()) {
        return a.error();
      }
      if (p <= 0 || p >= 1) {
        return error(NUMBER);
      }
      return Value.number(normSInv(session, p));
    });
    b.put(BuiltIn.PEARSON, (session, args) ->
        pairs(args, 2, StatisticalFunctions::correl));
    b.put(BuiltIn.PERCENTILE_EXC, (session, args) ->
        percentile(args, 1D, false));
    b.put(BuiltIn.PERCENTILE_INC, (session, args) ->
        percentile(args, 1D, true));
    b.put(BuiltIn.PERCENTRANK_EXC, (session, args) ->
        percentRank(args, false));
    b.put(BuiltIn.PERCENTRANK_INC, (session, args) ->
        percentRank(args, true));
    b.put(BuiltIn.PHI, Codes.unary(SpecialFunctions::normPdf));
    b.put(BuiltIn.POISSON_DIST, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double x = Math.floor(a.num(0));
      final double mean = a.num(1);
      final boolean cumulative = a.bool(2);
      if (a.failed()) {
        return a.error();
      }
      if (x < 0 || mean < 0) {
        return error(NUMBER);
      }
      return Value.number(cumulative
          ? SpecialFunctions.poissonCdf((int) x, mean)
          : SpecialFunctions.poissonPmf((int) x, mean));
    });
    b.put(BuiltIn.QUARTILE_EXC, (session, args) ->
        percentile(args, 4D, false));
    b.put(BuiltIn.QUARTILE_INC, (session, args) ->
        percentile(args, 4D, true));
    b.put(BuiltIn.RANK_AVG, (session, args) -> rank(args, true));
    b.put(BuiltIn.RANK_EQ, (session, args) -> rank(args, false));
    b.put(BuiltIn.RSQ, (session, args) -> pairs(args, 2, p -> {
      final Value r = correl(p);
      if (r instanceof Value.Num) {
        final double d = ((Value.Num) r).value;
        return Value.number(d * d);
      }
      return r;
    }));
    b.put(BuiltIn.SLOPE, (session, args) -> pairs(args, 2, p ->
        p.sxx() == 0 ? error(DIV_BY_ZERO)
            : Value.number(p.sxy() / p.sxx())));
    b.put(BuiltIn.SMALL, (session, args) -> nth(args, false));
    b.put(BuiltIn.STANDARDIZE, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double x = a.num(0);
      final double mean = a.num(1);
      final double sd = a.num(2);
      if (a.failed()) {
        return a.error();
      }
      return sd <= 0 ? error(NUMBER) : Value.number((x - mean) / sd);
    });
    b.put(BuiltIn.STDEV_P, variance(Aggregates.Mode.NUMBERS, false, true));
    b.put(BuiltIn.STDEV_S, variance(Aggregates.Mode.NUMBERS, true, true));
    b.put(BuiltIn.STDEVA, variance(Aggregates.Mode.ALL, true, true));
    b.put(BuiltIn.STDEVPA, variance(Aggregates.Mode.ALL, false, true));
    b.put(BuiltIn.STEYX, (session, args) -> pairs(args, 3, p -> {
      if (p.sxx() == 0) {
        return error(DIV_BY_ZERO);
      }
      final double sse = p.syy() - p.sxy() * p.sxy() / p.sxx();
      return Value.number(Math.sqrt(Math.max(sse, 0D) / (p.n - 2)));
    }));
    b.put(BuiltIn.T_DIST, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double x = a.num(0);
      final double df = Math.floor(a.num(1));
      final boolean cumulative = a.bool(2);
      if (a.failed()) {
        return a.error();
      }
      if (df < 1) {
        return error(NUMBER);
      }
      return Value.number(cumulative ? SpecialFunctions.tCdf(x, df)
          : SpecialFunctions.tPdf(x, df));
    });
    b.put(BuiltIn.T_DIST_2T, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double x = a.num(0);
      final double df = Math.floor(a.num(1));
      if (a.failed()) {
        return a.error();
      }
      if (x < 0 || df < 1) {
        return error(NUMBER);
      }
      return Value.number(2D * (1D - SpecialFunctions.tCdf(x, df)));
    });
    b.put(BuiltIn.T_DIST_RT, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double x = a.num(0);
      final double df = Math.floor(a.num(1));
      if (a.failed()) {
        return a.error();
      }
      if (df < 1) {
        return error(NUMBER);
      }
      return Value.number(1D - SpecialFunctions.tCdf(x, df));
    });
    b.put(BuiltIn.T_INV, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double p = a.num(0);
      final double df = Math.floor(a.num(1));
      if (a.failed()) {
        return a.error();
      }
      if (p <= 0 || p >= 1 || df < 1) {
        return error(NUMBER);
      }
      return Value.number(tInv(session, p, df));
    });
    b.put(BuiltIn.T_INV_2T, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double p = a.num(0);
      final double df = Math.floor(a.num(1));
      if (a.failed()) {
        return a.error();
      }
      if (p <= 0 || p > 1 || df < 1) {
        return error(NUMBER);
      }
      return Value.number(tInv(session, 1D - p / 2D, df));
    });
    b.put(BuiltIn.T_TEST, (session, args) -> tTest(args));
    b.put(BuiltIn.TREND, StatisticalFunctions::trend);
    b.put(BuiltIn.VAR_P, variance(Aggregates.Mode.NUMBERS, false, false));
    b.put(BuiltIn.VAR_S, variance(Aggregates.Mode.NUMBERS, true, false));
    b.put(BuiltIn.VARA, variance(Aggregates.Mode.ALL, true, false));
    b.put(BuiltIn.VARPA, variance(Aggregates.Mode.ALL, false, false));
    b.put(BuiltIn.WEIBULL_DIST, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double x = a.num(0);
      final double alpha = a.num(1);
      final double beta = a.num(2);
      final boolean cumulative = a.bool(3);
      if (a.failed()) {
        return a.error();
      }
      if (x < 0 || alpha <= 0 || beta <= 0) {
        return error(NUMBER);
      }
      final double e = Math.exp(-Math.pow(x / beta, alpha));
      return Value.number(cumulative ? 1D - e
          : alpha / Math.pow(beta, alpha) * Math.pow(x, alpha - 1D) * e);
    });
  }

  /**
   * Applies the function with a given number, as used by {@code SUBTOTAL}
   * (1 to 11) and {@code AGGREGATE} (1 to 19), to a list of arguments.
   */
  static Value aggregate(Session session, int function, List<Value> args) {
    final BuiltIn builtIn = AGGREGATE_FUNCTIONS.get(function - 1);
    final Applicable applicable =
        (Applicable) Codes.BUILT_IN_VALUES.get(builtIn);
    if (applicable == null || !builtIn.acceptsArgCount(args.size())) {
      return error(VALUE);
    }
    return applicable.apply(session, args);
  }

  /** Returns an implementation of an aggregate function. */
  private static Applicable agg(Aggregates.Mode mode,
      Function<Aggregates, Value> f) {
    return (session, args) -> {
      final Aggregates a = Aggregates.of(args, mode);
      return a.failed() ? a.failure() : f.apply(a);
    };
  }

  private static Applicable variance(Aggregates.Mode mode, boolean sample,
      boolean sqrt) {
    return agg(mode, a -> {
      final double v = a.variance(sample);
      if (Double.isNaN(v)) {
        return error(DIV_BY_ZERO);
      }
      return Value.number(sqrt ? Math.sqrt(v) : v);
    });
  }

  private static Value average(Aggregates a) {
    return a.count() == 0 ? error(DIV_BY_ZERO) : Value.number(a.mean());
  }

  private static Value maxMin(Aggregates a, boolean max) {
    if (a.count() == 0) {
      return Value.ZERO;
    }
    final double[] sorted = a.sorted();
    return Value.number(max ? sorted[sorted.length - 1] : sorted[0]);
  }

  /** Counts values; if {@code all}, counts every non-blank value (as
   * {@code COUNTA}), otherwise only numbers (as {@code COUNT}). */
  private static int count(List<Value> args, boolean all) {
    int n = 0;
    for (Value arg : args) {
      if (arg instanceof ArrayValue) {
        for (Value.Scalar s : ((ArrayValue) arg).cells()) {
          if (all ? !(s instanceof Value.Blank) : s instanceof Value.Num) {
            ++n;
          }
        }
      } else if (arg instanceof Closure) {
        if (all) {
          ++n;
        }
      } else if (all) {
        if (!(arg instanceof Value.Blank) || !((Value.Blank) arg).omitted) {
          ++n;
        }
      } else if (arg instanceof Value.Num || arg instanceof Value.Bool
          || arg instanceof Value.Text
              && Values.parseNumberOpt(((Value.Text) arg).value) != null) {
        ++n;
      }
    }
    return n;
  }

  private static Value countIfs(List<Value> args) {
    final ArrayValue shape = Values.toArray(args.get(0));
    final boolean[] mask = Criteria.mask(shape, args);
    if (mask == null) {
      return error(VALUE);
    }
    int n = 0;
    for (boolean b : mask) {
      if (b) {
        ++n;
      }
    }
    return Value.number(n);
  }

  /** Implements {@code AVERAGEIFS}, {@code MAXIFS} and {@code MINIFS}, whose
   * first argument is the range to aggregate. */
  private static Value ifs(List<Value> args, Function<Aggregates, Value> f) {
    if (args.size() % 2 == 0) {
      return error(VALUE);
    }
    return ifs(Values.toArray(args.get(0)), args.subList(1, args.size()), f);
  }

  private static Value ifs(ArrayValue range, List<Value> criteria,
      Function<Aggregates, Value> f) {
    final boolean[] mask = Criteria.mask(range, criteria);
    if (mask == null) {
      return error(VALUE);
    }
    final List<Value.Scalar> selected = new ArrayList<>();
    for (int i = 0; i < mask.length; i++) {
      if (mask[i]) {
        selected.add(range.get(i));
      }
    }
    final List<Value> values = new ArrayList<>();
    if (!selected.isEmpty()) {
      values.add(ArrayValue.column(selected));
    }
    final Aggregates a = Aggregates.of(values, Aggregates.Mode.NUMBERS);
    return a.failed() ? a.failure() : f.apply(a);
  }

  /** Returns the values that occur most often, in order of first
   * occurrence; empty if no value occurs more than once. */
  /** Returns whether a value is a whole number of trials or successes that
   * the binomial functions accept. */
  private static boolean isCount(double d) {
    return d >= 0 && d == Math.floor(d) && d <= SpecialFunctions.MAX_TRIALS;
  }

  private static List<Double> modes(Aggregates a) {
    final Map<Double, Integer> counts = new LinkedHashMap<>();
    for (double v : a.values()) {
      counts.merge(v, 1, Integer::sum);
    }
    int max = 1;
    for (int c : counts.values()) {
      max = Math.max(max, c);
    }
    final List<Double> modes = new ArrayList<>();
    if (max > 1) {
      for (Map.Entry<Double, Integer> e : counts.entrySet()) {
        if (e.getValue() == max) {
          modes.add(e.getKey());
        }
      }
    }
    return modes;
  }

  /** Implements {@code LARGE} and {@code SMALL}. */
  private static Value nth(List<Value> args, boolean largest) {
    final Aggregates values = Aggregates.ofArray(args.get(0));
    if (values.failed()) {
      return values.failure();
    }
    final ArgList a = ArgList.of(args);
    final double k = Math.ceil(a.num(1));
    if (a.failed()) {
      return a.error();
    }
    if (k < 1 || k > values.count()) {
      return error(NUMBER);
    }
    final double[] sorted = values.sorted();
    return Value.number(largest ? sorted[sorted.length - (int) k]
        : sorted[(int) k - 1]);
  }

  /** Implements the {@code PERCENTILE} and {@code QUARTILE} functions;
   * {@code scale} is 1 for percentiles and 4 for quartiles. */
  private static Value percentile(List<Value> args, double scale,
      boolean inclusive) {
    final Aggregates values = Aggregates.ofArray(args.get(0));
    if (values.failed()) {
      return values.failure();
    }
    final ArgList a = ArgList.of(args);
    double k = a.num(1);
    if (a.failed()) {
      return a.error();
    }
    if (scale != 1D) {
      k = Math.floor(k);
    }
    k /= scale;
    if (values.count() == 0 || k < 0 || k > 1) {
      return error(NUMBER);
    }
    final double[] sorted = values.sorted();
    if (inclusive) {
      return Value.number(Aggregates.percentileInc(sorted, k));
    }
    if (k == 0 || k == 1) {
      return error(NUMBER);
    }
    return Value.number(Aggregates.percentileExc(sorted, k));
  }

  private static Value percentRank(List<Value> args, boolean inclusive) {
    final Aggregates values = Aggregates.ofArray(args.get(0));
    if (values.failed()) {
      return values.failure();
    }
    final ArgList a = ArgList.of(args);
    final double x = a.num(1);
    final int significance = a.integer(2, 3);
    if (a.failed()) {
      return a.error();
    }
    final int n = values.count();
    if (n == 0 || significance < 1) {
      return error(NUMBER);
    }
    final double[] sorted = values.sorted();
    if (x < sorted[0] || x > sorted[n - 1]) {
      return error(NOT_AVAILABLE);
    }
    // Position of x among the sorted values, interpolating between
    // neighbors if x is not present.
    double position = 0D;
    for (int i = 0; i < n; i++) {
      if (sorted[i] == x) {
        position = i;
        break;
      }
      if (sorted[i] > x) {
        position = i - 1 + (x - sorted[i - 1]) / (sorted[i] - sorted[i - 1]);
        break;
      }
    }
    final double rank = inclusive
        ? (n == 1 ? 1D : position / (n - 1))
        : (position + 1D) / (n + 1D);
    final double factor = Math.pow(10D, significance);
    return Value.number(Math.floor(MathFunctions.fuzz(rank * factor))
        / factor);
  }

  private static Value rank(List<Value> args, boolean average) {
    final ArgList a = ArgList.of(args);
    final double x = a.num(0);
    final double order = a.num(2, 0D);
    if (a.failed()) {
      return a.error();
    }
    final Aggregates values = Aggregates.ofArray(args.get(1));
    if (values.failed()) {
      return values.failure();
    }
    int before = 0;
    int ties = 0;
    for (double v : values.values()) {
      if (v == x) {
        ++ties;
      } else if (order == 0 ? v > x : v < x) {
        ++before;
      }
    }
    if (ties == 0) {
      return error(NOT_AVAILABLE);
    }
    return Value.number(average ? before + (ties + 1D) / 2D : before + 1D);
  }

  private static Value frequency(Session session, List<Value> args) {
    final Aggregates data = Aggregates.ofArray(args.get(0));
    final Aggregates bins = Aggregates.ofArray(args.get(1));
    if (data.failed()) {
      return data.failure();
    }
    if (bins.failed()) {
      return bins.failure();
    }
    final double[] binValues = bins.values();
    final Integer[] order = new Integer[binValues.length];
    for (int i = 0; i < order.length; i++) {
      order[i] = i;
    }
    Arrays.sort(order, (i, j) -> Double.compare(binValues[i], binValues[j]));
    final int[] counts = new int[binValues.length + 1];
    for (double v : data.values()) {
      int slot = binValues.length;
      for (Integer i : order) {
        if (v <= binValues[i]) {
          slot = i;
          break;
        }
      }
      ++counts[slot];
    }
    final List<Value.Scalar> result = new ArrayList<>();
    for (int c : counts) {
      result.add(Value.number(c));
    }
    return ArrayValue.column(result);
  }

  private static Value hypGeomDist(Session session, List<Value> args) {
    final ArgList a = ArgList.of(args);
    final double s = Math.floor(a.num(0));
    final double n = Math.floor(a.num(1));
    final double k = Math.floor(a.num(2));
    final double pop = Math.floor(a.num(3));
    final boolean cumulative = a.bool(4);
    if (a.failed()) {
      return a.error();
    }
    if (s < 0 || s > n || s > k || n > pop || k > pop || n <= 0 || k <= 0
        || s < n - pop + k) {
      return error(NUMBER);
    }
    final double lnTotal = SpecialFunctions.lnCombin(pop, n);
    double sum = 0D;
    for (double i = cumulative ? Math.max(0D, n - pop + k) : s; i <= s; i++) {
      sum += Math.exp(SpecialFunctions.lnCombin(k, i)
          + SpecialFunctions.lnCombin(pop - k, n - i) - lnTotal);
    }
    return Value.number(Math.min(sum, 1D));
  }

  private static Value trend(Session session, List<Value> args) {
    final ArgList a = ArgList.of(args);
    final ArrayValue ys = a.array(0);
    final boolean constant = a.bool(3, true);
    if (a.failed()) {
      return a.error();
    }
    final ArrayValue xs = a.isMissing(1) ? sequence(ys) : a.array(1);
    final ArrayValue newXs = a.isMissing(2) ? xs : a.array(2);
    if (a.failed()) {
      return a.error();
    }
    final Value fit = pairs(ImmutableList.of(ys, xs), 1, p -> {
      final double slope;
      final double intercept;
      if (constant) {
        if (p.sxx() == 0) {
          return error(DIV_BY_ZERO);
        }
        slope = p.sxy() / p.sxx();
        intercept = p.meanY() - slope * p.meanX();
      } else {
        double sxy = 0D;
        double sxx = 0D;
        for (int i = 0; i < p.n; i++) {
          sxy += p.x[i] * p.y[i];
          sxx += p.x[i] * p.x[i];
        }
        if (sxx == 0) {
          return error(DIV_BY_ZERO);
        }
        slope = sxy / sxx;
        intercept = 0D;
      }
      return ArrayValue.row(
          ImmutableList.of(Value.number(slope), Value.number(intercept)));
    });
    if (!(fit instanceof ArrayValue)) {
      return fit;
    }
    final double slope = ((Value.Num) ((ArrayValue) fit).get(0)).value;
    final double intercept = ((Value.Num) ((ArrayValue) fit).get(1)).value;
    return newXs.map(s -> {
      final Value.Scalar x = Values.toNumber(s);
      return x instanceof Value.Num
          ? Value.number(intercept + slope * ((Value.Num) x).value)
          : x;
    });
  }

  /** Returns an array {1, 2, ..., n} the same shape as a given array. */
  private static ArrayValue sequence(ArrayValue shape) {
    final Value.Scalar[] cells = new Value.Scalar[shape.size()];
    for (int i = 0; i < cells.length; i++) {
      cells[i] = Value.number(i + 1);
    }
    return ArrayValue.of(shape.rows, shape.cols, cells);
  }

  /** Implements {@code LINEST}, and {@code LOGEST}, which fits the logarithms
   * of the known values and returns the exponents of the coefficients. */
  private static Value linest(List<Value> args, boolean log) {
    final ArgList a = ArgList.of(args);
    final ArrayValue ys = a.array(0);
    final boolean constant = a.bool(2, true);
    final boolean stats = a.bool(3, false);
    if (a.failed()) {
      return a.error();
    }
    final ArrayValue xs = a.isMissing(1) ? sequence(ys) : a.array(1);
    if (a.failed()) {
      return a.error();
    }
    return observations(ys, xs, log, o -> {
      final LinearModel model = LinearModel.fit(o.y, o.x, constant);
      if (model == null) {
        return error(NUMBER);
      }
      // Coefficients are in reverse order of the variables, then b.
      // Statistics beyond the first two columns are #N/A.
      final int k = model.slopes.length;
      final int w = k + 1;
      final Value.Scalar[] cells = new Value.Scalar[(stats ? 5 : 1) * w];
      Arrays.fill(cells, error(NOT_AVAILABLE));
      for (int j = 0; j < k; j++) {
        cells[k - 1 - j] = coefficient(model.slopes[j], log);
      }
      cells[k] = coefficient(model.intercept, log);
      if (stats) {
        for (int j = 0; j < k; j++) {
          cells[w + k - 1 - j] = Value.number(model.seSlope(j));
        }
        if (constant) {
          cells[w + k] = Value.number(model.seIntercept());
        }
        cells[2 * w] = Value.number(model.r2());
        cells[2 * w + 1] = Value.number(model.seY());
        cells[3 * w] = Value.number(model.f());
        cells[3 * w + 1] = Value.number(model.df());
        cells[4 * w] = Value.number(model.ssReg);
        cells[4 * w + 1] = Value.number(model.ssResid);
      }
      return ArrayValue.of(stats ? 5 : 1, w, cells);
    });
  }

  private static Value.Scalar coefficient(double c, boolean log) {
    return Value.number(log ? Math.exp(c) : c);
  }

  private static Value growth(List<Value> args) {
    final ArgList a = ArgList.of(args);
    final ArrayValue ys = a.array(0);
    final boolean constant = a.bool(3, true);
    if (a.failed()) {
      return a.error();
    }
    final ArrayValue xs = a.isMissing(1) ? sequence(ys) : a.array(1);
    final ArrayValue newXs = a.isMissing(2) ? xs : a.array(2);
    if (a.failed()) {
      return a.error();
    }
    return observations(ys, xs, true, o -> {
      final LinearModel model = LinearModel.fit(o.y, o.x, constant);
      if (model == null) {
        return error(NUMBER);
      }
      if (o.single) {
        return newXs.map(s -> {
          final Value.Scalar x = Values.toNumber(s);
          return x instanceof Value.Num
              ? Value.number(
                  Math.exp(model.predict(new double[] {((Value.Num) x).value})))
              : x;
        });
      }
      // Each new point is a row of new_xs if the variables are columns of
      // known_xs, and a column otherwise.
      final int k = model.slopes.length;
      if ((o.byColumn ? newXs.cols : newXs.rows) != k) {
        return error(REFERENCE);
      }
      final int count = o.byColumn ? newXs.rows : newXs.cols;
      final Value.Scalar[] cells = new Value.Scalar[count];
      final double[] point = new double[k];
      for (int i = 0; i < count; i++) {
        for (int j = 0; j < k; j++) {
          final Value.Scalar s = Values.toNumber(
              o.byColumn ? newXs.get(i, j) : newXs.get(j, i));
          if (!(s instanceof Value.Num)) {
            return s;
          }
          point[j] = ((Value.Num) s).value;
        }
        cells[i] = Value.number(Math.exp(model.predict(point)));
      }
      return o.byColumn ? ArrayValue.of(count, 1, cells)
          : ArrayValue.of(1, count, cells);
    });
  }

  /**
   * Reads the known values of a regression and applies a function to them.
   *
   * <p>If {@code known_xs} is the same size as {@code known_ys} there is one
   * variable. Otherwise, if {@code known_ys} is a column, each column of
   * {@code known_xs} is a variable, and if it is a row, each row is; other
   * shapes give {@code #REF!}. If {@code log}, the known y values must be
   * positive, and their logarithms are used.
   */
  private static Value observations(ArrayValue ys, ArrayValue xs, boolean log,
      Function<Observations, Value> f) {
    Value.Err err = ys.firstError();
    if (err == null) {
      err = xs.firstError();
    }
    if (err != null) {
      return err;
    }
    final int n = ys.size();
    final double[] y = new double[n];
    for (int i = 0; i < n; i++) {
      y[i] = number(ys.get(i));
      if (Double.isNaN(y[i])) {
        return error(VALUE);
      }
      if (log) {
        if (y[i] <= 0) {
          return error(NUMBER);
        }
        y[i] = Math.log(y[i]);
      }
    }
    final boolean single = xs.size() == n;
    final boolean byColumn;
    final double[][] x;
    if (single) {
      byColumn = ys.cols == 1;
      x = new double[n][1];
      for (int i = 0; i < n; i++) {
        x[i][0] = number(xs.get(i));
      }
    } else if (ys.cols == 1 && xs.rows == n) {
      byColumn = true;
      x = new double[n][xs.cols];
      for (int i = 0; i < n; i++) {
        for (int j = 0; j < xs.cols; j++) {
          x[i][j] = number(xs.get(i, j));
        }
      }
    } else if (ys.rows == 1 && xs.cols == n) {
      byColumn = false;
      x = new double[n][xs.rows];
      for (int i = 0; i < n; i++) {
        for (int j = 0; j < xs.rows; j++) {
          x[i][j] = number(xs.get(j, i));
        }
      }
    } else {
      return error(REFERENCE);
    }
    for (double[] row : x) {
      for (double d : row) {
        if (Double.isNaN(d)) {
          return error(VALUE);
        }
      }
    }
    return f.apply(new Observations(y, x, single, byColumn));
  }

  /** Returns the value of a number, or NaN if the value is not a number. */
  private static double number(Value.Scalar s) {
    return s instanceof Value.Num ? ((Value.Num) s).value : Double.NaN;
  }

  /** Returns the numbers in an array, skipping other values; returns null if
   * the array contains an error. */
  private static double @Nullable [] numbers(ArrayValue array) {
    if (array.firstError() != null) {
      return null;
    }
    final List<Double> list = new ArrayList<>();
    for (Value.Scalar s : array.cells()) {
      if (s instanceof Value.Num) {
        list.add(((Value.Num) s).value);
      }
    }
    final double[] numbers = new double[list.size()];
    for (int i = 0; i < numbers.length; i++) {
      numbers[i] = list.get(i);
    }
    return numbers;
  }

  private static double mean(double[] values) {
    double sum = 0D;
    for (double v : values) {
      sum += v;
    }
    return sum / values.length;
  }

  /** Sample variance. */
  private static double sampleVariance(double[] values) {
    final double mean = mean(values);
    double sum = 0D;
    for (double v : values) {
      sum += (v - mean) * (v - mean);
    }
    return sum / (values.length - 1);
  }

  /** Implements {@code T.TEST}. Type 1 is a paired test, type 2 assumes
   * equal variances, and type 3 uses Welch's approximation for the degrees
   * of freedom. */
  private static Value tTest(List<Value> args) {
    final ArgList a = ArgList.of(args);
    final ArrayValue array1 = a.array(0);
    final ArrayValue array2 = a.array(1);
    final double tails = Math.floor(a.num(2));
    final double type = Math.floor(a.num(3));
    if (a.failed()) {
      return a.error();
    }
    if ((tails != 1 && tails != 2) || type < 1 || type > 3) {
      return error(NUMBER);
    }
    if (type == 1) {
      return pairs(ImmutableList.of(array1, array2), 2, p -> {
        final double[] d = new double[p.n];
        for (int i = 0; i < p.n; i++) {
          d[i] = p.y[i] - p.x[i];
        }
        final double se = Math.sqrt(sampleVariance(d) / p.n);
        return tProbability(mean(d) / se, p.n - 1D, tails);
      });
    }
    final double[] x1 = numbers(array1);
    final double[] x2 = numbers(array2);
    if (x1 == null || x2 == null) {
      final Value.Err err = array1.firstError();
      return err != null ? err : array2.firstError();
    }
    final int n1 = x1.length;
    final int n2 = x2.length;
    if (n1 < 2 || n2 < 2) {
      return error(DIV_BY_ZERO);
    }
    final double v1 = sampleVariance(x1);
    final double v2 = sampleVariance(x2);
    final double se;
    final double df;
    if (type == 2) {
      final double pooled = ((n1 - 1) * v1 + (n2 - 1) * v2) / (n1 + n2 - 2);
      se = Math.sqrt(pooled * (1D / n1 + 1D / n2));
      df = n1 + n2 - 2;
    } else {
      final double q1 = v1 / n1;
      final double q2 = v2 / n2;
      se = Math.sqrt(q1 + q2);
      df = (q1 + q2) * (q1 + q2)
          / (q1 * q1 / (n1 - 1) + q2 * q2 / (n2 - 1));
    }
    return tProbability((mean(x1) - mean(x2)) / se, df, tails);
  }

  private static Value tProbability(double t, double df, double tails) {
    if (Double.isNaN(t) || Double.isInfinite(t)) {
      return error(DIV_BY_ZERO);
    }
    return Value.number(
        tails * (1D - SpecialFunctions.tCdf(Math.abs(t), df)));
  }

  /** Implements {@code F.TEST}, the two-tailed probability that the
   * variances of two samples are not significantly different. */
  private static Value fTest(List<Value> args) {
    final ArgList a = ArgList.of(args);
    final ArrayValue array1 = a.array(0);
    final ArrayValue array2 = a.array(1);
    if (a.failed()) {
      return a.error();
    }
    final double[] x1 = numbers(array1);
    final double[] x2 = numbers(array2);
    if (x1 == null || x2 == null) {
      final Value.Err err = array1.firstError();
      return err != null ? err : array2.firstError();
    }
    if (x1.length < 2 || x2.length < 2) {
      return error(DIV_BY_ZERO);
    }
    final double v1 = sampleVariance(x1);
    final double v2 = sampleVariance(x2);
    if (v1 == 0 || v2 == 0) {
      return error(DIV_BY_ZERO);
    }
    final double cdf =
        SpecialFunctions.fCdf(v1 / v2, x1.length - 1D, x2.length - 1D);
    return Value.number(Math.min(1D, 2D * Math.min(cdf, 1D - cdf)));
  }

  /** Implements {@code CHISQ.TEST}. A range with more than one row and
   * column has {@code (rows - 1) * (cols - 1)} degrees of freedom, a vector
   * one fewer than its size. */
  private static Value chiSqTest(List<Value> args) {
    final ArgList a = ArgList.of(args);
    final ArrayValue actual = a.array(0);
    final ArrayValue expected = a.array(1);
    if (a.failed()) {
      return a.error();
    }
    if (!actual.sameShape(expected)) {
      return error(NOT_AVAILABLE);
    }
    return pairs(ImmutableList.of(actual, expected), 1, p -> {
      double chiSq = 0D;
      for (int i = 0; i < p.n; i++) {
        if (p.x[i] <= 0) {
          return error(DIV_BY_ZERO);
        }
        chiSq += (p.y[i] - p.x[i]) * (p.y[i] - p.x[i]) / p.x[i];
      }
      final int df = actual.rows > 1 && actual.cols > 1
          ? (actual.rows - 1) * (actual.cols - 1)
          : actual.size() - 1;
      if (df < 1) {
        return error(NOT_AVAILABLE);
      }
      return Value.number(1D - SpecialFunctions.chiSqCdf(chiSq, df));
    });
  }

  private static Value correl(Pairs p) {
    final double d = Math.sqrt(p.sxx() * p.syy());
    return d == 0 ? error(DIV_BY_ZERO) : Value.number(p.sxy() / d);
  }

  /**
   * Applies a function to the pairs of numbers in two equal-sized arrays.
   * Returns {@code #N/A} if the arrays differ in size, {@code #DIV/0!} if
   * there are fewer than {@code minCount} pairs.
   */
  private static Value pairs(List<Value> args, int minCount,
      Function<Pairs, Value> f) {
    final ArrayValue ys = Values.toArray(args.get(0));
    final ArrayValue xs = Values.toArray(args.get(1));
    if (ys.size() != xs.size()) {
      return error(NOT_AVAILABLE);
    }
    final Pairs p = new Pairs(ys.size());
    for (int i = 0; i < ys.size(); i++) {
      final Value.Scalar y = ys.get(i);
      final Value.Scalar x = xs.get(i);
      if (y instanceof Value.Err) {
        return y;
      }
      if (x instanceof Value.Err) {
        return x;
      }
      if (y instanceof Value.Num && x instanceof Value.Num) {
        p.add(((Value.Num) x).value, ((Value.Num) y).value);
      }
    }
    if (p.n < minCount) {
      return error(DIV_BY_ZERO);
    }
    return f.apply(p);
  }

  private static Value chiSqInv(Session session, List<Value> args,
      boolean rightTail) {
    final ArgList a = ArgList.of(args);
    final double p = a.num(0);
    final double df = Math.floor(a.num(1));
    if (a.failed()) {
      return a.error();
    }
    if (p < 0 || p > 1 || df < 1 || (rightTail ? p == 0 : p == 1)) {
      return error(NUMBER);
    }
    return inverse(session, x -> SpecialFunctions.chiSqCdf(x, df),
        rightTail ? 1D - p : p);
  }

  private static Value fInv(Session session, List<Value> args,
      boolean rightTail) {
    final ArgList a = ArgList.of(args);
    final double p = a.num(0);
    final double d1 = Math.floor(a.num(1));
    final double d2 = Math.floor(a.num(2));
    if (a.failed()) {
      return a.error();
    }
    if (p < 0 || p > 1 || d1 < 1 || d2 < 1
        || (rightTail ? p == 0 : p == 1)) {
      return error(NUMBER);
    }
    return inverse(session, x -> SpecialFunctions.fCdf(x, d1, d2),
        rightTail ? 1D - p : p);
  }

  /** Inverts a cumulative distribution on {@code [0, infinity)}. */
  private static Value inverse(Session session, DoubleUnaryOperator cdf,
      double p) {
    if (p == 0D) {
      return Value.ZERO;
    }
    return Value.number(
        RootFinder.inverse(cdf, p, 0D, session.iterationLimit()));
  }

  /** Inverse of the standard normal cumulative distribution. */
  static double normSInv(Session session, double p) {
    return RootFinder.bisect(z -> SpecialFunctions.normCdf(z) - p, -40D, 40D,
        session.iterationLimit());
  }

  private static double tInv(Session session, double p, double df) {
    if (p < 0.5) {
      return -tInv(session, 1D - p, df);
    }
    return RootFinder.inverse(t -> SpecialFunctions.tCdf(t, df), p, 0D,
        session.iterationLimit());
  }

  /** Known values of a regression. {@code x[i][j]} is the value of
   * variable {@code j} in observation {@code i}. */
  private static class Observations {
    final double[] y;
    final double[][] x;
    /** Whether {@code known_xs} is the same size as {@code known_ys}. */
    final boolean single;
    /** Whether each variable is a column of {@code known_xs}. */
    final boolean byColumn;

    Observations(double[] y, double[][] x, boolean single,
        boolean byColumn) {
      this.y = y;
      this.x = x;
      this.single = single;
      this.byColumn = byColumn;
    }
  }

  /** Pairs of numbers, with running sums. */
  private static class Pairs {
    final double[] x;
    final double[] y;
    int n;

    Pairs(int capacity) {
      x = new double[capacity];
      y = new double[capacity];
    }

    void add(double xValue, double yValue) {
      x[n] = xValue;
      y[n] = yValue;
      ++n;
    }

    double meanX() {
      double sum = 0D;
      for (int i = 0; i < n; i++) {
        sum += x[i];
      }
      return sum / n;
    }

    double meanY() {
      double sum = 0D;
      for (int i = 0; i < n; i++) {
        sum += y[i];
      }
      return sum / n;
    }

    double sxx() {
      final double mx = meanX();
      double sum = 0D;
      for (int i = 0; i < n; i++) {
        sum += (x[i] - mx) * (x[i] - mx);
      }
      return sum;
    }

    double syy() {
      final double my = meanY();
      double sum = 0D;
      for (int i = 0; i < n; i++) {
        sum += (y[i] - my) * (y[i] - my);
      }
      return sum;
    }

    double sxy() {
      final double mx = meanX();
      final double my = meanY();
      double sum = 0D;
      for (int i = 0; i < n; i++) {
        sum += (x[i] - mx) * (y[i] - my);
      }
      return sum;
    }
  }
}

// End StatisticalFunctions.java
