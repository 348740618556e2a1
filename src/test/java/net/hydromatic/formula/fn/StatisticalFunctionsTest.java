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

import net.hydromatic.formula.Fx;
import net.hydromatic.formula.eval.ErrorKind;
import org.junit.jupiter.api.Test;

/** Tests for statistical functions. */
public class StatisticalFunctionsTest {
  private static final String DATA = "{2, 4, 4, 4, 5, 5, 7, 9}";

  @Test void testMoments() {
    fx("=AVERAGE(" + DATA + ")").assertNumber(5);
    fx("=STDEV.S(" + DATA + ")").assertNumber(2.138089935);
    fx("=STDEV(" + DATA + ")").assertNumber(2.138089935);
    fx("=STDEV.P(" + DATA + ")").assertNumber(2);
    fx("=VAR.S(" + DATA + ")").assertNumber(4.571428571);
    fx("=VAR.P(" + DATA + ")").assertNumber(4);
    fx("=STDEV.S(1)").assertError(ErrorKind.DIV_BY_ZERO);
    fx("=AVERAGE(A1:A3)").assertError(ErrorKind.DIV_BY_ZERO);
    fx("=AVERAGEA({1, \"x\", TRUE})").assertNumber(2D / 3D);
    fx("=AVEDEV(1, 2, 3, 4)").assertNumber(1);
    fx("=DEVSQ(1, 2, 3)").assertNumber(2);
    fx("=GEOMEAN(2, 8)").assertNumber(4);
    fx("=GEOMEAN(2, -8)").assertError(ErrorKind.NUMBER);
    fx("=HARMEAN(1, 2, 4)").assertNumber(12D / 7D);
  }

  @Test void testMaxMinMedianMode() {
    fx("=MAX(3, 9, 1)").assertNumber(9);
    fx("=MIN(3, 9, 1)").assertNumber(1);
    fx("=MAX(A1:A3)").assertNumber(0);
    fx("=MAXA({1, TRUE, -1})").assertNumber(1);
    fx("=MEDIAN(1, 2, 3, 4)").assertNumber(2.5);
    fx("=MEDIAN(5, 1, 3)").assertNumber(3);
    fx("=MODE.SNGL({1, 3, 2, 2, 3})").assertNumber(3);
    fx("=MODE.MULT({1, 2, 2, 3, 3})").assertArray("{2;3}");
    fx("=MODE(1, 2, 3)").assertError(ErrorKind.NOT_AVAILABLE);
  }

  @Test void testRankAndPercentile() {
    fx("=LARGE({3, 5, 3, 5, 4}, 2)").assertNumber(5);
    fx("=SMALL({3, 5, 3, 5, 4}, 2)").assertNumber(3);
    fx("=SMALL({3, 5}, 3)").assertError(ErrorKind.NUMBER);
    fx("=PERCENTILE.INC({1, 2, 3, 4}, 0.3)").assertNumber(1.9);
    fx("=PERCENTILE.EXC({1, 2, 3, 4}, 0.2)").assertNumber(1);
    fx("=PERCENTILE.EXC({1, 2, 3, 4}, 0)").assertError(ErrorKind.NUMBER);
    fx("=QUARTILE.INC({1, 2, 3, 4, 5}, 1)").assertNumber(2);
    fx("=QUARTILE.INC({1, 2, 3, 4, 5}, 5)").assertError(ErrorKind.NUMBER);
    fx("=PERCENTRANK.INC({1, 2, 3, 4, 5}, 3)").assertNumber(0.5);
    fx("=PERCENTRANK.EXC({1, 2, 3, 4, 5}, 3)").assertNumber(0.5);
    fx("=PERCENTRANK.INC({1, 2, 3, 4, 5}, 6)")
        .assertError(ErrorKind.NOT_AVAILABLE);
    fx("=RANK.EQ(4, {1, 4, 4, 7})").assertNumber(2);
    fx("=RANK.AVG(4, {1, 4, 4, 7})").assertNumber(2.5);
    fx("=RANK.EQ(4, {1, 4, 4, 7}, 1)").assertNumber(2);
    fx("=RANK.EQ(5, {1, 4, 4, 7})").assertError(ErrorKind.NOT_AVAILABLE);
    fx("=FREQUENCY({1, 2, 3, 4, 5}, {2, 4})").assertArray("{2;2;1}");
  }

  @Test void testCounting() {
    final Fx f = fx("=COUNT(A1:A5)")
        .withColumn("A1", 1, "two", true, 4.5)
        .withCell("A6", "");
    f.assertNumber(2);
    f.withFormula("=COUNTA(A1:A5)").assertNumber(4);
    f.withFormula("=COUNTBLANK(A1:A6)").assertNumber(2);
    f.withFormula("=COUNT(1, \"2\", \"x\", TRUE)").assertNumber(3);
    f.withFormula("=COUNTIF(A1:A5, \">1\")").assertNumber(1);
    f.withFormula("=COUNTIF(A1:A5, \"t*\")").assertNumber(1);
    f.withFormula("=COUNTIFS(A1:A5, \"<>\", A1:A5, \"<5\")").assertNumber(2);
    f.withFormula("=COUNTIFS(A1:A5, \"<>\", A1:A4, \"<5\")")
        .assertError(ErrorKind.VALUE);
  }

  @Test void testConditionalAverages() {
    final Fx f = fx("=AVERAGEIF(A1:A4, \">2\")")
        .withColumn("A1", 1, 3, 5, 7)
        .withColumn("B1", "x", "y", "x", "y");
    f.assertNumber(5);
    f.withFormula("=AVERAGEIF(B1:B4, \"x\", A1:A4)").assertNumber(3);
    f.withFormula("=AVERAGEIFS(A1:A4, B1:B4, \"y\", A1:A4, \">3\")")
        .assertNumber(7);
    f.withFormula("=AVERAGEIF(A1:A4, \">100\")")
        .assertError(ErrorKind.DIV_BY_ZERO);
    f.withFormula("=MAXIFS(A1:A4, B1:B4, \"x\")").assertNumber(5);
    f.withFormula("=MINIFS(A1:A4, B1:B4, \"y\")").assertNumber(3);
  }

  @Test void testRegression() {
    final String ys = "{2, 4, 6}";
    final String xs = "{1, 2, 3}";
    fx("=CORREL(" + ys + ", " + xs + ")").assertNumber(1);
    fx("=PEARSON({1, 2, 3}, {3, 2, 1})").assertNumber(-1);
    fx("=SLOPE(" + ys + ", " + xs + ")").assertNumber(2);
    fx("=INTERCEPT({3, 5, 7}, " + xs + ")").assertNumber(1);
    fx("=RSQ(" + ys + ", " + xs + ")").assertNumber(1);
    fx("=FORECAST.LINEAR(4, " + ys + ", " + xs + ")").assertNumber(8);
    fx("=FORECAST(4, " + ys + ", " + xs + ")").assertNumber(8);
    fx("=TREND(" + ys + ", " + xs + ", {4, 5})").assertArray("{8,10}");
    fx("=TREND(" + ys + ")").assertArray("{2,4,6}");
    fx("=COVARIANCE.P(" + xs + ", " + xs + ")").assertNumber(2D / 3D);
    fx("=COVARIANCE.S(" + xs + ", " + xs + ")").assertNumber(1);
    fx("=SLOPE({1, 2}, {1, 2, 3})").assertError(ErrorKind.NOT_AVAILABLE);
    fx("=SLOPE({1, 2}, {5, 5})").assertError(ErrorKind.DIV_BY_ZERO);
    fx("=STANDARDIZE(42, 40, 1.5)").assertNumber(4D / 3D);
  }

  /** LINEST and LOGEST return coefficients in reverse order of the
   * variables, then the constant; with statistics, four more rows. */
  @Test void testLinest() {
    fx("=LINEST({1, 3, 5, 7, 9}, {1, 2, 3, 4, 5})").assertArray("{2,-1}");
    fx("=LINEST({1, 3, 5, 7, 9})").assertArray("{2,-1}");
    fx("=LINEST({2, 4, 6, 8}, {1, 2, 3, 4}, FALSE)").assertArray("{2,0}");

    final String stats = "LINEST({1, 2, 4, 5}, {1, 2, 3, 4}, TRUE, TRUE)";
    fx("=ROWS(" + stats + ")").assertNumber(5);
    fx("=INDEX(" + stats + ", 1, 1)").assertNumber(1.4);
    fx("=INDEX(" + stats + ", 1, 2)").assertNumber(-0.5);
    fx("=INDEX(" + stats + ", 2, 1)").assertNumber(0.1414213562373096);
    fx("=INDEX(" + stats + ", 2, 2)").assertNumber(0.3872983346207417);
    fx("=INDEX(" + stats + ", 3, 1)").assertNumber(0.98);
    fx("=INDEX(" + stats + ", 3, 2)").assertNumber(0.3162277660168379);
    fx("=INDEX(" + stats + ", 4, 1)").assertNumber(98);
    fx("=INDEX(" + stats + ", 4, 2)").assertNumber(2);
    fx("=INDEX(" + stats + ", 5, 1)").assertNumber(9.8);
    fx("=INDEX(" + stats + ", 5, 2)").assertNumber(0.2);

    // Without a constant, the standard error of b is #N/A
    fx("=INDEX(LINEST({1, 2, 4, 5}, {1, 2, 3, 4}, FALSE, TRUE), 2, 2)")
        .assertError(ErrorKind.NOT_AVAILABLE);

    // Two variables, as the columns of known_xs: y = 1 + 2 x1 + 3 x2
    final String multi = "LINEST({6; 17; 13; 18; 26}, "
        + "{1, 1; 2, 4; 3, 2; 4, 3; 5, 5}, TRUE, TRUE)";
    fx("=INDEX(" + multi + ", 1, 1)").assertNumber(3);
    fx("=INDEX(" + multi + ", 1, 2)").assertNumber(2);
    fx("=INDEX(" + multi + ", 1, 3)").assertNumber(1);
    fx("=INDEX(" + multi + ", 3, 1)").assertNumber(1);
    fx("=INDEX(" + multi + ", 3, 3)").assertError(ErrorKind.NOT_AVAILABLE);
    fx("=COLUMNS(" + multi + ")").assertNumber(3);

    fx("=LINEST({1, 2, 3}, {1, 2})").assertError(ErrorKind.REFERENCE);
    fx("=LINEST({1, 2, 3}, {5, 5, 5})").assertError(ErrorKind.NUMBER);
    fx("=LINEST({1, \"a\", 3})").assertError(ErrorKind.VALUE);
  }

  @Test void testLogestAndGrowth() {
    final String logest = "LOGEST({2, 3, 4.5, 6.75}, {0, 1, 2, 3})";
    fx("=INDEX(" + logest + ", 1, 1)").assertNumber(1.5);
    fx("=INDEX(" + logest + ", 1, 2)").assertNumber(2);
    fx("=INDEX(LOGEST({1, 2, 4, 8}, {0, 1, 2, 3}, FALSE), 1, 2)")
        .assertNumber(1);
    fx("=LOGEST({1, -2, 4})").assertError(ErrorKind.NUMBER);

    final String growth = "GROWTH({1, 2, 4, 8}, {0, 1, 2, 3}, {4, 5})";
    fx("=INDEX(" + growth + ", 1, 1)").assertNumber(16);
    fx("=INDEX(" + growth + ", 1, 2)").assertNumber(32);
    fx("=COLUMNS(" + growth + ")").assertNumber(2);
    fx("=INDEX(GROWTH({1, 2, 4, 8}), 1, 4)").assertNumber(8);

    // y = 2 * 3^x1 * 0.5^x2; one new point, as a row of new_xs
    fx("=INDEX(GROWTH({3; 1.125; 13.5; 20.25; 15.1875}, "
        + "{1, 1; 2, 4; 3, 2; 4, 3; 5, 5}, {6, 1}), 1, 1)")
        .assertNumber(729);
    fx("=GROWTH({3; 1.125; 13.5; 20.25; 15.1875}, "
        + "{1, 1; 2, 4; 3, 2; 4, 3; 5, 5}, {6, 1, 2})")
        .assertError(ErrorKind.REFERENCE);
  }

  @Test void testHypothesisTests() {
    final Fx f = fx("=T.TEST(A1:A9, B1:B9, 2, 1)")
        .withColumn("A1", 3, 4, 5, 8, 9, 1, 2, 4, 5)
        .withColumn("B1", 6, 19, 3, 2, 14, 4, 5, 17, 1);
    f.assertNumber(0.196016, 1E-6);
    f.withFormula("=T.TEST(A1:A9, B1:B9, 1, 1)").assertNumber(0.098008, 1E-6);
    f.withFormula("=T.TEST(A1:A9, B1:B9, 2, 2)").assertNumber(0.191996, 1E-6);
    f.withFormula("=TTEST(A1:A9, B1:B9, 2, 3)").assertNumber(0.202294, 1E-6);
    f.withFormula("=T.TEST(A1:A9, B1:B9, 3, 1)").assertError(ErrorKind.NUMBER);
    f.withFormula("=T.TEST(A1:A9, B1:B9, 2, 4)").assertError(ErrorKind.NUMBER);
    f.withFormula("=T.TEST(A1:A9, B1:B8, 2, 1)")
        .assertError(ErrorKind.NOT_AVAILABLE);
    f.withFormula("=T.TEST({1}, {2, 3}, 2, 2)")
        .assertError(ErrorKind.DIV_BY_ZERO);

    fx("=F.TEST({6, 7, 9, 15, 21}, {20, 28, 31, 38, 40})")
        .assertNumber(0.648318, 1E-6);
    fx("=FTEST({20, 28, 31, 38, 40}, {6, 7, 9, 15, 21})")
        .assertNumber(0.648318, 1E-6);
    fx("=F.TEST({1, 1}, {1, 2})").assertError(ErrorKind.DIV_BY_ZERO);

    fx("=CHISQ.TEST({58, 35; 11, 25; 10, 23}, "
        + "{45.35, 47.65; 17.56, 18.44; 16.09, 16.91})")
        .assertNumber(0.000308192, 1E-9);
    fx("=CHITEST({10, 20, 30}, {20, 20, 20})")
        .assertNumber(0.006737947, 1E-9);
    fx("=CHISQ.TEST({10, 20, 30}, {20, 20})")
        .assertError(ErrorKind.NOT_AVAILABLE);
    fx("=CHISQ.TEST({10, 20}, {20, 0})").assertError(ErrorKind.DIV_BY_ZERO);
  }

  @Test void testNormal() {
    fx("=NORM.S.DIST(0, TRUE)").assertNumber(0.5, 1E-6);
    fx("=NORM.S.DIST(1.96, TRUE)").assertNumber(0.9750021, 1E-6);
    fx("=NORM.S.DIST(0, FALSE)").assertNumber(0.39894228, 1E-8);
    fx("=NORM.DIST(42, 40, 1.5, TRUE)").assertNumber(0.9087888, 1E-6);
    fx("=NORM.S.INV(0.975)").assertNumber(1.959964, 1E-5);
    fx("=NORM.INV(0.5, 10, 2)").assertNumber(10, 1E-5);
    fx("=NORM.S.INV(1)").assertError(ErrorKind.NUMBER);
    fx("=NORM.DIST(1, 0, 0, TRUE)").assertError(ErrorKind.NUMBER);
    fx("=GAUSS(0)").assertNumber(0, 1E-6);
    fx("=PHI(0)").assertNumber(0.39894228, 1E-8);
  }

  @Test void testDiscreteDistributions() {
    fx("=BINOM.DIST(6, 10, 0.5, FALSE)").assertNumber(0.205078125, 1E-9);
    fx("=BINOM.DIST(6, 10, 0.5, TRUE)").assertNumber(0.828125, 1E-9);
    fx("=BINOM.DIST(11, 10, 0.5, TRUE)").assertError(ErrorKind.NUMBER);
    fx("=BINOMDIST(0, 10, 0.1, FALSE)").assertNumber(0.3486784401, 1E-10);
    fx("=BINOM.INV(10, 0.5, 0.5)").assertNumber(5);
    fx("=BINOM.INV(100, 0.5, 0.95)").assertNumber(58);
    fx("=CRITBINOM(20, 0.3, 0.9)").assertNumber(9);
    fx("=NEGBINOM.DIST(10, 5, 0.25, FALSE)").assertNumber(0.0550487, 1E-7);
    fx("=NEGBINOM.DIST(10, 5, 0.25, TRUE)").assertNumber(0.3135141, 1E-7);
    fx("=POISSON.DIST(2, 5, FALSE)").assertNumber(0.084224337, 1E-8);
    fx("=POISSON.DIST(2, 5, TRUE)").assertNumber(0.124652019, 1E-8);
    fx("=HYPGEOM.DIST(1, 4, 8, 20, FALSE)").assertNumber(0.363261094, 1E-8);
  }

  /** Trials and successes must be whole numbers no larger than
   * {@link Integer#MAX_VALUE}. */
  @Test void testBinomialCounts() {
    fx("=BINOM.DIST(2, 10.5, 0.5, FALSE)").assertError(ErrorKind.NUMBER);
    fx("=BINOM.DIST(2.5, 10, 0.5, TRUE)").assertError(ErrorKind.NUMBER);
    fx("=BINOM.DIST(-1, 10, 0.5, TRUE)").assertError(ErrorKind.NUMBER);
    fx("=BINOM.INV(10.5, 0.5, 0.5)").assertError(ErrorKind.NUMBER);
    fx("=BINOM.DIST(1, 3000000000, 1E-9, FALSE)")
        .assertError(ErrorKind.NUMBER);
    fx("=BINOM.INV(3000000000, 0.5, 0.5)").assertError(ErrorKind.NUMBER);
    fx("=NEGBINOM.DIST(3000000000, 5, 0.5, TRUE)")
        .assertError(ErrorKind.NUMBER);

    // Large but valid counts are computed without narrowing
    fx("=BINOM.DIST(1, 2000000000, 1E-9, FALSE)")
        .assertNumber(0.2706705664732258, 1E-9);
    fx("=BINOM.DIST(2000000, 2000000000, 1E-9, TRUE)").assertNumber(1);
    fx("=BINOM.INV(2000000000, 0.5, 0.5)").assertNumber(1E9, 3);
  }

  @Test void testContinuousDistributions() {
    fx("=EXPON.DIST(0.2, 10, TRUE)").assertNumber(0.864664717, 1E-8);
    fx("=EXPON.DIST(0.2, 10, FALSE)").assertNumber(1.353352832, 1E-8);
    fx("=WEIBULL.DIST(105, 20, 100, TRUE)").assertNumber(0.929581, 1E-6);
    fx("=CHISQ.DIST.RT(3.841459, 1)").assertNumber(0.05, 1E-5);
    fx("=T.DIST(0, 10, TRUE)").assertNumber(0.5, 1E-6);
    fx("=GAMMA(5)").assertNumber(24, 1E-6);
    fx("=GAMMALN(10)").assertNumber(12.80182748, 1E-6);
    fx("=FISHER(0.75)").assertNumber(0.972955075, 1E-8);
    fx("=FISHERINV(0.972955075)").assertNumber(0.75, 1E-8);
  }
}

// End StatisticalFunctionsTest.java
