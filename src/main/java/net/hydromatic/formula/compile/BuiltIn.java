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
package net.hydromatic.formula.compile;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.formula.compile.Category.ARRAY;
import static net.hydromatic.formula.compile.Category.DATABASE;
import static net.hydromatic.formula.compile.Category.DATE_TIME;
import static net.hydromatic.formula.compile.Category.ENGINEERING;
import static net.hydromatic.formula.compile.Category.FINANCIAL;
import static net.hydromatic.formula.compile.Category.INFORMATION;
import static net.hydromatic.formula.compile.Category.LAMBDA;
import static net.hydromatic.formula.compile.Category.LOGICAL;
import static net.hydromatic.formula.compile.Category.LOOKUP;
import static net.hydromatic.formula.compile.Category.MATH;
import static net.hydromatic.formula.compile.Category.STATISTICAL;
import static net.hydromatic.formula.compile.Category.TEXT;
import static net.hydromatic.formula.compile.Trait.LAZY;
import static net.hydromatic.formula.compile.Trait.SCALAR;
import static net.hydromatic.formula.compile.Trait.SYNTAX;
import static net.hydromatic.formula.compile.Trait.VOLATILE;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Built-in functions.
 *
 * <p>The name and arity of each function are derived from its syntax hint:
 * a parameter in square brackets is optional, and "..." means that the
 * preceding parameters may repeat.
 *
 * <p>The implementation of each function is in {@link
 * net.hydromatic.formula.fn.Codes#BUILT_IN_VALUES}.
 */
public enum BuiltIn {
  // lint:startSorted

  // Math & trig

  ABS(MATH, "ABS(number)", "Returns the absolute value of a number", SCALAR),
  ACOS(MATH, "ACOS(number)", "Returns the arccosine of a number", SCALAR),
  ACOSH(MATH, "ACOSH(number)",
      "Returns the inverse hyperbolic cosine of a number", SCALAR),
  AGGREGATE(MATH, "AGGREGATE(function_num, options, ref1, [ref2], ...)",
      "Returns an aggregate, optionally ignoring errors"),
  ARABIC(MATH, "ARABIC(text)", "Converts a Roman numeral to a number",
      SCALAR),
  ASIN(MATH, "ASIN(number)", "Returns the arcsine of a number", SCALAR),
  ASINH(MATH, "ASINH(number)",
      "Returns the inverse hyperbolic sine of a number", SCALAR),
  ATAN(MATH, "ATAN(number)", "Returns the arctangent of a number", SCALAR),
  ATAN2(MATH, "ATAN2(x_num, y_num)",
      "Returns the arctangent from x- and y-coordinates", SCALAR),
  ATANH(MATH, "ATANH(number)",
      "Returns the inverse hyperbolic tangent of a number", SCALAR),
  BASE(MATH, "BASE(number, radix, [min_length])",
      "Converts a number to text in a given radix", SCALAR),
  CEILING(MATH, "CEILING(number, significance)",
      "Rounds a number up to the nearest multiple of significance", SCALAR),
  CEILING_MATH(MATH, "CEILING.MATH(number, [significance], [mode])",
      "Rounds a number up to the nearest integer or multiple", SCALAR),
  COMBIN(MATH, "COMBIN(number, number_chosen)",
      "Returns the number of combinations", SCALAR),
  COMBINA(MATH, "COMBINA(number, number_chosen)",
      "Returns the number of combinations with repetitions", SCALAR),
  COS(MATH, "COS(number)", "Returns the cosine of a number", SCALAR),
  COSH(MATH, "COSH(number)", "Returns the hyperbolic cosine of a number",
      SCALAR),
  COT(MATH, "COT(number)", "Returns the cotangent of an angle", SCALAR),
  CSC(MATH, "CSC(number)", "Returns the cosecant of an angle", SCALAR),
  DECIMAL(MATH, "DECIMAL(text, radix)",
      "Converts text in a given radix to a number", SCALAR),
  DEGREES(MATH, "DEGREES(angle)", "Converts radians to degrees", SCALAR),
  EVEN(MATH, "EVEN(number)",
      "Rounds a number away from zero to an even integer", SCALAR),
  EXP(MATH, "EXP(number)", "Returns e raised to a power", SCALAR),
  FACT(MATH, "FACT(number)", "Returns the factorial of a number", SCALAR),
  FACTDOUBLE(MATH, "FACTDOUBLE(number)",
      "Returns the double factorial of a number", SCALAR),
  FLOOR(MATH, "FLOOR(number, significance)",
      "Rounds a number down to the nearest multiple of significance",
      SCALAR),
  FLOOR_MATH(MATH, "FLOOR.MATH(number, [significance], [mode])",
      "Rounds a number down to the nearest integer or multiple", SCALAR),
  GCD(MATH, "GCD(number1, [number2], ...)",
      "Returns the greatest common divisor"),
  INT(MATH, "INT(number)", "Rounds a number down to the nearest integer",
      SCALAR),
  LCM(MATH, "LCM(number1, [number2], ...)",
      "Returns the least common multiple"),
  LN(MATH, "LN(number)", "Returns the natural logarithm of a number",
      SCALAR),
  LOG(MATH, "LOG(number, [base])",
      "Returns the logarithm of a number to a given base", SCALAR),
  LOG10(MATH, "LOG10(number)", "Returns the base-10 logarithm of a number",
      SCALAR),
  MDETERM(MATH, "MDETERM(array)",
      "Returns the matrix determinant of an array"),
  MMULT(MATH, "MMULT(array1, array2)",
      "Returns the matrix product of two arrays"),
  MOD(MATH, "MOD(number, divisor)", "Returns the remainder from division",
      SCALAR),
  MROUND(MATH, "MROUND(number, multiple)",
      "Returns a number rounded to the desired multiple", SCALAR),
  MULTINOMIAL(MATH, "MULTINOMIAL(number1, [number2], ...)",
      "Returns the multinomial of a set of numbers"),
  MUNIT(MATH, "MUNIT(dimension)",
      "Returns the unit matrix of a given dimension"),
  ODD(MATH, "ODD(number)",
      "Rounds a number away from zero to an odd integer", SCALAR),
  PERMUT(MATH, "PERMUT(number, number_chosen)",
      "Returns the number of permutations for a given number of objects",
      SCALAR),
  PI(MATH, "PI()", "Returns the value of pi"),
  POWER(MATH, "POWER(number, power)",
      "Returns the result of a number raised to a power", SCALAR),
  PRODUCT(MATH, "PRODUCT(number1, [number2], ...)",
      "Multiplies its arguments"),
  QUOTIENT(MATH, "QUOTIENT(numerator, denominator)",
      "Returns the integer portion of a division", SCALAR),
  RADIANS(MATH, "RADIANS(angle)", "Converts degrees to radians", SCALAR),
  RAND(MATH, "RAND()", "Returns a random number between 0 and 1", VOLATILE),
  RANDBETWEEN(MATH, "RANDBETWEEN(bottom, top)",
      "Returns a random integer between the numbers you specify", VOLATILE),
  ROMAN(MATH, "ROMAN(number, [form])",
      "Converts a number to a Roman numeral, as text", SCALAR),
  ROUND(MATH, "ROUND(number, num_digits)",
      "Rounds a number to a specified number of digits", SCALAR),
  ROUNDDOWN(MATH, "ROUNDDOWN(number, num_digits)",
      "Rounds a number down, toward zero", SCALAR),
  ROUNDUP(MATH, "ROUNDUP(number, num_digits)",
      "Rounds a number up, away from zero", SCALAR),
  SEC(MATH, "SEC(number)", "Returns the secant of an angle", SCALAR),
  SIGN(MATH, "SIGN(number)", "Returns the sign of a number", SCALAR),
  SIN(MATH, "SIN(number)", "Returns the sine of an angle", SCALAR),
  SINH(MATH, "SINH(number)", "Returns the hyperbolic sine of a number",
      SCALAR),
  SQRT(MATH, "SQRT(number)", "Returns a positive square root", SCALAR),
  SQRTPI(MATH, "SQRTPI(number)", "Returns the square root of (number * pi)",
      SCALAR),
  SUBTOTAL(MATH, "SUBTOTAL(function_num, ref1, [ref2], ...)",
      "Returns a subtotal in a list or database"),
  SUM(MATH, "SUM(number1, [number2], ...)", "Adds its arguments"),
  SUMIF(MATH, "SUMIF(range, criteria, [sum_range])",
      "Adds the cells specified by a given criterion"),
  SUMIFS(MATH, "SUMIFS(sum_range, criteria_range1, criteria1, ...)",
      "Adds the cells in a range that meet multiple criteria"),
  SUMPRODUCT(MATH, "SUMPRODUCT(array1, [array2], ...)",
      "Returns the sum of the products of corresponding array components"),
  SUMSQ(MATH, "SUMSQ(number1, [number2], ...)",
      "Returns the sum of the squares of the arguments"),
  SUMX2MY2(MATH, "SUMX2MY2(array_x, array_y)",
      "Returns the sum of the difference of squares of corresponding values"),
  SUMX2PY2(MATH, "SUMX2PY2(array_x, array_y)",
      "Returns the sum of the sum of squares of corresponding values"),
  SUMXMY2(MATH, "SUMXMY2(array_x, array_y)",
      "Returns the sum of squares of differences of corresponding values"),
  TAN(MATH, "TAN(number)", "Returns the tangent of a number", SCALAR),
  TANH(MATH, "TANH(number)", "Returns the hyperbolic tangent of a number",
      SCALAR),
  TRUNC(MATH, "TRUNC(number, [num_digits])",
      "Truncates a number to an integer", SCALAR),

  // Statistical

  AVEDEV(STATISTICAL, "AVEDEV(number1, [number2], ...)",
      "Returns the average of the absolute deviations from their mean"),
  AVERAGE(STATISTICAL, "AVERAGE(number1, [number2], ...)",
      "Returns the average of its arguments"),
  AVERAGEA(STATISTICAL, "AVERAGEA(value1, [value2], ...)",
      "Returns the average of its arguments, including text and logicals"),
  AVERAGEIF(STATISTICAL, "AVERAGEIF(range, criteria, [average_range])",
      "Returns the average of the cells that meet a criterion"),
  AVERAGEIFS(STATISTICAL,
      "AVERAGEIFS(average_range, criteria_range1, criteria1, ...)",
      "Returns the average of the cells that meet multiple criteria"),
  BETA_DIST(STATISTICAL,
      "BETA.DIST(x, alpha, beta, cumulative, [A], [B])",
      "Returns the beta distribution", SCALAR),
  BETA_INV(STATISTICAL, "BETA.INV(probability, alpha, beta, [A], [B])",
      "BETAINV", "Returns the inverse of the cumulative beta distribution",
      SCALAR),
  BINOM_DIST(STATISTICAL,
      "BINOM.DIST(number_s, trials, probability_s, cumulative)", "BINOMDIST",
      "Returns the individual term binomial distribution probability",
      SCALAR),
  BINOM_INV(STATISTICAL, "BINOM.INV(trials, probability_s, alpha)",
      "CRITBINOM",
      "Returns the smallest value for which the cumulative binomial "
          + "distribution is greater than or equal to a criterion value",
      SCALAR),
  CHISQ_DIST(STATISTICAL, "CHISQ.DIST(x, deg_freedom, cumulative)",
      "Returns the chi-squared distribution", SCALAR),
  CHISQ_DIST_RT(STATISTICAL, "CHISQ.DIST.RT(x, deg_freedom)", "CHIDIST",
      "Returns the right-tailed probability of the chi-squared distribution",
      SCALAR),
  CHISQ_INV(STATISTICAL, "CHISQ.INV(probability, deg_freedom)",
      "Returns the inverse of the left-tailed chi-squared distribution",
      SCALAR),
  CHISQ_INV_RT(STATISTICAL, "CHISQ.INV.RT(probability, deg_freedom)",
      "CHIINV",
      "Returns the inverse of the right-tailed chi-squared distribution",
      SCALAR),
  CHISQ_TEST(STATISTICAL, "CHISQ.TEST(actual_range, expected_range)",
      "CHITEST", "Returns the chi-squared test for independence"),
  CONFIDENCE_NORM(STATISTICAL,
      "CONFIDENCE.NORM(alpha, standard_dev, size)", "CONFIDENCE",
      "Returns the confidence interval for a population mean", SCALAR),
  CORREL(STATISTICAL, "CORREL(array1, array2)",
      "Returns the correlation coefficient between two data sets"),
  COUNT(STATISTICAL, "COUNT(value1, [value2], ...)",
      "Counts how many numbers are in the list of arguments"),
  COUNTA(STATISTICAL, "COUNTA(value1, [value2], ...)",
      "Counts how many values are in the list of arguments"),
  COUNTBLANK(STATISTICAL, "COUNTBLANK(range)",
      "Counts the number of blank cells within a range"),
  COUNTIF(STATISTICAL, "COUNTIF(range, criteria)",
      "Counts the number of cells within a range that meet a criterion"),
  COUNTIFS(STATISTICAL, "COUNTIFS(criteria_range1, criteria1, ...)",
      "Counts the number of cells within a range that meet multiple "
          + "criteria"),
  COVARIANCE_P(STATISTICAL, "COVARIANCE.P(array1, array2)", "COVAR",
      "Returns the population covariance"),
  COVARIANCE_S(STATISTICAL, "COVARIANCE.S(array1, array2)",
      "Returns the sample covariance"),
  DEVSQ(STATISTICAL, "DEVSQ(number1, [number2], ...)",
      "Returns the sum of squares of deviations"),
  EXPON_DIST(STATISTICAL, "EXPON.DIST(x, lambda, cumulative)", "EXPONDIST",
      "Returns the exponential distribution", SCALAR),
  F_DIST(STATISTICAL, "F.DIST(x, deg_freedom1, deg_freedom2, cumulative)",
      "Returns the F probability distribution", SCALAR),
  F_DIST_RT(STATISTICAL, "F.DIST.RT(x, deg_freedom1, deg_freedom2)",
      "FDIST", "Returns the right-tailed F probability distribution",
      SCALAR),
  F_INV(STATISTICAL, "F.INV(probability, deg_freedom1, deg_freedom2)",
      "Returns the inverse of the F probability distribution", SCALAR),
  F_INV_RT(STATISTICAL,
      "F.INV.RT(probability, deg_freedom1, deg_freedom2)", "FINV",
      "Returns the inverse of the right-tailed F probability distribution",
      SCALAR),
  F_TEST(STATISTICAL, "F.TEST(array1, array2)", "FTEST",
      "Returns the result of an F-test"),
  FISHER(STATISTICAL, "FISHER(x)", "Returns the Fisher transformation",
      SCALAR),
  FISHERINV(STATISTICAL, "FISHERINV(y)",
      "Returns the inverse of the Fisher transformation", SCALAR),
  FORECAST_LINEAR(STATISTICAL,
      "FORECAST.LINEAR(x, known_ys, known_xs)", "FORECAST",
      "Returns a value along a linear trend"),
  FREQUENCY(STATISTICAL, "FREQUENCY(data_array, bins_array)",
      "Returns a frequency distribution as a vertical array"),
  GAMMA(STATISTICAL, "GAMMA(number)", "Returns the gamma function value",
      SCALAR),
  GAMMA_DIST(STATISTICAL, "GAMMA.DIST(x, alpha, beta, cumulative)",
      "GAMMADIST", "Returns the gamma distribution", SCALAR),
  GAMMA_INV(STATISTICAL, "GAMMA.INV(probability, alpha, beta)", "GAMMAINV",
      "Returns the inverse of the gamma cumulative distribution", SCALAR),
  GAMMALN(STATISTICAL, "GAMMALN(x)", "GAMMALN.PRECISE",
      "Returns the natural logarithm of the gamma function", SCALAR),
  GAUSS(STATISTICAL, "GAUSS(z)",
      "Returns 0.5 less than the standard normal cumulative distribution",
      SCALAR),
  GEOMEAN(STATISTICAL, "GEOMEAN(number1, [number2], ...)",
      "Returns the geometric mean"),
  GROWTH(STATISTICAL, "GROWTH(known_ys, [known_xs], [new_xs], [const])",
      "Returns values along an exponential trend"),
  HARMEAN(STATISTICAL, "HARMEAN(number1, [number2], ...)",
      "Returns the harmonic mean"),
  HYPGEOM_DIST(STATISTICAL,
      "HYPGEOM.DIST(sample_s, number_sample, population_s, number_pop, "
          + "cumulative)",
      "Returns the hypergeometric distribution", SCALAR),
  INTERCEPT(STATISTICAL, "INTERCEPT(known_ys, known_xs)",
      "Returns the intercept of the linear regression line"),
  LARGE(STATISTICAL, "LARGE(array, k)",
      "Returns the k-th largest value in a data set"),
  LINEST(STATISTICAL, "LINEST(known_ys, [known_xs], [const], [stats])",
      "Returns the parameters of a linear trend"),
  LOGEST(STATISTICAL, "LOGEST(known_ys, [known_xs], [const], [stats])",
      "Returns the parameters of an exponential trend"),
  LOGNORM_DIST(STATISTICAL,
      "LOGNORM.DIST(x, mean, standard_dev, cumulative)",
      "Returns the lognormal distribution", SCALAR),
  LOGNORM_INV(STATISTICAL, "LOGNORM.INV(probability, mean, standard_dev)",
      "LOGINV", "Returns the inverse of the lognormal cumulative distribution",
      SCALAR),
  MAX(STATISTICAL, "MAX(number1, [number2], ...)",
      "Returns the maximum value in a list of arguments"),
  MAXA(STATISTICAL, "MAXA(value1, [value2], ...)",
      "Returns the maximum value, including numbers, text and logicals"),
  MAXIFS(STATISTICAL, "MAXIFS(max_range, criteria_range1, criteria1, ...)",
      "Returns the maximum value among cells that meet multiple criteria"),
  MEDIAN(STATISTICAL, "MEDIAN(number1, [number2], ...)",
      "Returns the median of the given numbers"),
  MIN(STATISTICAL, "MIN(number1, [number2], ...)",
      "Returns the minimum value in a list of arguments"),
  MINA(STATISTICAL, "MINA(value1, [value2], ...)",
      "Returns the minimum value, including numbers, text and logicals"),
  MINIFS(STATISTICAL, "MINIFS(min_range, criteria_range1, criteria1, ...)",
      "Returns the minimum value among cells that meet multiple criteria"),
  MODE_MULT(STATISTICAL, "MODE.MULT(number1, [number2], ...)",
      "Returns a vertical array of the most frequently occurring values"),
  MODE_SNGL(STATISTICAL, "MODE.SNGL(number1, [number2], ...)", "MODE",
      "Returns the most common value in a data set"),
  NEGBINOM_DIST(STATISTICAL,
      "NEGBINOM.DIST(number_f, number_s, probability_s, cumulative)",
      "Returns the negative binomial distribution", SCALAR),
  NORM_DIST(STATISTICAL, "NORM.DIST(x, mean, standard_dev, cumulative)",
      "NORMDIST", "Returns the normal cumulative distribution", SCALAR),
  NORM_INV(STATISTICAL, "NORM.INV(probability, mean, standard_dev)",
      "NORMINV", "Returns the inverse of the normal cumulative distribution",
      SCALAR),
  NORM_S_DIST(STATISTICAL, "NORM.S.DIST(z, cumulative)",
      "Returns the standard normal cumulative distribution", SCALAR),
  NORM_S_INV(STATISTICAL, "NORM.S.INV(probability)", "NORMSINV",
      "Returns the inverse of the standard normal cumulative distribution",
      SCALAR),
  PEARSON(STATISTICAL, "PEARSON(array1, array2)",
      "Returns the Pearson product moment correlation coefficient"),
  PERCENTILE_EXC(STATISTICAL, "PERCENTILE.EXC(array, k)",
      "Returns the k-th percentile, where k is exclusive of 0 and 1"),
  PERCENTILE_INC(STATISTICAL, "PERCENTILE.INC(array, k)", "PERCENTILE",
      "Returns the k-th percentile of values in a range"),
  PERCENTRANK_EXC(STATISTICAL,
      "PERCENTRANK.EXC(array, x, [significance])",
      "Returns the rank of a value as a percentage, exclusive of 0 and 1"),
  PERCENTRANK_INC(STATISTICAL,
      "PERCENTRANK.INC(array, x, [significance])", "PERCENTRANK",
      "Returns the percentage rank of a value in a data set"),
  PHI(STATISTICAL, "PHI(x)",
      "Returns the density of the standard normal distribution", SCALAR),
  POISSON_DIST(STATISTICAL, "POISSON.DIST(x, mean, cumulative)", "POISSON",
      "Returns the Poisson distribution", SCALAR),
  QUARTILE_EXC(STATISTICAL, "QUARTILE.EXC(array, quart)",
      "Returns the quartile of a data set, exclusive of 0 and 1"),
  QUARTILE_INC(STATISTICAL, "QUARTILE.INC(array, quart)", "QUARTILE",
      "Returns the quartile of a data set"),
  RANK_AVG(STATISTICAL, "RANK.AVG(number, ref, [order])",
      "Returns the rank of a number in a list, averaging ties"),
  RANK_EQ(STATISTICAL, "RANK.EQ(number, ref, [order])", "RANK",
      "Returns the rank of a number in a list"),
  RSQ(STATISTICAL, "RSQ(known_ys, known_xs)",
      "Returns the square of the Pearson correlation coefficient"),
  SLOPE(STATISTICAL, "SLOPE(known_ys, known_xs)",
      "Returns the slope of the linear regression line"),
  SMALL(STATISTICAL, "SMALL(array, k)",
      "Returns the k-th smallest value in a data set"),
  STANDARDIZE(STATISTICAL, "STANDARDIZE(x, mean, standard_dev)",
      "Returns a normalized value", SCALAR),
  STDEV_P(STATISTICAL, "STDEV.P(number1, [number2], ...)", "STDEVP",
      "Calculates standard deviation based on the entire population"),
  STDEV_S(STATISTICAL, "STDEV.S(number1, [number2], ...)", "STDEV",
      "Estimates standard deviation based on a sample"),
  STDEVA(STATISTICAL, "STDEVA(value1, [value2], ...)",
      "Estimates standard deviation, including text and logicals"),
  STDEVPA(STATISTICAL, "STDEVPA(value1, [value2], ...)",
      "Calculates population standard deviation, including text and "
          + "logicals"),
  STEYX(STATISTICAL, "STEYX(known_ys, known_xs)",
      "Returns the standard error of the predicted y-value in a regression"),
  T_DIST(STATISTICAL, "T.DIST(x, deg_freedom, cumulative)",
      "Returns the left-tailed Student's t-distribution", SCALAR),
  T_DIST_2T(STATISTICAL, "T.DIST.2T(x, deg_freedom)",
      "Returns the two-tailed Student's t-distribution", SCALAR),
  T_DIST_RT(STATISTICAL, "T.DIST.RT(x, deg_freedom)",
      "Returns the right-tailed Student's t-distribution", SCALAR),
  T_INV(STATISTICAL, "T.INV(probability, deg_freedom)",
      "Returns the left-tailed inverse of the Student's t-distribution",
      SCALAR),
  T_INV_2T(STATISTICAL, "T.INV.2T(probability, deg_freedom)", "TINV",
      "Returns the two-tailed inverse of the Student's t-distribution",
      SCALAR),
  T_TEST(STATISTICAL, "T.TEST(array1, array2, tails, type)", "TTEST",
      "Returns the probability associated with a Student's t-test"),
  TREND(STATISTICAL, "TREND(known_ys, [known_xs], [new_xs], [const])",
      "Returns values along a linear trend"),
  VAR_P(STATISTICAL, "VAR.P(number1, [number2], ...)", "VARP",
      "Calculates variance based on the entire population"),
  VAR_S(STATISTICAL, "VAR.S(number1, [number2], ...)", "VAR",
      "Estimates variance based on a sample"),
  VARA(STATISTICAL, "VARA(value1, [value2], ...)",
      "Estimates variance, including text and logicals"),
  VARPA(STATISTICAL, "VARPA(value1, [value2], ...)",
      "Calculates population variance, including text and logicals"),
  WEIBULL_DIST(STATISTICAL, "WEIBULL.DIST(x, alpha, beta, cumulative)",
      "WEIBULL", "Returns the Weibull distribution", SCALAR),

  // Text

  CHAR(TEXT, "CHAR(number)",
      "Returns the character specified by the code number", SCALAR),
  CLEAN(TEXT, "CLEAN(text)", "Removes all nonprintable characters from text",
      SCALAR),
  CODE(TEXT, "CODE(text)",
      "Returns a numeric code for the first character in a text string",
      SCALAR),
  CONCAT(TEXT, "CONCAT(text1, [text2], ...)",
      "Combines the text from multiple ranges and strings"),
  CONCATENATE(TEXT, "CONCATENATE(text1, [text2], ...)",
      "Joins several text items into one text item", SCALAR),
  DOLLAR(TEXT, "DOLLAR(number, [decimals])",
      "Converts a number to text, using currency format", SCALAR),
  EXACT(TEXT, "EXACT(text1, text2)",
      "Checks to see if two text values are identical", SCALAR),
  FIND(TEXT, "FIND(find_text, within_text, [start_num])",
      "Finds one text value within another (case-sensitive)", SCALAR),
  FIXED(TEXT, "FIXED(number, [decimals], [no_commas])",
      "Formats a number as text with a fixed number of decimals", SCALAR),
  LEFT(TEXT, "LEFT(text, [num_chars])",
      "Returns the leftmost characters from a text value", SCALAR),
  LEFTB(TEXT, "LEFTB(text, [num_bytes])",
      "Returns the leftmost bytes from a text value", SCALAR),
  LEN(TEXT, "LEN(text)", "Returns the number of characters in a text string",
      SCALAR),
  LENB(TEXT, "LENB(text)", "Returns the number of bytes in a text string",
      SCALAR),
  LOWER(TEXT, "LOWER(text)", "Converts text to lowercase", SCALAR),
  MID(TEXT, "MID(text, start_num, num_chars)",
      "Returns characters from the middle of a text string", SCALAR),
  MIDB(TEXT, "MIDB(text, start_num, num_bytes)",
      "Returns bytes from the middle of a text string", SCALAR),
  NUMBERVALUE(TEXT,
      "NUMBERVALUE(text, [decimal_separator], [group_separator])",
      "Converts text to a number in a locale-independent manner", SCALAR),
  PROPER(TEXT, "PROPER(text)",
      "Capitalizes the first letter in each word of a text value", SCALAR),
  REPLACE(TEXT, "REPLACE(old_text, start_num, num_chars, new_text)",
      "Replaces characters within text", SCALAR),
  REPT(TEXT, "REPT(text, number_times)",
      "Repeats text a given number of times", SCALAR),
  RIGHT(TEXT, "RIGHT(text, [num_chars])",
      "Returns the rightmost characters from a text value", SCALAR),
  RIGHTB(TEXT, "RIGHTB(text, [num_bytes])",
      "Returns the rightmost bytes from a text value", SCALAR),
  SEARCH(TEXT, "SEARCH(find_text, within_text, [start_num])",
      "Finds one text value within another (not case-sensitive)", SCALAR),
  SUBSTITUTE(TEXT, "SUBSTITUTE(text, old_text, new_text, [instance_num])",
      "Substitutes new text for old text in a text string", SCALAR),
  T(TEXT, "T(value)", "Returns its argument if it is text, otherwise empty",
      SCALAR),
  TEXT_(TEXT, "TEXT(value, format_text)",
      "Formats a number and converts it to text", SCALAR),
  TEXTAFTER(TEXT,
      "TEXTAFTER(text, delimiter, [instance_num], [match_mode], "
          + "[match_end], [if_not_found])",
      "Returns text that occurs after a given delimiter", SCALAR),
  TEXTBEFORE(TEXT,
      "TEXTBEFORE(text, delimiter, [instance_num], [match_mode], "
          + "[match_end], [if_not_found])",
      "Returns text that occurs before a given delimiter", SCALAR),
  TEXTJOIN(TEXT, "TEXTJOIN(delimiter, ignore_empty, text1, [text2], ...)",
      "Combines text from multiple ranges and strings, with a delimiter"),
  TEXTSPLIT(TEXT,
      "TEXTSPLIT(text, col_delimiter, [row_delimiter], [ignore_empty], "
          + "[match_mode], [pad_with])",
      "Splits text into rows and columns using delimiters"),
  TRIM(TEXT, "TRIM(text)", "Removes extra spaces from text", SCALAR),
  UNICHAR(TEXT, "UNICHAR(number)",
      "Returns the Unicode character for a code point", SCALAR),
  UNICODE(TEXT, "UNICODE(text)",
      "Returns the code point of the first character of the text", SCALAR),
  UPPER(TEXT, "UPPER(text)", "Converts text to uppercase", SCALAR),
  VALUE(TEXT, "VALUE(text)", "Converts a text argument to a number", SCALAR),

  // Logical

  AND(LOGICAL, "AND(logical1, [logical2], ...)",
      "Returns TRUE if all of its arguments are TRUE", LAZY),
  FALSE(LOGICAL, "FALSE()", "Returns the logical value FALSE"),
  IF(LOGICAL, "IF(logical_test, value_if_true, [value_if_false])",
      "Specifies a logical test to perform", LAZY),
  IFERROR(LOGICAL, "IFERROR(value, value_if_error)",
      "Returns a value you specify if a formula evaluates to an error",
      LAZY),
  IFNA(LOGICAL, "IFNA(value, value_if_na)",
      "Returns a value you specify if the expression resolves to #N/A", LAZY),
  IFS(LOGICAL, "IFS(logical_test1, value_if_true1, ...)",
      "Returns the value for the first condition that is TRUE", LAZY),
  NOT(LOGICAL, "NOT(logical)", "Reverses the logic of its argument", LAZY),
  OR(LOGICAL, "OR(logical1, [logical2], ...)",
      "Returns TRUE if any argument is TRUE", LAZY),
  SWITCH(LOGICAL, "SWITCH(expression, value1, result1, ...)",
      "Returns the result that corresponds to the first matching value",
      LAZY),
  TRUE(LOGICAL, "TRUE()", "Returns the logical value TRUE"),
  XOR(LOGICAL, "XOR(logical1, [logical2], ...)",
      "Returns TRUE if an odd number of arguments are TRUE"),

  // Information

  ERROR_TYPE(INFORMATION, "ERROR.TYPE(error_val)",
      "Returns a number corresponding to an error type", SCALAR),
  ISBLANK(INFORMATION, "ISBLANK(value)",
      "Returns TRUE if the value is blank", SCALAR),
  ISERR(INFORMATION, "ISERR(value)",
      "Returns TRUE if the value is any error value except #N/A", SCALAR),
  ISERROR(INFORMATION, "ISERROR(value)",
      "Returns TRUE if the value is any error value", SCALAR),
  ISEVEN(INFORMATION, "ISEVEN(number)",
      "Returns TRUE if the number is even", SCALAR),
  ISLOGICAL(INFORMATION, "ISLOGICAL(value)",
      "Returns TRUE if the value is a logical value", SCALAR),
  ISNA(INFORMATION, "ISNA(value)",
      "Returns TRUE if the value is the #N/A error value", SCALAR),
  ISNONTEXT(INFORMATION, "ISNONTEXT(value)",
      "Returns TRUE if the value is not text", SCALAR),
  ISNUMBER(INFORMATION, "ISNUMBER(value)",
      "Returns TRUE if the value is a number", SCALAR),
  ISODD(INFORMATION, "ISODD(number)", "Returns TRUE if the number is odd",
      SCALAR),
  ISOMITTED(INFORMATION, "ISOMITTED(argument)",
      "Returns TRUE if a lambda argument was omitted", SCALAR),
  ISREF(INFORMATION, "ISREF(value)",
      "Returns TRUE if the value is a reference", LAZY),
  ISTEXT(INFORMATION, "ISTEXT(value)", "Returns TRUE if the value is text",
      SCALAR),
  N(INFORMATION, "N(value)", "Returns a value converted to a number",
      SCALAR),
  NA(INFORMATION, "NA()", "Returns the error value #N/A"),
  TYPE(INFORMATION, "TYPE(value)",
      "Returns a number indicating the data type of a value"),

  // Lookup & reference

  ADDRESS(LOOKUP, "ADDRESS(row_num, column_num, [abs_num], [a1], "
      + "[sheet_text])",
      "Returns a reference as text to a single cell in a worksheet", SCALAR),
  CHOOSE(LOOKUP, "CHOOSE(index_num, value1, [value2], ...)",
      "Chooses a value from a list of values", LAZY),
  COLUMN(LOOKUP, "COLUMN([reference])",
      "Returns the column number of a reference", LAZY),
  COLUMNS(LOOKUP, "COLUMNS(array)",
      "Returns the number of columns in a reference"),
  HLOOKUP(LOOKUP,
      "HLOOKUP(lookup_value, table_array, row_index_num, [range_lookup])",
      "Looks in the top row of an array and returns the value of the "
          + "indicated cell"),
  INDEX(LOOKUP, "INDEX(array, row_num, [column_num])",
      "Uses an index to choose a value from an array"),
  INDIRECT(LOOKUP, "INDIRECT(ref_text, [a1])",
      "Returns the contents of a reference indicated by a text value"),
  LOOKUP_(LOOKUP, "LOOKUP(lookup_value, lookup_vector, [result_vector])",
      "Looks up values in a vector or array"),
  MATCH(LOOKUP, "MATCH(lookup_value, lookup_array, [match_type])",
      "Looks up values in a reference or array"),
  OFFSET(LOOKUP, "OFFSET(reference, rows, cols, [height], [width])",
      "Returns the contents of a range offset from a given reference", LAZY),
  ROW(LOOKUP, "ROW([reference])", "Returns the row number of a reference",
      LAZY),
  ROWS(LOOKUP, "ROWS(array)", "Returns the number of rows in a reference"),
  VLOOKUP(LOOKUP,
      "VLOOKUP(lookup_value, table_array, col_index_num, [range_lookup])",
      "Looks in the first column of an array and moves across the row to "
          + "return the value of a cell"),
  XLOOKUP(LOOKUP,
      "XLOOKUP(lookup_value, lookup_array, return_array, [if_not_found], "
          + "[match_mode], [search_mode])",
      "Searches a range or an array, and returns an item corresponding to "
          + "the first match it finds"),
  XMATCH(LOOKUP,
      "XMATCH(lookup_value, lookup_array, [match_mode], [search_mode])",
      "Returns the relative position of an item in an array or range"),

  // Dynamic array

  CHOOSECOLS(ARRAY, "CHOOSECOLS(array, col_num1, [col_num2], ...)",
      "Returns the specified columns from an array"),
  CHOOSEROWS(ARRAY, "CHOOSEROWS(array, row_num1, [row_num2], ...)",
      "Returns the specified rows from an array"),
  DROP(ARRAY, "DROP(array, rows, [columns])",
      "Excludes a specified number of rows or columns from the start or end "
          + "of an array"),
  EXPAND(ARRAY, "EXPAND(array, rows, [columns], [pad_with])",
      "Expands or pads an array to specified row and column dimensions"),
  FILTER(ARRAY, "FILTER(array, include, [if_empty])",
      "Filters a range of data based on criteria you define"),
  HSTACK(ARRAY, "HSTACK(array1, [array2], ...)",
      "Appends arrays horizontally and in sequence to return a larger array"),
  RANDARRAY(ARRAY,
      "RANDARRAY([rows], [columns], [min], [max], [whole_number])",
      "Returns an array of random numbers", VOLATILE),
  SEQUENCE(ARRAY, "SEQUENCE(rows, [columns], [start], [step])",
      "Generates a list of sequential numbers in an array"),
  SORT(ARRAY, "SORT(array, [sort_index], [sort_order], [by_col])",
      "Sorts the contents of a range or array"),
  SORTBY(ARRAY, "SORTBY(array, by_array1, [sort_order1], ...)",
      "Sorts the contents of a range or array based on the values in a "
          + "corresponding range or array"),
  TAKE(ARRAY, "TAKE(array, rows, [columns])",
      "Returns a specified number of contiguous rows or columns from the "
          + "start or end of an array"),
  TOCOL(ARRAY, "TOCOL(array, [ignore], [scan_by_column])",
      "Returns the array in a single column"),
  TOROW(ARRAY, "TOROW(array, [ignore], [scan_by_column])",
      "Returns the array in a single row"),
  TRANSPOSE(ARRAY, "TRANSPOSE(array)", "Returns the transpose of an array"),
  UNIQUE(ARRAY, "UNIQUE(array, [by_col], [exactly_once])",
      "Returns a list of unique values in a list or range"),
  VSTACK(ARRAY, "VSTACK(array1, [array2], ...)",
      "Appends arrays vertically and in sequence to return a larger array"),
  WRAPCOLS(ARRAY, "WRAPCOLS(vector, wrap_count, [pad_with])",
      "Wraps the provided row or column of values by columns"),
  WRAPROWS(ARRAY, "WRAPROWS(vector, wrap_count, [pad_with])",
      "Wraps the provided row or column of values by rows"),

  // Lambda

  BYCOL(LAMBDA, "BYCOL(array, lambda)",
      "Applies a lambda to each column and returns an array of the results"),
  BYROW(LAMBDA, "BYROW(array, lambda)",
      "Applies a lambda to each row and returns an array of the results"),
  LAMBDA_(LAMBDA, "LAMBDA([parameter1], ..., calculation)",
      "Creates a custom, reusable function", SYNTAX),
  LET(LAMBDA, "LET(name1, name_value1, calculation_or_name2, ...)",
      "Assigns names to calculation results", SYNTAX),
  MAKEARRAY(LAMBDA, "MAKEARRAY(rows, cols, lambda)",
      "Returns a calculated array of a specified row and column size, by "
          + "applying a lambda"),
  MAP(LAMBDA, "MAP(array1, lambda_or_array2, ...)",
      "Returns an array formed by mapping each value in the arrays to a new "
          + "value by applying a lambda"),
  REDUCE(LAMBDA, "REDUCE([initial_value], array, lambda)",
      "Reduces an array to an accumulated value by applying a lambda to "
          + "each value"),
  SCAN(LAMBDA, "SCAN([initial_value], array, lambda)",
      "Scans an array by applying a lambda to each value and returns an "
          + "array of each intermediate value"),

  // Date & time

  DATE(DATE_TIME, "DATE(year, month, day)",
      "Returns the serial number of a particular date", SCALAR),
  DATEDIF(DATE_TIME, "DATEDIF(start_date, end_date, unit)",
      "Calculates the number of days, months, or years between two dates",
      SCALAR),
  DATEVALUE(DATE_TIME, "DATEVALUE(date_text)",
      "Converts a date in the form of text to a serial number", SCALAR),
  DAY(DATE_TIME, "DAY(serial_number)",
      "Converts a serial number to a day of the month", SCALAR),
  DAYS(DATE_TIME, "DAYS(end_date, start_date)",
      "Returns the number of days between two dates", SCALAR),
  DAYS360(DATE_TIME, "DAYS360(start_date, end_date, [method])",
      "Calculates the number of days between two dates based on a 360-day "
          + "year",
      SCALAR),
  EDATE(DATE_TIME, "EDATE(start_date, months)",
      "Returns the serial number of the date that is the indicated number "
          + "of months before or after the start date",
      SCALAR),
  EOMONTH(DATE_TIME, "EOMONTH(start_date, months)",
      "Returns the serial number of the last day of the month before or "
          + "after a specified number of months",
      SCALAR),
  HOUR(DATE_TIME, "HOUR(serial_number)",
      "Converts a serial number to an hour", SCALAR),
  ISOWEEKNUM(DATE_TIME, "ISOWEEKNUM(date)",
      "Returns the ISO week number of the year for a given date", SCALAR),
  MINUTE(DATE_TIME, "MINUTE(serial_number)",
      "Converts a serial number to a minute", SCALAR),
  MONTH(DATE_TIME, "MONTH(serial_number)",
      "Converts a serial number to a month", SCALAR),
  NETWORKDAYS(DATE_TIME, "NETWORKDAYS(start_date, end_date, [holidays])",
      "Returns the number of whole workdays between two dates"),
  NOW(DATE_TIME, "NOW()",
      "Returns the serial number of the current date and time", VOLATILE),
  SECOND(DATE_TIME, "SECOND(serial_number)",
      "Converts a serial number to a second", SCALAR),
  TIME(DATE_TIME, "TIME(hour, minute, second)",
      "Returns the serial number of a particular time", SCALAR),
  TIMEVALUE(DATE_TIME, "TIMEVALUE(time_text)",
      "Converts a time in the form of text to a serial number", SCALAR),
  TODAY(DATE_TIME, "TODAY()", "Returns the serial number of today's date",
      VOLATILE),
  WEEKDAY(DATE_TIME, "WEEKDAY(serial_number, [return_type])",
      "Converts a serial number to a day of the week", SCALAR),
  WEEKNUM(DATE_TIME, "WEEKNUM(serial_number, [return_type])",
      "Returns the week number of the year", SCALAR),
  WORKDAY(DATE_TIME, "WORKDAY(start_date, days, [holidays])",
      "Returns the serial number of the date before or after a specified "
          + "number of workdays"),
  YEAR(DATE_TIME, "YEAR(serial_number)",
      "Converts a serial number to a year", SCALAR),
  YEARFRAC(DATE_TIME, "YEARFRAC(start_date, end_date, [basis])",
      "Returns the year fraction representing the number of whole days "
          + "between two dates",
      SCALAR),

  // Financial

  CUMIPMT(FINANCIAL,
      "CUMIPMT(rate, nper, pv, start_period, end_period, type)",
      "Returns the cumulative interest paid between two periods", SCALAR),
  CUMPRINC(FINANCIAL,
      "CUMPRINC(rate, nper, pv, start_period, end_period, type)",
      "Returns the cumulative principal paid on a loan between two periods",
      SCALAR),
  DB(FINANCIAL, "DB(cost, salvage, life, period, [month])",
      "Returns the depreciation of an asset using the fixed-declining "
          + "balance method",
      SCALAR),
  DDB(FINANCIAL, "DDB(cost, salvage, life, period, [factor])",
      "Returns the depreciation of an asset using the double-declining "
          + "balance method",
      SCALAR),
  DISC(FINANCIAL, "DISC(settlement, maturity, pr, redemption, [basis])",
      "Returns the discount rate for a security", SCALAR),
  DOLLARDE(FINANCIAL, "DOLLARDE(fractional_dollar, fraction)",
      "Converts a dollar price expressed as a fraction into a decimal "
          + "number",
      SCALAR),
  DOLLARFR(FINANCIAL, "DOLLARFR(decimal_dollar, fraction)",
      "Converts a dollar price expressed as a decimal number into a "
          + "fraction",
      SCALAR),
  EFFECT(FINANCIAL, "EFFECT(nominal_rate, npery)",
      "Returns the effective annual interest rate", SCALAR),
  FV(FINANCIAL, "FV(rate, nper, pmt, [pv], [type])",
      "Returns the future value of an investment", SCALAR),
  FVSCHEDULE(FINANCIAL, "FVSCHEDULE(principal, schedule)",
      "Returns the future value of an initial principal after applying a "
          + "series of compound interest rates"),
  INTRATE(FINANCIAL,
      "INTRATE(settlement, maturity, investment, redemption, [basis])",
      "Returns the interest rate for a fully invested security", SCALAR),
  IPMT(FINANCIAL, "IPMT(rate, per, nper, pv, [fv], [type])",
      "Returns the interest payment for an investment for a given period",
      SCALAR),
  IRR(FINANCIAL, "IRR(values, [guess])",
      "Returns the internal rate of return for a series of cash flows"),
  MIRR(FINANCIAL, "MIRR(values, finance_rate, reinvest_rate)",
      "Returns the internal rate of return where positive and negative cash "
          + "flows are financed at different rates"),
  NOMINAL(FINANCIAL, "NOMINAL(effect_rate, npery)",
      "Returns the annual nominal interest rate", SCALAR),
  NPER(FINANCIAL, "NPER(rate, pmt, pv, [fv], [type])",
      "Returns the number of periods for an investment", SCALAR),
  NPV(FINANCIAL, "NPV(rate, value1, [value2], ...)",
      "Returns the net present value of an investment based on a series of "
          + "periodic cash flows and a discount rate"),
  PDURATION(FINANCIAL, "PDURATION(rate, pv, fv)",
      "Returns the number of periods required by an investment to reach a "
          + "specified value",
      SCALAR),
  PMT(FINANCIAL, "PMT(rate, nper, pv, [fv], [type])",
      "Returns the periodic payment for an annuity", SCALAR),
  PPMT(FINANCIAL, "PPMT(rate, per, nper, pv, [fv], [type])",
      "Returns the payment on the principal for an investment for a given "
          + "period",
      SCALAR),
  PV(FINANCIAL, "PV(rate, nper, pmt, [fv], [type])",
      "Returns the present value of an investment", SCALAR),
  RATE(FINANCIAL, "RATE(nper, pmt, pv, [fv], [type], [guess])",
      "Returns the interest rate per period of an annuity", SCALAR),
  RRI(FINANCIAL, "RRI(nper, pv, fv)",
      "Returns an equivalent interest rate for the growth of an investment",
      SCALAR),
  SLN(FINANCIAL, "SLN(cost, salvage, life)",
      "Returns the straight-line depreciation of an asset for one period",
      SCALAR),
  SYD(FINANCIAL, "SYD(cost, salvage, life, per)",
      "Returns the sum-of-years' digits depreciation of an asset for a "
          + "specified period",
      SCALAR),
  VDB(FINANCIAL,
      "VDB(cost, salvage, life, start_period, end_period, [factor], "
          + "[no_switch])",
      "Returns the depreciation of an asset for a specified or partial "
          + "period using a declining balance method",
      SCALAR),
  XIRR(FINANCIAL, "XIRR(values, dates, [guess])",
      "Returns the internal rate of return for a schedule of cash flows that "
          + "is not necessarily periodic"),
  XNPV(FINANCIAL, "XNPV(rate, values, dates)",
      "Returns the net present value for a schedule of cash flows that is "
          + "not necessarily periodic"),

  // Engineering

  BIN2DEC(ENGINEERING, "BIN2DEC(number)",
      "Converts a binary number to decimal", SCALAR),
  BIN2HEX(ENGINEERING, "BIN2HEX(number, [places])",
      "Converts a binary number to hexadecimal", SCALAR),
  BIN2OCT(ENGINEERING, "BIN2OCT(number, [places])",
      "Converts a binary number to octal", SCALAR),
  BITAND(ENGINEERING, "BITAND(number1, number2)",
      "Returns a bitwise 'and' of two numbers", SCALAR),
  BITLSHIFT(ENGINEERING, "BITLSHIFT(number, shift_amount)",
      "Returns a number shifted left by shift_amount bits", SCALAR),
  BITOR(ENGINEERING, "BITOR(number1, number2)",
      "Returns a bitwise 'or' of two numbers", SCALAR),
  BITRSHIFT(ENGINEERING, "BITRSHIFT(number, shift_amount)",
      "Returns a number shifted right by shift_amount bits", SCALAR),
  BITXOR(ENGINEERING, "BITXOR(number1, number2)",
      "Returns a bitwise 'exclusive or' of two numbers", SCALAR),
  COMPLEX(ENGINEERING, "COMPLEX(real_num, i_num, [suffix])",
      "Converts real and imaginary coefficients into a complex number",
      SCALAR),
  DEC2BIN(ENGINEERING, "DEC2BIN(number, [places])",
      "Converts a decimal number to binary", SCALAR),
  DEC2HEX(ENGINEERING, "DEC2HEX(number, [places])",
      "Converts a decimal number to hexadecimal", SCALAR),
  DEC2OCT(ENGINEERING, "DEC2OCT(number, [places])",
      "Converts a decimal number to octal", SCALAR),
  DELTA(ENGINEERING, "DELTA(number1, [number2])",
      "Tests whether two values are equal", SCALAR),
  ERF(ENGINEERING, "ERF(lower_limit, [upper_limit])",
      "Returns the error function", SCALAR),
  ERF_PRECISE(ENGINEERING, "ERF.PRECISE(x)", "Returns the error function",
      SCALAR),
  ERFC(ENGINEERING, "ERFC(x)",
      "Returns the complementary error function", SCALAR),
  ERFC_PRECISE(ENGINEERING, "ERFC.PRECISE(x)",
      "Returns the complementary error function", SCALAR),
  GESTEP(ENGINEERING, "GESTEP(number, [step])",
      "Tests whether a number is greater than a threshold value", SCALAR),
  HEX2BIN(ENGINEERING, "HEX2BIN(number, [places])",
      "Converts a hexadecimal number to binary", SCALAR),
  HEX2DEC(ENGINEERING, "HEX2DEC(number)",
      "Converts a hexadecimal number to decimal", SCALAR),
  HEX2OCT(ENGINEERING, "HEX2OCT(number, [places])",
      "Converts a hexadecimal number to octal", SCALAR),
  IMABS(ENGINEERING, "IMABS(inumber)",
      "Returns the absolute value (modulus) of a complex number", SCALAR),
  IMAGINARY(ENGINEERING, "IMAGINARY(inumber)",
      "Returns the imaginary coefficient of a complex number", SCALAR),
  IMARGUMENT(ENGINEERING, "IMARGUMENT(inumber)",
      "Returns the argument theta, an angle expressed in radians", SCALAR),
  IMCONJUGATE(ENGINEERING, "IMCONJUGATE(inumber)",
      "Returns the complex conjugate of a complex number", SCALAR),
  IMCOS(ENGINEERING, "IMCOS(inumber)",
      "Returns the cosine of a complex number", SCALAR),
  IMCOSH(ENGINEERING, "IMCOSH(inumber)",
      "Returns the hyperbolic cosine of a complex number", SCALAR),
  IMCOT(ENGINEERING, "IMCOT(inumber)",
      "Returns the cotangent of a complex number", SCALAR),
  IMCSC(ENGINEERING, "IMCSC(inumber)",
      "Returns the cosecant of a complex number", SCALAR),
  IMDIV(ENGINEERING, "IMDIV(inumber1, inumber2)",
      "Returns the quotient of two complex numbers", SCALAR),
  IMEXP(ENGINEERING, "IMEXP(inumber)",
      "Returns the exponential of a complex number", SCALAR),
  IMLN(ENGINEERING, "IMLN(inumber)",
      "Returns the natural logarithm of a complex number", SCALAR),
  IMLOG10(ENGINEERING, "IMLOG10(inumber)",
      "Returns the base-10 logarithm of a complex number", SCALAR),
  IMLOG2(ENGINEERING, "IMLOG2(inumber)",
      "Returns the base-2 logarithm of a complex number", SCALAR),
  IMPOWER(ENGINEERING, "IMPOWER(inumber, number)",
      "Returns a complex number raised to an integer power", SCALAR),
  IMPRODUCT(ENGINEERING, "IMPRODUCT(inumber1, [inumber2], ...)",
      "Returns the product of complex numbers"),
  IMREAL(ENGINEERING, "IMREAL(inumber)",
      "Returns the real coefficient of a complex number", SCALAR),
  IMSEC(ENGINEERING, "IMSEC(inumber)",
      "Returns the secant of a complex number", SCALAR),
  IMSIN(ENGINEERING, "IMSIN(inumber)",
      "Returns the sine of a complex number", SCALAR),
  IMSINH(ENGINEERING, "IMSINH(inumber)",
      "Returns the hyperbolic sine of a complex number", SCALAR),
  IMSQRT(ENGINEERING, "IMSQRT(inumber)",
      "Returns the square root of a complex number", SCALAR),
  IMSUB(ENGINEERING, "IMSUB(inumber1, inumber2)",
      "Returns the difference between two complex numbers", SCALAR),
  IMSUM(ENGINEERING, "IMSUM(inumber1, [inumber2], ...)", "IMADD",
      "Returns the sum of complex numbers"),
  IMTAN(ENGINEERING, "IMTAN(inumber)",
      "Returns the tangent of a complex number", SCALAR),
  OCT2BIN(ENGINEERING, "OCT2BIN(number, [places])",
      "Converts an octal number to binary", SCALAR),
  OCT2DEC(ENGINEERING, "OCT2DEC(number)",
      "Converts an octal number to decimal", SCALAR),
  OCT2HEX(ENGINEERING, "OCT2HEX(number, [places])",
      "Converts an octal number to hexadecimal", SCALAR),

  // Database

  DAVERAGE(DATABASE, "DAVERAGE(database, field, criteria)",
      "Returns the average of selected database entries"),
  DCOUNT(DATABASE, "DCOUNT(database, [field], criteria)",
      "Counts the cells that contain numbers in a database"),
  DCOUNTA(DATABASE, "DCOUNTA(database, [field], criteria)",
      "Counts nonblank cells in a database"),
  DGET(DATABASE, "DGET(database, field, criteria)",
      "Extracts from a database a single record that matches the specified "
          + "criteria"),
  DMAX(DATABASE, "DMAX(database, field, criteria)",
      "Returns the maximum value from selected database entries"),
  DMIN(DATABASE, "DMIN(database, field, criteria)",
      "Returns the minimum value from selected database entries"),
  DPRODUCT(DATABASE, "DPRODUCT(database, field, criteria)",
      "Multiplies the values in a field of records that match the criteria"),
  DSTDEV(DATABASE, "DSTDEV(database, field, criteria)",
      "Estimates the standard deviation based on a sample of selected "
          + "database entries"),
  DSTDEVP(DATABASE, "DSTDEVP(database, field, criteria)",
      "Calculates the standard deviation based on the entire population of "
          + "selected database entries"),
  DSUM(DATABASE, "DSUM(database, field, criteria)",
      "Adds the numbers in the field column of records in the database that "
          + "match the criteria"),
  DVAR(DATABASE, "DVAR(database, field, criteria)",
      "Estimates variance based on a sample from selected database entries"),
  DVARP(DATABASE, "DVARP(database, field, criteria)",
      "Calculates variance based on the entire population of selected "
          + "database entries");

  // lint:endSorted

  /** Value of {@link #maxArgs} for a function that takes any number of
   * arguments. */
  public static final int VARIADIC = -1;

  /** Function name, e.g. "STDEV.S". */
  public final String fnName;

  /** Legacy name by which the function may also be called, e.g. "STDEV", or
   * null. */
  public final @Nullable String alias;

  public final Category category;

  /** Syntax hint, e.g. "ROUND(number, num_digits)". */
  public final String syntax;

  public final String description;

  public final int minArgs;

  /** Maximum number of arguments, or {@link #VARIADIC}. */
  public final int maxArgs;

  public final ArgMode argMode;

  /** Whether the function is applied element-wise to array arguments. */
  public final boolean scalar;

  /** Whether the function may return a different value each time. */
  public final boolean isVolatile;

  /** Map of all functions, keyed by name and alias. */
  public static final ImmutableMap<String, BuiltIn> BY_NAME;

  static {
    final ImmutableMap.Builder<String, BuiltIn> b = ImmutableMap.builder();
    for (BuiltIn builtIn : values()) {
      b.put(builtIn.fnName, builtIn);
      if (builtIn.alias != null) {
        b.put(builtIn.alias, builtIn);
      }
    }
    BY_NAME = b.buildOrThrow();
  }

  BuiltIn(Category category, String syntax, String description,
      Trait... traits) {
    this(category, syntax, null, description, traits);
  }

  BuiltIn(Category category, String syntax, @Nullable String alias,
      String description, Trait... traits) {
    this.category = requireNonNull(category, "category");
    this.syntax = requireNonNull(syntax, "syntax");
    this.alias = alias;
    this.description = requireNonNull(description, "description");
    final int paren = syntax.indexOf('(');
    checkArgument(paren > 0 && syntax.endsWith(")"), "bad syntax %s", syntax);
    this.fnName = syntax.substring(0, paren);
    final List<String> params =
        splitParams(syntax.substring(paren + 1, syntax.length() - 1));
    int min = 0;
    int max = 0;
    boolean variadic = false;
    for (String param : params) {
      if (param.equals("...")) {
        variadic = true;
      } else {
        ++max;
        if (!param.startsWith("[")) {
          ++min;
        }
      }
    }
    this.minArgs = min;
    this.maxArgs = variadic ? VARIADIC : max;
    final ImmutableSet<Trait> traitSet = ImmutableSet.copyOf(traits);
    this.argMode =
        traitSet.contains(SYNTAX) ? ArgMode.SYNTAX
            : traitSet.contains(LAZY) ? ArgMode.LAZY
            : ArgMode.EAGER;
    this.scalar = traitSet.contains(SCALAR);
    this.isVolatile = traitSet.contains(VOLATILE);
  }

  /** Splits a parameter list at commas that are not inside brackets. */
  private static List<String> splitParams(String s) {
    final List<String> list = new ArrayList<>();
    if (s.trim().isEmpty()) {
      return list;
    }
    int depth = 0;
    int start = 0;
    for (int i = 0; i < s.length(); i++) {
      switch (s.charAt(i)) {
      case '[':
        ++depth;
        break;
      case ']':
        --depth;
        break;
      case ',':
        if (depth == 0) {
          list.add(s.substring(start, i).trim());
          start = i + 1;
        }
        break;
      default:
        break;
      }
    }
    list.add(s.substring(start).trim());
    return list;
  }

  /** Returns whether a call with {@code n} arguments is valid. */
  public boolean acceptsArgCount(int n) {
    return n >= minArgs && (maxArgs == VARIADIC || n <= maxArgs);
  }

  /** Returns all functions in a given category. */
  public static List<BuiltIn> byCategory(Category category) {
    final List<BuiltIn> list = new ArrayList<>();
    Arrays.stream(values())
        .filter(b -> b.category == category)
        .forEach(list::add);
    return list;
  }
}

// End BuiltIn.java
