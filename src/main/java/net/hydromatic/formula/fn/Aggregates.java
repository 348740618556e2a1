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

import static net.hydromatic.formula.eval.ErrorKind.VALUE;
import static net.hydromatic.formula.eval.Value.error;

import com.google.common.primitives.Doubles;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import net.hydromatic.formula.eval.ArrayValue;
import net.hydromatic.formula.eval.Closure;
import net.hydromatic.formula.eval.Value;
import net.hydromatic.formula.eval.Values;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Collects the numbers that an aggregate function such as {@code SUM} or
 * {@code STDEV.S} operates on.
 *
 * <p>An argument given directly is coerced: numeric text is parsed, a
 * boolean is 1 or 0, an omitted argument is 0, and other text is
 * {@code #VALUE!}. Inside an array (or range), only numbers count, unless the
 * mode is {@link Mode#ALL}, in which case text counts as 0 and booleans as 1
 * or 0. Blank cells never count. An error anywhere is the result.
 */
final class Aggregates {
  /** Numbers collected so far; valid only if {@link #error} is null. */
  private double[] values = new double[16];
  private int count;
  private Value.@Nullable Scalar error;

  private Aggregates() {}

  /** How values inside arrays are treated. */
  enum Mode {
    /** Only numbers count. */
    NUMBERS,
    /** Numbers count; text counts as 0; booleans count as 1 or 0. */
    ALL
  }

  /** Collects numbers from a list of arguments. */
  static Aggregates of(List<? extends Value> args, Mode mode) {
    final Aggregates a = new Aggregates();
    for (Value arg : args) {
      a.add(arg, mode);
    }
    return a;
  }

  /** Collects numbers from a single array argument, such as the
   * {@code array} argument of {@code LARGE}. */
  static Aggregates ofArray(Value arg) {
    final Aggregates a = new Aggregates();
    if (arg instanceof ArrayValue) {
      a.add(arg, Mode.NUMBERS);
    } else {
      a.add(ArrayValue.of(Values.first(arg)), Mode.NUMBERS);
    }
    return a;
  }

  private void add(Value arg, Mode mode) {
    if (error != null) {
      return;
    }
    if (arg instanceof Closure) {
      error = error(VALUE);
    } else if (arg instanceof ArrayValue) {
      for (Value.Scalar s : ((ArrayValue) arg).cells()) {
        switch (s.kind()) {
        case NUMBER:
          add(((Value.Num) s).value);
          break;
        case ERROR:
          error = s;
          return;
        case TEXT:
          if (mode == Mode.ALL) {
            add(0D);
          }
          break;
        case BOOLEAN:
          if (mode == Mode.ALL) {
            add(((Value.Bool) s).value ? 1D : 0D);
          }
          break;
        default:
          break;
        }
      }
    } else {
      final Value.Scalar n = Values.toNumber((Value.Scalar) arg);
      if (n instanceof Value.Num) {
        add(((Value.Num) n).value);
      } else {
        error = n;
      }
    }
  }

  private void add(double d) {
    if (count == values.length) {
      values = Arrays.copyOf(values, count * 2);
    }
    values[count++] = d;
  }

  /** Returns whether an error was found. */
  boolean failed() {
    return error != null;
  }

  /** Returns the error found.
   *
   * @throws IllegalStateException if there is no error */
  Value.Scalar failure() {
    if (error == null) {
      throw new IllegalStateException("no error");
    }
    return error;
  }

  int count() {
    return count;
  }

  /** Returns the numbers, in the order they were found. */
  double[] values() {
    return Arrays.copyOf(values, count);
  }

  /** Returns the numbers, sorted ascending. */
  double[] sorted() {
    final double[] sorted = values();
    Arrays.sort(sorted);
    return sorted;
  }

  List<Double> list() {
    return new ArrayList<>(Doubles.asList(values()));
  }

  double sum() {
    double sum = 0D;
    for (int i = 0; i < count; i++) {
      sum += values[i];
    }
    return sum;
  }

  double product() {
    double product = 1D;
    for (int i = 0; i < count; i++) {
      product *= values[i];
    }
    return product;
  }

  double mean() {
    return sum() / count;
  }

  /** Returns the sum of squared deviations from the mean. */
  double devSq() {
    final double mean = mean();
    double sum = 0D;
    for (int i = 0; i < count; i++) {
      final double d = values[i] - mean;
      sum += d * d;
    }
    return sum;
  }

  /** Returns the variance; {@code sample} is true for the sample variance
   * (dividing by n - 1), false for the population variance. Returns NaN if
   * there are too few values. */
  double variance(boolean sample) {
    final int n = sample ? count - 1 : count;
    if (n <= 0) {
      return Double.NaN;
    }
    return devSq() / n;
  }

  /** Returns the median of sorted values. */
  static double median(double[] sorted) {
    final int n = sorted.length;
    return n % 2 == 1 ? sorted[n / 2]
        : (sorted[n / 2 - 1] + sorted[n / 2]) / 2D;
  }

  /** Returns the {@code k}th percentile of sorted values, interpolating
   * linearly; {@code 0 <= k <= 1}. */
  static double percentileInc(double[] sorted, double k) {
    final double rank = k * (sorted.length - 1);
    final int lo = (int) Math.floor(rank);
    final int hi = Math.min(lo + 1, sorted.length - 1);
    return sorted[lo] + (rank - lo) * (sorted[hi] - sorted[lo]);
  }

  /** Returns the {@code k}th percentile of sorted values, exclusive of 0
   * and 1; returns NaN if {@code k} is out of range. */
  static double percentileExc(double[] sorted, double k) {
    final int n = sorted.length;
    final double rank = k * (n + 1);
    if (rank < 1 || rank > n) {
      return Double.NaN;
    }
    final int lo = (int) Math.floor(rank);
    final int hi = Math.min(lo + 1, n);
    return sorted[lo - 1] + (rank - lo) * (sorted[hi - 1] - sorted[lo - 1]);
  }
}

// End Aggregates.java
