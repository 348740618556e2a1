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

import java.util.function.DoubleUnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Numeric root-finding.
 *
 * <p>Methods return {@link Double#NaN} if they do not converge within the
 * iteration limit; callers convert that to {@code #NUM!}.
 */
abstract class RootFinder {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(RootFinder.class);

  /** Absolute tolerance on the function value. */
  static final double TOLERANCE = 1E-10;

  private RootFinder() {}

  /**
   * Finds a root of {@code f} by Newton's method starting from {@code guess},
   * using a numeric derivative. If Newton's method fails, searches for a
   * bracket around the guess and bisects it.
   */
  static double solve(DoubleUnaryOperator f, double guess, int maxIter) {
    final double x = newton(f, guess, maxIter);
    if (!Double.isNaN(x)) {
      return x;
    }
    // Expand outward from the guess until the sign changes.
    double step = Math.max(Math.abs(guess), 0.01) / 2D;
    for (int i = 0; i < maxIter; i++) {
      final double lo = guess - step;
      final double hi = guess + step;
      final double flo = f.applyAsDouble(lo);
      final double fhi = f.applyAsDouble(hi);
      final double fg = f.applyAsDouble(guess);
      if (Double.isFinite(flo) && Double.isFinite(fg) && flo * fg <= 0) {
        return bisect(f, lo, guess, maxIter);
      }
      if (Double.isFinite(fhi) && Double.isFinite(fg) && fhi * fg <= 0) {
        return bisect(f, guess, hi, maxIter);
      }
      step *= 2D;
    }
    LOGGER.debug("No root found from guess {} after {} iterations",
        guess, maxIter);
    return Double.NaN;
  }

  /** Finds a root of {@code f} by Newton's method, or returns NaN. */
  static double newton(DoubleUnaryOperator f, double guess, int maxIter) {
    double x = guess;
    for (int i = 0; i < maxIter; i++) {
      final double fx = f.applyAsDouble(x);
      if (!Double.isFinite(fx)) {
        return Double.NaN;
      }
      if (Math.abs(fx) < TOLERANCE) {
        return x;
      }
      final double h = Math.max(Math.abs(x) * 1E-7, 1E-10);
      final double dfx = (f.applyAsDouble(x + h) - f.applyAsDouble(x - h))
          / (2D * h);
      if (dfx == 0D || !Double.isFinite(dfx)) {
        return Double.NaN;
      }
      final double next = x - fx / dfx;
      if (!Double.isFinite(next)) {
        return Double.NaN;
      }
      if (Math.abs(next - x) < TOLERANCE * Math.max(1D, Math.abs(x))) {
        return Math.abs(f.applyAsDouble(next)) < 1E-6 ? next : Double.NaN;
      }
      x = next;
    }
    return Double.NaN;
  }

  /**
   * Finds a root of {@code f} in {@code [lo, hi]} by bisection. The function
   * must have opposite signs (or be zero) at the two ends; otherwise returns
   * NaN.
   */
  static double bisect(DoubleUnaryOperator f, double lo, double hi,
      int maxIter) {
    double flo = f.applyAsDouble(lo);
    final double fhi = f.applyAsDouble(hi);
    if (flo == 0D) {
      return lo;
    }
    if (fhi == 0D) {
      return hi;
    }
    if (flo * fhi > 0) {
      return Double.NaN;
    }
    final int n = Math.max(maxIter, 200);
    for (int i = 0; i < n; i++) {
      final double mid = (lo + hi) / 2D;
      final double fmid = f.applyAsDouble(mid);
      if (fmid == 0D || (hi - lo) / 2D < 1E-15 * Math.max(1D, Math.abs(mid))) {
        return mid;
      }
      if (flo * fmid < 0) {
        hi = mid;
      } else {
        lo = mid;
        flo = fmid;
      }
    }
    return (lo + hi) / 2D;
  }

  /**
   * Inverts an increasing function on {@code [lo, infinity)}: finds
   * {@code x} such that {@code cdf(x) = p}, doubling the upper bound until
   * it brackets the answer.
   */
  static double inverse(DoubleUnaryOperator cdf, double p, double lo,
      int maxIter) {
    double hi = Math.max(1D, lo + 1D);
    for (int i = 0; i < 1100 && cdf.applyAsDouble(hi) < p; i++) {
      hi *= 2D;
    }
    return bisect(x -> cdf.applyAsDouble(x) - p, lo, hi, maxIter);
  }
}

// End RootFinder.java
