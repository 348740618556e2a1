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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Least-squares fit of a linear model
 * {@code y = m1 * x1 + ... + mk * xk + b}.
 *
 * <p>If the model has a constant, the variables are centered on their means
 * before the normal equations are solved, and {@code b} is recovered from
 * the means. Otherwise {@code b} is zero.
 */
final class LinearModel {
  /** Pivot, relative to the largest diagonal element, below which the
   * normal equations are considered singular. */
  private static final double SINGULAR = 1E-10;

  /** Slopes, one per independent variable, in variable order. */
  final double[] slopes;
  final double intercept;
  final boolean constant;
  /** Number of observations. */
  final int n;
  /** Residual sum of squares. */
  final double ssResid;
  /** Regression sum of squares. */
  final double ssReg;
  /** Standard errors of the slopes, before scaling by the standard error
   * of y. */
  private final double[] slopeFactors;
  private final double interceptFactor;

  private LinearModel(double[] slopes, double intercept, boolean constant,
      int n, double ssResid, double ssReg, double[] slopeFactors,
      double interceptFactor) {
    this.slopes = slopes;
    this.intercept = intercept;
    this.constant = constant;
    this.n = n;
    this.ssResid = ssResid;
    this.ssReg = ssReg;
    this.slopeFactors = slopeFactors;
    this.interceptFactor = interceptFactor;
  }

  /**
   * Fits a model to observations; {@code x[i][j]} is the value of variable
   * {@code j} in observation {@code i}.
   *
   * <p>Returns null if there are fewer observations than parameters, or if
   * the variables are collinear.
   */
  static @Nullable LinearModel fit(double[] y, double[][] x,
      boolean constant) {
    final int n = y.length;
    if (n == 0) {
      return null;
    }
    final int k = x[0].length;
    if (k == 0 || n < k + (constant ? 1 : 0)) {
      return null;
    }
    final double[] meanX = new double[k];
    double meanY = 0D;
    if (constant) {
      for (int i = 0; i < n; i++) {
        for (int j = 0; j < k; j++) {
          meanX[j] += x[i][j];
        }
        meanY += y[i];
      }
      for (int j = 0; j < k; j++) {
        meanX[j] /= n;
      }
      meanY /= n;
    }

    // Augmented matrix [S | I | s], where S is the (centered) cross-product
    // matrix of the variables and s their cross-products with y.
    final double[][] m = new double[k][2 * k + 1];
    for (int i = 0; i < n; i++) {
      final double dy = y[i] - meanY;
      for (int r = 0; r < k; r++) {
        final double dr = x[i][r] - meanX[r];
        for (int c = 0; c < k; c++) {
          m[r][c] += dr * (x[i][c] - meanX[c]);
        }
        m[r][2 * k] += dr * dy;
      }
    }
    double scale = 0D;
    for (int r = 0; r < k; r++) {
      m[r][k + r] = 1D;
      scale = Math.max(scale, Math.abs(m[r][r]));
    }

    // Gauss-Jordan elimination with partial pivoting
    for (int col = 0; col < k; col++) {
      int pivot = col;
      for (int r = col + 1; r < k; r++) {
        if (Math.abs(m[r][col]) > Math.abs(m[pivot][col])) {
          pivot = r;
        }
      }
      if (!(Math.abs(m[pivot][col]) > SINGULAR * scale)) {
        return null;
      }
      final double[] t = m[pivot];
      m[pivot] = m[col];
      m[col] = t;
      final double d = m[col][col];
      for (int c = 0; c <= 2 * k; c++) {
        m[col][c] /= d;
      }
      for (int r = 0; r < k; r++) {
        final double f = m[r][col];
        if (r != col && f != 0D) {
          for (int c = 0; c <= 2 * k; c++) {
            m[r][c] -= f * m[col][c];
          }
        }
      }
    }

    final double[] slopes = new double[k];
    final double[] slopeFactors = new double[k];
    double intercept = meanY;
    double interceptFactor = 1D / n;
    for (int j = 0; j < k; j++) {
      slopes[j] = m[j][2 * k];
      slopeFactors[j] = Math.sqrt(Math.max(m[j][k + j], 0D));
      intercept -= slopes[j] * meanX[j];
      for (int c = 0; c < k; c++) {
        interceptFactor += meanX[j] * m[j][k + c] * meanX[c];
      }
    }

    double ssResid = 0D;
    double ssTotal = 0D;
    for (int i = 0; i < n; i++) {
      final double e = y[i] - predict(slopes, intercept, x[i]);
      ssResid += e * e;
      ssTotal += (y[i] - meanY) * (y[i] - meanY);
    }
    return new LinearModel(slopes, intercept, constant, n, ssResid,
        ssTotal - ssResid, slopeFactors,
        Math.sqrt(Math.max(interceptFactor, 0D)));
  }

  private static double predict(double[] slopes, double intercept,
      double[] x) {
    double v = intercept;
    for (int j = 0; j < slopes.length; j++) {
      v += slopes[j] * x[j];
    }
    return v;
  }

  /** Returns the value of the model at a point. */
  double predict(double[] x) {
    return predict(slopes, intercept, x);
  }

  /** Residual degrees of freedom. */
  int df() {
    return n - slopes.length - (constant ? 1 : 0);
  }

  /** Standard error of the y estimate; NaN if there are no residual degrees
   * of freedom. */
  double seY() {
    final int df = df();
    return df == 0 ? Double.NaN : Math.sqrt(ssResid / df);
  }

  /** Coefficient of determination. */
  double r2() {
    return ssReg / (ssReg + ssResid);
  }

  /** The F statistic, comparing explained and residual variance. */
  double f() {
    return ssReg / slopes.length / (ssResid / df());
  }

  /** Standard error of slope {@code j}. */
  double seSlope(int j) {
    return slopeFactors[j] * seY();
  }

  /** Standard error of the intercept; NaN if the model has no constant. */
  double seIntercept() {
    return constant ? interceptFactor * seY() : Double.NaN;
  }
}

// End LinearModel.java
