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

/**
 * Special functions and probability distributions.
 *
 * <p>The error function uses the rational approximation 7.1.26 of Abramowitz
 * and Stegun, whose absolute error is less than 1.5E-7; the normal
 * distribution functions inherit that error.
 */
abstract class SpecialFunctions {
  private static final double[] LANCZOS = {
      0.99999999999980993, 676.5203681218851, -1259.1392167224028,
      771.32342877765313, -176.61502916214059, 12.507343278686905,
      -0.13857109526572012, 9.9843695780195716E-6, 1.5056327351493116E-7
  };

  private static final double EPS = 1E-15;
  private static final double FPMIN = 1E-300;

  private SpecialFunctions() {}

  static double erf(double x) {
    final double t = 1D / (1D + 0.3275911 * Math.abs(x));
    final double poly = t * (0.254829592
        + t * (-0.284496736
        + t * (1.421413741
        + t * (-1.453152027
        + t * 1.061405429))));
    final double y = 1D - poly * Math.exp(-x * x);
    return x >= 0 ? y : -y;
  }

  static double erfc(double x) {
    return 1D - erf(x);
  }

  /** Standard normal cumulative distribution. */
  static double normCdf(double z) {
    return 0.5 * (1D + erf(z / Math.sqrt(2D)));
  }

  /** Standard normal density. */
  static double normPdf(double z) {
    return Math.exp(-z * z / 2D) / Math.sqrt(2D * Math.PI);
  }

  /** Natural logarithm of the gamma function, for {@code x > 0}. */
  static double lnGamma(double x) {
    if (x < 0.5) {
      // Reflection formula
      return Math.log(Math.PI / Math.abs(Math.sin(Math.PI * x)))
          - lnGamma(1D - x);
    }
    final double z = x - 1D;
    double a = LANCZOS[0];
    final double t = z + 7.5;
    for (int i = 1; i < LANCZOS.length; i++) {
      a += LANCZOS[i] / (z + i);
    }
    return 0.5 * Math.log(2D * Math.PI) + (z + 0.5) * Math.log(t) - t
        + Math.log(a);
  }

  /** Gamma function; NaN at zero and negative integers. */
  static double gamma(double x) {
    if (x <= 0 && x == Math.floor(x)) {
      return Double.NaN;
    }
    if (x == Math.floor(x) && x <= 171) {
      double f = 1D;
      for (int i = 2; i < x; i++) {
        f *= i;
      }
      return f;
    }
    if (x < 0.5) {
      return Math.PI / (Math.sin(Math.PI * x) * gamma(1D - x));
    }
    return Math.exp(lnGamma(x));
  }

  /** Natural logarithm of the beta function. */
  static double lnBeta(double a, double b) {
    return lnGamma(a) + lnGamma(b) - lnGamma(a + b);
  }

  /** Regularized lower incomplete gamma function P(a, x). */
  static double gammaP(double a, double x) {
    if (x <= 0) {
      return 0D;
    }
    if (x < a + 1D) {
      // Series representation
      double ap = a;
      double sum = 1D / a;
      double del = sum;
      for (int n = 0; n < 1000; n++) {
        ap += 1D;
        del *= x / ap;
        sum += del;
        if (Math.abs(del) < Math.abs(sum) * EPS) {
          break;
        }
      }
      return sum * Math.exp(-x + a * Math.log(x) - lnGamma(a));
    }
    return 1D - gammaQContinuedFraction(a, x);
  }

  private static double gammaQContinuedFraction(double a, double x) {
    double b = x + 1D - a;
    double c = 1D / FPMIN;
    double d = 1D / b;
    double h = d;
    for (int i = 1; i < 1000; i++) {
      final double an = -i * (i - a);
      b += 2D;
      d = an * d + b;
      if (Math.abs(d) < FPMIN) {
        d = FPMIN;
      }
      c = b + an / c;
      if (Math.abs(c) < FPMIN) {
        c = FPMIN;
      }
      d = 1D / d;
      final double del = d * c;
      h *= del;
      if (Math.abs(del - 1D) < EPS) {
        break;
      }
    }
    return Math.exp(-x + a * Math.log(x) - lnGamma(a)) * h;
  }

  /** Regularized incomplete beta function I<sub>x</sub>(a, b). */
  static double betaI(double x, double a, double b) {
    if (x <= 0) {
      return 0D;
    }
    if (x >= 1) {
      return 1D;
    }
    final double bt = Math.exp(-lnBeta(a, b) + a * Math.log(x)
        + b * Math.log(1D - x));
    if (x < (a + 1D) / (a + b + 2D)) {
      return bt * betaContinuedFraction(x, a, b) / a;
    }
    return 1D - bt * betaContinuedFraction(1D - x, b, a) / b;
  }

  private static double betaContinuedFraction(double x, double a, double b) {
    final double qab = a + b;
    final double qap = a + 1D;
    final double qam = a - 1D;
    double c = 1D;
    double d = 1D - qab * x / qap;
    if (Math.abs(d) < FPMIN) {
      d = FPMIN;
    }
    d = 1D / d;
    double h = d;
    for (int m = 1; m <= 1000; m++) {
      final int m2 = 2 * m;
      double aa = m * (b - m) * x / ((qam + m2) * (a + m2));
      d = 1D + aa * d;
      if (Math.abs(d) < FPMIN) {
        d = FPMIN;
      }
      c = 1D + aa / c;
      if (Math.abs(c) < FPMIN) {
        c = FPMIN;
      }
      d = 1D / d;
      h *= d * c;
      aa = -(a + m) * (qab + m) * x / ((a + m2) * (qap + m2));
      d = 1D + aa * d;
      if (Math.abs(d) < FPMIN) {
        d = FPMIN;
      }
      c = 1D + aa / c;
      if (Math.abs(c) < FPMIN) {
        c = FPMIN;
      }
      d = 1D / d;
      final double del = d * c;
      h *= del;
      if (Math.abs(del - 1D) < EPS) {
        break;
      }
    }
    return h;
  }

  /** Natural logarithm of the binomial coefficient C(n, k). */
  static double lnCombin(double n, double k) {
    final double m = Math.min(k, n - k);
    if (m >= 0 && m < 100 && m == Math.floor(m)) {
      // Small k: sum of logs of the factors
      double r = 0D;
      for (int i = 1; i <= m; i++) {
        r += Math.log((n - m + i) / i);
      }
      return r;
    }
    return lnGamma(n + 1D) - lnGamma(k + 1D) - lnGamma(n - k + 1D);
  }

  /** Binomial coefficient C(n, k), rounded to an integer. */
  static double combin(double n, double k) {
    if (k < 0 || k > n) {
      return 0D;
    }
    double r = 1D;
    for (int i = 1; i <= k; i++) {
      r = r * (n - k + i) / i;
    }
    return Math.rint(r);
  }

  /** Largest number of trials accepted by the binomial functions. */
  static final double MAX_TRIALS = Integer.MAX_VALUE;

  static double binomPmf(double k, double n, double p) {
    if (p == 0D) {
      return k == 0 ? 1D : 0D;
    }
    if (p == 1D) {
      return k == n ? 1D : 0D;
    }
    return Math.exp(lnCombin(n, k) + k * Math.log(p)
        + (n - k) * Math.log1p(-p));
  }

  /** Smallest number of successes whose probability is not negligible;
   * the mean less 40 standard deviations. */
  static double binomLowest(double n, double p) {
    final double sd = Math.sqrt(n * p * (1D - p));
    return Math.max(0D, Math.floor(n * p - 40D * sd - 1D));
  }

  static double binomCdf(double k, double n, double p) {
    final double sd = Math.sqrt(n * p * (1D - p));
    if (k >= n || k > n * p + 40D * sd + 1D) {
      return 1D;
    }
    double sum = 0D;
    for (double i = binomLowest(n, p); i <= k; i++) {
      sum += binomPmf(i, n, p);
    }
    return Math.min(sum, 1D);
  }

  static double poissonPmf(int k, double mean) {
    if (mean == 0D) {
      return k == 0 ? 1D : 0D;
    }
    return Math.exp(k * Math.log(mean) - mean - lnGamma(k + 1D));
  }

  static double poissonCdf(int k, double mean) {
    double sum = 0D;
    for (int i = 0; i <= k; i++) {
      sum += poissonPmf(i, mean);
    }
    return Math.min(sum, 1D);
  }

  /** Cumulative chi-squared distribution. */
  static double chiSqCdf(double x, double df) {
    return gammaP(df / 2D, x / 2D);
  }

  static double chiSqPdf(double x, double df) {
    if (x < 0) {
      return 0D;
    }
    final double k = df / 2D;
    return Math.exp((k - 1D) * Math.log(x) - x / 2D - k * Math.log(2D)
        - lnGamma(k));
  }

  /** Cumulative gamma distribution with shape alpha and scale beta. */
  static double gammaCdf(double x, double alpha, double beta) {
    return gammaP(alpha, x / beta);
  }

  static double gammaPdf(double x, double alpha, double beta) {
    if (x < 0) {
      return 0D;
    }
    if (x == 0) {
      return alpha == 1D ? 1D / beta : 0D;
    }
    return Math.exp((alpha - 1D) * Math.log(x) - x / beta - lnGamma(alpha)
        - alpha * Math.log(beta));
  }

  /** Cumulative Student's t-distribution. */
  static double tCdf(double t, double df) {
    final double x = df / (df + t * t);
    final double tail = 0.5 * betaI(x, df / 2D, 0.5);
    return t > 0 ? 1D - tail : tail;
  }

  static double tPdf(double t, double df) {
    return Math.exp(lnGamma((df + 1D) / 2D) - lnGamma(df / 2D))
        / Math.sqrt(df * Math.PI)
        * Math.pow(1D + t * t / df, -(df + 1D) / 2D);
  }

  /** Cumulative F distribution. */
  static double fCdf(double x, double d1, double d2) {
    if (x <= 0) {
      return 0D;
    }
    return betaI(d1 * x / (d1 * x + d2), d1 / 2D, d2 / 2D);
  }

  static double fPdf(double x, double d1, double d2) {
    if (x < 0) {
      return 0D;
    }
    return Math.exp(0.5 * (d1 * Math.log(d1 * x) + d2 * Math.log(d2)
        - (d1 + d2) * Math.log(d1 * x + d2)) - Math.log(x)
        - lnBeta(d1 / 2D, d2 / 2D));
  }

  static double betaPdf(double x, double a, double b) {
    if (x < 0 || x > 1) {
      return 0D;
    }
    return Math.exp((a - 1D) * Math.log(x) + (b - 1D) * Math.log1p(-x)
        - lnBeta(a, b));
  }
}

// End SpecialFunctions.java
