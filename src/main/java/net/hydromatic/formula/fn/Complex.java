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

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.hydromatic.formula.eval.Values;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Complex number, as used by the engineering functions.
 *
 * <p>Complex numbers are passed to and from formulas as text, such as
 * "3+4i" or "-2j". The suffix ('i' or 'j') of the inputs is kept in the
 * output.
 */
final class Complex {
  private static final String NUM =
      "(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?";
  private static final Pattern PATTERN =
      Pattern.compile("^([+-]?" + NUM + ")?(?:([+-])(" + NUM + ")?([ij]))?$");
  private static final Pattern IMAGINARY =
      Pattern.compile("^([+-]?)(" + NUM + ")?([ij])$");

  final double re;
  final double im;
  final char suffix;

  Complex(double re, double im, char suffix) {
    this.re = re;
    this.im = im;
    this.suffix = suffix;
  }

  Complex(double re, double im) {
    this(re, im, 'i');
  }

  /** Parses a complex number; returns null if invalid. */
  static @Nullable Complex parseOpt(String s) {
    s = s.trim();
    if (s.isEmpty()) {
      return new Complex(0, 0);
    }
    final Matcher m = IMAGINARY.matcher(s);
    if (m.matches()) {
      final double im = m.group(2) == null ? 1D
          : Double.parseDouble(m.group(2));
      return new Complex(0, m.group(1).equals("-") ? -im : im,
          m.group(3).charAt(0));
    }
    final Matcher m2 = PATTERN.matcher(s);
    if (!m2.matches() || m2.group(1) == null && m2.group(2) == null) {
      return null;
    }
    final double re = m2.group(1) == null ? 0D
        : Double.parseDouble(m2.group(1));
    if (m2.group(2) == null) {
      return new Complex(re, 0);
    }
    double im = m2.group(3) == null ? 1D : Double.parseDouble(m2.group(3));
    if (m2.group(2).equals("-")) {
      im = -im;
    }
    return new Complex(re, im, m2.group(4).charAt(0));
  }

  Complex withSuffix(char suffix) {
    return new Complex(re, im, suffix);
  }

  double abs() {
    return Math.hypot(re, im);
  }

  double arg() {
    return Math.atan2(im, re);
  }

  Complex plus(Complex o) {
    return new Complex(re + o.re, im + o.im, suffix);
  }

  Complex minus(Complex o) {
    return new Complex(re - o.re, im - o.im, suffix);
  }

  Complex times(Complex o) {
    return new Complex(re * o.re - im * o.im, re * o.im + im * o.re, suffix);
  }

  /** Divides; returns null if the divisor is zero. */
  @Nullable Complex divideOpt(Complex o) {
    final double d = o.re * o.re + o.im * o.im;
    if (d == 0D) {
      return null;
    }
    return new Complex((re * o.re + im * o.im) / d,
        (im * o.re - re * o.im) / d, suffix);
  }

  Complex conjugate() {
    return new Complex(re, -im, suffix);
  }

  Complex exp() {
    final double e = Math.exp(re);
    return new Complex(e * Math.cos(im), e * Math.sin(im), suffix);
  }

  Complex ln() {
    return new Complex(Math.log(abs()), arg(), suffix);
  }

  Complex pow(double n) {
    final double r = Math.pow(abs(), n);
    final double theta = arg() * n;
    return new Complex(r * Math.cos(theta), r * Math.sin(theta), suffix);
  }

  Complex sqrt() {
    return pow(0.5);
  }

  Complex sin() {
    return new Complex(Math.sin(re) * Math.cosh(im),
        Math.cos(re) * Math.sinh(im), suffix);
  }

  Complex cos() {
    return new Complex(Math.cos(re) * Math.cosh(im),
        -Math.sin(re) * Math.sinh(im), suffix);
  }

  Complex sinh() {
    return new Complex(Math.sinh(re) * Math.cos(im),
        Math.cosh(re) * Math.sin(im), suffix);
  }

  Complex cosh() {
    return new Complex(Math.cosh(re) * Math.cos(im),
        Math.sinh(re) * Math.sin(im), suffix);
  }

  Complex scale(double f) {
    return new Complex(re * f, im * f, suffix);
  }

  boolean isZero() {
    return re == 0D && im == 0D;
  }

  /** Formats as text, such as "3+4i", "-i" or "2". */
  @Override public String toString() {
    final double r = clean(re);
    final double i = clean(im);
    if (i == 0D) {
      return Values.formatNumber(r);
    }
    final StringBuilder b = new StringBuilder();
    if (r != 0D) {
      b.append(Values.formatNumber(r));
      if (i > 0) {
        b.append('+');
      }
    }
    if (i == -1D) {
      b.append('-');
    } else if (i != 1D) {
      b.append(Values.formatNumber(i));
    }
    return b.append(suffix).toString();
  }

  /** Rounds values that are within rounding error of zero. */
  private static double clean(double d) {
    return Math.abs(d) < 1E-15 ? 0D : d;
  }
}

// End Complex.java
