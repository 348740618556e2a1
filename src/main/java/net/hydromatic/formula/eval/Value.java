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
package net.hydromatic.formula.eval;

import static java.util.Objects.requireNonNull;

import java.util.EnumMap;
import java.util.Map;

/**
 * Value that flows through a formula.
 *
 * <p>A value is either a {@link Scalar} (number, text, boolean, error or
 * blank), an {@link ArrayValue} (a rectangular grid of scalars) or a {@link
 * Closure} (a lambda).
 *
 * <p>Errors are values, not exceptions. An {@link Err} is returned in the
 * same way as any other result, and propagates through any operation that
 * consumes it.
 */
public abstract class Value {
  /** Blank value; the contents of an empty cell. */
  public static final Blank BLANK = new Blank(false);

  /**
   * Missing value; the value of an argument that was omitted from a call, such
   * as the second argument of {@code f(1,,2)}. Behaves as blank, but {@code
   * ISOMITTED} can tell the difference.
   */
  public static final Blank MISSING = new Blank(true);

  public static final Bool TRUE = new Bool(true);
  public static final Bool FALSE = new Bool(false);
  public static final Num ZERO = new Num(0D);
  public static final Text EMPTY = new Text("");

  private static final Map<ErrorKind, Err> ERRORS =
      new EnumMap<>(ErrorKind.class);

  static {
    for (ErrorKind kind : ErrorKind.values()) {
      ERRORS.put(kind, new Err(kind));
    }
  }

  /** Kind of value. */
  public enum Kind {
    NUMBER,
    TEXT,
    BOOLEAN,
    ERROR,
    BLANK,
    ARRAY,
    LAMBDA
  }

  Value() {}

  /** Returns the kind of this value. */
  public abstract Kind kind();

  /** Returns whether this value is an error. */
  public boolean isError() {
    return false;
  }

  /**
   * Creates a number value. A number that is infinite or not a number becomes
   * a {@code #NUM!} error.
   */
  public static Scalar number(double d) {
    if (!Double.isFinite(d)) {
      return error(ErrorKind.NUMBER);
    }
    if (d == 0D) {
      // Normalize -0.0 to 0.0
      return ZERO;
    }
    return new Num(d);
  }

  /** Creates a text value. */
  public static Text text(String s) {
    return s.isEmpty() ? EMPTY : new Text(s);
  }

  /** Returns the boolean value for a Java boolean. */
  public static Bool bool(boolean b) {
    return b ? TRUE : FALSE;
  }

  /** Returns the error value of a given kind. */
  public static Err error(ErrorKind kind) {
    return requireNonNull(ERRORS.get(kind));
  }

  /** Value that can be stored in a single cell. */
  public abstract static class Scalar extends Value {
    Scalar() {}
  }

  /** Numeric value. Never infinite, never NaN. */
  public static final class Num extends Scalar {
    public final double value;

    private Num(double value) {
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.NUMBER;
    }

    @Override
    public int hashCode() {
      return Double.hashCode(value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Num && Double.compare(value, ((Num) o).value) == 0;
    }

    @Override
    public String toString() {
      return Values.formatNumber(value);
    }
  }

  /** Text value. */
  public static final class Text extends Scalar {
    public final String value;

    private Text(String value) {
      this.value = requireNonNull(value);
    }

    @Override
    public Kind kind() {
      return Kind.TEXT;
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Text && value.equals(((Text) o).value);
    }

    @Override
    public String toString() {
      return value;
    }
  }

  /** Boolean value. There are only two instances. */
  public static final class Bool extends Scalar {
    public final boolean value;

    private Bool(boolean value) {
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.BOOLEAN;
    }

    @Override
    public String toString() {
      return value ? "TRUE" : "FALSE";
    }
  }

  /** Error value. There is one instance per {@link ErrorKind}. */
  public static final class Err extends Scalar {
    public final ErrorKind error;

    private Err(ErrorKind error) {
      this.error = error;
    }

    @Override
    public Kind kind() {
      return Kind.ERROR;
    }

    @Override
    public boolean isError() {
      return true;
    }

    @Override
    public String toString() {
      return error.token;
    }
  }

  /** Blank value. There are two instances, {@link #BLANK} and {@link
   * #MISSING}. */
  public static final class Blank extends Scalar {
    public final boolean omitted;

    private Blank(boolean omitted) {
      this.omitted = omitted;
    }

    @Override
    public Kind kind() {
      return Kind.BLANK;
    }

    @Override
    public String toString() {
      return "";
    }
  }
}

// End Value.java
