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

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Typed access to the evaluated arguments of a function.
 *
 * <p>Each accessor coerces an argument to the requested type. If the
 * argument is an error, or cannot be coerced, the accessor returns a
 * placeholder (0, "", false) and the list remembers the first such error.
 * A function reads all of its arguments, then checks {@link #failed()}:
 *
 * <blockquote><pre>
 * final ArgList a = ArgList.of(args);
 * final double number = a.num(0);
 * final int digits = a.integer(1, 0);
 * if (a.failed()) {
 *   return a.error();
 * }
 * </pre></blockquote>
 */
public final class ArgList {
  private final ImmutableList<Value> args;
  private Value.@Nullable Err error;

  private ArgList(List<? extends Value> args) {
    this.args = ImmutableList.copyOf(args);
  }

  public static ArgList of(List<? extends Value> args) {
    return new ArgList(args);
  }

  public int size() {
    return args.size();
  }

  /** Returns the {@code i}th argument, or {@link Value#MISSING} if there are
   * fewer arguments. */
  public Value get(int i) {
    return i < args.size() ? args.get(i) : Value.MISSING;
  }

  /** Returns whether the {@code i}th argument was omitted. */
  public boolean isMissing(int i) {
    final Value v = get(i);
    return v instanceof Value.Blank && ((Value.Blank) v).omitted;
  }

  /** Returns the {@code i}th argument as a scalar; an array yields its first
   * element. Does not record errors. */
  public Value.Scalar scalar(int i) {
    return Values.first(get(i));
  }

  public double num(int i) {
    final Value.Scalar n = Values.toNumber(check(scalar(i)));
    if (n instanceof Value.Num) {
      return ((Value.Num) n).value;
    }
    record(n);
    return 0D;
  }

  public double num(int i, double defaultValue) {
    return isMissing(i) ? defaultValue : num(i);
  }

  /** Returns the {@code i}th argument as an integer, truncating toward
   * zero. */
  public int integer(int i) {
    return (int) num(i);
  }

  public int integer(int i, int defaultValue) {
    return isMissing(i) ? defaultValue : integer(i);
  }

  public String text(int i) {
    final Value.Scalar t = Values.toText(check(scalar(i)));
    if (t instanceof Value.Text) {
      return ((Value.Text) t).value;
    }
    record(t);
    return "";
  }

  public String text(int i, String defaultValue) {
    return isMissing(i) ? defaultValue : text(i);
  }

  public boolean bool(int i) {
    final Value.Scalar b = Values.toBool(check(scalar(i)));
    if (b instanceof Value.Bool) {
      return ((Value.Bool) b).value;
    }
    record(b);
    return false;
  }

  public boolean bool(int i, boolean defaultValue) {
    return isMissing(i) ? defaultValue : bool(i);
  }

  /** Returns the {@code i}th argument as an array; a scalar becomes a
   * 1 x 1 array. A lambda records {@code #VALUE!}. */
  public ArrayValue array(int i) {
    final Value v = get(i);
    if (v instanceof Closure) {
      fail(ErrorKind.VALUE);
    }
    return Values.toArray(v);
  }

  /** Returns the {@code i}th argument as a lambda; records an error and
   * returns null if it is not a lambda. */
  public @Nullable Closure lambda(int i) {
    final Value v = get(i);
    if (v instanceof Closure) {
      return (Closure) v;
    }
    final Value.Scalar s = Values.first(v);
    record(s instanceof Value.Err ? s : Value.error(ErrorKind.VALUE));
    return null;
  }

  /** Returns whether any accessor has recorded an error. */
  public boolean failed() {
    return error != null;
  }

  /** Returns the first recorded error.
   *
   * @throws IllegalStateException if no error has been recorded */
  public Value.Err error() {
    if (error == null) {
      throw new IllegalStateException("no error");
    }
    return error;
  }

  /** Records an error (unless one is already recorded) and returns the
   * first recorded error. */
  public Value.Err fail(ErrorKind kind) {
    record(Value.error(kind));
    return requireNonNull(error);
  }

  private Value.Scalar check(Value.Scalar s) {
    if (s instanceof Value.Err) {
      record(s);
    }
    return s;
  }

  private void record(Value.Scalar s) {
    if (error == null && s instanceof Value.Err) {
      error = (Value.Err) s;
    }
  }
}

// End ArgList.java
