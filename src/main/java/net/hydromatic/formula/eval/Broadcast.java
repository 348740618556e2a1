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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.BinaryOperator;
import java.util.function.UnaryOperator;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Applies scalar operations element-wise to arrays.
 *
 * <p>A 1 x 1 array behaves as a scalar. A scalar is repeated across every
 * element of the array arguments. Arrays that are not 1 x 1 must all have
 * the same shape; otherwise the result is {@code #VALUE!}.
 */
public abstract class Broadcast {
  private Broadcast() {}

  /** Applies a unary operation to a value, element-wise if it is an
   * array. */
  public static Value map(Value v, UnaryOperator<Value.Scalar> fn) {
    if (v instanceof ArrayValue) {
      final ArrayValue a = (ArrayValue) v;
      if (a.size() == 1) {
        return fn.apply(a.get(0));
      }
      return a.map(fn);
    }
    return fn.apply(Values.first(v));
  }

  /** Applies a binary operation to two values, element-wise if either is an
   * array. */
  public static Value zip(Value a, Value b,
      BinaryOperator<Value.Scalar> fn) {
    final List<Value> args = Arrays.asList(a, b);
    if (!compatible(args)) {
      return Value.error(ErrorKind.VALUE);
    }
    final ArrayValue shape = shapeOpt(args);
    if (shape == null) {
      return fn.apply(Values.first(a), Values.first(b));
    }
    final List<Value.Scalar> cells = new ArrayList<>(shape.size());
    for (int r = 0; r < shape.rows; r++) {
      for (int c = 0; c < shape.cols; c++) {
        cells.add(fn.apply(element(a, r, c), element(b, r, c)));
      }
    }
    return ArrayValue.of(shape.rows, shape.cols, cells);
  }

  /**
   * Applies a scalar function to arguments, element-wise over any array
   * arguments; each element of the result is the first scalar of the
   * function's result for that element.
   */
  public static Value apply(Applicable fn, Session session,
      List<Value> args) {
    if (!compatible(args)) {
      return Value.error(ErrorKind.VALUE);
    }
    final ArrayValue shape = shapeOpt(args);
    if (shape == null) {
      final List<Value> scalars = new ArrayList<>(args.size());
      for (Value arg : args) {
        scalars.add(arg instanceof ArrayValue ? Values.first(arg) : arg);
      }
      return fn.apply(session, scalars);
    }
    final List<Value.Scalar> cells = new ArrayList<>(shape.size());
    for (int r = 0; r < shape.rows; r++) {
      for (int c = 0; c < shape.cols; c++) {
        final List<Value> elementArgs = new ArrayList<>(args.size());
        for (Value arg : args) {
          elementArgs.add(element(arg, r, c));
        }
        cells.add(Values.first(fn.apply(session, elementArgs)));
      }
    }
    return ArrayValue.of(shape.rows, shape.cols, cells);
  }

  private static Value.Scalar element(Value v, int r, int c) {
    if (v instanceof ArrayValue) {
      final ArrayValue a = (ArrayValue) v;
      return a.size() == 1 ? a.get(0) : a.get(r, c);
    }
    return Values.first(v);
  }

  private static boolean isMultiCell(Value v) {
    return v instanceof ArrayValue && ((ArrayValue) v).size() > 1;
  }

  /** Returns the first argument that is an array of more than one element,
   * or null. */
  private static @Nullable ArrayValue shapeOpt(List<? extends Value> values) {
    for (Value v : values) {
      if (isMultiCell(v)) {
        return (ArrayValue) v;
      }
    }
    return null;
  }

  /** Returns whether all arguments that are arrays of more than one element
   * have the same shape. */
  private static boolean compatible(List<? extends Value> values) {
    final ArrayValue shape = shapeOpt(values);
    if (shape == null) {
      return true;
    }
    for (Value v : values) {
      if (isMultiCell(v) && !shape.sameShape((ArrayValue) v)) {
        return false;
      }
    }
    return true;
  }
}

// End Broadcast.java
