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

import static net.hydromatic.formula.eval.ErrorKind.NUMBER;
import static net.hydromatic.formula.eval.ErrorKind.VALUE;
import static net.hydromatic.formula.eval.Value.error;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.formula.compile.BuiltIn;
import net.hydromatic.formula.eval.ArgList;
import net.hydromatic.formula.eval.ArrayValue;
import net.hydromatic.formula.eval.Closure;
import net.hydromatic.formula.eval.Session;
import net.hydromatic.formula.eval.Value;

/**
 * Functions that apply a lambda to the elements, rows or columns of an
 * array.
 *
 * <p>An error returned by the lambda lands in the corresponding cell of the
 * result; it does not abort the whole call.
 */
abstract class LambdaFunctions {
  private LambdaFunctions() {}

  static void populate(Codes.Builder b) {
    b.put(BuiltIn.BYCOL, (session, args) -> byRowCol(session, args, false));
    b.put(BuiltIn.BYROW, (session, args) -> byRowCol(session, args, true));
    b.put(BuiltIn.MAKEARRAY, LambdaFunctions::makeArray);
    b.put(BuiltIn.MAP, LambdaFunctions::map);
    b.put(BuiltIn.REDUCE, (session, args) -> reduce(session, args, false));
    b.put(BuiltIn.SCAN, (session, args) -> reduce(session, args, true));
  }

  /** Converts the result of a lambda to the content of one cell. A
   * multi-cell array cannot be stored in a cell. */
  static Value.Scalar cell(Value value) {
    if (value instanceof Value.Scalar) {
      return (Value.Scalar) value;
    }
    if (value instanceof ArrayValue && ((ArrayValue) value).size() == 1) {
      return ((ArrayValue) value).get(0);
    }
    return error(VALUE);
  }

  private static Value byRowCol(Session session, List<Value> args,
      boolean byRow) {
    final ArgList a = ArgList.of(args);
    final ArrayValue array0 = a.array(0);
    final Closure lambda = a.lambda(1);
    if (a.failed() || lambda == null) {
      return a.error();
    }
    if (lambda.params.size() != 1) {
      return error(VALUE);
    }
    final ArrayValue array = byRow ? array0 : array0.transpose();
    final List<Value.Scalar> cells = new ArrayList<>();
    for (int r = 0; r < array.rows; r++) {
      final ArrayValue line = byRow ? array.row(r) : array.row(r).transpose();
      cells.add(cell(session.apply(lambda, ImmutableList.of(line))));
    }
    return byRow ? ArrayValue.column(cells) : ArrayValue.row(cells);
  }

  /** Implements {@code MAKEARRAY(rows, cols, lambda)}; the lambda receives
   * the 1-based row and column. */
  private static Value makeArray(Session session, List<Value> args) {
    final ArgList a = ArgList.of(args);
    final int rows = a.integer(0);
    final int cols = a.integer(1);
    final Closure lambda = a.lambda(2);
    if (a.failed() || lambda == null) {
      return a.error();
    }
    if (rows < 1 || cols < 1) {
      return error(VALUE);
    }
    if ((long) rows * cols > ArrayFunctions.MAX_CELLS) {
      return error(NUMBER);
    }
    final Value.Scalar[] cells = new Value.Scalar[rows * cols];
    for (int r = 0; r < rows; r++) {
      for (int c = 0; c < cols; c++) {
        cells[r * cols + c] =
            cell(session.apply(lambda,
                ImmutableList.of(Value.number(r + 1), Value.number(c + 1))));
      }
    }
    return ArrayValue.of(rows, cols, cells);
  }

  /** Implements {@code MAP(array1, [array2, ...], lambda)}. The arrays must
   * have the same shape, except that a 1 x 1 array is repeated. */
  private static Value map(Session session, List<Value> args) {
    final ArgList a = ArgList.of(args);
    final Closure lambda = a.lambda(args.size() - 1);
    final List<ArrayValue> arrays = new ArrayList<>();
    for (int i = 0; i < args.size() - 1; i++) {
      arrays.add(a.array(i));
    }
    if (a.failed() || lambda == null) {
      return a.error();
    }
    if (lambda.params.size() != arrays.size()) {
      return error(VALUE);
    }
    ArrayValue shape = arrays.get(0);
    for (ArrayValue array : arrays) {
      if (array.size() > 1) {
        if (shape.size() > 1 && !shape.sameShape(array)) {
          return error(VALUE);
        }
        shape = array;
      }
    }
    final Value.Scalar[] cells = new Value.Scalar[shape.size()];
    for (int i = 0; i < cells.length; i++) {
      final List<Value> elements = new ArrayList<>();
      for (ArrayValue array : arrays) {
        elements.add(array.get(array.size() == 1 ? 0 : i));
      }
      cells[i] = cell(session.apply(lambda, elements));
    }
    return ArrayValue.of(shape.rows, shape.cols, cells);
  }

  /**
   * Implements {@code REDUCE([initial_value], array, lambda)} and
   * {@code SCAN}.
   *
   * <p>The lambda receives the accumulator and the next element, in
   * row-major order. If the initial value is omitted, the accumulator starts
   * blank. {@code SCAN} returns an array, the same shape as the input, of
   * each intermediate accumulator.
   */
  private static Value reduce(Session session, List<Value> args,
      boolean scan) {
    final int offset = args.size() - 2;
    final Value initial = offset == 0 ? Value.MISSING : args.get(0);
    final ArgList a = ArgList.of(args);
    final ArrayValue array = a.array(offset);
    final Closure lambda = a.lambda(offset + 1);
    if (a.failed() || lambda == null) {
      return a.error();
    }
    if (lambda.params.size() != 2 || initial instanceof Closure) {
      return error(VALUE);
    }
    Value acc = initial;
    final Value.Scalar[] cells = new Value.Scalar[array.size()];
    for (int i = 0; i < cells.length; i++) {
      acc = session.apply(lambda, ImmutableList.of(acc, array.get(i)));
      if (scan) {
        cells[i] = cell(acc);
      }
    }
    if (scan) {
      return ArrayValue.of(array.rows, array.cols, cells);
    }
    return acc;
  }
}

// End LambdaFunctions.java
