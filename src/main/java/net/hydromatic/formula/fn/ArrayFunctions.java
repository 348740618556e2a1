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

import static net.hydromatic.formula.eval.ErrorKind.NOT_AVAILABLE;
import static net.hydromatic.formula.eval.ErrorKind.NUMBER;
import static net.hydromatic.formula.eval.ErrorKind.VALUE;
import static net.hydromatic.formula.eval.Value.error;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import net.hydromatic.formula.compile.BuiltIn;
import net.hydromatic.formula.eval.ArgList;
import net.hydromatic.formula.eval.ArrayValue;
import net.hydromatic.formula.eval.Closure;
import net.hydromatic.formula.eval.Session;
import net.hydromatic.formula.eval.Value;
import net.hydromatic.formula.eval.Values;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Dynamic array functions.
 *
 * <p>Each function works on the shape of its argument directly; a scalar
 * argument behaves as a 1 x 1 array. A function whose result would have no
 * cells returns {@code #VALUE!}, because an {@link ArrayValue} is never
 * empty.
 */
abstract class ArrayFunctions {
  /** Largest number of cells that a generated array may have. */
  static final int MAX_CELLS = 1_000_000;

  private ArrayFunctions() {}

  static void populate(Codes.Builder b) {
    b.put(BuiltIn.CHOOSECOLS, (session, args) -> choose(args, false));
    b.put(BuiltIn.CHOOSEROWS, (session, args) -> choose(args, true));
    b.put(BuiltIn.DROP, (session, args) -> takeDrop(args, false));
    b.put(BuiltIn.EXPAND, (session, args) -> expand(args));
    b.put(BuiltIn.FILTER, (session, args) -> filter(args));
    b.put(BuiltIn.HSTACK, (session, args) -> stack(args, false));
    b.put(BuiltIn.RANDARRAY, ArrayFunctions::randArray);
    b.put(BuiltIn.SEQUENCE, (session, args) -> sequence(args));
    b.put(BuiltIn.SORT, (session, args) -> sort(args));
    b.put(BuiltIn.SORTBY, (session, args) -> sortBy(args));
    b.put(BuiltIn.TAKE, (session, args) -> takeDrop(args, true));
    b.put(BuiltIn.TOCOL, (session, args) -> toVector(args, true));
    b.put(BuiltIn.TOROW, (session, args) -> toVector(args, false));
    b.put(BuiltIn.TRANSPOSE, (session, args) -> {
      final ArgList a = ArgList.of(args);
      final ArrayValue array = a.array(0);
      return a.failed() ? a.error() : array.transpose();
    });
    b.put(BuiltIn.UNIQUE, (session, args) -> unique(args));
    b.put(BuiltIn.VSTACK, (session, args) -> stack(args, true));
    b.put(BuiltIn.WRAPCOLS, (session, args) -> wrap(args, false));
    b.put(BuiltIn.WRAPROWS, (session, args) -> wrap(args, true));
  }

  /** Implements {@code CHOOSEROWS} and {@code CHOOSECOLS}. Works on rows;
   * columns are handled by transposing. */
  private static Value choose(List<Value> args, boolean rows) {
    final ArgList a = ArgList.of(args);
    final ArrayValue array0 = a.array(0);
    if (a.failed()) {
      return a.error();
    }
    final ArrayValue array = rows ? array0 : array0.transpose();
    final List<Value.Scalar> cells = new ArrayList<>();
    int n = 0;
    for (Value arg : args.subList(1, args.size())) {
      if (arg instanceof Closure) {
        return error(VALUE);
      }
      for (Value.Scalar s : Values.toArray(arg).cells()) {
        final Value.Scalar number = Values.toNumber(s);
        if (number instanceof Value.Err) {
          return number;
        }
        final int k = (int) ((Value.Num) number).value;
        if (k == 0 || Math.abs(k) > array.rows) {
          return error(VALUE);
        }
        cells.addAll(array.row(k > 0 ? k - 1 : array.rows + k).cells());
        ++n;
      }
    }
    final ArrayValue result = ArrayValue.of(n, array.cols, cells);
    return rows ? result : result.transpose();
  }

  /** Implements {@code TAKE} and {@code DROP}. */
  private static Value takeDrop(List<Value> args, boolean take) {
    final ArgList a = ArgList.of(args);
    final ArrayValue array = a.array(0);
    final int rows = a.isMissing(1) ? (take ? array.rows : 0) : a.integer(1);
    final int cols = a.isMissing(2) ? (take ? array.cols : 0) : a.integer(2);
    if (a.failed()) {
      return a.error();
    }
    final int[] r = take ? take(rows, array.rows) : drop(rows, array.rows);
    final int[] c = take ? take(cols, array.cols) : drop(cols, array.cols);
    if (r == null || c == null) {
      return error(VALUE);
    }
    return array.subArray(r[0], c[0], r[1], c[1]);
  }

  /** Returns the start and length of the slice that {@code TAKE} keeps, or
   * null if the count is zero or exceeds the size. */
  private static int @Nullable [] take(int count, int size) {
    if (count == 0 || Math.abs(count) > size) {
      return null;
    }
    return count > 0 ? new int[] {0, count} : new int[] {size + count, -count};
  }

  /** Returns the start and length of the slice that {@code DROP} keeps, or
   * null if nothing would be left. */
  private static int @Nullable [] drop(int count, int size) {
    if (Math.abs(count) >= size) {
      return null;
    }
    return count >= 0 ? new int[] {count, size - count}
        : new int[] {0, size + count};
  }

  private static Value expand(List<Value> args) {
    final ArgList a = ArgList.of(args);
    final ArrayValue array = a.array(0);
    final int rows = a.isMissing(1) ? array.rows : a.integer(1);
    final int cols = a.isMissing(2) ? array.cols : a.integer(2);
    final Value.Scalar pad =
        a.isMissing(3) ? error(NOT_AVAILABLE) : a.scalar(3);
    if (a.failed()) {
      return a.error();
    }
    if (rows < array.rows || cols < array.cols) {
      return error(VALUE);
    }
    if ((long) rows * cols > MAX_CELLS) {
      return error(NUMBER);
    }
    final Value.Scalar[] cells = new Value.Scalar[rows * cols];
    for (int r = 0; r < rows; r++) {
      for (int c = 0; c < cols; c++) {
        cells[r * cols + c] =
            r < array.rows && c < array.cols ? array.get(r, c) : pad;
      }
    }
    return ArrayValue.of(rows, cols, cells);
  }

  /**
   * Implements {@code FILTER}.
   *
   * <p>If {@code include} is a column as tall as the array, selects rows;
   * if it is a row as wide as the array, selects columns. Any other shape is
   * {@code #VALUE!}.
   */
  private static Value filter(List<Value> args) {
    final ArgList a = ArgList.of(args);
    final ArrayValue array0 = a.array(0);
    final ArrayValue include0 = a.array(1);
    if (a.failed()) {
      return a.error();
    }
    final boolean byRow =
        include0.cols == 1 && include0.rows == array0.rows;
    if (!byRow && !(include0.rows == 1 && include0.cols == array0.cols)) {
      return error(VALUE);
    }
    final ArrayValue array = byRow ? array0 : array0.transpose();
    final List<Value.Scalar> cells = new ArrayList<>();
    int n = 0;
    for (int i = 0; i < array.rows; i++) {
      final Value.Scalar test = Values.toBool(include0.get(i));
      if (test instanceof Value.Err) {
        return test;
      }
      if (((Value.Bool) test).value) {
        cells.addAll(array.row(i).cells());
        ++n;
      }
    }
    if (n == 0) {
      return args.size() > 2 && !a.isMissing(2) ? args.get(2) : error(VALUE);
    }
    final ArrayValue result = ArrayValue.of(n, array.cols, cells);
    return byRow ? result : result.transpose();
  }

  /** Implements {@code VSTACK} and {@code HSTACK}. Narrower (or shorter)
   * arrays are padded with {@code #N/A}. */
  private static Value stack(List<Value> args, boolean vertical) {
    final ArgList a = ArgList.of(args);
    final List<ArrayValue> arrays = new ArrayList<>();
    for (int i = 0; i < args.size(); i++) {
      final ArrayValue array = a.array(i);
      arrays.add(vertical ? array : array.transpose());
    }
    if (a.failed()) {
      return a.error();
    }
    int rows = 0;
    int cols = 0;
    for (ArrayValue array : arrays) {
      rows += array.rows;
      cols = Math.max(cols, array.cols);
    }
    final Value.Scalar[] cells = new Value.Scalar[rows * cols];
    int r = 0;
    for (ArrayValue array : arrays) {
      for (int i = 0; i < array.rows; i++, r++) {
        for (int c = 0; c < cols; c++) {
          cells[r * cols + c] =
              c < array.cols ? array.get(i, c) : error(NOT_AVAILABLE);
        }
      }
    }
    final ArrayValue result = ArrayValue.of(rows, cols, cells);
    return vertical ? result : result.transpose();
  }

  private static Value randArray(Session session, List<Value> args) {
    final ArgList a = ArgList.of(args);
    final int rows = a.integer(0, 1);
    final int cols = a.integer(1, 1);
    final double min = a.num(2, 0D);
    final double max = a.num(3, 1D);
    final boolean whole = a.bool(4, false);
    if (a.failed()) {
      return a.error();
    }
    if (rows < 1 || cols < 1 || min > max) {
      return error(VALUE);
    }
    if ((long) rows * cols > MAX_CELLS) {
      return error(NUMBER);
    }
    final long lo = (long) Math.ceil(min);
    final long hi = (long) Math.floor(max);
    if (whole && lo > hi) {
      return error(VALUE);
    }
    final Random random = session.random();
    final Value.Scalar[] cells = new Value.Scalar[rows * cols];
    for (int i = 0; i < cells.length; i++) {
      cells[i] = whole
          ? Value.number(lo + (long) (random.nextDouble() * (hi - lo + 1)))
          : Value.number(min + random.nextDouble() * (max - min));
    }
    return ArrayValue.of(rows, cols, cells);
  }

  private static Value sequence(List<Value> args) {
    final ArgList a = ArgList.of(args);
    final int rows = a.integer(0);
    final int cols = a.integer(1, 1);
    final double start = a.num(2, 1D);
    final double step = a.num(3, 1D);
    if (a.failed()) {
      return a.error();
    }
    if (rows < 1 || cols < 1) {
      return error(VALUE);
    }
    if ((long) rows * cols > MAX_CELLS) {
      return error(NUMBER);
    }
    final Value.Scalar[] cells = new Value.Scalar[rows * cols];
    for (int i = 0; i < cells.length; i++) {
      cells[i] = Value.number(start + i * step);
    }
    return ArrayValue.of(rows, cols, cells);
  }

  /** Implements {@code SORT(array, [sort_index], [sort_order], [by_col])}.
   * The index and order may be arrays, to sort by several keys. */
  private static Value sort(List<Value> args) {
    final ArgList a = ArgList.of(args);
    final ArrayValue array0 = a.array(0);
    final ArrayValue indexes =
        a.isMissing(1) ? ArrayValue.of(Value.number(1)) : a.array(1);
    final ArrayValue orders =
        a.isMissing(2) ? ArrayValue.of(Value.number(1)) : a.array(2);
    final boolean byCol = a.bool(3, false);
    if (a.failed()) {
      return a.error();
    }
    if (orders.size() != 1 && orders.size() != indexes.size()) {
      return error(VALUE);
    }
    final ArrayValue array = byCol ? array0.transpose() : array0;
    final List<ArrayValue> keys = new ArrayList<>();
    final List<Integer> directions = new ArrayList<>();
    for (int i = 0; i < indexes.size(); i++) {
      final Value.Scalar index = Values.toNumber(indexes.get(i));
      final Value.Scalar order =
          Values.toNumber(orders.get(orders.size() == 1 ? 0 : i));
      if (index instanceof Value.Err) {
        return index;
      }
      if (order instanceof Value.Err) {
        return order;
      }
      final int k = (int) ((Value.Num) index).value;
      final int direction = direction(((Value.Num) order).value);
      if (k < 1 || k > array.cols || direction == 0) {
        return error(VALUE);
      }
      keys.add(array.column(k - 1));
      directions.add(direction);
    }
    final ArrayValue result = sortRows(array, keys, directions);
    return byCol ? result.transpose() : result;
  }

  /** Implements {@code SORTBY(array, by_array1, [sort_order1], ...)}. Each
   * key is a column as tall as the array, to sort rows, or a row as wide as
   * the array, to sort columns; all keys must agree. */
  private static Value sortBy(List<Value> args) {
    final ArgList a = ArgList.of(args);
    final ArrayValue array = a.array(0);
    final List<ArrayValue> keys = new ArrayList<>();
    final List<Integer> directions = new ArrayList<>();
    for (int i = 1; i < args.size(); i += 2) {
      keys.add(a.array(i));
      directions.add(direction(a.num(i + 1, 1D)));
    }
    if (a.failed()) {
      return a.error();
    }
    boolean allRows = true;
    boolean allCols = true;
    for (int i = 0; i < keys.size(); i++) {
      final ArrayValue key = keys.get(i);
      allRows &= key.cols == 1 && key.rows == array.rows;
      allCols &= key.rows == 1 && key.cols == array.cols;
      if (directions.get(i) == 0) {
        return error(VALUE);
      }
    }
    if (allRows) {
      return sortRows(array, keys, directions);
    }
    if (!allCols) {
      return error(VALUE);
    }
    return sortRows(array.transpose(), keys, directions).transpose();
  }

  private static int direction(double order) {
    return order == 1D ? 1 : order == -1D ? -1 : 0;
  }

  /** Sorts the rows of an array by one or more key vectors, each as long as
   * the array has rows. The sort is stable. */
  private static ArrayValue sortRows(ArrayValue array, List<ArrayValue> keys,
      List<Integer> directions) {
    final List<Integer> order = new ArrayList<>();
    for (int i = 0; i < array.rows; i++) {
      order.add(i);
    }
    final Comparator<Integer> comparator = (i, j) -> {
      for (int k = 0; k < keys.size(); k++) {
        final int c =
            Values.compare(keys.get(k).get(i), keys.get(k).get(j));
        if (c != 0) {
          return c * directions.get(k);
        }
      }
      return 0;
    };
    order.sort(comparator);
    final List<Value.Scalar> cells = new ArrayList<>();
    for (int i : order) {
      cells.addAll(array.row(i).cells());
    }
    return ArrayValue.of(array.rows, array.cols, cells);
  }

  /**
   * Implements {@code TOCOL} and {@code TOROW}.
   *
   * <p>{@code ignore} is 0 to keep all values, 1 to skip blanks, 2 to skip
   * errors, 3 to skip both.
   */
  private static Value toVector(List<Value> args, boolean column) {
    final ArgList a = ArgList.of(args);
    final ArrayValue array = a.array(0);
    final int ignore = a.integer(1, 0);
    final boolean scanByColumn = a.bool(2, false);
    if (a.failed()) {
      return a.error();
    }
    if (ignore < 0 || ignore > 3) {
      return error(VALUE);
    }
    final ArrayValue scan = scanByColumn ? array.transpose() : array;
    final List<Value.Scalar> cells = new ArrayList<>();
    for (Value.Scalar cell : scan.cells()) {
      if ((ignore & 1) != 0 && cell instanceof Value.Blank
          || (ignore & 2) != 0 && cell instanceof Value.Err) {
        continue;
      }
      cells.add(cell);
    }
    if (cells.isEmpty()) {
      return error(VALUE);
    }
    return column ? ArrayValue.column(cells) : ArrayValue.row(cells);
  }

  /** Implements {@code UNIQUE(array, [by_col], [exactly_once])}. Rows (or
   * columns) are equal if all their cells match case-insensitively. */
  private static Value unique(List<Value> args) {
    final ArgList a = ArgList.of(args);
    final ArrayValue array0 = a.array(0);
    final boolean byCol = a.bool(1, false);
    final boolean exactlyOnce = a.bool(2, false);
    if (a.failed()) {
      return a.error();
    }
    final ArrayValue array = byCol ? array0.transpose() : array0;
    final List<Integer> distinct = new ArrayList<>();
    final List<Integer> counts = new ArrayList<>();
    outer:
    for (int i = 0; i < array.rows; i++) {
      for (int j = 0; j < distinct.size(); j++) {
        if (sameRow(array, distinct.get(j), i)) {
          counts.set(j, counts.get(j) + 1);
          continue outer;
        }
      }
      distinct.add(i);
      counts.add(1);
    }
    final List<Value.Scalar> cells = new ArrayList<>();
    int n = 0;
    for (int j = 0; j < distinct.size(); j++) {
      if (!exactlyOnce || counts.get(j) == 1) {
        cells.addAll(array.row(distinct.get(j)).cells());
        ++n;
      }
    }
    if (n == 0) {
      return error(VALUE);
    }
    final ArrayValue result = ArrayValue.of(n, array.cols, cells);
    return byCol ? result.transpose() : result;
  }

  private static boolean sameRow(ArrayValue array, int r1, int r2) {
    for (int c = 0; c < array.cols; c++) {
      if (!Values.lookupEquals(array.get(r1, c), array.get(r2, c))) {
        return false;
      }
    }
    return true;
  }

  /** Implements {@code WRAPROWS} and {@code WRAPCOLS}. */
  private static Value wrap(List<Value> args, boolean byRows) {
    final ArgList a = ArgList.of(args);
    final ArrayValue vector = a.array(0);
    final int count = a.integer(1);
    final Value.Scalar pad =
        a.isMissing(2) ? error(NOT_AVAILABLE) : a.scalar(2);
    if (a.failed()) {
      return a.error();
    }
    if (!vector.isVector()) {
      return error(VALUE);
    }
    if (count < 1) {
      return error(NUMBER);
    }
    final int n = vector.size();
    final int lines = (n + count - 1) / count;
    final Value.Scalar[] cells = new Value.Scalar[lines * count];
    for (int i = 0; i < cells.length; i++) {
      // Cells of the result in the order they are filled.
      final int line = i / count;
      final int pos = i % count;
      final int index = byRows ? line * count + pos : pos * lines + line;
      cells[index] = i < n ? vector.get(i) : pad;
    }
    return byRows ? ArrayValue.of(lines, count, cells)
        : ArrayValue.of(count, lines, cells);
  }
}

// End ArrayFunctions.java
