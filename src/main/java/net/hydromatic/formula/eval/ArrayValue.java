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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import java.util.function.UnaryOperator;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Rectangular, two-dimensional array of scalar values.
 *
 * <p>Elements are held in row-major order. An array never contains another
 * array; elements are always {@link Value.Scalar}.
 */
public final class ArrayValue extends Value {
  public final int rows;
  public final int cols;
  private final ImmutableList<Scalar> cells;

  private ArrayValue(int rows, int cols, ImmutableList<Scalar> cells) {
    checkArgument(rows > 0 && cols > 0, "empty array %s x %s", rows, cols);
    checkArgument(
        cells.size() == rows * cols,
        "expected %s cells, got %s",
        rows * cols,
        cells.size());
    this.rows = rows;
    this.cols = cols;
    this.cells = cells;
  }

  /** Creates an array from a row-major list of scalars. */
  public static ArrayValue of(int rows, int cols,
      List<? extends Scalar> cells) {
    return new ArrayValue(rows, cols, ImmutableList.copyOf(cells));
  }

  /** Creates an array from a row-major Java array of scalars. */
  public static ArrayValue of(int rows, int cols, Scalar[] cells) {
    return of(rows, cols, Arrays.asList(cells));
  }

  /** Creates a 1 x 1 array. */
  public static ArrayValue of(Scalar scalar) {
    return new ArrayValue(1, 1, ImmutableList.of(scalar));
  }

  /** Creates an array with one row. */
  public static ArrayValue row(List<? extends Scalar> cells) {
    return of(1, cells.size(), cells);
  }

  /** Creates an array with one column. */
  public static ArrayValue column(List<? extends Scalar> cells) {
    return of(cells.size(), 1, cells);
  }

  /** Creates an array whose every element has the same value. */
  public static ArrayValue filled(int rows, int cols, Scalar scalar) {
    final Scalar[] cells = new Scalar[rows * cols];
    Arrays.fill(cells, scalar);
    return of(rows, cols, cells);
  }

  @Override
  public Kind kind() {
    return Kind.ARRAY;
  }

  /** Returns the element at a given 0-based row and column. */
  public Scalar get(int row, int col) {
    checkElementIndex(row, rows, "row");
    checkElementIndex(col, cols, "col");
    return cells.get(row * cols + col);
  }

  /** Returns the element at a given 0-based position in row-major order. */
  public Scalar get(int i) {
    return cells.get(i);
  }

  /** Returns the number of elements. */
  public int size() {
    return cells.size();
  }

  /** Returns the elements in row-major order. */
  public ImmutableList<Scalar> cells() {
    return cells;
  }

  /** Returns whether this array has one row or one column. */
  public boolean isVector() {
    return rows == 1 || cols == 1;
  }

  /** Returns whether this array has the same shape as another. */
  public boolean sameShape(ArrayValue other) {
    return rows == other.rows && cols == other.cols;
  }

  /** Returns the 0-based {@code row}th row, as a 1 x cols array. */
  public ArrayValue row(int row) {
    return subArray(row, 0, 1, cols);
  }

  /** Returns the 0-based {@code col}th column, as a rows x 1 array. */
  public ArrayValue column(int col) {
    return subArray(0, col, rows, 1);
  }

  /** Returns a rectangular region of this array. */
  public ArrayValue subArray(int row, int col, int rowCount, int colCount) {
    checkArgument(row >= 0 && row + rowCount <= rows, "rows out of range");
    checkArgument(col >= 0 && col + colCount <= cols, "cols out of range");
    if (row == 0 && col == 0 && rowCount == rows && colCount == cols) {
      return this;
    }
    final Scalar[] list = new Scalar[rowCount * colCount];
    for (int r = 0; r < rowCount; r++) {
      for (int c = 0; c < colCount; c++) {
        list[r * colCount + c] = get(row + r, col + c);
      }
    }
    return of(rowCount, colCount, list);
  }

  /** Returns this array with rows and columns swapped. */
  public ArrayValue transpose() {
    final Scalar[] list = new Scalar[cells.size()];
    for (int r = 0; r < rows; r++) {
      for (int c = 0; c < cols; c++) {
        list[c * rows + r] = get(r, c);
      }
    }
    return of(cols, rows, list);
  }

  /** Applies a function to each element, returning an array of the same
   * shape. */
  public ArrayValue map(UnaryOperator<Scalar> fn) {
    final Scalar[] list = new Scalar[cells.size()];
    for (int i = 0; i < list.length; i++) {
      list[i] = fn.apply(cells.get(i));
    }
    return of(rows, cols, list);
  }

  /** Returns the first error in this array, in row-major order, or null. */
  public @Nullable Err firstError() {
    for (Scalar cell : cells) {
      if (cell instanceof Err) {
        return (Err) cell;
      }
    }
    return null;
  }

  @Override
  public int hashCode() {
    return (rows * 31 + cols) * 31 + cells.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof ArrayValue
            && rows == ((ArrayValue) o).rows
            && cols == ((ArrayValue) o).cols
            && cells.equals(((ArrayValue) o).cells);
  }

  /** Prints in array-constant syntax, for example "{1,2;3,4}". */
  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder("{");
    for (int r = 0; r < rows; r++) {
      if (r > 0) {
        b.append(';');
      }
      for (int c = 0; c < cols; c++) {
        if (c > 0) {
          b.append(',');
        }
        final Scalar cell = get(r, c);
        if (cell instanceof Text) {
          Values.quote(b, ((Text) cell).value);
        } else {
          b.append(cell);
        }
      }
    }
    return b.append('}').toString();
  }
}

// End ArrayValue.java
