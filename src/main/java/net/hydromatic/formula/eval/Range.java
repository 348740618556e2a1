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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Rectangular range of cells.
 *
 * <p>The start and end are as the user wrote them; a range such as "B5:A1"
 * is reversed. Use {@link #normalize()} to get the bounding rectangle.
 */
public final class Range {
  public final Address start;
  public final Address end;

  private Range(Address start, Address end) {
    this.start = requireNonNull(start);
    this.end = requireNonNull(end);
  }

  /** Creates a range. */
  public static Range of(Address start, Address end) {
    return new Range(start, end);
  }

  /** Creates a range that contains a single cell. */
  public static Range of(Address address) {
    return new Range(address, address);
  }

  /**
   * Parses a range in A1 notation, such as "A1:B3" or "C4". Returns null if
   * invalid.
   */
  public static @Nullable Range parseOpt(String s) {
    final int colon = s.indexOf(':');
    if (colon < 0) {
      final Address address = Address.parseOpt(s);
      return address == null ? null : of(address);
    }
    final Address start = Address.parseOpt(s.substring(0, colon));
    final Address end = Address.parseOpt(s.substring(colon + 1));
    return start == null || end == null ? null : of(start, end);
  }

  /** Returns the top-left row. */
  public int firstRow() {
    return Math.min(start.row, end.row);
  }

  /** Returns the top-left column. */
  public int firstCol() {
    return Math.min(start.col, end.col);
  }

  /** Returns the number of rows. */
  public int rows() {
    return Math.abs(end.row - start.row) + 1;
  }

  /** Returns the number of columns. */
  public int cols() {
    return Math.abs(end.col - start.col) + 1;
  }

  /** Returns whether this range is a single cell. */
  public boolean isCell() {
    return start.equals(end);
  }

  /** Returns an equivalent range whose start is its top-left corner. */
  public Range normalize() {
    final Address topLeft = Address.of(firstRow(), firstCol());
    final Address bottomRight =
        Address.of(firstRow() + rows() - 1, firstCol() + cols() - 1);
    if (topLeft.equals(start) && bottomRight.equals(end)) {
      return this;
    }
    return new Range(topLeft, bottomRight);
  }

  /**
   * Returns a range moved by the given number of rows and columns, and
   * resized to the given height and width; or null if it would fall off the
   * worksheet.
   */
  public @Nullable Range offsetOpt(
      int rowOffset, int colOffset, int height, int width) {
    final Address topLeft =
        Address.of(firstRow(), firstCol()).offsetOpt(rowOffset, colOffset);
    if (topLeft == null || height < 1 || width < 1) {
      return null;
    }
    final Address bottomRight = topLeft.offsetOpt(height - 1, width - 1);
    return bottomRight == null ? null : new Range(topLeft, bottomRight);
  }

  @Override
  public int hashCode() {
    return start.hashCode() * 31 + end.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Range
            && start.equals(((Range) o).start)
            && end.equals(((Range) o).end);
  }

  @Override
  public String toString() {
    return isCell() ? start.toString() : start + ":" + end;
  }
}

// End Range.java
