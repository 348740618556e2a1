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

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Address of a cell.
 *
 * <p>Rows and columns are 0-based: "A1" is row 0, column 0.
 */
public final class Address implements Comparable<Address> {
  /** Number of rows in a worksheet. */
  public static final int MAX_ROWS = 1_048_576;

  /** Number of columns in a worksheet; the last column is "XFD". */
  public static final int MAX_COLS = 16_384;

  private static final Pattern PATTERN =
      Pattern.compile("\\$?([A-Za-z]{1,3})\\$?([0-9]+)");

  public final int row;
  public final int col;

  private Address(int row, int col) {
    checkArgument(
        isValid(row, col), "address out of range: row %s, col %s", row, col);
    this.row = row;
    this.col = col;
  }

  /** Creates an address from a 0-based row and column. */
  public static Address of(int row, int col) {
    return new Address(row, col);
  }

  /** Returns whether a 0-based row and column are within the worksheet. */
  public static boolean isValid(int row, int col) {
    return row >= 0 && row < MAX_ROWS && col >= 0 && col < MAX_COLS;
  }

  /**
   * Parses an address in A1 notation, such as "B3" or "$B$3". Returns null if
   * the string is not a valid address.
   */
  public static @Nullable Address parseOpt(String s) {
    final Matcher m = PATTERN.matcher(s);
    if (!m.matches()) {
      return null;
    }
    final int col = columnIndex(m.group(1));
    final String digits = m.group(2);
    if (digits.length() > 7) {
      return null;
    }
    final int row = Integer.parseInt(digits) - 1;
    return isValid(row, col) ? new Address(row, col) : null;
  }

  /** Converts column letters, such as "AB", to a 0-based index. */
  public static int columnIndex(String letters) {
    int n = 0;
    for (char c : letters.toUpperCase(Locale.ROOT).toCharArray()) {
      n = n * 26 + (c - 'A' + 1);
    }
    return n - 1;
  }

  /** Converts a 0-based column index to letters, for example 27 to "AB". */
  public static String columnName(int col) {
    final StringBuilder b = new StringBuilder();
    for (int n = col + 1; n > 0; n = (n - 1) / 26) {
      b.insert(0, (char) ('A' + (n - 1) % 26));
    }
    return b.toString();
  }

  /** Returns the address offset by a number of rows and columns, or null if
   * the result would be off the worksheet. */
  public @Nullable Address offsetOpt(int rowOffset, int colOffset) {
    final int r = row + rowOffset;
    final int c = col + colOffset;
    return isValid(r, c) ? new Address(r, c) : null;
  }

  @Override
  public int compareTo(Address o) {
    final int c = Integer.compare(row, o.row);
    return c != 0 ? c : Integer.compare(col, o.col);
  }

  @Override
  public int hashCode() {
    return row * 31 + col;
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Address
            && row == ((Address) o).row
            && col == ((Address) o).col;
  }

  /** Returns the address in A1 notation. */
  @Override
  public String toString() {
    return columnName(col) + (row + 1);
  }
}

// End Address.java
