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
import static java.util.Objects.requireNonNull;

import java.util.Map;
import java.util.TreeMap;

/** Helpers for {@link Worksheet}. */
public class Worksheets {
  private Worksheets() {}

  /** Returns a worksheet that has no cells and cannot be modified. */
  public static Worksheet empty() {
    return EmptyWorksheet.INSTANCE;
  }

  /** Creates an empty, modifiable worksheet that holds cells in memory. */
  public static Worksheet create() {
    return new MapWorksheet();
  }

  /**
   * Sets a cell, converting a Java value to a {@link Value}.
   *
   * <p>Accepts {@link Value}, {@link Number}, {@link String}, {@link Boolean}
   * and {@link ErrorKind}; null clears the cell.
   */
  public static void set(Worksheet worksheet, String address, Object o) {
    final Address a = Address.parseOpt(address);
    checkArgument(a != null, "invalid address: %s", address);
    worksheet.setCellValue(a, toValue(o));
  }

  /** Converts a Java object to a scalar value. */
  public static Value toValue(Object o) {
    if (o == null) {
      return Value.BLANK;
    } else if (o instanceof Value) {
      return (Value) o;
    } else if (o instanceof Number) {
      return Value.number(((Number) o).doubleValue());
    } else if (o instanceof String) {
      return Value.text((String) o);
    } else if (o instanceof Boolean) {
      return Value.bool((Boolean) o);
    } else if (o instanceof ErrorKind) {
      return Value.error((ErrorKind) o);
    } else {
      throw new IllegalArgumentException("cannot convert " + o.getClass());
    }
  }

  /** Worksheet that has no cells. */
  private enum EmptyWorksheet implements Worksheet {
    INSTANCE;

    @Override
    public Value getCellValue(Address address) {
      return Value.BLANK;
    }

    @Override
    public void setCellValue(Address address, Value value) {
      throw new UnsupportedOperationException("empty worksheet is read-only");
    }
  }

  /** Worksheet backed by a sorted map. Not thread-safe. */
  private static class MapWorksheet implements Worksheet {
    private final Map<Address, Value> cells = new TreeMap<>();

    @Override
    public Value getCellValue(Address address) {
      final Value value = cells.get(address);
      return value == null ? Value.BLANK : value;
    }

    @Override
    public void setCellValue(Address address, Value value) {
      requireNonNull(address, "address");
      if (value == Value.BLANK || value == null) {
        cells.remove(address);
      } else {
        cells.put(address, value);
      }
    }

    @Override
    public String toString() {
      return cells.toString();
    }
  }
}

// End Worksheets.java
