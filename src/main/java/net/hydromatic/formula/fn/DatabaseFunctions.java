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

import static net.hydromatic.formula.eval.ErrorKind.DIV_BY_ZERO;
import static net.hydromatic.formula.eval.ErrorKind.NUMBER;
import static net.hydromatic.formula.eval.ErrorKind.VALUE;
import static net.hydromatic.formula.eval.Value.error;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import net.hydromatic.formula.compile.BuiltIn;
import net.hydromatic.formula.eval.Applicable;
import net.hydromatic.formula.eval.ArgList;
import net.hydromatic.formula.eval.ArrayValue;
import net.hydromatic.formula.eval.Session;
import net.hydromatic.formula.eval.Value;
import net.hydromatic.formula.eval.Values;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Database functions.
 *
 * <p>A database is a range whose first row holds field names and whose
 * other rows are records. The criteria range also has field names in its
 * first row; each later row is a set of conditions, one per non-blank cell,
 * that a record must all satisfy, and a record is selected if it satisfies
 * any row. Conditions have the same syntax as in {@code SUMIF}.
 */
abstract class DatabaseFunctions {
  private DatabaseFunctions() {}

  static void populate(Codes.Builder b) {
    b.put(BuiltIn.DAVERAGE, numeric(a ->
        a.count() == 0 ? error(DIV_BY_ZERO) : Value.number(a.mean())));
    b.put(BuiltIn.DCOUNT, (session, args) -> count(args, false));
    b.put(BuiltIn.DCOUNTA, (session, args) -> count(args, true));
    b.put(BuiltIn.DGET, DatabaseFunctions::get);
    b.put(BuiltIn.DMAX, numeric(a -> maxMin(a, true)));
    b.put(BuiltIn.DMIN, numeric(a -> maxMin(a, false)));
    b.put(BuiltIn.DPRODUCT, numeric(a ->
        a.count() == 0 ? Value.ZERO : Value.number(a.product())));
    b.put(BuiltIn.DSTDEV, numeric(a -> variance(a, true, true)));
    b.put(BuiltIn.DSTDEVP, numeric(a -> variance(a, false, true)));
    b.put(BuiltIn.DSUM, numeric(a -> Value.number(a.sum())));
    b.put(BuiltIn.DVAR, numeric(a -> variance(a, true, false)));
    b.put(BuiltIn.DVARP, numeric(a -> variance(a, false, false)));
  }

  private static Value maxMin(Aggregates a, boolean max) {
    if (a.count() == 0) {
      return Value.ZERO;
    }
    final double[] sorted = a.sorted();
    return Value.number(max ? sorted[sorted.length - 1] : sorted[0]);
  }

  private static Value variance(Aggregates a, boolean sample, boolean sqrt) {
    final double v = a.variance(sample);
    if (Double.isNaN(v)) {
      return error(DIV_BY_ZERO);
    }
    return Value.number(sqrt ? Math.sqrt(v) : v);
  }

  /** Returns a function that aggregates the numbers in the selected
   * field of the matching records. */
  private static Applicable numeric(Function<Aggregates, Value> f) {
    return (session, args) -> {
      final Query query = Query.of(args, false);
      if (query.error != null) {
        return query.error;
      }
      final List<Value.Scalar> values = query.values();
      if (values.isEmpty()) {
        return f.apply(Aggregates.of(values, Aggregates.Mode.NUMBERS));
      }
      final Aggregates a = Aggregates.ofArray(ArrayValue.column(values));
      return a.failed() ? a.failure() : f.apply(a);
    };
  }

  /** Implements {@code DCOUNT} and {@code DCOUNTA}. If the field is
   * omitted, counts the matching records. */
  private static Value count(List<Value> args, boolean all) {
    final Query query = Query.of(args, true);
    if (query.error != null) {
      return query.error;
    }
    if (query.field < 0) {
      return Value.number(query.records.size());
    }
    int n = 0;
    for (Value.Scalar value : query.values()) {
      if (all ? !(value instanceof Value.Blank) : value instanceof Value.Num) {
        ++n;
      }
    }
    return Value.number(n);
  }

  /** Implements {@code DGET}: the field of the only matching record. */
  private static Value get(Session session, List<Value> args) {
    final Query query = Query.of(args, false);
    if (query.error != null) {
      return query.error;
    }
    final List<Value.Scalar> values = query.values();
    switch (values.size()) {
    case 0:
      return error(VALUE);
    case 1:
      return values.get(0);
    default:
      return error(NUMBER);
    }
  }

  /** Parsed arguments of a database function, and the records that match
   * the criteria. */
  private static class Query {
    final ArrayValue database;
    /** 0-based column of the field, or -1 if no field was given. */
    final int field;
    /** 0-based rows of the matching records (row 0 is the header). */
    final List<Integer> records;
    final Value.@Nullable Scalar error;

    private Query(ArrayValue database, int field, List<Integer> records,
        Value.@Nullable Scalar error) {
      this.database = database;
      this.field = field;
      this.records = records;
      this.error = error;
    }

    static Query failed(ArrayValue database, Value.Scalar error) {
      return new Query(database, -1, new ArrayList<>(), error);
    }

    /** Parses the arguments. If {@code optionalField} and there are only
     * two arguments, they are the database and the criteria. */
    static Query of(List<Value> args, boolean optionalField) {
      final ArgList a = ArgList.of(args);
      final boolean hasField = !optionalField || args.size() > 2;
      final ArrayValue database = a.array(0);
      final ArrayValue criteria = a.array(hasField ? 2 : 1);
      if (a.failed()) {
        return failed(database, a.error());
      }
      int field = -1;
      if (hasField && !a.isMissing(1)) {
        field = field(database, a.scalar(1));
        if (field < 0) {
          return failed(database, error(VALUE));
        }
      }
      // Map each criteria column to a database column (-1 if blank).
      final int[] columns = new int[criteria.cols];
      for (int c = 0; c < criteria.cols; c++) {
        final Value.Scalar name = criteria.get(0, c);
        if (name instanceof Value.Blank) {
          columns[c] = -1;
        } else {
          columns[c] = field(database, name);
          if (columns[c] < 0) {
            return failed(database, error(VALUE));
          }
        }
      }
      final List<Integer> records = new ArrayList<>();
      for (int r = 1; r < database.rows; r++) {
        if (matches(database, r, criteria, columns)) {
          records.add(r);
        }
      }
      return new Query(database, field, records, null);
    }

    /** Returns the 0-based column named by a field argument: text is a
     * field name, matched case-insensitively, and a number is a 1-based
     * column. Returns -1 if there is no such column. */
    private static int field(ArrayValue database, Value.Scalar field) {
      if (field instanceof Value.Num) {
        final int i = (int) ((Value.Num) field).value;
        return i >= 1 && i <= database.cols ? i - 1 : -1;
      }
      if (field instanceof Value.Text) {
        final String name = ((Value.Text) field).value.trim();
        for (int c = 0; c < database.cols; c++) {
          final Value.Scalar header = Values.toText(database.get(0, c));
          if (header instanceof Value.Text
              && ((Value.Text) header).value.trim().equalsIgnoreCase(name)) {
            return c;
          }
        }
      }
      return -1;
    }

    /** Returns whether a record satisfies any row of the criteria. A
     * criteria range with only a header row selects every record. */
    private static boolean matches(ArrayValue database, int r,
        ArrayValue criteria, int[] columns) {
      if (criteria.rows == 1) {
        return true;
      }
      for (int cr = 1; cr < criteria.rows; cr++) {
        if (matchesRow(database, r, criteria, cr, columns)) {
          return true;
        }
      }
      return false;
    }

    private static boolean matchesRow(ArrayValue database, int r,
        ArrayValue criteria, int cr, int[] columns) {
      for (int c = 0; c < criteria.cols; c++) {
        final Value.Scalar criterion = criteria.get(cr, c);
        if (columns[c] < 0 || criterion instanceof Value.Blank) {
          continue;
        }
        if (!Criteria.of(criterion).test(database.get(r, columns[c]))) {
          return false;
        }
      }
      return true;
    }

    /** Returns the values of the field in the matching records. */
    List<Value.Scalar> values() {
      final List<Value.Scalar> values = new ArrayList<>();
      if (field >= 0) {
        for (int r : records) {
          values.add(database.get(r, field));
        }
      }
      return values;
    }
  }
}

// End DatabaseFunctions.java
