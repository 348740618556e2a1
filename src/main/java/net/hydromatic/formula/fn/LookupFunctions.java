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
import static net.hydromatic.formula.eval.ErrorKind.REFERENCE;
import static net.hydromatic.formula.eval.ErrorKind.VALUE;
import static net.hydromatic.formula.eval.Value.error;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.hydromatic.formula.compile.BuiltIn;
import net.hydromatic.formula.eval.Address;
import net.hydromatic.formula.eval.ArgList;
import net.hydromatic.formula.eval.ArrayValue;
import net.hydromatic.formula.eval.Broadcast;
import net.hydromatic.formula.eval.Closure;
import net.hydromatic.formula.eval.Deferred;
import net.hydromatic.formula.eval.Range;
import net.hydromatic.formula.eval.Session;
import net.hydromatic.formula.eval.Value;
import net.hydromatic.formula.eval.Values;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Lookup and reference functions. */
abstract class LookupFunctions {
  private static final Pattern R1C1 =
      Pattern.compile("R([0-9]+)C([0-9]+)", Pattern.CASE_INSENSITIVE);

  private LookupFunctions() {}

  static void populate(Codes.Builder b) {
    b.put(BuiltIn.ADDRESS, LookupFunctions::address);
    b.putLazy(BuiltIn.CHOOSE, (session, args) -> {
      final ArgList a = ArgList.of(ImmutableList.of(args.get(0).force()));
      final int index = a.integer(0);
      if (a.failed()) {
        return a.error();
      }
      if (index < 1 || index >= args.size()) {
        return error(VALUE);
      }
      return args.get(index).force();
    });
    b.putLazy(BuiltIn.COLUMN, (session, args) -> rowColumn(session, args,
        false));
    b.put(BuiltIn.COLUMNS, (session, args) -> {
      final Value v = args.get(0);
      if (v instanceof Closure) {
        return error(VALUE);
      }
      return Value.number(Values.toArray(v).cols);
    });
    b.put(BuiltIn.HLOOKUP, (session, args) -> vhLookup(args, false));
    b.put(BuiltIn.INDEX, LookupFunctions::index);
    b.put(BuiltIn.INDIRECT, LookupFunctions::indirect);
    b.put(BuiltIn.LOOKUP_, LookupFunctions::lookup);
    b.put(BuiltIn.MATCH, LookupFunctions::match);
    b.putLazy(BuiltIn.OFFSET, LookupFunctions::offset);
    b.putLazy(BuiltIn.ROW, (session, args) -> rowColumn(session, args, true));
    b.put(BuiltIn.ROWS, (session, args) -> {
      final Value v = args.get(0);
      if (v instanceof Closure) {
        return error(VALUE);
      }
      return Value.number(Values.toArray(v).rows);
    });
    b.put(BuiltIn.VLOOKUP, (session, args) -> vhLookup(args, true));
    b.put(BuiltIn.XLOOKUP, LookupFunctions::xlookup);
    b.put(BuiltIn.XMATCH, LookupFunctions::xmatch);
  }

  /** How {@link #search} compares elements to the key. */
  enum MatchMode {
    EXACT,
    /** Exact match, or the largest element less than the key. */
    EXACT_OR_SMALLER,
    /** Exact match, or the smallest element greater than the key. */
    EXACT_OR_LARGER,
    /** Exact match, where text keys may contain wildcards. */
    WILDCARD;

    static @Nullable MatchMode ofXlookup(int code) {
      switch (code) {
      case 0:
        return EXACT;
      case -1:
        return EXACT_OR_SMALLER;
      case 1:
        return EXACT_OR_LARGER;
      case 2:
        return WILDCARD;
      default:
        return null;
      }
    }
  }

  /** Order in which {@link #search} visits elements. */
  enum SearchMode {
    FIRST_TO_LAST,
    LAST_TO_FIRST,
    /** Binary search; the caller asserts that the elements are sorted
     * ascending. */
    BINARY_ASCENDING,
    /** Binary search; the caller asserts that the elements are sorted
     * descending. */
    BINARY_DESCENDING;

    static @Nullable SearchMode ofXlookup(int code) {
      switch (code) {
      case 1:
        return FIRST_TO_LAST;
      case -1:
        return LAST_TO_FIRST;
      case 2:
        return BINARY_ASCENDING;
      case -2:
        return BINARY_DESCENDING;
      default:
        return null;
      }
    }
  }

  /**
   * Searches a vector for a key. Returns the 0-based index of the matching
   * element, or -1.
   */
  static int search(Value.Scalar key, List<Value.Scalar> vector,
      MatchMode matchMode, SearchMode searchMode) {
    switch (searchMode) {
    case BINARY_ASCENDING:
    case BINARY_DESCENDING:
      return binarySearch(key, vector, matchMode,
          searchMode == SearchMode.BINARY_DESCENDING);
    default:
      return linearSearch(key, vector, matchMode,
          searchMode == SearchMode.LAST_TO_FIRST);
    }
  }

  private static int linearSearch(Value.Scalar key, List<Value.Scalar> vector,
      MatchMode matchMode, boolean reverse) {
    // In wildcard mode, "~" escapes; a key with only escaped wildcards
    // ("a~*") matches its unescaped text.
    final Pattern pattern = matchMode == MatchMode.WILDCARD
        && key instanceof Value.Text
        ? Wildcards.toPattern(((Value.Text) key).value) : null;
    int best = -1;
    final int n = vector.size();
    for (int k = 0; k < n; k++) {
      final int i = reverse ? n - 1 - k : k;
      final Value.Scalar e = vector.get(i);
      if (pattern != null) {
        if (e instanceof Value.Text
            && pattern.matcher(((Value.Text) e).value).matches()) {
          return i;
        }
        continue;
      }
      if (Values.lookupEquals(key, e)) {
        return i;
      }
      if (e.kind() != key.kind()) {
        continue;
      }
      final int c = Values.compare(e, key);
      switch (matchMode) {
      case EXACT_OR_SMALLER:
        if (c < 0 && (best < 0 || Values.compare(e, vector.get(best)) > 0)) {
          best = i;
        }
        break;
      case EXACT_OR_LARGER:
        if (c > 0 && (best < 0 || Values.compare(e, vector.get(best)) < 0)) {
          best = i;
        }
        break;
      default:
        break;
      }
    }
    return best;
  }

  private static int binarySearch(Value.Scalar key, List<Value.Scalar> vector,
      MatchMode matchMode, boolean descending) {
    final int sign = descending ? -1 : 1;
    // Index of the last element that sorts at or before the key
    int lo = 0;
    int hi = vector.size() - 1;
    int lastBefore = -1;
    while (lo <= hi) {
      final int mid = (lo + hi) >>> 1;
      final int c = sign * Values.compare(vector.get(mid), key);
      if (c <= 0) {
        lastBefore = mid;
        lo = mid + 1;
      } else {
        hi = mid - 1;
      }
    }
    if (lastBefore >= 0
        && Values.lookupEquals(key, vector.get(lastBefore))) {
      return lastBefore;
    }
    final int firstAfter = lastBefore + 1;
    final int candidate;
    switch (matchMode) {
    case EXACT_OR_SMALLER:
      candidate = descending ? firstAfter : lastBefore;
      break;
    case EXACT_OR_LARGER:
      candidate = descending ? lastBefore : firstAfter;
      break;
    default:
      return -1;
    }
    if (candidate < 0 || candidate >= vector.size()
        || vector.get(candidate).kind() != key.kind()) {
      return -1;
    }
    return candidate;
  }

  /** Returns a vector as a list; null if the array is not a vector. */
  private static @Nullable List<Value.Scalar> vector(ArrayValue a) {
    if (a.rows == 1) {
      return a.row(0).cells();
    }
    if (a.cols == 1) {
      return a.column(0).cells();
    }
    return null;
  }

  /** Implements {@code VLOOKUP} and {@code HLOOKUP}. */
  private static Value vhLookup(List<Value> args, boolean vertical) {
    final ArgList a = ArgList.of(args);
    final Value.Scalar key = a.scalar(0);
    final ArrayValue table = a.array(1);
    final int index = a.integer(2);
    final boolean approximate = a.bool(3, true);
    if (key instanceof Value.Err) {
      return key;
    }
    if (a.failed()) {
      return a.error();
    }
    if (index < 1) {
      return error(VALUE);
    }
    if (index > (vertical ? table.cols : table.rows)) {
      return error(REFERENCE);
    }
    final List<Value.Scalar> keys =
        vertical ? table.column(0).cells() : table.row(0).cells();
    final int i = approximate
        ? search(key, keys, MatchMode.EXACT_OR_SMALLER,
            SearchMode.BINARY_ASCENDING)
        : search(key, keys, MatchMode.WILDCARD, SearchMode.FIRST_TO_LAST);
    if (i < 0) {
      return error(NOT_AVAILABLE);
    }
    return vertical ? table.get(i, index - 1) : table.get(index - 1, i);
  }

  private static Value lookup(Session session, List<Value> args) {
    final ArgList a = ArgList.of(args);
    final Value.Scalar key = a.scalar(0);
    final ArrayValue array = a.array(1);
    if (key instanceof Value.Err) {
      return key;
    }
    if (a.failed()) {
      return a.error();
    }
    final List<Value.Scalar> keys;
    final List<Value.Scalar> results;
    if (!a.isMissing(2)) {
      final List<Value.Scalar> k = vector(array);
      final List<Value.Scalar> r = vector(a.array(2));
      if (k == null || r == null) {
        return error(NOT_AVAILABLE);
      }
      keys = k;
      results = r;
    } else if (array.cols > array.rows) {
      keys = array.row(0).cells();
      results = array.row(array.rows - 1).cells();
    } else {
      keys = array.column(0).cells();
      results = array.column(array.cols - 1).cells();
    }
    final int i = search(key, keys, MatchMode.EXACT_OR_SMALLER,
        SearchMode.BINARY_ASCENDING);
    if (i < 0 || i >= results.size()) {
      return error(NOT_AVAILABLE);
    }
    return results.get(i);
  }

  private static Value match(Session session, List<Value> args) {
    final ArgList a = ArgList.of(args);
    final Value.Scalar key = a.scalar(0);
    final ArrayValue array = a.array(1);
    final int type = a.integer(2, 1);
    if (key instanceof Value.Err) {
      return key;
    }
    if (a.failed()) {
      return a.error();
    }
    final List<Value.Scalar> vector = vector(array);
    if (vector == null) {
      return error(NOT_AVAILABLE);
    }
    final int i;
    if (type == 0) {
      i = search(key, vector, MatchMode.WILDCARD, SearchMode.FIRST_TO_LAST);
    } else if (type > 0) {
      i = search(key, vector, MatchMode.EXACT_OR_SMALLER,
          SearchMode.BINARY_ASCENDING);
    } else {
      i = search(key, vector, MatchMode.EXACT_OR_LARGER,
          SearchMode.BINARY_DESCENDING);
    }
    return i < 0 ? error(NOT_AVAILABLE) : Value.number(i + 1);
  }

  private static Value xlookup(Session session, List<Value> args) {
    final ArgList a = ArgList.of(args);
    final Value keys = args.get(0);
    final ArrayValue lookupArray = a.array(1);
    final ArrayValue returnArray = a.array(2);
    final MatchMode matchMode = MatchMode.ofXlookup(a.integer(4, 0));
    final SearchMode searchMode = SearchMode.ofXlookup(a.integer(5, 1));
    if (a.failed()) {
      return a.error();
    }
    if (matchMode == null || searchMode == null) {
      return error(VALUE);
    }
    final List<Value.Scalar> vector = vector(lookupArray);
    if (vector == null) {
      return error(VALUE);
    }
    final boolean vertical = lookupArray.cols == 1;
    if (vertical ? returnArray.rows != lookupArray.rows
        : returnArray.cols != lookupArray.cols) {
      return error(VALUE);
    }
    if (keys instanceof ArrayValue && ((ArrayValue) keys).size() > 1) {
      return ((ArrayValue) keys).map(key ->
          Values.first(xlookup1(key, vector, returnArray, vertical, matchMode,
              searchMode, a)));
    }
    return xlookup1(Values.first(keys), vector, returnArray, vertical,
        matchMode, searchMode, a);
  }

  private static Value xlookup1(Value.Scalar key, List<Value.Scalar> vector,
      ArrayValue returnArray, boolean vertical, MatchMode matchMode,
      SearchMode searchMode, ArgList a) {
    if (key instanceof Value.Err) {
      return key;
    }
    final int i = search(key, vector, matchMode, searchMode);
    if (i < 0) {
      return a.isMissing(3) ? error(NOT_AVAILABLE) : a.get(3);
    }
    final ArrayValue result =
        vertical ? returnArray.row(i) : returnArray.column(i);
    return result.size() == 1 ? result.get(0) : result;
  }

  private static Value xmatch(Session session, List<Value> args) {
    final ArgList a = ArgList.of(args);
    final Value keys = args.get(0);
    final ArrayValue array = a.array(1);
    final MatchMode matchMode = MatchMode.ofXlookup(a.integer(2, 0));
    final SearchMode searchMode = SearchMode.ofXlookup(a.integer(3, 1));
    if (a.failed()) {
      return a.error();
    }
    if (matchMode == null || searchMode == null) {
      return error(VALUE);
    }
    final List<Value.Scalar> vector = vector(array);
    if (vector == null) {
      return error(NOT_AVAILABLE);
    }
    return Broadcast.map(keys, key -> {
      if (key instanceof Value.Err) {
        return key;
      }
      final int i = search(key, vector, matchMode, searchMode);
      return i < 0 ? error(NOT_AVAILABLE) : Value.number(i + 1);
    });
  }

  private static Value index(Session session, List<Value> args) {
    final ArgList a = ArgList.of(args);
    final ArrayValue array = a.array(0);
    int row = a.integer(1, 0);
    int col = a.integer(2, 0);
    if (a.failed()) {
      return a.error();
    }
    if (row < 0 || col < 0) {
      return error(VALUE);
    }
    if (array.rows == 1 && a.isMissing(2) && array.cols > 1) {
      // A single index into a row selects a column
      col = row;
      row = 1;
    }
    if (row > array.rows || col > array.cols) {
      return error(REFERENCE);
    }
    if (row == 0 && col == 0) {
      return array;
    }
    if (row == 0) {
      return array.column(col - 1);
    }
    if (col == 0) {
      return array.cols == 1 ? array.get(row - 1, 0) : array.row(row - 1);
    }
    return array.get(row - 1, col - 1);
  }

  private static Value indirect(Session session, List<Value> args) {
    final ArgList a = ArgList.of(args);
    final String text = a.text(0).trim();
    final boolean a1 = a.bool(1, true);
    if (a.failed()) {
      return a.error();
    }
    final Range range = a1 ? Range.parseOpt(text) : parseR1C1(text);
    if (range == null) {
      return error(REFERENCE);
    }
    return range.isCell() ? session.cell(range.start) : session.range(range);
  }

  /** Parses an absolute R1C1 reference such as "R2C3" or "R1C1:R2C2". */
  private static @Nullable Range parseR1C1(String text) {
    final String[] parts = text.split(":", -1);
    if (parts.length > 2) {
      return null;
    }
    final List<Address> addresses = new ArrayList<>();
    for (String part : parts) {
      final Matcher m = R1C1.matcher(part);
      if (!m.matches()) {
        return null;
      }
      final int row = Integer.parseInt(m.group(1)) - 1;
      final int col = Integer.parseInt(m.group(2)) - 1;
      if (!Address.isValid(row, col)) {
        return null;
      }
      addresses.add(Address.of(row, col));
    }
    return Range.of(addresses.get(0), addresses.get(addresses.size() - 1));
  }

  private static Value address(Session session, List<Value> args) {
    final ArgList a = ArgList.of(args);
    final int row = a.integer(0);
    final int col = a.integer(1);
    final int abs = a.integer(2, 1);
    final boolean a1 = a.bool(3, true);
    final String sheet = a.text(4, "");
    if (a.failed()) {
      return a.error();
    }
    if (!Address.isValid(row - 1, col - 1) || abs < 1 || abs > 4) {
      return error(VALUE);
    }
    final boolean absRow = abs == 1 || abs == 2;
    final boolean absCol = abs == 1 || abs == 3;
    final StringBuilder b = new StringBuilder();
    if (!sheet.isEmpty()) {
      if (sheet.matches("[A-Za-z0-9_.]+")) {
        b.append(sheet);
      } else {
        b.append('\'').append(sheet.replace("'", "''")).append('\'');
      }
      b.append('!');
    }
    if (a1) {
      b.append(absCol ? "$" : "").append(Address.columnName(col - 1))
          .append(absRow ? "$" : "").append(row);
    } else {
      b.append('R').append(absRow ? Integer.toString(row) : "[" + row + "]")
          .append('C').append(absCol ? Integer.toString(col) : "[" + col + "]");
    }
    return Value.text(b.toString());
  }

  /** Implements {@code ROW} and {@code COLUMN}. */
  private static Value rowColumn(Session session, List<Deferred> args,
      boolean row) {
    if (args.isEmpty() || args.get(0).isMissing()) {
      final Address current = session.currentCell();
      if (current == null) {
        return error(VALUE);
      }
      return Value.number((row ? current.row : current.col) + 1);
    }
    final Range range = args.get(0).reference();
    if (range == null) {
      final Value v = args.get(0).force();
      return v instanceof Value.Err ? v : error(VALUE);
    }
    final int first = row ? range.firstRow() : range.firstCol();
    final int count = row ? range.rows() : range.cols();
    if (count == 1) {
      return Value.number(first + 1);
    }
    final List<Value.Scalar> numbers = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      numbers.add(Value.number(first + i + 1));
    }
    return row ? ArrayValue.column(numbers) : ArrayValue.row(numbers);
  }

  private static Value offset(Session session, List<Deferred> args) {
    final Range range = args.get(0).reference();
    if (range == null) {
      final Value v = args.get(0).force();
      return v instanceof Value.Err ? v : error(VALUE);
    }
    final List<Value> values = new ArrayList<>();
    for (Deferred arg : args.subList(1, args.size())) {
      values.add(arg.force());
    }
    final ArgList a = ArgList.of(values);
    final int rows = a.integer(0);
    final int cols = a.integer(1);
    final int height = a.integer(2, range.rows());
    final int width = a.integer(3, range.cols());
    if (a.failed()) {
      return a.error();
    }
    if (height < 1 || width < 1) {
      return error(REFERENCE);
    }
    final Range target = range.offsetOpt(rows, cols, height, width);
    if (target == null) {
      return error(REFERENCE);
    }
    return target.isCell() ? session.cell(target.start)
        : session.range(target);
  }
}

// End LookupFunctions.java
