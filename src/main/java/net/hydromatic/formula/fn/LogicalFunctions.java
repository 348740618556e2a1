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
import static net.hydromatic.formula.eval.ErrorKind.VALUE;
import static net.hydromatic.formula.eval.Value.error;

import java.util.List;
import net.hydromatic.formula.compile.BuiltIn;
import net.hydromatic.formula.eval.ArrayValue;
import net.hydromatic.formula.eval.Broadcast;
import net.hydromatic.formula.eval.Closure;
import net.hydromatic.formula.eval.Deferred;
import net.hydromatic.formula.eval.ErrorKind;
import net.hydromatic.formula.eval.Session;
import net.hydromatic.formula.eval.Value;
import net.hydromatic.formula.eval.Values;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Logical functions.
 *
 * <p>Most are lazy: they evaluate only the arguments they need, so that
 * {@code IF(TRUE, 1, 1/0)} is 1, not {@code #DIV/0!}.
 */
abstract class LogicalFunctions {
  private LogicalFunctions() {}

  static void populate(Codes.Builder b) {
    b.putLazy(BuiltIn.AND, (session, args) -> andOr(args, true));
    b.put(BuiltIn.FALSE, (session, args) -> Value.FALSE);
    b.putLazy(BuiltIn.IF, LogicalFunctions::if_);
    b.putLazy(BuiltIn.IFERROR, (session, args) ->
        ifError(args, kind -> true));
    b.putLazy(BuiltIn.IFNA, (session, args) ->
        ifError(args, kind -> kind == NOT_AVAILABLE));
    b.putLazy(BuiltIn.IFS, (session, args) -> {
      if (args.size() % 2 != 0) {
        return error(VALUE);
      }
      for (int i = 0; i < args.size(); i += 2) {
        final Value.Scalar test = Values.toBool(Values.first(
            args.get(i).force()));
        if (test instanceof Value.Err) {
          return test;
        }
        if (((Value.Bool) test).value) {
          return args.get(i + 1).force();
        }
      }
      return error(NOT_AVAILABLE);
    });
    b.putLazy(BuiltIn.NOT, (session, args) ->
        Broadcast.map(args.get(0).force(), s -> {
          final Value.Scalar v = Values.toBool(s);
          return v instanceof Value.Bool ? Value.bool(!((Value.Bool) v).value)
              : v;
        }));
    b.putLazy(BuiltIn.OR, (session, args) -> andOr(args, false));
    b.putLazy(BuiltIn.SWITCH, LogicalFunctions::switch_);
    b.put(BuiltIn.TRUE, (session, args) -> Value.TRUE);
    b.put(BuiltIn.XOR, (session, args) -> {
      int trues = 0;
      int count = 0;
      for (Value arg : args) {
        for (Value.Scalar s : Values.toArray(arg).cells()) {
          final Value.Scalar v = logical(s, arg instanceof ArrayValue);
          if (v instanceof Value.Err) {
            return v;
          }
          if (v instanceof Value.Bool) {
            ++count;
            if (((Value.Bool) v).value) {
              ++trues;
            }
          }
        }
      }
      return count == 0 ? error(VALUE) : Value.bool(trues % 2 == 1);
    });
  }

  /**
   * Converts an argument of {@code AND}, {@code OR} or {@code XOR} to a
   * boolean. Inside an array, text and blanks are ignored (returns null).
   */
  private static Value.@Nullable Scalar logical(Value.Scalar s,
      boolean inArray) {
    switch (s.kind()) {
    case BLANK:
      return null;
    case TEXT:
      return inArray ? null : Values.toBool(s);
    default:
      return Values.toBool(s);
    }
  }

  /** Implements {@code AND} and {@code OR}. Stops at the first argument
   * that decides the result. */
  private static Value andOr(List<Deferred> args, boolean and) {
    int count = 0;
    for (Deferred arg : args) {
      final Value v = arg.force();
      if (v instanceof Closure) {
        return error(VALUE);
      }
      for (Value.Scalar s : Values.toArray(v).cells()) {
        final Value.Scalar b = logical(s, v instanceof ArrayValue);
        if (b instanceof Value.Err) {
          return b;
        }
        if (b instanceof Value.Bool) {
          ++count;
          if (((Value.Bool) b).value != and) {
            return Value.bool(!and);
          }
        }
      }
    }
    return count == 0 ? error(VALUE) : Value.bool(and);
  }

  private static Value if_(Session session, List<Deferred> args) {
    final Value test = args.get(0).force();
    if (test instanceof ArrayValue && ((ArrayValue) test).size() > 1) {
      // Element-wise; evaluates both branches.
      final ArrayValue tests = (ArrayValue) test;
      final Value ifTrue = args.get(1).force();
      final Value ifFalse =
          args.size() > 2 ? args.get(2).force() : Value.FALSE;
      return elementWise(tests, ifTrue, ifFalse);
    }
    final Value.Scalar b = Values.toBool(Values.first(test));
    if (b instanceof Value.Err) {
      return b;
    }
    if (((Value.Bool) b).value) {
      return args.get(1).force();
    }
    return args.size() > 2 ? args.get(2).force() : Value.FALSE;
  }

  /** Chooses, for each element of an array of tests, the corresponding
   * element of one of two branches. */
  private static Value elementWise(ArrayValue tests, Value ifTrue,
      Value ifFalse) {
    final Value.Scalar[] cells = new Value.Scalar[tests.size()];
    for (int r = 0; r < tests.rows; r++) {
      for (int c = 0; c < tests.cols; c++) {
        final Value.Scalar b = Values.toBool(tests.get(r, c));
        final int i = r * tests.cols + c;
        if (b instanceof Value.Err) {
          cells[i] = b;
        } else {
          cells[i] = element(((Value.Bool) b).value ? ifTrue : ifFalse, r, c);
        }
      }
    }
    return ArrayValue.of(tests.rows, tests.cols, cells);
  }

  /** Returns the element of a value at a given position; a scalar or 1 x 1
   * array is the same at every position. */
  static Value.Scalar element(Value v, int r, int c) {
    if (v instanceof ArrayValue) {
      final ArrayValue a = (ArrayValue) v;
      if (a.size() == 1) {
        return a.get(0);
      }
      if (a.rows == 1 && c < a.cols) {
        return a.get(0, c);
      }
      if (a.cols == 1 && r < a.rows) {
        return a.get(r, 0);
      }
      return r < a.rows && c < a.cols ? a.get(r, c) : error(NOT_AVAILABLE);
    }
    return Values.first(v);
  }

  /** Implements {@code IFERROR} and {@code IFNA}. */
  private static Value ifError(List<Deferred> args, ErrorTest test) {
    final Value v = args.get(0).force();
    if (v instanceof Value.Err) {
      return test.test(((Value.Err) v).error) ? args.get(1).force() : v;
    }
    if (v instanceof ArrayValue && ((ArrayValue) v).firstError() != null) {
      final Value fallback = args.get(1).force();
      return ((ArrayValue) v).map(s ->
          s instanceof Value.Err && test.test(((Value.Err) s).error)
              ? Values.first(fallback) : s);
    }
    return v;
  }

  private static Value switch_(Session session, List<Deferred> args) {
    final Value.Scalar v = Values.first(args.get(0).force());
    if (v instanceof Value.Err) {
      return v;
    }
    int i = 1;
    for (; i + 1 < args.size(); i += 2) {
      final Value.Scalar candidate = Values.first(args.get(i).force());
      if (candidate instanceof Value.Err) {
        return candidate;
      }
      if (Values.lookupEquals(v, candidate)) {
        return args.get(i + 1).force();
      }
    }
    return i < args.size() ? args.get(i).force() : error(NOT_AVAILABLE);
  }

  /** Predicate on an error kind. */
  @FunctionalInterface
  private interface ErrorTest {
    boolean test(ErrorKind kind);
  }
}

// End LogicalFunctions.java
