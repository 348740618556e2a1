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
import static net.hydromatic.formula.eval.Value.error;

import java.util.List;
import java.util.function.Predicate;
import net.hydromatic.formula.compile.BuiltIn;
import net.hydromatic.formula.eval.Applicable;
import net.hydromatic.formula.eval.ArgList;
import net.hydromatic.formula.eval.ArrayValue;
import net.hydromatic.formula.eval.Closure;
import net.hydromatic.formula.eval.Value;
import net.hydromatic.formula.eval.Values;

/** Information functions, which test the type of a value. */
abstract class InformationFunctions {
  private InformationFunctions() {}

  static void populate(Codes.Builder b) {
    b.put(BuiltIn.ERROR_TYPE, (session, args) -> {
      final Value.Scalar s = Values.first(args.get(0));
      return s instanceof Value.Err
          ? Value.number(((Value.Err) s).error.code)
          : error(NOT_AVAILABLE);
    });
    b.put(BuiltIn.ISBLANK, is(s -> s instanceof Value.Blank));
    b.put(BuiltIn.ISERR, is(s -> s instanceof Value.Err
        && ((Value.Err) s).error != NOT_AVAILABLE));
    b.put(BuiltIn.ISERROR, is(s -> s instanceof Value.Err));
    b.put(BuiltIn.ISEVEN, (session, args) -> isEvenOdd(args, 0));
    b.put(BuiltIn.ISLOGICAL, is(s -> s instanceof Value.Bool));
    b.put(BuiltIn.ISNA, is(s -> s instanceof Value.Err
        && ((Value.Err) s).error == NOT_AVAILABLE));
    b.put(BuiltIn.ISNONTEXT, is(s -> !(s instanceof Value.Text)));
    b.put(BuiltIn.ISNUMBER, is(s -> s instanceof Value.Num));
    b.put(BuiltIn.ISODD, (session, args) -> isEvenOdd(args, 1));
    b.put(BuiltIn.ISOMITTED, (session, args) -> {
      final Value v = args.get(0);
      return Value.bool(v instanceof Value.Blank && ((Value.Blank) v).omitted);
    });
    b.putLazy(BuiltIn.ISREF, (session, args) ->
        Value.bool(args.get(0).reference() != null));
    b.put(BuiltIn.ISTEXT, is(s -> s instanceof Value.Text));
    b.put(BuiltIn.N, (session, args) -> {
      final Value.Scalar s = Values.first(args.get(0));
      switch (s.kind()) {
      case NUMBER:
      case ERROR:
        return s;
      case BOOLEAN:
        return Values.toNumber(s);
      default:
        return Value.ZERO;
      }
    });
    b.put(BuiltIn.NA, (session, args) -> error(NOT_AVAILABLE));
    b.put(BuiltIn.TYPE, (session, args) -> {
      Value v = args.get(0);
      if (v instanceof ArrayValue && ((ArrayValue) v).size() == 1) {
        v = ((ArrayValue) v).get(0);
      }
      if (v instanceof Closure) {
        return Value.number(128);
      }
      switch (v.kind()) {
      case TEXT:
        return Value.number(2);
      case BOOLEAN:
        return Value.number(4);
      case ERROR:
        return Value.number(16);
      case ARRAY:
        return Value.number(64);
      default:
        return Value.number(1);
      }
    });
  }

  /** Returns an implementation of a function that tests its argument. */
  private static Applicable is(Predicate<Value.Scalar> predicate) {
    return (session, args) -> {
      final Value v = args.get(0);
      if (v instanceof Closure) {
        return Value.FALSE;
      }
      return Value.bool(predicate.test(Values.first(v)));
    };
  }

  private static Value isEvenOdd(List<Value> args, int remainder) {
    final ArgList a = ArgList.of(args);
    final double x = a.num(0);
    if (a.failed()) {
      return a.error();
    }
    return Value.bool(Math.abs((long) x) % 2 == remainder);
  }
}

// End InformationFunctions.java
