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

import static com.google.common.base.Preconditions.checkArgument;
import static net.hydromatic.formula.eval.ErrorKind.NUMBER;
import static net.hydromatic.formula.eval.Value.error;

import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.DoublePredicate;
import java.util.function.DoubleUnaryOperator;
import net.hydromatic.formula.compile.ArgMode;
import net.hydromatic.formula.compile.BuiltIn;
import net.hydromatic.formula.eval.Applicable;
import net.hydromatic.formula.eval.ArgList;
import net.hydromatic.formula.eval.LazyApplicable;
import net.hydromatic.formula.eval.Value;

/** Implementations of built-in functions. */
public abstract class Codes {
  private Codes() {}

  /** Implementation of each built-in function: an {@link Applicable} for
   * eager functions, a {@link LazyApplicable} for lazy functions. Functions
   * that are syntax ({@code LAMBDA}, {@code LET}) have no entry. */
  public static final ImmutableMap<BuiltIn, Object> BUILT_IN_VALUES;

  static {
    final Builder b = new Builder();
    MathFunctions.populate(b);
    StatisticalFunctions.populate(b);
    TextFunctions.populate(b);
    LogicalFunctions.populate(b);
    InformationFunctions.populate(b);
    LookupFunctions.populate(b);
    ArrayFunctions.populate(b);
    LambdaFunctions.populate(b);
    DateTimeFunctions.populate(b);
    FinancialFunctions.populate(b);
    EngineeringFunctions.populate(b);
    DatabaseFunctions.populate(b);
    BUILT_IN_VALUES = b.build();
  }

  /** Returns an implementation of a function of one number. */
  static Applicable unary(DoubleUnaryOperator f) {
    return (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double x = a.num(0);
      return a.failed() ? a.error() : Value.number(f.applyAsDouble(x));
    };
  }

  /** Returns an implementation of a function of one number that returns
   * {@code #NUM!} if the argument is outside its domain. */
  static Applicable unary(DoublePredicate domain, DoubleUnaryOperator f) {
    return (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double x = a.num(0);
      if (a.failed()) {
        return a.error();
      }
      return domain.test(x) ? Value.number(f.applyAsDouble(x)) : error(NUMBER);
    };
  }

  /** Returns an implementation of a function of two numbers. */
  static Applicable binary(DoubleFunction2 f) {
    return (session, args) -> {
      final ArgList a = ArgList.of(args);
      final double x = a.num(0);
      final double y = a.num(1);
      return a.failed() ? a.error() : f.apply(x, y);
    };
  }

  /** Function of two numbers. */
  @FunctionalInterface
  interface DoubleFunction2 {
    Value.Scalar apply(double x, double y);
  }

  /** Collects the implementations of built-in functions. */
  public static class Builder {
    private final Map<BuiltIn, Object> map = new EnumMap<>(BuiltIn.class);

    Builder() {}

    /** Registers the implementation of an eager function. */
    @CanIgnoreReturnValue
    public Builder put(BuiltIn builtIn, Applicable applicable) {
      checkArgument(builtIn.argMode == ArgMode.EAGER,
          "%s is not eager", builtIn);
      return put_(builtIn, applicable);
    }

    /** Registers the implementation of a lazy function. */
    @CanIgnoreReturnValue
    public Builder putLazy(BuiltIn builtIn, LazyApplicable applicable) {
      checkArgument(builtIn.argMode == ArgMode.LAZY,
          "%s is not lazy", builtIn);
      return put_(builtIn, applicable);
    }

    private Builder put_(BuiltIn builtIn, Object impl) {
      if (map.put(builtIn, impl) != null) {
        throw new IllegalStateException("duplicate implementation of "
            + builtIn);
      }
      return this;
    }

    /** Creates the map; throws if any function lacks an implementation. */
    ImmutableMap<BuiltIn, Object> build() {
      final List<BuiltIn> missing = new ArrayList<>();
      for (BuiltIn builtIn : BuiltIn.values()) {
        if (builtIn.argMode != ArgMode.SYNTAX && !map.containsKey(builtIn)) {
          missing.add(builtIn);
        }
      }
      if (!missing.isEmpty()) {
        throw new IllegalStateException("no implementation for " + missing);
      }
      return ImmutableMap.copyOf(map);
    }
  }
}

// End Codes.java
