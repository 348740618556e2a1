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
package net.hydromatic.formula;

import static net.hydromatic.formula.Matchers.isArray;
import static net.hydromatic.formula.Matchers.isBool;
import static net.hydromatic.formula.Matchers.isError;
import static net.hydromatic.formula.Matchers.isNumber;
import static net.hydromatic.formula.Matchers.isText;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableMap;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.formula.eval.Address;
import net.hydromatic.formula.eval.ErrorKind;
import net.hydromatic.formula.eval.EvalContext;
import net.hydromatic.formula.eval.Prop;
import net.hydromatic.formula.eval.Value;
import net.hydromatic.formula.eval.Worksheet;
import net.hydromatic.formula.eval.Worksheets;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.hamcrest.Matcher;

/** Fluent test helper. Evaluates a formula against a worksheet. */
public class Fx {
  private final String formula;
  private final ImmutableMap<String, Object> cells;
  private final ImmutableMap<String, String> lambdas;
  private final ImmutableMap<Prop, Object> propMap;
  private final @Nullable String currentCell;
  private final @Nullable Clock clock;

  private Fx(String formula, ImmutableMap<String, Object> cells,
      ImmutableMap<String, String> lambdas, ImmutableMap<Prop, Object> propMap,
      @Nullable String currentCell, @Nullable Clock clock) {
    this.formula = formula;
    this.cells = cells;
    this.lambdas = lambdas;
    this.propMap = propMap;
    this.currentCell = currentCell;
    this.clock = clock;
  }

  /** Creates an {@code Fx}. */
  public static Fx fx(String formula) {
    return new Fx(formula, ImmutableMap.of(), ImmutableMap.of(),
        ImmutableMap.of(), null, null);
  }

  public Fx withFormula(String formula) {
    return new Fx(formula, cells, lambdas, propMap, currentCell, clock);
  }

  /** Sets the value of a cell. */
  public Fx withCell(String address, Object value) {
    final Map<String, Object> map = new LinkedHashMap<>(cells);
    map.put(address, value);
    return new Fx(formula, ImmutableMap.copyOf(map), lambdas, propMap,
        currentCell, clock);
  }

  /** Sets cells in a column, starting at a given cell and going down. */
  public Fx withColumn(String top, Object... values) {
    final Address a = Address.parseOpt(top);
    Fx fx = this;
    for (int i = 0; i < values.length; i++) {
      fx = fx.withCell(Address.of(a.row + i, a.col).toString(), values[i]);
    }
    return fx;
  }

  /** Sets cells in a row, starting at a given cell and going right. */
  public Fx withRow(String left, Object... values) {
    final Address a = Address.parseOpt(left);
    Fx fx = this;
    for (int i = 0; i < values.length; i++) {
      fx = fx.withCell(Address.of(a.row, a.col + i).toString(), values[i]);
    }
    return fx;
  }

  /** Defines a named lambda, such as
   * {@code withLambda("DOUBLE", "=LAMBDA(x, 2 * x)")}. */
  public Fx withLambda(String name, String lambdaFormula) {
    final Map<String, String> map = new LinkedHashMap<>(lambdas);
    map.put(name, lambdaFormula);
    return new Fx(formula, cells, ImmutableMap.copyOf(map), propMap,
        currentCell, clock);
  }

  public Fx withProp(Prop prop, Object value) {
    final Map<Prop, Object> map = new LinkedHashMap<>(propMap);
    map.put(prop, value);
    return new Fx(formula, cells, lambdas, ImmutableMap.copyOf(map),
        currentCell, clock);
  }

  public Fx withCurrentCell(String address) {
    return new Fx(formula, cells, lambdas, propMap, address, clock);
  }

  public Fx withClock(Clock clock) {
    return new Fx(formula, cells, lambdas, propMap, currentCell, clock);
  }

  /** Builds the evaluation context. */
  public EvalContext context() {
    final Worksheet worksheet = Worksheets.create();
    cells.forEach((address, value) ->
        Worksheets.set(worksheet, address, value));
    final EvalContext.Builder b = EvalContext.builder().worksheet(worksheet);
    lambdas.forEach(b::lambda);
    propMap.forEach(b::set);
    if (currentCell != null) {
      b.currentCell(currentCell);
    }
    if (clock != null) {
      b.clock(clock);
    }
    return b.build();
  }

  /** Evaluates the formula. */
  public Value eval() {
    return Formulas.evaluate(formula, context());
  }

  public Fx assertEval(Matcher<Value> matcher) {
    assertThat(formula, eval(), matcher);
    return this;
  }

  public Fx assertNumber(double expected) {
    return assertEval(isNumber(expected));
  }

  public Fx assertNumber(double expected, double tolerance) {
    return assertEval(isNumber(expected, tolerance));
  }

  public Fx assertText(String expected) {
    return assertEval(isText(expected));
  }

  public Fx assertBool(boolean expected) {
    return assertEval(isBool(expected));
  }

  public Fx assertError(ErrorKind expected) {
    return assertEval(isError(expected));
  }

  public Fx assertArray(String expected) {
    return assertEval(isArray(expected));
  }
}

// End Fx.java
