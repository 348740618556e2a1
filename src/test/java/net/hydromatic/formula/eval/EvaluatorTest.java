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

import static net.hydromatic.formula.Fx.fx;
import static net.hydromatic.formula.Matchers.isNumber;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.formula.Formulas;
import net.hydromatic.formula.Fx;
import org.junit.jupiter.api.Test;

/** Tests for {@link Evaluator} and {@link Session}. */
public class EvaluatorTest {
  private static final String FACT =
      "=LAMBDA(n, IF(n <= 1, 1, n * FACT(n - 1)))";

  @Test void testOperators() {
    fx("=1 + 2 * 3").assertNumber(7);
    fx("=(1 + 2) * 3").assertNumber(9);
    fx("=-2 ^ 2").assertNumber(-4);
    fx("=(-2) ^ 2").assertNumber(4);
    fx("=2 ^ 3 ^ 2").assertNumber(64);
    fx("=50%").assertNumber(0.5);
    fx("=\"a\" & 1 + 2").assertText("a3");
    fx("=1 / 0").assertError(ErrorKind.DIV_BY_ZERO);
    fx("=0 ^ 0").assertError(ErrorKind.NUMBER);
    fx("=0 ^ -1").assertError(ErrorKind.DIV_BY_ZERO);
    fx("=\"abc\" = \"ABC\"").assertBool(true);
    fx("=\"a\" < \"b\"").assertBool(true);
  }

  @Test void testCellReferences() {
    final Fx f = fx("=A1 * 2").withCell("A1", 21);
    f.assertNumber(42);
    f.withFormula("=B7").assertNumber(0);
    f.withCell("B1", "x").withFormula("=B1").assertText("x");
    f.withCell("A2", 3).withFormula("=A1:A3").assertArray("{21;3;0}");
    f.withCell("A2", 3).withFormula("=SUM(A3:A1)").assertNumber(24);
  }

  @Test void testUnknownName() {
    fx("=foo").assertError(ErrorKind.NAME);
    fx("=NO_SUCH_FUNCTION(1)").assertError(ErrorKind.NAME);
  }

  @Test void testWrongArgCount() {
    fx("=ABS(1, 2)").assertError(ErrorKind.VALUE);
    fx("=ABS()").assertError(ErrorKind.VALUE);
  }

  @Test void testParseFailureIsNameError() {
    fx("=1 +").assertError(ErrorKind.NAME);
    fx("1 + 2").assertError(ErrorKind.NAME);
  }

  @Test void testLet() {
    fx("=LET(x, 2, y, x * 3, x + y)").assertNumber(8);
    fx("=LET(x, 1, LET(x, 5, x) + x)").assertNumber(6);
    // A LET name may shadow a function name
    fx("=LET(sum, 5, sum + 1)").assertNumber(6);
    fx("=LET(y, 1 / 0, 5)").assertError(ErrorKind.DIV_BY_ZERO);
  }

  @Test void testLambda() {
    fx("=LAMBDA(x, x * 2)(5)").assertNumber(10);
    fx("=LAMBDA(x, y, x - y)(10, 4)").assertNumber(6);
    fx("=LET(k, 10, f, LAMBDA(x, x + k), f(1))").assertNumber(11);
    fx("=LET(twice, LAMBDA(f, x, f(f(x))), "
        + "twice(LAMBDA(n, n * 3), 2))").assertNumber(18);
    fx("=LAMBDA(x, y, x)(1)").assertError(ErrorKind.VALUE);
    fx("=LET(f, 1, f(2))").assertError(ErrorKind.VALUE);
  }

  @Test void testNamedLambda() {
    final Fx f = fx("=DOUBLE(21)").withLambda("double", "=LAMBDA(x, 2 * x)");
    f.assertNumber(42);
    f.withFormula("=double(1) + DOUBLE(2)").assertNumber(6);
    f.withFormula("=MAP({1, 2, 3}, DOUBLE)").assertArray("{2,4,6}");
  }

  /** A range larger than {@link Session#MAX_RANGE_CELLS} is {@code #NUM!},
   * however it is reached; a full column is within the limit. */
  @Test void testLargeRange() {
    final Fx f = fx("=SUM(A1:XFD1048576)").withCell("A1", 1);
    f.assertError(ErrorKind.NUMBER);
    f.withFormula("=SUM(XFD1048576:A1)").assertError(ErrorKind.NUMBER);
    f.withFormula("=SUM(INDIRECT(\"A1:XFD1048576\"))")
        .assertError(ErrorKind.NUMBER);
    f.withFormula("=SUM(OFFSET(A1, 0, 0, 1048576, 16384))")
        .assertError(ErrorKind.NUMBER);
    f.withFormula("=SUM(A1:A1048576)").assertNumber(1);
  }

  @Test void testRecursiveLambda() {
    fx("=FACT(5)").withLambda("FACT", FACT).assertNumber(120);
  }

  @Test void testCallDepth() {
    fx("=LOOP(1)")
        .withLambda("LOOP", "=LAMBDA(n, LOOP(n + 1))")
        .assertError(ErrorKind.NOT_AVAILABLE);
    final Fx f = fx("=FACT(10)").withLambda("FACT", FACT);
    f.assertNumber(3_628_800);
    f.withProp(Prop.MAX_CALL_DEPTH, 5).assertError(ErrorKind.NOT_AVAILABLE);
  }

  @Test void testNotALambda() {
    assertThrows(IllegalArgumentException.class, () ->
        EvalContext.builder().lambda("F", "=1 + 2"));
    assertThrows(IllegalArgumentException.class, () ->
        EvalContext.builder().lambda("F", "=LAMBDA("));
  }

  /** With a fixed seed, volatile functions give the same result each
   * time. */
  @Test void testRandomSeed() {
    final Fx f = fx("=RAND()").withProp(Prop.RANDOM_SEED, 42);
    final Value v1 = f.eval();
    final Value v2 = f.eval();
    assertThat(v1, instanceOf(Value.Num.class));
    assertThat(v2, is(v1));
    final double d = ((Value.Num) v1).value;
    assertThat(d >= 0 && d < 1, is(true));
  }

  @Test void testSessionApply() {
    final EvalContext context = EvalContext.of(Worksheets.empty());
    final Session session = new Session(context);
    final Value fn =
        Formulas.evaluate("=LAMBDA(a, b, a * b)", context);
    assertThat(fn, instanceOf(Closure.class));
    assertThat(
        session.apply(fn, numbers(3, 4)), isNumber(12));
    assertThat(session.apply(Value.number(1), numbers(1)),
        is(Value.error(ErrorKind.VALUE)));
    assertThat(
        session.apply(Value.error(ErrorKind.REFERENCE), numbers(1)),
        is(Value.error(ErrorKind.REFERENCE)));
  }

  private static List<Value> numbers(double... values) {
    final ImmutableList.Builder<Value> list = ImmutableList.builder();
    for (double value : values) {
      list.add(Value.number(value));
    }
    return list.build();
  }
}

// End EvaluatorTest.java
