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

import static net.hydromatic.formula.Fx.fx;

import net.hydromatic.formula.eval.ErrorKind;
import org.junit.jupiter.api.Test;

/** Tests for functions that take a lambda argument. */
public class LambdaFunctionsTest {
  @Test void testMap() {
    fx("=MAP({1,2,3}, LAMBDA(x, x * 2))").assertArray("{2,4,6}");
    fx("=MAP({1,2}, {10,20}, LAMBDA(a, b, a + b))").assertArray("{11,22}");
    fx("=MAP({1;2}, 10, LAMBDA(a, b, a + b))").assertArray("{11;12}");
    fx("=MAP({1,0}, LAMBDA(x, 1 / x))").assertArray("{1,#DIV/0!}");
    fx("=MAP({1,2}, LAMBDA(x, {1,2}))").assertArray("{#VALUE!,#VALUE!}");
    fx("=MAP(A1:A2, LAMBDA(x, UPPER(x)))")
        .withColumn("A1", "a", "b")
        .assertArray("{\"A\";\"B\"}");
    fx("=MAP({1,2}, {1,2,3}, LAMBDA(a, b, a + b))")
        .assertError(ErrorKind.VALUE);
    fx("=MAP({1,2}, LAMBDA(a, b, a + b))").assertError(ErrorKind.VALUE);
    fx("=MAP({1,2}, 5)").assertError(ErrorKind.VALUE);
  }

  @Test void testReduce() {
    fx("=REDUCE(0, {1,2,3}, LAMBDA(acc, x, acc + x))").assertNumber(6);
    fx("=REDUCE(1, {1,2;3,4}, LAMBDA(acc, x, acc * x))").assertNumber(24);
    fx("=REDUCE({1,2,3}, LAMBDA(acc, x, acc + x))").assertNumber(6);
    fx("=REDUCE(, {1,2,3}, LAMBDA(acc, x, acc + x))").assertNumber(6);
    fx("=REDUCE(\"\", {\"a\",\"b\"}, LAMBDA(acc, x, acc & x))")
        .assertText("ab");
    fx("=REDUCE(0, {1,2}, LAMBDA(acc, acc))").assertError(ErrorKind.VALUE);
    fx("=REDUCE(0, {1,2}, 3)").assertError(ErrorKind.VALUE);

    // A named lambda may be passed by name
    fx("=REDUCE(0, {1,2,3}, ADD)")
        .withLambda("ADD", "=LAMBDA(a, b, a + b)")
        .assertNumber(6);
  }

  @Test void testScan() {
    fx("=SCAN(0, {1,2,3}, LAMBDA(acc, x, acc + x))").assertArray("{1,3,6}");
    fx("=SCAN(\"\", {\"a\",\"b\"}, LAMBDA(acc, x, acc & x))")
        .assertArray("{\"a\",\"ab\"}");
    fx("=SCAN(1, {1,2;3,4}, LAMBDA(acc, x, acc * x))")
        .assertArray("{1,2;6,24}");
  }

  @Test void testByRowAndByCol() {
    fx("=BYROW({1,2;3,4}, LAMBDA(r, SUM(r)))").assertArray("{3;7}");
    fx("=BYCOL({1,2;3,4}, LAMBDA(c, SUM(c)))").assertArray("{4,6}");
    fx("=BYCOL({1,2;3,4}, LAMBDA(c, ROWS(c)))").assertArray("{2,2}");
    fx("=BYROW({1,2;3,4}, LAMBDA(r, r))")
        .assertArray("{#VALUE!;#VALUE!}");
    fx("=BYROW({1,2;3,4}, LAMBDA(a, b, a))").assertError(ErrorKind.VALUE);
  }

  @Test void testMakeArray() {
    fx("=MAKEARRAY(2, 3, LAMBDA(r, c, r * c))")
        .assertArray("{1,2,3;2,4,6}");
    fx("=MAKEARRAY(1, 2, LAMBDA(r, c, \"x\"))").assertArray("{\"x\",\"x\"}");
    fx("=MAKEARRAY(0, 1, LAMBDA(r, c, 1))").assertError(ErrorKind.VALUE);
    fx("=MAKEARRAY(1000, 1001, LAMBDA(r, c, 1))")
        .assertError(ErrorKind.NUMBER);
    fx("=MAKEARRAY(1, 1, 1)").assertError(ErrorKind.VALUE);
  }
}

// End LambdaFunctionsTest.java
