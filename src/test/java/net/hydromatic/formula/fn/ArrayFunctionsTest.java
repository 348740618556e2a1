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

/** Tests for dynamic array functions. */
public class ArrayFunctionsTest {
  private static final String GRID = "{1,2;3,4;5,6}";

  @Test void testSequence() {
    fx("=SEQUENCE(3)").assertArray("{1;2;3}");
    fx("=SEQUENCE(2, 3)").assertArray("{1,2,3;4,5,6}");
    fx("=SEQUENCE(2, 2, 0, 5)").assertArray("{0,5;10,15}");
    fx("=SEQUENCE(1, 3, 1, -0.5)").assertArray("{1,0.5,0}");
    fx("=SEQUENCE(1)").assertArray("{1}");
    fx("=SEQUENCE(0)").assertError(ErrorKind.VALUE);
    fx("=SEQUENCE(1000, 1001)").assertError(ErrorKind.NUMBER);
  }

  @Test void testTransposeAndReshape() {
    fx("=TRANSPOSE({1,2,3})").assertArray("{1;2;3}");
    fx("=TRANSPOSE(" + GRID + ")").assertArray("{1,3,5;2,4,6}");
    fx("=TOCOL({1,2;3,4})").assertArray("{1;2;3;4}");
    fx("=TOCOL({1,2;3,4}, 0, TRUE)").assertArray("{1;3;2;4}");
    fx("=TOROW({1;2})").assertArray("{1,2}");
    fx("=TOCOL({1,#N/A;3,4}, 2)").assertArray("{1;3;4}");
    fx("=TOCOL(A1:B2, 1)")
        .withCell("A1", 1)
        .withCell("B2", 2)
        .assertArray("{1;2}");
    fx("=TOCOL({1}, 5)").assertError(ErrorKind.VALUE);
    fx("=WRAPROWS({1,2,3,4,5}, 2)").assertArray("{1,2;3,4;5,#N/A}");
    fx("=WRAPROWS({1,2,3,4,5}, 2, 0)").assertArray("{1,2;3,4;5,0}");
    fx("=WRAPCOLS({1,2,3,4,5}, 2)").assertArray("{1,3,5;2,4,#N/A}");
    fx("=WRAPROWS({1,2;3,4}, 2)").assertError(ErrorKind.VALUE);
    fx("=WRAPROWS({1,2}, 0)").assertError(ErrorKind.NUMBER);
  }

  @Test void testTakeAndDrop() {
    fx("=TAKE(" + GRID + ", 2)").assertArray("{1,2;3,4}");
    fx("=TAKE(" + GRID + ", -1)").assertArray("{5,6}");
    fx("=TAKE(" + GRID + ", , 1)").assertArray("{1;3;5}");
    fx("=TAKE(" + GRID + ", -2, -1)").assertArray("{4;6}");
    fx("=TAKE(" + GRID + ", 4)").assertError(ErrorKind.VALUE);
    fx("=TAKE(" + GRID + ", 0)").assertError(ErrorKind.VALUE);
    fx("=DROP(" + GRID + ", 1)").assertArray("{3,4;5,6}");
    fx("=DROP(" + GRID + ", -2)").assertArray("{1,2}");
    fx("=DROP(" + GRID + ", , 1)").assertArray("{2;4;6}");
    fx("=DROP(" + GRID + ", 3)").assertError(ErrorKind.VALUE);
  }

  @Test void testChooseRowsAndCols() {
    fx("=CHOOSEROWS(" + GRID + ", 3, 1)").assertArray("{5,6;1,2}");
    fx("=CHOOSEROWS(" + GRID + ", -1)").assertArray("{5,6}");
    fx("=CHOOSEROWS(" + GRID + ", {1,1})").assertArray("{1,2;1,2}");
    fx("=CHOOSECOLS(" + GRID + ", 2)").assertArray("{2;4;6}");
    fx("=CHOOSEROWS(" + GRID + ", 4)").assertError(ErrorKind.VALUE);
    fx("=CHOOSECOLS(" + GRID + ", 0)").assertError(ErrorKind.VALUE);
  }

  @Test void testExpandAndStack() {
    fx("=EXPAND({1,2}, 2, 3, 0)").assertArray("{1,2,0;0,0,0}");
    fx("=EXPAND({1,2}, 2)").assertArray("{1,2;#N/A,#N/A}");
    fx("=EXPAND({1,2;3,4}, 1)").assertError(ErrorKind.VALUE);
    fx("=VSTACK({1,2}, {3,4})").assertArray("{1,2;3,4}");
    fx("=VSTACK({1,2}, 3)").assertArray("{1,2;3,#N/A}");
    fx("=HSTACK({1;2}, {3;4})").assertArray("{1,3;2,4}");
    fx("=HSTACK(1, {2,3})").assertArray("{1,2,3}");
  }

  @Test void testFilter() {
    fx("=FILTER({1,2,3,4}, {1,0,1,0})").assertArray("{1,3}");
    fx("=FILTER({1;2;3}, {1;2;3} > 1)").assertArray("{2;3}");
    fx("=FILTER(" + GRID + ", {TRUE;FALSE;TRUE})").assertArray("{1,2;5,6}");
    fx("=FILTER({1,2}, {0,0}, \"none\")").assertText("none");
    fx("=FILTER({1,2}, {0,0})").assertError(ErrorKind.VALUE);
    fx("=FILTER({1,2}, {1,0,1})").assertError(ErrorKind.VALUE);
    fx("=FILTER(A1:A3, B1:B3 = \"x\")")
        .withColumn("A1", 10, 20, 30)
        .withColumn("B1", "x", "y", "x")
        .assertArray("{10;30}");
  }

  @Test void testSort() {
    fx("=SORT({3;1;2})").assertArray("{1;2;3}");
    fx("=SORT({3;1;2}, 1, -1)").assertArray("{3;2;1}");
    fx("=SORT({\"b\",2;\"a\",1}, 2)").assertArray("{\"a\",1;\"b\",2}");
    fx("=SORT({3,1,2}, 1, 1, TRUE)").assertArray("{1,2,3}");
    fx("=SORT({\"b\";1;TRUE;\"a\"})").assertArray("{1;\"a\";\"b\";TRUE}");
    fx("=SORT({1,\"x\";1,\"a\";0,\"z\"}, {1,2}, {1,-1})")
        .assertArray("{0,\"z\";1,\"x\";1,\"a\"}");
    fx("=SORT({1;2}, 2)").assertError(ErrorKind.VALUE);
    fx("=SORT({1;2}, 1, 0)").assertError(ErrorKind.VALUE);
  }

  @Test void testSortBy() {
    fx("=SORTBY({\"a\";\"b\";\"c\"}, {3;1;2})")
        .assertArray("{\"b\";\"c\";\"a\"}");
    fx("=SORTBY({\"a\",\"b\"}, {2,1})").assertArray("{\"b\",\"a\"}");
    fx("=SORTBY({\"x\";\"y\";\"z\"}, {1;1;0}, 1, {\"b\";\"c\";\"a\"}, -1)")
        .assertArray("{\"z\";\"y\";\"x\"}");
    fx("=SORTBY({\"a\";\"b\"}, {1;2;3})").assertError(ErrorKind.VALUE);
    fx("=SORTBY({\"a\";\"b\"}, {1;2}, 2)").assertError(ErrorKind.VALUE);
  }

  @Test void testUnique() {
    fx("=UNIQUE({1;2;1;3})").assertArray("{1;2;3}");
    fx("=UNIQUE({1;2;1;3}, FALSE, TRUE)").assertArray("{2;3}");
    fx("=UNIQUE({\"a\";\"A\";\"b\"})").assertArray("{\"a\";\"b\"}");
    fx("=UNIQUE({1,1,2}, TRUE)").assertArray("{1,2}");
    fx("=UNIQUE({1,2;1,2;1,3})").assertArray("{1,2;1,3}");
    fx("=UNIQUE({1;1}, FALSE, TRUE)").assertError(ErrorKind.VALUE);
  }

  @Test void testRandArray() {
    fx("=ROWS(RANDARRAY(2, 3))").assertNumber(2);
    fx("=COLUMNS(RANDARRAY(2, 3))").assertNumber(3);
    fx("=SUM(RANDARRAY(5, 5, 1, 1, TRUE))").assertNumber(25);
    fx("=SUM(RANDARRAY(5, 5, 2, 2))").assertNumber(50);
    fx("=AND(RANDARRAY(10, 10, 1, 6, TRUE) >= 1)").assertBool(true);
    fx("=RANDARRAY(1, 1, 5, 1)").assertError(ErrorKind.VALUE);
    fx("=RANDARRAY(0)").assertError(ErrorKind.VALUE);
  }
}

// End ArrayFunctionsTest.java
