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

import net.hydromatic.formula.Fx;
import net.hydromatic.formula.eval.ErrorKind;
import org.junit.jupiter.api.Test;

/** Tests for lookup and reference functions. */
public class LookupFunctionsTest {
  /** A table of numbers in A1:A3 and their names in B1:B3. */
  private static Fx table(String formula) {
    return fx(formula)
        .withColumn("A1", 10, 20, 30)
        .withColumn("B1", "ten", "twenty", "thirty");
  }

  @Test void testVlookup() {
    table("=VLOOKUP(20, A1:B3, 2, FALSE)").assertText("twenty");
    table("=VLOOKUP(25, A1:B3, 2)").assertText("twenty");
    table("=VLOOKUP(99, A1:B3, 2, TRUE)").assertText("thirty");
    table("=VLOOKUP(5, A1:B3, 2)").assertError(ErrorKind.NOT_AVAILABLE);
    table("=VLOOKUP(25, A1:B3, 2, FALSE)")
        .assertError(ErrorKind.NOT_AVAILABLE);
    table("=VLOOKUP(20, A1:B3, 3, FALSE)").assertError(ErrorKind.REFERENCE);
    table("=VLOOKUP(20, A1:B3, 0, FALSE)").assertError(ErrorKind.VALUE);
    table("=VLOOKUP(1/0, A1:B3, 2)").assertError(ErrorKind.DIV_BY_ZERO);
    fx("=VLOOKUP(\"t*y\", {\"ten\",1;\"twenty\",2}, 2, FALSE)")
        .assertNumber(2);
    fx("=VLOOKUP(\"TEN\", {\"ten\",1;\"twenty\",2}, 2, FALSE)")
        .assertNumber(1);
  }

  @Test void testHlookupAndLookup() {
    fx("=HLOOKUP(\"b\", {\"a\",\"b\",\"c\";1,2,3}, 2, FALSE)").assertNumber(2);
    fx("=HLOOKUP(2.5, {1,2,3;\"x\",\"y\",\"z\"}, 2)").assertText("y");
    fx("=LOOKUP(3, {1,2,4}, {\"a\",\"b\",\"c\"})").assertText("b");
    fx("=LOOKUP(0, {1,2,4}, {\"a\",\"b\",\"c\"})")
        .assertError(ErrorKind.NOT_AVAILABLE);

    // Without a result vector, the result is the last column
    fx("=LOOKUP(2.5, {1,2;3,4})").assertNumber(2);
  }

  @Test void testMatch() {
    fx("=MATCH(25, {10,20,30})").assertNumber(2);
    fx("=MATCH(20, {10,20,30}, 0)").assertNumber(2);
    fx("=MATCH(40, {10,20,30}, 0)").assertError(ErrorKind.NOT_AVAILABLE);
    fx("=MATCH(\"B*\", {\"apple\",\"banana\"}, 0)").assertNumber(2);
    fx("=MATCH(25, {30,20,10}, -1)").assertNumber(1);
    fx("=MATCH(1, {1,2;3,4}, 0)").assertError(ErrorKind.NOT_AVAILABLE);
    table("=MATCH(30, A1:A3, 0)").assertNumber(3);
  }

  @Test void testXlookup() {
    fx("=XLOOKUP(\"b\", {\"a\";\"b\";\"c\"}, {1;2;3})").assertNumber(2);
    fx("=XLOOKUP(\"z\", {\"a\";\"b\"}, {1;2}, \"none\")").assertText("none");
    fx("=XLOOKUP(\"z\", {\"a\";\"b\"}, {1;2})")
        .assertError(ErrorKind.NOT_AVAILABLE);
    fx("=XLOOKUP(25, {10,20,30}, {\"x\",\"y\",\"z\"}, , 1)").assertText("z");
    fx("=XLOOKUP(25, {10,20,30}, {\"x\",\"y\",\"z\"}, , -1)").assertText("y");
    fx("=XLOOKUP(1, {1,2,1}, {\"a\",\"b\",\"c\"}, , 0, -1)").assertText("c");
    fx("=XLOOKUP(20, {10,20,30}, {\"x\",\"y\",\"z\"}, , 0, 2)")
        .assertText("y");
    fx("=XLOOKUP(\"b\", {\"a\";\"b\"}, {1,2;3,4})").assertArray("{3,4}");
    fx("=XLOOKUP({\"a\",\"c\"}, {\"a\";\"b\";\"c\"}, {1;2;3})")
        .assertArray("{1,3}");
    fx("=XLOOKUP(1, {1;2}, {1;2;3})").assertError(ErrorKind.VALUE);
    fx("=XLOOKUP(1, {1;2}, {1;2}, , 5)").assertError(ErrorKind.VALUE);
    table("=XLOOKUP(\"thirty\", B1:B3, A1:A3)").assertNumber(30);
  }

  @Test void testXmatch() {
    fx("=XMATCH(\"c\", {\"a\",\"b\",\"c\"})").assertNumber(3);
    fx("=XMATCH(25, {10,20,30}, 1)").assertNumber(3);
    fx("=XMATCH(25, {10,20,30}, -1)").assertNumber(2);
    fx("=XMATCH({\"b\",\"z\"}, {\"a\",\"b\"})").assertArray("{2,#N/A}");
    fx("=XMATCH(\"?b\", {\"ab\",\"b\"}, 2)").assertNumber(1);
  }

  /** In a wildcard match, "~" makes the next character literal, even if no
   * unescaped wildcard remains. */
  @Test void testEscapedWildcards() {
    fx("=XLOOKUP(\"a~*\", {\"ab\",\"a*\"}, {1,2}, , 2)").assertNumber(2);
    fx("=XLOOKUP(\"a~*\", {\"ab\",\"ac\"}, {1,2}, \"none\", 2)")
        .assertText("none");
    fx("=XMATCH(\"a~?\", {\"ab\",\"a?\"}, 2)").assertNumber(2);
    fx("=XMATCH(\"~~\", {\"a\",\"~\"}, 2)").assertNumber(2);
    fx("=VLOOKUP(\"a~*\", {\"ab\",1;\"a*\",2}, 2, FALSE)").assertNumber(2);
    fx("=MATCH(\"a~*\", {\"ab\",\"a*\"}, 0)").assertNumber(2);
    fx("=MATCH(\"A~*\", {\"ab\",\"a*\"}, 0)").assertNumber(2);
    fx("=MATCH(\"a~*b*\", {\"ab\",\"a*bc\"}, 0)").assertNumber(2);
    fx("=COUNTIF({\"ab\",\"a*\"}, \"a~*\")").assertNumber(1);
  }

  @Test void testIndex() {
    fx("=INDEX({1,2;3,4}, 2, 1)").assertNumber(3);
    fx("=INDEX({1,2;3,4}, 0, 2)").assertArray("{2;4}");
    fx("=INDEX({1,2;3,4}, 1)").assertArray("{1,2}");
    fx("=INDEX({1,2;3,4}, 0, 0)").assertArray("{1,2;3,4}");
    fx("=INDEX({1,2,3}, 2)").assertNumber(2);
    fx("=INDEX({1;2;3}, 2)").assertNumber(2);
    fx("=INDEX({1,2}, 1, 3)").assertError(ErrorKind.REFERENCE);
    fx("=INDEX({1,2}, -1)").assertError(ErrorKind.VALUE);
    table("=INDEX(A1:B3, MATCH(20, A1:A3, 0), 2)").assertText("twenty");
  }

  @Test void testIndirect() {
    table("=INDIRECT(\"A2\")").assertNumber(20);
    table("=SUM(INDIRECT(\"A1:A3\"))").assertNumber(60);
    table("=INDIRECT(\"R3C2\", FALSE)").assertText("thirty");
    table("=INDIRECT(\"B\" & 1)").assertText("ten");
    fx("=INDIRECT(\"bogus\")").assertError(ErrorKind.REFERENCE);
    fx("=INDIRECT(\"R0C1\", FALSE)").assertError(ErrorKind.REFERENCE);
  }

  @Test void testAddress() {
    fx("=ADDRESS(2, 3)").assertText("$C$2");
    fx("=ADDRESS(2, 3, 2)").assertText("C$2");
    fx("=ADDRESS(2, 3, 3)").assertText("$C2");
    fx("=ADDRESS(2, 3, 4)").assertText("C2");
    fx("=ADDRESS(2, 3, 1, FALSE)").assertText("R2C3");
    fx("=ADDRESS(2, 3, 4, FALSE)").assertText("R[2]C[3]");
    fx("=ADDRESS(1, 28, 4)").assertText("AB1");
    fx("=ADDRESS(1, 1, 1, TRUE, \"Sheet 1\")").assertText("'Sheet 1'!$A$1");
    fx("=ADDRESS(1, 1, 4, TRUE, \"Data\")").assertText("Data!A1");
    fx("=ADDRESS(0, 1)").assertError(ErrorKind.VALUE);
    fx("=ADDRESS(1, 1, 5)").assertError(ErrorKind.VALUE);
  }

  @Test void testChoose() {
    fx("=CHOOSE(2, \"a\", \"b\", \"c\")").assertText("b");
    fx("=CHOOSE(1, \"a\", 1/0)").assertText("a");
    fx("=CHOOSE(2.9, \"a\", \"b\")").assertText("b");
    fx("=CHOOSE(3, \"a\", \"b\")").assertError(ErrorKind.VALUE);
    fx("=CHOOSE(0, \"a\", \"b\")").assertError(ErrorKind.VALUE);
  }

  @Test void testRowAndColumn() {
    fx("=ROW(B3)").assertNumber(3);
    fx("=COLUMN(C1)").assertNumber(3);
    fx("=ROW(A2:A4)").assertArray("{2;3;4}");
    fx("=COLUMN(A1:C1)").assertArray("{1,2,3}");
    fx("=ROW()").withCurrentCell("D5").assertNumber(5);
    fx("=COLUMN()").withCurrentCell("D5").assertNumber(4);
    fx("=ROW()").assertError(ErrorKind.VALUE);
    fx("=ROW(1)").assertError(ErrorKind.VALUE);
    fx("=ROWS({1,2;3,4;5,6})").assertNumber(3);
    fx("=COLUMNS({1,2;3,4;5,6})").assertNumber(2);
    fx("=ROWS(A1:C10)").assertNumber(10);
    fx("=COLUMNS(A1:C10)").assertNumber(3);
    fx("=ROWS(5)").assertNumber(1);
  }

  @Test void testOffset() {
    table("=OFFSET(A1, 1, 1)").assertText("twenty");
    table("=SUM(OFFSET(A1, 0, 0, 2, 1))").assertNumber(30);
    table("=OFFSET(A1:A2, 1, 0)").assertArray("{20;30}");
    fx("=OFFSET(A1, -1, 0)").assertError(ErrorKind.REFERENCE);
    fx("=OFFSET(A1, 0, 0, 0, 1)").assertError(ErrorKind.REFERENCE);
    fx("=OFFSET(1, 0, 0)").assertError(ErrorKind.VALUE);
  }
}

// End LookupFunctionsTest.java
