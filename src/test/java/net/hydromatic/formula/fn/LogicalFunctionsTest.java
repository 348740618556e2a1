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

/** Tests for logical functions. */
public class LogicalFunctionsTest {
  @Test void testIf() {
    fx("=IF(TRUE, 1, 2)").assertNumber(1);
    fx("=IF(0, 1, 2)").assertNumber(2);
    fx("=IF(FALSE, 1)").assertBool(false);
    fx("=IF(\"true\", \"y\", \"n\")").assertText("y");
    fx("=IF(\"maybe\", 1, 2)").assertError(ErrorKind.VALUE);
    fx("=IF(1/0, 1, 2)").assertError(ErrorKind.DIV_BY_ZERO);

    // Only the chosen branch is evaluated
    fx("=IF(TRUE, 1, 1/0)").assertNumber(1);
    fx("=IF(FALSE, 1/0, 2)").assertNumber(2);

    // An array of tests chooses element-wise
    fx("=IF({1,0,1}, \"a\", \"b\")").assertArray("{\"a\",\"b\",\"a\"}");
    fx("=IF({TRUE;FALSE}, {1;2}, {10;20})").assertArray("{1;20}");
    fx("=IF(A1:A3 > 1, A1:A3, 0)")
        .withColumn("A1", 1, 2, 3)
        .assertArray("{0;2;3}");
  }

  @Test void testIfs() {
    fx("=IFS(FALSE, 1, TRUE, 2)").assertNumber(2);
    fx("=IFS(A1 > 90, \"A\", A1 > 80, \"B\", TRUE, \"C\")")
        .withCell("A1", 85)
        .assertText("B");
    fx("=IFS(FALSE, 1)").assertError(ErrorKind.NOT_AVAILABLE);
    fx("=IFS(TRUE, 1, FALSE)").assertError(ErrorKind.VALUE);
    fx("=IFS(TRUE, 1, 1/0, 2)").assertNumber(1);
  }

  @Test void testIfError() {
    fx("=IFERROR(1/0, 99)").assertNumber(99);
    fx("=IFERROR(5, 99)").assertNumber(5);
    fx("=IFERROR(NA(), \"none\")").assertText("none");
    fx("=IFERROR({1,#N/A,3}, 0)").assertArray("{1,0,3}");
    fx("=IFNA(NA(), 0)").assertNumber(0);
    fx("=IFNA(1/0, 0)").assertError(ErrorKind.DIV_BY_ZERO);
    fx("=IFNA(7, 0)").assertNumber(7);
  }

  @Test void testAndOr() {
    fx("=AND(TRUE, 1, \"TRUE\")").assertBool(true);
    fx("=AND(TRUE, FALSE)").assertBool(false);
    fx("=OR(FALSE, 0)").assertBool(false);
    fx("=OR(FALSE, 1)").assertBool(true);
    fx("=AND(\"x\")").assertError(ErrorKind.VALUE);

    // Stops at the first argument that decides the result
    fx("=AND(FALSE, 1/0)").assertBool(false);
    fx("=OR(TRUE, 1/0)").assertBool(true);
    fx("=AND(TRUE, 1/0)").assertError(ErrorKind.DIV_BY_ZERO);

    // Inside a range, text and blanks are ignored
    fx("=AND(A1:A3)")
        .withCell("A1", true)
        .withCell("A2", "text")
        .assertBool(true);
    fx("=OR(A1:A2)")
        .withCell("A1", "text")
        .assertError(ErrorKind.VALUE);
    fx("=AND({TRUE,1,2})").assertBool(true);
    fx("=OR({0,0})").assertBool(false);
  }

  @Test void testNotAndXor() {
    fx("=NOT(TRUE)").assertBool(false);
    fx("=NOT(0)").assertBool(true);
    fx("=NOT(\"x\")").assertError(ErrorKind.VALUE);
    fx("=NOT({TRUE,FALSE})").assertArray("{FALSE,TRUE}");
    fx("=XOR(TRUE, TRUE)").assertBool(false);
    fx("=XOR(TRUE, FALSE)").assertBool(true);
    fx("=XOR(TRUE, TRUE, TRUE)").assertBool(true);
    fx("=XOR({1,0,0})").assertBool(true);
    fx("=XOR(A1)").withCell("A1", "x").assertError(ErrorKind.VALUE);
  }

  @Test void testSwitch() {
    fx("=SWITCH(2, 1, \"one\", 2, \"two\")").assertText("two");
    fx("=SWITCH(3, 1, \"one\", 2, \"two\", \"other\")").assertText("other");
    fx("=SWITCH(3, 1, \"one\", 2, \"two\")")
        .assertError(ErrorKind.NOT_AVAILABLE);
    fx("=SWITCH(\"B\", \"a\", 1, \"b\", 2)").assertNumber(2);
    fx("=SWITCH(1/0, 1, 2)").assertError(ErrorKind.DIV_BY_ZERO);

    // Results that are not chosen are not evaluated
    fx("=SWITCH(1, 1, \"one\", 2, 1/0)").assertText("one");
  }

  @Test void testConstants() {
    fx("=TRUE()").assertBool(true);
    fx("=FALSE()").assertBool(false);
    fx("=TRUE").assertBool(true);
  }
}

// End LogicalFunctionsTest.java
