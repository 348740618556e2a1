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

/** Tests for information functions. */
public class InformationFunctionsTest {
  @Test void testIsFunctions() {
    fx("=ISBLANK(A1)").assertBool(true);
    fx("=ISBLANK(A1)").withCell("A1", "").assertBool(false);
    fx("=ISBLANK(0)").assertBool(false);
    fx("=ISNUMBER(1)").assertBool(true);
    fx("=ISNUMBER(\"1\")").assertBool(false);
    fx("=ISTEXT(\"1\")").assertBool(true);
    fx("=ISNONTEXT(1)").assertBool(true);
    fx("=ISNONTEXT(A1)").assertBool(true);
    fx("=ISLOGICAL(FALSE)").assertBool(true);
    fx("=ISLOGICAL(0)").assertBool(false);
    fx("=ISNUMBER({1,\"a\"})").assertArray("{TRUE,FALSE}");
  }

  @Test void testErrorTests() {
    fx("=ISERROR(1/0)").assertBool(true);
    fx("=ISERROR(NA())").assertBool(true);
    fx("=ISERROR(1)").assertBool(false);
    fx("=ISERR(NA())").assertBool(false);
    fx("=ISERR(#REF!)").assertBool(true);
    fx("=ISNA(NA())").assertBool(true);
    fx("=ISNA(#VALUE!)").assertBool(false);
    fx("=ISERROR(A1)").withCell("A1", ErrorKind.NAME).assertBool(true);
    fx("=NA()").assertError(ErrorKind.NOT_AVAILABLE);
  }

  @Test void testErrorType() {
    fx("=ERROR.TYPE(#NULL!)").assertNumber(1);
    fx("=ERROR.TYPE(1/0)").assertNumber(2);
    fx("=ERROR.TYPE(#VALUE!)").assertNumber(3);
    fx("=ERROR.TYPE(#REF!)").assertNumber(4);
    fx("=ERROR.TYPE(#NAME?)").assertNumber(5);
    fx("=ERROR.TYPE(#NUM!)").assertNumber(6);
    fx("=ERROR.TYPE(NA())").assertNumber(7);
    fx("=ERROR.TYPE(1)").assertError(ErrorKind.NOT_AVAILABLE);
  }

  @Test void testEvenOdd() {
    fx("=ISEVEN(4)").assertBool(true);
    fx("=ISEVEN(-3)").assertBool(false);
    fx("=ISEVEN(2.9)").assertBool(true);
    fx("=ISODD(3)").assertBool(true);
    fx("=ISODD(-3)").assertBool(true);
    fx("=ISODD(\"x\")").assertError(ErrorKind.VALUE);
  }

  @Test void testIsRefAndIsOmitted() {
    fx("=ISREF(A1)").assertBool(true);
    fx("=ISREF(A1:B2)").assertBool(true);
    fx("=ISREF(1)").assertBool(false);
    fx("=LAMBDA(a, b, IF(ISOMITTED(b), a, a + b))(1, )").assertNumber(1);
    fx("=LAMBDA(a, b, IF(ISOMITTED(b), a, a + b))(1, 2)").assertNumber(3);
  }

  @Test void testN() {
    fx("=N(5)").assertNumber(5);
    fx("=N(TRUE)").assertNumber(1);
    fx("=N(\"7\")").assertNumber(0);
    fx("=N(A1)").assertNumber(0);
    fx("=N(1/0)").assertError(ErrorKind.DIV_BY_ZERO);
  }

  @Test void testType() {
    fx("=TYPE(1)").assertNumber(1);
    fx("=TYPE(A1)").assertNumber(1);
    fx("=TYPE(\"a\")").assertNumber(2);
    fx("=TYPE(TRUE)").assertNumber(4);
    fx("=TYPE(1/0)").assertNumber(16);
    fx("=TYPE({1,2})").assertNumber(64);
    fx("=TYPE(LAMBDA(x, x))").assertNumber(128);
  }
}

// End InformationFunctionsTest.java
