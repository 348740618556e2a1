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

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import net.hydromatic.formula.Fx;
import net.hydromatic.formula.eval.ErrorKind;
import net.hydromatic.formula.eval.Prop;
import net.hydromatic.formula.eval.Value;
import org.junit.jupiter.api.Test;

/** Tests for math and trigonometry functions. */
public class MathFunctionsTest {
  @Test void testSum() {
    fx("=SUM(1, \"2\", TRUE)").assertNumber(4);
    // In a range, only numbers count
    fx("=SUM(A1:A3)").withColumn("A1", 1, "x", true).assertNumber(1);
    fx("=SUM(A1)").withCell("A1", "3").assertNumber(0);
    fx("=SUM(\"abc\")").assertError(ErrorKind.VALUE);
    fx("=SUM({1, 2; 3, 4}, 10)").assertNumber(20);
    fx("=PRODUCT(2, 3, 4)").assertNumber(24);
    fx("=SUMSQ(3, 4)").assertNumber(25);
  }

  @Test void testRounding() {
    fx("=ROUND(2.345, 2)").assertNumber(2.35);
    fx("=ROUND(1.005, 2)").assertNumber(1.01);
    fx("=ROUND(-2.5, 0)").assertNumber(-3);
    fx("=ROUND(1234, -2)").assertNumber(1200);
    fx("=ROUNDDOWN(3.99, 0)").assertNumber(3);
    fx("=ROUNDUP(3.01, 0)").assertNumber(4);
    fx("=ROUNDUP(-3.01, 0)").assertNumber(-4);
    fx("=TRUNC(-4.7)").assertNumber(-4);
    fx("=INT(-1.5)").assertNumber(-2);
    fx("=CEILING(2.5, 1)").assertNumber(3);
    fx("=CEILING(4.3, 0.1)").assertNumber(4.3);
    fx("=FLOOR(2.5, 1)").assertNumber(2);
    fx("=FLOOR(2.5, 0)").assertError(ErrorKind.DIV_BY_ZERO);
    fx("=CEILING.MATH(-4.5)").assertNumber(-4);
    fx("=CEILING.MATH(-4.5, 1, 1)").assertNumber(-5);
    fx("=FLOOR.MATH(-4.5)").assertNumber(-5);
    fx("=EVEN(1.5)").assertNumber(2);
    fx("=EVEN(-1)").assertNumber(-2);
    fx("=ODD(1.5)").assertNumber(3);
    fx("=ODD(2)").assertNumber(3);
    fx("=ODD(0)").assertNumber(1);
    fx("=MROUND(10, 3)").assertNumber(9);
    fx("=MROUND(-10, 3)").assertError(ErrorKind.NUMBER);
  }

  @Test void testArithmetic() {
    fx("=MOD(-3, 2)").assertNumber(1);
    fx("=MOD(3, -2)").assertNumber(-1);
    fx("=MOD(1, 0)").assertError(ErrorKind.DIV_BY_ZERO);
    fx("=QUOTIENT(7, 2)").assertNumber(3);
    fx("=QUOTIENT(-7, 2)").assertNumber(-3);
    fx("=ABS(-3)").assertNumber(3);
    fx("=SIGN(-2)").assertNumber(-1);
    fx("=POWER(2, 10)").assertNumber(1024);
    fx("=SQRT(-1)").assertError(ErrorKind.NUMBER);
    fx("=LN(0)").assertError(ErrorKind.NUMBER);
    fx("=LOG(100)").assertNumber(2);
    fx("=LOG(8, 2)").assertNumber(3);
    fx("=LOG(8, 1)").assertError(ErrorKind.DIV_BY_ZERO);
    fx("=LOG10(1000)").assertNumber(3);
    fx("=EXP(1)").assertNumber(Math.E);
    fx("=GCD(24, 36)").assertNumber(12);
    fx("=LCM(4, 6)").assertNumber(12);
    fx("=GCD(-1, 2)").assertError(ErrorKind.NUMBER);
  }

  @Test void testCombinatorics() {
    fx("=FACT(5)").assertNumber(120);
    fx("=FACT(-1)").assertError(ErrorKind.NUMBER);
    fx("=FACTDOUBLE(6)").assertNumber(48);
    fx("=COMBIN(8, 2)").assertNumber(28);
    fx("=COMBIN(2, 3)").assertError(ErrorKind.NUMBER);
    fx("=COMBINA(4, 3)").assertNumber(20);
    fx("=PERMUT(5, 2)").assertNumber(20);
    fx("=PERMUT(100, 3)").assertNumber(970200);
    fx("=PERMUT(5.9, 2.2)").assertNumber(20);
    fx("=PERMUT(4, 0)").assertNumber(1);
    fx("=PERMUT(2, 3)").assertError(ErrorKind.NUMBER);
    fx("=PERMUT(-1, 0)").assertError(ErrorKind.NUMBER);
    fx("=PERMUT(1000, 500)").assertError(ErrorKind.NUMBER);
    fx("=PERMUT({5, 6}, 2)").assertArray("{20,30}");
    fx("=MULTINOMIAL(2, 3, 4)").assertNumber(1260);
  }

  @Test void testTrigonometry() {
    fx("=DEGREES(PI())").assertNumber(180);
    fx("=RADIANS(180)").assertNumber(Math.PI);
    fx("=SIN(PI() / 2)").assertNumber(1);
    fx("=ATAN2(1, 1)").assertNumber(Math.PI / 4);
    fx("=ATAN2(0, 0)").assertError(ErrorKind.DIV_BY_ZERO);
    fx("=COT(0)").assertError(ErrorKind.DIV_BY_ZERO);
    fx("=ACOS(2)").assertError(ErrorKind.NUMBER);
    fx("=ASINH(0)").assertNumber(0);
  }

  @Test void testRomanAndBase() {
    fx("=ROMAN(1999)").assertText("MCMXCIX");
    fx("=ROMAN(4000)").assertError(ErrorKind.VALUE);
    fx("=ARABIC(\"MCMXCIX\")").assertNumber(1999);
    fx("=ARABIC(\"-xiv\")").assertNumber(-14);
    fx("=ARABIC(\"ABC\")").assertError(ErrorKind.VALUE);
    fx("=BASE(255, 16)").assertText("FF");
    fx("=BASE(5, 2, 8)").assertText("00000101");
    fx("=DECIMAL(\"FF\", 16)").assertNumber(255);
    fx("=DECIMAL(\"12\", 1)").assertError(ErrorKind.NUMBER);
  }

  @Test void testMatrices() {
    fx("=MMULT({1, 2; 3, 4}, {5; 6})").assertArray("{17;39}");
    fx("=MMULT({1, 2}, {1, 2})").assertError(ErrorKind.VALUE);
    fx("=MDETERM({1, 2; 3, 4})").assertNumber(-2);
    fx("=MUNIT(2)").assertArray("{1,0;0,1}");
    fx("=SUMPRODUCT({1, 2, 3}, {4, 5, 6})").assertNumber(32);
    fx("=SUMPRODUCT({1, 2}, {1, 2, 3})").assertError(ErrorKind.VALUE);
    fx("=SUMX2MY2({2, 3}, {1, 1})").assertNumber(11);
    fx("=SUMX2PY2({1, 2}, {3, 4})").assertNumber(30);
    fx("=SUMXMY2({1, 2}, {2, 4})").assertNumber(5);
  }

  @Test void testConditionalSums() {
    final Fx f = fx("=SUMIF(A1:A4, \">4\")")
        .withColumn("A1", 1, 5, 10, 15)
        .withColumn("B1", 2, 4, 6, 8);
    f.assertNumber(30);
    f.withFormula("=SUMIF(A1:A4, \">4\", B1:B4)").assertNumber(18);
    f.withFormula("=SUMIF(A1:A4, 10, B1:B4)").assertNumber(6);
    f.withFormula("=SUMIFS(B1:B4, A1:A4, \">=5\", A1:A4, \"<15\")")
        .assertNumber(10);
    f.withFormula("=SUMIFS(B1:B4, A1:A3, \">=5\")")
        .assertError(ErrorKind.VALUE);
  }

  @Test void testSubtotalAndAggregate() {
    final Fx f = fx("=SUBTOTAL(9, A1:A4)").withColumn("A1", 1, 5, 10, 15);
    f.assertNumber(31);
    f.withFormula("=SUBTOTAL(1, A1:A4)").assertNumber(7.75);
    f.withFormula("=SUBTOTAL(104, A1:A4)").assertNumber(15);
    f.withFormula("=SUBTOTAL(12, A1:A4)").assertError(ErrorKind.VALUE);
    fx("=AGGREGATE(9, 6, {1, #DIV/0!, 3})").assertNumber(4);
    fx("=AGGREGATE(9, 0, {1, #DIV/0!, 3})")
        .assertError(ErrorKind.DIV_BY_ZERO);
    fx("=AGGREGATE(14, 6, {1, #N/A, 3, 7}, 2)").assertNumber(3);
  }

  @Test void testRandom() {
    final Fx f = fx("=RANDBETWEEN(1, 6)").withProp(Prop.RANDOM_SEED, 1);
    for (int i = 0; i < 3; i++) {
      final Value v = f.eval();
      assertThat(v, instanceOf(Value.Num.class));
      final double d = ((Value.Num) v).value;
      assertThat(d >= 1 && d <= 6 && d == Math.rint(d), is(true));
    }
    fx("=RANDBETWEEN(6, 1)").assertError(ErrorKind.NUMBER);
  }
}

// End MathFunctionsTest.java
