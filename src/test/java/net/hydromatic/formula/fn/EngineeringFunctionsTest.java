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

/** Tests for engineering functions. */
public class EngineeringFunctionsTest {
  @Test void testFromDecimal() {
    fx("=DEC2BIN(10)").assertText("1010");
    fx("=DEC2BIN(10, 8)").assertText("00001010");
    fx("=DEC2BIN(-1)").assertText("1111111111");
    fx("=DEC2BIN(-512)").assertText("1000000000");
    fx("=DEC2BIN(512)").assertError(ErrorKind.NUMBER);
    fx("=DEC2BIN(10, 2)").assertError(ErrorKind.NUMBER);
    fx("=DEC2BIN(10, 0)").assertError(ErrorKind.NUMBER);
    fx("=DEC2HEX(255)").assertText("FF");
    fx("=DEC2HEX(-1)").assertText("FFFFFFFFFF");
    fx("=DEC2OCT(8)").assertText("10");
    fx("=DEC2OCT(\"x\")").assertError(ErrorKind.VALUE);
  }

  @Test void testToDecimal() {
    fx("=BIN2DEC(\"1010\")").assertNumber(10);
    fx("=BIN2DEC(1010)").assertNumber(10);
    fx("=BIN2DEC(\"1111111111\")").assertNumber(-1);
    fx("=BIN2DEC(\"102\")").assertError(ErrorKind.NUMBER);
    fx("=BIN2DEC(\"10101010101\")").assertError(ErrorKind.NUMBER);
    fx("=HEX2DEC(\"FF\")").assertNumber(255);
    fx("=HEX2DEC(\"ff\")").assertNumber(255);
    fx("=HEX2DEC(\"FFFFFFFFFF\")").assertNumber(-1);
    fx("=OCT2DEC(\"777\")").assertNumber(511);
  }

  @Test void testRadixToRadix() {
    fx("=BIN2HEX(\"1010\")").assertText("A");
    fx("=BIN2OCT(\"1010\", 4)").assertText("0012");
    fx("=HEX2BIN(\"F\", 8)").assertText("00001111");
    fx("=HEX2BIN(\"200\")").assertError(ErrorKind.NUMBER);
    fx("=HEX2OCT(\"FFFFFFFFFF\")").assertText("7777777777");
    fx("=OCT2HEX(\"17\")").assertText("F");
    fx("=OCT2BIN(\"7\")").assertText("111");
  }

  @Test void testBitwise() {
    fx("=BITAND(13, 25)").assertNumber(9);
    fx("=BITOR(13, 25)").assertNumber(29);
    fx("=BITXOR(13, 25)").assertNumber(20);
    fx("=BITLSHIFT(4, 2)").assertNumber(16);
    fx("=BITLSHIFT(4, -2)").assertNumber(1);
    fx("=BITRSHIFT(13, 2)").assertNumber(3);
    fx("=BITAND(-1, 1)").assertError(ErrorKind.NUMBER);
    fx("=BITAND(1.5, 1)").assertError(ErrorKind.NUMBER);
    fx("=BITOR(2^48, 1)").assertError(ErrorKind.NUMBER);
    fx("=BITLSHIFT(2^47, 1)").assertError(ErrorKind.NUMBER);
    fx("=BITLSHIFT(1, 60)").assertError(ErrorKind.NUMBER);
  }

  @Test void testStepAndErrorFunctions() {
    fx("=DELTA(5, 5)").assertNumber(1);
    fx("=DELTA(5, 4)").assertNumber(0);
    fx("=DELTA(0)").assertNumber(1);
    fx("=GESTEP(5, 4)").assertNumber(1);
    fx("=GESTEP(-1)").assertNumber(0);
    fx("=ERF(1)").assertNumber(0.8427007929, 1E-6);
    fx("=ERF(0, 1)").assertNumber(0.8427007929, 1E-6);
    fx("=ERF(1, 2)").assertNumber(0.1526214720, 1E-6);
    fx("=ERF.PRECISE(-1)").assertNumber(-0.8427007929, 1E-6);
    fx("=ERFC(1)").assertNumber(0.1572992070, 1E-6);
    fx("=ERFC.PRECISE(0)").assertNumber(1, 1E-6);
  }

  @Test void testComplex() {
    fx("=COMPLEX(3, 4)").assertText("3+4i");
    fx("=COMPLEX(3, 4, \"j\")").assertText("3+4j");
    fx("=COMPLEX(0, -1)").assertText("-i");
    fx("=COMPLEX(3, 0)").assertText("3");
    fx("=COMPLEX(1.5, -2.5)").assertText("1.5-2.5i");
    fx("=COMPLEX(1, 1, \"k\")").assertError(ErrorKind.VALUE);
    fx("=IMREAL(\"3+4i\")").assertNumber(3);
    fx("=IMAGINARY(\"3+4i\")").assertNumber(4);
    fx("=IMAGINARY(\"-j\")").assertNumber(-1);
    fx("=IMABS(\"3+4i\")").assertNumber(5);
    fx("=IMABS(-5)").assertNumber(5);
    fx("=IMARGUMENT(\"i\")").assertNumber(Math.PI / 2);
    fx("=IMARGUMENT(\"0\")").assertError(ErrorKind.DIV_BY_ZERO);
    fx("=IMCONJUGATE(\"3+4i\")").assertText("3-4i");
    fx("=IMREAL(\"abc\")").assertError(ErrorKind.NUMBER);
  }

  @Test void testComplexArithmetic() {
    fx("=IMSUM(\"1+2i\", \"3-4i\")").assertText("4-2i");
    fx("=IMSUM(\"1+2i\", 5)").assertText("6+2i");
    fx("=IMSUB(\"5+3i\", \"2+i\")").assertText("3+2i");
    fx("=IMPRODUCT(\"1+2i\", \"3+4i\")").assertText("-5+10i");
    fx("=IMPRODUCT(A1:A2)")
        .withColumn("A1", "1+i", "1-i")
        .assertText("2");
    fx("=IMDIV(\"-238+240i\", \"10+24i\")").assertText("5+12i");
    fx("=IMDIV(\"1\", \"0\")").assertError(ErrorKind.NUMBER);
    fx("=IMSUM(\"1+i\", \"1+j\")").assertError(ErrorKind.VALUE);
    fx("=IMSUM(\"1+j\", \"2\")").assertText("3+j");
    fx("=IMPOWER(\"2+3i\", 2)").assertText("-5+12i");
    fx("=IMPOWER(\"0\", -1)").assertError(ErrorKind.NUMBER);
    fx("=IMSQRT(\"-4\")").assertText("2i");
  }

  @Test void testComplexFunctions() {
    fx("=IMEXP(\"0\")").assertText("1");
    fx("=IMLN(\"1\")").assertText("0");
    fx("=IMLN(\"0\")").assertError(ErrorKind.NUMBER);
    fx("=IMLOG10(\"100\")").assertText("2");
    fx("=IMLOG2(\"8\")").assertText("3");
    fx("=IMSIN(\"0\")").assertText("0");
    fx("=IMCOS(\"0\")").assertText("1");
    fx("=IMSINH(\"0\")").assertText("0");
    fx("=IMCOSH(\"0\")").assertText("1");
    fx("=IMTAN(\"0\")").assertText("0");
    fx("=IMSEC(\"0\")").assertText("1");
    fx("=IMCSC(\"0\")").assertError(ErrorKind.NUMBER);
    fx("=IMCOT(\"0\")").assertError(ErrorKind.NUMBER);
    fx("=IMREAL(IMEXP(COMPLEX(0, PI())))").assertNumber(-1);
  }
}

// End EngineeringFunctionsTest.java
