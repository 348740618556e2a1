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

/** Tests for financial functions. */
public class FinancialFunctionsTest {
  /** Payment that repays 1,000 over two periods at 10%. */
  private static final String PAYMENT = "-576.1904761904762";

  @Test void testPaymentFunctions() {
    fx("=PMT(0.1, 2, 1000)").assertNumber(-576.1904761904758);
    fx("=PMT(0.08 / 12, 10, 10000)").assertNumber(-1037.0320893591636);
    fx("=PMT(0, 10, 1000)").assertNumber(-100);
    fx("=PMT(0.1, 2, 1000, 0, 1)").assertNumber(-576.1904761904758 / 1.1);
    fx("=PMT(0.1, 0, 1000)").assertError(ErrorKind.NUMBER);
    fx("=IPMT(0.1, 1, 2, 1000)").assertNumber(-100);
    fx("=PPMT(0.1, 1, 2, 1000)").assertNumber(-476.1904761904758);
    fx("=IPMT(0.1, 1, 2, 1000, 0, 1)").assertNumber(0);
    fx("=IPMT(0.1, 3, 2, 1000)").assertError(ErrorKind.NUMBER);
    fx("=CUMIPMT(0.1, 2, 1000, 1, 2, 0)").assertNumber(-152.3809523809524);
    fx("=CUMPRINC(0.1, 2, 1000, 1, 2, 0)").assertNumber(-1000);
    fx("=CUMIPMT(0.1, 2, 1000, 1, 2, 2)").assertError(ErrorKind.NUMBER);
    fx("=CUMIPMT(0.1, 2, 1000, 2, 1, 0)").assertError(ErrorKind.NUMBER);
  }

  @Test void testPresentAndFutureValue() {
    fx("=FV(0.1, 2, -100)").assertNumber(210);
    fx("=FV(0.1, 2, -100, 0, 1)").assertNumber(231);
    fx("=FV(0, 5, -10, -100)").assertNumber(150);
    fx("=PV(0.1, 2, 100)").assertNumber(-173.55371900826447);
    fx("=PV(0, 3, 10, 5)").assertNumber(-35);
    fx("=PV(0.1, 2, " + PAYMENT + ")").assertNumber(1000, 1E-9);
    fx("=FVSCHEDULE(1, {0.09, 0.11, 0.1})").assertNumber(1.33089);
    fx("=FVSCHEDULE(1, {0.1, \"x\"})").assertError(ErrorKind.VALUE);
  }

  @Test void testNperAndRate() {
    fx("=NPER(0.1, " + PAYMENT + ", 1000)").assertNumber(2, 1E-9);
    fx("=NPER(0, -100, 1000)").assertNumber(10);
    fx("=NPER(0, 0, 1000)").assertError(ErrorKind.NUMBER);
    fx("=NPER(0.1, -50, 1000)").assertError(ErrorKind.NUMBER);
    fx("=RATE(2, " + PAYMENT + ", 1000)").assertNumber(0.1, 1E-7);
    fx("=RATE(0, -100, 1000)").assertError(ErrorKind.NUMBER);
    fx("=PDURATION(0.1, 100, 121)").assertNumber(2);
    fx("=PDURATION(0, 100, 121)").assertError(ErrorKind.NUMBER);
    fx("=RRI(2, 100, 121)").assertNumber(0.1);
    fx("=RRI(0, 100, 121)").assertError(ErrorKind.NUMBER);
  }

  @Test void testInterestRates() {
    fx("=EFFECT(0.12, 12)").assertNumber(0.12682503013196977);
    fx("=NOMINAL(EFFECT(0.12, 12), 12)").assertNumber(0.12);
    fx("=EFFECT(0, 12)").assertError(ErrorKind.NUMBER);
    fx("=NOMINAL(0.1, 0)").assertError(ErrorKind.NUMBER);
  }

  @Test void testNpvAndIrr() {
    fx("=NPV(0.1, 100, 100)").assertNumber(173.55371900826447);
    fx("=NPV(0.1, {100,100})").assertNumber(173.55371900826447);
    fx("=NPV(-1, 1)").assertError(ErrorKind.DIV_BY_ZERO);
    fx("=IRR({-100,110})").assertNumber(0.1, 1E-7);
    fx("=IRR({-100,60,60})").assertNumber(0.13066238629180735, 1E-7);
    fx("=IRR(A1:A3)")
        .withColumn("A1", -100, 60, 60)
        .assertNumber(0.13066238629180735, 1E-7);
    fx("=IRR({100,100})").assertError(ErrorKind.NUMBER);
    fx("=IRR({-100})").assertError(ErrorKind.NUMBER);
    fx("=MIRR({-100,60,60}, 0.1, 0.12)").assertNumber(0.12782977438973475);
    fx("=MIRR({100,60}, 0.1, 0.12)").assertError(ErrorKind.NUMBER);
  }

  @Test void testScheduledCashFlows() {
    fx("=XNPV(0.1, {-100,110}, {45292,45658})")
        .assertNumber(-0.026108969043889374, 1E-9);
    fx("=XNPV(0.1, {-100,110}, {45292,45657})").assertNumber(0, 1E-9);
    fx("=XNPV(0.1, {-100,110}, {45292})").assertError(ErrorKind.NUMBER);
    fx("=XNPV(0.1, {-100,110}, {45292,45000})")
        .assertError(ErrorKind.NUMBER);
    fx("=XNPV(-1, {-100,110}, {45292,45657})")
        .assertError(ErrorKind.NUMBER);
    fx("=XIRR({-100,110}, {45292,45657})").assertNumber(0.1, 1E-7);
    fx("=XIRR({100,110}, {45292,45657})").assertError(ErrorKind.NUMBER);
  }

  @Test void testDepreciation() {
    fx("=SLN(1000, 100, 9)").assertNumber(100);
    fx("=SLN(1000, 100, 0)").assertError(ErrorKind.DIV_BY_ZERO);
    fx("=SYD(1000, 100, 5, 1)").assertNumber(300);
    fx("=SYD(1000, 100, 5, 5)").assertNumber(60);
    fx("=SYD(1000, 100, 5, 6)").assertError(ErrorKind.NUMBER);
    fx("=DB(1000000, 100000, 6, 1, 7)").assertNumber(186083.33333333334);
    fx("=DB(1000000, 100000, 6, 2, 7)").assertNumber(259639.41666666666);
    fx("=DB(1000000, 100000, 6, 7, 7)").assertNumber(15845.098473848071);
    fx("=DB(1000000, 100000, 6, 8, 7)").assertError(ErrorKind.NUMBER);
    fx("=DB(0, 0, 6, 1)").assertNumber(0);
    fx("=DDB(2400, 300, 10, 1)").assertNumber(480);
    fx("=DDB(2400, 300, 10, 2)").assertNumber(384);
    fx("=DDB(2400, 300, 10, 10)").assertNumber(22.1225472000001);
    fx("=DDB(2400, 300, 10, 11)").assertError(ErrorKind.NUMBER);
    fx("=VDB(2400, 300, 3650, 0, 1)").assertNumber(1.315068493150685);
    fx("=VDB(2400, 300, 120, 0, 1)").assertNumber(40);
    fx("=VDB(2400, 300, 10, 0, 1)").assertNumber(480);
    fx("=VDB(2400, 300, 120, 6, 18)").assertNumber(396.306053, 1E-6);
    fx("=VDB(2400, 300, 120, 6, 18, 1.5)").assertNumber(311.808937, 1E-6);
    fx("=VDB(2400, 300, 10, 0, 0.875, 1.5)").assertNumber(315);
    // Switches to straight-line in the fourth year, unless told not to
    fx("=VDB(10000, 0, 5, 3, 4)").assertNumber(1080);
    fx("=VDB(10000, 0, 5, 4, 5)").assertNumber(1080);
    fx("=VDB(10000, 0, 5, 4, 5, 2, TRUE)").assertNumber(518.4);
    fx("=VDB(2400, 300, 10, 0, 11)").assertError(ErrorKind.NUMBER);
    fx("=VDB(2400, 300, 10, 5, 4)").assertError(ErrorKind.NUMBER);
  }

  @Test void testSecurities() {
    final String dates = "DATE(2024, 1, 1), DATE(2024, 7, 1)";
    fx("=DISC(" + dates + ", 97, 100)").assertNumber(0.06);
    fx("=INTRATE(" + dates + ", 97, 100)")
        .assertNumber(0.061855670103092786);
    fx("=DISC(" + dates + ", 0, 100)").assertError(ErrorKind.NUMBER);
    fx("=DISC(DATE(2024, 7, 1), DATE(2024, 1, 1), 97, 100)")
        .assertError(ErrorKind.NUMBER);
  }

  @Test void testDollarFractions() {
    fx("=DOLLARDE(1.02, 16)").assertNumber(1.125);
    fx("=DOLLARFR(1.125, 16)").assertNumber(1.02);
    fx("=DOLLARDE(-1.02, 16)").assertNumber(-1.125);
    fx("=DOLLARDE(1.1, 0)").assertError(ErrorKind.DIV_BY_ZERO);
    fx("=DOLLARDE(1.1, -1)").assertError(ErrorKind.NUMBER);
  }
}

// End FinancialFunctionsTest.java
