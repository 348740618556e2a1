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

/** Tests for database functions. */
public class DatabaseFunctionsTest {
  /** An orchard: a header row and six trees. */
  private static final String ORCHARD =
      "{\"Tree\",\"Height\",\"Age\",\"Yield\";"
      + "\"Apple\",18,20,14;"
      + "\"Pear\",12,12,10;"
      + "\"Cherry\",13,14,9;"
      + "\"Apple\",14,15,10;"
      + "\"Pear\",9,8,8;"
      + "\"Apple\",8,9,6}";

  private static final String APPLE = "{\"Tree\";\"Apple\"}";

  /** Creates a fixture that calls a database function on the orchard. */
  private static Fx orchard(String fn, String field, String criteria) {
    return fx("=" + fn + "(" + ORCHARD + ", " + field + ", " + criteria
        + ")");
  }

  @Test void testSum() {
    orchard("DSUM", "\"Yield\"", APPLE).assertNumber(30);
    orchard("DSUM", "\"yield\"", APPLE).assertNumber(30);
    orchard("DSUM", "4", APPLE).assertNumber(30);
    orchard("DSUM", "\"Yield\"", "{\"Tree\"}").assertNumber(57);
    orchard("DSUM", "\"Yield\"", "{\"Tree\";\"P*\"}").assertNumber(18);
    orchard("DSUM", "\"Weight\"", APPLE).assertError(ErrorKind.VALUE);
    orchard("DSUM", "5", APPLE).assertError(ErrorKind.VALUE);
    orchard("DSUM", "\"Yield\"", "{\"Colour\";\"Red\"}")
        .assertError(ErrorKind.VALUE);
  }

  @Test void testCriteria() {
    // Conditions in one row must all hold
    orchard("DCOUNT", "\"Age\"",
        "{\"Tree\",\"Height\",\"Height\";\"Apple\",\">10\",\"<16\"}")
        .assertNumber(1);
    orchard("DAVERAGE", "\"Yield\"", "{\"Tree\",\"Height\";\"Apple\",\">10\"}")
        .assertNumber(12);

    // A record may match any row
    orchard("DMAX", "\"Yield\"", "{\"Tree\";\"Apple\";\"Pear\"}")
        .assertNumber(14);
    orchard("DMIN", "\"Yield\"", "{\"Tree\";\"Apple\";\"Pear\"}")
        .assertNumber(6);
    orchard("DSUM", "\"Yield\"", "{\"Tree\";\"Cherry\";\"Pear\"}")
        .assertNumber(27);
  }

  @Test void testCount() {
    orchard("DCOUNT", "\"Yield\"", APPLE).assertNumber(3);
    orchard("DCOUNT", "\"Tree\"", APPLE).assertNumber(0);
    orchard("DCOUNTA", "\"Tree\"", "{\"Height\";\">10\"}").assertNumber(4);
    orchard("DCOUNT", "", APPLE).assertNumber(3);
    fx("=DCOUNT(" + ORCHARD + ", " + APPLE + ")").assertNumber(3);
  }

  @Test void testGet() {
    orchard("DGET", "\"Yield\"", "{\"Tree\";\"Cherry\"}").assertNumber(9);
    orchard("DGET", "\"Tree\"", "{\"Yield\";\">12\"}").assertText("Apple");
    orchard("DGET", "\"Yield\"", APPLE).assertError(ErrorKind.NUMBER);
    orchard("DGET", "\"Yield\"", "{\"Tree\";\"Plum\"}")
        .assertError(ErrorKind.VALUE);
  }

  @Test void testStatistics() {
    orchard("DPRODUCT", "\"Yield\"", "{\"Tree\";\"Pear\"}").assertNumber(80);
    orchard("DSTDEV", "\"Yield\"", APPLE).assertNumber(4);
    orchard("DVAR", "\"Yield\"", APPLE).assertNumber(16);
    orchard("DVARP", "\"Yield\"", APPLE).assertNumber(32D / 3D);
    orchard("DSTDEVP", "\"Yield\"", APPLE).assertNumber(Math.sqrt(32D / 3D));
    orchard("DSTDEV", "\"Yield\"", "{\"Tree\";\"Cherry\"}")
        .assertError(ErrorKind.DIV_BY_ZERO);
    orchard("DAVERAGE", "\"Yield\"", "{\"Tree\";\"Plum\"}")
        .assertError(ErrorKind.DIV_BY_ZERO);
    orchard("DMAX", "\"Yield\"", "{\"Tree\";\"Plum\"}").assertNumber(0);
  }

  @Test void testRanges() {
    fx("=DSUM(A1:B3, \"Score\", D1:D2)")
        .withRow("A1", "Name", "Score")
        .withRow("A2", "x", 5)
        .withRow("A3", "y", 7)
        .withColumn("D1", "Score", ">5")
        .assertNumber(7);
    fx("=DSUM(A1:B3, \"Score\", D1:E2)")
        .withRow("A1", "Name", "Score")
        .withRow("A2", "x", 5)
        .withRow("A3", "y", 7)
        .withRow("D1", "Name", "Score")
        .withCell("D2", "x")
        .assertNumber(5);
  }
}

// End DatabaseFunctionsTest.java
