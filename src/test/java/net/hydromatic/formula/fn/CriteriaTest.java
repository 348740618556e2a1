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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import net.hydromatic.formula.eval.ErrorKind;
import net.hydromatic.formula.eval.Value;
import org.junit.jupiter.api.Test;

/** Tests for {@link Criteria} and {@link Wildcards}. */
public class CriteriaTest {
  private static boolean test(Object criterion, Object cell) {
    return Criteria.of(scalar(criterion)).test(scalar(cell));
  }

  private static Value.Scalar scalar(Object o) {
    if (o instanceof Number) {
      return Value.number(((Number) o).doubleValue());
    }
    if (o instanceof Boolean) {
      return Value.bool((Boolean) o);
    }
    if (o == null) {
      return Value.BLANK;
    }
    return Value.text((String) o);
  }

  @Test void testNumeric() {
    assertThat(test(5, 5), is(true));
    assertThat(test(5, "5"), is(true));
    assertThat(test(5, 6), is(false));
    assertThat(test(">5", 6), is(true));
    assertThat(test(">5", 5), is(false));
    assertThat(test(">=5", 5), is(true));
    assertThat(test("<5", 4.5), is(true));
    assertThat(test("<=5", "4"), is(false));
    assertThat(test("<>5", 4), is(true));
    assertThat(test("<>5", "apple"), is(true));
    assertThat(test("=5", 5), is(true));
  }

  @Test void testText() {
    assertThat(test("apple", "APPLE"), is(true));
    assertThat(test("<>apple", "Apple"), is(false));
    assertThat(test("<>apple", "pear"), is(true));
    assertThat(test(">b", "c"), is(true));
    assertThat(test(">b", 3), is(false));
    assertThat(test("TRUE", true), is(true));
  }

  @Test void testBlank() {
    assertThat(test("", null), is(true));
    assertThat(test("", ""), is(true));
    assertThat(test("", 0), is(false));
    assertThat(test("=", null), is(true));
    assertThat(test("<>", null), is(false));
    assertThat(test("<>", "x"), is(true));
  }

  @Test void testWildcards() {
    assertThat(test("a*", "Apple"), is(true));
    assertThat(test("a*", "banana"), is(false));
    assertThat(test("?ear", "pear"), is(true));
    assertThat(test("?ear", "spear"), is(false));
    assertThat(test("<>*an*", "banana"), is(false));
    assertThat(test("what~?", "what?"), is(true));
    assertThat(test("what~?", "whats"), is(false));
    assertThat(test("~*", "*"), is(true));

    assertThat(Wildcards.hasWildcards("a~*b"), is(false));
    assertThat(Wildcards.matches("*.txt", "Notes.TXT"), is(true));
    assertThat(Wildcards.unescape("a~*b~~"), is("a*b~"));
  }

  @Test void testErrorCells() {
    final Criteria criteria = Criteria.of(Value.text(">0"));
    assertThat(criteria.test(Value.error(ErrorKind.NOT_AVAILABLE)),
        is(false));
    assertThat(Criteria.of(Value.error(ErrorKind.NOT_AVAILABLE))
        .test(Value.error(ErrorKind.NOT_AVAILABLE)), is(true));
  }
}

// End CriteriaTest.java
