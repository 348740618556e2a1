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
package net.hydromatic.formula;

import net.hydromatic.formula.eval.ArrayValue;
import net.hydromatic.formula.eval.ErrorKind;
import net.hydromatic.formula.eval.Value;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Matcher;

/** Matchers for use in formula tests. */
public abstract class Matchers {
  private Matchers() {}

  /** Matches a number, allowing a small relative error. */
  public static Matcher<Value> isNumber(double expected) {
    return isNumber(expected, 1E-9 * Math.max(1D, Math.abs(expected)));
  }

  /** Matches a number within a given tolerance. */
  public static Matcher<Value> isNumber(double expected, double tolerance) {
    return new CustomTypeSafeMatcher<Value>("number " + expected) {
      @Override protected boolean matchesSafely(Value value) {
        return value instanceof Value.Num
            && Math.abs(((Value.Num) value).value - expected) <= tolerance;
      }
    };
  }

  /** Matches a text value. */
  public static Matcher<Value> isText(String expected) {
    return new CustomTypeSafeMatcher<Value>("text \"" + expected + "\"") {
      @Override protected boolean matchesSafely(Value value) {
        return value instanceof Value.Text
            && ((Value.Text) value).value.equals(expected);
      }
    };
  }

  /** Matches a boolean value. */
  public static Matcher<Value> isBool(boolean expected) {
    return new CustomTypeSafeMatcher<Value>("boolean " + expected) {
      @Override protected boolean matchesSafely(Value value) {
        return value instanceof Value.Bool
            && ((Value.Bool) value).value == expected;
      }
    };
  }

  /** Matches an error value. */
  public static Matcher<Value> isError(ErrorKind expected) {
    return new CustomTypeSafeMatcher<Value>("error " + expected) {
      @Override protected boolean matchesSafely(Value value) {
        return value instanceof Value.Err
            && ((Value.Err) value).error == expected;
      }
    };
  }

  /** Matches an array by its string representation, such as
   * "{1,2;3,4}". */
  public static Matcher<Value> isArray(String expected) {
    return new CustomTypeSafeMatcher<Value>("array " + expected) {
      @Override protected boolean matchesSafely(Value value) {
        return value instanceof ArrayValue
            && value.toString().equals(expected);
      }
    };
  }
}

// End Matchers.java
