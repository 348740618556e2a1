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
package net.hydromatic.formula.eval;

import static java.util.Objects.requireNonNull;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Argument whose evaluation is deferred until a function asks for it.
 *
 * <p>Functions such as {@code IF} receive their arguments as deferred values,
 * and force only the ones they need. Forcing is memoized: a deferred value
 * is evaluated at most once.
 *
 * @see LazyApplicable
 */
public interface Deferred {
  /** Evaluates the argument, if not already evaluated, and returns its
   * value. */
  Value force();

  /**
   * Returns the range that the argument refers to, if it is written as a cell
   * or range reference; otherwise null. Does not evaluate the argument.
   */
  default @Nullable Range reference() {
    return null;
  }

  /** Returns whether the argument was omitted, as in {@code f(1,,2)}. */
  default boolean isMissing() {
    return false;
  }

  /** Creates a deferred value that has already been evaluated. */
  static Deferred of(Value value) {
    requireNonNull(value);
    return () -> value;
  }
}

// End Deferred.java
