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
package net.hydromatic.formula.compile;

/** How the arguments of a function are evaluated. */
public enum ArgMode {
  /** Every argument is evaluated before the function is called. */
  EAGER,

  /**
   * Each argument is passed as a {@link net.hydromatic.formula.eval.Deferred}
   * and is evaluated only if the function forces it.
   */
  LAZY,

  /**
   * The call is a syntactic form, such as {@code LET} or {@code LAMBDA}, that
   * the parser turns into a dedicated node; the function has no
   * implementation.
   */
  SYNTAX
}

// End ArgMode.java
