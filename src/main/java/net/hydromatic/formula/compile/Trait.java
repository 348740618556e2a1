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

/** Traits of a built-in function. */
enum Trait {
  /**
   * The function takes scalar arguments and returns a scalar; if called with
   * array arguments it is applied element-wise.
   */
  SCALAR,

  /** Arguments are deferred; see {@link ArgMode#LAZY}. */
  LAZY,

  /** The function is a syntactic form; see {@link ArgMode#SYNTAX}. */
  SYNTAX,

  /** The function may return a different result each time it is called. */
  VOLATILE
}

// End Trait.java
