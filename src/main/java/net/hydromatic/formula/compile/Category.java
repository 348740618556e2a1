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

/** Category of a built-in function, as shown by tooling such as
 * autocomplete. */
public enum Category {
  ARRAY("Dynamic array"),
  DATABASE("Database"),
  DATE_TIME("Date & time"),
  ENGINEERING("Engineering"),
  FINANCIAL("Financial"),
  INFORMATION("Information"),
  LAMBDA("Lambda"),
  LOGICAL("Logical"),
  LOOKUP("Lookup & reference"),
  MATH("Math & trig"),
  STATISTICAL("Statistical"),
  TEXT("Text");

  /** Display name, e.g. "Math &amp; trig". */
  public final String displayName;

  Category(String displayName) {
    this.displayName = displayName;
  }
}

// End Category.java
