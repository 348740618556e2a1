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

/**
 * Grid of cells that a formula reads.
 *
 * <p>The engine only calls {@link #getCellValue}. {@link #setCellValue}
 * exists so that test harnesses can populate a worksheet.
 *
 * <p>Implementations that are read by several concurrent evaluations must be
 * immutable or synchronized by the caller.
 *
 * @see Worksheets
 */
public interface Worksheet {
  /** Returns the value of a cell; {@link Value#BLANK} if it is empty. */
  Value getCellValue(Address address);

  /** Sets the value of a cell. */
  void setCellValue(Address address, Value value);
}

// End Worksheet.java
