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

import net.hydromatic.formula.ast.AstNode;
import net.hydromatic.formula.eval.ArrayValue;
import net.hydromatic.formula.eval.ErrorKind;
import net.hydromatic.formula.eval.EvalContext;
import net.hydromatic.formula.eval.Session;
import net.hydromatic.formula.eval.Value;
import net.hydromatic.formula.parse.FormulaParser;
import net.hydromatic.formula.parse.ParseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: evaluates formula text against a context.
 *
 * <pre>{@code
 * Worksheet ws = Worksheets.create();
 * Worksheets.set(ws, "A1", 10);
 * Worksheets.set(ws, "A2", 20);
 * Value v = Formulas.evaluate("=SUM(A1:A2)", EvalContext.of(ws));
 * // v is 30
 * }</pre>
 *
 * <p>Evaluation never throws for a bad formula or bad arguments. Malformed
 * text yields {@code #NAME?}; other problems yield the appropriate error
 * value.
 */
public abstract class Formulas {
  private static final Logger LOGGER = LoggerFactory.getLogger(Formulas.class);

  private Formulas() {}

  /** Parses and evaluates a formula. */
  public static Value evaluate(String formulaText, EvalContext context) {
    final ParseResult result = FormulaParser.parse(formulaText);
    if (!result.isSuccess()) {
      LOGGER.debug("Cannot parse formula {}: {}", formulaText, result.error());
      return Value.error(ErrorKind.NAME);
    }
    return evaluate(result.node(), context);
  }

  /** Evaluates a parsed formula. */
  public static Value evaluate(AstNode node, EvalContext context) {
    final Value value = new Session(context).evaluate(node);
    return finish(value);
  }

  /** Converts a result to the form the caller sees: a reference to an
   * empty cell becomes 0. */
  private static Value finish(Value value) {
    if (value instanceof Value.Blank) {
      return Value.ZERO;
    }
    if (value instanceof ArrayValue) {
      return ((ArrayValue) value)
          .map(s -> s instanceof Value.Blank ? Value.ZERO : s);
    }
    return value;
  }
}

// End Formulas.java
