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

import java.time.LocalDateTime;
import java.util.List;
import java.util.Random;
import net.hydromatic.formula.ast.AstNode;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State of one evaluation.
 *
 * <p>A session lives for one call to {@link
 * net.hydromatic.formula.Formulas#evaluate}. Function implementations use
 * it to read cells, to call lambdas, and to get the random number
 * generator and the clock.
 */
public class Session {
  private static final Logger LOGGER = LoggerFactory.getLogger(Session.class);

  /** Largest range that can be read; four full columns. */
  public static final int MAX_RANGE_CELLS = 1 << 22;

  public final EvalContext context;
  private final Evaluator evaluator;
  private @Nullable Random random;
  private int callDepth;
  private boolean depthWarned;

  /** Creates a Session. */
  public Session(EvalContext context) {
    this.context = requireNonNull(context);
    this.evaluator = new Evaluator(this);
  }

  /** Evaluates a parse tree in an empty environment. */
  public Value evaluate(AstNode node) {
    return evaluator.eval(node, EvalEnvs.empty());
  }

  /** Returns the value of a cell. An empty cell is {@link Value#BLANK}. */
  public Value.Scalar cell(Address address) {
    final Value value = context.worksheet.getCellValue(address);
    return value == null ? Value.BLANK : Values.first(value);
  }

  /**
   * Returns the values of the cells in a range, as an array. A reversed
   * range is normalized.
   *
   * <p>Returns {@code #NUM!} if the range has more than
   * {@link #MAX_RANGE_CELLS} cells.
   */
  public Value range(Range range) {
    final Range r = range.normalize();
    final int rows = r.rows();
    final int cols = r.cols();
    if ((long) rows * cols > MAX_RANGE_CELLS) {
      return Value.error(ErrorKind.NUMBER);
    }
    final Value.Scalar[] cells = new Value.Scalar[rows * cols];
    for (int i = 0; i < rows; i++) {
      for (int j = 0; j < cols; j++) {
        cells[i * cols + j] =
            cell(Address.of(r.firstRow() + i, r.firstCol() + j));
      }
    }
    return ArrayValue.of(rows, cols, cells);
  }

  /**
   * Calls a function value with arguments.
   *
   * <p>If {@code fn} is an error, returns it; if it is not a lambda, returns
   * {@code #VALUE!}.
   */
  public Value apply(Value fn, List<? extends Value> args) {
    if (fn instanceof Value.Err) {
      return fn;
    }
    if (!(fn instanceof Closure)) {
      return Value.error(ErrorKind.VALUE);
    }
    final Closure closure = (Closure) fn;
    if (args.size() != closure.params.size()) {
      return Value.error(ErrorKind.VALUE);
    }
    if (callDepth >= maxCallDepth()) {
      if (!depthWarned) {
        depthWarned = true;
        LOGGER.warn("Lambda call depth exceeded {}; returning #N/A",
            maxCallDepth());
      }
      return Value.error(ErrorKind.NOT_AVAILABLE);
    }
    ++callDepth;
    try {
      return evaluator.eval(closure.body, closure.bindArgs(args));
    } finally {
      --callDepth;
    }
  }

  /** Returns the random number generator, creating it on first use. */
  public Random random() {
    if (random == null) {
      final Integer seed = Prop.RANDOM_SEED.intValueOpt(context.propMap);
      random = seed == null ? new Random() : new Random(seed);
    }
    return random;
  }

  /** Returns the current date and time, according to the context's
   * clock. */
  public LocalDateTime now() {
    return LocalDateTime.now(context.clock);
  }

  /** Returns the maximum number of iterations of a root-finder. */
  public int iterationLimit() {
    return Prop.ITERATION_LIMIT.intValue(context.propMap);
  }

  /** Returns the maximum depth of nested lambda calls. */
  public int maxCallDepth() {
    return Prop.MAX_CALL_DEPTH.intValue(context.propMap);
  }

  /** Returns the address of the cell that holds the formula, or null. */
  public @Nullable Address currentCell() {
    return context.currentCell;
  }
}

// End Session.java
