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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.formula.ast.AstNode;

/**
 * Value of a {@code LAMBDA} expression.
 *
 * <p>A closure holds the parameter names, the body, and the environment that
 * was in scope where the lambda was written, so that the body can see names
 * bound by enclosing {@code LET} and {@code LAMBDA} expressions.
 */
public final class Closure extends Value {
  public final ImmutableList<String> params;
  public final AstNode body;
  final EvalEnv evalEnv;

  /** Creates a Closure. */
  public Closure(List<String> params, AstNode body, EvalEnv evalEnv) {
    this.params = ImmutableList.copyOf(params);
    this.body = requireNonNull(body);
    this.evalEnv = requireNonNull(evalEnv);
  }

  @Override
  public Kind kind() {
    return Kind.LAMBDA;
  }

  /**
   * Creates the environment in which the body is evaluated, binding the
   * parameters to argument values.
   */
  EvalEnv bindArgs(List<? extends Value> args) {
    return evalEnv.bindAll(params, args);
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder("LAMBDA(");
    for (String param : params) {
      b.append(param).append(", ");
    }
    return b.append(body).append(')').toString();
  }
}

// End Closure.java
