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

import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Evaluation environment.
 *
 * <p>Holds the names that are in scope at a point in a formula: parameters of
 * enclosing lambdas and names bound by enclosing {@code LET} expressions.
 * Names are upper-case. Environments are immutable; binding a name creates a
 * child environment.
 */
public interface EvalEnv {

  /** Returns the binding of {@code name} if bound, null if not. */
  @Nullable Value getOpt(String name);

  /**
   * Creates an environment that has the same content as this one, plus the
   * binding (name, value).
   */
  default EvalEnv bind(String name, Value value) {
    return new EvalEnvs.SubEvalEnv(this, name, value);
  }

  /**
   * Creates an environment that has the same content as this one, plus a
   * binding for each (name, value) pair.
   */
  default EvalEnv bindAll(List<String> names, List<? extends Value> values) {
    if (names.size() == 1) {
      return bind(names.get(0), values.get(0));
    }
    return new EvalEnvs.ArraySubEvalEnv(this, names, values);
  }
}

// End EvalEnv.java
