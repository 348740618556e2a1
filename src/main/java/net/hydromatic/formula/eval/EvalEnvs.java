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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Helpers for {@link EvalEnv}. */
public class EvalEnvs {
  private EvalEnvs() {}

  /** Environment with no bindings; the root of every chain. */
  private static final EvalEnv EMPTY = name -> null;

  /** Returns an environment with no bindings. */
  public static EvalEnv empty() {
    return EMPTY;
  }

  /**
   * Evaluation environment that inherits from a parent environment and adds
   * one binding.
   */
  static class SubEvalEnv implements EvalEnv {
    private final EvalEnv parentEnv;
    private final String name;
    private final Value value;

    SubEvalEnv(EvalEnv parentEnv, String name, Value value) {
      this.parentEnv = requireNonNull(parentEnv);
      this.name = requireNonNull(name);
      this.value = requireNonNull(value);
    }

    @Override
    public @Nullable Value getOpt(String name) {
      for (SubEvalEnv e = this; ; ) {
        if (name.equals(e.name)) {
          return e.value;
        }
        if (e.parentEnv instanceof SubEvalEnv) {
          e = (SubEvalEnv) e.parentEnv;
        } else {
          return e.parentEnv.getOpt(name);
        }
      }
    }
  }

  /**
   * Evaluation environment that inherits from a parent environment and adds
   * several bindings; used for the parameters of a lambda.
   */
  static class ArraySubEvalEnv implements EvalEnv {
    private final EvalEnv parentEnv;
    private final ImmutableList<String> names;
    private final ImmutableList<Value> values;

    ArraySubEvalEnv(EvalEnv parentEnv, List<String> names,
        List<? extends Value> values) {
      checkArgument(names.size() == values.size());
      this.parentEnv = requireNonNull(parentEnv);
      this.names = ImmutableList.copyOf(names);
      this.values = ImmutableList.copyOf(values);
    }

    @Override
    public @Nullable Value getOpt(String name) {
      final int i = names.indexOf(name);
      if (i >= 0) {
        return values.get(i);
      }
      return parentEnv.getOpt(name);
    }
  }
}

// End EvalEnvs.java
