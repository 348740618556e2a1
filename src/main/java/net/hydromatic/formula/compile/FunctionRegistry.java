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

import static java.util.Objects.requireNonNull;

import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Supplier;
import net.hydromatic.formula.fn.Codes;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Set of functions that formulas may call, keyed by upper-case name.
 *
 * <p>The registry of built-in functions is created once and frozen; it is
 * shared by all evaluations. To add custom functions, call {@link
 * #withBuiltIns()} to get a mutable copy, register functions, and pass the
 * registry to {@link net.hydromatic.formula.eval.EvalContext.Builder#registry}.
 */
public class FunctionRegistry {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(FunctionRegistry.class);

  private static final Supplier<FunctionRegistry> BUILT_INS =
      Suppliers.memoize(() -> populate(new FunctionRegistry()).freeze());

  private final Map<String, FunctionDef> map = new TreeMap<>();
  private boolean frozen;

  private FunctionRegistry() {}

  /** Returns the registry of built-in functions. It is frozen. */
  public static FunctionRegistry builtIns() {
    return BUILT_INS.get();
  }

  /** Creates an empty, mutable registry. */
  public static FunctionRegistry create() {
    return new FunctionRegistry();
  }

  /** Creates a mutable registry that contains the built-in functions. */
  public static FunctionRegistry withBuiltIns() {
    final FunctionRegistry registry = new FunctionRegistry();
    registry.map.putAll(builtIns().map);
    return registry;
  }

  private static FunctionRegistry populate(FunctionRegistry registry) {
    for (BuiltIn builtIn : BuiltIn.values()) {
      final FunctionDef def =
          FunctionDef.of(builtIn, Codes.BUILT_IN_VALUES.get(builtIn));
      registry.register(def);
      if (builtIn.alias != null) {
        registry.register(builtIn.alias, def);
      }
    }
    LOGGER.debug("Registered {} built-in functions ({} names)",
        BuiltIn.values().length, registry.map.size());
    return registry;
  }

  /**
   * Registers a function.
   *
   * @throws IllegalStateException if a function of the same name is already
   *     registered, or if the registry is frozen
   */
  public FunctionRegistry register(FunctionDef def) {
    return register(def.name, def);
  }

  private FunctionRegistry register(String name, FunctionDef def) {
    if (frozen) {
      throw new IllegalStateException("registry is frozen");
    }
    final String key = name.toUpperCase(Locale.ROOT);
    if (map.containsKey(key)) {
      throw new IllegalStateException("function " + key
          + " is already registered");
    }
    map.put(key, requireNonNull(def));
    return this;
  }

  /** Prevents further registrations. */
  public FunctionRegistry freeze() {
    frozen = true;
    return this;
  }

  public boolean isFrozen() {
    return frozen;
  }

  /** Looks up a function by name, case-insensitively; returns null if not
   * found. */
  public @Nullable FunctionDef lookupOpt(String name) {
    return map.get(name.toUpperCase(Locale.ROOT));
  }

  /** Returns the names of all registered functions, including aliases, in
   * alphabetical order. */
  public ImmutableSortedSet<String> allNames() {
    return ImmutableSortedSet.copyOf(map.keySet());
  }
}

// End FunctionRegistry.java
