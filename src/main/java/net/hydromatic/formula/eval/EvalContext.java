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

import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import net.hydromatic.formula.ast.Ast;
import net.hydromatic.formula.compile.FunctionRegistry;
import net.hydromatic.formula.parse.FormulaParser;
import net.hydromatic.formula.parse.ParseResult;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Everything a formula can see while it is evaluated: the worksheet, the
 * address of the cell that holds the formula, named lambdas, configuration
 * properties, the clock, and the function registry.
 *
 * <p>A context is immutable; create one using {@link #builder()}.
 */
public class EvalContext {
  public final Worksheet worksheet;
  public final @Nullable Address currentCell;
  /** Named lambdas, keyed by upper-case name. */
  public final ImmutableMap<String, Closure> namedLambdas;
  public final ImmutableMap<Prop, Object> propMap;
  public final Clock clock;
  public final FunctionRegistry registry;

  private EvalContext(Worksheet worksheet, @Nullable Address currentCell,
      ImmutableMap<String, Closure> namedLambdas,
      ImmutableMap<Prop, Object> propMap, Clock clock,
      FunctionRegistry registry) {
    this.worksheet = requireNonNull(worksheet);
    this.currentCell = currentCell;
    this.namedLambdas = requireNonNull(namedLambdas);
    this.propMap = requireNonNull(propMap);
    this.clock = requireNonNull(clock);
    this.registry = requireNonNull(registry);
  }

  /** Creates a context that reads from a given worksheet, with default
   * settings. */
  public static EvalContext of(Worksheet worksheet) {
    return builder().worksheet(worksheet).build();
  }

  /** Creates a builder. */
  public static Builder builder() {
    return new Builder();
  }

  /** Returns a builder initialized with the contents of this context. */
  public Builder toBuilder() {
    final Builder b = new Builder();
    b.worksheet = worksheet;
    b.currentCell = currentCell;
    b.namedLambdas.putAll(namedLambdas);
    b.propMap.putAll(propMap);
    b.clock = clock;
    b.registry = registry;
    return b;
  }

  /** Returns the named lambda with a given name, or null. */
  public @Nullable Closure namedLambdaOpt(String name) {
    return namedLambdas.get(name.toUpperCase(Locale.ROOT));
  }

  /** Builder for {@link EvalContext}. */
  public static class Builder {
    private Worksheet worksheet = Worksheets.empty();
    private @Nullable Address currentCell;
    private final Map<String, Closure> namedLambdas = new LinkedHashMap<>();
    private final Map<Prop, Object> propMap = new LinkedHashMap<>();
    private Clock clock = Clock.systemDefaultZone();
    private FunctionRegistry registry = FunctionRegistry.builtIns();

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder worksheet(Worksheet worksheet) {
      this.worksheet = requireNonNull(worksheet);
      return this;
    }

    /** Sets the address of the cell that contains the formula. */
    @CanIgnoreReturnValue
    public Builder currentCell(@Nullable Address currentCell) {
      this.currentCell = currentCell;
      return this;
    }

    /** Sets the address, in A1 notation, of the cell that contains the
     * formula. */
    @CanIgnoreReturnValue
    public Builder currentCell(String address) {
      final Address a = Address.parseOpt(address);
      checkArgument(a != null, "invalid address: %s", address);
      return currentCell(a);
    }

    /** Defines a named lambda. */
    @CanIgnoreReturnValue
    public Builder lambda(String name, Closure closure) {
      namedLambdas.put(name.toUpperCase(Locale.ROOT), requireNonNull(closure));
      return this;
    }

    /**
     * Defines a named lambda from formula text, for example
     * {@code lambda("DOUBLE", "=LAMBDA(x, 2 * x)")}.
     *
     * @throws IllegalArgumentException if the text is not a valid
     *     {@code LAMBDA} expression
     */
    @CanIgnoreReturnValue
    public Builder lambda(String name, String formula) {
      final ParseResult result = FormulaParser.parse(formula);
      if (!result.isSuccess()) {
        throw new IllegalArgumentException("invalid lambda " + name + ": "
            + result.error());
      }
      if (!(result.node() instanceof Ast.Lambda)) {
        throw new IllegalArgumentException("not a lambda: " + formula);
      }
      final Ast.Lambda lambda = (Ast.Lambda) result.node();
      return lambda(name,
          new Closure(lambda.params, lambda.body, EvalEnvs.empty()));
    }

    /** Sets a property. */
    @CanIgnoreReturnValue
    public Builder set(Prop prop, @Nullable Object value) {
      prop.set(propMap, value);
      return this;
    }

    /** Sets a property by name, either {@link Prop#camelName} or the enum
     * constant's name. A string value is converted to the property's type,
     * so that values can come from a properties file or command line. */
    @CanIgnoreReturnValue
    public Builder set(String propName, @Nullable Object value) {
      Prop.lookup(propName).setLenient(propMap, value);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder clock(Clock clock) {
      this.clock = requireNonNull(clock);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder registry(FunctionRegistry registry) {
      this.registry = requireNonNull(registry);
      return this;
    }

    public EvalContext build() {
      return new EvalContext(worksheet, currentCell,
          ImmutableMap.copyOf(namedLambdas), ImmutableMap.copyOf(propMap),
          clock, registry);
    }
  }
}

// End EvalContext.java
