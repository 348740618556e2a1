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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Locale;
import net.hydromatic.formula.eval.Applicable;
import net.hydromatic.formula.eval.LazyApplicable;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Definition of a function that can be called from a formula: its name,
 * metadata, and implementation.
 *
 * <p>Exactly one of {@link #applicable} and {@link #lazyApplicable} is set,
 * according to {@link #argMode}. A function whose mode is {@link
 * ArgMode#SYNTAX} has neither; the evaluator handles it directly.
 */
public final class FunctionDef {
  public final String name;
  public final Category category;
  public final String syntax;
  public final String description;
  public final int minArgs;
  /** Maximum number of arguments, or {@link BuiltIn#VARIADIC}. */
  public final int maxArgs;
  public final ArgMode argMode;
  public final boolean scalar;
  public final boolean isVolatile;
  public final @Nullable Applicable applicable;
  public final @Nullable LazyApplicable lazyApplicable;

  private FunctionDef(String name, Category category, String syntax,
      String description, int minArgs, int maxArgs, ArgMode argMode,
      boolean scalar, boolean isVolatile, @Nullable Applicable applicable,
      @Nullable LazyApplicable lazyApplicable) {
    this.name = requireNonNull(name).toUpperCase(Locale.ROOT);
    this.category = requireNonNull(category);
    this.syntax = requireNonNull(syntax);
    this.description = requireNonNull(description);
    this.minArgs = minArgs;
    this.maxArgs = maxArgs;
    this.argMode = requireNonNull(argMode);
    this.scalar = scalar;
    this.isVolatile = isVolatile;
    this.applicable = applicable;
    this.lazyApplicable = lazyApplicable;
    checkArgument(minArgs >= 0, "minArgs");
    checkArgument(maxArgs == BuiltIn.VARIADIC || maxArgs >= minArgs,
        "maxArgs");
    switch (argMode) {
    case EAGER:
      checkArgument(applicable != null && lazyApplicable == null,
          "eager function %s requires an Applicable", name);
      break;
    case LAZY:
      checkArgument(lazyApplicable != null && applicable == null,
          "lazy function %s requires a LazyApplicable", name);
      break;
    default:
      checkArgument(applicable == null && lazyApplicable == null,
          "syntax function %s must not have an implementation", name);
    }
  }

  /** Creates the definition of a built-in function. */
  static FunctionDef of(BuiltIn builtIn, @Nullable Object impl) {
    return new FunctionDef(builtIn.fnName, builtIn.category, builtIn.syntax,
        builtIn.description, builtIn.minArgs, builtIn.maxArgs,
        builtIn.argMode, builtIn.scalar, builtIn.isVolatile,
        impl instanceof Applicable ? (Applicable) impl : null,
        impl instanceof LazyApplicable ? (LazyApplicable) impl : null);
  }

  /** Creates a builder for a custom function. */
  public static Builder builder(String name) {
    return new Builder(name);
  }

  /** Returns whether a call with {@code n} arguments is valid. */
  public boolean acceptsArgCount(int n) {
    return n >= minArgs && (maxArgs == BuiltIn.VARIADIC || n <= maxArgs);
  }

  @Override
  public String toString() {
    return syntax;
  }

  /** Builder for a {@link FunctionDef}. */
  public static class Builder {
    private final String name;
    private Category category = Category.MATH;
    private @Nullable String syntax;
    private String description = "";
    private int minArgs = 0;
    private int maxArgs = BuiltIn.VARIADIC;
    private boolean scalar;
    private boolean isVolatile;
    private @Nullable Applicable applicable;
    private @Nullable LazyApplicable lazyApplicable;

    private Builder(String name) {
      this.name = requireNonNull(name);
      checkArgument(!name.isEmpty(), "empty name");
    }

    @CanIgnoreReturnValue
    public Builder category(Category category) {
      this.category = requireNonNull(category);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder syntax(String syntax) {
      this.syntax = requireNonNull(syntax);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder description(String description) {
      this.description = requireNonNull(description);
      return this;
    }

    /** Sets the minimum and maximum number of arguments; use {@link
     * BuiltIn#VARIADIC} as maximum for no limit. */
    @CanIgnoreReturnValue
    public Builder arity(int minArgs, int maxArgs) {
      this.minArgs = minArgs;
      this.maxArgs = maxArgs;
      return this;
    }

    /** Declares that the function is applied element-wise to arrays. */
    @CanIgnoreReturnValue
    public Builder scalar() {
      this.scalar = true;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder volatile_() {
      this.isVolatile = true;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder eager(Applicable applicable) {
      this.applicable = requireNonNull(applicable);
      this.lazyApplicable = null;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder lazy(LazyApplicable lazyApplicable) {
      this.lazyApplicable = requireNonNull(lazyApplicable);
      this.applicable = null;
      return this;
    }

    public FunctionDef build() {
      final String upperName = name.toUpperCase(Locale.ROOT);
      final ArgMode argMode =
          lazyApplicable != null ? ArgMode.LAZY : ArgMode.EAGER;
      return new FunctionDef(upperName, category,
          syntax != null ? syntax : upperName + "(...)", description,
          minArgs, maxArgs, argMode, scalar, isVolatile, applicable,
          lazyApplicable);
    }
  }
}

// End FunctionDef.java
