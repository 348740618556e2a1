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

import static net.hydromatic.formula.Matchers.isArray;
import static net.hydromatic.formula.Matchers.isError;
import static net.hydromatic.formula.Matchers.isNumber;
import static net.hydromatic.formula.Matchers.isText;

import static org.hamcrest.CoreMatchers.hasItems;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import net.hydromatic.formula.Formulas;
import net.hydromatic.formula.eval.ArgList;
import net.hydromatic.formula.eval.ErrorKind;
import net.hydromatic.formula.eval.EvalContext;
import net.hydromatic.formula.eval.Value;
import org.junit.jupiter.api.Test;

/** Tests for {@link FunctionRegistry}, {@link FunctionDef} and
 * {@link BuiltIn}. */
public class RegistryTest {
  @Test void testBuiltIns() {
    final FunctionRegistry registry = FunctionRegistry.builtIns();
    assertThat(registry.isFrozen(), is(true));
    assertThat(FunctionRegistry.builtIns(), sameInstance(registry));
    assertThat(registry.allNames(),
        hasItems("ABS", "SUM", "XLOOKUP", "STDEV.S", "TEXTSPLIT"));

    final FunctionDef sum = registry.lookupOpt("sum");
    assertThat(sum, notNullValue());
    assertThat(sum.name, is("SUM"));
    assertThat(sum.category, is(Category.MATH));
    assertThat(sum.argMode, is(ArgMode.EAGER));
    assertThat(sum.acceptsArgCount(0), is(false));
    assertThat(sum.acceptsArgCount(1), is(true));
    assertThat(sum.acceptsArgCount(200), is(true));

    final FunctionDef abs = registry.lookupOpt("Abs");
    assertThat(abs, notNullValue());
    assertThat(abs.scalar, is(true));
    assertThat(abs.acceptsArgCount(2), is(false));

    assertThat(registry.lookupOpt("IF").argMode, is(ArgMode.LAZY));
    assertThat(registry.lookupOpt("RAND").isVolatile, is(true));
    assertThat(registry.lookupOpt("NO_SUCH_FUNCTION"), nullValue());
  }

  /** An alias shares the definition of the function it names. */
  @Test void testAlias() {
    final FunctionRegistry registry = FunctionRegistry.builtIns();
    assertThat(registry.lookupOpt("STDEV"),
        sameInstance(registry.lookupOpt("STDEV.S")));
  }

  @Test void testCategories() {
    final List<BuiltIn> database = BuiltIn.byCategory(Category.DATABASE);
    assertThat(database.size(), is(12));
    assertThat(database, hasItems(BuiltIn.DSUM, BuiltIn.DGET));
    for (BuiltIn builtIn : database) {
      assertThat(builtIn.name(), builtIn.category, is(Category.DATABASE));
    }
    int total = 0;
    for (Category category : Category.values()) {
      total += BuiltIn.byCategory(category).size();
    }
    assertThat(total, is(BuiltIn.values().length));
  }

  /** Every built-in other than LAMBDA and LET has an implementation. */
  @Test void testEveryBuiltInIsImplemented() {
    final FunctionRegistry registry = FunctionRegistry.builtIns();
    for (BuiltIn builtIn : BuiltIn.values()) {
      final FunctionDef def = registry.lookupOpt(builtIn.fnName);
      assertThat(builtIn.name(), def, notNullValue());
      if (def.argMode == ArgMode.EAGER) {
        assertThat(builtIn.name(), def.applicable, notNullValue());
      } else if (def.argMode == ArgMode.LAZY) {
        assertThat(builtIn.name(), def.lazyApplicable, notNullValue());
      }
    }
  }

  @Test void testRegisterErrors() {
    final FunctionDef def = FunctionDef.builder("answer")
        .arity(0, 0)
        .eager((session, args) -> Value.number(42))
        .build();
    assertThrows(IllegalStateException.class,
        () -> FunctionRegistry.builtIns().register(def));

    final FunctionRegistry registry = FunctionRegistry.create();
    registry.register(def);
    final IllegalStateException e =
        assertThrows(IllegalStateException.class,
            () -> registry.register(def));
    assertThat(e.getMessage(), is("function ANSWER is already registered"));

    assertThrows(IllegalStateException.class,
        () -> FunctionRegistry.withBuiltIns().register(
            FunctionDef.builder("sum").eager((s, a) -> Value.ZERO).build()));

    // A definition needs an implementation
    assertThrows(IllegalArgumentException.class,
        () -> FunctionDef.builder("nothing").build());
    assertThrows(IllegalArgumentException.class,
        () -> FunctionDef.builder("").build());
  }

  @Test void testCustomFunction() {
    final FunctionRegistry registry = FunctionRegistry.withBuiltIns()
        .register(
            FunctionDef.builder("triple")
                .category(Category.MATH)
                .syntax("TRIPLE(number)")
                .arity(1, 1)
                .scalar()
                .eager((session, args) -> {
                  final ArgList a = ArgList.of(args);
                  final double x = a.num(0);
                  return a.failed() ? a.error() : Value.number(x * 3);
                })
                .build())
        .register(
            FunctionDef.builder("firstOk")
                .arity(2, 2)
                .lazy((session, args) -> {
                  final Value v = args.get(0).force();
                  return v instanceof Value.Err ? args.get(1).force() : v;
                })
                .build());
    final EvalContext context =
        EvalContext.builder().registry(registry).build();
    assertThat(Formulas.evaluate("=TRIPLE(2)", context), isNumber(6));
    assertThat(Formulas.evaluate("=Triple({1, 2})", context),
        isArray("{3,6}"));
    assertThat(Formulas.evaluate("=TRIPLE(\"x\")", context),
        isError(ErrorKind.VALUE));
    assertThat(Formulas.evaluate("=TRIPLE(1, 2)", context),
        isError(ErrorKind.VALUE));
    assertThat(Formulas.evaluate("=FIRSTOK(1/0, \"fallback\")", context),
        isText("fallback"));
    assertThat(Formulas.evaluate("=SUM(TRIPLE(1), 1)", context),
        isNumber(4));
    assertThat(registry.lookupOpt("TRIPLE").isVolatile, is(false));

    final FunctionDef tick = FunctionDef.builder("tick")
        .arity(0, 0)
        .volatile_()
        .eager((session, args) -> Value.ZERO)
        .build();
    assertThat(tick.isVolatile, is(true));
    assertThat(tick.syntax, is("TICK(...)"));

    // Not visible with the default registry
    assertThat(
        Formulas.evaluate("=TRIPLE(2)", EvalContext.builder().build()),
        isError(ErrorKind.NAME));
  }
}

// End RegistryTest.java
