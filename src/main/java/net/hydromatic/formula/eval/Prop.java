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

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property that configures an evaluation.
 *
 * @see EvalContext#propMap
 */
public enum Prop {
  /**
   * Integer property "iterationLimit" is the maximum number of iterations of
   * a numeric root-finder, such as the one used by {@code IRR}, {@code XIRR},
   * {@code RATE} and the inverse distribution functions. Default is 100.
   */
  ITERATION_LIMIT("iterationLimit", Integer.class, true, 100),

  /**
   * Integer property "maxCallDepth" is the maximum depth of nested lambda
   * invocations. A call that would exceed it returns {@code #N/A}. Guards
   * against runaway recursion through named lambdas. Default is 100.
   */
  MAX_CALL_DEPTH("maxCallDepth", Integer.class, true, 100),

  /**
   * Integer property "randomSeed" seeds the generator used by {@code RAND},
   * {@code RANDBETWEEN} and {@code RANDARRAY}. If not set (the default), each
   * evaluation uses a different seed.
   */
  RANDOM_SEED("randomSeed", Integer.class, false, null);

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final @Nullable Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.immutableSortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, boolean required,
      @Nullable Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    if (defaultValue == null) {
      checkArgument(
          !required, "required property %s must have default value", camelName);
    } else {
      checkArgument(type.isInstance(defaultValue));
    }
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    final Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName
          + " not found; valid properties are "
          + Lists.transform(BY_CAMEL_NAME, p -> p.camelName));
    }
    return prop;
  }

  /** Returns the value of a property, or its default value, or null. */
  public @Nullable Object get(Map<Prop, Object> map) {
    final Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        type,
        camelName);
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    return this.<Integer>typeValue(map.get(this));
  }

  /** Returns the value of an optional integer property, or null. */
  public @Nullable Integer intValueOpt(Map<Prop, Object> map) {
    checkType(Integer.class);
    return (Integer) get(map);
  }

  @SuppressWarnings("unchecked")
  private <T> T typeValue(@Nullable Object o) {
    if (o == null) {
      if (defaultValue == null) {
        throw new IllegalStateException(
            "no value for property " + camelName + " and no default value");
      }
      return (T) defaultValue;
    }
    return (T) o;
  }

  /** Sets the value of a property, converting from a string if necessary. */
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (type == Integer.class && value instanceof String) {
      try {
        set(map, Integer.valueOf(((String) value).trim()));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(
            "value for property " + camelName + " must be an integer", e);
      }
      return;
    }
    set(map, value);
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      if (required) {
        throw new IllegalArgumentException(
            "property " + camelName + " is required");
      }
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new IllegalArgumentException(
            "value for property " + camelName + " must have type " + type);
      }
      map.put(this, value);
    }
  }
}

// End Prop.java
