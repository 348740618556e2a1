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

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Locale;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Kinds of error value.
 *
 * <p>The set is closed, and each kind has a fixed textual token, such as
 * "#DIV/0!", that callers may use to interoperate with other spreadsheets.
 */
public enum ErrorKind {
  NULL("#NULL!", 1),
  DIV_BY_ZERO("#DIV/0!", 2),
  VALUE("#VALUE!", 3),
  REFERENCE("#REF!", 4),
  NAME("#NAME?", 5),
  NUMBER("#NUM!", 6),
  NOT_AVAILABLE("#N/A", 7);

  /** Token, e.g. "#N/A". */
  public final String token;

  /** Code returned by the {@code ERROR.TYPE} function. */
  public final int code;

  private static final ImmutableMap<String, ErrorKind> BY_TOKEN;

  static {
    final ImmutableMap.Builder<String, ErrorKind> b = ImmutableMap.builder();
    for (ErrorKind kind : values()) {
      b.put(kind.token, kind);
    }
    BY_TOKEN = b.build();
  }

  ErrorKind(String token, int code) {
    this.token = token;
    this.code = code;
  }

  /**
   * Looks up an error kind by its token, case-insensitively. Returns null if
   * not found.
   */
  public static @Nullable ErrorKind fromTokenOpt(String token) {
    return BY_TOKEN.get(token.toUpperCase(Locale.ROOT));
  }

  /** Returns all tokens, longest first, for use by a tokenizer. */
  public static ImmutableList<String> tokens() {
    return BY_TOKEN.keySet().stream()
        .sorted((a, b) -> Integer.compare(b.length(), a.length()))
        .collect(toImmutableList());
  }

  @Override
  public String toString() {
    return token;
  }
}

// End ErrorKind.java
