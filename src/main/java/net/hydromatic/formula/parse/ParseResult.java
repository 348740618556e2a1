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
package net.hydromatic.formula.parse;

import static java.util.Objects.requireNonNull;

import net.hydromatic.formula.ast.AstNode;
import net.hydromatic.formula.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Result of parsing formula text: either a tree or an error. */
public final class ParseResult {
  private final @Nullable AstNode node;
  private final @Nullable ParseError error;

  private ParseResult(@Nullable AstNode node, @Nullable ParseError error) {
    this.node = node;
    this.error = error;
  }

  static ParseResult success(AstNode node) {
    return new ParseResult(requireNonNull(node), null);
  }

  static ParseResult failure(ParseError error) {
    return new ParseResult(null, requireNonNull(error));
  }

  public boolean isSuccess() {
    return node != null;
  }

  /** Returns the parse tree.
   *
   * @throws IllegalStateException if parsing failed */
  public AstNode node() {
    if (node == null) {
      throw new IllegalStateException("parse failed: " + error);
    }
    return node;
  }

  /** Returns the error, or null if parsing succeeded. */
  public @Nullable ParseError error() {
    return error;
  }

  @Override public String toString() {
    return node != null ? node.toString() : String.valueOf(error);
  }

  /** Description of why formula text could not be parsed. */
  public static final class ParseError {
    public final String message;
    public final Pos pos;

    ParseError(String message, Pos pos) {
      this.message = requireNonNull(message);
      this.pos = requireNonNull(pos);
    }

    @Override public String toString() {
      return pos.describeTo(new StringBuilder())
          .append(" Error: ")
          .append(message)
          .toString();
    }
  }
}

// End ParseResult.java
