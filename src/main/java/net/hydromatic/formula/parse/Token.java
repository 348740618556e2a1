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

import net.hydromatic.formula.ast.Pos;

/** Lexical token. */
final class Token {
  final Kind kind;
  /** Text of the token; for a string literal, the unquoted value. */
  final String text;
  final Pos pos;

  Token(Kind kind, String text, Pos pos) {
    this.kind = requireNonNull(kind);
    this.text = requireNonNull(text);
    this.pos = requireNonNull(pos);
  }

  boolean is(Kind kind, String text) {
    return this.kind == kind && this.text.equals(text);
  }

  @Override public String toString() {
    return kind == Kind.EOF ? "end of formula" : "'" + text + "'";
  }

  /** Kind of token. */
  enum Kind {
    NUMBER,
    STRING,
    BOOL,
    ERROR,
    /** Cell reference, such as "A1" or "$B$2". */
    REF,
    IDENT,
    LPAREN,
    RPAREN,
    LBRACE,
    RBRACE,
    COMMA,
    SEMICOLON,
    COLON,
    /** Operator: + - * / ^ &amp; = &lt;&gt; &lt; &lt;= &gt; &gt;= */
    OP,
    PERCENT,
    EOF
  }
}

// End Token.java
