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
package net.hydromatic.formula.ast;

import java.util.List;

/** Context for writing an AST out as formula text. */
public class AstWriter {
  private final StringBuilder b = new StringBuilder();

  /** Appends a string to the output. */
  public AstWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends a call to an infix operator. */
  public AstWriter infix(int left, AstNode a0, Op op, AstNode a1, int right) {
    if (left > op.left || op.right < right) {
      return append("(").infix(0, a0, op, a1, 0).append(")");
    }
    a0.unparse(this, left, op.left);
    append(op.symbol);
    a1.unparse(this, op.right, right);
    return this;
  }

  /** Appends a call to a prefix operator, such as unary minus. */
  public AstWriter prefix(int left, Op op, AstNode a, int right) {
    if (op.right < right) {
      return append("(").prefix(0, op, a, 0).append(")");
    }
    append(op.symbol);
    a.unparse(this, op.right, right);
    return this;
  }

  /** Appends a call to a postfix operator, such as "%". */
  public AstWriter postfix(int left, AstNode a, Op op, int right) {
    if (left > op.left) {
      return append("(").postfix(0, a, op, 0).append(")");
    }
    a.unparse(this, left, op.left);
    append(op.symbol);
    return this;
  }

  /** Appends a parenthesized, comma-separated list of nodes. */
  public AstWriter args(List<? extends AstNode> nodes) {
    append("(");
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        append(", ");
      }
      nodes.get(i).unparse(this, 0, 0);
    }
    return append(")");
  }

  @Override
  public String toString() {
    return b.toString();
  }
}

// End AstWriter.java
