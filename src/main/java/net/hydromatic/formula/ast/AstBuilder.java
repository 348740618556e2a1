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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.formula.eval.Address;
import net.hydromatic.formula.eval.Value;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  /** Creates a literal. */
  public Ast.Literal literal(Pos pos, Value.Scalar value) {
    return new Ast.Literal(pos, value);
  }

  /** Creates a number literal. */
  public Ast.Literal numberLiteral(Pos pos, double value) {
    return new Ast.Literal(pos, Value.number(value));
  }

  /** Creates a string literal. */
  public Ast.Literal stringLiteral(Pos pos, String value) {
    return new Ast.Literal(pos, Value.text(value));
  }

  /** Creates a reference to a cell. */
  public Ast.CellRef cellRef(
      Pos pos, Address address, boolean colAbsolute, boolean rowAbsolute) {
    return new Ast.CellRef(pos, address, colAbsolute, rowAbsolute);
  }

  /** Creates a reference to a range of cells. */
  public Ast.RangeRef rangeRef(Ast.CellRef start, Ast.CellRef end) {
    return new Ast.RangeRef(start.pos.plus(end.pos), start, end);
  }

  /** Creates a name. */
  public Ast.Name name(Pos pos, String name) {
    return new Ast.Name(pos, name);
  }

  /** Creates a call to a prefix or postfix operator. */
  public Ast.Unary unary(Pos pos, Op op, AstNode operand) {
    return new Ast.Unary(pos, op, operand);
  }

  /** Creates a call to an infix operator. */
  public Ast.Binary binary(Op op, AstNode left, AstNode right) {
    return new Ast.Binary(left.pos.plus(right.pos), op, left, right);
  }

  /** Creates a call to a named function. */
  public Ast.Call call(Pos pos, String name, List<? extends AstNode> args) {
    return new Ast.Call(pos, name, ImmutableList.copyOf(args));
  }

  /** Creates an invocation of a lambda-valued expression. */
  public Ast.Invoke invoke(Pos pos, AstNode fn, List<? extends AstNode> args) {
    return new Ast.Invoke(pos, fn, ImmutableList.copyOf(args));
  }

  /** Creates a lambda. */
  public Ast.Lambda lambda(Pos pos, List<String> params, AstNode body) {
    return new Ast.Lambda(pos, ImmutableList.copyOf(params), body);
  }

  /** Creates a LET. */
  public Ast.Let let(Pos pos, List<String> names,
      List<? extends AstNode> values, AstNode body) {
    return new Ast.Let(pos, ImmutableList.copyOf(names),
        ImmutableList.copyOf(values), body);
  }

  /** Creates an array constant. */
  public Ast.ArrayLiteral array(Pos pos, int rows, int cols,
      List<? extends Value.Scalar> elements) {
    return new Ast.ArrayLiteral(pos, rows, cols,
        ImmutableList.copyOf(elements));
  }

  /** Creates an omitted argument. */
  public Ast.Missing missing(Pos pos) {
    return new Ast.Missing(pos);
  }
}

// End AstBuilder.java
