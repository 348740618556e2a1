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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import net.hydromatic.formula.eval.Address;
import net.hydromatic.formula.eval.Range;
import net.hydromatic.formula.eval.Value;
import net.hydromatic.formula.eval.Values;

/** Various sub-classes of AST nodes. */
public class Ast {
  private Ast() {}

  /** Literal: a number, string, boolean or error. */
  public static class Literal extends AstNode {
    public final Value.Scalar value;

    Literal(Pos pos, Value.Scalar value) {
      super(pos, Op.LITERAL);
      this.value = requireNonNull(value);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (value instanceof Value.Text) {
        final StringBuilder b = new StringBuilder();
        Values.quote(b, ((Value.Text) value).value);
        return w.append(b.toString());
      }
      return w.append(value.toString());
    }
  }

  /** Reference to a single cell, such as "A1" or "$B$2". */
  public static class CellRef extends AstNode {
    public final Address address;
    public final boolean colAbsolute;
    public final boolean rowAbsolute;

    CellRef(Pos pos, Address address, boolean colAbsolute,
        boolean rowAbsolute) {
      super(pos, Op.CELL_REF);
      this.address = requireNonNull(address);
      this.colAbsolute = colAbsolute;
      this.rowAbsolute = rowAbsolute;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(colAbsolute ? "$" : "")
          .append(Address.columnName(address.col))
          .append(rowAbsolute ? "$" : "")
          .append(Integer.toString(address.row + 1));
    }
  }

  /** Reference to a rectangular range of cells, such as "A1:B10". */
  public static class RangeRef extends AstNode {
    public final CellRef start;
    public final CellRef end;

    RangeRef(Pos pos, CellRef start, CellRef end) {
      super(pos, Op.RANGE_REF);
      this.start = requireNonNull(start);
      this.end = requireNonNull(end);
    }

    /** Returns the range, as written (possibly reversed). */
    public Range range() {
      return Range.of(start.address, end.address);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      start.unparse(w, 0, 0);
      w.append(":");
      return end.unparse(w, 0, 0);
    }
  }

  /**
   * Identifier that is not a function call: a parameter of an enclosing
   * lambda, a name bound by {@code LET}, or a named lambda.
   */
  public static class Name extends AstNode {
    public final String name;

    Name(Pos pos, String name) {
      super(pos, Op.NAME);
      this.name = requireNonNull(name);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name);
    }
  }

  /** Call to a prefix or postfix operator. */
  public static class Unary extends AstNode {
    public final AstNode operand;

    Unary(Pos pos, Op op, AstNode operand) {
      super(pos, op);
      checkArgument(
          op.fixity == Op.Fixity.PREFIX || op.fixity == Op.Fixity.POSTFIX);
      this.operand = requireNonNull(operand);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return op.fixity == Op.Fixity.PREFIX
          ? w.prefix(left, op, operand, right)
          : w.postfix(left, operand, op, right);
    }
  }

  /** Call to an infix operator. */
  public static class Binary extends AstNode {
    public final AstNode left;
    public final AstNode right;

    Binary(Pos pos, Op op, AstNode left, AstNode right) {
      super(pos, op);
      checkArgument(op.fixity == Op.Fixity.INFIX);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, this.left, op, this.right, right);
    }
  }

  /** Call to a function by name, such as "SUM(A1:A3, 2)". */
  public static class Call extends AstNode {
    /** Function name, upper-case. */
    public final String name;
    public final ImmutableList<AstNode> args;

    Call(Pos pos, String name, ImmutableList<AstNode> args) {
      super(pos, Op.CALL);
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name).args(args);
    }
  }

  /**
   * Invocation of an expression that yields a lambda, such as
   * "LAMBDA(x, x + 1)(5)".
   */
  public static class Invoke extends AstNode {
    public final AstNode fn;
    public final ImmutableList<AstNode> args;

    Invoke(Pos pos, AstNode fn, ImmutableList<AstNode> args) {
      super(pos, Op.INVOKE);
      this.fn = requireNonNull(fn);
      this.args = requireNonNull(args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (fn.op == Op.CALL || fn.op == Op.LAMBDA || fn.op == Op.INVOKE) {
        fn.unparse(w, 0, 0);
      } else {
        w.append("(");
        fn.unparse(w, 0, 0);
        w.append(")");
      }
      return w.args(args);
    }
  }

  /** Lambda expression, "LAMBDA(param, ..., body)". */
  public static class Lambda extends AstNode {
    /** Parameter names, upper-case. */
    public final ImmutableList<String> params;
    public final AstNode body;

    Lambda(Pos pos, ImmutableList<String> params, AstNode body) {
      super(pos, Op.LAMBDA);
      this.params = requireNonNull(params);
      this.body = requireNonNull(body);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("LAMBDA(");
      for (String param : params) {
        w.append(param).append(", ");
      }
      body.unparse(w, 0, 0);
      return w.append(")");
    }
  }

  /** Local bindings, "LET(name1, value1, ..., body)". */
  public static class Let extends AstNode {
    /** Bound names, upper-case. */
    public final ImmutableList<String> names;
    public final ImmutableList<AstNode> values;
    public final AstNode body;

    Let(Pos pos, ImmutableList<String> names, ImmutableList<AstNode> values,
        AstNode body) {
      super(pos, Op.LET);
      checkArgument(!names.isEmpty() && names.size() == values.size());
      this.names = requireNonNull(names);
      this.values = requireNonNull(values);
      this.body = requireNonNull(body);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("LET(");
      for (int i = 0; i < names.size(); i++) {
        w.append(names.get(i)).append(", ");
        values.get(i).unparse(w, 0, 0);
        w.append(", ");
      }
      body.unparse(w, 0, 0);
      return w.append(")");
    }
  }

  /** Array constant, such as "{1,2;3,4}". */
  public static class ArrayLiteral extends AstNode {
    public final int rows;
    public final int cols;
    /** Elements, in row-major order. */
    public final ImmutableList<Value.Scalar> elements;

    ArrayLiteral(Pos pos, int rows, int cols,
        ImmutableList<Value.Scalar> elements) {
      super(pos, Op.ARRAY);
      checkArgument(rows > 0 && cols > 0 && elements.size() == rows * cols);
      this.rows = rows;
      this.cols = cols;
      this.elements = elements;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      final StringBuilder b = new StringBuilder("{");
      for (int i = 0; i < elements.size(); i++) {
        if (i > 0) {
          b.append(i % cols == 0 ? ';' : ',');
        }
        final Value.Scalar element = elements.get(i);
        if (element instanceof Value.Text) {
          Values.quote(b, ((Value.Text) element).value);
        } else {
          b.append(element);
        }
      }
      return w.append(b.append('}').toString());
    }
  }

  /** Argument that was omitted, such as the second argument of "f(1,,2)". */
  public static class Missing extends AstNode {
    Missing(Pos pos) {
      super(pos, Op.MISSING);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w;
    }
  }
}

// End Ast.java
