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

import static java.util.Objects.requireNonNull;

import com.google.common.base.Suppliers;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import net.hydromatic.formula.ast.Ast;
import net.hydromatic.formula.ast.AstNode;
import net.hydromatic.formula.compile.FunctionDef;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Walks a parse tree and computes its value.
 *
 * <p>A call to a function is resolved, in order, against names bound in the
 * environment (lambda parameters and {@code LET} names), the context's named
 * lambdas, and the function registry.
 */
class Evaluator {
  private final Session session;

  Evaluator(Session session) {
    this.session = requireNonNull(session);
  }

  Value eval(AstNode node, EvalEnv env) {
    switch (node.op) {
    case LITERAL:
      return ((Ast.Literal) node).value;

    case CELL_REF:
      return session.cell(((Ast.CellRef) node).address);

    case RANGE_REF:
      return session.range(((Ast.RangeRef) node).range());

    case ARRAY:
      final Ast.ArrayLiteral array = (Ast.ArrayLiteral) node;
      return ArrayValue.of(array.rows, array.cols, array.elements);

    case MISSING:
      return Value.MISSING;

    case NAME:
      return name((Ast.Name) node, env);

    case NEGATE:
    case UNARY_PLUS:
    case PERCENT:
      final Ast.Unary unary = (Ast.Unary) node;
      return Operators.unary(node.op, eval(unary.operand, env));

    case POWER:
    case TIMES:
    case DIVIDE:
    case PLUS:
    case MINUS:
    case CONCAT:
    case EQ:
    case NE:
    case LT:
    case LE:
    case GT:
    case GE:
      final Ast.Binary binary = (Ast.Binary) node;
      final Value left = eval(binary.left, env);
      final Value right = eval(binary.right, env);
      return Operators.binary(node.op, left, right);

    case CALL:
      return call((Ast.Call) node, env);

    case INVOKE:
      final Ast.Invoke invoke = (Ast.Invoke) node;
      final Value fn = eval(invoke.fn, env);
      return session.apply(fn, evalArgs(invoke.args, env));

    case LAMBDA:
      final Ast.Lambda lambda = (Ast.Lambda) node;
      return new Closure(lambda.params, lambda.body, env);

    case LET:
      return let((Ast.Let) node, env);

    default:
      throw new AssertionError("unknown op " + node.op);
    }
  }

  private Value name(Ast.Name name, EvalEnv env) {
    final Value value = env.getOpt(name.name);
    if (value != null) {
      return value;
    }
    final Closure closure = session.context.namedLambdaOpt(name.name);
    if (closure != null) {
      return closure;
    }
    return Value.error(ErrorKind.NAME);
  }

  private Value let(Ast.Let let, EvalEnv env) {
    EvalEnv e = env;
    for (int i = 0; i < let.names.size(); i++) {
      final Value value = eval(let.values.get(i), e);
      if (value instanceof Value.Err) {
        return value;
      }
      e = e.bind(let.names.get(i), value);
    }
    return eval(let.body, e);
  }

  private Value call(Ast.Call call, EvalEnv env) {
    final Value local = env.getOpt(call.name);
    if (local != null) {
      return session.apply(local, evalArgs(call.args, env));
    }
    final Closure closure = session.context.namedLambdaOpt(call.name);
    if (closure != null) {
      return session.apply(closure, evalArgs(call.args, env));
    }
    final FunctionDef def = session.context.registry.lookupOpt(call.name);
    if (def == null) {
      return Value.error(ErrorKind.NAME);
    }
    if (!def.acceptsArgCount(call.args.size())) {
      return Value.error(ErrorKind.VALUE);
    }
    switch (def.argMode) {
    case LAZY:
      final List<Deferred> deferreds = new ArrayList<>(call.args.size());
      for (AstNode arg : call.args) {
        deferreds.add(new NodeDeferred(arg, env));
      }
      return requireNonNull(def.lazyApplicable).apply(session, deferreds);

    case EAGER:
      final Applicable applicable = requireNonNull(def.applicable);
      if (def.scalar) {
        return Broadcast.apply(applicable, session, evalArgs(call.args, env));
      }
      final List<Value> args = new ArrayList<>(call.args.size());
      for (AstNode arg : call.args) {
        // A function that takes ranges sees a cell reference as a 1 x 1
        // range, so that it can treat it as a reference rather than as a
        // direct argument.
        if (arg instanceof Ast.CellRef) {
          args.add(ArrayValue.of(session.cell(((Ast.CellRef) arg).address)));
        } else {
          args.add(eval(arg, env));
        }
      }
      return applicable.apply(session, args);

    default:
      // LAMBDA and LET are handled by the parser
      return Value.error(ErrorKind.VALUE);
    }
  }

  private List<Value> evalArgs(List<AstNode> argNodes, EvalEnv env) {
    final List<Value> args = new ArrayList<>(argNodes.size());
    for (AstNode arg : argNodes) {
      args.add(eval(arg, env));
    }
    return args;
  }

  /** Argument of a lazy function; evaluates its expression at most once. */
  private class NodeDeferred implements Deferred {
    private final AstNode node;
    private final Supplier<Value> supplier;

    NodeDeferred(AstNode node, EvalEnv env) {
      this.node = node;
      this.supplier = Suppliers.memoize(() -> eval(node, env));
    }

    @Override
    public Value force() {
      return supplier.get();
    }

    @Override
    public @Nullable Range reference() {
      if (node instanceof Ast.CellRef) {
        return Range.of(((Ast.CellRef) node).address);
      }
      if (node instanceof Ast.RangeRef) {
        return ((Ast.RangeRef) node).range();
      }
      return null;
    }

    @Override
    public boolean isMissing() {
      return node instanceof Ast.Missing;
    }
  }
}

// End Evaluator.java
