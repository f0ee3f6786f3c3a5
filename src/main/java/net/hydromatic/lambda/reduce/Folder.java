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
package net.hydromatic.lambda.reduce;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.lambda.ast.TermBuilder.term;

import net.hydromatic.lambda.ast.Op;
import net.hydromatic.lambda.ast.Shuttle;
import net.hydromatic.lambda.ast.Term;

/**
 * Folds arithmetic.
 *
 * <p>One pass, bottom-up, replaces each {@link Term.BinOp} and {@link
 * Term.Neg} whose operands are (or fold to) {@link Term.Num} with a single
 * {@code Num}. Arithmetic is IEEE double; division by zero yields an infinity
 * or NaN.
 *
 * <p>Under {@link Strategy#LAZY_NO_BINDER} the pass does not enter
 * applications or abstractions; under {@link Strategy#EAGER} it does.
 */
public class Folder extends Shuttle {
  public final Strategy strategy;

  public Folder(Strategy strategy) {
    this.strategy = requireNonNull(strategy, "strategy");
  }

  /** Folds all foldable arithmetic in a term. */
  public Term fold(Term term) {
    return term.accept(this);
  }

  @Override
  protected Term visit(Term.Abs abs) {
    return strategy.full ? super.visit(abs) : abs;
  }

  @Override
  protected Term visit(Term.App app) {
    return strategy.full ? super.visit(app) : app;
  }

  @Override
  protected Term visit(Term.BinOp binOp) {
    final Term left = binOp.left.accept(this);
    final Term right = binOp.right.accept(this);
    if (left.op == Op.NUM && right.op == Op.NUM) {
      return term.num(
          apply(binOp.op, ((Term.Num) left).value, ((Term.Num) right).value));
    }
    return binOp.copy(left, right);
  }

  @Override
  protected Term visit(Term.Neg neg) {
    final Term operand = neg.operand.accept(this);
    if (operand.op == Op.NUM) {
      return term.num(-((Term.Num) operand).value);
    }
    return neg.copy(operand);
  }

  /** Applies a binary operator to two numbers. */
  static double apply(Op op, double left, double right) {
    switch (op) {
      case PLUS:
        return left + right;
      case MINUS:
        return left - right;
      case TIMES:
        return left * right;
      case DIVIDE:
        return left / right;
      default:
        throw new AssertionError("not a binary operator: " + op);
    }
  }
}

// End Folder.java
