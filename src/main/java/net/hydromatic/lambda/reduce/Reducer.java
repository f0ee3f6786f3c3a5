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

import net.hydromatic.lambda.ast.Term;

/**
 * Performs a single beta-reduction.
 *
 * <p>Redexes are searched leftmost-outermost: a term that is a redex is
 * reduced before anything inside it; in an application, the function is
 * searched before the argument; arithmetic operands are searched left to
 * right. The {@link Strategy} decides whether the search enters abstraction
 * bodies and arguments.
 *
 * <p>The reducer never folds arithmetic; see {@link Folder}.
 */
public class Reducer {
  public final Strategy strategy;

  public Reducer(Strategy strategy) {
    this.strategy = requireNonNull(strategy, "strategy");
  }

  /** Performs at most one reduction on a term. */
  public Step step(Term term) {
    switch (term.op) {
      case VAR:
      case NUM:
        return Step.none(term);

      case APP:
        final Term.App app = (Term.App) term;
        if (app.isRedex()) {
          return Step.of(contract(app));
        }
        final Step fnStep = step(app.fn);
        if (fnStep.reduced) {
          return Step.of(app.copy(fnStep.term, app.arg));
        }
        if (strategy.full) {
          final Step argStep = step(app.arg);
          if (argStep.reduced) {
            return Step.of(app.copy(app.fn, argStep.term));
          }
        }
        return Step.none(term);

      case ABS:
        if (strategy.full) {
          final Term.Abs abs = (Term.Abs) term;
          final Step bodyStep = step(abs.body);
          if (bodyStep.reduced) {
            return Step.of(abs.copy(abs.param, bodyStep.term));
          }
        }
        return Step.none(term);

      case PLUS:
      case MINUS:
      case TIMES:
      case DIVIDE:
        final Term.BinOp binOp = (Term.BinOp) term;
        final Step leftStep = step(binOp.left);
        if (leftStep.reduced) {
          return Step.of(binOp.copy(leftStep.term, binOp.right));
        }
        final Step rightStep = step(binOp.right);
        if (rightStep.reduced) {
          return Step.of(binOp.copy(binOp.left, rightStep.term));
        }
        return Step.none(term);

      case NEGATE:
        final Term.Neg neg = (Term.Neg) term;
        final Step operandStep = step(neg.operand);
        if (operandStep.reduced) {
          return Step.of(neg.copy(operandStep.term));
        }
        return Step.none(term);

      default:
        throw new AssertionError("unknown op " + term.op);
    }
  }

  /**
   * Contracts a redex {@code (\x.body) arg} to {@code body[x := arg]}. The
   * argument is substituted unevaluated.
   */
  static Term contract(Term.App redex) {
    final Term.Abs abs = (Term.Abs) redex.fn;
    return Replacer.substitute(abs.body, abs.param, redex.arg);
  }

  /** Result of {@link #step}: a term, and whether a reduction occurred. */
  public static final class Step {
    public final Term term;
    public final boolean reduced;

    private Step(Term term, boolean reduced) {
      this.term = requireNonNull(term, "term");
      this.reduced = reduced;
    }

    static Step of(Term term) {
      return new Step(term, true);
    }

    static Step none(Term term) {
      return new Step(term, false);
    }

    @Override
    public String toString() {
      return (reduced ? "reduced to " : "unchanged ") + term;
    }
  }
}

// End Reducer.java
