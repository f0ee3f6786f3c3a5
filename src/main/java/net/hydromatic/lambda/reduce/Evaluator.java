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
 * Evaluates a term to normal form.
 *
 * <p>Alternates between {@link Reducer} and {@link Folder}: performs
 * beta-reductions until none remains, then a folding pass; if the pass
 * changed the term, starts reducing again. The result is reached when neither
 * changes the term.
 *
 * <p>Evaluation of a term that has no normal form does not terminate, unless
 * there is a step limit.
 */
public class Evaluator {
  public final Strategy strategy;
  /** Maximum number of beta-reductions, or -1 if unbounded. */
  public final int stepLimit;

  private final Tracer tracer;
  private final Reducer reducer;
  private final Folder folder;

  /** Creates an Evaluator. */
  private Evaluator(Strategy strategy, int stepLimit, Tracer tracer) {
    this.strategy = requireNonNull(strategy, "strategy");
    this.stepLimit = stepLimit;
    this.tracer = requireNonNull(tracer, "tracer");
    this.reducer = new Reducer(strategy);
    this.folder = new Folder(strategy);
  }

  /** Creates an Evaluator with no step limit that does not trace. */
  public static Evaluator of(Strategy strategy) {
    return new Evaluator(strategy, -1, Tracers.empty());
  }

  /** Returns a copy of this Evaluator with a given step limit. */
  public Evaluator withStepLimit(int stepLimit) {
    return stepLimit == this.stepLimit
        ? this
        : new Evaluator(strategy, stepLimit, tracer);
  }

  /** Returns a copy of this Evaluator with a given tracer. */
  public Evaluator withTracer(Tracer tracer) {
    return tracer == this.tracer
        ? this
        : new Evaluator(strategy, stepLimit, tracer);
  }

  /**
   * Evaluates a term.
   *
   * @throws NonTerminationException if there is a step limit and the term
   *     has not reached normal form after that many steps
   */
  public Term evaluate(Term term) {
    int stepCount = 0;
    for (; ; ) {
      final Reducer.Step step = reducer.step(term);
      if (step.reduced) {
        if (stepLimit >= 0 && stepCount >= stepLimit) {
          throw new NonTerminationException(stepLimit, term);
        }
        ++stepCount;
        tracer.onStep(stepCount, term, step.term);
        term = step.term;
        continue;
      }
      final Term folded = folder.fold(term);
      if (folded.equals(term)) {
        tracer.onResult(term);
        return term;
      }
      tracer.onFold(term, folded);
      term = folded;
    }
  }
}

// End Evaluator.java
