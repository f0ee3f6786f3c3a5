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

import static net.hydromatic.lambda.Matchers.isExtended;
import static net.hydromatic.lambda.ast.TermBuilder.term;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;

import net.hydromatic.lambda.ast.Term;
import org.junit.jupiter.api.Test;

/** Tests {@link Reducer}. */
public class ReducerTest {
  private final Reducer eager = new Reducer(Strategy.EAGER);
  private final Reducer lazy = new Reducer(Strategy.LAZY_NO_BINDER);

  private final Term a = term.var("a");
  private final Term b = term.var("b");
  private final Term id = term.abs("x", term.var("x"));

  @Test void testNormalForms() {
    for (Term t
        : new Term[] {a, term.num(1), id, term.app(a, b),
            term.plus(term.num(1), term.num(2))}) {
      final Reducer.Step step = eager.step(t);
      assertThat(step.reduced, is(false));
      assertThat(step.term, sameInstance(t));
    }
  }

  @Test void testContract() {
    final Term.App redex = term.app(id, a);
    assertThat(Reducer.contract(redex), is(a));
    assertThat(lazy.step(redex).term, is(a));
    assertThat(lazy.step(redex).reduced, is(true));
  }

  /** The outermost redex is contracted before any inner one. */
  @Test void testLeftmostOutermost() {
    final Term t =
        term.app(term.abs("x", term.app(a, term.var("x"))),
            term.app(id, b));
    final Reducer.Step step = eager.step(t);
    assertThat(step.term, isExtended("(a ((\\x.x) b))"));

    final Reducer.Step step2 = eager.step(step.term);
    assertThat(step2.term, isExtended("(a b)"));
    assertThat(eager.step(step2.term).reduced, is(false));
  }

  @Test void testFunctionBeforeArgument() {
    final Term t = term.app(term.app(id, a), term.app(id, b));
    assertThat(eager.step(t).term, isExtended("(a ((\\x.x) b))"));
    assertThat(lazy.step(t).term, isExtended("(a ((\\x.x) b))"));
  }

  @Test void testStrategies() {
    // Under an abstraction
    final Term abs = term.abs("y", term.app(id, term.var("y")));
    assertThat(eager.step(abs).term, isExtended("(\\y.y)"));
    assertThat(lazy.step(abs).reduced, is(false));

    // In the argument of a stuck application
    final Term app = term.app(a, term.app(id, b));
    assertThat(eager.step(app).term, isExtended("(a b)"));
    assertThat(lazy.step(app).reduced, is(false));
  }

  @Test void testArithmeticOperands() {
    final Term t = term.plus(term.app(id, term.num(1)), term.app(id, a));
    final Reducer.Step step = lazy.step(t);
    assertThat(step.term, isExtended("1.0 + ((\\x.x) a)"));
    assertThat(lazy.step(step.term).term, isExtended("1.0 + a"));

    final Term n = term.neg(term.app(id, term.num(2)));
    assertThat(lazy.step(n).term, isExtended("-2.0"));
  }
}

// End ReducerTest.java
