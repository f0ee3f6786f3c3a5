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
package net.hydromatic.lambda.eval;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import net.hydromatic.lambda.reduce.Evaluator;
import net.hydromatic.lambda.reduce.Strategy;
import net.hydromatic.lambda.reduce.Tracers;
import org.junit.jupiter.api.Test;

/** Tests {@link Session} and {@link Dialect}. */
public class SessionTest {
  @Test void testDefaults() {
    final Session session = Session.create();
    assertThat(session.dialect(), is(Dialect.ARITHMETIC));
    assertThat(session.strategy(), is(Strategy.LAZY_NO_BINDER));
    assertThat(session.stepLimit(), is(-1));
    assertThat(session.run("(\\x.x * 2) 21"), is("42.0"));
  }

  @Test void testStrategyFollowsDialect() {
    final Session session = Session.create();
    Prop.DIALECT.set(session.map, Dialect.LAMBDA);
    assertThat(session.strategy(), is(Strategy.EAGER));
    Prop.STRATEGY.set(session.map, Strategy.LAZY_NO_BINDER);
    assertThat(session.strategy(), is(Strategy.LAZY_NO_BINDER));
    Prop.STRATEGY.remove(session.map);
    assertThat(session.strategy(), is(Strategy.EAGER));
  }

  @Test void testEvaluator() {
    final Session session = Session.create();
    Prop.STEP_LIMIT.set(session.map, 50);
    Prop.STRATEGY.set(session.map, Strategy.EAGER);
    final Evaluator evaluator =
        session.evaluator(Tracers.empty());
    assertThat(evaluator.stepLimit, is(50));
    assertThat(evaluator.strategy, is(Strategy.EAGER));
  }

  @Test void testDialectPrinting() {
    final Session session = Session.create();
    assertThat(session.run("\\x.\\y.x"), is("(\\x.\\y.x)"));
    Prop.DIALECT.set(session.map, Dialect.LAMBDA);
    assertThat(session.run("\\x.\\y.x"), is("\\x.\\y.x"));
    assertThat(Dialect.LAMBDA.arithmetic, is(false));
    assertThat(Dialect.ARITHMETIC.linearizer().notation.name(),
        is("EXTENDED"));
  }
}

// End SessionTest.java
