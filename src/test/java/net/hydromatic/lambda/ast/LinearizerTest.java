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
package net.hydromatic.lambda.ast;

import static net.hydromatic.lambda.Matchers.isClassic;
import static net.hydromatic.lambda.Matchers.isExtended;
import static net.hydromatic.lambda.ast.TermBuilder.term;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import org.junit.jupiter.api.Test;

/** Tests {@link Linearizer}. */
public class LinearizerTest {
  private final Term a = term.var("a");
  private final Term b = term.var("b");
  private final Term c = term.var("c");
  private final Term f = term.var("f");
  private final Term x = term.var("x");

  @Test void testAtoms() {
    assertThat(a, isClassic("a"));
    assertThat(a, isExtended("a"));
    assertThat(term.num(3), isExtended("3.0"));
    assertThat(term.num(-2.5), isExtended("-2.5"));
  }

  @Test void testAbstraction() {
    final Term id = term.abs("x", x);
    assertThat(id, isClassic("\\x.x"));
    assertThat(id, isExtended("(\\x.x)"));

    final Term fx = term.abs("x", term.app(f, x));
    assertThat(fx, isClassic("\\x.f x"));
    assertThat(fx, isExtended("(\\x.(f x))"));

    final Term k = term.abs("x", term.abs("y", x));
    assertThat(k, isClassic("\\x.\\y.x"));
    assertThat(k, isExtended("(\\x.\\y.x)"));

    assertThat(term.abs("x", term.plus(x, term.num(1))),
        isExtended("(\\x.x + 1.0)"));
  }

  @Test void testApplication() {
    assertThat(term.apply(f, a, b), isClassic("f a b"));
    assertThat(term.apply(f, a, b), isExtended("(f a b)"));
    assertThat(term.app(f, term.app(a, b)), isClassic("f (a b)"));
    assertThat(term.app(term.abs("x", x), a), isClassic("(\\x.x) a"));
    assertThat(term.app(term.abs("x", x), a), isExtended("((\\x.x) a)"));
    assertThat(term.app(f, term.abs("x", x)), isClassic("f (\\x.x)"));
    assertThat(term.app(f, term.plus(a, b)), isExtended("(f (a + b))"));
    assertThat(term.app(f, term.num(2)), isExtended("(f 2.0)"));
    assertThat(term.app(f, term.neg(a)), isExtended("(f (-a))"));
  }

  @Test void testSums() {
    assertThat(term.plus(a, b), isExtended("a + b"));
    assertThat(term.minus(term.minus(a, b), c), isExtended("(a - b) - c"));
    assertThat(term.minus(a, term.minus(b, c)), isExtended("a - (b - c)"));
    assertThat(term.plus(a, term.neg(b)), isExtended("a + (-b)"));
    assertThat(term.plus(term.times(a, b), c), isExtended("(a * b) + c"));
    assertThat(term.plus(term.app(f, a), b), isExtended("(f a) + b"));
  }

  @Test void testProducts() {
    assertThat(term.times(term.times(a, b), c), isExtended("a * b * c"));
    assertThat(term.times(a, term.times(b, c)), isExtended("a * b * c"));
    assertThat(term.divide(term.times(a, b), c), isExtended("a * b / c"));
    assertThat(term.times(term.divide(a, b), c), isExtended("(a / b) * c"));
    assertThat(term.divide(a, term.divide(b, c)), isExtended("a / (b / c)"));
    // A divisor that is a product keeps its parentheses
    assertThat(term.divide(a, term.times(b, c)), isExtended("a / (b * c)"));
    assertThat(term.divide(term.times(a, b), term.times(b, c)),
        isExtended("a * b / (b * c)"));
    assertThat(term.times(term.plus(a, b), c), isExtended("(a + b) * c"));
    assertThat(term.times(term.neg(a), c), isExtended("(-a) * c"));
  }

  @Test void testNegation() {
    assertThat(term.neg(x), isExtended("-x"));
    assertThat(term.neg(term.num(5)), isExtended("-5.0"));
    assertThat(term.neg(term.neg(term.num(5))), isExtended("-(-5.0)"));
    assertThat(term.neg(term.app(f, x)), isExtended("-(f x)"));
    assertThat(term.neg(term.plus(a, b)), isExtended("-(a + b)"));
  }

  @Test void testNumber() {
    assertThat(Linearizer.number(0), is("0.0"));
    assertThat(Linearizer.number(-0.0), is("0.0"));
    assertThat(Linearizer.number(7), is("7.0"));
    assertThat(Linearizer.number(-9), is("-9.0"));
    assertThat(Linearizer.number(2.5), is("2.5"));
    assertThat(Linearizer.number(0.1), is("0.1"));
    assertThat(Linearizer.number(1e-5), is("0.00001"));
    assertThat(Linearizer.number(1e20), is("100000000000000000000.0"));
    assertThat(Linearizer.number(Double.POSITIVE_INFINITY), is("inf"));
    assertThat(Linearizer.number(Double.NEGATIVE_INFINITY), is("-inf"));
    assertThat(Linearizer.number(Double.NaN), is("nan"));
  }

  @Test void testToString() {
    final Term t = term.app(term.abs("x", x), term.num(1));
    assertThat(t.toString(), is("((\\x.x) 1.0)"));
  }
}

// End LinearizerTest.java
