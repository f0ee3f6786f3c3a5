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

import net.hydromatic.lambda.ast.Linearizer;
import net.hydromatic.lambda.ast.Term;
import net.hydromatic.lambda.parse.LambdaParser;
import net.hydromatic.lambda.reduce.Strategy;

/**
 * Language dialect: grammar, default reduction strategy, and output notation.
 */
public enum Dialect {
  /**
   * Pure lambda calculus. No numbers or arithmetic; evaluated in normal order;
   * printed in {@link Linearizer.Notation#CLASSIC classic} notation.
   */
  LAMBDA(false, Strategy.EAGER, Linearizer.Notation.CLASSIC),

  /**
   * Lambda calculus with arithmetic. Evaluated call-by-name without reducing
   * under binders; printed in {@link Linearizer.Notation#EXTENDED extended}
   * notation.
   */
  ARITHMETIC(true, Strategy.LAZY_NO_BINDER, Linearizer.Notation.EXTENDED);

  /** Whether the grammar allows numbers and arithmetic operators. */
  public final boolean arithmetic;
  public final Strategy defaultStrategy;
  public final Linearizer.Notation notation;

  Dialect(
      boolean arithmetic,
      Strategy defaultStrategy,
      Linearizer.Notation notation) {
    this.arithmetic = arithmetic;
    this.defaultStrategy = defaultStrategy;
    this.notation = notation;
  }

  /** Parses an expression in this dialect. */
  public Term parse(String source) {
    return LambdaParser.parse(source, arithmetic);
  }

  /** Returns the linearizer for this dialect's notation. */
  public Linearizer linearizer() {
    return Linearizer.of(notation);
  }
}

// End Dialect.java
