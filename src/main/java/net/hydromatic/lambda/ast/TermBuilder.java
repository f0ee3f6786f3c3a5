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

/** Builds terms. */
public enum TermBuilder {
  /**
   * The singleton instance of the term builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  term;

  /** Creates a variable. */
  public Term.Var var(String name) {
    return new Term.Var(name);
  }

  /** Creates an abstraction, {@code \param.body}. */
  public Term.Abs abs(String param, Term body) {
    return new Term.Abs(param, body);
  }

  /** Creates an application, {@code fn arg}. */
  public Term.App app(Term fn, Term arg) {
    return new Term.App(fn, arg);
  }

  /**
   * Creates a chain of left-associative applications; {@code apply(f, a, b)}
   * is {@code (f a) b}.
   */
  public Term apply(Term fn, Term... args) {
    Term t = fn;
    for (Term arg : args) {
      t = app(t, arg);
    }
    return t;
  }

  /** Creates a numeric literal. */
  public Term.Num num(double value) {
    return new Term.Num(value);
  }

  /** Creates a binary arithmetic term. */
  public Term.BinOp binOp(Op op, Term left, Term right) {
    return new Term.BinOp(op, left, right);
  }

  public Term.BinOp plus(Term left, Term right) {
    return binOp(Op.PLUS, left, right);
  }

  public Term.BinOp minus(Term left, Term right) {
    return binOp(Op.MINUS, left, right);
  }

  public Term.BinOp times(Term left, Term right) {
    return binOp(Op.TIMES, left, right);
  }

  public Term.BinOp divide(Term left, Term right) {
    return binOp(Op.DIVIDE, left, right);
  }

  /** Creates a negation, {@code -operand}. */
  public Term.Neg neg(Term operand) {
    return new Term.Neg(operand);
  }
}

// End TermBuilder.java
