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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Objects;

/**
 * Lambda term, optionally extended with arithmetic.
 *
 * <p>Terms are immutable. Each transformation builds a new tree; a method
 * that would not change a node returns the node itself. Create terms via
 * {@link TermBuilder#term}.
 *
 * <p>The set of sub-classes is closed: {@link Var}, {@link Abs}, {@link App},
 * {@link Num}, {@link BinOp} and {@link Neg}. The {@link #op} field identifies
 * which.
 */
public abstract class Term {
  public final Op op;

  Term(Op op) {
    this.op = requireNonNull(op);
  }

  /**
   * Converts this term to a string in {@link Linearizer.Notation#EXTENDED
   * extended} notation.
   *
   * <p>The purpose of this string is debugging. To print a result, use a
   * {@link Linearizer} for the notation of the current dialect.
   */
  @Override
  public final String toString() {
    return Linearizer.EXTENDED.linearize(this);
  }

  /** Returns whether this term is a redex, {@code (\x.body) arg}. */
  public boolean isRedex() {
    return false;
  }

  /**
   * Accepts a shuttle, calling the {@link Shuttle#visit} method appropriate to
   * the type of this term, and returning the result.
   */
  public abstract Term accept(Shuttle shuttle);

  /**
   * Accepts a visitor, calling the {@link Visitor#visit} method appropriate to
   * the type of this term.
   */
  public abstract void accept(Visitor visitor);

  /** Variable. */
  public static final class Var extends Term {
    public final String name;

    Var(String name) {
      super(Op.VAR);
      this.name = requireNonNull(name, "name");
      checkArgument(!name.isEmpty(), "empty name");
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Var && ((Var) o).name.equals(name);
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Abstraction, {@code \param.body}. */
  public static final class Abs extends Term {
    public final String param;
    public final Term body;

    Abs(String param, Term body) {
      super(Op.ABS);
      this.param = requireNonNull(param, "param");
      this.body = requireNonNull(body, "body");
      checkArgument(!param.isEmpty(), "empty param");
    }

    @Override
    public int hashCode() {
      return Objects.hash(param, body);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Abs
              && ((Abs) o).param.equals(param)
              && ((Abs) o).body.equals(body);
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /**
     * Creates a copy of this abstraction with given parameter and body, or
     * returns this abstraction if they are the same.
     */
    public Abs copy(String param, Term body) {
      return param.equals(this.param) && body == this.body
          ? this
          : new Abs(param, body);
    }
  }

  /** Application, {@code fn arg}. */
  public static final class App extends Term {
    public final Term fn;
    public final Term arg;

    App(Term fn, Term arg) {
      super(Op.APP);
      this.fn = requireNonNull(fn, "fn");
      this.arg = requireNonNull(arg, "arg");
    }

    @Override
    public int hashCode() {
      return Objects.hash(fn, arg);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof App
              && ((App) o).fn.equals(fn)
              && ((App) o).arg.equals(arg);
    }

    @Override
    public boolean isRedex() {
      return fn.op == Op.ABS;
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public App copy(Term fn, Term arg) {
      return fn == this.fn && arg == this.arg ? this : new App(fn, arg);
    }
  }

  /**
   * Numeric literal.
   *
   * <p>Two literals are equal if their values have the same bits, so {@code
   * NaN} equals itself and {@code -0.0} does not equal {@code 0.0}.
   */
  public static final class Num extends Term {
    public final double value;

    Num(double value) {
      super(Op.NUM);
      this.value = value;
    }

    @Override
    public int hashCode() {
      return Double.hashCode(value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Num && Double.compare(((Num) o).value, value) == 0;
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Binary arithmetic: {@link Op#PLUS}, {@link Op#MINUS}, {@link Op#TIMES} or
   * {@link Op#DIVIDE}.
   */
  public static final class BinOp extends Term {
    public final Term left;
    public final Term right;

    BinOp(Op op, Term left, Term right) {
      super(op);
      this.left = requireNonNull(left, "left");
      this.right = requireNonNull(right, "right");
      checkArgument(Op.BINARY.contains(op), "not a binary operator: %s", op);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, left, right);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof BinOp
              && ((BinOp) o).op == op
              && ((BinOp) o).left.equals(left)
              && ((BinOp) o).right.equals(right);
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public BinOp copy(Term left, Term right) {
      return left == this.left && right == this.right
          ? this
          : new BinOp(op, left, right);
    }
  }

  /** Unary negation, {@code -operand}. */
  public static final class Neg extends Term {
    public final Term operand;

    Neg(Term operand) {
      super(Op.NEGATE);
      this.operand = requireNonNull(operand, "operand");
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, operand);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Neg && ((Neg) o).operand.equals(operand);
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public Neg copy(Term operand) {
      return operand == this.operand ? this : new Neg(operand);
    }
  }
}

// End Term.java
