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

import static java.util.Objects.requireNonNull;

import java.math.BigDecimal;

/**
 * Converts a term to source text.
 *
 * <p>The parenthesization is not minimal. For example, the left operand of
 * {@code -} is wrapped even though subtraction is left-associative. Output
 * must stay byte-compatible with existing results, so do not "improve" it.
 */
public class Linearizer {
  /** Linearizer in {@link Notation#CLASSIC} notation. */
  public static final Linearizer CLASSIC = new Linearizer(Notation.CLASSIC);

  /** Linearizer in {@link Notation#EXTENDED} notation. */
  public static final Linearizer EXTENDED = new Linearizer(Notation.EXTENDED);

  public final Notation notation;

  private Linearizer(Notation notation) {
    this.notation = requireNonNull(notation);
  }

  /** Returns the linearizer for a given notation. */
  public static Linearizer of(Notation notation) {
    return notation == Notation.CLASSIC ? CLASSIC : EXTENDED;
  }

  /** Converts a term to a string. */
  public String linearize(Term term) {
    final StringBuilder buf = new StringBuilder();
    if (notation == Notation.EXTENDED
        && (term.op == Op.ABS || term.op == Op.APP)) {
      buf.append('(');
      unparse(buf, term);
      return buf.append(')').toString();
    }
    return unparse(buf, term).toString();
  }

  private StringBuilder unparse(StringBuilder buf, Term term) {
    switch (term.op) {
      case VAR:
        return buf.append(((Term.Var) term).name);

      case NUM:
        return buf.append(number(((Term.Num) term).value));

      case ABS:
        final Term.Abs abs = (Term.Abs) term;
        buf.append('\\').append(abs.param).append(term.op.padded);
        return child(
            buf,
            abs.body,
            notation == Notation.EXTENDED && abs.body.op == Op.APP);

      case APP:
        final Term.App app = (Term.App) term;
        child(buf, app.fn, app.fn.op == Op.ABS);
        buf.append(term.op.padded);
        return child(buf, app.arg, !app.arg.op.atom);

      case PLUS:
      case MINUS:
        final Term.BinOp sum = (Term.BinOp) term;
        child(buf, sum.left, !sum.left.op.atom);
        buf.append(term.op.padded);
        return child(buf, sum.right, !sum.right.op.atom);

      case TIMES:
      case DIVIDE:
        // A product is not wrapped, except as a divisor.
        final Term.BinOp product = (Term.BinOp) term;
        child(buf, product.left, wrapFactor(product.left));
        buf.append(term.op.padded);
        return child(
            buf,
            product.right,
            term.op == Op.DIVIDE
                ? !product.right.op.atom
                : wrapFactor(product.right));

      case NEGATE:
        final Term.Neg neg = (Term.Neg) term;
        buf.append(term.op.padded);
        return child(buf, neg.operand, !neg.operand.op.atom);

      default:
        throw new AssertionError("unknown op " + term.op);
    }
  }

  private static boolean wrapFactor(Term term) {
    return !term.op.atom && term.op != Op.TIMES;
  }

  private StringBuilder child(StringBuilder buf, Term term, boolean wrap) {
    if (wrap) {
      buf.append('(');
      unparse(buf, term);
      return buf.append(')');
    }
    return unparse(buf, term);
  }

  /**
   * Converts a number to a string.
   *
   * <p>An integral value prints all of its digits followed by ".0", never in
   * scientific notation; negative zero prints "0.0". Other finite values print
   * their shortest decimal form. Infinities print "inf" and "-inf", and NaN
   * prints "nan".
   */
  public static String number(double value) {
    if (Double.isNaN(value)) {
      return "nan";
    }
    if (Double.isInfinite(value)) {
      return value > 0 ? "inf" : "-inf";
    }
    if (value == Math.rint(value)) {
      return new BigDecimal(value).toPlainString() + ".0";
    }
    return new BigDecimal(Double.toString(value))
        .stripTrailingZeros()
        .toPlainString();
  }

  /** Parenthesization conventions. */
  public enum Notation {
    /**
     * Convention of the pure lambda calculus. The body of an abstraction is
     * never wrapped, nor is the whole term.
     */
    CLASSIC,

    /**
     * Convention of the lazy, arithmetic calculus. The body of an abstraction
     * is wrapped if it is an application, and so is the whole term if it is an
     * abstraction or application.
     */
    EXTENDED
  }
}

// End Linearizer.java
