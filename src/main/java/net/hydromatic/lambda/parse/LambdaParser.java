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
package net.hydromatic.lambda.parse;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.lambda.ast.TermBuilder.term;

import java.util.List;
import net.hydromatic.lambda.ast.Op;
import net.hydromatic.lambda.ast.Pos;
import net.hydromatic.lambda.ast.Term;

/**
 * Recursive-descent parser.
 *
 * <p>Grammar, from loosest to tightest binding:
 *
 * <pre>{@code
 * exp            ::= additive
 * additive       ::= multiplicative (("+" | "-") multiplicative)*
 * multiplicative ::= unary (("*" | "/") unary)*
 * unary          ::= "-" unary | application
 * application    ::= atom atom*
 * atom           ::= NAME | NUMBER | "(" exp ")" | LAMBDA NAME "." exp
 * }</pre>
 *
 * <p>The body of an abstraction extends as far right as possible. If the
 * parser does not allow arithmetic, numbers and operators are syntax errors.
 */
public class LambdaParser {
  /** File name used in error positions. */
  public static final String STDIN = "stdIn";

  private final String source;
  private final String file;
  private final boolean arithmetic;
  private final List<Token> tokens;
  /** Index of the next token to be parsed. */
  private int current = 0;

  /** Creates a LambdaParser. */
  public LambdaParser(String source, String file, boolean arithmetic) {
    this.source = requireNonNull(source, "source");
    this.file = requireNonNull(file, "file");
    this.arithmetic = arithmetic;
    this.tokens = new LambdaScanner(source, file).scanTokens();
  }

  /** Parses a string. */
  public static Term parse(String source, boolean arithmetic) {
    return new LambdaParser(source, STDIN, arithmetic).parse();
  }

  /** Parses the whole source as one expression. */
  public Term parse() {
    final Term exp = expression();
    consume(Token.Type.EOF, "end of input");
    return exp;
  }

  private Term expression() {
    return additive();
  }

  private Term additive() {
    Term exp = multiplicative();
    while (arithmetic && match(Token.Type.PLUS, Token.Type.MINUS)) {
      final Op op = previous().type == Token.Type.PLUS ? Op.PLUS : Op.MINUS;
      exp = term.binOp(op, exp, multiplicative());
    }
    return exp;
  }

  private Term multiplicative() {
    Term exp = unary();
    while (arithmetic && match(Token.Type.STAR, Token.Type.SLASH)) {
      final Op op = previous().type == Token.Type.STAR ? Op.TIMES : Op.DIVIDE;
      exp = term.binOp(op, exp, unary());
    }
    return exp;
  }

  private Term unary() {
    if (arithmetic && match(Token.Type.MINUS)) {
      return term.neg(unary());
    }
    return application();
  }

  private Term application() {
    Term exp = atom();
    while (isAtomStart(peek())) {
      exp = term.app(exp, atom());
    }
    return exp;
  }

  private Term atom() {
    if (match(Token.Type.NAME)) {
      return term.var(previous().text);
    }
    if (match(Token.Type.NUMBER)) {
      if (!arithmetic) {
        throw error(previous(), "Numbers are not allowed in this dialect");
      }
      return term.num(Double.parseDouble(previous().text));
    }
    if (match(Token.Type.LEFT_PAREN)) {
      final Term exp = expression();
      consume(Token.Type.RIGHT_PAREN, "')'");
      return exp;
    }
    if (match(Token.Type.LAMBDA)) {
      final Token param = consume(Token.Type.NAME, "parameter name");
      consume(Token.Type.DOT, "'.'");
      return term.abs(param.text, expression());
    }
    throw expected(peek(), "expression");
  }

  private boolean isAtomStart(Token token) {
    switch (token.type) {
      case NAME:
      case LAMBDA:
      case LEFT_PAREN:
        return true;
      case NUMBER:
        return arithmetic;
      default:
        return false;
    }
  }

  private boolean match(Token.Type... types) {
    for (Token.Type type : types) {
      if (peek().type == type) {
        ++current;
        return true;
      }
    }
    return false;
  }

  private Token consume(Token.Type type, String what) {
    if (peek().type == type) {
      return tokens.get(current++);
    }
    throw expected(peek(), what);
  }

  private Token peek() {
    return tokens.get(current);
  }

  private Token previous() {
    return tokens.get(current - 1);
  }

  private LambdaParseException expected(Token token, String what) {
    return error(token, "Expected " + what + ", but found " + token);
  }

  private LambdaParseException error(Token token, String message) {
    final int end = Math.max(token.end, token.start + 1);
    return new LambdaParseException(
        message, Pos.of(source, file, token.start, end));
  }
}

// End LambdaParser.java
