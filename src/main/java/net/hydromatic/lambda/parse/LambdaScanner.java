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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.lambda.ast.Pos;

/**
 * Converts source text into tokens.
 *
 * <p>Identifiers match {@code [A-Za-z][A-Za-z0-9]*}, numbers match {@code
 * [0-9]+(\.[0-9]+)?}, and a lambda is either {@code \} or {@code λ}.
 * Whitespace separates tokens and is otherwise ignored.
 */
public class LambdaScanner {
  private final String source;
  private final String file;
  private final ImmutableList.Builder<Token> tokens = ImmutableList.builder();
  /** Offset of the first character of the token being scanned. */
  private int start = 0;
  /** Offset of the next character to consider. */
  private int current = 0;

  public LambdaScanner(String source, String file) {
    this.source = requireNonNull(source, "source");
    this.file = requireNonNull(file, "file");
  }

  /** Scans the whole source; the last token is {@link Token.Type#EOF}. */
  public List<Token> scanTokens() {
    while (!isAtEnd()) {
      start = current;
      scanToken();
    }
    tokens.add(new Token(Token.Type.EOF, "", current, current));
    return tokens.build();
  }

  private void scanToken() {
    final char c = advance();
    switch (c) {
      case '(':
        addToken(Token.Type.LEFT_PAREN);
        break;
      case ')':
        addToken(Token.Type.RIGHT_PAREN);
        break;
      case '.':
        addToken(Token.Type.DOT);
        break;
      case '+':
        addToken(Token.Type.PLUS);
        break;
      case '-':
        addToken(Token.Type.MINUS);
        break;
      case '*':
        addToken(Token.Type.STAR);
        break;
      case '/':
        addToken(Token.Type.SLASH);
        break;
      case '\\':
      case '\u03bb': // λ
        addToken(Token.Type.LAMBDA);
        break;
      case ' ':
      case '\r':
      case '\t':
      case '\n':
        break;
      default:
        if (isDigit(c)) {
          number();
        } else if (isAlpha(c)) {
          identifier();
        } else {
          throw new LambdaParseException(
              "Unexpected character '" + c + "'",
              Pos.of(source, file, start, current));
        }
    }
  }

  private void number() {
    while (isDigit(peek())) {
      advance();
    }
    // A fractional part needs at least one digit after the dot.
    if (peek() == '.' && isDigit(peekNext())) {
      advance();
      while (isDigit(peek())) {
        advance();
      }
    }
    addToken(Token.Type.NUMBER);
  }

  private void identifier() {
    while (isAlpha(peek()) || isDigit(peek())) {
      advance();
    }
    addToken(Token.Type.NAME);
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isAlpha(char c) {
    return c >= 'a' && c <= 'z' || c >= 'A' && c <= 'Z';
  }

  private boolean isAtEnd() {
    return current >= source.length();
  }

  private char advance() {
    return source.charAt(current++);
  }

  private char peek() {
    return isAtEnd() ? '\0' : source.charAt(current);
  }

  private char peekNext() {
    return current + 1 >= source.length() ? '\0' : source.charAt(current + 1);
  }

  private void addToken(Token.Type type) {
    tokens.add(
        new Token(type, source.substring(start, current), start, current));
  }
}

// End LambdaScanner.java
