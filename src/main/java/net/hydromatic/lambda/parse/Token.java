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

/** Token produced by {@link LambdaScanner}. */
public class Token {
  public final Type type;
  public final String text;
  /** Offset of the first character in the source text. */
  public final int start;
  /** Offset just after the last character in the source text. */
  public final int end;

  Token(Type type, String text, int start, int end) {
    this.type = requireNonNull(type, "type");
    this.text = requireNonNull(text, "text");
    this.start = start;
    this.end = end;
  }

  @Override
  public String toString() {
    return type == Type.EOF ? "<EOF>" : "\"" + text + "\"";
  }

  /** Token type. */
  public enum Type {
    NAME,
    NUMBER,
    LAMBDA,
    DOT,
    LEFT_PAREN,
    RIGHT_PAREN,
    PLUS,
    MINUS,
    STAR,
    SLASH,
    EOF
  }
}

// End Token.java
