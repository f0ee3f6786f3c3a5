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

import com.google.common.collect.ImmutableSet;
import java.util.Set;

/** Sub-types of {@link Term}. */
public enum Op {
  // atoms
  VAR(true),
  NUM(true),

  ABS("."),
  APP(" "),

  // arithmetic
  PLUS(" + "),
  MINUS(" - "),
  TIMES(" * "),
  DIVIDE(" / "),
  NEGATE("-");

  /** Padded name, e.g. " + ". */
  public final String padded;
  /** Whether a node of this type never needs parentheses. */
  public final boolean atom;

  /** Operators of {@link Term.BinOp}. */
  public static final Set<Op> BINARY =
      ImmutableSet.of(PLUS, MINUS, TIMES, DIVIDE);

  Op(boolean atom) {
    this("", atom);
  }

  Op(String padded) {
    this(padded, false);
  }

  Op(String padded, boolean atom) {
    this.padded = padded;
    this.atom = atom;
  }
}

// End Op.java
