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
package net.hydromatic.lambda.reduce;

import static java.util.Objects.requireNonNull;

import net.hydromatic.lambda.ast.Pos;
import net.hydromatic.lambda.ast.Term;
import net.hydromatic.lambda.util.LambdaException;

/**
 * Thrown by {@link Evaluator} when a term has not reached normal form within
 * the step limit.
 */
public class NonTerminationException extends RuntimeException
    implements LambdaException {
  public final int stepLimit;
  /** The term after the last step that was performed. */
  public final Term term;

  public NonTerminationException(int stepLimit, Term term) {
    super("did not terminate within " + stepLimit + " steps");
    this.stepLimit = stepLimit;
    this.term = requireNonNull(term, "term");
  }

  @Override
  public Pos pos() {
    return Pos.ZERO;
  }
}

// End NonTerminationException.java
