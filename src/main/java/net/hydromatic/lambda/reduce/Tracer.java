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

import net.hydromatic.lambda.ast.Term;

/** Called on various events during evaluation. */
public interface Tracer {
  /**
   * Called after a beta-reduction.
   *
   * @param step Number of the step, starting at 1
   * @param before Term before the step
   * @param after Term after the step
   */
  void onStep(int step, Term before, Term after);

  /** Called after a folding pass that changed the term. */
  void onFold(Term before, Term after);

  /** Called with the normal form. */
  void onResult(Term term);
}

// End Tracer.java
