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

/** Reduction strategy; which redexes {@link Reducer} is allowed to reduce. */
public enum Strategy {
  /**
   * Normal order. Reduces the leftmost-outermost redex anywhere in the term,
   * including the argument of an application and the body of an abstraction.
   */
  EAGER(true),

  /**
   * Call-by-name, without reduction under a binder. Reduces only redexes in
   * head position (and inside arithmetic operands), so evaluation yields a
   * head normal form and never normalizes the body of an abstraction or an
   * argument that is not applied.
   */
  LAZY_NO_BINDER(false);

  /**
   * Whether the strategy reduces the body of an abstraction and the argument
   * of an application that is not a redex.
   */
  public final boolean full;

  Strategy(boolean full) {
    this.full = full;
  }
}

// End Strategy.java
