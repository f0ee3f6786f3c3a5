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

import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;
import java.util.function.Consumer;
import net.hydromatic.lambda.ast.Term;
import net.hydromatic.lambda.ast.Visitor;

/** Finds free variables in a term. */
public class FreeFinder extends Visitor {
  /** Names of the enclosing binders, innermost first. */
  private final Deque<String> bound = new ArrayDeque<>();

  private final Consumer<String> consumer;

  private FreeFinder(Consumer<String> consumer) {
    this.consumer = consumer;
  }

  /**
   * Returns the names of the variables that occur free in a term, in order of
   * first occurrence.
   */
  public static Set<String> freeVars(Term term) {
    final ImmutableSet.Builder<String> set = ImmutableSet.builder();
    term.accept(new FreeFinder(set::add));
    return set.build();
  }

  @Override
  protected void visit(Term.Var var) {
    if (!bound.contains(var.name)) {
      consumer.accept(var.name);
    }
  }

  @Override
  protected void visit(Term.Abs abs) {
    bound.push(abs.param);
    try {
      abs.body.accept(this);
    } finally {
      bound.pop();
    }
  }
}

// End FreeFinder.java
