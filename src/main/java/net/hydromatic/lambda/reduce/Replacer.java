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
import static net.hydromatic.lambda.ast.TermBuilder.term;

import com.google.common.collect.ImmutableSet;
import java.util.Set;
import net.hydromatic.lambda.ast.Shuttle;
import net.hydromatic.lambda.ast.Term;

/**
 * Capture-avoiding substitution.
 *
 * <p>The replacement is substituted as is; it is never evaluated.
 */
public class Replacer extends Shuttle {
  private final String name;
  private final Term replacement;
  private final Set<String> replacementFreeVars;

  private Replacer(String name, Term replacement) {
    this.name = requireNonNull(name, "name");
    this.replacement = requireNonNull(replacement, "replacement");
    this.replacementFreeVars = FreeFinder.freeVars(replacement);
  }

  /**
   * Returns {@code term[name := replacement]}, the term with every free
   * occurrence of {@code name} replaced by {@code replacement}.
   *
   * <p>If a binder inside {@code term} would capture a free variable of
   * {@code replacement}, the binder is first renamed to a fresh name.
   */
  public static Term substitute(Term term, String name, Term replacement) {
    return term.accept(new Replacer(name, replacement));
  }

  @Override
  protected Term visit(Term.Var var) {
    return var.name.equals(name) ? replacement : var;
  }

  @Override
  protected Term visit(Term.Abs abs) {
    if (abs.param.equals(name)) {
      // "name" is shadowed; nothing below is free
      return abs;
    }
    if (replacementFreeVars.contains(abs.param)) {
      final Set<String> usedNames =
          ImmutableSet.<String>builder()
              .addAll(replacementFreeVars)
              .addAll(FreeFinder.freeVars(abs.body))
              .add(name)
              .build();
      final String param = NameGenerator.fresh(usedNames);
      final Term body = substitute(abs.body, abs.param, term.var(param));
      return term.abs(param, body.accept(this));
    }
    return abs.copy(abs.param, abs.body.accept(this));
  }
}

// End Replacer.java
