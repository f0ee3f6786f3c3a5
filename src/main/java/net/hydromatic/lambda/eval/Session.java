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
package net.hydromatic.lambda.eval;

import static java.util.Objects.requireNonNull;

import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.lambda.ast.Term;
import net.hydromatic.lambda.reduce.Evaluator;
import net.hydromatic.lambda.reduce.Strategy;
import net.hydromatic.lambda.reduce.Tracer;
import net.hydromatic.lambda.reduce.Tracers;

/**
 * Session environment.
 *
 * <p>Holds the property values that control how expressions are parsed,
 * evaluated and printed.
 */
public class Session {
  /** Property values. */
  public final Map<Prop, Object> map;

  /**
   * Creates a Session.
   *
   * <p>The {@code map} parameter, that becomes the property map, is used as
   * is, not copied. It may be immutable if the session is for a narrow,
   * internal use. Otherwise, it should probably be a {@link LinkedHashMap} to
   * provide deterministic iteration order.
   *
   * @param map Map that contains property values
   */
  public Session(Map<Prop, Object> map) {
    this.map = requireNonNull(map, "map");
  }

  /** Creates a Session with default property values. */
  public static Session create() {
    return new Session(new LinkedHashMap<>());
  }

  /** Returns the current dialect. */
  public Dialect dialect() {
    return Prop.DIALECT.enumValue(map, Dialect.class);
  }

  /**
   * Returns the reduction strategy: the value of {@link Prop#STRATEGY} if set,
   * otherwise the dialect's default.
   */
  public Strategy strategy() {
    final Strategy strategy = Prop.STRATEGY.enumValue(map, Strategy.class);
    return strategy != null ? strategy : dialect().defaultStrategy;
  }

  /** Returns the step limit, or -1 if evaluation is unbounded. */
  public int stepLimit() {
    final Integer stepLimit = Prop.STEP_LIMIT.intValue(map);
    return stepLimit != null ? stepLimit : -1;
  }

  /** Creates an evaluator for the current properties. */
  public Evaluator evaluator(Tracer tracer) {
    return Evaluator.of(strategy())
        .withStepLimit(stepLimit())
        .withTracer(tracer);
  }

  /** Parses an expression in the current dialect. */
  public Term parse(String expression) {
    return dialect().parse(expression);
  }

  /** Evaluates a term, and converts its normal form to a string. */
  public String evaluate(Term term, Tracer tracer) {
    final Term result = evaluator(tracer).evaluate(term);
    return dialect().linearizer().linearize(result);
  }

  /**
   * Parses and evaluates an expression, and returns its normal form as a
   * string.
   *
   * @throws net.hydromatic.lambda.parse.LambdaParseException if the
   *     expression is not valid
   * @throws net.hydromatic.lambda.reduce.NonTerminationException if the step
   *     limit is reached
   */
  public String run(String expression) {
    return run(expression, Tracers.empty());
  }

  /** As {@link #run(String)}, reporting evaluation events to a tracer. */
  public String run(String expression, Tracer tracer) {
    return evaluate(parse(expression), tracer);
  }
}

// End Session.java
