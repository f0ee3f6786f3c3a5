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

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;
import net.hydromatic.lambda.ast.Term;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action on the term after each
   * beta-reduction, then calls the underlying tracer.
   */
  public static Tracer withOnStep(Tracer tracer, Consumer<Term> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onStep(int step, Term before, Term after) {
        consumer.accept(after);
        super.onStep(step, before, after);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each folding pass,
   * then calls the underlying tracer.
   */
  public static Tracer withOnFold(
      Tracer tracer, BiConsumer<Term, Term> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onFold(Term before, Term after) {
        consumer.accept(before, after);
        super.onFold(before, after);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on the normal form, then
   * calls the underlying tracer.
   */
  public static Tracer withOnResult(Tracer tracer, Consumer<Term> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onResult(Term term) {
        consumer.accept(term);
        super.onResult(term);
      }
    };
  }

  /**
   * Returns a tracer that writes a line for each step and folding pass, then
   * calls the underlying tracer.
   */
  public static Tracer printing(
      Tracer tracer,
      Function<Term, String> printer,
      Consumer<String> outLines) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onStep(int step, Term before, Term after) {
        outLines.accept("[" + step + "] " + printer.apply(after));
        super.onStep(step, before, after);
      }

      @Override
      public void onFold(Term before, Term after) {
        outLines.accept("[fold] " + printer.apply(after));
        super.onFold(before, after);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onStep(int step, Term before, Term after) {}

    @Override
    public void onFold(Term before, Term after) {}

    @Override
    public void onResult(Term term) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onStep(int step, Term before, Term after) {
      tracer.onStep(step, before, after);
    }

    @Override
    public void onFold(Term before, Term after) {
      tracer.onFold(before, after);
    }

    @Override
    public void onResult(Term term) {
      tracer.onResult(term);
    }
  }
}

// End Tracers.java
