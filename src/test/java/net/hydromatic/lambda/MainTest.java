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
package net.hydromatic.lambda;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.io.StringWriter;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests {@link Main}, the command-line evaluator. */
public class MainTest {
  /** Runs {@link Main} and captures what it writes. */
  private static class Run {
    final Main.Status status;
    final String out;
    final String err;

    Run(String... args) {
      final StringWriter out = new StringWriter();
      final StringWriter err = new StringWriter();
      final List<String> argList = ImmutableList.copyOf(args);
      this.status = new Main(argList, out, err).run();
      this.out = out.toString().trim();
      this.err = err.toString().trim();
    }
  }

  @Test void testSuccess() {
    final Run run = new Run("(\\x.x) (1--2)");
    assertThat(run.status, is(Main.Status.SUCCESS));
    assertThat(run.status.exitCode, is(0));
    assertThat(run.out, is("3.0"));
    assertThat(run.err, is(""));

    assertThat(new Run("(\\x.x) (\\y.y)").out, is("(\\y.y)"));
    assertThat(new Run("-0").out, is("0.0"));
  }

  /** An argument that starts with "--" but has no "=" is an expression. */
  @Test void testNegatedNegation() {
    final Run run = new Run("--5");
    assertThat(run.status, is(Main.Status.SUCCESS));
    assertThat(run.out, is("5.0"));

    assertThat(Main.isPropertyArg("--5"), is(false));
    assertThat(Main.isPropertyArg("--x=1"), is(true));
    assertThat(Main.isPropertyArg("--=1"), is(false));
    assertThat(Main.isPropertyArg("-x=1"), is(false));
  }

  @Test void testProperties() {
    assertThat(new Run("--dialect=lambda", "\\x.(\\y.y) x").out,
        is("\\x.x"));
    assertThat(new Run("--strategy=eager", "\\x.(\\y.y)x").out,
        is("(\\x.x)"));
    assertThat(new Run("--strategy=lazy-no-binder", "--dialect=LAMBDA",
            "\\x.(\\y.y) x").out,
        is("\\x.(\\y.y) x"));
  }

  @Test void testUsageError() {
    final Run run = new Run();
    assertThat(run.status, is(Main.Status.USAGE_ERROR));
    assertThat(run.status.exitCode, is(1));
    assertThat(run.err, containsString("Usage:"));
    assertThat(run.err, containsString("--stepLimit"));
    assertThat(run.out, is(""));

    final Run run2 = new Run("a", "b");
    assertThat(run2.status, is(Main.Status.USAGE_ERROR));

    final Run run3 = new Run("--foo=bar", "x");
    assertThat(run3.status, is(Main.Status.USAGE_ERROR));
    assertThat(run3.err, is("property foo not found"));

    final Run run4 = new Run("--stepLimit=lots", "x");
    assertThat(run4.status, is(Main.Status.USAGE_ERROR));
    assertThat(run4.err,
        is("value for property stepLimit must be an integer"));

    final Run run5 = new Run("--dialect=scheme", "x");
    assertThat(run5.status, is(Main.Status.USAGE_ERROR));
    assertThat(run5.err,
        is("value for property dialect must be one of: 'lambda', "
            + "'arithmetic'"));
  }

  @Test void testParseError() {
    final Run run = new Run("(\\x");
    assertThat(run.status, is(Main.Status.PARSE_ERROR));
    assertThat(run.status.exitCode, is(2));
    assertThat(run.out, is(""));
    assertThat(run.err,
        is("stdIn:1.4 Error: Expected '.', but found <EOF>"));

    final Run run2 = new Run("x $ y");
    assertThat(run2.status, is(Main.Status.PARSE_ERROR));
    assertThat(run2.err, is("stdIn:1.3 Error: Unexpected character '$'"));
  }

  @Test void testEvaluationError() {
    final Run run = new Run("--stepLimit=5", "(\\x.x x) (\\x.x x)");
    assertThat(run.status, is(Main.Status.EVALUATION_ERROR));
    assertThat(run.status.exitCode, is(3));
    assertThat(run.out, is(""));
    assertThat(run.err, is("Error: did not terminate within 5 steps"));

    final Run run2 = new Run(Strings.repeat("-", 200_000) + "1");
    assertThat(run2.status, is(Main.Status.EVALUATION_ERROR));
    assertThat(run2.err, containsString("StackOverflowError"));
  }
}

// End MainTest.java
