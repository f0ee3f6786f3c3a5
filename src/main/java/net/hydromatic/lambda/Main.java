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

import com.google.common.collect.ImmutableList;
import java.io.BufferedWriter;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Writer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.lambda.eval.Prop;
import net.hydromatic.lambda.eval.Session;
import net.hydromatic.lambda.parse.LambdaParseException;
import net.hydromatic.lambda.reduce.NonTerminationException;
import net.hydromatic.lambda.util.LambdaException;

/**
 * Evaluates one expression given on the command line.
 *
 * <p>Usage: {@code Main [--property=value]... expression}. For example,
 * {@code Main --strategy=eager '\x.(\y.y) x'} prints {@code (\x.x)}.
 *
 * <p>On success, prints the normal form to standard output. On failure,
 * prints a diagnostic to standard error and nothing to standard output; the
 * {@link Status} says what failed.
 */
public class Main {
  private final List<String> argList;
  private final PrintWriter out;
  private final PrintWriter err;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final Main main =
        new Main(
            ImmutableList.copyOf(args),
            new OutputStreamWriter(System.out),
            new OutputStreamWriter(System.err));
    final Status status = main.run();
    System.exit(status.exitCode);
  }

  /** Creates a Main. */
  public Main(List<String> argList, Writer out, Writer err) {
    this.argList = ImmutableList.copyOf(argList);
    this.out = buffer(out);
    this.err = buffer(err);
  }

  private static PrintWriter buffer(Writer out) {
    if (out instanceof PrintWriter) {
      return (PrintWriter) out;
    } else {
      if (!(out instanceof BufferedWriter)) {
        out = new BufferedWriter(out);
      }
      return new PrintWriter(out);
    }
  }

  /**
   * Returns whether an argument sets a property.
   *
   * <p>A property argument looks like "--name=value". An expression may also
   * start with "--" (for example "--5"), but never contains "=".
   */
  static boolean isPropertyArg(String arg) {
    return arg.startsWith("--") && arg.indexOf('=') > 2;
  }

  /** Runs the command, and returns its status. */
  public Status run() {
    try {
      return run_();
    } finally {
      out.flush();
      err.flush();
    }
  }

  private Status run_() {
    final Map<Prop, Object> propMap = new LinkedHashMap<>();
    final List<String> expressions = new ArrayList<>();
    try {
      for (String arg : argList) {
        if (isPropertyArg(arg)) {
          final int i = arg.indexOf('=');
          Prop.lookup(arg.substring(2, i))
              .setLenient(propMap, arg.substring(i + 1));
        } else {
          expressions.add(arg);
        }
      }
    } catch (IllegalArgumentException e) {
      err.println(e.getMessage());
      return Status.USAGE_ERROR;
    }
    if (expressions.size() != 1) {
      usage();
      return Status.USAGE_ERROR;
    }

    final Session session = new Session(propMap);
    final String result;
    try {
      result = session.run(expressions.get(0));
    } catch (LambdaParseException e) {
      err.println(describe(e));
      return Status.PARSE_ERROR;
    } catch (NonTerminationException e) {
      err.println(describe(e));
      return Status.EVALUATION_ERROR;
    } catch (RuntimeException | StackOverflowError e) {
      // A very deep term can exhaust the stack.
      err.println(e);
      return Status.EVALUATION_ERROR;
    }
    out.println(result);
    return Status.SUCCESS;
  }

  private static String describe(LambdaException e) {
    return e.describeTo(new StringBuilder()).toString();
  }

  private void usage() {
    err.println("Usage: java " + Main.class.getName()
        + " [--property=value]... expression");
    err.println("Properties:");
    for (Prop prop : Prop.BY_CAMEL_NAME) {
      err.println("  --" + prop.camelName);
    }
  }

  /** Outcome of a command, and the process exit code it maps to. */
  public enum Status {
    /** The normal form was printed. */
    SUCCESS(0),
    /** Wrong number of arguments, unknown property, or invalid value. */
    USAGE_ERROR(1),
    /** The expression is not valid. */
    PARSE_ERROR(2),
    /** Evaluation failed, for example by reaching the step limit. */
    EVALUATION_ERROR(3);

    public final int exitCode;

    Status(int exitCode) {
      this.exitCode = exitCode;
    }
  }
}

// End Main.java
