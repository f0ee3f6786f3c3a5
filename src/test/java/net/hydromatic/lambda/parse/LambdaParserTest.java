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
package net.hydromatic.lambda.parse;

import static net.hydromatic.lambda.Matchers.describedAs;
import static net.hydromatic.lambda.ast.TermBuilder.term;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import net.hydromatic.lambda.ast.Term;
import org.hamcrest.Matcher;
import org.junit.jupiter.api.Test;

/** Tests {@link LambdaScanner} and {@link LambdaParser}. */
public class LambdaParserTest {
  private final Term a = term.var("a");
  private final Term b = term.var("b");
  private final Term c = term.var("c");
  private final Term f = term.var("f");
  private final Term x = term.var("x");

  private static Term parse(String source) {
    return LambdaParser.parse(source, true);
  }

  private static void assertError(String source, boolean arithmetic,
      Matcher<Throwable> matcher) {
    final LambdaParseException e =
        assertThrows(LambdaParseException.class,
            () -> LambdaParser.parse(source, arithmetic));
    assertThat(e, matcher);
  }

  @Test void testScan() {
    final List<String> tokens =
        new LambdaScanner("\\x1.(x1 * 2.5)/ -y", "f").scanTokens().stream()
            .map(t -> t.type + ":" + t.text)
            .collect(Collectors.toList());
    assertThat(tokens,
        is(
            ImmutableList.of("LAMBDA:\\", "NAME:x1", "DOT:.", "LEFT_PAREN:(",
                "NAME:x1", "STAR:*", "NUMBER:2.5", "RIGHT_PAREN:)", "SLASH:/",
                "MINUS:-", "NAME:y", "EOF:")));
  }

  @Test void testLambda() {
    assertThat(parse("\\x.x"), is(term.abs("x", x)));
    assertThat(parse("λx.x"), is(term.abs("x", x)));
    assertThat(parse("  \\x . \\y . x  "),
        is(term.abs("x", term.abs("y", x))));
    // The body extends as far right as possible
    assertThat(parse("\\x.f x + 1"),
        is(term.abs("x", term.plus(term.app(f, x), term.num(1)))));
    assertThat(parse("(\\x.x) a"), is(term.app(term.abs("x", x), a)));
    assertThat(parse("f \\x.x"), is(term.app(f, term.abs("x", x))));
  }

  @Test void testApplication() {
    assertThat(parse("f a b"), is(term.apply(f, a, b)));
    assertThat(parse("f (a b)"), is(term.app(f, term.app(a, b))));
    assertThat(parse("((f))"), is(f));
    assertThat(parse("f 2"), is(term.app(f, term.num(2))));
  }

  @Test void testPrecedence() {
    assertThat(parse("a - b - c"), is(term.minus(term.minus(a, b), c)));
    assertThat(parse("a + b * c"), is(term.plus(a, term.times(b, c))));
    assertThat(parse("a / b * c"), is(term.times(term.divide(a, b), c)));
    assertThat(parse("-a * b"), is(term.times(term.neg(a), b)));
    assertThat(parse("--a"), is(term.neg(term.neg(a))));
    assertThat(parse("a--b"), is(term.minus(a, term.neg(b))));
    assertThat(parse("-f a"), is(term.neg(term.app(f, a))));
    // "f -a" is a subtraction, not an application
    assertThat(parse("f -a"), is(term.minus(f, a)));
    assertThat(parse("f a * b"), is(term.times(term.app(f, a), b)));
  }

  @Test void testNumbers() {
    assertThat(parse("0"), is(term.num(0)));
    assertThat(parse("12.75"), is(term.num(12.75)));
    assertThat(parse("007"), is(term.num(7)));
  }

  @Test void testPureLambda() {
    final Term t = LambdaParser.parse("\\f.\\x.f (f x)", false);
    assertThat(t,
        is(term.abs("f", term.abs("x", term.app(f, term.app(f, x))))));

    assertError("f 1", false,
        describedAs("stdIn:1.3 Error: Expected end of input, but found \"1\""));
    assertError("1", false,
        describedAs(
            "stdIn:1.1 Error: Numbers are not allowed in this dialect"));
    assertError("a + b", false,
        describedAs("stdIn:1.3 Error: Expected end of input, but found \"+\""));
  }

  @Test void testErrors() {
    assertError("", true,
        describedAs("stdIn:1.1 Error: Expected expression, but found <EOF>"));
    assertError("(a", true,
        describedAs("stdIn:1.3 Error: Expected ')', but found <EOF>"));
    assertError("a)", true,
        describedAs("stdIn:1.2 Error: Expected end of input, but found \")\""));
    assertError("\\.x", true,
        describedAs(
            "stdIn:1.2 Error: Expected parameter name, but found \".\""));
    assertError("\\x x", true,
        describedAs("stdIn:1.4 Error: Expected '.', but found \"x\""));
    assertError("a +", true,
        describedAs("stdIn:1.4 Error: Expected expression, but found <EOF>"));
    assertError("5.", true,
        describedAs("stdIn:1.2 Error: Expected end of input, but found \".\""));
    assertError("a\n  # b", true,
        describedAs("stdIn:2.3 Error: Unexpected character '#'"));
    assertError("café", true,
        describedAs("stdIn:1.4 Error: Unexpected character 'é'"));
  }

  @Test void testFile() {
    final LambdaParseException e =
        assertThrows(LambdaParseException.class,
            () -> new LambdaParser("a b)", "script.lam", true).parse());
    assertThat(e.pos().toString(), is("script.lam:1.4"));
  }
}

// End LambdaParserTest.java
