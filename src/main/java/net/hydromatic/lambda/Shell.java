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

import static java.util.Objects.requireNonNull;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import net.hydromatic.lambda.eval.Prop;
import net.hydromatic.lambda.eval.Session;
import net.hydromatic.lambda.reduce.Tracer;
import net.hydromatic.lambda.reduce.Tracers;
import net.hydromatic.lambda.util.LambdaException;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;

/**
 * Command shell for lambda expressions, powered by JLine3.
 *
 * <p>Each line is an expression, whose normal form is printed, or a command:
 *
 * <ul>
 *   <li>{@code :set name value} sets a property (see {@link Prop});
 *   <li>{@code :help} prints the list of commands;
 *   <li>{@code :quit} ends the session, as does end of input.
 * </ul>
 */
public class Shell {
  private static final Splitter SPLITTER =
      Splitter.on(' ').trimResults().omitEmptyStrings();

  private final Config config;
  private final InputStream in;
  private final OutputStream out;
  private final Session session;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    try {
      final Shell shell =
          create(ImmutableList.copyOf(args), System.in, System.out);
      shell.run();
    } catch (Throwable e) {
      e.printStackTrace();
      System.exit(1);
    }
  }

  /**
   * Creates a Shell.
   *
   * @throws IllegalArgumentException if an argument is not valid
   */
  public static Shell create(
      List<String> args, InputStream in, OutputStream out) {
    final Map<Prop, Object> propMap = new LinkedHashMap<>();
    final Config config = parse(Config.DEFAULT, args, propMap);
    return create(config, propMap, in, out);
  }

  /** Creates a Shell with a given configuration and property values. */
  static Shell create(
      Config config,
      Map<Prop, Object> propMap,
      InputStream in,
      OutputStream out) {
    return new Shell(config, in, out, new Session(propMap));
  }

  private Shell(
      Config config, InputStream in, OutputStream out, Session session) {
    this.config = requireNonNull(config, "config");
    this.in = requireNonNull(in, "in");
    this.out = requireNonNull(out, "out");
    this.session = requireNonNull(session, "session");
  }

  /**
   * Parses an argument list to an equivalent Config, and puts property
   * settings into a map.
   */
  static Config parse(
      Config config, List<String> argList, Map<Prop, Object> propMap) {
    Config c = config;
    for (String arg : argList) {
      switch (arg) {
        case "--banner=false":
          c = c.withBanner(false);
          break;
        case "--terminal=dumb":
          c = c.withDumb(true);
          break;
        case "--system=false":
          c = c.withSystem(false);
          break;
        case "--raw":
          c = c.withRaw(true);
          break;
        case "--help":
          c = c.withHelp(true);
          break;
        default:
          if (!Main.isPropertyArg(arg)) {
            throw new IllegalArgumentException("unknown argument: " + arg);
          }
          final int i = arg.indexOf('=');
          Prop.lookup(arg.substring(2, i))
              .setLenient(propMap, arg.substring(i + 1));
      }
    }
    return c;
  }

  static void usage(Consumer<String> outLines) {
    String[] usageLines = {
      "Usage: java " + Shell.class.getName() + " [option]...",
      "Options:",
      "    --banner=false   Do not print the banner",
      "    --help           Print this usage",
      "    --raw            Read lines without a terminal",
      "    --system=false   Do not use the system terminal",
      "    --terminal=dumb  Use a dumb terminal",
      "    --name=value     Set property 'name'",
    };
    Arrays.asList(usageLines).forEach(outLines);
  }

  static void help(Consumer<String> outLines) {
    String[] helpLines = {
      "List of available commands:",
      "    :help              Print this help",
      "    :quit              Quit shell",
      "    :set name value    Set property 'name' to 'value'",
      "Any other line is an expression to evaluate.",
      "Properties:",
    };
    Arrays.asList(helpLines).forEach(outLines);
    for (Prop prop : Prop.BY_CAMEL_NAME) {
      outLines.accept("    " + prop.camelName);
    }
  }

  /**
   * Pauses after creating the terminal.
   *
   * <p>Calls the value set by {@link Config#withPauseFn(Runnable)} which, for
   * the default config, does nothing; the instance used in testing pauses for
   * a few milliseconds, which gives JLine's reader time to start.
   */
  private void pause() {
    config.pauseFn.run();
  }

  /** Generates a banner to be shown on startup. */
  private static String banner(@Nullable Terminal terminal) {
    return "lambda shell (java version \""
        + System.getProperty("java.version")
        + "\""
        + (terminal == null
            ? ""
            : ", " + terminal.getName() + ", " + terminal.getType())
        + ")";
  }

  /** Runs the shell until end of input or {@code :quit}. */
  public void run() throws IOException {
    if (config.raw) {
      final PrintWriter writer =
          new PrintWriter(
              new OutputStreamWriter(out, StandardCharsets.UTF_8), true);
      final BufferedReader reader =
          new BufferedReader(
              new InputStreamReader(in, StandardCharsets.UTF_8));
      run(new ReaderLineFn(reader), writer::println);
      writer.flush();
      return;
    }

    final TerminalBuilder builder = TerminalBuilder.builder();
    builder.streams(in, out);
    builder.system(config.system);
    builder.dumb(config.dumb);
    if (config.dumb) {
      builder.type("dumb");
    }
    try (Terminal terminal = builder.build()) {
      final Consumer<String> outLines = terminal.writer()::println;
      if (config.banner && !config.help) {
        outLines.accept(banner(terminal));
      }
      final String prompt =
          new AttributedStringBuilder()
              .style(AttributedStyle.DEFAULT.bold())
              .append("-")
              .style(AttributedStyle.DEFAULT)
              .append(" ")
              .toAnsi(terminal);
      final LineReader lineReader =
          LineReaderBuilder.builder().appName("lambda").terminal(terminal)
              .build();
      pause();
      run(new TerminalLineFn(prompt, lineReader), outLines);
      terminal.writer().flush();
    }
  }

  private void run(LineFn lineFn, Consumer<String> outLines) {
    if (config.help) {
      usage(outLines);
      return;
    }
    for (; ; ) {
      final Line line = lineFn.read();
      switch (line.type) {
        case EOF:
        case QUIT:
          return;
        case HELP:
          help(outLines);
          break;
        case IGNORE:
        case INTERRUPT:
          break;
        case REGULAR:
          command(line.text, outLines);
          break;
        default:
          throw new AssertionError(line.type);
      }
    }
  }

  /**
   * Executes a line: a {@code :set} command, or an expression. Prints the
   * result, or a description of the error, and never throws, even if the
   * stack overflows.
   */
  void command(String line, Consumer<String> outLines) {
    try {
      if (line.startsWith(":")) {
        final List<String> words = SPLITTER.splitToList(line.substring(1));
        if (words.size() != 3 || !words.get(0).equals("set")) {
          throw new IllegalArgumentException("unknown command: " + line);
        }
        Prop.lookup(words.get(1)).setLenient(session.map, words.get(2));
        return;
      }
      final Tracer tracer =
          Prop.TRACE.booleanValue(session.map)
              ? Tracers.printing(
                  Tracers.empty(),
                  session.dialect().linearizer()::linearize,
                  outLines)
              : Tracers.empty();
      outLines.accept(session.run(line, tracer));
    } catch (RuntimeException e) {
      final StringBuilder buf = new StringBuilder();
      handle(e, buf);
      outLines.accept(buf.toString());
    } catch (StackOverflowError e) {
      // A very deep term can exhaust the stack; the session carries on.
      outLines.accept(e.toString());
    }
  }

  /** Formats an exception to a buffer. */
  static void handle(RuntimeException e, StringBuilder buf) {
    if (e instanceof LambdaException) {
      ((LambdaException) e).describeTo(buf);
    } else if (e instanceof IllegalArgumentException) {
      buf.append("Error: ").append(e.getMessage());
    } else {
      buf.append(e);
    }
  }

  /** Shell configuration. */
  static class Config {
    static final Config DEFAULT =
        new Config(true, false, true, false, false, () -> {});

    final boolean banner;
    final boolean dumb;
    final boolean system;
    final boolean raw;
    final boolean help;
    final Runnable pauseFn;

    private Config(
        boolean banner,
        boolean dumb,
        boolean system,
        boolean raw,
        boolean help,
        Runnable pauseFn) {
      this.banner = banner;
      this.dumb = dumb;
      this.system = system;
      this.raw = raw;
      this.help = help;
      this.pauseFn = requireNonNull(pauseFn, "pauseFn");
    }

    Config withBanner(boolean banner) {
      return new Config(banner, dumb, system, raw, help, pauseFn);
    }

    Config withDumb(boolean dumb) {
      return new Config(banner, dumb, system, raw, help, pauseFn);
    }

    Config withSystem(boolean system) {
      return new Config(banner, dumb, system, raw, help, pauseFn);
    }

    Config withRaw(boolean raw) {
      return new Config(banner, dumb, system, raw, help, pauseFn);
    }

    Config withHelp(boolean help) {
      return new Config(banner, dumb, system, raw, help, pauseFn);
    }

    Config withPauseFn(Runnable pauseFn) {
      return new Config(banner, dumb, system, raw, help, pauseFn);
    }
  }

  /** Type of line returned by {@link LineFn#read}. */
  enum LineType {
    REGULAR,
    IGNORE,
    HELP,
    QUIT,
    INTERRUPT,
    EOF
  }

  /** A line of input, and its type. */
  static class Line {
    final LineType type;
    final String text;

    Line(LineType type, String text) {
      this.type = requireNonNull(type, "type");
      this.text = requireNonNull(text, "text");
    }

    static Line of(LineType type) {
      return new Line(type, "");
    }

    /** Classifies a line that has been read. */
    static Line classify(String line) {
      final String trimmed = line.trim();
      if (trimmed.isEmpty()) {
        return of(LineType.IGNORE);
      }
      if (trimmed.equals(":quit") || trimmed.equals(":exit")) {
        return of(LineType.QUIT);
      }
      if (trimmed.equals(":help") || trimmed.equals(":?")) {
        return of(LineType.HELP);
      }
      return new Line(LineType.REGULAR, trimmed);
    }
  }

  /** Source of lines. */
  interface LineFn {
    Line read();
  }

  /** Implementation of {@link LineFn} that reads from a reader. */
  static class ReaderLineFn implements LineFn {
    private final BufferedReader reader;

    ReaderLineFn(BufferedReader reader) {
      this.reader = reader;
    }

    @Override
    public Line read() {
      try {
        final String line = reader.readLine();
        if (line == null) {
          return Line.of(LineType.EOF);
        }
        return Line.classify(line);
      } catch (IOException e) {
        throw new RuntimeException(e);
      }
    }
  }

  /**
   * Implementation of {@link LineFn} that reads from JLine's terminal. It is
   * used for interactive sessions.
   */
  private static class TerminalLineFn implements LineFn {
    private final String prompt;
    private final LineReader lineReader;

    TerminalLineFn(String prompt, LineReader lineReader) {
      this.prompt = prompt;
      this.lineReader = lineReader;
    }

    @Override
    public Line read() {
      final String line;
      try {
        line = lineReader.readLine(prompt);
      } catch (UserInterruptException e) {
        return Line.of(LineType.INTERRUPT);
      } catch (EndOfFileException e) {
        return Line.of(LineType.EOF);
      }
      return Line.classify(line);
    }
  }
}

// End Shell.java
