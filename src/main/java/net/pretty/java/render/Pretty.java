// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.pretty.java.render;

import com.google.common.base.Preconditions;
import com.google.common.flogger.GoogleLogger;
import com.google.common.reflect.TypeToken;
import com.google.errorprone.annotations.CheckReturnValue;
import com.google.errorprone.annotations.FormatMethod;
import java.io.IOException;
import java.lang.reflect.Type;
import java.time.temporal.TemporalAccessor;
import java.util.Calendar;
import java.util.Date;
import java.util.Formattable;
import java.util.function.UnaryOperator;
import javax.annotation.Nullable;
import net.pretty.java.text.TextIndent;

/**
 * The Pretty class defines the entry points for rendering values, and convenience wrappers for
 * string formatting, printing and logging that render their operands.
 *
 * <p>Every operation reads a {@link RenderConfig}: either the one passed explicitly, or the
 * process-wide default held here, which is read once at the start of the call. The default may be
 * changed at any time; callers that render concurrently with different settings should pass their
 * own configuration instead.
 */
public final class Pretty {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private static volatile RenderConfig defaultConfig = RenderConfig.DEFAULT;

  private Pretty() {} // uninstantiable

  // -- process-wide configuration --

  /** Returns the configuration used by operations not given one explicitly. */
  public static RenderConfig defaultConfig() {
    return defaultConfig;
  }

  /** Replaces the configuration used by operations not given one explicitly. */
  public static void setDefaultConfig(RenderConfig config) {
    defaultConfig = Preconditions.checkNotNull(config);
  }

  private static synchronized void updateDefault(UnaryOperator<RenderConfig.Builder> update) {
    defaultConfig = update.apply(defaultConfig.toBuilder()).build();
  }

  /** Returns the number of columns of one indentation step (initially 4). */
  public static int outputIndentLevel() {
    return defaultConfig.indentWidth();
  }

  /**
   * Sets the number of columns of one indentation step; 2 or 4 are usual.
   *
   * @throws IllegalArgumentException if {@code indent} is not positive
   */
  public static void setOutputIndentLevel(int indent) {
    updateDefault(b -> b.setIndentWidth(indent));
  }

  /** Reports whether output is humanized (initially false). */
  public static boolean humanize() {
    return defaultConfig.humanize();
  }

  /**
   * Turns humanized output on or off.
   *
   * <p>Humanized output is meant to be read by end users: type names, quotes and brackets are
   * dropped, and {@link net.pretty.java.annot.PrettyTag} directives on fields rename, hide or omit
   * empty fields. Zero numbers and false booleans are still shown.
   */
  public static void setHumanize(boolean humanize) {
    updateDefault(b -> b.setHumanize(humanize));
  }

  /** Returns the text prefixed to every line of formatted output (initially empty). */
  public static String outputPrefix() {
    return defaultConfig.outputPrefix();
  }

  public static void setOutputPrefix(String prefix) {
    Preconditions.checkNotNull(prefix);
    updateDefault(b -> b.setOutputPrefix(prefix));
  }

  /** Reports whether humanized output puts a blank line between items (initially false). */
  public static boolean newlineAfterItems() {
    return defaultConfig.newlineAfterItems();
  }

  public static void setNewlineAfterItems(boolean newlineAfterItems) {
    updateDefault(b -> b.setNewlineAfterItems(newlineAfterItems));
  }

  // -- rendering --

  /**
   * Renders {@code x} to {@code sink} using the default configuration, showing its type and
   * quoting it if it is a string.
   */
  public static void render(Appendable sink, @Nullable Object x) throws IOException {
    render(sink, x, defaultConfig);
  }

  /** Renders {@code x} to {@code sink}, showing its type and quoting it if it is a string. */
  public static void render(Appendable sink, @Nullable Object x, RenderConfig config)
      throws IOException {
    new Printer(sink, config).print(Value.of(x), /*showType=*/ true, /*quote=*/ true);
  }

  /**
   * Renders {@code x}, whose static type is given by {@code type}, to {@code sink}. The static
   * type decides how generic containers are laid out, e.g. a {@code List<String>} inlines where a
   * {@code List<Object>} expands.
   */
  public static void render(
      Appendable sink,
      @Nullable Object x,
      TypeToken<?> type,
      boolean showType,
      boolean quote,
      RenderConfig config)
      throws IOException {
    render(sink, x, type.getType(), showType, quote, config);
  }

  public static void render(
      Appendable sink,
      @Nullable Object x,
      Type type,
      boolean showType,
      boolean quote,
      RenderConfig config)
      throws IOException {
    new Printer(sink, config).print(Value.of(x, type), showType, quote);
  }

  // Renders into a buffer, which cannot fail.
  static void render(
      StringBuilder buf, Value v, boolean showType, boolean quote, RenderConfig config) {
    try {
      new Printer(buf, config).print(v, showType, quote);
    } catch (IOException e) {
      throw new IllegalStateException("StringBuilder threw", e);
    }
  }

  /** Returns the rendering of {@code x}, as by {@link #render(Appendable, Object)}. */
  public static String toString(@Nullable Object x) {
    return toString(x, defaultConfig);
  }

  public static String toString(@Nullable Object x, RenderConfig config) {
    StringBuilder buf = new StringBuilder();
    render(buf, Value.of(x), /*showType=*/ true, /*quote=*/ true, config);
    return buf.toString();
  }

  /**
   * Returns a wrapper for {@code x} that renders it when formatted with {@code %#s}, and formats
   * its string form for other {@code %s} conversions:
   *
   * <pre>
   *   String.format("%#s", Pretty.formatter(x))
   * </pre>
   */
  public static PrettyFormatter formatter(@Nullable Object x) {
    return formatter(x, defaultConfig);
  }

  public static PrettyFormatter formatter(@Nullable Object x, RenderConfig config) {
    return new PrettyFormatter(x, /*force=*/ false, /*quote=*/ true, config);
  }

  // -- string formatting --

  /**
   * Renders each operand and joins the results with spaces. Strings are not quoted at top level.
   * The output prefix is applied to every line.
   */
  public static String sprint(Object... args) {
    return sprint(defaultConfig, args);
  }

  public static String sprint(RenderConfig config, Object... args) {
    return TextIndent.indent(join(config, args), config.outputPrefix());
  }

  /** Like {@link #sprint}, but ends the output with a newline. */
  public static String sprintln(Object... args) {
    return sprintln(defaultConfig, args);
  }

  public static String sprintln(RenderConfig config, Object... args) {
    return TextIndent.indent(join(config, args) + "\n", config.outputPrefix());
  }

  /**
   * Formats {@code args} as if by {@link String#format}, after wrapping each operand in a
   * formatter, so that {@code %#s} renders it. Numbers, characters, booleans and dates are not
   * wrapped, so numeric and date conversions apply to them as usual. The output prefix is
   * applied to every line.
   */
  @FormatMethod
  public static String sprintf(String format, Object... args) {
    return sprintf(defaultConfig, format, args);
  }

  @FormatMethod
  public static String sprintf(RenderConfig config, String format, Object... args) {
    return TextIndent.indent(String.format(format, wrap(config, args)), config.outputPrefix());
  }

  private static String join(RenderConfig config, Object[] args) {
    StringBuilder buf = new StringBuilder();
    for (int i = 0; i < args.length; i++) {
      if (i > 0) {
        buf.append(' ');
      }
      render(buf, Value.of(args[i]), /*showType=*/ true, /*quote=*/ false, config);
    }
    return buf.toString();
  }

  private static Object[] wrap(RenderConfig config, Object[] args) {
    Object[] wrapped = new Object[args.length];
    for (int i = 0; i < args.length; i++) {
      Object x = args[i];
      wrapped[i] = passesUnwrapped(x) ? x : new PrettyFormatter(x, false, false, config);
    }
    return wrapped;
  }

  private static boolean passesUnwrapped(@Nullable Object x) {
    return x instanceof Number
        || x instanceof Character
        || x instanceof Boolean
        || x instanceof TemporalAccessor
        || x instanceof Date
        || x instanceof Calendar
        || x instanceof Formattable;
  }

  // -- printing --

  /** Writes {@link #sprint sprint(args)} to standard output. */
  public static void print(Object... args) {
    System.out.print(sprint(args));
  }

  /** Writes {@link #sprintln sprintln(args)} to standard output. */
  public static void println(Object... args) {
    System.out.print(sprintln(args));
  }

  /** Writes {@link #sprintf sprintf(format, args)} to standard output. */
  @FormatMethod
  public static void printf(String format, Object... args) {
    System.out.print(sprintf(format, args));
  }

  /** Writes {@link #sprint sprint(args)} to {@code out}. */
  public static void fprint(Appendable out, Object... args) throws IOException {
    out.append(sprint(args));
  }

  /** Writes {@link #sprintln sprintln(args)} to {@code out}. */
  public static void fprintln(Appendable out, Object... args) throws IOException {
    out.append(sprintln(args));
  }

  /** Writes {@link #sprintf sprintf(format, args)} to {@code out}. */
  @FormatMethod
  public static void fprintf(Appendable out, String format, Object... args) throws IOException {
    out.append(sprintf(format, args));
  }

  // -- logging --

  /** Logs {@link #sprint sprint(args)} at INFO level. */
  public static void log(Object... args) {
    logger.atInfo().log("%s", sprint(args));
  }

  /** Logs {@link #sprintln sprintln(args)} at INFO level. */
  public static void logln(Object... args) {
    logger.atInfo().log("%s", sprintln(args));
  }

  /** Logs {@link #sprintf sprintf(format, args)} at INFO level. */
  @FormatMethod
  public static void logf(String format, Object... args) {
    logger.atInfo().log("%s", sprintf(format, args));
  }

  /**
   * Returns a new PrettyException whose message is {@link #sprintf sprintf(format, args)}.
   */
  @FormatMethod
  @CheckReturnValue // don't forget to throw it
  public static PrettyException errorf(String format, Object... args) {
    return new PrettyException(sprintf(format, args));
  }

  /** Like {@link #errorf(String, Object...)}, but records {@code cause} on the exception. */
  @FormatMethod
  @CheckReturnValue
  public static PrettyException errorf(Throwable cause, String format, Object... args) {
    return new PrettyException(sprintf(format, args), cause);
  }
}
