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

import static java.util.FormattableFlags.ALTERNATE;
import static java.util.FormattableFlags.LEFT_JUSTIFY;
import static java.util.FormattableFlags.UPPERCASE;

import com.google.common.base.Preconditions;
import java.util.Formattable;
import java.util.Formatter;
import javax.annotation.Nullable;

/**
 * A PrettyFormatter wraps a value so that {@link java.util.Formatter} renders it with {@link
 * Printer}.
 *
 * <p>The value is rendered for the {@code %#s} conversion. For {@code %s} and {@code %S} it is
 * formatted as its string form, honouring width, precision and the {@code -} flag, unless the
 * formatter is forced, in which case every conversion renders.
 */
public final class PrettyFormatter implements Formattable {

  @Nullable private final Object x;
  private final boolean force;
  private final boolean quote;
  private final RenderConfig config;

  PrettyFormatter(@Nullable Object x, boolean force, boolean quote, RenderConfig config) {
    this.x = x;
    this.force = force;
    this.quote = quote;
    this.config = Preconditions.checkNotNull(config);
  }

  @Override
  public void formatTo(Formatter formatter, int flags, int width, int precision) {
    if (force || (flags & ALTERNATE) != 0) {
      StringBuilder buf = new StringBuilder();
      Pretty.render(buf, Value.of(x), /*showType=*/ true, quote, config);
      formatter.format("%s", buf);
      return;
    }
    passThrough(formatter, flags, width, precision);
  }

  // Formats the string form of x with the same flags, width and precision.
  private void passThrough(Formatter formatter, int flags, int width, int precision) {
    StringBuilder pattern = new StringBuilder("%");
    if ((flags & LEFT_JUSTIFY) != 0) {
      pattern.append('-');
    }
    if (width >= 0) {
      pattern.append(width);
    }
    if (precision >= 0) {
      pattern.append('.').append(precision);
    }
    pattern.append((flags & UPPERCASE) != 0 ? 'S' : 's');
    formatter.format(pattern.toString(), String.valueOf(x));
  }

  /** Returns the string form of the wrapped value, not its rendering. */
  @Override
  public String toString() {
    return String.valueOf(x);
  }
}
