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

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.Iterables;
import javax.annotation.Nullable;

/**
 * The parsed form of a {@link net.pretty.java.annot.PrettyTag} directive: an optional display
 * name, the {@code omitempty} option, and whether the field is hidden altogether.
 */
public final class FieldDirective {

  /** The directive of a field without a tag. */
  public static final FieldDirective NONE = new FieldDirective(null, false, false);

  private static final String OMIT_EMPTY = "omitempty";

  // Punctuation allowed in a display name, besides letters and digits.
  // Backslash, quote, and comma are reserved.
  private static final CharMatcher NAME_PUNCTUATION =
      CharMatcher.anyOf("!#$%&()*+-./:<=>?@[]^_{|}~ ");

  @Nullable private final String name;
  private final boolean omitEmpty;
  private final boolean hidden;

  private FieldDirective(@Nullable String name, boolean omitEmpty, boolean hidden) {
    this.name = name;
    this.omitEmpty = omitEmpty;
    this.hidden = hidden;
  }

  /**
   * Parses a directive of the form {@code name[,option...]}, or {@code "-"}. A null or empty tag
   * yields {@link #NONE}; an invalid name is dropped, leaving the options in effect.
   */
  public static FieldDirective parse(@Nullable String tag) {
    if (tag == null || tag.isEmpty()) {
      return NONE;
    }
    if (tag.equals("-")) {
      return new FieldDirective(null, false, true);
    }
    String name = tag;
    String options = "";
    int comma = tag.indexOf(',');
    if (comma >= 0) {
      name = tag.substring(0, comma);
      options = tag.substring(comma + 1);
    }
    boolean omitEmpty =
        !options.isEmpty() && Iterables.contains(Splitter.on(',').split(options), OMIT_EMPTY);
    return new FieldDirective(isValidName(name) ? name : null, omitEmpty, false);
  }

  /**
   * Reports whether {@code name} may be used as a display name: it is non-empty and consists of
   * letters, digits, spaces and a fixed set of punctuation.
   */
  static boolean isValidName(String name) {
    if (name.isEmpty()) {
      return false;
    }
    for (int i = 0; i < name.length(); ) {
      int cp = name.codePointAt(i);
      boolean ok =
          Character.isLetter(cp)
              || Character.isDigit(cp)
              || (cp < 0x80 && NAME_PUNCTUATION.matches((char) cp));
      if (!ok) {
        return false;
      }
      i += Character.charCount(cp);
    }
    return true;
  }

  /** Returns the display name, or {@code declaredName} if the directive does not override it. */
  public String displayName(String declaredName) {
    return name != null ? name : declaredName;
  }

  public boolean omitEmpty() {
    return omitEmpty;
  }

  /** Reports whether the field is never shown in humanized output. */
  public boolean hidden() {
    return hidden;
  }

  @Override
  public String toString() {
    if (hidden) {
      return "-";
    }
    String s = name != null ? name : "";
    return omitEmpty ? s + "," + OMIT_EMPTY : s;
  }
}
