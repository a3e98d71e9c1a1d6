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

package net.pretty.java.text;

/** Utilities for indenting blocks of text. */
public final class TextIndent {

  private TextIndent() {}

  /**
   * Returns {@code text} with {@code prefix} inserted at the start of every line, blank lines
   * included. Nothing is inserted after a trailing newline, so empty text stays empty.
   */
  public static String indent(String text, String prefix) {
    if (prefix.isEmpty() || text.isEmpty()) {
      return text;
    }
    StringBuilder buf = new StringBuilder(text.length() + prefix.length());
    boolean atLineStart = true;
    for (int i = 0, n = text.length(); i < n; i++) {
      char c = text.charAt(i);
      if (atLineStart) {
        buf.append(prefix);
      }
      buf.append(c);
      atLineStart = c == '\n';
    }
    return buf.toString();
  }
}
