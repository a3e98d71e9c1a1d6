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

import com.google.common.annotations.VisibleForTesting;

/**
 * Tracks the text of the current output line and the run of closing brackets just written, so
 * that humanized output, which drops brackets, can still decide where line breaks belong.
 *
 * <p>One tracker observes every write of a single render call, in write order and before any
 * indentation is added.
 */
final class LayoutTracker {

  private final boolean humanize;
  private final boolean newlineAfterItems;

  private final StringBuilder currentLine = new StringBuilder();
  private int closeBrackets;

  LayoutTracker(boolean humanize, boolean newlineAfterItems) {
    this.humanize = humanize;
    this.newlineAfterItems = newlineAfterItems;
  }

  /**
   * Records a structural bracket, {@code '{'} or {@code '}'}, and reports whether it should be
   * written. Humanized output writes none, but counts the closing ones.
   */
  boolean bracket(char c) {
    if (!humanize) {
      text(c);
      return true;
    }
    if (c == '}') {
      closeBrackets++;
    }
    return false;
  }

  /** Records a written character. */
  void text(char c) {
    if (c == '\n') {
      currentLine.setLength(0);
    } else {
      currentLine.append(c);
    }
    closeBrackets = 0;
  }

  /** Records a written string. */
  void text(String s) {
    if (s.isEmpty()) {
      return;
    }
    int nl = s.lastIndexOf('\n');
    if (nl >= 0) {
      currentLine.setLength(0);
      currentLine.append(s, nl + 1, s.length());
    } else {
      currentLine.append(s);
    }
    closeBrackets = 0;
  }

  /**
   * Reports whether an expanding value must start on a new, indented line. Always true in
   * structured output; in humanized output only after a {@code "key:"} header.
   */
  boolean indentNeeded() {
    return !humanize || currentLine.indexOf(":") >= 0;
  }

  /**
   * Reports whether a line break must follow an item of a humanized block: unless the item ended
   * with a (dropped) closing bracket, whose block already ended its last line. With blank lines
   * between items enabled, a run of exactly two closing brackets also gets one.
   */
  boolean newlineNeeded() {
    return closeBrackets == 0 || (newlineAfterItems && closeBrackets == 2);
  }

  @VisibleForTesting
  String currentLine() {
    return currentLine.toString();
  }

  @VisibleForTesting
  int closeBrackets() {
    return closeBrackets;
  }
}
