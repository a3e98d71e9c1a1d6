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

/** Literal forms of scalar values. */
final class Literals {

  private Literals() {}

  /**
   * Returns the literal form of a non-null scalar: {@code true}, {@code 42}, {@code 2.5}, {@code
   * (1.0+2.0i)}, {@code 0x7f00}. Enum constants are shown by name; other opaque values by their
   * string form.
   */
  static String of(ValueKind kind, Object x) {
    if (kind == ValueKind.OPAQUE && x instanceof Enum<?> e) {
      return e.name();
    }
    return String.valueOf(x);
  }

  /** Returns an identity handle for an object that has no address, e.g. {@code 0x1b6d3586}. */
  static String handle(Object x) {
    return "0x" + Integer.toHexString(System.identityHashCode(x));
  }

  /**
   * Returns {@code s} as a double-quoted literal, with quotes, backslashes and control characters
   * escaped.
   */
  static String quote(String s) {
    StringBuilder buf = new StringBuilder(s.length() + 2);
    buf.append('"');
    for (int i = 0, n = s.length(); i < n; i++) {
      escapeCharacter(buf, s.charAt(i));
    }
    return buf.append('"').toString();
  }

  private static void escapeCharacter(StringBuilder buf, char c) {
    switch (c) {
      case '"' -> buf.append("\\\"");
      case '\\' -> buf.append("\\\\");
      case '\n' -> buf.append("\\n");
      case '\r' -> buf.append("\\r");
      case '\t' -> buf.append("\\t");
      case '\b' -> buf.append("\\b");
      case '\f' -> buf.append("\\f");
      default -> {
        if (c < 0x20 || c == 0x7f) {
          buf.append(String.format("\\x%02x", (int) c));
        } else {
          buf.append(c);
        }
      }
    }
  }
}
