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

import com.google.common.reflect.TypeToken;
import java.lang.reflect.Type;
import net.pretty.java.render.RecordDescriptor.FieldDescriptor;

/**
 * Decides from static types alone whether a composite value is printed on one line or expanded
 * into an indented block, one item per line.
 *
 * <p>The lookahead is one level deep: a composite inlines only if none of its element, value or
 * field types is itself expandable (see {@link ValueKind#isExpandable}). Run-time emptiness is
 * not considered.
 */
final class Inlining {

  private Inlining() {}

  /**
   * Reports whether a value of the given kind and static type can be printed inline. Nothing
   * inlines in humanized output.
   */
  static boolean canInline(ValueKind kind, Type type, boolean humanize) {
    if (humanize) {
      return false;
    }
    switch (kind) {
      case MAP:
        return !canExpand(Value.mapValueType(type));
      case RECORD:
        RecordDescriptor d = RecordDescriptor.of(TypeToken.of(type).getRawType());
        for (FieldDescriptor f : d.fields()) {
          if (canExpand(Value.fieldType(type, f))) {
            return false;
          }
        }
        return true;
      case SEQUENCE:
        return !canExpand(Value.elementType(type));
      case ANY:
      case REFERENCE:
      case CHANNEL:
      case FUNCTION:
      case ADDRESS:
        return false;
      default:
        return true;
    }
  }

  static boolean canInline(Value v, boolean humanize) {
    return canInline(v.kind(), v.type(), humanize);
  }

  /** Reports whether values of static type {@code type} may expand into a block. */
  static boolean canExpand(Type type) {
    return ValueKind.of(type).isExpandable();
  }

  /**
   * Reports whether a field of static type {@code type} is printed with its type name in
   * structured output.
   */
  static boolean labelType(Type type) {
    ValueKind kind = ValueKind.of(type);
    return kind == ValueKind.ANY || kind == ValueKind.RECORD;
  }
}
