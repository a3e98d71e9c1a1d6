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
import java.util.Arrays;

/**
 * Bounds the recursion of a single render call.
 *
 * <p>It tracks the composite values in the middle of being printed, as (identity, class) pairs on
 * the active path. A value encountered again while it is still on the path is a cycle. Values
 * shared by several branches of an acyclic graph are not cycles and print in full each time.
 */
final class VisitGuard {

  /** The deepest nesting that is printed; deeper values render as {@link #DEPTH_EXCEEDED}. */
  static final int MAX_DEPTH = 10;

  static final String DEPTH_EXCEEDED = "!(DEPTH EXCEEDED)";

  static final String CYCLIC_REFERENCE = "{(CYCLIC REFERENCE)}";

  private Object[] objects = new Object[4];
  private Class<?>[] classes = new Class<?>[4];
  private int size;

  static boolean depthExceeded(int depth) {
    return depth > MAX_DEPTH;
  }

  /** Reports whether x is already on the visitation path, pushing it if not. */
  boolean push(Object x, Class<?> cls) {
    for (int i = 0; i < size; i++) {
      if (objects[i] == x && classes[i] == cls) {
        return false;
      }
    }
    if (size == objects.length) {
      objects = Arrays.copyOf(objects, 2 * size);
      classes = Arrays.copyOf(classes, 2 * size);
    }
    objects[size] = x;
    classes[size] = cls;
    size++;
    return true;
  }

  void pop() {
    size--;
    objects[size] = null;
    classes[size] = null;
  }

  /** Returns the number of values on the path. */
  @VisibleForTesting
  int size() {
    return size;
  }
}
