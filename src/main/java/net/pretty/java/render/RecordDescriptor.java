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
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import net.pretty.java.annot.PrettyTag;

/**
 * A RecordDescriptor lists the fields of a record class that the printer renders, with their
 * parsed directives.
 *
 * <p>Descriptors are computed on first use and kept in a global map, since a class's fields never
 * change.
 */
final class RecordDescriptor {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private static final ConcurrentHashMap<Class<?>, RecordDescriptor> cache =
      new ConcurrentHashMap<>();

  private final Class<?> cls;
  // Empty if the class is opaque.
  private final ImmutableList<FieldDescriptor> fields;
  private final boolean opaque;

  private RecordDescriptor(Class<?> cls, ImmutableList<FieldDescriptor> fields, boolean opaque) {
    this.cls = cls;
    this.fields = fields;
    this.opaque = opaque;
  }

  /** A field of a record class. */
  static final class FieldDescriptor {
    private final Field field;
    private final FieldDirective directive;

    private FieldDescriptor(Field field, FieldDirective directive) {
      this.field = field;
      this.directive = directive;
    }

    String name() {
      return field.getName();
    }

    /** Returns the declared type, which may mention type variables of the declaring class. */
    Type genericType() {
      return field.getGenericType();
    }

    FieldDirective directive() {
      return directive;
    }

    Object get(Object record) {
      try {
        return field.get(record);
      } catch (IllegalAccessException e) {
        // The field was made accessible when the descriptor was built.
        throw new IllegalStateException("cannot read field " + field, e);
      }
    }
  }

  /** Returns the descriptor of {@code cls}, computing it if necessary. */
  static RecordDescriptor of(Class<?> cls) {
    // Concurrent calls may compute the same descriptor; the first to be stored wins.
    RecordDescriptor d = cache.get(cls);
    if (d == null) {
      d = build(cls);
      RecordDescriptor prev = cache.putIfAbsent(cls, d);
      if (prev != null) {
        d = prev;
      }
    }
    return d;
  }

  private static RecordDescriptor build(Class<?> cls) {
    // Superclass fields come first; platform superclasses are not inspected.
    Deque<Class<?>> hierarchy = new ArrayDeque<>();
    for (Class<?> c = cls; c != null && !ValueKind.isPlatformClass(c); c = c.getSuperclass()) {
      hierarchy.push(c);
    }

    ImmutableList.Builder<FieldDescriptor> fields = ImmutableList.builder();
    for (Class<?> c : hierarchy) {
      for (Field field : c.getDeclaredFields()) {
        if (Modifier.isStatic(field.getModifiers()) || field.isSynthetic()) {
          continue;
        }
        if (!field.trySetAccessible()) {
          logger.atFine().atMostEvery(1, TimeUnit.MINUTES).log(
              "rendering %s opaquely: field %s is not accessible", cls.getName(), field.getName());
          return new RecordDescriptor(cls, ImmutableList.of(), true);
        }
        PrettyTag tag = field.getAnnotation(PrettyTag.class);
        FieldDirective directive =
            tag != null ? FieldDirective.parse(tag.value()) : FieldDirective.NONE;
        fields.add(new FieldDescriptor(field, directive));
      }
    }
    return new RecordDescriptor(cls, fields.build(), false);
  }

  @VisibleForTesting
  Class<?> recordClass() {
    return cls;
  }

  ImmutableList<FieldDescriptor> fields() {
    return fields;
  }

  /** Reports whether the class's fields cannot be read, so its values render as opaque text. */
  boolean isOpaque() {
    return opaque;
  }
}
