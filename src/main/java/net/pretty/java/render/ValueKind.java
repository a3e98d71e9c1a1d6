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

import com.google.common.collect.ImmutableSet;
import com.google.common.primitives.UnsignedInteger;
import com.google.common.primitives.UnsignedLong;
import com.google.common.reflect.TypeToken;
import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.channels.Channel;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;

/**
 * The structural kind of a value, as seen by the printer.
 *
 * <p>Kinds are derived from static types by {@link #of}. {@link #RECORD} is never the kind of a
 * declared type: an application class used as a field or element type is a {@link #REFERENCE},
 * whose referent is a record.
 */
public enum ValueKind {
  /** An absent value: Java null with no usable static type. */
  INVALID,
  BOOL,
  INT,
  UINT,
  FLOAT,
  COMPLEX,
  STRING,
  /** An array or collection. */
  SEQUENCE,
  MAP,
  /** An application object, rendered field by field. */
  RECORD,
  /** A value whose concrete type is known only at run time, such as an {@code Object} field. */
  ANY,
  /** A reference to a record. */
  REFERENCE,
  CHANNEL,
  FUNCTION,
  ADDRESS,
  /** A value rendered through its string form, such as an enum constant or a platform type. */
  OPAQUE;

  private static final ImmutableSet<Class<?>> BOOL_TYPES =
      ImmutableSet.of(boolean.class, Boolean.class);

  private static final ImmutableSet<Class<?>> INT_TYPES =
      ImmutableSet.of(
          byte.class,
          Byte.class,
          short.class,
          Short.class,
          int.class,
          Integer.class,
          long.class,
          Long.class,
          BigInteger.class);

  private static final ImmutableSet<Class<?>> UINT_TYPES =
      ImmutableSet.of(UnsignedInteger.class, UnsignedLong.class);

  private static final ImmutableSet<Class<?>> FLOAT_TYPES =
      ImmutableSet.of(float.class, Float.class, double.class, Double.class, BigDecimal.class);

  private static final ImmutableSet<Class<?>> STRING_TYPES =
      ImmutableSet.of(String.class, char.class, Character.class);

  /** Reports whether values of this kind may be rendered as an indented block. */
  public boolean isExpandable() {
    return switch (this) {
      case MAP, RECORD, ANY, SEQUENCE, REFERENCE -> true;
      default -> false;
    };
  }

  /** Returns the kind of values whose static type is {@code type}. */
  public static ValueKind of(Type type) {
    if (type instanceof TypeVariable || type instanceof WildcardType) {
      return ANY;
    }
    return of(TypeToken.of(type).getRawType());
  }

  private static ValueKind of(Class<?> c) {
    if (BOOL_TYPES.contains(c)) {
      return BOOL;
    } else if (INT_TYPES.contains(c)) {
      return INT;
    } else if (UINT_TYPES.contains(c)) {
      return UINT;
    } else if (FLOAT_TYPES.contains(c)) {
      return FLOAT;
    } else if (c == Complex.class) {
      return COMPLEX;
    } else if (c == Address.class) {
      return ADDRESS;
    } else if (STRING_TYPES.contains(c)) {
      return STRING;
    } else if (c == Optional.class) {
      return ANY;
    } else if (c.isArray()) {
      return SEQUENCE;
    }

    // Blocking queues are collections too; check them first.
    if (Channel.class.isAssignableFrom(c) || BlockingQueue.class.isAssignableFrom(c)) {
      return CHANNEL;
    } else if (Map.class.isAssignableFrom(c)) {
      return MAP;
    } else if (Collection.class.isAssignableFrom(c)) {
      return SEQUENCE;
    } else if (isFunction(c)) {
      return FUNCTION;
    } else if (c.isEnum() || (c.getSuperclass() != null && c.getSuperclass().isEnum())) {
      return OPAQUE;
    } else if (CharSequence.class.isAssignableFrom(c) && !isAbstract(c)) {
      return STRING;
    } else if (c == Object.class || isAbstract(c)) {
      return ANY;
    } else if (c.isPrimitive() || isPlatformClass(c)) {
      return OPAQUE;
    }
    return REFERENCE;
  }

  private static boolean isAbstract(Class<?> c) {
    return c.isInterface() || Modifier.isAbstract(c.getModifiers());
  }

  static boolean isFunction(Class<?> c) {
    if (isLambda(c) || c == Method.class || c == Constructor.class) {
      return true;
    }
    if (!c.isInterface()) {
      return false;
    }
    return c == Runnable.class
        || c == Callable.class
        || c.getName().startsWith("java.util.function.")
        || c.isAnnotationPresent(FunctionalInterface.class);
  }

  static boolean isLambda(Class<?> c) {
    return (c.isSynthetic() || c.isHidden()) && c.getName().contains("$$Lambda");
  }

  /** Reports whether {@code c} belongs to the Java platform rather than to the application. */
  static boolean isPlatformClass(Class<?> c) {
    String name = c.getName();
    return name.startsWith("java.")
        || name.startsWith("javax.")
        || name.startsWith("jdk.")
        || name.startsWith("sun.")
        || name.startsWith("com.sun.");
  }
}
