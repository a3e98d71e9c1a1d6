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
import com.google.common.reflect.TypeToken;
import java.lang.reflect.Array;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;
import net.pretty.java.render.RecordDescriptor.FieldDescriptor;

/**
 * A Value pairs a Java object with the static type through which the printer reached it, and the
 * {@link ValueKind} derived from that type.
 *
 * <p>The static type matters: an {@code Object} field holding a string is an {@link ValueKind#ANY}
 * whose concrete value is a {@link ValueKind#STRING}, and a {@code List<String>} field inlines
 * where a raw {@code List} would not.
 */
public final class Value {

  /** The absent value. */
  public static final Value INVALID = new Value(ValueKind.INVALID, Object.class, null);

  private static final TypeVariable<?> ITERABLE_ELEMENT = Iterable.class.getTypeParameters()[0];
  private static final TypeVariable<?> MAP_KEY = Map.class.getTypeParameters()[0];
  private static final TypeVariable<?> MAP_VALUE = Map.class.getTypeParameters()[1];

  private final ValueKind kind;
  private final Type type;
  @Nullable private final Object object;

  private Value(ValueKind kind, Type type, @Nullable Object object) {
    this.kind = kind;
    this.type = type;
    this.object = object;
  }

  /**
   * Returns the value of a top-level object, typed by its run-time class. An application object
   * is a {@link ValueKind#RECORD}.
   */
  public static Value of(@Nullable Object x) {
    if (x == null) {
      return INVALID;
    }
    Value v = concrete(x);
    return v.kind == ValueKind.REFERENCE ? v.referent() : v;
  }

  /**
   * Returns the value of a top-level object whose static type is known, such as a {@code
   * List<String>} captured by a {@link TypeToken}.
   */
  public static Value of(@Nullable Object x, Type type) {
    Preconditions.checkNotNull(type);
    ValueKind kind = ValueKind.of(type);
    if (x == null) {
      return kind == ValueKind.ANY ? INVALID : new Value(kind, type, null);
    }
    return switch (kind) {
      case ANY -> x instanceof Optional ? new Value(kind, type, x) : of(x);
      case REFERENCE -> new Value(kind, type, x).referent();
      default -> new Value(kind, type, x);
    };
  }

  /** Returns the value {@code x} reached through a field or element of static type {@code type}. */
  static Value declared(Type type, @Nullable Object x) {
    return new Value(ValueKind.of(type), type, x);
  }

  /** Returns the value of {@code x} typed by its run-time class. */
  static Value concrete(Object x) {
    Class<?> c = x.getClass();
    ValueKind kind = ValueKind.of(c);
    if (kind == ValueKind.ANY && !(x instanceof Optional)) {
      kind = ValueKind.OPAQUE; // a plain Object
    }
    return new Value(kind, c, x);
  }

  public ValueKind kind() {
    return kind;
  }

  /** Returns the static type of this value. */
  public Type type() {
    return type;
  }

  @Nullable
  public Object object() {
    return object;
  }

  String typeName() {
    return TypeNames.of(type);
  }

  // -- indirection --

  /**
   * Returns the record that a non-null {@link ValueKind#REFERENCE} refers to, typed by its
   * run-time class unless that is the raw form of the static type.
   */
  Value referent() {
    Preconditions.checkState(kind == ValueKind.REFERENCE && object != null);
    Class<?> c = object.getClass();
    Type referentType = TypeToken.of(type).getRawType() == c ? type : c;
    return new Value(ValueKind.RECORD, referentType, object);
  }

  /**
   * Returns the concrete value held by a non-null {@link ValueKind#ANY}, or null if it is a
   * handle holding nothing (an empty {@link Optional}).
   */
  @Nullable
  Value unwrap() {
    Preconditions.checkState(kind == ValueKind.ANY && object != null);
    if (object instanceof Optional<?> opt) {
      return opt.isPresent() ? concrete(opt.get()) : null;
    }
    return concrete(object);
  }

  // -- composite access --

  /** Returns the element type of a sequence type. */
  static Type elementType(Type seqType) {
    if (seqType instanceof GenericArrayType g) {
      return g.getGenericComponentType();
    }
    Class<?> raw = TypeToken.of(seqType).getRawType();
    if (raw.isArray()) {
      return raw.getComponentType();
    }
    return TypeToken.of(seqType).resolveType(ITERABLE_ELEMENT).getType();
  }

  static Type mapKeyType(Type mapType) {
    return TypeToken.of(mapType).resolveType(MAP_KEY).getType();
  }

  static Type mapValueType(Type mapType) {
    return TypeToken.of(mapType).resolveType(MAP_VALUE).getType();
  }

  /** Returns the declared type of a field of a record of static type {@code recordType}. */
  static Type fieldType(Type recordType, FieldDescriptor field) {
    return TypeToken.of(recordType).resolveType(field.genericType()).getType();
  }

  /** Returns the elements of a non-null sequence, in index order. */
  List<Object> elements() {
    Preconditions.checkState(kind == ValueKind.SEQUENCE && object != null);
    if (object.getClass().isArray()) {
      int n = Array.getLength(object);
      List<Object> list = new ArrayList<>(n);
      for (int i = 0; i < n; i++) {
        list.add(Array.get(object, i));
      }
      return list;
    }
    return new ArrayList<>((Collection<?>) object);
  }

  /**
   * Returns the value of a field of a non-null record. A non-null {@code Object}-typed field is
   * returned as its concrete value.
   */
  Value field(FieldDescriptor f) {
    Preconditions.checkState(kind == ValueKind.RECORD && object != null);
    Object x = f.get(object);
    Value v = declared(fieldType(type, f), x);
    if (v.kind == ValueKind.ANY && x != null) {
      Value concrete = v.unwrap();
      if (concrete != null) {
        return concrete;
      }
    }
    return v;
  }

  // -- predicates --

  /**
   * Reports whether this value counts as empty for the {@code omitempty} directive: a null
   * reference, an empty {@link Optional}, or a zero-length string, sequence or map. Booleans,
   * numbers and records are never empty.
   */
  boolean isEmpty() {
    if (object == null) {
      return true;
    }
    return switch (kind) {
      case SEQUENCE ->
          object.getClass().isArray()
              ? Array.getLength(object) == 0
              : ((Collection<?>) object).isEmpty();
      case MAP -> ((Map<?, ?>) object).isEmpty();
      case STRING -> object instanceof CharSequence s && s.length() == 0;
      case ANY -> object instanceof Optional<?> opt && opt.isEmpty();
      default -> false;
    };
  }

  /**
   * Reports whether this value is the zero value of its kind. A record is zero if all its fields
   * are; references, sequences, maps and other handles are zero only if null.
   */
  boolean isZero() {
    if (object == null) {
      return true;
    }
    switch (kind) {
      case BOOL:
        return !(Boolean) object;
      case INT:
        return object instanceof BigInteger b
            ? b.signum() == 0
            : ((Number) object).longValue() == 0;
      case UINT:
        // UnsignedInteger and UnsignedLong are Numbers.
        return ((Number) object).longValue() == 0;
      case FLOAT:
        return object instanceof BigDecimal d
            ? d.signum() == 0
            : ((Number) object).doubleValue() == 0;
      case COMPLEX:
        return ((Complex) object).isZero();
      case STRING:
        return object instanceof Character c ? c == 0 : ((CharSequence) object).length() == 0;
      case ADDRESS:
        return ((Address) object).value() == 0;
      case RECORD:
        RecordDescriptor d = RecordDescriptor.of(object.getClass());
        if (d.isOpaque()) {
          return false;
        }
        for (FieldDescriptor f : d.fields()) {
          if (!field(f).isZero()) {
            return false;
          }
        }
        return true;
      default:
        return false;
    }
  }

  @Override
  public String toString() {
    return kind + "(" + typeName() + ")";
  }
}
