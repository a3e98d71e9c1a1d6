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

import com.google.common.base.Joiner;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Source-like names of Java types, as they appear in structured output. */
final class TypeNames {

  private TypeNames() {}

  /**
   * Returns the name of {@code type}: a simple class name qualified by its enclosing classes,
   * followed by type arguments or array brackets, e.g. {@code Outer.Inner}, {@code int[]}, {@code
   * Map<String, List<Integer>>}.
   */
  static String of(Type type) {
    if (type instanceof Class<?> c) {
      return ofClass(c);
    } else if (type instanceof ParameterizedType p) {
      List<String> args = new ArrayList<>();
      for (Type arg : p.getActualTypeArguments()) {
        args.add(of(arg));
      }
      return of(p.getRawType()) + "<" + Joiner.on(", ").join(args) + ">";
    } else if (type instanceof GenericArrayType g) {
      return of(g.getGenericComponentType()) + "[]";
    } else if (type instanceof WildcardType w) {
      Type[] lower = w.getLowerBounds();
      if (lower.length > 0) {
        return "? super " + of(lower[0]);
      }
      Type[] upper = w.getUpperBounds();
      if (upper.length > 0 && upper[0] != Object.class) {
        return "? extends " + of(upper[0]);
      }
      return "?";
    } else if (type instanceof TypeVariable<?> v) {
      return v.getName();
    }
    return type.getTypeName();
  }

  private static String ofClass(Class<?> c) {
    if (c.isArray()) {
      return ofClass(c.getComponentType()) + "[]";
    }
    if (ValueKind.isLambda(c)) {
      Class<?>[] interfaces = c.getInterfaces();
      return interfaces.length > 0 ? ofClass(interfaces[0]) : "lambda";
    }
    if (c.isAnonymousClass()) {
      Class<?>[] interfaces = c.getInterfaces();
      if (c.getSuperclass() == Object.class && interfaces.length > 0) {
        return ofClass(interfaces[0]);
      }
      return ofClass(c.getSuperclass());
    }
    // Hidden implementation classes such as those behind List.of are named by their interface.
    if (!Modifier.isPublic(c.getModifiers())
        && (ValueKind.isPlatformClass(c) || c.getName().startsWith("com.google.common."))) {
      if (List.class.isAssignableFrom(c)) {
        return "List";
      } else if (Set.class.isAssignableFrom(c)) {
        return "Set";
      } else if (Collection.class.isAssignableFrom(c)) {
        return "Collection";
      } else if (Map.class.isAssignableFrom(c)) {
        return "Map";
      }
    }
    Class<?> enclosing = c.getEnclosingClass();
    if (enclosing != null && !c.isLocalClass()) {
      return ofClass(enclosing) + "." + c.getSimpleName();
    }
    return c.getSimpleName();
  }
}
