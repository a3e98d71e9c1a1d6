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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.reflect.TypeToken;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class TypeNamesTest {

  static class Outer {
    static class Inner {}
  }

  static class Box<T> {
    T value;
  }

  private static String name(TypeToken<?> t) {
    return TypeNames.of(t.getType());
  }

  @Test
  public void testClasses() throws Exception {
    assertThat(TypeNames.of(String.class)).isEqualTo("String");
    assertThat(TypeNames.of(int.class)).isEqualTo("int");
    assertThat(TypeNames.of(int[][].class)).isEqualTo("int[][]");
    assertThat(TypeNames.of(Outer.Inner.class)).isEqualTo("TypeNamesTest.Outer.Inner");
    assertThat(TypeNames.of(ArrayList.class)).isEqualTo("ArrayList");
  }

  @Test
  public void testParameterizedTypes() throws Exception {
    assertThat(name(new TypeToken<List<String>>() {})).isEqualTo("List<String>");
    assertThat(name(new TypeToken<Map<String, List<Integer>>>() {}))
        .isEqualTo("Map<String, List<Integer>>");
    assertThat(name(new TypeToken<Box<Outer>>() {}))
        .isEqualTo("TypeNamesTest.Box<TypeNamesTest.Outer>");
    assertThat(name(new TypeToken<List<String>[]>() {})).isEqualTo("List<String>[]");
  }

  @Test
  public void testWildcardsAndVariables() throws Exception {
    assertThat(name(new TypeToken<List<?>>() {})).isEqualTo("List<?>");
    assertThat(name(new TypeToken<List<? extends Number>>() {}))
        .isEqualTo("List<? extends Number>");
    assertThat(name(new TypeToken<List<? super Integer>>() {}))
        .isEqualTo("List<? super Integer>");
    assertThat(TypeNames.of(Box.class.getTypeParameters()[0])).isEqualTo("T");
  }

  @Test
  public void testHiddenImplementationsUseTheirInterface() throws Exception {
    assertThat(TypeNames.of(List.of(1, 2).getClass())).isEqualTo("List");
    assertThat(TypeNames.of(Arrays.asList(1, 2).getClass())).isEqualTo("List");
    assertThat(TypeNames.of(Map.of("a", 1).getClass())).isEqualTo("Map");
  }

  @Test
  public void testLambdaIsNamedByItsInterface() throws Exception {
    Supplier<String> s = () -> "x";
    assertThat(TypeNames.of(s.getClass())).isEqualTo("Supplier");
  }

  @Test
  public void testAnonymousClassIsNamedBySupertype() throws Exception {
    Runnable r =
        new Runnable() {
          @Override
          public void run() {}
        };
    assertThat(TypeNames.of(r.getClass())).isEqualTo("Runnable");
  }
}
