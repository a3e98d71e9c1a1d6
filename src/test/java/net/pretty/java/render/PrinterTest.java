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

import com.google.common.primitives.UnsignedInteger;
import com.google.common.reflect.TypeToken;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of structured (non-humanized) rendering. */
@RunWith(JUnit4.class)
public final class PrinterTest {

  static class Person {
    String name;
    int age;

    Person(String name, int age) {
      this.name = name;
      this.age = age;
    }
  }

  static class Server {
    String host;
    int port;

    Server(String host, int port) {
      this.host = host;
      this.port = port;
    }
  }

  static class Fleet {
    Server primary;
    Server backup;

    Fleet(Server primary, Server backup) {
      this.primary = primary;
      this.backup = backup;
    }
  }

  static class Registry {
    String name;
    Map<String, Server> servers = new LinkedHashMap<>();

    Registry(String name) {
      this.name = name;
    }
  }

  static class Point {
    int x;
    int y;

    Point(int x, int y) {
      this.x = x;
      this.y = y;
    }
  }

  static class Holder {
    List<String> items;
    Map<String, Integer> counts;
    Integer boxed;
    Object any;
    Optional<String> maybe = Optional.empty();
  }

  static class Box {
    Object value;

    Box(Object value) {
      this.value = value;
    }
  }

  enum Color {
    RED,
    GREEN
  }

  static class Misc {
    Color color = Color.RED;
    Complex c = Complex.of(1, 2);
    UnsignedInteger u = UnsignedInteger.valueOf(7);
    Address addr = Address.of(0x7f);
    Runnable task = () -> {};
  }

  private static String render(Object x) {
    return Pretty.toString(x, RenderConfig.DEFAULT);
  }

  private static String render(Object x, TypeToken<?> type) throws IOException {
    StringBuilder buf = new StringBuilder();
    Pretty.render(buf, x, type, /*showType=*/ true, /*quote=*/ true, RenderConfig.DEFAULT);
    return buf.toString();
  }

  @Test
  public void testScalars() throws Exception {
    assertThat(render(5)).isEqualTo("Integer(5)");
    assertThat(render(-3L)).isEqualTo("Long(-3)");
    assertThat(render(true)).isEqualTo("Boolean(true)");
    assertThat(render(2.5)).isEqualTo("Double(2.5)");
    assertThat(render(Complex.of(1, -2.5))).isEqualTo("Complex((1.0-2.5i))");
    assertThat(render(UnsignedInteger.MAX_VALUE)).isEqualTo("UnsignedInteger(4294967295)");
    assertThat(render(Color.GREEN)).isEqualTo("PrinterTest.Color(GREEN)");
    assertThat(render(null)).isEqualTo("nil");
  }

  @Test
  public void testStringsAreQuotedButNeverTyped() throws Exception {
    assertThat(render("ed")).isEqualTo("\"ed\"");
    assertThat(render("a\"b\\c\n")).isEqualTo("\"a\\\"b\\\\c\\n\"");
    assertThat(render('x')).isEqualTo("\"x\"");
  }

  @Test
  public void testInlineRecord() throws Exception {
    assertThat(render(new Person("ed", 0))).isEqualTo("PrinterTest.Person{name:\"ed\", age:0}");
  }

  @Test
  public void testZeroRecordRendersEmpty() throws Exception {
    assertThat(render(new Point(0, 0))).isEqualTo("PrinterTest.Point{}");
    assertThat(render(new Point(1, 0))).isEqualTo("PrinterTest.Point{x:1, y:0}");
  }

  @Test
  public void testExpandedRecordAlignsFieldValues() throws Exception {
    Fleet fleet = new Fleet(new Server("a", 80), new Server("b", 81));
    assertThat(render(fleet))
        .isEqualTo(
            "PrinterTest.Fleet{\n"
                + "    primary: &PrinterTest.Server{host:\"a\", port:80},\n"
                + "    backup:  &PrinterTest.Server{host:\"b\", port:81},\n"
                + "}");
  }

  @Test
  public void testNullReference() throws Exception {
    Fleet fleet = new Fleet(new Server("a", 80), null);
    assertThat(render(fleet))
        .isEqualTo(
            "PrinterTest.Fleet{\n"
                + "    primary: &PrinterTest.Server{host:\"a\", port:80},\n"
                + "    backup:  (PrinterTest.Server)(nil),\n"
                + "}");
  }

  @Test
  public void testNullsAndEmptyOptional() throws Exception {
    assertThat(render(new Holder()))
        .isEqualTo(
            "PrinterTest.Holder{\n"
                + "    items:  nil,\n"
                + "    counts: nil,\n"
                + "    boxed:  nil,\n"
                + "    any:    nil,\n"
                + "    maybe:  Optional<String>(nil),\n"
                + "}");
  }

  @Test
  public void testNullSequenceShowsTypeWhenRequested() throws Exception {
    assertThat(render(null, new TypeToken<List<String>>() {})).isEqualTo("List<String>(nil)");
  }

  @Test
  public void testObjectFieldShowsConcreteType() throws Exception {
    assertThat(render(new Box(5))).isEqualTo("PrinterTest.Box{\n    value: Integer(5),\n}");
    assertThat(render(new Box("hi"))).isEqualTo("PrinterTest.Box{\n    value: \"hi\",\n}");
  }

  @Test
  public void testOpaqueKinds() throws Exception {
    assertThat(render(new Misc()))
        .isEqualTo(
            "PrinterTest.Misc{color:RED, c:(1.0+2.0i), u:7, addr:0x7f, task:Runnable {...}}");
  }

  @Test
  public void testScalarMapInlines() throws Exception {
    Map<String, Integer> map = new LinkedHashMap<>();
    map.put("k1", 1);
    map.put("k2", 2);
    map.put("k3", 3);
    assertThat(render(map, new TypeToken<Map<String, Integer>>() {}))
        .isEqualTo("Map<String, Integer>{\"k1\":1, \"k2\":2, \"k3\":3}");
  }

  @Test
  public void testRecordMapExpands() throws Exception {
    Map<String, Server> map = new LinkedHashMap<>();
    map.put("a", new Server("a", 80));
    map.put("bb", new Server("b", 81));
    assertThat(render(map, new TypeToken<Map<String, Server>>() {}))
        .isEqualTo(
            "Map<String, PrinterTest.Server>{\n"
                + "    \"a\":  &PrinterTest.Server{host:\"a\", port:80},\n"
                + "    \"bb\": &PrinterTest.Server{host:\"b\", port:81},\n"
                + "}");
  }

  @Test
  public void testEmptyMapStaysInline() throws Exception {
    Map<String, Server> servers = new LinkedHashMap<>();
    assertThat(render(servers, new TypeToken<Map<String, Server>>() {}))
        .isEqualTo("Map<String, PrinterTest.Server>{}");
    assertThat(render(new HashMap<>())).isEqualTo("HashMap{}");
  }

  @Test
  public void testEmptyMapField() throws Exception {
    assertThat(render(new Registry("r")))
        .isEqualTo("PrinterTest.Registry{\n    name:    \"r\",\n    servers: {},\n}");
  }

  @Test
  public void testSequences() throws Exception {
    assertThat(render(new int[] {1, 2, 3})).isEqualTo("int[]{1, 2, 3}");
    assertThat(render(Arrays.asList("a", "b"), new TypeToken<List<String>>() {}))
        .isEqualTo("List<String>{\"a\", \"b\"}");
  }

  @Test
  public void testObjectSequenceShowsElementTypes() throws Exception {
    List<Object> list = new ArrayList<>();
    list.add(1);
    list.add("two");
    list.add(null);
    assertThat(render(list))
        .isEqualTo("ArrayList{\n    Integer(1),\n    \"two\",\n    nil,\n}");
  }

  @Test
  public void testIndentWidth() throws Exception {
    RenderConfig config = RenderConfig.builder().setIndentWidth(2).build();
    assertThat(Pretty.toString(new Box(true), config))
        .isEqualTo("PrinterTest.Box{\n  value: Boolean(true),\n}");
  }

  @Test
  public void testDeterministic() throws Exception {
    Fleet fleet = new Fleet(new Server("a", 80), new Server("b", 81));
    assertThat(render(fleet)).isEqualTo(render(fleet));
  }
}
