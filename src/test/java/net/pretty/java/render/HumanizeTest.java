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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.pretty.java.annot.PrettyTag;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of humanized rendering: no types, quotes or brackets, and field directives apply. */
@RunWith(JUnit4.class)
public final class HumanizeTest {

  private static final RenderConfig HUMANIZE =
      RenderConfig.builder().setHumanize(true).build();

  private static final RenderConfig HUMANIZE_SPACED =
      HUMANIZE.toBuilder().setNewlineAfterItems(true).build();

  static class Person {
    String name = "ed";
    @PrettyTag(",omitempty")
    int age = 0;
  }

  static class Profile {
    String name = "ed";

    @PrettyTag(",omitempty")
    List<String> nicknames = new ArrayList<>();

    List<String> aliases = new ArrayList<>();

    @PrettyTag("home,omitempty")
    Server server = null;
  }

  static class Account {
    @PrettyTag("User Name")
    String user = "ann";

    @PrettyTag("-")
    String password = "secret";

    @PrettyTag("bad\"name")
    int id = 7;
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

  static class Cluster {
    List<Server> servers = List.of(new Server("a", 80), new Server("b", 81));
    String name = "c1";
  }

  static class Note {
    String text = "  ";
    String empty = "";
  }

  static class Scores {
    Map<String, Integer> scores = new LinkedHashMap<>();

    Scores() {
      scores.put("a", 1);
      scores.put("b", 22);
    }
  }

  private static String render(Object x) {
    return Pretty.toString(x, HUMANIZE);
  }

  @Test
  public void testScalarsAreBare() throws Exception {
    assertThat(render(5)).isEqualTo("5");
    assertThat(render("ed")).isEqualTo("ed");
    assertThat(render(true)).isEqualTo("true");
    assertThat(render(null)).isEqualTo("nil");
  }

  @Test
  public void testBlankStringsAreQuoted() throws Exception {
    assertThat(render("  ")).isEqualTo("\"  \"");
    assertThat(render(new Note())).isEqualTo("text:  \"  \"\nempty: \n");
  }

  @Test
  public void testZeroNumberIsNotEmpty() throws Exception {
    assertThat(render(new Person())).isEqualTo("name: ed\nage:  0\n");
  }

  @Test
  public void testOmitEmpty() throws Exception {
    String out = render(new Profile());
    assertThat(out).isEqualTo("name:    ed\naliases: \n");
    assertThat(out).doesNotContain("nicknames");
    assertThat(out).doesNotContain("home");
  }

  @Test
  public void testOmitEmptyKeepsNonEmptyValues() throws Exception {
    Profile p = new Profile();
    p.nicknames.add("eddie");
    assertThat(render(p)).contains("nicknames:");
    assertThat(render(p)).contains("eddie");
  }

  @Test
  public void testRenameHideAndInvalidName() throws Exception {
    String out = render(new Account());
    assertThat(out).isEqualTo("User Name: ann\nid:        7\n");
    assertThat(out).doesNotContain("secret");
  }

  @Test
  public void testNestedRecordsAreIndentedUnderTheirKey() throws Exception {
    Fleet fleet = new Fleet(new Server("a", 80), new Server("b", 81));
    assertThat(render(fleet))
        .isEqualTo(
            "primary: \n"
                + "    host: a\n"
                + "    port: 80\n"
                + "backup: \n"
                + "    host: b\n"
                + "    port: 81\n");
  }

  @Test
  public void testNullReferenceIsNil() throws Exception {
    Fleet fleet = new Fleet(new Server("a", 80), null);
    assertThat(render(fleet))
        .isEqualTo("primary: \n    host: a\n    port: 80\nbackup: nil\n");
  }

  @Test
  public void testMapEntries() throws Exception {
    assertThat(render(new Scores())).isEqualTo("scores: \n    a:  1\n    b:  22\n");
  }

  @Test
  public void testTopLevelSequence() throws Exception {
    assertThat(render(List.of("x", "y"))).isEqualTo("x\ny\n");
  }

  @Test
  public void testNoBlankLinesByDefault() throws Exception {
    assertThat(render(new Cluster()))
        .isEqualTo(
            "servers: \n"
                + "    host: a\n"
                + "    port: 80\n"
                + "    host: b\n"
                + "    port: 81\n"
                + "name: c1\n");
  }

  @Test
  public void testNewlineAfterItems() throws Exception {
    assertThat(Pretty.toString(new Cluster(), HUMANIZE_SPACED))
        .isEqualTo(
            "servers: \n"
                + "    host: a\n"
                + "    port: 80\n"
                + "    host: b\n"
                + "    port: 81\n"
                + "\n"
                + "name: c1\n");
  }
}
