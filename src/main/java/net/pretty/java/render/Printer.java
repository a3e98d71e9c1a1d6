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

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.flogger.GoogleLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.IOException;
import java.io.Writer;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.pretty.java.render.RecordDescriptor.FieldDescriptor;
import net.pretty.java.text.IndentWriter;
import net.pretty.java.text.TabWriter;

/**
 * A printer of arbitrary values, in structured form for developers or humanized form for end
 * users.
 *
 * <p>A Printer serves a single render call: it owns the call's layout tracker and visitation
 * path, and lays out its output through a {@link TabWriter} so that the values of expanded
 * composites line up in a column. Output reaches the sink only when {@link #print} returns.
 */
public final class Printer {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private static final CharMatcher WHITESPACE = CharMatcher.whitespace();

  private final RenderConfig config;
  private final boolean humanize;
  private final LayoutTracker layout;
  private final VisitGuard guard;

  // The aligner of the current indentation scope, and the writer that feeds it.
  private final TabWriter tw;
  private final Writer out;

  private int depth;

  /** Creates a printer that writes to {@code sink} as configured by {@code config}. */
  public Printer(Appendable sink, RenderConfig config) {
    this.config = Preconditions.checkNotNull(config);
    this.humanize = config.humanize();
    this.layout = new LayoutTracker(humanize, config.newlineAfterItems());
    this.guard = new VisitGuard();
    this.tw = new TabWriter(sink, config.indentWidth(), 1, ' ');
    this.out = tw;
    this.depth = 0;
  }

  private Printer(Printer parent, TabWriter tw, Writer out) {
    this.config = parent.config;
    this.humanize = parent.humanize;
    this.layout = parent.layout;
    this.guard = parent.guard;
    this.tw = tw;
    this.out = out;
    this.depth = parent.depth;
  }

  /**
   * Renders {@code v} and flushes the pending layout to the sink.
   *
   * @param showType whether a top-level scalar or composite is prefixed by its type name
   * @param quote whether a top-level string is quoted
   */
  @CanIgnoreReturnValue
  public Printer print(Value v, boolean showType, boolean quote) throws IOException {
    printValue(v, showType, quote);
    tw.flush();
    return this;
  }

  /** Returns a printer for one level of indentation below this one. */
  private Printer indent() {
    TabWriter child = new TabWriter(out, config.indentWidth(), 1, ' ');
    return new Printer(this, child, new IndentWriter(child, "\t"));
  }

  // -- writes --

  private void writeBracket(char c) throws IOException {
    if (layout.bracket(c)) {
      out.write(c);
    }
  }

  private void writeChar(char c) throws IOException {
    layout.text(c);
    out.write(c);
  }

  private void writeString(String s) throws IOException {
    layout.text(s);
    out.write(s);
  }

  // Writes what follows item i of n in a composite.
  private void writeSeparator(boolean expand, int i, int n) throws IOException {
    if (humanize) {
      if (layout.newlineNeeded()) {
        writeChar('\n');
      }
    } else if (expand) {
      writeString(",\n");
    } else if (i < n - 1) {
      writeString(", ");
    }
  }

  // -- values --

  private void printValue(Value v, boolean showType, boolean quote) throws IOException {
    if (VisitGuard.depthExceeded(depth)) {
      logger.atFinest().log("depth limit reached at %s", v);
      writeString(VisitGuard.DEPTH_EXCEEDED);
      return;
    }
    if (humanize) {
      showType = false;
      quote = false;
    }

    Object x = v.object();
    if (x == null && v.kind() != ValueKind.REFERENCE) {
      printNil(v, showType);
      return;
    }

    switch (v.kind()) {
      case BOOL, INT, UINT, FLOAT, COMPLEX, ADDRESS, OPAQUE ->
          printInline(v, Literals.of(v.kind(), x), showType);
      case STRING -> printString(x.toString(), quote);
      case MAP -> printMap(v, showType);
      case SEQUENCE -> printSequence(v, showType);
      case RECORD -> printRecord(v, showType);
      case ANY -> printAny(v, showType);
      case REFERENCE -> printReference(v);
      case CHANNEL -> {
        String handle = Literals.handle(x);
        if (showType) {
          writeString("(" + v.typeName() + ")(" + handle + ")");
        } else {
          writeString(handle);
        }
      }
      case FUNCTION -> writeString(v.typeName() + " {...}");
      case INVALID -> writeString("nil");
    }
  }

  // Prints a null of any kind but REFERENCE.
  private void printNil(Value v, boolean showType) throws IOException {
    if (showType && (v.kind() == ValueKind.SEQUENCE || v.kind() == ValueKind.MAP)) {
      writeString(v.typeName());
      writeString("(nil)");
    } else {
      writeString("nil");
    }
  }

  private void printInline(Value v, String literal, boolean showType) throws IOException {
    if (showType && !humanize) {
      writeString(v.typeName());
      writeString("(" + literal + ")");
    } else if (humanize && !literal.isEmpty() && WHITESPACE.matchesAllOf(literal)) {
      writeString("\"" + literal + "\"");
    } else {
      writeString(literal);
    }
  }

  private void printString(String s, boolean quote) throws IOException {
    if (quote || (humanize && !s.isEmpty() && WHITESPACE.matchesAllOf(s))) {
      s = Literals.quote(s);
    }
    writeString(s);
  }

  private void printCycle(Value v) throws IOException {
    logger.atFinest().log("cycle detected at %s", v);
    printString(v.typeName() + VisitGuard.CYCLIC_REFERENCE, false);
  }

  private void printMap(Value v, boolean showType) throws IOException {
    Map<?, ?> map = (Map<?, ?>) v.object();
    if (!guard.push(map, map.getClass())) {
      printCycle(v);
      return;
    }
    try {
      if (showType && !humanize) {
        writeString(v.typeName());
      }
      writeBracket('{');
      if (humanize || !map.isEmpty()) {
        printEntries(v, map);
      }
      writeBracket('}');
    } finally {
      guard.pop();
    }
  }

  private void printEntries(Value v, Map<?, ?> map) throws IOException {
    Type keyType = Value.mapKeyType(v.type());
    Type valueType = Value.mapValueType(v.type());
    boolean expand = !Inlining.canInline(v, humanize);
    Printer pp = this;
    if (expand && layout.indentNeeded()) {
      writeChar('\n');
      pp = indent();
    }
    List<Map.Entry<?, ?>> entries = new ArrayList<>(map.entrySet());
    boolean showValueType = !humanize && ValueKind.of(valueType) == ValueKind.ANY;
    for (int i = 0; i < entries.size(); i++) {
      Map.Entry<?, ?> e = entries.get(i);
      pp.printValue(Value.declared(keyType, e.getKey()), false, true);
      pp.writeChar(':');
      if (expand) {
        pp.writeChar('\t');
      }
      pp.printValue(Value.declared(valueType, e.getValue()), showValueType, true);
      pp.writeSeparator(expand, i, entries.size());
    }
    if (expand) {
      pp.tw.flush();
    }
  }

  private void printSequence(Value v, boolean showType) throws IOException {
    Object seq = v.object();
    if (!guard.push(seq, seq.getClass())) {
      printCycle(v);
      return;
    }
    try {
      if (showType) {
        writeString(v.typeName());
      }
      writeBracket('{');
      Type elemType = Value.elementType(v.type());
      boolean expand = !Inlining.canInline(v, humanize);
      Printer pp = this;
      if (expand && layout.indentNeeded()) {
        writeChar('\n');
        pp = indent();
      }
      List<Object> elems = v.elements();
      boolean showElemType = !humanize && ValueKind.of(elemType) == ValueKind.ANY;
      for (int i = 0; i < elems.size(); i++) {
        pp.printValue(Value.declared(elemType, elems.get(i)), showElemType, true);
        pp.writeSeparator(expand, i, elems.size());
      }
      if (expand) {
        pp.tw.flush();
      }
      writeBracket('}');
    } finally {
      guard.pop();
    }
  }

  private void printRecord(Value v, boolean showType) throws IOException {
    Object x = v.object();
    RecordDescriptor desc = RecordDescriptor.of(x.getClass());
    if (desc.isOpaque()) {
      printInline(v, Literals.of(ValueKind.OPAQUE, x), showType);
      return;
    }
    if (!guard.push(x, x.getClass())) {
      printCycle(v);
      return;
    }
    try {
      if (showType && !humanize) {
        writeString(v.typeName());
      }
      writeBracket('{');
      if (humanize || !v.isZero()) {
        printFields(v, desc);
      }
      writeBracket('}');
    } finally {
      guard.pop();
    }
  }

  private void printFields(Value v, RecordDescriptor desc) throws IOException {
    boolean expand = !Inlining.canInline(v, humanize);
    Printer pp = this;
    if (expand && layout.indentNeeded()) {
      writeChar('\n');
      pp = indent();
    }
    List<FieldDescriptor> fields = desc.fields();
    for (int i = 0; i < fields.size(); i++) {
      FieldDescriptor f = fields.get(i);
      Value fv = v.field(f);
      String name = f.name();
      if (humanize) {
        FieldDirective directive = f.directive();
        if (directive.hidden() || (directive.omitEmpty() && fv.isEmpty())) {
          continue;
        }
        name = directive.displayName(name);
      }
      pp.writeString(name);
      pp.writeChar(':');
      if (expand) {
        pp.writeChar('\t');
      }
      boolean showFieldType = !humanize && Inlining.labelType(Value.fieldType(v.type(), f));
      pp.printValue(fv, showFieldType, true);
      pp.writeSeparator(expand, i, fields.size());
    }
    if (expand) {
      pp.tw.flush();
    }
  }

  private void printAny(Value v, boolean showType) throws IOException {
    Value concrete = v.unwrap();
    if (concrete == null) {
      writeString(v.typeName());
      writeString("(nil)");
      return;
    }
    depth++;
    try {
      printValue(concrete, showType, true);
    } finally {
      depth--;
    }
  }

  private void printReference(Value v) throws IOException {
    if (v.object() == null) {
      if (humanize) {
        writeString("nil");
      } else {
        writeString("(" + v.typeName() + ")(nil)");
      }
      return;
    }
    depth++;
    try {
      if (!humanize) {
        writeChar('&');
      }
      printValue(v.referent(), true, true);
    } finally {
      depth--;
    }
  }
}
