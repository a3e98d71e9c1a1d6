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

package net.pretty.java.text;

import com.google.common.base.Preconditions;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

/**
 * A TabWriter aligns tab-terminated cells of consecutive lines into columns ("elastic
 * tabstops").
 *
 * <p>Text is split into cells at each {@code '\t'}; a line ends at {@code '\n'}. The last cell of a
 * line is not tab-terminated and so is not part of any column. A column block is a run of
 * consecutive lines that all have a cell in that column; every cell of a block is padded to the
 * width of the block, which is the widest cell plus {@code padding}, but at least {@code
 * minWidth}. Widths are counted in code points.
 *
 * <p>Text is buffered until {@link #flush}, or until a line without cells ends every pending
 * block. {@code flush} writes the formatted text to the underlying sink but does not flush the sink
 * itself, so that nested writers can hand aligned text up to an enclosing writer whose own
 * columns are still open.
 */
public final class TabWriter extends Writer {

  private final Appendable out;
  private final int minWidth;
  private final int padding;
  private final char padChar;

  // Buffered lines; the last one is the line being written.
  private final List<List<Cell>> lines = new ArrayList<>();
  private final StringBuilder cell = new StringBuilder();

  // Widths of the columns to the left of the one being formatted.
  private final List<Integer> widths = new ArrayList<>();

  private static final class Cell {
    final String text;
    final int width;

    Cell(String text) {
      this.text = text;
      this.width = text.codePointCount(0, text.length());
    }
  }

  /**
   * Creates a TabWriter.
   *
   * @param out the sink receiving aligned text
   * @param minWidth minimal width of a column, including padding
   * @param padding number of pad characters added to the widest cell of a column
   * @param padChar the character used for padding
   */
  public TabWriter(Appendable out, int minWidth, int padding, char padChar) {
    Preconditions.checkArgument(minWidth >= 0, "negative minWidth: %s", minWidth);
    Preconditions.checkArgument(padding >= 0, "negative padding: %s", padding);
    this.out = Preconditions.checkNotNull(out);
    this.minWidth = minWidth;
    this.padding = padding;
    this.padChar = padChar;
    reset();
  }

  @Override
  public void write(char[] cbuf, int off, int len) throws IOException {
    for (int i = off; i < off + len; i++) {
      char c = cbuf[i];
      switch (c) {
        case '\t' -> terminateCell();
        case '\n' -> {
          int cells = terminateCell();
          lines.add(new ArrayList<>());
          // A line with a single cell takes part in no column,
          // so everything buffered so far can be laid out now.
          if (cells == 1) {
            flushBuffer();
          }
        }
        default -> cell.append(c);
      }
    }
  }

  /** Lays out all buffered text and writes it to the sink. */
  @Override
  public void flush() throws IOException {
    if (cell.length() > 0) {
      terminateCell();
    }
    flushBuffer();
  }

  @Override
  public void close() throws IOException {
    flush();
  }

  private void reset() {
    lines.clear();
    lines.add(new ArrayList<>());
    cell.setLength(0);
    widths.clear();
  }

  // Ends the current cell, returning the number of cells in the current line.
  private int terminateCell() {
    List<Cell> line = lines.get(lines.size() - 1);
    line.add(new Cell(cell.toString()));
    cell.setLength(0);
    return line.size();
  }

  private void flushBuffer() throws IOException {
    format(0, lines.size());
    reset();
  }

  private void format(int line0, int line1) throws IOException {
    int column = widths.size();
    for (int i = line0; i < line1; i++) {
      if (column >= lines.get(i).size() - 1) {
        continue;
      }
      // Line i starts a block of lines having a cell in this column.
      writeLines(line0, i);
      line0 = i;

      int width = minWidth;
      for (; i < line1; i++) {
        List<Cell> line = lines.get(i);
        if (column >= line.size() - 1) {
          break;
        }
        width = Math.max(width, line.get(column).width + padding);
      }

      widths.add(width);
      format(line0, i);
      widths.remove(widths.size() - 1);
      line0 = i;
    }
    writeLines(line0, line1);
  }

  private void writeLines(int line0, int line1) throws IOException {
    for (int i = line0; i < line1; i++) {
      List<Cell> line = lines.get(i);
      for (int j = 0; j < line.size(); j++) {
        Cell c = line.get(j);
        out.append(c.text);
        if (j < widths.size()) {
          for (int k = c.width; k < widths.get(j); k++) {
            out.append(padChar);
          }
        }
      }
      if (i + 1 < lines.size()) {
        out.append('\n');
      }
    }
  }
}
