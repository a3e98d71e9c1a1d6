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
import java.io.Flushable;
import java.io.IOException;
import java.io.Writer;

/**
 * An IndentWriter writes a fixed prefix before the first character of every line it passes on,
 * empty lines included.
 */
public final class IndentWriter extends Writer {

  private final Appendable out;
  private final String prefix;
  private boolean atLineStart = true;

  public IndentWriter(Appendable out, String prefix) {
    this.out = Preconditions.checkNotNull(out);
    this.prefix = Preconditions.checkNotNull(prefix);
  }

  @Override
  public void write(char[] cbuf, int off, int len) throws IOException {
    for (int i = off; i < off + len; i++) {
      char c = cbuf[i];
      if (atLineStart) {
        out.append(prefix);
      }
      out.append(c);
      atLineStart = c == '\n';
    }
  }

  @Override
  public void flush() throws IOException {
    if (out instanceof Flushable flushable) {
      flushable.flush();
    }
  }

  @Override
  public void close() throws IOException {
    flush();
  }
}
