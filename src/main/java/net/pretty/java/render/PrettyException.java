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
import javax.annotation.Nullable;

/**
 * A PrettyException carries an error message built from rendered values. Use {@link
 * Pretty#errorf} to construct one from a format string.
 */
public class PrettyException extends Exception {

  /** Constructs a PrettyException with the given message. */
  public PrettyException(String message) {
    this(message, /*cause=*/ null);
  }

  /**
   * Constructs a PrettyException with a message and optional cause.
   *
   * <p>The cause does not affect the error message.
   */
  public PrettyException(String message, @Nullable Throwable cause) {
    super(Preconditions.checkNotNull(message), cause);
  }

  /** Returns the error message. Does not include the cause. */
  @Override
  public final String getMessage() {
    return super.getMessage();
  }
}
