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

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.Immutable;
import java.util.Objects;

/**
 * A RenderConfig is an immutable set of options that affect how values are rendered.
 *
 * <p>Two configurations are equal if all their options are equal. A RenderConfig is read once at
 * the start of each render call; see {@link Pretty} for the process-wide default.
 */
@Immutable
public final class RenderConfig {

  /** The configuration in which every option has its default value. */
  public static final RenderConfig DEFAULT = builder().build();

  private static final int DEFAULT_INDENT_WIDTH = 4;

  private final int indentWidth;
  private final String outputPrefix;
  private final boolean humanize;
  private final boolean newlineAfterItems;

  private RenderConfig(Builder b) {
    this.indentWidth = b.indentWidth;
    this.outputPrefix = b.outputPrefix;
    this.humanize = b.humanize;
    this.newlineAfterItems = b.newlineAfterItems;
  }

  /** Returns the number of columns of one indentation step. Always positive. */
  public int indentWidth() {
    return indentWidth;
  }

  /**
   * Returns the text prepended to every line of the final output of the convenience functions in
   * {@link Pretty}. The core printer does not apply it.
   */
  public String outputPrefix() {
    return outputPrefix;
  }

  /**
   * Reports whether output is for end users rather than developers: no type names, quotes or
   * brackets, and field directives are honoured.
   */
  public boolean humanize() {
    return humanize;
  }

  /** Reports whether humanized output separates sibling composite items with a blank line. */
  public boolean newlineAfterItems() {
    return newlineAfterItems;
  }

  /** Returns a new builder that initially holds the options of this RenderConfig. */
  public Builder toBuilder() {
    Builder b = new Builder();
    b.indentWidth = indentWidth;
    b.outputPrefix = outputPrefix;
    b.humanize = humanize;
    b.newlineAfterItems = newlineAfterItems;
    return b;
  }

  /** Returns a new builder holding the default options. */
  public static Builder builder() {
    return new Builder();
  }

  /** A Builder is a mutable container used to construct an immutable RenderConfig. */
  public static final class Builder {
    private int indentWidth = DEFAULT_INDENT_WIDTH;
    private String outputPrefix = "";
    private boolean humanize;
    private boolean newlineAfterItems;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder setIndentWidth(int indentWidth) {
      this.indentWidth = indentWidth;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setOutputPrefix(String outputPrefix) {
      this.outputPrefix = Preconditions.checkNotNull(outputPrefix);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setHumanize(boolean humanize) {
      this.humanize = humanize;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setNewlineAfterItems(boolean newlineAfterItems) {
      this.newlineAfterItems = newlineAfterItems;
      return this;
    }

    /**
     * Returns an immutable RenderConfig.
     *
     * @throws IllegalArgumentException if the indent width is not positive
     */
    public RenderConfig build() {
      Preconditions.checkArgument(
          indentWidth > 0, "indent width must be positive, got %s", indentWidth);
      return new RenderConfig(this);
    }
  }

  @Override
  public int hashCode() {
    return Objects.hash(indentWidth, outputPrefix, humanize, newlineAfterItems);
  }

  @Override
  public boolean equals(Object that) {
    if (this == that) {
      return true;
    }
    if (!(that instanceof RenderConfig)) {
      return false;
    }
    RenderConfig other = (RenderConfig) that;
    return indentWidth == other.indentWidth
        && outputPrefix.equals(other.outputPrefix)
        && humanize == other.humanize
        && newlineAfterItems == other.newlineAfterItems;
  }

  /** Returns a representation of the options that differ from their defaults. */
  @Override
  public String toString() {
    MoreObjects.ToStringHelper helper = MoreObjects.toStringHelper(this);
    if (humanize) {
      helper.add("humanize", true);
    }
    if (newlineAfterItems) {
      helper.add("newlineAfterItems", true);
    }
    if (indentWidth != DEFAULT_INDENT_WIDTH) {
      helper.add("indentWidth", indentWidth);
    }
    if (!outputPrefix.isEmpty()) {
      helper.add("outputPrefix", outputPrefix);
    }
    return helper.toString();
  }
}
