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

/**
 * An immutable complex number with double-precision parts.
 *
 * <p>Its string form is the literal {@code (re+imi)}, e.g. {@code (1.0-2.5i)}.
 */
public final class Complex {

  private final double re;
  private final double im;

  private Complex(double re, double im) {
    this.re = re;
    this.im = im;
  }

  public static Complex of(double re, double im) {
    return new Complex(re, im);
  }

  public double re() {
    return re;
  }

  public double im() {
    return im;
  }

  boolean isZero() {
    return re == 0 && im == 0;
  }

  @Override
  public boolean equals(Object that) {
    return this == that
        || (that instanceof Complex c
            && Double.compare(re, c.re) == 0
            && Double.compare(im, c.im) == 0);
  }

  @Override
  public int hashCode() {
    return 31 * Double.hashCode(re) + Double.hashCode(im);
  }

  @Override
  public String toString() {
    String imag = Double.toString(im);
    if (!imag.startsWith("-")) {
      imag = "+" + imag;
    }
    return "(" + re + imag + "i)";
  }
}
