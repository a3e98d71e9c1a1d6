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
 * An opaque native address or handle, such as a pointer obtained through a foreign interface.
 * Addresses are rendered as hexadecimal numbers and never dereferenced.
 */
public final class Address {

  public static final Address NULL = new Address(0);

  private final long value;

  private Address(long value) {
    this.value = value;
  }

  public static Address of(long value) {
    return value == 0 ? NULL : new Address(value);
  }

  public long value() {
    return value;
  }

  @Override
  public boolean equals(Object that) {
    return this == that || (that instanceof Address a && value == a.value);
  }

  @Override
  public int hashCode() {
    return Long.hashCode(value);
  }

  @Override
  public String toString() {
    return "0x" + Long.toHexString(value);
  }
}
