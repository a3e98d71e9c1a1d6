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

package net.pretty.java.annot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * A directive controlling how a field appears in humanized output. It is ignored by structured
 * output, which always shows every field under its declared name.
 *
 * <p>The directive has the form {@code name[,option...]}:
 *
 * <ul>
 *   <li>{@code name}, if non-empty and made only of letters, digits, spaces and the punctuation
 *       {@code !#$%&()*+-./:<=>?@[]^_{|}~}, replaces the field name. Other names are ignored.
 *   <li>the option {@code omitempty} hides the field when its value is empty: a null reference,
 *       or a zero-length string, array, collection or map. Booleans and numbers are never empty.
 *   <li>the directive {@code "-"} hides the field always.
 * </ul>
 *
 * <p>Applied to the component of a Java record, the directive is carried by the component's field.
 */
@Documented
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface PrettyTag {

  /** The directive, e.g. {@code "Full Name"}, {@code ",omitempty"} or {@code "-"}. */
  String value();
}
