/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.yil.common.lang;

import java.util.List;

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

/**
 * Constructor of a datatype.  Each constructor yields a distinct
 * runtime tag, even if two are structurally identical.
 */
public class DatatypeConstructor {
  public final String name;
  public final ImmutableList<LocalDecl> inputs;
  public final Meta meta;

  public DatatypeConstructor(String name, List<LocalDecl> inputs,
                             Meta meta) {
    this.name = name;
    this.inputs = ImmutableList.copyOf(inputs);
    this.meta = meta;
  }

  public DatatypeConstructor(String name, List<LocalDecl> inputs) {
    this(name, inputs, Meta.EMPTY);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof DatatypeConstructor)) {
      return false;
    }
    DatatypeConstructor other = (DatatypeConstructor)obj;
    return name.equals(other.name) && inputs.equals(other.inputs);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(name, inputs);
  }

  @Override
  public String toString() {
    return name + inputs;
  }
}
