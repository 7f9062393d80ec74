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

import com.google.common.base.Objects;

import exm.yil.common.lang.Types.Type;

/**
 * Typed variable declaration used in method inputs and outputs, binders
 * and local variable declarations.
 * Ghost declarations are only needed for specifications and proofs.
 */
public class LocalDecl {

  /** name of anonymous variables */
  public static final String ANONYMOUS = "_";

  public final String name;
  public final Type type;
  public final boolean ghost;

  public LocalDecl(String name, Type type, boolean ghost) {
    this.name = name;
    this.type = type;
    this.ghost = ghost;
  }

  public LocalDecl(String name, Type type) {
    this(name, type, false);
  }

  public boolean isAnonymous() {
    return name.equals(ANONYMOUS);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof LocalDecl)) {
      return false;
    }
    LocalDecl other = (LocalDecl)obj;
    return name.equals(other.name) && type.equals(other.type) &&
           ghost == other.ghost;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(name, type, ghost);
  }

  @Override
  public String toString() {
    return (ghost ? "ghost " : "") + name + ": " + type;
  }
}
