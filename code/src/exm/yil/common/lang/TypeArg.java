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

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Objects;

import exm.yil.common.lang.Types.Type;

/**
 * A type parameter of a declaration, with its variance and whether it
 * may only be instantiated with types that support equality
 */
public class TypeArg {

  public static enum Variance {
    NONE, COVARIANT, CONTRAVARIANT;
  }

  public final String name;
  public final Variance variance;
  public final boolean requiresEquality;

  public TypeArg(String name, Variance variance, boolean requiresEquality) {
    this.name = name;
    this.variance = variance;
    this.requiresEquality = requiresEquality;
  }

  /** invariant type argument given by name */
  public static TypeArg plain(String name) {
    return new TypeArg(name, Variance.NONE, false);
  }

  public static List<TypeArg> plain(List<String> names) {
    List<TypeArg> result = new ArrayList<TypeArg>(names.size());
    for (String name: names) {
      result.add(plain(name));
    }
    return result;
  }

  /** the corresponding list of type variables */
  public static List<Type> toTypeVars(List<TypeArg> typeArgs) {
    List<Type> result = new ArrayList<Type>(typeArgs.size());
    for (TypeArg ta: typeArgs) {
      result.add(Types.typeVar(ta.name));
    }
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof TypeArg)) {
      return false;
    }
    TypeArg other = (TypeArg)obj;
    return name.equals(other.name) && variance == other.variance &&
           requiresEquality == other.requiresEquality;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(name, variance, requiresEquality);
  }

  @Override
  public String toString() {
    return name;
  }
}
