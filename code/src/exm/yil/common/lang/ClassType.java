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

import org.apache.commons.lang3.StringUtils;

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

import exm.yil.common.lang.Types.Type;

/**
 * A reference to a module or class with all its type parameters
 * instantiated
 */
public class ClassType {
  public final Path path;
  public final ImmutableList<Type> typeArgs;

  public ClassType(Path path, List<? extends Type> typeArgs) {
    this.path = path;
    this.typeArgs = ImmutableList.copyOf(typeArgs);
  }

  public ClassType(Path path) {
    this(path, ImmutableList.<Type>of());
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ClassType)) {
      return false;
    }
    ClassType other = (ClassType)obj;
    return path.equals(other.path) && typeArgs.equals(other.typeArgs);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(path, typeArgs);
  }

  @Override
  public String toString() {
    if (typeArgs.isEmpty()) {
      return path.toString();
    }
    return path + "<" + StringUtils.join(typeArgs, ",") + ">";
  }
}
