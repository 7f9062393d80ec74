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

import exm.yil.common.lang.Exprs.Expr;
import exm.yil.common.lang.Types.Type;

/**
 * Output specification: typed variables and postconditions.
 *
 * An unnamed output type is represented as a single anonymous
 * variable so that named and unnamed outputs can be treated alike.
 */
public class OutputSpec {

  public static final OutputSpec EMPTY =
      new OutputSpec(ImmutableList.<LocalDecl>of(), ImmutableList.<Expr>of());

  public final ImmutableList<LocalDecl> decls;
  public final ImmutableList<Expr> conditions;

  public OutputSpec(List<LocalDecl> decls, List<? extends Expr> conditions) {
    this.decls = ImmutableList.copyOf(decls);
    this.conditions = ImmutableList.copyOf(conditions);
  }

  /**
   * OutputSpec with a plain return type
   */
  public static OutputSpec ofType(Type t, List<? extends Expr> conditions) {
    return new OutputSpec(ImmutableList.of(
        new LocalDecl(LocalDecl.ANONYMOUS, t, false)), conditions);
  }

  /**
   * @return the unnamed output type, or null if outputs are named
   */
  public Type outputType() {
    if (decls.size() == 1 && decls.get(0).isAnonymous()) {
      return decls.get(0).type;
    }
    return null;
  }

  /**
   * @return the output declarations without the dummy declaration for
   *          an unnamed output type
   */
  public List<LocalDecl> namedDecls() {
    ImmutableList.Builder<LocalDecl> result = ImmutableList.builder();
    for (LocalDecl ld: decls) {
      if (!ld.isAnonymous()) {
        result.add(ld);
      }
    }
    return result.build();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof OutputSpec)) {
      return false;
    }
    OutputSpec other = (OutputSpec)obj;
    return decls.equals(other.decls) && conditions.equals(other.conditions);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(decls, conditions);
  }
}
