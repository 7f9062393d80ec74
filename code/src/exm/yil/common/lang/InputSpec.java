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

/**
 * Input specification: typed variables and preconditions
 */
public class InputSpec {

  public static final InputSpec EMPTY =
      new InputSpec(ImmutableList.<LocalDecl>of(), ImmutableList.<Expr>of());

  public final ImmutableList<LocalDecl> decls;
  public final ImmutableList<Expr> conditions;

  public InputSpec(List<LocalDecl> decls, List<? extends Expr> conditions) {
    this.decls = ImmutableList.copyOf(decls);
    this.conditions = ImmutableList.copyOf(conditions);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof InputSpec)) {
      return false;
    }
    InputSpec other = (InputSpec)obj;
    return decls.equals(other.decls) && conditions.equals(other.conditions);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(decls, conditions);
  }
}
