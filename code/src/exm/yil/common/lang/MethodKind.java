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

/**
 * The kinds of method-like declarations.  The printer needs these
 * since each kind allows a different set of syntaxes.
 */
public enum MethodKind {
  METHOD("method", false),
  FUNCTION_METHOD("function method", false),
  FUNCTION("function", true),
  LEMMA("lemma", true),
  PREDICATE("predicate", true),
  PREDICATE_METHOD("predicate method", false);

  private final String keyword;
  private final boolean ghost;

  private MethodKind(String keyword, boolean ghost) {
    this.keyword = keyword;
    this.ghost = ghost;
  }

  /**
   * @return true if declarations of this kind are always ghost
   */
  public boolean isGhost() {
    return ghost;
  }

  /**
   * @return true if the result is given as a type after a colon
   *         rather than as named outputs after "returns"
   */
  public boolean isFunctionLike() {
    return this == FUNCTION || this == FUNCTION_METHOD;
  }

  public boolean isPredicate() {
    return this == PREDICATE || this == PREDICATE_METHOD;
  }

  /**
   * @return true if the body is a statement rather than an expression
   */
  public boolean hasStatementBody() {
    return this == METHOD || this == LEMMA;
  }

  @Override
  public String toString() {
    return keyword;
  }
}
