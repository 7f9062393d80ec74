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
package exm.yil.frontend;

/**
 * Where in a declaration the current traversal is.
 * Some constructs print differently depending on position.
 */
public enum ContextPosition {
  /** body of a method or function */
  BODY,
  /** declaration of the loop index of a for loop */
  IN_FOR_LOOP_INITIALIZER,
  IN_FOR_LOOP_BODY,
  /** left-hand side of a match case */
  PATTERN,
  OTHER;
}
