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

package exm.yil.common.exceptions;

import exm.yil.common.lang.Path;

/**
 * A path was looked up that does not exist in the program.
 * Callers may only query paths of a well-formed program.
 */
public class InvalidPathError extends YILRuntimeError {

  public InvalidPathError(String msg) {
    super(msg);
  }

  public static InvalidPathError notValid(Path path, String programName) {
    return new InvalidPathError("Path [" + path + "] not valid in " +
                                programName);
  }

  private static final long serialVersionUID = 1L;
}
