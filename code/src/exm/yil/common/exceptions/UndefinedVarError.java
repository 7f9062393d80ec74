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

import exm.yil.frontend.Context;

/**
 * A variable or type variable was looked up that is not bound in the
 * context.  Names encountered while traversing a resolved program are
 * always bound, so this signals a traversal bug.
 */
public class UndefinedVarError extends YILRuntimeError
{
  public UndefinedVarError(String msg)
  {
    super(msg);
  }

  public static UndefinedVarError fromName(Context context, String varName) {
    return new UndefinedVarError("variable " + varName + " not visible " +
                                 context);
  }

  public static UndefinedVarError fromTypeVarName(Context context,
                                                  String typeVarName) {
    return new UndefinedVarError("type variable " + typeVarName +
                                 " not visible " + context);
  }

  private static final long serialVersionUID = 1L;
}
