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
package exm.yil.dafnybackend;

import org.apache.commons.lang3.StringUtils;

/**
 * Indentation of printed text.  Nested text is printed flat and then
 * shifted by one unit as a whole.
 */
public class Indentation {

  public static final int DEFAULT_WIDTH = 2;

  public static final Indentation DEFAULT = new Indentation(DEFAULT_WIDTH);

  private final String unit;

  public Indentation(int width) {
    this.unit = StringUtils.repeat(' ', width);
  }

  public String unit() {
    return unit;
  }

  /**
   * Starts s on a new line and indents every line of it by one unit
   * @param braced if true, wrap the result in braces followed by a newline
   */
  public String indented(String s, boolean braced) {
    String shifted = ("\n" + s).replace("\n", "\n" + unit);
    if (braced) {
      return " {" + shifted + "\n}\n";
    }
    return shifted;
  }

  public String indentedBraced(String s) {
    return indented(s, true);
  }
}
