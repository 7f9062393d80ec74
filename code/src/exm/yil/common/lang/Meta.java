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

/**
 * Meta-information attached to declarations: a comment, a source
 * position and a raw prelude string.
 *
 * All Meta objects are equal to each other and share one hash code,
 * so that structural comparison of trees ignores them.
 */
public class Meta {

  public static final Meta EMPTY = new Meta(null, null, "");

  /** may be null */
  private final String comment;
  /** may be null */
  private final Position position;
  private final String prelude;

  public Meta(String comment, Position position, String prelude) {
    this.comment = comment;
    this.position = position;
    this.prelude = prelude == null ? "" : prelude;
  }

  public static Meta withComment(String comment) {
    return new Meta(comment, null, "");
  }

  public static Meta withPrelude(String prelude) {
    return new Meta(null, null, prelude);
  }

  public String comment() {
    return comment;
  }

  public Position position() {
    return position;
  }

  public String prelude() {
    return prelude;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Meta;
  }

  @Override
  public int hashCode() {
    return 0;
  }

  @Override
  public String toString() {
    return "Meta(" + (position == null ? "?" : position) + ")";
  }

  /**
   * Position in a source file
   */
  public static class Position {
    public final String filename;
    /** character offset in file */
    public final int offset;
    public final int line;
    public final int col;

    public Position(String filename, int offset, int line, int col) {
      this.filename = filename;
      this.offset = offset;
      this.line = line;
      this.col = col;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Position)) {
        return false;
      }
      Position other = (Position)obj;
      return Objects.equal(filename, other.filename) &&
             offset == other.offset && line == other.line && col == other.col;
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(filename, offset, line, col);
    }

    @Override
    public String toString() {
      return filename + "@" + line + ":" + col;
    }
  }
}
