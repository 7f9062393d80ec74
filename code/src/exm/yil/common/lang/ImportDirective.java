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

import exm.yil.common.exceptions.YILRuntimeError;

/**
 * A module import directive
 */
public class ImportDirective {

  public static enum ImportKind {
    /** import P */
    DEFAULT,
    /** import opened P */
    OPENED,
    /** import A = P */
    EQUALS;
  }

  public final ImportKind kind;
  /** only set for EQUALS, null otherwise */
  public final Path lhs;
  /** imported module */
  public final Path path;

  private ImportDirective(ImportKind kind, Path lhs, Path path) {
    this.kind = kind;
    this.lhs = lhs;
    this.path = path;
  }

  public static ImportDirective importDefault(Path p) {
    return new ImportDirective(ImportKind.DEFAULT, null, p);
  }

  public static ImportDirective importOpened(Path p) {
    return new ImportDirective(ImportKind.OPENED, null, p);
  }

  public static ImportDirective importEquals(Path lhs, Path rhs) {
    return new ImportDirective(ImportKind.EQUALS, lhs, rhs);
  }

  /**
   * @return the imported path; for an aliased import, its right-hand side
   */
  public Path getPath() {
    return path;
  }

  public boolean pathEquals(Path p) {
    return path.equals(p);
  }

  /**
   * @return the same import with the imported path prefixed
   *          (left-hand side of an alias unchanged)
   */
  public ImportDirective prefix(String pre) {
    return new ImportDirective(kind, lhs, path.prefix(pre));
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ImportDirective)) {
      return false;
    }
    ImportDirective other = (ImportDirective)obj;
    return kind == other.kind && Objects.equal(lhs, other.lhs) &&
           path.equals(other.path);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(kind, lhs, path);
  }

  @Override
  public String toString() {
    switch (kind) {
      case DEFAULT:
        return "import " + path;
      case OPENED:
        return "import opened " + path;
      case EQUALS:
        return "import " + lhs + " = " + path;
      default:
        throw new YILRuntimeError("Unknown import kind " + kind);
    }
  }
}
