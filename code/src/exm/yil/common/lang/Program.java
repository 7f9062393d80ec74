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

import exm.yil.common.lang.Decls.Decl;

/**
 * Top-level of a YIL tree.
 * The program name corresponds to the package name or root namespace.
 * The declarations are the root-level declarations; the printer takes
 * the prelude to emit before them from the meta-information.
 */
public class Program {

  public static final Program EMPTY =
      new Program("", ImmutableList.<Decl>of(), Meta.EMPTY);

  public final String name;
  public final ImmutableList<Decl> decls;
  public final Meta meta;

  public Program(String name, List<? extends Decl> decls, Meta meta) {
    this.name = name;
    this.decls = ImmutableList.copyOf(decls);
    this.meta = meta;
  }

  public Program(String name, List<? extends Decl> decls) {
    this(name, decls, Meta.EMPTY);
  }

  /**
   * @return a copy of this program with the given declarations
   */
  public Program withDecls(List<? extends Decl> newDecls) {
    return new Program(name, newDecls, meta);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Program)) {
      return false;
    }
    Program other = (Program)obj;
    return name.equals(other.name) && decls.equals(other.decls);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(name, decls);
  }

  @Override
  public String toString() {
    return "program " + name + " (" + decls.size() + " declarations)";
  }
}
