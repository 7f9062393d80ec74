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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableList;

import exm.yil.common.Logging;
import exm.yil.common.exceptions.InvalidPathError;
import exm.yil.common.lang.DatatypeConstructor;
import exm.yil.common.lang.Decls;
import exm.yil.common.lang.Decls.Datatype;
import exm.yil.common.lang.Decls.Decl;
import exm.yil.common.lang.Decls.DeclKind;
import exm.yil.common.lang.Decls.Field;
import exm.yil.common.lang.LocalDecl;
import exm.yil.common.lang.Meta;
import exm.yil.common.lang.Path;
import exm.yil.common.lang.Program;
import exm.yil.common.lang.Types;

/**
 * Resolves paths to declarations.
 *
 * Besides the declarations written in the program, some declarations
 * exist implicitly: a datatype has a field for every constructor
 * argument and a tester C? for every constructor C.  These are found
 * by lookups but are not stored in the program.
 *
 * All lookups are pure; nothing is cached.
 */
public class DeclResolver {

  private static final Logger logger = Logging.getYILLogger();

  /** the name of the tester for constructor c */
  public static String testerName(String ctor) {
    return ctor + "?";
  }

  /**
   * The declarations implied by a declaration, i.e. the destructors and
   * testers of a datatype.  For modules, the implicit children of all
   * children.
   */
  public static List<Decl> implicitChildren(Decl d) {
    if (d.kind() == DeclKind.DATATYPE) {
      return datatypeImplicitChildren((Datatype)d);
    } else if (d.kind() == DeclKind.MODULE) {
      List<Decl> result = new ArrayList<Decl>();
      for (Decl child: d.children()) {
        result.addAll(implicitChildren(child));
      }
      return result;
    } else {
      return ImmutableList.of();
    }
  }

  private static List<Decl> datatypeImplicitChildren(Datatype dt) {
    List<Decl> result = new ArrayList<Decl>();
    // several constructors may share an argument; first occurrence wins
    Set<String> seen = new HashSet<String>();
    for (DatatypeConstructor c: dt.constructors) {
      for (LocalDecl ld: c.inputs) {
        if (seen.add(ld.name)) {
          result.add(new Field(ld.name, ld.type, null, ld.ghost, false, false,
                               Meta.EMPTY));
        }
      }
    }
    for (DatatypeConstructor c: dt.constructors) {
      result.add(new Field(testerName(c.name), Types.BOOL, null, false,
                           false, false, Meta.EMPTY));
    }
    return result;
  }

  /**
   * The program itself acts as a module containing the top-level
   * declarations.
   */
  public static Decl rootModule(Program prog) {
    return new Decls.Module(prog.name, prog.decls, Meta.EMPTY);
  }

  /**
   * Looks up a declaration and all its ancestors.
   * @return the chain of declarations from the target up to the root
   *         module, target first
   * @throws InvalidPathError if the path does not resolve
   */
  public static List<Decl> lookupAncestorsByPath(Program prog, Path p) {
    if (p.isRoot()) {
      return ImmutableList.of(rootModule(prog));
    }
    List<Decl> ancestors = lookupAncestorsByPath(prog, p.parent());
    Decl parent = ancestors.get(0);
    String name = p.name();
    Decl found = findByName(parent.children(), name);
    if (found == null) {
      found = findByName(implicitChildren(parent), name);
      if (found != null && logger.isTraceEnabled()) {
        logger.trace("Resolved " + p + " to implicit child of " +
                     parent.name());
      }
    }
    if (found == null) {
      throw InvalidPathError.notValid(p, prog.name);
    }
    return ImmutableList.<Decl>builder().add(found)
                                        .addAll(ancestors).build();
  }

  private static Decl findByName(List<Decl> decls, String name) {
    for (Decl d: decls) {
      if (d.name().equals(name)) {
        return d;
      }
    }
    return null;
  }

  /**
   * @throws InvalidPathError if the path does not resolve
   */
  public static Decl lookupByPath(Program prog, Path p) {
    return lookupAncestorsByPath(prog, p).get(0);
  }

  /**
   * Looks up a datatype constructor, e.g. M.D.C for constructor C of
   * datatype M.D.
   * @throws InvalidPathError if the parent is not a datatype or has no
   *         such constructor
   */
  public static DatatypeConstructor lookupConstructor(Program prog, Path p) {
    Decl parent = lookupByPath(prog, p.parent());
    if (parent.kind() != DeclKind.DATATYPE) {
      throw new InvalidPathError("Parent of constructor " + p +
                                 " is not a datatype: " + parent);
    }
    for (DatatypeConstructor c: ((Datatype)parent).constructors) {
      if (c.name.equals(p.name())) {
        return c;
      }
    }
    throw new InvalidPathError("Constructor " + p + " not found in " +
                               prog.name);
  }
}
