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

import java.util.List;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;

import exm.yil.common.exceptions.UndefinedVarError;
import exm.yil.common.exceptions.YILRuntimeError;
import exm.yil.common.lang.Decls.Decl;
import exm.yil.common.lang.ImportDirective;
import exm.yil.common.lang.LocalDecl;
import exm.yil.common.lang.Meta;
import exm.yil.common.lang.Path;
import exm.yil.common.lang.Program;
import exm.yil.common.lang.TypeArg;
import exm.yil.common.lang.Types.Type;

/**
 * Contextual information about a point in the traversal of a program:
 * the program itself, the declaration we are in, and the type
 * parameters and local variables visible there.
 *
 * Contexts are immutable.  Each operation returns a new context, so
 * contexts can be passed down a traversal and shared between branches.
 *
 * currentDecl is always a valid path in the program.
 */
public class Context {

  private final Program program;

  /**
   * Path of the declaration we have traversed into, e.g.
   * the root path at the top level, M.D in datatype D in module M
   */
  private final Path currentDecl;

  /** type parameters of enclosing declarations, innermost last */
  private final ImmutableList<TypeArg> typeParams;

  /** local variables declared so far, most recent last */
  private final ImmutableList<LocalDecl> vars;

  private final ContextPosition position;

  /** imports seen so far, most recent first */
  private final ImmutableList<ImportDirective> imports;

  private Context(Program program, Path currentDecl,
                  ImmutableList<TypeArg> typeParams,
                  ImmutableList<LocalDecl> vars, ContextPosition position,
                  ImmutableList<ImportDirective> imports) {
    this.program = program;
    this.currentDecl = currentDecl;
    this.typeParams = typeParams;
    this.vars = vars;
    this.position = position;
    this.imports = imports;
  }

  /**
   * Context at the top level of a program
   */
  public Context(Program program) {
    this(program, Path.root(), ImmutableList.<TypeArg>of(),
         ImmutableList.<LocalDecl>of(), ContextPosition.OTHER,
         ImmutableList.<ImportDirective>of());
  }

  /**
   * Dummy context over the empty program.  Only for printing fragments
   * that do not depend on their surroundings.
   */
  public static Context empty() {
    return new Context(Program.EMPTY);
  }

  public Program program() {
    return program;
  }

  public Path currentDecl() {
    return currentDecl;
  }

  public List<TypeArg> typeParams() {
    return typeParams;
  }

  public List<LocalDecl> vars() {
    return vars;
  }

  public ContextPosition position() {
    return position;
  }

  public List<ImportDirective> imports() {
    return imports;
  }

  /**
   * Traverse into a child declaration
   */
  public Context enter(String name) {
    return new Context(program, currentDecl.child(name), typeParams, vars,
                       position, imports);
  }

  public Context addTypeParams(List<TypeArg> tps) {
    return new Context(program, currentDecl,
        ImmutableList.<TypeArg>builder().addAll(typeParams).addAll(tps).build(),
        vars, position, imports);
  }

  public Context addTypeParamNames(List<String> names) {
    return addTypeParams(TypeArg.plain(names));
  }

  public Context add(List<LocalDecl> decls) {
    return new Context(program, currentDecl, typeParams,
        ImmutableList.<LocalDecl>builder().addAll(vars).addAll(decls).build(),
        position, imports);
  }

  /**
   * Add a single non-ghost local variable
   */
  public Context add(String name, Type type) {
    return add(ImmutableList.of(new LocalDecl(name, type, false)));
  }

  public Context setPosition(ContextPosition newPosition) {
    return new Context(program, currentDecl, typeParams, vars, newPosition,
                       imports);
  }

  public Context enterBody() {
    return setPosition(ContextPosition.BODY);
  }

  public Context addImport(ImportDirective directive) {
    return new Context(program, currentDecl, typeParams, vars, position,
        ImmutableList.<ImportDirective>builder().add(directive)
                                                .addAll(imports).build());
  }

  /**
   * Names encountered while traversing a resolved program are always
   * visible, so failure indicates a bug in the traversal.
   * @throws UndefinedVarError if not visible
   */
  public TypeArg lookupTypeParam(String name) {
    for (TypeArg ta: typeParams.reverse()) {
      if (ta.name.equals(name)) {
        return ta;
      }
    }
    throw UndefinedVarError.fromTypeVarName(this, name);
  }

  /**
   * @throws UndefinedVarError if not visible
   */
  public LocalDecl lookupLocalDecl(String name) {
    Optional<LocalDecl> result = lookupLocalDeclOpt(name);
    if (!result.isPresent()) {
      throw UndefinedVarError.fromName(this, name);
    }
    return result.get();
  }

  /**
   * @return the most recently declared variable of that name, if any
   */
  public Optional<LocalDecl> lookupLocalDeclOpt(String name) {
    for (LocalDecl ld: vars.reverse()) {
      if (ld.name.equals(name)) {
        return Optional.of(ld);
      }
    }
    return Optional.empty();
  }

  public Decl lookupCurrent() {
    return DeclResolver.lookupByPath(program, currentDecl);
  }

  public Meta currentMeta() {
    return lookupCurrent().meta();
  }

  /**
   * @return path of the innermost module containing the current
   *         declaration, the declaration itself if it is a module
   */
  public Path modulePath() {
    List<Decl> ancestors = DeclResolver.lookupAncestorsByPath(program,
                                                              currentDecl);
    // last is the pseudo-module for the whole program
    List<Decl> real = ancestors.subList(0, ancestors.size() - 1);
    for (int i = 0; i < real.size(); i++) {
      if (real.get(i).isModule()) {
        return new Path(currentDecl.names().subList(0, real.size() - i));
      }
    }
    throw new YILRuntimeError("no module path " + this);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("in declaration ");
    sb.append(currentDecl);
    Meta.Position pos = lookupCurrent().meta().position();
    if (pos != null) {
      sb.append("(").append(pos).append(")");
    }
    sb.append(" with type variables ");
    sb.append(StringUtils.join(typeParams, ","));
    sb.append(" and variables ");
    StringBuilder varNames = new StringBuilder();
    for (LocalDecl ld: vars) {
      if (varNames.length() > 0) {
        varNames.append(", ");
      }
      varNames.append(ld.name);
    }
    sb.append(varNames);
    return sb.toString();
  }
}
