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

import java.util.Arrays;
import java.util.List;

import com.google.common.base.Predicate;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;

import exm.yil.common.lang.Exprs.Expr;
import exm.yil.common.lang.Types.Type;

/**
 * Declarations of the YIL language.
 *
 * Modules, datatypes and classes are child-bearing, i.e. they contain
 * nested declarations.  Each declaration is named uniquely within its
 * parent, so within a program each declaration is uniquely identified
 * by its {@link Path}.
 */
public class Decls {

  public static enum DeclKind {
    INCLUDE, MODULE, DATATYPE, CLASS, CLASS_CONSTRUCTOR, TYPE_DEF,
    FIELD, METHOD, IMPORT, EXPORT, UNIMPLEMENTED,
  }

  /** dummy for missing cases */
  public static final Decl UNIMPLEMENTED = new UnimplementedDecl();

  public abstract static class Decl {
    private final DeclKind kind;
    private final Meta meta;

    protected Decl(DeclKind kind, Meta meta) {
      this.kind = kind;
      this.meta = meta;
    }

    public DeclKind kind() {
      return kind;
    }

    public Meta meta() {
      return meta;
    }

    /**
     * @return the name, or the empty string for directives
     */
    public String name() {
      return "";
    }

    /** type parameters of this declaration */
    public List<TypeArg> typeParams() {
      return ImmutableList.of();
    }

    /** nested declarations of child-bearing declarations */
    public List<Decl> children() {
      return ImmutableList.of();
    }

    public boolean isModule() {
      return kind == DeclKind.MODULE;
    }

    /**
     * @return this declaration with only the children that satisfy the
     *         predicate; unchanged if not child-bearing
     */
    public Decl filterChildren(Predicate<? super Decl> mustPreserve) {
      return this;
    }

    /**
     * Components compared by structural equality.  Meta-information is
     * never among them.
     */
    protected abstract List<?> parts();

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      if (obj == null || obj.getClass() != getClass()) {
        return false;
      }
      return parts().equals(((Decl)obj).parts());
    }

    @Override
    public int hashCode() {
      return kind.hashCode() + 31 * parts().hashCode();
    }

    @Override
    public String toString() {
      return kind.toString().toLowerCase() + " " + name();
    }
  }

  /**
   * Preprocessor-like inclusion of another file
   */
  public static class Include extends Decl {
    public final Path path;

    public Include(Path path) {
      super(DeclKind.INCLUDE, Meta.EMPTY);
      this.path = path;
    }

    @Override
    protected List<?> parts() {
      return ImmutableList.of(path);
    }

    @Override
    public String toString() {
      return "include " + path;
    }
  }

  /**
   * Modules are just namespaces: no abstraction or inheritance.
   * Their children are statically visible via their qualified path.
   */
  public static class Module extends Decl {
    public final String name;
    public final ImmutableList<Decl> decls;

    public Module(String name, List<? extends Decl> decls, Meta meta) {
      super(DeclKind.MODULE, meta);
      this.name = name;
      this.decls = ImmutableList.copyOf(decls);
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public List<Decl> children() {
      return decls;
    }

    @Override
    public Decl filterChildren(Predicate<? super Decl> mustPreserve) {
      return new Module(name, filter(decls, mustPreserve), meta());
    }

    @Override
    protected List<?> parts() {
      return ImmutableList.of(name, decls);
    }
  }

  /**
   * Inductive types.  Two different constructors always produce different
   * values.  Members cannot be private, abstract or mutable.  If several
   * constructors have arguments of the same name, they have the same type.
   */
  public static class Datatype extends Decl {
    public final String name;
    public final ImmutableList<TypeArg> typeParams;
    public final ImmutableList<DatatypeConstructor> constructors;
    public final ImmutableList<Decl> members;

    public Datatype(String name, List<TypeArg> typeParams,
                    List<DatatypeConstructor> constructors,
                    List<? extends Decl> members, Meta meta) {
      super(DeclKind.DATATYPE, meta);
      this.name = name;
      this.typeParams = ImmutableList.copyOf(typeParams);
      this.constructors = ImmutableList.copyOf(constructors);
      this.members = ImmutableList.copyOf(members);
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public List<TypeArg> typeParams() {
      return typeParams;
    }

    @Override
    public List<Decl> children() {
      return members;
    }

    @Override
    public Decl filterChildren(Predicate<? super Decl> mustPreserve) {
      return new Datatype(name, typeParams, constructors,
                          filter(members, mustPreserve), meta());
    }

    @Override
    protected List<?> parts() {
      return ImmutableList.of(name, typeParams, constructors, members);
    }
  }

  /**
   * Classes and traits
   */
  public static class ClassDecl extends Decl {
    public final String name;
    public final boolean isTrait;
    public final ImmutableList<TypeArg> typeParams;
    public final ImmutableList<ClassType> superTypes;
    public final ImmutableList<Decl> members;

    public ClassDecl(String name, boolean isTrait, List<TypeArg> typeParams,
                     List<ClassType> superTypes, List<? extends Decl> members,
                     Meta meta) {
      super(DeclKind.CLASS, meta);
      this.name = name;
      this.isTrait = isTrait;
      this.typeParams = ImmutableList.copyOf(typeParams);
      this.superTypes = ImmutableList.copyOf(superTypes);
      this.members = ImmutableList.copyOf(members);
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public List<TypeArg> typeParams() {
      return typeParams;
    }

    @Override
    public List<Decl> children() {
      return members;
    }

    @Override
    public Decl filterChildren(Predicate<? super Decl> mustPreserve) {
      return new ClassDecl(name, isTrait, typeParams, superTypes,
                           filter(members, mustPreserve), meta());
    }

    @Override
    protected List<?> parts() {
      return ImmutableList.of(name, isTrait, typeParams, superTypes, members);
    }
  }

  /**
   * Class constructor, as opposed to the default constructor of a
   * datatype
   */
  public static class ClassConstructor extends Decl {
    /** name given to anonymous constructors by the front-end */
    public static final String DEFAULT_NAME = "_ctor";

    public final String name;
    public final ImmutableList<TypeArg> typeParams;
    public final InputSpec ins;
    public final ImmutableList<Expr> ensures;
    /** null if no body */
    public final Expr body;

    public ClassConstructor(String name, List<TypeArg> typeParams,
                            InputSpec ins, List<? extends Expr> ensures,
                            Expr body, Meta meta) {
      super(DeclKind.CLASS_CONSTRUCTOR, meta);
      this.name = name;
      this.typeParams = ImmutableList.copyOf(typeParams);
      this.ins = ins;
      this.ensures = ImmutableList.copyOf(ensures);
      this.body = body;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public List<TypeArg> typeParams() {
      return typeParams;
    }

    @Override
    protected List<?> parts() {
      return Arrays.asList(name, typeParams, ins, ensures, body);
    }
  }

  /**
   * Type definitions.
   * With a predicate: HOL-style subset type {x: superType | predicate(x)}
   * (without witness), otherwise a type synonym.
   * If isNewType, the type is not a subtype of the supertype, which must
   * then be an unbounded int or real and there are no type parameters.
   */
  public static class TypeDef extends Decl {
    public final String name;
    public final ImmutableList<TypeArg> typeParams;
    public final Type superType;
    /** bound variable of the predicate; null if no predicate */
    public final String predicateVar;
    /** null if no predicate */
    public final Expr predicate;
    public final boolean isNewType;

    public TypeDef(String name, List<TypeArg> typeParams, Type superType,
                   String predicateVar, Expr predicate, boolean isNewType,
                   Meta meta) {
      super(DeclKind.TYPE_DEF, meta);
      assert((predicateVar == null) == (predicate == null));
      this.name = name;
      this.typeParams = ImmutableList.copyOf(typeParams);
      this.superType = superType;
      this.predicateVar = predicateVar;
      this.predicate = predicate;
      this.isNewType = isNewType;
    }

    public static TypeDef synonym(String name, List<TypeArg> typeParams,
                                  Type superType) {
      return new TypeDef(name, typeParams, superType, null, null, false,
                         Meta.EMPTY);
    }

    public boolean hasPredicate() {
      return predicate != null;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public List<TypeArg> typeParams() {
      return typeParams;
    }

    @Override
    protected List<?> parts() {
      return Arrays.asList(name, typeParams, superType, predicateVar,
                           predicate, isNewType);
    }
  }

  /**
   * Mutable fields only occur in classes and never have an initializer:
   * the class constructor initializes them.
   * Immutable fields (constants) may have an initializer.
   */
  public static class Field extends Decl {
    public final String name;
    public final Type type;
    /** null if no initializer */
    public final Expr init;
    public final boolean ghost;
    public final boolean isStatic;
    public final boolean isMutable;

    public Field(String name, Type type, Expr init, boolean ghost,
                 boolean isStatic, boolean isMutable, Meta meta) {
      super(DeclKind.FIELD, meta);
      this.name = name;
      this.type = type;
      this.init = init;
      this.ghost = ghost;
      this.isStatic = isStatic;
      this.isMutable = isMutable;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    protected List<?> parts() {
      return Arrays.asList(name, type, init, ghost, isStatic, isMutable);
    }
  }

  /**
   * Methods, functions, lemmas and predicates
   */
  public static class Method extends Decl {
    public final MethodKind methodKind;
    public final String name;
    public final ImmutableList<TypeArg> typeParams;
    public final InputSpec ins;
    public final OutputSpec outs;
    public final ImmutableList<Expr> modifies;
    public final ImmutableList<Expr> reads;
    public final ImmutableList<Expr> decreases;
    /** null if no body */
    public final Expr body;
    public final boolean ghost;
    public final boolean isStatic;

    public Method(MethodKind methodKind, String name,
                  List<TypeArg> typeParams, InputSpec ins, OutputSpec outs,
                  List<? extends Expr> modifies, List<? extends Expr> reads,
                  List<? extends Expr> decreases, Expr body,
                  boolean ghost, boolean isStatic, Meta meta) {
      super(DeclKind.METHOD, meta);
      this.methodKind = methodKind;
      this.name = name;
      this.typeParams = ImmutableList.copyOf(typeParams);
      this.ins = ins;
      this.outs = outs;
      this.modifies = ImmutableList.copyOf(modifies);
      this.reads = ImmutableList.copyOf(reads);
      this.decreases = ImmutableList.copyOf(decreases);
      this.body = body;
      this.ghost = ghost;
      this.isStatic = isStatic;
    }

    /**
     * @return true if explicitly ghost or ghost by its kind
     */
    public boolean isGhost() {
      return ghost || methodKind.isGhost();
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public List<TypeArg> typeParams() {
      return typeParams;
    }

    @Override
    protected List<?> parts() {
      return Arrays.asList(methodKind, name, typeParams, ins, outs, modifies,
                           reads, decreases, body, ghost, isStatic);
    }
  }

  public static class Import extends Decl {
    public final ImportDirective directive;

    public Import(ImportDirective directive) {
      super(DeclKind.IMPORT, Meta.EMPTY);
      this.directive = directive;
    }

    @Override
    protected List<?> parts() {
      return ImmutableList.of(directive);
    }

    @Override
    public String toString() {
      return directive.toString();
    }
  }

  public static class Export extends Decl {
    public final ExportSpec spec;

    public Export(ExportSpec spec) {
      super(DeclKind.EXPORT, Meta.EMPTY);
      this.spec = spec;
    }

    @Override
    protected List<?> parts() {
      return ImmutableList.of(spec);
    }

    @Override
    public String toString() {
      return spec.toString();
    }
  }

  /**
   * Placeholder for a front-end construct not yet modeled
   */
  public static class UnimplementedDecl extends Decl {
    private UnimplementedDecl() {
      super(DeclKind.UNIMPLEMENTED, Meta.EMPTY);
    }

    @Override
    protected List<?> parts() {
      return ImmutableList.of();
    }

    @Override
    public String toString() {
      return "UNIMPLEMENTED";
    }
  }

  /**
   * True if a datatype is simply an enumeration, i.e. it has no type
   * parameters and no constructor takes arguments
   */
  public static boolean isEnum(Decl d) {
    if (d.kind() != DeclKind.DATATYPE) {
      return false;
    }
    Datatype dt = (Datatype)d;
    if (!dt.typeParams.isEmpty()) {
      return false;
    }
    for (DatatypeConstructor c: dt.constructors) {
      if (!c.inputs.isEmpty()) {
        return false;
      }
    }
    return true;
  }

  private static List<Decl> filter(List<Decl> decls,
                                   Predicate<? super Decl> mustPreserve) {
    return ImmutableList.copyOf(Iterables.filter(decls, mustPreserve));
  }
}
