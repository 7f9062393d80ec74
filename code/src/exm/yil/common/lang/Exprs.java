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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.yil.common.lang.Types.Type;
import exm.yil.common.util.Pair;

/**
 * Expressions of the YIL language.
 *
 * The source language treats most statements as unit-typed expressions,
 * so statements and expressions are one family here.  The printer
 * decides from the position of a node whether to render it as a
 * statement or as an expression.
 *
 * Optional components are null when absent.
 */
public class Exprs {

  public static enum ExprKind {
    // identifiers
    MEMBER_REF, VAR, THIS,
    // object construction
    NEW, NULL, NEW_ARRAY,
    // literals
    BOOL, CHAR, STRING, TO_STRING, INT, REAL,
    // binders
    QUANT, OLD, TUPLE, PROJ, FUN,
    // collections
    SET, SET_COMP, SEQ, SEQ_CONSTR, MAP_KEYS, MAP_DISPLAY, MAP_COMP,
    SEQ_SELECT, MULTI_SELECT, SEQ_UPDATE, ARRAY_UPDATE,
    // applications
    UN_OP_APPLY, BIN_OP_APPLY, METHOD_APPLY, ANON_APPLY, CONSTRUCTOR_APPLY,
    TYPE_CONVERSION, TYPE_TEST,
    // control flow and statements
    BLOCK, LET, IF, WHILE, FOR, RETURN, BREAK, MATCH,
    DECLS, UPDATE, DECL_CHOICE, PRINT,
    ASSERT, EXPECT, ASSUME, REVEAL,
    COMMENTED,
    // dummy for missing cases
    UNIMPLEMENTED,
  }

  public static enum Quantifier {
    FORALL("forall"),
    EXISTS("exists");

    private final String keyword;

    private Quantifier(String keyword) {
      this.keyword = keyword;
    }

    @Override
    public String toString() {
      return keyword;
    }
  }

  public abstract static class Expr {
    private final ExprKind kind;

    protected Expr(ExprKind kind) {
      this.kind = kind;
    }

    public ExprKind kind() {
      return kind;
    }

    /**
     * Components compared by structural equality, in a fixed order.
     * May contain nulls for absent optional components.
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
      return parts().equals(((Expr)obj).parts());
    }

    @Override
    public int hashCode() {
      return kind.hashCode() + 31 * parts().hashCode();
    }

    @Override
    public String toString() {
      return kind + parts().toString();
    }
  }

  /**
   * The left-hand side of the . operator when accessing members
   */
  public abstract static class Receiver {
    private Receiver() {
    }
  }

  /**
   * Reference to a static member of a class or module
   */
  public static class StaticReceiver extends Receiver {
    public final ClassType classType;

    public StaticReceiver(ClassType classType) {
      this.classType = classType;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof StaticReceiver &&
             classType.equals(((StaticReceiver)obj).classType);
    }

    @Override
    public int hashCode() {
      return classType.hashCode();
    }

    @Override
    public String toString() {
      return classType.toString();
    }
  }

  /**
   * Reference to a member of an object of a class or datatype
   */
  public static class ObjectReceiver extends Receiver {
    public final Expr object;

    public ObjectReceiver(Expr object) {
      this.object = object;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof ObjectReceiver &&
             object.equals(((ObjectReceiver)obj).object);
    }

    @Override
    public int hashCode() {
      return 7 + object.hashCode();
    }

    @Override
    public String toString() {
      return object.toString();
    }
  }

  /**
   * Pattern match case.  Nested and literal patterns are resolved away
   * by the front-end, so the pattern is always c(x1,...,xn) for a
   * constructor c and the bound variables x1..xn.
   */
  public static class Case {
    public final ImmutableList<LocalDecl> boundVars;
    public final Expr pattern;
    public final Expr body;

    public Case(List<LocalDecl> boundVars, Expr pattern, Expr body) {
      this.boundVars = ImmutableList.copyOf(boundVars);
      this.pattern = pattern;
      this.body = body;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Case)) {
        return false;
      }
      Case other = (Case)obj;
      return boundVars.equals(other.boundVars) &&
             pattern.equals(other.pattern) && body.equals(other.body);
    }

    @Override
    public int hashCode() {
      return Arrays.asList(boundVars, pattern, body).hashCode();
    }
  }

  /**
   * Right-hand side of a declaration or assignment.
   *
   * Plain if monadicType is null: x := V with x:A and V:A.
   * Otherwise monadic: x :- V with V:M<A> and x:A, where
   * monadicType = M<A>.  This binds the result of V, returns early if it
   * is a failure, and extracts the success value otherwise.
   */
  public static class UpdateRHS {
    public final Expr value;
    /** null for plain updates */
    public final Type monadicType;

    public UpdateRHS(Expr value, Type monadicType) {
      this.value = value;
      this.monadicType = monadicType;
    }

    /** makes a plain update := e */
    public static UpdateRHS plain(Expr value) {
      return new UpdateRHS(value, null);
    }

    public boolean isMonadic() {
      return monadicType != null;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof UpdateRHS)) {
        return false;
      }
      UpdateRHS other = (UpdateRHS)obj;
      return value.equals(other.value) &&
          (monadicType == null ? other.monadicType == null :
                                 monadicType.equals(other.monadicType));
    }

    @Override
    public int hashCode() {
      return Arrays.asList(value, monadicType).hashCode();
    }
  }

  // ***** identifiers

  /**
   * Reference to a field or method of a child-bearing declaration
   */
  public static class MemberRefExpr extends Expr {
    public final Receiver receiver;
    public final Path member;
    public final ImmutableList<Type> typeArgs;

    public MemberRefExpr(Receiver receiver, Path member,
                         List<? extends Type> typeArgs) {
      super(ExprKind.MEMBER_REF);
      this.receiver = receiver;
      this.member = member;
      this.typeArgs = ImmutableList.copyOf(typeArgs);
    }

    @Override
    protected List<?> parts() {
      return Arrays.asList(receiver, member, typeArgs);
    }
  }

  public static class VarExpr extends Expr {
    public final String name;

    public VarExpr(String name) {
      super(ExprKind.VAR);
      this.name = name;
    }

    @Override
    protected List<?> parts() {
      return ImmutableList.of(name);
    }
  }

  public static class ThisExpr extends Expr {
    private ThisExpr() {
      super(ExprKind.THIS);
    }

    @Override
    protected List<?> parts() {
      return ImmutableList.of();
    }
  }

  // ***** object construction

  public static class NewExpr extends Expr {
    public final ClassType classType;
    public final ImmutableList<Expr> args;

    public NewExpr(ClassType classType, List<? extends Expr> args) {
      super(ExprKind.NEW);
      this.classType = classType;
      this.args = ImmutableList.copyOf(args);
    }

    @Override
    protected List<?> parts() {
      return Arrays.asList(classType, args);
    }
  }

  public static class NullExpr extends Expr {
    public final Type type;

    public NullExpr(Type type) {
      super(ExprKind.NULL);
      this.type = type;
    }

    @Override
    protected List<?> parts() {
      return Arrays.asList(type);
    }
  }

  /**
   * Fixed size uninitialized array
   */
  public static class NewArrayExpr extends Expr {
    public final Type elemType;
    public final ImmutableList<Expr> dims;

    public NewArrayExpr(Type elemType, List<? extends Expr> dims) {
      super(ExprKind.NEW_ARRAY);
      this.elemType = elemType;
      this.dims = ImmutableList.copyOf(dims);
    }

    @Override
    protected List<?> parts() {
      return Arrays.asList(elemType, dims);
    }
  }

  // ***** literals

  public static class BoolExpr extends Expr {
    public final boolean value;

    public BoolExpr(boolean value) {
      super(ExprKind.BOOL);
      this.value = value;
    }

    @Override
    protected List<?> parts() {
      return ImmutableList.of(value);
    }
  }

  /**
   * Character literal.  Escapes are kept as separate characters, as in
   * the source text.
   */
  public static class CharExpr extends Expr {
    public final String value;

    public CharExpr(String value) {
      super(ExprKind.CHAR);
      this.value = value;
    }

    @Override
    protected List<?> parts() {
      return ImmutableList.of(value);
    }
  }

  /**
   * String literal.  Escapes are kept as separate characters, as in
   * the source text.
   */
  public static class StringExpr extends Expr {
    public final String value;

    public StringExpr(String value) {
      super(ExprKind.STRING);
      this.value = value;
    }

    @Override
    protected List<?> parts() {
      return ImmutableList.of(value);
    }
  }

  /**
   * String built from a sequence display of characters
   */
  public static class ToStringExpr extends Expr {
    public final ImmutableList<Expr> elems;

    public ToStringExpr(List<? extends Expr> elems) {
      super(ExprKind.TO_STRING);
      this.elems = ImmutableList.copyOf(elems);
    }

    @Override
    protected List<?> parts() {
      return ImmutableList.of(elems);
    }
  }

  /**
   * Integer literal.  Nat literals are int literals whose type is nat.
   */
  public static class IntExpr extends Expr {
    public final BigInteger value;
    public final Type type;

    public IntExpr(BigInteger value, Type type) {
      super(ExprKind.INT);
      this.value = value;
      this.type = type;
    }

    @Override
    protected List<?> parts() {
      return Arrays.asList(value, type);
    }
  }

  public static class RealExpr extends Expr {
    public final BigDecimal value;
    public final Type type;

    public RealExpr(BigDecimal value, Type type) {
      super(ExprKind.REAL);
      this.value = value;
      this.type = type;
    }

    @Override
    protected List<?> parts() {
      return Arrays.asList(value, type);
    }
  }

  // ***** binders

  /**
   * Quantifier over a finite domain.  The guard, if any, restricts the
   * domain of the bound variables.
   */
  public static class QuantExpr extends Expr {
    public final Quantifier quantifier;
    public final ImmutableList<LocalDecl> vars;
    /** null if no guard */
    public final Expr guard;
    public final Expr body;

    public QuantExpr(Quantifier quantifier, List<LocalDecl> vars, Expr guard,
                     Expr body) {
      super(ExprKind.QUANT);
      this.quantifier = quantifier;
      this.vars = ImmutableList.copyOf(vars);
      this.guard = guard;
      this.body = body;
    }

    @Override
    protected List<?> parts() {
      return Arrays.asList(quantifier, vars, guard, body);
    }
  }

  /**
   * Pre-state value, used in postconditions
   */
  public static class OldExpr extends Expr {
    public final Expr expr;

    public OldExpr(Expr expr) {
      super(ExprKind.OLD);
      this.expr = expr;
    }

    @Override
    protected List<?> parts() {
      return ImmutableList.of(expr);
    }
  }

  public static class TupleExpr extends Expr {
    public final ImmutableList<Expr> elems;

    public TupleExpr(List<? extends Expr> elems) {
      super(ExprKind.TUPLE);
      this.elems = ImmutableList.copyOf(elems);
    }

    @Override
    protected List<?> parts() {
      return ImmutableList.of(elems);
    }
  }

  public static class ProjExpr extends Expr {
    public final Expr tuple;
    public final int index;

    public ProjExpr(Expr tuple, int index) {
      super(ExprKind.PROJ);
      this.tuple = tuple;
      this.index = index;
    }

    @Override
    protected List<?> parts() {
      return Arrays.asList(tuple, index);
    }
  }

  /**
   * Anonymous function
   */
  public static class FunExpr extends Expr {
    public final ImmutableList<LocalDecl> vars;
    public final Type outType;
    public final Expr body;

    public FunExpr(List<LocalDecl> vars, Type outType, Expr body) {
      super(ExprKind.FUN);
      this.vars = ImmutableList.copyOf(vars);
      this.outType = outType;
      this.body = body;
    }

    @Override
    protected List<?> parts() {
      return Arrays.asList(vars, outType, body);
    }
  }

  // ***** collections

  public static class SetExpr extends Expr {
    public final Type type;
    public final ImmutableList<Expr> elems;

    public SetExpr(Type type, List<? extends Expr> elems) {
      super(ExprKind.SET);
      this.type = type;
      this.elems = ImmutableList.copyOf(elems);
    }

    @Override
    protected List<?> parts() {
      return Arrays.asList(type, elems);
    }
  }

  /**
   * Set comprehension: set vars | pred :: body
   */
  public static class SetCompExpr extends Expr {
    public final ImmutableList<LocalDecl> vars;
    public final Expr pred;
    public final Expr body;

    public SetCompExpr(List<LocalDecl> vars, Expr pred, Expr body) {
      super(ExprKind.SET_COMP);
      this.vars = ImmutableList.copyOf(vars);
      this.pred = pred;
      this.body = body;
    }

    @Override
    protected List<?> parts() {
      return Arrays.asList(vars, pred, body);
    }
  }

  public static class SeqExpr extends Expr {
    public final Type type;
    public final ImmutableList<Expr> elems;

    public SeqExpr(Type type, List<? extends Expr> elems) {
      super(ExprKind.SEQ);
      this.type = type;
      this.elems = ImmutableList.copyOf(elems);
    }

    @Override
    protected List<?> parts() {
      return Arrays.asList(type, elems);
    }
  }

  /**
   * Builds the sequence init(0), ..., init(length-1)
   */
  public static class SeqConstrExpr extends Expr {
    public final Type type;
    public final Expr length;
    public final Expr init;

    public SeqConstrExpr(Type type, Expr length, Expr init) {
      super(ExprKind.SEQ_CONSTR);
      this.type = type;
      this.length = length;
      this.init = init;
    }

    @Override
    protected List<?> parts() {
      return Arrays.asList(type, length, init);
    }
  }

  public static class MapKeysExpr extends Expr {
    public final Expr map;

    public MapKeysExpr(Expr map) {
      super(ExprKind.MAP_KEYS);
      this.map = map;
    }

    @Override
    protected List<?> parts() {
      return ImmutableList.of(map);
    }
  }

  /**
   * Explicit map given as a list of key-value pairs
   */
  public static class MapDisplayExpr extends Expr {
    public final ImmutableList<Pair<Expr, Expr>> entries;

    public MapDisplayExpr(List<Pair<Expr, Expr>> entries) {
      super(ExprKind.MAP_DISPLAY);
      this.entries = ImmutableList.copyOf(entries);
    }

    @Override
    protected List<?> parts() {
      return ImmutableList.of(entries);
    }
  }

  /**
   * Map comprehension: map vars | pred :: key := value.
   * Without a key expression, each element of the domain maps to the
   * value, i.e. map vars | pred :: value.
   */
  public static class MapCompExpr extends Expr {
    public final ImmutableList<LocalDecl> vars;
    public final Expr pred;
    /** null if the domain is not relabeled */
    public final Expr key;
    public final Expr value;

    public MapCompExpr(List<LocalDecl> vars, Expr pred, Expr key, Expr value) {
      super(ExprKind.MAP_COMP);
      this.vars = ImmutableList.copyOf(vars);
      this.pred = pred;
      this.key = key;
      this.value = value;
    }

    @Override
    protected List<?> parts() {
      return Arrays.asList(vars, pred, key, value);
    }
  }

  /**
   * Polymorphic selection from anything sequence-like (sequence, map,
   * string, array).  Returns an element if element is set, in which
   * case from is the index, else a slice from..to where either bound may
   * be missing.
   */
  public static class SeqSelectExpr extends Expr {
    public final Expr seq;
    public final Type type;
    public final boolean element;
    /** may be null for slices */
    public final Expr from;
    /** may be null */
    public final Expr to;

    public SeqSelectExpr(Expr seq, Type type, boolean element, Expr from,
                         Expr to) {
      super(ExprKind.SEQ_SELECT);
      this.seq = seq;
      this.type = type;
      this.element = element;
      this.from = from;
      this.to = to;
    }

    @Override
    protected List<?> parts() {
      return Arrays.asList(seq, type, element, from, to);
    }
  }

  /**
   * Multi-dimensional array access
   */
  public static class MultiSelectExpr extends Expr {
    public final Expr array;
    public final ImmutableList<Expr> indices;

    public MultiSelectExpr(Expr array, List<? extends Expr> indices) {
      super(ExprKind.MULTI_SELECT);
      this.array = array;
      this.indices = ImmutableList.copyOf(indices);
    }

    @Override
    protected List<?> parts() {
      return Arrays.asList(array, indices);
    }
  }

  public static class SeqUpdateExpr extends Expr {
    public final Expr seq;
    public final Expr index;
    public final Expr value;

    public SeqUpdateExpr(Expr seq, Expr index, Expr value) {
      super(ExprKind.SEQ_UPDATE);
      this.seq = seq;
      this.index = index;
      this.value = value;
    }

    @Override
    protected List<?> parts() {
      return Arrays.asList(seq, index, value);
    }
  }

  /**
   * In-place array update
   */
  public static class ArrayUpdateExpr extends Expr {
    public final Expr array;
    public final ImmutableList<Expr> indices;
    public final Expr value;

    public ArrayUpdateExpr(Expr array, List<? extends Expr> indices,
                           Expr value) {
      super(ExprKind.ARRAY_UPDATE);
      this.array = array;
      this.indices = ImmutableList.copyOf(indices);
      this.value = value;
    }

    @Override
    protected List<?> parts() {
      return Arrays.asList(array, indices, value);
    }
  }

  // ***** applications

  /**
   * Built-in unary operator, identified by name.
   * See {@link Operators.UnaryOp} for the supported names.
   */
  public static class UnOpApplyExpr extends Expr {
    public final String op;
    public final Expr arg;

    public UnOpApplyExpr(String op, Expr arg) {
      super(ExprKind.UN_OP_APPLY);
      this.op = op;
      this.arg = arg;
    }

    @Override
    protected List<?> parts() {
      return Arrays.asList(op, arg);
    }
  }

  /**
   * Built-in binary operator, identified by the name of its resolved
   * opcode.  See {@link Operators.BinaryOp} for the supported names.
   */
  public static class BinOpApplyExpr extends Expr {
    public final String op;
    public final Expr left;
    public final Expr right;

    public BinOpApplyExpr(String op, Expr left, Expr right) {
      super(ExprKind.BIN_OP_APPLY);
      this.op = op;
      this.left = left;
      this.right = right;
    }

    @Override
    protected List<?> parts() {
      return Arrays.asList(op, left, right);
    }
  }

  /**
   * Method invocation.  Type arguments are those of the enclosing
   * declaration followed by those of the method.  ghost is set for
   * ghost calls such as lemma calls.
   */
  public static class MethodApplyExpr extends Expr {
    public final Receiver receiver;
    public final Path method;
    public final ImmutableList<Type> typeArgs;
    public final ImmutableList<Expr> args;
    public final boolean ghost;

    public MethodApplyExpr(Receiver receiver, Path method,
                           List<? extends Type> typeArgs,
                           List<? extends Expr> args, boolean ghost) {
      super(ExprKind.METHOD_APPLY);
      this.receiver = receiver;
      this.method = method;
      this.typeArgs = ImmutableList.copyOf(typeArgs);
      this.args = ImmutableList.copyOf(args);
      this.ghost = ghost;
    }

    @Override
    protected List<?> parts() {
      return Arrays.asList(receiver, method, typeArgs, args, ghost);
    }
  }

  /**
   * Application of an anonymous function
   */
  public static class AnonApplyExpr extends Expr {
    public final Expr fn;
    public final ImmutableList<Expr> args;

    public AnonApplyExpr(Expr fn, List<? extends Expr> args) {
      super(ExprKind.ANON_APPLY);
      this.fn = fn;
      this.args = ImmutableList.copyOf(args);
    }

    @Override
    protected List<?> parts() {
      return Arrays.asList(fn, args);
    }
  }

  public static class ConstructorApplyExpr extends Expr {
    public final Path constructor;
    public final ImmutableList<Type> typeArgs;
    public final ImmutableList<Expr> args;

    public ConstructorApplyExpr(Path constructor,
                                List<? extends Type> typeArgs,
                                List<? extends Expr> args) {
      super(ExprKind.CONSTRUCTOR_APPLY);
      this.constructor = constructor;
      this.typeArgs = ImmutableList.copyOf(typeArgs);
      this.args = ImmutableList.copyOf(args);
    }

    @Override
    protected List<?> parts() {
      return Arrays.asList(constructor, typeArgs, args);
    }
  }

  /** e as t */
  public static class TypeConversionExpr extends Expr {
    public final Expr expr;
    public final Type toType;

    public TypeConversionExpr(Expr expr, Type toType) {
      super(ExprKind.TYPE_CONVERSION);
      this.expr = expr;
      this.toType = toType;
    }

    @Override
    protected List<?> parts() {
      return Arrays.asList(expr, toType);
    }
  }

  /** e is t */
  public static class TypeTestExpr extends Expr {
    public final Expr expr;
    public final Type type;

    public TypeTestExpr(Expr expr, Type type) {
      super(ExprKind.TYPE_TEST);
      this.expr = expr;
      this.type = type;
    }

    @Override
    protected List<?> parts() {
      return Arrays.asList(expr, type);
    }
  }

  // ***** control flow and statements

  public static class BlockExpr extends Expr {
    public final ImmutableList<Expr> exprs;

    public BlockExpr(List<? extends Expr> exprs) {
      super(ExprKind.BLOCK);
      this.exprs = ImmutableList.copyOf(exprs);
    }

    public boolean isEmpty() {
      return exprs.isEmpty();
    }

    @Override
    protected List<?> parts() {
      return ImmutableList.of(exprs);
    }
  }

  /**
   * var name: type := def; body
   * or, if not exact, the non-deterministic var name: type :| def; body
   */
  public static class LetExpr extends Expr {
    public final String var;
    public final Type type;
    public final boolean exact;
    public final Expr def;
    public final Expr body;

    public LetExpr(String var, Type type, boolean exact, Expr def,
                   Expr body) {
      super(ExprKind.LET);
      this.var = var;
      this.type = type;
      this.exact = exact;
      this.def = def;
      this.body = body;
    }

    @Override
    protected List<?> parts() {
      return Arrays.asList(var, type, exact, def, body);
    }
  }

  /**
   * The condition must not have side effects.  The else branch is
   * required in expression position.
   */
  public static class IfExpr extends Expr {
    public final Expr cond;
    public final Expr thenBranch;
    /** null if no else branch */
    public final Expr elseBranch;

    public IfExpr(Expr cond, Expr thenBranch, Expr elseBranch) {
      super(ExprKind.IF);
      this.cond = cond;
      this.thenBranch = thenBranch;
      this.elseBranch = elseBranch;
    }

    @Override
    protected List<?> parts() {
      return Arrays.asList(cond, thenBranch, elseBranch);
    }
  }

  public static class WhileExpr extends Expr {
    public final Expr cond;
    public final Expr body;
    /** null if unlabeled */
    public final String label;

    public WhileExpr(Expr cond, Expr body, String label) {
      super(ExprKind.WHILE);
      this.cond = cond;
      this.body = body;
      this.label = label;
    }

    @Override
    protected List<?> parts() {
      return Arrays.asList(cond, body, label);
    }
  }

  /**
   * for index := init to last (or downto last if not up)
   */
  public static class ForExpr extends Expr {
    public final LocalDecl index;
    public final Expr init;
    public final Expr last;
    public final boolean up;
    public final Expr body;

    public ForExpr(LocalDecl index, Expr init, Expr last, boolean up,
                   Expr body) {
      super(ExprKind.FOR);
      this.index = index;
      this.init = init;
      this.last = last;
      this.up = up;
      this.body = body;
    }

    @Override
    protected List<?> parts() {
      return Arrays.asList(index, init, last, up, body);
    }
  }

  /**
   * If there are no values, there is no return value or the outputs
   * have been set by assignments.
   */
  public static class ReturnExpr extends Expr {
    public final ImmutableList<Expr> values;

    public ReturnExpr(List<? extends Expr> values) {
      super(ExprKind.RETURN);
      this.values = ImmutableList.copyOf(values);
    }

    @Override
    protected List<?> parts() {
      return ImmutableList.of(values);
    }
  }

  public static class BreakExpr extends Expr {
    /** null if unlabeled */
    public final String label;

    public BreakExpr(String label) {
      super(ExprKind.BREAK);
      this.label = label;
    }

    @Override
    protected List<?> parts() {
      return Arrays.asList(label);
    }
  }

  public static class MatchExpr extends Expr {
    public final Expr on;
    public final Type type;
    public final ImmutableList<Case> cases;
    /** null if no default case */
    public final Expr dflt;

    public MatchExpr(Expr on, Type type, List<Case> cases, Expr dflt) {
      super(ExprKind.MATCH);
      this.on = on;
      this.type = type;
      this.cases = ImmutableList.copyOf(cases);
      this.dflt = dflt;
    }

    @Override
    protected List<?> parts() {
      return Arrays.asList(on, type, cases, dflt);
    }
  }

  /**
   * Declaration of local mutable variables with optional initial values,
   * e.g. var x1,...,xn := V1,...,Vn.  Patterns on the left are not
   * allowed.
   */
  public static class DeclsExpr extends Expr {
    /** second component is null if no initial value */
    public final ImmutableList<Pair<LocalDecl, UpdateRHS>> decls;

    public DeclsExpr(List<Pair<LocalDecl, UpdateRHS>> decls) {
      super(ExprKind.DECLS);
      this.decls = ImmutableList.copyOf(decls);
    }

    public List<LocalDecl> localDecls() {
      return Pair.extract1(decls);
    }

    @Override
    protected List<?> parts() {
      return ImmutableList.of(decls);
    }
  }

  /**
   * Assignment x1,...,xn := V.  Several left-hand sides only make sense
   * if V is a method call with several outputs.
   */
  public static class UpdateExpr extends Expr {
    public final ImmutableList<Expr> lhs;
    public final UpdateRHS rhs;

    public UpdateExpr(List<? extends Expr> lhs, UpdateRHS rhs) {
      super(ExprKind.UPDATE);
      this.lhs = ImmutableList.copyOf(lhs);
      this.rhs = rhs;
    }

    @Override
    protected List<?> parts() {
      return Arrays.asList(lhs, rhs);
    }
  }

  /**
   * Variable declaration with non-deterministic initial value:
   * var x :| pred(x)
   */
  public static class DeclChoiceExpr extends Expr {
    public final LocalDecl decl;
    public final Expr pred;

    public DeclChoiceExpr(LocalDecl decl, Expr pred) {
      super(ExprKind.DECL_CHOICE);
      this.decl = decl;
      this.pred = pred;
    }

    @Override
    protected List<?> parts() {
      return Arrays.asList(decl, pred);
    }
  }

  public static class PrintExpr extends Expr {
    public final ImmutableList<Expr> exprs;

    public PrintExpr(List<? extends Expr> exprs) {
      super(ExprKind.PRINT);
      this.exprs = ImmutableList.copyOf(exprs);
    }

    @Override
    protected List<?> parts() {
      return ImmutableList.of(exprs);
    }
  }

  public static class AssertExpr extends Expr {
    public final Expr expr;

    public AssertExpr(Expr expr) {
      super(ExprKind.ASSERT);
      this.expr = expr;
    }

    @Override
    protected List<?> parts() {
      return ImmutableList.of(expr);
    }
  }

  /**
   * Runtime-checked, non-ghost assertion
   */
  public static class ExpectExpr extends Expr {
    public final Expr expr;

    public ExpectExpr(Expr expr) {
      super(ExprKind.EXPECT);
      this.expr = expr;
    }

    @Override
    protected List<?> parts() {
      return ImmutableList.of(expr);
    }
  }

  public static class AssumeExpr extends Expr {
    public final Expr expr;

    public AssumeExpr(Expr expr) {
      super(ExprKind.ASSUME);
      this.expr = expr;
    }

    @Override
    protected List<?> parts() {
      return ImmutableList.of(expr);
    }
  }

  public static class RevealExpr extends Expr {
    public final ImmutableList<Expr> exprs;

    public RevealExpr(List<? extends Expr> exprs) {
      super(ExprKind.REVEAL);
      this.exprs = ImmutableList.copyOf(exprs);
    }

    @Override
    protected List<?> parts() {
      return ImmutableList.of(exprs);
    }
  }

  /**
   * An expression preceded by a source comment
   */
  public static class CommentedExpr extends Expr {
    public final String comment;
    public final Expr expr;

    public CommentedExpr(String comment, Expr expr) {
      super(ExprKind.COMMENTED);
      this.comment = comment;
      this.expr = expr;
    }

    @Override
    protected List<?> parts() {
      return Arrays.asList(comment, expr);
    }
  }

  public static class UnimplementedExpr extends Expr {
    private UnimplementedExpr() {
      super(ExprKind.UNIMPLEMENTED);
    }

    @Override
    protected List<?> parts() {
      return ImmutableList.of();
    }
  }

  // ***** auxiliary values and methods

  public static final Expr THIS = new ThisExpr();

  public static final Expr UNIMPLEMENTED = new UnimplementedExpr();

  /** empty command */
  public static final Expr SKIP = new BlockExpr(ImmutableList.<Expr>of());

  /** the special variable _ (only to be used in patterns) */
  public static final Expr WILDCARD = new VarExpr(LocalDecl.ANONYMOUS);

  public static final Expr TRUE = new BoolExpr(true);

  public static final Expr FALSE = new BoolExpr(false);

  public static Expr var(String name) {
    return new VarExpr(name);
  }

  public static Expr intLit(long value) {
    return new IntExpr(BigInteger.valueOf(value), Types.INT);
  }

  /**
   * wrap a list of expressions in a block, unless it is a single one
   */
  public static Expr listToExpr(List<? extends Expr> es) {
    if (es.size() == 1) {
      return es.get(0);
    }
    return new BlockExpr(es);
  }

  /**
   * unwrap a block into its expressions
   */
  public static List<Expr> exprToList(Expr e) {
    if (e.kind() == ExprKind.BLOCK) {
      return ((BlockExpr)e).exprs;
    }
    return ImmutableList.of(e);
  }

  /**
   * wrap in a block if not yet a block
   */
  public static Expr block(Expr e) {
    if (e.kind() == ExprKind.BLOCK) {
      return e;
    }
    return new BlockExpr(ImmutableList.of(e));
  }

  /**
   * @return true for empty blocks, also if wrapped in a comment
   */
  public static boolean isEmptyBlock(Expr e) {
    if (e.kind() == ExprKind.COMMENTED) {
      return isEmptyBlock(((CommentedExpr)e).expr);
    }
    return e.kind() == ExprKind.BLOCK && ((BlockExpr)e).isEmpty();
  }

  /** s == t */
  public static Expr equal(Expr s, Expr t) {
    return new BinOpApplyExpr(Operators.BinaryOp.EQ_COMMON.opName(), s, t);
  }

  /** conjunction of some expressions; true if empty */
  public static Expr conj(List<? extends Expr> es) {
    return fold(Operators.BinaryOp.AND.opName(), es, TRUE);
  }

  /** disjunction of some expressions; false if empty */
  public static Expr disj(List<? extends Expr> es) {
    return fold(Operators.BinaryOp.OR.opName(), es, FALSE);
  }

  private static Expr fold(String op, List<? extends Expr> es, Expr unit) {
    if (es.isEmpty()) {
      return unit;
    }
    Expr sofar = es.get(0);
    for (Expr next: es.subList(1, es.size())) {
      sofar = new BinOpApplyExpr(op, sofar, next);
    }
    return sofar;
  }

  /** variable referencing a local declaration */
  public static Expr localDeclTerm(LocalDecl ld) {
    return new VarExpr(ld.name);
  }

  /**
   * Makes the pattern-match case c(x1,...,xn) => body for constructor c
   */
  public static Case plainCase(Path constructor, List<LocalDecl> vars,
                               Expr body) {
    List<Expr> terms = new ArrayList<Expr>(vars.size());
    for (LocalDecl ld: vars) {
      terms.add(localDeclTerm(ld));
    }
    // no type arguments: there is no matching on types
    Expr pattern = new ConstructorApplyExpr(constructor,
                                  ImmutableList.<Type>of(), terms);
    return new Case(vars, pattern, body);
  }

  /**
   * Local variables introduced by an expression.  These are visible to
   * later statements in the same block.
   */
  public static List<LocalDecl> exprDecl(Expr e) {
    switch (e.kind()) {
      case DECLS:
        return ((DeclsExpr)e).localDecls();
      case DECL_CHOICE:
        return ImmutableList.of(((DeclChoiceExpr)e).decl);
      default:
        return ImmutableList.of();
    }
  }
}
