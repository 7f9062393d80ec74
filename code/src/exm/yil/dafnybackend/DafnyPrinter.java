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

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableList;

import exm.yil.common.Logging;
import exm.yil.common.Settings;
import exm.yil.common.exceptions.InvalidOptionException;
import exm.yil.common.exceptions.UnsupportedConstructError;
import exm.yil.common.lang.ClassType;
import exm.yil.common.lang.DatatypeConstructor;
import exm.yil.common.lang.Decls;
import exm.yil.common.lang.Decls.ClassConstructor;
import exm.yil.common.lang.Decls.ClassDecl;
import exm.yil.common.lang.Decls.Datatype;
import exm.yil.common.lang.Decls.Decl;
import exm.yil.common.lang.Decls.DeclKind;
import exm.yil.common.lang.Decls.Field;
import exm.yil.common.lang.Decls.Include;
import exm.yil.common.lang.Decls.Method;
import exm.yil.common.lang.Decls.TypeDef;
import exm.yil.common.lang.Exprs;
import exm.yil.common.lang.Exprs.AnonApplyExpr;
import exm.yil.common.lang.Exprs.ArrayUpdateExpr;
import exm.yil.common.lang.Exprs.AssertExpr;
import exm.yil.common.lang.Exprs.AssumeExpr;
import exm.yil.common.lang.Exprs.BinOpApplyExpr;
import exm.yil.common.lang.Exprs.BlockExpr;
import exm.yil.common.lang.Exprs.BoolExpr;
import exm.yil.common.lang.Exprs.BreakExpr;
import exm.yil.common.lang.Exprs.Case;
import exm.yil.common.lang.Exprs.CharExpr;
import exm.yil.common.lang.Exprs.CommentedExpr;
import exm.yil.common.lang.Exprs.ConstructorApplyExpr;
import exm.yil.common.lang.Exprs.DeclChoiceExpr;
import exm.yil.common.lang.Exprs.DeclsExpr;
import exm.yil.common.lang.Exprs.ExpectExpr;
import exm.yil.common.lang.Exprs.Expr;
import exm.yil.common.lang.Exprs.ForExpr;
import exm.yil.common.lang.Exprs.FunExpr;
import exm.yil.common.lang.Exprs.IfExpr;
import exm.yil.common.lang.Exprs.IntExpr;
import exm.yil.common.lang.Exprs.LetExpr;
import exm.yil.common.lang.Exprs.MapCompExpr;
import exm.yil.common.lang.Exprs.MapDisplayExpr;
import exm.yil.common.lang.Exprs.MapKeysExpr;
import exm.yil.common.lang.Exprs.MatchExpr;
import exm.yil.common.lang.Exprs.MemberRefExpr;
import exm.yil.common.lang.Exprs.MethodApplyExpr;
import exm.yil.common.lang.Exprs.MultiSelectExpr;
import exm.yil.common.lang.Exprs.NewArrayExpr;
import exm.yil.common.lang.Exprs.NewExpr;
import exm.yil.common.lang.Exprs.ObjectReceiver;
import exm.yil.common.lang.Exprs.OldExpr;
import exm.yil.common.lang.Exprs.PrintExpr;
import exm.yil.common.lang.Exprs.ProjExpr;
import exm.yil.common.lang.Exprs.Quantifier;
import exm.yil.common.lang.Exprs.QuantExpr;
import exm.yil.common.lang.Exprs.RealExpr;
import exm.yil.common.lang.Exprs.Receiver;
import exm.yil.common.lang.Exprs.ReturnExpr;
import exm.yil.common.lang.Exprs.RevealExpr;
import exm.yil.common.lang.Exprs.SeqConstrExpr;
import exm.yil.common.lang.Exprs.SeqExpr;
import exm.yil.common.lang.Exprs.SeqSelectExpr;
import exm.yil.common.lang.Exprs.SeqUpdateExpr;
import exm.yil.common.lang.Exprs.SetCompExpr;
import exm.yil.common.lang.Exprs.SetExpr;
import exm.yil.common.lang.Exprs.StaticReceiver;
import exm.yil.common.lang.Exprs.StringExpr;
import exm.yil.common.lang.Exprs.ToStringExpr;
import exm.yil.common.lang.Exprs.TupleExpr;
import exm.yil.common.lang.Exprs.TypeConversionExpr;
import exm.yil.common.lang.Exprs.TypeTestExpr;
import exm.yil.common.lang.Exprs.UnOpApplyExpr;
import exm.yil.common.lang.Exprs.UpdateExpr;
import exm.yil.common.lang.Exprs.UpdateRHS;
import exm.yil.common.lang.Exprs.VarExpr;
import exm.yil.common.lang.Exprs.WhileExpr;
import exm.yil.common.lang.LocalDecl;
import exm.yil.common.lang.MethodKind;
import exm.yil.common.lang.Operators.BinaryOp;
import exm.yil.common.lang.Operators.UnaryOp;
import exm.yil.common.lang.Program;
import exm.yil.common.lang.TypeArg;
import exm.yil.common.lang.Types.ApplyType;
import exm.yil.common.lang.Types.CollectionType;
import exm.yil.common.lang.Types.FunctionType;
import exm.yil.common.lang.Types.MapType;
import exm.yil.common.lang.Types.NullableType;
import exm.yil.common.lang.Types.TupleType;
import exm.yil.common.lang.Types.Type;
import exm.yil.common.lang.Types.TypeKind;
import exm.yil.common.util.Pair;
import exm.yil.frontend.Context;
import exm.yil.frontend.ContextPosition;

/**
 * Prints YIL programs in Dafny concrete syntax.
 *
 * Printing is a pure function of the printed node and the context
 * passed along with it, so one printer can serve any number of print
 * jobs.
 *
 * Statements and expressions share one representation.  Whether a node
 * is printed as a statement or as an expression depends on whether it
 * is reached through {@link #statement} or {@link #expr}.
 *
 * In strict mode, only output that Dafny can parse is produced.  The
 * passed contexts must then be correct, i.e. their current declaration
 * must exist in their program.
 */
public class DafnyPrinter {

  private static final Logger logger = Logging.getYILLogger();

  public static final String UNIMPLEMENTED = "<UNIMPLEMENTED>";
  public static final String UNIMPLEMENTED_STATEMENT = "/* UNIMPLEMENTED */";

  private static final String UNIMPLEMENTED_WARNING =
      "Output contains placeholders for unsupported constructs";

  public static final String PRELUDE_START = "/***** PRELUDE START *****/";
  public static final String PRELUDE_END = "/***** PRELUDE END *****/";

  private final boolean strict;

  /** whether to print comments attached to declarations */
  private final boolean printComments;

  private final Indentation indentation;

  public DafnyPrinter(boolean strict, boolean printComments,
                      Indentation indentation) {
    this.strict = strict;
    this.printComments = printComments;
    this.indentation = indentation;
  }

  public DafnyPrinter(boolean strict) {
    this(strict, false, Indentation.DEFAULT);
  }

  /**
   * @return a strict printer with default layout
   */
  public static DafnyPrinter printer() {
    return new DafnyPrinter(true);
  }

  /**
   * @return a printer configured from {@link Settings}
   */
  public static DafnyPrinter fromSettings() throws InvalidOptionException {
    return new DafnyPrinter(Settings.getBoolean(Settings.PRINTER_STRICT),
              Settings.getBoolean(Settings.PRINTER_COMMENTS),
              new Indentation(Settings.getIndentWidth()));
  }

  public boolean isStrict() {
    return strict;
  }

  // ***** programs and declarations

  /**
   * Includes come first because Dafny requires them before any
   * declaration.  The prelude, if any, follows them.
   */
  public String program(Program p, Context ctx) {
    logger.debug("Printing program " + p.name + " with " + p.decls.size() +
                 " top-level declarations");
    List<String> includes = new ArrayList<String>();
    for (Decl d: p.decls) {
      if (d.kind() == DeclKind.INCLUDE) {
        includes.add(include((Include)d));
      }
    }
    StringBuilder sb = new StringBuilder();
    sb.append(StringUtils.join(includes, "\n"));
    sb.append("\n");
    String prelude = p.meta.prelude();
    if (!prelude.isEmpty()) {
      sb.append(PRELUDE_START).append("\n");
      sb.append(prelude);
      sb.append("\n").append(PRELUDE_END);
    } else {
      sb.append("\n");
    }
    sb.append(declsGeneral(p.decls, ctx, false));
    return sb.toString();
  }

  private String include(Include inc) {
    return "include \"" + StringUtils.join(inc.path.names(), "/") + "\"";
  }

  private String declsGeneral(List<Decl> ds, Context ctx, boolean braced) {
    StringBuilder sb = new StringBuilder();
    for (Decl d: ds) {
      // includes are printed first by program()
      if (d.kind() != DeclKind.INCLUDE) {
        sb.append(decl(d, ctx)).append("\n\n");
      }
    }
    return indentation.indented(sb.toString(), braced);
  }

  /**
   * Children of a declaration, in braces
   */
  private String members(List<Decl> ds, Context ctx) {
    return declsGeneral(ds, ctx, true);
  }

  public String decl(Decl d, Context ctx) {
    String comment = "";
    if (printComments && d.meta().comment() != null) {
      comment = "/* " + d.meta().comment() + " */\n";
    }
    return comment + declCore(d, ctx);
  }

  private String declCore(Decl d, Context ctx) {
    switch (d.kind()) {
      case INCLUDE:
        return "";
      case MODULE:
        return "module " + d.name() + members(d.children(),
                                              ctx.enter(d.name()));
      case DATATYPE:
        return datatype((Datatype)d, ctx);
      case CLASS:
        return classDecl((ClassDecl)d, ctx);
      case TYPE_DEF:
        return typeDef((TypeDef)d, ctx);
      case FIELD:
        return field((Field)d, ctx);
      case METHOD:
        return method((Method)d, ctx);
      case CLASS_CONSTRUCTOR:
        return classConstructor((ClassConstructor)d, ctx);
      case IMPORT:
        return ((Decls.Import)d).directive.toString();
      case EXPORT:
        return ((Decls.Export)d).spec.toString();
      case UNIMPLEMENTED:
        Logging.uniqueWarn(UNIMPLEMENTED_WARNING);
        return UNIMPLEMENTED;
      default:
        throw new UnsupportedConstructError("Unknown declaration kind " +
                                            d.kind());
    }
  }

  private String datatype(Datatype dt, Context ctx) {
    List<String> ctors = new ArrayList<String>();
    for (DatatypeConstructor c: dt.constructors) {
      ctors.add(datatypeConstructor(c));
    }
    Context inner = ctx.enter(dt.name).addTypeParams(dt.typeParams);
    return "datatype " + dt.name + typeParams(dt.typeParams, true) + " = " +
           StringUtils.join(ctors, " | ") + members(dt.members, inner);
  }

  private String datatypeConstructor(DatatypeConstructor c) {
    if (c.inputs.isEmpty()) {
      return c.name;
    }
    return c.name + localDecls(c.inputs);
  }

  private String classDecl(ClassDecl cls, Context ctx) {
    StringBuilder sb = new StringBuilder();
    sb.append(cls.isTrait ? "trait " : "class ");
    sb.append(cls.name);
    sb.append(typeParams(cls.typeParams, true));
    if (!cls.superTypes.isEmpty()) {
      List<String> supers = new ArrayList<String>();
      for (ClassType ct: cls.superTypes) {
        supers.add(classType(ct));
      }
      sb.append(" extends ").append(StringUtils.join(supers, ","));
    }
    Context inner = ctx.enter(cls.name).addTypeParams(cls.typeParams);
    sb.append(members(cls.members, inner));
    return sb.toString();
  }

  private String typeDef(TypeDef td, Context ctx) {
    String rhs;
    if (td.hasPredicate()) {
      Context predCtx = ctx.enter(td.name).addTypeParams(td.typeParams)
                           .add(td.predicateVar, td.superType);
      rhs = localDecl(new LocalDecl(td.predicateVar, td.superType), false) +
            " | " + expr(td.predicate, predCtx);
    } else {
      rhs = type(td.superType);
    }
    return (td.isNewType ? "newtype " : "type ") + td.name +
           typeParams(td.typeParams, true) + " = " + rhs;
  }

  private String field(Field f, Context ctx) {
    String init = "";
    if (f.init != null) {
      init = " := " + expr(f.init, ctx);
    }
    return staticModifier(f.isStatic, ctx) + ghost(f.ghost) +
           (f.isMutable ? "var " : "const ") + f.name + ": " + type(f.type) +
           init;
  }

  private String method(Method m, Context ctx) {
    MethodKind kind = m.methodKind;
    Context clauseCtx = ctx.enter(m.name).addTypeParams(m.typeParams)
                         .add(m.ins.decls).add(m.outs.namedDecls());
    Context bodyCtx = clauseCtx.enterBody();

    StringBuilder sb = new StringBuilder();
    sb.append(staticModifier(m.isStatic, ctx));
    // intrinsically ghost kinds must not repeat the keyword
    if (!kind.isGhost()) {
      sb.append(ghost(m.ghost));
    }
    sb.append(kind).append(" ").append(m.name);
    sb.append(typeParams(m.typeParams, false));
    sb.append(localDecls(m.ins.decls));
    sb.append(outputs(m));

    List<String> clauses = new ArrayList<String>();
    addClause(clauses, "modifies", m.modifies, clauseCtx);
    addClause(clauses, "reads", m.reads, clauseCtx);
    addClause(clauses, "decreases", m.decreases, clauseCtx);
    for (Expr c: m.ins.conditions) {
      clauses.add("requires " + expr(c, clauseCtx));
    }
    for (Expr c: m.outs.conditions) {
      clauses.add("ensures " + expr(c, clauseCtx));
    }
    if (!clauses.isEmpty()) {
      sb.append(indentation.indented(StringUtils.join(clauses, "\n"), false));
    }
    sb.append("\n");

    if (m.body != null) {
      if (kind.hasStatementBody()) {
        sb.append(statement(Exprs.block(m.body), bodyCtx));
      } else {
        sb.append(indentation.indentedBraced(expr(m.body, bodyCtx)));
      }
    }
    return sb.toString();
  }

  private String outputs(Method m) {
    MethodKind kind = m.methodKind;
    if (kind.isPredicate()) {
      return "";
    }
    if (kind.isFunctionLike()) {
      Type outType = m.outs.outputType();
      if (outType != null) {
        return ": " + type(outType);
      }
      return ": " + localDecls(m.outs.decls);
    }
    // lemmas only name their outputs if they have any
    List<LocalDecl> outs = kind == MethodKind.LEMMA ?
        m.outs.namedDecls() : m.outs.decls;
    if (outs.isEmpty()) {
      return "";
    }
    return " returns " + localDecls(outs);
  }

  private void addClause(List<String> clauses, String keyword,
                         List<Expr> es, Context ctx) {
    if (!es.isEmpty()) {
      clauses.add(keyword + " " + exprs(es, ", ", ctx));
    }
  }

  private String classConstructor(ClassConstructor cc, Context ctx) {
    Context ctorCtx = ctx.enter(cc.name).addTypeParams(cc.typeParams)
                         .add(cc.ins.decls);
    StringBuilder sb = new StringBuilder("constructor");
    if (!cc.name.equals(ClassConstructor.DEFAULT_NAME)) {
      sb.append(" ").append(cc.name);
    }
    sb.append(typeParams(cc.typeParams, false));
    sb.append(localDecls(cc.ins.decls));
    List<String> clauses = new ArrayList<String>();
    for (Expr c: cc.ins.conditions) {
      clauses.add("requires " + expr(c, ctorCtx));
    }
    for (Expr c: cc.ensures) {
      clauses.add("ensures " + expr(c, ctorCtx));
    }
    if (!clauses.isEmpty()) {
      sb.append(indentation.indented(StringUtils.join(clauses, "\n"), false));
    }
    sb.append("\n");
    if (cc.body != null) {
      sb.append(statement(Exprs.block(cc.body), ctorCtx.enterBody()));
    } else {
      sb.append("{}");
    }
    return sb.toString();
  }

  private String ghost(boolean g) {
    return g ? "ghost " : "";
  }

  /**
   * Members of modules are static anyway, and Dafny rejects the keyword
   * there.
   */
  private String staticModifier(boolean isStatic, Context ctx) {
    if (isStatic && !(strict && ctx.lookupCurrent().isModule())) {
      return "static ";
    }
    return "";
  }

  /**
   * Variance and equality constraints are only printed where type
   * parameters are declared for datatypes and classes.
   */
  private String typeParam(TypeArg ta, boolean inDecl) {
    if (!inDecl) {
      return ta.name;
    }
    String variance;
    switch (ta.variance) {
      case COVARIANT:
        variance = "+";
        break;
      case CONTRAVARIANT:
        variance = "-";
        break;
      default:
        variance = "";
    }
    return variance + ta.name + (ta.requiresEquality ? "(==)" : "");
  }

  private String typeParams(List<TypeArg> tps, boolean inDecl) {
    if (tps.isEmpty()) {
      return "";
    }
    List<String> strs = new ArrayList<String>(tps.size());
    for (TypeArg ta: tps) {
      strs.add(typeParam(ta, inDecl));
    }
    return "<" + StringUtils.join(strs, ", ") + ">";
  }

  // ***** types

  public String type(Type t) {
    switch (t.kind()) {
      case UNIT:
        return "()";
      case TUPLE:
        return "(" + types(((TupleType)t).elems(), ", ") + ")";
      case FUNCTION: {
        FunctionType ft = (FunctionType)t;
        String ins;
        if (ft.ins().size() == 1) {
          ins = type(ft.ins().get(0));
        } else {
          ins = "(" + types(ft.ins(), ", ") + ")";
        }
        return ins + " -> " + type(ft.out());
      }
      case SEQ:
      case SET: {
        CollectionType ct = (CollectionType)t;
        String prefix = t.kind() == TypeKind.SEQ ? "seq" : "set";
        return prefix + ct.bound() + "<" + type(ct.elem()) + ">";
      }
      case ARRAY: {
        CollectionType ct = (CollectionType)t;
        return "array" + ct.bound() + "<" + type(ct.elem()) + ">";
      }
      case MAP: {
        MapType mt = (MapType)t;
        return "map" + mt.bound() + "<" + type(mt.key()) + ", " +
               type(mt.value()) + ">";
      }
      case NULLABLE:
        return type(((NullableType)t).base()) + "?";
      case APPLY: {
        ApplyType at = (ApplyType)t;
        return at.path() + typeArgs(at.args());
      }
      default:
        return t.toString();
    }
  }

  private String types(List<Type> ts, String sep) {
    List<String> strs = new ArrayList<String>(ts.size());
    for (Type t: ts) {
      strs.add(type(t));
    }
    return StringUtils.join(strs, sep);
  }

  private String typeArgs(List<Type> ts) {
    if (ts.isEmpty()) {
      return "";
    }
    return "<" + types(ts, ",") + ">";
  }

  private String classType(ClassType ct) {
    return ct.path + typeArgs(ct.typeArgs);
  }

  // ***** local declarations

  /**
   * Replace names generated by the Dafny resolver that are not valid
   * Dafny concrete syntax
   */
  static String mangle(String name) {
    String n = name.replace("_mcc#", "mcc_");
    if (n.startsWith("_")) {
      // generated anonymous variable
      return "_";
    }
    return n;
  }

  private String localDecl(LocalDecl ld, boolean withGhost) {
    return (withGhost ? ghost(ld.ghost) : "") + mangle(ld.name) + ": " +
           type(ld.type);
  }

  private String localDeclsNoBr(List<LocalDecl> lds, boolean withGhost) {
    List<String> strs = new ArrayList<String>(lds.size());
    for (LocalDecl ld: lds) {
      strs.add(localDecl(ld, withGhost));
    }
    return StringUtils.join(strs, ", ");
  }

  /**
   * Parameter lists, with ghost markers
   */
  private String localDecls(List<LocalDecl> lds) {
    return "(" + localDeclsNoBr(lds, true) + ")";
  }

  // ***** statements

  /**
   * @return true if the statement form of e must not be followed by a
   *         separator, e.g. because it ends with a block
   */
  public boolean noPrintSep(Expr e) {
    switch (e.kind()) {
      case IF:
      case FOR:
      case WHILE:
      case BLOCK:
      case MATCH:
      case UNIMPLEMENTED:
        return true;
      case REVEAL:
        return ((RevealExpr)e).exprs.isEmpty();
      case COMMENTED:
        return noPrintSep(((CommentedExpr)e).expr);
      case LET:
        return noPrintSep(((LetExpr)e).body);
      default:
        return false;
    }
  }

  /**
   * Print e as a statement, terminated by a separator where needed
   * @throws UnsupportedConstructError if e has no statement form
   */
  public String statement(Expr e, Context ctx) {
    String core = statementCore(e, ctx);
    if (noPrintSep(e)) {
      return core;
    }
    return core + ";";
  }

  private String statementCore(Expr e, Context ctx) {
    switch (e.kind()) {
      case ASSERT:
        return "assert " + expr(((AssertExpr)e).expr, ctx);
      case ASSUME:
        return "assume " + expr(((AssumeExpr)e).expr, ctx);
      case EXPECT:
        return "expect " + expr(((ExpectExpr)e).expr, ctx);
      case BLOCK:
        return statementBlock((BlockExpr)e, ctx);
      case BREAK:
        return breakStmt((BreakExpr)e);
      case IF: {
        IfExpr ife = (IfExpr)e;
        String s = "if (" + expr(ife.cond, ctx) + ")" +
                   statement(Exprs.block(ife.thenBranch), ctx);
        if (ife.elseBranch != null) {
          s += " else" + statement(Exprs.block(ife.elseBranch), ctx);
        }
        return s;
      }
      case MATCH:
        return match((MatchExpr)e, ctx, true);
      case PRINT:
        return "print " + exprs(((PrintExpr)e).exprs, ", ", ctx);
      case RETURN: {
        List<Expr> values = ((ReturnExpr)e).values;
        if (values.isEmpty()) {
          return "return";
        }
        return "return " + exprs(values, ", ", ctx);
      }
      case REVEAL: {
        List<Expr> es = ((RevealExpr)e).exprs;
        if (es.isEmpty()) {
          // unresolved reveals are dropped by the front-end
          return "";
        }
        return "reveal " + exprs(es, ", ", ctx);
      }
      case WHILE: {
        WhileExpr w = (WhileExpr)e;
        return label(w.label) + "while (" + expr(w.cond, ctx) + ")" +
               statement(Exprs.block(w.body), ctx);
      }
      case FOR: {
        ForExpr f = (ForExpr)e;
        return forHeader(f, ctx) +
            statement(Exprs.block(f.body),
                      ctx.setPosition(ContextPosition.IN_FOR_LOOP_BODY)
                         .add(ImmutableList.of(f.index)));
      }
      case LET: {
        LetExpr let = (LetExpr)e;
        return letHeader(let, ctx) + " " +
               statementCore(let.body, ctx.add(let.var, let.type));
      }
      case COMMENTED: {
        CommentedExpr c = (CommentedExpr)e;
        return "/* " + c.comment + " */ " + statementCore(c.expr, ctx);
      }
      case VAR:
      case MEMBER_REF:
      case DECLS:
      case UPDATE:
      case METHOD_APPLY:
      case ARRAY_UPDATE:
        return expr(e, ctx);
      case DECL_CHOICE:
        return declChoice((DeclChoiceExpr)e, ctx);
      case UNIMPLEMENTED:
        Logging.uniqueWarn(UNIMPLEMENTED_WARNING);
        return UNIMPLEMENTED_STATEMENT;
      default:
        throw new UnsupportedConstructError(
            "encountered non-statement in statement position: " + e);
    }
  }

  private String statementBlock(BlockExpr b, Context ctx) {
    List<String> stmts = new ArrayList<String>();
    Context inner = ctx;
    for (Expr s: withoutEmptyBlocks(b.exprs)) {
      stmts.add(statement(s, inner));
      // later statements see the variables declared by earlier ones
      inner = inner.add(Exprs.exprDecl(s));
    }
    return indentation.indentedBraced(StringUtils.join(stmts, "\n"));
  }

  /**
   * Empty blocks are usually artifacts of processing by the front-end
   */
  private List<Expr> withoutEmptyBlocks(List<Expr> es) {
    List<Expr> result = new ArrayList<Expr>(es.size());
    for (Expr e: es) {
      if (Exprs.isEmptyBlock(e)) {
        if (logger.isTraceEnabled()) {
          logger.trace("Dropping empty block " + e);
        }
      } else {
        result.add(e);
      }
    }
    return result;
  }

  // ***** expressions

  public String expr(Expr e, Context ctx) {
    switch (e.kind()) {
      case VAR:
        return mangle(((VarExpr)e).name);
      case THIS:
        return "this";
      case NEW: {
        NewExpr n = (NewExpr)e;
        return "new " + classType(n.classType) + args(n.args, ctx);
      }
      case NULL:
        return "null";
      case NEW_ARRAY: {
        NewArrayExpr na = (NewArrayExpr)e;
        return "new " + type(na.elemType) + dims(na.dims, ctx);
      }
      case MEMBER_REF: {
        MemberRefExpr mr = (MemberRefExpr)e;
        return receiver(mr.receiver, ctx) + mr.member.name();
      }
      case BOOL:
        return ((BoolExpr)e).value ? "true" : "false";
      case CHAR:
        return "'" + ((CharExpr)e).value + "'";
      case STRING:
        return "\"" + ((StringExpr)e).value + "\"";
      case TO_STRING:
        return "[" + exprs(((ToStringExpr)e).elems, ", ", ctx) + "]";
      case INT:
        return ((IntExpr)e).value.toString();
      case REAL:
        return realLiteral(((RealExpr)e).value);
      case QUANT:
        return quant((QuantExpr)e, ctx);
      case OLD:
        return "old(" + expr(((OldExpr)e).expr, ctx) + ")";
      case TUPLE:
        return args(((TupleExpr)e).elems, ctx);
      case PROJ: {
        ProjExpr p = (ProjExpr)e;
        return expr(p.tuple, ctx) + "." + p.index;
      }
      case FUN: {
        FunExpr f = (FunExpr)e;
        return localDecls(f.vars) + " => " + expr(f.body, ctx.add(f.vars));
      }
      case SET:
        return "{" + exprs(((SetExpr)e).elems, ", ", ctx) + "}";
      case SET_COMP: {
        SetCompExpr sc = (SetCompExpr)e;
        Context inner = ctx.add(sc.vars);
        return "set " + localDeclsNoBr(sc.vars, false) + " | " +
               expr(sc.pred, inner) + " :: " + expr(sc.body, inner);
      }
      case SEQ:
        return "[" + exprs(((SeqExpr)e).elems, ", ", ctx) + "]";
      case SEQ_CONSTR: {
        SeqConstrExpr sc = (SeqConstrExpr)e;
        return "seq(" + expr(sc.length, ctx) + ", " + expr(sc.init, ctx) + ")";
      }
      case SEQ_SELECT:
        return seqSelect((SeqSelectExpr)e, ctx);
      case SEQ_UPDATE: {
        SeqUpdateExpr su = (SeqUpdateExpr)e;
        return expr(su.seq, ctx) + "[" + expr(su.index, ctx) + " := " +
               expr(su.value, ctx) + "]";
      }
      case MULTI_SELECT: {
        MultiSelectExpr ms = (MultiSelectExpr)e;
        return expr(ms.array, ctx) + dims(ms.indices, ctx);
      }
      case ARRAY_UPDATE: {
        ArrayUpdateExpr au = (ArrayUpdateExpr)e;
        return expr(au.array, ctx) + dims(au.indices, ctx) + " := " +
               expr(au.value, ctx);
      }
      case MAP_KEYS:
        return expr(((MapKeysExpr)e).map, ctx) + ".Keys";
      case MAP_DISPLAY:
        return mapDisplay((MapDisplayExpr)e, ctx);
      case MAP_COMP:
        return mapComp((MapCompExpr)e, ctx);
      case UN_OP_APPLY: {
        UnOpApplyExpr u = (UnOpApplyExpr)e;
        return unaryOperator(u.op, expr(u.arg, ctx));
      }
      case BIN_OP_APPLY: {
        BinOpApplyExpr b = (BinOpApplyExpr)e;
        return binaryOperator(b.op, expr(b.left, ctx), expr(b.right, ctx));
      }
      case ANON_APPLY: {
        AnonApplyExpr a = (AnonApplyExpr)e;
        return expr(a.fn, ctx) + args(a.args, ctx);
      }
      case METHOD_APPLY: {
        MethodApplyExpr m = (MethodApplyExpr)e;
        return receiver(m.receiver, ctx) + m.method.name() +
               args(m.args, ctx);
      }
      case CONSTRUCTOR_APPLY: {
        ConstructorApplyExpr c = (ConstructorApplyExpr)e;
        String name;
        if (ctx.position() == ContextPosition.PATTERN) {
          name = c.constructor.name();
        } else {
          name = c.constructor.toString();
        }
        return name + args(c.args, ctx);
      }
      case TYPE_CONVERSION: {
        TypeConversionExpr tc = (TypeConversionExpr)e;
        return "(" + expr(tc.expr, ctx) + " as " + type(tc.toType) + ")";
      }
      case TYPE_TEST: {
        TypeTestExpr tt = (TypeTestExpr)e;
        return "(" + expr(tt.expr, ctx) + " is " + type(tt.type) + ")";
      }
      case BLOCK:
        return exprBlock((BlockExpr)e, ctx);
      case LET: {
        LetExpr let = (LetExpr)e;
        return letHeader(let, ctx) + " " +
               expr(let.body, ctx.add(let.var, let.type));
      }
      case IF: {
        IfExpr ife = (IfExpr)e;
        String s = "if " + expr(ife.cond, ctx) + " then " +
                   expr(ife.thenBranch, ctx);
        if (ife.elseBranch != null) {
          s += " else " + expr(ife.elseBranch, ctx);
        }
        return s;
      }
      case FOR: {
        ForExpr f = (ForExpr)e;
        return forHeader(f, ctx) + " " +
            expr(f.body, ctx.setPosition(ContextPosition.IN_FOR_LOOP_BODY)
                            .add(ImmutableList.of(f.index)));
      }
      case WHILE: {
        WhileExpr w = (WhileExpr)e;
        return label(w.label) + "while (" + expr(w.cond, ctx) + ") " +
               expr(w.body, ctx);
      }
      case RETURN:
        return exprs(((ReturnExpr)e).values, ", ", ctx);
      case BREAK:
        return breakStmt((BreakExpr)e);
      case MATCH:
        return match((MatchExpr)e, ctx, false);
      case DECLS:
        return decls((DeclsExpr)e, ctx);
      case UPDATE: {
        UpdateExpr u = (UpdateExpr)e;
        return exprs(u.lhs, ", ", ctx) + update(u.rhs, ctx);
      }
      case DECL_CHOICE:
        return declChoice((DeclChoiceExpr)e, ctx);
      case PRINT:
        return "print " + exprs(((PrintExpr)e).exprs, ", ", ctx);
      case ASSERT:
        return "assert " + expr(((AssertExpr)e).expr, ctx);
      case ASSUME:
        return "assume " + expr(((AssumeExpr)e).expr, ctx);
      case EXPECT:
        return "expect " + expr(((ExpectExpr)e).expr, ctx);
      case REVEAL: {
        List<Expr> es = ((RevealExpr)e).exprs;
        if (es.isEmpty()) {
          // Dafny does not allow an empty reveal
          return "reveal true";
        }
        return "reveal " + exprs(es, ", ", ctx);
      }
      case COMMENTED: {
        CommentedExpr c = (CommentedExpr)e;
        return "/* " + c.comment + " */ " + expr(c.expr, ctx);
      }
      case UNIMPLEMENTED:
        Logging.uniqueWarn(UNIMPLEMENTED_WARNING);
        return UNIMPLEMENTED;
      default:
        throw new UnsupportedConstructError("Unknown expression kind " +
                                            e.kind());
    }
  }

  /**
   * Sequence of expressions.  Braces are omitted since Dafny would parse
   * them as a set display.
   */
  private String exprBlock(BlockExpr b, Context ctx) {
    List<String> strs = new ArrayList<String>();
    Context inner = ctx;
    for (Expr s: withoutEmptyBlocks(b.exprs)) {
      strs.add(expr(s, inner));
      inner = inner.add(Exprs.exprDecl(s));
    }
    return indentation.indented(StringUtils.join(strs, "; "), false);
  }

  private String quant(QuantExpr q, Context ctx) {
    Context inner = ctx.add(q.vars);
    String guard = "";
    if (q.guard != null) {
      guard = expr(q.guard, inner) +
          (q.quantifier == Quantifier.FORALL ? " ==> " : " && ");
    }
    return "(" + q.quantifier + " " + localDeclsNoBr(q.vars, false) +
           " :: " + guard + expr(q.body, inner) + ")";
  }

  private String seqSelect(SeqSelectExpr s, Context ctx) {
    if (s.element) {
      return expr(s.seq, ctx) + "[" + expr(s.from, ctx) + "]";
    }
    return expr(s.seq, ctx) + "[" + exprOpt(s.from, ctx) + ".." +
           exprOpt(s.to, ctx) + "]";
  }

  private String mapDisplay(MapDisplayExpr m, Context ctx) {
    List<String> entries = new ArrayList<String>(m.entries.size());
    for (Pair<Expr, Expr> kv: m.entries) {
      entries.add(expr(kv.val1, ctx) + " := " + expr(kv.val2, ctx));
    }
    return "map[" + StringUtils.join(entries, ", ") + "]";
  }

  private String mapComp(MapCompExpr m, Context ctx) {
    Context inner = ctx.add(m.vars);
    String key = "";
    if (m.key != null) {
      key = expr(m.key, inner) + " := ";
    }
    return "map " + localDeclsNoBr(m.vars, false) + " | " +
           expr(m.pred, inner) + " :: " + key + expr(m.value, inner);
  }

  private String letHeader(LetExpr let, Context ctx) {
    return "var " + mangle(let.var) + ": " + type(let.type) +
           (let.exact ? " := " : " :| ") + expr(let.def, ctx) + ";";
  }

  /**
   * The loop index is declared in the initializer
   */
  private String forHeader(ForExpr f, Context ctx) {
    Expr init = new DeclsExpr(ImmutableList.of(
        Pair.create(f.index, UpdateRHS.plain(f.init))));
    Context initCtx = ctx.setPosition(ContextPosition.IN_FOR_LOOP_INITIALIZER);
    return "for " + expr(init, initCtx) + (f.up ? " to " : " downto ") +
           expr(f.last, ctx);
  }

  /**
   * Dafny requires the label keyword; lenient output keeps the bare
   * form of older Dafny versions
   */
  private String label(String label) {
    if (label == null) {
      return "";
    }
    return (strict ? "label " : "") + label + ": ";
  }

  private String breakStmt(BreakExpr b) {
    return b.label == null ? "break" : "break " + b.label;
  }

  private String declChoice(DeclChoiceExpr dc, Context ctx) {
    return "var " + localDecl(dc.decl, false) + " :| " +
           expr(dc.pred, ctx.add(ImmutableList.of(dc.decl)));
  }

  /**
   * var x: T, y: U := a, b
   * Declarations that only partly have initial values are split into
   * separate declarations.
   */
  private String decls(DeclsExpr d, Context ctx) {
    if (d.decls.isEmpty()) {
      return "";
    }
    boolean allInit = true;
    boolean noneInit = true;
    for (Pair<LocalDecl, UpdateRHS> p: d.decls) {
      if (p.val2 == null) {
        allInit = false;
      } else {
        noneInit = false;
      }
    }
    if (!allInit && !noneInit) {
      List<String> parts = new ArrayList<String>(d.decls.size());
      for (Pair<LocalDecl, UpdateRHS> p: d.decls) {
        parts.add(decls(new DeclsExpr(ImmutableList.of(p)), ctx));
      }
      return StringUtils.join(parts, "; ");
    }

    String qualifier;
    if (ctx.position() == ContextPosition.IN_FOR_LOOP_INITIALIZER) {
      qualifier = "";
    } else if (d.decls.get(0).val1.ghost) {
      qualifier = "ghost var ";
    } else {
      qualifier = "var ";
    }
    String lhs = localDeclsNoBr(d.localDecls(), false);
    if (noneInit) {
      return qualifier + lhs;
    }
    List<Expr> values = new ArrayList<Expr>(d.decls.size());
    boolean monadic = false;
    for (Pair<LocalDecl, UpdateRHS> p: d.decls) {
      values.add(p.val2.value);
      monadic = monadic || p.val2.isMonadic();
    }
    return qualifier + lhs + " " + (monadic ? ":-" : ":=") + " " +
           exprs(values, ", ", ctx);
  }

  private String update(UpdateRHS u, Context ctx) {
    return " " + (u.isMonadic() ? ":-" : ":=") + " " + expr(u.value, ctx);
  }

  private String match(MatchExpr m, Context ctx, boolean asStatement) {
    List<Case> cases = new ArrayList<Case>(m.cases);
    if (m.dflt != null) {
      cases.add(new Case(ImmutableList.<LocalDecl>of(), Exprs.WILDCARD,
                         m.dflt));
    }
    List<String> strs = new ArrayList<String>(cases.size());
    for (Case c: cases) {
      strs.add(matchCase(c, ctx, asStatement));
    }
    return "match " + expr(m.on, ctx) +
           indentation.indentedBraced(StringUtils.join(strs, "\n"));
  }

  private String matchCase(Case c, Context ctx, boolean asStatement) {
    Context inner = ctx.add(c.boundVars);
    String body;
    if (asStatement) {
      body = statement(c.body, inner);
    } else {
      body = expr(c.body, inner);
    }
    return "case " +
           expr(c.pattern, inner.setPosition(ContextPosition.PATTERN)) +
           " =>" + indentation.indented(body, false);
  }

  /**
   * Dafny real literals need a decimal point
   */
  private String realLiteral(BigDecimal v) {
    String s = v.toPlainString();
    if (s.indexOf('.') < 0) {
      s += ".0";
    }
    return s;
  }

  private String receiver(Receiver r, Context ctx) {
    String s;
    if (r instanceof StaticReceiver) {
      s = classType(((StaticReceiver)r).classType);
    } else {
      s = expr(((ObjectReceiver)r).object, ctx);
    }
    return s.isEmpty() ? "" : s + ".";
  }

  private String exprs(List<Expr> es, String sep, Context ctx) {
    List<String> strs = new ArrayList<String>(es.size());
    for (Expr e: es) {
      strs.add(expr(e, ctx));
    }
    return StringUtils.join(strs, sep);
  }

  private String exprOpt(Expr e, Context ctx) {
    return e == null ? "" : expr(e, ctx);
  }

  private String args(List<Expr> es, Context ctx) {
    return "(" + exprs(es, ", ", ctx) + ")";
  }

  /** array dimensions or indices */
  private String dims(List<Expr> es, Context ctx) {
    return "[" + exprs(es, ", ", ctx) + "]";
  }

  // ***** operators

  /**
   * @throws UnsupportedConstructError if the operator is unknown
   */
  public String unaryOperator(String op, String arg) {
    return UnaryOp.fromName(op).render(arg);
  }

  /**
   * Binary applications are always parenthesized, so precedence never
   * matters.
   * @throws UnsupportedConstructError if the operator is unknown
   */
  public String binaryOperator(String op, String left, String right) {
    return "(" + left + " " + BinaryOp.fromName(op).syntax() + " " + right +
           ")";
  }
}
