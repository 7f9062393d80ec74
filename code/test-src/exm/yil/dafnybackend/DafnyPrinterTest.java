package exm.yil.dafnybackend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;

import org.apache.commons.lang3.StringUtils;
import org.junit.After;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

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
import exm.yil.common.lang.Decls.Field;
import exm.yil.common.lang.Decls.Include;
import exm.yil.common.lang.Decls.Method;
import exm.yil.common.lang.Decls.Module;
import exm.yil.common.lang.Decls.TypeDef;
import exm.yil.common.lang.Exprs;
import exm.yil.common.lang.Exprs.ArrayUpdateExpr;
import exm.yil.common.lang.Exprs.AssertExpr;
import exm.yil.common.lang.Exprs.BinOpApplyExpr;
import exm.yil.common.lang.Exprs.BlockExpr;
import exm.yil.common.lang.Exprs.BreakExpr;
import exm.yil.common.lang.Exprs.Case;
import exm.yil.common.lang.Exprs.CharExpr;
import exm.yil.common.lang.Exprs.CommentedExpr;
import exm.yil.common.lang.Exprs.ConstructorApplyExpr;
import exm.yil.common.lang.Exprs.DeclChoiceExpr;
import exm.yil.common.lang.Exprs.DeclsExpr;
import exm.yil.common.lang.Exprs.Expr;
import exm.yil.common.lang.Exprs.ForExpr;
import exm.yil.common.lang.Exprs.IfExpr;
import exm.yil.common.lang.Exprs.IntExpr;
import exm.yil.common.lang.Exprs.LetExpr;
import exm.yil.common.lang.Exprs.MapDisplayExpr;
import exm.yil.common.lang.Exprs.MapKeysExpr;
import exm.yil.common.lang.Exprs.MatchExpr;
import exm.yil.common.lang.Exprs.MethodApplyExpr;
import exm.yil.common.lang.Exprs.NewArrayExpr;
import exm.yil.common.lang.Exprs.NewExpr;
import exm.yil.common.lang.Exprs.ObjectReceiver;
import exm.yil.common.lang.Exprs.PrintExpr;
import exm.yil.common.lang.Exprs.QuantExpr;
import exm.yil.common.lang.Exprs.Quantifier;
import exm.yil.common.lang.Exprs.RealExpr;
import exm.yil.common.lang.Exprs.ReturnExpr;
import exm.yil.common.lang.Exprs.RevealExpr;
import exm.yil.common.lang.Exprs.SeqConstrExpr;
import exm.yil.common.lang.Exprs.SeqSelectExpr;
import exm.yil.common.lang.Exprs.SeqUpdateExpr;
import exm.yil.common.lang.Exprs.SetExpr;
import exm.yil.common.lang.Exprs.StaticReceiver;
import exm.yil.common.lang.Exprs.StringExpr;
import exm.yil.common.lang.Exprs.TypeConversionExpr;
import exm.yil.common.lang.Exprs.TypeTestExpr;
import exm.yil.common.lang.Exprs.UnOpApplyExpr;
import exm.yil.common.lang.Exprs.UpdateExpr;
import exm.yil.common.lang.Exprs.UpdateRHS;
import exm.yil.common.lang.Exprs.WhileExpr;
import exm.yil.common.lang.InputSpec;
import exm.yil.common.lang.LocalDecl;
import exm.yil.common.lang.Meta;
import exm.yil.common.lang.MethodKind;
import exm.yil.common.lang.OutputSpec;
import exm.yil.common.lang.Path;
import exm.yil.common.lang.Program;
import exm.yil.common.lang.TypeArg;
import exm.yil.common.lang.Types;
import exm.yil.common.lang.Types.FunctionType;
import exm.yil.common.lang.Types.NullableType;
import exm.yil.common.lang.Types.Type;
import exm.yil.common.util.Pair;
import exm.yil.frontend.Context;
import exm.yil.frontend.ContextPosition;

public class DafnyPrinterTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static final DafnyPrinter P = DafnyPrinter.printer();

  private static final Context CTX = Context.empty();

  private static final LocalDecl X_INT = new LocalDecl("x", Types.INT);
  private static final LocalDecl Y_BOOL = new LocalDecl("y", Types.BOOL);

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/DafnyPrinterTest.yil.log", true);
  }

  @After
  public void resetSettings() {
    Settings.reset();
  }

  private static Expr v(String name) {
    return Exprs.var(name);
  }

  private static Expr num(long i) {
    return Exprs.intLit(i);
  }

  private static Expr bin(String op, Expr l, Expr r) {
    return new BinOpApplyExpr(op, l, r);
  }

  private static Expr assign(String var, Expr value) {
    return new UpdateExpr(ImmutableList.of(v(var)), UpdateRHS.plain(value));
  }

  private static DeclsExpr decls(LocalDecl ld, Expr init) {
    UpdateRHS rhs = init == null ? null : UpdateRHS.plain(init);
    return new DeclsExpr(ImmutableList.of(Pair.create(ld, rhs)));
  }

  private static Method method(MethodKind kind, String name,
        InputSpec ins, OutputSpec outs, Expr body, boolean ghost) {
    return new Method(kind, name, ImmutableList.<TypeArg>of(), ins, outs,
        ImmutableList.<Expr>of(), ImmutableList.<Expr>of(),
        ImmutableList.<Expr>of(), body, ghost, false, Meta.EMPTY);
  }

  private static InputSpec ins(LocalDecl... lds) {
    return new InputSpec(Arrays.asList(lds), ImmutableList.<Expr>of());
  }

  // ***** operators

  @Test
  public void testBinaryOperator() {
    assertEquals("(true && false)",
                 P.expr(bin("And", Exprs.TRUE, Exprs.FALSE), CTX));
    assertEquals("(x in s)", P.expr(bin("InSet", v("x"), v("s")), CTX));
    assertEquals("((a + b) * c)",
        P.expr(bin("Mul", bin("Add", v("a"), v("b")), v("c")), CTX));
  }

  @Test
  public void testUnknownBinaryOperator() {
    exception.expect(UnsupportedConstructError.class);
    exception.expectMessage("Bogus");
    P.expr(bin("Bogus", Exprs.TRUE, Exprs.FALSE), CTX);
  }

  @Test
  public void testUnaryOperator() {
    assertEquals("|s|", P.expr(new UnOpApplyExpr("Cardinality", v("s")),
                               CTX));
    assertEquals("!b", P.expr(new UnOpApplyExpr("Not", v("b")), CTX));
  }

  // ***** statements and blocks

  @Test
  public void testEmptyBlocksDropped() {
    Expr block = new BlockExpr(ImmutableList.of(assign("a", num(1)),
        Exprs.SKIP, new CommentedExpr("nothing", Exprs.SKIP),
        assign("b", num(2))));
    assertEquals(" {\n  a := 1;\n  b := 2;\n}\n", P.statement(block, CTX));
    assertEquals("\n  a := 1; b := 2", P.expr(block, CTX));
  }

  @Test
  public void testDecls() {
    assertEquals("var x: int := 0", P.expr(decls(X_INT, num(0)), CTX));
    assertEquals("x: int := 0", P.expr(decls(X_INT, num(0)),
        CTX.setPosition(ContextPosition.IN_FOR_LOOP_INITIALIZER)));
    assertEquals("var x: int := 0;", P.statement(decls(X_INT, num(0)), CTX));

    DeclsExpr both = new DeclsExpr(ImmutableList.of(
        Pair.create(X_INT, UpdateRHS.plain(num(1))),
        Pair.create(Y_BOOL, UpdateRHS.plain(Exprs.TRUE))));
    assertEquals("var x: int, y: bool := 1, true", P.expr(both, CTX));

    DeclsExpr none = new DeclsExpr(ImmutableList.of(
        Pair.<LocalDecl, UpdateRHS>create(X_INT, null),
        Pair.<LocalDecl, UpdateRHS>create(Y_BOOL, null)));
    assertEquals("var x: int, y: bool", P.expr(none, CTX));

    DeclsExpr mixed = new DeclsExpr(ImmutableList.of(
        Pair.create(X_INT, UpdateRHS.plain(num(1))),
        Pair.<LocalDecl, UpdateRHS>create(Y_BOOL, null)));
    assertEquals("var x: int := 1; var y: bool", P.expr(mixed, CTX));
  }

  @Test
  public void testMonadicDecl() {
    Type result = Types.apply(Path.of("Result"), Types.INT);
    DeclsExpr d = new DeclsExpr(ImmutableList.of(
        Pair.create(X_INT, new UpdateRHS(v("r"), result))));
    assertEquals("var x: int :- r", P.expr(d, CTX));
    Expr u = new UpdateExpr(ImmutableList.of(v("x")),
                            new UpdateRHS(v("r"), result));
    assertEquals("x :- r;", P.statement(u, CTX));
  }

  @Test
  public void testGhostLocalDecl() {
    LocalDecl g = new LocalDecl("g", Types.INT, true);
    assertEquals("ghost var g: int := 1", P.expr(decls(g, num(1)), CTX));
  }

  @Test
  public void testFor() {
    Expr loop = new ForExpr(new LocalDecl("i", Types.INT), num(0), v("n"),
        true, assign("s", bin("Add", v("s"), v("i"))));
    assertEquals("for i: int := 0 to n {\n  s := (s + i);\n}\n",
                 P.statement(loop, CTX));
    Expr down = new ForExpr(new LocalDecl("i", Types.INT), v("n"), num(0),
        false, Exprs.SKIP);
    assertTrue(P.statement(down, CTX).startsWith("for i: int := n downto 0"));
  }

  @Test
  public void testIf() {
    Expr stmt = new IfExpr(v("c"), assign("x", num(1)), assign("x", num(2)));
    assertEquals("if (c) {\n  x := 1;\n}\n else {\n  x := 2;\n}\n",
                 P.statement(stmt, CTX));
    assertEquals("if (c) {\n  x := 1;\n}\n",
        P.statement(new IfExpr(v("c"), assign("x", num(1)), null), CTX));
    assertEquals("if c then 1 else 2",
                 P.expr(new IfExpr(v("c"), num(1), num(2)), CTX));
    assertEquals("/* note */ if (c) {\n  x := 1;\n}\n",
        P.statement(new CommentedExpr("note",
            new IfExpr(v("c"), assign("x", num(1)), null)), CTX));
  }

  @Test
  public void testWhileAndBreak() {
    Expr loop = new WhileExpr(v("c"), assign("x", num(1)), "outer");
    assertEquals("label outer: while (c) {\n  x := 1;\n}\n",
                 P.statement(loop, CTX));
    assertEquals("outer: while (c) {\n  x := 1;\n}\n",
                 new DafnyPrinter(false).statement(loop, CTX));
    assertEquals("break outer;", P.statement(new BreakExpr("outer"), CTX));
    assertEquals("break;", P.statement(new BreakExpr(null), CTX));
  }

  @Test
  public void testSimpleStatements() {
    assertEquals("assert true;", P.statement(new AssertExpr(Exprs.TRUE), CTX));
    assertEquals("print a, b;", P.statement(
        new PrintExpr(ImmutableList.of(v("a"), v("b"))), CTX));
    assertEquals("return x;", P.statement(
        new ReturnExpr(ImmutableList.of(v("x"))), CTX));
    assertEquals("return;", P.statement(
        new ReturnExpr(ImmutableList.<Expr>of()), CTX));
    assertEquals("", P.statement(
        new RevealExpr(ImmutableList.<Expr>of()), CTX));
    assertEquals("reveal true", P.expr(
        new RevealExpr(ImmutableList.<Expr>of()), CTX));
    assertEquals("reveal f;", P.statement(
        new RevealExpr(ImmutableList.of(v("f"))), CTX));
    assertEquals("var x: int :| (x > 0);", P.statement(
        new DeclChoiceExpr(X_INT, bin("Gt", v("x"), num(0))), CTX));
    assertEquals("/* note */ a := 1;", P.statement(
        new CommentedExpr("note", assign("a", num(1))), CTX));
    assertEquals("var x: int := 1; y := x;", P.statement(
        new LetExpr("x", Types.INT, true, num(1), assign("y", v("x"))), CTX));
    assertEquals("a[i, j] := 0;", P.statement(new ArrayUpdateExpr(v("a"),
        ImmutableList.of(v("i"), v("j")), num(0)), CTX));
  }

  @Test
  public void testMethodCalls() {
    Expr call = new MethodApplyExpr(new ObjectReceiver(v("o")),
        Path.of("M", "C", "m"), ImmutableList.<Type>of(),
        ImmutableList.of(num(1)), false);
    assertEquals("o.m(1);", P.statement(call, CTX));
    Expr staticCall = new MethodApplyExpr(
        new StaticReceiver(new ClassType(Path.of("M"))), Path.of("M", "f"),
        ImmutableList.<Type>of(), ImmutableList.<Expr>of(), false);
    assertEquals("M.f()", P.expr(staticCall, CTX));
  }

  @Test
  public void testNonStatement() {
    exception.expect(UnsupportedConstructError.class);
    exception.expectMessage("non-statement");
    P.statement(num(1), CTX);
  }

  @Test
  public void testUnimplemented() {
    assertEquals("<UNIMPLEMENTED>", P.expr(Exprs.UNIMPLEMENTED, CTX));
    assertEquals("/* UNIMPLEMENTED */",
                 P.statement(Exprs.UNIMPLEMENTED, CTX));
    assertEquals("<UNIMPLEMENTED>", P.decl(Decls.UNIMPLEMENTED, CTX));
  }

  // ***** expressions

  @Test
  public void testNameMangling() {
    assertEquals("mcc_3", P.expr(v("_mcc#3"), CTX));
    assertEquals("_", P.expr(v("_x"), CTX));
    assertEquals("x_", P.expr(v("x_"), CTX));
    assertEquals("var mcc_0: int",
        P.expr(decls(new LocalDecl("_mcc#0", Types.INT), null), CTX));
  }

  @Test
  public void testMatch() {
    LocalDecl y = new LocalDecl("y", Types.INT);
    Path ctor = Path.of("M", "D", "C");
    Case c = Exprs.plainCase(ctor, ImmutableList.of(y), v("y"));
    Expr m = new MatchExpr(v("x"), Types.apply(Path.of("M", "D")),
                           ImmutableList.of(c), num(0));
    assertEquals("match x {\n  case C(y) =>\n    y\n  case _ =>\n    0\n}\n",
                 P.expr(m, CTX));

    Case sc = Exprs.plainCase(ctor, ImmutableList.of(y),
                              assign("z", v("y")));
    Expr stmt = new MatchExpr(v("x"), Types.apply(Path.of("M", "D")),
                              ImmutableList.of(sc), null);
    assertEquals("match x {\n  case C(y) =>\n    z := y;\n}\n",
                 P.statement(stmt, CTX));
  }

  @Test
  public void testConstructorOutsidePattern() {
    Expr c = new ConstructorApplyExpr(Path.of("M", "D", "C"),
        ImmutableList.<Type>of(), ImmutableList.of(num(1)));
    assertEquals("M.D.C(1)", P.expr(c, CTX));
    assertEquals("C(1)",
        P.expr(c, CTX.setPosition(ContextPosition.PATTERN)));
  }

  @Test
  public void testLiterals() {
    assertEquals("3.0", P.expr(new RealExpr(new BigDecimal("3"),
                                            Types.REAL), CTX));
    assertEquals("1.50", P.expr(new RealExpr(new BigDecimal("1.50"),
                                             Types.REAL), CTX));
    assertEquals("'a'", P.expr(new CharExpr("a"), CTX));
    assertEquals("\"hi\\n\"", P.expr(new StringExpr("hi\\n"), CTX));
    assertEquals("12345678901234567890", P.expr(new IntExpr(
        new BigInteger("12345678901234567890"), Types.INT), CTX));
  }

  @Test
  public void testCollections() {
    assertEquals("s[i := x]",
        P.expr(new SeqUpdateExpr(v("s"), v("i"), v("x")), CTX));
    assertEquals("map[1 := true, 2 := false]",
        P.expr(new MapDisplayExpr(ImmutableList.of(
            Pair.create(num(1), Exprs.TRUE),
            Pair.create(num(2), Exprs.FALSE))), CTX));
    Type seqInt = Types.seqType(Types.INT);
    assertEquals("s[i]", P.expr(new SeqSelectExpr(v("s"), seqInt, true,
                                                  v("i"), null), CTX));
    assertEquals("s[..j]", P.expr(new SeqSelectExpr(v("s"), seqInt, false,
                                                    null, v("j")), CTX));
    assertEquals("{1, 2}", P.expr(new SetExpr(Types.setType(Types.INT),
        ImmutableList.of(num(1), num(2))), CTX));
    assertEquals("m.Keys", P.expr(new MapKeysExpr(v("m")), CTX));
    assertEquals("seq(n, f)",
        P.expr(new SeqConstrExpr(seqInt, v("n"), v("f")), CTX));
    assertEquals("new int[n]", P.expr(new NewArrayExpr(Types.INT,
        ImmutableList.of(v("n"))), CTX));
    assertEquals("new M.C(1)", P.expr(new NewExpr(
        new ClassType(Path.of("M", "C")), ImmutableList.of(num(1))), CTX));
  }

  @Test
  public void testQuantifiers() {
    Expr all = new QuantExpr(Quantifier.FORALL, ImmutableList.of(X_INT),
        bin("Gt", v("x"), num(0)), bin("Ge", v("x"), num(0)));
    assertEquals("(forall x: int :: (x > 0) ==> (x >= 0))",
                 P.expr(all, CTX));
    Expr some = new QuantExpr(Quantifier.EXISTS, ImmutableList.of(X_INT),
        bin("Gt", v("x"), num(0)), Exprs.TRUE);
    assertEquals("(exists x: int :: (x > 0) && true)", P.expr(some, CTX));
  }

  @Test
  public void testQuantifierNotAStatement() {
    Expr all = new QuantExpr(Quantifier.FORALL, ImmutableList.of(X_INT),
        null, Exprs.TRUE);
    exception.expect(UnsupportedConstructError.class);
    exception.expectMessage("non-statement");
    P.statement(all, CTX);
  }

  @Test
  public void testLetAndConversions() {
    assertEquals("var x: int := 1; (x + 1)", P.expr(new LetExpr("x",
        Types.INT, true, num(1), bin("Add", v("x"), num(1))), CTX));
    assertEquals("var x: int :| (x > 0); x", P.expr(new LetExpr("x",
        Types.INT, false, bin("Gt", v("x"), num(0)), v("x")), CTX));
    assertEquals("(x as real)",
                 P.expr(new TypeConversionExpr(v("x"), Types.REAL), CTX));
    assertEquals("(o is M.C)", P.expr(new TypeTestExpr(v("o"),
        Types.apply(Path.of("M", "C"))), CTX));
  }

  // ***** types

  @Test
  public void testTypes() {
    assertEquals("()", P.type(Types.UNIT));
    assertEquals("array2<int>",
                 P.type(Types.arrayType(Types.Bound.of(2), Types.INT)));
    assertEquals("array<int>",
                 P.type(Types.arrayType(Types.NO_BOUND, Types.INT)));
    assertEquals("map<int, bool>",
                 P.type(Types.mapType(Types.INT, Types.BOOL)));
    assertEquals("int -> bool", P.type(new FunctionType(
        ImmutableList.of(Types.INT), Types.BOOL)));
    assertEquals("(int, int) -> bool", P.type(new FunctionType(
        ImmutableList.of(Types.INT, Types.INT), Types.BOOL)));
    assertEquals("M.C?", P.type(new NullableType(
        Types.apply(Path.of("M", "C")))));
    assertEquals("(int, bool)", P.type(Types.tupleType(Types.INT,
                                                       Types.BOOL)));
    assertEquals("seq<L<int>>", P.type(Types.seqType(
        Types.apply(Path.of("L"), Types.INT))));
    assertEquals("int32", P.type(Types.intType(Types.BOUND_32)));
  }

  // ***** declarations

  @Test
  public void testMethod() {
    InputSpec in = new InputSpec(ImmutableList.of(X_INT),
        ImmutableList.of(bin("Gt", v("x"), num(0))));
    OutputSpec out = new OutputSpec(
        ImmutableList.of(new LocalDecl("r", Types.INT)),
        ImmutableList.<Expr>of());
    Method m = method(MethodKind.METHOD, "m", in, out,
                      Exprs.block(assign("r", v("x"))), false);
    assertEquals("method m(x: int) returns (r: int)\n" +
                 "  requires (x > 0)\n" +
                 " {\n  r := x;\n}\n", P.decl(m, CTX));
  }

  @Test
  public void testMethodClauses() {
    Method m = new Method(MethodKind.METHOD, "m", ImmutableList.<TypeArg>of(),
        InputSpec.EMPTY, new OutputSpec(ImmutableList.<LocalDecl>of(),
                                        ImmutableList.of(v("p"))),
        ImmutableList.of(v("a")), ImmutableList.<Expr>of(),
        ImmutableList.of(v("n")), null, false, false, Meta.EMPTY);
    assertEquals("method m()\n  modifies a\n  decreases n\n  ensures p\n",
                 P.decl(m, CTX));
  }

  @Test
  public void testFunction() {
    Method f = method(MethodKind.FUNCTION, "f", ins(X_INT),
        OutputSpec.ofType(Types.INT, ImmutableList.<Expr>of()),
        bin("Add", v("x"), num(1)), false);
    assertEquals("function f(x: int): int\n {\n  (x + 1)\n}\n",
                 P.decl(f, CTX));
  }

  @Test
  public void testGhostCombinations() {
    assertTrue(P.decl(method(MethodKind.METHOD, "m", InputSpec.EMPTY,
        OutputSpec.EMPTY, null, true), CTX).startsWith("ghost method m()"));
    assertEquals("Intrinsically ghost kinds do not repeat the keyword",
        "lemma l()\n", P.decl(method(MethodKind.LEMMA, "l", InputSpec.EMPTY,
                                     OutputSpec.EMPTY, null, true), CTX));
    assertEquals("function method f(): int\n",
        P.decl(method(MethodKind.FUNCTION_METHOD, "f", InputSpec.EMPTY,
            OutputSpec.ofType(Types.INT, ImmutableList.<Expr>of()), null,
            false), CTX));
    assertEquals("predicate p(x: int)\n",
        P.decl(method(MethodKind.PREDICATE, "p", ins(X_INT),
            OutputSpec.ofType(Types.BOOL, ImmutableList.<Expr>of()), null,
            false), CTX));
    assertEquals("method m(ghost g: int)\n",
        P.decl(method(MethodKind.METHOD, "m",
            ins(new LocalDecl("g", Types.INT, true)), OutputSpec.EMPTY,
            null, false), CTX));
    assertEquals("lemma l() returns (r: int)\n",
        P.decl(method(MethodKind.LEMMA, "l", InputSpec.EMPTY,
            new OutputSpec(ImmutableList.of(new LocalDecl("r", Types.INT)),
                           ImmutableList.<Expr>of()), null, false), CTX));
    assertEquals("ghost const f: int", P.decl(new Field("f", Types.INT, null,
        true, false, false, Meta.EMPTY), CTX));
  }

  @Test
  public void testOutputsByKind() {
    OutputSpec named = new OutputSpec(
        ImmutableList.of(new LocalDecl("r", Types.INT)),
        ImmutableList.<Expr>of());
    OutputSpec unnamed = OutputSpec.ofType(Types.BOOL,
                                           ImmutableList.<Expr>of());
    assertEquals("predicate method p()\n",
        P.decl(method(MethodKind.PREDICATE_METHOD, "p", InputSpec.EMPTY,
                      unnamed, null, false), CTX));
    assertEquals("function f(): (r: int)\n",
        P.decl(method(MethodKind.FUNCTION, "f", InputSpec.EMPTY, named,
                      null, false), CTX));
    assertEquals("lemma l()\n",
        P.decl(method(MethodKind.LEMMA, "l", InputSpec.EMPTY, unnamed,
                      null, false), CTX));
    assertEquals("method m()\n",
        P.decl(method(MethodKind.METHOD, "m", InputSpec.EMPTY,
                      OutputSpec.EMPTY, null, false), CTX));
  }

  @Test
  public void testStaticAndMutableFields() {
    Decl f = new Field("f", Types.INT, null, true, true, false, Meta.EMPTY);
    Decl cls = new ClassDecl("C", false, ImmutableList.<TypeArg>of(),
        ImmutableList.<ClassType>of(), ImmutableList.of(f), Meta.EMPTY);
    Program prog = new Program("P", ImmutableList.of(
        new Module("M", ImmutableList.of(cls, f), Meta.EMPTY)));
    Context inModule = new Context(prog).enter("M");
    Context inClass = inModule.enter("C");

    assertEquals("ghost const f: int", P.decl(f, inModule));
    assertEquals("static ghost const f: int", P.decl(f, inClass));
    assertEquals("Lenient printing keeps static in modules",
        "static ghost const f: int", new DafnyPrinter(false).decl(f, inModule));

    Decl mutable = new Field("x", Types.INT, num(0), false, false, true,
                             Meta.EMPTY);
    assertEquals("var x: int := 0", P.decl(mutable, inClass));
  }

  @Test
  public void testModuleAndDatatype() {
    Decl d = new Datatype("D", ImmutableList.<TypeArg>of(),
        ImmutableList.of(new DatatypeConstructor("C",
                           ImmutableList.<LocalDecl>of())),
        ImmutableList.<Decl>of(), Meta.EMPTY);
    Program prog = new Program("P", ImmutableList.of(
        new Module("M", ImmutableList.of(d), Meta.EMPTY)));
    String out = P.program(prog, new Context(prog));
    assertTrue(out, out.startsWith("\n\n"));
    assertTrue(out, out.contains("module M {"));
    assertTrue(out, out.contains("datatype D = C {"));
    assertTrue("Datatype nested in module",
        out.indexOf("module M") < out.indexOf("datatype D"));
  }

  @Test
  public void testDatatypeTypeParams() {
    TypeArg a = new TypeArg("A", TypeArg.Variance.COVARIANT, true);
    Type listA = Types.apply(Path.of("List"), Types.typeVar("A"));
    Decl d = new Datatype("List", ImmutableList.of(a), ImmutableList.of(
        new DatatypeConstructor("Nil", ImmutableList.<LocalDecl>of()),
        new DatatypeConstructor("Cons", ImmutableList.of(
            new LocalDecl("head", Types.typeVar("A")),
            new LocalDecl("tail", listA)))),
        ImmutableList.<Decl>of(), Meta.EMPTY);
    assertTrue(P.decl(d, CTX).startsWith(
        "datatype List<+A(==)> = Nil | Cons(head: A, tail: List<A>)"));
  }

  @Test
  public void testIncludesAndPrelude() {
    Program prog = new Program("P", ImmutableList.of(
        new Include(Path.of("lib", "a.dfy")),
        new Module("M", ImmutableList.<Decl>of(), Meta.EMPTY)),
        Meta.withPrelude("// prelude"));
    String out = P.program(prog, new Context(prog));
    assertTrue(out, out.startsWith("include \"lib/a.dfy\"\n" +
        DafnyPrinter.PRELUDE_START + "\n// prelude\n" +
        DafnyPrinter.PRELUDE_END));
    assertEquals(1, StringUtils.countMatches(out, "include"));
    assertTrue("Declarations follow the prelude", out.contains("module M"));
  }

  @Test
  public void testClassesAndConstructors() {
    Decl trait = new ClassDecl("C", true, TypeArg.plain(Arrays.asList("T")),
        ImmutableList.of(new ClassType(Path.of("M", "Base"))),
        ImmutableList.<Decl>of(), Meta.EMPTY);
    assertTrue(P.decl(trait, CTX).startsWith("trait C<T> extends M.Base {"));

    Decl ctor = new ClassConstructor(ClassConstructor.DEFAULT_NAME,
        ImmutableList.<TypeArg>of(), ins(X_INT), ImmutableList.<Expr>of(),
        null, Meta.EMPTY);
    assertEquals("constructor(x: int)\n{}", P.decl(ctor, CTX));

    Decl named = new ClassConstructor("init", ImmutableList.<TypeArg>of(),
        InputSpec.EMPTY, ImmutableList.of(v("p")), assign("a", num(1)),
        Meta.EMPTY);
    assertEquals("constructor init()\n  ensures p\n {\n  a := 1;\n}\n",
                 P.decl(named, CTX));
  }

  @Test
  public void testTypeDefs() {
    Decl pos = new TypeDef("Pos", ImmutableList.<TypeArg>of(), Types.INT,
        "x", bin("Gt", v("x"), num(0)), true, Meta.EMPTY);
    assertEquals("newtype Pos = x: int | (x > 0)", P.decl(pos, CTX));
    Decl syn = TypeDef.synonym("L", TypeArg.plain(Arrays.asList("A")),
        Types.seqType(Types.typeVar("A")));
    assertEquals("type L<A> = seq<A>", P.decl(syn, CTX));
  }

  @Test
  public void testComments() {
    Decl f = new Field("f", Types.INT, null, false, false, false,
                       Meta.withComment("doc"));
    assertEquals("const f: int", P.decl(f, CTX));
    DafnyPrinter withComments = new DafnyPrinter(true, true,
                                                 Indentation.DEFAULT);
    assertEquals("/* doc */\nconst f: int", withComments.decl(f, CTX));
  }

  @Test
  public void testFromSettings() throws Exception {
    Settings.set(Settings.PRINTER_INDENT_WIDTH, "4");
    DafnyPrinter p = DafnyPrinter.fromSettings();
    assertTrue(p.isStrict());
    assertEquals(" {\n    a := 1;\n}\n",
                 p.statement(Exprs.block(assign("a", num(1))), CTX));
  }

  @Test
  public void testFromSettingsRejectsOversizedWidth() throws Exception {
    Settings.set(Settings.PRINTER_INDENT_WIDTH, "4294967298");
    exception.expect(InvalidOptionException.class);
    DafnyPrinter.fromSettings();
  }

  @Test
  public void testFromSettingsRejectsNegativeWidth() throws Exception {
    Settings.set(Settings.PRINTER_INDENT_WIDTH, "-1");
    exception.expect(InvalidOptionException.class);
    DafnyPrinter.fromSettings();
  }
}
