package exm.yil.common.lang;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;

import org.junit.Test;

import com.google.common.collect.ImmutableList;

import exm.yil.common.lang.Decls.Decl;
import exm.yil.common.lang.Decls.Field;
import exm.yil.common.lang.Decls.Module;
import exm.yil.common.lang.Meta.Position;

public class MetaTest {

  private static final Meta COMMENTED =
      new Meta("some comment", new Position("a.dfy", 120, 3, 7), "prelude");

  @Test
  public void testAllMetaEqual() {
    assertEquals(Meta.EMPTY, COMMENTED);
    assertEquals(COMMENTED, Meta.EMPTY);
    assertEquals(Meta.EMPTY.hashCode(), COMMENTED.hashCode());
    assertEquals(Meta.withComment("x"), Meta.withPrelude("y"));
  }

  @Test
  public void testMetaIgnoredInNodes() {
    Decl f1 = new Field("f", Types.INT, null, false, false, false,
                        Meta.EMPTY);
    Decl f2 = new Field("f", Types.INT, null, false, false, false,
                        COMMENTED);
    assertEquals(f1, f2);
    assertEquals(f1.hashCode(), f2.hashCode());

    Decl m1 = new Module("M", ImmutableList.of(f1), Meta.EMPTY);
    Decl m2 = new Module("M", ImmutableList.of(f2), COMMENTED);
    assertEquals(m1, m2);
    assertEquals(m1.hashCode(), m2.hashCode());

    assertEquals(new Program("P", ImmutableList.of(m1), Meta.EMPTY),
                 new Program("P", ImmutableList.of(m2), COMMENTED));

    DatatypeConstructor c1 = new DatatypeConstructor("C",
        ImmutableList.<LocalDecl>of(), Meta.EMPTY);
    DatatypeConstructor c2 = new DatatypeConstructor("C",
        ImmutableList.<LocalDecl>of(), COMMENTED);
    assertEquals(c1, c2);
    assertEquals(c1.hashCode(), c2.hashCode());
  }

  @Test
  public void testPositionWithoutFile() {
    Position p1 = new Position(null, 0, 1, 1);
    Position p2 = new Position(null, 0, 1, 1);
    assertEquals(p1, p2);
    assertEquals(p1.hashCode(), p2.hashCode());
    assertFalse(p1.equals(new Position("a.dfy", 0, 1, 1)));
    assertFalse(new Position("a.dfy", 0, 1, 1).equals(p1));
  }

  @Test
  public void testAccessors() {
    assertEquals("some comment", COMMENTED.comment());
    assertEquals("prelude", COMMENTED.prelude());
    assertEquals("a.dfy@3:7", COMMENTED.position().toString());
    assertNull(Meta.EMPTY.comment());
    assertEquals("", Meta.EMPTY.prelude());
  }
}
