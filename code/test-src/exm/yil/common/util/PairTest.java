package exm.yil.common.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

public class PairTest {

  @Test
  public void testEquality() {
    assertEquals(Pair.create("a", 1), Pair.create("a", 1));
    assertEquals(Pair.create("a", 1).hashCode(),
                 Pair.create("a", 1).hashCode());
    assertNotEquals(Pair.create("a", 1), Pair.create("a", 2));
    assertEquals(Pair.create("a", null), Pair.create("a", null));
  }

  @Test
  public void testExtract() {
    List<Pair<String, Integer>> pairs = Arrays.asList(Pair.create("a", 1),
                                                      Pair.create("b", 2));
    assertEquals(Arrays.asList("a", "b"), Pair.extract1(pairs));
    assertEquals(Arrays.asList(1, 2), Pair.extract2(pairs));
  }
}
