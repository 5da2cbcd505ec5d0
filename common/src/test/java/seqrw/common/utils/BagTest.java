package seqrw.common.utils;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("fast")
public class BagTest {
  @Test
  void testCounting() {
    final Bag<String> bag = new Bag<>();
    assertTrue(bag.isEmpty());

    bag.add("a");
    bag.add("a");
    bag.add("b", 3);
    assertEquals(2, bag.count("a"));
    assertEquals(3, bag.count("b"));
    assertEquals(0, bag.count("c"));

    assertTrue(bag.removeOne("a"));
    assertTrue(bag.removeOne("a"));
    assertFalse(bag.removeOne("a"));
    assertEquals(0, bag.count("a"));
    assertFalse(bag.isEmpty());
  }
}
