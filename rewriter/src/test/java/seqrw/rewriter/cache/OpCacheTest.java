package seqrw.rewriter.cache;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import seqrw.term.Op;
import seqrw.term.Sort;
import seqrw.term.Term;
import seqrw.term.TermManager;

import static org.junit.jupiter.api.Assertions.*;

@Tag("fast")
public class OpCacheTest {
  @Test
  void testFindInsert() {
    final TermManager mgr = TermManager.mk();
    final Term a = mgr.mkToRe(mgr.mkString("a"));
    final Term b = mgr.mkToRe(mgr.mkString("b"));
    final Term u = mgr.mkReUnion(a, b);
    final OpCache cache = new OpCache(16);

    assertNull(cache.find(Op.RE_UNION, a, b, null));
    cache.insert(Op.RE_UNION, a, b, null, u);
    assertSame(u, cache.find(Op.RE_UNION, a, b, null));
    assertNull(cache.find(Op.RE_UNION, b, a, null));
    assertNull(cache.find(Op.RE_INTERSECT, a, b, null));
    assertNull(cache.find(Op.RE_UNION, a, b, mgr.mkTrue()));
  }

  @Test
  void testResetAtCapacity() {
    final TermManager mgr = TermManager.mk();
    final OpCache cache = new OpCache(3);
    final Term[] xs = new Term[4];
    for (int i = 0; i < xs.length; ++i) xs[i] = mgr.mkConst("x" + i, Sort.STRING_RE);

    for (int i = 0; i < 3; ++i) cache.insert(Op.RE_IS_NULLABLE, xs[i], null, null, mgr.mkTrue());
    assertEquals(3, cache.size());
    assertEquals(0, cache.numResets());

    cache.insert(Op.RE_IS_NULLABLE, xs[3], null, null, mgr.mkFalse());
    assertEquals(1, cache.size());
    assertEquals(1, cache.numResets());
    assertNull(cache.find(Op.RE_IS_NULLABLE, xs[0], null, null));
    assertSame(mgr.mkFalse(), cache.find(Op.RE_IS_NULLABLE, xs[3], null, null));

    cache.reset();
    assertEquals(0, cache.size());
  }

  @Test
  void testPositiveCapacity() {
    assertThrows(IllegalArgumentException.class, () -> new OpCache(0));
  }
}
