package seqrw.rewriter.wordeq;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import seqrw.term.Sort;
import seqrw.term.Term;
import seqrw.term.TermManager;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag("wordeq")
@Tag("fast")
public class OverlapSupportTest {
  @Test
  void testStrings() {
    assertTrue(OverlapSupport.nonOverlap("aa", "bab"));
    assertTrue(OverlapSupport.nonOverlap("ab", "cd"));
    assertFalse(OverlapSupport.nonOverlap("ab", "xab"));
    // partial overlaps at either end count
    assertFalse(OverlapSupport.nonOverlap("ab", "bc"));
    assertFalse(OverlapSupport.nonOverlap("ab", "ca"));
    assertFalse(OverlapSupport.nonOverlap("abc", "b"));
    assertFalse(OverlapSupport.nonOverlap("", "abc"));
    assertFalse(OverlapSupport.nonOverlap("abc", ""));
  }

  private static List<Term> units(TermManager mgr, String s) {
    final List<Term> us = new ArrayList<>();
    for (char c : s.toCharArray()) us.add(mgr.mkUnit(mgr.mkChar(c)));
    return us;
  }

  @Test
  void testUnits() {
    final TermManager mgr = TermManager.mk();
    assertTrue(OverlapSupport.nonOverlap(units(mgr, "aa"), units(mgr, "bab")));
    assertFalse(OverlapSupport.nonOverlap(units(mgr, "ab"), units(mgr, "bc")));

    final List<Term> symbolic = units(mgr, "b");
    symbolic.add(mgr.mkUnit(mgr.mkConst("c", Sort.CHAR)));
    symbolic.addAll(units(mgr, "b"));
    assertFalse(OverlapSupport.nonOverlap(units(mgr, "a"), symbolic));
    assertTrue(OverlapSupport.nonOverlap(units(mgr, "aa"), symbolic));
    assertFalse(OverlapSupport.nonOverlap(List.of(), symbolic));
  }
}
