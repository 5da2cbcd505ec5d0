package seqrw.rewriter.wordeq;

import seqrw.term.Op;
import seqrw.term.Term;

import java.util.List;

import static seqrw.term.TermSupport.areDistinct;

/** Checks that two words cannot overlap at any alignment, by containment or at their ends. */
public abstract class OverlapSupport {
  private OverlapSupport() {}

  public static boolean nonOverlap(String s1, String s2) {
    if (s1.isEmpty() || s2.isEmpty()) return false;
    for (int d = -(s1.length() - 1); d < s2.length(); ++d) {
      if (canOverlapAt(s1, s2, d)) return false;
    }
    return true;
  }

  /** Whether s1 placed at offset d of s2 agrees with s2 on every shared position. */
  private static boolean canOverlapAt(String s1, String s2, int d) {
    for (int i = Math.max(0, -d); i < s1.length() && i + d < s2.length(); ++i) {
      if (s1.charAt(i) != s2.charAt(i + d)) return false;
    }
    return true;
  }

  /**
   * Like {@link #nonOverlap(String, String)} over lists of units. An alignment is ruled out only
   * when two units at a shared position are certainly distinct.
   */
  public static boolean nonOverlap(List<Term> p1, List<Term> p2) {
    if (p1.isEmpty() || p2.isEmpty()) return false;
    for (int d = -(p1.size() - 1); d < p2.size(); ++d) {
      if (canOverlapAt(p1, p2, d)) return false;
    }
    return true;
  }

  private static boolean canOverlapAt(List<Term> p1, List<Term> p2, int d) {
    for (int i = Math.max(0, -d); i < p1.size() && i + d < p2.size(); ++i) {
      final Term x = p1.get(i), y = p2.get(i + d);
      if (!x.is(Op.SEQ_UNIT) || !y.is(Op.SEQ_UNIT)) return true;
      if (areDistinct(x, y)) return false;
    }
    return true;
  }
}
