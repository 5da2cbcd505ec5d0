package seqrw.rewriter.ops;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import seqrw.rewriter.RewriteResult;
import seqrw.rewriter.RewriteStatus;
import seqrw.rewriter.automaton.RegexToAutomaton;
import seqrw.rewriter.cache.OpCache;
import seqrw.rewriter.regex.IteCombiner;
import seqrw.rewriter.regex.RegexDerivative;
import seqrw.term.Sort;
import seqrw.term.Term;
import seqrw.term.TermManager;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag("ops")
@Tag("fast")
public class RegexOpSimplifierTest {
  private TermManager mgr;
  private RegexOpSimplifier ops;
  private Term a, b, eps, none, all;
  private Term x, p;

  @BeforeEach
  void setUp() {
    mgr = TermManager.mk();
    final OpCache cache = new OpCache(1000);
    final SeqOpSimplifier seqOps = new SeqOpSimplifier(mgr, true);
    final RegexDerivative derivs =
        new RegexDerivative(mgr, cache, new IteCombiner(mgr, cache), seqOps, () -> false);
    ops = new RegexOpSimplifier(mgr, seqOps, derivs, new RegexToAutomaton(mgr));

    a = str("a");
    b = str("b");
    eps = mgr.mkToRe(mgr.mkEmpty(Sort.STRING));
    none = mgr.mkReEmpty(Sort.STRING_RE);
    all = mgr.mkReFullSeq(Sort.STRING_RE);
    x = mgr.mkConst("x", Sort.STRING);
    p = mgr.mkConst("p", Sort.BOOL);
  }

  private Term str(String s) {
    return mgr.mkToRe(mgr.mkString(s));
  }

  private Term range(String lo, String hi) {
    return mgr.mkReRange(mgr.mkString(lo), mgr.mkString(hi));
  }

  private static void assertResult(RewriteStatus status, Term expected, RewriteResult actual) {
    assertSame(status, actual.status(), actual::toString);
    assertSame(expected, actual.result());
  }

  @Test
  void testConcat() {
    assertResult(RewriteStatus.DONE, none, ops.mkReConcat(none, a));
    assertResult(RewriteStatus.DONE, a, ops.mkReConcat(eps, a));
    assertResult(RewriteStatus.DONE, a, ops.mkReConcat(a, eps));
    assertResult(RewriteStatus.DONE, all, ops.mkReConcat(all, all));
    assertResult(
        RewriteStatus.REWRITE2,
        mgr.mkToRe(mgr.mkConcat(mgr.mkString("a"), mgr.mkString("b"))),
        ops.mkReConcat(a, b));

    final Term astar = mgr.mkReStar(a);
    assertResult(RewriteStatus.DONE, astar, ops.mkReConcat(astar, astar));
    assertResult(RewriteStatus.DONE, mgr.mkReConcat(a, astar), ops.mkReConcat(astar, a));
    assertTrue(ops.mkReConcat(astar, b).isFailed());
  }

  @Test
  void testConcatOfLoops() {
    assertResult(
        RewriteStatus.DONE,
        mgr.mkReLoop(a, 3, 5),
        ops.mkReConcat(mgr.mkReLoop(a, 1, 2), mgr.mkReLoop(a, 2, 3)));
    assertResult(
        RewriteStatus.DONE, mgr.mkReLoop(a, 3), ops.mkReConcat(mgr.mkReLoop(a, 2), mgr.mkReLoop(a, 1)));
    assertResult(
        RewriteStatus.DONE,
        mgr.mkReLoop(a, 3),
        ops.mkReConcat(mgr.mkReLoop(a, 2), mgr.mkReLoop(a, 1, 4)));
    assertResult(
        RewriteStatus.DONE, mgr.mkReLoop(a, 1), ops.mkReConcat(mgr.mkReLoop(a, 1, 2), mgr.mkReStar(a)));
    assertResult(RewriteStatus.DONE, mgr.mkReLoop(a, 2, 3), ops.mkReConcat(mgr.mkReLoop(a, 1, 2), a));
    assertResult(RewriteStatus.DONE, mgr.mkReLoop(a, 2, 3), ops.mkReConcat(a, mgr.mkReLoop(a, 1, 2)));
    // loops over different bodies stay apart
    assertTrue(ops.mkReConcat(mgr.mkReLoop(a, 1, 2), mgr.mkReLoop(b, 1, 2)).isFailed());
  }

  @Test
  void testUnion() {
    assertResult(RewriteStatus.DONE, a, ops.mkReUnion(a, a));
    assertResult(RewriteStatus.DONE, a, ops.mkReUnion(none, a));
    assertResult(RewriteStatus.DONE, all, ops.mkReUnion(a, all));
    final Term astar = mgr.mkReStar(a);
    assertResult(RewriteStatus.DONE, astar, ops.mkReUnion(astar, eps));
    assertResult(RewriteStatus.DONE, astar, ops.mkReUnion(eps, astar));
    assertTrue(ops.mkReUnion(a, b).isFailed());
  }

  @Test
  void testComplement() {
    assertResult(
        RewriteStatus.REWRITE2,
        mgr.mkReUnion(mgr.mkReComplement(a), mgr.mkReComplement(b)),
        ops.mkReComplement(mgr.mkReInter(a, b)));
    assertResult(
        RewriteStatus.REWRITE2,
        mgr.mkReInter(mgr.mkReComplement(a), mgr.mkReComplement(b)),
        ops.mkReComplement(mgr.mkReUnion(a, b)));
    assertResult(RewriteStatus.DONE, all, ops.mkReComplement(none));
    assertResult(RewriteStatus.DONE, none, ops.mkReComplement(all));
    assertResult(
        RewriteStatus.REWRITE2,
        mgr.mkIte(p, mgr.mkReComplement(a), mgr.mkReComplement(b)),
        ops.mkReComplement(mgr.mkIte(p, a, b)));
    assertTrue(ops.mkReComplement(a).isFailed());
  }

  @Test
  void testIntersectionAndDifference() {
    assertResult(RewriteStatus.DONE, a, ops.mkReInter(a, a));
    assertResult(RewriteStatus.DONE, b, ops.mkReInter(all, b));
    assertResult(RewriteStatus.DONE, none, ops.mkReInter(b, none));
    assertResult(RewriteStatus.DONE, none, ops.mkReInter(mgr.mkReComplement(b), b));

    final Term ab = str("ab"), letters = mgr.mkReStar(range("a", "z"));
    assertResult(
        RewriteStatus.REWRITE2,
        mgr.mkIte(mgr.mkInRe(mgr.mkString("ab"), letters), ab, none),
        ops.mkReInter(ab, letters));
    assertTrue(ops.mkReInter(mgr.mkReStar(a), letters).isFailed());

    assertResult(
        RewriteStatus.REWRITE2, mgr.mkReInter(a, mgr.mkReComplement(b)), ops.mkReDiff(a, b));
  }

  @Test
  void testLoop() {
    assertResult(RewriteStatus.DONE, none, ops.mkReLoop(new int[] {3, 2}, List.of(a)));
    assertResult(RewriteStatus.DONE, eps, ops.mkReLoop(new int[] {0, 0}, List.of(a)));
    assertResult(RewriteStatus.DONE, a, ops.mkReLoop(new int[] {1, 1}, List.of(a)));
    assertResult(
        RewriteStatus.REWRITE1, mgr.mkReStar(a), ops.mkReLoop(new int[] {0}, List.of(a)));
    assertResult(
        RewriteStatus.REWRITE1,
        mgr.mkReLoop(a, 6),
        ops.mkReLoop(new int[] {3}, List.of(mgr.mkReLoop(a, 2))));
    assertResult(
        RewriteStatus.REWRITE1,
        mgr.mkReLoop(a, 6, 6),
        ops.mkReLoop(new int[] {3, 3}, List.of(mgr.mkReLoop(a, 2, 2))));
    assertResult(
        RewriteStatus.REWRITE2,
        mgr.mkIte(p, mgr.mkReLoop(a, 2, 3), mgr.mkReLoop(b, 2, 3)),
        ops.mkReLoop(new int[] {2, 3}, List.of(mgr.mkIte(p, a, b))));
    assertTrue(ops.mkReLoop(new int[] {2, 3}, List.of(a)).isFailed());

    // bounds given as integer arguments
    assertResult(
        RewriteStatus.REWRITE1, mgr.mkReLoop(a, 2), ops.mkReLoop(null, List.of(a, mgr.mkInt(2))));
    assertResult(
        RewriteStatus.REWRITE1,
        mgr.mkReLoop(a, 1, 4),
        ops.mkReLoop(null, List.of(a, mgr.mkInt(1), mgr.mkInt(4))));
    final Term n = mgr.mkConst("n", Sort.INT);
    assertTrue(ops.mkReLoop(null, List.of(a, n)).isFailed());

    assertResult(RewriteStatus.REWRITE1, mgr.mkReLoop(a, 3, 3), ops.mkRePower(3, a));
  }

  @Test
  void testStarPlusOpt() {
    final Term astar = mgr.mkReStar(a);
    assertResult(RewriteStatus.DONE, astar, ops.mkReStar(astar));
    assertResult(RewriteStatus.DONE, all, ops.mkReStar(mgr.mkReFullChar(Sort.STRING_RE)));
    assertResult(RewriteStatus.DONE, eps, ops.mkReStar(none));
    assertResult(RewriteStatus.DONE, astar, ops.mkReStar(mgr.mkRePlus(a)));
    assertResult(
        RewriteStatus.REWRITE2,
        mgr.mkReStar(mgr.mkReUnion(a, b)),
        ops.mkReStar(mgr.mkReUnion(astar, b)));
    assertResult(
        RewriteStatus.REWRITE2, mgr.mkReStar(b), ops.mkReStar(mgr.mkReUnion(eps, b)));
    assertResult(
        RewriteStatus.REWRITE2,
        mgr.mkReStar(mgr.mkReUnion(a, b)),
        ops.mkReStar(mgr.mkReConcat(astar, mgr.mkReStar(b))));
    assertResult(
        RewriteStatus.REWRITE2,
        mgr.mkIte(p, astar, mgr.mkReStar(b)),
        ops.mkReStar(mgr.mkIte(p, a, b)));
    assertTrue(ops.mkReStar(a).isFailed());

    assertResult(RewriteStatus.DONE, none, ops.mkRePlus(none));
    assertResult(RewriteStatus.DONE, astar, ops.mkRePlus(astar));
    assertResult(RewriteStatus.REWRITE2, mgr.mkReConcat(a, astar), ops.mkRePlus(a));

    assertResult(RewriteStatus.REWRITE1, mgr.mkReUnion(eps, a), ops.mkReOpt(a));
  }

  @Test
  void testReverse() {
    assertResult(RewriteStatus.DONE, str("cba"), ops.mkReReverse(str("abc")));
    assertResult(
        RewriteStatus.REWRITE2,
        mgr.mkReConcat(mgr.mkReReverse(b), mgr.mkReReverse(a)),
        ops.mkReReverse(mgr.mkReConcat(a, b)));
    assertResult(RewriteStatus.DONE, a, ops.mkReReverse(mgr.mkReReverse(a)));
    final Term r = range("a", "c");
    assertResult(RewriteStatus.DONE, r, ops.mkReReverse(r));
    assertResult(
        RewriteStatus.REWRITE2,
        mgr.mkReStar(mgr.mkReReverse(a)),
        ops.mkReReverse(mgr.mkReStar(a)));

    final Term xab = mgr.mkToRe(mgr.mkConcat(x, mgr.mkString("ab")));
    assertResult(
        RewriteStatus.REWRITE3,
        mgr.mkReConcat(mgr.mkReReverse(str("ab")), mgr.mkReReverse(mgr.mkToRe(x))),
        ops.mkReReverse(xab));
    assertTrue(ops.mkReReverse(mgr.mkToRe(x)).isFailed());
  }

  @Test
  void testMembership() {
    assertResult(RewriteStatus.DONE, mgr.mkFalse(), ops.mkStrInRegexp(x, none));
    assertResult(RewriteStatus.DONE, mgr.mkTrue(), ops.mkStrInRegexp(x, all));
    final Term y = mgr.mkConst("y", Sort.STRING);
    assertResult(RewriteStatus.REWRITE1, mgr.mkEq(x, y), ops.mkStrInRegexp(x, mgr.mkToRe(y)));

    final Term empty = mgr.mkEmpty(Sort.STRING);
    assertResult(
        RewriteStatus.REWRITE_FULL, mgr.mkTrue(), ops.mkStrInRegexp(empty, mgr.mkReStar(a)));

    // the first character is consumed by a derivative
    final Term abStar = mgr.mkReStar(str("ab"));
    final Term word = mgr.mkConcat(mgr.mkString("ab"), x);
    assertResult(
        RewriteStatus.REWRITE_FULL,
        mgr.mkInRe(mgr.mkConcat(mgr.mkString("b"), x), mgr.mkReConcat(b, abStar)),
        ops.mkStrInRegexp(word, abStar));

    // and the last one by a derivative of the reversed regex
    final Term bStar = mgr.mkReStar(b);
    final Term reversed =
        mgr.mkReReverse(mgr.mkReDerivative(mgr.mkChar('b'), mgr.mkReReverse(bStar)));
    assertResult(
        RewriteStatus.REWRITE_FULL,
        mgr.mkInRe(x, reversed),
        ops.mkStrInRegexp(mgr.mkConcat(x, mgr.mkString("b")), bStar));

    final Term emptyLanguage = mgr.mkReConcat(range("ab", "c"), mgr.mkReStar(a));
    assertResult(RewriteStatus.DONE, mgr.mkFalse(), ops.mkStrInRegexp(x, emptyLanguage));
    assertTrue(ops.mkStrInRegexp(x, mgr.mkReStar(a)).isFailed());
  }

  @Test
  void testEmptyWordInOpaqueRegex() {
    final Term empty = mgr.mkEmpty(Sort.STRING);
    final Term r = mgr.mkConst("R", Sort.STRING_RE);
    assertTrue(ops.mkStrInRegexp(empty, r).isFailed());
    assertResult(
        RewriteStatus.DONE, mgr.mkInRe(empty, r), ops.mkStrInRegexp(empty, mgr.mkRePlus(r)));
  }

  @Test
  void testContainsPattern() {
    final Term y = mgr.mkConst("y", Sort.STRING);
    final Term pattern = mgr.mkReConcat(all, mgr.mkReConcat(str("ab"), all));
    final Term word = mgr.mkConcat(x, mgr.mkConcat(mgr.mkString("cc"), y));

    assertTrue(ops.mkStrInRegexp(word, pattern).isFailed());

    ops.setContainsPattern(true);
    final RewriteResult r = ops.mkStrInRegexp(word, pattern);
    assertSame(RewriteStatus.REWRITE_FULL, r.status());
    final Term tail = mgr.mkConcat(mgr.mkString("cc"), y);
    final Term prefix = mgr.mkReConcat(mgr.mkReConcat(all, str("ab")), all);
    final Term expected =
        mgr.mkOr(mgr.mkInRe(tail, pattern), mgr.mkAnd(mgr.mkInRe(x, prefix), mgr.mkInRe(tail, all)));
    assertSame(expected, r.result());

    // "b" can complete an occurrence started in x
    final Term overlapping = mgr.mkConcat(x, mgr.mkConcat(mgr.mkString("b"), y));
    assertNull(ops.rewriteContainsPattern(overlapping, pattern));
  }
}
