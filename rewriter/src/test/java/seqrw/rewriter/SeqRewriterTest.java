package seqrw.rewriter;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import seqrw.term.Op;
import seqrw.term.Sort;
import seqrw.term.Term;
import seqrw.term.TermManager;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag("fast")
public class SeqRewriterTest {
  private TermManager mgr;
  private SeqRewriter rewriter;
  private Term x, y, p, q;
  private Term a, b, c, none;

  @BeforeEach
  void setUp() {
    mgr = TermManager.mk();
    rewriter = new SeqRewriter(mgr, config());
    x = mgr.mkConst("x", Sort.STRING);
    y = mgr.mkConst("y", Sort.STRING);
    p = mgr.mkConst("p", Sort.BOOL);
    q = mgr.mkConst("q", Sort.BOOL);
    a = mgr.mkToRe(mgr.mkString("a"));
    b = mgr.mkToRe(mgr.mkString("b"));
    c = mgr.mkToRe(mgr.mkString("c"));
    none = mgr.mkReEmpty(Sort.STRING_RE);
  }

  private static RewriterConfig config() {
    return RewriterConfig.fromSystemProperties()
        .setCoalesceChars(true)
        .setMaxCacheSize(1000)
        .setContainsPattern(false)
        .setReIteRewrite(false);
  }

  private static void assertResult(RewriteStatus status, Term expected, RewriteResult actual) {
    assertSame(status, actual.status(), actual::toString);
    assertSame(expected, actual.result());
  }

  @Test
  void testDispatch() {
    assertThrows(
        IllegalArgumentException.class,
        () -> rewriter.mkAppCore(Op.ADD, null, List.of(mgr.mkInt(1), mgr.mkInt(2))));
    assertTrue(rewriter.mkAppCore(Op.SEQ_CONCAT, null, List.of()).isFailed());
    assertResult(
        RewriteStatus.DONE, x, rewriter.mkAppCore(Op.SEQ_CONCAT, null, List.of(x)));

    assertResult(
        RewriteStatus.REWRITE1,
        mgr.mkIndex(x, y, mgr.mkInt(0)),
        rewriter.mkAppCore(Op.SEQ_INDEX, null, List.of(x, y)));
    assertResult(
        RewriteStatus.REWRITE1,
        mgr.mkReLoop(a, 3, 3),
        rewriter.mkAppCore(Op.RE_POWER, new int[] {3}, List.of(a)));
    assertResult(
        RewriteStatus.DONE,
        mgr.mkString("ab"),
        rewriter.rewrite(mgr.mkConcat(mgr.mkString("a"), mgr.mkString("b"))));

    // nothing is known about an uninterpreted regex
    final Term r = mgr.mkConst("R", Sort.STRING_RE);
    final Term emptyInR = mgr.mkInRe(mgr.mkEmpty(Sort.STRING), r);
    assertTrue(rewriter.mkAppCore(Op.SEQ_IN_RE, null, emptyInR.args()).isFailed());
    assertTrue(rewriter.rewrite(emptyInR).isFailed());
  }

  @Test
  void testBinarize() {
    assertResult(
        RewriteStatus.REWRITE_FULL,
        mgr.mkReUnion(a, mgr.mkReUnion(b, c)),
        rewriter.mkAppCore(Op.RE_UNION, null, List.of(a, b, c)));
    assertResult(
        RewriteStatus.REWRITE_FULL,
        mgr.mkReDiff(mgr.mkReDiff(a, b), c),
        rewriter.mkAppCore(Op.RE_DIFF, null, List.of(a, b, c)));
    final Term z = mgr.mkConst("z", Sort.STRING);
    assertResult(
        RewriteStatus.REWRITE_FULL,
        mgr.mkConcat(x, mgr.mkConcat(y, z)),
        rewriter.mkAppCore(Op.SEQ_CONCAT, null, List.of(x, y, z)));
  }

  @Test
  void testStringLiterals() {
    final Term ab = mgr.mkString("ab");
    assertTrue(rewriter.rewrite(ab).isFailed());

    final SeqRewriter units = new SeqRewriter(mgr, config().setCoalesceChars(false));
    final Term expected =
        mgr.mkConcat(mgr.mkUnit(mgr.mkChar('a')), mgr.mkUnit(mgr.mkChar('b')));
    assertResult(RewriteStatus.DONE, expected, units.rewrite(ab));
  }

  @Test
  void testCancellation() {
    final Term abStar = mgr.mkReStar(mgr.mkToRe(mgr.mkString("ab")));
    final Term word = mgr.mkConcat(mgr.mkString("ab"), x);
    rewriter.setCancellation(() -> true);
    assertTrue(rewriter.isCancelled());
    // no derivative is computed, only the deferred form is produced
    final Term tail = mgr.mkConcat(mgr.mkString("b"), x);
    assertResult(
        RewriteStatus.REWRITE2,
        mgr.mkInRe(tail, mgr.mkReDerivative(mgr.mkChar('a'), abStar)),
        rewriter.mkAppCore(Op.SEQ_IN_RE, null, List.of(word, abStar)));

    rewriter.setCancellation(null);
    assertFalse(rewriter.isCancelled());
  }

  @Test
  void testEquations() {
    assertThrows(IllegalArgumentException.class, () -> rewriter.mkEqCore(x, mgr.mkInt(1)));

    final Term ax = mgr.mkConcat(mgr.mkString("a"), x);
    final Term by = mgr.mkConcat(mgr.mkString("b"), y);
    final Term ay = mgr.mkConcat(mgr.mkString("a"), y);
    assertResult(RewriteStatus.DONE, mgr.mkFalse(), rewriter.mkEqCore(ax, by));
    assertResult(RewriteStatus.REWRITE3, mgr.mkEq(x, y), rewriter.mkEqCore(ax, ay));
    assertTrue(rewriter.mkEqCore(x, y).isFailed());

    assertResult(
        RewriteStatus.DONE, mgr.mkFalse(), rewriter.mkEqCore(none, mgr.mkReStar(a)));
    assertResult(RewriteStatus.DONE, mgr.mkTrue(), rewriter.mkEqCore(none, none));
    assertTrue(rewriter.mkEqCore(a, b).isFailed());
  }

  @Test
  void testRegexEmptiness() {
    assertResult(
        RewriteStatus.REWRITE2,
        mgr.mkAnd(mgr.mkEq(a, none), mgr.mkEq(b, none)),
        rewriter.reduceReIsEmpty(mgr.mkReUnion(a, b)));
    assertResult(
        RewriteStatus.REWRITE2,
        mgr.mkOr(mgr.mkEq(a, none), mgr.mkEq(b, none)),
        rewriter.reduceReIsEmpty(mgr.mkReConcat(a, b)));
    assertResult(RewriteStatus.DONE, mgr.mkFalse(), rewriter.reduceReIsEmpty(a));
    assertResult(
        RewriteStatus.DONE,
        mgr.mkFalse(),
        rewriter.reduceReIsEmpty(mgr.mkReFullChar(Sort.STRING_RE)));

    final Term ca = mgr.mkReRange(mgr.mkString("c"), mgr.mkString("a"));
    final Term ac = mgr.mkReRange(mgr.mkString("a"), mgr.mkString("c"));
    assertResult(RewriteStatus.DONE, mgr.mkTrue(), rewriter.reduceReIsEmpty(ca));
    assertResult(RewriteStatus.DONE, mgr.mkFalse(), rewriter.reduceReIsEmpty(ac));

    assertResult(RewriteStatus.DONE, mgr.mkTrue(), rewriter.reduceReIsEmpty(mgr.mkReLoop(a, 3, 2)));
    assertResult(RewriteStatus.DONE, mgr.mkFalse(), rewriter.reduceReIsEmpty(mgr.mkReLoop(b, 0, 2)));
    assertResult(
        RewriteStatus.REWRITE1, mgr.mkEq(b, none), rewriter.reduceReIsEmpty(mgr.mkReLoop(b, 1, 2)));

    assertResult(
        RewriteStatus.REWRITE3,
        mgr.mkEq(mgr.mkReUnion(mgr.mkReInter(a, c), mgr.mkReInter(b, c)), none),
        rewriter.reduceReIsEmpty(mgr.mkReInter(mgr.mkReUnion(a, b), c)));

    // left to the automaton: a range with a bound longer than one character matches nothing
    final Term bad = mgr.mkReRange(mgr.mkString("ab"), mgr.mkString("c"));
    assertResult(RewriteStatus.DONE, mgr.mkTrue(), rewriter.reduceReIsEmpty(mgr.mkRePlus(bad)));
    // complement needs a solver
    assertTrue(rewriter.reduceReIsEmpty(mgr.mkReComplement(a)).isFailed());
  }

  @Test
  void testMergeMemberships() {
    final Term inA = mgr.mkInRe(x, a), inB = mgr.mkInRe(x, b);

    assertResult(
        RewriteStatus.REWRITE_FULL,
        mgr.mkInRe(x, mgr.mkReInter(a, b)),
        rewriter.mkBoolApp(Op.AND, List.of(inA, inB)));
    assertResult(
        RewriteStatus.REWRITE_FULL,
        mgr.mkOr(mgr.mkInRe(x, mgr.mkReUnion(a, mgr.mkReComplement(b))), p),
        rewriter.mkBoolApp(Op.OR, List.of(inA, mgr.mkNot(inB), p)));
    assertResult(
        RewriteStatus.REWRITE_FULL,
        mgr.mkInRe(x, mgr.mkReComplement(mgr.mkReUnion(a, b))),
        rewriter.mkBoolApp(Op.AND, List.of(mgr.mkNot(inA), mgr.mkNot(inB))));

    assertTrue(rewriter.mkBoolApp(Op.AND, List.of(inA, mgr.mkInRe(y, b))).isFailed());
    assertTrue(rewriter.mkBoolApp(Op.OR, List.of(p, q)).isFailed());
    assertThrows(IllegalArgumentException.class, () -> rewriter.mkBoolApp(Op.EQ, List.of(p, q)));
  }

  @Test
  void testRegexIte() {
    assertTrue(rewriter.rewriteReIte(mgr.mkNot(p), a, b).isFailed());

    final SeqRewriter ordered = new SeqRewriter(mgr, config().setReIteRewrite(true));
    assertResult(
        RewriteStatus.REWRITE1, mgr.mkIte(p, b, a), ordered.rewriteReIte(mgr.mkNot(p), a, b));
    assertResult(
        RewriteStatus.REWRITE1,
        mgr.mkIte(p, a, c),
        ordered.rewriteReIte(p, mgr.mkIte(p, a, b), c));
    assertResult(
        RewriteStatus.REWRITE1,
        mgr.mkIte(p, a, c),
        ordered.rewriteReIte(p, a, mgr.mkIte(p, b, c)));

    // q was created after p, so it goes on top
    assertTrue(p.id() < q.id());
    assertResult(
        RewriteStatus.REWRITE2,
        mgr.mkIte(q, mgr.mkIte(p, a, c), mgr.mkIte(p, b, c)),
        ordered.rewriteReIte(p, mgr.mkIte(q, a, b), c));
    assertTrue(ordered.rewriteReIte(q, mgr.mkIte(p, a, b), c).isFailed());

    assertThrows(IllegalArgumentException.class, () -> ordered.rewriteReIte(p, x, y));
  }
}
