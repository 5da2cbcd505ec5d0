package seqrw.rewriter.ops;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import seqrw.rewriter.RewriteResult;
import seqrw.rewriter.RewriteStatus;
import seqrw.term.Sort;
import seqrw.term.Term;
import seqrw.term.TermManager;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag("ops")
@Tag("fast")
public class StrOpSimplifierTest {
  private TermManager mgr;
  private StrOpSimplifier ops;
  private Term x, y, n;

  @BeforeEach
  void setUp() {
    mgr = TermManager.mk();
    ops = new StrOpSimplifier(mgr);
    x = mgr.mkConst("x", Sort.STRING);
    y = mgr.mkConst("y", Sort.STRING);
    n = mgr.mkConst("n", Sort.INT);
  }

  private Term s(String str) {
    return mgr.mkString(str);
  }

  private Term i(long v) {
    return mgr.mkInt(v);
  }

  private static void assertDone(Term expected, RewriteResult actual) {
    assertSame(RewriteStatus.DONE, actual.status(), actual::toString);
    assertSame(expected, actual.result());
  }

  @Test
  void testUnits() {
    final Term units =
        mgr.mkConcat(mgr.mkUnit(mgr.mkChar('a')), mgr.mkUnit(mgr.mkChar('b')));
    assertDone(units, ops.mkStrUnits(s("ab")));
    assertTrue(ops.mkStrUnits(s("")).isFailed());
  }

  @Test
  void testOrdering() {
    final List<String> words = List.of("", "a", "b", "ab", "ba", "abc");
    for (String a : words)
      for (String b : words) assertDone(mgr.mkBool(a.compareTo(b) < 0), ops.mkStrLt(s(a), s(b)));

    final RewriteResult le = ops.mkStrLe(x, y);
    assertSame(RewriteStatus.REWRITE2, le.status());
    assertSame(mgr.mkNot(mgr.mkStrLt(y, x)), le.result());
    assertTrue(ops.mkStrLt(x, y).isFailed());
  }

  @Test
  void testCodes() {
    assertDone(s("a"), ops.mkStrFromCode(i('a')));
    assertDone(s(""), ops.mkStrFromCode(i(-1)));
    assertDone(s(""), ops.mkStrFromCode(i(TermManager.MAX_CHAR + 1)));
    assertTrue(ops.mkStrFromCode(n).isFailed());

    assertDone(i('a'), ops.mkStrToCode(s("a")));
    assertDone(i(-1), ops.mkStrToCode(s("ab")));
    assertDone(i(-1), ops.mkStrToCode(s("")));

    assertDone(mgr.mkTrue(), ops.mkStrIsDigit(s("5")));
    assertDone(mgr.mkFalse(), ops.mkStrIsDigit(s("a")));
    assertDone(mgr.mkFalse(), ops.mkStrIsDigit(s("55")));
  }

  @Test
  void testIntegerConversion() {
    assertDone(s("12"), ops.mkStrItos(i(12)));
    assertDone(s("0"), ops.mkStrItos(i(0)));
    assertDone(s(""), ops.mkStrItos(i(-3)));

    assertDone(i(12), ops.mkStrStoi(s("12")));
    assertDone(i(7), ops.mkStrStoi(s("007")));
    assertDone(i(-1), ops.mkStrStoi(s("")));
    assertDone(i(-1), ops.mkStrStoi(s("1a")));

    assertDone(mgr.mkIte(mgr.mkGe(n, i(0)), n, i(-1)), ops.mkStrStoi(mgr.mkItos(n)));
    assertDone(i(7), ops.mkStrStoi(mgr.mkUnit(mgr.mkChar('7'))));
    assertDone(i(-1), ops.mkStrStoi(mgr.mkUnit(mgr.mkChar('x'))));
  }

  @Test
  void testStoiOfConcatenation() {
    final RewriteResult r = ops.mkStrStoi(mgr.mkConcat(x, s("5")));
    assertSame(RewriteStatus.REWRITE_FULL, r.status());

    final Term su = mgr.mkStoi(x), sd = mgr.mkStoi(mgr.mkUnit(mgr.mkChar('5')));
    final Term value = mgr.mkAdd(mgr.mkMul(i(10), su), sd);
    final Term expected =
        mgr.mkIte(
            mgr.mkLt(sd, i(0)),
            i(-1),
            mgr.mkIte(mgr.mkIsEmpty(x), sd, mgr.mkIte(mgr.mkLt(su, i(0)), i(-1), value)));
    assertSame(expected, r.result());

    final Term p = mgr.mkConst("p", Sort.BOOL);
    final RewriteResult ite = ops.mkStrStoi(mgr.mkIte(p, s("1"), x));
    assertSame(mgr.mkIte(p, mgr.mkStoi(s("1")), mgr.mkStoi(x)), ite.result());
    assertTrue(ops.mkStrStoi(x).isFailed());
  }
}
