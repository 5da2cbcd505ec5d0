package seqrw.rewriter.automaton;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import seqrw.term.Sort;
import seqrw.term.Term;
import seqrw.term.TermManager;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag("automaton")
@Tag("fast")
public class RegexToAutomatonTest {
  private TermManager mgr;
  private RegexToAutomaton automata;

  @BeforeEach
  void setUp() {
    mgr = TermManager.mk();
    automata = new RegexToAutomaton(mgr);
    automata.setSolver(new EnumeratingSolver());
  }

  private Term str(String s) {
    return mgr.mkToRe(mgr.mkString(s));
  }

  private Term range(char lo, char hi) {
    return mgr.mkReRange(mgr.mkString(String.valueOf(lo)), mgr.mkString(String.valueOf(hi)));
  }

  private Term unit(char c) {
    return mgr.mkUnit(mgr.mkChar(c));
  }

  private boolean accepts(Term r, String word) {
    final SymbolicAutomaton<SymExpr> a = automata.compile(r);
    assertNotNull(a, "no automaton for " + r);
    final SymbolicAutomaton<SymExpr> w = automata.compile(str(word));
    final SymbolicAutomaton<SymExpr> product = automata.mkProduct(a, w);
    assertNotNull(product);
    return !product.isEmpty();
  }

  @Test
  void testLiteralIsSequence() {
    final SymbolicAutomaton<SymExpr> a = automata.compile(str("abc"));
    final Term expected =
        mgr.mkConcat(
            List.of(unit('a'), unit('b'), unit('c')), Sort.STRING);
    assertSame(expected, automata.sequenceOf(a, Sort.STRING));
    assertFalse(a.isEmpty());
  }

  @Test
  void testUnionIsNoSequence() {
    final SymbolicAutomaton<SymExpr> a = automata.compile(mgr.mkReUnion(str("a"), str("b")));
    assertNotNull(a);
    assertFalse(a.isEmpty());
    assertNull(automata.sequenceOf(a, Sort.STRING));
  }

  @Test
  void testEmptyLanguages() {
    final Term none = mgr.mkReEmpty(Sort.STRING_RE);
    assertTrue(automata.compile(none).isEmpty());
    assertTrue(automata.compile(mgr.mkReConcat(range('a', 'z'), none)).isEmpty());
    // bounds longer than one character
    assertTrue(
        automata.compile(mgr.mkReRange(mgr.mkString("ab"), mgr.mkString("z"))).isEmpty());
  }

  @Test
  void testSymbolicBounds() {
    final Term c = mgr.mkConst("c", Sort.CHAR);
    final Term x = mgr.mkConst("x", Sort.STRING);
    assertNotNull(automata.compile(mgr.mkReRange(mgr.mkUnit(c), mgr.mkString("z"))));
    assertNull(automata.compile(mgr.mkReRange(x, mgr.mkString("z"))));
  }

  @Test
  void testNoSolverNoComplement() {
    final RegexToAutomaton plain = new RegexToAutomaton(mgr);
    assertNull(plain.compile(mgr.mkReComplement(str("a"))));
    assertNull(plain.compile(mgr.mkReInter(str("a"), str("a"))));
    assertNull(plain.mkProduct(plain.compile(str("a")), plain.compile(str("a"))));
    assertNotNull(plain.compile(mgr.mkReStar(str("a"))));
  }

  @Test
  void testUnsupportedOperators() {
    final Term r = mgr.mkReReverse(str("ab"));
    assertNull(automata.compile(r));
    assertNull(automata.compile(mgr.mkReDerivative(mgr.mkChar('a'), str("ab"))));
  }

  @Test
  void testStar() {
    // (a*b)*
    final Term r = mgr.mkReStar(mgr.mkReConcat(mgr.mkReStar(str("a")), str("b")));
    assertTrue(accepts(r, ""));
    assertTrue(accepts(r, "b"));
    assertTrue(accepts(r, "aab"));
    assertTrue(accepts(r, "abb"));
    assertFalse(accepts(r, "a"));
    assertFalse(accepts(r, "aba"));
  }

  @Test
  void testPlusAndOpt() {
    final Term plus = mgr.mkRePlus(str("ab"));
    assertFalse(accepts(plus, ""));
    assertTrue(accepts(plus, "abab"));
    assertFalse(accepts(plus, "aba"));

    final Term opt = mgr.mkReOpt(str("ab"));
    assertTrue(accepts(opt, ""));
    assertTrue(accepts(opt, "ab"));
    assertFalse(accepts(opt, "abab"));
  }

  @Test
  void testLoops() {
    final Term bounded = mgr.mkReLoop(str("a"), 2, 3);
    assertFalse(accepts(bounded, "a"));
    assertTrue(accepts(bounded, "aa"));
    assertTrue(accepts(bounded, "aaa"));
    assertFalse(accepts(bounded, "aaaa"));

    final Term unbounded = mgr.mkReLoop(str("a"), 2);
    assertFalse(accepts(unbounded, "a"));
    assertTrue(accepts(unbounded, "aa"));
    assertTrue(accepts(unbounded, "aaaaa"));
  }

  @Test
  void testInvertedLoopIsEmpty() {
    final SymbolicAutomaton<SymExpr> a = automata.compile(mgr.mkReLoop(str("a"), 3, 1));
    assertNotNull(a);
    assertTrue(a.isEmpty());

    final Term free = mgr.mkConst("R", Sort.STRING_RE);
    final SymbolicAutomaton<SymExpr> b = automata.compile(mgr.mkReLoop(free, 2, 0));
    assertNotNull(b);
    assertTrue(b.isEmpty());
  }

  @Test
  void testComplement() {
    final Term notA = mgr.mkReComplement(str("a"));
    assertTrue(accepts(notA, ""));
    assertTrue(accepts(notA, "b"));
    assertTrue(accepts(notA, "aa"));
    assertFalse(accepts(notA, "a"));

    assertTrue(automata.compile(mgr.mkReComplement(mgr.mkReFullSeq(Sort.STRING_RE))).isEmpty());
  }

  @Test
  void testIntersection() {
    assertTrue(automata.compile(mgr.mkReInter(range('a', 'c'), range('d', 'f'))).isEmpty());

    final Term r = mgr.mkReInter(mgr.mkReStar(range('a', 'c')), mgr.mkReStar(str("ab")));
    assertTrue(accepts(r, "abab"));
    assertFalse(accepts(r, "aba"));
  }

  @Test
  void testFullChar() {
    final Term r = mgr.mkReConcat(mgr.mkReFullChar(Sort.STRING_RE), str("b"));
    assertTrue(accepts(r, "xb"));
    assertFalse(accepts(r, "b"));
    assertFalse(accepts(r, "xxb"));
  }
}
