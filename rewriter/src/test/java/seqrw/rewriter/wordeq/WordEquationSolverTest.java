package seqrw.rewriter.wordeq;

import org.apache.commons.lang3.tuple.Pair;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import seqrw.term.Sort;
import seqrw.term.Term;
import seqrw.term.TermManager;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;
import static seqrw.term.TermSupport.valueOf;

@Tag("wordeq")
@Tag("fast")
public class WordEquationSolverTest {
  private TermManager mgr;
  private WordEquationSolver solver;
  private Term x, y, z;

  @BeforeEach
  void setUp() {
    mgr = TermManager.mk();
    solver = new WordEquationSolver(mgr);
    x = mgr.mkConst("x", Sort.STRING);
    y = mgr.mkConst("y", Sort.STRING);
    z = mgr.mkConst("z", Sort.STRING);
  }

  private Term s(String str) {
    return mgr.mkString(str);
  }

  private Term unit(Term c) {
    return mgr.mkUnit(c);
  }

  private Term cat(Term... parts) {
    return mgr.mkConcat(List.of(parts), Sort.STRING);
  }

  @Test
  void testRefutations() {
    assertSame(WordEquationResult.Kind.REFUTED, solver.reduceEq(cat(s("ab"), x), cat(s("ba"), y)).kind());
    assertSame(WordEquationResult.Kind.REFUTED, solver.reduceEq(cat(x, s("a")), cat(y, s("b"))).kind());
    assertSame(
        WordEquationResult.Kind.REFUTED,
        solver.reduceEq(cat(unit(mgr.mkChar('b')), x), s("ab")).kind());
    // the right side is longer than any value of the left side
    assertSame(
        WordEquationResult.Kind.REFUTED,
        solver.reduceEq(s("ab"), cat(x, unit(mgr.mkConst("c", Sort.CHAR)), s("ab"))).kind());
  }

  @Test
  void testStripEnds() {
    final WordEquationResult result = solver.reduceEq(cat(s("a"), x), cat(s("a"), y));
    assertSame(WordEquationResult.Kind.SIMPLIFIED, result.kind());
    assertEquals(List.of(Pair.of(x, y)), result.equations());

    final WordEquationResult same = solver.reduceEq(x, x);
    assertSame(WordEquationResult.Kind.SIMPLIFIED, same.kind());
    assertTrue(same.equations().isEmpty());

    assertSame(WordEquationResult.Kind.UNCHANGED, solver.reduceEq(x, y).kind());
  }

  @Test
  void testUnitAgainstLiteral() {
    final Term c = mgr.mkConst("c", Sort.CHAR);
    final WordEquationResult result = solver.reduceEq(cat(unit(c), x), s("ab"));
    assertSame(WordEquationResult.Kind.SIMPLIFIED, result.kind());
    assertEquals(List.of(Pair.of(mgr.mkChar('a'), c), Pair.of(x, s("b"))), result.equations());
  }

  @Test
  void testItos() {
    final Term n = mgr.mkConst("n", Sort.INT);
    final WordEquationResult result = solver.reduceEq(mgr.mkItos(n), s("12"));
    assertSame(WordEquationResult.Kind.SIMPLIFIED, result.kind());
    assertEquals(List.of(Pair.of(n, mgr.mkInt(12))), result.equations());

    assertSame(WordEquationResult.Kind.REFUTED, solver.reduceEq(mgr.mkItos(n), s("012")).kind());
    assertSame(WordEquationResult.Kind.REFUTED, solver.reduceEq(s("1a"), mgr.mkItos(n)).kind());
  }

  @Test
  void testSubsequence() {
    final WordEquationResult result = solver.reduceEq(cat(x, y), cat(y, z, x));
    assertSame(WordEquationResult.Kind.SIMPLIFIED, result.kind());
    assertEquals(
        List.of(Pair.of(mgr.mkEmpty(Sort.STRING), z), Pair.of(cat(x, y), cat(y, x))),
        result.equations());
  }

  @Test
  void testNonOverlappingRun() {
    final Term a = unit(mgr.mkChar('a')), b = unit(mgr.mkChar('b'));
    assertSame(
        WordEquationResult.Kind.REFUTED, solver.reduceEq(cat(x, a, a, y), cat(b, a, b)).kind());
  }

  @Test
  void testIllSorted() {
    final Term n = mgr.mkConst("n", Sort.INT);
    assertThrows(IllegalArgumentException.class, () -> solver.reduceEq(n, n));
    final Term u = mgr.mkConst("u", Sort.seq(Sort.INT));
    assertThrows(IllegalArgumentException.class, () -> solver.reduceEq(x, u));
  }

  @Test
  void testReduceContains() {
    final List<Term> split = solver.reduceContains(cat(s("ab"), x), s("c"));
    assertNotNull(split);
    assertEquals(3, split.size());
    final Term a = unit(mgr.mkChar('a')), b = unit(mgr.mkChar('b'));
    assertSame(mgr.mkPrefix(s("c"), cat(a, b, x)), split.get(0));
    assertSame(mgr.mkPrefix(s("c"), cat(b, x)), split.get(1));
    final Term all = mgr.mkReFullSeq(Sort.STRING_RE);
    assertSame(
        mgr.mkInRe(x, mgr.mkReConcat(all, mgr.mkReConcat(mgr.mkToRe(s("c")), all))),
        split.get(2));

    final Term c = unit(mgr.mkConst("c", Sort.CHAR));
    assertEquals(List.of(mgr.mkPrefix(y, c), mgr.mkIsEmpty(y)), solver.reduceContains(c, y));

    assertNull(solver.reduceContains(cat(x, s("a")), y));
  }

  private static String randomWord(Random rand, int maxLen) {
    final StringBuilder builder = new StringBuilder();
    final int len = rand.nextInt(maxLen + 1);
    for (int i = 0; i < len; ++i) builder.append(rand.nextBoolean() ? 'a' : 'b');
    return builder.toString();
  }

  private Term substituteAll(Term t, Map<Term, Term> values) {
    for (Map.Entry<Term, Term> e : values.entrySet()) t = mgr.substitute(t, e.getKey(), e.getValue());
    return t;
  }

  @Test
  void testSolutionsSurvive() {
    final Random rand = new Random(42L);
    final List<Term> strVars = List.of(x, y, z);
    final List<Term> charVars =
        List.of(mgr.mkConst("c0", Sort.CHAR), mgr.mkConst("c1", Sort.CHAR));

    for (int iter = 0; iter < 1000; ++iter) {
      final Map<Term, Term> values = new HashMap<>();
      final Map<Term, String> words = new HashMap<>();
      for (Term v : strVars) {
        final String w = randomWord(rand, 3);
        words.put(v, w);
        values.put(v, mgr.mkString(w));
      }
      final Map<Term, Character> chars = new HashMap<>();
      for (Term c : charVars) {
        final char ch = rand.nextBoolean() ? 'a' : 'b';
        chars.put(c, ch);
        values.put(c, mgr.mkChar(ch));
      }

      final List<Term> lhs = new ArrayList<>();
      final StringBuilder value = new StringBuilder();
      final int n = 1 + rand.nextInt(4);
      for (int i = 0; i < n; ++i) {
        switch (rand.nextInt(4)) {
          case 0: {
            final Term v = strVars.get(rand.nextInt(strVars.size()));
            lhs.add(v);
            value.append(words.get(v));
            break;
          }
          case 1: {
            final String w = rand.nextBoolean() ? "a" : randomWord(rand, 3) + "b";
            lhs.add(mgr.mkString(w));
            value.append(w);
            break;
          }
          case 2: {
            final char ch = rand.nextBoolean() ? 'a' : 'b';
            lhs.add(unit(mgr.mkChar(ch)));
            value.append(ch);
            break;
          }
          default: {
            final Term c = charVars.get(rand.nextInt(charVars.size()));
            lhs.add(unit(c));
            value.append((char) chars.get(c));
            break;
          }
        }
      }

      final String target = value.toString();
      final List<Term> rhs = new ArrayList<>();
      int pos = 0, fresh = 0;
      while (pos < target.length()) {
        final int remaining = target.length() - pos;
        final int kind = rand.nextInt(5);
        if (kind == 0) {
          Term match = null;
          for (Term v : strVars) {
            final String w = words.get(v);
            if (!w.isEmpty() && target.startsWith(w, pos)) match = v;
          }
          if (match != null) {
            rhs.add(match);
            pos += words.get(match).length();
            continue;
          }
        }
        if (kind == 1) {
          final int len = rand.nextInt(Math.min(3, remaining) + 1);
          final Term v = mgr.mkConst("w" + fresh++, Sort.STRING);
          values.put(v, mgr.mkString(target.substring(pos, pos + len)));
          rhs.add(v);
          pos += len;
          continue;
        }
        final char ch = target.charAt(pos);
        if (kind == 2) {
          rhs.add(unit(mgr.mkChar(ch)));
          ++pos;
        } else if (kind == 3) {
          final Term c = charVars.get(rand.nextInt(charVars.size()));
          rhs.add(chars.get(c) == ch ? unit(c) : unit(mgr.mkChar(ch)));
          ++pos;
        } else {
          final int len = 1 + rand.nextInt(Math.min(3, remaining));
          rhs.add(mgr.mkString(target.substring(pos, pos + len)));
          pos += len;
        }
      }

      Term l = mgr.mkConcat(lhs, Sort.STRING), r = mgr.mkConcat(rhs, Sort.STRING);
      if (rand.nextBoolean()) {
        final Term tmp = l;
        l = r;
        r = tmp;
      }
      final Term left = l, right = r;
      final WordEquationResult result = solver.reduceEq(left, right);
      assertNotSame(
          WordEquationResult.Kind.REFUTED, result.kind(), () -> left + " = " + right);
      for (Pair<Term, Term> eq : result.equations()) {
        final Object v1 = valueOf(substituteAll(eq.getLeft(), values));
        final Object v2 = valueOf(substituteAll(eq.getRight(), values));
        assertNotNull(v1, eq::toString);
        assertEquals(v1, v2, () -> left + " = " + right + " gave " + eq);
      }
    }
  }
}
