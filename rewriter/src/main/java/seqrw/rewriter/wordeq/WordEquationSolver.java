package seqrw.rewriter.wordeq;

import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import seqrw.term.Op;
import seqrw.term.Sort;
import seqrw.term.Term;
import seqrw.term.TermManager;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static seqrw.common.utils.ListSupport.tail;
import static seqrw.term.TermSupport.areDistinct;
import static seqrw.term.TermSupport.charOf;
import static seqrw.term.TermSupport.getConcat;
import static seqrw.term.TermSupport.isBoundedLength;
import static seqrw.term.TermSupport.isEmpty;
import static seqrw.term.TermSupport.minLength;
import static seqrw.term.TermSupport.stringOf;

/**
 * Simplifies an equation between two concatenations. The reduction strips matching operands from
 * both ends, decides equations of integer-to-string conversions against literals, compares
 * lengths, matches a shorter side as a subsequence of the longer one and looks for literal runs
 * that cannot occur on the other side.
 */
public class WordEquationSolver {
  private static final Logger LOG = LoggerFactory.getLogger(WordEquationSolver.class);

  private final TermManager mgr;

  public WordEquationSolver(TermManager mgr) {
    this.mgr = mgr;
  }

  public WordEquationResult reduceEq(Term l, Term r) {
    if (!l.sort().isSeq() || !l.sort().equals(r.sort()))
      throw new IllegalArgumentException("not a sequence equation: " + l + " = " + r);
    final WordEquationResult result = reduce(getConcat(l), getConcat(r), l.sort());
    if (result.kind() == WordEquationResult.Kind.REFUTED) LOG.debug("refuted {} = {}", l, r);
    return result;
  }

  /**
   * Reduces {@code ls = rs}, both read as concatenations of sort {@code sort}. The residual of the
   * two sides, if not trivially empty, is the last of the returned equations.
   */
  public WordEquationResult reduce(List<Term> ls0, List<Term> rs0, Sort sort) {
    final List<Term> ls = new ArrayList<>(ls0), rs = new ArrayList<>(rs0);
    final List<Pair<Term, Term>> eqs = new ArrayList<>();
    removeEmptyAndConcats(ls);
    removeEmptyAndConcats(rs);
    final List<Term> l1 = List.copyOf(ls), r1 = List.copyOf(rs);

    final boolean sat =
        reduceBack(ls, rs, eqs)
            && reduceFront(ls, rs, eqs)
            && reduceItos(ls, rs, eqs)
            && reduceItos(rs, ls, eqs)
            && reduceByLength(ls, rs, eqs, sort)
            && reduceSubsequence(ls, rs, eqs, sort)
            && reduceNonOverlap(ls, rs)
            && reduceNonOverlap(rs, ls);
    if (!sat) return WordEquationResult.refuted();

    final boolean changed =
        !eqs.isEmpty()
            || !((ls.equals(l1) && rs.equals(r1)) || (ls.equals(r1) && rs.equals(l1)));
    if (!changed) return WordEquationResult.unchanged();

    if (!ls.isEmpty() || !rs.isEmpty())
      eqs.add(Pair.of(mgr.mkConcat(ls, sort), mgr.mkConcat(rs, sort)));
    return WordEquationResult.simplified(eqs);
  }

  private static void removeEmptyAndConcats(List<Term> es) {
    final List<Term> flat = new ArrayList<>(es.size());
    for (Term e : es) getConcat(e, flat);
    es.clear();
    es.addAll(flat);
  }

  private boolean reduceBack(List<Term> ls, List<Term> rs, List<Pair<Term, Term>> eqs) {
    while (!ls.isEmpty() && !rs.isEmpty()) {
      final Term l = ls.get(ls.size() - 1), r = rs.get(rs.size() - 1);
      final String s1 = stringOf(l), s2 = stringOf(r);
      if (l == r) {
        removeLast(ls);
        removeLast(rs);
      } else if (l.is(Op.SEQ_UNIT) && r.is(Op.SEQ_UNIT)) {
        if (areDistinct(l.arg(0), r.arg(0))) return false;
        eqs.add(Pair.of(l.arg(0), r.arg(0)));
        removeLast(ls);
        removeLast(rs);
      } else if (l.is(Op.SEQ_UNIT) && s2 != null) {
        if (!popLastChar(l, rs, s2, eqs)) return false;
        removeLast(ls);
      } else if (r.is(Op.SEQ_UNIT) && s1 != null) {
        if (!popLastChar(r, ls, s1, eqs)) return false;
        removeLast(rs);
      } else if (s1 != null && s2 != null) {
        final int min = Math.min(s1.length(), s2.length());
        for (int i = 0; i < min; ++i) {
          if (s1.charAt(s1.length() - i - 1) != s2.charAt(s2.length() - i - 1)) return false;
        }
        removeLast(ls);
        removeLast(rs);
        if (min < s1.length()) ls.add(mgr.mkString(s1.substring(0, s1.length() - min)));
        if (min < s2.length()) rs.add(mgr.mkString(s2.substring(0, s2.length() - min)));
      } else {
        break;
      }
    }
    return true;
  }

  /** Matches {@code unit} against the last character of the literal {@code s} ending {@code es}. */
  private boolean popLastChar(Term unit, List<Term> es, String s, List<Pair<Term, Term>> eqs) {
    final Term ch = mgr.mkChar(s.charAt(s.length() - 1));
    if (areDistinct(ch, unit.arg(0))) return false;
    eqs.add(Pair.of(ch, unit.arg(0)));
    if (s.length() == 1) removeLast(es);
    else es.set(es.size() - 1, mgr.mkString(s.substring(0, s.length() - 1)));
    return true;
  }

  private boolean reduceFront(List<Term> ls, List<Term> rs, List<Pair<Term, Term>> eqs) {
    int head1 = 0, head2 = 0;
    while (head1 < ls.size() && head2 < rs.size()) {
      final Term l = ls.get(head1), r = rs.get(head2);
      final String s1 = stringOf(l), s2 = stringOf(r);
      if (l == r) {
        ++head1;
        ++head2;
      } else if (l.is(Op.SEQ_UNIT) && r.is(Op.SEQ_UNIT)) {
        if (areDistinct(l.arg(0), r.arg(0))) return false;
        eqs.add(Pair.of(l.arg(0), r.arg(0)));
        ++head1;
        ++head2;
      } else if (l.is(Op.SEQ_UNIT) && s2 != null) {
        if (!popFirstChar(l, rs, head2, s2, eqs)) return false;
        ++head1;
        if (s2.length() == 1) ++head2;
      } else if (r.is(Op.SEQ_UNIT) && s1 != null) {
        if (!popFirstChar(r, ls, head1, s1, eqs)) return false;
        ++head2;
        if (s1.length() == 1) ++head1;
      } else if (s1 != null && s2 != null) {
        final int min = Math.min(s1.length(), s2.length());
        for (int i = 0; i < min; ++i) {
          if (s1.charAt(i) != s2.charAt(i)) return false;
        }
        if (min == s1.length()) ++head1;
        else ls.set(head1, mgr.mkString(s1.substring(min)));
        if (min == s2.length()) ++head2;
        else rs.set(head2, mgr.mkString(s2.substring(min)));
      } else {
        break;
      }
    }
    ls.subList(0, head1).clear();
    rs.subList(0, head2).clear();
    return true;
  }

  private boolean popFirstChar(
      Term unit, List<Term> es, int at, String s, List<Pair<Term, Term>> eqs) {
    final Term ch = mgr.mkChar(s.charAt(0));
    if (areDistinct(ch, unit.arg(0))) return false;
    eqs.add(Pair.of(ch, unit.arg(0)));
    if (s.length() > 1) es.set(at, mgr.mkString(s.substring(1)));
    return true;
  }

  /** Solves {@code itos(n) = w} for a concrete word w. */
  private boolean reduceItos(List<Term> ls, List<Term> rs, List<Pair<Term, Term>> eqs) {
    if (ls.size() != 1 || !ls.get(0).is(Op.STRING_ITOS)) return true;
    final String s = concreteString(rs);
    if (s == null || s.isEmpty()) return true;
    for (int i = 0; i < s.length(); ++i) {
      final char c = s.charAt(i);
      if (c < '0' || c > '9') return false;
    }
    final BigInteger v = new BigInteger(s);
    // decimal encodings have no leading zeros
    if (!v.toString().equals(s)) return false;
    eqs.add(Pair.of(ls.get(0).arg(0), mgr.mkInt(v)));
    ls.clear();
    rs.clear();
    return true;
  }

  private static String concreteString(List<Term> es) {
    final StringBuilder builder = new StringBuilder();
    for (Term e : es) {
      final String s = stringOf(e);
      if (s != null) builder.append(s);
      else if (e.is(Op.SEQ_UNIT) && charOf(e.arg(0)) >= 0) builder.append((char) charOf(e.arg(0)));
      else return null;
    }
    return builder.toString();
  }

  private boolean reduceByLength(
      List<Term> ls, List<Term> rs, List<Pair<Term, Term>> eqs, Sort sort) {
    if (ls.isEmpty() && rs.isEmpty()) return true;
    final int len1 = minLength(ls), len2 = minLength(rs);
    final boolean bounded1 = isBoundedLength(ls), bounded2 = isBoundedLength(rs);
    if (bounded1 && len1 < len2) return false;
    if (bounded2 && len2 < len1) return false;
    if (len1 == len2 && len1 > 0 && (bounded1 || bounded2)) {
      setEmpty(bounded1 ? rs : ls, eqs, sort);
      eqs.add(Pair.of(concatNonEmpty(ls, sort), concatNonEmpty(rs, sort)));
      ls.clear();
      rs.clear();
    }
    return true;
  }

  /** Equates every operand that is neither a unit nor a literal with the empty sequence. */
  private void setEmpty(List<Term> es, List<Pair<Term, Term>> eqs, Sort sort) {
    for (Term e : es) {
      if (!e.is(Op.SEQ_UNIT) && stringOf(e) == null && !isEmpty(e))
        eqs.add(Pair.of(mgr.mkEmpty(sort), e));
    }
  }

  /** Whether {@code e} certainly has a positive length. */
  private static boolean isNonEmpty(Term e) {
    final String s = stringOf(e);
    return e.is(Op.SEQ_UNIT) || (s != null && !s.isEmpty());
  }

  private Term concatNonEmpty(List<Term> es, Sort sort) {
    final List<Term> kept = new ArrayList<>(es.size());
    for (Term e : es) if (isNonEmpty(e)) kept.add(e);
    return mgr.mkConcat(kept, sort);
  }

  /**
   * When every operand of the shorter side is matched, in any order, by an identical operand or a
   * unit-by-unit of the longer side, the unmatched operands of the longer side must be empty.
   */
  private boolean reduceSubsequence(
      List<Term> ls, List<Term> rs, List<Pair<Term, Term>> eqs, Sort sort) {
    final List<Term> xs = ls.size() > rs.size() ? rs : ls;
    final List<Term> ys = xs == ls ? rs : ls;
    if (xs.size() == ys.size()) return true;
    if (xs.isEmpty() && ys.size() == 1) return true;

    final Set<Integer> matched = new HashSet<>();
    for (Term x : xs) {
      int j = 0;
      for (; j < ys.size(); ++j) {
        final Term y = ys.get(j);
        if (!matched.contains(j) && (x == y || (x.is(Op.SEQ_UNIT) && y.is(Op.SEQ_UNIT)))) {
          matched.add(j);
          break;
        }
      }
      if (j == ys.size()) return true;
    }

    final List<Term> kept = new ArrayList<>(xs.size());
    for (int j = 0; j < ys.size(); ++j) {
      final Term y = ys.get(j);
      if (matched.contains(j)) kept.add(y);
      else if (isNonEmpty(y)) return false;
      else if (!isEmpty(y)) eqs.add(Pair.of(mgr.mkEmpty(sort), y));
    }
    if (!xs.isEmpty()) eqs.add(Pair.of(mgr.mkConcat(xs, sort), mgr.mkConcat(kept, sort)));
    ls.clear();
    rs.clear();
    return true;
  }

  /** Fails when {@code rs} is all units and a run of units of {@code ls} cannot occur in it. */
  private static boolean reduceNonOverlap(List<Term> ls, List<Term> rs) {
    for (Term u : rs) if (!u.is(Op.SEQ_UNIT)) return true;
    List<Term> pattern = new ArrayList<>();
    for (Term x : ls) {
      if (x.is(Op.SEQ_UNIT)) {
        pattern.add(x);
      } else if (!pattern.isEmpty()) {
        if (OverlapSupport.nonOverlap(pattern, rs)) return false;
        pattern = new ArrayList<>();
      }
    }
    return pattern.isEmpty() || !OverlapSupport.nonOverlap(pattern, rs);
  }

  /**
   * Splits {@code contains(a, b)} into the disjunction of where an occurrence of b may start in a.
   * Null when a begins with an operand whose content is unknown.
   */
  public List<Term> reduceContains(Term a, Term b) {
    final Sort sort = a.sort();
    final List<Term> lhs = getConcat(a);
    final List<Term> disj = new ArrayList<>();
    for (int i = 0; i < lhs.size(); ++i) {
      final Term e = lhs.get(i);
      final String s = stringOf(e);
      if (s != null) {
        final List<Term> es = new ArrayList<>(s.length() + lhs.size() - i);
        for (int j = 0; j < s.length(); ++j) es.add(mgr.mkUnit(mgr.mkChar(s.charAt(j))));
        es.addAll(lhs.subList(i + 1, lhs.size()));
        for (int j = 0; j < s.length(); ++j)
          disj.add(mgr.mkPrefix(b, mgr.mkConcat(es.subList(j, es.size()), sort)));
        continue;
      }
      if (e.is(Op.SEQ_UNIT)) {
        disj.add(mgr.mkPrefix(b, mgr.mkConcat(tail(lhs, i), sort)));
        continue;
      }
      if (stringOf(b) != null) {
        final Sort reSort = Sort.re(b.sort());
        final Term all = mgr.mkReFullSeq(reSort);
        final Term pattern = mgr.mkReConcat(all, mgr.mkReConcat(mgr.mkToRe(b), all));
        disj.add(mgr.mkInRe(mgr.mkConcat(tail(lhs, i), sort), pattern));
        return disj;
      }
      if (i == 0) return null;
      disj.add(mgr.mkContains(mgr.mkConcat(tail(lhs, i), sort), b));
      return disj;
    }
    disj.add(mgr.mkIsEmpty(b));
    return disj;
  }

  private static void removeLast(List<Term> es) {
    es.remove(es.size() - 1);
  }
}
