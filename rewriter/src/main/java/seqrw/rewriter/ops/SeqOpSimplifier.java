package seqrw.rewriter.ops;

import seqrw.common.utils.Bag;
import seqrw.rewriter.RewriteResult;
import seqrw.term.Op;
import seqrw.term.Sort;
import seqrw.term.Term;
import seqrw.term.TermManager;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static seqrw.common.utils.IterableSupport.all;
import static seqrw.common.utils.ListSupport.slice;
import static seqrw.common.utils.ListSupport.tail;
import static seqrw.term.TermSupport.areDistinct;
import static seqrw.term.TermSupport.areEqual;
import static seqrw.term.TermSupport.charOf;
import static seqrw.term.TermSupport.getConcat;
import static seqrw.term.TermSupport.getConcatUnits;
import static seqrw.term.TermSupport.getLeftmostConcat;
import static seqrw.term.TermSupport.isBoundedLength;
import static seqrw.term.TermSupport.isConstChar;
import static seqrw.term.TermSupport.isEmpty;
import static seqrw.term.TermSupport.isUnsigned;
import static seqrw.term.TermSupport.isValue;
import static seqrw.term.TermSupport.isZero;
import static seqrw.term.TermSupport.minLength;
import static seqrw.term.TermSupport.numeralOf;
import static seqrw.term.TermSupport.smallIntOf;
import static seqrw.term.TermSupport.stringOf;

/**
 * Local rules of the sequence operators. Every {@code mkSeqX} method takes the already rewritten
 * arguments of one application and either fails or returns an equivalent term.
 */
public class SeqOpSimplifier {
  public enum LengthComparison {
    SHORTER,
    SAME,
    LONGER,
    UNKNOWN
  }

  enum Sign {
    NEG,
    ZERO,
    POS
  }

  /** An integer term read as {@code offset + len(lens[0]) + .. + len(lens[n-1])}. */
  static final class LengthSum {
    final List<Term> lens = new ArrayList<>();
    BigInteger offset = BigInteger.ZERO;
  }

  private final TermManager mgr;
  private final boolean coalesceChars;

  public SeqOpSimplifier(TermManager mgr, boolean coalesceChars) {
    this.mgr = mgr;
    this.coalesceChars = coalesceChars;
  }

  public TermManager mgr() {
    return mgr;
  }

  public boolean coalesceChars() {
    return coalesceChars;
  }

  public RewriteResult mkSeqUnit(Term e) {
    if (coalesceChars && isConstChar(e)) {
      return RewriteResult.done(mgr.mkString(String.valueOf((char) charOf(e))));
    }
    return RewriteResult.failed();
  }

  public RewriteResult mkSeqConcat(Term a, Term b) {
    final String s1 = coalesceChars ? stringOf(a) : null;
    final String s2 = coalesceChars ? stringOf(b) : null;
    if (s1 != null && s2 != null) return RewriteResult.done(mgr.mkString(s1 + s2));

    if (a.is(Op.SEQ_CONCAT)) {
      return RewriteResult.rewrite2(mgr.mkConcat(a.arg(0), mgr.mkConcat(restOf(a), b)));
    }
    if (isEmpty(a)) return RewriteResult.done(b);
    if (isEmpty(b)) return RewriteResult.done(a);

    if (s1 != null && b.is(Op.SEQ_CONCAT)) {
      final String s3 = stringOf(b.arg(0));
      if (s3 != null) return RewriteResult.done(mgr.mkConcat(mgr.mkString(s1 + s3), restOf(b)));
    }
    return RewriteResult.failed();
  }

  /** {@code a ++ b} simplified by one step of {@link #mkSeqConcat} where it applies. */
  public Term mkSeqConcatTerm(Term a, Term b) {
    final RewriteResult r = mkSeqConcat(a, b);
    return r.isFailed() ? mgr.mkConcat(a, b) : r.result();
  }

  public RewriteResult mkSeqLength(Term a) {
    final List<Term> es = getConcat(a);
    final List<Term> symbolic = new ArrayList<>();
    int len = 0;
    for (Term e : es) {
      final String s = stringOf(e);
      if (s != null) len += s.length();
      else if (e.is(Op.SEQ_UNIT)) ++len;
      else symbolic.add(e);
    }
    if (symbolic.isEmpty()) return RewriteResult.done(mgr.mkInt(len));

    if (symbolic.size() != es.size() || symbolic.size() != 1) {
      final List<Term> sum = new ArrayList<>(symbolic.size() + 1);
      for (Term e : symbolic) sum.add(mgr.mkLength(e));
      if (len != 0) sum.add(mgr.mkInt(len));
      return RewriteResult.rewrite2(mgr.mkAdd(sum));
    }
    return RewriteResult.failed();
  }

  public RewriteResult mkSeqExtract(Term a, Term b, Term c) {
    final Sort sort = a.sort();
    final Term empty = mgr.mkEmpty(sort);

    if (signIsDetermined(c) == Sign.NEG) return RewriteResult.done(empty);

    final BigInteger posNum = numeralOf(b), lenNum = numeralOf(c);
    final String s = stringOf(a);
    if (posNum != null && posNum.signum() < 0) return RewriteResult.done(empty);
    if (lenNum != null && lenNum.signum() <= 0) return RewriteResult.done(empty);
    if (posNum != null && s != null && posNum.compareTo(BigInteger.valueOf(s.length())) >= 0)
      return RewriteResult.done(empty);

    final boolean constantPos = isUnsigned(b), constantLen = isUnsigned(c);
    final int pos = constantPos ? smallIntOf(b) : 0;
    final int len = constantLen ? smallIntOf(c) : 0;

    if (constantPos && constantLen && s != null) {
      final long end = (long) pos + len;
      final String sub = end >= s.length() ? s.substring(pos) : s.substring(pos, (int) end);
      return RewriteResult.done(mgr.mkString(sub));
    }

    final List<Term> as = getConcatUnits(mgr, a);
    if (as.isEmpty()) return RewriteResult.done(empty);

    if (b.is(Op.SEQ_LENGTH) || b.is(Op.ADD)) return extractAfterLengths(a, b, c);

    if (!constantPos) return RewriteResult.failed();

    // extract(a2 ++ s, 0, len(a2)) = a2
    if (pos == 0 && c.is(Op.SEQ_LENGTH)) {
      final List<Term> lhs = getConcat(a);
      if (!lhs.isEmpty() && lhs.get(0) == c.arg(0)) return RewriteResult.done(c.arg(0));
    }

    if (a.is(Op.SEQ_EXTRACT)
        && isSuffix(a.arg(0), a.arg(1), a.arg(2))
        && isSuffix(a, b, c)) {
      final Term a1 = a.arg(0), b1 = a.arg(1), c1 = a.arg(2);
      return RewriteResult.rewrite3(mgr.mkExtract(a1, mgr.mkAdd(b1, b), mgr.mkSub(c1, b)));
    }

    int offset = 0;
    while (offset < as.size() && as.get(offset).is(Op.SEQ_UNIT) && offset < pos) ++offset;
    if (offset == 0 && pos > 0) return RewriteResult.failed();

    if (pos == 0 && all(as, e -> e.is(Op.SEQ_UNIT))) {
      Term result = empty;
      for (int i = 1; i <= as.size(); ++i) {
        result =
            mgr.mkIte(
                mgr.mkGe(c, mgr.mkInt(i)), mgr.mkConcat(as.subList(0, i), sort), result);
      }
      return RewriteResult.rewriteFull(result);
    }
    if (pos == 0 && !constantLen) return RewriteResult.failed();

    // the prefix of units was consumed by the offset
    if (offset == as.size()) return RewriteResult.done(empty);

    if (constantLen && pos == offset) {
      int i = offset;
      while (i < as.size() && as.get(i).is(Op.SEQ_UNIT) && i - offset < len) ++i;
      if (i - offset == len)
        return RewriteResult.done(mgr.mkConcat(as.subList(offset, offset + len), sort));
      if (i == as.size()) return RewriteResult.done(mgr.mkConcat(tail(as, offset), sort));
    }
    if (offset == 0) return RewriteResult.failed();

    final Term pos1 = mgr.mkSub(b, mgr.mkInt(offset));
    return RewriteResult.rewrite3(mgr.mkExtract(mgr.mkConcat(tail(as, offset), sort), pos1, c));
  }

  private RewriteResult extractAfterLengths(Term a, Term b, Term c) {
    final LengthSum sum = getLengths(b);
    if (sum == null || sum.offset.signum() < 0) return RewriteResult.failed();

    final List<Term> lhs = getConcat(a);
    BigInteger pos = sum.offset;
    int i = 0;
    for (; i < lhs.size(); ++i) {
      final Term e = lhs.get(i);
      if (sum.lens.remove(e)) continue;
      if (e.is(Op.SEQ_UNIT) && pos.signum() > 0) pos = pos.subtract(BigInteger.ONE);
      else break;
    }
    if (i == 0) return RewriteResult.failed();

    final Term t1 = mgr.mkConcat(tail(lhs, i), a.sort());
    Term t2 = mgr.mkInt(pos);
    for (Term rest : sum.lens) t2 = mgr.mkAdd(t2, mgr.mkLength(rest));
    return RewriteResult.rewrite2(mgr.mkExtract(t1, t2, c));
  }

  /** Whether {@code extract(s, offset, len)} is a suffix of s: len = len(s) - offset, offset > 0. */
  private boolean isSuffix(Term s, Term offset, Term len) {
    final BigInteger off = numeralOf(offset);
    if (off == null || off.signum() <= 0) return false;
    final LengthSum sum = getLengths(len);
    return sum != null
        && sum.lens.size() == 1
        && sum.lens.get(0) == s
        && sum.offset.negate().equals(off);
  }

  /** Reads {@code e} as a constant plus a sum of sequence lengths. Null for any other shape. */
  LengthSum getLengths(Term e) {
    final LengthSum sum = new LengthSum();
    final Deque<Term> todo = new ArrayDeque<>();
    todo.push(e);
    while (!todo.isEmpty()) {
      final Term t = todo.pop();
      final BigInteger v = numeralOf(t);
      if (t.is(Op.ADD)) {
        for (int i = t.numArgs() - 1; i >= 0; --i) todo.push(t.arg(i));
      } else if (t.is(Op.SEQ_LENGTH)) {
        sum.lens.add(t.arg(0));
      } else if (v != null) {
        sum.offset = sum.offset.add(v);
      } else {
        return null;
      }
    }
    return sum;
  }

  /**
   * A sign that holds for every value of {@code e}, null if undetermined. NEG means the value is
   * at most zero.
   */
  Sign signIsDetermined(Term e) {
    final BigInteger v = numeralOf(e);
    if (v != null) return v.signum() > 0 ? Sign.POS : v.signum() < 0 ? Sign.NEG : Sign.ZERO;
    if (e.is(Op.SEQ_LENGTH)) return Sign.POS;
    if (e.is(Op.ADD)) {
      Sign s = Sign.ZERO;
      for (Term arg : e.args()) {
        final Sign s1 = signIsDetermined(arg);
        if (s1 == null) return null;
        if (s1 == Sign.ZERO) continue;
        if (s == Sign.ZERO) s = s1;
        else if (s != s1) return null;
      }
      return s;
    }
    if (e.is(Op.MUL)) {
      Sign s = Sign.ZERO;
      for (Term arg : e.args()) {
        final Sign s1 = signIsDetermined(arg);
        if (s1 == null) return null;
        if (s1 == Sign.ZERO) return Sign.ZERO;
        if (s == Sign.ZERO) s = s1;
        else s = s != s1 ? Sign.NEG : Sign.POS;
      }
      return s;
    }
    return null;
  }

  public RewriteResult mkSeqContains(Term a, Term b) {
    final String c = stringOf(a), d = stringOf(b);
    if (c != null && d != null) return RewriteResult.done(mgr.mkBool(c.contains(d)));

    if (b.is(Op.SEQ_EXTRACT) && b.arg(0) == a) return RewriteResult.done(mgr.mkTrue());

    final List<Term> as = getConcatUnits(mgr, a), bs = getConcatUnits(mgr, b);
    if (bs.isEmpty()) return RewriteResult.done(mgr.mkTrue());
    if (as.isEmpty()) return RewriteResult.rewrite2(mgr.mkIsEmpty(b));

    for (int i = 0; bs.size() + i <= as.size(); ++i) {
      int j = 0;
      while (j < bs.size() && as.get(i + j) == bs.get(j)) ++j;
      if (j == bs.size()) return RewriteResult.done(mgr.mkTrue());
    }

    if (all(as, e -> isValue(e)) && all(bs, e -> isValue(e)))
      return RewriteResult.done(mgr.mkFalse());

    if (isBoundedLength(as) && minLength(bs) > minLength(as))
      return RewriteResult.done(mgr.mkFalse());

    // drop the operands no occurrence of b can start or end in
    int offs = 0, sz = as.size();
    final Term b0 = bs.get(0), bL = bs.get(bs.size() - 1);
    while (offs < sz && cannotContainPrefix(as.get(offs), b0)) ++offs;
    while (offs < sz && cannotContainSuffix(as.get(sz - 1), bL)) --sz;
    if (offs == sz) return RewriteResult.rewrite2(mgr.mkIsEmpty(b));
    if (offs > 0 || sz < as.size()) {
      final Term trimmed = mgr.mkConcat(as.subList(offs, sz), a.sort());
      return RewriteResult.rewrite2(mgr.mkContains(trimmed, b));
    }

    if (all(as, e -> e.is(Op.SEQ_UNIT)) && all(bs, e -> e.is(Op.SEQ_UNIT))) {
      final List<Term> ors = new ArrayList<>();
      for (int i = 0; i + bs.size() <= as.size(); ++i) {
        final List<Term> ands = new ArrayList<>(bs.size());
        for (int j = 0; j < bs.size(); ++j) ands.add(mgr.mkEq(as.get(i + j), bs.get(j)));
        ors.add(mgr.mkAnd(ands));
      }
      return RewriteResult.rewriteFull(mgr.mkOr(ors));
    }

    if (bs.size() == 1 && b0.is(Op.SEQ_UNIT) && as.size() > 1) {
      final List<Term> ors = new ArrayList<>(as.size());
      for (Term e : as) ors.add(mgr.mkContains(e, b0));
      return RewriteResult.rewriteFull(mgr.mkOr(ors));
    }
    return RewriteResult.failed();
  }

  /** Whether no occurrence of a word starting with {@code b} can start inside {@code a}. */
  private static boolean cannotContainPrefix(Term a, Term b) {
    if (a.is(Op.SEQ_UNIT) && b.is(Op.SEQ_UNIT)) return areDistinct(a, b);
    final String s = stringOf(a), t = stringOf(b);
    if (s == null || t == null) return false;
    for (int i = 0; i < s.length(); ++i) {
      final String suffix = s.substring(i);
      if (t.startsWith(suffix) || suffix.startsWith(t)) return false;
    }
    return true;
  }

  /** Whether no occurrence of a word ending with {@code b} can end inside {@code a}. */
  private static boolean cannotContainSuffix(Term a, Term b) {
    if (a.is(Op.SEQ_UNIT) && b.is(Op.SEQ_UNIT)) return areDistinct(a, b);
    final String s = stringOf(a), t = stringOf(b);
    if (s == null || t == null) return false;
    for (int i = 1; i <= s.length(); ++i) {
      final String prefix = s.substring(0, i);
      if (t.endsWith(prefix) || prefix.endsWith(t)) return false;
    }
    return true;
  }

  public RewriteResult mkSeqAt(Term a, Term b) {
    final Sort sort = a.sort();
    final Term empty = mgr.mkEmpty(sort);
    final LengthSum sum = getLengths(b);
    if (sum == null) return RewriteResult.failed();

    BigInteger r = sum.offset;
    if (sum.lens.isEmpty() && r.signum() < 0) return RewriteResult.done(empty);
    if (sum.lens.isEmpty() && a.is(Op.SEQ_AT))
      return RewriteResult.done(r.signum() > 0 ? empty : a);

    final List<Term> lhs = getConcatUnits(mgr, a);
    if (lhs.isEmpty()) return RewriteResult.done(empty);

    int i = 0;
    for (; i < lhs.size(); ++i) {
      final Term e = lhs.get(i);
      if (r.signum() >= 0 && sum.lens.remove(e)) continue;
      if (e.is(Op.SEQ_UNIT) && r.signum() == 0 && sum.lens.isEmpty())
        return RewriteResult.rewrite1(e);
      if (e.is(Op.SEQ_UNIT) && r.signum() > 0) r = r.subtract(BigInteger.ONE);
      else break;
    }
    if (i == 0) return RewriteResult.failed();
    if (i == lhs.size()) return RewriteResult.done(empty);

    Term pos = mgr.mkInt(r);
    for (Term rest : sum.lens) pos = mgr.mkAdd(pos, mgr.mkLength(rest));
    return RewriteResult.rewrite2(mgr.mkAt(mgr.mkConcat(tail(lhs, i), sort), pos));
  }

  public RewriteResult mkSeqNth(Term a, Term b) {
    if (a.is(Op.SEQ_UNIT) && isZero(b)) return RewriteResult.done(a.arg(0));

    if (a.is(Op.SEQ_EXTRACT)) {
      final Term s = a.arg(0);
      final BigInteger p = numeralOf(a.arg(1));
      final LengthSum sum = getLengths(a.arg(2));
      if (p != null
          && sum != null
          && sum.offset.negate().equals(p)
          && sum.lens.size() == 1
          && sum.lens.get(0) == s) {
        return RewriteResult.rewriteFull(mgr.mkNth(s, mgr.mkAdd(b, mgr.mkInt(p))));
      }
    }

    final Term inRange =
        mgr.mkAnd(mgr.mkGe(b, mgr.mkInt(0)), mgr.mkNot(mgr.mkLe(mgr.mkLength(a), b)));
    return RewriteResult.rewriteFull(mgr.mkIte(inRange, mgr.mkNthI(a, b), mgr.mkNthU(a, b)));
  }

  public RewriteResult mkSeqNthI(Term a, Term b) {
    if (!isUnsigned(b)) return RewriteResult.failed();
    final int k = smallIntOf(b);
    final List<Term> as = getConcatUnits(mgr, a);
    for (int i = 0; i < as.size() && as.get(i).is(Op.SEQ_UNIT); ++i) {
      if (i == k) return RewriteResult.done(as.get(i).arg(0));
    }
    return RewriteResult.failed();
  }

  public RewriteResult mkSeqLastIndex(Term a, Term b) {
    final String s1 = stringOf(a), s2 = stringOf(b);
    if (s1 != null && s2 != null) return RewriteResult.done(mgr.mkInt(s1.lastIndexOf(s2)));
    return RewriteResult.failed();
  }

  public RewriteResult mkSeqIndex(Term a, Term b, Term c) {
    final Sort sort = a.sort();
    final Term zero = mgr.mkInt(0), minusOne = mgr.mkInt(-1);
    final String s1 = stringOf(a), s2 = stringOf(b);
    final BigInteger r = numeralOf(c);

    if (s1 != null && s2 != null && isUnsigned(c)) {
      final int from = smallIntOf(c);
      return RewriteResult.done(mgr.mkInt(from > s1.length() ? -1 : s1.indexOf(s2, from)));
    }
    if (r != null && r.signum() < 0) return RewriteResult.done(minusOne);
    if (isEmpty(b) && isZero(c)) return RewriteResult.done(c);

    if (isEmpty(a)) {
      final Term cond = mgr.mkAnd(mgr.mkEq(c, zero), mgr.mkIsEmpty(b));
      return RewriteResult.rewrite2(mgr.mkIte(cond, zero, minusOne));
    }

    if (a == b) {
      if (r != null) return RewriteResult.done(r.signum() == 0 ? zero : minusOne);
      return RewriteResult.rewrite2(mgr.mkIte(mgr.mkEq(zero, c), zero, minusOne));
    }

    final List<Term> as = getConcatUnits(mgr, a);
    // skip units the search starts after
    if (r != null) {
      BigInteger rest = r;
      int i = 0;
      while (i < as.size() && rest.signum() > 0 && as.get(i).is(Op.SEQ_UNIT)) {
        rest = rest.subtract(BigInteger.ONE);
        ++i;
      }
      if (i > 0) return shiftedIndex(tail(as, i), sort, b, mgr.mkInt(rest), i);
    }

    final List<Term> bs = getConcatUnits(mgr, b);
    if (isZero(c) && !bs.isEmpty()) {
      int i = 0;
      while (i < as.size()
          && as.get(i).is(Op.SEQ_UNIT)
          && bs.get(0).is(Op.SEQ_UNIT)
          && areDistinct(as.get(i), bs.get(0))) ++i;
      if (i > 0) return shiftedIndex(tail(as, i), sort, b, c, i);
    }

    switch (compareLengths(as, bs)) {
      case SHORTER:
        if (isZero(c)) return RewriteResult.done(minusOne);
        break;
      case SAME: {
        final Term same =
            mgr.mkIte(
                mgr.mkLe(c, minusOne),
                minusOne,
                mgr.mkIte(mgr.mkEq(c, zero), mgr.mkIte(mgr.mkEq(a, b), zero, minusOne), minusOne));
        return RewriteResult.rewriteFull(same);
      }
      default:
        break;
    }

    if (isZero(c) && !as.isEmpty() && as.get(0).is(Op.SEQ_UNIT)) {
      final Term a1 = mgr.mkConcat(tail(as, 1), sort);
      final Term b1 = mgr.mkIndex(a1, b, c);
      final Term result =
          mgr.mkIte(
              mgr.mkPrefix(b, a),
              zero,
              mgr.mkIte(mgr.mkGe(b1, zero), mgr.mkAdd(mgr.mkInt(1), b1), minusOne));
      return RewriteResult.rewrite3(result);
    }
    return RewriteResult.failed();
  }

  private RewriteResult shiftedIndex(List<Term> rest, Sort sort, Term b, Term from, int shift) {
    final Term idx = mgr.mkIndex(mgr.mkConcat(rest, sort), b, from);
    final Term result =
        mgr.mkIte(
            mgr.mkGe(idx, mgr.mkInt(0)), mgr.mkAdd(mgr.mkInt(shift), idx), mgr.mkInt(-1));
    return RewriteResult.rewriteFull(result);
  }

  /** Compares lengths by counting units and cancelling symbolic operands occurring on both sides. */
  public static LengthComparison compareLengths(List<Term> as, List<Term> bs) {
    int unitsA = 0, unitsB = 0;
    final Bag<Term> multA = new Bag<>(), multB = new Bag<>();
    for (Term e : as) {
      if (e.is(Op.SEQ_UNIT)) ++unitsA;
      else multA.add(e);
    }
    boolean bHasForeign = false;
    for (Term e : bs) {
      if (e.is(Op.SEQ_UNIT)) ++unitsB;
      else if (!multA.removeOne(e)) {
        multB.add(e);
        bHasForeign = true;
      }
    }
    final boolean cancelled = multA.isEmpty() && multB.isEmpty();
    if (unitsA > unitsB && !bHasForeign) return LengthComparison.LONGER;
    if (unitsA == unitsB && cancelled) return LengthComparison.SAME;
    if (unitsB > unitsA && multA.isEmpty()) return LengthComparison.SHORTER;
    return LengthComparison.UNKNOWN;
  }

  public RewriteResult mkSeqReplace(Term a, Term b, Term c) {
    final Sort sort = a.sort();
    final String s1 = stringOf(a), s2 = stringOf(b), s3 = stringOf(c);
    if (s1 != null && s2 != null && s3 != null)
      return RewriteResult.done(mgr.mkString(replaceFirst(s1, s2, s3)));

    if (b == c) return RewriteResult.done(a);
    if (a == b) return RewriteResult.done(c);
    if (isEmpty(b)) return RewriteResult.rewrite1(mgr.mkConcat(c, a));

    List<Term> lhs = getConcat(a);
    if (lhs.isEmpty()) {
      if (minLength(getConcat(b)) > 0) return RewriteResult.done(a);
      return RewriteResult.failed();
    }

    if (lhs.get(0) == b) {
      lhs.set(0, c);
      return RewriteResult.rewrite1(mgr.mkConcat(lhs, sort));
    }

    final String head = stringOf(lhs.get(0));
    if (head != null && s2 != null && s3 != null && head.contains(s2)) {
      lhs.set(0, mgr.mkString(replaceFirst(head, s2, s3)));
      return RewriteResult.rewrite1(mgr.mkConcat(lhs, sort));
    }

    lhs = getConcatUnits(mgr, a);
    final List<Term> rhs = getConcatUnits(mgr, b);
    if (rhs.isEmpty()) return RewriteResult.rewrite1(mgr.mkConcat(c, a));

    int i = 0;
    for (; i < lhs.size(); ++i) {
      final Boolean cmp = compareAt(lhs, rhs, i);
      if (Boolean.FALSE.equals(cmp) && lhs.get(i).is(Op.SEQ_UNIT)) continue;
      if (Boolean.TRUE.equals(cmp) && lhs.size() < i + rhs.size()) {
        final Term a1 = mgr.mkConcat(lhs.subList(0, i), sort);
        final Term a2 = mgr.mkConcat(tail(lhs, i), sort);
        return RewriteResult.rewriteFull(mgr.mkIte(mgr.mkEq(a2, b), mgr.mkConcat(a1, c), a));
      }
      if (Boolean.TRUE.equals(cmp)) {
        final List<Term> es = slice(lhs, 0, i);
        es.add(c);
        es.addAll(lhs.subList(i + rhs.size(), lhs.size()));
        return RewriteResult.rewriteFull(mgr.mkConcat(es, sort));
      }
      break;
    }
    if (i > 0) {
      final Term a1 = mgr.mkConcat(lhs.subList(0, i), sort);
      final Term a2 = mgr.mkConcat(tail(lhs, i), sort);
      return RewriteResult.rewriteFull(mgr.mkConcat(a1, mgr.mkReplace(a2, b, c)));
    }
    return RewriteResult.failed();
  }

  /** Whether {@code rhs} matches {@code lhs} at position i: TRUE, FALSE or null when unknown. */
  private static Boolean compareAt(List<Term> lhs, List<Term> rhs, int i) {
    for (int j = 0; j < rhs.size() && i + j < lhs.size(); ++j) {
      final Term x = lhs.get(i + j), y = rhs.get(j);
      if (areEqual(x, y)) continue;
      if (x.is(Op.SEQ_UNIT) && y.is(Op.SEQ_UNIT) && areDistinct(x, y)) return Boolean.FALSE;
      return null;
    }
    return Boolean.TRUE;
  }

  private static String replaceFirst(String s, String pattern, String replacement) {
    final int idx = s.indexOf(pattern);
    if (idx < 0) return s;
    return s.substring(0, idx) + replacement + s.substring(idx + pattern.length());
  }

  public RewriteResult mkSeqPrefix(Term a, Term b) {
    final Sort sort = a.sort();
    final String c = stringOf(a), d = stringOf(b);
    if (c != null && d != null) return RewriteResult.done(mgr.mkBool(d.startsWith(c)));
    if (isEmpty(a)) return RewriteResult.done(mgr.mkTrue());

    final Term a1 = getLeftmostConcat(a), b1 = getLeftmostConcat(b);
    if (a1 != b1 && a1.is(Op.STRING_CONST) && b1.is(Op.STRING_CONST)) {
      final String s1 = stringOf(a1), s2 = stringOf(b1);
      final List<Term> as = getConcat(a), bs = getConcat(b);
      if (s1.length() <= s2.length()) {
        if (!s2.startsWith(s1)) return RewriteResult.done(mgr.mkFalse());
        if (a == a1) return RewriteResult.done(mgr.mkTrue());
        bs.set(0, mgr.mkString(s2.substring(s1.length())));
        return RewriteResult.rewriteFull(
            mgr.mkPrefix(mgr.mkConcat(tail(as, 1), sort), mgr.mkConcat(bs, sort)));
      }
      if (!s1.startsWith(s2)) return RewriteResult.done(mgr.mkFalse());
      if (b == b1) return RewriteResult.done(mgr.mkFalse());
      as.set(0, mgr.mkString(s1.substring(s2.length())));
      return RewriteResult.rewriteFull(
          mgr.mkPrefix(mgr.mkConcat(as, sort), mgr.mkConcat(tail(bs, 1), sort)));
    }

    final List<Term> as = getConcatUnits(mgr, a), bs = getConcatUnits(mgr, b);
    final List<Term> eqs = new ArrayList<>();
    int i = 0;
    for (; i < as.size() && i < bs.size(); ++i) {
      final Term x = as.get(i), y = bs.get(i);
      if (areEqual(x, y)) continue;
      if (areDistinct(x, y)) return RewriteResult.done(mgr.mkFalse());
      if (x.is(Op.SEQ_UNIT) && y.is(Op.SEQ_UNIT)) {
        eqs.add(mgr.mkEq(x, y));
        continue;
      }
      break;
    }
    if (i == as.size()) return RewriteResult.rewrite3(mgr.mkAnd(eqs));
    if (i == bs.size()) {
      for (int j = i; j < as.size(); ++j) eqs.add(mgr.mkIsEmpty(as.get(j)));
      return RewriteResult.rewrite3(mgr.mkAnd(eqs));
    }
    if (i > 0) {
      eqs.add(mgr.mkPrefix(mgr.mkConcat(tail(as, i), sort), mgr.mkConcat(tail(bs, i), sort)));
      return RewriteResult.rewrite3(mgr.mkAnd(eqs));
    }
    return RewriteResult.failed();
  }

  public RewriteResult mkSeqSuffix(Term a, Term b) {
    final Sort sort = a.sort();
    if (a == b) return RewriteResult.done(mgr.mkTrue());
    if (isEmpty(a)) return RewriteResult.done(mgr.mkTrue());
    if (isEmpty(b)) return RewriteResult.rewrite3(mgr.mkIsEmpty(a));

    final List<Term> as = getConcatUnits(mgr, a), bs = getConcatUnits(mgr, b);
    final int sza = as.size(), szb = bs.size();
    final List<Term> eqs = new ArrayList<>();
    int i = 1;
    for (; i <= sza && i <= szb; ++i) {
      final Term x = as.get(sza - i), y = bs.get(szb - i);
      if (areEqual(x, y)) continue;
      if (areDistinct(x, y)) return RewriteResult.done(mgr.mkFalse());
      if (x.is(Op.SEQ_UNIT) && y.is(Op.SEQ_UNIT)) {
        eqs.add(mgr.mkEq(x, y));
        continue;
      }
      break;
    }
    if (i > sza) return RewriteResult.rewrite3(mgr.mkAnd(eqs));
    if (i > szb) {
      for (int j = i; j <= sza; ++j) eqs.add(mgr.mkIsEmpty(as.get(sza - j)));
      return RewriteResult.rewrite3(mgr.mkAnd(eqs));
    }
    if (i > 1) {
      final Term a1 = mgr.mkConcat(as.subList(0, sza - i + 1), sort);
      final Term b1 = mgr.mkConcat(bs.subList(0, szb - i + 1), sort);
      eqs.add(mgr.mkSuffix(a1, b1));
      return RewriteResult.rewrite3(mgr.mkAnd(eqs));
    }
    return RewriteResult.failed();
  }

  /**
   * Splits a sequence into its first element and the rest: {head, tail}. Null when the first
   * element is not syntactically known.
   */
  public Term[] getHeadTail(Term s) {
    final Deque<Term> rights = new ArrayDeque<>();
    Term e = s;
    while (e.is(Op.SEQ_CONCAT)) {
      rights.push(restOf(e));
      e = e.arg(0);
    }

    final Term head, first;
    final String str = stringOf(e);
    if (str != null && !str.isEmpty()) {
      head = mgr.mkChar(str.charAt(0));
      first = mgr.mkString(str.substring(1));
    } else if (e.is(Op.SEQ_UNIT)) {
      head = e.arg(0);
      first = mgr.mkEmpty(e.sort());
    } else {
      return null;
    }

    Term tail = first;
    while (!rights.isEmpty()) tail = mkSeqConcatTerm(tail, rights.pop());
    return new Term[] {head, tail};
  }

  /**
   * Splits a sequence into everything but its last element and that element: {init, last}. Null
   * when the last element is not syntactically known.
   */
  public Term[] getHeadTailReversed(Term s) {
    final Deque<Term> lefts = new ArrayDeque<>();
    Term e = s;
    while (e.is(Op.SEQ_CONCAT)) {
      lefts.push(initOf(e));
      e = e.arg(e.numArgs() - 1);
    }

    final Term last, init;
    final String str = stringOf(e);
    if (str != null && !str.isEmpty()) {
      last = mgr.mkChar(str.charAt(str.length() - 1));
      init = mgr.mkString(str.substring(0, str.length() - 1));
    } else if (e.is(Op.SEQ_UNIT)) {
      last = e.arg(0);
      init = mgr.mkEmpty(e.sort());
    } else {
      return null;
    }

    Term head = init;
    while (!lefts.isEmpty()) head = mkSeqConcatTerm(lefts.pop(), head);
    return new Term[] {head, last};
  }

  /** All but the first operand of a concatenation. */
  private Term restOf(Term concat) {
    if (concat.numArgs() == 2) return concat.arg(1);
    return mgr.mkConcat(concat.args().subList(1, concat.numArgs()), concat.sort());
  }

  /** All but the last operand of a concatenation. */
  private Term initOf(Term concat) {
    final int n = concat.numArgs();
    if (n == 2) return concat.arg(0);
    return mgr.mkConcat(concat.args().subList(0, n - 1), concat.sort());
  }
}
