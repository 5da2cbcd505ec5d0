package seqrw.rewriter.ops;

import seqrw.rewriter.RewriteResult;
import seqrw.term.Op;
import seqrw.term.Sort;
import seqrw.term.Term;
import seqrw.term.TermManager;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static seqrw.term.TermSupport.charOf;
import static seqrw.term.TermSupport.getConcatUnits;
import static seqrw.term.TermSupport.numeralOf;
import static seqrw.term.TermSupport.stringOf;

/** Rules of the string-only operators: ordering, code points, digits and integer conversion. */
public class StrOpSimplifier {
  private final TermManager mgr;

  public StrOpSimplifier(TermManager mgr) {
    this.mgr = mgr;
  }

  /** Splits a literal into units. Only used when characters are not coalesced. */
  public RewriteResult mkStrUnits(Term literal) {
    final String s = stringOf(literal);
    if (s == null || s.isEmpty()) return RewriteResult.failed();
    final List<Term> units = new ArrayList<>(s.length());
    for (int i = 0; i < s.length(); ++i) units.add(mgr.mkUnit(mgr.mkChar(s.charAt(i))));
    return RewriteResult.done(mgr.mkConcat(units, Sort.STRING));
  }

  public RewriteResult mkStrLe(Term a, Term b) {
    return RewriteResult.rewrite2(mgr.mkNot(mgr.mkStrLt(b, a)));
  }

  public RewriteResult mkStrLt(Term a, Term b) {
    final String s1 = stringOf(a), s2 = stringOf(b);
    if (s1 != null && s2 != null) return RewriteResult.done(mgr.mkBool(s1.compareTo(s2) < 0));
    return RewriteResult.failed();
  }

  public RewriteResult mkStrFromCode(Term a) {
    final BigInteger v = numeralOf(a);
    if (v == null) return RewriteResult.failed();
    if (v.signum() < 0 || v.compareTo(BigInteger.valueOf(TermManager.MAX_CHAR)) > 0)
      return RewriteResult.done(mgr.mkString(""));
    return RewriteResult.done(mgr.mkString(String.valueOf((char) v.intValue())));
  }

  public RewriteResult mkStrToCode(Term a) {
    final String s = stringOf(a);
    if (s == null) return RewriteResult.failed();
    return RewriteResult.done(mgr.mkInt(s.length() == 1 ? s.charAt(0) : -1));
  }

  public RewriteResult mkStrIsDigit(Term a) {
    final String s = stringOf(a);
    if (s == null) return RewriteResult.failed();
    return RewriteResult.done(mgr.mkBool(s.length() == 1 && isDigit(s.charAt(0))));
  }

  public RewriteResult mkStrItos(Term a) {
    final BigInteger v = numeralOf(a);
    if (v == null) return RewriteResult.failed();
    return RewriteResult.done(mgr.mkString(v.signum() < 0 ? "" : v.toString()));
  }

  public RewriteResult mkStrStoi(Term a) {
    final Term minusOne = mgr.mkInt(-1);
    final String s = stringOf(a);
    if (s != null) {
      if (s.isEmpty()) return RewriteResult.done(minusOne);
      for (int i = 0; i < s.length(); ++i)
        if (!isDigit(s.charAt(i))) return RewriteResult.done(minusOne);
      return RewriteResult.done(mgr.mkInt(new BigInteger(s)));
    }

    if (a.is(Op.STRING_ITOS)) {
      final Term x = a.arg(0);
      return RewriteResult.done(mgr.mkIte(mgr.mkGe(x, mgr.mkInt(0)), x, minusOne));
    }

    if (a.is(Op.ITE)) {
      final Term result =
          mgr.mkIte(a.arg(0), mgr.mkStoi(a.arg(1)), mgr.mkStoi(a.arg(2)));
      return RewriteResult.rewriteFull(result);
    }

    if (a.is(Op.SEQ_UNIT) && charOf(a.arg(0)) >= 0) {
      final int c = charOf(a.arg(0));
      return RewriteResult.done(isDigit(c) ? mgr.mkInt(c - '0') : minusOne);
    }

    final List<Term> as = getConcatUnits(mgr, a);
    if (as.isEmpty()) return RewriteResult.done(minusOne);

    // stoi(u ++ d) for a last unit d; u may be empty
    final Term last = as.get(as.size() - 1);
    if (last.is(Op.SEQ_UNIT) && as.size() > 1) {
      final Term u = mgr.mkConcat(as.subList(0, as.size() - 1), Sort.STRING);
      final Term su = mgr.mkStoi(u), sd = mgr.mkStoi(last);
      final Term zero = mgr.mkInt(0);
      final Term value = mgr.mkAdd(mgr.mkMul(mgr.mkInt(10), su), sd);
      final Term nonEmpty = mgr.mkIte(mgr.mkLt(su, zero), minusOne, value);
      final Term result =
          mgr.mkIte(mgr.mkLt(sd, zero), minusOne, mgr.mkIte(mgr.mkIsEmpty(u), sd, nonEmpty));
      return RewriteResult.rewriteFull(result);
    }
    return RewriteResult.failed();
  }

  private static boolean isDigit(int c) {
    return c >= '0' && c <= '9';
  }
}
