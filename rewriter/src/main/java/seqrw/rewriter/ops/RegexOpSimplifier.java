package seqrw.rewriter.ops;

import seqrw.rewriter.RewriteResult;
import seqrw.rewriter.automaton.RegexToAutomaton;
import seqrw.rewriter.automaton.SymExpr;
import seqrw.rewriter.automaton.SymbolicAutomaton;
import seqrw.rewriter.regex.RegexDerivative;
import seqrw.rewriter.wordeq.OverlapSupport;
import seqrw.term.Op;
import seqrw.term.Sort;
import seqrw.term.Term;
import seqrw.term.TermManager;

import java.util.ArrayList;
import java.util.List;

import static seqrw.term.TermSupport.getConcatUnits;
import static seqrw.term.TermSupport.isEmpty;
import static seqrw.term.TermSupport.loopBounds;
import static seqrw.term.TermSupport.smallIntOf;
import static seqrw.term.TermSupport.stringOf;

/** Local rules of the regex operators and of regex membership. */
public class RegexOpSimplifier {
  private final TermManager mgr;
  private final SeqOpSimplifier seqOps;
  private final RegexDerivative derivatives;
  private final RegexToAutomaton automata;
  private boolean containsPattern;

  public RegexOpSimplifier(
      TermManager mgr,
      SeqOpSimplifier seqOps,
      RegexDerivative derivatives,
      RegexToAutomaton automata) {
    this.mgr = mgr;
    this.seqOps = seqOps;
    this.derivatives = derivatives;
    this.automata = automata;
  }

  public void setContainsPattern(boolean containsPattern) {
    this.containsPattern = containsPattern;
  }

  public RewriteResult mkReConcat(Term a, Term b) {
    if (a.is(Op.RE_FULL_SEQ) && b.is(Op.RE_FULL_SEQ)) return RewriteResult.done(a);
    if (a.is(Op.RE_EMPTY)) return RewriteResult.done(a);
    if (b.is(Op.RE_EMPTY)) return RewriteResult.done(b);
    if (isEpsilon(a)) return RewriteResult.done(b);
    if (isEpsilon(b)) return RewriteResult.done(a);

    if (a.is(Op.SEQ_TO_RE) && b.is(Op.SEQ_TO_RE))
      return RewriteResult.rewrite2(mgr.mkToRe(mgr.mkConcat(a.arg(0), b.arg(0))));
    if (a.is(Op.RE_STAR) && b.is(Op.RE_STAR) && a.arg(0) == b.arg(0))
      return RewriteResult.done(a);
    // r* ++ r = r ++ r*
    if (a.is(Op.RE_STAR) && a.arg(0) == b) return RewriteResult.done(mgr.mkReConcat(b, a));

    final int[] la = loopBounds(a), lb = loopBounds(b);
    if (la != null && lb != null && a.arg(0) == b.arg(0)) {
      final Term r = a.arg(0);
      if (la.length == 2 && lb.length == 2 && la[0] <= la[1] && lb[0] <= lb[1])
        return RewriteResult.done(mgr.mkReLoop(r, la[0] + lb[0], la[1] + lb[1]));
      if (la.length == 1 && lb.length == 1)
        return RewriteResult.done(mgr.mkReLoop(r, la[0] + lb[0]));
    }

    for (int i = 0; i < 2; ++i) {
      final Term x = i == 0 ? a : b, y = i == 0 ? b : a;
      final int[] lx = loopBounds(x), ly = loopBounds(y);
      if (lx == null) continue;
      final Term r = x.arg(0);
      if (lx.length == 1 && ly != null && ly.length == 2 && ly[0] <= ly[1] && y.arg(0) == r)
        return RewriteResult.done(mgr.mkReLoop(r, lx[0] + ly[0]));
      if (y.is(Op.RE_STAR) && y.arg(0) == r)
        return RewriteResult.done(lx.length == 2 ? mgr.mkReLoop(r, lx[0]) : x);
      if (lx.length == 2 && lx[0] <= lx[1] && y == r)
        return RewriteResult.done(mgr.mkReLoop(r, lx[0] + 1, lx[1] + 1));
    }
    return RewriteResult.failed();
  }

  public RewriteResult mkReUnion(Term a, Term b) {
    if (a == b) return RewriteResult.done(a);
    if (a.is(Op.RE_EMPTY)) return RewriteResult.done(b);
    if (b.is(Op.RE_EMPTY)) return RewriteResult.done(a);
    if (a.is(Op.RE_FULL_SEQ)) return RewriteResult.done(a);
    if (b.is(Op.RE_FULL_SEQ)) return RewriteResult.done(b);
    if (a.is(Op.RE_STAR) && isEpsilon(b)) return RewriteResult.done(a);
    if (b.is(Op.RE_STAR) && isEpsilon(a)) return RewriteResult.done(b);
    return RewriteResult.failed();
  }

  public RewriteResult mkReComplement(Term a) {
    if (a.is(Op.RE_INTERSECT) && a.numArgs() == 2) {
      return RewriteResult.rewrite2(
          mgr.mkReUnion(mgr.mkReComplement(a.arg(0)), mgr.mkReComplement(a.arg(1))));
    }
    if (a.is(Op.RE_UNION) && a.numArgs() == 2) {
      return RewriteResult.rewrite2(
          mgr.mkReInter(mgr.mkReComplement(a.arg(0)), mgr.mkReComplement(a.arg(1))));
    }
    if (a.is(Op.RE_EMPTY)) return RewriteResult.done(mgr.mkReFullSeq(a.sort()));
    if (a.is(Op.RE_FULL_SEQ)) return RewriteResult.done(mgr.mkReEmpty(a.sort()));
    if (a.is(Op.ITE)) {
      return RewriteResult.rewrite2(
          mgr.mkIte(a.arg(0), mgr.mkReComplement(a.arg(1)), mgr.mkReComplement(a.arg(2))));
    }
    return RewriteResult.failed();
  }

  public RewriteResult mkReInter(Term a, Term b) {
    if (a == b) return RewriteResult.done(a);
    if (a.is(Op.RE_EMPTY)) return RewriteResult.done(a);
    if (b.is(Op.RE_EMPTY)) return RewriteResult.done(b);
    if (a.is(Op.RE_FULL_SEQ)) return RewriteResult.done(b);
    if (b.is(Op.RE_FULL_SEQ)) return RewriteResult.done(a);
    if ((a.is(Op.RE_COMPLEMENT) && a.arg(0) == b) || (b.is(Op.RE_COMPLEMENT) && b.arg(0) == a))
      return RewriteResult.done(mgr.mkReEmpty(a.sort()));

    final Term word = b.is(Op.SEQ_TO_RE) ? b : a, other = word == b ? a : b;
    if (word.is(Op.SEQ_TO_RE)) {
      final Term cond = mgr.mkInRe(word.arg(0), other);
      return RewriteResult.rewrite2(mgr.mkIte(cond, word, mgr.mkReEmpty(a.sort())));
    }
    return RewriteResult.failed();
  }

  public RewriteResult mkReDiff(Term a, Term b) {
    return RewriteResult.rewrite2(mgr.mkReInter(a, mgr.mkReComplement(b)));
  }

  public RewriteResult mkReLoop(int[] params, List<Term> args) {
    final Term a = args.get(0);
    switch (args.size()) {
      case 1: {
        final int np = params == null ? 0 : params.length;
        final int lo2 = np > 0 ? params[0] : 0;
        final int hi2 = np > 1 ? params[1] : lo2;
        if (np == 2 && lo2 > hi2) return RewriteResult.done(mgr.mkReEmpty(a.sort()));
        if (np == 2 && hi2 == 0) return RewriteResult.done(epsilon(a.sort()));

        final int[] inner = loopBounds(a);
        // (a{lo,}){lo2,} = a{lo*lo2,} for lo2 > 0
        if (inner != null && inner.length == 1 && np == 1 && lo2 > 0)
          return RewriteResult.rewrite1(mgr.mkReLoop(a.arg(0), lo2 * inner[0]));
        if (inner != null
            && inner.length == 2
            && np == 2
            && inner[0] == inner[1]
            && lo2 == hi2) {
          return RewriteResult.rewrite1(
              mgr.mkReLoop(a.arg(0), lo2 * inner[0], hi2 * inner[1]));
        }
        if (np == 2 && lo2 == 1 && hi2 == 1) return RewriteResult.done(a);
        if (np == 0 || (np == 1 && lo2 == 0)) return RewriteResult.rewrite1(mgr.mkReStar(a));
        if (a.is(Op.ITE)) {
          final Term r1 = np == 1 ? mgr.mkReLoop(a.arg(1), lo2) : mgr.mkReLoop(a.arg(1), lo2, hi2);
          final Term r2 = np == 1 ? mgr.mkReLoop(a.arg(2), lo2) : mgr.mkReLoop(a.arg(2), lo2, hi2);
          return RewriteResult.rewrite2(mgr.mkIte(a.arg(0), r1, r2));
        }
        return RewriteResult.failed();
      }
      case 2: {
        final Integer n1 = smallIntOf(args.get(1));
        if (n1 != null && n1 >= 0) return RewriteResult.rewrite1(mgr.mkReLoop(a, n1));
        return RewriteResult.failed();
      }
      case 3: {
        final Integer n1 = smallIntOf(args.get(1)), n2 = smallIntOf(args.get(2));
        if (n1 != null && n1 >= 0 && n2 != null && n2 >= 0)
          return RewriteResult.rewrite1(mgr.mkReLoop(a, n1, n2));
        return RewriteResult.failed();
      }
      default:
        return RewriteResult.failed();
    }
  }

  public RewriteResult mkRePower(int n, Term a) {
    return RewriteResult.rewrite1(mgr.mkReLoop(a, n, n));
  }

  public RewriteResult mkReStar(Term a) {
    if (a.is(Op.RE_STAR) || a.is(Op.RE_FULL_SEQ)) return RewriteResult.done(a);
    if (a.is(Op.RE_FULL_CHAR)) return RewriteResult.done(mgr.mkReFullSeq(a.sort()));
    if (a.is(Op.RE_EMPTY)) return RewriteResult.done(epsilon(a.sort()));
    if (a.is(Op.RE_PLUS)) return RewriteResult.done(mgr.mkReStar(a.arg(0)));
    if (a.is(Op.RE_UNION) && a.numArgs() == 2) {
      final Term b = a.arg(0), c = a.arg(1);
      if (b.is(Op.RE_STAR)) return RewriteResult.rewrite2(mgr.mkReStar(mgr.mkReUnion(b.arg(0), c)));
      if (c.is(Op.RE_STAR)) return RewriteResult.rewrite2(mgr.mkReStar(mgr.mkReUnion(b, c.arg(0))));
      if (isEpsilon(b)) return RewriteResult.rewrite2(mgr.mkReStar(c));
      if (isEpsilon(c)) return RewriteResult.rewrite2(mgr.mkReStar(b));
    }
    if (a.is(Op.RE_CONCAT)
        && a.numArgs() == 2
        && a.arg(0).is(Op.RE_STAR)
        && a.arg(1).is(Op.RE_STAR)) {
      return RewriteResult.rewrite2(
          mgr.mkReStar(mgr.mkReUnion(a.arg(0).arg(0), a.arg(1).arg(0))));
    }
    if (a.is(Op.ITE)) {
      return RewriteResult.rewrite2(
          mgr.mkIte(a.arg(0), mgr.mkReStar(a.arg(1)), mgr.mkReStar(a.arg(2))));
    }
    return RewriteResult.failed();
  }

  public RewriteResult mkRePlus(Term a) {
    if (a.is(Op.RE_EMPTY)
        || a.is(Op.RE_FULL_SEQ)
        || isEpsilon(a)
        || a.is(Op.RE_PLUS)
        || a.is(Op.RE_STAR)) {
      return RewriteResult.done(a);
    }
    return RewriteResult.rewrite2(mgr.mkReConcat(a, mgr.mkReStar(a)));
  }

  public RewriteResult mkReOpt(Term a) {
    return RewriteResult.rewrite1(mgr.mkReUnion(epsilon(a.sort()), a));
  }

  public RewriteResult mkReReverse(Term r) {
    switch (r.op()) {
      case RE_CONCAT: {
        final List<Term> args = new ArrayList<>(r.numArgs());
        for (int i = r.numArgs() - 1; i >= 0; --i) args.add(mgr.mkReReverse(r.arg(i)));
        return RewriteResult.rewrite2(mgr.mkApp(Op.RE_CONCAT, null, args));
      }
      case RE_STAR:
      case RE_PLUS:
      case RE_OPTION:
      case RE_COMPLEMENT:
      case RE_LOOP:
      case RE_POWER: {
        if (r.numArgs() != 1) return RewriteResult.failed();
        return RewriteResult.rewrite2(mgr.mkAppLike(r, List.of(mgr.mkReReverse(r.arg(0)))));
      }
      case RE_UNION:
      case RE_INTERSECT:
      case RE_DIFF: {
        final List<Term> args = new ArrayList<>(r.numArgs());
        for (Term arg : r.args()) args.add(mgr.mkReReverse(arg));
        return RewriteResult.rewrite2(mgr.mkAppLike(r, args));
      }
      case ITE:
        return RewriteResult.rewrite2(
            mgr.mkIte(r.arg(0), mgr.mkReReverse(r.arg(1)), mgr.mkReReverse(r.arg(2))));
      case RE_REVERSE:
        return RewriteResult.done(r.arg(0));
      case RE_FULL_SEQ:
      case RE_EMPTY:
      case RE_RANGE:
      case RE_FULL_CHAR:
      case RE_OF_PRED:
        return RewriteResult.done(r);
      case SEQ_TO_RE: {
        final Term s = r.arg(0);
        final String str = stringOf(s);
        if (str != null)
          return RewriteResult.done(
              mgr.mkToRe(mgr.mkString(new StringBuilder(str).reverse().toString())));
        if (s.is(Op.SEQ_UNIT)) return RewriteResult.done(r);
        if (s.is(Op.SEQ_CONCAT)) {
          final List<Term> args = new ArrayList<>(s.numArgs());
          for (int i = s.numArgs() - 1; i >= 0; --i)
            args.add(mgr.mkReReverse(mgr.mkToRe(s.arg(i))));
          return RewriteResult.rewrite3(mgr.mkApp(Op.RE_CONCAT, null, args));
        }
        return RewriteResult.failed();
      }
      default:
        return RewriteResult.failed();
    }
  }

  public RewriteResult mkStrInRegexp(Term a, Term b) {
    if (b.is(Op.RE_EMPTY)) return RewriteResult.done(mgr.mkFalse());
    if (b.is(Op.RE_FULL_SEQ)) return RewriteResult.done(mgr.mkTrue());
    if (b.is(Op.SEQ_TO_RE)) return RewriteResult.rewrite1(mgr.mkEq(a, b.arg(0)));

    if (isEmpty(a)) {
      final Term result = derivatives.isNullable(b);
      if (result == mgr.mkInRe(a, b)) return RewriteResult.failed();
      return result.is(Op.SEQ_IN_RE) ? RewriteResult.done(result) : RewriteResult.rewriteFull(result);
    }

    final Term[] ht = seqOps.getHeadTail(a);
    if (ht != null) {
      final Term d = derivatives.derivative(ht[0], b);
      if (d != null) return RewriteResult.rewriteFull(mgr.mkInRe(ht[1], d));
      return RewriteResult.rewrite2(mgr.mkInRe(ht[1], mgr.mkReDerivative(ht[0], b)));
    }

    final Term[] htr = seqOps.getHeadTailReversed(a);
    if (htr != null) {
      final Term reversed =
          mgr.mkReReverse(mgr.mkReDerivative(htr[1], mgr.mkReReverse(b)));
      return RewriteResult.rewriteFull(mgr.mkInRe(htr[0], reversed));
    }

    if (containsPattern) {
      final Term result = rewriteContainsPattern(a, b);
      if (result != null) return RewriteResult.rewriteFull(result);
    }

    final SymbolicAutomaton<SymExpr> aut = automata.compile(b);
    if (aut != null) {
      if (aut.isEmpty()) return RewriteResult.done(mgr.mkFalse());
      final Term word = automata.sequenceOf(aut, a.sort());
      if (word != null) return RewriteResult.rewrite1(mgr.mkEq(a, word));
    }
    return RewriteResult.failed();
  }

  /**
   * The literal runs of a regex of the shape {@code .* p1 .* p2 .. .* pn .*}, null for any other
   * shape.
   */
  List<List<Term>> getContainsPatterns(Term r) {
    if (!r.is(Op.RE_CONCAT) || r.numArgs() != 2 || !r.arg(0).is(Op.RE_FULL_SEQ)) return null;
    final List<List<Term>> patterns = new ArrayList<>();
    patterns.add(new ArrayList<>());
    Term e = r.arg(1);
    while (e.is(Op.RE_CONCAT) && e.numArgs() == 2) {
      final Term r1 = e.arg(0);
      if (r1.is(Op.SEQ_TO_RE)) patterns.get(patterns.size() - 1).add(r1.arg(0));
      else if (r1.is(Op.RE_FULL_SEQ)) patterns.add(new ArrayList<>());
      else return null;
      e = e.arg(1);
    }
    return e.is(Op.RE_FULL_SEQ) ? patterns : null;
  }

  /**
   * {@code x ++ y in .* p1 .* .. pn .*} where the literal prefix of y overlaps no pattern: the
   * patterns are split between x and y.
   */
  Term rewriteContainsPattern(Term a, Term b) {
    if (!a.is(Op.SEQ_CONCAT)) return null;
    final List<List<Term>> patterns = getContainsPatterns(b);
    if (patterns == null) return null;
    final Sort sort = a.sort();
    final Term x = a.arg(0);
    final Term y =
        a.numArgs() == 2 ? a.arg(1) : mgr.mkConcat(a.args().subList(1, a.numArgs()), sort);

    final List<Term> lhs = new ArrayList<>();
    Term u = y;
    while (u.is(Op.SEQ_CONCAT) && (u.arg(0).is(Op.SEQ_UNIT) || stringOf(u.arg(0)) != null)) {
      lhs.add(u.arg(0));
      u = u.numArgs() == 2 ? u.arg(1) : mgr.mkConcat(u.args().subList(1, u.numArgs()), sort);
    }
    final List<Term> lhsUnits = getConcatUnits(mgr, mgr.mkConcat(lhs, sort));
    for (List<Term> p : patterns) {
      final List<Term> pUnits = getConcatUnits(mgr, mgr.mkConcat(p, sort));
      if (!OverlapSupport.nonOverlap(pUnits, lhsUnits)) return null;
    }

    final Term full = mgr.mkReFullSeq(b.sort());
    final List<Term> fmls = new ArrayList<>();
    fmls.add(mgr.mkInRe(y, b));
    Term prefix = full;
    for (int i = 0; i < patterns.size(); ++i) {
      for (Term e : patterns.get(i)) prefix = mgr.mkReConcat(prefix, mgr.mkToRe(e));
      prefix = mgr.mkReConcat(prefix, full);
      Term suffix = full;
      for (int j = i + 1; j < patterns.size(); ++j) {
        for (Term e : patterns.get(j)) suffix = mgr.mkReConcat(suffix, mgr.mkToRe(e));
        suffix = mgr.mkReConcat(suffix, full);
      }
      fmls.add(mgr.mkAnd(mgr.mkInRe(x, prefix), mgr.mkInRe(y, suffix)));
    }
    return mgr.mkOr(fmls);
  }

  static boolean isEpsilon(Term r) {
    return r.is(Op.SEQ_TO_RE) && isEmpty(r.arg(0));
  }

  private Term epsilon(Sort reSort) {
    return mgr.mkToRe(mgr.mkEmpty(reSort.seqSort()));
  }
}
