package seqrw.rewriter.driver;

import seqrw.rewriter.RewriteResult;
import seqrw.term.Op;
import seqrw.term.Term;
import seqrw.term.TermManager;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static seqrw.term.TermSupport.areDistinct;
import static seqrw.term.TermSupport.areEqual;
import static seqrw.term.TermSupport.charOf;
import static seqrw.term.TermSupport.isFalse;
import static seqrw.term.TermSupport.isTrue;
import static seqrw.term.TermSupport.numeralOf;

/**
 * Constant folding for the boolean, arithmetic and character operators. Just enough to let the
 * results of the sequence rules settle; no normalization of linear arithmetic.
 */
public class BasicSimplifier {
  private final TermManager mgr;

  public BasicSimplifier(TermManager mgr) {
    this.mgr = mgr;
  }

  public RewriteResult simplify(Term t) {
    switch (t.op()) {
      case EQ:
        return mkEq(t.arg(0), t.arg(1));
      case NOT:
        return mkNot(t.arg(0));
      case AND:
      case OR:
        return mkJunction(t);
      case ITE:
        return mkIte(t.arg(0), t.arg(1), t.arg(2));
      case ADD:
        return mkAdd(t);
      case SUB:
        return mkSub(t);
      case MUL:
        return mkMul(t);
      case LE:
      case GE:
      case LT:
        return mkCompare(t.op(), t.arg(0), t.arg(1));
      case CHAR_LE: {
        final int c1 = charOf(t.arg(0)), c2 = charOf(t.arg(1));
        if (c1 >= 0 && c2 >= 0) return RewriteResult.done(mgr.mkBool(c1 <= c2));
        if (t.arg(0) == t.arg(1)) return RewriteResult.done(mgr.mkTrue());
        return RewriteResult.failed();
      }
      default:
        return RewriteResult.failed();
    }
  }

  private RewriteResult mkEq(Term a, Term b) {
    if (areEqual(a, b)) return RewriteResult.done(mgr.mkTrue());
    if (areDistinct(a, b)) return RewriteResult.done(mgr.mkFalse());
    if (a.sort().isBool()) {
      if (isTrue(a)) return RewriteResult.done(b);
      if (isTrue(b)) return RewriteResult.done(a);
      if (isFalse(a)) return RewriteResult.rewrite1(mgr.mkNot(b));
      if (isFalse(b)) return RewriteResult.rewrite1(mgr.mkNot(a));
    }
    return RewriteResult.failed();
  }

  private RewriteResult mkNot(Term a) {
    if (isTrue(a)) return RewriteResult.done(mgr.mkFalse());
    if (isFalse(a)) return RewriteResult.done(mgr.mkTrue());
    if (a.is(Op.NOT)) return RewriteResult.done(a.arg(0));
    return RewriteResult.failed();
  }

  private RewriteResult mkJunction(Term t) {
    final boolean isAnd = t.is(Op.AND);
    final List<Term> flat = new ArrayList<>(t.numArgs());
    for (Term arg : t.args()) {
      if (arg.op() == t.op()) flat.addAll(arg.args());
      else flat.add(arg);
    }
    // x and not x, x or not x
    for (Term arg : flat) {
      if (flat.contains(mgr.mkNot(arg))) return RewriteResult.done(mgr.mkBool(!isAnd));
    }
    final Term result = isAnd ? mgr.mkAnd(flat) : mgr.mkOr(flat);
    return result == t ? RewriteResult.failed() : RewriteResult.done(result);
  }

  private RewriteResult mkIte(Term c, Term th, Term el) {
    if (isTrue(c)) return RewriteResult.done(th);
    if (isFalse(c)) return RewriteResult.done(el);
    if (th == el) return RewriteResult.done(th);
    if (c.is(Op.NOT)) return RewriteResult.rewrite1(mgr.mkIte(c.arg(0), el, th));
    if (th.sort().isBool()) {
      if (isTrue(th) && isFalse(el)) return RewriteResult.done(c);
      if (isFalse(th) && isTrue(el)) return RewriteResult.rewrite1(mgr.mkNot(c));
      if (isTrue(th)) return RewriteResult.rewrite1(mgr.mkOr(c, el));
      if (isFalse(el)) return RewriteResult.rewrite1(mgr.mkAnd(c, th));
    }
    if (th.is(Op.ITE) && th.arg(0) == c) return RewriteResult.rewrite1(mgr.mkIte(c, th.arg(1), el));
    if (el.is(Op.ITE) && el.arg(0) == c) return RewriteResult.rewrite1(mgr.mkIte(c, th, el.arg(2)));
    return RewriteResult.failed();
  }

  private RewriteResult mkAdd(Term t) {
    BigInteger sum = BigInteger.ZERO;
    final List<Term> rest = new ArrayList<>(t.numArgs() + 1);
    for (Term arg : t.args()) {
      for (Term e : arg.is(Op.ADD) ? arg.args() : List.of(arg)) {
        final BigInteger v = numeralOf(e);
        if (v != null) sum = sum.add(v);
        else rest.add(e);
      }
    }
    if (sum.signum() != 0 || rest.isEmpty()) rest.add(mgr.mkInt(sum));
    if (rest.size() == 1) return RewriteResult.done(rest.get(0));
    if (rest.equals(t.args())) return RewriteResult.failed();
    return RewriteResult.done(mgr.mkAdd(rest));
  }

  private RewriteResult mkSub(Term t) {
    if (t.numArgs() == 1) return RewriteResult.rewrite1(mgr.mkMul(mgr.mkInt(-1), t.arg(0)));
    final List<Term> terms = new ArrayList<>(t.numArgs());
    terms.add(t.arg(0));
    for (int i = 1; i < t.numArgs(); ++i) {
      final Term e = t.arg(i);
      final BigInteger v = numeralOf(e);
      terms.add(v != null ? mgr.mkInt(v.negate()) : mgr.mkMul(mgr.mkInt(-1), e));
    }
    return RewriteResult.rewrite2(mgr.mkAdd(terms));
  }

  private RewriteResult mkMul(Term t) {
    BigInteger product = BigInteger.ONE;
    final List<Term> rest = new ArrayList<>(t.numArgs() + 1);
    for (Term arg : t.args()) {
      for (Term e : arg.is(Op.MUL) ? arg.args() : List.of(arg)) {
        final BigInteger v = numeralOf(e);
        if (v != null) product = product.multiply(v);
        else rest.add(e);
      }
    }
    if (product.signum() == 0) return RewriteResult.done(mgr.mkInt(0));
    if (!product.equals(BigInteger.ONE) || rest.isEmpty()) rest.add(0, mgr.mkInt(product));
    if (rest.size() == 1) return RewriteResult.done(rest.get(0));
    if (rest.equals(t.args())) return RewriteResult.failed();
    return RewriteResult.done(mgr.mkApp(Op.MUL, null, rest));
  }

  private RewriteResult mkCompare(Op op, Term a, Term b) {
    final BigInteger v1 = numeralOf(a), v2 = numeralOf(b);
    if (v1 != null && v2 != null) {
      final int cmp = v1.compareTo(v2);
      final boolean holds = op == Op.LE ? cmp <= 0 : op == Op.GE ? cmp >= 0 : cmp < 0;
      return RewriteResult.done(mgr.mkBool(holds));
    }
    if (a == b) return RewriteResult.done(mgr.mkBool(op != Op.LT));
    return RewriteResult.failed();
  }
}
