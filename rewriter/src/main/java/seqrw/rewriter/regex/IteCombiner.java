package seqrw.rewriter.regex;

import seqrw.rewriter.cache.OpCache;
import seqrw.term.Op;
import seqrw.term.Term;
import seqrw.term.TermManager;

import java.util.ArrayList;
import java.util.List;

import static seqrw.term.TermSupport.stringOf;

/**
 * Combines regexes in BDD form: if-then-else over boolean conditions, with the condition of an
 * outer node always of a larger term id than every condition below it, and no condition repeated
 * along a path. Leaves are ite-free regexes.
 */
public class IteCombiner {
  private final TermManager mgr;
  private final OpCache cache;

  public IteCombiner(TermManager mgr, OpCache cache) {
    this.mgr = mgr;
    this.cache = cache;
  }

  /**
   * Applies a binary regex operator (union, intersection, concatenation, difference) to {@code a}
   * and {@code b}, or builds {@code ite(cond, a, b)} when {@code op} is ITE. Both operands must be
   * in BDD form and so is the result.
   */
  public Term combine(Op op, Term a, Term b, Term cond) {
    if ((op == Op.ITE) != (cond != null))
      throw new IllegalArgumentException("a condition is required exactly for ite: " + op);

    final Term cached = cache.find(op, a, b, cond);
    if (cached != null) return cached;
    final Term result = combine0(op, a, b, cond);
    cache.insert(op, a, b, cond, result);
    return result;
  }

  private Term combine0(Op op, Term a, Term b, Term cond) {
    final boolean iteA = a.is(Op.ITE), iteB = b.is(Op.ITE);

    if (op == Op.ITE) {
      if (a == b) return a;
      if (iteA) {
        final Term ca = a.arg(0);
        // the condition is already decided along the then-branch
        if (ca == cond) return combine(Op.ITE, a.arg(1), b, cond);
        if (ca.id() > cond.id()) {
          if (iteB && b.arg(0) == ca) {
            return mkIte(
                ca,
                combine(Op.ITE, a.arg(1), b.arg(1), cond),
                combine(Op.ITE, a.arg(2), b.arg(2), cond));
          }
          if (!iteB || b.arg(0).id() < ca.id()) {
            return mkIte(
                ca, combine(Op.ITE, a.arg(1), b, cond), combine(Op.ITE, a.arg(2), b, cond));
          }
        }
      }
      if (iteB) {
        final Term cb = b.arg(0);
        if (cb == cond) return combine(Op.ITE, a, b.arg(2), cond);
        if (cb.id() > cond.id() && (!iteA || a.arg(0).id() < cb.id())) {
          return mkIte(
              cb, combine(Op.ITE, a, b.arg(1), cond), combine(Op.ITE, a, b.arg(2), cond));
        }
      }
      return mkIte(cond, a, b);
    }

    if (iteA && iteB && a.arg(0) == b.arg(0)) {
      final Term c = a.arg(0);
      return mkIte(c, combine(op, a.arg(1), b.arg(1), null), combine(op, a.arg(2), b.arg(2), null));
    }
    if (iteA && (!iteB || a.arg(0).id() > b.arg(0).id())) {
      final Term c = a.arg(0);
      return mkIte(c, combine(op, a.arg(1), b, null), combine(op, a.arg(2), b, null));
    }
    if (iteB) {
      final Term c = b.arg(0);
      return mkIte(c, combine(op, a, b.arg(1), null), combine(op, a, b.arg(2), null));
    }
    return apply(op, a, b);
  }

  private Term mkIte(Term c, Term t, Term e) {
    return t == e ? t : mgr.mkIte(c, t, e);
  }

  /** Builds {@code op(a, b)} over ite-free operands, folding units and annihilators. */
  Term apply(Op op, Term a, Term b) {
    switch (op) {
      case RE_CONCAT:
        if (a.is(Op.RE_EMPTY) || b.is(Op.RE_EMPTY)) return a.is(Op.RE_EMPTY) ? a : b;
        if (isEpsilon(a)) return b;
        if (isEpsilon(b)) return a;
        return mgr.mkReConcat(a, b);
      case RE_UNION:
        if (a == b || b.is(Op.RE_EMPTY) || a.is(Op.RE_FULL_SEQ)) return a;
        if (a.is(Op.RE_EMPTY) || b.is(Op.RE_FULL_SEQ)) return b;
        return mgr.mkReUnion(a, b);
      case RE_INTERSECT:
        if (a == b || a.is(Op.RE_EMPTY) || b.is(Op.RE_FULL_SEQ)) return a;
        if (b.is(Op.RE_EMPTY) || a.is(Op.RE_FULL_SEQ)) return b;
        return mgr.mkReInter(a, b);
      case RE_DIFF:
        if (a == b || b.is(Op.RE_FULL_SEQ)) return mgr.mkReEmpty(a.sort());
        if (a.is(Op.RE_EMPTY) || b.is(Op.RE_EMPTY)) return a;
        return mgr.mkReDiff(a, b);
      default:
        return mgr.mkApp(op, a, b);
    }
  }

  static boolean isEpsilon(Term r) {
    if (!r.is(Op.SEQ_TO_RE)) return false;
    final String s = stringOf(r.arg(0));
    return (s != null && s.isEmpty()) || r.arg(0).is(Op.SEQ_EMPTY);
  }

  /**
   * Lifts the if-then-else nodes of {@code r} to the top, producing an equivalent regex in BDD form.
   * {@code liftOverUnion} and {@code liftOverInter} select whether union and intersection are
   * lifted through; when not set they are kept as leaves over lifted operands.
   */
  public Term lift(Term r, boolean liftOverUnion, boolean liftOverInter) {
    if (!r.sort().isRe()) throw new IllegalArgumentException("not a regex: " + r);
    final Term flags0 = mgr.mkBool(liftOverUnion), flags1 = mgr.mkBool(liftOverInter);
    final Term cached = cache.find(Op.RE_LIFT_ITES, r, flags0, flags1);
    if (cached != null) return cached;

    final Term result;
    switch (r.op()) {
      case ITE:
        result =
            combine(
                Op.ITE,
                lift(r.arg(1), liftOverUnion, liftOverInter),
                lift(r.arg(2), liftOverUnion, liftOverInter),
                r.arg(0));
        break;
      case RE_CONCAT:
      case RE_DIFF:
        result = liftBinary(r, liftOverUnion, liftOverInter);
        break;
      case RE_UNION:
        result =
            liftOverUnion
                ? liftBinary(r, liftOverUnion, liftOverInter)
                : rebuild(r, liftOverUnion, liftOverInter);
        break;
      case RE_INTERSECT:
        result =
            liftOverInter
                ? liftBinary(r, liftOverUnion, liftOverInter)
                : rebuild(r, liftOverUnion, liftOverInter);
        break;
      case RE_STAR:
      case RE_PLUS:
      case RE_OPTION:
      case RE_COMPLEMENT:
      case RE_REVERSE:
      case RE_LOOP:
      case RE_POWER:
        if (r.numArgs() != 1) {
          result = r;
        } else {
          result = distribute(r, 0, lift(r.arg(0), liftOverUnion, liftOverInter));
        }
        break;
      case RE_DERIVATIVE:
        result = distribute(r, 1, lift(r.arg(1), liftOverUnion, liftOverInter));
        break;
      default:
        result = r;
        break;
    }

    cache.insert(Op.RE_LIFT_ITES, r, flags0, flags1, result);
    return result;
  }

  private Term liftBinary(Term r, boolean lou, boolean loi) {
    Term acc = lift(r.arg(0), lou, loi);
    for (int i = 1; i < r.numArgs(); ++i) {
      acc = combine(r.op(), acc, lift(r.arg(i), lou, loi), null);
    }
    return acc;
  }

  private Term rebuild(Term r, boolean lou, boolean loi) {
    final List<Term> args = new ArrayList<>(r.numArgs());
    for (Term arg : r.args()) args.add(lift(arg, lou, loi));
    return mgr.mkAppLike(r, args);
  }

  /** Rebuilds the unary node {@code model} over each leaf of the BDD {@code child}. */
  private Term distribute(Term model, int argIndex, Term child) {
    if (child.is(Op.ITE)) {
      return combine(
          Op.ITE,
          distribute(model, argIndex, child.arg(1)),
          distribute(model, argIndex, child.arg(2)),
          child.arg(0));
    }
    final List<Term> args = new ArrayList<>(model.args());
    args.set(argIndex, child);
    return mgr.mkAppLike(model, args);
  }
}
