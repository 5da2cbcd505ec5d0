package seqrw.rewriter.regex;

import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import seqrw.rewriter.RewriteResult;
import seqrw.rewriter.cache.OpCache;
import seqrw.rewriter.ops.SeqOpSimplifier;
import seqrw.term.Op;
import seqrw.term.Sort;
import seqrw.term.Term;
import seqrw.term.TermManager;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BooleanSupplier;

import static seqrw.term.TermSupport.areDistinct;
import static seqrw.term.TermSupport.areEqual;
import static seqrw.term.TermSupport.charOf;
import static seqrw.term.TermSupport.isEmpty;
import static seqrw.term.TermSupport.isFalse;
import static seqrw.term.TermSupport.isTrue;
import static seqrw.term.TermSupport.loopBounds;
import static seqrw.term.TermSupport.smallIntOf;
import static seqrw.term.TermSupport.stringOf;

/**
 * Nullability and Brzozowski derivatives of regexes.
 *
 * <p>{@link #derivative} computes the whole derivative eagerly and returns it in BDD form (see
 * {@link IteCombiner}). {@link #mkDerivativeStep} is the local rule for a {@code re.derivative}
 * node that pushes the derivative one level down.
 */
public class RegexDerivative {
  private static final Logger LOG = LoggerFactory.getLogger(RegexDerivative.class);

  private final TermManager mgr;
  private final OpCache cache;
  private final IteCombiner ites;
  private final SeqOpSimplifier seqOps;
  private final BooleanSupplier cancelled;

  public RegexDerivative(
      TermManager mgr,
      OpCache cache,
      IteCombiner ites,
      SeqOpSimplifier seqOps,
      BooleanSupplier cancelled) {
    this.mgr = mgr;
    this.cache = cache;
    this.ites = ites;
    this.seqOps = seqOps;
    this.cancelled = cancelled;
  }

  /** A boolean term that holds iff the empty sequence is in {@code r}. */
  public Term isNullable(Term r) {
    if (!r.sort().isRe()) throw new IllegalArgumentException("not a regex: " + r);
    final Term cached = cache.find(Op.RE_IS_NULLABLE, r, null, null);
    if (cached != null) return cached;
    final Term result = isNullable0(r);
    cache.insert(Op.RE_IS_NULLABLE, r, null, null, result);
    return result;
  }

  private Term isNullable0(Term r) {
    switch (r.op()) {
      case RE_CONCAT:
      case RE_INTERSECT: {
        final List<Term> args = new ArrayList<>(r.numArgs());
        for (Term arg : r.args()) args.add(isNullable(arg));
        return mgr.mkAnd(args);
      }
      case RE_UNION: {
        final List<Term> args = new ArrayList<>(r.numArgs());
        for (Term arg : r.args()) args.add(isNullable(arg));
        return mgr.mkOr(args);
      }
      case RE_DIFF: {
        Term acc = isNullable(r.arg(0));
        for (int i = 1; i < r.numArgs(); ++i)
          acc = mgr.mkAnd(acc, mgr.mkNot(isNullable(r.arg(i))));
        return acc;
      }
      case RE_STAR:
      case RE_OPTION:
      case RE_FULL_SEQ:
        return mgr.mkTrue();
      case RE_FULL_CHAR:
      case RE_EMPTY:
      case RE_OF_PRED:
      case RE_RANGE:
        return mgr.mkFalse();
      case RE_PLUS:
      case RE_REVERSE:
        return isNullable(r.arg(0));
      case RE_LOOP: {
        final int[] bounds = loopBounds(r);
        if (bounds != null && bounds.length == 2 && bounds[0] > bounds[1]) return mgr.mkFalse();
        if (bounds != null) return bounds[0] == 0 ? mgr.mkTrue() : isNullable(r.arg(0));
        break;
      }
      case RE_POWER:
        return r.param(0) == 0 ? mgr.mkTrue() : isNullable(r.arg(0));
      case RE_COMPLEMENT:
        return mgr.mkNot(isNullable(r.arg(0)));
      case SEQ_TO_RE:
        return mkEqSimplified(mgr.mkEmpty(r.arg(0).sort()), r.arg(0));
      case ITE:
        return mkBoolIte(r.arg(0), isNullable(r.arg(1)), isNullable(r.arg(2)));
      default:
        break;
    }
    return mgr.mkInRe(mgr.mkEmpty(r.sort().seqSort()), r);
  }

  /** Pushes {@code re.derivative(ele, r)} one level into {@code r}. */
  public RewriteResult mkDerivativeStep(Term ele, Term r) {
    final Sort sort = r.sort();
    switch (r.op()) {
      case RE_CONCAT: {
        final Term r1 = r.arg(0), r2 = rest(r);
        final Term head = mgr.mkReConcat(mgr.mkReDerivative(ele, r1), r2);
        final Term n = isNullable(r1);
        if (isFalse(n)) return RewriteResult.rewrite2(head);
        final Term both = mgr.mkReUnion(head, mgr.mkReDerivative(ele, r2));
        if (isTrue(n)) return RewriteResult.rewrite2(both);
        return RewriteResult.rewrite3(mgr.mkIte(n, both, head));
      }
      case RE_STAR:
        return RewriteResult.rewrite2(mgr.mkReConcat(mgr.mkReDerivative(ele, r.arg(0)), r));
      case RE_PLUS:
        return RewriteResult.rewrite2(mgr.mkReDerivative(ele, mgr.mkReStar(r.arg(0))));
      case RE_UNION:
      case RE_INTERSECT:
      case RE_DIFF: {
        final List<Term> args = new ArrayList<>(r.numArgs());
        for (Term arg : r.args()) args.add(mgr.mkReDerivative(ele, arg));
        return RewriteResult.rewrite2(mgr.mkAppLike(r, args));
      }
      case ITE:
        return RewriteResult.rewrite2(
            mgr.mkIte(
                r.arg(0),
                mgr.mkReDerivative(ele, r.arg(1)),
                mgr.mkReDerivative(ele, r.arg(2))));
      case RE_OPTION:
        return RewriteResult.rewrite1(mgr.mkReDerivative(ele, r.arg(0)));
      case RE_COMPLEMENT:
        return RewriteResult.rewrite2(mgr.mkReComplement(mgr.mkReDerivative(ele, r.arg(0))));
      case RE_LOOP: {
        final int[] bounds = loopBounds(r);
        if (bounds == null) return RewriteResult.failed();
        final Term r1 = r.arg(0);
        final Term d1 = mgr.mkReDerivative(ele, r1);
        final int lo = Math.max(bounds[0] - 1, 0);
        if (bounds.length == 1)
          return RewriteResult.rewrite2(mgr.mkReConcat(d1, mgr.mkReLoop(r1, lo)));
        if (bounds[1] == 0) return RewriteResult.done(mgr.mkReEmpty(sort));
        return RewriteResult.rewrite2(mgr.mkReConcat(d1, mgr.mkReLoop(r1, lo, bounds[1] - 1)));
      }
      case RE_FULL_SEQ:
      case RE_EMPTY:
        return RewriteResult.done(r);
      case RE_FULL_CHAR:
        return RewriteResult.done(epsilon(sort));
      case SEQ_TO_RE: {
        final Term s = r.arg(0);
        final Term[] ht = seqOps.getHeadTail(s);
        if (ht != null)
          return RewriteResult.rewrite2(reAnd(mkEqSimplified(ele, ht[0]), mgr.mkToRe(ht[1])));
        if (isEmpty(s) || "".equals(stringOf(s)))
          return RewriteResult.done(mgr.mkReEmpty(sort));
        return RewriteResult.failed();
      }
      case RE_RANGE: {
        final Term guard = rangeGuard(ele, r);
        if (guard == null) return RewriteResult.failed();
        return RewriteResult.rewrite2(reAnd(guard, epsilon(sort)));
      }
      case RE_OF_PRED:
        return RewriteResult.rewrite2(reAnd(mgr.mkSelect(r.arg(0), ele), epsilon(sort)));
      default:
        return RewriteResult.failed();
    }
  }

  /**
   * The derivative of {@code r} by the element {@code ele} in BDD form. Null when {@code r}
   * contains an operator the derivative cannot see through, or when cancelled.
   */
  public Term derivative(Term ele, Term r) {
    if (cancelled.getAsBoolean()) return null;
    final Term cached = cache.find(Op.RE_DERIVATIVE, ele, r, null);
    if (cached != null) return cached;
    final Term result = r.is(Op.RE_CONCAT) ? derivativeOfConcat(ele, r) : derivative0(ele, r);
    if (result != null) cache.insert(Op.RE_DERIVATIVE, ele, r, null, result);
    else LOG.trace("no derivative of {} by {}", r, ele);
    return result;
  }

  private Term derivative0(Term ele, Term r) {
    final Sort sort = r.sort();
    switch (r.op()) {
      case RE_STAR: {
        final Term d = derivative(ele, r.arg(0));
        return d == null ? null : ites.combine(Op.RE_CONCAT, d, r, null);
      }
      case RE_PLUS: {
        final Term d = derivative(ele, r.arg(0));
        return d == null ? null : ites.combine(Op.RE_CONCAT, d, mgr.mkReStar(r.arg(0)), null);
      }
      case RE_OPTION:
        return derivative(ele, r.arg(0));
      case RE_UNION:
      case RE_INTERSECT:
      case RE_DIFF: {
        Term acc = derivative(ele, r.arg(0));
        for (int i = 1; acc != null && i < r.numArgs(); ++i) {
          final Term d = derivative(ele, r.arg(i));
          acc = d == null ? null : ites.combine(r.op(), acc, d, null);
        }
        return acc;
      }
      case ITE: {
        final Term d1 = derivative(ele, r.arg(1));
        final Term d2 = d1 == null ? null : derivative(ele, r.arg(2));
        return d2 == null ? null : ites.combine(Op.ITE, d1, d2, r.arg(0));
      }
      case RE_COMPLEMENT: {
        final Term d = derivative(ele, r.arg(0));
        return d == null ? null : complement(d);
      }
      case RE_LOOP:
        return derivativeOfLoop(ele, r);
      case RE_POWER:
        return derivative(ele, mgr.mkReLoop(r.arg(0), r.param(0), r.param(0)));
      case RE_FULL_SEQ:
      case RE_EMPTY:
        return r;
      case RE_FULL_CHAR:
        return epsilon(sort);
      case SEQ_TO_RE: {
        final Term s = r.arg(0);
        final Term[] ht = seqOps.getHeadTail(s);
        if (ht != null) return reAnd(mkEqSimplified(ele, ht[0]), mgr.mkToRe(ht[1]));
        if (isEmpty(s)) return mgr.mkReEmpty(sort);
        return null;
      }
      case RE_RANGE: {
        final Term guard = rangeGuard(ele, r);
        return guard == null ? null : reAnd(guard, epsilon(sort));
      }
      case RE_OF_PRED:
        return reAnd(mgr.mkSelect(r.arg(0), ele), epsilon(sort));
      default:
        return null;
    }
  }

  /** Walks the operands left to right while they are possibly nullable, then folds from the right. */
  private Term derivativeOfConcat(Term ele, Term r) {
    final List<Term> parts = new ArrayList<>();
    Term e = r;
    while (e.is(Op.RE_CONCAT)) {
      for (int i = 0; i < e.numArgs() - 1; ++i) parts.add(e.arg(i));
      e = e.arg(e.numArgs() - 1);
    }
    parts.add(e);

    // tails.get(i) is the concatenation of parts i+1 .. n-1
    final List<Term> tails = new ArrayList<>(parts.size());
    for (int i = 0; i < parts.size(); ++i) tails.add(null);
    Term tail = parts.get(parts.size() - 1);
    for (int i = parts.size() - 2; i >= 0; --i) {
      tails.set(i, tail);
      tail = mgr.mkReConcat(parts.get(i), tail);
    }

    final List<Term> heads = new ArrayList<>(), guards = new ArrayList<>();
    for (int i = 0; i < parts.size(); ++i) {
      final Term d = derivative(ele, parts.get(i));
      if (d == null) return null;
      final Term rest = tails.get(i);
      heads.add(rest == null ? d : ites.combine(Op.RE_CONCAT, d, rest, null));
      if (rest == null) break;
      final Term n = isNullable(parts.get(i));
      guards.add(n);
      if (isFalse(n)) break;
    }

    Term acc = heads.get(heads.size() - 1);
    for (int i = heads.size() - 2; i >= 0; --i) {
      final Term head = heads.get(i), n = guards.get(i);
      final Term both = ites.combine(Op.RE_UNION, head, acc, null);
      acc = isTrue(n) ? both : ites.combine(Op.ITE, both, head, n);
    }
    return acc;
  }

  private Term derivativeOfLoop(Term ele, Term r) {
    int[] bounds = loopBounds(r);
    if (bounds == null) {
      // argument forms with numeral bounds
      final Integer lo = r.numArgs() > 1 ? smallIntOf(r.arg(1)) : null;
      final Integer hi = r.numArgs() > 2 ? smallIntOf(r.arg(2)) : null;
      if (lo == null || lo < 0 || (r.numArgs() > 2 && (hi == null || hi < 0))) return null;
      bounds = hi == null ? new int[] {lo} : new int[] {lo, hi};
    }
    final Term r1 = r.arg(0);
    if (bounds.length == 2 && (bounds[1] == 0 || bounds[0] > bounds[1]))
      return mgr.mkReEmpty(r.sort());
    final Term d = derivative(ele, r1);
    if (d == null) return null;
    final int lo = Math.max(bounds[0] - 1, 0);
    final Term rest =
        bounds.length == 1 ? mkLoop(r1, lo) : mkLoop(r1, lo, bounds[1] - 1);
    return ites.combine(Op.RE_CONCAT, d, rest, null);
  }

  private Term mkLoop(Term r, int lo) {
    return lo == 0 ? mgr.mkReStar(r) : mgr.mkReLoop(r, lo);
  }

  private Term mkLoop(Term r, int lo, int hi) {
    if (hi == 0) return epsilon(r.sort());
    if (lo == 1 && hi == 1) return r;
    return mgr.mkReLoop(r, lo, hi);
  }

  private Term complement(Term d) {
    if (d.is(Op.ITE)) {
      return ites.combine(Op.ITE, complement(d.arg(1)), complement(d.arg(2)), d.arg(0));
    }
    if (d.is(Op.RE_EMPTY)) return mgr.mkReFullSeq(d.sort());
    if (d.is(Op.RE_FULL_SEQ)) return mgr.mkReEmpty(d.sort());
    if (d.is(Op.RE_COMPLEMENT)) return d.arg(0);
    return mgr.mkReComplement(d);
  }

  /** The membership condition of a character range. Null for symbolic non-unit bounds. */
  private Term rangeGuard(Term ele, Term range) {
    final Term lo = range.arg(0), hi = range.arg(1);
    final String s1 = stringOf(lo), s2 = stringOf(hi);
    if (s1 != null && s2 != null) {
      if (s1.length() != 1 || s2.length() != 1) return mgr.mkFalse();
      return mkRange(mgr.mkChar(s1.charAt(0)), ele, mgr.mkChar(s2.charAt(0)));
    }
    final Term c1 = s1 != null && s1.length() == 1 ? mgr.mkChar(s1.charAt(0)) : unitArg(lo);
    final Term c2 = s2 != null && s2.length() == 1 ? mgr.mkChar(s2.charAt(0)) : unitArg(hi);
    if (c1 == null || c2 == null) return null;
    return mkRange(c1, ele, c2);
  }

  private static Term unitArg(Term t) {
    return t.is(Op.SEQ_UNIT) ? t.arg(0) : null;
  }

  private Term mkRange(Term lo, Term ele, Term hi) {
    return mgr.mkAnd(mkCharLe(lo, ele), mkCharLe(ele, hi));
  }

  private Term mkCharLe(Term a, Term b) {
    if (a == b) return mgr.mkTrue();
    final int x = charOf(a), y = charOf(b);
    if (x >= 0 && y >= 0) return mgr.mkBool(x <= y);
    return mgr.mkCharLe(a, b);
  }

  private Term mkEqSimplified(Term a, Term b) {
    if (areEqual(a, b)) return mgr.mkTrue();
    if (areDistinct(a, b)) return mgr.mkFalse();
    return mgr.mkEq(a, b);
  }

  private Term mkBoolIte(Term c, Term t, Term e) {
    if (isTrue(c) || t == e) return t;
    if (isFalse(c)) return e;
    return mgr.mkIte(c, t, e);
  }

  /** {@code r} if {@code cond} holds, otherwise the empty language. */
  private Term reAnd(Term cond, Term r) {
    if (isTrue(cond)) return r;
    final Term empty = mgr.mkReEmpty(r.sort());
    if (isFalse(cond)) return empty;
    return ites.combine(Op.ITE, r, empty, cond);
  }

  private Term epsilon(Sort reSort) {
    return mgr.mkToRe(mgr.mkEmpty(reSort.seqSort()));
  }

  private Term rest(Term concat) {
    if (concat.numArgs() == 2) return concat.arg(1);
    return mgr.mkApp(Op.RE_CONCAT, null, concat.args().subList(1, concat.numArgs()));
  }

  /**
   * The leaves of the ite structure at the top of {@code r}, each with the conjunction of the
   * conditions leading to it, then-branches first.
   */
  public List<Pair<Term, Term>> getCofactors(Term r) {
    final List<Pair<Term, Term>> result = new ArrayList<>();
    final Deque<Pair<List<Term>, Term>> todo = new ArrayDeque<>();
    todo.push(Pair.of(List.of(), r));
    while (!todo.isEmpty()) {
      final Pair<List<Term>, Term> item = todo.pop();
      final List<Term> conds = item.getLeft();
      final Term e = item.getRight();
      if (!e.is(Op.ITE)) {
        result.add(Pair.of(mgr.mkAnd(conds), e));
        continue;
      }
      final Term c = e.arg(0);
      todo.push(Pair.of(extend(conds, mgr.mkNot(c)), e.arg(2)));
      todo.push(Pair.of(extend(conds, c), e.arg(1)));
    }
    return result;
  }

  private static List<Term> extend(List<Term> conds, Term c) {
    final List<Term> xs = new ArrayList<>(conds.size() + 1);
    xs.addAll(conds);
    xs.add(c);
    return xs;
  }

  /**
   * Finds a condition c of an ite occurring under regex operators of {@code r} and returns
   * {c, r[c := true], r[c := false]}, the two cofactors over the operators it occurs under. Null
   * when {@code r} has no such ite.
   */
  public Term[] hasCofactor(Term r) {
    final Set<Term> visited = new HashSet<>(), noCofactor = new HashSet<>();
    final Map<Term, Term> cacheTh = new HashMap<>(), cacheEl = new HashMap<>();
    final Deque<Term> todo = new ArrayDeque<>();
    Term cond = null;
    todo.push(r);
    while (!todo.isEmpty()) {
      final Term e = todo.peek();
      if (visited.contains(e)) {
        todo.pop();
        continue;
      }
      if (e.is(Op.ITE)) {
        visited.add(e);
        todo.pop();
        if (cond == null) cond = e.arg(0);
        if (cond == e.arg(0)) {
          cacheTh.put(e, e.arg(1));
          cacheEl.put(e, e.arg(2));
        } else {
          noCofactor.add(e);
        }
        continue;
      }
      if (!e.is(Op.RE_CONCAT)
          && !e.is(Op.RE_UNION)
          && !e.is(Op.RE_INTERSECT)
          && !e.is(Op.RE_COMPLEMENT)) {
        visited.add(e);
        noCofactor.add(e);
        todo.pop();
        continue;
      }

      final List<Term> argsTh = new ArrayList<>(e.numArgs()), argsEl = new ArrayList<>(e.numArgs());
      boolean ready = true, hasCof = false;
      for (Term arg : e.args()) {
        if (noCofactor.contains(arg)) {
          argsTh.add(arg);
          argsEl.add(arg);
        } else if (cacheTh.containsKey(arg)) {
          argsTh.add(cacheTh.get(arg));
          argsEl.add(cacheEl.get(arg));
          hasCof = true;
        } else {
          todo.push(arg);
          ready = false;
        }
      }
      if (!ready) continue;

      visited.add(e);
      todo.pop();
      if (hasCof) {
        cacheTh.put(e, mgr.mkAppLike(e, argsTh));
        cacheEl.put(e, mgr.mkAppLike(e, argsEl));
      } else {
        noCofactor.add(e);
      }
    }
    if (cond == null || !cacheTh.containsKey(r)) return null;
    return new Term[] {cond, cacheTh.get(r), cacheEl.get(r)};
  }

  /**
   * Eliminates {@code ele} from a path condition: ranges over a character element are intersected
   * and an equation {@code ele = t} is substituted. For an uninterpreted {@code ele} the result is
   * equisatisfiable with {@code exists ele. cond}; otherwise it is equivalent to {@code cond}.
   */
  public Term elimCondition(Term ele, Term cond) {
    final List<Term> conds = new ArrayList<>();
    flattenAnd(cond, conds);

    if (ele.sort().isChar()) {
      int lo = 0, hi = TermManager.MAX_CHAR;
      boolean allRanges = true;
      for (Term c : conds) {
        final boolean neg = c.is(Op.NOT);
        final Term atom = neg ? c.arg(0) : c;
        int cLo = -1, cHi = -1;
        if (atom.is(Op.CHAR_LE) && atom.arg(1) == ele && charOf(atom.arg(0)) >= 0) {
          cLo = charOf(atom.arg(0));
          cHi = TermManager.MAX_CHAR;
        } else if (atom.is(Op.CHAR_LE) && atom.arg(0) == ele && charOf(atom.arg(1)) >= 0) {
          cLo = 0;
          cHi = charOf(atom.arg(1));
        } else if (atom.is(Op.EQ) && atom.arg(0) == ele && charOf(atom.arg(1)) >= 0) {
          cLo = cHi = charOf(atom.arg(1));
        } else if (atom.is(Op.EQ) && atom.arg(1) == ele && charOf(atom.arg(0)) >= 0) {
          cLo = cHi = charOf(atom.arg(0));
        } else {
          allRanges = false;
          continue;
        }
        if (!neg) {
          lo = Math.max(lo, cLo);
          hi = Math.min(hi, cHi);
        } else if (cLo == 0 && cHi < TermManager.MAX_CHAR) {
          lo = Math.max(lo, cHi + 1);
        } else if (cHi == TermManager.MAX_CHAR && cLo > 0) {
          hi = Math.min(hi, cLo - 1);
        } else {
          allRanges = false;
        }
      }
      if (lo > hi) return mgr.mkFalse();
      if (allRanges && ele.is(Op.VAR)) return mgr.mkTrue();
    }

    Term solution = null;
    for (Term c : conds) {
      if (!c.is(Op.EQ)) continue;
      if (c.arg(0) == ele && c.arg(1) != ele) solution = c.arg(1);
      else if (c.arg(1) == ele && c.arg(0) != ele) solution = c.arg(0);
      if (solution != null) break;
    }
    if (solution == null) return cond;

    final Term result = mgr.substitute(cond, ele, solution);
    if (ele.is(Op.VAR)) return result;
    return mgr.mkAnd(mgr.mkEq(ele, solution), result);
  }

  private static void flattenAnd(Term t, List<Term> out) {
    final Deque<Term> todo = new ArrayDeque<>();
    todo.push(t);
    while (!todo.isEmpty()) {
      final Term e = todo.pop();
      if (e.is(Op.AND)) {
        for (int i = e.numArgs() - 1; i >= 0; --i) todo.push(e.arg(i));
      } else {
        out.add(e);
      }
    }
  }
}
