package seqrw.rewriter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import seqrw.rewriter.automaton.ExprSolver;
import seqrw.rewriter.automaton.RegexToAutomaton;
import seqrw.rewriter.automaton.SymExpr;
import seqrw.rewriter.automaton.SymbolicAutomaton;
import seqrw.rewriter.cache.OpCache;
import seqrw.rewriter.ops.RegexOpSimplifier;
import seqrw.rewriter.ops.SeqOpSimplifier;
import seqrw.rewriter.ops.StrOpSimplifier;
import seqrw.rewriter.regex.IteCombiner;
import seqrw.rewriter.regex.RegexDerivative;
import seqrw.rewriter.wordeq.WordEquationResult;
import seqrw.rewriter.wordeq.WordEquationSolver;
import seqrw.term.Op;
import seqrw.term.Sort;
import seqrw.term.Term;
import seqrw.term.TermManager;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

import static seqrw.common.utils.IterableSupport.none;
import static seqrw.common.utils.ListSupport.filter;
import static seqrw.common.utils.ListSupport.map;
import static seqrw.term.TermSupport.loopBounds;
import static seqrw.term.TermSupport.stringOf;

/**
 * Entry point of the sequence rewriter. {@link #mkAppCore} applies the local rules of one operator
 * to already simplified arguments; the status of the result tells the caller how deep the result
 * must be simplified again.
 *
 * <p>Besides operator applications the rewriter reduces equations ({@link #mkEqCore}) and merges
 * regex memberships of the same sequence under a conjunction or disjunction ({@link #mkBoolApp}).
 */
public class SeqRewriter {
  private static final Logger LOG = LoggerFactory.getLogger(SeqRewriter.class);

  private final TermManager mgr;
  private final RewriterConfig config;
  private final OpCache cache;
  private final SeqOpSimplifier seqOps;
  private final StrOpSimplifier strOps;
  private final RegexOpSimplifier reOps;
  private final IteCombiner ites;
  private final RegexDerivative derivatives;
  private final RegexToAutomaton automata;
  private final WordEquationSolver wordEqs;
  private BooleanSupplier cancellation;

  public SeqRewriter(TermManager mgr) {
    this(mgr, RewriterConfig.fromSystemProperties());
  }

  public SeqRewriter(TermManager mgr, RewriterConfig config) {
    this.mgr = mgr;
    this.config = config;
    this.cancellation = () -> false;

    final BooleanSupplier cancelled = () -> cancellation.getAsBoolean();
    this.cache = new OpCache(config.maxCacheSize());
    this.seqOps = new SeqOpSimplifier(mgr, config.coalesceChars());
    this.strOps = new StrOpSimplifier(mgr);
    this.ites = new IteCombiner(mgr, cache);
    this.derivatives = new RegexDerivative(mgr, cache, ites, seqOps, cancelled);
    this.automata = new RegexToAutomaton(mgr, cancelled);
    this.reOps = new RegexOpSimplifier(mgr, seqOps, derivatives, automata);
    this.reOps.setContainsPattern(config.containsPattern());
    this.wordEqs = new WordEquationSolver(mgr);
    LOG.debug("created with {}", config);
  }

  /** Enables complement and intersection in the automaton construction. */
  public void setSolver(ExprSolver solver) {
    automata.setSolver(solver);
  }

  public void setCancellation(BooleanSupplier cancellation) {
    this.cancellation = cancellation == null ? () -> false : cancellation;
  }

  public boolean isCancelled() {
    return cancellation.getAsBoolean();
  }

  public TermManager mgr() {
    return mgr;
  }

  public RewriterConfig config() {
    return config;
  }

  public OpCache cache() {
    return cache;
  }

  public IteCombiner ites() {
    return ites;
  }

  public RegexDerivative derivatives() {
    return derivatives;
  }

  public RegexToAutomaton automata() {
    return automata;
  }

  public WordEquationSolver wordEquations() {
    return wordEqs;
  }

  public void resetCache() {
    cache.reset();
  }

  /** Applies the rules of {@code app}'s operator to its arguments. */
  public RewriteResult rewrite(Term app) {
    if (app.is(Op.STRING_CONST))
      return config.coalesceChars() ? RewriteResult.failed() : strOps.mkStrUnits(app);
    return mkAppCore(app.op(), app.paramsCopy(), app.args());
  }

  public RewriteResult mkAppCore(Op op, int[] params, List<Term> args) {
    if (!op.isSeqFamily())
      throw new IllegalArgumentException("not a sequence operator: " + op);
    if (args.isEmpty()) return RewriteResult.failed();

    final Sort range = mgr.sortOf(op, params, args);
    final RewriteResult result = dispatch(op, params, args);
    if (!result.isFailed()) {
      if (!result.result().sort().equals(range))
        throw new IllegalStateException(
            "rewrite of " + op + " changed the sort to " + result.result().sort());
      LOG.trace("{}{} --> {}", op.symbol(), args, result);
    }
    return result;
  }

  private RewriteResult dispatch(Op op, int[] params, List<Term> args) {
    final int n = args.size();
    final Term a = args.get(0), b = n > 1 ? args.get(1) : null, c = n > 2 ? args.get(2) : null;
    return switch (op) {
      case SEQ_UNIT -> seqOps.mkSeqUnit(a);
      case SEQ_CONCAT -> n == 1 ? RewriteResult.done(a)
          : n == 2 ? seqOps.mkSeqConcat(a, b) : binarize(op, args);
      case SEQ_LENGTH -> seqOps.mkSeqLength(a);
      case SEQ_EXTRACT -> seqOps.mkSeqExtract(a, b, c);
      case SEQ_CONTAINS -> seqOps.mkSeqContains(a, b);
      case SEQ_AT -> seqOps.mkSeqAt(a, b);
      case SEQ_NTH -> seqOps.mkSeqNth(a, b);
      case SEQ_NTH_I -> seqOps.mkSeqNthI(a, b);
      case SEQ_INDEX -> n == 2 ? RewriteResult.rewrite1(mgr.mkIndex(a, b, mgr.mkInt(0)))
          : seqOps.mkSeqIndex(a, b, c);
      case SEQ_LAST_INDEX -> seqOps.mkSeqLastIndex(a, b);
      case SEQ_REPLACE -> seqOps.mkSeqReplace(a, b, c);
      case SEQ_PREFIX -> seqOps.mkSeqPrefix(a, b);
      case SEQ_SUFFIX -> seqOps.mkSeqSuffix(a, b);
      case SEQ_IN_RE -> reOps.mkStrInRegexp(a, b);
      case STRING_LT -> strOps.mkStrLt(a, b);
      case STRING_LE -> strOps.mkStrLe(a, b);
      case STRING_ITOS -> strOps.mkStrItos(a);
      case STRING_STOI -> strOps.mkStrStoi(a);
      case STRING_FROM_CODE -> strOps.mkStrFromCode(a);
      case STRING_TO_CODE -> strOps.mkStrToCode(a);
      case STRING_IS_DIGIT -> strOps.mkStrIsDigit(a);

      case RE_CONCAT -> n == 1 ? RewriteResult.done(a)
          : n == 2 ? reOps.mkReConcat(a, b) : binarize(op, args);
      case RE_UNION -> n == 1 ? RewriteResult.done(a)
          : n == 2 ? reOps.mkReUnion(a, b) : binarize(op, args);
      case RE_INTERSECT -> n == 1 ? RewriteResult.done(a)
          : n == 2 ? reOps.mkReInter(a, b) : binarize(op, args);
      case RE_DIFF -> n == 1 ? RewriteResult.done(a)
          : n == 2 ? reOps.mkReDiff(a, b) : binarize(op, args);
      case RE_COMPLEMENT -> reOps.mkReComplement(a);
      case RE_STAR -> reOps.mkReStar(a);
      case RE_PLUS -> reOps.mkRePlus(a);
      case RE_OPTION -> reOps.mkReOpt(a);
      case RE_LOOP -> reOps.mkReLoop(params, args);
      case RE_POWER -> reOps.mkRePower(params[0], a);
      case RE_REVERSE -> reOps.mkReReverse(a);
      case RE_DERIVATIVE -> derivatives.mkDerivativeStep(a, b);

      case SEQ_EMPTY, STRING_CONST, SEQ_TO_RE, SEQ_NTH_U, SEQ_SKOLEM,
          RE_EMPTY, RE_FULL_SEQ, RE_FULL_CHAR, RE_RANGE, RE_OF_PRED -> RewriteResult.failed();

      case TRUE, FALSE, VAR, BOUND_VAR, EQ, NOT, AND, OR, ITE, SELECT,
          INT_NUM, ADD, SUB, MUL, LE, GE, LT, CHAR_CONST, CHAR_LE,
          RE_IS_NULLABLE, RE_LIFT_ITES -> throw new IllegalArgumentException(
              "not a sequence operator: " + op);
    };
  }

  // concat, union and intersection nest to the right, difference to the left
  private RewriteResult binarize(Op op, List<Term> args) {
    final int n = args.size();
    if (op == Op.RE_DIFF) {
      Term acc = args.get(0);
      for (int i = 1; i < n; ++i) acc = mgr.mkApp(op, acc, args.get(i));
      return RewriteResult.rewriteFull(acc);
    }
    Term acc = args.get(n - 1);
    for (int i = n - 2; i >= 0; --i) acc = mgr.mkApp(op, args.get(i), acc);
    return RewriteResult.rewriteFull(acc);
  }

  /** Simplifies {@code l = r} over sequences or regexes. */
  public RewriteResult mkEqCore(Term l, Term r) {
    if (!l.sort().equals(r.sort()))
      throw new IllegalArgumentException("sort mismatch in " + l + " = " + r);
    if (l.sort().isRe()) return reduceReEq(l, r);

    final WordEquationResult reduced = wordEqs.reduceEq(l, r);
    switch (reduced.kind()) {
      case REFUTED:
        return RewriteResult.done(mgr.mkFalse());
      case UNCHANGED:
        return RewriteResult.failed();
      default: {
        final List<Term> eqs =
            map(reduced.equations(), eq -> mgr.mkEq(eq.getLeft(), eq.getRight()));
        final Term result = mgr.mkAnd(eqs);
        LOG.trace("{} = {} --> {}", l, r, result);
        return RewriteResult.rewrite3(result);
      }
    }
  }

  private RewriteResult reduceReEq(Term l, Term r) {
    if (l.is(Op.RE_EMPTY)) return reduceReIsEmpty(r);
    if (r.is(Op.RE_EMPTY)) return reduceReIsEmpty(l);
    return RewriteResult.failed();
  }

  /** Simplifies {@code r = re.empty}. */
  public RewriteResult reduceReIsEmpty(Term r) {
    switch (r.op()) {
      case RE_UNION: {
        final List<Term> eqs = new ArrayList<>(r.numArgs());
        for (Term arg : r.args()) eqs.add(eqEmpty(arg));
        return RewriteResult.rewrite2(mgr.mkAnd(eqs));
      }
      case RE_STAR:
      case SEQ_TO_RE:
      case RE_FULL_CHAR:
      case RE_FULL_SEQ:
        return RewriteResult.done(mgr.mkFalse());
      case RE_EMPTY:
        return RewriteResult.done(mgr.mkTrue());
      case RE_CONCAT: {
        final List<Term> eqs = new ArrayList<>(r.numArgs());
        for (Term arg : r.args()) eqs.add(eqEmpty(arg));
        return RewriteResult.rewrite2(mgr.mkOr(eqs));
      }
      case RE_RANGE: {
        final String lo = stringOf(r.arg(0)), hi = stringOf(r.arg(1));
        if (lo != null && hi != null && lo.length() == 1 && hi.length() == 1)
          return RewriteResult.done(mgr.mkBool(lo.charAt(0) > hi.charAt(0)));
        break;
      }
      case RE_LOOP: {
        final int[] bounds = loopBounds(r);
        if (bounds == null) break;
        if (bounds.length == 2 && bounds[0] > bounds[1]) return RewriteResult.done(mgr.mkTrue());
        if (bounds[0] == 0) return RewriteResult.done(mgr.mkFalse());
        return RewriteResult.rewrite1(eqEmpty(r.arg(0)));
      }
      case RE_INTERSECT: {
        if (r.numArgs() != 2) break;
        final Term r1 = r.arg(0), r2 = r.arg(1);
        // partial DNF: (a | b) & c = (a & c) | (b & c)
        if (r1.is(Op.RE_UNION) && r1.numArgs() == 2) {
          return RewriteResult.rewrite3(
              eqEmpty(
                  mgr.mkReUnion(mgr.mkReInter(r1.arg(0), r2), mgr.mkReInter(r1.arg(1), r2))));
        }
        if (r2.is(Op.RE_UNION) && r2.numArgs() == 2) {
          return RewriteResult.rewrite3(
              eqEmpty(
                  mgr.mkReUnion(mgr.mkReInter(r2.arg(0), r1), mgr.mkReInter(r2.arg(1), r1))));
        }
        break;
      }
      default:
        break;
    }

    final SymbolicAutomaton<SymExpr> aut = automata.compile(r);
    if (aut != null && aut.isEmpty()) return RewriteResult.done(mgr.mkTrue());
    return RewriteResult.failed();
  }

  private Term eqEmpty(Term r) {
    return mgr.mkEq(r, mgr.mkReEmpty(r.sort()));
  }

  /**
   * Merges memberships of the same sequence among {@code args}. Under AND, {@code x in R1} and
   * {@code x in R2} become {@code x in R1 & R2}; under OR they become {@code x in R1 | R2}. A
   * negated membership contributes the complement of its regex.
   */
  public RewriteResult mkBoolApp(Op op, List<Term> args) {
    if (op != Op.AND && op != Op.OR)
      throw new IllegalArgumentException("not a conjunction or disjunction: " + op);
    final boolean isAnd = op == Op.AND;

    if (none(args, SeqRewriter::isMembershipLiteral)) return RewriteResult.failed();

    final Map<Term, Term> inRe = new LinkedHashMap<>(), notInRe = new LinkedHashMap<>();
    boolean foundPair = false;
    for (Term arg : args) {
      if (isMembership(arg)) {
        final Term x = arg.arg(0), y = arg.arg(1);
        final Term z = inRe.get(x);
        if (z != null) {
          inRe.put(x, isAnd ? mgr.mkReInter(z, y) : mgr.mkReUnion(z, y));
          foundPair = true;
        } else {
          inRe.put(x, y);
        }
        foundPair |= notInRe.containsKey(x);
      } else if (arg.is(Op.NOT) && isMembership(arg.arg(0))) {
        final Term x = arg.arg(0).arg(0), y = arg.arg(0).arg(1);
        final Term z = notInRe.get(x);
        if (z != null) {
          notInRe.put(x, isAnd ? mgr.mkReUnion(z, y) : mgr.mkReInter(z, y));
          foundPair = true;
        } else {
          notInRe.put(x, y);
        }
        foundPair |= inRe.containsKey(x);
      }
    }
    if (!foundPair) return RewriteResult.failed();

    final List<Term> newArgs = new ArrayList<>(args.size());
    for (Map.Entry<Term, Term> kv : inRe.entrySet()) {
      final Term x = kv.getKey(), y = kv.getValue();
      final Term z = notInRe.get(x);
      if (z != null) {
        final Term zc = mgr.mkReComplement(z);
        newArgs.add(mgr.mkInRe(x, isAnd ? mgr.mkReInter(y, zc) : mgr.mkReUnion(y, zc)));
      } else {
        newArgs.add(mgr.mkInRe(x, y));
      }
    }
    for (Map.Entry<Term, Term> kv : notInRe.entrySet()) {
      if (!inRe.containsKey(kv.getKey()))
        newArgs.add(mgr.mkInRe(kv.getKey(), mgr.mkReComplement(kv.getValue())));
    }
    newArgs.addAll(filter(args, arg -> !isMembershipLiteral(arg)));

    final Term result = isAnd ? mgr.mkAnd(newArgs) : mgr.mkOr(newArgs);
    LOG.trace("{}{} --> {}", op.symbol(), args, result);
    return RewriteResult.rewriteFull(result);
  }

  private static boolean isMembership(Term t) {
    return t.is(Op.SEQ_IN_RE);
  }

  private static boolean isMembershipLiteral(Term t) {
    return isMembership(t) || (t.is(Op.NOT) && isMembership(t.arg(0)));
  }

  /**
   * Orders a regex-sorted {@code ite(cond, r1, r2)} by condition id: a negated condition swaps the
   * branches, a condition repeated in a branch is decided, and a branch condition of larger id is
   * hoisted above {@code cond}. Only active with {@link RewriterConfig#reIteRewrite()}.
   */
  public RewriteResult rewriteReIte(Term cond, Term r1, Term r2) {
    if (!config.reIteRewrite()) return RewriteResult.failed();
    if (!r1.sort().isRe() || !r1.sort().equals(r2.sort()))
      throw new IllegalArgumentException("not a conditional regex: " + r1 + ", " + r2);

    if (cond.is(Op.NOT)) return RewriteResult.rewrite1(mgr.mkIte(cond.arg(0), r2, r1));
    if (r1.is(Op.ITE)) {
      final Term c = r1.arg(0);
      if (c == cond) return RewriteResult.rewrite1(mgr.mkIte(cond, r1.arg(1), r2));
      if (cond.id() < c.id()) {
        return RewriteResult.rewrite2(
            mgr.mkIte(c, mgr.mkIte(cond, r1.arg(1), r2), mgr.mkIte(cond, r1.arg(2), r2)));
      }
    }
    if (r2.is(Op.ITE)) {
      final Term c = r2.arg(0);
      if (c == cond) return RewriteResult.rewrite1(mgr.mkIte(cond, r1, r2.arg(2)));
      if (cond.id() < c.id()) {
        return RewriteResult.rewrite2(
            mgr.mkIte(c, mgr.mkIte(cond, r1, r2.arg(1)), mgr.mkIte(cond, r1, r2.arg(2))));
      }
    }
    return RewriteResult.failed();
  }
}
