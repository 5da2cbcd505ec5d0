package seqrw.term;

import com.google.common.collect.ImmutableList;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Arena of interned terms. Every constructor returns the existing node when an identical one
 * (operator, sort, parameters, payload, children) was built before.
 *
 * <p>{@link #mkAnd}, {@link #mkOr} and {@link #mkNot} drop trivially true/false operands. All
 * other constructors build exactly the requested node.
 */
public class TermManager {
  public static final int MAX_CHAR = 0xFFFF;

  private final Map<Key, Term> table;
  private final List<Term> nodes;
  private int nextFresh;

  private final Term trueTerm, falseTerm;

  public TermManager() {
    this.table = new HashMap<>(1024);
    this.nodes = new ArrayList<>(1024);
    this.nextFresh = 0;
    this.trueTerm = intern(Op.TRUE, Sort.BOOL, null, null, ImmutableList.of());
    this.falseTerm = intern(Op.FALSE, Sort.BOOL, null, null, ImmutableList.of());
  }

  public static TermManager mk() {
    return new TermManager();
  }

  public Term termAt(int id) {
    return nodes.get(id);
  }

  public int numTerms() {
    return nodes.size();
  }

  private Term intern(Op op, Sort sort, int[] params, Object payload, ImmutableList<Term> args) {
    final Key key = new Key(op, sort, params, payload, args);
    final Term existing = table.get(key);
    if (existing != null) return existing;

    final Term t = new Term(nodes.size(), op, sort, args, params, payload);
    nodes.add(t);
    table.put(key, t);
    return t;
  }

  public Term mkTrue() {
    return trueTerm;
  }

  public Term mkFalse() {
    return falseTerm;
  }

  public Term mkBool(boolean b) {
    return b ? trueTerm : falseTerm;
  }

  public Term mkConst(String name, Sort sort) {
    return intern(Op.VAR, sort, null, name, ImmutableList.of());
  }

  /** A constant whose name was never handed out by this manager. */
  public Term mkFreshConst(String prefix, Sort sort) {
    while (true) {
      final String name = prefix + "!" + nextFresh++;
      final Key key = new Key(Op.VAR, sort, null, name, ImmutableList.of());
      if (!table.containsKey(key)) return mkConst(name, sort);
    }
  }

  public Term mkBoundVar(int index, Sort sort) {
    return intern(Op.BOUND_VAR, sort, null, index, ImmutableList.of());
  }

  public Term mkInt(long v) {
    return mkInt(BigInteger.valueOf(v));
  }

  public Term mkInt(BigInteger v) {
    return intern(Op.INT_NUM, Sort.INT, null, v, ImmutableList.of());
  }

  public Term mkChar(int c) {
    if (c < 0 || c > MAX_CHAR) throw new IllegalArgumentException("character out of range: " + c);
    return intern(Op.CHAR_CONST, Sort.CHAR, null, c, ImmutableList.of());
  }

  /** String literal. The empty literal is the empty string sequence. */
  public Term mkString(String s) {
    if (s.isEmpty()) return mkEmpty(Sort.STRING);
    return intern(Op.STRING_CONST, Sort.STRING, null, s, ImmutableList.of());
  }

  public Term mkEmpty(Sort seqSort) {
    if (!seqSort.isSeq()) throw new IllegalArgumentException("not a sequence sort: " + seqSort);
    return intern(Op.SEQ_EMPTY, seqSort, null, null, ImmutableList.of());
  }

  public Term mkEq(Term a, Term b) {
    return mkApp(Op.EQ, a, b);
  }

  public Term mkNot(Term a) {
    if (a == trueTerm) return falseTerm;
    if (a == falseTerm) return trueTerm;
    if (a.is(Op.NOT)) return a.arg(0);
    return mkApp(Op.NOT, a);
  }

  public Term mkAnd(Term a, Term b) {
    return mkAnd(List.of(a, b));
  }

  public Term mkAnd(List<Term> xs) {
    final List<Term> kept = new ArrayList<>(xs.size());
    for (Term x : xs) {
      if (x == falseTerm) return falseTerm;
      if (x != trueTerm && !kept.contains(x)) kept.add(x);
    }
    if (kept.isEmpty()) return trueTerm;
    if (kept.size() == 1) return kept.get(0);
    return mkApp(Op.AND, null, kept);
  }

  public Term mkOr(Term a, Term b) {
    return mkOr(List.of(a, b));
  }

  public Term mkOr(List<Term> xs) {
    final List<Term> kept = new ArrayList<>(xs.size());
    for (Term x : xs) {
      if (x == trueTerm) return trueTerm;
      if (x != falseTerm && !kept.contains(x)) kept.add(x);
    }
    if (kept.isEmpty()) return falseTerm;
    if (kept.size() == 1) return kept.get(0);
    return mkApp(Op.OR, null, kept);
  }

  public Term mkIte(Term c, Term t, Term e) {
    return mkApp(Op.ITE, c, t, e);
  }

  public Term mkSelect(Term pred, Term elem) {
    return mkApp(Op.SELECT, pred, elem);
  }

  public Term mkAdd(Term a, Term b) {
    return mkApp(Op.ADD, a, b);
  }

  public Term mkAdd(List<Term> xs) {
    if (xs.isEmpty()) return mkInt(0);
    if (xs.size() == 1) return xs.get(0);
    return mkApp(Op.ADD, null, xs);
  }

  public Term mkSub(Term a, Term b) {
    return mkApp(Op.SUB, a, b);
  }

  public Term mkMul(Term a, Term b) {
    return mkApp(Op.MUL, a, b);
  }

  public Term mkLe(Term a, Term b) {
    return mkApp(Op.LE, a, b);
  }

  public Term mkGe(Term a, Term b) {
    return mkApp(Op.GE, a, b);
  }

  public Term mkLt(Term a, Term b) {
    return mkApp(Op.LT, a, b);
  }

  public Term mkCharLe(Term a, Term b) {
    return mkApp(Op.CHAR_LE, a, b);
  }

  public Term mkUnit(Term elem) {
    return mkApp(Op.SEQ_UNIT, elem);
  }

  public Term mkConcat(Term a, Term b) {
    return mkApp(Op.SEQ_CONCAT, a, b);
  }

  /** Right-nested concatenation of {@code xs}. Empty gives the empty sequence of {@code sort}. */
  public Term mkConcat(List<Term> xs, Sort sort) {
    if (xs.isEmpty()) return mkEmpty(sort);
    Term result = xs.get(xs.size() - 1);
    for (int i = xs.size() - 2; i >= 0; --i) result = mkConcat(xs.get(i), result);
    return result;
  }

  public Term mkLength(Term s) {
    return mkApp(Op.SEQ_LENGTH, s);
  }

  public Term mkExtract(Term s, Term pos, Term len) {
    return mkApp(Op.SEQ_EXTRACT, s, pos, len);
  }

  public Term mkContains(Term a, Term b) {
    return mkApp(Op.SEQ_CONTAINS, a, b);
  }

  public Term mkAt(Term s, Term i) {
    return mkApp(Op.SEQ_AT, s, i);
  }

  public Term mkNth(Term s, Term i) {
    return mkApp(Op.SEQ_NTH, s, i);
  }

  public Term mkNthI(Term s, Term i) {
    return mkApp(Op.SEQ_NTH_I, s, i);
  }

  public Term mkNthU(Term s, Term i) {
    return mkApp(Op.SEQ_NTH_U, s, i);
  }

  public Term mkIndex(Term a, Term b, Term start) {
    return mkApp(Op.SEQ_INDEX, a, b, start);
  }

  public Term mkLastIndex(Term a, Term b) {
    return mkApp(Op.SEQ_LAST_INDEX, a, b);
  }

  public Term mkReplace(Term a, Term b, Term c) {
    return mkApp(Op.SEQ_REPLACE, a, b, c);
  }

  public Term mkPrefix(Term a, Term b) {
    return mkApp(Op.SEQ_PREFIX, a, b);
  }

  public Term mkSuffix(Term a, Term b) {
    return mkApp(Op.SEQ_SUFFIX, a, b);
  }

  public Term mkIsEmpty(Term s) {
    return mkEq(s, mkEmpty(s.sort()));
  }

  public Term mkToRe(Term s) {
    return mkApp(Op.SEQ_TO_RE, s);
  }

  public Term mkInRe(Term s, Term r) {
    return mkApp(Op.SEQ_IN_RE, s, r);
  }

  public Term mkStrLt(Term a, Term b) {
    return mkApp(Op.STRING_LT, a, b);
  }

  public Term mkStrLe(Term a, Term b) {
    return mkApp(Op.STRING_LE, a, b);
  }

  public Term mkItos(Term i) {
    return mkApp(Op.STRING_ITOS, i);
  }

  public Term mkStoi(Term s) {
    return mkApp(Op.STRING_STOI, s);
  }

  public Term mkFromCode(Term i) {
    return mkApp(Op.STRING_FROM_CODE, i);
  }

  public Term mkToCode(Term s) {
    return mkApp(Op.STRING_TO_CODE, s);
  }

  public Term mkIsDigit(Term s) {
    return mkApp(Op.STRING_IS_DIGIT, s);
  }

  public Term mkReEmpty(Sort reSort) {
    return mkReConstant(Op.RE_EMPTY, reSort);
  }

  public Term mkReFullSeq(Sort reSort) {
    return mkReConstant(Op.RE_FULL_SEQ, reSort);
  }

  public Term mkReFullChar(Sort reSort) {
    return mkReConstant(Op.RE_FULL_CHAR, reSort);
  }

  private Term mkReConstant(Op op, Sort reSort) {
    if (!reSort.isRe()) throw new IllegalArgumentException("not a regex sort: " + reSort);
    return intern(op, reSort, null, null, ImmutableList.of());
  }

  public Term mkReConcat(Term a, Term b) {
    return mkApp(Op.RE_CONCAT, a, b);
  }

  public Term mkReUnion(Term a, Term b) {
    return mkApp(Op.RE_UNION, a, b);
  }

  public Term mkReInter(Term a, Term b) {
    return mkApp(Op.RE_INTERSECT, a, b);
  }

  public Term mkReDiff(Term a, Term b) {
    return mkApp(Op.RE_DIFF, a, b);
  }

  public Term mkReComplement(Term a) {
    return mkApp(Op.RE_COMPLEMENT, a);
  }

  public Term mkReStar(Term a) {
    return mkApp(Op.RE_STAR, a);
  }

  public Term mkRePlus(Term a) {
    return mkApp(Op.RE_PLUS, a);
  }

  public Term mkReOpt(Term a) {
    return mkApp(Op.RE_OPTION, a);
  }

  /** {@code a{lo,}} */
  public Term mkReLoop(Term a, int lo) {
    return mkApp(Op.RE_LOOP, new int[] {lo}, List.of(a));
  }

  /** {@code a{lo,hi}} */
  public Term mkReLoop(Term a, int lo, int hi) {
    return mkApp(Op.RE_LOOP, new int[] {lo, hi}, List.of(a));
  }

  public Term mkRePower(Term a, int n) {
    return mkApp(Op.RE_POWER, new int[] {n}, List.of(a));
  }

  public Term mkReRange(Term lo, Term hi) {
    return mkApp(Op.RE_RANGE, lo, hi);
  }

  public Term mkReReverse(Term a) {
    return mkApp(Op.RE_REVERSE, a);
  }

  public Term mkReDerivative(Term ele, Term r) {
    return mkApp(Op.RE_DERIVATIVE, ele, r);
  }

  public Term mkReOfPred(Term pred) {
    return mkApp(Op.RE_OF_PRED, pred);
  }

  public Term mkApp(Op op, Term... args) {
    return mkApp(op, null, Arrays.asList(args));
  }

  public Term mkApp(Op op, int[] params, List<Term> args) {
    final ImmutableList<Term> children = ImmutableList.copyOf(args);
    final int[] ps = params == null || params.length == 0 ? null : params.clone();
    return intern(op, sortOf(op, ps, children), ps, null, children);
  }

  /** Rebuilds {@code t} with new children, keeping operator, sort and parameters. */
  public Term mkAppLike(Term t, List<Term> args) {
    if (args.isEmpty()) return t;
    return mkApp(t.op(), t.params(), args);
  }

  /**
   * The range sort of {@code op} applied to {@code args}. Throws {@link IllegalArgumentException}
   * on an arity or sort mismatch.
   */
  public Sort sortOf(Op op, int[] params, List<Term> args) {
    final int n = args.size();
    switch (op) {
      case EQ -> {
        checkArity(op, n, 2, 2);
        checkSame(op, args.get(0).sort(), args.get(1).sort());
        return Sort.BOOL;
      }
      case NOT -> {
        checkArity(op, n, 1, 1);
        checkSorts(op, args, Sort.BOOL);
        return Sort.BOOL;
      }
      case AND, OR -> {
        checkSorts(op, args, Sort.BOOL);
        return Sort.BOOL;
      }
      case ITE -> {
        checkArity(op, n, 3, 3);
        checkSame(op, Sort.BOOL, args.get(0).sort());
        checkSame(op, args.get(1).sort(), args.get(2).sort());
        return args.get(1).sort();
      }
      case SELECT -> {
        checkArity(op, n, 2, 2);
        if (!args.get(0).sort().isPred()) throw mismatch(op, args);
        checkSame(op, args.get(0).sort().elem(), args.get(1).sort());
        return Sort.BOOL;
      }
      case ADD, SUB, MUL -> {
        checkArity(op, n, 1, Integer.MAX_VALUE);
        checkSorts(op, args, Sort.INT);
        return Sort.INT;
      }
      case LE, GE, LT -> {
        checkArity(op, n, 2, 2);
        checkSorts(op, args, Sort.INT);
        return Sort.BOOL;
      }
      case CHAR_LE -> {
        checkArity(op, n, 2, 2);
        checkSorts(op, args, Sort.CHAR);
        return Sort.BOOL;
      }
      case SEQ_UNIT -> {
        checkArity(op, n, 1, 1);
        return Sort.seq(args.get(0).sort());
      }
      case SEQ_CONCAT -> {
        checkArity(op, n, 1, Integer.MAX_VALUE);
        final Sort s = seqArg(op, args, 0);
        checkSorts(op, args, s);
        return s;
      }
      case SEQ_LENGTH -> {
        checkArity(op, n, 1, 1);
        seqArg(op, args, 0);
        return Sort.INT;
      }
      case SEQ_EXTRACT -> {
        checkArity(op, n, 3, 3);
        final Sort s = seqArg(op, args, 0);
        checkSame(op, Sort.INT, args.get(1).sort());
        checkSame(op, Sort.INT, args.get(2).sort());
        return s;
      }
      case SEQ_CONTAINS, SEQ_PREFIX, SEQ_SUFFIX -> {
        checkArity(op, n, 2, 2);
        checkSame(op, seqArg(op, args, 0), args.get(1).sort());
        return Sort.BOOL;
      }
      case SEQ_AT -> {
        checkArity(op, n, 2, 2);
        final Sort s = seqArg(op, args, 0);
        checkSame(op, Sort.INT, args.get(1).sort());
        return s;
      }
      case SEQ_NTH, SEQ_NTH_I, SEQ_NTH_U -> {
        checkArity(op, n, 2, 2);
        final Sort s = seqArg(op, args, 0);
        checkSame(op, Sort.INT, args.get(1).sort());
        return s.elem();
      }
      case SEQ_INDEX -> {
        checkArity(op, n, 2, 3);
        checkSame(op, seqArg(op, args, 0), args.get(1).sort());
        if (n == 3) checkSame(op, Sort.INT, args.get(2).sort());
        return Sort.INT;
      }
      case SEQ_LAST_INDEX -> {
        checkArity(op, n, 2, 2);
        checkSame(op, seqArg(op, args, 0), args.get(1).sort());
        return Sort.INT;
      }
      case SEQ_REPLACE -> {
        checkArity(op, n, 3, 3);
        final Sort s = seqArg(op, args, 0);
        checkSorts(op, args, s);
        return s;
      }
      case SEQ_SKOLEM -> {
        checkArity(op, n, 1, Integer.MAX_VALUE);
        return seqArg(op, args, 0);
      }
      case SEQ_TO_RE -> {
        checkArity(op, n, 1, 1);
        return Sort.re(seqArg(op, args, 0));
      }
      case SEQ_IN_RE -> {
        checkArity(op, n, 2, 2);
        checkSame(op, Sort.re(seqArg(op, args, 0)), args.get(1).sort());
        return Sort.BOOL;
      }
      case STRING_LT, STRING_LE -> {
        checkArity(op, n, 2, 2);
        checkSorts(op, args, Sort.STRING);
        return Sort.BOOL;
      }
      case STRING_ITOS, STRING_FROM_CODE -> {
        checkArity(op, n, 1, 1);
        checkSorts(op, args, Sort.INT);
        return Sort.STRING;
      }
      case STRING_STOI, STRING_TO_CODE -> {
        checkArity(op, n, 1, 1);
        checkSorts(op, args, Sort.STRING);
        return Sort.INT;
      }
      case STRING_IS_DIGIT -> {
        checkArity(op, n, 1, 1);
        checkSorts(op, args, Sort.STRING);
        return Sort.BOOL;
      }
      case RE_CONCAT, RE_UNION, RE_INTERSECT, RE_DIFF -> {
        checkArity(op, n, 1, Integer.MAX_VALUE);
        final Sort s = reArg(op, args, 0);
        checkSorts(op, args, s);
        return s;
      }
      case RE_COMPLEMENT, RE_STAR, RE_PLUS, RE_OPTION, RE_REVERSE -> {
        checkArity(op, n, 1, 1);
        return reArg(op, args, 0);
      }
      case RE_LOOP -> {
        checkArity(op, n, 1, 3);
        final Sort s = reArg(op, args, 0);
        for (int i = 1; i < n; ++i) checkSame(op, Sort.INT, args.get(i).sort());
        final int numParams = params == null ? 0 : params.length;
        if (n == 1 && (numParams < 1 || numParams > 2)) throw mismatch(op, args);
        if (n > 1 && numParams != 0) throw mismatch(op, args);
        return s;
      }
      case RE_POWER -> {
        checkArity(op, n, 1, 1);
        if (params == null || params.length != 1) throw mismatch(op, args);
        return reArg(op, args, 0);
      }
      case RE_RANGE -> {
        checkArity(op, n, 2, 2);
        checkSorts(op, args, Sort.STRING);
        return Sort.STRING_RE;
      }
      case RE_DERIVATIVE -> {
        checkArity(op, n, 2, 2);
        final Sort s = reArg(op, args, 1);
        checkSame(op, s.elem(), args.get(0).sort());
        return s;
      }
      case RE_OF_PRED -> {
        checkArity(op, n, 1, 1);
        if (!args.get(0).sort().isPred()) throw mismatch(op, args);
        return Sort.re(Sort.seq(args.get(0).sort().elem()));
      }
      default -> throw new IllegalArgumentException(op + " cannot be built by application");
    }
  }

  private static void checkArity(Op op, int n, int min, int max) {
    if (n < min || n > max)
      throw new IllegalArgumentException("wrong number of arguments for " + op + ": " + n);
  }

  private static void checkSame(Op op, Sort expected, Sort actual) {
    if (!expected.equals(actual))
      throw new IllegalArgumentException(
          "sort mismatch for " + op + ": expected " + expected + ", got " + actual);
  }

  private static void checkSorts(Op op, List<Term> args, Sort expected) {
    for (Term arg : args) checkSame(op, expected, arg.sort());
  }

  private static Sort seqArg(Op op, List<Term> args, int i) {
    final Sort s = args.get(i).sort();
    if (!s.isSeq()) throw mismatch(op, args);
    return s;
  }

  private static Sort reArg(Op op, List<Term> args, int i) {
    final Sort s = args.get(i).sort();
    if (!s.isRe()) throw mismatch(op, args);
    return s;
  }

  private static IllegalArgumentException mismatch(Op op, List<Term> args) {
    return new IllegalArgumentException("ill-sorted application of " + op + " to " + args);
  }

  /** Replaces every occurrence of {@code from} in {@code t} with {@code to}. */
  public Term substitute(Term t, Term from, Term to) {
    if (!from.sort().equals(to.sort()))
      throw new IllegalArgumentException("substitution changes sort: " + from + " := " + to);
    return substitute(t, from, to, new IdentityHashMap<>());
  }

  private Term substitute(Term t, Term from, Term to, Map<Term, Term> memo) {
    if (t == from) return to;
    if (t.numArgs() == 0) return t;
    final Term cached = memo.get(t);
    if (cached != null) return cached;

    final List<Term> args = new ArrayList<>(t.numArgs());
    boolean changed = false;
    for (Term arg : t.args()) {
      final Term newArg = substitute(arg, from, to, memo);
      changed |= newArg != arg;
      args.add(newArg);
    }
    final Term result = changed ? mkAppLike(t, args) : t;
    memo.put(t, result);
    return result;
  }

  private static final class Key {
    private final Op op;
    private final Sort sort;
    private final int[] params;
    private final Object payload;
    private final int[] argIds;
    private final int hash;

    private Key(Op op, Sort sort, int[] params, Object payload, List<Term> args) {
      this.op = op;
      this.sort = sort;
      this.params = params;
      this.payload = payload;
      this.argIds = new int[args.size()];
      for (int i = 0; i < argIds.length; ++i) argIds[i] = args.get(i).id();
      this.hash =
          Objects.hash(op, sort, payload)
              + 31 * Arrays.hashCode(params)
              + 961 * Arrays.hashCode(argIds);
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof Key)) return false;
      final Key that = (Key) o;
      return op == that.op
          && hash == that.hash
          && sort.equals(that.sort)
          && Arrays.equals(params, that.params)
          && Objects.equals(payload, that.payload)
          && Arrays.equals(argIds, that.argIds);
    }

    @Override
    public int hashCode() {
      return hash;
    }
  }
}
