package seqrw.rewriter.automaton;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import seqrw.rewriter.automaton.SymbolicAutomaton.Move;
import seqrw.term.Op;
import seqrw.term.Sort;
import seqrw.term.Term;
import seqrw.term.TermManager;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

import static seqrw.term.TermSupport.isString;
import static seqrw.term.TermSupport.loopBounds;
import static seqrw.term.TermSupport.stringOf;

/**
 * Compiles a regex into a symbolic automaton. Complement and intersection are only compiled once a
 * solver was installed with {@link #setSolver}; without one, or for operators that have no
 * construction (derivatives, reversals, predicates, loops with symbolic bounds), {@link #compile}
 * returns null and callers fall back to derivatives.
 */
public class RegexToAutomaton {
  private static final Logger LOG = LoggerFactory.getLogger(RegexToAutomaton.class);

  private final TermManager mgr;
  private final BooleanSupplier cancelled;
  private SymExprBooleanAlgebra ba;
  private SymbolicAutomata<SymExpr> sa;

  public RegexToAutomaton(TermManager mgr) {
    this(mgr, () -> false);
  }

  public RegexToAutomaton(TermManager mgr, BooleanSupplier cancelled) {
    this.mgr = mgr;
    this.cancelled = cancelled;
  }

  public void setSolver(ExprSolver solver) {
    this.ba = new SymExprBooleanAlgebra(mgr, solver, Sort.CHAR);
    this.sa = new SymbolicAutomata<>(ba, cancelled);
  }

  public SymExprBooleanAlgebra booleanAlgebra() {
    return ba;
  }

  public SymbolicAutomaton<SymExpr> compile(Term r) {
    final SymbolicAutomaton<SymExpr> a = re2aut(r);
    if (a != null) {
      a.compress();
      LOG.trace("{} -->\n{}", r, a);
    }
    return a;
  }

  /** Intersection of two compiled automata. Null without a solver. */
  public SymbolicAutomaton<SymExpr> mkProduct(
      SymbolicAutomaton<SymExpr> a, SymbolicAutomaton<SymExpr> b) {
    return sa == null ? null : sa.mkProduct(a, b);
  }

  /** The word accepted by a linear automaton over character labels, otherwise null. */
  public Term sequenceOf(SymbolicAutomaton<SymExpr> a, Sort seqSort) {
    final List<SymExpr> labels = new ArrayList<>();
    if (!a.isSequence(labels)) return null;
    final List<Term> units = new ArrayList<>(labels.size());
    for (SymExpr label : labels) {
      if (!label.isChar()) return null;
      units.add(mgr.mkUnit(label.getChar()));
    }
    return mgr.mkConcat(units, seqSort);
  }

  private SymbolicAutomaton<SymExpr> re2aut(Term e) {
    if (!e.sort().isRe()) throw new IllegalArgumentException("not a regex: " + e);
    SymbolicAutomaton<SymExpr> a, b;
    switch (e.op()) {
      case SEQ_TO_RE:
        return seq2aut(e.arg(0));

      case RE_CONCAT:
      case RE_UNION: {
        SymbolicAutomaton<SymExpr> acc = re2aut(e.arg(0));
        for (int i = 1; acc != null && i < e.numArgs(); ++i) {
          final SymbolicAutomaton<SymExpr> next = re2aut(e.arg(i));
          if (next == null) return null;
          acc =
              e.is(Op.RE_CONCAT)
                  ? SymbolicAutomaton.mkConcat(acc, next)
                  : SymbolicAutomaton.mkUnion(acc, next);
        }
        return acc;
      }

      case RE_STAR:
        if ((a = re2aut(e.arg(0))) == null) return null;
        a.addFinalToInitMoves();
        a.addInitToFinalStates();
        return a;

      case RE_PLUS:
        if ((a = re2aut(e.arg(0))) == null) return null;
        a.addFinalToInitMoves();
        return a;

      case RE_OPTION:
        if ((a = re2aut(e.arg(0))) == null) return null;
        return SymbolicAutomaton.mkOpt(a);

      case RE_RANGE: {
        final Term lo = unitChar(e.arg(0)), hi = unitChar(e.arg(1));
        if (lo != null && hi != null) return SymbolicAutomaton.mkSingle(SymExpr.mkRange(lo, hi));
        // a range over literal bounds other than single characters denotes the empty language
        if (isString(e.arg(0)) && isString(e.arg(1))) return SymbolicAutomaton.mkEmpty();
        return null;
      }

      case RE_COMPLEMENT:
        if (sa == null || (a = re2aut(e.arg(0))) == null) return null;
        return sa.mkComplement(a);

      case RE_LOOP: {
        final int[] bounds = loopBounds(e);
        if (bounds == null) return null;
        if (bounds.length == 2 && bounds[0] > bounds[1]) return SymbolicAutomaton.mkEmpty();
        if ((a = re2aut(e.arg(0))) == null) return null;
        int lo = bounds[0];
        if (bounds.length == 2) {
          int hi = bounds[1];
          final SymbolicAutomaton<SymExpr> eps = SymbolicAutomaton.mkEpsilon();
          SymbolicAutomaton<SymExpr> acc = SymbolicAutomaton.mkEpsilon();
          while (hi > lo) {
            acc = SymbolicAutomaton.mkUnion(eps, SymbolicAutomaton.mkConcat(a, acc));
            --hi;
          }
          while (lo > 0) {
            acc = SymbolicAutomaton.mkConcat(a, acc);
            --lo;
          }
          return acc;
        }
        SymbolicAutomaton<SymExpr> acc = SymbolicAutomaton.copyOf(a);
        acc.addFinalToInitMoves();
        acc.addInitToFinalStates();
        while (lo > 0) {
          acc = SymbolicAutomaton.mkConcat(a, acc);
          --lo;
        }
        return acc;
      }

      case RE_EMPTY:
        return SymbolicAutomaton.mkEmpty();

      case RE_FULL_SEQ:
        return SymbolicAutomaton.mkLoop(SymExpr.mkPred(mgr.mkTrue(), e.sort().elem()));

      case RE_FULL_CHAR:
        return SymbolicAutomaton.mkSingle(SymExpr.mkPred(mgr.mkTrue(), e.sort().elem()));

      case RE_INTERSECT:
        if (sa == null || (a = re2aut(e.arg(0))) == null || (b = re2aut(e.arg(1))) == null)
          return null;
        return sa.mkProduct(a, b);

      default:
        LOG.trace("not handled {}", e);
        return null;
    }
  }

  private SymbolicAutomaton<SymExpr> seq2aut(Term e) {
    final String s = stringOf(e);
    if (s != null) {
      final List<Move<SymExpr>> moves = new ArrayList<>(s.length());
      for (int k = 0; k < s.length(); ++k)
        moves.add(new Move<>(k, k + 1, SymExpr.mkChar(mgr.mkChar(s.charAt(k)))));
      return new SymbolicAutomaton<>(0, List.of(s.length()), moves);
    }
    switch (e.op()) {
      case SEQ_CONCAT: {
        SymbolicAutomaton<SymExpr> acc = seq2aut(e.arg(0));
        for (int i = 1; acc != null && i < e.numArgs(); ++i) {
          final SymbolicAutomaton<SymExpr> next = seq2aut(e.arg(i));
          acc = next == null ? null : SymbolicAutomaton.mkConcat(acc, next);
        }
        return acc;
      }
      case SEQ_UNIT:
        return SymbolicAutomaton.mkSingle(SymExpr.mkChar(e.arg(0)));
      case SEQ_EMPTY:
        return SymbolicAutomaton.mkEpsilon();
      default:
        return null;
    }
  }

  private Term unitChar(Term e) {
    final String s = stringOf(e);
    if (s != null && s.length() == 1) return mgr.mkChar(s.charAt(0));
    if (e.is(Op.SEQ_UNIT)) return e.arg(0);
    return null;
  }
}
