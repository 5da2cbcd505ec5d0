package seqrw.rewriter.solver;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.BoolSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.IntExpr;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import seqrw.rewriter.automaton.ExprSolver;
import seqrw.rewriter.automaton.Lbool;
import seqrw.term.Op;
import seqrw.term.Sort;
import seqrw.term.Term;
import seqrw.term.TermManager;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link ExprSolver} backed by Z3. Characters are integers in {@code [0, MAX_CHAR]}, character
 * predicates are uninterpreted functions. Formulas mentioning anything else are reported as
 * undecided.
 */
public class Z3ExprSolver implements ExprSolver {
  private static final Logger LOG = LoggerFactory.getLogger(Z3ExprSolver.class);

  public static final int DEFAULT_TIMEOUT = 2000;

  private final int timeout;
  private int numChecks;

  public Z3ExprSolver() {
    this(DEFAULT_TIMEOUT);
  }

  public Z3ExprSolver(int timeoutMillis) {
    this.timeout = timeoutMillis;
  }

  public int numChecks() {
    return numChecks;
  }

  @Override
  public Lbool checkSat(Term fml) {
    ++numChecks;
    try (final Context ctx = new Context()) {
      final Translator translator = new Translator(ctx);
      final BoolExpr target;
      try {
        target = translator.bool(fml);
      } catch (UnsupportedOperationException ex) {
        LOG.debug("cannot hand {} to z3: {}", fml, ex.getMessage());
        return Lbool.UNDEF;
      }

      final Solver s = ctx.mkSolver();
      final Params params = ctx.mkParams();
      params.add("timeout", timeout);
      s.setParameters(params);
      final List<BoolExpr> assertions = new ArrayList<>(translator.sideConditions);
      assertions.add(target);
      s.add(assertions.toArray(new BoolExpr[0]));

      final Status q = s.check();
      if (q == Status.SATISFIABLE) return Lbool.TRUE;
      if (q == Status.UNSATISFIABLE) return Lbool.FALSE;
      LOG.debug("z3 returned unknown for {}: {}", fml, s.getReasonUnknown());
      return Lbool.UNDEF;
    }
  }

  // booleans become BoolExpr, integers and characters IntExpr
  private static final class Translator {
    private final Context ctx;
    private final Map<Term, Expr<?>> memo = new HashMap<>();
    private final Map<String, FuncDecl<BoolSort>> preds = new HashMap<>();
    private final List<BoolExpr> sideConditions = new ArrayList<>();

    private Translator(Context ctx) {
      this.ctx = ctx;
    }

    private BoolExpr bool(Term t) {
      if (!t.sort().isBool()) throw new UnsupportedOperationException("not a formula: " + t);
      final Expr<?> cached = memo.get(t);
      if (cached != null) return (BoolExpr) cached;
      final BoolExpr e = bool0(t);
      memo.put(t, e);
      return e;
    }

    private IntExpr integer(Term t) {
      if (!t.sort().equals(Sort.INT) && !t.sort().equals(Sort.CHAR))
        throw new UnsupportedOperationException("term of sort " + t.sort());
      final Expr<?> cached = memo.get(t);
      if (cached != null) return (IntExpr) cached;
      final IntExpr e = integer0(t);
      memo.put(t, e);
      return e;
    }

    private BoolExpr bool0(Term t) {
      switch (t.op()) {
        case TRUE:
          return ctx.mkTrue();
        case FALSE:
          return ctx.mkFalse();
        case VAR:
          return ctx.mkBoolConst((String) t.payload());
        case EQ: {
          final Term a = t.arg(0), b = t.arg(1);
          if (a.sort().isBool()) return ctx.mkEq(bool(a), bool(b));
          return ctx.mkEq(integer(a), integer(b));
        }
        case NOT:
          return ctx.mkNot(bool(t.arg(0)));
        case AND:
          return ctx.mkAnd(bools(t.args()));
        case OR:
          return ctx.mkOr(bools(t.args()));
        case ITE:
          return (BoolExpr) ctx.mkITE(bool(t.arg(0)), bool(t.arg(1)), bool(t.arg(2)));
        case LE:
        case CHAR_LE:
          return ctx.mkLe(integer(t.arg(0)), integer(t.arg(1)));
        case GE:
          return ctx.mkGe(integer(t.arg(0)), integer(t.arg(1)));
        case LT:
          return ctx.mkLt(integer(t.arg(0)), integer(t.arg(1)));
        case SELECT: {
          final Term pred = t.arg(0);
          if (!pred.is(Op.VAR))
            throw new UnsupportedOperationException("predicate " + pred);
          final FuncDecl<BoolSort> f =
              preds.computeIfAbsent(
                  (String) pred.payload(),
                  name -> ctx.mkFuncDecl(name, ctx.getIntSort(), ctx.getBoolSort()));
          return (BoolExpr) ctx.mkApp(f, integer(t.arg(1)));
        }
        default:
          throw new UnsupportedOperationException(t.op().symbol());
      }
    }

    private IntExpr integer0(Term t) {
      switch (t.op()) {
        case INT_NUM:
          return ctx.mkInt(t.payload().toString());
        case CHAR_CONST:
          return ctx.mkInt((Integer) t.payload());
        case VAR: {
          final IntExpr c = ctx.mkIntConst((String) t.payload());
          if (t.sort().equals(Sort.CHAR)) {
            sideConditions.add(ctx.mkLe(ctx.mkInt(0), c));
            sideConditions.add(ctx.mkLe(c, ctx.mkInt(TermManager.MAX_CHAR)));
          }
          return c;
        }
        case ITE:
          return (IntExpr) ctx.mkITE(bool(t.arg(0)), integer(t.arg(1)), integer(t.arg(2)));
        case ADD:
          return (IntExpr) ctx.mkAdd(integers(t.args()));
        case SUB:
          return (IntExpr) ctx.mkSub(integers(t.args()));
        case MUL:
          return (IntExpr) ctx.mkMul(integers(t.args()));
        default:
          throw new UnsupportedOperationException(t.op().symbol());
      }
    }

    private BoolExpr[] bools(List<Term> ts) {
      final BoolExpr[] es = new BoolExpr[ts.size()];
      for (int i = 0; i < es.length; ++i) es[i] = bool(ts.get(i));
      return es;
    }

    private IntExpr[] integers(List<Term> ts) {
      final IntExpr[] es = new IntExpr[ts.size()];
      for (int i = 0; i < es.length; ++i) es[i] = integer(ts.get(i));
      return es;
    }
  }
}
