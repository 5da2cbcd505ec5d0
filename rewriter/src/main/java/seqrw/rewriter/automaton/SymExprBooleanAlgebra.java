package seqrw.rewriter.automaton;

import seqrw.term.Op;
import seqrw.term.Sort;
import seqrw.term.Term;
import seqrw.term.TermManager;

import static seqrw.term.TermSupport.areDistinct;
import static seqrw.term.TermSupport.charOf;
import static seqrw.term.TermSupport.isFalse;
import static seqrw.term.TermSupport.isTrue;

public class SymExprBooleanAlgebra implements BooleanAlgebra<SymExpr> {
  private final TermManager mgr;
  private final ExprSolver solver;
  private final Sort sort;
  private Term var;

  public SymExprBooleanAlgebra(TermManager mgr, ExprSolver solver, Sort sort) {
    this.mgr = mgr;
    this.solver = solver;
    this.sort = sort;
  }

  @Override
  public SymExpr mkTrue() {
    return SymExpr.mkPred(mgr.mkTrue(), sort);
  }

  @Override
  public SymExpr mkFalse() {
    return SymExpr.mkPred(mgr.mkFalse(), sort);
  }

  @Override
  public SymExpr mkAnd(SymExpr x, SymExpr y) {
    if (x.isChar() && y.isChar()) {
      if (x.getChar() == y.getChar()) return x;
      if (areDistinct(x.getChar(), y.getChar())) return mkFalse();
    }
    if (x.isConstRange() && y.isConstRange()) {
      final int lo = Math.max(charOf(x.getLo()), charOf(y.getLo()));
      final int hi = Math.min(charOf(x.getHi()), charOf(y.getHi()));
      if (lo > hi) return mkFalse();
      return SymExpr.mkRange(mgr.mkChar(lo), mgr.mkChar(hi));
    }

    final Term v = mgr.mkBoundVar(0, x.sort());
    final Term fml1 = x.accept(mgr, v);
    final Term fml2 = y.accept(mgr, v);
    if (isTrue(fml1)) return y;
    if (isTrue(fml2)) return x;
    if (fml1 == fml2) return x;
    if (isComplement(fml1, fml2)) return mkFalse();
    return SymExpr.mkPred(mgr.mkAnd(fml1, fml2), x.sort());
  }

  @Override
  public SymExpr mkOr(SymExpr x, SymExpr y) {
    if (x.isChar() && y.isChar() && x.getChar() == y.getChar()) return x;
    if (x == y) return x;

    final Term v = mgr.mkBoundVar(0, x.sort());
    final Term fml1 = x.accept(mgr, v);
    final Term fml2 = y.accept(mgr, v);
    if (isFalse(fml1)) return y;
    if (isFalse(fml2)) return x;
    return SymExpr.mkPred(mgr.mkOr(fml1, fml2), x.sort());
  }

  @Override
  public SymExpr mkNot(SymExpr x) {
    return SymExpr.mkNot(x);
  }

  @Override
  public Lbool isSat(SymExpr x) {
    if (x.isChar()) return Lbool.TRUE;
    if (x.isConstRange()) return Lbool.of(charOf(x.getLo()) <= charOf(x.getHi()));
    if (x.isNot() && x.getArg().isConstRange()) {
      final SymExpr r = x.getArg();
      if (charOf(r.getLo()) > 0 || charOf(r.getHi()) < TermManager.MAX_CHAR) return Lbool.TRUE;
    }

    if (var == null || !var.sort().equals(x.sort())) var = mgr.mkFreshConst("x", x.sort());
    final Term fml = x.accept(mgr, var);
    if (isTrue(fml)) return Lbool.TRUE;
    if (isFalse(fml)) return Lbool.FALSE;
    return solver.checkSat(fml);
  }

  private static boolean isComplement(Term a, Term b) {
    return (a.is(Op.NOT) && a.arg(0) == b) || (b.is(Op.NOT) && b.arg(0) == a);
  }
}
