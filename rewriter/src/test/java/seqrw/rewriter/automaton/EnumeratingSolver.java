package seqrw.rewriter.automaton;

import seqrw.term.Term;
import seqrw.term.TermManager;

import java.util.HashSet;
import java.util.Set;

import static seqrw.term.TermSupport.charOf;

/**
 * Decides formulas over a single character constant by trying every character. Anything else is
 * left undecided.
 */
public class EnumeratingSolver implements ExprSolver {
  private int numChecks;

  public int numChecks() {
    return numChecks;
  }

  @Override
  public Lbool checkSat(Term fml) {
    ++numChecks;
    final Set<Term> vars = new HashSet<>();
    if (!collectVars(fml, vars) || vars.size() > 1) return Lbool.UNDEF;
    final Term var = vars.isEmpty() ? null : vars.iterator().next();
    if (var == null) return Lbool.of(eval(fml, null, 0));
    for (int c = 0; c <= TermManager.MAX_CHAR; ++c) {
      if (eval(fml, var, c)) return Lbool.TRUE;
    }
    return Lbool.FALSE;
  }

  private static boolean collectVars(Term t, Set<Term> vars) {
    switch (t.op()) {
      case VAR:
        if (!t.sort().isChar()) return false;
        vars.add(t);
        return true;
      case TRUE:
      case FALSE:
      case CHAR_CONST:
        return true;
      case EQ:
      case NOT:
      case AND:
      case OR:
      case CHAR_LE:
        for (Term arg : t.args()) if (!collectVars(arg, vars)) return false;
        return true;
      default:
        return false;
    }
  }

  private static boolean eval(Term t, Term var, int value) {
    switch (t.op()) {
      case TRUE:
        return true;
      case FALSE:
        return false;
      case NOT:
        return !eval(t.arg(0), var, value);
      case AND:
        for (Term arg : t.args()) if (!eval(arg, var, value)) return false;
        return true;
      case OR:
        for (Term arg : t.args()) if (eval(arg, var, value)) return true;
        return false;
      case EQ:
        if (t.arg(0).sort().isBool())
          return eval(t.arg(0), var, value) == eval(t.arg(1), var, value);
        return charValue(t.arg(0), var, value) == charValue(t.arg(1), var, value);
      case CHAR_LE:
        return charValue(t.arg(0), var, value) <= charValue(t.arg(1), var, value);
      default:
        throw new IllegalArgumentException("cannot evaluate " + t);
    }
  }

  private static int charValue(Term t, Term var, int value) {
    return t == var ? value : charOf(t);
  }
}
