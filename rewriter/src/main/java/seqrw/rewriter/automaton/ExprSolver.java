package seqrw.rewriter.automaton;

import seqrw.term.Term;

/** Satisfiability oracle for quantifier-free boolean terms over characters. */
public interface ExprSolver {
  /** UNDEF when the oracle cannot decide or does not understand the formula. */
  Lbool checkSat(Term fml);
}
