package seqrw.rewriter.automaton;

import seqrw.term.Sort;
import seqrw.term.Term;
import seqrw.term.TermManager;

import static seqrw.term.TermSupport.charOf;
import static seqrw.term.TermSupport.isConstChar;

/**
 * Transition label of a symbolic automaton: a single character, a character range, a negation, or
 * an arbitrary predicate over bound variable 0.
 */
public final class SymExpr {
  public enum Kind {
    CHAR,
    RANGE,
    NOT,
    PRED;
  }

  private final Kind kind;
  private final Sort sort;
  // CHAR: the character; RANGE: lower bound; PRED: the formula
  private final Term t;
  private final Term hi;
  private final SymExpr inner;

  private SymExpr(Kind kind, Sort sort, Term t, Term hi, SymExpr inner) {
    this.kind = kind;
    this.sort = sort;
    this.t = t;
    this.hi = hi;
    this.inner = inner;
  }

  public static SymExpr mkChar(Term ch) {
    return new SymExpr(Kind.CHAR, ch.sort(), ch, null, null);
  }

  public static SymExpr mkRange(Term lo, Term hi) {
    if (!lo.sort().equals(hi.sort()))
      throw new IllegalArgumentException("range bounds of different sorts");
    return new SymExpr(Kind.RANGE, lo.sort(), lo, hi, null);
  }

  public static SymExpr mkNot(SymExpr x) {
    return new SymExpr(Kind.NOT, x.sort, null, null, x);
  }

  /** {@code fml} is a boolean term over the bound variable 0 of sort {@code sort}. */
  public static SymExpr mkPred(Term fml, Sort sort) {
    if (!fml.sort().isBool()) throw new IllegalArgumentException("predicate must be boolean");
    return new SymExpr(Kind.PRED, sort, fml, null, null);
  }

  public Kind kind() {
    return kind;
  }

  public Sort sort() {
    return sort;
  }

  public boolean isChar() {
    return kind == Kind.CHAR;
  }

  public boolean isRange() {
    return kind == Kind.RANGE;
  }

  public boolean isNot() {
    return kind == Kind.NOT;
  }

  public boolean isPred() {
    return kind == Kind.PRED;
  }

  public Term getChar() {
    assert isChar();
    return t;
  }

  public Term getLo() {
    assert isRange();
    return t;
  }

  public Term getHi() {
    assert isRange();
    return hi;
  }

  public SymExpr getArg() {
    assert isNot();
    return inner;
  }

  public Term getPred() {
    assert isPred();
    return t;
  }

  /** Both bounds of a range are character constants. */
  public boolean isConstRange() {
    return isRange() && isConstChar(t) && isConstChar(hi);
  }

  /** The formula stating that {@code e} satisfies this label. */
  public Term accept(TermManager mgr, Term e) {
    switch (kind) {
      case CHAR:
        if (isConstChar(t) && isConstChar(e)) return mgr.mkBool(charOf(t) == charOf(e));
        return mgr.mkEq(e, t);
      case RANGE:
        if (isConstRange() && isConstChar(e)) {
          final int c = charOf(e);
          return mgr.mkBool(charOf(t) <= c && c <= charOf(hi));
        }
        return mgr.mkAnd(mgr.mkCharLe(t, e), mgr.mkCharLe(e, hi));
      case NOT:
        return mgr.mkNot(inner.accept(mgr, e));
      case PRED:
        return mgr.substitute(t, mgr.mkBoundVar(0, sort), e);
      default:
        throw new IllegalStateException();
    }
  }

  @Override
  public String toString() {
    return switch (kind) {
      case CHAR -> t.toString();
      case RANGE -> "[" + t + "-" + hi + "]";
      case NOT -> "not " + inner;
      case PRED -> t.toString();
    };
  }
}
