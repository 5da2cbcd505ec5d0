package seqrw.rewriter.wordeq;

import org.apache.commons.lang3.tuple.Pair;
import seqrw.term.Term;

import java.util.List;

/** Outcome of reducing a word equation. */
public final class WordEquationResult {
  public enum Kind {
    /** The equation has no solution. */
    REFUTED,
    /** The equation is equivalent to the conjunction of {@link #equations()}. */
    SIMPLIFIED,
    UNCHANGED
  }

  private static final WordEquationResult REFUTED = new WordEquationResult(Kind.REFUTED, List.of());
  private static final WordEquationResult UNCHANGED =
      new WordEquationResult(Kind.UNCHANGED, List.of());

  private final Kind kind;
  private final List<Pair<Term, Term>> equations;

  private WordEquationResult(Kind kind, List<Pair<Term, Term>> equations) {
    this.kind = kind;
    this.equations = equations;
  }

  public static WordEquationResult refuted() {
    return REFUTED;
  }

  public static WordEquationResult unchanged() {
    return UNCHANGED;
  }

  public static WordEquationResult simplified(List<Pair<Term, Term>> equations) {
    return new WordEquationResult(Kind.SIMPLIFIED, List.copyOf(equations));
  }

  public Kind kind() {
    return kind;
  }

  public List<Pair<Term, Term>> equations() {
    return equations;
  }

  @Override
  public String toString() {
    return kind == Kind.SIMPLIFIED ? kind + " " + equations : kind.toString();
  }
}
