package seqrw.rewriter.automaton;

public enum Lbool {
  TRUE,
  FALSE,
  UNDEF;

  public static Lbool of(boolean b) {
    return b ? TRUE : FALSE;
  }
}
