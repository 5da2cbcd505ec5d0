package seqrw.rewriter;

/**
 * Outcome of one rewrite step. The REWRITE levels tell the driver how deep into the result it must
 * rewrite again; FULL means the whole result.
 */
public enum RewriteStatus {
  FAILED,
  DONE,
  REWRITE1,
  REWRITE2,
  REWRITE3,
  REWRITE_FULL;

  public boolean isRewriteAgain() {
    return this != FAILED && this != DONE;
  }
}
