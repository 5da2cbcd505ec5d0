package seqrw.rewriter;

import seqrw.term.Term;

public final class RewriteResult {
  private static final RewriteResult FAILED = new RewriteResult(RewriteStatus.FAILED, null);

  private final RewriteStatus status;
  private final Term result;

  private RewriteResult(RewriteStatus status, Term result) {
    this.status = status;
    this.result = result;
  }

  public static RewriteResult failed() {
    return FAILED;
  }

  public static RewriteResult done(Term t) {
    return new RewriteResult(RewriteStatus.DONE, t);
  }

  public static RewriteResult rewrite1(Term t) {
    return new RewriteResult(RewriteStatus.REWRITE1, t);
  }

  public static RewriteResult rewrite2(Term t) {
    return new RewriteResult(RewriteStatus.REWRITE2, t);
  }

  public static RewriteResult rewrite3(Term t) {
    return new RewriteResult(RewriteStatus.REWRITE3, t);
  }

  public static RewriteResult rewriteFull(Term t) {
    return new RewriteResult(RewriteStatus.REWRITE_FULL, t);
  }

  public static RewriteResult of(RewriteStatus status, Term t) {
    if (status == RewriteStatus.FAILED) return FAILED;
    if (t == null) throw new IllegalArgumentException("missing result for " + status);
    return new RewriteResult(status, t);
  }

  public RewriteStatus status() {
    return status;
  }

  /** The rewritten term, null iff failed. */
  public Term result() {
    return result;
  }

  public boolean isFailed() {
    return status == RewriteStatus.FAILED;
  }

  @Override
  public String toString() {
    return isFailed() ? "FAILED" : status + " " + result;
  }
}
