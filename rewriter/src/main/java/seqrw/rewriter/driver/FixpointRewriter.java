package seqrw.rewriter.driver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import seqrw.rewriter.RewriteResult;
import seqrw.rewriter.SeqRewriter;
import seqrw.term.Op;
import seqrw.term.Term;
import seqrw.term.TermManager;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rewrites a term bottom-up until no rule applies. Sequence operators go to a {@link SeqRewriter},
 * everything else to a {@link BasicSimplifier}. Every result that asks to be rewritten again is
 * rewritten in full.
 *
 * <p>The traversal keeps its own stack, so the depth of a term is not limited by the call stack.
 */
public class FixpointRewriter {
  private static final Logger LOG = LoggerFactory.getLogger(FixpointRewriter.class);

  public static final int DEFAULT_MAX_STEPS = 1_000_000;

  private final TermManager mgr;
  private final SeqRewriter seq;
  private final BasicSimplifier basic;
  private final int maxSteps;

  public FixpointRewriter(SeqRewriter seq) {
    this(seq, DEFAULT_MAX_STEPS);
  }

  public FixpointRewriter(SeqRewriter seq, int maxSteps) {
    if (maxSteps <= 0) throw new IllegalArgumentException("step budget must be positive");
    this.mgr = seq.mgr();
    this.seq = seq;
    this.basic = new BasicSimplifier(mgr);
    this.maxSteps = maxSteps;
  }

  /**
   * The normal form of {@code root}. Null when cancelled. Throws {@link IllegalStateException} when
   * the step budget runs out, which signals a rule cycle.
   */
  public Term rewrite(Term root) {
    final Map<Term, Term> memo = new IdentityHashMap<>();
    // a node whose rule fired, mapped to the result still being normalized
    final Map<Term, Term> pending = new IdentityHashMap<>();
    final Deque<Term> stack = new ArrayDeque<>();
    stack.push(root);
    int steps = 0;

    while (!stack.isEmpty()) {
      if (seq.isCancelled()) {
        LOG.debug("cancelled after {} steps", steps);
        return null;
      }
      if (++steps > maxSteps)
        throw new IllegalStateException("no fixpoint after " + maxSteps + " steps: " + root);

      final Term t = stack.peek();
      if (memo.containsKey(t)) {
        stack.pop();
        continue;
      }

      final Term next = pending.get(t);
      if (next != null) {
        final Term nf = memo.get(next);
        if (nf != null) {
          memo.put(t, nf);
          pending.remove(t);
          stack.pop();
        } else {
          stack.push(next);
        }
        continue;
      }

      boolean ready = true;
      for (int i = t.numArgs() - 1; i >= 0; --i) {
        if (!memo.containsKey(t.arg(i))) {
          stack.push(t.arg(i));
          ready = false;
        }
      }
      if (!ready) continue;

      final List<Term> args = new ArrayList<>(t.numArgs());
      boolean changed = false;
      for (Term arg : t.args()) {
        final Term nf = memo.get(arg);
        changed |= nf != arg;
        args.add(nf);
      }
      final Term app = changed ? mgr.mkAppLike(t, args) : t;
      final RewriteResult r = step(app);

      if (r.isFailed()) {
        memo.put(t, app);
        memo.put(app, app);
        stack.pop();
      } else if (r.result() == app) {
        memo.put(t, app);
        memo.put(app, app);
        stack.pop();
      } else {
        pending.put(t, r.result());
        if (app != t) pending.put(app, r.result());
      }
    }
    return memo.get(root);
  }

  private RewriteResult step(Term t) {
    final Op op = t.op();
    if (op.isSeqFamily()) return seq.rewrite(t);

    switch (op) {
      case EQ: {
        final Term a = t.arg(0), b = t.arg(1);
        if (a.sort().isSeq() || a.sort().isRe()) {
          final RewriteResult r = seq.mkEqCore(a, b);
          if (!r.isFailed()) return r;
        }
        return basic.simplify(t);
      }
      case AND:
      case OR: {
        final RewriteResult r = seq.mkBoolApp(op, t.args());
        return r.isFailed() ? basic.simplify(t) : r;
      }
      case ITE: {
        if (t.sort().isRe()) {
          final RewriteResult r = seq.rewriteReIte(t.arg(0), t.arg(1), t.arg(2));
          if (!r.isFailed()) return r;
        }
        return basic.simplify(t);
      }
      default:
        return basic.simplify(t);
    }
  }
}
