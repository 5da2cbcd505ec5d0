package seqrw.term;

import com.google.common.collect.ImmutableList;

/**
 * A node in a {@link TermManager}'s arena. Nodes are interned, so two terms are the same expression
 * iff they are the same object. {@link #id()} is dense, assigned in creation order and never
 * reused within a manager.
 */
public final class Term {
  private static final int[] NO_PARAMS = new int[0];

  private final int id;
  private final Op op;
  private final Sort sort;
  private final ImmutableList<Term> args;
  private final int[] params;
  // VAR: name; STRING_CONST: value; CHAR_CONST, BOUND_VAR: Integer; INT_NUM: BigInteger
  private final Object payload;

  Term(int id, Op op, Sort sort, ImmutableList<Term> args, int[] params, Object payload) {
    this.id = id;
    this.op = op;
    this.sort = sort;
    this.args = args;
    this.params = params == null ? NO_PARAMS : params;
    this.payload = payload;
  }

  public int id() {
    return id;
  }

  public Op op() {
    return op;
  }

  public Sort sort() {
    return sort;
  }

  public boolean is(Op op) {
    return this.op == op;
  }

  public ImmutableList<Term> args() {
    return args;
  }

  public Term arg(int i) {
    return args.get(i);
  }

  public int numArgs() {
    return args.size();
  }

  public int numParams() {
    return params.length;
  }

  public int param(int i) {
    return params[i];
  }

  int[] params() {
    return params;
  }

  /** A copy of the integer parameters. */
  public int[] paramsCopy() {
    return params.clone();
  }

  public Object payload() {
    return payload;
  }

  @Override
  public String toString() {
    return TermPrinter.print(this);
  }
}
