package seqrw.rewriter.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import seqrw.term.Op;
import seqrw.term.Term;

import java.util.HashMap;
import java.util.Map;

/**
 * Memo table keyed by an operator tag and up to three operands (null for absent ones). Operands are
 * compared by identity. When an insert finds the table at capacity the table is emptied first.
 */
public class OpCache {
  private static final Logger LOG = LoggerFactory.getLogger(OpCache.class);

  private final int maxSize;
  private final Map<Key, Term> table;
  private int numResets;

  public OpCache(int maxSize) {
    if (maxSize <= 0) throw new IllegalArgumentException("cache size must be positive");
    this.maxSize = maxSize;
    this.table = new HashMap<>();
  }

  public Term find(Op op, Term a, Term b, Term c) {
    return table.get(new Key(op, a, b, c));
  }

  public void insert(Op op, Term a, Term b, Term c, Term result) {
    cleanup();
    table.put(new Key(op, a, b, c), result);
  }

  public void reset() {
    table.clear();
  }

  public int size() {
    return table.size();
  }

  public int numResets() {
    return numResets;
  }

  private void cleanup() {
    if (table.size() >= maxSize) {
      LOG.debug("op cache reached {} entries, resetting", table.size());
      table.clear();
      ++numResets;
    }
  }

  private static final class Key {
    private final Op op;
    private final Term a, b, c;

    private Key(Op op, Term a, Term b, Term c) {
      this.op = op;
      this.a = a;
      this.b = b;
      this.c = c;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof Key)) return false;
      final Key that = (Key) o;
      return op == that.op && a == that.a && b == that.b && c == that.c;
    }

    @Override
    public int hashCode() {
      int h = op.hashCode();
      h = 31 * h + (a == null ? 0 : a.id());
      h = 31 * h + (b == null ? 0 : b.id() + 1);
      h = 31 * h + (c == null ? 0 : c.id() + 2);
      return h;
    }
  }
}
