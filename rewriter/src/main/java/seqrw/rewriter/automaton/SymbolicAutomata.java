package seqrw.rewriter.automaton;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import seqrw.rewriter.automaton.SymbolicAutomaton.Move;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

/** Operations that need to reason about labels, hence a {@link BooleanAlgebra}. */
public class SymbolicAutomata<T> {
  private static final Logger LOG = LoggerFactory.getLogger(SymbolicAutomata.class);

  private final BooleanAlgebra<T> ba;
  private final BooleanSupplier cancelled;

  public SymbolicAutomata(BooleanAlgebra<T> ba, BooleanSupplier cancelled) {
    this.ba = ba;
    this.cancelled = cancelled;
  }

  /** Intersection. Null on cancellation. */
  public SymbolicAutomaton<T> mkProduct(SymbolicAutomaton<T> a0, SymbolicAutomaton<T> b0) {
    final SymbolicAutomaton<T> a = a0.removeEpsilons(), b = b0.removeEpsilons();
    final Map<Long, Integer> stateIds = new HashMap<>();
    final List<long[]> pairs = new ArrayList<>();
    final List<Move<T>> moves = new ArrayList<>();
    final List<Integer> finals = new ArrayList<>();
    final Deque<Integer> todo = new ArrayDeque<>();

    pairs.add(new long[] {a.initialState(), b.initialState()});
    stateIds.put(pairKey(a.initialState(), b.initialState()), 0);
    todo.push(0);

    while (!todo.isEmpty()) {
      if (cancelled.getAsBoolean()) return null;
      final int id = todo.pop();
      final int sa = (int) pairs.get(id)[0], sb = (int) pairs.get(id)[1];
      if (a.isFinalState(sa) && b.isFinalState(sb)) finals.add(id);

      for (Move<T> ma : a.movesFrom(sa)) {
        for (Move<T> mb : b.movesFrom(sb)) {
          final T label = ba.mkAnd(ma.label(), mb.label());
          if (ba.isSat(label) == Lbool.FALSE) continue;

          final long key = pairKey(ma.dst(), mb.dst());
          Integer dst = stateIds.get(key);
          if (dst == null) {
            dst = pairs.size();
            pairs.add(new long[] {ma.dst(), mb.dst()});
            stateIds.put(key, dst);
            todo.push(dst);
          }
          moves.add(new Move<>(id, dst, label));
        }
      }
    }

    final SymbolicAutomaton<T> product = new SymbolicAutomaton<>(0, finals, moves);
    product.compress();
    return product;
  }

  /**
   * Complement: determinize over the minterms of the outgoing labels, complete with a sink state
   * and flip finality. Null on cancellation or when some minterm cannot be decided.
   */
  public SymbolicAutomaton<T> mkComplement(SymbolicAutomaton<T> a0) {
    final SymbolicAutomaton<T> a = a0.removeEpsilons();
    final Map<BitSet, Integer> stateIds = new HashMap<>();
    final List<BitSet> subsets = new ArrayList<>();
    final List<Move<T>> moves = new ArrayList<>();
    final List<Integer> finals = new ArrayList<>();
    final Deque<Integer> todo = new ArrayDeque<>();

    final BitSet initSet = new BitSet();
    initSet.set(a.initialState());
    subsets.add(initSet);
    stateIds.put(initSet, 0);
    todo.push(0);

    while (!todo.isEmpty()) {
      if (cancelled.getAsBoolean()) return null;
      final int id = todo.pop();
      final BitSet subset = subsets.get(id);

      boolean accepting = false;
      final List<Move<T>> out = new ArrayList<>();
      for (int s = subset.nextSetBit(0); s >= 0; s = subset.nextSetBit(s + 1)) {
        accepting |= a.isFinalState(s);
        out.addAll(a.movesFrom(s));
      }
      if (!accepting) finals.add(id);

      final List<Minterm<T>> minterms = minterms(out);
      if (minterms == null) {
        LOG.debug("complement gave up on an undecided minterm");
        return null;
      }

      for (Minterm<T> mt : minterms) {
        final BitSet dstSet = new BitSet();
        for (int i = mt.moves.nextSetBit(0); i >= 0; i = mt.moves.nextSetBit(i + 1))
          dstSet.set(out.get(i).dst());

        Integer dst = stateIds.get(dstSet);
        if (dst == null) {
          dst = subsets.size();
          subsets.add(dstSet);
          stateIds.put(dstSet, dst);
          todo.push(dst);
        }
        moves.add(new Move<>(id, dst, mt.label));
      }
    }

    final SymbolicAutomaton<T> complement = new SymbolicAutomaton<>(0, finals, moves);
    complement.compress();
    return complement;
  }

  private List<Minterm<T>> minterms(List<Move<T>> out) {
    List<Minterm<T>> current = new ArrayList<>();
    current.add(new Minterm<>(ba.mkTrue(), new BitSet()));
    for (int i = 0; i < out.size(); ++i) {
      final T label = out.get(i).label();
      final List<Minterm<T>> next = new ArrayList<>();
      for (Minterm<T> mt : current) {
        final T pos = ba.mkAnd(mt.label, label);
        final T neg = ba.mkAnd(mt.label, ba.mkNot(label));
        final Lbool posSat = ba.isSat(pos), negSat = ba.isSat(neg);
        if (posSat == Lbool.UNDEF || negSat == Lbool.UNDEF) return null;
        if (posSat == Lbool.TRUE) {
          final BitSet ids = (BitSet) mt.moves.clone();
          ids.set(i);
          next.add(new Minterm<>(pos, ids));
        }
        if (negSat == Lbool.TRUE) next.add(new Minterm<>(neg, mt.moves));
      }
      current = next;
    }
    return current;
  }

  private static long pairKey(int a, int b) {
    return ((long) a << 32) | (b & 0xFFFFFFFFL);
  }

  private static final class Minterm<T> {
    private final T label;
    private final BitSet moves;

    private Minterm(T label, BitSet moves) {
      this.label = label;
      this.moves = moves;
    }
  }
}
