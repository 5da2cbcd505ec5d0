package seqrw.rewriter.automaton;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;

/**
 * Automaton over symbolic labels. States are {@code 0 .. numStates()-1}; a move with a null label
 * is an epsilon move. Instances are mutable; the static combinators never modify their inputs.
 */
public class SymbolicAutomaton<T> {
  public static final class Move<T> {
    private final int src, dst;
    private final T label;

    public Move(int src, int dst, T label) {
      this.src = src;
      this.dst = dst;
      this.label = label;
    }

    public int src() {
      return src;
    }

    public int dst() {
      return dst;
    }

    /** Null for an epsilon move. */
    public T label() {
      return label;
    }

    public boolean isEpsilon() {
      return label == null;
    }

    @Override
    public String toString() {
      return src + " -" + (label == null ? "ε" : label) + "-> " + dst;
    }
  }

  private int numStates;
  private int init;
  private final BitSet finals;
  private final List<Move<T>> moves;

  public SymbolicAutomaton(int init, List<Integer> finals, List<Move<T>> moves) {
    this.init = init;
    this.finals = new BitSet();
    this.moves = new ArrayList<>(moves);
    int n = init + 1;
    for (int f : finals) {
      this.finals.set(f);
      n = Math.max(n, f + 1);
    }
    for (Move<T> mv : moves) n = Math.max(n, Math.max(mv.src, mv.dst) + 1);
    this.numStates = n;
  }

  private SymbolicAutomaton(int numStates, int init, BitSet finals, List<Move<T>> moves) {
    this.numStates = numStates;
    this.init = init;
    this.finals = finals;
    this.moves = moves;
  }

  /** Accepts nothing. */
  public static <T> SymbolicAutomaton<T> mkEmpty() {
    return new SymbolicAutomaton<>(1, 0, new BitSet(), new ArrayList<>());
  }

  /** Accepts only the empty word. */
  public static <T> SymbolicAutomaton<T> mkEpsilon() {
    final BitSet finals = new BitSet();
    finals.set(0);
    return new SymbolicAutomaton<>(1, 0, finals, new ArrayList<>());
  }

  /** Accepts the one-letter words satisfying {@code label}. */
  public static <T> SymbolicAutomaton<T> mkSingle(T label) {
    final BitSet finals = new BitSet();
    finals.set(1);
    final List<Move<T>> moves = new ArrayList<>();
    moves.add(new Move<>(0, 1, label));
    return new SymbolicAutomaton<>(2, 0, finals, moves);
  }

  /** Accepts all words whose letters satisfy {@code label}. */
  public static <T> SymbolicAutomaton<T> mkLoop(T label) {
    final BitSet finals = new BitSet();
    finals.set(0);
    final List<Move<T>> moves = new ArrayList<>();
    moves.add(new Move<>(0, 0, label));
    return new SymbolicAutomaton<>(1, 0, finals, moves);
  }

  public static <T> SymbolicAutomaton<T> copyOf(SymbolicAutomaton<T> a) {
    return new SymbolicAutomaton<>(
        a.numStates, a.init, (BitSet) a.finals.clone(), new ArrayList<>(a.moves));
  }

  public static <T> SymbolicAutomaton<T> mkConcat(SymbolicAutomaton<T> a, SymbolicAutomaton<T> b) {
    if (a.finals.isEmpty() || b.finals.isEmpty()) return mkEmpty();

    final int offset = a.numStates;
    final List<Move<T>> moves = new ArrayList<>(a.moves);
    for (Move<T> mv : b.moves) moves.add(new Move<>(mv.src + offset, mv.dst + offset, mv.label));
    for (int f = a.finals.nextSetBit(0); f >= 0; f = a.finals.nextSetBit(f + 1))
      moves.add(new Move<>(f, b.init + offset, null));

    final BitSet finals = new BitSet();
    for (int f = b.finals.nextSetBit(0); f >= 0; f = b.finals.nextSetBit(f + 1))
      finals.set(f + offset);
    return new SymbolicAutomaton<>(a.numStates + b.numStates, a.init, finals, moves);
  }

  public static <T> SymbolicAutomaton<T> mkUnion(SymbolicAutomaton<T> a, SymbolicAutomaton<T> b) {
    final int offsetA = 1, offsetB = 1 + a.numStates;
    final List<Move<T>> moves = new ArrayList<>();
    final BitSet finals = new BitSet();
    moves.add(new Move<>(0, a.init + offsetA, null));
    moves.add(new Move<>(0, b.init + offsetB, null));
    shiftInto(a, offsetA, moves, finals);
    shiftInto(b, offsetB, moves, finals);
    return new SymbolicAutomaton<>(1 + a.numStates + b.numStates, 0, finals, moves);
  }

  /** Accepts the empty word and everything {@code a} accepts. */
  public static <T> SymbolicAutomaton<T> mkOpt(SymbolicAutomaton<T> a) {
    final List<Move<T>> moves = new ArrayList<>();
    final BitSet finals = new BitSet();
    finals.set(0);
    moves.add(new Move<>(0, a.init + 1, null));
    shiftInto(a, 1, moves, finals);
    return new SymbolicAutomaton<>(1 + a.numStates, 0, finals, moves);
  }

  private static <T> void shiftInto(
      SymbolicAutomaton<T> a, int offset, List<Move<T>> moves, BitSet finals) {
    for (Move<T> mv : a.moves) moves.add(new Move<>(mv.src + offset, mv.dst + offset, mv.label));
    for (int f = a.finals.nextSetBit(0); f >= 0; f = a.finals.nextSetBit(f + 1))
      finals.set(f + offset);
  }

  public int numStates() {
    return numStates;
  }

  public int initialState() {
    return init;
  }

  public boolean isFinalState(int s) {
    return finals.get(s);
  }

  public List<Integer> finalStates() {
    final List<Integer> fs = new ArrayList<>();
    for (int f = finals.nextSetBit(0); f >= 0; f = finals.nextSetBit(f + 1)) fs.add(f);
    return fs;
  }

  public List<Move<T>> moves() {
    return moves;
  }

  public List<Move<T>> movesFrom(int s) {
    final List<Move<T>> out = new ArrayList<>();
    for (Move<T> mv : moves) if (mv.src == s) out.add(mv);
    return out;
  }

  public boolean hasEpsilonMoves() {
    for (Move<T> mv : moves) if (mv.isEpsilon()) return true;
    return false;
  }

  /** Adds an epsilon move from every final state back to the initial state. */
  public void addFinalToInitMoves() {
    for (int f = finals.nextSetBit(0); f >= 0; f = finals.nextSetBit(f + 1)) {
      if (f == init) continue;
      boolean found = false;
      for (Move<T> mv : moves) {
        if (mv.src == f && mv.dst == init && mv.isEpsilon()) {
          found = true;
          break;
        }
      }
      if (!found) moves.add(new Move<>(f, init, null));
    }
  }

  /**
   * Makes the initial state final. When the initial state is re-entered by some move a fresh
   * initial state is introduced first, otherwise the automaton would accept partial words.
   */
  public void addInitToFinalStates() {
    boolean reentered = false;
    for (Move<T> mv : moves) {
      if (mv.dst == init) {
        reentered = true;
        break;
      }
    }
    if (reentered) {
      final int fresh = numStates++;
      moves.add(new Move<>(fresh, init, null));
      init = fresh;
    }
    finals.set(init);
  }

  public BitSet epsilonClosure(int s) {
    final BitSet closure = new BitSet();
    final Deque<Integer> todo = new ArrayDeque<>();
    closure.set(s);
    todo.push(s);
    while (!todo.isEmpty()) {
      final int cur = todo.pop();
      for (Move<T> mv : moves) {
        if (mv.src == cur && mv.isEpsilon() && !closure.get(mv.dst)) {
          closure.set(mv.dst);
          todo.push(mv.dst);
        }
      }
    }
    return closure;
  }

  /** An equivalent automaton without epsilon moves. */
  public SymbolicAutomaton<T> removeEpsilons() {
    if (!hasEpsilonMoves()) return copyOf(this);

    final BitSet newFinals = new BitSet();
    final List<Move<T>> newMoves = new ArrayList<>();
    for (int s = 0; s < numStates; ++s) {
      final BitSet closure = epsilonClosure(s);
      if (closure.intersects(finals)) newFinals.set(s);
      for (Move<T> mv : moves) {
        if (!mv.isEpsilon() && closure.get(mv.src)) newMoves.add(new Move<>(s, mv.dst, mv.label));
      }
    }
    return new SymbolicAutomaton<>(numStates, init, newFinals, newMoves);
  }

  /** Drops states unreachable from the initial state or from which no final state is reachable. */
  public void compress() {
    final BitSet reachable = new BitSet();
    final Deque<Integer> todo = new ArrayDeque<>();
    reachable.set(init);
    todo.push(init);
    while (!todo.isEmpty()) {
      final int s = todo.pop();
      for (Move<T> mv : moves) {
        if (mv.src == s && !reachable.get(mv.dst)) {
          reachable.set(mv.dst);
          todo.push(mv.dst);
        }
      }
    }

    final BitSet live = new BitSet();
    live.or(finals);
    live.and(reachable);
    boolean changed = true;
    while (changed) {
      changed = false;
      for (Move<T> mv : moves) {
        if (live.get(mv.dst) && reachable.get(mv.src) && !live.get(mv.src)) {
          live.set(mv.src);
          changed = true;
        }
      }
    }

    if (!live.get(init)) {
      numStates = 1;
      init = 0;
      finals.clear();
      moves.clear();
      return;
    }

    final int[] renumber = new int[numStates];
    int n = 0;
    renumber[init] = n++;
    for (int s = live.nextSetBit(0); s >= 0; s = live.nextSetBit(s + 1)) {
      if (s != init) renumber[s] = n++;
    }

    final List<Move<T>> kept = new ArrayList<>();
    for (Move<T> mv : moves) {
      if (live.get(mv.src) && live.get(mv.dst) && !(mv.isEpsilon() && mv.src == mv.dst))
        kept.add(new Move<>(renumber[mv.src], renumber[mv.dst], mv.label));
    }
    final BitSet newFinals = new BitSet();
    for (int f = finals.nextSetBit(0); f >= 0; f = finals.nextSetBit(f + 1)) {
      if (live.get(f)) newFinals.set(renumber[f]);
    }

    moves.clear();
    moves.addAll(kept);
    finals.clear();
    finals.or(newFinals);
    init = 0;
    numStates = n;
  }

  /** Whether no final state is reachable. */
  public boolean isEmpty() {
    final SymbolicAutomaton<T> copy = copyOf(this);
    copy.compress();
    return copy.finals.isEmpty();
  }

  /**
   * Whether the automaton is a single chain {@code init -l1-> .. -ln-> final} without branching,
   * epsilon moves or other final states. Fills {@code labels} with {@code l1..ln} on success.
   */
  public boolean isSequence(List<T> labels) {
    labels.clear();
    final BitSet seen = new BitSet();
    int s = init;
    while (true) {
      if (seen.get(s)) return false;
      seen.set(s);
      final List<Move<T>> out = movesFrom(s);
      if (out.isEmpty()) return isFinalState(s) && finals.cardinality() == 1;
      if (out.size() != 1 || isFinalState(s)) return false;
      final Move<T> mv = out.get(0);
      if (mv.isEpsilon()) return false;
      labels.add(mv.label);
      s = mv.dst;
    }
  }

  @Override
  public String toString() {
    final StringBuilder builder = new StringBuilder();
    builder.append("init: ").append(init).append(", finals: ").append(finals);
    for (Move<T> mv : moves) builder.append("\n  ").append(mv);
    return builder.toString();
  }
}
