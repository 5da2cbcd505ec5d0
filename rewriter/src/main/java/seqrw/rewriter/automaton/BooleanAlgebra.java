package seqrw.rewriter.automaton;

import java.util.List;

/** Effective boolean algebra over transition labels. */
public interface BooleanAlgebra<T> {
  T mkTrue();

  T mkFalse();

  T mkAnd(T x, T y);

  T mkOr(T x, T y);

  T mkNot(T x);

  Lbool isSat(T x);

  default T mkAnd(List<T> xs) {
    if (xs.isEmpty()) return mkTrue();
    T result = xs.get(0);
    for (int i = 1; i < xs.size(); ++i) result = mkAnd(result, xs.get(i));
    return result;
  }

  default T mkOr(List<T> xs) {
    if (xs.isEmpty()) return mkFalse();
    T result = xs.get(0);
    for (int i = 1; i < xs.size(); ++i) result = mkOr(result, xs.get(i));
    return result;
  }
}
