package seqrw.common.utils;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

public interface ListSupport {
  static <X, Y> List<Y> map(Iterable<? extends X> xs, Function<? super X, ? extends Y> func) {
    final List<Y> ys = new ArrayList<>();
    for (X x : xs) ys.add(func.apply(x));
    return ys;
  }

  static <X> List<X> filter(Iterable<X> xs, Predicate<? super X> pred) {
    final List<X> ys = new ArrayList<>();
    for (X x : xs) if (pred.test(x)) ys.add(x);
    return ys;
  }

  /** Sub-list [from, to) copied into a fresh mutable list. */
  static <X> List<X> slice(List<X> xs, int from, int to) {
    return new ArrayList<>(xs.subList(from, to));
  }

  static <X> List<X> tail(List<X> xs, int from) {
    return slice(xs, from, xs.size());
  }
}
