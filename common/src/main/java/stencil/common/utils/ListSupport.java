package stencil.common.utils;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

public interface ListSupport {
  static <X, Y> List<Y> map(Collection<? extends X> xs, Function<? super X, ? extends Y> func) {
    final List<Y> ys = new ArrayList<>(xs.size());
    for (X x : xs) ys.add(func.apply(x));
    return ys;
  }

  static <X> List<X> filter(Iterable<X> xs, Predicate<? super X> pred) {
    final List<X> ys = new ArrayList<>();
    for (X x : xs) if (pred.test(x)) ys.add(x);
    return ys;
  }

  static <X> List<X> join(List<? extends X> xs, List<? extends X> ys) {
    final List<X> joined = new ArrayList<>(xs.size() + ys.size());
    joined.addAll(xs);
    joined.addAll(ys);
    return joined;
  }

  /** Keeps the first occurrence of each element, in the original order. */
  static <X> List<X> dedup(Collection<? extends X> xs) {
    return new ArrayList<>(new LinkedHashSet<>(xs));
  }

  static <X extends Comparable<? super X>> ImmutableList<X> sorted(Collection<? extends X> xs) {
    return ImmutableList.sortedCopyOf(xs);
  }
}
