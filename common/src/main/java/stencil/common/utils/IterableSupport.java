package stencil.common.utils;

import java.util.function.Predicate;

public interface IterableSupport {
  static <T> boolean all(Iterable<T> xs, Predicate<? super T> check) {
    for (T x : xs) if (!check.test(x)) return false;
    return true;
  }
}
