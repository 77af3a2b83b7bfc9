package stencil.common.utils;

import java.util.function.Function;

public interface Commons {
  static <T> String joining(String sep, Iterable<T> xs) {
    return joining(sep, xs, String::valueOf);
  }

  static <T> String joining(String sep, Iterable<T> xs, Function<? super T, String> toString) {
    final StringBuilder builder = new StringBuilder();
    boolean first = true;
    for (T x : xs) {
      if (!first) builder.append(sep);
      builder.append(toString.apply(x));
      first = false;
    }
    return builder.toString();
  }
}
