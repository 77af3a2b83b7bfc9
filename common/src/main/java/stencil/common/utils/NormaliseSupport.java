package stencil.common.utils;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Collapses a list of partial-monoid elements until no two of them append. */
public abstract class NormaliseSupport {
  private NormaliseSupport() {}

  public interface MergeListener<T> {
    void onMerge(T x, T y, T merged);
  }

  public static <T extends PartialMonoid<T>> List<T> normalise(List<T> xs) {
    return normalise(xs, null);
  }

  /**
   * Left-to-right pairwise scan. After every successful append the merged element takes the
   * place of the left operand, the right operand is dropped and the scan restarts. Duplicates are
   * removed from the result.
   *
   * @param listener notified of every successful append, may be null
   */
  public static <T extends PartialMonoid<T>> List<T> normalise(List<T> xs, MergeListener<T> listener) {
    final List<T> elements = new ArrayList<>(xs);

    boolean isModified;
    do {
      isModified = false;
      scan:
      for (int i = 0; i < elements.size(); ++i) {
        for (int j = i + 1; j < elements.size(); ++j) {
          final T x = elements.get(i), y = elements.get(j);
          final Optional<T> merged = x.appendM(y);
          if (merged.isEmpty()) continue;

          if (listener != null) listener.onMerge(x, y, merged.get());
          elements.set(i, merged.get());
          elements.remove(j);
          isModified = true;
          break scan;
        }
      }
    } while (isModified);

    return ListSupport.dedup(elements);
  }
}
