package stencil.common.utils;

import java.util.Optional;

/**
 * A monoid whose append may be undefined.
 *
 * <p>{@link #appendM(Object)} returns empty when the two operands cannot be combined into a
 * single value. That is not a failure: callers keep both operands side by side.
 */
public interface PartialMonoid<T extends PartialMonoid<T>> {
  Optional<T> appendM(T other);
}
