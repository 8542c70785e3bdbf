package cal.prim;

import java.io.IOException;

/**
 * A {@link java.util.function.Consumer Consumer} whose {@link #accept(Object)} method
 * may throw {@link IOException}.  Used to describe producers of byte streams, e.g.
 * {@link cal.dedup.Util#createInputStream(IOConsumer)}.
 *
 * @param <T> the consumed type
 */
@FunctionalInterface
public interface IOConsumer<T> {
  void accept(T x) throws IOException;
}
