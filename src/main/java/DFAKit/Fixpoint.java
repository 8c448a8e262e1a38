package DFAKit;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Iterate-until-stable closure, shared by reachability and table building.
 */
public final class Fixpoint {
    public static boolean DEBUG = false;
    /**
     * Iteration cap when the state space is not enumerated up front.
     */
    public static final int DEFAULT_MAX_ITERATIONS = 1 << 16;

    private Fixpoint() {
    }

    /**
     * Apply {@code step} until two consecutive values are equal.
     * @param step - step function; must converge on a finite universe
     * @param seed - starting value
     * @param maxIterations - maximum number of step applications
     * @return the stable value
     * @param <T> - value type, compared with equals
     */
    public static <T> T limit(UnaryOperator<T> step, T seed, int maxIterations) {
        T current = seed;
        for (int i = 1; i <= maxIterations; i++) {
            final T next = step.apply(current);
            if (Objects.equals(next, current)) {
                if (DEBUG) {
                    System.out.println("DEBUG: Fixpoint reached after " + i + " iterations");
                }
                return current;
            }
            current = next;
        }
        throw new IllegalStateException("No fixpoint reached after " + maxIterations + " iterations");
    }

    /**
     * Ordered-set closure. Every intermediate value is unioned with its predecessor, deduplicated and sorted,
     * so that "no growth" is plain list equality.
     * @param step - one-step expansion of the current elements
     * @param seed - starting elements
     * @param order - total order on elements
     * @param maxIterations - maximum number of step applications
     * @return the closed, sorted, duplicate-free list
     */
    public static <E> List<E> closure(Function<? super List<E>, ? extends Collection<? extends E>> step,
                                      Collection<? extends E> seed,
                                      Comparator<? super E> order,
                                      int maxIterations) {
        return limit(current -> {
            final List<E> grown = new ArrayList<>(current);
            grown.addAll(step.apply(current));
            return normalize(grown, order);
        }, normalize(seed, order), maxIterations);
    }

    /**
     * Sort and deduplicate.
     */
    public static <E> List<E> normalize(Collection<? extends E> elements, Comparator<? super E> order) {
        final TreeSet<E> sorted = new TreeSet<>(order);
        sorted.addAll(elements);
        return new ArrayList<>(sorted);
    }
}
