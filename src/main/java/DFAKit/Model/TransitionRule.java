package DFAKit.Model;

/**
 * A total transition function of a deterministic automaton.
 * @param <S> - State type
 * @param <I> - Input symbol type
 */
@FunctionalInterface
public interface TransitionRule<S, I> {

    S next(S state, I symbol);

    /**
     * Memoize this rule, e.g. when successors of set-valued states are expensive to compute.
     * @param maximumSize - upper bound on cached (state, symbol) pairs
     */
    default TransitionRule<S, I> cached(long maximumSize) {
        return new CachedTransitionRule<>(this, maximumSize);
    }
}
