package DFAKit.Model;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

public final class CachedTransitionRule<S, I> implements TransitionRule<S, I> {
    public static final long DEFAULT_MAXIMUM_SIZE = 1_000_000L;
    private static final int INITIAL_CAPACITY = 1_024;

    private final TransitionRule<S, I> delegate;
    // Upper bound on cache size, so large explorations don't overflow memory
    private final Cache<Key<S, I>, S> successors;

    public CachedTransitionRule(TransitionRule<S, I> delegate) {
        this(delegate, DEFAULT_MAXIMUM_SIZE);
    }

    public CachedTransitionRule(TransitionRule<S, I> delegate, long maximumSize) {
        this.delegate = delegate;
        this.successors = Caffeine.newBuilder()
            .initialCapacity((int) Math.min(INITIAL_CAPACITY, maximumSize))
            .maximumSize(maximumSize)
            .build();
    }

    @Override
    public S next(S state, I symbol) {
        return successors.get(new Key<>(state, symbol), k -> delegate.next(k.state(), k.symbol()));
    }

    public long cachedCount() {
        successors.cleanUp();
        return successors.estimatedSize();
    }

    private record Key<S, I>(S state, I symbol) { }
}
