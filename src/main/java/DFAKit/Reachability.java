package DFAKit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import DFAKit.Model.Dfa;
import DFAKit.Model.TransitionRule;

/**
 * One-step transitions and reachable-state closure.
 */
public final class Reachability {

    private Reachability() {
    }

    /**
     * Destinations of {@code origin}, one per symbol in vocabulary order. Duplicates are kept.
     */
    public static <S, I> List<S> destinationsFrom(TransitionRule<S, I> rule, List<? extends I> vocabulary, S origin) {
        final List<S> result = new ArrayList<>(vocabulary.size());
        for (I symbol : vocabulary) {
            result.add(rule.next(origin, symbol));
        }
        return result;
    }

    /**
     * Symbols (in vocabulary order) under which {@code origin} goes to {@code dest}.
     */
    public static <S, I> List<I> transitionsFromTo(TransitionRule<S, I> rule, List<? extends I> vocabulary, S origin, S dest) {
        final List<I> result = new ArrayList<>();
        for (I symbol : vocabulary) {
            if (dest.equals(rule.next(origin, symbol))) {
                result.add(symbol);
            }
        }
        return result;
    }

    public static <S extends Comparable<? super S>, I> Set<S> reachedStatesFrom(TransitionRule<S, I> rule, List<? extends I> vocabulary, S origin) {
        return reachedStatesFrom(rule, vocabulary, origin, Comparator.naturalOrder(), Fixpoint.DEFAULT_MAX_ITERATIONS);
    }

    public static <S extends Comparable<? super S>, I> Set<S> reachedStatesFrom(Dfa<S, I> dfa, S origin) {
        return reachedStatesFrom(dfa.getTransitionRule(), dfa.getVocabulary(), origin, Comparator.naturalOrder(),
            iterationBound(dfa));
    }

    /**
     * States reachable from {@code origin} through any sequence of symbols, {@code origin} included.
     * @param rule - transition rule
     * @param vocabulary - input symbols
     * @param origin - state to start from
     * @param order - total order on states
     * @param maxIterations - closure iteration cap
     * @return reached states, sorted by {@code order}
     */
    public static <S, I> Set<S> reachedStatesFrom(TransitionRule<S, I> rule,
                                                  List<? extends I> vocabulary,
                                                  S origin,
                                                  Comparator<? super S> order,
                                                  int maxIterations) {
        final List<S> seed = destinationsFrom(rule, vocabulary, origin);
        seed.add(origin);
        final List<S> closed = Fixpoint.closure(sts -> {
            final List<S> next = new ArrayList<>();
            for (S st : sts) {
                next.addAll(destinationsFrom(rule, vocabulary, st));
            }
            return next;
        }, seed, order, maxIterations);
        return Collections.unmodifiableSet(new LinkedHashSet<>(closed));
    }

    /**
     * Closure grows by at least one state per iteration, plus one step to observe stability.
     */
    static int iterationBound(Dfa<?, ?> dfa) {
        return dfa.size() + 1;
    }
}
