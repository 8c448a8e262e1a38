package DFAKit.Model;

import java.util.Collection;
import java.util.List;
import java.util.Set;

import net.automatalib.automaton.concept.FiniteRepresentation;

/**
 * Deterministic finite automaton over states {@code S} and symbols {@code I}.
 * Implementations are immutable; the successor function is total over states x vocabulary.
 * @param <S> - State type, needs equals/hashCode
 * @param <I> - Input symbol type, needs equals/hashCode
 */
public interface Dfa<S, I> extends FiniteRepresentation {

    List<I> getVocabulary();

    List<S> getStates();

    S getStart();

    Set<S> getFinals();

    S getSuccessor(S state, I symbol);

    /**
     * Same automaton with another set of final states.
     * @param finals - new final states, a subset of the states
     * @return new automaton, this one is left untouched
     */
    Dfa<S, I> withFinals(Collection<? extends S> finals);

    default TransitionRule<S, I> getTransitionRule() {
        return this::getSuccessor;
    }

    default boolean isAccepting(S state) {
        return getFinals().contains(state);
    }

    @Override
    default int size() {
        return getStates().size();
    }
}
