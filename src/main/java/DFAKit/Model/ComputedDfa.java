package DFAKit.Model;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Automaton whose transitions are given by a callable {@link TransitionRule}.
 * The rule is evaluated once over states x vocabulary on construction to check it stays within the states.
 */
public final class ComputedDfa<S, I> implements Dfa<S, I> {
    private final List<I> vocabulary;
    private final List<S> states;
    private final Set<S> stateSet;
    private final S start;
    private final Set<S> finals;
    private final TransitionRule<S, I> rule;

    public ComputedDfa(Collection<? extends I> vocabulary,
                       Collection<? extends S> states,
                       S start,
                       Collection<? extends S> finals,
                       TransitionRule<S, I> rule) {
        this.vocabulary = List.copyOf(vocabulary);
        this.states = List.copyOf(states);
        this.stateSet = new HashSet<>(this.states);
        this.start = start;
        this.finals = Collections.unmodifiableSet(new LinkedHashSet<>(finals));
        this.rule = rule;
        validate();
    }

    public static <S, I> ComputedDfa<S, I> of(Collection<? extends I> vocabulary,
                                              Collection<? extends S> states,
                                              S start,
                                              Collection<? extends S> finals,
                                              TransitionRule<S, I> rule) {
        return new ComputedDfa<>(vocabulary, states, start, finals, rule);
    }

    private void validate() {
        if (!stateSet.contains(start)) {
            throw new MalformedAutomatonException("Start state " + start + " is not a state");
        }
        for (S f : finals) {
            if (!stateSet.contains(f)) {
                throw new MalformedAutomatonException("Final state " + f + " is not a state");
            }
        }
        for (S s : states) {
            for (I a : vocabulary) {
                final S dest = rule.next(s, a);
                if (!stateSet.contains(dest)) {
                    throw new MalformedAutomatonException(
                        "Transition (" + s + ", " + a + ") leads to " + dest + ", which is not a state");
                }
            }
        }
    }

    @Override
    public List<I> getVocabulary() {
        return vocabulary;
    }

    @Override
    public List<S> getStates() {
        return states;
    }

    @Override
    public S getStart() {
        return start;
    }

    @Override
    public Set<S> getFinals() {
        return finals;
    }

    @Override
    public S getSuccessor(S state, I symbol) {
        return rule.next(state, symbol);
    }

    @Override
    public TransitionRule<S, I> getTransitionRule() {
        return rule;
    }

    @Override
    public ComputedDfa<S, I> withFinals(Collection<? extends S> finals) {
        return new ComputedDfa<>(vocabulary, states, start, finals, rule);
    }

    /**
     * Same automaton with a memoized transition rule.
     * @param maximumSize - upper bound on cached transitions
     */
    public ComputedDfa<S, I> cached(long maximumSize) {
        return new ComputedDfa<>(vocabulary, states, start, finals, rule.cached(maximumSize));
    }

    @Override
    public String toString() {
        return "ComputedDfa{vocabulary=" + vocabulary + ", states=" + states + ", start=" + start
            + ", finals=" + finals + "}";
    }
}
