package DFAKit;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import DFAKit.Model.Dfa;
import DFAKit.Model.TransitionRule;
import DFAKit.Model.Triple;
import it.unimi.dsi.fastutil.ints.IntIntImmutablePair;
import it.unimi.dsi.fastutil.ints.IntIntPair;

/**
 * Properties of automata and of their states.
 */
public class StructuralAnalyzer {

    /**
     * Same automaton, accepting exactly the words the original rejects.
     */
    public static <S, I> Dfa<S, I> complement(Dfa<S, I> dfa) {
        final List<S> finals = new ArrayList<>(dfa.getStates());
        finals.removeAll(dfa.getFinals());
        return dfa.withFinals(finals);
    }

    /**
     * A state is dead when no final state can be reached from it.
     * @param rule - transition rule
     * @param vocabulary - input symbols
     * @param finals - final states
     * @param state - state to check
     * @return if no final state is reachable
     */
    public static <S extends Comparable<? super S>, I> boolean isDead(TransitionRule<S, I> rule,
                                                                     List<? extends I> vocabulary,
                                                                     Collection<? extends S> finals,
                                                                     S state) {
        return noneReached(Reachability.reachedStatesFrom(rule, vocabulary, state), finals);
    }

    public static <S extends Comparable<? super S>, I> boolean isDead(Dfa<S, I> dfa, S state) {
        return noneReached(Reachability.reachedStatesFrom(dfa, state), dfa.getFinals());
    }

    private static <S> boolean noneReached(Set<S> reached, Collection<? extends S> finals) {
        for (S f : finals) {
            if (reached.contains(f)) {
                return false;
            }
        }
        return true;
    }

    /**
     * A state is a sync state when it is not final and loops to itself on every symbol.
     */
    public static <S, I> boolean isSync(TransitionRule<S, I> rule,
                                        List<? extends I> vocabulary,
                                        Collection<? extends S> finals,
                                        S state) {
        if (finals.contains(state)) {
            return false;
        }
        for (I symbol : vocabulary) {
            if (!state.equals(Acceptance.walk(rule, state, List.of(symbol)))) {
                return false;
            }
        }
        return true;
    }

    public static <S, I> boolean isSync(Dfa<S, I> dfa, S state) {
        return isSync(dfa.getTransitionRule(), dfa.getVocabulary(), dfa.getFinals(), state);
    }

    public static <S extends Comparable<? super S>, I> List<S> deadStates(Dfa<S, I> dfa) {
        return deadStates(dfa, false);
    }

    /**
     * Dead states, in state order.
     * @param parallel - check states concurrently; the result order is the same either way
     */
    public static <S extends Comparable<? super S>, I> List<S> deadStates(Dfa<S, I> dfa, boolean parallel) {
        if (parallel) {
            return dfa.getStates().parallelStream().filter(st -> isDead(dfa, st)).collect(Collectors.toList());
        }
        final List<S> result = new ArrayList<>();
        for (S st : dfa.getStates()) {
            if (isDead(dfa, st)) {
                result.add(st);
            }
        }
        return result;
    }

    public static <S, I> List<S> syncStates(Dfa<S, I> dfa) {
        final List<S> result = new ArrayList<>();
        for (S st : dfa.getStates()) {
            if (isSync(dfa, st)) {
                result.add(st);
            }
        }
        return result;
    }

    public static int size(Dfa<?, ?> dfa) {
        return dfa.size();
    }

    /**
     * @return (#states, #transitions)
     */
    public static <S extends Comparable<? super S>, I extends Comparable<? super I>> IntIntPair nodesAndEdges(Dfa<S, I> dfa) {
        return new IntIntImmutablePair(dfa.size(), TableConverter.fullTripleRelation(dfa).size());
    }

    /**
     * Like {@link #nodesAndEdges(Dfa)}, without dead and sync states and without transitions into them.
     * @return (#states, #transitions)
     */
    public static <S extends Comparable<? super S>, I extends Comparable<? super I>> IntIntPair nodesAndEdgesExcludingTrapStates(Dfa<S, I> dfa) {
        final Set<S> traps = new HashSet<>(deadStates(dfa));
        traps.addAll(syncStates(dfa));

        int nodes = 0;
        for (S st : dfa.getStates()) {
            if (!traps.contains(st)) {
                nodes++;
            }
        }
        int edges = 0;
        for (Triple<S, I> t : TableConverter.fullTripleRelation(dfa)) {
            if (!traps.contains(t.destination())) {
                edges++;
            }
        }
        return new IntIntImmutablePair(nodes, edges);
    }

    /**
     * Cyclomatic complexity E - N + 2P of the graph without trap states, with a single component (P = 1).
     */
    public static <S extends Comparable<? super S>, I extends Comparable<? super I>> int cyclomaticComplexity(Dfa<S, I> dfa) {
        final IntIntPair nodesAndEdges = nodesAndEdgesExcludingTrapStates(dfa);
        final int components = 1;
        return nodesAndEdges.rightInt() - nodesAndEdges.leftInt() + 2 * components;
    }

    /**
     * Number of (state, symbol) pairs leading to {@code dest}.
     */
    public static <S, I> int incomingArrowCount(TransitionRule<S, I> rule,
                                                List<? extends I> vocabulary,
                                                Collection<? extends S> states,
                                                S dest) {
        int count = 0;
        for (I symbol : vocabulary) {
            for (S st : states) {
                if (dest.equals(rule.next(st, symbol))) {
                    count++;
                }
            }
        }
        return count;
    }

    public static <S, I> int outgoingArrowCount(TransitionRule<S, I> rule, List<? extends I> vocabulary, S origin) {
        return Reachability.destinationsFrom(rule, vocabulary, origin).size();
    }
}
