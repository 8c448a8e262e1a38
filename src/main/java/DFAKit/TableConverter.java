package DFAKit;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import DFAKit.Model.ComputedDfa;
import DFAKit.Model.Dfa;
import DFAKit.Model.DfaExport;
import DFAKit.Model.IncompleteTransitionTableException;
import DFAKit.Model.LookupPolicy;
import DFAKit.Model.MalformedAutomatonException;
import DFAKit.Model.TabulatedDfa;
import DFAKit.Model.TransitionRule;
import DFAKit.Model.TransitionTable;
import DFAKit.Model.Triple;

/**
 * Conversions between transition rules and explicit transition tables.
 */
public class TableConverter {

    /**
     * Transition table of the states reachable from the start state.
     * Columns follow the sorted vocabulary; rows follow discovery order.
     * @param dfa - automaton
     * @return table with one row per reachable state
     */
    public static <S, I extends Comparable<? super I>> TransitionTable<S, I> toTable(Dfa<S, I> dfa) {
        return toTable(dfa.getTransitionRule(), dfa.getVocabulary(), dfa.getStart(), Reachability.iterationBound(dfa));
    }

    /**
     * Transition table grown from the start row until every destination has a row.
     * Works for state types that are not enumerated up front, as long as the reachable states are finite.
     * @param rule - transition rule
     * @param vocabulary - input symbols
     * @param start - start state
     * @param maxIterations - closure iteration cap
     * @return table with one row per reachable state
     */
    public static <S, I extends Comparable<? super I>> TransitionTable<S, I> toTable(TransitionRule<S, I> rule,
                                                                                   Collection<? extends I> vocabulary,
                                                                                   S start,
                                                                                   int maxIterations) {
        final List<I> sortedVocabulary = new ArrayList<>(vocabulary);
        sortedVocabulary.sort(null);
        final TransitionTable<S, I> firstRow = TransitionTable.<S, I>empty(sortedVocabulary)
            .withRows(newRows(rule, List.of(start), sortedVocabulary));
        return Fixpoint.limit(table -> addRows(rule, table), firstRow, maxIterations);
    }

    private static <S, I> TransitionTable<S, I> addRows(TransitionRule<S, I> rule, TransitionTable<S, I> table) {
        final List<S> newStates = table.getPendingStates();
        if (newStates.isEmpty()) {
            return table;
        }
        return table.withRows(newRows(rule, newStates, table.getVocabulary()));
    }

    private static <S, I> Map<S, List<S>> newRows(TransitionRule<S, I> rule, List<S> states, List<I> vocabulary) {
        final Map<S, List<S>> rows = new LinkedHashMap<>();
        for (S st : states) {
            rows.put(st, Reachability.destinationsFrom(rule, vocabulary, st));
        }
        return rows;
    }

    /**
     * Tabulated automaton over the states reachable from the start state.
     */
    public static <S, I extends Comparable<? super I>> TabulatedDfa<S, I> tabulate(Dfa<S, I> dfa) {
        final TransitionTable<S, I> table = toTable(dfa);
        final List<S> finals = new ArrayList<>();
        for (S f : dfa.getFinals()) {
            if (table.hasRow(f)) {
                finals.add(f);
            }
        }
        return new TabulatedDfa<>(table, dfa.getStart(), finals);
    }

    /**
     * Tabulated automaton with a row for every declared state, in declared order.
     */
    public static <S, I extends Comparable<? super I>> TabulatedDfa<S, I> tabulateAll(Dfa<S, I> dfa) {
        final List<I> sortedVocabulary = new ArrayList<>(dfa.getVocabulary());
        sortedVocabulary.sort(null);
        final TransitionTable<S, I> table = TransitionTable.<S, I>empty(sortedVocabulary)
            .withRows(newRows(dfa.getTransitionRule(), dfa.getStates(), sortedVocabulary));
        return new TabulatedDfa<>(table, dfa.getStart(), dfa.getFinals());
    }

    /**
     * Tabulate an automaton whose states are only known through its rule.
     * @param vocabulary - input symbols
     * @param start - start state
     * @param accepting - acceptance test on discovered states
     * @param rule - transition rule
     * @return tabulated automaton over the reachable states
     */
    public static <S, I extends Comparable<? super I>> TabulatedDfa<S, I> explore(Collection<? extends I> vocabulary,
                                                                                S start,
                                                                                Predicate<? super S> accepting,
                                                                                TransitionRule<S, I> rule) {
        return explore(vocabulary, start, accepting, rule, Fixpoint.DEFAULT_MAX_ITERATIONS);
    }

    public static <S, I extends Comparable<? super I>> TabulatedDfa<S, I> explore(Collection<? extends I> vocabulary,
                                                                                S start,
                                                                                Predicate<? super S> accepting,
                                                                                TransitionRule<S, I> rule,
                                                                                int maxIterations) {
        final TransitionTable<S, I> table = toTable(rule, vocabulary, start, maxIterations);
        final List<S> finals = new ArrayList<>();
        for (S st : table.getOrigins()) {
            if (accepting.test(st)) {
                finals.add(st);
            }
        }
        return new TabulatedDfa<>(table, start, finals);
    }

    /**
     * Every transition over the declared states, sorted by (origin, symbol).
     * Unlike {@link #toTable(Dfa)}, unreachable states are included.
     */
    public static <S extends Comparable<? super S>, I extends Comparable<? super I>> List<Triple<S, I>> fullTripleRelation(Dfa<S, I> dfa) {
        final List<Triple<S, I>> result = new ArrayList<>(dfa.size() * dfa.getVocabulary().size());
        for (S origin : dfa.getStates()) {
            for (I symbol : dfa.getVocabulary()) {
                result.add(new Triple<>(origin, symbol, dfa.getSuccessor(origin, symbol)));
            }
        }
        result.sort(Triple.byOriginAndSymbol());
        return result;
    }

    public static <S, I> ComputedDfa<S, I> fromTable(Collection<? extends I> vocabulary,
                                                     Collection<? extends S> states,
                                                     S start,
                                                     Collection<? extends S> finals,
                                                     List<? extends Triple<? extends S, ? extends I>> triples) {
        return fromTable(vocabulary, states, start, finals, triples, LookupPolicy.STRICT);
    }

    /**
     * Automaton whose rule looks transitions up in a list of triples. The first matching triple wins.
     * With {@link LookupPolicy#LAST_TRIPLE_FALLBACK} a missing (state, symbol) pair yields the destination of the
     * last triple instead of failing.
     * @throws IncompleteTransitionTableException with {@link LookupPolicy#STRICT}, if a (state, symbol) pair has no triple
     * @throws MalformedAutomatonException if a destination is not a state
     */
    public static <S, I> ComputedDfa<S, I> fromTable(Collection<? extends I> vocabulary,
                                                     Collection<? extends S> states,
                                                     S start,
                                                     Collection<? extends S> finals,
                                                     List<? extends Triple<? extends S, ? extends I>> triples,
                                                     LookupPolicy policy) {
        final TransitionRule<S, I> rule = tripleLookup(triples, policy);
        return new ComputedDfa<>(vocabulary, states, start, finals, rule);
    }

    private static <S, I> TransitionRule<S, I> tripleLookup(List<? extends Triple<? extends S, ? extends I>> triples,
                                                           LookupPolicy policy) {
        final Map<Key, S> index = new HashMap<>();
        for (Triple<? extends S, ? extends I> t : triples) {
            index.putIfAbsent(new Key(t.origin(), t.symbol()), t.destination());
        }
        final S fallback = triples.isEmpty() ? null : triples.get(triples.size() - 1).destination();
        return (state, symbol) -> {
            final Key key = new Key(state, symbol);
            if (index.containsKey(key)) {
                return index.get(key);
            }
            if (policy == LookupPolicy.LAST_TRIPLE_FALLBACK && !triples.isEmpty()) {
                return fallback;
            }
            throw new IncompleteTransitionTableException(state, symbol);
        };
    }

    private record Key(Object state, Object symbol) { }

    /**
     * Structured form for printers and writers: vocabulary, states, start, sorted finals and sorted triples.
     */
    public static <S extends Comparable<? super S>, I extends Comparable<? super I>> DfaExport<S, I> export(Dfa<S, I> dfa) {
        final List<S> finals = new ArrayList<>(dfa.getFinals());
        finals.sort(null);
        return new DfaExport<>(dfa.getVocabulary(), dfa.getStates(), dfa.getStart(), finals, fullTripleRelation(dfa));
    }
}
