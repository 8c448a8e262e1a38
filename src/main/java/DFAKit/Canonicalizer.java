package DFAKit;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import DFAKit.Model.ComputedDfa;
import DFAKit.Model.Dfa;
import DFAKit.Model.MalformedAutomatonException;
import DFAKit.Model.SentinelState;
import DFAKit.Model.TabulatedDfa;
import DFAKit.Model.TransitionRule;
import DFAKit.Model.TransitionTable;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Deterministic state renaming.
 * Two automata that only differ by a bijection on their (reachable) states are renamed to equal automata,
 * which makes renaming the equivalence test for minimized automata.
 */
public class Canonicalizer {
    private static final int MISSING_ELEMENT = -1;

    /**
     * Rename the reachable states of an automaton to consecutive integers.
     * The start state gets {@code initialId}; every other state gets the next integer the first time it shows up
     * as a destination, reading the transition table row by row and column by column.
     * @param dfa - automaton to rename
     * @param initialId - ID of the start state
     * @return renamed automaton over {@code [initialId, initialId + n)}, vocabulary sorted, rows in ID order
     * @param <S> - State type, only needs equals/hashCode
     * @param <I> - Input symbol type
     */
    public static <S, I extends Comparable<? super I>> TabulatedDfa<Integer, I> rename(Dfa<S, I> dfa, int initialId) {
        final TransitionTable<S, I> table = TableConverter.toTable(dfa);
        final Object2IntMap<S> ids = numberStates(table, dfa.getStart(), initialId);

        final List<S> byId = new ArrayList<>(ids.size());
        for (int i = 0; i < ids.size(); i++) {
            byId.add(null);
        }
        for (Object2IntMap.Entry<S> e : ids.object2IntEntrySet()) {
            byId.set(e.getIntValue() - initialId, e.getKey());
        }

        final Map<Integer, List<Integer>> rows = new LinkedHashMap<>();
        for (S origin : byId) {
            final List<S> row = table.getRow(origin);
            final List<Integer> renamedRow = new ArrayList<>(row.size());
            for (S dest : row) {
                renamedRow.add(ids.getInt(dest));
            }
            rows.put(ids.getInt(origin), renamedRow);
        }

        final List<Integer> finals = new ArrayList<>();
        for (S f : dfa.getFinals()) {
            if (ids.containsKey(f)) {
                finals.add(ids.getInt(f));
            }
        }
        finals.sort(null);

        return new TabulatedDfa<>(TransitionTable.<Integer, I>of(table.getVocabulary(), rows), initialId, finals);
    }

    private static <S, I> Object2IntMap<S> numberStates(TransitionTable<S, I> table, S start, int initialId) {
        final Object2IntMap<S> ids = new Object2IntOpenHashMap<>();
        ids.defaultReturnValue(MISSING_ELEMENT);
        int next = initialId;
        ids.put(start, next++);
        for (List<S> row : table.getRows().values()) {
            for (S dest : row) {
                if (!ids.containsKey(dest)) {
                    ids.put(dest, next++);
                }
            }
        }
        return ids;
    }

    public static <S, I extends Comparable<? super I>> TabulatedDfa<Integer, I> beautify(Dfa<S, I> dfa) {
        return rename(dfa, 1);
    }

    /**
     * Whether two automata are equal up to renaming of their reachable states.
     */
    public static <S1, S2, I extends Comparable<? super I>> boolean isomorphic(Dfa<S1, I> a, Dfa<S2, I> b) {
        return beautify(a).equals(beautify(b));
    }

    /**
     * Rename an automaton whose states are sets of states, e.g. the raw output of a subset construction.
     * Non-empty sets are numbered from 1 in state order. The empty set becomes the {@link SentinelState#dead()}
     * sentinel: it gets no number, is listed last and loops to itself on every symbol.
     * Successors of the empty set are never looked up in {@code dfa}; a subset construction maps it to itself anyway.
     * @param dfa - automaton over set-valued states
     * @return renamed automaton, vocabulary order unchanged
     * @param <P> - set-valued state type
     * @param <I> - Input symbol type
     */
    public static <P extends Set<?>, I> ComputedDfa<SentinelState, I> beautifyWithSentinel(Dfa<P, I> dfa) {
        final Map<P, SentinelState> numbering = new HashMap<>();
        final Map<SentinelState, P> original = new HashMap<>();
        final List<SentinelState> states = new ArrayList<>();
        int next = 1;
        for (P st : dfa.getStates()) {
            if (!st.isEmpty() && !numbering.containsKey(st)) {
                final SentinelState renamed = SentinelState.numbered(next++);
                numbering.put(st, renamed);
                original.put(renamed, st);
                states.add(renamed);
            }
        }
        states.add(SentinelState.dead());

        final List<SentinelState> finals = new ArrayList<>();
        for (P f : dfa.getFinals()) {
            finals.add(lookupSentinel(f, numbering));
        }

        final TransitionRule<SentinelState, I> rule = (st, sy) -> st.isDead()
            ? SentinelState.dead()
            : lookupSentinel(dfa.getSuccessor(original.get(st), sy), numbering);

        return new ComputedDfa<>(dfa.getVocabulary(), states, lookupSentinel(dfa.getStart(), numbering), finals, rule);
    }

    private static <P extends Set<?>> SentinelState lookupSentinel(P st, Map<P, SentinelState> numbering) {
        if (st.isEmpty()) {
            return SentinelState.dead();
        }
        final SentinelState renamed = numbering.get(st);
        if (renamed == null) {
            throw new MalformedAutomatonException("State-set " + st + " is not a state");
        }
        return renamed;
    }
}
