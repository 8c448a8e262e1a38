package DFAKit.Model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Automaton whose transitions are an explicit {@link TransitionTable}.
 * Its states are the table's origins, in row order.
 */
public final class TabulatedDfa<S, I> implements Dfa<S, I> {
    private static final int MISSING_SYMBOL = -1;

    private final TransitionTable<S, I> table;
    private final List<S> states;
    private final S start;
    private final Set<S> finals;
    private final Object2IntMap<I> symbolIndex;

    public TabulatedDfa(TransitionTable<S, I> table, S start, Collection<? extends S> finals) {
        this.table = table;
        this.states = Collections.unmodifiableList(table.getOrigins());
        this.start = start;
        this.finals = Collections.unmodifiableSet(new LinkedHashSet<>(finals));
        this.symbolIndex = new Object2IntOpenHashMap<>();
        this.symbolIndex.defaultReturnValue(MISSING_SYMBOL); // if missing, return MISSING_SYMBOL
        final List<I> vocabulary = table.getVocabulary();
        for (int i = 0; i < vocabulary.size(); i++) {
            this.symbolIndex.putIfAbsent(vocabulary.get(i), i);
        }
        validate();
    }

    private void validate() {
        if (!table.hasRow(start)) {
            throw new MalformedAutomatonException("Start state " + start + " has no row");
        }
        for (S f : finals) {
            if (!table.hasRow(f)) {
                throw new MalformedAutomatonException("Final state " + f + " has no row");
            }
        }
        final List<S> pending = table.getPendingStates();
        if (!pending.isEmpty()) {
            throw new MalformedAutomatonException("Destinations without a row: " + pending);
        }
    }

    public TransitionTable<S, I> getTable() {
        return table;
    }

    @Override
    public List<I> getVocabulary() {
        return table.getVocabulary();
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
        final List<S> row = table.getRow(state);
        if (row == null) {
            throw new MalformedAutomatonException("Unknown state: " + state);
        }
        final int idx = symbolIndex.getInt(symbol);
        if (idx == MISSING_SYMBOL) {
            throw new IllegalArgumentException("Unknown symbol: " + symbol);
        }
        return row.get(idx);
    }

    @Override
    public TabulatedDfa<S, I> withFinals(Collection<? extends S> finals) {
        return new TabulatedDfa<>(table, start, finals);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TabulatedDfa)) {
            return false;
        }
        final TabulatedDfa<?, ?> other = (TabulatedDfa<?, ?>) o;
        return Objects.equals(start, other.start) && finals.equals(other.finals) && table.equals(other.table);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, finals, table);
    }

    @Override
    public String toString() {
        return "TabulatedDfa{start=" + start + ", finals=" + finals + ", " + table + "}";
    }
}
