package DFAKit.Model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Explicit transitions of an automaton, built incrementally.
 * Each row maps an origin to its destinations, one per vocabulary symbol in vocabulary order.
 * Rows keep the order in which they were added; it is the discovery order used for renaming.
 */
public final class TransitionTable<S, I> {
    private final List<I> vocabulary;
    private final Map<S, List<S>> rows;

    private TransitionTable(List<I> vocabulary, Map<S, List<S>> rows) {
        this.vocabulary = vocabulary;
        this.rows = rows;
    }

    public static <S, I> TransitionTable<S, I> empty(List<? extends I> vocabulary) {
        return new TransitionTable<>(List.copyOf(vocabulary), Collections.emptyMap());
    }

    public static <S, I> TransitionTable<S, I> of(List<? extends I> vocabulary, Map<? extends S, ? extends List<? extends S>> rows) {
        return TransitionTable.<S, I>empty(vocabulary).withRows(rows);
    }

    /**
     * New table with the given rows appended. Rows for origins already present are ignored.
     */
    public TransitionTable<S, I> withRows(Map<? extends S, ? extends List<? extends S>> newRows) {
        final Map<S, List<S>> result = new LinkedHashMap<>(this.rows);
        for (Map.Entry<? extends S, ? extends List<? extends S>> e : newRows.entrySet()) {
            final List<? extends S> row = e.getValue();
            if (row.size() != vocabulary.size()) {
                throw new MalformedAutomatonException(
                    "Row of " + e.getKey() + " has " + row.size() + " destinations, expected " + vocabulary.size());
            }
            result.putIfAbsent(e.getKey(), Collections.unmodifiableList(new ArrayList<>(row)));
        }
        return new TransitionTable<>(vocabulary, Collections.unmodifiableMap(result));
    }

    public List<I> getVocabulary() {
        return vocabulary;
    }

    public Map<S, List<S>> getRows() {
        return rows;
    }

    public List<S> getRow(S origin) {
        return rows.get(origin);
    }

    public boolean hasRow(S origin) {
        return rows.containsKey(origin);
    }

    /**
     * All origins, in row order.
     */
    public List<S> getOrigins() {
        return new ArrayList<>(rows.keySet());
    }

    /**
     * All destinations, deduplicated, in row-then-column order of first appearance.
     * While the table is being built this may contain states that have no row yet.
     */
    public List<S> getDestinations() {
        final Set<S> result = new LinkedHashSet<>();
        for (List<S> row : rows.values()) {
            result.addAll(row);
        }
        return new ArrayList<>(result);
    }

    /**
     * Destinations that have no row of their own yet, in first-seen order.
     */
    public List<S> getPendingStates() {
        final List<S> result = getDestinations();
        result.removeIf(rows::containsKey);
        return result;
    }

    /**
     * Triples in row-then-column order.
     */
    public List<Triple<S, I>> toTriples() {
        final List<Triple<S, I>> result = new ArrayList<>(rows.size() * vocabulary.size());
        for (Map.Entry<S, List<S>> e : rows.entrySet()) {
            for (int i = 0; i < vocabulary.size(); i++) {
                result.add(new Triple<>(e.getKey(), vocabulary.get(i), e.getValue().get(i)));
            }
        }
        return result;
    }

    public int size() {
        return rows.size();
    }

    // Row order is significant, so compare entries as lists
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TransitionTable)) {
            return false;
        }
        final TransitionTable<?, ?> other = (TransitionTable<?, ?>) o;
        return vocabulary.equals(other.vocabulary)
            && new ArrayList<>(rows.entrySet()).equals(new ArrayList<>(other.rows.entrySet()));
    }

    @Override
    public int hashCode() {
        return 31 * vocabulary.hashCode() + new ArrayList<>(rows.entrySet()).hashCode();
    }

    @Override
    public String toString() {
        return "TransitionTable{vocabulary=" + vocabulary + ", rows=" + rows + "}";
    }
}
