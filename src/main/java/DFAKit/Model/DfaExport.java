package DFAKit.Model;

import java.util.List;

/**
 * Structured form of an automaton, as handed to printers, writers and graph tools.
 * Triples are sorted by (origin, symbol).
 */
public record DfaExport<S, I>(List<I> vocabulary, List<S> states, S start, List<S> finals, List<Triple<S, I>> triples) {

    public DfaExport {
        vocabulary = List.copyOf(vocabulary);
        states = List.copyOf(states);
        finals = List.copyOf(finals);
        triples = List.copyOf(triples);
    }
}
