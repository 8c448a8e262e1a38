package DFAKit;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import DFAKit.Model.Dfa;
import DFAKit.Model.IncompleteTransitionTableException;
import DFAKit.Model.MalformedAutomatonException;
import DFAKit.Model.TabulatedDfa;
import DFAKit.Model.TransitionTable;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.DFA;
import net.automatalib.automaton.fsa.impl.CompactDFA;

/**
 * Copies automata to and from AutomataLib, which serves as minimizer, determinizer and file writer.
 */
public class CompactBridge {

    /**
     * Copy into a {@link CompactDFA}. State IDs follow the declared state order.
     * @param dfa - automaton to copy
     * @param alphabet - AutomataLib alphabet holding the automaton's vocabulary
     * @return complete compact DFA
     */
    public static <S, I> CompactDFA<I> toCompactDFA(Dfa<S, I> dfa, Alphabet<I> alphabet) {
        final CompactDFA<I> out = new CompactDFA<>(alphabet, dfa.size());
        final Object2IntMap<S> stateIds = new Object2IntOpenHashMap<>();

        for (S st : dfa.getStates()) {
            stateIds.put(st, out.addState(dfa.isAccepting(st)));
        }
        out.setInitialState(stateIds.getInt(dfa.getStart()));

        for (S st : dfa.getStates()) {
            final int id = stateIds.getInt(st);
            for (I symbol : dfa.getVocabulary()) {
                out.setTransition(id, alphabet.getSymbolIndex(symbol), stateIds.getInt(dfa.getSuccessor(st, symbol)));
            }
        }
        return out;
    }

    /**
     * Copy an AutomataLib DFA. Rows follow the DFA's state order.
     * @param dfa - complete DFA
     * @param inputs - input symbols, in column order
     * @return tabulated automaton
     * @throws MalformedAutomatonException if the DFA has no initial state
     * @throws IncompleteTransitionTableException if a transition is undefined
     */
    public static <S, I> TabulatedDfa<S, I> fromDFA(DFA<S, I> dfa, Collection<? extends I> inputs) {
        final S init = dfa.getInitialState();
        if (init == null) {
            throw new MalformedAutomatonException("DFA has no initial state");
        }
        final List<I> vocabulary = new ArrayList<>(inputs);
        final Map<S, List<S>> rows = new LinkedHashMap<>();
        final List<S> finals = new ArrayList<>();
        for (S st : dfa.getStates()) {
            final List<S> row = new ArrayList<>(vocabulary.size());
            for (I symbol : vocabulary) {
                final S succ = dfa.getSuccessor(st, symbol);
                if (succ == null) {
                    throw new IncompleteTransitionTableException(st, symbol);
                }
                row.add(succ);
            }
            rows.put(st, row);
            if (dfa.isAccepting(st)) {
                finals.add(st);
            }
        }
        return new TabulatedDfa<>(TransitionTable.of(vocabulary, rows), init, finals);
    }
}
