package DFAKit;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;

import DFAKit.Model.Dfa;
import DFAKit.Model.MalformedAutomatonException;
import DFAKit.Model.TabulatedDfa;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.exception.FormatException;
import net.automatalib.serialization.ba.BAParsers;
import net.automatalib.serialization.ba.BAWriter;
import net.automatalib.util.automaton.fsa.NFAs;

/**
 * Reading and writing automata in the BA format, through AutomataLib.
 * Symbols are replaced by their index in the sorted list of symbols.
 */
public class BAFormat {

    /**
     * Parse a BA automaton. Symbols are numbered in their sorted (string) order, so that the same symbol gets the
     * same index in every file regardless of where it first appears.
     * @param is - BA input
     * @return NFA over {@code 0 .. #symbols-1}
     * @throws MalformedAutomatonException if the automaton has no initial state
     */
    public static CompactNFA<Integer> readNFA(InputStream is) throws IOException, FormatException {
        final CompactNFA<String> parsed = BAParsers.nfa().readModel(is).model;
        if (parsed.getInitialStates().isEmpty()) {
            throw new MalformedAutomatonException("BA automaton has no initial state");
        }
        final List<String> symbols = new ArrayList<>(parsed.getInputAlphabet());
        symbols.sort(null);

        final int states = parsed.size();
        final CompactNFA<Integer> result = new CompactNFA<>(Alphabets.integers(0, symbols.size() - 1), states);
        for (int q = 0; q < states; q++) {
            result.addState(parsed.isAccepting(q));
        }
        for (int q : parsed.getInitialStates()) {
            result.setInitial(q, true);
        }
        for (int q = 0; q < states; q++) {
            for (int idx = 0; idx < symbols.size(); idx++) {
                result.addTransitions(q, idx, parsed.getTransitions(q, symbols.get(idx)));
            }
        }
        return result;
    }

    /**
     * Read a BA file and determinize it into a complete automaton.
     * @param filePath - path of the BA file
     * @return complete DFA over the symbol indexes
     */
    public static TabulatedDfa<Integer, Integer> readDfa(String filePath) {
        try (InputStream is = new FileInputStream(filePath)) {
            return determinize(readNFA(is));
        } catch (IOException | FormatException ex) {
            throw new RuntimeException(ex);
        }
    }

    public static TabulatedDfa<Integer, Integer> determinize(CompactNFA<Integer> nfa) {
        final Alphabet<Integer> alphabet = nfa.getInputAlphabet();
        final CompactDFA<Integer> dfa = NFAs.determinize(nfa, alphabet, false, false);
        return CompactBridge.fromDFA(dfa, alphabet);
    }

    public static <S> void writeDfa(OutputStream os, Dfa<S, Integer> dfa) throws IOException {
        final Alphabet<Integer> alphabet = DfaEquivalence.sortedAlphabet(dfa);
        final CompactDFA<Integer> compact = CompactBridge.toCompactDFA(dfa, alphabet);
        final BAWriter<Integer> baWriter = new BAWriter<>();
        baWriter.writeModel(os, compact, alphabet);
    }
}
