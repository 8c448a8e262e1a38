package DFAKit;

import java.util.ArrayList;
import java.util.List;

import DFAKit.Model.Dfa;
import DFAKit.Model.TabulatedDfa;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.util.automaton.minimizer.HopcroftMinimizer;

/**
 * Language equivalence: minimize both automata, rename both, compare.
 */
public class DfaEquivalence {

    public static <S1, S2, I extends Comparable<? super I>> boolean equivalent(Dfa<S1, I> a, Dfa<S2, I> b) {
        return Canonicalizer.isomorphic(minimize(a), minimize(b));
    }

    /**
     * Minimal automaton for the same language, computed by AutomataLib's Hopcroft minimizer.
     * Unreachable states are dropped.
     * @param dfa - automaton to minimize
     * @return minimal automaton over integer states, sorted vocabulary
     */
    public static <S, I extends Comparable<? super I>> TabulatedDfa<Integer, I> minimize(Dfa<S, I> dfa) {
        final Alphabet<I> alphabet = sortedAlphabet(dfa);
        final CompactDFA<I> compact = CompactBridge.toCompactDFA(dfa, alphabet);
        final CompactDFA<I> minimized = HopcroftMinimizer.minimizeDFA(compact, alphabet);
        return CompactBridge.fromDFA(minimized, alphabet);
    }

    static <I extends Comparable<? super I>> Alphabet<I> sortedAlphabet(Dfa<?, I> dfa) {
        final List<I> symbols = new ArrayList<>(dfa.getVocabulary());
        symbols.sort(null);
        return Alphabets.fromCollection(symbols);
    }
}
