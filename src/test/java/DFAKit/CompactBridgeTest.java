package DFAKit;

import DFAKit.Model.ComputedDfa;
import DFAKit.Model.IncompleteTransitionTableException;
import DFAKit.Model.MalformedAutomatonException;
import DFAKit.Model.TabulatedDfa;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.word.Word;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertThrows;

public class CompactBridgeTest {
  @Test
  void testToCompactDFA() {
    ComputedDfa<String, Integer> div3 = Examples.divisibleBy3();
    Alphabet<Integer> alphabet = DfaEquivalence.sortedAlphabet(div3);
    CompactDFA<Integer> compact = CompactBridge.toCompactDFA(div3, alphabet);
    Assertions.assertEquals(3, compact.size());
    Assertions.assertTrue(compact.accepts(Word.fromSymbols(1, 1, 0)));
    Assertions.assertFalse(compact.accepts(Word.fromSymbols(1, 0, 1)));
    Assertions.assertTrue(compact.accepts(Word.epsilon()));
  }

  @Test
  void testFromDFA() {
    ComputedDfa<String, Integer> div3 = Examples.divisibleBy3();
    Alphabet<Integer> alphabet = DfaEquivalence.sortedAlphabet(div3);
    TabulatedDfa<Integer, Integer> back = CompactBridge.fromDFA(CompactBridge.toCompactDFA(div3, alphabet), alphabet);
    Assertions.assertEquals(List.of(0, 1, 2), back.getStates());
    Assertions.assertTrue(Canonicalizer.isomorphic(div3, back));
  }

  @Test
  void testFromPartialDFA() {
    Alphabet<Integer> alphabet = Alphabets.integers(0, 1);
    CompactDFA<Integer> partial = new CompactDFA<>(alphabet);
    int q0 = partial.addInitialState(true);
    partial.setTransition(q0, 0, q0);
    IncompleteTransitionTableException ex = assertThrows(IncompleteTransitionTableException.class,
        () -> CompactBridge.fromDFA(partial, alphabet));
    Assertions.assertEquals(1, ex.getSymbol());

    CompactDFA<Integer> noInitial = new CompactDFA<>(alphabet);
    noInitial.addState(true);
    assertThrows(MalformedAutomatonException.class, () -> CompactBridge.fromDFA(noInitial, alphabet));
  }
}
