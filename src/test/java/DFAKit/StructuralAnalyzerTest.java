package DFAKit;

import DFAKit.Model.ComputedDfa;
import DFAKit.Model.Dfa;
import it.unimi.dsi.fastutil.ints.IntIntPair;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;
import java.util.Set;

public class StructuralAnalyzerTest {
  @Test
  void testComplement() {
    ComputedDfa<String, Integer> dfa = Examples.divisibleBy3();
    Dfa<String, Integer> complement = StructuralAnalyzer.complement(dfa);
    Assertions.assertEquals(Set.of("S1", "S2"), complement.getFinals());
    Assertions.assertFalse(Acceptance.accepts(complement, 1, 1, 0));
    Assertions.assertTrue(Acceptance.accepts(complement, 1, 0, 1));
    Assertions.assertTrue(Acceptance.accepts(complement, List.of(1, 0, 1)));
    Assertions.assertFalse(Acceptance.accepts(complement, List.of()));
    // original untouched
    Assertions.assertEquals(Set.of("S0"), dfa.getFinals());
  }

  @Test
  void testComplementDuality() {
    Random r = new Random(17);
    for (int i = 0; i < 20; i++) {
      ComputedDfa<Integer, Integer> dfa = RandomDfa.generateDFA(r, 6, 2, 0.5f);
      Dfa<Integer, Integer> complement = StructuralAnalyzer.complement(dfa);
      for (List<Integer> word : RandomDfa.allWords(dfa.getVocabulary(), 6)) {
        Assertions.assertNotEquals(Acceptance.accepts(dfa, word), Acceptance.accepts(complement, word));
      }
      Assertions.assertEquals(dfa.getFinals(), StructuralAnalyzer.complement(complement).getFinals());
    }
  }

  @Test
  void testDeadAndSync() {
    ComputedDfa<String, String> dfa = Examples.withTrapStates();
    Assertions.assertEquals(List.of("C", "D"), StructuralAnalyzer.deadStates(dfa));
    Assertions.assertEquals(List.of("C", "D"), StructuralAnalyzer.deadStates(dfa, true));
    Assertions.assertEquals(List.of("C"), StructuralAnalyzer.syncStates(dfa));
    Assertions.assertFalse(StructuralAnalyzer.isDead(dfa, "A"));
    Assertions.assertFalse(StructuralAnalyzer.isDead(dfa, "B"));
    Assertions.assertTrue(StructuralAnalyzer.isDead(dfa.getTransitionRule(), dfa.getVocabulary(), dfa.getFinals(), "D"));
    Assertions.assertFalse(StructuralAnalyzer.isSync(dfa, "D"));

    // a final self-looping state is not a sync state
    Dfa<String, String> accepting = dfa.withFinals(List.of("C"));
    Assertions.assertFalse(StructuralAnalyzer.isSync(accepting, "C"));
    Assertions.assertTrue(StructuralAnalyzer.deadStates(accepting).isEmpty());

    Assertions.assertTrue(StructuralAnalyzer.deadStates(Examples.divisibleBy3()).isEmpty());
    Assertions.assertTrue(StructuralAnalyzer.syncStates(Examples.divisibleBy3()).isEmpty());
  }

  @Test
  void testDeadStatesAgainstWords() {
    Random r = new Random(23);
    for (int i = 0; i < 20; i++) {
      ComputedDfa<Integer, Integer> dfa = RandomDfa.generateDFA(r, 6, 2, 0.15f);
      List<List<Integer>> words = RandomDfa.allWords(dfa.getVocabulary(), dfa.size());
      List<Integer> dead = StructuralAnalyzer.deadStates(dfa);
      Assertions.assertEquals(dead, StructuralAnalyzer.deadStates(dfa, true));
      for (Integer s : dfa.getStates()) {
        boolean acceptsSomething = false;
        for (List<Integer> word : words) {
          if (dfa.isAccepting(Acceptance.walk(dfa.getTransitionRule(), s, word))) {
            acceptsSomething = true;
            break;
          }
        }
        Assertions.assertEquals(!acceptsSomething, dead.contains(s), "state " + s);
      }
    }
  }

  @Test
  void testCounts() {
    ComputedDfa<String, Integer> div3 = Examples.divisibleBy3();
    Assertions.assertEquals(3, StructuralAnalyzer.size(div3));
    IntIntPair all = StructuralAnalyzer.nodesAndEdges(div3);
    Assertions.assertEquals(3, all.leftInt());
    Assertions.assertEquals(6, all.rightInt());
    Assertions.assertEquals(all, StructuralAnalyzer.nodesAndEdgesExcludingTrapStates(div3));
    Assertions.assertEquals(5, StructuralAnalyzer.cyclomaticComplexity(div3));
    Assertions.assertEquals(2, StructuralAnalyzer.incomingArrowCount(div3.getTransitionRule(), div3.getVocabulary(),
        div3.getStates(), "S0"));
    Assertions.assertEquals(2, StructuralAnalyzer.outgoingArrowCount(div3.getTransitionRule(), div3.getVocabulary(), "S0"));

    ComputedDfa<String, String> traps = Examples.withTrapStates();
    all = StructuralAnalyzer.nodesAndEdges(traps);
    Assertions.assertEquals(4, all.leftInt());
    Assertions.assertEquals(8, all.rightInt());
    IntIntPair meaningful = StructuralAnalyzer.nodesAndEdgesExcludingTrapStates(traps);
    Assertions.assertEquals(2, meaningful.leftInt());
    Assertions.assertEquals(2, meaningful.rightInt());
    Assertions.assertEquals(2, StructuralAnalyzer.cyclomaticComplexity(traps));
    Assertions.assertEquals(5, StructuralAnalyzer.incomingArrowCount(traps.getTransitionRule(), traps.getVocabulary(),
        traps.getStates(), "C"));
    Assertions.assertEquals(0, StructuralAnalyzer.incomingArrowCount(traps.getTransitionRule(), traps.getVocabulary(),
        traps.getStates(), "A"));
  }
}
