package DFAKit;

import DFAKit.Model.ComputedDfa;
import DFAKit.Model.TransitionRule;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertThrows;

public class ReachabilityTest {
  @Test
  void testDestinations() {
    ComputedDfa<String, Integer> dfa = Examples.divisibleBy3();
    TransitionRule<String, Integer> rule = dfa.getTransitionRule();
    Assertions.assertEquals(List.of("S1", "S2"), Reachability.destinationsFrom(rule, dfa.getVocabulary(), "S2"));
    Assertions.assertEquals(List.of(1), Reachability.transitionsFromTo(rule, dfa.getVocabulary(), "S1", "S0"));
    Assertions.assertEquals(List.of(), Reachability.transitionsFromTo(rule, dfa.getVocabulary(), "S0", "S2"));

    ComputedDfa<String, String> traps = Examples.withTrapStates();
    // duplicates are kept
    Assertions.assertEquals(List.of("C", "C"),
        Reachability.destinationsFrom(traps.getTransitionRule(), traps.getVocabulary(), "C"));
    Assertions.assertEquals(List.of("a", "b"),
        Reachability.transitionsFromTo(traps.getTransitionRule(), traps.getVocabulary(), "C", "C"));
  }

  @Test
  void testReachedStates() {
    ComputedDfa<String, String> dfa = Examples.withTrapStates();
    Assertions.assertEquals(Set.of("A", "B", "C"), Reachability.reachedStatesFrom(dfa, "A"));
    Assertions.assertEquals(Set.of("C"), Reachability.reachedStatesFrom(dfa, "C"));
    Assertions.assertEquals(Set.of("C", "D"),
        Reachability.reachedStatesFrom(dfa.getTransitionRule(), dfa.getVocabulary(), "D"));
    // sorted
    Assertions.assertEquals(List.of("A", "B", "C"), List.copyOf(Reachability.reachedStatesFrom(dfa, "A")));
  }

  @Test
  void testUnenumeratedStates() {
    // states are only known through the rule
    TransitionRule<Integer, Integer> rule = (n, b) -> (2 * n + b) % 5;
    Assertions.assertEquals(Set.of(0, 1, 2, 3, 4), Reachability.reachedStatesFrom(rule, List.of(0, 1), 0));
    // iteration cap too small
    assertThrows(IllegalStateException.class,
        () -> Reachability.reachedStatesFrom(rule, List.of(0, 1), 0, Comparator.naturalOrder(), 1));
  }

  @Test
  void testClosureProperty() {
    Random r = new Random(7);
    for (int i = 0; i < 20; i++) {
      ComputedDfa<Integer, Integer> dfa = RandomDfa.generateDFA(r, 12, 3, 0.3f);
      for (Integer s : dfa.getStates()) {
        Set<Integer> reached = Reachability.reachedStatesFrom(dfa, s);
        Assertions.assertTrue(reached.contains(s));
        for (Integer t : reached) {
          for (Integer a : dfa.getVocabulary()) {
            Assertions.assertTrue(reached.contains(dfa.getSuccessor(t, a)));
          }
        }
      }
    }
  }
}
