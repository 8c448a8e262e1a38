package DFAKit;

import java.util.Arrays;

import DFAKit.Model.Dfa;
import DFAKit.Model.TransitionRule;

public final class Acceptance {

    private Acceptance() {
    }

    /**
     * Run the transition rule over the input, starting in {@code start}.
     * @return the state after the last symbol; {@code start} for empty input
     */
    public static <S, I> S walk(TransitionRule<S, I> rule, S start, Iterable<? extends I> input) {
        S current = start;
        for (I symbol : input) {
            current = rule.next(current, symbol);
        }
        return current;
    }

    public static <S, I> boolean accepts(Dfa<S, I> dfa, Iterable<? extends I> input) {
        return dfa.isAccepting(walk(dfa.getTransitionRule(), dfa.getStart(), input));
    }

    @SafeVarargs
    public static <S, I> boolean accepts(Dfa<S, I> dfa, I... input) {
        return accepts(dfa, Arrays.asList(input));
    }
}
