package DFAKit.Model;

/**
 * Thrown when an automaton violates its structural invariants: the start state or a final state is not
 * one of the states, or a transition leads outside the states.
 */
public class MalformedAutomatonException extends IllegalArgumentException {

    public MalformedAutomatonException(String message) {
        super(message);
    }
}
