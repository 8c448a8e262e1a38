package DFAKit.Model;

/**
 * Thrown when a transition table has no entry for a (state, symbol) pair.
 * Callers relying on the legacy behavior can rebuild with {@link LookupPolicy#LAST_TRIPLE_FALLBACK}.
 */
public class IncompleteTransitionTableException extends RuntimeException {

    private final Object state;
    private final Object symbol;

    public IncompleteTransitionTableException(Object state, Object symbol) {
        super("No transition for state " + state + " on symbol " + symbol);
        this.state = state;
        this.symbol = symbol;
    }

    public Object getState() {
        return state;
    }

    public Object getSymbol() {
        return symbol;
    }
}
