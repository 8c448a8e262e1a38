package DFAKit.Model;

/**
 * What a table-backed transition rule does when a (state, symbol) pair has no triple.
 */
public enum LookupPolicy {
    /** Fail with {@link IncompleteTransitionTableException}. */
    STRICT,
    /** Return the destination of the last triple in the table. Kept for compatibility only. */
    LAST_TRIPLE_FALLBACK
}
