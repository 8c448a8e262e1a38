package DFAKit.Model;

import java.util.Comparator;

/**
 * One transition (origin, symbol, destination).
 */
public record Triple<S, I>(S origin, I symbol, S destination) {

    /**
     * Order by origin, then symbol. This is the order of a canonical triple relation.
     */
    public static <S extends Comparable<? super S>, I extends Comparable<? super I>> Comparator<Triple<S, I>> byOriginAndSymbol() {
        return Comparator.comparing((Triple<S, I> t) -> t.origin()).thenComparing(t -> t.symbol());
    }

    @Override
    public String toString() {
        return "(" + origin + ", " + symbol + ", " + destination + ")";
    }
}
