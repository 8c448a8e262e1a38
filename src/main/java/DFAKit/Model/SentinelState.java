package DFAKit.Model;

/**
 * State of a renamed automaton whose original states were state-sets.
 * Non-empty sets become {@link Numbered} states; the empty set becomes the single {@link Dead} sentinel,
 * which is never numbered and orders after every numbered state.
 */
public interface SentinelState extends Comparable<SentinelState> {
    SentinelState DEAD = new Dead();

    static SentinelState numbered(int id) {
        return new Numbered(id);
    }

    static SentinelState dead() {
        return DEAD;
    }

    boolean isDead();

    record Numbered(int id) implements SentinelState {
        @Override
        public boolean isDead() {
            return false;
        }

        @Override
        public int compareTo(SentinelState o) {
            if (o instanceof Numbered) {
                return Integer.compare(id, ((Numbered) o).id);
            }
            return -1;
        }

        @Override
        public String toString() {
            return String.valueOf(id);
        }
    }

    record Dead() implements SentinelState {
        @Override
        public boolean isDead() {
            return true;
        }

        @Override
        public int compareTo(SentinelState o) {
            return o.isDead() ? 0 : 1;
        }

        @Override
        public String toString() {
            return "dead";
        }
    }
}
