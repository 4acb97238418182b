package ai.compile.game;

/**
 * The six phases of a turn, in order.
 */
public enum Phase {
    START,
    CONTROL,
    COMPILE,
    ACTION,
    HAND_LIMIT,
    END;

    /**
     * Returns the phase that follows this one within a turn; {@code END} wraps to {@code START}.
     */
    public Phase next() {
        Phase[] all = values();
        return all[(ordinal() + 1) % all.length];
    }
}
