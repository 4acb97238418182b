package ai.compile.game;

/**
 * The two seats at the table.
 * <p>
 * The engine is symmetric: every rule is written in terms of "the acting side" and
 * {@link #opponent()}, never in terms of a human or an AI.
 */
public enum Side {
    PLAYER("player"),
    OPPONENT("opponent");

    private final String label;

    Side(String label) {
        this.label = label;
    }

    /**
     * Returns the other side.
     *
     * @return {@code OPPONENT} for {@code PLAYER} and vice versa
     */
    public Side opponent() {
        return this == PLAYER ? OPPONENT : PLAYER;
    }

    /**
     * Lower-case label used in logs and match output.
     */
    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
