package ai.compile.effects;

/**
 * Keyword flags derived from a card's instructions; used by AI heuristics.
 */
public enum Keyword {
    DELETE,
    FLIP,
    SHIFT,
    RETURN,
    DRAW,
    PLAY,
    DISCARD;

    /**
     * Keywords that interfere with the opponent's board or hand.
     */
    public boolean isDisruptive() {
        return this == DELETE || this == FLIP || this == SHIFT || this == RETURN || this == DISCARD;
    }
}
