package ai.compile.effects;

/**
 * When an {@link Effect} fires.
 */
public enum Trigger {
    /** Middle box: the card is played face-up, flipped face-up or uncovered. */
    ON_PLAY,
    /** Start phase of the owner's turn. */
    START,
    /** End phase of the owner's turn. */
    END,
    /** The card is face-up and uncovered and another card is about to be placed on it. */
    ON_COVER,
    /** The card is face-up and is about to be flipped. */
    ON_FLIP,
    /** The card is about to be discarded by a compile of its lane. */
    ON_COMPILE_DELETE,
    /** The owner just deleted one or more cards. */
    AFTER_DELETE,
    /** The owner's opponent just discarded one or more cards. */
    AFTER_OPPONENT_DISCARD,
    /** The owner just discarded during the hand limit check. */
    AFTER_CLEAR_CACHE,
    /** The owner just drew one or more cards. */
    AFTER_DRAW,
    /** Always-on rule while the card is active; carries a {@link PassiveRule} instead of instructions. */
    PASSIVE;

    /**
     * Reactive triggers fire from board events rather than from a phase or a placement.
     */
    public boolean isReactive() {
        return this == AFTER_DELETE || this == AFTER_OPPONENT_DISCARD
                || this == AFTER_CLEAR_CACHE || this == AFTER_DRAW;
    }
}
