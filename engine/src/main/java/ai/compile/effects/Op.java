package ai.compile.effects;

/**
 * Closed set of instruction operations understood by the {@link EffectInterpreter}.
 * <p>
 * The catalog loader rejects any operation name not listed here, so a malformed card
 * definition fails when the catalog is loaded rather than when the card is played.
 */
public enum Op {
    DRAW(Keyword.DRAW),
    MUTUAL_DRAW(Keyword.DRAW),
    DRAW_FROM_OPPONENT_DECK(Keyword.DRAW),
    REFRESH(Keyword.DRAW),
    DISCARD(Keyword.DISCARD),
    DISCARD_HAND_AND_REDRAW(Keyword.DISCARD),
    FLIP(Keyword.FLIP),
    FLIP_SELF(Keyword.FLIP),
    FLIP_PREVIOUS(Keyword.FLIP),
    FLIP_ALL(Keyword.FLIP),
    DELETE(Keyword.DELETE),
    DELETE_SELF(Keyword.DELETE),
    DELETE_ALL_IN_LANE(Keyword.DELETE),
    DELETE_HIGHEST_UNCOVERED(Keyword.DELETE),
    DELETE_LOWEST_COVERED_IN_LANE(Keyword.DELETE),
    SHIFT(Keyword.SHIFT),
    SHIFT_SELF(Keyword.SHIFT),
    SHIFT_PREVIOUS(Keyword.SHIFT),
    SHIFT_ALL_FACE_DOWN(Keyword.SHIFT),
    RETURN(Keyword.RETURN),
    RETURN_ALL_IN_LANE(Keyword.RETURN),
    PLAY_FROM_HAND(Keyword.PLAY),
    PLAY_TOP_OF_DECK(Keyword.PLAY),
    PLAY_TOP_OF_DECK_UNDER_SELF(Keyword.PLAY),
    REARRANGE_PROTOCOLS(null),
    SWAP_PROTOCOLS(null),
    SWAP_STACKS(null),
    REVEAL_HAND(null),
    REVEAL_CARD(null),
    REVEAL_FROM_HAND(null),
    GIVE(null),
    TAKE_RANDOM(null),
    BLOCK_COMPILE(null),
    CHOICE(null);

    private final Keyword keyword;

    Op(Keyword keyword) {
        this.keyword = keyword;
    }

    /**
     * Keyword flag this operation contributes to its card, or {@code null}.
     */
    public Keyword keyword() {
        return keyword;
    }

    /**
     * True for operations that pick a single card on the board through a target filter.
     */
    public boolean isTargeted() {
        return this == FLIP || this == DELETE || this == SHIFT || this == RETURN || this == REVEAL_CARD;
    }
}
