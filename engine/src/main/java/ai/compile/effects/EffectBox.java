package ai.compile.effects;

/**
 * The three text boxes printed on a card.
 * <p>
 * Top-box effects are active whenever the card is face-up, even if covered. Middle and bottom
 * box effects additionally require the card to be uncovered.
 */
public enum EffectBox {
    TOP,
    MIDDLE,
    BOTTOM;

    public boolean requiresUncovered() {
        return this != TOP;
    }
}
