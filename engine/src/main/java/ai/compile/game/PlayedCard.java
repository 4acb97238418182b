package ai.compile.game;

import java.util.Objects;

/**
 * A physical copy of a {@link Card} inside one game.
 * <p>
 * The id is assigned when the deck is built and never changes; orientation and the revealed flag
 * are replaced through the {@code with*} methods, which return a new instance. Containers hold
 * these instances, so a flip swaps the element in its lane rather than mutating it.
 */
public final class PlayedCard {
    private final String id;
    private final Card card;
    private final boolean faceUp;
    private final boolean revealed;

    public PlayedCard(String id, Card card, boolean faceUp, boolean revealed) {
        this.id = Objects.requireNonNull(id, "id");
        this.card = Objects.requireNonNull(card, "card");
        this.faceUp = faceUp;
        this.revealed = revealed;
    }

    public String getId() {
        return id;
    }

    public Card getCard() {
        return card;
    }

    public String getProtocol() {
        return card.getProtocol();
    }

    public int getValue() {
        return card.getValue();
    }

    public boolean isFaceUp() {
        return faceUp;
    }

    /**
     * Whether the opponent has been shown this card while it is hidden (in hand or face-down).
     */
    public boolean isRevealed() {
        return revealed;
    }

    public PlayedCard withFaceUp(boolean newFaceUp) {
        return newFaceUp == faceUp ? this : new PlayedCard(id, card, newFaceUp, revealed);
    }

    public PlayedCard withRevealed(boolean newRevealed) {
        return newRevealed == revealed ? this : new PlayedCard(id, card, faceUp, newRevealed);
    }

    public PlayedCard flipped() {
        return new PlayedCard(id, card, !faceUp, false);
    }

    /**
     * Card name for face-up cards, "a face-down card" otherwise; used in log lines.
     */
    public String describe() {
        return faceUp ? card.name() : "a face-down card";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PlayedCard)) {
            return false;
        }
        PlayedCard that = (PlayedCard) o;
        return faceUp == that.faceUp && revealed == that.revealed && id.equals(that.id) && card.equals(that.card);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, card, faceUp, revealed);
    }

    @Override
    public String toString() {
        return id + ":" + card.name() + (faceUp ? "" : "(down)");
    }
}
