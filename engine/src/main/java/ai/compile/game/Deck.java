package ai.compile.game;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * One side's draw pile at the start of a game: every card of its three protocols, each bound to a
 * fresh {@link PlayedCard} identity.
 * <p>
 * Identities are {@code "<side>-<Protocol>-<value>"}, e.g. {@code "player-Speed-0"}, which keeps
 * them unique across both decks and readable in logs. Shuffling takes an explicit {@link Random}
 * so that a game is reproducible from its seed.
 */
public class Deck {
    /** The cards in draw order; index 0 is the top. */
    private final List<PlayedCard> cards = new ArrayList<>();

    /**
     * Builds an unshuffled deck.
     *
     * @param owner the side the deck belongs to
     * @param cards catalog entries of the owner's protocols
     */
    public Deck(Side owner, Collection<Card> cards) {
        for (Card card : cards) {
            this.cards.add(new PlayedCard(idFor(owner, card), card, false, false));
        }
    }

    /**
     * Identity a card gets in a deck built for {@code owner}.
     */
    public static String idFor(Side owner, Card card) {
        return owner.label() + "-" + card.name();
    }

    public void shuffle(Random random) {
        Collections.shuffle(cards, random);
    }

    /**
     * Draws and removes the top card, or returns {@code null} if the deck is empty.
     */
    public PlayedCard draw() {
        if (cards.isEmpty()) {
            return null;
        }
        return cards.remove(0);
    }

    public int size() {
        return cards.size();
    }

    public boolean isEmpty() {
        return cards.isEmpty();
    }

    public List<PlayedCard> asUnmodifiableList() {
        return Collections.unmodifiableList(cards);
    }

    /**
     * Moves every remaining card onto the bottom of the player's deck, preserving order.
     */
    public void moveInto(PlayerState playerState) {
        playerState.deck.addAll(cards);
        cards.clear();
    }

    @Override
    public String toString() {
        return "Deck(size=" + cards.size() + ")";
    }
}
