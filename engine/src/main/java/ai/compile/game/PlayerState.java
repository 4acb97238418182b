package ai.compile.game;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Everything one side owns: three lanes, hand, deck, discard pile, protocols and counters.
 * <p>
 * <strong>Ordering conventions</strong> (all lists):
 * <ul>
 *   <li>Lanes are bottom-to-top: index 0 is the oldest, covered card; the last element is the
 *       uncovered card.</li>
 *   <li>The deck draws from the front (index 0).</li>
 *   <li>Hand and discard keep insertion order.</li>
 * </ul>
 * Getters return unmodifiable views. Mutation goes through {@link GameState}, which keeps the
 * lane value cache and statistics in step with every change.
 */
public class PlayerState {
    public static final int LANES = 3;

    final List<List<PlayedCard>> lanes = new ArrayList<>();
    final List<PlayedCard> hand = new ArrayList<>();
    final List<PlayedCard> deck = new ArrayList<>();
    final List<PlayedCard> discard = new ArrayList<>();
    final List<String> protocols = new ArrayList<>();
    final boolean[] compiled = new boolean[LANES];
    final int[] laneValues = new int[LANES];
    PlayerStats stats = new PlayerStats();
    boolean cannotCompile;

    /**
     * Creates an empty player board with the given protocols in lane order.
     *
     * @param protocols exactly three distinct protocol names
     */
    public PlayerState(List<String> protocols) {
        Objects.requireNonNull(protocols, "protocols");
        if (protocols.size() != LANES) {
            throw new IllegalArgumentException("Exactly " + LANES + " protocols required, got " + protocols);
        }
        if (protocols.stream().distinct().count() != LANES) {
            throw new IllegalArgumentException("Protocols must be distinct: " + protocols);
        }
        this.protocols.addAll(protocols);
        for (int i = 0; i < LANES; i++) {
            lanes.add(new ArrayList<>());
        }
    }

    /**
     * Deep copy; {@link PlayedCard} instances are immutable and shared.
     */
    public PlayerState copy() {
        PlayerState clone = new PlayerState(protocols);
        for (int i = 0; i < LANES; i++) {
            clone.lanes.get(i).addAll(lanes.get(i));
        }
        clone.hand.addAll(hand);
        clone.deck.addAll(deck);
        clone.discard.addAll(discard);
        System.arraycopy(compiled, 0, clone.compiled, 0, LANES);
        System.arraycopy(laneValues, 0, clone.laneValues, 0, LANES);
        clone.stats = stats.copy();
        clone.cannotCompile = cannotCompile;
        return clone;
    }

    public List<List<PlayedCard>> getLanes() {
        List<List<PlayedCard>> views = new ArrayList<>(LANES);
        for (List<PlayedCard> lane : lanes) {
            views.add(Collections.unmodifiableList(lane));
        }
        return Collections.unmodifiableList(views);
    }

    public List<PlayedCard> getLane(int laneIndex) {
        return Collections.unmodifiableList(lanes.get(laneIndex));
    }

    /**
     * Uncovered card of a lane, or {@code null} when the lane is empty.
     */
    public PlayedCard top(int laneIndex) {
        List<PlayedCard> lane = lanes.get(laneIndex);
        return lane.isEmpty() ? null : lane.get(lane.size() - 1);
    }

    public List<PlayedCard> getHand() {
        return Collections.unmodifiableList(hand);
    }

    public List<PlayedCard> getDeck() {
        return Collections.unmodifiableList(deck);
    }

    public List<PlayedCard> getDiscard() {
        return Collections.unmodifiableList(discard);
    }

    public List<String> getProtocols() {
        return Collections.unmodifiableList(protocols);
    }

    public String getProtocol(int laneIndex) {
        return protocols.get(laneIndex);
    }

    public boolean isCompiled(int laneIndex) {
        return compiled[laneIndex];
    }

    public int compiledCount() {
        int n = 0;
        for (boolean c : compiled) {
            if (c) {
                n++;
            }
        }
        return n;
    }

    public int getLaneValue(int laneIndex) {
        return laneValues[laneIndex];
    }

    public int[] getLaneValues() {
        return Arrays.copyOf(laneValues, LANES);
    }

    public PlayerStats getStats() {
        return stats;
    }

    /**
     * Set by "your opponent cannot compile next turn"; cleared when this side's turn ends.
     */
    public boolean isCannotCompile() {
        return cannotCompile;
    }

    public int cardsOnBoard() {
        int n = 0;
        for (List<PlayedCard> lane : lanes) {
            n += lane.size();
        }
        return n;
    }

    /**
     * Returns every card this side currently holds in any container.
     */
    public List<PlayedCard> allCards() {
        List<PlayedCard> all = new ArrayList<>(hand);
        all.addAll(deck);
        all.addAll(discard);
        for (List<PlayedCard> lane : lanes) {
            all.addAll(lane);
        }
        return all;
    }
}
