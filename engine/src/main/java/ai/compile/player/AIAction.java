package ai.compile.player;

import ai.compile.game.Side;
import java.util.List;
import java.util.Objects;

/**
 * A decision a player hands back to the match loop: either a turn action or the answer to the
 * pending {@link ai.compile.actions.ActionRequired}.
 * <p>
 * Only the fields relevant to {@link #type()} are set; the rest keep their defaults ({@code null},
 * {@code -1}, {@code false}).
 */
public final class AIAction {

    public enum Type {
        PLAY_CARD,
        FILL_HAND,
        COMPILE,
        DISCARD_CARDS,
        SELECT_CARD,
        SELECT_LANE,
        SKIP,
        REARRANGE,
        SWAP,
        CHOOSE_OPTION,
        ACCEPT_PROMPT,
        CONTROL
    }

    private final Type type;
    private final String cardId;
    private final List<String> cardIds;
    private final int laneIndex;
    private final boolean faceUp;
    private final List<String> order;
    private final int second;
    private final Side targetSide;

    private AIAction(Type type, String cardId, List<String> cardIds, int laneIndex, boolean faceUp,
                     List<String> order, int second, Side targetSide) {
        this.type = Objects.requireNonNull(type, "type");
        this.cardId = cardId;
        this.cardIds = cardIds == null ? List.of() : List.copyOf(cardIds);
        this.laneIndex = laneIndex;
        this.faceUp = faceUp;
        this.order = order == null ? List.of() : List.copyOf(order);
        this.second = second;
        this.targetSide = targetSide;
    }

    public static AIAction playCard(String cardId, int laneIndex, boolean faceUp) {
        return new AIAction(Type.PLAY_CARD, cardId, null, laneIndex, faceUp, null, -1, null);
    }

    public static AIAction fillHand() {
        return new AIAction(Type.FILL_HAND, null, null, -1, false, null, -1, null);
    }

    public static AIAction compile(int laneIndex) {
        return new AIAction(Type.COMPILE, null, null, laneIndex, false, null, -1, null);
    }

    public static AIAction discard(List<String> cardIds) {
        return new AIAction(Type.DISCARD_CARDS, null, cardIds, -1, false, null, -1, null);
    }

    public static AIAction selectCard(String cardId) {
        return new AIAction(Type.SELECT_CARD, cardId, null, -1, false, null, -1, null);
    }

    public static AIAction selectLane(int laneIndex) {
        return new AIAction(Type.SELECT_LANE, null, null, laneIndex, false, null, -1, null);
    }

    public static AIAction skip() {
        return new AIAction(Type.SKIP, null, null, -1, false, null, -1, null);
    }

    public static AIAction rearrange(List<String> order) {
        return new AIAction(Type.REARRANGE, null, null, -1, false, order, -1, null);
    }

    public static AIAction swap(int first, int second) {
        return new AIAction(Type.SWAP, null, null, first, false, null, second, null);
    }

    public static AIAction chooseOption(int option) {
        return new AIAction(Type.CHOOSE_OPTION, null, null, option, false, null, -1, null);
    }

    public static AIAction answerPrompt(boolean accept) {
        return new AIAction(Type.ACCEPT_PROMPT, null, null, -1, accept, null, -1, null);
    }

    /**
     * Answer to the control prompt.
     *
     * @param targetSide whose protocols to rearrange, or {@code null} to decline
     */
    public static AIAction control(Side targetSide) {
        return new AIAction(Type.CONTROL, null, null, -1, false, null, -1, targetSide);
    }

    public Type type() {
        return type;
    }

    public String cardId() {
        return cardId;
    }

    public List<String> cardIds() {
        return cardIds;
    }

    /**
     * Lane for plays, compiles and lane selections; the option index for choices; the first index for
     * swaps.
     */
    public int laneIndex() {
        return laneIndex;
    }

    public int option() {
        return laneIndex;
    }

    public int first() {
        return laneIndex;
    }

    public int second() {
        return second;
    }

    /**
     * Orientation for plays; the answer for yes/no prompts.
     */
    public boolean faceUp() {
        return faceUp;
    }

    public boolean accept() {
        return faceUp;
    }

    public List<String> order() {
        return order;
    }

    public Side targetSide() {
        return targetSide;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AIAction)) {
            return false;
        }
        AIAction other = (AIAction) o;
        return type == other.type
                && laneIndex == other.laneIndex
                && faceUp == other.faceUp
                && second == other.second
                && Objects.equals(cardId, other.cardId)
                && cardIds.equals(other.cardIds)
                && order.equals(other.order)
                && targetSide == other.targetSide;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, cardId, cardIds, laneIndex, faceUp, order, second, targetSide);
    }

    @Override
    public String toString() {
        switch (type) {
            case PLAY_CARD:
                return "play " + cardId + " " + (faceUp ? "face-up" : "face-down") + " in line " + laneIndex;
            case FILL_HAND:
                return "fill hand";
            case COMPILE:
                return "compile line " + laneIndex;
            case DISCARD_CARDS:
                return "discard " + cardIds;
            case SELECT_CARD:
                return "select " + cardId;
            case SELECT_LANE:
                return "select line " + laneIndex;
            case SKIP:
                return "skip";
            case REARRANGE:
                return "rearrange " + order;
            case SWAP:
                return "swap lines " + laneIndex + " and " + second;
            case CHOOSE_OPTION:
                return "choose option " + laneIndex;
            case ACCEPT_PROMPT:
                return faceUp ? "accept" : "decline";
            case CONTROL:
                return targetSide == null ? "decline control" : "use control on " + targetSide;
            default:
                return type.name();
        }
    }
}
