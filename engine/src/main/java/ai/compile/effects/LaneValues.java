package ai.compile.effects;

import ai.compile.game.GameState;
import ai.compile.game.PlayedCard;
import ai.compile.game.PlayerState;
import ai.compile.game.Side;
import java.util.List;

/**
 * Derives lane totals from the board.
 * <p>
 * A face-up card counts its printed value. A face-down card counts 2, or the value granted by a
 * face-up "face-down cards in this stack" rule in the same stack. Line modifiers from passive rules
 * are added afterwards and the total never drops below zero.
 */
public final class LaneValues {
    public static final int FACE_DOWN_VALUE = 2;

    private LaneValues() {
    }

    /**
     * Effective value of a board card in the given stack.
     */
    public static int effectiveValue(GameState state, Side side, int lane, PlayedCard card) {
        if (card.isFaceUp()) {
            return card.getValue();
        }
        return faceDownValue(state.side(side).getLane(lane));
    }

    private static int faceDownValue(List<PlayedCard> stack) {
        int value = FACE_DOWN_VALUE;
        for (PlayedCard other : stack) {
            if (!other.isFaceUp()) {
                continue;
            }
            for (Effect effect : other.getCard().effectsFor(Trigger.PASSIVE)) {
                if (effect.rule().type() == PassiveRule.Type.FACE_DOWN_VALUE
                        && (!effect.box().requiresUncovered() || other == stack.get(stack.size() - 1))) {
                    value = Math.max(value, effect.rule().value());
                }
            }
        }
        return value;
    }

    /**
     * Total of one side in one lane, modifiers included.
     */
    public static int laneTotal(GameState state, Side side, int lane) {
        List<PlayedCard> stack = state.side(side).getLane(lane);
        int sum = 0;
        int faceDown = faceDownValue(stack);
        for (PlayedCard card : stack) {
            sum += card.isFaceUp() ? card.getValue() : faceDown;
        }
        return Math.max(0, sum + modifiers(state, side, lane));
    }

    private static int modifiers(GameState state, Side side, int lane) {
        int total = 0;
        for (PassiveRules.ActiveRule active : PassiveRules.active(state)) {
            if (active.laneIndex() != lane || !active.appliesTo(side)) {
                continue;
            }
            PassiveRule rule = active.rule();
            if (rule.type() == PassiveRule.Type.LANE_VALUE_MODIFIER) {
                total += rule.value();
            } else if (rule.type() == PassiveRule.Type.LANE_VALUE_PER_FACE_DOWN) {
                total += rule.value() * faceDownCardsInLine(state, lane);
            }
        }
        return total;
    }

    private static int faceDownCardsInLine(GameState state, int lane) {
        int n = 0;
        for (Side s : Side.values()) {
            for (PlayedCard card : state.side(s).getLane(lane)) {
                if (!card.isFaceUp()) {
                    n++;
                }
            }
        }
        return n;
    }

    /**
     * Recomputes every cached lane value of both sides.
     */
    public static void recalculate(GameState state) {
        for (Side side : Side.values()) {
            for (int lane = 0; lane < PlayerState.LANES; lane++) {
                state.cacheLaneValue(side, lane, laneTotal(state, side, lane));
            }
        }
    }

    /**
     * Total a side would have in a lane after adding one more card on top, ignoring any effects the
     * play would trigger. Used by AI evaluation.
     */
    public static int totalAfterPlay(GameState state, Side side, int lane, PlayedCard card, boolean faceUp) {
        GameState trial = state.copy();
        trial.placeOnLane(side, lane, card, faceUp);
        return trial.side(side).getLaneValue(lane);
    }
}
