package ai.compile.effects;

import ai.compile.game.CardLocation;
import ai.compile.game.GameState;
import ai.compile.game.PlayedCard;
import ai.compile.game.PlayerState;
import ai.compile.game.Side;
import java.util.ArrayList;
import java.util.List;

/**
 * Queries over the always-on rules granted by face-up cards.
 * <p>
 * Rules are collected from the board on every call rather than cached, so they follow flips,
 * covers and deletions without any bookkeeping.
 */
public final class PassiveRules {

    /**
     * A rule currently in force.
     *
     * @param rule      the printed rule
     * @param owner     side owning the granting card
     * @param laneIndex lane of the granting card
     * @param cardId    the granting card
     */
    public record ActiveRule(PassiveRule rule, Side owner, int laneIndex, String cardId) {

        /**
         * Whether the rule binds {@code side}.
         */
        public boolean appliesTo(Side side) {
            return switch (rule.target()) {
                case SELF -> owner == side;
                case OPPONENT -> owner.opponent() == side;
                case ALL -> true;
            };
        }

        public boolean covers(int lane) {
            return rule.scope() == PassiveRule.Scope.GLOBAL || laneIndex == lane;
        }
    }

    private PassiveRules() {
    }

    public static List<ActiveRule> active(GameState state) {
        List<ActiveRule> rules = new ArrayList<>();
        for (Side side : Side.values()) {
            PlayerState ps = state.side(side);
            for (int lane = 0; lane < PlayerState.LANES; lane++) {
                List<PlayedCard> cards = ps.getLane(lane);
                for (int i = 0; i < cards.size(); i++) {
                    PlayedCard card = cards.get(i);
                    if (!card.isFaceUp()) {
                        continue;
                    }
                    boolean uncovered = i == cards.size() - 1;
                    for (Effect effect : card.getCard().effectsFor(Trigger.PASSIVE)) {
                        if (!effect.box().requiresUncovered() || uncovered) {
                            rules.add(new ActiveRule(effect.rule(), side, lane, card.getId()));
                        }
                    }
                }
            }
        }
        return rules;
    }

    private static boolean binds(GameState state, PassiveRule.Type type, Side side, int lane) {
        for (ActiveRule active : active(state)) {
            if (active.rule().type() == type && active.appliesTo(side) && active.covers(lane)) {
                return true;
            }
        }
        return false;
    }

    /** "Your opponent cannot play cards in this line." */
    public static boolean isPlayBlocked(GameState state, Side side, int lane) {
        return binds(state, PassiveRule.Type.BLOCK_ALL_PLAY, side, lane);
    }

    public static boolean isFaceDownPlayBlocked(GameState state, Side side, int lane) {
        return binds(state, PassiveRule.Type.BLOCK_FACE_DOWN_PLAY, side, lane);
    }

    public static boolean requiresFaceDownPlay(GameState state, Side side, int lane) {
        return binds(state, PassiveRule.Type.REQUIRE_FACE_DOWN_PLAY, side, lane);
    }

    public static boolean allowsAnyProtocol(GameState state, Side side, int lane) {
        return binds(state, PassiveRule.Type.ALLOW_ANY_PROTOCOL_PLAY, side, lane);
    }

    public static boolean requiresNonMatchingProtocol(GameState state, Side side, int lane) {
        return binds(state, PassiveRule.Type.REQUIRE_NON_MATCHING_PROTOCOL, side, lane);
    }

    public static boolean skipsHandLimit(GameState state, Side side) {
        for (ActiveRule active : active(state)) {
            if (active.rule().type() == PassiveRule.Type.SKIP_HAND_LIMIT && active.appliesTo(side)) {
                return true;
            }
        }
        return false;
    }

    private static boolean inForce(GameState state, PassiveRule.Type type, int lane) {
        for (ActiveRule active : active(state)) {
            if (active.rule().type() == type && (lane < 0 || active.covers(lane))) {
                return true;
            }
        }
        return false;
    }

    /** "Cards cannot be flipped face-up." */
    public static boolean blocksFlipFaceUp(GameState state, int lane) {
        return inForce(state, PassiveRule.Type.BLOCK_FLIP_FACE_UP, lane);
    }

    public static boolean blocksProtocolRearrange(GameState state) {
        return inForce(state, PassiveRule.Type.BLOCK_PROTOCOL_REARRANGE, -1);
    }

    /** "Cards cannot shift from or to this line." */
    public static boolean blocksShifts(GameState state, int lane) {
        return inForce(state, PassiveRule.Type.BLOCK_SHIFTS, lane);
    }

    /**
     * True when middle-box commands of cards in the lane are ignored.
     */
    public static boolean ignoresMiddleCommands(GameState state, int lane) {
        return inForce(state, PassiveRule.Type.IGNORE_MIDDLE_COMMANDS, lane);
    }

    /**
     * True when the middle box of the card at {@code loc} would be ignored.
     */
    public static boolean ignoresMiddleCommands(GameState state, CardLocation loc) {
        return loc != null && loc.onBoard() && ignoresMiddleCommands(state, loc.laneIndex());
    }
}
