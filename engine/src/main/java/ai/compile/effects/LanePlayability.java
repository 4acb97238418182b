package ai.compile.effects;

import ai.compile.game.GameState;
import ai.compile.game.PlayedCard;
import ai.compile.game.PlayerState;
import ai.compile.game.Side;

/**
 * Whether a side may play into a lane, and in which orientation.
 * <p>
 * Rules are checked in precedence order: a blocked lane rejects everything; a face-down block
 * rejects face-down plays; "play face-down only" rejects face-up plays; "non-matching only" lets a
 * face-up card in only when it matches neither protocol of the lane; otherwise a face-up card must
 * match one of the two protocols unless its owner may play any protocol or the card ignores
 * protocol matching.
 *
 * @param playable        at least one orientation is allowed
 * @param faceUpAllowed   a face-up play is allowed (for the given card, or for some card in hand)
 * @param faceDownAllowed a face-down play is allowed
 * @param reason          why the lane is closed, or empty
 */
public record LanePlayability(boolean playable, boolean faceUpAllowed, boolean faceDownAllowed, String reason) {

    public static LanePlayability closed(String reason) {
        return new LanePlayability(false, false, false, reason);
    }

    /**
     * Evaluates a lane for one card, or for the side's whole hand when {@code card} is {@code null}.
     */
    public static LanePlayability evaluate(GameState state, Side side, int lane, PlayedCard card) {
        if (lane < 0 || lane >= PlayerState.LANES) {
            return closed("No such line: " + lane);
        }
        if (PassiveRules.isPlayBlocked(state, side, lane)) {
            return closed("Cards cannot be played in line " + lane);
        }
        boolean faceDown = !PassiveRules.isFaceDownPlayBlocked(state, side, lane);
        boolean faceUp;
        if (card != null) {
            faceUp = faceUpAllowed(state, side, lane, card);
        } else {
            faceUp = false;
            for (PlayedCard inHand : state.side(side).getHand()) {
                if (faceUpAllowed(state, side, lane, inHand)) {
                    faceUp = true;
                    break;
                }
            }
        }
        String reason = faceUp || faceDown ? "" : "No legal orientation for line " + lane;
        return new LanePlayability(faceUp || faceDown, faceUp, faceDown, reason);
    }

    private static boolean faceUpAllowed(GameState state, Side side, int lane, PlayedCard card) {
        if (PassiveRules.requiresFaceDownPlay(state, side, lane)) {
            return false;
        }
        String protocol = card.getProtocol();
        boolean matches = protocol.equals(state.getPlayer().getProtocol(lane))
                || protocol.equals(state.getOpponent().getProtocol(lane));
        if (PassiveRules.requiresNonMatchingProtocol(state, side, lane)) {
            return !matches;
        }
        return matches
                || PassiveRules.allowsAnyProtocol(state, side, lane)
                || card.getCard().ignoresProtocolMatching();
    }

    /**
     * Whether the given orientation is allowed.
     */
    public boolean allows(boolean faceUp) {
        return faceUp ? faceUpAllowed : faceDownAllowed;
    }
}
