package ai.compile.effects;

import ai.compile.game.CardLocation;
import ai.compile.game.GameState;
import ai.compile.game.PlayedCard;
import ai.compile.game.PlayerState;
import ai.compile.game.Side;
import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates {@link TargetFilter}s against the board. Pure; never mutates the state.
 */
public final class Targets {

    private Targets() {
    }

    /**
     * Lane the source card sits in now, or {@code fallback} when it has left the board.
     */
    public static int sourceLane(GameState state, String sourceCardId, int fallback) {
        CardLocation loc = state.locate(sourceCardId);
        return loc != null && loc.onBoard() ? loc.laneIndex() : fallback;
    }

    /**
     * Whether the board card at {@code loc} satisfies the filter for {@code actor}.
     *
     * @param sourceCardId card whose effect is targeting, for {@code excludeSelf}
     * @param sourceLane   lane used for {@code THIS}/{@code OTHER} lane filters
     */
    public static boolean matches(GameState state, Side actor, String sourceCardId, int sourceLane,
                                  TargetFilter filter, CardLocation loc) {
        if (loc == null || !loc.onBoard()) {
            return false;
        }
        PlayedCard card = state.cardAt(loc);
        if (filter.excludeSelf() && card.getId().equals(sourceCardId)) {
            return false;
        }
        switch (filter.owner()) {
            case OWN:
                if (loc.side() != actor) {
                    return false;
                }
                break;
            case OPPONENT:
                if (loc.side() == actor) {
                    return false;
                }
                break;
            default:
                break;
        }
        if (filter.faceState() == TargetFilter.FaceState.FACE_UP && !card.isFaceUp()) {
            return false;
        }
        if (filter.faceState() == TargetFilter.FaceState.FACE_DOWN && card.isFaceUp()) {
            return false;
        }
        boolean uncovered = state.isUncovered(loc);
        if (filter.position() == TargetFilter.Position.UNCOVERED && !uncovered) {
            return false;
        }
        if (filter.position() == TargetFilter.Position.COVERED && uncovered) {
            return false;
        }
        if (filter.lane() == TargetFilter.LaneFilter.THIS && loc.laneIndex() != sourceLane) {
            return false;
        }
        if (filter.lane() == TargetFilter.LaneFilter.OTHER && loc.laneIndex() == sourceLane) {
            return false;
        }
        if (filter.onlyLane() >= 0 && loc.laneIndex() != filter.onlyLane()) {
            return false;
        }
        if (filter.hasValueRange()) {
            int value = LaneValues.effectiveValue(state, loc.side(), loc.laneIndex(), card);
            if (value < filter.minValue() || value > filter.maxValue()) {
                return false;
            }
        }
        if (filter.protocolMatch() == TargetFilter.ProtocolMatch.MATCHING && !matchesLine(state, card, loc.laneIndex())) {
            return false;
        }
        return true;
    }

    /**
     * True when the card is face-up and its protocol is one of the two protocols of the lane.
     */
    public static boolean matchesLine(GameState state, PlayedCard card, int lane) {
        if (!card.isFaceUp()) {
            return false;
        }
        String protocol = card.getProtocol();
        return protocol.equals(state.getPlayer().getProtocol(lane)) || protocol.equals(state.getOpponent().getProtocol(lane));
    }

    /**
     * Ids of every board card matching the filter, player side first, bottom-to-top per lane.
     */
    public static List<String> candidates(GameState state, Side actor, String sourceCardId, int sourceLane,
                                          TargetFilter filter) {
        List<String> ids = new ArrayList<>();
        for (Side side : Side.values()) {
            for (int lane = 0; lane < PlayerState.LANES; lane++) {
                List<PlayedCard> stack = state.side(side).getLane(lane);
                for (int i = 0; i < stack.size(); i++) {
                    CardLocation loc = new CardLocation(side, CardLocation.Zone.LANE, lane, i);
                    if (matches(state, actor, sourceCardId, sourceLane, filter, loc)) {
                        ids.add(stack.get(i).getId());
                    }
                }
            }
        }
        return ids;
    }

    /**
     * Lanes a board card may be shifted to.
     *
     * @param destination restriction printed on the effect, or {@code null} for any other line
     * @param sourceLane  lane of the effect's source card, for "to this line"
     */
    public static List<Integer> shiftDestinations(GameState state, String cardId, Instruction.Destination destination,
                                                  int sourceLane) {
        List<Integer> lanes = new ArrayList<>();
        CardLocation loc = state.locate(cardId);
        if (loc == null || !loc.onBoard()) {
            return lanes;
        }
        if (PassiveRules.blocksShifts(state, loc.laneIndex())) {
            return lanes;
        }
        PlayedCard card = state.cardAt(loc);
        for (int lane = 0; lane < PlayerState.LANES; lane++) {
            if (lane == loc.laneIndex() || PassiveRules.blocksShifts(state, lane)) {
                continue;
            }
            if (destination == Instruction.Destination.THIS_LANE && lane != sourceLane) {
                continue;
            }
            if (destination == Instruction.Destination.TO_OR_FROM_THIS_LANE
                    && loc.laneIndex() != sourceLane && lane != sourceLane) {
                continue;
            }
            if (destination == Instruction.Destination.NON_MATCHING
                    && (card.getProtocol().equals(state.getPlayer().getProtocol(lane))
                    || card.getProtocol().equals(state.getOpponent().getProtocol(lane)))) {
                continue;
            }
            lanes.add(lane);
        }
        return lanes;
    }

    /**
     * Drops the targets an operation cannot act on: face-down cards while flipping face-up is blocked,
     * cards with nowhere to shift to.
     */
    public static List<String> unblocked(GameState state, Op op, List<String> ids, Instruction.Destination destination,
                                         int sourceLane) {
        if (op != Op.FLIP && op != Op.SHIFT) {
            return ids;
        }
        List<String> kept = new ArrayList<>();
        for (String id : ids) {
            CardLocation loc = state.locate(id);
            if (op == Op.FLIP && !state.cardAt(loc).isFaceUp() && PassiveRules.blocksFlipFaceUp(state, loc.laneIndex())) {
                continue;
            }
            if (op == Op.SHIFT && shiftDestinations(state, id, destination, sourceLane).isEmpty()) {
                continue;
            }
            kept.add(id);
        }
        return kept;
    }

    /**
     * Lanes eligible for a line-wide delete or return: enough cards in the line and at least one
     * card matching the filter.
     */
    public static List<Integer> massTargetLanes(GameState state, Side actor, String sourceCardId, int sourceLane,
                                                TargetFilter filter, int minCards) {
        List<Integer> lanes = new ArrayList<>();
        for (int lane = 0; lane < PlayerState.LANES; lane++) {
            if (filter.lane() == TargetFilter.LaneFilter.THIS && lane != sourceLane) {
                continue;
            }
            if (filter.lane() == TargetFilter.LaneFilter.OTHER && lane == sourceLane) {
                continue;
            }
            if (state.cardsInLane(lane) < minCards) {
                continue;
            }
            if (!candidatesInLane(state, actor, sourceCardId, sourceLane, filter, lane).isEmpty()) {
                lanes.add(lane);
            }
        }
        return lanes;
    }

    /**
     * Ids of matching cards within one lane (both sides).
     */
    public static List<String> candidatesInLane(GameState state, Side actor, String sourceCardId, int sourceLane,
                                                TargetFilter filter, int lane) {
        return candidates(state, actor, sourceCardId, sourceLane, filter.withOnlyLane(lane));
    }
}
