package ai.compile.actions;

import ai.compile.effects.EffectInterpreter;
import ai.compile.effects.Instruction;
import ai.compile.effects.LanePlayability;
import ai.compile.effects.Op;
import ai.compile.effects.PassiveRules;
import ai.compile.effects.TargetFilter;
import ai.compile.effects.Targets;
import ai.compile.game.GameState;
import ai.compile.game.PlayedCard;
import ai.compile.game.PlayerState;
import java.util.ArrayList;
import java.util.List;

/**
 * Legal answers to the active action. Every method is a pure function of its arguments, so a UI
 * can call {@link #isCardTargetable(PlayedCard, GameState)} for every card on screen to highlight
 * targets.
 */
public final class Targeting {

    private Targeting() {
    }

    /**
     * Whether the card is a legal answer to the active action.
     */
    public static boolean isCardTargetable(PlayedCard card, GameState state) {
        ActionRequired action = state.getActionRequired();
        if (card == null || action == null) {
            return false;
        }
        return legalCardTargets(state, action).contains(card.getId());
    }

    /**
     * Card ids that answer a card-picking action: board cards for selections, hand cards for
     * discards, gifts, reveals and plays, candidate cards for phase effect ordering.
     */
    public static List<String> legalCardTargets(GameState state, ActionRequired action) {
        List<String> ids = new ArrayList<>();
        switch (action.type()) {
            case DISCARD:
                for (PlayedCard card : state.side(action.actor()).getHand()) {
                    ids.add(card.getId());
                }
                return ids;
            case PLAY_FROM_HAND:
                for (PlayedCard card : state.side(action.actor()).getHand()) {
                    if (!legalPlayLanes(state, action, card).isEmpty()) {
                        ids.add(card.getId());
                    }
                }
                return ids;
            case SELECT_CARD_TO_GIVE:
            case SELECT_HAND_CARD_TO_REVEAL:
                for (PlayedCard card : state.side(action.actor()).getHand()) {
                    ids.add(card.getId());
                }
                return ids;
            case SELECT_PHASE_EFFECT:
                for (String id : action.candidateIds()) {
                    if (state.isOnBoard(id)) {
                        ids.add(id);
                    }
                }
                return ids;
            default:
                break;
        }
        if (!action.type().isCardSelection()) {
            return ids;
        }
        int sourceLane = Targets.sourceLane(state, action.sourceCardId(), action.laneIndex());
        TargetFilter filter = action.filter() == null ? TargetFilter.any() : action.filter();
        List<String> matching = Targets.candidates(state, action.actor(), action.sourceCardId(), sourceLane, filter);
        if (action.type() == ActionRequired.Type.SELECT_CARD_TO_FLIP) {
            matching = Targets.unblocked(state, Op.FLIP, matching, null, sourceLane);
        } else if (action.type() == ActionRequired.Type.SELECT_CARD_TO_SHIFT) {
            matching = Targets.unblocked(state, Op.SHIFT, matching, destinationOf(action), sourceLane);
        }
        for (String id : matching) {
            if (action.disallowedIds().contains(id)) {
                continue;
            }
            if (!action.candidateIds().isEmpty() && !action.candidateIds().contains(id)) {
                continue;
            }
            ids.add(id);
        }
        return ids;
    }

    /**
     * Lanes that answer a lane-picking action.
     */
    public static List<Integer> legalLanes(GameState state, ActionRequired action) {
        List<Integer> lanes = new ArrayList<>();
        int sourceLane = Targets.sourceLane(state, action.sourceCardId(), action.laneIndex());
        switch (action.type()) {
            case SELECT_LANE_FOR_SHIFT:
                lanes.addAll(Targets.shiftDestinations(state, action.targetCardId(), destinationOf(action), sourceLane));
                break;
            case SELECT_LANE_FOR_DELETE_ALL:
            case SELECT_LANE_FOR_RETURN_ALL:
                lanes.addAll(Targets.massTargetLanes(state, action.actor(), action.sourceCardId(), sourceLane,
                        action.filter(), action.instruction().minCards()));
                break;
            case SELECT_LANE_FOR_SHIFT_ALL:
                if (PassiveRules.blocksShifts(state, action.laneIndex())) {
                    break;
                }
                for (int lane = 0; lane < PlayerState.LANES; lane++) {
                    if (!PassiveRules.blocksShifts(state, lane)) {
                        lanes.add(lane);
                    }
                }
                break;
            case SELECT_LANE_FOR_DECK_PLAY:
                for (int lane = 0; lane < PlayerState.LANES; lane++) {
                    lanes.add(lane);
                }
                break;
            case SELECT_LANES_FOR_SWAP_STACKS: {
                PlayerState own = state.side(action.actor());
                boolean firstEmpty = !action.disallowedLanes().isEmpty()
                        && own.getLane(action.disallowedLanes().iterator().next()).isEmpty();
                for (int lane = 0; lane < PlayerState.LANES; lane++) {
                    if (!firstEmpty || !own.getLane(lane).isEmpty()) {
                        lanes.add(lane);
                    }
                }
                break;
            }
            case PLAY_FROM_HAND:
                for (int lane = 0; lane < PlayerState.LANES; lane++) {
                    for (PlayedCard card : state.side(action.actor()).getHand()) {
                        if (legalPlayLanes(state, action, card).contains(lane)) {
                            lanes.add(lane);
                            break;
                        }
                    }
                }
                break;
            default:
                break;
        }
        lanes.removeAll(action.disallowedLanes());
        return lanes;
    }

    private static Instruction.Destination destinationOf(ActionRequired action) {
        return action.instruction() == null ? Instruction.Destination.ANY_OTHER : action.instruction().destination();
    }

    /**
     * Lanes where {@code card} may be played to satisfy a PLAY_FROM_HAND action, in at least one
     * allowed orientation.
     */
    public static List<Integer> legalPlayLanes(GameState state, ActionRequired action, PlayedCard card) {
        List<Integer> lanes = new ArrayList<>();
        for (int lane = 0; lane < PlayerState.LANES; lane++) {
            if (action.disallowedLanes().contains(lane)) {
                continue;
            }
            LanePlayability playability = LanePlayability.evaluate(state, action.actor(), lane, card);
            if (playability.faceDownAllowed() || (!action.faceDownOnly() && playability.faceUpAllowed())) {
                lanes.add(lane);
            }
        }
        return lanes;
    }

    /**
     * Whether the action can be answered at all. Optional actions can always be skipped.
     */
    public static boolean hasLegalResolution(GameState state, ActionRequired action) {
        if (action.optional()) {
            return true;
        }
        if (action.type() == ActionRequired.Type.PLAY_FROM_HAND) {
            return EffectInterpreter.hasLegalPlay(state, action);
        }
        if (action.type() == ActionRequired.Type.DISCARD || action.type() == ActionRequired.Type.SELECT_PHASE_EFFECT
                || action.type().isCardSelection() || action.type().isHandSelection()) {
            return !legalCardTargets(state, action).isEmpty();
        }
        if (action.type().isLaneSelection()) {
            return !legalLanes(state, action).isEmpty();
        }
        return true;
    }

    /**
     * Whether a new protocol order for a rearrange or swap keeps the forbidden protocol (if any) off
     * the action's line.
     */
    public static boolean isProtocolOrderAllowed(ActionRequired action, List<String> order) {
        String forbidden = action.forbiddenProtocol();
        return forbidden == null || action.laneIndex() < 0 || !forbidden.equals(order.get(action.laneIndex()));
    }
}
