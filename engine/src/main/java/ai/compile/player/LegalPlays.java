package ai.compile.player;

import ai.compile.actions.ActionRequired;
import ai.compile.actions.Targeting;
import ai.compile.effects.LanePlayability;
import ai.compile.engine.CompileEngine;
import ai.compile.game.GameState;
import ai.compile.game.Phase;
import ai.compile.game.PlayedCard;
import ai.compile.game.PlayerState;
import ai.compile.game.Side;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Enumerates the decisions available to a side, as {@link AIAction}s.
 * <p>
 * Discards are listed once, as the first cards of the hand; a strategy that cares which cards go picks
 * them itself.
 */
public final class LegalPlays {

    private LegalPlays() {
    }

    /**
     * The side expected to decide next: the actor of the pending action, otherwise the turn player.
     */
    public static Side decider(GameState state) {
        ActionRequired action = state.getActionRequired();
        return action != null ? action.actor() : state.getTurn();
    }

    /**
     * Every legal decision in the current state, or an empty list when the game is over.
     */
    public static List<AIAction> listLegalActions(GameState state) {
        if (state == null || state.isGameOver()) {
            return Collections.emptyList();
        }
        ActionRequired action = state.getActionRequired();
        return action != null ? answers(state, action) : turnActions(state);
    }

    /**
     * Compiles in the compile phase; plays in both orientations and the refresh in the action phase.
     */
    public static List<AIAction> turnActions(GameState state) {
        List<AIAction> actions = new ArrayList<>();
        Side turn = state.getTurn();
        if (state.getPhase() == Phase.COMPILE) {
            for (int lane : CompileEngine.compilableLanes(state, turn)) {
                actions.add(AIAction.compile(lane));
            }
            return actions;
        }
        if (state.getPhase() != Phase.ACTION) {
            return actions;
        }
        actions.addAll(plays(state, turn));
        actions.add(AIAction.fillHand());
        return actions;
    }

    /**
     * Every legal turn play of the side's hand.
     */
    public static List<AIAction> plays(GameState state, Side side) {
        List<AIAction> actions = new ArrayList<>();
        for (PlayedCard card : state.side(side).getHand()) {
            for (int lane = 0; lane < PlayerState.LANES; lane++) {
                LanePlayability playability = LanePlayability.evaluate(state, side, lane, card);
                if (playability.faceUpAllowed()) {
                    actions.add(AIAction.playCard(card.getId(), lane, true));
                }
                if (playability.faceDownAllowed()) {
                    actions.add(AIAction.playCard(card.getId(), lane, false));
                }
            }
        }
        return actions;
    }

    /**
     * Every legal answer to the pending action, ending with {@link AIAction#skip()} when it is optional.
     */
    public static List<AIAction> answers(GameState state, ActionRequired action) {
        List<AIAction> actions = new ArrayList<>();
        switch (action.type()) {
            case DISCARD: {
                List<PlayedCard> hand = state.side(action.actor()).getHand();
                if (hand.size() >= action.count()) {
                    List<String> ids = new ArrayList<>();
                    for (int i = 0; i < action.count(); i++) {
                        ids.add(hand.get(i).getId());
                    }
                    actions.add(AIAction.discard(ids));
                }
                break;
            }
            case PLAY_FROM_HAND:
                for (PlayedCard card : state.side(action.actor()).getHand()) {
                    for (int lane : Targeting.legalPlayLanes(state, action, card)) {
                        LanePlayability playability = LanePlayability.evaluate(state, action.actor(), lane, card);
                        if (playability.faceUpAllowed() && !action.faceDownOnly()) {
                            actions.add(AIAction.playCard(card.getId(), lane, true));
                        }
                        if (playability.faceDownAllowed()) {
                            actions.add(AIAction.playCard(card.getId(), lane, false));
                        }
                    }
                }
                break;
            case PROMPT_OPTIONAL_EFFECT:
                actions.add(AIAction.answerPrompt(true));
                actions.add(AIAction.answerPrompt(false));
                return actions;
            case PROMPT_CHOICE:
                for (int i = 0; i < action.options().size(); i++) {
                    actions.add(AIAction.chooseOption(i));
                }
                break;
            case REARRANGE_PROTOCOLS:
                for (List<String> order : permutations(state.side(action.targetSide()).getProtocols())) {
                    if (Targeting.isProtocolOrderAllowed(action, order)) {
                        actions.add(AIAction.rearrange(order));
                    }
                }
                break;
            case SWAP_PROTOCOLS:
                for (int i = 0; i < PlayerState.LANES; i++) {
                    for (int j = i + 1; j < PlayerState.LANES; j++) {
                        List<String> order = new ArrayList<>(state.side(action.targetSide()).getProtocols());
                        Collections.swap(order, i, j);
                        if (Targeting.isProtocolOrderAllowed(action, order)) {
                            actions.add(AIAction.swap(i, j));
                        }
                    }
                }
                break;
            case PROMPT_USE_CONTROL:
                actions.add(AIAction.control(null));
                actions.add(AIAction.control(action.actor()));
                actions.add(AIAction.control(action.actor().opponent()));
                return actions;
            default:
                if (action.type() == ActionRequired.Type.SELECT_PHASE_EFFECT || action.type().isCardSelection()
                        || action.type().isHandSelection()) {
                    for (String id : Targeting.legalCardTargets(state, action)) {
                        actions.add(AIAction.selectCard(id));
                    }
                } else if (action.type().isLaneSelection()) {
                    for (int lane : Targeting.legalLanes(state, action)) {
                        actions.add(AIAction.selectLane(lane));
                    }
                }
                break;
        }
        if (action.optional()) {
            actions.add(AIAction.skip());
        }
        return actions;
    }

    static List<List<String>> permutations(List<String> items) {
        List<List<String>> result = new ArrayList<>();
        permute(new ArrayList<>(items), 0, result);
        return result;
    }

    private static void permute(List<String> items, int k, List<List<String>> result) {
        if (k == items.size()) {
            result.add(new ArrayList<>(items));
            return;
        }
        for (int i = k; i < items.size(); i++) {
            Collections.swap(items, k, i);
            permute(items, k + 1, result);
            Collections.swap(items, k, i);
        }
    }
}
