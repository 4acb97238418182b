package ai.compile.player;

import ai.compile.engine.EngineResult;
import ai.compile.engine.RulesEngine;
import ai.compile.game.GameState;
import ai.compile.game.Side;

/**
 * Applies an {@link AIAction} through the public {@link RulesEngine} API on behalf of one side.
 */
public final class ActionApplier {

    private ActionApplier() {
    }

    public static EngineResult apply(GameState state, Side side, AIAction action) {
        switch (action.type()) {
            case PLAY_CARD:
                return RulesEngine.playCard(state, action.cardId(), action.laneIndex(), action.faceUp(), side);
            case FILL_HAND:
                if (side != state.getTurn()) {
                    return EngineResult.illegal(state, "It is " + state.getTurn() + "'s turn");
                }
                return RulesEngine.fillHand(state);
            case COMPILE:
                if (side != state.getTurn()) {
                    return EngineResult.illegal(state, "It is " + state.getTurn() + "'s turn");
                }
                return RulesEngine.compileLane(state, action.laneIndex());
            case DISCARD_CARDS:
                return RulesEngine.discardCards(state, action.cardIds(), side);
            case SELECT_CARD:
                return RulesEngine.resolveActionWithCard(state, action.cardId(), side);
            case SELECT_LANE:
                return RulesEngine.resolveActionWithLane(state, action.laneIndex(), side);
            case SKIP:
                return RulesEngine.skipAction(state, side);
            case REARRANGE:
                return RulesEngine.rearrangeProtocols(state, action.order(), side);
            case SWAP:
                return RulesEngine.swapProtocols(state, action.first(), action.second(), side);
            case CHOOSE_OPTION:
                return RulesEngine.resolveChoice(state, action.option(), side);
            case ACCEPT_PROMPT:
                return RulesEngine.resolvePrompt(state, action.accept(), side);
            case CONTROL:
                return RulesEngine.resolveControlPrompt(state, action.targetSide(), side);
            default:
                throw new IllegalArgumentException("Unknown action type " + action.type());
        }
    }
}
