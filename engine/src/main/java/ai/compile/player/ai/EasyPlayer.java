package ai.compile.player.ai;

import ai.compile.actions.ActionRequired;
import ai.compile.effects.LanePlayability;
import ai.compile.effects.LaneValues;
import ai.compile.engine.CompileEngine;
import ai.compile.game.GameState;
import ai.compile.game.Phase;
import ai.compile.game.PlayedCard;
import ai.compile.game.PlayerState;
import ai.compile.game.Side;
import ai.compile.player.AIAction;
import ai.compile.player.AIPlayer;
import ai.compile.player.LegalPlays;
import java.util.List;

/**
 * Beginner level. Looks only at its own side of the board:
 *
 * - compiles whenever it can, the line closest to 10 first;
 * - otherwise plays its highest card face-up where the line lands closest to 10;
 * - otherwise the first card that fits face-down, otherwise refreshes.
 *
 * Pending actions get the first legal answer.
 */
public class EasyPlayer extends AIPlayer {

    @Override
    public AIAction nextAction(GameState state, Side side) {
        ActionRequired action = state.getActionRequired();
        if (action != null) {
            return firstAnswer(state, action);
        }
        if (state.getPhase() == Phase.COMPILE) {
            return compileClosestToTen(state, side);
        }
        AIAction faceUp = bestFaceUpPlay(state, side);
        if (faceUp != null) {
            return faceUp;
        }
        for (PlayedCard card : state.side(side).getHand()) {
            for (int lane = 0; lane < PlayerState.LANES; lane++) {
                if (LanePlayability.evaluate(state, side, lane, card).faceDownAllowed()) {
                    return AIAction.playCard(card.getId(), lane, false);
                }
            }
        }
        return AIAction.fillHand();
    }

    private AIAction firstAnswer(GameState state, ActionRequired action) {
        List<AIAction> answers = LegalPlays.answers(state, action);
        for (AIAction answer : answers) {
            if (answer.type() != AIAction.Type.SKIP) {
                return answer;
            }
        }
        return AIAction.skip();
    }

    private AIAction compileClosestToTen(GameState state, Side side) {
        int best = -1;
        for (int lane : CompileEngine.compilableLanes(state, side)) {
            if (best < 0 || state.side(side).getLaneValue(lane) < state.side(side).getLaneValue(best)) {
                best = lane;
            }
        }
        return best < 0 ? AIAction.fillHand() : AIAction.compile(best);
    }

    private AIAction bestFaceUpPlay(GameState state, Side side) {
        PlayedCard bestCard = null;
        int bestLane = -1;
        int bestDistance = Integer.MAX_VALUE;
        for (PlayedCard card : state.side(side).getHand()) {
            if (bestCard != null && card.getValue() < bestCard.getValue()) {
                continue;
            }
            for (int lane = 0; lane < PlayerState.LANES; lane++) {
                if (!LanePlayability.evaluate(state, side, lane, card).faceUpAllowed()) {
                    continue;
                }
                int distance = Math.abs(GameState.COMPILE_THRESHOLD - LaneValues.totalAfterPlay(state, side, lane, card, true));
                boolean higher = bestCard == null || card.getValue() > bestCard.getValue();
                if (higher || distance < bestDistance) {
                    bestCard = card;
                    bestLane = lane;
                    bestDistance = distance;
                }
            }
        }
        return bestCard == null ? null : AIAction.playCard(bestCard.getId(), bestLane, true);
    }
}
