package ai.compile.player;

import ai.compile.game.GameState;
import ai.compile.game.Side;

/**
 * Represents a player capable of providing the next decision for the match loop.
 */
public interface Player {

    /**
     * Provide the next decision for {@code side}.
     *
     * @param state current game state; {@code side} is the actor of its pending action, or the turn
     *              player when nothing is pending.
     * @param side  the side deciding.
     * @return the decision, never null; a player with nothing better to do returns a fill hand or a skip.
     */
    AIAction nextAction(GameState state, Side side);
}
