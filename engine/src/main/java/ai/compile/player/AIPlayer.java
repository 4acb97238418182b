package ai.compile.player;

import ai.compile.effects.Keyword;
import ai.compile.engine.EngineResult;
import ai.compile.game.Card;
import ai.compile.game.GameState;
import ai.compile.game.PlayedCard;
import ai.compile.game.PlayerState;
import ai.compile.game.Side;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Base class for AI players with helpers for board evaluation.
 */
public abstract class AIPlayer implements Player {

    /** Lane totals from which an opponent's line starts to look dangerous. */
    protected static final int[] THREAT_LEVELS = {6, 8, 10};

    private static final int WIN_SCORE = 1_000;
    private static final int COMPILED_WEIGHT = 30;
    private static final int COMPILE_READY_BONUS = 8;

    /**
     * Applies the action to a copy and returns the resulting state, or {@code null} when the engine
     * rejects it.
     */
    protected GameState simulate(GameState state, Side side, AIAction action) {
        EngineResult result = ActionApplier.apply(state, side, action);
        return result.legal ? result.state : null;
    }

    /**
     * Static evaluation from {@code side}'s point of view: compiled protocols, lane leads, lines ready
     * to compile and hand size.
     */
    protected int evaluate(GameState state, Side side) {
        if (state.getWinner() == side) {
            return WIN_SCORE;
        }
        if (state.getWinner() == side.opponent()) {
            return -WIN_SCORE;
        }
        PlayerState own = state.side(side);
        PlayerState other = state.side(side.opponent());
        int score = COMPILED_WEIGHT * (own.compiledCount() - other.compiledCount());
        for (int lane = 0; lane < PlayerState.LANES; lane++) {
            int mine = own.getLaneValue(lane);
            int theirs = other.getLaneValue(lane);
            score += Math.min(mine, GameState.COMPILE_THRESHOLD + 2) - Math.min(theirs, GameState.COMPILE_THRESHOLD + 2);
            if (compileReady(mine, theirs) && !own.isCompiled(lane)) {
                score += COMPILE_READY_BONUS;
            }
            if (compileReady(theirs, mine) && !other.isCompiled(lane)) {
                score -= COMPILE_READY_BONUS;
            }
        }
        score += own.getHand().size() - other.getHand().size();
        return score;
    }

    /**
     * Sum over lanes of the side's total minus the opponent's.
     */
    protected int lead(GameState state, Side side) {
        int lead = 0;
        for (int lane = 0; lane < PlayerState.LANES; lane++) {
            lead += state.side(side).getLaneValue(lane) - state.side(side.opponent()).getLaneValue(lane);
        }
        return lead;
    }

    protected static boolean compileReady(int value, int opposing) {
        return value >= GameState.COMPILE_THRESHOLD && value > opposing;
    }

    /**
     * Number of threat levels the opponent's total in the lane has reached.
     */
    protected int threat(GameState state, Side side, int lane) {
        int value = state.side(side.opponent()).getLaneValue(lane);
        int level = 0;
        for (int threshold : THREAT_LEVELS) {
            if (value >= threshold) {
                level++;
            }
        }
        return level;
    }

    /**
     * Heuristic strength of a card: its keywords (disruptive ones count double) plus the inverse of
     * its value, since low cards carry the strongest effects.
     */
    protected int cardPower(Card card) {
        int power = 0;
        for (Keyword keyword : card.getKeywords()) {
            power += keyword.isDisruptive() ? 2 : 1;
        }
        if (card.hasTopBoxEffect()) {
            power++;
        }
        return power + Math.max(0, 5 - card.getValue());
    }

    protected boolean isDisruptive(Card card) {
        for (Keyword keyword : card.getKeywords()) {
            if (keyword.isDisruptive()) {
                return true;
            }
        }
        return false;
    }

    /**
     * The {@code count} hand cards ranked lowest by {@code rank}.
     */
    protected List<String> pickFromHand(GameState state, Side side, int count, Comparator<PlayedCard> rank) {
        List<PlayedCard> hand = new ArrayList<>(state.side(side).getHand());
        hand.sort(rank);
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < count && i < hand.size(); i++) {
            ids.add(hand.get(i).getId());
        }
        return ids;
    }

    /**
     * How much of {@code side}'s board points at uncompiled protocols: the side's total in every lane
     * it is ahead in whose protocol is still open.
     */
    protected int compilePotential(GameState state, Side side) {
        PlayerState own = state.side(side);
        int potential = 0;
        for (int lane = 0; lane < PlayerState.LANES; lane++) {
            int mine = own.getLaneValue(lane);
            if (!own.isCompiled(lane) && mine > state.side(side.opponent()).getLaneValue(lane)) {
                potential += mine;
            }
        }
        return potential;
    }
}
