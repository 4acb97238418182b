package ai.compile.player;

import ai.compile.engine.EngineResult;
import ai.compile.game.GameState;
import ai.compile.game.Side;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives AI decisions through the engine.
 * <p>
 * Players are created per decision with a seed derived from the state, so the same state and
 * difficulty always produce the same decision. A decision the engine rejects is replaced by the first
 * legal alternative.
 */
public final class AiDecisionEngine {
    private static final Logger log = LoggerFactory.getLogger(AiDecisionEngine.class);

    /** Safety cap on decisions within one turn. */
    static final int MAX_DECISIONS_PER_TURN = 500;

    private AiDecisionEngine() {
    }

    /**
     * One decision by whoever is expected to act, applied to the state.
     */
    public static Decision decide(GameState state, Difficulty difficulty) {
        Side side = LegalPlays.decider(state);
        Player player = difficulty.newPlayer(seedFor(state));
        AIAction action = player.nextAction(state, side);
        EngineResult result = ActionApplier.apply(state, side, action);
        if (result.legal) {
            return new Decision(side, action, result);
        }
        log.warn("{} AI chose an illegal action for {} ({}): {}", difficulty, side, action, result.message);
        List<AIAction> legal = LegalPlays.listLegalActions(state);
        for (AIAction alternative : legal) {
            EngineResult retry = ActionApplier.apply(state, side, alternative);
            if (retry.legal) {
                return new Decision(side, alternative, retry);
            }
        }
        return new Decision(side, action, result);
    }

    /**
     * The next decision of the side that has to act: its answer to the pending action, or its turn
     * action. The state is left untouched; apply the result with {@link ActionApplier}.
     *
     * @return the chosen action, or {@code null} when the game is over
     */
    public static AIAction runTurn(GameState state, Difficulty difficulty) {
        if (state.isGameOver()) {
            return null;
        }
        return decide(state, difficulty).action;
    }

    /**
     * The AI's answer to the pending action, for the action's actor.
     *
     * @return the chosen answer, or {@code null} when nothing is pending
     */
    public static AIAction resolvePendingAction(GameState state, Difficulty difficulty) {
        if (state.getActionRequired() == null || state.isGameOver()) {
            return null;
        }
        return decide(state, difficulty).action;
    }

    /**
     * Plays the rest of the current turn for the side that is deciding now: every decision it has to
     * make until the turn passes, the game ends, or the other side has to answer something.
     */
    public static GameState playTurn(GameState state, Difficulty difficulty) {
        Side side = LegalPlays.decider(state);
        int turn = state.getTurnNumber();
        GameState current = state;
        for (int i = 0; i < MAX_DECISIONS_PER_TURN; i++) {
            if (current.isGameOver() || current.getTurnNumber() != turn || LegalPlays.decider(current) != side) {
                return current;
            }
            Decision decision = decide(current, difficulty);
            if (!decision.result.legal) {
                log.warn("No legal decision for {} in {}", side, current.getPhase());
                return current;
            }
            current = decision.result.state;
        }
        throw new IllegalStateException("Turn " + turn + " did not end after " + MAX_DECISIONS_PER_TURN + " decisions");
    }

    /**
     * Answers the pending action for its actor and applies the answer, or returns the state unchanged
     * when nothing is pending.
     */
    public static GameState applyPendingAction(GameState state, Difficulty difficulty) {
        if (state.getActionRequired() == null || state.isGameOver()) {
            return state;
        }
        return decide(state, difficulty).result.state;
    }

    private static long seedFor(GameState state) {
        return state.getSeed() * 31 + state.getTurnNumber() * 1_000_003L + state.getActionsIssued();
    }

    /**
     * A decision and what the engine made of it.
     */
    public static final class Decision {
        public final Side side;
        public final AIAction action;
        public final EngineResult result;

        public Decision(Side side, AIAction action, EngineResult result) {
            this.side = side;
            this.action = action;
            this.result = result;
        }
    }
}
