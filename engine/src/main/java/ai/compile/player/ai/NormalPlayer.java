package ai.compile.player.ai;

import ai.compile.actions.ActionRequired;
import ai.compile.game.GameState;
import ai.compile.game.PlayedCard;
import ai.compile.game.Side;
import ai.compile.player.AIAction;
import ai.compile.player.AIPlayer;
import ai.compile.player.LegalPlays;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Greedy (1-ply) player:
 *
 * - Enumerates every legal decision, including the refresh.
 * - Applies each one to a copy of the state and scores the result with {@link #evaluate}.
 * - Plays the highest-scoring decision; ties are broken with a seeded {@link Random}.
 *
 * Discards always drop the lowest-value cards.
 */
public class NormalPlayer extends AIPlayer {
    private static final Logger log = LoggerFactory.getLogger(NormalPlayer.class);

    private final Random random;

    public NormalPlayer(long seed) {
        this.random = new Random(seed);
    }

    @Override
    public AIAction nextAction(GameState state, Side side) {
        ActionRequired action = state.getActionRequired();
        if (action != null) {
            return answer(state, side, action);
        }
        AIAction best = pickBest(state, side, LegalPlays.turnActions(state));
        return best != null ? best : AIAction.fillHand();
    }

    /**
     * Greedy answer to a pending action.
     */
    protected AIAction answer(GameState state, Side side, ActionRequired action) {
        if (action.type() == ActionRequired.Type.DISCARD) {
            return AIAction.discard(pickFromHand(state, side, action.count(),
                    Comparator.comparingInt(PlayedCard::getValue)));
        }
        AIAction best = pickBest(state, side, LegalPlays.answers(state, action));
        return best != null ? best : AIAction.skip();
    }

    /**
     * Highest-scoring candidate after a one-step simulation, or {@code null} when none is legal.
     */
    protected AIAction pickBest(GameState state, Side side, List<AIAction> candidates) {
        List<AIAction> best = new ArrayList<>();
        int bestScore = Integer.MIN_VALUE;
        for (AIAction candidate : candidates) {
            GameState after = simulate(state, side, candidate);
            if (after == null) {
                continue;
            }
            int score = evaluate(after, side);
            if (score > bestScore) {
                bestScore = score;
                best.clear();
                best.add(candidate);
            } else if (score == bestScore) {
                best.add(candidate);
            }
        }
        if (best.isEmpty()) {
            return null;
        }
        AIAction chosen = best.get(random.nextInt(best.size()));
        if (log.isDebugEnabled()) {
            log.debug("{} picks {} (score {}, {} tied of {})", side, chosen, bestScore, best.size(), candidates.size());
        }
        return chosen;
    }

    protected Random random() {
        return random;
    }
}
