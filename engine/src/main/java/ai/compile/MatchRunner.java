package ai.compile;

import ai.compile.catalog.CardCatalog;
import ai.compile.catalog.CardCatalogProvider;
import ai.compile.config.MatchProperties;
import ai.compile.engine.GameStateInvariants;
import ai.compile.engine.RulesEngine;
import ai.compile.game.BoardFormatter;
import ai.compile.game.GameState;
import ai.compile.game.Side;
import ai.compile.player.AIAction;
import ai.compile.player.ActionApplier;
import ai.compile.player.AiDecisionEngine;
import ai.compile.player.AiDecisionEngine.Decision;
import ai.compile.player.LegalPlays;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Plays the configured number of AI-versus-AI matches and reports each one to the
 * {@link StatisticsSink}.
 */
@Component
public class MatchRunner implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(MatchRunner.class);

    private static final int PROTOCOLS_PER_SIDE = 3;

    private final MatchProperties properties;
    private final CardCatalogProvider catalogProvider;
    private final StatisticsSink statisticsSink;
    private CardCatalog catalog;

    public MatchRunner(MatchProperties properties, CardCatalogProvider catalogProvider, StatisticsSink statisticsSink) {
        this.properties = properties;
        this.catalogProvider = catalogProvider;
        this.statisticsSink = statisticsSink;
    }

    @Override
    public void run(String... args) {
        long base = properties.getSeed() != null ? properties.getSeed() : new Random().nextLong();
        for (int i = 0; i < properties.getGames(); i++) {
            MatchResult result = play(base + i);
            statisticsSink.recordMatch(result);
        }
    }

    /**
     * Plays one match from a fresh state until a winner, the turn cap, or a state in which no legal
     * decision exists.
     */
    public MatchResult play(long seed) {
        CardCatalog cards = catalog();
        List<String> playerProtocols = new ArrayList<>(properties.getPlayerProtocols());
        List<String> opponentProtocols = new ArrayList<>(properties.getOpponentProtocols());
        draftMissing(cards, seed, playerProtocols, opponentProtocols);

        long startNanos = System.nanoTime();
        GameState state = RulesEngine.createInitialState(cards, playerProtocols, opponentProtocols,
                properties.isUseControl(), properties.getStartingPlayer(), seed);
        int decisions = 0;
        while (!state.isGameOver() && state.getTurnNumber() <= properties.getMaxTurns()) {
            Side side = LegalPlays.decider(state);
            AIAction action = AiDecisionEngine.runTurn(state, properties.difficultyFor(side));
            Decision decision = new Decision(side, action, ActionApplier.apply(state, side, action));
            if (MatchLogger.isEnabled()) {
                MatchLogger.logStep(seed, decisions, state, decision);
            }
            if (!decision.result.legal) {
                log.warn("Match {} stalled at turn {}: {}", seed, state.getTurnNumber(), decision.result.message);
                break;
            }
            state = decision.result.state;
            decisions++;
            if (log.isDebugEnabled()) {
                log.debug("{} -> {}\n{}", side, decision.action, new BoardFormatter(state).format());
            }
        }
        List<String> violations = GameStateInvariants.check(state);
        if (!violations.isEmpty()) {
            log.warn("Match {} ended with invariant violations: {}", seed, violations);
        }
        if (!state.isGameOver() && log.isDebugEnabled()) {
            log.debug("Match {} reached the turn cap of {}", seed, properties.getMaxTurns());
        }
        MatchResult result = new MatchResult(seed, state.getWinner(), state.getTurnNumber(), decisions,
                System.nanoTime() - startNanos, playerProtocols, opponentProtocols,
                state.getPlayer().getStats(), state.getOpponent().getStats());
        if (MatchLogger.isEnabled()) {
            MatchLogger.logSummary(result);
        }
        return result;
    }

    private CardCatalog catalog() {
        if (catalog == null) {
            catalog = catalogProvider.load();
        }
        return catalog;
    }

    /**
     * Fills empty protocol lists with distinct protocols not used by the other side.
     */
    private static void draftMissing(CardCatalog cards, long seed, List<String> player, List<String> opponent) {
        if (player.size() == PROTOCOLS_PER_SIDE && opponent.size() == PROTOCOLS_PER_SIDE) {
            return;
        }
        List<String> pool = new ArrayList<>(cards.protocols());
        pool.removeAll(player);
        pool.removeAll(opponent);
        Collections.shuffle(pool, new Random(seed));
        int next = 0;
        while (player.size() < PROTOCOLS_PER_SIDE) {
            player.add(pool.get(next++));
        }
        while (opponent.size() < PROTOCOLS_PER_SIDE) {
            opponent.add(pool.get(next++));
        }
    }
}
