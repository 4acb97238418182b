package ai.compile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.compile.catalog.JsonCardCatalogProvider;
import ai.compile.config.MatchProperties;
import ai.compile.game.Side;
import ai.compile.player.Difficulty;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

/**
 * AI-versus-AI matches end to end, without a Spring context.
 */
class MatchRunnerTest {

    private static MatchProperties properties(long seed, int games) {
        MatchProperties properties = new MatchProperties();
        properties.setSeed(seed);
        properties.setGames(games);
        properties.setMaxTurns(80);
        properties.setPlayerDifficulty(Difficulty.HARD);
        properties.setOpponentDifficulty(Difficulty.EASY);
        return properties;
    }

    @Test
    void draftsDistinctProtocolsWhenNoneAreConfigured() {
        MatchRunner runner = new MatchRunner(properties(17L, 1), new JsonCardCatalogProvider(), new LoggingStatisticsSink());

        MatchResult result = runner.play(17L);

        assertEquals(3, result.getPlayerProtocols().size());
        assertEquals(3, result.getOpponentProtocols().size());
        Set<String> all = new HashSet<>(result.getPlayerProtocols());
        all.addAll(result.getOpponentProtocols());
        assertEquals(6, all.size());
        assertTrue(result.getTurns() <= 81, "turns " + result.getTurns());
        assertTrue(result.getDecisions() > 0);
        assertNotNull(result.getStats(Side.PLAYER));
    }

    @Test
    void configuredProtocolsAreKept() {
        MatchProperties properties = properties(4L, 1);
        properties.setPlayerProtocols(new ArrayList<>(List.of("Speed", "Life", "Water")));
        properties.setOpponentProtocols(new ArrayList<>(List.of("Metal", "Death", "Hate")));
        MatchRunner runner = new MatchRunner(properties, new JsonCardCatalogProvider(), new LoggingStatisticsSink());

        MatchResult result = runner.play(4L);

        assertEquals(List.of("Speed", "Life", "Water"), result.getPlayerProtocols());
        assertEquals(List.of("Metal", "Death", "Hate"), result.getOpponentProtocols());
    }

    @Test
    void sameSeedReplaysTheSameMatch() {
        MatchRunner runner = new MatchRunner(properties(9L, 1), new JsonCardCatalogProvider(), new LoggingStatisticsSink());

        MatchResult first = runner.play(9L);
        MatchResult second = runner.play(9L);

        assertEquals(first.getWinner(), second.getWinner());
        assertEquals(first.getTurns(), second.getTurns());
        assertEquals(first.getDecisions(), second.getDecisions());
        assertEquals(first.getPlayerProtocols(), second.getPlayerProtocols());
    }

    @Test
    void runReportsEveryGameToTheSink() {
        LoggingStatisticsSink sink = new LoggingStatisticsSink();
        MatchRunner runner = new MatchRunner(properties(30L, 3), new JsonCardCatalogProvider(), sink);

        runner.run();

        assertEquals(3, sink.getMatches());
        assertTrue(sink.getPlayerWins() + sink.getOpponentWins() <= 3);
    }

    @Test
    void unknownDifficultyIsRejected() {
        assertEquals(Difficulty.HARD, Difficulty.parse(" hard "));
        assertThrows(IllegalArgumentException.class, () -> Difficulty.parse("impossible"));
        assertThrows(IllegalArgumentException.class, () -> Difficulty.parse(""));
    }
}
