package ai.compile;

import ai.compile.game.PlayerStats;
import ai.compile.game.Side;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default {@link StatisticsSink}: writes the per-side counters of every match to the log and keeps
 * running win totals.
 */
@Component
public class LoggingStatisticsSink implements StatisticsSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingStatisticsSink.class);

    private int matches;
    private int playerWins;
    private int opponentWins;

    @Override
    public void recordMatch(MatchResult result) {
        matches++;
        if (result.getWinner() == Side.PLAYER) {
            playerWins++;
        } else if (result.getWinner() == Side.OPPONENT) {
            opponentWins++;
        }
        log.info("Match {} (seed {}): winner={} turns={} {}ms", matches, result.getSeed(),
                result.isDraw() ? "none" : result.getWinner(), result.getTurns(), result.getDurationNanos() / 1_000_000);
        for (Side side : Side.values()) {
            PlayerStats stats = result.getStats(side);
            log.info("  {}: played={} drawn={} discarded={} deleted={} flipped={} shifted={} returned={} refreshes={} compiles={}",
                    side,
                    stats.getCardsPlayed(),
                    stats.getCardsDrawn(),
                    stats.getCardsDiscarded(),
                    stats.getCardsDeleted(),
                    stats.getCardsFlipped(),
                    stats.getCardsShifted(),
                    stats.getCardsReturned(),
                    stats.getHandsRefreshed(),
                    stats.getCompiles());
        }
        if (log.isDebugEnabled()) {
            log.debug("Totals after {} matches: player {} / opponent {} / draws {}",
                    matches, playerWins, opponentWins, matches - playerWins - opponentWins);
        }
    }

    public int getMatches() {
        return matches;
    }

    public int getPlayerWins() {
        return playerWins;
    }

    public int getOpponentWins() {
        return opponentWins;
    }
}
