package ai.compile;

import ai.compile.game.PlayerStats;
import ai.compile.game.Side;
import java.util.List;

/**
 * Summary of one finished (or capped) AI-versus-AI match.
 */
public final class MatchResult {
    private final long seed;
    private final Side winner;
    private final int turns;
    private final int decisions;
    private final long durationNanos;
    private final List<String> playerProtocols;
    private final List<String> opponentProtocols;
    private final PlayerStats playerStats;
    private final PlayerStats opponentStats;

    public MatchResult(long seed, Side winner, int turns, int decisions, long durationNanos,
                       List<String> playerProtocols, List<String> opponentProtocols,
                       PlayerStats playerStats, PlayerStats opponentStats) {
        this.seed = seed;
        this.winner = winner;
        this.turns = turns;
        this.decisions = decisions;
        this.durationNanos = durationNanos;
        this.playerProtocols = List.copyOf(playerProtocols);
        this.opponentProtocols = List.copyOf(opponentProtocols);
        this.playerStats = playerStats;
        this.opponentStats = opponentStats;
    }

    public long getSeed() {
        return seed;
    }

    /**
     * @return the winning side, or null when the match hit the turn cap or stalled
     */
    public Side getWinner() {
        return winner;
    }

    public boolean isDraw() {
        return winner == null;
    }

    public int getTurns() {
        return turns;
    }

    public int getDecisions() {
        return decisions;
    }

    public long getDurationNanos() {
        return durationNanos;
    }

    public List<String> getPlayerProtocols() {
        return playerProtocols;
    }

    public List<String> getOpponentProtocols() {
        return opponentProtocols;
    }

    public PlayerStats getStats(Side side) {
        return side == Side.PLAYER ? playerStats : opponentStats;
    }

    @Override
    public String toString() {
        return "MatchResult{seed=" + seed + ", winner=" + (winner == null ? "none" : winner)
                + ", turns=" + turns + ", decisions=" + decisions + "}";
    }
}
