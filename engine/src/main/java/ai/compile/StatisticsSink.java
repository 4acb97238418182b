package ai.compile;

/**
 * Receives finished matches. The engine itself never reports here; the match runner does.
 */
public interface StatisticsSink {

    void recordMatch(MatchResult result);
}
