package ai.compile;

import ai.compile.actions.ActionRequired;
import ai.compile.game.GameState;
import ai.compile.game.PlayerState;
import ai.compile.game.Side;
import ai.compile.player.AiDecisionEngine.Decision;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Responsible for emitting structured JSON lines describing AI matches.
 *
 * <p>Lines go through this class's own logger so logback can route them to a separate file
 * (match.log). Each line is prefixed with "MATCH_STEP " or "MATCH_SUMMARY " for easy filtering.</p>
 */
public final class MatchLogger {
    private static final Logger log = LoggerFactory.getLogger(MatchLogger.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final boolean ENABLED = Boolean.getBoolean("log.matches");

    private MatchLogger() {
    }

    /**
     * Return true if match logging is enabled via -Dlog.matches=true.
     */
    public static boolean isEnabled() {
        return ENABLED;
    }

    /**
     * One line per applied decision: the board before it, who decided what, and what is pending after.
     */
    public static void logStep(long seed, int stepIndex, GameState before, Decision decision) {
        ObjectNode line = OBJECT_MAPPER.createObjectNode();
        line.put("type", "step");
        line.put("seed", seed);
        line.put("step_index", stepIndex);
        line.put("turn", before.getTurnNumber());
        line.put("phase", before.getPhase().name());
        line.put("side", decision.side.name());
        line.put("action_type", decision.action.type().name());
        line.put("action", decision.action.toString());
        line.put("legal", decision.result.legal);
        if (!decision.result.legal) {
            line.put("message", decision.result.message);
        }
        ActionRequired pending = before.getActionRequired();
        line.put("answering", pending == null ? null : pending.type().name());
        for (Side side : Side.values()) {
            line.set(side.label(), sideNode(before.side(side)));
        }
        ActionRequired next = decision.result.state.getActionRequired();
        line.put("pending_after", next == null ? null : next.type().name());
        line.put("events", decision.result.events().size());
        write("MATCH_STEP", line);
    }

    /**
     * Emit a single line summarising the whole match.
     */
    public static void logSummary(MatchResult result) {
        ObjectNode line = OBJECT_MAPPER.createObjectNode();
        line.put("type", "summary");
        line.put("seed", result.getSeed());
        line.put("winner", result.isDraw() ? null : result.getWinner().name());
        line.put("turns", result.getTurns());
        line.put("decisions", result.getDecisions());
        line.put("duration_nanos", result.getDurationNanos());
        ArrayNode player = line.putArray("player_protocols");
        result.getPlayerProtocols().forEach(player::add);
        ArrayNode opponent = line.putArray("opponent_protocols");
        result.getOpponentProtocols().forEach(opponent::add);
        write("MATCH_SUMMARY", line);
    }

    private static ObjectNode sideNode(PlayerState ps) {
        ObjectNode node = OBJECT_MAPPER.createObjectNode();
        ArrayNode protocols = node.putArray("protocols");
        ArrayNode values = node.putArray("lane_values");
        ArrayNode compiled = node.putArray("compiled");
        for (int lane = 0; lane < PlayerState.LANES; lane++) {
            protocols.add(ps.getProtocol(lane));
            values.add(ps.getLaneValue(lane));
            compiled.add(ps.isCompiled(lane));
        }
        node.put("hand", ps.getHand().size());
        node.put("deck", ps.getDeck().size());
        node.put("discard", ps.getDiscard().size());
        return node;
    }

    private static void write(String prefix, ObjectNode line) {
        if (!log.isInfoEnabled()) {
            return;
        }
        try {
            log.info("{} {}", prefix, OBJECT_MAPPER.writeValueAsString(line));
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialise {} line", prefix, e);
        }
    }
}
