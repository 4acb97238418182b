package ai.compile.engine;

import ai.compile.game.BoardEvent;
import ai.compile.game.GameState;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of applying an intent.
 * <p>
 * A rejected intent is not an exception: {@link #legal} is false, {@link #message} says why and
 * {@link #state} is the unchanged input, so the caller can simply ask again.
 */
public final class EngineResult {
    public final boolean legal;
    public final String message;
    public final GameState state;

    private EngineResult(boolean legal, String message, GameState state) {
        this.legal = legal;
        this.message = message;
        this.state = Objects.requireNonNull(state, "state");
    }

    public static EngineResult legal(GameState state) {
        return new EngineResult(true, "", state);
    }

    public static EngineResult illegal(GameState unchanged, String message) {
        return new EngineResult(false, message, unchanged);
    }

    /**
     * Board events produced by this transition, for a presentation layer to replay.
     */
    public List<BoardEvent> events() {
        return legal ? state.getEvents() : List.of();
    }

    /**
     * True when the new state is waiting on a decision.
     */
    public boolean requiresFollowUp() {
        return state.getActionRequired() != null;
    }

    @Override
    public String toString() {
        return legal ? "EngineResult{legal}" : "EngineResult{illegal: " + message + "}";
    }
}
