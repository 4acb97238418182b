package ai.compile.engine;

import java.util.List;

/**
 * A game state broke one of the board invariants. Signals an engine bug, never a player mistake.
 */
public class InvariantViolationException extends RuntimeException {
    private final List<String> violations;

    public InvariantViolationException(List<String> violations) {
        super("Game state invariants violated: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
