package ai.compile.engine;

import ai.compile.effects.LaneValues;
import ai.compile.game.GameState;
import ai.compile.game.PlayedCard;
import ai.compile.game.PlayerState;
import ai.compile.game.Side;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Structural checks on a {@link GameState}.
 * <ul>
 *   <li>every card identity sits in exactly one container</li>
 *   <li>cached lane values equal the derived totals</li>
 *   <li>the interrupt stack is empty whenever no action is active</li>
 * </ul>
 * Tests call {@link #assertValid(GameState)}; the engine calls {@link #check(GameState)} after each
 * transition and repairs what it can.
 */
public final class GameStateInvariants {

    private GameStateInvariants() {
    }

    /**
     * Lists every violation found; empty when the state is sound.
     */
    public static List<String> check(GameState state) {
        List<String> violations = new ArrayList<>();
        Map<String, Integer> seen = countIdentities(state);
        for (Map.Entry<String, Integer> entry : seen.entrySet()) {
            if (entry.getValue() > 1) {
                violations.add("Card " + entry.getKey() + " appears in " + entry.getValue() + " containers");
            }
        }
        violations.addAll(laneCacheDrift(state));
        if (state.getActionRequired() == null && state.stackDepth() > 0 && !state.isGameOver()) {
            violations.add("Interrupt stack holds " + state.stackDepth() + " frames with no active action");
        }
        return violations;
    }

    /**
     * Lanes whose cached value differs from the derived total.
     */
    public static List<String> laneCacheDrift(GameState state) {
        List<String> violations = new ArrayList<>();
        for (Side side : Side.values()) {
            for (int lane = 0; lane < PlayerState.LANES; lane++) {
                int cached = state.side(side).getLaneValue(lane);
                int derived = LaneValues.laneTotal(state, side, lane);
                if (cached != derived) {
                    violations.add(side + " lane " + lane + " caches " + cached + " but totals " + derived);
                }
            }
        }
        return violations;
    }

    /**
     * Compares the card identities of two states of the same game: nothing may appear or vanish.
     */
    public static List<String> checkConservation(GameState before, GameState after) {
        Set<String> was = new TreeSet<>(countIdentities(before).keySet());
        Set<String> now = new TreeSet<>(countIdentities(after).keySet());
        List<String> violations = new ArrayList<>();
        for (String id : was) {
            if (!now.contains(id)) {
                violations.add("Card " + id + " went missing");
            }
        }
        for (String id : now) {
            if (!was.contains(id)) {
                violations.add("Card " + id + " appeared from nowhere");
            }
        }
        return violations;
    }

    /**
     * @throws InvariantViolationException when {@link #check(GameState)} finds anything
     */
    public static void assertValid(GameState state) {
        List<String> violations = check(state);
        if (!violations.isEmpty()) {
            throw new InvariantViolationException(violations);
        }
    }

    private static Map<String, Integer> countIdentities(GameState state) {
        Map<String, Integer> seen = new HashMap<>();
        for (Side side : Side.values()) {
            PlayerState ps = state.side(side);
            for (List<PlayedCard> lane : ps.getLanes()) {
                count(seen, lane);
            }
            count(seen, ps.getHand());
            count(seen, ps.getDeck());
            count(seen, ps.getDiscard());
        }
        return seen;
    }

    private static void count(Map<String, Integer> seen, List<PlayedCard> cards) {
        for (PlayedCard card : cards) {
            seen.merge(card.getId(), 1, Integer::sum);
        }
    }
}
