package ai.compile.engine;

import ai.compile.actions.ActionRequired;
import ai.compile.actions.QueuedEffect;
import ai.compile.effects.Trigger;
import ai.compile.game.GameState;
import ai.compile.game.Phase;
import ai.compile.game.PlayedCard;
import ai.compile.game.PlayerState;
import ai.compile.game.Side;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lane totals, compile legality and the compile transition.
 */
public final class CompileEngine {
    private static final Logger log = LoggerFactory.getLogger(CompileEngine.class);

    private CompileEngine() {
    }

    /**
     * Whether {@code side} may compile the lane: at least 10 and strictly more than the other side,
     * and not under a "cannot compile" effect. Lanes that were compiled before stay eligible.
     */
    public static boolean canCompile(GameState state, Side side, int lane) {
        if (lane < 0 || lane >= PlayerState.LANES || state.side(side).isCannotCompile()) {
            return false;
        }
        int own = state.side(side).getLaneValue(lane);
        int other = state.side(side.opponent()).getLaneValue(lane);
        return own >= GameState.COMPILE_THRESHOLD && own > other;
    }

    public static List<Integer> compilableLanes(GameState state, Side side) {
        List<Integer> lanes = new ArrayList<>();
        for (int lane = 0; lane < PlayerState.LANES; lane++) {
            if (canCompile(state, side, lane)) {
                lanes.add(lane);
            }
        }
        return lanes;
    }

    /**
     * Compiles a lane for the turn player, in place.
     * <ul>
     *   <li>Both stacks of the lane go to their owners' discard piles, except face-up cards that
     *       survive compiles; each survivor queues a shift for its owner.</li>
     *   <li>The protocol is flagged compiled. Compiling it again instead takes the top card of the
     *       opponent's deck.</li>
     *   <li>Compiling replaces the action phase, so the turn continues at the hand limit check.</li>
     *   <li>Three compiled protocols win the game; {@code onEndGame} is told the winner.</li>
     * </ul>
     */
    public static void performCompile(GameState state, int lane, Consumer<Side> onEndGame) {
        Side side = state.getTurn();
        Set<String> survivors = new LinkedHashSet<>();
        for (Side owner : Side.values()) {
            for (PlayedCard card : state.side(owner).getLane(lane)) {
                if (card.isFaceUp() && card.getCard().hasTrigger(Trigger.ON_COMPILE_DELETE)) {
                    survivors.add(card.getId());
                }
            }
        }
        List<String> cleared = new ArrayList<>(state.clearLane(Side.PLAYER, lane, survivors));
        cleared.addAll(state.clearLane(Side.OPPONENT, lane, survivors));
        if (log.isDebugEnabled()) {
            log.debug("Compile of line {} by {} clears {} and keeps {}", lane, side, cleared, survivors);
        }
        boolean recompile = state.side(side).isCompiled(lane);
        state.markCompiled(side, lane);
        if (recompile) {
            PlayedCard prize = state.takeTopOfDeck(side.opponent());
            if (prize != null) {
                state.addToHand(side, prize);
                state.log(side + " takes the top card of " + side.opponent() + "'s deck for compiling again");
            }
        }
        for (String id : survivors) {
            Side owner = state.locate(id).side();
            state.enqueue(QueuedEffect.ofAction(ActionRequired.builder(ActionRequired.Type.SELECT_LANE_FOR_SHIFT, owner)
                    .sourceCardId(id)
                    .targetCardId(id)
                    .laneIndex(lane)
                    .build()));
        }
        state.setCompilableLanes(List.of());
        state.setPhase(Phase.HAND_LIMIT);
        if (state.side(side).compiledCount() >= GameState.PROTOCOLS_TO_WIN) {
            state.recordWin(side);
            if (onEndGame != null) {
                onEndGame.accept(side);
            }
        }
    }
}
