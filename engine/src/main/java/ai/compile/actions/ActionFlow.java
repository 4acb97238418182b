package ai.compile.actions;

import ai.compile.effects.EffectActivity;
import ai.compile.effects.EffectInterpreter;
import ai.compile.effects.PassiveRules;
import ai.compile.effects.Trigger;
import ai.compile.engine.PhaseManager;
import ai.compile.game.CardLocation;
import ai.compile.game.GameState;
import ai.compile.game.PlayedCard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The action/interrupt stack: one active action, a LIFO of suspended actions and effect
 * continuations, and a FIFO of deferred follow-ups.
 * <p>
 * {@link #settle(GameState)} is called at the end of every public transition. It keeps working
 * until somebody has to decide something: a suspended frame is restored first, then one queued
 * follow-up is drained, and only when both are empty does the phase machine move on.
 */
public final class ActionFlow {
    private static final Logger log = LoggerFactory.getLogger(ActionFlow.class);

    /** Upper bound on settle iterations; reaching it means the engine is looping. */
    static final int MAX_SETTLE_STEPS = 10_000;

    private ActionFlow() {
    }

    /**
     * Installs an action, suspending the active one (if any) on the interrupt stack.
     */
    public static void issue(GameState state, ActionRequired action) {
        ActionRequired active = state.getActionRequired();
        if (active != null) {
            state.pushFrame(SuspendedFrame.ofAction(active));
        }
        state.setActionRequired(action);
        if (log.isDebugEnabled()) {
            log.debug("Issued {} (stack depth {})", action, state.stackDepth());
        }
    }

    /**
     * Advances the state until an action is active, the turn player has to act, or the game is
     * over.
     */
    public static void settle(GameState state) {
        for (int i = 0; i < MAX_SETTLE_STEPS; i++) {
            if (state.isGameOver() || state.getActionRequired() != null) {
                return;
            }
            SuspendedFrame frame = state.popFrame();
            if (frame != null) {
                if (frame.isAction()) {
                    reinstate(state, frame.action());
                } else {
                    EffectInterpreter.execute(state, frame.continuation());
                }
                continue;
            }
            QueuedEffect queued = state.pollQueue();
            if (queued != null) {
                runQueued(state, queued);
                continue;
            }
            if (!PhaseManager.step(state)) {
                return;
            }
        }
        throw new IllegalStateException("Game did not settle after " + MAX_SETTLE_STEPS + " steps");
    }

    /**
     * Puts a suspended action back, unless the board changed so much that a mandatory action has
     * nothing left to target; then its effect continues as if the instruction had been skipped.
     */
    private static void reinstate(GameState state, ActionRequired action) {
        if (Targeting.hasLegalResolution(state, action)) {
            state.setActionRequired(action);
            return;
        }
        state.log("Dropping " + action.type() + ": no legal target left");
        if (action.continuation() != null) {
            EffectInterpreter.execute(state, action.continuation().skipped());
        }
    }

    private static void runQueued(GameState state, QueuedEffect queued) {
        if (!sourceStillActive(state, queued)) {
            state.log("Follow-up from " + queued.sourceCardId() + " cancelled");
            return;
        }
        if (queued.action() != null) {
            if (Targeting.hasLegalResolution(state, queued.action())) {
                issue(state, queued.action());
            }
            return;
        }
        EffectInterpreter.execute(state, queued.run());
    }

    private static boolean sourceStillActive(GameState state, QueuedEffect queued) {
        CardLocation loc = state.locate(queued.sourceCardId());
        if (loc == null || !loc.onBoard()) {
            return false;
        }
        PlayedCard card = state.cardAt(loc);
        if (!card.isFaceUp()) {
            return false;
        }
        if (queued.run() != null && queued.run().trigger() == Trigger.ON_PLAY) {
            return state.isUncovered(loc) && !PassiveRules.ignoresMiddleCommands(state, loc);
        }
        if (queued.run() != null && queued.run().trigger().isReactive()) {
            return card.getCard().effectsFor(queued.run().trigger()).stream()
                    .anyMatch(effect -> EffectActivity.isLive(state, loc, effect));
        }
        return true;
    }
}
