package ai.compile.engine;

import ai.compile.actions.ActionFlow;
import ai.compile.actions.ActionRequired;
import ai.compile.effects.Effect;
import ai.compile.effects.EffectActivity;
import ai.compile.effects.EffectInterpreter;
import ai.compile.effects.EffectRun;
import ai.compile.effects.PassiveRules;
import ai.compile.effects.Trigger;
import ai.compile.game.BoardEvent;
import ai.compile.game.CardLocation;
import ai.compile.game.GameState;
import ai.compile.game.Phase;
import ai.compile.game.PlayedCard;
import ai.compile.game.PlayerState;
import ai.compile.game.Side;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * The six-phase turn: start, control, compile, action, hand limit, end.
 * <p>
 * {@link #step(GameState)} performs the automatic work of the current phase and reports whether
 * anything moved. It never runs while an action is pending; the interrupt stack and the queue are
 * always drained before the phase machine gets control back.
 */
public final class PhaseManager {

    private PhaseManager() {
    }

    /**
     * Advances the current phase by one piece of work.
     *
     * @return {@code false} when the turn player has to act (action phase, or a compile is due)
     */
    public static boolean step(GameState state) {
        Side turn = state.getTurn();
        switch (state.getPhase()) {
            case START:
                if (!offerPhaseEffect(state, Trigger.START, state.getProcessedStartEffectIds())) {
                    enter(state, Phase.CONTROL);
                }
                return true;
            case CONTROL:
                checkControl(state, turn);
                enter(state, Phase.COMPILE);
                return true;
            case COMPILE: {
                List<Integer> lanes = CompileEngine.compilableLanes(state, turn);
                state.setCompilableLanes(lanes);
                if (lanes.isEmpty()) {
                    enter(state, Phase.ACTION);
                    return true;
                }
                return false;
            }
            case ACTION:
                return false;
            case HAND_LIMIT:
                checkHandLimit(state, turn);
                return true;
            case END:
                if (!offerPhaseEffect(state, Trigger.END, state.getProcessedEndEffectIds())) {
                    state.passTurn();
                }
                return true;
            default:
                throw new IllegalStateException("Unknown phase " + state.getPhase());
        }
    }

    private static void enter(GameState state, Phase phase) {
        state.setPhase(phase);
        state.clearUncoverGuard();
    }

    private static void checkControl(GameState state, Side turn) {
        if (!state.isUseControlMechanic()) {
            return;
        }
        int leads = 0;
        for (int lane = 0; lane < PlayerState.LANES; lane++) {
            if (state.side(turn).getLaneValue(lane) > state.side(turn.opponent()).getLaneValue(lane)) {
                leads++;
            }
        }
        if (leads >= 2 && state.getControlCardHolder() != turn) {
            state.setControlCardHolder(turn);
            state.record(new BoardEvent(BoardEvent.Type.CONTROL_GAINED, turn, null, -1, ""));
            state.log(turn + " takes control");
        }
    }

    private static void checkHandLimit(GameState state, Side turn) {
        int excess = state.side(turn).getHand().size() - GameState.HAND_LIMIT;
        if (state.isHandLimitChecked() || excess <= 0) {
            enter(state, Phase.END);
            return;
        }
        state.setHandLimitChecked(true);
        if (PassiveRules.skipsHandLimit(state, turn)) {
            state.log(turn + " skips the hand limit check");
            enter(state, Phase.END);
            return;
        }
        state.log(turn + " must discard " + excess + " down to " + GameState.HAND_LIMIT);
        ActionFlow.issue(state, ActionRequired.builder(ActionRequired.Type.DISCARD, turn)
                .count(excess)
                .clearCache(true)
                .build());
    }

    /**
     * Runs the next unprocessed Start or End effect, or lets the turn player pick the order when
     * several are waiting.
     *
     * @return {@code false} when no effect is left for this phase
     */
    private static boolean offerPhaseEffect(GameState state, Trigger trigger, Set<String> processed) {
        List<String> pending = pendingPhaseEffects(state, trigger, processed);
        if (pending.isEmpty()) {
            return false;
        }
        if (pending.size() == 1) {
            runPhaseEffect(state, pending.get(0));
            return true;
        }
        ActionFlow.issue(state, ActionRequired.builder(ActionRequired.Type.SELECT_PHASE_EFFECT, state.getTurn())
                .candidateIds(pending)
                .build());
        return true;
    }

    /**
     * Ids of the turn player's cards with a live, unprocessed effect for the trigger.
     */
    public static List<String> pendingPhaseEffects(GameState state, Trigger trigger, Set<String> processed) {
        List<String> ids = new ArrayList<>();
        Side turn = state.getTurn();
        for (int lane = 0; lane < PlayerState.LANES; lane++) {
            for (PlayedCard card : state.side(turn).getLane(lane)) {
                if (processed.contains(card.getId())) {
                    continue;
                }
                for (Effect effect : card.getCard().effectsFor(trigger)) {
                    if (EffectActivity.isLive(state, card.getId(), effect)) {
                        ids.add(card.getId());
                        break;
                    }
                }
            }
        }
        return ids;
    }

    /**
     * Marks the card's Start or End effect processed and runs it if it is still live.
     */
    public static void runPhaseEffect(GameState state, String cardId) {
        Trigger trigger = state.getPhase() == Phase.END ? Trigger.END : Trigger.START;
        Set<String> processed = trigger == Trigger.END
                ? state.getProcessedEndEffectIds() : state.getProcessedStartEffectIds();
        processed.add(cardId);
        CardLocation loc = state.locate(cardId);
        if (loc == null) {
            return;
        }
        PlayedCard card = state.cardAt(loc);
        for (Effect effect : card.getCard().effectsFor(trigger)) {
            if (EffectActivity.isLive(state, loc, effect)) {
                state.log(card.getCard().name() + " " + trigger.name().toLowerCase() + " effect");
                EffectInterpreter.execute(state, EffectRun.start(cardId, loc.side(), loc.laneIndex(), trigger,
                        effect.instructions()));
                return;
            }
        }
    }
}
