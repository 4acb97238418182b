package ai.compile.engine;

import ai.compile.actions.ActionFlow;
import ai.compile.actions.ActionRequired;
import ai.compile.actions.FollowUp;
import ai.compile.actions.Targeting;
import ai.compile.catalog.CardCatalog;
import ai.compile.effects.BoardActions;
import ai.compile.effects.EffectInterpreter;
import ai.compile.effects.EffectRun;
import ai.compile.effects.LanePlayability;
import ai.compile.game.Card;
import ai.compile.game.Deck;
import ai.compile.game.GameState;
import ai.compile.game.Phase;
import ai.compile.game.PlayedCard;
import ai.compile.game.PlayerState;
import ai.compile.game.Side;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Public entry point of the rules engine.
 * <p>
 * Every operation is a pure transition: the input state is copied, the intent is validated against
 * the copy's active action and phase, applied, and the copy is then settled (interrupts resumed,
 * queued follow-ups run, automatic phases advanced) until a player has to decide something. A
 * rejected intent returns {@link EngineResult#illegal(GameState, String)} with the untouched input.
 * <p>
 * Operations that take an optional {@code side} check it against the side that is expected to act;
 * passing {@code null} means "whoever is expected".
 */
public final class RulesEngine {
    private static final Logger log = LoggerFactory.getLogger(RulesEngine.class);

    private RulesEngine() {
    }

    // ------------------------------------------------------------------
    // Setup
    // ------------------------------------------------------------------

    /**
     * Builds and shuffles both decks, deals the starting hands and advances the starting player's
     * turn to its first decision.
     *
     * @param startingPlayer the side that moves first, or {@code null} to flip a coin from the seed
     * @param seed           drives the coin flip, the deck shuffles and every later reshuffle
     */
    public static GameState createInitialState(CardCatalog catalog, List<String> playerProtocols,
                                               List<String> opponentProtocols, boolean useControlMechanic,
                                               Side startingPlayer, long seed) {
        Objects.requireNonNull(catalog, "catalog");
        Random random = new Random(seed);
        Side first = startingPlayer;
        if (first == null) {
            first = random.nextBoolean() ? Side.PLAYER : Side.OPPONENT;
        }
        PlayerState player = newPlayer(catalog, Side.PLAYER, playerProtocols, random);
        PlayerState opponent = newPlayer(catalog, Side.OPPONENT, opponentProtocols, random);
        GameState state = new GameState(player, opponent, first, useControlMechanic, seed);
        state.draw(Side.PLAYER, GameState.STARTING_HAND);
        state.draw(Side.OPPONENT, GameState.STARTING_HAND);
        state.log(first + " goes first (player " + playerProtocols + " vs opponent " + opponentProtocols + ")");
        ActionFlow.settle(state);
        return state;
    }

    private static PlayerState newPlayer(CardCatalog catalog, Side side, List<String> protocols, Random random) {
        PlayerState ps = new PlayerState(protocols);
        List<Card> cards = new ArrayList<>();
        for (String protocol : protocols) {
            cards.addAll(catalog.cardsOf(protocol));
        }
        Deck deck = new Deck(side, cards);
        deck.shuffle(random);
        deck.moveInto(ps);
        return ps;
    }

    // ------------------------------------------------------------------
    // Turn actions
    // ------------------------------------------------------------------

    public static EngineResult playCard(GameState state, String cardId, int laneIndex, boolean faceUp) {
        return playCard(state, cardId, laneIndex, faceUp, null);
    }

    /**
     * Plays a card from hand: the turn's action in the action phase, or the answer to a pending
     * "play a card" effect.
     */
    public static EngineResult playCard(GameState state, String cardId, int laneIndex, boolean faceUp, Side side) {
        if (state.isGameOver()) {
            return illegal(state, "The game is over");
        }
        ActionRequired action = state.getActionRequired();
        Side actor = side;
        if (actor == null) {
            actor = action != null ? action.actor() : state.getTurn();
        }
        PlayedCard card = findInHand(state, actor, cardId);
        if (card == null) {
            return illegal(state, cardId + " is not in " + actor + "'s hand");
        }
        if (laneIndex < 0 || laneIndex >= PlayerState.LANES) {
            return illegal(state, "No such line: " + laneIndex);
        }
        LanePlayability playability = LanePlayability.evaluate(state, actor, laneIndex, card);
        String orientation = faceUp ? "face-up" : "face-down";
        if (action != null) {
            if (action.type() != ActionRequired.Type.PLAY_FROM_HAND) {
                return illegal(state, "Waiting for " + action.type() + ", not a play");
            }
            if (actor != action.actor()) {
                return illegal(state, "Waiting for " + action.actor() + ", not " + actor);
            }
            if (faceUp && action.faceDownOnly()) {
                return illegal(state, "This card has to be played face-down");
            }
            if (action.disallowedLanes().contains(laneIndex)) {
                return illegal(state, "Line " + laneIndex + " is excluded by " + action.sourceCardId());
            }
            if (!playability.allows(faceUp)) {
                return illegal(state, reason(playability, card, orientation, laneIndex));
            }
            GameState next = begin(state);
            int depth = next.stackDepth();
            long issued = next.getActionsIssued();
            BoardActions.play(next, actor, next.takeFromHand(actor, cardId), laneIndex, faceUp);
            EffectRun continuation = action.continuation();
            EffectInterpreter.resume(next, depth, issued,
                    continuation == null ? null : continuation.completed(true, 1, cardId, card.getValue()));
            return finish(next);
        }
        String problem = turnActionProblem(state, actor, Phase.ACTION);
        if (problem != null) {
            return illegal(state, problem);
        }
        if (!playability.allows(faceUp)) {
            return illegal(state, reason(playability, card, orientation, laneIndex));
        }
        GameState next = begin(state);
        next.setPhase(Phase.HAND_LIMIT);
        next.setLastPlayedCardId(cardId);
        BoardActions.play(next, actor, next.takeFromHand(actor, cardId), laneIndex, faceUp);
        return finish(next);
    }

    /**
     * The refresh action: draw up to the hand limit. Offers the control marker first when the turn
     * player holds it.
     */
    public static EngineResult fillHand(GameState state) {
        String problem = turnActionProblem(state, state.getTurn(), Phase.ACTION);
        if (problem != null) {
            return illegal(state, problem);
        }
        GameState next = begin(state);
        if (!offerControl(next, FollowUp.fillHand())) {
            refresh(next, next.getTurn());
        }
        return finish(next);
    }

    public static EngineResult compileLane(GameState state, int laneIndex) {
        return performCompile(state, laneIndex, null);
    }

    /**
     * Compiles a qualifying line in the compile phase.
     *
     * @param onEndGame told the winner when this compile ends the game; not called when the compile
     *                  is postponed behind a control prompt
     */
    public static EngineResult performCompile(GameState state, int laneIndex, Consumer<Side> onEndGame) {
        Side turn = state.getTurn();
        String problem = turnActionProblem(state, turn, Phase.COMPILE);
        if (problem != null) {
            return illegal(state, problem);
        }
        if (!CompileEngine.canCompile(state, turn, laneIndex)) {
            return illegal(state, "Line " + laneIndex + " cannot be compiled by " + turn);
        }
        GameState next = begin(state);
        if (!offerControl(next, FollowUp.compile(laneIndex))) {
            compile(next, laneIndex, onEndGame);
        }
        return finish(next);
    }

    // ------------------------------------------------------------------
    // Answers to pending actions
    // ------------------------------------------------------------------

    public static EngineResult resolveActionWithCard(GameState state, String cardId) {
        return resolveActionWithCard(state, cardId, null);
    }

    /**
     * Answers a card-picking action: a board target, a card to discard, give or reveal, or the next
     * Start/End effect to run.
     */
    public static EngineResult resolveActionWithCard(GameState state, String cardId, Side side) {
        ActionRequired action = state.getActionRequired();
        String problem = pendingProblem(state, action, side);
        if (problem != null) {
            return illegal(state, problem);
        }
        if (action.type() == ActionRequired.Type.DISCARD) {
            return discardCards(state, List.of(cardId), side);
        }
        if (action.type() == ActionRequired.Type.PLAY_FROM_HAND) {
            return illegal(state, "A pending play needs a line and an orientation; use playCard");
        }
        if (action.type() != ActionRequired.Type.SELECT_PHASE_EFFECT && !action.type().isCardSelection()
                && !action.type().isHandSelection()) {
            return illegal(state, action.type() + " is not answered with a card");
        }
        if (!Targeting.legalCardTargets(state, action).contains(cardId)) {
            return illegal(state, cardId + " is not a legal target for " + action.type());
        }
        GameState next = begin(state);
        if (action.type() == ActionRequired.Type.SELECT_PHASE_EFFECT) {
            PhaseManager.runPhaseEffect(next, cardId);
            return finish(next);
        }
        int depth = next.stackDepth();
        long issued = next.getActionsIssued();
        EffectRun after = action.type().isHandSelection()
                ? EffectInterpreter.applyHandChoice(next, action.continuation(), action.instruction(), action.actor(), cardId)
                : EffectInterpreter.applyCardChoice(next, action.continuation(), action.instruction(),
                        action.actor(), cardId);
        EffectInterpreter.resume(next, depth, issued, after);
        return finish(next);
    }

    public static EngineResult resolveActionWithLane(GameState state, int laneIndex) {
        return resolveActionWithLane(state, laneIndex, null);
    }

    /**
     * Answers a lane-picking action: a shift destination, a line to clear, a line to play the top of
     * the deck into, or one of the two lines of a stack swap.
     */
    public static EngineResult resolveActionWithLane(GameState state, int laneIndex, Side side) {
        ActionRequired action = state.getActionRequired();
        String problem = pendingProblem(state, action, side);
        if (problem != null) {
            return illegal(state, problem);
        }
        if (!action.type().isLaneSelection()) {
            return illegal(state, action.type() + " is not answered with a line");
        }
        if (!Targeting.legalLanes(state, action).contains(laneIndex)) {
            return illegal(state, "Line " + laneIndex + " is not a legal choice for " + action.type());
        }
        GameState next = begin(state);
        int depth = next.stackDepth();
        long issued = next.getActionsIssued();
        EffectRun continuation = action.continuation();
        Side actor = action.actor();
        EffectRun after = switch (action.type()) {
            case SELECT_LANE_FOR_SHIFT ->
                    EffectInterpreter.applyShift(next, continuation, actor, action.targetCardId(), laneIndex);
            case SELECT_LANE_FOR_DELETE_ALL, SELECT_LANE_FOR_RETURN_ALL ->
                    EffectInterpreter.applyMassLane(next, continuation, action.instruction(), actor, laneIndex);
            case SELECT_LANE_FOR_SHIFT_ALL ->
                    EffectInterpreter.applyShiftAll(next, continuation, action.instruction(), actor,
                            action.laneIndex(), laneIndex);
            case SELECT_LANE_FOR_DECK_PLAY ->
                    EffectInterpreter.applyDeckPlay(next, continuation, action.instruction(), actor, laneIndex);
            case SELECT_LANES_FOR_SWAP_STACKS -> EffectInterpreter.applyStackSwapLane(next, action, laneIndex);
            default -> throw new IllegalStateException("Unhandled lane action " + action.type());
        };
        EffectInterpreter.resume(next, depth, issued, after);
        return finish(next);
    }

    public static EngineResult discardCards(GameState state, List<String> cardIds) {
        return discardCards(state, cardIds, null);
    }

    /**
     * Discards the chosen cards for a pending DISCARD: exactly the requested count, or at least that
     * many for "1 or more" discards.
     */
    public static EngineResult discardCards(GameState state, List<String> cardIds, Side side) {
        ActionRequired action = state.getActionRequired();
        String problem = pendingProblem(state, action, side);
        if (problem != null) {
            return illegal(state, problem);
        }
        if (action.type() != ActionRequired.Type.DISCARD) {
            return illegal(state, "Waiting for " + action.type() + ", not a discard");
        }
        if (cardIds == null || cardIds.isEmpty()) {
            return illegal(state, "No cards chosen");
        }
        if (new HashSet<>(cardIds).size() != cardIds.size()) {
            return illegal(state, "The same card was chosen twice");
        }
        for (String id : cardIds) {
            if (findInHand(state, action.actor(), id) == null) {
                return illegal(state, id + " is not in " + action.actor() + "'s hand");
            }
        }
        if (action.variable() ? cardIds.size() < action.count() : cardIds.size() != action.count()) {
            return illegal(state, "Discard " + (action.variable() ? "at least " : "exactly ") + action.count()
                    + (action.count() == 1 ? " card" : " cards") + ", got " + cardIds.size());
        }
        GameState next = begin(state);
        int depth = next.stackDepth();
        long issued = next.getActionsIssued();
        BoardActions.discard(next, action.actor(), cardIds, action.clearCache());
        EffectRun continuation = action.continuation();
        EffectInterpreter.resume(next, depth, issued,
                continuation == null ? null : continuation.completed(true, cardIds.size(), null, 0));
        return finish(next);
    }

    public static EngineResult rearrangeProtocols(GameState state, List<String> order) {
        return rearrangeProtocols(state, order, null);
    }

    /**
     * Puts the target side's protocols in a new lane order. Compiled flags travel with their protocol.
     */
    public static EngineResult rearrangeProtocols(GameState state, List<String> order, Side side) {
        ActionRequired action = state.getActionRequired();
        String problem = pendingProblem(state, action, side);
        if (problem != null) {
            return illegal(state, problem);
        }
        if (action.type() != ActionRequired.Type.REARRANGE_PROTOCOLS) {
            return illegal(state, "Waiting for " + action.type() + ", not a rearrange");
        }
        List<String> current = state.side(action.targetSide()).getProtocols();
        if (order == null || order.size() != current.size() || !new HashSet<>(order).equals(new HashSet<>(current))) {
            return illegal(state, order + " is not a rearrangement of " + current);
        }
        if (!Targeting.isProtocolOrderAllowed(action, order)) {
            return illegal(state, action.forbiddenProtocol() + " cannot be on line " + action.laneIndex());
        }
        return applyProtocolOrder(state, action, order);
    }

    public static EngineResult swapProtocols(GameState state, int first, int second) {
        return swapProtocols(state, first, second, null);
    }

    /**
     * Swaps two of the target side's protocols.
     */
    public static EngineResult swapProtocols(GameState state, int first, int second, Side side) {
        ActionRequired action = state.getActionRequired();
        String problem = pendingProblem(state, action, side);
        if (problem != null) {
            return illegal(state, problem);
        }
        if (action.type() != ActionRequired.Type.SWAP_PROTOCOLS) {
            return illegal(state, "Waiting for " + action.type() + ", not a swap");
        }
        if (first == second || first < 0 || second < 0 || first >= PlayerState.LANES || second >= PlayerState.LANES) {
            return illegal(state, "Cannot swap lines " + first + " and " + second);
        }
        List<String> order = new ArrayList<>(state.side(action.targetSide()).getProtocols());
        Collections.swap(order, first, second);
        if (!Targeting.isProtocolOrderAllowed(action, order)) {
            return illegal(state, action.forbiddenProtocol() + " cannot be on line " + action.laneIndex());
        }
        return applyProtocolOrder(state, action, order);
    }

    private static EngineResult applyProtocolOrder(GameState state, ActionRequired action, List<String> order) {
        GameState next = begin(state);
        int depth = next.stackDepth();
        long issued = next.getActionsIssued();
        next.rearrangeProtocols(action.targetSide(), order);
        if (action.followUp() != null) {
            runFollowUp(next, action.followUp(), action.actor());
        } else {
            EffectRun continuation = action.continuation();
            EffectInterpreter.resume(next, depth, issued,
                    continuation == null ? null : continuation.completed(true, 1, null, 0));
        }
        return finish(next);
    }

    public static EngineResult resolvePrompt(GameState state, boolean accept) {
        return resolvePrompt(state, accept, null);
    }

    /**
     * Accepts or declines a "you may" effect. Declining the control prompt is the same as
     * {@link #resolveControlPrompt(GameState, Side)} with {@code null}.
     */
    public static EngineResult resolvePrompt(GameState state, boolean accept, Side side) {
        ActionRequired action = state.getActionRequired();
        String problem = pendingProblem(state, action, side);
        if (problem != null) {
            return illegal(state, problem);
        }
        if (action.type() == ActionRequired.Type.PROMPT_USE_CONTROL) {
            if (accept) {
                return illegal(state, "Choose whose protocols to rearrange with resolveControlPrompt");
            }
            return resolveControlPrompt(state, null, side);
        }
        if (action.type() != ActionRequired.Type.PROMPT_OPTIONAL_EFFECT) {
            return illegal(state, "Waiting for " + action.type() + ", not a yes/no prompt");
        }
        GameState next = begin(state);
        EffectRun continuation = action.continuation();
        if (!accept) {
            next.log(action.actor() + " declines the effect of " + action.sourceCardId());
        }
        EffectInterpreter.execute(next, accept ? continuation : continuation.skipped());
        return finish(next);
    }

    public static EngineResult resolveChoice(GameState state, int option) {
        return resolveChoice(state, option, null);
    }

    /**
     * Picks one branch of an "either ... or ..." effect.
     */
    public static EngineResult resolveChoice(GameState state, int option, Side side) {
        ActionRequired action = state.getActionRequired();
        String problem = pendingProblem(state, action, side);
        if (problem != null) {
            return illegal(state, problem);
        }
        if (action.type() != ActionRequired.Type.PROMPT_CHOICE) {
            return illegal(state, "Waiting for " + action.type() + ", not a choice");
        }
        if (option < 0 || option >= action.instruction().options().size()) {
            return illegal(state, "No option " + option + " in " + action.options());
        }
        GameState next = begin(state);
        next.log(action.actor() + " chooses \"" + action.options().get(option) + "\"");
        EffectInterpreter.execute(next, action.continuation().replaceCurrent(action.instruction().options().get(option)));
        return finish(next);
    }

    public static EngineResult resolveControlPrompt(GameState state, Side targetSide) {
        return resolveControlPrompt(state, targetSide, null);
    }

    /**
     * Uses the control marker to rearrange {@code targetSide}'s protocols, or declines it when
     * {@code targetSide} is {@code null}. Either way the marker is returned and the postponed compile
     * or refresh follows.
     */
    public static EngineResult resolveControlPrompt(GameState state, Side targetSide, Side side) {
        ActionRequired action = state.getActionRequired();
        String problem = pendingProblem(state, action, side);
        if (problem != null) {
            return illegal(state, problem);
        }
        if (action.type() != ActionRequired.Type.PROMPT_USE_CONTROL) {
            return illegal(state, "Waiting for " + action.type() + ", not the control prompt");
        }
        GameState next = begin(state);
        next.setControlCardHolder(null);
        if (targetSide == null) {
            next.log(action.actor() + " keeps the protocols as they are and returns control");
            runFollowUp(next, action.followUp(), action.actor());
        } else {
            next.log(action.actor() + " uses control on " + targetSide + "'s protocols");
            ActionFlow.issue(next, ActionRequired.builder(ActionRequired.Type.REARRANGE_PROTOCOLS, action.actor())
                    .targetSide(targetSide)
                    .followUp(action.followUp())
                    .build());
        }
        return finish(next);
    }

    public static EngineResult skipAction(GameState state) {
        return skipAction(state, null);
    }

    /**
     * Declines an optional action; the effect that asked carries on as if the step did nothing.
     */
    public static EngineResult skipAction(GameState state, Side side) {
        ActionRequired action = state.getActionRequired();
        String problem = pendingProblem(state, action, side);
        if (problem != null) {
            return illegal(state, problem);
        }
        if (!action.optional()) {
            return illegal(state, action.type() + " is mandatory");
        }
        if (action.type() == ActionRequired.Type.PROMPT_USE_CONTROL) {
            return resolveControlPrompt(state, null, side);
        }
        GameState next = begin(state);
        next.log(action.actor() + " skips " + action.type());
        if (action.continuation() != null) {
            EffectInterpreter.execute(next, action.continuation().skipped());
        }
        return finish(next);
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public static boolean isCardTargetable(PlayedCard card, GameState state) {
        return Targeting.isCardTargetable(card, state);
    }

    public static LanePlayability getLanePlayability(GameState state, Side side, int laneIndex) {
        return LanePlayability.evaluate(state, side, laneIndex, null);
    }

    public static LanePlayability getLanePlayability(GameState state, Side side, int laneIndex, PlayedCard card) {
        return LanePlayability.evaluate(state, side, laneIndex, card);
    }

    public static List<Integer> compilableLanes(GameState state, Side side) {
        return CompileEngine.compilableLanes(state, side);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static GameState begin(GameState state) {
        GameState next = state.copy();
        next.beginTransition();
        next.setActionRequired(null);
        return next;
    }

    private static EngineResult finish(GameState next) {
        ActionFlow.settle(next);
        List<String> violations = GameStateInvariants.check(next);
        if (!violations.isEmpty()) {
            log.warn("State violates invariants after transition, repairing lane values: {}", violations);
            next.recalculateLaneValues();
        }
        return EngineResult.legal(next);
    }

    private static EngineResult illegal(GameState state, String message) {
        if (log.isDebugEnabled()) {
            log.debug("Rejected intent: {}", message);
        }
        return EngineResult.illegal(state, message);
    }

    private static String turnActionProblem(GameState state, Side actor, Phase phase) {
        if (state.isGameOver()) {
            return "The game is over";
        }
        if (state.getActionRequired() != null) {
            return "Waiting for " + state.getActionRequired().type() + " by " + state.getActionRequired().actor();
        }
        if (actor != state.getTurn()) {
            return "It is " + state.getTurn() + "'s turn";
        }
        if (state.getPhase() != phase) {
            return "Not allowed in the " + state.getPhase() + " phase";
        }
        return null;
    }

    private static String pendingProblem(GameState state, ActionRequired action, Side side) {
        if (state.isGameOver()) {
            return "The game is over";
        }
        if (action == null) {
            return "No action is pending";
        }
        if (side != null && side != action.actor()) {
            return "Waiting for " + action.actor() + ", not " + side;
        }
        return null;
    }

    private static PlayedCard findInHand(GameState state, Side side, String cardId) {
        for (PlayedCard card : state.side(side).getHand()) {
            if (card.getId().equals(cardId)) {
                return card;
            }
        }
        return null;
    }

    private static String reason(LanePlayability playability, PlayedCard card, String orientation, int laneIndex) {
        if (!playability.reason().isEmpty()) {
            return playability.reason();
        }
        return card.getCard().name() + " cannot be played " + orientation + " in line " + laneIndex;
    }

    /**
     * Issues the control prompt in front of a compile or refresh when the turn player holds the
     * marker.
     *
     * @return {@code true} if the prompt was issued and the follow-up postponed
     */
    private static boolean offerControl(GameState state, FollowUp followUp) {
        if (!state.isUseControlMechanic() || state.getControlCardHolder() != state.getTurn()) {
            return false;
        }
        ActionFlow.issue(state, ActionRequired.builder(ActionRequired.Type.PROMPT_USE_CONTROL, state.getTurn())
                .optional(true)
                .followUp(followUp)
                .build());
        return true;
    }

    private static void runFollowUp(GameState state, FollowUp followUp, Side actor) {
        if (followUp == null) {
            return;
        }
        switch (followUp.kind()) {
            case COMPILE:
                compile(state, followUp.laneIndex(), null);
                break;
            case FILL_HAND:
                refresh(state, actor);
                break;
            default:
                throw new IllegalStateException("Unknown follow-up " + followUp);
        }
    }

    private static void compile(GameState state, int laneIndex, Consumer<Side> onEndGame) {
        Side turn = state.getTurn();
        state.log(turn + " compiles " + state.side(turn).getProtocol(laneIndex) + " in line " + laneIndex);
        CompileEngine.performCompile(state, laneIndex, onEndGame);
    }

    private static void refresh(GameState state, Side side) {
        state.setPhase(Phase.HAND_LIMIT);
        int missing = GameState.HAND_LIMIT - state.side(side).getHand().size();
        state.log(side + " refreshes");
        if (missing > 0) {
            BoardActions.draw(state, side, missing);
        }
        state.countRefresh(side);
    }
}
