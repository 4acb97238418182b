package ai.compile.effects;

import ai.compile.actions.ActionFlow;
import ai.compile.actions.ActionRequired;
import ai.compile.actions.SuspendedFrame;
import ai.compile.game.CardLocation;
import ai.compile.game.GameState;
import ai.compile.game.PlayedCard;
import ai.compile.game.PlayerState;
import ai.compile.game.Side;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes card effects one instruction at a time.
 * <p>
 * Each step either completes immediately (no choice needed, exactly one legal target for a
 * mandatory choice, or nothing to do), or issues an {@link ActionRequired} that carries the run as
 * its continuation and stops. When a step that completed immediately caused another card to ask for
 * input (an uncovered card, a flipped card, a cover effect), the rest of this run is suspended on
 * the interrupt stack beneath whatever that step issued, so the newest interrupt resolves first.
 */
public final class EffectInterpreter {
    private static final Logger log = LoggerFactory.getLogger(EffectInterpreter.class);

    /** Operations that ask through their own action, so "you may" becomes a skippable action. */
    private static final Set<Op> SELF_PROMPTING = EnumSet.of(
            Op.DISCARD, Op.FLIP, Op.DELETE, Op.SHIFT, Op.RETURN, Op.REVEAL_CARD,
            Op.SHIFT_SELF, Op.SHIFT_PREVIOUS, Op.SHIFT_ALL_FACE_DOWN, Op.PLAY_FROM_HAND,
            Op.DELETE_ALL_IN_LANE, Op.RETURN_ALL_IN_LANE, Op.REARRANGE_PROTOCOLS, Op.SWAP_PROTOCOLS,
            Op.GIVE, Op.REVEAL_FROM_HAND, Op.CHOICE);

    private EffectInterpreter() {
    }

    /**
     * Runs an effect until it finishes or has to wait for a player.
     */
    public static void execute(GameState state, EffectRun run) {
        boolean entered = run.trigger() == Trigger.ON_PLAY && state.enterMiddle(run.sourceCardId());
        try {
            run(state, run);
        } finally {
            if (entered) {
                state.exitMiddle(run.sourceCardId());
            }
        }
    }

    private static void run(GameState state, EffectRun run) {
        EffectRun current = run;
        while (current != null && current.hasNext() && !state.isGameOver()) {
            int depth = state.stackDepth();
            long issued = state.getActionsIssued();
            EffectRun next = step(state, current);
            if (next == null) {
                return;
            }
            if (state.getActionsIssued() != issued) {
                suspend(state, depth, next);
                return;
            }
            current = next;
        }
    }

    /**
     * Continues a run after a player's choice has been applied.
     *
     * @param depth  interrupt stack depth before the choice was applied
     * @param issued action counter before the choice was applied
     * @param next   the run positioned after the resolved instruction; {@code null} when applying the
     *               choice issued a follow-up action that carries the run itself
     */
    public static void resume(GameState state, int depth, long issued, EffectRun next) {
        if (next == null) {
            return;
        }
        if (state.getActionsIssued() != issued) {
            suspend(state, depth, next);
            return;
        }
        execute(state, next);
    }

    private static void suspend(GameState state, int depth, EffectRun next) {
        if (next.hasNext()) {
            if (log.isDebugEnabled()) {
                log.debug("Suspending {} at depth {}", next, depth);
            }
            state.insertFrame(depth, SuspendedFrame.ofContinuation(next));
        }
    }

    /**
     * Executes the current instruction.
     *
     * @return the run to continue with, or {@code null} when an action was issued for it
     */
    static EffectRun step(GameState state, EffectRun run) {
        Instruction in = run.current();
        if (!conditionHolds(state, run, in)) {
            if (log.isDebugEnabled()) {
                log.debug("{}: condition {} not met for {}", run.sourceCardId(), in.condition(), in.op());
            }
            return run.skipped();
        }
        int sourceLane = Targets.sourceLane(state, run.sourceCardId(), run.laneIndex());
        if (in.scope() != Instruction.Scope.SINGLE && in.scope() != Instruction.Scope.CHOSEN_OTHER_LANE) {
            List<Instruction> expanded = expand(state, run, in, sourceLane);
            return expanded.isEmpty() ? run.skipped() : run.replaceCurrent(expanded);
        }
        Side actor = actorOf(run, in);
        if (in.optional() && !SELF_PROMPTING.contains(in.op())) {
            ActionFlow.issue(state, base(ActionRequired.Type.PROMPT_OPTIONAL_EFFECT, actor, run, in, sourceLane)
                    .optional(true)
                    .continuation(run.replaceCurrent(List.of(settled(in))))
                    .build());
            return null;
        }
        int amount = amount(state, run, in);
        switch (in.op()) {
            case DRAW: {
                if (amount <= 0) {
                    return run.skipped();
                }
                int drawn = BoardActions.draw(state, actor, amount);
                return run.completed(drawn > 0, drawn, null, 0);
            }
            case MUTUAL_DRAW:
                return mutualDraw(state, run, actor);
            case DRAW_FROM_OPPONENT_DECK: {
                int drawn = 0;
                for (int i = 0; i < amount; i++) {
                    PlayedCard card = state.takeTopOfDeck(actor.opponent());
                    if (card == null) {
                        break;
                    }
                    state.addToHand(actor, card);
                    drawn++;
                }
                if (drawn > 0) {
                    state.log(actor + " draws " + drawn + " from " + actor.opponent() + "'s deck");
                }
                return run.completed(drawn > 0, drawn, null, 0);
            }
            case TAKE_RANDOM: {
                List<String> theirs = handIds(state, actor.opponent());
                if (theirs.isEmpty()) {
                    state.log(actor.opponent() + " has no card to take");
                    return run.skipped();
                }
                state.passToOpponent(actor.opponent(), theirs.get(state.randomIndex(theirs.size())));
                return run.completed(true, 1, null, 0);
            }
            case GIVE:
            case REVEAL_FROM_HAND:
                return selectHandCard(state, run, in, actor, sourceLane);
            case REFRESH: {
                int missing = GameState.HAND_LIMIT - state.side(actor).getHand().size();
                int drawn = missing > 0 ? BoardActions.draw(state, actor, missing) : 0;
                state.countRefresh(actor);
                return run.completed(drawn > 0, drawn, null, 0);
            }
            case DISCARD:
                return discard(state, run, in, actor, amount, sourceLane);
            case DISCARD_HAND_AND_REDRAW: {
                List<String> hand = handIds(state, actor);
                if (hand.isEmpty()) {
                    return run.skipped();
                }
                BoardActions.discard(state, actor, hand, false);
                int drawn = BoardActions.draw(state, actor, hand.size());
                return run.completed(true, drawn, null, 0);
            }
            case FLIP:
            case DELETE:
            case RETURN:
            case SHIFT:
            case REVEAL_CARD:
                return selectCard(state, run, in, actor, sourceLane);
            case FLIP_SELF:
            case DELETE_SELF:
            case SHIFT_SELF:
                if (!state.isOnBoard(run.sourceCardId())) {
                    return run.skipped();
                }
                return applyCardChoice(state, run, in, actor, run.sourceCardId());
            case FLIP_PREVIOUS:
            case SHIFT_PREVIOUS:
                if (run.lastTargetId() == null || !state.isOnBoard(run.lastTargetId())) {
                    return run.skipped();
                }
                return applyCardChoice(state, run, in, actor, run.lastTargetId());
            case FLIP_ALL:
                return flipAll(state, run, in, actor, sourceLane);
            case DELETE_ALL_IN_LANE:
            case RETURN_ALL_IN_LANE:
                return selectMassLane(state, run, in, actor, sourceLane);
            case DELETE_HIGHEST_UNCOVERED:
            case DELETE_LOWEST_COVERED_IN_LANE:
                return deleteExtreme(state, run, in, actor, sourceLane);
            case SHIFT_ALL_FACE_DOWN:
                return shiftAllFaceDown(state, run, in, actor, sourceLane);
            case PLAY_FROM_HAND:
                return playFromHand(state, run, in, actor, sourceLane);
            case PLAY_TOP_OF_DECK:
                return playTopOfDeck(state, run, in, actor, sourceLane);
            case PLAY_TOP_OF_DECK_UNDER_SELF: {
                int played = 0;
                for (int i = 0; i < amount && state.isOnBoard(run.sourceCardId()); i++) {
                    if (!BoardActions.playTopOfDeckUnder(state, actor, run.sourceCardId())) {
                        break;
                    }
                    played++;
                }
                return run.completed(played > 0, played, null, 0);
            }
            case REARRANGE_PROTOCOLS:
            case SWAP_PROTOCOLS: {
                if (PassiveRules.blocksProtocolRearrange(state)) {
                    state.log("Protocols cannot be rearranged; " + run.sourceCardId() + " changes nothing");
                    return run.skipped();
                }
                Side target = in.whose() == TargetFilter.Owner.OPPONENT ? actor.opponent() : actor;
                ActionRequired.Type type = in.op() == Op.REARRANGE_PROTOCOLS
                        ? ActionRequired.Type.REARRANGE_PROTOCOLS : ActionRequired.Type.SWAP_PROTOCOLS;
                ActionFlow.issue(state, base(type, actor, run, in, sourceLane)
                        .optional(in.optional())
                        .targetSide(target)
                        .forbiddenProtocol(in.forbiddenProtocol())
                        .build());
                return null;
            }
            case SWAP_STACKS: {
                if (state.side(actor).cardsOnBoard() == 0) {
                    state.log(actor + " has no stack to swap");
                    return run.skipped();
                }
                ActionFlow.issue(state,
                        base(ActionRequired.Type.SELECT_LANES_FOR_SWAP_STACKS, actor, run, in, sourceLane)
                                .optional(in.optional())
                                .build());
                return null;
            }
            case REVEAL_HAND: {
                Side target = in.whose() == TargetFilter.Owner.OWN ? actor : actor.opponent();
                List<String> hand = handIds(state, target);
                for (String id : hand) {
                    state.reveal(id);
                }
                state.log(target + " reveals their hand");
                return run.completed(!hand.isEmpty(), hand.size(), null, 0);
            }
            case BLOCK_COMPILE:
                state.setCannotCompile(actor.opponent(), true);
                state.log(actor.opponent() + " cannot compile next turn");
                return run.completed(true, 0, null, 0);
            case CHOICE:
                ActionFlow.issue(state, base(ActionRequired.Type.PROMPT_CHOICE, actor, run, in, sourceLane)
                        .optional(in.optional())
                        .options(in.optionLabels())
                        .build());
                return null;
            default:
                throw new IllegalStateException("Unhandled operation " + in.op());
        }
    }

    private static ActionRequired.Builder base(ActionRequired.Type type, Side actor, EffectRun run, Instruction in,
                                               int sourceLane) {
        return ActionRequired.builder(type, actor)
                .sourceCardId(run.sourceCardId())
                .laneIndex(sourceLane)
                .instruction(in)
                .filter(in.filter())
                .continuation(run);
    }

    /**
     * Copy of an instruction whose condition and "you may" have already been dealt with.
     */
    private static Instruction settled(Instruction in) {
        return in.toBuilder().optional(false).condition(Instruction.Condition.ALWAYS).build();
    }

    private static Side actorOf(EffectRun run, Instruction in) {
        return in.actor() == Instruction.Actor.SELF ? run.owner() : run.owner().opponent();
    }

    private static boolean conditionHolds(GameState state, EffectRun run, Instruction in) {
        switch (in.condition()) {
            case IF_PREVIOUS:
                return run.lastSucceeded();
            case IF_COVERING: {
                CardLocation loc = state.locate(run.sourceCardId());
                return loc != null && loc.onBoard() && loc.index() > 0;
            }
            case IF_IN_PROTOCOL_LINE: {
                CardLocation loc = state.locate(run.sourceCardId());
                if (loc == null || !loc.onBoard()) {
                    return false;
                }
                String protocol = in.conditionProtocol();
                return protocol.equals(state.getPlayer().getProtocol(loc.laneIndex()))
                        || protocol.equals(state.getOpponent().getProtocol(loc.laneIndex()));
            }
            default:
                return true;
        }
    }

    private static List<Instruction> expand(GameState state, EffectRun run, Instruction in, int sourceLane) {
        List<Instruction> expanded = new ArrayList<>();
        for (int lane = 0; lane < PlayerState.LANES; lane++) {
            boolean include = switch (in.scope()) {
                case EACH_LANE -> true;
                case EACH_OTHER_LANE -> lane != sourceLane;
                case EACH_LANE_WITH_OWN_CARD -> !state.side(run.owner()).getLane(lane).isEmpty();
                default -> false;
            };
            if (include) {
                expanded.add(in.forLane(lane).toBuilder().condition(Instruction.Condition.ALWAYS).build());
            }
        }
        return expanded;
    }

    private static int amount(GameState state, EffectRun run, Instruction in) {
        return switch (in.amount()) {
            case FIXED -> in.count();
            case PREVIOUS_COUNT_PLUS_ONE -> run.lastCount() + 1;
            case PREVIOUS_VALUE -> run.lastValue();
            case NON_MATCHING_LINES -> nonMatchingLines(state);
            case FACE_DOWN_CARDS -> faceDownCards(state);
            case HALF_CARDS_IN_LINE ->
                    state.cardsInLane(Targets.sourceLane(state, run.sourceCardId(), run.laneIndex())) / 2;
        };
    }

    /**
     * Lines holding at least one face-up card whose protocol matches neither protocol of the line.
     */
    static int nonMatchingLines(GameState state) {
        int lines = 0;
        for (int lane = 0; lane < PlayerState.LANES; lane++) {
            boolean found = false;
            for (Side side : Side.values()) {
                for (PlayedCard card : state.side(side).getLane(lane)) {
                    if (card.isFaceUp() && !Targets.matchesLine(state, card, lane)) {
                        found = true;
                    }
                }
            }
            if (found) {
                lines++;
            }
        }
        return lines;
    }

    static int faceDownCards(GameState state) {
        int count = 0;
        for (Side side : Side.values()) {
            for (int lane = 0; lane < PlayerState.LANES; lane++) {
                for (PlayedCard card : state.side(side).getLane(lane)) {
                    if (!card.isFaceUp()) {
                        count++;
                    }
                }
            }
        }
        return count;
    }

    private static List<String> handIds(GameState state, Side side) {
        List<String> ids = new ArrayList<>();
        for (PlayedCard card : state.side(side).getHand()) {
            ids.add(card.getId());
        }
        return ids;
    }

    private static EffectRun mutualDraw(GameState state, EffectRun run, Side actor) {
        int moved = 0;
        PlayedCard fromOpponent = state.takeTopOfDeck(actor.opponent());
        if (fromOpponent != null) {
            state.addToHand(actor, fromOpponent);
            moved++;
        }
        PlayedCard fromOwn = state.takeTopOfDeck(actor);
        if (fromOwn != null) {
            state.addToHand(actor.opponent(), fromOwn);
            moved++;
        }
        state.log(actor + " and " + actor.opponent() + " draw from each other's decks");
        return run.completed(moved > 0, moved, null, 0);
    }

    private static EffectRun discard(GameState state, EffectRun run, Instruction in, Side actor, int amount,
                                     int sourceLane) {
        List<String> hand = handIds(state, actor);
        if (hand.isEmpty() || amount <= 0) {
            return run.skipped();
        }
        if (!in.optional() && !in.variable() && hand.size() <= amount) {
            int discarded = BoardActions.discard(state, actor, hand, false);
            return run.completed(true, discarded, null, 0);
        }
        ActionFlow.issue(state, base(ActionRequired.Type.DISCARD, actor, run, in, sourceLane)
                .optional(in.optional())
                .count(Math.min(amount, hand.size()))
                .variable(in.variable())
                .build());
        return null;
    }

    private static EffectRun selectCard(GameState state, EffectRun run, Instruction in, Side actor, int sourceLane) {
        List<String> candidates = Targets.unblocked(state, in.op(),
                Targets.candidates(state, actor, run.sourceCardId(), sourceLane, in.filter()), in.destination(), sourceLane);
        if (candidates.isEmpty()) {
            state.log("No legal target for " + in.op() + " from " + run.sourceCardId());
            return run.skipped();
        }
        if (!in.optional() && candidates.size() == 1) {
            return applyCardChoice(state, run, in, actor, candidates.get(0));
        }
        ActionFlow.issue(state, base(selectionType(in.op()), actor, run, in, sourceLane)
                .optional(in.optional())
                .build());
        return null;
    }

    private static EffectRun selectHandCard(GameState state, EffectRun run, Instruction in, Side actor, int sourceLane) {
        List<String> hand = handIds(state, actor);
        if (hand.isEmpty()) {
            state.log(actor + " has no card in hand for " + in.op());
            return run.skipped();
        }
        if (!in.optional() && hand.size() == 1) {
            return applyHandChoice(state, run, in, actor, hand.get(0));
        }
        ActionRequired.Type type = in.op() == Op.GIVE
                ? ActionRequired.Type.SELECT_CARD_TO_GIVE : ActionRequired.Type.SELECT_HAND_CARD_TO_REVEAL;
        ActionFlow.issue(state, base(type, actor, run, in, sourceLane).optional(in.optional()).build());
        return null;
    }

    /**
     * Gives away or reveals the chosen hand card.
     */
    public static EffectRun applyHandChoice(GameState state, EffectRun run, Instruction in, Side actor, String cardId) {
        if (in.op() == Op.GIVE) {
            state.passToOpponent(actor, cardId);
        } else {
            state.reveal(cardId);
            state.log(actor + " reveals " + state.findCard(cardId).getCard().name() + " from hand");
        }
        return run.completed(true, 1, null, 0);
    }

    private static ActionRequired.Type selectionType(Op op) {
        return switch (op) {
            case FLIP -> ActionRequired.Type.SELECT_CARD_TO_FLIP;
            case DELETE -> ActionRequired.Type.SELECT_CARD_TO_DELETE;
            case RETURN -> ActionRequired.Type.SELECT_CARD_TO_RETURN;
            case SHIFT -> ActionRequired.Type.SELECT_CARD_TO_SHIFT;
            case REVEAL_CARD -> ActionRequired.Type.SELECT_CARD_TO_REVEAL;
            default -> throw new IllegalArgumentException("Not a card selection: " + op);
        };
    }

    /**
     * Applies an instruction to a chosen board card.
     *
     * @return the run positioned after the instruction, or {@code null} when a shift still needs
     *         its destination and an action was issued for it
     */
    public static EffectRun applyCardChoice(GameState state, EffectRun run, Instruction in, Side actor, String cardId) {
        boolean entered = run.trigger() == Trigger.ON_PLAY && state.enterMiddle(run.sourceCardId());
        try {
            return applyToCard(state, run, in, actor, cardId);
        } finally {
            if (entered) {
                state.exitMiddle(run.sourceCardId());
            }
        }
    }

    private static EffectRun applyToCard(GameState state, EffectRun run, Instruction in, Side actor, String cardId) {
        CardLocation loc = state.locate(cardId);
        int value = loc != null && loc.onBoard() ? state.cardAt(loc).getValue() : 0;
        switch (in.op()) {
            case FLIP:
            case FLIP_SELF:
            case FLIP_PREVIOUS: {
                boolean flipped = BoardActions.flip(state, actor, cardId);
                return run.completed(flipped, flipped ? 1 : 0, cardId, value);
            }
            case DELETE:
            case DELETE_SELF:
            case DELETE_HIGHEST_UNCOVERED:
            case DELETE_LOWEST_COVERED_IN_LANE: {
                int deleted = BoardActions.delete(state, actor, List.of(cardId));
                return run.completed(deleted > 0, deleted, cardId, value);
            }
            case RETURN: {
                int returned = BoardActions.returnToHand(state, actor, List.of(cardId));
                return run.completed(returned > 0, returned, cardId, value);
            }
            case REVEAL_CARD:
                state.reveal(cardId);
                state.log(actor + " reveals " + state.findCard(cardId).getCard().name());
                return run.completed(true, 1, cardId, value);
            case SHIFT:
            case SHIFT_SELF:
            case SHIFT_PREVIOUS:
                return requestShiftDestination(state, run, in, actor, cardId);
            default:
                throw new IllegalArgumentException(in.op() + " does not target a card");
        }
    }

    private static EffectRun requestShiftDestination(GameState state, EffectRun run, Instruction in, Side actor,
                                                     String cardId) {
        int sourceLane = Targets.sourceLane(state, run.sourceCardId(), run.laneIndex());
        List<Integer> lanes = Targets.shiftDestinations(state, cardId, in.destination(), sourceLane);
        if (lanes.isEmpty()) {
            return run.skipped();
        }
        boolean optional = in.optional() && in.op() != Op.SHIFT;
        if (!optional && lanes.size() == 1) {
            return applyShift(state, run, actor, cardId, lanes.get(0));
        }
        ActionFlow.issue(state, base(ActionRequired.Type.SELECT_LANE_FOR_SHIFT, actor, run, in, sourceLane)
                .optional(optional)
                .targetCardId(cardId)
                .build());
        return null;
    }

    /**
     * Shifts the chosen card and records it as "that card".
     */
    public static EffectRun applyShift(GameState state, EffectRun run, Side actor, String cardId, int toLane) {
        int value = state.isOnBoard(cardId) ? state.findCard(cardId).getValue() : 0;
        BoardActions.shift(state, actor, cardId, toLane);
        return run == null ? null : run.completed(true, 1, cardId, value);
    }

    private static EffectRun flipAll(GameState state, EffectRun run, Instruction in, Side actor, int sourceLane) {
        List<String> ids = Targets.candidates(state, actor, run.sourceCardId(), sourceLane, in.filter());
        int flipped = 0;
        for (String id : ids) {
            if (state.isOnBoard(id) && BoardActions.flip(state, actor, id)) {
                flipped++;
            }
        }
        return run.completed(flipped > 0, flipped, null, 0);
    }

    private static EffectRun selectMassLane(GameState state, EffectRun run, Instruction in, Side actor, int sourceLane) {
        List<Integer> lanes = Targets.massTargetLanes(state, actor, run.sourceCardId(), sourceLane, in.filter(),
                in.minCards());
        if (lanes.isEmpty()) {
            state.log("No line qualifies for " + in.op() + " from " + run.sourceCardId());
            return run.skipped();
        }
        if (!in.optional() && lanes.size() == 1) {
            return applyMassLane(state, run, in, actor, lanes.get(0));
        }
        ActionRequired.Type type = in.op() == Op.DELETE_ALL_IN_LANE
                ? ActionRequired.Type.SELECT_LANE_FOR_DELETE_ALL : ActionRequired.Type.SELECT_LANE_FOR_RETURN_ALL;
        ActionFlow.issue(state, base(type, actor, run, in, sourceLane).optional(in.optional()).build());
        return null;
    }

    /**
     * Deletes or returns every matching card of the chosen lane.
     */
    public static EffectRun applyMassLane(GameState state, EffectRun run, Instruction in, Side actor, int lane) {
        int sourceLane = Targets.sourceLane(state, run.sourceCardId(), run.laneIndex());
        List<String> ids = Targets.candidatesInLane(state, actor, run.sourceCardId(), sourceLane, in.filter(), lane);
        int affected = in.op() == Op.DELETE_ALL_IN_LANE
                ? BoardActions.delete(state, actor, ids)
                : BoardActions.returnToHand(state, actor, ids);
        return run.completed(affected > 0, affected, null, 0);
    }

    private static EffectRun deleteExtreme(GameState state, EffectRun run, Instruction in, Side actor, int sourceLane) {
        List<String> candidates = Targets.candidates(state, actor, run.sourceCardId(), sourceLane, in.filter());
        if (candidates.isEmpty()) {
            return run.skipped();
        }
        boolean highest = in.op() == Op.DELETE_HIGHEST_UNCOVERED;
        int best = highest ? Integer.MIN_VALUE : Integer.MAX_VALUE;
        List<String> ties = new ArrayList<>();
        for (String id : candidates) {
            CardLocation loc = state.locate(id);
            int value = LaneValues.effectiveValue(state, loc.side(), loc.laneIndex(), state.cardAt(loc));
            if (highest ? value > best : value < best) {
                best = value;
                ties.clear();
            }
            if (value == best) {
                ties.add(id);
            }
        }
        if (ties.size() == 1) {
            return applyCardChoice(state, run, in, actor, ties.get(0));
        }
        ActionFlow.issue(state, base(ActionRequired.Type.SELECT_CARD_TO_DELETE, actor, run, in, sourceLane)
                .candidateIds(ties)
                .build());
        return null;
    }

    private static EffectRun shiftAllFaceDown(GameState state, EffectRun run, Instruction in, Side actor,
                                              int sourceLane) {
        List<String> ids = Targets.candidatesInLane(state, actor, run.sourceCardId(), sourceLane, in.filter(), sourceLane);
        if (ids.isEmpty()) {
            return run.skipped();
        }
        ActionFlow.issue(state, base(ActionRequired.Type.SELECT_LANE_FOR_SHIFT_ALL, actor, run, in, sourceLane)
                .optional(in.optional())
                .disallowLane(sourceLane)
                .build());
        return null;
    }

    /**
     * Shifts every matching card of the action's lane to the chosen lane, bottom card first.
     */
    public static EffectRun applyShiftAll(GameState state, EffectRun run, Instruction in, Side actor, int fromLane,
                                          int toLane) {
        List<String> ids = Targets.candidatesInLane(state, actor, run.sourceCardId(), fromLane, in.filter(), fromLane);
        int shifted = 0;
        for (String id : ids) {
            if (state.isOnBoard(id)) {
                BoardActions.shift(state, actor, id, toLane);
                shifted++;
            }
        }
        return run.completed(shifted > 0, shifted, null, 0);
    }

    private static EffectRun playFromHand(GameState state, EffectRun run, Instruction in, Side actor, int sourceLane) {
        boolean faceDownOnly = in.filter().faceState() == TargetFilter.FaceState.FACE_DOWN;
        ActionRequired action = base(ActionRequired.Type.PLAY_FROM_HAND, actor, run, in, sourceLane)
                .optional(in.optional())
                .faceDownOnly(faceDownOnly)
                .build();
        if (in.filter().lane() == TargetFilter.LaneFilter.OTHER) {
            action = action.toBuilder().disallowLane(sourceLane).build();
        }
        if (!hasLegalPlay(state, action)) {
            state.log(actor + " has no card to play for " + run.sourceCardId());
            return run.skipped();
        }
        ActionFlow.issue(state, action);
        return null;
    }

    /**
     * Whether a PLAY_FROM_HAND action can be satisfied by at least one card and lane.
     */
    public static boolean hasLegalPlay(GameState state, ActionRequired action) {
        for (PlayedCard card : state.side(action.actor()).getHand()) {
            for (int lane = 0; lane < PlayerState.LANES; lane++) {
                if (action.disallowedLanes().contains(lane)) {
                    continue;
                }
                LanePlayability playability = LanePlayability.evaluate(state, action.actor(), lane, card);
                if (playability.faceDownAllowed() || (!action.faceDownOnly() && playability.faceUpAllowed())) {
                    return true;
                }
            }
        }
        return false;
    }

    private static EffectRun playTopOfDeck(GameState state, EffectRun run, Instruction in, Side actor, int sourceLane) {
        PlayerState ps = state.side(actor);
        if (ps.getDeck().isEmpty() && ps.getDiscard().isEmpty()) {
            return run.skipped();
        }
        if (in.scope() == Instruction.Scope.CHOSEN_OTHER_LANE) {
            ActionFlow.issue(state, base(ActionRequired.Type.SELECT_LANE_FOR_DECK_PLAY, actor, run, in, sourceLane)
                    .optional(in.optional())
                    .disallowLane(sourceLane)
                    .build());
            return null;
        }
        int lane = in.filter().onlyLane() >= 0 ? in.filter().onlyLane() : sourceLane;
        return applyDeckPlay(state, run, in, actor, lane);
    }

    /**
     * Plays the top card(s) of the actor's deck face-down into a lane.
     */
    /**
     * Takes one line of a stack swap. The first line re-issues the action for the second; the second
     * performs the swap.
     *
     * @return the run to continue with, or {@code null} while the second line is outstanding
     */
    public static EffectRun applyStackSwapLane(GameState state, ActionRequired action, int lane) {
        if (action.disallowedLanes().isEmpty()) {
            ActionFlow.issue(state, action.toBuilder().disallowLane(lane).build());
            return null;
        }
        int first = action.disallowedLanes().iterator().next();
        state.swapStacks(action.actor(), first, lane);
        return action.continuation().completed(true, 1, null, 0);
    }

    public static EffectRun applyDeckPlay(GameState state, EffectRun run, Instruction in, Side actor, int lane) {
        int played = 0;
        for (int i = 0; i < in.count(); i++) {
            if (!BoardActions.playTopOfDeck(state, actor, lane)) {
                break;
            }
            played++;
        }
        return run.completed(played > 0, played, null, 0);
    }
}
