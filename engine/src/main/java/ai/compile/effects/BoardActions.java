package ai.compile.effects;

import ai.compile.actions.QueuedEffect;
import ai.compile.game.CardLocation;
import ai.compile.game.GameState;
import ai.compile.game.PlayedCard;
import ai.compile.game.PlayerState;
import ai.compile.game.Side;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Board operations as the rules see them: each wraps a {@link GameState} primitive and fires
 * whatever the move triggers.
 * <ul>
 *   <li>Placing a card on a face-up card runs that card's "when covered" effect first.</li>
 *   <li>A card entering the board face-up, or turning face-up while uncovered, runs its middle box.</li>
 *   <li>Removing a card that exposes a face-up card runs the exposed card's middle box again.</li>
 *   <li>Deletes, discards and draws queue the matching "after ..." reactions.</li>
 *   <li>Flips face-up and shifts refuse to happen while a passive rule forbids them.</li>
 * </ul>
 */
public final class BoardActions {
    private static final Logger log = LoggerFactory.getLogger(BoardActions.class);

    private BoardActions() {
    }

    /**
     * Puts a card (already taken out of its container) on top of one of the side's lanes.
     *
     * @return the placed card
     */
    public static PlayedCard play(GameState state, Side side, PlayedCard card, int lane, boolean faceUp) {
        long issued = state.getActionsIssued();
        runCoverEffects(state, side, lane);
        boolean coverSuspended = state.getActionsIssued() != issued;
        PlayedCard placed = state.placeOnLane(side, lane, card, faceUp);
        state.countPlay(side);
        state.log(side + " plays " + (faceUp ? card.getCard().name() + " face-up" : "a card face-down")
                + " in line " + lane);
        if (faceUp) {
            if (coverSuspended) {
                queueMiddle(state, placed.getId());
            } else {
                triggerMiddle(state, placed.getId());
            }
        }
        return placed;
    }

    private static void runCoverEffects(GameState state, Side side, int lane) {
        PlayedCard covered = state.side(side).top(lane);
        if (covered == null || !covered.isFaceUp()) {
            return;
        }
        for (Effect effect : covered.getCard().effectsFor(Trigger.ON_COVER)) {
            if (!EffectActivity.isLive(state, covered.getId(), effect)) {
                continue;
            }
            state.log(covered.getCard().name() + " is about to be covered");
            EffectInterpreter.execute(state, EffectRun.start(covered.getId(), side, lane, Trigger.ON_COVER,
                    effect.instructions()));
        }
    }

    /**
     * Runs the middle box of a card if it is face-up, uncovered and not silenced by its line.
     */
    public static void triggerMiddle(GameState state, String cardId) {
        CardLocation loc = state.locate(cardId);
        if (loc == null || !loc.onBoard() || !state.isUncovered(loc)) {
            return;
        }
        PlayedCard card = state.cardAt(loc);
        if (!card.isFaceUp()) {
            return;
        }
        List<Effect> middle = card.getCard().effectsFor(Trigger.ON_PLAY);
        if (middle.isEmpty()) {
            return;
        }
        if (PassiveRules.ignoresMiddleCommands(state, loc)) {
            state.log("Middle commands of " + card.getCard().name() + " are ignored in line " + loc.laneIndex());
            return;
        }
        for (Effect effect : middle) {
            EffectInterpreter.execute(state, EffectRun.start(cardId, loc.side(), loc.laneIndex(), Trigger.ON_PLAY,
                    effect.instructions()));
        }
    }

    /**
     * A card turned face-up (or uncovered) while its own middle box is still resolving does not start
     * that box a second time.
     */
    private static void triggerMiddleUnlessResolving(GameState state, String cardId) {
        if (state.isResolvingMiddle(cardId)) {
            state.log(state.findCard(cardId).getCard().name() + " is already resolving its middle commands");
            return;
        }
        triggerMiddle(state, cardId);
    }

    private static void queueMiddle(GameState state, String cardId) {
        CardLocation loc = state.locate(cardId);
        PlayedCard card = state.cardAt(loc);
        for (Effect effect : card.getCard().effectsFor(Trigger.ON_PLAY)) {
            state.enqueue(QueuedEffect.ofRun(EffectRun.start(cardId, loc.side(), loc.laneIndex(), Trigger.ON_PLAY,
                    effect.instructions())));
        }
    }

    /**
     * Flips a board card. A face-up card with a "when this card would be flipped" effect runs that
     * effect instead.
     *
     * @return whether the card was actually turned over
     */
    public static boolean flip(GameState state, Side actor, String cardId) {
        CardLocation loc = state.locate(cardId);
        if (loc == null || !loc.onBoard()) {
            return false;
        }
        PlayedCard card = state.cardAt(loc);
        if (card.isFaceUp()) {
            for (Effect effect : card.getCard().effectsFor(Trigger.ON_FLIP)) {
                if (EffectActivity.isLive(state, loc, effect)) {
                    state.log(card.getCard().name() + " would be flipped");
                    EffectInterpreter.execute(state, EffectRun.start(cardId, loc.side(), loc.laneIndex(), Trigger.ON_FLIP,
                            effect.instructions()));
                    return false;
                }
            }
        }
        if (!card.isFaceUp() && PassiveRules.blocksFlipFaceUp(state, loc.laneIndex())) {
            state.log("The face-down card in " + loc.side() + "'s line " + loc.laneIndex() + " cannot be flipped face-up");
            return false;
        }
        PlayedCard flipped = state.flip(actor, cardId);
        if (flipped.isFaceUp() && state.isUncovered(state.locate(cardId))) {
            triggerMiddleUnlessResolving(state, cardId);
        }
        return true;
    }

    /**
     * Deletes a batch of board cards, then runs uncover checks and queues the actor's "after you
     * delete" reactions.
     *
     * @return number of cards deleted
     */
    public static int delete(GameState state, Side actor, List<String> cardIds) {
        Map<String, String> topsBefore = topsOf(state, cardIds);
        int deleted = 0;
        for (String id : cardIds) {
            if (state.isOnBoard(id)) {
                state.deleteFromBoard(actor, id);
                deleted++;
            }
        }
        checkUncovers(state, topsBefore);
        if (deleted > 0) {
            queueReactions(state, actor, Trigger.AFTER_DELETE);
        }
        return deleted;
    }

    /**
     * Returns a batch of board cards to their owners' hands.
     *
     * @return number of cards returned
     */
    public static int returnToHand(GameState state, Side actor, List<String> cardIds) {
        Map<String, String> topsBefore = topsOf(state, cardIds);
        int returned = 0;
        for (String id : cardIds) {
            if (state.isOnBoard(id)) {
                state.returnToHand(actor, id);
                returned++;
            }
        }
        checkUncovers(state, topsBefore);
        return returned;
    }

    /**
     * Moves a board card to another lane on its owner's side. The card it lands on is covered
     * (firing its cover effect); the card it leaves behind may be uncovered.
     */
    public static void shift(GameState state, Side actor, String cardId, int toLane) {
        CardLocation loc = state.locate(cardId);
        if (loc == null || !loc.onBoard() || loc.laneIndex() == toLane) {
            return;
        }
        if (PassiveRules.blocksShifts(state, loc.laneIndex()) || PassiveRules.blocksShifts(state, toLane)) {
            state.log("Cards cannot shift between line " + loc.laneIndex() + " and line " + toLane);
            return;
        }
        Side owner = loc.side();
        int fromLane = loc.laneIndex();
        Map<String, String> topsBefore = topsOf(state, List.of(cardId));
        PlayedCard card = state.liftForShift(cardId);
        checkUncovers(state, topsBefore);
        runCoverEffects(state, owner, toLane);
        state.landShift(actor, owner, card, fromLane, toLane);
    }

    private static Map<String, String> topsOf(GameState state, List<String> cardIds) {
        Map<String, String> tops = new LinkedHashMap<>();
        for (String id : cardIds) {
            CardLocation loc = state.locate(id);
            if (loc == null || !loc.onBoard()) {
                continue;
            }
            String key = loc.side().name() + ":" + loc.laneIndex();
            if (!tops.containsKey(key)) {
                PlayedCard top = state.side(loc.side()).top(loc.laneIndex());
                tops.put(key, top == null ? null : top.getId());
            }
        }
        return tops;
    }

    private static void checkUncovers(GameState state, Map<String, String> topsBefore) {
        for (Map.Entry<String, String> entry : topsBefore.entrySet()) {
            String[] parts = entry.getKey().split(":");
            checkUncover(state, Side.valueOf(parts[0]), Integer.parseInt(parts[1]), entry.getValue());
        }
    }

    /**
     * Re-runs the middle box of a face-up card that became the top of its stack.
     */
    public static void checkUncover(GameState state, Side side, int lane, String previousTopId) {
        PlayedCard top = state.side(side).top(lane);
        if (top == null || top.getId().equals(previousTopId) || !top.isFaceUp()) {
            return;
        }
        if (!state.getProcessedUncoverEventIds().add(top.getId())) {
            if (log.isDebugEnabled()) {
                log.debug("Uncover of {} already handled this phase", top.getId());
            }
            return;
        }
        state.log(top.getCard().name() + " is uncovered");
        triggerMiddleUnlessResolving(state, top.getId());
    }

    /**
     * Draws cards and queues "after you draw" reactions.
     *
     * @return number of cards drawn
     */
    public static int draw(GameState state, Side side, int count) {
        int drawn = state.draw(side, count);
        if (drawn > 0) {
            for (int lane = 0; lane < PlayerState.LANES; lane++) {
                for (PlayedCard card : state.side(side).getLane(lane)) {
                    for (Effect effect : card.getCard().effectsFor(Trigger.AFTER_DRAW)) {
                        if (EffectActivity.isLive(state, card.getId(), effect)
                                && state.getProcessedDrawTriggerIds().add(card.getId())) {
                            state.enqueue(QueuedEffect.ofRun(EffectRun.start(card.getId(), side, lane,
                                    Trigger.AFTER_DRAW, effect.instructions())));
                        }
                    }
                }
            }
        }
        return drawn;
    }

    /**
     * Discards cards from hand. Queues the opponent's "after your opponent discards" reactions and,
     * for the hand limit discard, the side's own "after you clear cache" reactions.
     */
    public static int discard(GameState state, Side side, List<String> cardIds, boolean clearCache) {
        int discarded = 0;
        for (String id : cardIds) {
            state.discardFromHand(side, id);
            discarded++;
        }
        if (discarded > 0) {
            queueReactions(state, side.opponent(), Trigger.AFTER_OPPONENT_DISCARD);
            if (clearCache) {
                queueReactions(state, side, Trigger.AFTER_CLEAR_CACHE);
            }
        }
        return discarded;
    }

    private static void queueReactions(GameState state, Side owner, Trigger trigger) {
        List<QueuedEffect> reactions = new ArrayList<>();
        for (int lane = 0; lane < PlayerState.LANES; lane++) {
            for (PlayedCard card : state.side(owner).getLane(lane)) {
                for (Effect effect : card.getCard().effectsFor(trigger)) {
                    if (EffectActivity.isLive(state, card.getId(), effect)) {
                        reactions.add(QueuedEffect.ofRun(EffectRun.start(card.getId(), owner, lane, trigger,
                                effect.instructions())));
                    }
                }
            }
        }
        for (QueuedEffect reaction : reactions) {
            state.enqueue(reaction);
        }
    }

    /**
     * Slides the top card of the side's deck face-down beneath a board card of that side.
     *
     * @return whether a card was placed
     */
    public static boolean playTopOfDeckUnder(GameState state, Side side, String cardId) {
        CardLocation loc = state.locate(cardId);
        if (loc == null || !loc.onBoard() || loc.side() != side) {
            return false;
        }
        PlayedCard top = state.takeTopOfDeck(side);
        if (top == null) {
            return false;
        }
        state.placeUnder(side, loc.laneIndex(), loc.index(), top);
        state.countPlay(side);
        state.log(side + " plays a card face-down under " + state.cardAt(state.locate(cardId)).getCard().name());
        return true;
    }

    /**
     * Plays the top card of a deck face-down into a lane, unless the lane refuses face-down cards
     * for that side.
     *
     * @return whether a card was played
     */
    public static boolean playTopOfDeck(GameState state, Side side, int lane) {
        if (PassiveRules.isPlayBlocked(state, side, lane) || PassiveRules.isFaceDownPlayBlocked(state, side, lane)) {
            state.log(side + " cannot play into line " + lane);
            return false;
        }
        PlayedCard top = state.takeTopOfDeck(side);
        if (top == null) {
            return false;
        }
        play(state, side, top, lane, false);
        return true;
    }
}
