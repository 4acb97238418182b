package ai.compile.game;

import ai.compile.actions.ActionRequired;
import ai.compile.actions.QueuedEffect;
import ai.compile.actions.SuspendedFrame;
import ai.compile.effects.EffectRun;
import ai.compile.effects.LaneValues;
import ai.compile.effects.Trigger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Canonical snapshot of a game of Compile.
 * <p>
 * The public engine API treats states as values: every transition copies the input with
 * {@link #copy()}, mutates the copy through the primitives below and returns it. The primitives
 * move cards between containers and keep statistics, the event list and the lane value cache in
 * step; they never fire card effects. Triggers are the job of the effect layer, which calls these
 * primitives and then decides what reacts.
 */
public class GameState {
    private static final Logger log = LoggerFactory.getLogger(GameState.class);

    public static final int HAND_LIMIT = 5;
    public static final int STARTING_HAND = 5;
    public static final int COMPILE_THRESHOLD = 10;
    public static final int PROTOCOLS_TO_WIN = 3;

    private PlayerState player;
    private PlayerState opponent;
    private Side turn;
    private Phase phase;
    private ActionRequired actionRequired;
    // index 0 is the bottom of the stack
    private final List<SuspendedFrame> interruptStack = new ArrayList<>();
    private final List<QueuedEffect> queue = new ArrayList<>();
    private Side winner;
    private final List<String> moveLog = new ArrayList<>();
    private final Set<String> processedStartEffectIds = new HashSet<>();
    private final Set<String> processedEndEffectIds = new HashSet<>();
    private final Set<String> processedUncoverEventIds = new HashSet<>();
    private final Set<String> processedDrawTriggerIds = new HashSet<>();
    private boolean useControlMechanic;
    private Side controlCardHolder;
    private final List<Integer> compilableLanes = new ArrayList<>();
    private String lastPlayedCardId;
    private int turnNumber = 1;
    private long seed;
    private int shuffleCount;
    private int randomPicks;
    private long actionsIssued;
    private boolean handLimitChecked;
    private final List<BoardEvent> events = new ArrayList<>();
    // middle boxes executing on the current call stack; never copied
    private final Set<String> runningMiddleIds = new HashSet<>();

    public GameState(PlayerState player, PlayerState opponent, Side startingPlayer,
                     boolean useControlMechanic, long seed) {
        this.player = Objects.requireNonNull(player, "player");
        this.opponent = Objects.requireNonNull(opponent, "opponent");
        this.turn = Objects.requireNonNull(startingPlayer, "startingPlayer");
        this.phase = Phase.START;
        this.useControlMechanic = useControlMechanic;
        this.seed = seed;
        recalculateLaneValues();
    }

    private GameState() {
    }

    /**
     * Deep copy. Cards, actions, frames and queued effects are immutable and shared.
     */
    public GameState copy() {
        GameState c = new GameState();
        c.player = player.copy();
        c.opponent = opponent.copy();
        c.turn = turn;
        c.phase = phase;
        c.actionRequired = actionRequired;
        c.interruptStack.addAll(interruptStack);
        c.queue.addAll(queue);
        c.winner = winner;
        c.moveLog.addAll(moveLog);
        c.processedStartEffectIds.addAll(processedStartEffectIds);
        c.processedEndEffectIds.addAll(processedEndEffectIds);
        c.processedUncoverEventIds.addAll(processedUncoverEventIds);
        c.processedDrawTriggerIds.addAll(processedDrawTriggerIds);
        c.useControlMechanic = useControlMechanic;
        c.controlCardHolder = controlCardHolder;
        c.compilableLanes.addAll(compilableLanes);
        c.lastPlayedCardId = lastPlayedCardId;
        c.turnNumber = turnNumber;
        c.seed = seed;
        c.shuffleCount = shuffleCount;
        c.randomPicks = randomPicks;
        c.actionsIssued = actionsIssued;
        c.handLimitChecked = handLimitChecked;
        c.events.addAll(events);
        return c;
    }

    // ------------------------------------------------------------------
    // Accessors
    // ------------------------------------------------------------------

    public PlayerState getPlayer() {
        return player;
    }

    public PlayerState getOpponent() {
        return opponent;
    }

    public PlayerState side(Side side) {
        return side == Side.PLAYER ? player : opponent;
    }

    public Side getTurn() {
        return turn;
    }

    public void setTurn(Side turn) {
        this.turn = Objects.requireNonNull(turn, "turn");
    }

    public Phase getPhase() {
        return phase;
    }

    public void setPhase(Phase phase) {
        if (this.phase != phase && log.isDebugEnabled()) {
            log.debug("Turn {} ({}): {} -> {}", turnNumber, turn, this.phase, phase);
        }
        this.phase = Objects.requireNonNull(phase, "phase");
    }

    public ActionRequired getActionRequired() {
        return actionRequired;
    }

    /**
     * Installs (or clears, with {@code null}) the active action. Installing counts as an issue,
     * which lets a running effect notice that it has to suspend.
     */
    public void setActionRequired(ActionRequired actionRequired) {
        if (actionRequired != null) {
            actionsIssued++;
        }
        this.actionRequired = actionRequired;
    }

    /**
     * Monotonic counter of installed actions; compared before and after a step to detect that the
     * step asked a player for input.
     */
    public long getActionsIssued() {
        return actionsIssued;
    }

    public List<SuspendedFrame> getInterruptStack() {
        return Collections.unmodifiableList(interruptStack);
    }

    public int stackDepth() {
        return interruptStack.size();
    }

    public void pushFrame(SuspendedFrame frame) {
        interruptStack.add(Objects.requireNonNull(frame, "frame"));
    }

    /**
     * Inserts a frame at the given depth, below every frame pushed after that depth was recorded.
     */
    public void insertFrame(int depth, SuspendedFrame frame) {
        interruptStack.add(Math.min(depth, interruptStack.size()), Objects.requireNonNull(frame, "frame"));
    }

    public SuspendedFrame popFrame() {
        return interruptStack.isEmpty() ? null : interruptStack.remove(interruptStack.size() - 1);
    }

    public List<QueuedEffect> getQueue() {
        return Collections.unmodifiableList(queue);
    }

    public void enqueue(QueuedEffect effect) {
        queue.add(Objects.requireNonNull(effect, "effect"));
    }

    public QueuedEffect pollQueue() {
        return queue.isEmpty() ? null : queue.remove(0);
    }

    public Side getWinner() {
        return winner;
    }

    public void setWinner(Side winner) {
        this.winner = winner;
    }

    public List<String> getLog() {
        return Collections.unmodifiableList(moveLog);
    }

    public Set<String> getProcessedStartEffectIds() {
        return processedStartEffectIds;
    }

    public Set<String> getProcessedEndEffectIds() {
        return processedEndEffectIds;
    }

    public Set<String> getProcessedUncoverEventIds() {
        return processedUncoverEventIds;
    }

    /**
     * Cards whose "after you draw" reaction already fired this turn.
     */
    public Set<String> getProcessedDrawTriggerIds() {
        return processedDrawTriggerIds;
    }

    public boolean isUseControlMechanic() {
        return useControlMechanic;
    }

    public Side getControlCardHolder() {
        return controlCardHolder;
    }

    public void setControlCardHolder(Side controlCardHolder) {
        this.controlCardHolder = controlCardHolder;
    }

    public List<Integer> getCompilableLanes() {
        return Collections.unmodifiableList(compilableLanes);
    }

    public void setCompilableLanes(List<Integer> lanes) {
        compilableLanes.clear();
        compilableLanes.addAll(lanes);
    }

    public String getLastPlayedCardId() {
        return lastPlayedCardId;
    }

    public void setLastPlayedCardId(String lastPlayedCardId) {
        this.lastPlayedCardId = lastPlayedCardId;
    }

    public int getTurnNumber() {
        return turnNumber;
    }

    public long getSeed() {
        return seed;
    }

    public int getShuffleCount() {
        return shuffleCount;
    }

    /**
     * Board events produced by the transition that returned this state.
     */
    public List<BoardEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    /**
     * Whether the turn player's hand limit check already ran this turn; "after you clear cache"
     * draws do not trigger a second check.
     */
    public boolean isHandLimitChecked() {
        return handLimitChecked;
    }

    public void setHandLimitChecked(boolean handLimitChecked) {
        this.handLimitChecked = handLimitChecked;
    }

    public boolean isGameOver() {
        return winner != null;
    }

    // ------------------------------------------------------------------
    // Transition bookkeeping
    // ------------------------------------------------------------------

    /**
     * Clears the per-transition event list; called on a fresh copy at the start of every public
     * engine operation.
     */
    public void beginTransition() {
        events.clear();
    }

    /**
     * Marks a card's middle box as executing.
     *
     * @return false when it was already marked by an outer call
     */
    public boolean enterMiddle(String cardId) {
        return runningMiddleIds.add(cardId);
    }

    public void exitMiddle(String cardId) {
        runningMiddleIds.remove(cardId);
    }

    /**
     * Whether the middle box of a card has not finished yet: it is executing, it waits on the active
     * action, or it is suspended on the interrupt stack.
     */
    public boolean isResolvingMiddle(String cardId) {
        if (runningMiddleIds.contains(cardId)) {
            return true;
        }
        if (actionRequired != null && isMiddleOf(actionRequired.continuation(), cardId)) {
            return true;
        }
        for (SuspendedFrame frame : interruptStack) {
            EffectRun run = frame.isAction() ? frame.action().continuation() : frame.continuation();
            if (isMiddleOf(run, cardId)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isMiddleOf(EffectRun run, String cardId) {
        return run != null && run.trigger() == Trigger.ON_PLAY && run.hasNext() && cardId.equals(run.sourceCardId());
    }

    public void record(BoardEvent event) {
        events.add(event);
    }

    public void log(String line) {
        moveLog.add(line);
        if (log.isDebugEnabled()) {
            log.debug("[T{} {} {}] {}", turnNumber, turn, phase, line);
        }
    }

    /**
     * Resets the per-phase uncover guard when a phase is entered.
     */
    public void clearUncoverGuard() {
        processedUncoverEventIds.clear();
    }

    /**
     * Hands the turn to the other side: phase back to START, per-turn id sets cleared, the ending
     * side's compile block lifted.
     */
    public void passTurn() {
        side(turn).cannotCompile = false;
        turn = turn.opponent();
        phase = Phase.START;
        turnNumber++;
        processedStartEffectIds.clear();
        processedEndEffectIds.clear();
        processedUncoverEventIds.clear();
        processedDrawTriggerIds.clear();
        compilableLanes.clear();
        handLimitChecked = false;
        log("Turn " + turnNumber + " begins for " + turn);
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    /**
     * Finds the container of a card identity, or {@code null} when the id is unknown.
     */
    public CardLocation locate(String cardId) {
        if (cardId == null) {
            return null;
        }
        for (Side s : Side.values()) {
            PlayerState ps = side(s);
            for (int lane = 0; lane < PlayerState.LANES; lane++) {
                int idx = indexOf(ps.lanes.get(lane), cardId);
                if (idx >= 0) {
                    return new CardLocation(s, CardLocation.Zone.LANE, lane, idx);
                }
            }
            int idx = indexOf(ps.hand, cardId);
            if (idx >= 0) {
                return new CardLocation(s, CardLocation.Zone.HAND, -1, idx);
            }
            idx = indexOf(ps.deck, cardId);
            if (idx >= 0) {
                return new CardLocation(s, CardLocation.Zone.DECK, -1, idx);
            }
            idx = indexOf(ps.discard, cardId);
            if (idx >= 0) {
                return new CardLocation(s, CardLocation.Zone.DISCARD, -1, idx);
            }
        }
        return null;
    }

    private static int indexOf(List<PlayedCard> cards, String cardId) {
        for (int i = 0; i < cards.size(); i++) {
            if (cards.get(i).getId().equals(cardId)) {
                return i;
            }
        }
        return -1;
    }

    public PlayedCard cardAt(CardLocation loc) {
        PlayerState ps = side(loc.side());
        switch (loc.zone()) {
            case HAND:
                return ps.hand.get(loc.index());
            case DECK:
                return ps.deck.get(loc.index());
            case DISCARD:
                return ps.discard.get(loc.index());
            default:
                return ps.lanes.get(loc.laneIndex()).get(loc.index());
        }
    }

    /**
     * Looks a card up anywhere; {@code null} when unknown.
     */
    public PlayedCard findCard(String cardId) {
        CardLocation loc = locate(cardId);
        return loc == null ? null : cardAt(loc);
    }

    public boolean isOnBoard(String cardId) {
        CardLocation loc = locate(cardId);
        return loc != null && loc.onBoard();
    }

    public boolean isUncovered(CardLocation loc) {
        return loc.onBoard() && loc.index() == side(loc.side()).lanes.get(loc.laneIndex()).size() - 1;
    }

    /**
     * Total cards of both sides in one lane.
     */
    public int cardsInLane(int laneIndex) {
        return player.lanes.get(laneIndex).size() + opponent.lanes.get(laneIndex).size();
    }

    // ------------------------------------------------------------------
    // Primitives
    // ------------------------------------------------------------------

    public void recalculateLaneValues() {
        LaneValues.recalculate(this);
    }

    /**
     * Writes a lane total into the cache; used by {@link LaneValues}.
     */
    public void cacheLaneValue(Side side, int laneIndex, int value) {
        side(side).laneValues[laneIndex] = value;
    }

    /**
     * Removes a card from its owner's hand.
     *
     * @throws IllegalArgumentException when the card is not in that hand
     */
    public PlayedCard takeFromHand(Side side, String cardId) {
        List<PlayedCard> hand = side(side).hand;
        int idx = indexOf(hand, cardId);
        if (idx < 0) {
            throw new IllegalArgumentException("Card " + cardId + " is not in " + side + "'s hand");
        }
        return hand.remove(idx);
    }

    /**
     * Puts a card on top of one of the side's lanes with the given orientation.
     */
    public PlayedCard placeOnLane(Side side, int laneIndex, PlayedCard card, boolean faceUp) {
        PlayedCard placed = new PlayedCard(card.getId(), card.getCard(), faceUp, faceUp ? false : card.isRevealed());
        side(side).lanes.get(laneIndex).add(placed);
        recalculateLaneValues();
        record(new BoardEvent(BoardEvent.Type.PLAYED, side, placed.getId(), laneIndex, faceUp ? "face-up" : "face-down"));
        return placed;
    }

    /**
     * Slides a card face-down into one of the side's lanes at {@code index}, beneath the card that
     * held that position.
     */
    public PlayedCard placeUnder(Side side, int laneIndex, int index, PlayedCard card) {
        PlayedCard placed = new PlayedCard(card.getId(), card.getCard(), false, false);
        side(side).lanes.get(laneIndex).add(index, placed);
        recalculateLaneValues();
        record(new BoardEvent(BoardEvent.Type.PLAYED, side, placed.getId(), laneIndex, "face-down underneath"));
        return placed;
    }

    public void countPlay(Side side) {
        side(side).stats.addPlayed();
    }

    public void countRefresh(Side side) {
        side(side).stats.addRefresh();
    }

    public void addToHand(Side side, PlayedCard card) {
        side(side).hand.add(new PlayedCard(card.getId(), card.getCard(), false, false));
    }

    /**
     * Moves a card from one hand into the other side's hand.
     */
    public PlayedCard passToOpponent(Side from, String cardId) {
        PlayedCard card = takeFromHand(from, cardId);
        addToHand(from.opponent(), card);
        record(new BoardEvent(BoardEvent.Type.CHANGED_HANDS, from, cardId, -1, "to " + from.opponent()));
        log(from + " hands a card to " + from.opponent());
        return card;
    }

    /**
     * A pick in {@code [0, bound)} that replays identically for the same seed.
     */
    public int randomIndex(int bound) {
        Random random = new Random(seed * 17 + randomPicks);
        randomPicks++;
        return random.nextInt(bound);
    }

    /**
     * Removes and returns the top card of a deck, reshuffling the discard pile first if the deck is
     * empty. Returns {@code null} when both are empty.
     */
    public PlayedCard takeTopOfDeck(Side side) {
        PlayerState ps = side(side);
        if (ps.deck.isEmpty()) {
            reshuffle(side);
        }
        if (ps.deck.isEmpty()) {
            return null;
        }
        return ps.deck.remove(0);
    }

    /**
     * Draws up to {@code count} cards into the side's hand.
     *
     * @return the number of cards actually drawn
     */
    public int draw(Side side, int count) {
        int drawn = 0;
        for (int i = 0; i < count; i++) {
            PlayedCard card = takeTopOfDeck(side);
            if (card == null) {
                break;
            }
            addToHand(side, card);
            drawn++;
        }
        if (drawn > 0) {
            side(side).stats.addDrawn(drawn);
            record(new BoardEvent(BoardEvent.Type.DREW, side, null, -1, String.valueOf(drawn)));
            log(side + " draws " + drawn + (drawn == 1 ? " card" : " cards"));
        }
        return drawn;
    }

    private void reshuffle(Side side) {
        PlayerState ps = side(side);
        if (ps.discard.isEmpty()) {
            return;
        }
        List<PlayedCard> cards = new ArrayList<>();
        for (PlayedCard c : ps.discard) {
            cards.add(new PlayedCard(c.getId(), c.getCard(), false, false));
        }
        ps.discard.clear();
        Collections.shuffle(cards, new Random(seed * 31 + shuffleCount));
        shuffleCount++;
        ps.deck.addAll(cards);
        record(new BoardEvent(BoardEvent.Type.RESHUFFLED, side, null, -1, String.valueOf(cards.size())));
        log(side + " reshuffles " + cards.size() + " cards from the discard pile into the deck");
    }

    /**
     * Moves a card from hand to its owner's discard pile.
     */
    public void discardFromHand(Side side, String cardId) {
        PlayedCard card = takeFromHand(side, cardId);
        side(side).discard.add(new PlayedCard(card.getId(), card.getCard(), false, false));
        side(side).stats.addDiscarded(1);
        record(new BoardEvent(BoardEvent.Type.DISCARDED, side, cardId, -1, card.getCard().name()));
        log(side + " discards " + card.getCard().name());
    }

    private PlayedCard removeFromLane(CardLocation loc) {
        PlayedCard removed = side(loc.side()).lanes.get(loc.laneIndex()).remove(loc.index());
        recalculateLaneValues();
        return removed;
    }

    private CardLocation requireOnBoard(String cardId) {
        CardLocation loc = locate(cardId);
        if (loc == null || !loc.onBoard()) {
            throw new IllegalArgumentException("Card " + cardId + " is not on the board");
        }
        return loc;
    }

    /**
     * Deletes a board card into its owner's discard pile, credited to {@code actor}.
     */
    public PlayedCard deleteFromBoard(Side actor, String cardId) {
        CardLocation loc = requireOnBoard(cardId);
        PlayedCard card = removeFromLane(loc);
        side(loc.side()).discard.add(new PlayedCard(card.getId(), card.getCard(), false, false));
        side(actor).stats.addDeleted(1);
        record(new BoardEvent(BoardEvent.Type.DELETED, loc.side(), cardId, loc.laneIndex(), card.describe()));
        log(actor + " deletes " + card.describe() + " from " + loc.side() + "'s line " + loc.laneIndex());
        return card;
    }

    /**
     * Returns a board card to its owner's hand, credited to {@code actor}.
     */
    public PlayedCard returnToHand(Side actor, String cardId) {
        CardLocation loc = requireOnBoard(cardId);
        PlayedCard card = removeFromLane(loc);
        addToHand(loc.side(), card);
        side(actor).stats.addReturned(1);
        record(new BoardEvent(BoardEvent.Type.RETURNED, loc.side(), cardId, loc.laneIndex(), card.describe()));
        log(actor + " returns " + card.describe() + " to " + loc.side() + "'s hand");
        return card;
    }

    /**
     * Lifts a card off the board for a shift; {@link #landShift} puts it down again.
     */
    public PlayedCard liftForShift(String cardId) {
        return removeFromLane(requireOnBoard(cardId));
    }

    public void landShift(Side actor, Side owner, PlayedCard card, int fromLane, int toLane) {
        side(owner).lanes.get(toLane).add(card);
        recalculateLaneValues();
        side(actor).stats.addShifted();
        record(new BoardEvent(BoardEvent.Type.SHIFTED, owner, card.getId(), toLane, "from line " + fromLane));
        log(actor + " shifts " + card.describe() + " from line " + fromLane + " to line " + toLane);
    }

    /**
     * Exchanges every card of two of a side's stacks. Protocols and compile marks stay where they are.
     */
    public void swapStacks(Side side, int first, int second) {
        List<PlayedCard> a = side(side).lanes.get(first);
        List<PlayedCard> b = side(side).lanes.get(second);
        List<PlayedCard> held = new ArrayList<>(a);
        a.clear();
        a.addAll(b);
        b.clear();
        b.addAll(held);
        recalculateLaneValues();
        record(new BoardEvent(BoardEvent.Type.STACKS_SWAPPED, side, null, second, "with line " + first));
        log(side + " swaps the stacks of lines " + first + " and " + second);
    }

    /**
     * Turns a board card over in place, credited to {@code actor}.
     *
     * @return the card in its new orientation
     */
    public PlayedCard flip(Side actor, String cardId) {
        CardLocation loc = requireOnBoard(cardId);
        List<PlayedCard> lane = side(loc.side()).lanes.get(loc.laneIndex());
        PlayedCard flipped = lane.get(loc.index()).flipped();
        lane.set(loc.index(), flipped);
        recalculateLaneValues();
        side(actor).stats.addFlipped();
        record(new BoardEvent(BoardEvent.Type.FLIPPED, loc.side(), cardId, loc.laneIndex(),
                flipped.isFaceUp() ? "face-up" : "face-down"));
        log(actor + " flips " + flipped.getCard().name() + (flipped.isFaceUp() ? " face-up" : " face-down"));
        return flipped;
    }

    /**
     * Marks a hidden card as seen by the other side. Works for board and hand cards.
     */
    public void reveal(String cardId) {
        CardLocation loc = locate(cardId);
        if (loc == null) {
            throw new IllegalArgumentException("Unknown card " + cardId);
        }
        List<PlayedCard> container = loc.onBoard()
                ? side(loc.side()).lanes.get(loc.laneIndex())
                : loc.zone() == CardLocation.Zone.HAND ? side(loc.side()).hand : null;
        if (container == null) {
            throw new IllegalArgumentException("Card " + cardId + " cannot be revealed from " + loc.zone());
        }
        container.set(loc.index(), container.get(loc.index()).withRevealed(true));
        record(new BoardEvent(BoardEvent.Type.REVEALED, loc.side(), cardId, loc.laneIndex(), ""));
    }

    /**
     * Puts every card of one lane into its owner's discard pile, except the given ids.
     *
     * @return the ids that were discarded
     */
    public List<String> clearLane(Side side, int laneIndex, Set<String> keep) {
        List<PlayedCard> lane = side(side).lanes.get(laneIndex);
        List<PlayedCard> kept = new ArrayList<>();
        List<String> cleared = new ArrayList<>();
        for (PlayedCard card : lane) {
            if (keep.contains(card.getId())) {
                kept.add(card);
            } else {
                side(side).discard.add(new PlayedCard(card.getId(), card.getCard(), false, false));
                cleared.add(card.getId());
            }
        }
        lane.clear();
        lane.addAll(kept);
        recalculateLaneValues();
        return cleared;
    }

    public void markCompiled(Side side, int laneIndex) {
        PlayerState ps = side(side);
        ps.compiled[laneIndex] = true;
        ps.stats.addCompile();
        record(new BoardEvent(BoardEvent.Type.COMPILED, side, null, laneIndex, ps.getProtocol(laneIndex)));
        log(side + " compiles " + ps.getProtocol(laneIndex));
    }

    public void setCannotCompile(Side side, boolean cannotCompile) {
        side(side).cannotCompile = cannotCompile;
    }

    /**
     * Reorders a side's protocols; compiled flags travel with their protocol.
     *
     * @param order a permutation of the side's current protocols
     */
    public void rearrangeProtocols(Side side, List<String> order) {
        PlayerState ps = side(side);
        if (order.size() != PlayerState.LANES || !new HashSet<>(order).equals(new HashSet<>(ps.protocols))) {
            throw new IllegalArgumentException("Not a permutation of " + ps.protocols + ": " + order);
        }
        boolean[] compiledBefore = ps.compiled.clone();
        List<String> before = new ArrayList<>(ps.protocols);
        for (int i = 0; i < PlayerState.LANES; i++) {
            ps.compiled[i] = compiledBefore[before.indexOf(order.get(i))];
        }
        ps.protocols.clear();
        ps.protocols.addAll(order);
        record(new BoardEvent(BoardEvent.Type.PROTOCOLS_REARRANGED, side, null, -1, order.toString()));
        log(side + "'s protocols are now " + order);
    }

    public void recordWin(Side side) {
        winner = side;
        record(new BoardEvent(BoardEvent.Type.GAME_WON, side, null, -1, ""));
        log(side + " wins the game");
    }
}
