package ai.compile.player.ai;

import ai.compile.actions.ActionRequired;
import ai.compile.game.CardLocation;
import ai.compile.game.GameState;
import ai.compile.game.Phase;
import ai.compile.game.PlayedCard;
import ai.compile.game.PlayerState;
import ai.compile.game.Side;
import ai.compile.player.AIAction;
import ai.compile.player.LegalPlays;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Heuristic player. Every legal play (both orientations) and the refresh get a score built from:
 *
 * - card power, when the play is face-up and the card's effects fire;
 * - the immediate change in total lead;
 * - a bonus when the play sets up a compile (10 or more and ahead);
 * - a defensive bonus for disruptive cards, growing with the opponent's threat per line.
 *
 * Pending actions use tailored rules where they matter (deletes and returns hit the opponent's most
 * threatening card, discards drop the weakest cards, protocol orders maximise the compile potential)
 * and fall back to the greedy {@link NormalPlayer} answer otherwise.
 */
public class HardPlayer extends NormalPlayer {
    private static final Logger log = LoggerFactory.getLogger(HardPlayer.class);

    private static final int LEAD_WEIGHT = 3;
    private static final int COMPILE_SETUP_BONUS = 15;
    private static final int RECOMPILE_SETUP_BONUS = 5;
    private static final int THREAT_WEIGHT = 3;
    private static final int WIN_BONUS = 1_000;

    public HardPlayer(long seed) {
        super(seed);
    }

    @Override
    public AIAction nextAction(GameState state, Side side) {
        ActionRequired action = state.getActionRequired();
        if (action != null) {
            return answer(state, side, action);
        }
        if (state.getPhase() == Phase.COMPILE) {
            AIAction compile = pickBest(state, side, LegalPlays.turnActions(state));
            return compile != null ? compile : AIAction.fillHand();
        }
        AIAction best = AIAction.fillHand();
        int bestScore = refreshScore(state, side);
        for (AIAction play : LegalPlays.plays(state, side)) {
            GameState after = simulate(state, side, play);
            if (after == null) {
                continue;
            }
            int score = playScore(state, after, side, play);
            if (score <= 0) {
                continue;
            }
            boolean tieWithPlay = score == bestScore && best.type() != AIAction.Type.FILL_HAND;
            if (score > bestScore || (tieWithPlay && random().nextBoolean())) {
                best = play;
                bestScore = score;
            }
        }
        if (log.isDebugEnabled()) {
            log.debug("{} plays {} (score {})", side, best, bestScore);
        }
        return best;
    }

    private int playScore(GameState before, GameState after, Side side, AIAction play) {
        if (after.getWinner() == side) {
            return WIN_BONUS;
        }
        PlayedCard card = findInHand(before, side, play.cardId());
        int lane = play.laneIndex();
        int score = LEAD_WEIGHT * (lead(after, side) - lead(before, side));
        int mine = after.side(side).getLaneValue(lane);
        if (compileReady(mine, after.side(side.opponent()).getLaneValue(lane))) {
            score += after.side(side).isCompiled(lane) ? RECOMPILE_SETUP_BONUS : COMPILE_SETUP_BONUS;
        }
        int power = cardPower(card.getCard());
        if (play.faceUp()) {
            score += power;
            if (isDisruptive(card.getCard())) {
                score += THREAT_WEIGHT * maxThreat(before, side);
            }
        } else {
            score -= power / 2;
        }
        return score;
    }

    private int refreshScore(GameState state, Side side) {
        int hand = state.side(side).getHand().size();
        if (hand == 0) {
            return WIN_BONUS / 2;
        }
        return Math.max(0, 2 * (GameState.HAND_LIMIT - hand) - 2);
    }

    private int maxThreat(GameState state, Side side) {
        int max = 0;
        for (int lane = 0; lane < PlayerState.LANES; lane++) {
            max = Math.max(max, threat(state, side, lane));
        }
        return max;
    }

    @Override
    protected AIAction answer(GameState state, Side side, ActionRequired action) {
        switch (action.type()) {
            case DISCARD:
                return AIAction.discard(pickFromHand(state, side, action.count(),
                        Comparator.comparingInt((PlayedCard c) -> cardPower(c.getCard()))
                                .thenComparingInt(PlayedCard::getValue)));
            case SELECT_CARD_TO_GIVE:
                return AIAction.selectCard(pickFromHand(state, side, 1,
                        Comparator.comparingInt((PlayedCard c) -> cardPower(c.getCard()))
                                .thenComparingInt(PlayedCard::getValue)).get(0));
            case SELECT_CARD_TO_DELETE:
            case SELECT_CARD_TO_RETURN: {
                AIAction target = mostThreatening(state, side, action);
                return target != null ? target : super.answer(state, side, action);
            }
            case REARRANGE_PROTOCOLS:
            case SWAP_PROTOCOLS: {
                AIAction order = bestProtocolOrder(state, side, action);
                return order != null ? order : super.answer(state, side, action);
            }
            default:
                return super.answer(state, side, action);
        }
    }

    /**
     * The opponent's card in their strongest line, highest value first; when only own cards are legal,
     * the weakest of them.
     */
    private AIAction mostThreatening(GameState state, Side side, ActionRequired action) {
        String best = null;
        int bestScore = Integer.MIN_VALUE;
        for (AIAction candidate : LegalPlays.answers(state, action)) {
            if (candidate.type() != AIAction.Type.SELECT_CARD) {
                continue;
            }
            CardLocation loc = state.locate(candidate.cardId());
            PlayedCard card = state.cardAt(loc);
            int score;
            if (loc.side() == side.opponent()) {
                score = 100 + 2 * state.side(loc.side()).getLaneValue(loc.laneIndex()) + card.getValue();
            } else {
                score = -(cardPower(card.getCard()) + card.getValue());
            }
            if (score > bestScore) {
                bestScore = score;
                best = candidate.cardId();
            }
        }
        return best == null ? null : AIAction.selectCard(best);
    }

    /**
     * The protocol order with the best own compile potential against the opponent's.
     */
    private AIAction bestProtocolOrder(GameState state, Side side, ActionRequired action) {
        List<AIAction> best = new ArrayList<>();
        int bestScore = Integer.MIN_VALUE;
        for (AIAction candidate : LegalPlays.answers(state, action)) {
            if (candidate.type() == AIAction.Type.SKIP) {
                continue;
            }
            GameState after = simulate(state, side, candidate);
            if (after == null) {
                continue;
            }
            int score = compilePotential(after, side) - compilePotential(after, side.opponent())
                    + evaluate(after, side);
            if (score > bestScore) {
                bestScore = score;
                best.clear();
                best.add(candidate);
            } else if (score == bestScore) {
                best.add(candidate);
            }
        }
        return best.isEmpty() ? null : best.get(random().nextInt(best.size()));
    }

    private static PlayedCard findInHand(GameState state, Side side, String cardId) {
        for (PlayedCard card : state.side(side).getHand()) {
            if (card.getId().equals(cardId)) {
                return card;
            }
        }
        throw new IllegalArgumentException(cardId + " is not in " + side + "'s hand");
    }
}
