package ai.compile.player;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.compile.catalog.CardCatalog;
import ai.compile.catalog.JsonCardCatalogProvider;
import ai.compile.engine.EngineResult;
import ai.compile.engine.RulesEngine;
import ai.compile.game.GameState;
import ai.compile.game.GameStateBuilder;
import ai.compile.game.Phase;
import ai.compile.game.Side;
import java.util.HashSet;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Enumeration of legal decisions.
 *
 * <p><b>Tests and their intentions:</b>
 * <ul>
 *   <li><b>actionPhaseListsPlaysAndRefresh</b> - face-up only where the protocol matches, face-down
 *       everywhere, refresh last</li>
 *   <li><b>compilePhaseListsOnlyCompiles</b> - nothing but compiles while a compile is due</li>
 *   <li><b>pendingActionBelongsToItsActor</b> - the decider follows the pending action across turns</li>
 *   <li><b>everyListedDecisionIsAccepted</b> - the engine accepts whatever is enumerated</li>
 *   <li><b>controlPromptOffersBothSides</b> - keep, rearrange own, rearrange the opponent's</li>
 *   <li><b>giftOffersEveryHandCardOrNothing</b> - an optional hand selection lists the hand, then
 *       the skip</li>
 *   <li><b>finishedGameHasNoDecisions</b> - nothing to do after a win</li>
 * </ul>
 */
class LegalPlaysTest {

    private static final CardCatalog CATALOG = new JsonCardCatalogProvider().load();

    @Test
    void actionPhaseListsPlaysAndRefresh() {
        GameState state = GameStateBuilder.newGame(CATALOG)
                .hand(Side.PLAYER, "Speed-1", "Life-1")
                .build();

        List<AIAction> actions = LegalPlays.listLegalActions(state);

        assertEquals(9, actions.size());
        assertTrue(actions.contains(AIAction.playCard("player-Speed-1", 0, true)));
        assertTrue(actions.contains(AIAction.playCard("player-Life-1", 1, true)));
        assertFalse(actions.contains(AIAction.playCard("player-Life-1", 0, true)));
        assertTrue(actions.contains(AIAction.playCard("player-Life-1", 2, false)));
        assertEquals(AIAction.fillHand(), actions.get(actions.size() - 1));
    }

    @Test
    void compilePhaseListsOnlyCompiles() {
        GameState state = GameStateBuilder.newGame(CATALOG)
                .faceUp(Side.PLAYER, 0, "Speed-5", "Speed-4", "Speed-1")
                .hand(Side.PLAYER, "Life-1")
                .phase(Phase.COMPILE)
                .build();

        assertEquals(List.of(AIAction.compile(0)), LegalPlays.listLegalActions(state));
    }

    @Test
    void pendingActionBelongsToItsActor() {
        GameState state = GameStateBuilder.newGame(CATALOG)
                .faceUp(Side.PLAYER, 1, "Life-2")
                .hand(Side.OPPONENT, "Hate-0")
                .turn(Side.OPPONENT)
                .build();
        GameState pending = RulesEngine.playCard(state, "opponent-Hate-0", 2, true).state;

        assertEquals(Side.OPPONENT, LegalPlays.decider(pending));
        List<AIAction> answers = LegalPlays.listLegalActions(pending);
        assertTrue(answers.contains(AIAction.selectCard("player-Life-2")));
        assertFalse(answers.contains(AIAction.skip()));
    }

    @Test
    void everyListedDecisionIsAccepted() {
        GameState state = GameStateBuilder.newGame(CATALOG)
                .faceDown(Side.PLAYER, 1, "Life-1")
                .faceUp(Side.PLAYER, 1, "Life-2")
                .faceUp(Side.OPPONENT, 0, "Metal-3")
                .hand(Side.PLAYER, "Speed-0", "Water-4", "Life-5")
                .hand(Side.OPPONENT, "Hate-0", "Death-2")
                .deck(Side.PLAYER, "Water-1", "Water-2")
                .deck(Side.OPPONENT, "Hate-1")
                .build();
        GameState opponentPending = RulesEngine.playCard(
                GameStateBuilder.newGame(CATALOG)
                        .faceUp(Side.PLAYER, 1, "Life-2")
                        .faceUp(Side.OPPONENT, 0, "Metal-3")
                        .hand(Side.OPPONENT, "Hate-0")
                        .turn(Side.OPPONENT)
                        .build(),
                "opponent-Hate-0", 2, true).state;

        for (GameState candidate : List.of(state, opponentPending)) {
            Side side = LegalPlays.decider(candidate);
            for (AIAction action : LegalPlays.listLegalActions(candidate)) {
                EngineResult result = ActionApplier.apply(candidate, side, action);
                assertTrue(result.legal, action + ": " + result.message);
            }
        }
    }

    @Test
    void controlPromptOffersBothSides() {
        GameState state = GameStateBuilder.newGame(CATALOG)
                .faceUp(Side.PLAYER, 0, "Speed-5", "Speed-4", "Speed-1")
                .controlHolder(Side.PLAYER)
                .phase(Phase.COMPILE)
                .build();
        GameState prompted = RulesEngine.compileLane(state, 0).state;

        List<AIAction> answers = LegalPlays.listLegalActions(prompted);

        assertEquals(List.of(AIAction.control(null), AIAction.control(Side.PLAYER), AIAction.control(Side.OPPONENT)),
                answers);
    }

    @Test
    void permutationsCoverEveryOrder() {
        List<List<String>> orders = LegalPlays.permutations(List.of("Speed", "Life", "Water"));

        assertEquals(6, orders.size());
        assertEquals(6, new HashSet<>(orders).size());
    }

    @Test
    void giftOffersEveryHandCardOrNothing() {
        GameState state = GameStateBuilder.newGame(CATALOG)
                .protocols(Side.PLAYER, "Love", "Speed", "Water")
                .hand(Side.PLAYER, "Love-1", "Water-1")
                .deck(Side.OPPONENT, "Metal-0")
                .build();
        GameState played = RulesEngine.playCard(state, "player-Love-1", 0, true).state;

        List<AIAction> actions = LegalPlays.listLegalActions(played);

        assertEquals(List.of(AIAction.selectCard("player-Water-1"), AIAction.selectCard("opponent-Metal-0"),
                AIAction.skip()), actions);
    }

    @Test
    void finishedGameHasNoDecisions() {
        GameState state = GameStateBuilder.newGame(CATALOG)
                .hand(Side.PLAYER, "Speed-1")
                .build();
        state.setWinner(Side.OPPONENT);

        assertTrue(LegalPlays.listLegalActions(state).isEmpty());
    }
}
