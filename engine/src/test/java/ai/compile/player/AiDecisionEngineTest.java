package ai.compile.player;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.compile.actions.ActionRequired;
import ai.compile.catalog.CardCatalog;
import ai.compile.catalog.JsonCardCatalogProvider;
import ai.compile.engine.EngineResult;
import ai.compile.engine.GameStateInvariants;
import ai.compile.engine.RulesEngine;
import ai.compile.game.GameState;
import ai.compile.game.GameStateBuilder;
import ai.compile.game.Side;
import ai.compile.player.AiDecisionEngine.Decision;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives whole games through the decision engine and checks the structural invariants after every
 * single decision.
 */
class AiDecisionEngineTest {
    private static final Logger log = LoggerFactory.getLogger(AiDecisionEngineTest.class);

    private static final CardCatalog CATALOG = new JsonCardCatalogProvider().load();
    private static final int MAX_TURNS = 120;

    @Test
    void decisionComesFromTheSideToAct() {
        GameState state = newGame(List.of("Speed", "Life", "Water"), List.of("Metal", "Death", "Hate"), Side.OPPONENT, 5L);

        Decision decision = AiDecisionEngine.decide(state, Difficulty.NORMAL);

        assertEquals(Side.OPPONENT, decision.side);
        assertTrue(decision.result.legal, decision.result.message);
    }

    @Test
    void sameStateAndLevelGiveTheSameDecision() {
        GameState state = newGame(List.of("Fire", "Light", "Psychic"), List.of("Spirit", "Plague", "Darkness"), Side.PLAYER, 8L);

        assertEquals(AiDecisionEngine.decide(state, Difficulty.HARD).action,
                AiDecisionEngine.decide(state, Difficulty.HARD).action);
    }

    @Test
    void runTurnOnlyNamesTheChoice() {
        GameState state = newGame(List.of("Speed", "Life", "Water"), List.of("Metal", "Death", "Hate"), Side.PLAYER, 12L);
        int handBefore = state.getPlayer().getHand().size();

        AIAction action = AiDecisionEngine.runTurn(state, Difficulty.NORMAL);

        assertNotNull(action);
        assertTrue(LegalPlays.listLegalActions(state).contains(action), action.toString());
        assertEquals(handBefore, state.getPlayer().getHand().size());
        assertNull(state.getActionRequired());
        assertTrue(ActionApplier.apply(state, Side.PLAYER, action).legal);
    }

    @Test
    void runTurnHasNothingToSayAfterTheGame() {
        GameState state = newGame(List.of("Speed", "Life", "Water"), List.of("Metal", "Death", "Hate"), Side.PLAYER, 13L);
        state.setWinner(Side.OPPONENT);

        assertNull(AiDecisionEngine.runTurn(state, Difficulty.HARD));
    }

    @Test
    void pendingActionIsAnsweredByItsActor() {
        GameState state = GameStateBuilder.newGame(CATALOG)
                .faceUp(Side.PLAYER, 1, "Life-2")
                .faceUp(Side.PLAYER, 2, "Water-3")
                .hand(Side.OPPONENT, "Hate-0")
                .turn(Side.OPPONENT)
                .build();
        GameState pending = RulesEngine.playCard(state, "opponent-Hate-0", 2, true).state;
        ActionRequired before = pending.getActionRequired();

        AIAction answer = AiDecisionEngine.resolvePendingAction(pending, Difficulty.HARD);

        assertEquals(AIAction.Type.SELECT_CARD, answer.type());
        assertSame(before, pending.getActionRequired());
        EngineResult result = ActionApplier.apply(pending, Side.OPPONENT, answer);
        assertTrue(result.legal, result.message);
        assertFalse(result.state.isOnBoard(answer.cardId()));
    }

    @Test
    void playTurnHandsOverToTheOtherSide() {
        GameState state = newGame(List.of("Speed", "Life", "Water"), List.of("Metal", "Death", "Hate"), Side.PLAYER, 12L);

        GameState after = AiDecisionEngine.playTurn(state, Difficulty.EASY);

        boolean handedOver = after.isGameOver() || LegalPlays.decider(after) != Side.PLAYER
                || after.getTurnNumber() != state.getTurnNumber();
        assertTrue(handedOver);
        GameStateInvariants.assertValid(after);
    }

    @Test
    void resolvingWithNothingPendingIsANoOp() {
        GameState state = newGame(List.of("Speed", "Life", "Water"), List.of("Metal", "Death", "Hate"), Side.PLAYER, 2L);

        assertNull(AiDecisionEngine.resolvePendingAction(state, Difficulty.HARD));
        assertSame(state, AiDecisionEngine.applyPendingAction(state, Difficulty.HARD));
    }

    @Test
    void hardAgainstNormalKeepsEveryInvariant() {
        playOut(List.of("Speed", "Life", "Water"), List.of("Metal", "Death", "Hate"), 21L,
                Difficulty.HARD, Difficulty.NORMAL);
    }

    @Test
    void disruptiveProtocolsKeepEveryInvariant() {
        playOut(List.of("Hate", "Apathy", "Darkness"), List.of("Psychic", "Plague", "Fire"), 34L,
                Difficulty.NORMAL, Difficulty.HARD);
    }

    @Test
    void protocolShufflingDecksKeepEveryInvariant() {
        playOut(List.of("Light", "Spirit", "Chaos"), List.of("Anarchy", "Water", "Death"), 55L,
                Difficulty.EASY, Difficulty.HARD);
    }

    private void playOut(List<String> player, List<String> opponent, long seed, Difficulty playerLevel,
                         Difficulty opponentLevel) {
        GameState initial = newGame(player, opponent, null, seed);
        GameState state = initial;
        int decisions = 0;
        while (!state.isGameOver() && state.getTurnNumber() <= MAX_TURNS) {
            Side side = LegalPlays.decider(state);
            Decision decision = AiDecisionEngine.decide(state, side == Side.PLAYER ? playerLevel : opponentLevel);
            assertTrue(decision.result.legal, "seed " + seed + ": " + decision.action + " -> " + decision.result.message);
            state = decision.result.state;
            decisions++;
            assertTrue(GameStateInvariants.check(state).isEmpty(),
                    "seed " + seed + " after " + decision.action + ": " + GameStateInvariants.check(state));
            assertTrue(GameStateInvariants.checkConservation(initial, state).isEmpty(),
                    "seed " + seed + ": " + GameStateInvariants.checkConservation(initial, state));
        }
        log.info("Seed {}: {} decisions over {} turns, winner {}", seed, decisions, state.getTurnNumber(),
                state.getWinner());
    }

    private static GameState newGame(List<String> player, List<String> opponent, Side first, long seed) {
        return RulesEngine.createInitialState(CATALOG, player, opponent, true, first, seed);
    }
}
