package ai.compile.player.ai;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.compile.actions.ActionFlow;
import ai.compile.catalog.CardCatalog;
import ai.compile.catalog.JsonCardCatalogProvider;
import ai.compile.engine.RulesEngine;
import ai.compile.game.GameState;
import ai.compile.game.GameStateBuilder;
import ai.compile.game.Phase;
import ai.compile.game.Side;
import ai.compile.player.AIAction;
import ai.compile.player.LegalPlays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("AI players")
class AIPlayersTest {

    private static final CardCatalog CATALOG = new JsonCardCatalogProvider().load();

    /**
     * Line 0 holds 6 in face-down cards against the opponent's 7; Water-5 face-up there reaches 11.
     */
    private static GameState oneCardFromCompiling() {
        return GameStateBuilder.newGame(CATALOG)
                .protocols(Side.PLAYER, "Water", "Life", "Speed")
                .faceDown(Side.PLAYER, 0, "Life-2", "Speed-4", "Life-1")
                .faceUp(Side.OPPONENT, 0, "Metal-5")
                .faceDown(Side.OPPONENT, 0, "Death-1")
                .hand(Side.PLAYER, "Water-5", "Speed-2")
                .deck(Side.PLAYER, "Water-0", "Water-1")
                .deck(Side.OPPONENT, "Hate-1", "Hate-2")
                .build();
    }

    private static GameState twoCompilableLines() {
        return GameStateBuilder.newGame(CATALOG)
                .faceUp(Side.PLAYER, 0, "Speed-5", "Speed-3")
                .faceDown(Side.PLAYER, 0, "Water-0")
                .faceUp(Side.PLAYER, 1, "Life-5", "Life-4", "Life-3")
                .phase(Phase.COMPILE)
                .build();
    }

    private static GameState pendingDelete() {
        GameState state = GameStateBuilder.newGame(CATALOG)
                .faceDown(Side.PLAYER, 1, "Life-1")
                .faceUp(Side.PLAYER, 1, "Life-5")
                .faceUp(Side.OPPONENT, 0, "Metal-3")
                .hand(Side.OPPONENT, "Hate-0")
                .turn(Side.OPPONENT)
                .build();
        return RulesEngine.playCard(state, "opponent-Hate-0", 2, true).state;
    }

    private static GameState handLimitDiscard() {
        GameState state = GameStateBuilder.newGame(CATALOG)
                .hand(Side.PLAYER, "Life-0", "Life-1", "Life-2", "Life-3", "Life-4", "Life-5", "Water-0")
                .phase(Phase.HAND_LIMIT)
                .build();
        ActionFlow.settle(state);
        return state;
    }

    @Nested
    @DisplayName("Hard")
    class HardTests {

        @Test
        void playsTheCardThatMakesALineCompilable() {
            AIAction action = new HardPlayer(1L).nextAction(oneCardFromCompiling(), Side.PLAYER);

            assertEquals(AIAction.playCard("player-Water-5", 0, true), action);
        }

        @Test
        void choiceDoesNotDependOnTheTieBreakSeed() {
            GameState state = oneCardFromCompiling();
            for (long seed = 0; seed < 5; seed++) {
                assertEquals(AIAction.playCard("player-Water-5", 0, true),
                        new HardPlayer(seed).nextAction(state, Side.PLAYER));
            }
        }

        @Test
        void deletesTheOpponentsCardRatherThanItsOwn() {
            AIAction action = new HardPlayer(3L).nextAction(pendingDelete(), Side.OPPONENT);

            assertEquals(AIAction.selectCard("player-Life-5"), action);
        }

        @Test
        void compilesWhenACompileIsDue() {
            AIAction action = new HardPlayer(5L).nextAction(twoCompilableLines(), Side.PLAYER);

            assertEquals(AIAction.Type.COMPILE, action.type());
        }

        /**
         * Every line is closed to the player except one where Metal-0 cancels a face-down card, so no
         * play gains anything.
         */
        @Test
        void refreshesWhenNoPlayScoresPositively() {
            GameState state = GameStateBuilder.newGame(CATALOG)
                    .faceUp(Side.OPPONENT, 0, "Plague-0")
                    .faceUp(Side.OPPONENT, 1, "Metal-2")
                    .faceUp(Side.OPPONENT, 2, "Metal-0")
                    .hand(Side.PLAYER, "Plague-1", "Plague-2", "Plague-3", "Plague-4", "Plague-5")
                    .build();

            assertFalse(LegalPlays.plays(state, Side.PLAYER).isEmpty());
            assertEquals(AIAction.fillHand(), new HardPlayer(6L).nextAction(state, Side.PLAYER));
        }

        @Test
        void refreshesAnEmptyHand() {
            GameState state = GameStateBuilder.newGame(CATALOG)
                    .deck(Side.PLAYER, "Water-0", "Water-1", "Water-2")
                    .build();

            assertEquals(AIAction.fillHand(), new HardPlayer(9L).nextAction(state, Side.PLAYER));
        }
    }

    @Nested
    @DisplayName("Normal")
    class NormalTests {

        @Test
        void discardsTheLowestCards() {
            AIAction action = new NormalPlayer(2L).nextAction(handLimitDiscard(), Side.PLAYER);

            assertEquals(AIAction.Type.DISCARD_CARDS, action.type());
            assertEquals(Set.of("player-Life-0", "player-Water-0"), new HashSet<>(action.cardIds()));
        }

        @Test
        void alwaysAnswersWithALegalDecision() {
            GameState state = oneCardFromCompiling();

            AIAction action = new NormalPlayer(4L).nextAction(state, Side.PLAYER);

            assertTrue(LegalPlays.listLegalActions(state).contains(action), action.toString());
        }
    }

    @Nested
    @DisplayName("Easy")
    class EasyTests {

        @Test
        void playsItsHighestCardFaceUpNearestToTen() {
            AIAction action = new EasyPlayer().nextAction(oneCardFromCompiling(), Side.PLAYER);

            assertEquals(AIAction.playCard("player-Water-5", 0, true), action);
        }

        @Test
        void compilesTheLowerQualifyingLineFirst() {
            assertEquals(AIAction.compile(0), new EasyPlayer().nextAction(twoCompilableLines(), Side.PLAYER));
        }

        @Test
        void takesTheFirstAnswerToAPendingAction() {
            GameState state = pendingDelete();
            List<AIAction> answers = LegalPlays.answers(state, state.getActionRequired());

            assertEquals(answers.get(0), new EasyPlayer().nextAction(state, Side.OPPONENT));
        }

        @Test
        void fallsBackToFaceDownWhenNothingMatches() {
            GameState state = GameStateBuilder.newGame(CATALOG)
                    .hand(Side.PLAYER, "Plague-5")
                    .build();

            assertEquals(AIAction.playCard("player-Plague-5", 0, false), new EasyPlayer().nextAction(state, Side.PLAYER));
        }
    }
}
