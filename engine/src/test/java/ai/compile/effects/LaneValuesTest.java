package ai.compile.effects;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.compile.catalog.CardCatalog;
import ai.compile.catalog.JsonCardCatalogProvider;
import ai.compile.engine.GameStateInvariants;
import ai.compile.game.GameState;
import ai.compile.game.GameStateBuilder;
import ai.compile.game.Side;
import org.junit.jupiter.api.Test;

/**
 * Line totals: printed values, face-down cards and the passives that modify them.
 */
class LaneValuesTest {

    private static final CardCatalog CATALOG = new JsonCardCatalogProvider().load();

    @Test
    void faceDownCardsCountTwo() {
        GameState state = GameStateBuilder.newGame(CATALOG)
                .faceDown(Side.PLAYER, 0, "Speed-5", "Life-0")
                .faceUp(Side.PLAYER, 0, "Speed-3")
                .build();

        assertEquals(7, state.getPlayer().getLaneValue(0));
        assertEquals(7, LaneValues.laneTotal(state, Side.PLAYER, 0));
    }

    @Test
    void darknessTwoRaisesFaceDownCardsInItsStack() {
        GameState state = GameStateBuilder.newGame(CATALOG)
                .protocols(Side.PLAYER, "Darkness", "Life", "Water")
                .faceDown(Side.PLAYER, 0, "Life-5")
                .faceUp(Side.PLAYER, 0, "Darkness-2")
                .faceDown(Side.PLAYER, 1, "Life-4")
                .build();

        assertEquals(6, state.getPlayer().getLaneValue(0));
        assertEquals(2, state.getPlayer().getLaneValue(1));
    }

    @Test
    void metalZeroLowersTheOpposingLine() {
        GameState state = GameStateBuilder.newGame(CATALOG)
                .faceUp(Side.PLAYER, 0, "Speed-3")
                .faceUp(Side.OPPONENT, 0, "Metal-0")
                .faceUp(Side.PLAYER, 1, "Life-3")
                .build();

        assertEquals(1, state.getPlayer().getLaneValue(0));
        assertEquals(0, state.getOpponent().getLaneValue(0));
        assertEquals(3, state.getPlayer().getLaneValue(1));
    }

    @Test
    void totalsNeverDropBelowZero() {
        GameState state = GameStateBuilder.newGame(CATALOG)
                .faceUp(Side.PLAYER, 0, "Speed-1")
                .faceUp(Side.OPPONENT, 0, "Metal-0")
                .build();

        assertEquals(0, state.getPlayer().getLaneValue(0));
    }

    @Test
    void apathyZeroCountsFaceDownCards() {
        GameState state = GameStateBuilder.newGame(CATALOG)
                .protocols(Side.PLAYER, "Apathy", "Life", "Water")
                .faceDown(Side.PLAYER, 0, "Life-5", "Life-4")
                .faceUp(Side.PLAYER, 0, "Apathy-0")
                .build();

        assertEquals(6, state.getPlayer().getLaneValue(0));
    }

    @Test
    void totalAfterPlayIncludesPassivesAndLeavesTheStateAlone() {
        GameState state = GameStateBuilder.newGame(CATALOG)
                .faceUp(Side.OPPONENT, 0, "Metal-0")
                .hand(Side.PLAYER, "Speed-5")
                .build();

        int total = LaneValues.totalAfterPlay(state, Side.PLAYER, 0, state.getPlayer().getHand().get(0), true);

        assertEquals(3, total);
        assertTrue(state.getPlayer().getLane(0).isEmpty());
        assertEquals(0, state.getPlayer().getLaneValue(0));
    }

    @Test
    void cachedValuesMatchTheDerivedTotals() {
        GameState state = GameStateBuilder.newGame(CATALOG)
                .protocols(Side.PLAYER, "Darkness", "Apathy", "Water")
                .faceDown(Side.PLAYER, 0, "Water-5")
                .faceUp(Side.PLAYER, 0, "Darkness-2")
                .faceDown(Side.PLAYER, 1, "Water-4")
                .faceUp(Side.PLAYER, 1, "Apathy-0")
                .faceUp(Side.OPPONENT, 1, "Metal-0")
                .build();

        assertTrue(GameStateInvariants.laneCacheDrift(state).isEmpty());
    }
}
