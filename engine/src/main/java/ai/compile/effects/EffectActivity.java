package ai.compile.effects;

import ai.compile.game.CardLocation;
import ai.compile.game.GameState;
import ai.compile.game.PlayedCard;

/**
 * Decides whether a printed effect is currently in force.
 * <p>
 * Top-box effects are live while the card is face-up on the board, covered or not. Middle and
 * bottom box effects also need the card to be uncovered.
 */
public final class EffectActivity {

    private EffectActivity() {
    }

    public static boolean isLive(GameState state, CardLocation loc, Effect effect) {
        if (loc == null || !loc.onBoard()) {
            return false;
        }
        PlayedCard card = state.cardAt(loc);
        if (!card.isFaceUp()) {
            return false;
        }
        return !effect.box().requiresUncovered() || state.isUncovered(loc);
    }

    public static boolean isLive(GameState state, String cardId, Effect effect) {
        return isLive(state, state.locate(cardId), effect);
    }
}
