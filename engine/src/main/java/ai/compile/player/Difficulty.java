package ai.compile.player;

import ai.compile.player.ai.EasyPlayer;
import ai.compile.player.ai.HardPlayer;
import ai.compile.player.ai.NormalPlayer;
import java.util.Locale;

/**
 * AI skill levels.
 */
public enum Difficulty {
    EASY,
    NORMAL,
    HARD;

    /**
     * Creates a player of this level. {@code seed} drives the tie-breaks of the levels that randomise.
     */
    public Player newPlayer(long seed) {
        switch (this) {
            case EASY:
                return new EasyPlayer();
            case NORMAL:
                return new NormalPlayer(seed);
            case HARD:
                return new HardPlayer(seed);
            default:
                throw new IllegalStateException("Unknown difficulty " + this);
        }
    }

    /**
     * Lenient parse for configuration values ("hard", "Normal", ...).
     */
    public static Difficulty parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Difficulty must not be blank");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
