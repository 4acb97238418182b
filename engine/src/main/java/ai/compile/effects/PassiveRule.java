package ai.compile.effects;

import java.util.Objects;

/**
 * An always-on rule granted by a face-up card, e.g. "Your opponent cannot play cards in this line".
 *
 * @param type   what the rule does
 * @param target whose plays or values the rule applies to, relative to the card's owner
 * @param scope  whether the rule covers only the card's line or the whole board
 * @param value  numeric parameter (face-down value, lane modifier amount); zero when unused
 */
public record PassiveRule(Type type, Target target, Scope scope, int value) {

    public enum Type {
        BLOCK_ALL_PLAY,
        BLOCK_FACE_DOWN_PLAY,
        REQUIRE_FACE_DOWN_PLAY,
        ALLOW_ANY_PROTOCOL_PLAY,
        REQUIRE_NON_MATCHING_PROTOCOL,
        IGNORE_MIDDLE_COMMANDS,
        SKIP_HAND_LIMIT,
        /** Face-down cards in the owner's stack in this line count as {@link #value()}. */
        FACE_DOWN_VALUE,
        /** Adds {@link #value()} to the target's total in this line. */
        LANE_VALUE_MODIFIER,
        /** Adds {@link #value()} to the target's total in this line for each face-down card in the line. */
        LANE_VALUE_PER_FACE_DOWN,
        /** Face-down cards cannot be turned face-up. */
        BLOCK_FLIP_FACE_UP,
        /** Effects cannot rearrange or swap protocols. */
        BLOCK_PROTOCOL_REARRANGE,
        /** Cards cannot shift out of or into the line. */
        BLOCK_SHIFTS
    }

    public enum Target {
        SELF,
        OPPONENT,
        ALL
    }

    public enum Scope {
        THIS_LANE,
        GLOBAL
    }

    public PassiveRule {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(scope, "scope");
    }
}
