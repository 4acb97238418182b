package ai.compile.game;

import java.util.Objects;

/**
 * Something visible that happened during one transition, in order.
 * <p>
 * The engine never waits for these; a presentation layer may replay them as animations after the
 * new state has been returned.
 *
 * @param type      what happened
 * @param side      the side whose card or hand was affected
 * @param cardId    the affected card, or {@code null} for hand-level events
 * @param laneIndex the lane involved, or -1
 * @param detail    short free-text detail for logs
 */
public record BoardEvent(Type type, Side side, String cardId, int laneIndex, String detail) {

    public enum Type {
        PLAYED,
        FLIPPED,
        DELETED,
        SHIFTED,
        RETURNED,
        DREW,
        DISCARDED,
        /** A hand card moved to the other side's hand; {@code side} lost it. */
        CHANGED_HANDS,
        RESHUFFLED,
        REVEALED,
        PROTOCOLS_REARRANGED,
        /** Two of a side's stacks traded lines; {@code laneIndex} is the second line. */
        STACKS_SWAPPED,
        COMPILED,
        CONTROL_GAINED,
        GAME_WON
    }

    public BoardEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(side, "side");
        detail = detail == null ? "" : detail;
    }
}
