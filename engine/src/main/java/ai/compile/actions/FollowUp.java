package ai.compile.actions;

/**
 * A turn action postponed behind a control-mechanic prompt.
 *
 * @param kind      the postponed action
 * @param laneIndex lane to compile, or -1 for a refresh
 */
public record FollowUp(Kind kind, int laneIndex) {

    public enum Kind {
        COMPILE,
        FILL_HAND
    }

    public static FollowUp compile(int laneIndex) {
        return new FollowUp(Kind.COMPILE, laneIndex);
    }

    public static FollowUp fillHand() {
        return new FollowUp(Kind.FILL_HAND, -1);
    }
}
