package ai.compile.effects;

import java.util.Objects;

/**
 * Constraints a board card must satisfy to be chosen by a targeted instruction.
 * <p>
 * Owner is always relative to the side performing the instruction: {@link Owner#OWN} means
 * "the actor's cards", which for "your opponent deletes 1 of their face-down cards" is the
 * opponent's own side.
 * <p>
 * Defaults match the printed rule "only uncovered cards can be targeted": a filter built with
 * {@link #any()} targets any uncovered card, face-up or face-down, on either side.
 */
public final class TargetFilter {

    public enum Owner {
        ANY,
        OWN,
        OPPONENT
    }

    public enum FaceState {
        ANY,
        FACE_UP,
        FACE_DOWN
    }

    public enum Position {
        UNCOVERED,
        COVERED,
        ANY
    }

    public enum LaneFilter {
        ANY,
        THIS,
        OTHER
    }

    public enum ProtocolMatch {
        ANY,
        /** The card is face-up and its protocol matches either protocol of its line. */
        MATCHING
    }

    private static final TargetFilter ANY = builder().build();

    private final Owner owner;
    private final FaceState faceState;
    private final Position position;
    private final boolean excludeSelf;
    private final int minValue;
    private final int maxValue;
    private final LaneFilter lane;
    private final ProtocolMatch protocolMatch;
    /** Restricts targets to one lane index; -1 when unrestricted. Set when a scoped instruction is expanded. */
    private final int onlyLane;

    private TargetFilter(Builder b) {
        this.owner = Objects.requireNonNull(b.owner, "owner");
        this.faceState = Objects.requireNonNull(b.faceState, "faceState");
        this.position = Objects.requireNonNull(b.position, "position");
        this.excludeSelf = b.excludeSelf;
        this.minValue = b.minValue;
        this.maxValue = b.maxValue;
        this.lane = Objects.requireNonNull(b.lane, "lane");
        this.protocolMatch = Objects.requireNonNull(b.protocolMatch, "protocolMatch");
        this.onlyLane = b.onlyLane;
    }

    /**
     * Any uncovered card on either side.
     */
    public static TargetFilter any() {
        return ANY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.owner = owner;
        b.faceState = faceState;
        b.position = position;
        b.excludeSelf = excludeSelf;
        b.minValue = minValue;
        b.maxValue = maxValue;
        b.lane = lane;
        b.protocolMatch = protocolMatch;
        b.onlyLane = onlyLane;
        return b;
    }

    public TargetFilter withOnlyLane(int laneIndex) {
        return toBuilder().onlyLane(laneIndex).build();
    }

    public Owner owner() {
        return owner;
    }

    public FaceState faceState() {
        return faceState;
    }

    public Position position() {
        return position;
    }

    public boolean excludeSelf() {
        return excludeSelf;
    }

    public int minValue() {
        return minValue;
    }

    public int maxValue() {
        return maxValue;
    }

    public boolean hasValueRange() {
        return minValue > 0 || maxValue < Integer.MAX_VALUE;
    }

    public LaneFilter lane() {
        return lane;
    }

    public ProtocolMatch protocolMatch() {
        return protocolMatch;
    }

    public int onlyLane() {
        return onlyLane;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TargetFilter)) {
            return false;
        }
        TargetFilter that = (TargetFilter) o;
        return excludeSelf == that.excludeSelf
                && minValue == that.minValue
                && maxValue == that.maxValue
                && onlyLane == that.onlyLane
                && owner == that.owner
                && faceState == that.faceState
                && position == that.position
                && lane == that.lane
                && protocolMatch == that.protocolMatch;
    }

    @Override
    public int hashCode() {
        return Objects.hash(owner, faceState, position, excludeSelf, minValue, maxValue, lane, protocolMatch, onlyLane);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("TargetFilter{");
        sb.append("owner=").append(owner)
                .append(", face=").append(faceState)
                .append(", position=").append(position);
        if (excludeSelf) {
            sb.append(", excludeSelf");
        }
        if (hasValueRange()) {
            sb.append(", value=").append(minValue).append("..").append(maxValue);
        }
        if (lane != LaneFilter.ANY) {
            sb.append(", lane=").append(lane);
        }
        if (protocolMatch != ProtocolMatch.ANY) {
            sb.append(", protocol=").append(protocolMatch);
        }
        if (onlyLane >= 0) {
            sb.append(", onlyLane=").append(onlyLane);
        }
        return sb.append('}').toString();
    }

    public static final class Builder {
        private Owner owner = Owner.ANY;
        private FaceState faceState = FaceState.ANY;
        private Position position = Position.UNCOVERED;
        private boolean excludeSelf;
        private int minValue = 0;
        private int maxValue = Integer.MAX_VALUE;
        private LaneFilter lane = LaneFilter.ANY;
        private ProtocolMatch protocolMatch = ProtocolMatch.ANY;
        private int onlyLane = -1;

        private Builder() {
        }

        public Builder owner(Owner owner) {
            this.owner = owner;
            return this;
        }

        public Builder faceState(FaceState faceState) {
            this.faceState = faceState;
            return this;
        }

        public Builder position(Position position) {
            this.position = position;
            return this;
        }

        public Builder excludeSelf(boolean excludeSelf) {
            this.excludeSelf = excludeSelf;
            return this;
        }

        public Builder valueRange(int minValue, int maxValue) {
            this.minValue = minValue;
            this.maxValue = maxValue;
            return this;
        }

        public Builder lane(LaneFilter lane) {
            this.lane = lane;
            return this;
        }

        public Builder protocolMatch(ProtocolMatch protocolMatch) {
            this.protocolMatch = protocolMatch;
            return this;
        }

        public Builder onlyLane(int onlyLane) {
            this.onlyLane = onlyLane;
            return this;
        }

        public TargetFilter build() {
            if (minValue > maxValue) {
                throw new IllegalArgumentException("minValue " + minValue + " > maxValue " + maxValue);
            }
            return new TargetFilter(this);
        }
    }
}
