package ai.compile.actions;

import ai.compile.effects.EffectRun;
import ai.compile.effects.Instruction;
import ai.compile.effects.TargetFilter;
import ai.compile.game.Side;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A decision the engine is waiting for.
 *
 * <p>Each {@link Type} is one variant of a closed union. All variants share {@link #actor()},
 * {@link #sourceCardId()} and {@link #optional()}; the remaining fields are only meaningful for
 * the variants that document them and are {@code null}, empty or -1 otherwise.
 *
 * <p>Instances are immutable. {@link #continuation()} is the effect that emitted the action,
 * positioned at the emitting instruction; resolving the action records the outcome on it and
 * resumes execution.
 */
public final class ActionRequired {

    public enum Type {
        /** Discard {@code count} cards from hand ({@code variable}: at least {@code count}). */
        DISCARD,
        SELECT_CARD_TO_DELETE,
        SELECT_CARD_TO_FLIP,
        SELECT_CARD_TO_SHIFT,
        /** Pick the destination lane for {@code targetCardId}. */
        SELECT_LANE_FOR_SHIFT,
        SELECT_CARD_TO_RETURN,
        SELECT_CARD_TO_REVEAL,
        SELECT_LANE_FOR_DELETE_ALL,
        SELECT_LANE_FOR_RETURN_ALL,
        /** Pick where every face-down card of {@code laneIndex} goes. */
        SELECT_LANE_FOR_SHIFT_ALL,
        /** Pick the lane that receives the top card of the actor's deck, face-down. */
        SELECT_LANE_FOR_DECK_PLAY,
        /**
         * Pick two of the actor's lines whose stacks trade places, one line per answer. After the first
         * answer {@code disallowedLanes} holds it.
         */
        SELECT_LANES_FOR_SWAP_STACKS,
        /** Play a card from hand as part of an effect. */
        PLAY_FROM_HAND,
        /** Pick a hand card to hand over to the other side. */
        SELECT_CARD_TO_GIVE,
        /** Pick a hand card to show to the other side. */
        SELECT_HAND_CARD_TO_REVEAL,
        /** Accept or decline a "you may" instruction. */
        PROMPT_OPTIONAL_EFFECT,
        /** Pick one of {@code options}. */
        PROMPT_CHOICE,
        /** Reorder the protocols of {@code targetSide}. */
        REARRANGE_PROTOCOLS,
        /** Swap two protocols of {@code targetSide}. */
        SWAP_PROTOCOLS,
        /** Pick which of {@code candidateIds} resolves its Start or End effect next. */
        SELECT_PHASE_EFFECT,
        /** Use the control marker to rearrange either side's protocols before {@code followUp}. */
        PROMPT_USE_CONTROL;

        /**
         * True for the variants that are resolved by pointing at a board card.
         */
        public boolean isCardSelection() {
            return this == SELECT_CARD_TO_DELETE || this == SELECT_CARD_TO_FLIP || this == SELECT_CARD_TO_SHIFT
                    || this == SELECT_CARD_TO_RETURN || this == SELECT_CARD_TO_REVEAL;
        }

        /**
         * True for the variants that are resolved by pointing at one of the actor's hand cards.
         */
        public boolean isHandSelection() {
            return this == SELECT_CARD_TO_GIVE || this == SELECT_HAND_CARD_TO_REVEAL;
        }

        /**
         * True for the variants that are resolved by pointing at a lane.
         */
        public boolean isLaneSelection() {
            return this == SELECT_LANE_FOR_SHIFT || this == SELECT_LANE_FOR_DELETE_ALL
                    || this == SELECT_LANE_FOR_RETURN_ALL || this == SELECT_LANE_FOR_SHIFT_ALL
                    || this == SELECT_LANE_FOR_DECK_PLAY || this == SELECT_LANES_FOR_SWAP_STACKS;
        }
    }

    private final Type type;
    private final Side actor;
    private final String sourceCardId;
    private final boolean optional;
    private final int count;
    private final boolean variable;
    private final boolean clearCache;
    private final TargetFilter filter;
    private final Set<String> disallowedIds;
    private final Set<Integer> disallowedLanes;
    private final int laneIndex;
    private final String targetCardId;
    private final Side targetSide;
    private final boolean faceDownOnly;
    private final List<String> candidateIds;
    private final Instruction instruction;
    private final EffectRun continuation;
    private final List<String> options;
    private final FollowUp followUp;
    private final String forbiddenProtocol;

    private ActionRequired(Builder b) {
        this.type = Objects.requireNonNull(b.type, "type");
        this.actor = Objects.requireNonNull(b.actor, "actor");
        this.sourceCardId = b.sourceCardId;
        this.optional = b.optional;
        this.count = b.count;
        this.variable = b.variable;
        this.clearCache = b.clearCache;
        this.filter = b.filter;
        this.disallowedIds = Collections.unmodifiableSet(new LinkedHashSet<>(b.disallowedIds));
        this.disallowedLanes = Collections.unmodifiableSet(new LinkedHashSet<>(b.disallowedLanes));
        this.laneIndex = b.laneIndex;
        this.targetCardId = b.targetCardId;
        this.targetSide = b.targetSide;
        this.faceDownOnly = b.faceDownOnly;
        this.candidateIds = Collections.unmodifiableList(new ArrayList<>(b.candidateIds));
        this.instruction = b.instruction;
        this.continuation = b.continuation;
        this.options = Collections.unmodifiableList(new ArrayList<>(b.options));
        this.followUp = b.followUp;
        this.forbiddenProtocol = b.forbiddenProtocol;
    }

    public static Builder builder(Type type, Side actor) {
        return new Builder(type, actor);
    }

    public Builder toBuilder() {
        Builder b = new Builder(type, actor);
        b.sourceCardId = sourceCardId;
        b.optional = optional;
        b.count = count;
        b.variable = variable;
        b.clearCache = clearCache;
        b.filter = filter;
        b.disallowedIds.addAll(disallowedIds);
        b.disallowedLanes.addAll(disallowedLanes);
        b.laneIndex = laneIndex;
        b.targetCardId = targetCardId;
        b.targetSide = targetSide;
        b.faceDownOnly = faceDownOnly;
        b.candidateIds.addAll(candidateIds);
        b.instruction = instruction;
        b.continuation = continuation;
        b.options.addAll(options);
        b.followUp = followUp;
        b.forbiddenProtocol = forbiddenProtocol;
        return b;
    }

    public Type type() {
        return type;
    }

    /**
     * The only side whose intents are accepted while this action is active.
     */
    public Side actor() {
        return actor;
    }

    /**
     * Card whose effect asked for this decision; {@code null} for rule-driven actions such as the
     * hand limit discard.
     */
    public String sourceCardId() {
        return sourceCardId;
    }

    /**
     * Whether the actor may skip this action.
     */
    public boolean optional() {
        return optional;
    }

    public int count() {
        return count;
    }

    public boolean variable() {
        return variable;
    }

    /**
     * Set on the hand limit discard, whose completion fires "after you clear cache" reactions.
     */
    public boolean clearCache() {
        return clearCache;
    }

    public TargetFilter filter() {
        return filter;
    }

    public Set<String> disallowedIds() {
        return disallowedIds;
    }

    public Set<Integer> disallowedLanes() {
        return disallowedLanes;
    }

    /**
     * The lane the source card occupied when the action was emitted, or the lane the action is
     * about; -1 when neither applies.
     */
    public int laneIndex() {
        return laneIndex;
    }

    public String targetCardId() {
        return targetCardId;
    }

    public Side targetSide() {
        return targetSide;
    }

    public boolean faceDownOnly() {
        return faceDownOnly;
    }

    /**
     * Explicit shortlist of eligible cards, used for ties and phase effect ordering; empty when the
     * filter alone decides.
     */
    public List<String> candidateIds() {
        return candidateIds;
    }

    /**
     * The instruction being resolved.
     */
    public Instruction instruction() {
        return instruction;
    }

    public EffectRun continuation() {
        return continuation;
    }

    public List<String> options() {
        return options;
    }

    public FollowUp followUp() {
        return followUp;
    }

    public String forbiddenProtocol() {
        return forbiddenProtocol;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(type.name()).append(" for ").append(actor);
        if (sourceCardId != null) {
            sb.append(" from ").append(sourceCardId);
        }
        if (type == Type.DISCARD) {
            sb.append(" count=").append(count).append(variable ? "+" : "");
        }
        if (targetCardId != null) {
            sb.append(" card=").append(targetCardId);
        }
        if (targetSide != null) {
            sb.append(" side=").append(targetSide);
        }
        if (optional) {
            sb.append(" (optional)");
        }
        return sb.toString();
    }

    public static final class Builder {
        private final Type type;
        private final Side actor;
        private String sourceCardId;
        private boolean optional;
        private int count = 1;
        private boolean variable;
        private boolean clearCache;
        private TargetFilter filter;
        private final Set<String> disallowedIds = new LinkedHashSet<>();
        private final Set<Integer> disallowedLanes = new LinkedHashSet<>();
        private int laneIndex = -1;
        private String targetCardId;
        private Side targetSide;
        private boolean faceDownOnly;
        private final List<String> candidateIds = new ArrayList<>();
        private Instruction instruction;
        private EffectRun continuation;
        private final List<String> options = new ArrayList<>();
        private FollowUp followUp;
        private String forbiddenProtocol;

        private Builder(Type type, Side actor) {
            this.type = type;
            this.actor = actor;
        }

        public Builder sourceCardId(String sourceCardId) {
            this.sourceCardId = sourceCardId;
            return this;
        }

        public Builder optional(boolean optional) {
            this.optional = optional;
            return this;
        }

        public Builder count(int count) {
            this.count = count;
            return this;
        }

        public Builder variable(boolean variable) {
            this.variable = variable;
            return this;
        }

        public Builder clearCache(boolean clearCache) {
            this.clearCache = clearCache;
            return this;
        }

        public Builder filter(TargetFilter filter) {
            this.filter = filter;
            return this;
        }

        public Builder disallowId(String id) {
            this.disallowedIds.add(id);
            return this;
        }

        public Builder disallowLane(int lane) {
            this.disallowedLanes.add(lane);
            return this;
        }

        public Builder laneIndex(int laneIndex) {
            this.laneIndex = laneIndex;
            return this;
        }

        public Builder targetCardId(String targetCardId) {
            this.targetCardId = targetCardId;
            return this;
        }

        public Builder targetSide(Side targetSide) {
            this.targetSide = targetSide;
            return this;
        }

        public Builder faceDownOnly(boolean faceDownOnly) {
            this.faceDownOnly = faceDownOnly;
            return this;
        }

        public Builder candidateIds(List<String> ids) {
            this.candidateIds.clear();
            this.candidateIds.addAll(ids);
            return this;
        }

        public Builder instruction(Instruction instruction) {
            this.instruction = instruction;
            return this;
        }

        public Builder continuation(EffectRun continuation) {
            this.continuation = continuation;
            return this;
        }

        public Builder options(List<String> labels) {
            this.options.clear();
            this.options.addAll(labels);
            return this;
        }

        public Builder followUp(FollowUp followUp) {
            this.followUp = followUp;
            return this;
        }

        public Builder forbiddenProtocol(String forbiddenProtocol) {
            this.forbiddenProtocol = forbiddenProtocol;
            return this;
        }

        public ActionRequired build() {
            return new ActionRequired(this);
        }
    }
}
