package ai.compile.effects;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One step of a card effect, e.g. "Delete 1 face-down card" or "Draw 2 cards".
 * <p>
 * Instructions are immutable and built by the catalog loader. An effect is an ordered list of
 * instructions; the interpreter executes them in order and remembers a few facts about the
 * previous step (did it happen, how many cards, which card) so that "If you do" and
 * "that card" phrasing can be expressed with {@link Condition#IF_PREVIOUS} and the
 * {@code *_PREVIOUS} operations.
 */
public final class Instruction {

    /** Who carries out the instruction, relative to the card's owner. */
    public enum Actor {
        SELF,
        OPPONENT
    }

    public enum Condition {
        ALWAYS,
        /** Only if the previous instruction actually happened ("If you do"). */
        IF_PREVIOUS,
        /** Only if the source card sits on top of another card. */
        IF_COVERING,
        /** Only if either protocol of the source card's line equals {@link #conditionProtocol()}. */
        IF_IN_PROTOCOL_LINE
    }

    public enum Amount {
        FIXED,
        /** Number of cards affected by the previous instruction, plus one. */
        PREVIOUS_COUNT_PLUS_ONE,
        /** Effective value of the card targeted by the previous instruction. */
        PREVIOUS_VALUE,
        /** Number of lines holding a face-up card whose protocol matches neither protocol of that line. */
        NON_MATCHING_LINES,
        /** Face-down cards on the whole board. */
        FACE_DOWN_CARDS,
        /** Half the cards in the source card's line, both sides, rounded down. */
        HALF_CARDS_IN_LINE
    }

    public enum Scope {
        SINGLE,
        EACH_LANE,
        EACH_OTHER_LANE,
        EACH_LANE_WITH_OWN_CARD,
        CHOSEN_OTHER_LANE
    }

    public enum Destination {
        ANY_OTHER,
        THIS_LANE,
        NON_MATCHING,
        /** Into the source card's line, or out of it when the card already sits there. */
        TO_OR_FROM_THIS_LANE
    }

    private final Op op;
    private final int count;
    private final boolean optional;
    private final boolean variable;
    private final Actor actor;
    private final TargetFilter filter;
    private final Condition condition;
    private final String conditionProtocol;
    private final Amount amount;
    private final Scope scope;
    private final Destination destination;
    private final TargetFilter.Owner whose;
    private final int minCards;
    private final String forbiddenProtocol;
    private final List<List<Instruction>> options;
    private final List<String> optionLabels;

    private Instruction(Builder b) {
        this.op = Objects.requireNonNull(b.op, "op");
        this.count = b.count;
        this.optional = b.optional;
        this.variable = b.variable;
        this.actor = Objects.requireNonNull(b.actor, "actor");
        this.filter = Objects.requireNonNull(b.filter, "filter");
        this.condition = Objects.requireNonNull(b.condition, "condition");
        this.conditionProtocol = b.conditionProtocol;
        this.amount = Objects.requireNonNull(b.amount, "amount");
        this.scope = Objects.requireNonNull(b.scope, "scope");
        this.destination = Objects.requireNonNull(b.destination, "destination");
        this.whose = Objects.requireNonNull(b.whose, "whose");
        this.minCards = b.minCards;
        this.forbiddenProtocol = b.forbiddenProtocol;
        List<List<Instruction>> opts = new ArrayList<>();
        for (List<Instruction> option : b.options) {
            opts.add(Collections.unmodifiableList(new ArrayList<>(option)));
        }
        this.options = Collections.unmodifiableList(opts);
        this.optionLabels = Collections.unmodifiableList(new ArrayList<>(b.optionLabels));
    }

    public static Builder builder(Op op) {
        return new Builder(op);
    }

    public Builder toBuilder() {
        Builder b = new Builder(op);
        b.count = count;
        b.optional = optional;
        b.variable = variable;
        b.actor = actor;
        b.filter = filter;
        b.condition = condition;
        b.conditionProtocol = conditionProtocol;
        b.amount = amount;
        b.scope = scope;
        b.destination = destination;
        b.whose = whose;
        b.minCards = minCards;
        b.forbiddenProtocol = forbiddenProtocol;
        b.options.addAll(options);
        b.optionLabels.addAll(optionLabels);
        return b;
    }

    /**
     * Copy of this instruction restricted to one lane and with its scope collapsed to {@link Scope#SINGLE}.
     */
    public Instruction forLane(int laneIndex) {
        return toBuilder()
                .scope(Scope.SINGLE)
                .filter(filter.withOnlyLane(laneIndex))
                .build();
    }

    /**
     * Copy of this instruction with the "you may" removed, used once the player accepted it.
     */
    public Instruction mandatory() {
        return toBuilder().optional(false).build();
    }

    public Instruction withCount(int newCount) {
        return toBuilder().count(newCount).amount(Amount.FIXED).build();
    }

    public Op op() {
        return op;
    }

    public int count() {
        return count;
    }

    public boolean optional() {
        return optional;
    }

    /**
     * "1 or more" discards: the actor picks how many, at least {@link #count()}.
     */
    public boolean variable() {
        return variable;
    }

    public Actor actor() {
        return actor;
    }

    public TargetFilter filter() {
        return filter;
    }

    public Condition condition() {
        return condition;
    }

    public String conditionProtocol() {
        return conditionProtocol;
    }

    public Amount amount() {
        return amount;
    }

    public Scope scope() {
        return scope;
    }

    public Destination destination() {
        return destination;
    }

    /**
     * Whose protocols a rearrange or swap applies to.
     */
    public TargetFilter.Owner whose() {
        return whose;
    }

    /**
     * Minimum number of cards a line must hold to be chosen, for lane-wide deletes.
     */
    public int minCards() {
        return minCards;
    }

    /**
     * Protocol that may not end up on the source card's line after a rearrange.
     */
    public String forbiddenProtocol() {
        return forbiddenProtocol;
    }

    public List<List<Instruction>> options() {
        return options;
    }

    public List<String> optionLabels() {
        return optionLabels;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(op.name());
        if (count != 1) {
            sb.append(' ').append(count);
        }
        if (variable) {
            sb.append("+");
        }
        if (optional) {
            sb.append(" (optional)");
        }
        if (actor == Actor.OPPONENT) {
            sb.append(" by opponent");
        }
        if (condition != Condition.ALWAYS) {
            sb.append(" when ").append(condition);
        }
        if (scope != Scope.SINGLE) {
            sb.append(" in ").append(scope);
        }
        if (op.isTargeted()) {
            sb.append(' ').append(filter);
        }
        return sb.toString();
    }

    public static final class Builder {
        private final Op op;
        private int count = 1;
        private boolean optional;
        private boolean variable;
        private Actor actor = Actor.SELF;
        private TargetFilter filter = TargetFilter.any();
        private Condition condition = Condition.ALWAYS;
        private String conditionProtocol;
        private Amount amount = Amount.FIXED;
        private Scope scope = Scope.SINGLE;
        private Destination destination = Destination.ANY_OTHER;
        private TargetFilter.Owner whose = TargetFilter.Owner.OWN;
        private int minCards;
        private String forbiddenProtocol;
        private final List<List<Instruction>> options = new ArrayList<>();
        private final List<String> optionLabels = new ArrayList<>();

        private Builder(Op op) {
            this.op = op;
        }

        public Builder count(int count) {
            this.count = count;
            return this;
        }

        public Builder optional(boolean optional) {
            this.optional = optional;
            return this;
        }

        public Builder variable(boolean variable) {
            this.variable = variable;
            return this;
        }

        public Builder actor(Actor actor) {
            this.actor = actor;
            return this;
        }

        public Builder filter(TargetFilter filter) {
            this.filter = filter;
            return this;
        }

        public Builder condition(Condition condition) {
            this.condition = condition;
            return this;
        }

        public Builder conditionProtocol(String conditionProtocol) {
            this.conditionProtocol = conditionProtocol;
            return this;
        }

        public Builder amount(Amount amount) {
            this.amount = amount;
            return this;
        }

        public Builder scope(Scope scope) {
            this.scope = scope;
            return this;
        }

        public Builder destination(Destination destination) {
            this.destination = destination;
            return this;
        }

        public Builder whose(TargetFilter.Owner whose) {
            this.whose = whose;
            return this;
        }

        public Builder minCards(int minCards) {
            this.minCards = minCards;
            return this;
        }

        public Builder forbiddenProtocol(String forbiddenProtocol) {
            this.forbiddenProtocol = forbiddenProtocol;
            return this;
        }

        public Builder option(String label, List<Instruction> steps) {
            this.optionLabels.add(label);
            this.options.add(steps);
            return this;
        }

        public Instruction build() {
            return new Instruction(this);
        }
    }
}
