package ai.compile.effects;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A parsed card effect: a trigger, the box it is printed in, and either an instruction list or a
 * passive rule.
 */
public final class Effect {
    private final Trigger trigger;
    private final EffectBox box;
    private final List<Instruction> instructions;
    private final PassiveRule rule;

    public Effect(Trigger trigger, EffectBox box, List<Instruction> instructions, PassiveRule rule) {
        this.trigger = Objects.requireNonNull(trigger, "trigger");
        this.box = Objects.requireNonNull(box, "box");
        this.instructions = Collections.unmodifiableList(new ArrayList<>(instructions));
        this.rule = rule;
        if (trigger == Trigger.PASSIVE && rule == null) {
            throw new IllegalArgumentException("Passive effect requires a rule");
        }
        if (trigger != Trigger.PASSIVE && this.instructions.isEmpty()) {
            throw new IllegalArgumentException(trigger + " effect requires at least one instruction");
        }
    }

    public static Effect passive(EffectBox box, PassiveRule rule) {
        return new Effect(Trigger.PASSIVE, box, Collections.emptyList(), rule);
    }

    public Trigger trigger() {
        return trigger;
    }

    public EffectBox box() {
        return box;
    }

    public List<Instruction> instructions() {
        return instructions;
    }

    /**
     * The passive rule, or {@code null} for non-passive effects.
     */
    public PassiveRule rule() {
        return rule;
    }

    @Override
    public String toString() {
        if (trigger == Trigger.PASSIVE) {
            return box + " passive " + rule;
        }
        return box + " " + trigger + " " + instructions;
    }
}
