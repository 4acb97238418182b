package ai.compile.effects;

import ai.compile.game.Side;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An effect in progress: the instructions of one card effect plus a program counter and the
 * result registers of the last executed step.
 * <p>
 * Runs are immutable. When an instruction has to wait for a player's choice the interpreter stores
 * {@code run.advance()} on the emitted action; resolving the action resumes from there. This is how
 * "Draw 3 cards. Shift 1 of your opponent's covered cards." keeps going after the shift target is
 * chosen.
 */
public final class EffectRun {
    private final String sourceCardId;
    private final Side owner;
    private final int laneIndex;
    private final Trigger trigger;
    private final List<Instruction> instructions;
    private final int next;
    private final boolean lastSucceeded;
    private final int lastCount;
    private final String lastTargetId;
    private final int lastValue;

    private EffectRun(String sourceCardId, Side owner, int laneIndex, Trigger trigger,
                      List<Instruction> instructions, int next,
                      boolean lastSucceeded, int lastCount, String lastTargetId, int lastValue) {
        this.sourceCardId = Objects.requireNonNull(sourceCardId, "sourceCardId");
        this.owner = Objects.requireNonNull(owner, "owner");
        this.laneIndex = laneIndex;
        this.trigger = Objects.requireNonNull(trigger, "trigger");
        this.instructions = instructions;
        this.next = next;
        this.lastSucceeded = lastSucceeded;
        this.lastCount = lastCount;
        this.lastTargetId = lastTargetId;
        this.lastValue = lastValue;
    }

    /**
     * Starts a run at the first instruction of an effect.
     */
    public static EffectRun start(String sourceCardId, Side owner, int laneIndex, Trigger trigger,
                                  List<Instruction> instructions) {
        return new EffectRun(sourceCardId, owner, laneIndex, trigger,
                Collections.unmodifiableList(new ArrayList<>(instructions)), 0, true, 0, null, 0);
    }

    public boolean hasNext() {
        return next < instructions.size();
    }

    public Instruction current() {
        return instructions.get(next);
    }

    public EffectRun advance() {
        return new EffectRun(sourceCardId, owner, laneIndex, trigger, instructions, next + 1,
                lastSucceeded, lastCount, lastTargetId, lastValue);
    }

    /**
     * Records the outcome of the current instruction and moves past it.
     */
    public EffectRun completed(boolean succeeded, int count, String targetId, int value) {
        return new EffectRun(sourceCardId, owner, laneIndex, trigger, instructions, next + 1,
                succeeded, count, targetId, value);
    }

    /**
     * Records a skipped instruction ("If you do" checks will fail) and moves past it.
     */
    public EffectRun skipped() {
        return completed(false, 0, null, 0);
    }

    /**
     * Replaces the current instruction with the given steps, e.g. the per-lane expansion of
     * "Delete 1 card from each other line" or the chosen option of an either/or effect.
     */
    public EffectRun replaceCurrent(List<Instruction> replacement) {
        List<Instruction> expanded = new ArrayList<>(instructions.subList(0, next));
        expanded.addAll(replacement);
        expanded.addAll(instructions.subList(next + 1, instructions.size()));
        return new EffectRun(sourceCardId, owner, laneIndex, trigger, Collections.unmodifiableList(expanded), next,
                lastSucceeded, lastCount, lastTargetId, lastValue);
    }

    public String sourceCardId() {
        return sourceCardId;
    }

    public Side owner() {
        return owner;
    }

    /**
     * Lane the source card occupied when the effect triggered.
     */
    public int laneIndex() {
        return laneIndex;
    }

    public Trigger trigger() {
        return trigger;
    }

    public List<Instruction> instructions() {
        return instructions;
    }

    public int position() {
        return next;
    }

    public boolean lastSucceeded() {
        return lastSucceeded;
    }

    public int lastCount() {
        return lastCount;
    }

    public String lastTargetId() {
        return lastTargetId;
    }

    public int lastValue() {
        return lastValue;
    }

    @Override
    public String toString() {
        return "EffectRun{" + sourceCardId + " " + trigger + " step " + next + "/" + instructions.size() + "}";
    }
}
