package ai.compile.catalog;

import java.util.ArrayList;
import java.util.List;

/**
 * A trigger and box with either instructions or a passive rule.
 */
public class EffectDefinition {

    private String trigger;
    private String box;
    private List<InstructionDefinition> instructions = new ArrayList<>();
    private RuleDefinition rule;

    public EffectDefinition() {
        // Default constructor for JSON binding.
    }

    public String getTrigger() {
        return trigger;
    }

    public void setTrigger(String trigger) {
        this.trigger = trigger;
    }

    public String getBox() {
        return box;
    }

    public void setBox(String box) {
        this.box = box;
    }

    public List<InstructionDefinition> getInstructions() {
        return instructions;
    }

    public void setInstructions(List<InstructionDefinition> instructions) {
        this.instructions = instructions;
    }

    public RuleDefinition getRule() {
        return rule;
    }

    public void setRule(RuleDefinition rule) {
        this.rule = rule;
    }
}
