package ai.compile.catalog;

import java.util.ArrayList;
import java.util.List;

/**
 * One branch of a CHOICE instruction.
 */
public class OptionDefinition {

    private String label;
    private List<InstructionDefinition> steps = new ArrayList<>();

    public OptionDefinition() {
        // Default constructor for JSON binding.
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label;
    }

    public List<InstructionDefinition> getSteps() {
        return steps;
    }

    public void setSteps(List<InstructionDefinition> steps) {
        this.steps = steps;
    }
}
