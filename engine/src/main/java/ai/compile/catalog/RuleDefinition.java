package ai.compile.catalog;

/**
 * Passive rule parameters. Target and scope default to the card owner's opponent and the card's line.
 */
public class RuleDefinition {

    private String type;
    private String target = "OPPONENT";
    private String scope = "THIS_LANE";
    private int value;

    public RuleDefinition() {
        // Default constructor for JSON binding.
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getTarget() {
        return target;
    }

    public void setTarget(String target) {
        this.target = target;
    }

    public String getScope() {
        return scope;
    }

    public void setScope(String scope) {
        this.scope = scope;
    }

    public int getValue() {
        return value;
    }

    public void setValue(int value) {
        this.value = value;
    }
}
