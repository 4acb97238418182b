package ai.compile.catalog;

import java.util.ArrayList;
import java.util.List;

/**
 * One instruction as written in the catalog. Enum-valued fields are kept as strings here and
 * checked by {@link CatalogMapper}, so an unknown name is reported with the card it belongs to.
 */
public class InstructionDefinition {

    private String op;
    private int count = 1;
    private boolean optional;
    private boolean variable;
    private String actor;
    private FilterDefinition filter;
    private String condition;
    private String conditionProtocol;
    private String amount;
    private String scope;
    private String destination;
    private String whose;
    private int minCards;
    private String forbiddenProtocol;
    private List<OptionDefinition> options = new ArrayList<>();

    public InstructionDefinition() {
        // Default constructor for JSON binding.
    }

    public String getOp() {
        return op;
    }

    public void setOp(String op) {
        this.op = op;
    }

    public int getCount() {
        return count;
    }

    public void setCount(int count) {
        this.count = count;
    }

    public boolean isOptional() {
        return optional;
    }

    public void setOptional(boolean optional) {
        this.optional = optional;
    }

    public boolean isVariable() {
        return variable;
    }

    public void setVariable(boolean variable) {
        this.variable = variable;
    }

    public String getActor() {
        return actor;
    }

    public void setActor(String actor) {
        this.actor = actor;
    }

    public FilterDefinition getFilter() {
        return filter;
    }

    public void setFilter(FilterDefinition filter) {
        this.filter = filter;
    }

    public String getCondition() {
        return condition;
    }

    public void setCondition(String condition) {
        this.condition = condition;
    }

    public String getConditionProtocol() {
        return conditionProtocol;
    }

    public void setConditionProtocol(String conditionProtocol) {
        this.conditionProtocol = conditionProtocol;
    }

    public String getAmount() {
        return amount;
    }

    public void setAmount(String amount) {
        this.amount = amount;
    }

    public String getScope() {
        return scope;
    }

    public void setScope(String scope) {
        this.scope = scope;
    }

    public String getDestination() {
        return destination;
    }

    public void setDestination(String destination) {
        this.destination = destination;
    }

    public String getWhose() {
        return whose;
    }

    public void setWhose(String whose) {
        this.whose = whose;
    }

    public int getMinCards() {
        return minCards;
    }

    public void setMinCards(int minCards) {
        this.minCards = minCards;
    }

    public String getForbiddenProtocol() {
        return forbiddenProtocol;
    }

    public void setForbiddenProtocol(String forbiddenProtocol) {
        this.forbiddenProtocol = forbiddenProtocol;
    }

    public List<OptionDefinition> getOptions() {
        return options;
    }

    public void setOptions(List<OptionDefinition> options) {
        this.options = options;
    }
}
