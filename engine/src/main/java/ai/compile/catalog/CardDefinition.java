package ai.compile.catalog;

import java.util.ArrayList;
import java.util.List;

/**
 * A printed card: value, the three text boxes and the parsed effects.
 */
public class CardDefinition {

    private int value;
    private String top = "";
    private String middle = "";
    private String bottom = "";
    private boolean ignoresProtocolMatching;
    private List<EffectDefinition> effects = new ArrayList<>();

    public CardDefinition() {
        // Default constructor for JSON binding.
    }

    public int getValue() {
        return value;
    }

    public void setValue(int value) {
        this.value = value;
    }

    public String getTop() {
        return top;
    }

    public void setTop(String top) {
        this.top = top;
    }

    public String getMiddle() {
        return middle;
    }

    public void setMiddle(String middle) {
        this.middle = middle;
    }

    public String getBottom() {
        return bottom;
    }

    public void setBottom(String bottom) {
        this.bottom = bottom;
    }

    public boolean isIgnoresProtocolMatching() {
        return ignoresProtocolMatching;
    }

    public void setIgnoresProtocolMatching(boolean ignoresProtocolMatching) {
        this.ignoresProtocolMatching = ignoresProtocolMatching;
    }

    public List<EffectDefinition> getEffects() {
        return effects;
    }

    public void setEffects(List<EffectDefinition> effects) {
        this.effects = effects;
    }
}
