package ai.compile.catalog;

/**
 * Target filter fields; every field is optional and defaults to the printed rule "any uncovered card".
 */
public class FilterDefinition {

    private String owner;
    private String face;
    private String position;
    private boolean excludeSelf;
    private Integer minValue;
    private Integer maxValue;
    private String lane;
    private String protocolMatch;

    public FilterDefinition() {
        // Default constructor for JSON binding.
    }

    public String getOwner() {
        return owner;
    }

    public void setOwner(String owner) {
        this.owner = owner;
    }

    public String getFace() {
        return face;
    }

    public void setFace(String face) {
        this.face = face;
    }

    public String getPosition() {
        return position;
    }

    public void setPosition(String position) {
        this.position = position;
    }

    public boolean isExcludeSelf() {
        return excludeSelf;
    }

    public void setExcludeSelf(boolean excludeSelf) {
        this.excludeSelf = excludeSelf;
    }

    public Integer getMinValue() {
        return minValue;
    }

    public void setMinValue(Integer minValue) {
        this.minValue = minValue;
    }

    public Integer getMaxValue() {
        return maxValue;
    }

    public void setMaxValue(Integer maxValue) {
        this.maxValue = maxValue;
    }

    public String getLane() {
        return lane;
    }

    public void setLane(String lane) {
        this.lane = lane;
    }

    public String getProtocolMatch() {
        return protocolMatch;
    }

    public void setProtocolMatch(String protocolMatch) {
        this.protocolMatch = protocolMatch;
    }
}
