package ai.compile.game;

/**
 * Where a card identity currently lives.
 *
 * @param side      owner of the container
 * @param zone      which container
 * @param laneIndex lane index for {@link Zone#LANE}, otherwise -1
 * @param index     position inside the container (bottom-to-top for lanes)
 */
public record CardLocation(Side side, Zone zone, int laneIndex, int index) {

    public enum Zone {
        HAND,
        DECK,
        DISCARD,
        LANE
    }

    public boolean onBoard() {
        return zone == Zone.LANE;
    }
}
