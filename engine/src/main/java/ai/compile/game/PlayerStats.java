package ai.compile.game;

/**
 * Per-game counters for one side. Mutable; copied with the owning {@link PlayerState}.
 */
public final class PlayerStats {
    private int cardsPlayed;
    private int cardsDiscarded;
    private int cardsDeleted;
    private int cardsFlipped;
    private int cardsShifted;
    private int cardsReturned;
    private int cardsDrawn;
    private int handsRefreshed;
    private int compiles;

    public PlayerStats copy() {
        PlayerStats c = new PlayerStats();
        c.cardsPlayed = cardsPlayed;
        c.cardsDiscarded = cardsDiscarded;
        c.cardsDeleted = cardsDeleted;
        c.cardsFlipped = cardsFlipped;
        c.cardsShifted = cardsShifted;
        c.cardsReturned = cardsReturned;
        c.cardsDrawn = cardsDrawn;
        c.handsRefreshed = handsRefreshed;
        c.compiles = compiles;
        return c;
    }

    public int getCardsPlayed() {
        return cardsPlayed;
    }

    public int getCardsDiscarded() {
        return cardsDiscarded;
    }

    public int getCardsDeleted() {
        return cardsDeleted;
    }

    public int getCardsFlipped() {
        return cardsFlipped;
    }

    public int getCardsShifted() {
        return cardsShifted;
    }

    public int getCardsReturned() {
        return cardsReturned;
    }

    public int getCardsDrawn() {
        return cardsDrawn;
    }

    public int getHandsRefreshed() {
        return handsRefreshed;
    }

    public int getCompiles() {
        return compiles;
    }

    void addPlayed() {
        cardsPlayed++;
    }

    void addDiscarded(int n) {
        cardsDiscarded += n;
    }

    void addDeleted(int n) {
        cardsDeleted += n;
    }

    void addFlipped() {
        cardsFlipped++;
    }

    void addShifted() {
        cardsShifted++;
    }

    void addReturned(int n) {
        cardsReturned += n;
    }

    void addDrawn(int n) {
        cardsDrawn += n;
    }

    void addRefresh() {
        handsRefreshed++;
    }

    void addCompile() {
        compiles++;
    }

    @Override
    public String toString() {
        return "played=" + cardsPlayed
                + " discarded=" + cardsDiscarded
                + " deleted=" + cardsDeleted
                + " flipped=" + cardsFlipped
                + " shifted=" + cardsShifted
                + " returned=" + cardsReturned
                + " drawn=" + cardsDrawn
                + " refreshed=" + handsRefreshed
                + " compiles=" + compiles;
    }
}
