package ai.compile.game;

import ai.compile.catalog.CardCatalog;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fluent builder for mid-game {@link GameState}s in tests.
 *
 * <p>Lives in the {@code game} package so it can seed the package-private containers of
 * {@link PlayerState} directly instead of replaying a whole match to reach a position.
 *
 * <p><strong>How to use</strong>
 * <pre>{@code
 * GameState state = GameStateBuilder
 *     .newGame(catalog)
 *     .protocols(Side.PLAYER, "Speed", "Life", "Water")
 *     .faceUp(Side.PLAYER, 0, "Speed-5")
 *     .faceDown(Side.PLAYER, 0, "Life-4")
 *     .hand(Side.PLAYER, "Water-5", "Speed-2")
 *     .deck(Side.PLAYER, "Life-0", "Life-1")
 *     .turn(Side.PLAYER)
 *     .build();
 * }
 * </pre>
 *
 * <p><strong>Ordering conventions</strong>
 * <ul>
 *   <li>lanes are bottom-to-top: the last card named is the uncovered one;</li>
 *   <li>{@link #deck(Side, String...)} is top-first: the first card named is drawn first.</li>
 * </ul>
 * Cards get their usual ids ({@code player-Speed-0}). Naming the same card twice for one side fails
 * in {@link #build()}. Unlike a real deal, the builder does not require all 18 cards to be placed.
 */
public final class GameStateBuilder {

    private final CardCatalog catalog;
    private final Map<Side, List<String>> protocols = new EnumMap<>(Side.class);
    private final Map<Side, List<List<Slot>>> lanes = new EnumMap<>(Side.class);
    private final Map<Side, List<String>> hands = new EnumMap<>(Side.class);
    private final Map<Side, List<String>> decks = new EnumMap<>(Side.class);
    private final Map<Side, List<String>> discards = new EnumMap<>(Side.class);
    private final Map<Side, Set<Integer>> compiled = new EnumMap<>(Side.class);
    private Side turn = Side.PLAYER;
    private Phase phase = Phase.ACTION;
    private boolean useControl;
    private Side controlHolder;
    private long seed = 42L;

    private GameStateBuilder(CardCatalog catalog) {
        this.catalog = catalog;
        protocols.put(Side.PLAYER, List.of("Speed", "Life", "Water"));
        protocols.put(Side.OPPONENT, List.of("Metal", "Death", "Hate"));
        for (Side side : Side.values()) {
            List<List<Slot>> sideLanes = new ArrayList<>();
            for (int i = 0; i < PlayerState.LANES; i++) {
                sideLanes.add(new ArrayList<>());
            }
            lanes.put(side, sideLanes);
            hands.put(side, new ArrayList<>());
            decks.put(side, new ArrayList<>());
            discards.put(side, new ArrayList<>());
            compiled.put(side, new HashSet<>());
        }
    }

    public static GameStateBuilder newGame(CardCatalog catalog) {
        return new GameStateBuilder(catalog);
    }

    public GameStateBuilder protocols(Side side, String... names) {
        protocols.put(side, List.of(names));
        return this;
    }

    public GameStateBuilder faceUp(Side side, int lane, String... cards) {
        for (String card : cards) {
            lanes.get(side).get(lane).add(new Slot(card, true));
        }
        return this;
    }

    public GameStateBuilder faceDown(Side side, int lane, String... cards) {
        for (String card : cards) {
            lanes.get(side).get(lane).add(new Slot(card, false));
        }
        return this;
    }

    public GameStateBuilder hand(Side side, String... cards) {
        hands.get(side).addAll(List.of(cards));
        return this;
    }

    public GameStateBuilder deck(Side side, String... cards) {
        decks.get(side).addAll(List.of(cards));
        return this;
    }

    public GameStateBuilder discard(Side side, String... cards) {
        discards.get(side).addAll(List.of(cards));
        return this;
    }

    public GameStateBuilder compiled(Side side, int lane) {
        compiled.get(side).add(lane);
        return this;
    }

    public GameStateBuilder turn(Side side) {
        this.turn = side;
        return this;
    }

    /**
     * Phase the built state sits in; {@link Phase#ACTION} unless set.
     */
    public GameStateBuilder phase(Phase phase) {
        this.phase = phase;
        return this;
    }

    public GameStateBuilder control(boolean useControl) {
        this.useControl = useControl;
        return this;
    }

    public GameStateBuilder controlHolder(Side side) {
        this.useControl = true;
        this.controlHolder = side;
        return this;
    }

    public GameStateBuilder seed(long seed) {
        this.seed = seed;
        return this;
    }

    public GameState build() {
        PlayerState player = side(Side.PLAYER);
        PlayerState opponent = side(Side.OPPONENT);
        GameState state = new GameState(player, opponent, turn, useControl, seed);
        state.setPhase(phase);
        state.setControlCardHolder(controlHolder);
        state.recalculateLaneValues();
        return state;
    }

    private PlayerState side(Side side) {
        PlayerState ps = new PlayerState(protocols.get(side));
        Set<String> used = new HashSet<>();
        for (int lane = 0; lane < PlayerState.LANES; lane++) {
            for (Slot slot : lanes.get(side).get(lane)) {
                ps.lanes.get(lane).add(card(side, slot.name, slot.faceUp, used));
            }
        }
        for (String name : hands.get(side)) {
            ps.hand.add(card(side, name, true, used));
        }
        for (String name : decks.get(side)) {
            ps.deck.add(card(side, name, false, used));
        }
        for (String name : discards.get(side)) {
            ps.discard.add(card(side, name, false, used));
        }
        for (int lane : compiled.get(side)) {
            ps.compiled[lane] = true;
        }
        return ps;
    }

    private PlayedCard card(Side side, String name, boolean faceUp, Set<String> used) {
        Card card = catalog.get(name);
        String id = Deck.idFor(side, card);
        if (!used.add(id)) {
            throw new IllegalStateException("Card " + id + " placed twice");
        }
        return new PlayedCard(id, card, faceUp, false);
    }

    private static final class Slot {
        private final String name;
        private final boolean faceUp;

        private Slot(String name, boolean faceUp) {
            this.name = name;
            this.faceUp = faceUp;
        }
    }
}
