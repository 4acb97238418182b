package ai.compile.game;

import ai.compile.effects.Effect;
import ai.compile.effects.EffectBox;
import ai.compile.effects.Instruction;
import ai.compile.effects.Keyword;
import ai.compile.effects.Trigger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A catalog entry: one printed card of a protocol.
 * <p>
 * Cards are immutable and shared by every {@link PlayedCard} that represents a physical copy in a
 * game. Two cards are equal when protocol and value match; the catalog guarantees that pair is
 * unique.
 * <p>
 * Keyword flags are not read from the catalog; they are derived from the operations of the card's
 * instructions when the card is constructed, so a card can never advertise a keyword its effects do
 * not perform.
 */
public class Card {
    /** Protocol name, e.g. "Speed". */
    private final String protocol;
    /** Printed value; also the card's points while face-up. */
    private final int value;
    private final String top;
    private final String middle;
    private final String bottom;
    private final List<Effect> effects;
    private final Set<Keyword> keywords;
    /** "This card can be played without matching protocols." */
    private final boolean ignoresProtocolMatching;

    /**
     * Constructs a card.
     *
     * @param protocol               protocol name (must not be null)
     * @param value                  printed value, non-negative
     * @param top                    top box text, empty when blank
     * @param middle                 middle box text, empty when blank
     * @param bottom                 bottom box text, empty when blank
     * @param effects                parsed effects in print order
     * @param ignoresProtocolMatching whether this card may be played face-up into any line
     */
    public Card(String protocol, int value, String top, String middle, String bottom,
                List<Effect> effects, boolean ignoresProtocolMatching) {
        this.protocol = Objects.requireNonNull(protocol, "protocol");
        if (value < 0) {
            throw new IllegalArgumentException("Card value must be non-negative: " + protocol + "-" + value);
        }
        this.value = value;
        this.top = top == null ? "" : top;
        this.middle = middle == null ? "" : middle;
        this.bottom = bottom == null ? "" : bottom;
        this.effects = Collections.unmodifiableList(new ArrayList<>(effects));
        this.ignoresProtocolMatching = ignoresProtocolMatching;
        this.keywords = Collections.unmodifiableSet(deriveKeywords(this.effects));
    }

    private static Set<Keyword> deriveKeywords(List<Effect> effects) {
        EnumSet<Keyword> found = EnumSet.noneOf(Keyword.class);
        for (Effect effect : effects) {
            collect(effect.instructions(), found);
        }
        return found;
    }

    private static void collect(List<Instruction> instructions, EnumSet<Keyword> found) {
        for (Instruction instruction : instructions) {
            if (instruction.op().keyword() != null) {
                found.add(instruction.op().keyword());
            }
            for (List<Instruction> option : instruction.options()) {
                collect(option, found);
            }
        }
    }

    public String getProtocol() {
        return protocol;
    }

    public int getValue() {
        return value;
    }

    public String getTop() {
        return top;
    }

    public String getMiddle() {
        return middle;
    }

    public String getBottom() {
        return bottom;
    }

    public List<Effect> getEffects() {
        return effects;
    }

    public Set<Keyword> getKeywords() {
        return keywords;
    }

    public boolean hasKeyword(Keyword keyword) {
        return keywords.contains(keyword);
    }

    public boolean ignoresProtocolMatching() {
        return ignoresProtocolMatching;
    }

    /**
     * Returns the effects with the given trigger, in print order.
     */
    public List<Effect> effectsFor(Trigger trigger) {
        List<Effect> matching = new ArrayList<>();
        for (Effect effect : effects) {
            if (effect.trigger() == trigger) {
                matching.add(effect);
            }
        }
        return matching;
    }

    public boolean hasTrigger(Trigger trigger) {
        for (Effect effect : effects) {
            if (effect.trigger() == trigger) {
                return true;
            }
        }
        return false;
    }

    /**
     * True when the top box carries any effect; such cards stay relevant while covered.
     */
    public boolean hasTopBoxEffect() {
        for (Effect effect : effects) {
            if (effect.box() == EffectBox.TOP) {
                return true;
            }
        }
        return false;
    }

    /**
     * Canonical short name, e.g. "Speed-0".
     */
    public String name() {
        return protocol + "-" + value;
    }

    @Override
    public String toString() {
        return name();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Card)) {
            return false;
        }
        Card card = (Card) o;
        return value == card.value && protocol.equals(card.protocol);
    }

    @Override
    public int hashCode() {
        return Objects.hash(protocol, value);
    }
}
