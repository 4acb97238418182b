package ai.compile.catalog;

import ai.compile.game.Card;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only lookup of every card, grouped by protocol.
 */
public final class CardCatalog {
    private final Map<String, List<Card>> byProtocol;

    public CardCatalog(Collection<Card> cards) {
        Map<String, List<Card>> grouped = new LinkedHashMap<>();
        for (Card card : cards) {
            List<Card> protocol = grouped.computeIfAbsent(card.getProtocol(), k -> new ArrayList<>());
            if (protocol.contains(card)) {
                throw new CatalogException("Duplicate card " + card.name());
            }
            protocol.add(card);
        }
        Map<String, List<Card>> sorted = new LinkedHashMap<>();
        for (Map.Entry<String, List<Card>> entry : grouped.entrySet()) {
            List<Card> list = new ArrayList<>(entry.getValue());
            list.sort(Comparator.comparingInt(Card::getValue));
            sorted.put(entry.getKey(), Collections.unmodifiableList(list));
        }
        this.byProtocol = Collections.unmodifiableMap(sorted);
    }

    /**
     * Protocol names in catalog order.
     */
    public Set<String> protocols() {
        return byProtocol.keySet();
    }

    public boolean hasProtocol(String protocol) {
        return byProtocol.containsKey(protocol);
    }

    /**
     * Cards of one protocol, lowest value first.
     *
     * @throws IllegalArgumentException for an unknown protocol
     */
    public List<Card> cardsOf(String protocol) {
        List<Card> cards = byProtocol.get(protocol);
        if (cards == null) {
            throw new IllegalArgumentException("Unknown protocol " + protocol);
        }
        return cards;
    }

    public Card get(String protocol, int value) {
        for (Card card : cardsOf(protocol)) {
            if (card.getValue() == value) {
                return card;
            }
        }
        throw new IllegalArgumentException("No card " + protocol + "-" + value);
    }

    /**
     * Looks a card up by its short name, e.g. "Speed-0".
     */
    public Card get(String name) {
        int dash = name.lastIndexOf('-');
        if (dash <= 0) {
            throw new IllegalArgumentException("Not a card name: " + name);
        }
        return get(name.substring(0, dash), Integer.parseInt(name.substring(dash + 1)));
    }

    public int size() {
        int size = 0;
        for (List<Card> cards : byProtocol.values()) {
            size += cards.size();
        }
        return size;
    }
}
