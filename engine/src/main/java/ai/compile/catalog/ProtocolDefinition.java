package ai.compile.catalog;

import java.util.ArrayList;
import java.util.List;

/**
 * One protocol and its six cards, as read from the catalog.
 */
public class ProtocolDefinition {

    private String name;
    private List<CardDefinition> cards = new ArrayList<>();

    public ProtocolDefinition() {
        // Default constructor for JSON binding.
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<CardDefinition> getCards() {
        return cards;
    }

    public void setCards(List<CardDefinition> cards) {
        this.cards = cards;
    }
}
