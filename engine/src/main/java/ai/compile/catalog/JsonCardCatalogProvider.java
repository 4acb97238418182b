package ai.compile.catalog;

import ai.compile.game.Card;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the catalog from a JSON classpath resource (by default {@code cards.json}).
 */
public class JsonCardCatalogProvider implements CardCatalogProvider {
    private static final Logger log = LoggerFactory.getLogger(JsonCardCatalogProvider.class);

    public static final String DEFAULT_RESOURCE = "cards.json";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final String resource;

    public JsonCardCatalogProvider() {
        this(DEFAULT_RESOURCE);
    }

    public JsonCardCatalogProvider(String resource) {
        this.resource = resource;
    }

    @Override
    public CardCatalog load() {
        try (InputStream in = JsonCardCatalogProvider.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new CatalogException("Catalog resource not found: " + resource);
            }
            CatalogDocument document = OBJECT_MAPPER.readValue(in, CatalogDocument.class);
            CardCatalog catalog = fromDocument(document);
            log.info("Loaded {} cards in {} protocols from {}", catalog.size(), catalog.protocols().size(), resource);
            return catalog;
        } catch (IOException e) {
            throw new CatalogException("Failed to read catalog " + resource + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parses catalog JSON held in memory.
     */
    public static CardCatalog fromJson(String json) {
        try {
            return fromDocument(OBJECT_MAPPER.readValue(json, CatalogDocument.class));
        } catch (JsonProcessingException e) {
            throw new CatalogException("Malformed catalog JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static CardCatalog fromDocument(CatalogDocument document) {
        List<Card> cards = CatalogMapper.toCards(document);
        return new CardCatalog(cards);
    }
}
