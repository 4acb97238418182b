package ai.compile.catalog;

/**
 * Source of the static card definitions.
 */
public interface CardCatalogProvider {

    /**
     * Loads and validates the catalog.
     *
     * @throws CatalogException when the definitions are unreadable or malformed
     */
    CardCatalog load();
}
