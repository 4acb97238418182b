package ai.compile.catalog;

/**
 * Thrown when a card catalog cannot be read or fails validation. The message names the offending
 * card or protocol.
 */
public class CatalogException extends RuntimeException {

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
