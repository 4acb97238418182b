package ai.compile.catalog;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of the JSON card catalog.
 * <p>
 * Matches the shape of {@code cards.json}: a format version and one entry per protocol.
 */
public class CatalogDocument {

    /** Instruction format version; the loader rejects anything other than {@link #SUPPORTED_VERSION}. */
    public static final int SUPPORTED_VERSION = 1;

    private int version;
    private List<ProtocolDefinition> protocols = new ArrayList<>();

    public CatalogDocument() {
        // Default constructor for JSON binding.
    }

    public int getVersion() {
        return version;
    }

    public void setVersion(int version) {
        this.version = version;
    }

    public List<ProtocolDefinition> getProtocols() {
        return protocols;
    }

    public void setProtocols(List<ProtocolDefinition> protocols) {
        this.protocols = protocols;
    }
}
