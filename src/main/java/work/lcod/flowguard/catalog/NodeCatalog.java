package work.lcod.flowguard.catalog;

import java.util.Optional;

/**
 * Read-only lookup of step-kind metadata. An absent entry means the kind is unknown and gets
 * no special policy.
 */
@FunctionalInterface
public interface NodeCatalog {
    Optional<CatalogEntry> lookup(String kind);

    static NodeCatalog empty() {
        return kind -> Optional.empty();
    }
}
