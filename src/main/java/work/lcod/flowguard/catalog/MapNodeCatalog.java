package work.lcod.flowguard.catalog;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable catalog backed by a kind-keyed map.
 */
public final class MapNodeCatalog implements NodeCatalog {
    private final Map<String, CatalogEntry> entries;

    public MapNodeCatalog(Collection<CatalogEntry> entries) {
        var byKind = new LinkedHashMap<String, CatalogEntry>();
        if (entries != null) {
            for (var entry : entries) {
                byKind.put(entry.kind(), entry);
            }
        }
        this.entries = Collections.unmodifiableMap(byKind);
    }

    @Override
    public Optional<CatalogEntry> lookup(String kind) {
        if (kind == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(kind));
    }

    public int size() {
        return entries.size();
    }

    public Map<String, CatalogEntry> entries() {
        return entries;
    }

    /**
     * Layers {@code overrides} on top of this catalog; entries with the same kind are replaced.
     */
    public MapNodeCatalog merge(MapNodeCatalog overrides) {
        var merged = new LinkedHashMap<>(entries);
        merged.putAll(overrides.entries);
        return new MapNodeCatalog(merged.values());
    }
}
