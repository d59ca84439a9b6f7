package work.lcod.flowguard.catalog;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Reads node catalogs from TOML documents of the form:
 *
 * <pre>
 * [kinds."n8n-nodes-base.gmail"]
 * displayName = "Gmail"
 * requiresCredentials = true
 * credentialKind = "gmailOAuth2"
 * toolEquivalent = "n8n-nodes-base.gmailTool"
 * role = "regular"
 * </pre>
 */
public final class NodeCatalogLoader {
    public static final String BUNDLED_RESOURCE = "/catalog/node-catalog.toml";

    private NodeCatalogLoader() {}

    /**
     * Catalog shipped with the library, parsed on first use and shared afterwards.
     */
    public static MapNodeCatalog bundled() {
        return BundledHolder.INSTANCE;
    }

    public static MapNodeCatalog load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Node catalog not found: " + path);
        }
        try {
            return fromToml(Toml.parse(Files.readString(path)), path.toString());
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read node catalog " + path + ": " + ex.getMessage(), ex);
        }
    }

    public static MapNodeCatalog parse(String toml) {
        return fromToml(Toml.parse(toml == null ? "" : toml), "<inline>");
    }

    static MapNodeCatalog fromToml(TomlParseResult result, String origin) {
        if (result.hasErrors()) {
            var problems = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid node catalog " + origin + ": " + problems);
        }
        var kinds = result.getTable("kinds");
        if (kinds == null || kinds.isEmpty()) {
            return new MapNodeCatalog(List.of());
        }
        var entries = new ArrayList<CatalogEntry>();
        for (var kind : kinds.keySet()) {
            var path = List.of(kind);
            if (!kinds.isTable(path)) {
                throw new IllegalArgumentException("Catalog entry \"" + kind + "\" in " + origin + " must be a table");
            }
            entries.add(readEntry(kind, kinds.getTable(path)));
        }
        return new MapNodeCatalog(entries);
    }

    private static CatalogEntry readEntry(String kind, TomlTable table) {
        return new CatalogEntry(
            kind,
            table.getString("displayName", () -> ""),
            table.getBoolean("requiresCredentials", () -> false),
            table.getString("credentialKind", () -> ""),
            optionalString(table, "toolEquivalent"),
            optionalString(table, "role")
        );
    }

    private static Optional<String> optionalString(TomlTable table, String key) {
        var value = table.getString(key);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.trim());
    }

    private static MapNodeCatalog loadBundled() {
        try (InputStream in = NodeCatalogLoader.class.getResourceAsStream(BUNDLED_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Bundled node catalog missing: " + BUNDLED_RESOURCE);
            }
            return fromToml(Toml.parse(in), BUNDLED_RESOURCE);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read bundled node catalog: " + ex.getMessage(), ex);
        }
    }

    private static final class BundledHolder {
        private static final MapNodeCatalog INSTANCE = loadBundled();
    }
}
