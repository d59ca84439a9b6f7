package work.lcod.flowguard.catalog;

import java.util.Objects;
import java.util.Optional;

/**
 * Descriptive metadata for one step kind.
 *
 * @param kind step kind the entry describes
 * @param displayName human-readable name used for generated step names
 * @param requiresCredentials whether the step needs credentials to run
 * @param credentialKind credential type key used in a step's {@code credentials} map
 * @param toolEquivalent kind that exposes the same service as an agent tool
 * @param role explicit structural role ({@code trigger}, {@code agent}, {@code tool}, ...)
 */
public record CatalogEntry(
    String kind,
    String displayName,
    boolean requiresCredentials,
    String credentialKind,
    Optional<String> toolEquivalent,
    Optional<String> role
) {
    public CatalogEntry {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(toolEquivalent, "toolEquivalent");
        Objects.requireNonNull(role, "role");
        displayName = displayName == null ? "" : displayName;
        credentialKind = credentialKind == null ? "" : credentialKind;
    }

    public static CatalogEntry of(String kind, String displayName) {
        return new CatalogEntry(kind, displayName, false, "", Optional.empty(), Optional.empty());
    }

    public CatalogEntry withToolEquivalent(String equivalent) {
        return new CatalogEntry(kind, displayName, requiresCredentials, credentialKind, Optional.ofNullable(equivalent), role);
    }

    public CatalogEntry withCredentials(String credentialType) {
        return new CatalogEntry(kind, displayName, true, credentialType, toolEquivalent, role);
    }

    public CatalogEntry withRole(String roleName) {
        return new CatalogEntry(kind, displayName, requiresCredentials, credentialKind, toolEquivalent, Optional.ofNullable(roleName));
    }
}
