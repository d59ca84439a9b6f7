package work.lcod.flowguard.policy;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Placeholder credential references the execution engine recognises as "to be configured".
 */
public final class CredentialPlaceholders {
    private CredentialPlaceholders() {}

    /**
     * {@code {credentialKind: {id: "placeholder-<credentialKind>", name: "<display> account"}}}
     * for kinds whose catalog entry requires credentials.
     */
    public static Optional<Map<String, Object>> forKind(String kind, PortKindPolicy policy, StepNames names) {
        var entry = policy.entry(kind);
        if (entry.isEmpty() || !entry.get().requiresCredentials() || entry.get().credentialKind().isBlank()) {
            return Optional.empty();
        }
        var credentialKind = entry.get().credentialKind();
        var displayName = entry.get().displayName().isBlank() ? names.descriptiveName(kind) : entry.get().displayName();
        var reference = new LinkedHashMap<String, Object>();
        reference.put("id", "placeholder-" + credentialKind);
        reference.put("name", displayName + " account");
        var credentials = new LinkedHashMap<String, Object>();
        credentials.put(credentialKind, reference);
        return Optional.of(credentials);
    }
}
