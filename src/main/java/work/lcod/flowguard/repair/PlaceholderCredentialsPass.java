package work.lcod.flowguard.repair;

import java.util.ArrayList;
import java.util.List;
import work.lcod.flowguard.api.ValidationOptions;
import work.lcod.flowguard.policy.CredentialPlaceholders;

/**
 * Attaches a placeholder credential reference to steps whose catalog entry requires
 * credentials and that carry none. Runs only when enabled in the options.
 */
final class PlaceholderCredentialsPass implements RepairPass {
    static final String ID = "placeholder-credentials";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean enabledBy(ValidationOptions options) {
        return options.placeholderCredentials() && options.isPassEnabled(ID);
    }

    @Override
    public List<String> apply(RepairContext context) {
        var fixes = new ArrayList<String>();
        for (var step : context.graph().steps()) {
            if (step.credentials() != null && !step.credentials().isEmpty()) {
                continue;
            }
            var placeholder = CredentialPlaceholders.forKind(step.kind(), context.policy(), context.names());
            if (placeholder.isEmpty()) {
                continue;
            }
            step.setCredentials(placeholder.get());
            fixes.add("Added placeholder " + placeholder.get().keySet() + " credentials to step " + context.label(step));
        }
        return fixes;
    }
}
