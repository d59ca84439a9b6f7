package work.lcod.flowguard.repair;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import work.lcod.flowguard.policy.StepRole;

/**
 * Deletes hard-coded model identifiers from language-model steps. Model choice belongs to
 * the runtime configuration; an {@code options} map is left in place of removed keys.
 */
final class StripModelLiteralsPass implements RepairPass {
    static final String ID = "strip-model-literals";
    static final String OPTIONS_KEY = "options";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<String> apply(RepairContext context) {
        var denyList = new ArrayList<String>();
        for (var entry : context.options().modelDenyList()) {
            if (entry != null && !entry.isBlank()) {
                denyList.add(entry.toLowerCase(Locale.ROOT));
            }
        }
        var fixes = new ArrayList<String>();
        for (var step : context.stepsWithRole(StepRole.LANGUAGE_MODEL)) {
            var parameters = step.parameters();
            if (parameters == null) {
                continue;
            }
            boolean removed = false;
            for (var key : context.options().modelParameterKeys()) {
                var literal = modelLiteral(parameters.get(key));
                if (literal != null && matches(literal, denyList)) {
                    parameters.remove(key);
                    removed = true;
                    fixes.add("Removed hard-coded model \"" + literal + "\" (" + key + ") from step " + context.label(step));
                }
            }
            if (removed && !(parameters.get(OPTIONS_KEY) instanceof Map<?, ?>)) {
                parameters.put(OPTIONS_KEY, new LinkedHashMap<String, Object>());
            }
        }
        return fixes;
    }

    // plain strings and resource-locator maps ({"__rl": true, "value": "gpt-4o", ...})
    private static String modelLiteral(Object value) {
        if (value instanceof String text) {
            return text;
        }
        if (value instanceof Map<?, ?> map && map.get("value") instanceof String text) {
            return text;
        }
        return null;
    }

    private static boolean matches(String literal, List<String> denyList) {
        var lowered = literal.toLowerCase(Locale.ROOT);
        for (var entry : denyList) {
            if (lowered.contains(entry)) {
                return true;
            }
        }
        return false;
    }
}
