package work.lcod.flowguard.policy;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import work.lcod.flowguard.catalog.CatalogEntry;

/**
 * Descriptive, human-readable step names derived from step kinds.
 */
public final class StepNames {
    private static final Pattern GENERIC = Pattern.compile("^node\\s*\\d+$", Pattern.CASE_INSENSITIVE);
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("(?<=[a-z0-9])(?=[A-Z])");
    public static final String FALLBACK = "Step";

    // exact local names
    private static final Map<String, String> KNOWN = new LinkedHashMap<>();
    // substrings of the lower-cased local name, first match wins
    private static final Map<String, String> HINTS = new LinkedHashMap<>();

    static {
        KNOWN.put("manualTrigger", "Manual Trigger");
        KNOWN.put("webhook", "Webhook Trigger");
        KNOWN.put("scheduleTrigger", "Schedule Trigger");
        KNOWN.put("googleSheets", "Google Sheets");
        KNOWN.put("gmail", "Gmail");
        KNOWN.put("slack", "Slack");
        KNOWN.put("httpRequest", "HTTP Request");
        KNOWN.put("set", "Set Data");
        KNOWN.put("code", "Code Execute");
        KNOWN.put("if", "Condition Check");
        KNOWN.put("function", "Function");
        KNOWN.put("merge", "Merge Data");
        KNOWN.put("filter", "Filter Data");
        KNOWN.put("lmChatOpenAi", "OpenAI Chat Model");
        KNOWN.put("lmChatAnthropic", "Anthropic Chat Model");
        KNOWN.put("agent", "AI Agent");

        HINTS.put("schedule", "Schedule Trigger");
        HINTS.put("webhook", "Webhook Trigger");
        HINTS.put("split", "Split Data");
        HINTS.put("transform", "Transform Data");
        HINTS.put("email", "Send Email");
        HINTS.put("file", "File Operation");
        HINTS.put("database", "Database Query");
        HINTS.put("memory", "Chat Memory");
        HINTS.put("tool", "AI Tool");
    }

    private final PortKindPolicy policy;

    public StepNames(PortKindPolicy policy) {
        this.policy = policy;
    }

    public static boolean isGeneric(String name) {
        return name != null && GENERIC.matcher(name.trim()).matches();
    }

    /**
     * Name for a step of the given kind: built-in table, then catalog display name, then
     * keyword hints, then the kind's local name split into words. Never returns a generic
     * placeholder name.
     */
    public String descriptiveName(String kind) {
        var name = lookupName(kind);
        return isGeneric(name) ? FALLBACK : name;
    }

    private String lookupName(String kind) {
        var local = PortKindPolicy.localName(kind);
        if (local.isBlank()) {
            return FALLBACK;
        }
        var known = KNOWN.get(local);
        if (known != null) {
            return known;
        }
        var display = policy.entry(kind).map(CatalogEntry::displayName).orElse("");
        if (!display.isBlank()) {
            return display;
        }
        var lowered = local.toLowerCase(Locale.ROOT);
        for (var hint : HINTS.entrySet()) {
            if (lowered.contains(hint.getKey())) {
                return hint.getValue();
            }
        }
        return titleCase(local);
    }

    /**
     * Returns {@code base} if unused, otherwise the first free {@code "base N"} with N from 2.
     */
    public static String uniquify(String base, Set<String> used) {
        if (!used.contains(base)) {
            return base;
        }
        int counter = 2;
        while (used.contains(base + " " + counter)) {
            counter++;
        }
        return base + " " + counter;
    }

    static String titleCase(String local) {
        var words = CAMEL_BOUNDARY.split(local.replace('_', ' ').replace('-', ' ').trim());
        var out = new StringBuilder();
        for (var word : words) {
            var trimmed = word.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (out.length() > 0) {
                out.append(' ');
            }
            out.append(Character.toUpperCase(trimmed.charAt(0))).append(trimmed.substring(1));
        }
        return out.length() == 0 ? FALLBACK : out.toString();
    }
}
