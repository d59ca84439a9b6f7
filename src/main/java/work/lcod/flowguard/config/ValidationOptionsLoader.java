package work.lcod.flowguard.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;
import work.lcod.flowguard.api.ValidationOptions;

/**
 * Reads {@link ValidationOptions} from {@code flowguard.toml}:
 *
 * <pre>
 * [repair]
 * enabled = true
 * placeholderCredentials = false
 * disabledPasses = ["prune-fanout"]
 *
 * [repair.models]
 * denyList = ["gpt-4", "claude-3"]
 * parameterKeys = ["model", "modelName"]
 * </pre>
 *
 * Keys that are absent keep the value of the base options.
 */
public final class ValidationOptionsLoader {
    public static final String DEFAULT_FILE_NAME = "flowguard.toml";

    private ValidationOptionsLoader() {}

    /**
     * {@code flowguard.toml} in the given directory, if present.
     */
    public static Optional<Path> discover(Path directory) {
        if (directory == null) {
            return Optional.empty();
        }
        var candidate = directory.resolve(DEFAULT_FILE_NAME);
        return Files.isRegularFile(candidate) ? Optional.of(candidate) : Optional.empty();
    }

    public static ValidationOptions load(Path path) {
        return load(path, ValidationOptions.defaults());
    }

    public static ValidationOptions load(Path path, ValidationOptions base) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Configuration file not found: " + path);
        }
        try {
            return fromToml(Toml.parse(Files.readString(path)), base, path.toString());
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read configuration " + path + ": " + ex.getMessage(), ex);
        }
    }

    public static ValidationOptions parse(String toml, ValidationOptions base) {
        return fromToml(Toml.parse(toml == null ? "" : toml), base, "<inline>");
    }

    static ValidationOptions fromToml(TomlParseResult result, ValidationOptions base, String origin) {
        if (result.hasErrors()) {
            var problems = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid configuration " + origin + ": " + problems);
        }
        var builder = base.toBuilder();
        try {
            var enabled = result.getBoolean("repair.enabled");
            if (enabled != null) {
                builder.autofix(enabled);
            }
            var placeholders = result.getBoolean("repair.placeholderCredentials");
            if (placeholders != null) {
                builder.placeholderCredentials(placeholders);
            }
            readStrings(result.getArray("repair.disabledPasses"), origin, "repair.disabledPasses")
                .ifPresent(ids -> builder.disabledPasses(new LinkedHashSet<>(ids)));
            readStrings(result.getArray("repair.models.denyList"), origin, "repair.models.denyList")
                .ifPresent(builder::modelDenyList);
            readStrings(result.getArray("repair.models.parameterKeys"), origin, "repair.models.parameterKeys")
                .ifPresent(builder::modelParameterKeys);
        } catch (TomlInvalidTypeException ex) {
            throw new IllegalArgumentException("Invalid configuration " + origin + ": " + ex.getMessage(), ex);
        }
        return builder.build();
    }

    private static Optional<List<String>> readStrings(TomlArray array, String origin, String key) {
        if (array == null) {
            return Optional.empty();
        }
        var values = new ArrayList<String>();
        for (int i = 0; i < array.size(); i++) {
            var value = array.get(i);
            if (!(value instanceof String text)) {
                throw new IllegalArgumentException("Invalid configuration " + origin + ": " + key + " must contain strings only");
            }
            values.add(text.trim());
        }
        return Optional.of(values);
    }
}
