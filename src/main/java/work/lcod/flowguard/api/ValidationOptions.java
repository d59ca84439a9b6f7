package work.lcod.flowguard.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable settings for one {@link FlowValidator}.
 *
 * @param autofix run the repair pipeline and re-validate the repaired copy
 * @param placeholderCredentials attach placeholder credentials to steps that need them
 * @param disabledPasses ids of repair passes to skip
 * @param modelDenyList model-name substrings removed from model steps (case-insensitive)
 * @param modelParameterKeys parameter keys scanned for model names
 */
public record ValidationOptions(
    boolean autofix,
    boolean placeholderCredentials,
    Set<String> disabledPasses,
    List<String> modelDenyList,
    List<String> modelParameterKeys
) {
    public static final List<String> DEFAULT_MODEL_DENY_LIST = List.of(
        "gpt-4", "gpt-3.5", "gpt-4-turbo", "gpt-4o",
        "claude-3", "claude-2", "claude-instant", "claude-3-5-sonnet", "claude-3-opus", "claude-3-sonnet", "claude-3-haiku",
        "gemini", "palm", "llama", "mistral", "mixtral"
    );
    public static final List<String> DEFAULT_MODEL_PARAMETER_KEYS = List.of("model", "modelName");

    public ValidationOptions {
        disabledPasses = Set.copyOf(Objects.requireNonNull(disabledPasses, "disabledPasses"));
        modelDenyList = List.copyOf(Objects.requireNonNull(modelDenyList, "modelDenyList"));
        modelParameterKeys = List.copyOf(Objects.requireNonNull(modelParameterKeys, "modelParameterKeys"));
    }

    public static ValidationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isPassEnabled(String passId) {
        return !disabledPasses.contains(passId);
    }

    public Builder toBuilder() {
        return new Builder()
            .autofix(autofix)
            .placeholderCredentials(placeholderCredentials)
            .disabledPasses(disabledPasses)
            .modelDenyList(modelDenyList)
            .modelParameterKeys(modelParameterKeys);
    }

    public static final class Builder {
        private boolean autofix = true;
        private boolean placeholderCredentials;
        private final Set<String> disabledPasses = new LinkedHashSet<>();
        private List<String> modelDenyList = DEFAULT_MODEL_DENY_LIST;
        private List<String> modelParameterKeys = DEFAULT_MODEL_PARAMETER_KEYS;

        public Builder autofix(boolean autofix) {
            this.autofix = autofix;
            return this;
        }

        public Builder placeholderCredentials(boolean placeholderCredentials) {
            this.placeholderCredentials = placeholderCredentials;
            return this;
        }

        public Builder disablePass(String passId) {
            this.disabledPasses.add(passId);
            return this;
        }

        public Builder disabledPasses(Set<String> passIds) {
            this.disabledPasses.clear();
            this.disabledPasses.addAll(passIds);
            return this;
        }

        public Builder modelDenyList(List<String> modelDenyList) {
            this.modelDenyList = new ArrayList<>(modelDenyList);
            return this;
        }

        public Builder modelParameterKeys(List<String> modelParameterKeys) {
            this.modelParameterKeys = new ArrayList<>(modelParameterKeys);
            return this;
        }

        public ValidationOptions build() {
            return new ValidationOptions(
                autofix,
                placeholderCredentials,
                disabledPasses,
                modelDenyList,
                modelParameterKeys
            );
        }
    }
}
