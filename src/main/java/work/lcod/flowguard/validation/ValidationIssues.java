package work.lcod.flowguard.validation;

import java.util.List;

/**
 * Errors make a graph invalid; warnings are advisory.
 */
public record ValidationIssues(List<String> errors, List<String> warnings) {
    public ValidationIssues {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public static ValidationIssues fatal(String message) {
        return new ValidationIssues(List.of(message), List.of());
    }
}
