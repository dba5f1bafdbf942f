package io.segmentlite.segment.validation;

import java.util.List;
import java.util.Objects;

/**
 * The outcome of validating a segment definition.
 * Only errors block persistence; warnings are advisory.
 */
public record ValidationResult(
        List<ValidationIssue> errors,
        List<ValidationIssue> warnings) {

    public ValidationResult {
        Objects.requireNonNull(errors, "Errors cannot be null");
        Objects.requireNonNull(warnings, "Warnings cannot be null");
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public boolean ok() {
        return errors.isEmpty();
    }

    /**
     * @return true if some error is reported at exactly this path
     */
    public boolean hasErrorAt(String path) {
        return errors.stream().anyMatch(e -> e.path().equals(path));
    }

    public List<String> errorMessages() {
        return errors.stream().map(ValidationIssue::toString).toList();
    }

    @Override
    public String toString() {
        if (ok()) {
            return "ValidationResult(ok, " + warnings.size() + " warning(s))";
        }
        return "ValidationResult(" + String.join("; ", errorMessages()) + ")";
    }
}
