package com.jay.proforma.exception;

import java.util.List;

/**
 * Scenario inputs rejected before any projection ran. Carries every rule that failed,
 * not only the first one.
 */
public class ScenarioValidationException extends ProFormaException {

    private final List<String> failures;

    public ScenarioValidationException(List<String> failures) {
        super("Scenario validation failed: " + String.join("; ", failures));
        this.failures = List.copyOf(failures);
    }

    public ScenarioValidationException(String failure) {
        this(List.of(failure));
    }

    public List<String> getFailures() {
        return failures;
    }
}
