package com.example.usagemeter.model;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of event validation. Lists every violated rule, not only the first.
 */
public class ValidationResult {

    private final List<String> errors;

    public ValidationResult(List<String> errors) {
        this.errors = errors == null ? Collections.emptyList() : List.copyOf(errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<String> getErrors() {
        return errors;
    }
}
