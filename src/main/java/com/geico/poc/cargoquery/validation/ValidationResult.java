package com.geico.poc.cargoquery.validation;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of query parameter validation
 */
public class ValidationResult {
    private final List<String> errors = new ArrayList<>();

    public void addError(String error) {
        if (!errors.contains(error)) {
            errors.add(error);
        }
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public List<String> getErrors() {
        return errors;
    }

    public boolean isValid() {
        return !hasErrors();
    }

    /**
     * All errors, one per line; null when valid
     */
    public String getErrorMessage() {
        if (!hasErrors()) {
            return null;
        }
        if (errors.size() == 1) {
            return errors.get(0);
        }
        StringBuilder sb = new StringBuilder();
        for (String error : errors) {
            if (sb.length() > 0) {
                sb.append("\n");
            }
            sb.append(error);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return hasErrors() ? "Errors: " + errors : "Valid";
    }
}
