package com.alertsentinel.core.model;

import java.util.List;

/**
 * Thrown by {@link AlertRule.Builder#build()} when required rule fields are
 * missing.
 *
 * @since 1.0.0
 */
public class RuleValidationException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public RuleValidationException(List<String> errors) {
        super("Invalid AlertRule: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    /**
     * @return every validation problem found, in field order
     */
    public List<String> getErrors() {
        return errors;
    }
}
