package com.alertsentinel.core.manager;

/**
 * Thrown when an operation names a rule id the manager does not hold.
 *
 * @since 1.0.0
 */
public class RuleNotFoundException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String ruleId;

    public RuleNotFoundException(String ruleId) {
        super("Rule " + ruleId + " not found");
        this.ruleId = ruleId;
    }

    public String getRuleId() {
        return ruleId;
    }
}
