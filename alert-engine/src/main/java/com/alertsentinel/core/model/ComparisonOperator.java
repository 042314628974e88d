package com.alertsentinel.core.model;

/**
 * Comparison applied between an aggregated metric value and a threshold.
 *
 * @since 1.0.0
 */
public enum ComparisonOperator {

    GREATER_THAN(">") {
        @Override
        public boolean test(double actual, double threshold) {
            return actual > threshold;
        }
    },
    GREATER_THAN_OR_EQUAL(">=") {
        @Override
        public boolean test(double actual, double threshold) {
            return actual >= threshold;
        }
    },
    LESS_THAN("<") {
        @Override
        public boolean test(double actual, double threshold) {
            return actual < threshold;
        }
    },
    LESS_THAN_OR_EQUAL("<=") {
        @Override
        public boolean test(double actual, double threshold) {
            return actual <= threshold;
        }
    },
    EQUAL("=") {
        @Override
        public boolean test(double actual, double threshold) {
            return actual == threshold;
        }
    },
    NOT_EQUAL("!=") {
        @Override
        public boolean test(double actual, double threshold) {
            return actual != threshold;
        }
    };

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Apply the comparison.
     *
     * @param actual    aggregated metric value
     * @param threshold configured threshold
     * @return {@code true} if {@code actual <op> threshold} holds
     */
    public abstract boolean test(double actual, double threshold);

    public String symbol() {
        return symbol;
    }

    /**
     * Resolve an operator from its symbol ({@code ">"}, {@code "!="}, ...).
     * {@code "=="} is accepted as an alias for {@link #EQUAL}.
     *
     * @param symbol operator symbol
     * @return the matching operator
     * @throws IllegalArgumentException if the symbol is unknown
     */
    public static ComparisonOperator fromSymbol(String symbol) {
        if (symbol != null) {
            String trimmed = symbol.trim();
            if ("==".equals(trimmed)) {
                return EQUAL;
            }
            for (ComparisonOperator op : values()) {
                if (op.symbol.equals(trimmed)) {
                    return op;
                }
            }
        }
        throw new IllegalArgumentException("Unknown comparison operator: '" + symbol
                + "'. Supported: >, >=, <, <=, =, !=");
    }

    @Override
    public String toString() {
        return symbol;
    }
}
