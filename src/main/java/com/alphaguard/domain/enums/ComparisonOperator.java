package com.alphaguard.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Comparison operators used by falsifiers and factor failure rules.
 * Serialized as their symbol ({@code "<"}, {@code ">="}, ...).
 */
public enum ComparisonOperator {
    LT("<"),
    LTE("<="),
    GT(">"),
    GTE(">="),
    EQ("==");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    @JsonValue
    public String getSymbol() {
        return symbol;
    }

    /** Returns true when {@code value <op> threshold} holds. */
    public boolean test(double value, double threshold) {
        return switch (this) {
            case LT -> value < threshold;
            case LTE -> value <= threshold;
            case GT -> value > threshold;
            case GTE -> value >= threshold;
            case EQ -> Double.compare(value, threshold) == 0;
        };
    }

    @JsonCreator
    public static ComparisonOperator fromSymbol(String symbol) {
        for (ComparisonOperator op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown comparison operator: " + symbol);
    }
}
