package com.templatebinder.expressions;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ComparisonOperator {
    GT("gt", ">", "Show if first number > second number"),
    LT("lt", "<", "Show if first number < second number"),
    EQ("eq", "==", "Show if numbers are equal");

    private final String id;
    private final String symbol;
    private final String comment;

    ComparisonOperator(String id, String symbol, String comment) {
        this.id = id;
        this.symbol = symbol;
        this.comment = comment;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public String getSymbol() {
        return symbol;
    }

    String getComment() {
        return comment;
    }

    @JsonCreator
    public static ComparisonOperator fromValue(String value) {
        if (value != null) {
            String trimmed = value.trim();
            for (ComparisonOperator op : values()) {
                if (op.id.equalsIgnoreCase(trimmed) || op.symbol.equals(trimmed)) {
                    return op;
                }
            }
        }
        throw new IllegalArgumentException("Comparison must be one of gt, lt, eq; got '" + value + "'");
    }
}
