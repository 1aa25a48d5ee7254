package com.csl.commentquery.meta;

import java.util.Locale;

public enum MetaCompare {
    EQUALS("="),
    NOT_EQUALS("!="),
    GREATER(">"),
    GREATER_OR_EQUAL(">="),
    LESS("<"),
    LESS_OR_EQUAL("<="),
    IN("IN"),
    NOT_IN("NOT IN"),
    BETWEEN("BETWEEN"),
    NOT_BETWEEN("NOT BETWEEN"),
    LIKE("LIKE"),
    NOT_LIKE("NOT LIKE"),
    EXISTS("EXISTS"),
    NOT_EXISTS("NOT EXISTS");

    private final String operator;

    MetaCompare(String operator) {
        this.operator = operator;
    }

    public String operator() {
        return operator;
    }

    // Without a compare: "=" when a value is present, EXISTS otherwise.
    public static MetaCompare from(Object raw, boolean hasValue) {
        if (raw == null || raw.toString().isBlank()) {
            return hasValue ? EQUALS : EXISTS;
        }
        String normalized = raw.toString().trim().toUpperCase(Locale.ROOT).replaceAll("\\s+", " ");
        for (MetaCompare compare : values()) {
            if (compare.operator.equals(normalized)) {
                return compare;
            }
        }
        return null;
    }
}
