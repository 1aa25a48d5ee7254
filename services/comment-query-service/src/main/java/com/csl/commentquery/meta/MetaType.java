package com.csl.commentquery.meta;

import java.util.Locale;

public enum MetaType {
    CHAR("raw"),
    NUMERIC("long"),
    DECIMAL("double"),
    DATE("date"),
    DATETIME("datetime"),
    TIME("time");

    private final String subField;

    MetaType(String subField) {
        this.subField = subField;
    }

    public String subField() {
        return subField;
    }

    public static MetaType from(Object raw) {
        if (raw == null) {
            return CHAR;
        }
        String normalized = raw.toString().trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "NUMERIC", "SIGNED", "UNSIGNED" -> NUMERIC;
            case "DECIMAL" -> DECIMAL;
            case "DATE" -> DATE;
            case "DATETIME" -> DATETIME;
            case "TIME" -> TIME;
            default -> CHAR;
        };
    }
}
