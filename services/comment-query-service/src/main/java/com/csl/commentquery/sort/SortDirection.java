package com.csl.commentquery.sort;

public enum SortDirection {
    ASC("asc"),
    DESC("desc");

    private final String value;

    SortDirection(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static SortDirection from(Object raw) {
        if (raw instanceof String text && "ASC".equalsIgnoreCase(text)) {
            return ASC;
        }
        return DESC;
    }
}
