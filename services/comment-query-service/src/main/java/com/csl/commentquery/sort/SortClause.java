package com.csl.commentquery.sort;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public final class SortClause {
    private final String field;
    private final SortDirection direction;

    public SortClause(String field, SortDirection direction) {
        this.field = field;
        this.direction = direction;
    }

    public String getField() {
        return field;
    }

    public SortDirection getDirection() {
        return direction;
    }

    public Map<String, Object> toDsl() {
        Map<String, Object> order = new LinkedHashMap<>();
        order.put("order", direction.value());
        Map<String, Object> node = new LinkedHashMap<>();
        node.put(field, order);
        return node;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SortClause that)) {
            return false;
        }
        return field.equals(that.field) && direction == that.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, direction);
    }

    @Override
    public String toString() {
        return field + ":" + direction.value();
    }
}
