package com.csl.commentquery.request;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public final class FilterRequest {
    private static final FilterRequest EMPTY = new FilterRequest(Map.of());

    private final Map<String, Object> vars;

    private FilterRequest(Map<String, Object> vars) {
        this.vars = vars;
    }

    public static FilterRequest empty() {
        return EMPTY;
    }

    public static FilterRequest of(Map<String, ?> vars) {
        if (vars == null || vars.isEmpty()) {
            return EMPTY;
        }
        return new FilterRequest(Collections.unmodifiableMap(new LinkedHashMap<String, Object>(vars)));
    }

    public Object get(String name) {
        return vars.get(name);
    }

    // First non-empty value among aliases such as paged/page.
    public Object first(String... names) {
        for (String name : names) {
            Object value = vars.get(name);
            if (!QueryVars.isEmpty(value)) {
                return value;
            }
        }
        return null;
    }

    public boolean isSet(String name) {
        return vars.get(name) != null;
    }

    public boolean isEmpty(String name) {
        return QueryVars.isEmpty(vars.get(name));
    }

    public String getString(String name) {
        return QueryVars.asString(vars.get(name));
    }

    public long getLong(String name) {
        return QueryVars.toLong(vars.get(name));
    }

    public Map<String, Object> asMap() {
        return vars;
    }

    @Override
    public String toString() {
        return "FilterRequest" + vars;
    }
}
