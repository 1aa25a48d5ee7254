package com.csl.commentquery.compile;

import com.csl.commentquery.dsl.QueryDsl;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class FilterAccumulator {
    private final List<Object> must = new ArrayList<>();

    public void add(ClausePlacement placement, Object clause) {
        switch (placement) {
            case FLAT -> must.add(clause);
            case MUST -> must.add(QueryDsl.bool("must", clause));
            case MUST_NOT -> must.add(QueryDsl.bool("must_not", clause));
        }
    }

    public void addShould(List<?> clauses) {
        must.add(QueryDsl.bool("should", clauses));
    }

    public boolean isEmpty() {
        return must.isEmpty();
    }

    public int size() {
        return must.size();
    }

    public Map<String, Object> toPostFilter() {
        return QueryDsl.bool("must", new ArrayList<>(must));
    }
}
