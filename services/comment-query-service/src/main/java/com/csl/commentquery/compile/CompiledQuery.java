package com.csl.commentquery.compile;

import com.csl.commentquery.dsl.QueryDsl;
import com.csl.commentquery.sort.SortClause;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class CompiledQuery {
    private final long from;
    private final long size;
    private final List<SortClause> sort;
    private final List<String> sourceIncludes;
    private final Map<String, Object> query;
    private final Map<String, Object> postFilter;

    public CompiledQuery(
        long from,
        long size,
        List<SortClause> sort,
        List<String> sourceIncludes,
        Map<String, Object> query,
        Map<String, Object> postFilter
    ) {
        this.from = from;
        this.size = size;
        this.sort = sort == null ? List.of() : List.copyOf(sort);
        this.sourceIncludes = sourceIncludes;
        this.query = query;
        this.postFilter = postFilter;
    }

    public long getFrom() {
        return from;
    }

    public long getSize() {
        return size;
    }

    public List<SortClause> getSort() {
        return sort;
    }

    public List<String> getSourceIncludes() {
        return sourceIncludes;
    }

    public Map<String, Object> getQuery() {
        return query;
    }

    public Map<String, Object> getPostFilter() {
        return postFilter;
    }

    public boolean hasPostFilter() {
        return postFilter != null;
    }

    public Map<String, Object> toDsl() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("from", from);
        body.put("size", size);
        List<Object> sortDsl = new ArrayList<>(sort.size());
        for (SortClause clause : sort) {
            sortDsl.add(clause.toDsl());
        }
        body.put("sort", sortDsl);
        if (sourceIncludes != null) {
            body.put("_source", QueryDsl.single("includes", sourceIncludes));
        }
        body.put("query", query);
        if (postFilter != null) {
            body.put("post_filter", postFilter);
        }
        return body;
    }
}
