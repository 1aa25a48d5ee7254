package com.csl.commentquery.relevance;

import com.csl.commentquery.customize.CommentQueryCustomizer;
import com.csl.commentquery.dsl.QueryDsl;
import com.csl.commentquery.request.FilterRequest;
import com.csl.commentquery.request.QueryVars;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class RelevanceQueryBuilder {
    private final RelevanceProperties properties;
    private final List<CommentQueryCustomizer> customizers;

    public RelevanceQueryBuilder(RelevanceProperties properties, List<CommentQueryCustomizer> customizers) {
        this.properties = properties;
        this.customizers = customizers == null ? List.of() : List.copyOf(customizers);
    }

    public boolean hasSearchTerm(FilterRequest request) {
        return request != null && !request.isEmpty("search");
    }

    public Map<String, Object> build(FilterRequest request) {
        String term = request.getString("search");
        List<String> fields = resolveFields(request.get("search_fields"));
        for (CommentQueryCustomizer customizer : customizers) {
            fields = customizer.searchFields(fields, request);
        }
        return build(term, fields, request);
    }

    public Map<String, Object> build(String term, List<String> fields, FilterRequest request) {
        double phraseBoost = properties.getPhraseBoost();
        double matchBoost = properties.getMatchBoost();
        int fuzziness = properties.getFuzziness();
        for (CommentQueryCustomizer customizer : customizers) {
            phraseBoost = customizer.phraseBoost(phraseBoost, fields, request);
            matchBoost = customizer.matchBoost(matchBoost, fields, request);
            fuzziness = customizer.fuzziness(fuzziness, fields, request);
        }

        List<Object> should = new ArrayList<>(3);
        should.add(QueryDsl.single("multi_match", phraseMatch(term, fields, phraseBoost)));
        should.add(QueryDsl.single("multi_match", conjunctiveMatch(term, fields, matchBoost)));
        should.add(QueryDsl.single("multi_match", fuzzyMatch(term, fields, fuzziness)));
        Map<String, Object> query = QueryDsl.bool("should", should);
        for (CommentQueryCustomizer customizer : customizers) {
            query = customizer.relevanceQuery(query, request);
        }
        return query;
    }

    // Meta keys become meta.<key>.value paths appended after the explicit fields.
    public List<String> resolveFields(Object searchFields) {
        if (QueryVars.isEmpty(searchFields)) {
            return new ArrayList<>(properties.getDefaultFields());
        }
        List<String> fields = new ArrayList<>();
        List<String> metaFields = new ArrayList<>();
        if (searchFields instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if ("meta".equals(entry.getKey())) {
                    addMetaFields(entry.getValue(), metaFields);
                } else {
                    addFields(entry.getValue(), fields, metaFields);
                }
            }
        } else {
            addFields(searchFields, fields, metaFields);
        }
        fields.addAll(metaFields);
        return fields;
    }

    private void addFields(Object value, List<String> fields, List<String> metaFields) {
        for (Object item : QueryVars.toList(value)) {
            if (item instanceof Map<?, ?> nested) {
                addMetaFields(nested.get("meta"), metaFields);
                continue;
            }
            String field = QueryVars.asString(item);
            if (!field.isEmpty()) {
                fields.add(field);
            }
        }
    }

    private void addMetaFields(Object value, List<String> metaFields) {
        for (Object key : QueryVars.toList(value)) {
            metaFields.add("meta." + QueryVars.asString(key) + ".value");
        }
    }

    private Map<String, Object> phraseMatch(String term, List<String> fields, double boost) {
        Map<String, Object> match = new LinkedHashMap<>();
        match.put("query", term);
        match.put("type", "phrase");
        match.put("fields", fields);
        match.put("boost", QueryDsl.number(boost));
        return match;
    }

    private Map<String, Object> conjunctiveMatch(String term, List<String> fields, double boost) {
        Map<String, Object> match = new LinkedHashMap<>();
        match.put("query", term);
        match.put("fields", fields);
        match.put("boost", QueryDsl.number(boost));
        match.put("fuzziness", 0);
        match.put("operator", "and");
        return match;
    }

    private Map<String, Object> fuzzyMatch(String term, List<String> fields, int fuzziness) {
        Map<String, Object> match = new LinkedHashMap<>();
        match.put("fields", fields);
        match.put("query", term);
        match.put("fuzziness", fuzziness);
        return match;
    }
}
