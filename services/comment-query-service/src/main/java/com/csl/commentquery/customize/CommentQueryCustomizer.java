package com.csl.commentquery.customize;

import com.csl.commentquery.request.FilterRequest;
import java.util.List;
import java.util.Map;

public interface CommentQueryCustomizer {
    default List<String> searchFields(List<String> fields, FilterRequest request) {
        return fields;
    }

    default double phraseBoost(double boost, List<String> fields, FilterRequest request) {
        return boost;
    }

    default double matchBoost(double boost, List<String> fields, FilterRequest request) {
        return boost;
    }

    default int fuzziness(int fuzziness, List<String> fields, FilterRequest request) {
        return fuzziness;
    }

    default Map<String, Object> relevanceQuery(Map<String, Object> query, FilterRequest request) {
        return query;
    }

    default Map<String, Object> body(Map<String, Object> body, FilterRequest request) {
        return body;
    }
}
