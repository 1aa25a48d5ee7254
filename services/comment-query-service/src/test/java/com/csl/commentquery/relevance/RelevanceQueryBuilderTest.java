package com.csl.commentquery.relevance;

import static org.assertj.core.api.Assertions.assertThat;

import com.csl.commentquery.customize.CommentQueryCustomizer;
import com.csl.commentquery.request.FilterRequest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RelevanceQueryBuilderTest {
    private static final List<String> DEFAULT_FIELDS = List.of(
        "comment_author",
        "comment_author_email",
        "comment_author_url",
        "comment_author_IP",
        "comment_content"
    );

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void cascadeIsPhraseThenConjunctiveThenFuzzy() {
        RelevanceQueryBuilder builder = new RelevanceQueryBuilder(new RelevanceProperties(), List.of());

        JsonNode should = objectMapper.valueToTree(builder.build(FilterRequest.of(Map.of("search", "great post"))))
            .path("bool").path("should");

        assertThat(should.size()).isEqualTo(3);

        JsonNode phrase = should.get(0).path("multi_match");
        assertThat(phrase.path("query").asText()).isEqualTo("great post");
        assertThat(phrase.path("type").asText()).isEqualTo("phrase");
        assertThat(phrase.path("boost").isInt()).isTrue();
        assertThat(phrase.path("boost").asInt()).isEqualTo(4);

        JsonNode conjunctive = should.get(1).path("multi_match");
        assertThat(conjunctive.path("boost").asInt()).isEqualTo(2);
        assertThat(conjunctive.path("fuzziness").asInt()).isZero();
        assertThat(conjunctive.path("operator").asText()).isEqualTo("and");
        assertThat(conjunctive.has("type")).isFalse();

        JsonNode fuzzy = should.get(2).path("multi_match");
        assertThat(fuzzy.path("fuzziness").asInt()).isEqualTo(1);
        assertThat(fuzzy.has("boost")).isFalse();
        assertThat(fuzzy.has("operator")).isFalse();
    }

    @Test
    void omittedSearchFieldsUseDefaults() {
        RelevanceQueryBuilder builder = new RelevanceQueryBuilder(new RelevanceProperties(), List.of());

        assertThat(builder.resolveFields(null)).containsExactlyElementsOf(DEFAULT_FIELDS);
        assertThat(builder.resolveFields(List.of())).containsExactlyElementsOf(DEFAULT_FIELDS);

        JsonNode fields = objectMapper.valueToTree(builder.build(FilterRequest.of(Map.of("search", "x"))))
            .path("bool").path("should").get(0).path("multi_match").path("fields");
        assertThat(fields.size()).isEqualTo(5);
        assertThat(fields.get(4).asText()).isEqualTo("comment_content");
    }

    @Test
    void metaKeysBecomeValuePathsAfterExplicitFields() {
        RelevanceQueryBuilder builder = new RelevanceQueryBuilder(new RelevanceProperties(), List.of());

        assertThat(builder.resolveFields(Map.of("meta", List.of("mood", "topic"))))
            .containsExactly("meta.mood.value", "meta.topic.value");
        assertThat(builder.resolveFields(List.of("comment_content", Map.of("meta", "mood"), "comment_author")))
            .containsExactly("comment_content", "comment_author", "meta.mood.value");
        assertThat(builder.resolveFields("comment_content")).containsExactly("comment_content");
    }

    @Test
    void weightsAndFuzzinessAreConfigurable() {
        RelevanceProperties properties = new RelevanceProperties();
        properties.setPhraseBoost(6.5);
        properties.setMatchBoost(3);
        properties.setFuzziness(2);
        properties.setDefaultFields(List.of("comment_content"));
        RelevanceQueryBuilder builder = new RelevanceQueryBuilder(properties, List.of());

        JsonNode should = objectMapper.valueToTree(builder.build("typo", builder.resolveFields(null), FilterRequest.empty()))
            .path("bool").path("should");

        assertThat(should.get(0).path("multi_match").path("boost").asDouble()).isEqualTo(6.5);
        assertThat(should.get(1).path("multi_match").path("boost").asInt()).isEqualTo(3);
        assertThat(should.get(2).path("multi_match").path("fuzziness").asInt()).isEqualTo(2);
        assertThat(should.get(2).path("multi_match").path("fields").toString()).isEqualTo("[\"comment_content\"]");
    }

    @Test
    void customizersSeeResolvedFieldsAndQueryVars() {
        CommentQueryCustomizer customizer = new CommentQueryCustomizer() {
            @Override
            public List<String> searchFields(List<String> fields, FilterRequest request) {
                if ("content".equals(request.get("scope"))) {
                    return List.of("comment_content");
                }
                return fields;
            }

            @Override
            public double phraseBoost(double boost, List<String> fields, FilterRequest request) {
                return fields.size() == 1 ? 8 : boost;
            }

            @Override
            public int fuzziness(int fuzziness, List<String> fields, FilterRequest request) {
                return 2;
            }
        };
        RelevanceQueryBuilder builder = new RelevanceQueryBuilder(new RelevanceProperties(), List.of(customizer));

        JsonNode scoped = objectMapper.valueToTree(builder.build(FilterRequest.of(Map.of("search", "x", "scope", "content"))))
            .path("bool").path("should");
        assertThat(scoped.get(0).path("multi_match").path("fields").toString()).isEqualTo("[\"comment_content\"]");
        assertThat(scoped.get(0).path("multi_match").path("boost").asInt()).isEqualTo(8);
        assertThat(scoped.get(1).path("multi_match").path("boost").asInt()).isEqualTo(2);
        assertThat(scoped.get(2).path("multi_match").path("fuzziness").asInt()).isEqualTo(2);

        JsonNode unscoped = objectMapper.valueToTree(builder.build(FilterRequest.of(Map.of("search", "x"))))
            .path("bool").path("should");
        assertThat(unscoped.get(0).path("multi_match").path("fields").size()).isEqualTo(5);
        assertThat(unscoped.get(0).path("multi_match").path("boost").asInt()).isEqualTo(4);
    }

    @Test
    void customizerCanReplaceRelevanceQuery() {
        CommentQueryCustomizer customizer = new CommentQueryCustomizer() {
            @Override
            public Map<String, Object> relevanceQuery(Map<String, Object> query, FilterRequest request) {
                return Map.of("match", Map.of("comment_content", request.getString("search")));
            }
        };
        RelevanceQueryBuilder builder = new RelevanceQueryBuilder(new RelevanceProperties(), List.of(customizer));

        assertThat(builder.build(FilterRequest.of(Map.of("search", "hello"))))
            .isEqualTo(Map.of("match", Map.of("comment_content", "hello")));
    }

    @Test
    void detectsSearchTerm() {
        RelevanceQueryBuilder builder = new RelevanceQueryBuilder(new RelevanceProperties(), List.of());

        assertThat(builder.hasSearchTerm(FilterRequest.of(Map.of("search", "hi")))).isTrue();
        assertThat(builder.hasSearchTerm(FilterRequest.of(Map.of("search", "")))).isFalse();
        assertThat(builder.hasSearchTerm(FilterRequest.empty())).isFalse();
    }
}
