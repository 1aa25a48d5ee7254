package com.csl.commentquery.api;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.csl.commentquery.customize.CommentQueryCustomizer;
import com.csl.commentquery.request.FilterRequest;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class CommentQueryCustomizerWiringTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void registeredCustomizersApplyToServedBody() throws Exception {
        mockMvc.perform(post("/comments/query")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"search\":\"hello\",\"search_fields\":[\"comment_content\"]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.query.bool.should[0].multi_match.fields.length()").value(2))
            .andExpect(jsonPath("$.query.bool.should[0].multi_match.fields[1]").value("comment_author"))
            .andExpect(jsonPath("$.track_total_hits").value(true));
    }

    @TestConfiguration
    static class CustomizerConfig {
        @Bean
        CommentQueryCustomizer authorFieldCustomizer() {
            return new CommentQueryCustomizer() {
                @Override
                public List<String> searchFields(List<String> fields, FilterRequest request) {
                    if (fields.contains("comment_author")) {
                        return fields;
                    }
                    List<String> widened = new ArrayList<>(fields);
                    widened.add("comment_author");
                    return widened;
                }
            };
        }

        @Bean
        CommentQueryCustomizer totalHitsCustomizer() {
            return new CommentQueryCustomizer() {
                @Override
                public Map<String, Object> body(Map<String, Object> body, FilterRequest request) {
                    Map<String, Object> tracked = new LinkedHashMap<>(body);
                    tracked.put("track_total_hits", true);
                    return tracked;
                }
            };
        }
    }
}
