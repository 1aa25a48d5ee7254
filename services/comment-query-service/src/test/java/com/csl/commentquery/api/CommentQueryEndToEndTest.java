package com.csl.commentquery.api;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest(properties = "comment-query.search.phrase-boost=5")
@AutoConfigureMockMvc
class CommentQueryEndToEndTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void compilesFullRequestThroughWiredCollaborators() throws Exception {
        String body = "{"
            + "\"number\":10,"
            + "\"paged\":2,"
            + "\"orderby\":\"comment_author\","
            + "\"order\":\"asc\","
            + "\"status\":\"hold,approve\","
            + "\"include_unapproved\":[\"3\",\"a@example.com\"],"
            + "\"meta_key\":\"color\","
            + "\"meta_value\":\"blue\","
            + "\"date_query\":[{\"year\":2020}],"
            + "\"search\":\"great post\""
            + "}";

        mockMvc.perform(post("/comments/query")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.from").value(10))
            .andExpect(jsonPath("$.size").value(10))
            .andExpect(jsonPath("$.sort[0]['comment_author.raw'].order").value("asc"))
            .andExpect(jsonPath("$.query.bool.should.length()").value(3))
            .andExpect(jsonPath("$.query.bool.should[0].multi_match.boost").value(5))
            .andExpect(jsonPath("$.query.bool.should[1].multi_match.boost").value(2))
            .andExpect(jsonPath("$.post_filter.bool.must.length()").value(3))
            .andExpect(jsonPath("$.post_filter.bool.must[0].bool.must[0].range.comment_date.gte")
                .value("2020-01-01 00:00:00"))
            .andExpect(jsonPath("$.post_filter.bool.must[1].bool.must[0].term['meta.color.raw']").value("blue"))
            .andExpect(jsonPath("$.post_filter.bool.must[2].bool.should[0].terms.comment_approved[1]").value(1))
            .andExpect(jsonPath("$.post_filter.bool.must[2].bool.should[1].terms.user_id[0]").value(3))
            .andExpect(jsonPath("$.post_filter.bool.must[2].bool.should[2].terms['comment_author_email.raw'][0]")
                .value("a@example.com"));
    }

    @Test
    void emptyObjectCompilesToUnfilteredQuery() throws Exception {
        mockMvc.perform(post("/comments/query")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.size").value(10000))
            .andExpect(jsonPath("$.sort[0].comment_date_gmt.order").value("desc"))
            .andExpect(jsonPath("$.query.match_all.boost").value(1))
            .andExpect(jsonPath("$.post_filter").doesNotExist());
    }
}
