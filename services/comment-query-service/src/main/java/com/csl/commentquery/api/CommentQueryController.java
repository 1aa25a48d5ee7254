package com.csl.commentquery.api;

import com.csl.commentquery.compile.CommentQueryCompiler;
import com.csl.commentquery.request.FilterRequest;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class CommentQueryController {
    private final CommentQueryCompiler compiler;

    public CommentQueryController(CommentQueryCompiler compiler) {
        this.compiler = compiler;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @PostMapping("/comments/query")
    public Map<String, Object> compile(@RequestBody(required = false) Map<String, Object> queryVars) {
        if (queryVars == null) {
            throw new InvalidQueryVarsException(
                "request body is required",
                "send the comment query vars as a JSON object, {} for defaults"
            );
        }
        return compiler.compileBody(FilterRequest.of(queryVars));
    }
}
