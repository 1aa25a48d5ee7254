package com.csl.commentquery.compile;

import com.csl.commentquery.relevance.RelevanceProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({CommentQueryProperties.class, RelevanceProperties.class})
public class CommentQueryConfig {}
