package com.csl.commentquery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CommentQueryServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(CommentQueryServiceApplication.class, args);
    }
}
