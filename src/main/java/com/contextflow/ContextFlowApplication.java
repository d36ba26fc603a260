package com.contextflow;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

@SpringBootApplication
public class ContextFlowApplication {

    public static void main(String[] args) {
        // Library-style container: no web server, callers use WorkflowEngine directly
        new SpringApplicationBuilder(ContextFlowApplication.class)
                .properties(
                        "spring.main.web-application-type=none",
                        "spring.main.banner-mode=off"
                )
                .run(args);
    }
}
