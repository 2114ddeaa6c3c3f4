package com.eainde.knowledge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KnowledgePipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(KnowledgePipelineApplication.class, args);
    }
}
