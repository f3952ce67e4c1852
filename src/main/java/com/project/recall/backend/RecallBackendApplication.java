package com.project.recall.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RecallBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(RecallBackendApplication.class, args);
    }
}
