package com.codesmith.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CodesmithApplication {

    public static void main(String[] args) {
        SpringApplication.run(CodesmithApplication.class, args);
    }
}
