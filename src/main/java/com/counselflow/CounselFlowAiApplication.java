package com.counselflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * CounselFlow AI core: multi-provider LLM orchestration for the legal modules.
 */
@SpringBootApplication
@EnableScheduling
public class CounselFlowAiApplication {

    public static void main(String[] args) {
        SpringApplication.run(CounselFlowAiApplication.class, args);
    }
}
