package com.reprise;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for Reprise - adaptive response cache for LLM completion requests.
 */
@SpringBootApplication
@EnableScheduling
public class RepriseApplication {

    public static void main(String[] args) {
        SpringApplication.run(RepriseApplication.class, args);
    }
}
