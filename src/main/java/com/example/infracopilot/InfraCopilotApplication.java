package com.example.infracopilot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * InfraCopilot - hybrid health aggregation with a conversational SRE agent.
 */
@SpringBootApplication
@EnableAsync
public class InfraCopilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(InfraCopilotApplication.class, args);
    }
}
