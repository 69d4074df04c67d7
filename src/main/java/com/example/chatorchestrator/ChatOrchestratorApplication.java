package com.example.chatorchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ChatOrchestratorApplication {
    public static void main(String[] args) {
        SpringApplication.run(ChatOrchestratorApplication.class, args);
    }
}
