package com.team.issueintel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class IssueIntelligenceApplication {

    public static void main(String[] args) {
        SpringApplication.run(IssueIntelligenceApplication.class, args);
    }
}
