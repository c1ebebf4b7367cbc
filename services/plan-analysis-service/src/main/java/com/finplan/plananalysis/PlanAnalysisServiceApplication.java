package com.finplan.plananalysis;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Plan Analysis Service
 * Infers budget plan structure from uploaded spreadsheets and learns from user corrections
 */
@SpringBootApplication
@EnableScheduling
public class PlanAnalysisServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlanAnalysisServiceApplication.class, args);
    }
}
