package com.ottoai.analysis;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AnalysisOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnalysisOrchestratorApplication.class, args);
    }
}
