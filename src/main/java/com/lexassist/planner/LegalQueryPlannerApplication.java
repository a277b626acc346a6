package com.lexassist.planner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LegalQueryPlannerApplication {

    public static void main(String[] args) {
        SpringApplication.run(LegalQueryPlannerApplication.class, args);
    }
}
