package com.marketengine.estimation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EstimationServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(EstimationServiceApplication.class, args);
    }
}
