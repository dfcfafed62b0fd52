package com.emissions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EmissionsCacheApplication {

    private static final Logger log = LoggerFactory.getLogger(EmissionsCacheApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(EmissionsCacheApplication.class, args);
        log.info("Emissions Cache Service started.");
        log.info("Emissions API: POST http://localhost:8080/api/emissions {startDate, endDate, businessFacility}");
        log.info("Status:        GET  http://localhost:8080/status");
        log.info("Health:        GET  http://localhost:8080/actuator/health");
    }
}
