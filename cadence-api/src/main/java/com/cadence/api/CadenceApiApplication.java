package com.cadence.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Cadence Platform API Application
 *
 * Stores classification datasets of recordings.
 * Java 17 + Spring Boot 3.4.x
 */
@SpringBootApplication(scanBasePackages = "com.cadence")
public class CadenceApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(CadenceApiApplication.class, args);
    }
}
