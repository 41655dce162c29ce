package com.sharedmodel.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * SharedModel Platform API Application
 *
 * Deposit-backed crowd-sourced training: submissions, refunds and reports.
 * Java 17 + Spring Boot 3.3.x
 */
@SpringBootApplication(scanBasePackages = "com.sharedmodel")
@EntityScan(basePackages = "com.sharedmodel.api")
@EnableJpaRepositories(basePackages = "com.sharedmodel.api")
public class SharedModelApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(SharedModelApiApplication.class, args);
    }
}
