package com.ainp.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * AINP broker API application.
 *
 * Negotiation, credit ledger and incentive settlement for agent-to-agent intents.
 * Java 17 + Spring Boot 3.4.x
 */
@SpringBootApplication(scanBasePackages = "com.ainp")
@EntityScan(basePackages = "com.ainp.core.domain")
@EnableJpaRepositories(basePackages = "com.ainp.core.repository")
public class AinpApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(AinpApiApplication.class, args);
    }
}
