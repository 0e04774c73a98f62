package com.ai.clinicdesk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "com.ai.clinicdesk")
@EnableJpaRepositories(basePackages = "com.ai.clinicdesk.repository")
@EntityScan(basePackages = "com.ai.clinicdesk.entity")
@EnableScheduling
public class ClinicDeskApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClinicDeskApplication.class, args);
    }
}
