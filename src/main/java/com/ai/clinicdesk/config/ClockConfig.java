package com.ai.clinicdesk.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(@Value("${clinicdesk.zone:Asia/Riyadh}") String zone) {
        return Clock.system(ZoneId.of(zone));
    }
}
