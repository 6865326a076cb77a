package com.ai.intake.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class AppConfig {

    /** "Today" for relative appointment dates. */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
