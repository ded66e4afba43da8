package com.codegym.backend.config;

import java.time.Clock;
import java.time.ZoneId;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(GymProperties properties) {
        return Clock.system(ZoneId.of(properties.timezone()));
    }
}
