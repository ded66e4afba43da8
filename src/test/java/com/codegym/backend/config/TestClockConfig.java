package com.codegym.backend.config;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

/**
 * Pins "today" to 2024-03-15 in the gym's timezone.
 */
@TestConfiguration
public class TestClockConfig {

    public static final ZoneId ZONE = ZoneId.of("Asia/Ho_Chi_Minh");
    public static final Instant FIXED_INSTANT = Instant.parse("2024-03-15T03:00:00Z");
    public static final LocalDate TODAY = LocalDate.ofInstant(FIXED_INSTANT, ZONE);

    @Bean
    @Primary
    public Clock testClock() {
        return Clock.fixed(FIXED_INSTANT, ZONE);
    }
}
