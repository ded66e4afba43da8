package com.codegym.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * {@code gym.*} settings.
 *
 * @param defaultMaxTrainingDays weekly cap used when {@code max_training_days} is missing or unreadable
 * @param timezone zone that decides what "today" is for membership dates
 * @param seed initial data switch
 */
@ConfigurationProperties(prefix = "gym")
public record GymProperties(
        Integer defaultMaxTrainingDays,
        String timezone,
        Seed seed
) {

    public static final int FALLBACK_MAX_TRAINING_DAYS = 6;

    public GymProperties {
        if (defaultMaxTrainingDays == null || defaultMaxTrainingDays < 1 || defaultMaxTrainingDays > 7) {
            defaultMaxTrainingDays = FALLBACK_MAX_TRAINING_DAYS;
        }
        if (timezone == null || timezone.isBlank()) {
            timezone = "Asia/Ho_Chi_Minh";
        }
        if (seed == null) {
            seed = new Seed(false);
        }
    }

    public record Seed(boolean enabled) {
    }
}
