package com.codegym.backend.services;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.codegym.backend.audit.Auditable;
import com.codegym.backend.config.GymProperties;
import com.codegym.backend.dto.settings.SystemSettingsDTO;
import com.codegym.backend.entities.SystemConfig;
import com.codegym.backend.exceptions.BadRequestException;
import com.codegym.backend.repositories.SystemConfigRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Process-wide settings stored as key/value rows. Values are read from the
 * database on every call so an admin change applies to the next request.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SystemConfigService {

    static final String MAX_TRAINING_DAYS_DESCRIPTION = "Maximum training days per week for workout plans";
    static final int MIN_DAYS = 1;
    static final int MAX_DAYS = 7;

    private final SystemConfigRepository systemConfigRepository;
    private final GymProperties gymProperties;

    @Transactional(readOnly = true)
    public int getMaxTrainingDays() {
        int fallback = gymProperties.defaultMaxTrainingDays();
        return systemConfigRepository.findByKey(SystemConfig.MAX_TRAINING_DAYS)
                .map(config -> parseDays(config.getValue(), fallback))
                .orElse(fallback);
    }

    @Transactional(readOnly = true)
    public SystemSettingsDTO getSettings() {
        return new SystemSettingsDTO(getMaxTrainingDays());
    }

    @Auditable(action = "SETTINGS_UPDATED", entityType = "SystemConfig")
    @Transactional
    public SystemSettingsDTO updateMaxTrainingDays(int maxTrainingDays) {
        if (maxTrainingDays < MIN_DAYS || maxTrainingDays > MAX_DAYS) {
            throw new BadRequestException("Maximum training days must be between 1 and 7");
        }

        SystemConfig config = systemConfigRepository.findByKey(SystemConfig.MAX_TRAINING_DAYS)
                .orElseGet(() -> {
                    SystemConfig created = new SystemConfig();
                    created.setKey(SystemConfig.MAX_TRAINING_DAYS);
                    created.setDescription(MAX_TRAINING_DAYS_DESCRIPTION);
                    return created;
                });
        config.setValue(String.valueOf(maxTrainingDays));
        systemConfigRepository.save(config);

        log.info("max_training_days set to {}", maxTrainingDays);
        return new SystemSettingsDTO(maxTrainingDays);
    }

    private int parseDays(String raw, int fallback) {
        try {
            int value = Integer.parseInt(raw == null ? "" : raw.trim());
            if (value >= MIN_DAYS && value <= MAX_DAYS) {
                return value;
            }
        } catch (NumberFormatException e) {
            log.warn("Stored max_training_days '{}' is not a number", raw);
            return fallback;
        }
        log.warn("Stored max_training_days '{}' is out of range, using {}", raw, fallback);
        return fallback;
    }
}
