package com.codegym.backend.entities;

import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Data;

@Entity
@Table(name = "system_config")
@Data
public class SystemConfig {

    public static final String MAX_TRAINING_DAYS = "max_training_days";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "config_key", nullable = false, unique = true, length = 50)
    private String key;

    @Column(name = "config_value", nullable = false, length = 200)
    private String value;

    @Column(columnDefinition = "text")
    private String description;
}
