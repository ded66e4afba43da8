package com.codegym.backend.enums;

public enum AuditEventStatus {
    SUCCESS,
    FAILURE
}
