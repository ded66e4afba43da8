package com.codegym.backend.enums;

public enum Role {
    ADMIN("/admin/dashboard"),
    RECEPTIONIST("/reception/dashboard"),
    TRAINER("/trainer/dashboard"),
    CASHIER("/cashier/dashboard");

    private final String landingPath;

    Role(String landingPath) {
        this.landingPath = landingPath;
    }

    /**
     * Dashboard the client should open after a successful login.
     */
    public String getLandingPath() {
        return landingPath;
    }
}
