package com.cranestats.service;

/**
 * Usage cannot be measured for an entity: no telemetry, or a spreader without assigned cranes.
 */
public class UsageUnavailableException extends Exception {

    private final String code;

    public UsageUnavailableException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
