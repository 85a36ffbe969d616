package com.company.correlation.exception;

public class InvalidConfigurationException extends RuntimeException {
    public InvalidConfigurationException(String key, Object value, String constraint) {
        super(String.format("Invalid configuration %s=%s: %s", key, value, constraint));
    }
}
