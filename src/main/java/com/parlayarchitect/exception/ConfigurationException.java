package com.parlayarchitect.exception;

import java.util.Map;

/**
 * Raised when the architect configuration cannot be turned into a valid snapshot.
 *
 * <p>Thrown during application startup (or a reload), never while serving a selection. At
 * startup it aborts context creation so a bad threshold table can never reach production.
 */
public class ConfigurationException extends BaseException {

    public ConfigurationException(String message) {
        super(ErrorCode.CONFIGURATION_ERROR, message);
    }

    public ConfigurationException(String message, Map<String, Object> details) {
        super(ErrorCode.CONFIGURATION_ERROR, message, details);
    }
}
