package com.riskengine.exception;

import java.util.Map;

/**
 * Raised at startup when the configured risk thresholds are inconsistent.
 */
public class ConfigurationException extends BaseException {

    public ConfigurationException(String message, Map<String, Object> details) {
        super(ErrorCode.INVALID_CONFIGURATION, message, details);
    }
}
