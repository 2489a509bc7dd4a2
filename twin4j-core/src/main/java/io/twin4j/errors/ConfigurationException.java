package io.twin4j.errors;

import java.util.Map;

/**
 * Static misconfiguration (missing source, malformed cron, unreachable job store). Fatal and never retried.
 */
public class ConfigurationException extends TwinException {

    public ConfigurationException(String message) {
        super(ErrorCode.CONFIGURATION_ERROR, message);
    }

    public ConfigurationException(String message, Map<String, ?> context) {
        super(ErrorCode.CONFIGURATION_ERROR, message, context, null);
    }

    public ConfigurationException(String message, Map<String, ?> context, Throwable cause) {
        super(ErrorCode.CONFIGURATION_ERROR, message, context, cause);
    }
}
