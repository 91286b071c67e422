package com.chaincollector.exception;

/**
 * Invalid or incomplete configuration detected while wiring the collector. Fails startup.
 */
public class ConfigurationException extends BaseException {

    public ConfigurationException(String message) {
        super(ErrorCode.CONFIGURATION_ERROR, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorCode.CONFIGURATION_ERROR, message, cause);
    }
}
