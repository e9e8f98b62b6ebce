package com.meridian.common;

/**
 * Local configuration cannot be used: an unreadable key file, key text in neither supported
 * encoding, an invalid node id, or a certificate outside the configured broker domain.
 */
public final class ConfigurationFailedException extends MeridianException {

    public ConfigurationFailedException(String message) {
        super(message);
    }

    public ConfigurationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
