/* (C)2026 */
package com.ammann.wearable.exception;

/**
 * Raised when analysis settings are invalid, for example a negative deviation multiplier
 * or severity thresholds that are not increasing.
 *
 * <p>Thrown while the settings are built at startup, so no run is attempted with an
 * invalid configuration.
 */
public class ConfigurationException extends ApiException {

    public ConfigurationException(String message) {
        super(message);
    }

    public static ConfigurationException invalidSetting(String name, Object value, String expected) {
        return new ConfigurationException(
                String.format(
                        "Invalid analysis setting '%s': got '%s', expected %s",
                        name, value, expected));
    }
}
