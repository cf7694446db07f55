package org.javai.kconfig.settings;

/**
 * Exception thrown when a settings file cannot be read or contains invalid values.
 */
public class SettingsException extends RuntimeException {

	public SettingsException(String message) {
		super(message);
	}

	public SettingsException(String message, Throwable cause) {
		super(message, cause);
	}
}
