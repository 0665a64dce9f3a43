package com.example.personioexport.application.exception;

/**
 * Raised while binding the export configuration when a mandatory setting is missing or invalid.
 */
public class InvalidConfigurationException extends ApplicationException {

	/**
	 * Creates the exception describing the offending setting.
	 *
	 * @param message which setting is missing or invalid
	 */
    public InvalidConfigurationException(String message) {
        super(message);
    }
}
