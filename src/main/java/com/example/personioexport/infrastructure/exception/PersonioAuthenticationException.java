package com.example.personioexport.infrastructure.exception;

/**
 * Signals that the credential exchange with the Personio auth endpoint failed.
 * Authentication failures are never retried and abort the current export run.
 */
public class PersonioAuthenticationException extends InfrastructureException {

	/**
	 * Creates the exception for a rejected or malformed token response.
	 *
	 * @param message description of what the auth endpoint returned
	 */
    public PersonioAuthenticationException(String message) {
        super(message);
    }

	/**
	 * Creates the exception for a transport failure during the exchange.
	 *
	 * @param message description shared with the application layer
	 * @param cause   low-level HTTP client exception
	 */
    public PersonioAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
