package com.example.personioexport.infrastructure.exception;

/**
 * Base unchecked exception for failures talking to Personio or the output file system.
 * Subclasses that reach the run boundary are fatal for the run, except document failures which
 * are recorded per document.
 */
public abstract class InfrastructureException extends RuntimeException {

	/**
	 * @param message what failed, including the endpoint or path involved
	 */
    protected InfrastructureException(String message) {
        super(message);
    }

	/**
	 * @param message what failed, including the endpoint or path involved
	 * @param cause   HTTP client, Jackson, PDFBox or NIO exception behind the failure
	 */
    protected InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
