package com.example.personioexport.infrastructure.exception;

/**
 * Non-recoverable failure of a Personio API call: either a non-retryable status or a transient
 * failure that persisted after every allowed attempt.
 */
public class PersonioApiException extends InfrastructureException {

    /** Status used when no HTTP response was received at all. */
    public static final int NO_STATUS = -1;

    private final int status;
    private final String endpoint;

	/**
	 * Creates the exception for a failed call that produced an HTTP status.
	 *
	 * @param message  description of the failure
	 * @param status   last HTTP status observed, or {@link #NO_STATUS}
	 * @param endpoint endpoint that was called
	 */
    public PersonioApiException(String message, int status, String endpoint) {
        super(message);
        this.status = status;
        this.endpoint = endpoint;
    }

	/**
	 * Creates the exception for a failed call with an underlying cause.
	 *
	 * @param message  description of the failure
	 * @param status   last HTTP status observed, or {@link #NO_STATUS}
	 * @param endpoint endpoint that was called
	 * @param cause    transport or parsing exception
	 */
    public PersonioApiException(String message, int status, String endpoint, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.endpoint = endpoint;
    }

    public int getStatus() {
        return status;
    }

    public String getEndpoint() {
        return endpoint;
    }
}
