package com.example.personioexport.application.exception;

/**
 * Base unchecked exception for export orchestration errors, such as invalid settings or a
 * rejected trigger. Unlike infrastructure failures these are raised before Personio or the
 * file system is touched.
 */
public abstract class ApplicationException extends RuntimeException {

	/**
	 * @param message description suitable for the HTTP caller and the log
	 */
    protected ApplicationException(String message) {
        super(message);
    }
}
