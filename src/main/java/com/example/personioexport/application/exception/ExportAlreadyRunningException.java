package com.example.personioexport.application.exception;

/**
 * Signals that an export was requested while another export run is still in progress.
 * Controllers translate this exception into an HTTP 409 response.
 */
public class ExportAlreadyRunningException extends ApplicationException {

	/**
	 * Creates the exception with a fixed explanation.
	 */
    public ExportAlreadyRunningException() {
        super("An export run is already in progress.");
    }
}
