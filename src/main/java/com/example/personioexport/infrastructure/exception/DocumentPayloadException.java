package com.example.personioexport.infrastructure.exception;

/**
 * Raised when a downloaded document payload does not match its declared format.
 */
public class DocumentPayloadException extends InfrastructureException {

	/**
	 * Creates the exception with the PDFBox cause.
	 *
	 * @param message description shared with the document fetcher
	 * @param cause   parser exception
	 */
    public DocumentPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
