package com.example.personioexport.domain.exception;

/**
 * Raised when a raw employee record cannot be flattened because its structure is unusable,
 * typically because it carries no employee identifier.
 * Callers treat it as a skipped record rather than a failed run.
 */
public class InvalidEmployeeRecordException extends DomainException {

	/**
	 * Creates the exception with the reason the record was rejected.
	 *
	 * @param reason description of the structural problem
	 */
    public InvalidEmployeeRecordException(String reason) {
        super("Invalid employee record: " + reason);
    }
}
