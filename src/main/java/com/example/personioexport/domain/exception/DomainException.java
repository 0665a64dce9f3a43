package com.example.personioexport.domain.exception;

/**
 * Base type for failures raised while mapping Personio records onto the export model.
 * These concern a single record and never abort a whole run on their own.
 */
public abstract class DomainException extends RuntimeException {

	/**
	 * @param message which record could not be mapped and why
	 */
    protected DomainException(String message) {
        super(message);
    }
}
