package com.example.personioexport.domain.model;

/**
 * Reference to one downloadable employee document.
 *
 * @param employeeId       owning employee
 * @param documentId       Personio document identifier
 * @param filename         sanitized file name used on disk
 * @param downloadEndpoint endpoint or absolute URL that serves the binary payload
 */
public record DocumentRef(
        String employeeId,
        String documentId,
        String filename,
        String downloadEndpoint
) {
}
