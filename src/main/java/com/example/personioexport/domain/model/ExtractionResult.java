package com.example.personioexport.domain.model;

import java.util.List;

/**
 * Employee data pulled from Personio during one run, before transformation.
 */
public record ExtractionResult(List<RawEmployeeRecord> employees) {

    public ExtractionResult {
        employees = List.copyOf(employees);
    }
}
