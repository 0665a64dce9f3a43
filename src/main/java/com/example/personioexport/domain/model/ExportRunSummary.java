package com.example.personioexport.domain.model;

import java.time.Instant;

/**
 * Result of a successful export run, returned by the export trigger endpoint.
 */
public record ExportRunSummary(
        Instant startedAt,
        Instant finishedAt,
        int employeeCount,
        int skippedRecords,
        int departmentCount,
        String employeeCsv,
        String departmentCsv,
        FetchReport documents
) {
}
