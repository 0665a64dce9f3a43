package com.example.personioexport.domain.model;

import java.time.Instant;

/**
 * Status of the most recent export run as exposed by the health endpoint.
 *
 * @param status     whether the run succeeded
 * @param finishedAt when the run ended
 * @param errorType  simple name of the fatal exception, {@code null} on success
 * @param message    failure message, {@code null} on success
 * @param summary    run summary, {@code null} on failure
 */
public record ExportRunOutcome(
        RunStatus status,
        Instant finishedAt,
        String errorType,
        String message,
        ExportRunSummary summary
) {

    public static ExportRunOutcome succeeded(ExportRunSummary summary) {
        return new ExportRunOutcome(RunStatus.SUCCEEDED, summary.finishedAt(), null, null, summary);
    }

    public static ExportRunOutcome failed(Instant finishedAt, Throwable error) {
        return new ExportRunOutcome(RunStatus.FAILED, finishedAt, error.getClass().getSimpleName(), error.getMessage(), null);
    }

    /**
     * Terminal status of a run.
     */
    public enum RunStatus {
        SUCCEEDED,
        FAILED
    }
}
