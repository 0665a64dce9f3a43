package com.example.personioexport.domain.model;

import java.util.List;

/**
 * Outcome of a document download pass.
 *
 * @param succeeded      number of documents written to disk
 * @param failed         documents that could not be downloaded, in input order
 * @param failedListings employees whose document metadata could not be listed
 */
public record FetchReport(int succeeded, List<FailedDocument> failed, List<FailedListing> failedListings) {

    public FetchReport {
        failed = List.copyOf(failed);
        failedListings = List.copyOf(failedListings);
    }

	/**
	 * @return report for a pass that did not run
	 */
    public static FetchReport empty() {
        return new FetchReport(0, List.of(), List.of());
    }

	/**
	 * @param listings listing failures collected before the downloads started
	 * @return copy of this report carrying the given listing failures
	 */
    public FetchReport withFailedListings(List<FailedListing> listings) {
        return new FetchReport(succeeded, failed, listings);
    }

    /**
     * A document that could not be stored and why. Carries no download location, which may be a
     * signed link.
     */
    public record FailedDocument(String employeeId, String documentId, String filename, String reason) {

        public static FailedDocument of(DocumentRef ref, String reason) {
            return new FailedDocument(ref.employeeId(), ref.documentId(), ref.filename(), reason);
        }
    }

    /**
     * An employee whose documents were skipped because their metadata could not be listed.
     */
    public record FailedListing(String employeeId, String reason) {
    }
}
