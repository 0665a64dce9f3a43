package com.example.personioexport.application.service;

import com.example.personioexport.config.PersonioProperties;
import com.example.personioexport.domain.model.DocumentRef;
import com.example.personioexport.domain.model.FetchReport;
import com.example.personioexport.domain.model.FetchReport.FailedDocument;
import com.example.personioexport.domain.model.FetchReport.FailedListing;
import com.example.personioexport.infrastructure.exception.PersonioApiException;
import com.example.personioexport.infrastructure.personio.PersonioHttpGateway;
import com.example.personioexport.infrastructure.pdf.PdfDocumentInspector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Lists and downloads employee documents into {@code <output>/documents/<employeeId>/<filename>}.
 * <p>
 * Runs after the CSV files are written. Downloads run on a bounded pool sharing the HTTP gateway.
 * A listing that fails for one employee, or a failed document, is recorded in the
 * {@link FetchReport} and never stops the other employees, the other downloads or the run.
 */
@Service
public class DocumentFetchService {

    public static final String DOCUMENTS_DIR = "documents";

    private static final Logger log = LoggerFactory.getLogger(DocumentFetchService.class);

    private final EmployeeExtractor extractor;
    private final PersonioHttpGateway gateway;
    private final PdfDocumentInspector pdfInspector;
    private final int workers;
    private final boolean verifyPdfDocuments;

	/**
	 * Creates the fetcher.
	 *
	 * @param extractor    source of per-employee document metadata
	 * @param gateway      HTTP gateway shared with the extraction
	 * @param pdfInspector PDFBox based payload check
	 * @param properties   export configuration (pool size, PDF verification)
	 */
    public DocumentFetchService(EmployeeExtractor extractor,
                                PersonioHttpGateway gateway,
                                PdfDocumentInspector pdfInspector,
                                PersonioProperties properties) {
        this.extractor = extractor;
        this.gateway = gateway;
        this.pdfInspector = pdfInspector;
        this.workers = properties.export().documentWorkers();
        this.verifyPdfDocuments = properties.export().verifyPdfDocuments();
    }

	/**
	 * Lists the documents of every employee and downloads them.
	 *
	 * @param employeeIds employees whose documents are exported
	 * @param outputRoot  export output directory
	 * @param enabled     when {@code false} nothing is listed or downloaded
	 * @return counts of stored documents, failed downloads and failed listings
	 */
    public FetchReport fetchDocuments(List<String> employeeIds, Path outputRoot, boolean enabled) {
        if (!enabled) {
            return FetchReport.empty();
        }
        List<DocumentRef> refs = new ArrayList<>();
        List<FailedListing> failedListings = new ArrayList<>();
        for (String employeeId : employeeIds) {
            try {
                refs.addAll(extractor.listDocuments(employeeId));
            } catch (PersonioApiException ex) {
                log.warn("Skipping documents of employee {}, listing failed: {}", employeeId, ex.getMessage());
                failedListings.add(new FailedListing(employeeId, describe(ex)));
            }
        }
        log.info("Found {} documents to download", refs.size());
        return download(refs, outputRoot).withFailedListings(failedListings);
    }

	/**
	 * Downloads every referenced document.
	 *
	 * @param refs       documents to download
	 * @param outputRoot export output directory
	 * @return counts of stored documents and the failures in input order
	 */
    public FetchReport download(List<DocumentRef> refs, Path outputRoot) {
        if (refs.isEmpty()) {
            return FetchReport.empty();
        }
        log.info("Starting download of {} documents with {} workers...", refs.size(), workers);
        Path documentsRoot = outputRoot.resolve(DOCUMENTS_DIR);

        ExecutorService executor = Executors.newFixedThreadPool(
                Math.min(workers, refs.size()), new CustomizableThreadFactory("document-fetch-"));
        List<Future<String>> results = new ArrayList<>(refs.size());
        try {
            for (DocumentRef ref : refs) {
                results.add(executor.submit(() -> fetchOne(ref, documentsRoot)));
            }
            return collect(refs, results);
        } finally {
            executor.shutdownNow();
        }
    }

    private FetchReport collect(List<DocumentRef> refs, List<Future<String>> results) {
        int succeeded = 0;
        List<FailedDocument> failed = new ArrayList<>();
        for (int i = 0; i < refs.size(); i++) {
            DocumentRef ref = refs.get(i);
            String failure;
            try {
                failure = results.get(i).get();
            } catch (ExecutionException ex) {
                failure = describe(ex.getCause());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                failure = "interrupted";
            }
            if (failure == null) {
                succeeded++;
            } else {
                log.warn("Failed to download document {} for employee {}: {}",
                        ref.documentId(), ref.employeeId(), failure);
                failed.add(FailedDocument.of(ref, failure));
            }
        }
        log.info("Document download finished: {} stored, {} failed", succeeded, failed.size());
        return new FetchReport(succeeded, failed, List.of());
    }

	/**
	 * Downloads and stores one document.
	 *
	 * @return {@code null} on success, otherwise the failure reason
	 */
    private String fetchOne(DocumentRef ref, Path documentsRoot) {
        try {
            Path employeeDir = documentsRoot.resolve(ref.employeeId());
            Files.createDirectories(employeeDir);
            byte[] payload = gateway.download(ref.downloadEndpoint());
            if (verifyPdfDocuments && ref.filename().toLowerCase(Locale.ROOT).endsWith(".pdf")) {
                pdfInspector.inspect(payload, ref.filename());
            }
            Path target = employeeDir.resolve(ref.filename());
            Files.write(target, payload);
            log.debug("Saved {} bytes to {}", payload.length, target);
            return null;
        } catch (IOException | RuntimeException ex) {
            return describe(ex);
        }
    }

    private String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }
}
