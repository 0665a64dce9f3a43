package com.example.personioexport.application.service;

import com.example.personioexport.application.exception.ExportAlreadyRunningException;
import com.example.personioexport.config.PersonioProperties;
import com.example.personioexport.domain.model.DepartmentStat;
import com.example.personioexport.domain.model.EmployeeRow;
import com.example.personioexport.domain.model.ExportRunOutcome;
import com.example.personioexport.domain.model.ExportRunSummary;
import com.example.personioexport.domain.model.ExtractionResult;
import com.example.personioexport.domain.model.FetchReport;
import com.example.personioexport.infrastructure.exception.FileWriteException;
import com.example.personioexport.infrastructure.exception.PersonioApiException;
import com.example.personioexport.infrastructure.exception.PersonioAuthenticationException;
import com.example.personioexport.infrastructure.personio.TokenProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Application-layer service that runs one complete export:
 * authenticate, extract, transform, write both CSV files, then list and download documents.
 * <p>
 * Fatal failures propagate to the caller after being recorded as the last outcome; no CSV file
 * is replaced unless extraction and transformation completed.
 */
@Service
public class ExportJobService {

    private static final Logger log = LoggerFactory.getLogger(ExportJobService.class);

    private final TokenProvider tokenProvider;
    private final EmployeeExtractor extractor;
    private final EmployeeRowTransformer transformer;
    private final DepartmentSummaryService summaryService;
    private final CsvExportService csvExportService;
    private final DocumentFetchService documentFetchService;
    private final PersonioProperties.Export exportProperties;
    private final Clock clock;
    private final ReentrantLock runLock = new ReentrantLock();

    private volatile ExportRunOutcome lastOutcome;

    public ExportJobService(TokenProvider tokenProvider,
                            EmployeeExtractor extractor,
                            EmployeeRowTransformer transformer,
                            DepartmentSummaryService summaryService,
                            CsvExportService csvExportService,
                            DocumentFetchService documentFetchService,
                            PersonioProperties properties,
                            Clock clock) {
        this.tokenProvider = tokenProvider;
        this.extractor = extractor;
        this.transformer = transformer;
        this.summaryService = summaryService;
        this.csvExportService = csvExportService;
        this.documentFetchService = documentFetchService;
        this.exportProperties = properties.export();
        this.clock = clock;
    }

	/**
	 * Runs one export synchronously.
	 *
	 * @return summary of the completed run
	 * @throws ExportAlreadyRunningException    when another run is in progress
	 * @throws PersonioAuthenticationException  when the credential exchange fails
	 * @throws PersonioApiException             when a resource cannot be fetched
	 * @throws FileWriteException               when the output cannot be written
	 */
    public ExportRunSummary runExport() {
        if (!runLock.tryLock()) {
            throw new ExportAlreadyRunningException();
        }
        try {
            ExportRunSummary summary = execute();
            lastOutcome = ExportRunOutcome.succeeded(summary);
            return summary;
        } catch (RuntimeException ex) {
            lastOutcome = ExportRunOutcome.failed(clock.instant(), ex);
            throw ex;
        } finally {
            runLock.unlock();
        }
    }

	/**
	 * @return outcome of the most recent run, empty before the first run
	 */
    public Optional<ExportRunOutcome> lastOutcome() {
        return Optional.ofNullable(lastOutcome);
    }

    private ExportRunSummary execute() {
        Instant startedAt = clock.instant();
        Path outputDir = exportProperties.outputPath();
        log.info("--- Starting Personio export into {} ---", outputDir.toAbsolutePath());

        csvExportService.prepareOutputDirectory(outputDir);
        tokenProvider.getValidToken();

        ExtractionResult extraction = extractor.extractAll();

        log.info("Transforming employee data...");
        List<EmployeeRow> rows = transformer.flattenAll(extraction.employees());
        int skipped = extraction.employees().size() - rows.size();
        log.info("Successfully transformed {} employee records ({} skipped).", rows.size(), skipped);

        List<DepartmentStat> stats = summaryService.summarize(rows);
        Path employeeCsv = csvExportService.writeEmployees(outputDir, rows);
        Path departmentCsv = csvExportService.writeDepartmentSummary(outputDir, stats);

        List<String> employeeIds = rows.stream().map(EmployeeRow::employeeId).toList();
        FetchReport documents = documentFetchService.fetchDocuments(
                employeeIds, outputDir, exportProperties.includeDocuments());

        Instant finishedAt = clock.instant();
        log.info("--- Personio export completed: {} employees, {} departments, {} documents stored, {} failed, "
                        + "{} employees without document listing ---",
                rows.size(), stats.size(), documents.succeeded(), documents.failed().size(),
                documents.failedListings().size());
        return new ExportRunSummary(startedAt, finishedAt, rows.size(), skipped, stats.size(),
                employeeCsv.toString(), departmentCsv.toString(), documents);
    }
}
