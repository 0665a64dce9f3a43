package com.example.personioexport.application.service;

import com.example.personioexport.application.exception.ExportAlreadyRunningException;
import com.example.personioexport.config.PersonioClientConfig;
import com.example.personioexport.config.PersonioProperties;
import com.example.personioexport.domain.model.EmployeeRow;
import com.example.personioexport.domain.model.ExportRunOutcome;
import com.example.personioexport.domain.model.ExportRunSummary;
import com.example.personioexport.domain.model.ExtractionResult;
import com.example.personioexport.domain.model.FetchReport;
import com.example.personioexport.infrastructure.exception.PersonioApiException;
import com.example.personioexport.infrastructure.exception.PersonioAuthenticationException;
import com.example.personioexport.infrastructure.pdf.PdfDocumentInspector;
import com.example.personioexport.infrastructure.personio.PersonioHttpGateway;
import com.example.personioexport.infrastructure.personio.TokenProvider;
import com.example.personioexport.testutil.CsvTestReader;
import com.example.personioexport.testutil.PdfFixtures;
import com.example.personioexport.testutil.RecordingSleeper;
import com.example.personioexport.testutil.StubPersonioServer;
import com.example.personioexport.testutil.StubPersonioServer.StubResponse;
import com.example.personioexport.testutil.TestProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.BDDMockito;
import org.mockito.Mockito;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * End-to-end tests of one export run against an in-process Personio stub.
 */
class ExportJobServiceTest {

    private static final String EMPLOYEES = "/v1/company/employees";
    private static final String EMPLOYMENTS = "/v1/company/employments";
    private static final String COMPENSATIONS = "/v1/company/compensations";

    @TempDir
    Path tempDir;

    private StubPersonioServer server;
    private Path outputDir;
    private PersonioProperties properties;
    private ExportJobService service;

    @BeforeEach
    void setUp() throws IOException {
        server = StubPersonioServer.start();
        outputDir = tempDir.resolve("output");
        properties = TestProperties.properties(server.baseUrl(), outputDir);

        Clock clock = Clock.systemUTC();
        RestClient restClient = new PersonioClientConfig().personioRestClient(properties);
        TokenProvider tokenProvider = new TokenProvider(restClient, properties, clock);
        PersonioHttpGateway gateway = new PersonioHttpGateway(restClient, tokenProvider, properties,
                new ObjectMapper(), new RecordingSleeper(), clock);
        EmployeeExtractor extractor = new EmployeeExtractor(gateway, properties);
        service = new ExportJobService(
                tokenProvider,
                extractor,
                new EmployeeRowTransformer(),
                new DepartmentSummaryService(),
                new CsvExportService(),
                new DocumentFetchService(extractor, gateway, new PdfDocumentInspector(), properties),
                properties,
                clock);
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    /**
     * Ensures a run writes both CSV files and the documents tree, and that a failed document
     * download is reported without failing the run.
     *
     * @throws IOException when an output file cannot be read
     */
    @Test
    void runWritesCsvFilesAndReportsDocumentFailures() throws IOException {
        stubHappyPath();
        server.always("/v1/company/employees/1002/documents/12/download", StubResponse.json(500, "{}"));

        ExportRunSummary summary = service.runExport();

        assertThat(summary.employeeCount()).isEqualTo(3);
        assertThat(summary.skippedRecords()).isZero();
        assertThat(summary.departmentCount()).isEqualTo(2);
        assertThat(summary.documents().succeeded()).isEqualTo(1);
        assertThat(summary.documents().failed()).hasSize(1);
        assertThat(summary.documents().failedListings()).isEmpty();
        assertThat(summary.documents().failed().get(0).documentId()).isEqualTo("12");

        List<List<String>> employees = CsvTestReader.read(outputDir.resolve(CsvExportService.EMPLOYEE_FILE));
        assertThat(employees).hasSize(4);
        assertThat(employees.get(1)).startsWith("1001", "Jonas", "Weber");
        assertThat(employees.get(1).get(15)).isEmpty();
        assertThat(employees.get(2).get(15)).isEqualTo("60000.00");

        List<List<String>> departments = CsvTestReader.read(outputDir.resolve(CsvExportService.DEPARTMENT_FILE));
        assertThat(departments).containsExactly(
                List.of("department", "employee_count", "average_base_salary"),
                List.of("Engineering", "2", "70000.00"),
                List.of("Sales", "1", ""));

        Path contract = outputDir.resolve("documents").resolve("1002").resolve("Contract.pdf");
        assertThat(contract).exists();
        assertThat(outputDir.resolve("documents").resolve("1002").resolve("Payslip.pdf")).doesNotExist();

        ExportRunOutcome outcome = service.lastOutcome().orElseThrow();
        assertThat(outcome.status()).isEqualTo(ExportRunOutcome.RunStatus.SUCCEEDED);
        assertThat(outcome.summary()).isEqualTo(summary);
    }

    /**
     * Ensures a document listing rejected for one employee is reported after both CSV files are
     * written, and the other employees' documents are still downloaded.
     *
     * @throws IOException when an output file cannot be read
     */
    @Test
    void failedDocumentListingKeepsCsvFiles() throws IOException {
        stubHappyPath();
        server.always("/v1/company/employees/1002/documents/12/download", StubResponse.bytes(200, PdfFixtures.pdf(1)));
        server.always("/v1/company/employees/1003/documents", StubResponse.json(403, "{\"success\":false}"));

        ExportRunSummary summary = service.runExport();

        assertThat(summary.employeeCount()).isEqualTo(3);
        assertThat(summary.documents().succeeded()).isEqualTo(2);
        assertThat(summary.documents().failed()).isEmpty();
        assertThat(summary.documents().failedListings())
                .extracting(FetchReport.FailedListing::employeeId)
                .containsExactly("1003");
        assertThat(CsvTestReader.read(outputDir.resolve(CsvExportService.EMPLOYEE_FILE))).hasSize(4);
        assertThat(CsvTestReader.read(outputDir.resolve(CsvExportService.DEPARTMENT_FILE))).hasSize(3);
        assertThat(outputDir.resolve("documents").resolve("1002").resolve("Payslip.pdf")).exists();
        assertThat(service.lastOutcome().orElseThrow().status()).isEqualTo(ExportRunOutcome.RunStatus.SUCCEEDED);
    }

    /**
     * Ensures a resource failure fails the run without touching existing CSV files.
     *
     * @throws IOException when an output file cannot be prepared or read
     */
    @Test
    void apiFailureKeepsPreviousCsvFiles() throws IOException {
        Files.createDirectories(outputDir);
        Path previous = Files.writeString(outputDir.resolve(CsvExportService.EMPLOYEE_FILE), "previous run");
        server.always(EMPLOYEES, StubResponse.json(200, employeesJson()));
        server.always(EMPLOYMENTS, StubResponse.json(403, "{\"success\":false}"));

        PersonioApiException ex = assertThrows(PersonioApiException.class, () -> service.runExport());

        assertThat(ex.getStatus()).isEqualTo(403);
        assertThat(previous).hasContent("previous run");
        assertThat(outputDir.resolve(CsvExportService.DEPARTMENT_FILE)).doesNotExist();
        ExportRunOutcome outcome = service.lastOutcome().orElseThrow();
        assertThat(outcome.status()).isEqualTo(ExportRunOutcome.RunStatus.FAILED);
        assertThat(outcome.errorType()).isEqualTo("PersonioApiException");
    }

    /**
     * Ensures rejected credentials fail the run before anything is written.
     */
    @Test
    void authenticationFailureWritesNothing() {
        server.always(StubPersonioServer.AUTH_PATH, StubResponse.json(403, "{\"success\":false}"));

        assertThrows(PersonioAuthenticationException.class, () -> service.runExport());

        assertThat(outputDir.resolve(CsvExportService.EMPLOYEE_FILE)).doesNotExist();
        assertThat(server.requests(EMPLOYEES)).isEmpty();
    }

    /**
     * Ensures a second trigger is rejected while a run is in progress.
     *
     * @throws Exception when the background run fails unexpectedly
     */
    @Test
    void concurrentRunIsRejected() throws Exception {
        CountDownLatch extracting = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        EmployeeExtractor blockingExtractor = Mockito.mock(EmployeeExtractor.class);
        BDDMockito.given(blockingExtractor.extractAll()).willAnswer(invocation -> {
            extracting.countDown();
            release.await(5, TimeUnit.SECONDS);
            return new ExtractionResult(List.of());
        });
        TokenProvider tokenProvider = new TokenProvider(
                new PersonioClientConfig().personioRestClient(properties), properties, Clock.systemUTC());
        PersonioHttpGateway unusedGateway = Mockito.mock(PersonioHttpGateway.class);
        ExportJobService blockingService = new ExportJobService(tokenProvider, blockingExtractor,
                new EmployeeRowTransformer(), new DepartmentSummaryService(), new CsvExportService(),
                new DocumentFetchService(blockingExtractor, unusedGateway, new PdfDocumentInspector(), properties),
                properties, Clock.systemUTC());

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<ExportRunSummary> first = executor.submit(blockingService::runExport);
            assertThat(extracting.await(5, TimeUnit.SECONDS)).isTrue();

            assertThrows(ExportAlreadyRunningException.class, blockingService::runExport);

            release.countDown();
            assertThat(first.get(5, TimeUnit.SECONDS).employeeCount()).isZero();
        } finally {
            executor.shutdownNow();
        }
        assertThat(outputDir.resolve(CsvExportService.EMPLOYEE_FILE)).hasContent(
                String.join(",", EmployeeRow.HEADERS) + "\r\n");
    }

    private void stubHappyPath() {
        server.always(EMPLOYEES, StubResponse.json(200, employeesJson()));
        server.always(EMPLOYMENTS, StubResponse.json(200, """
                {"data":[
                  {"employee_id":1002,"position":"Backend Engineer","employment_type":"internal"},
                  {"employee_id":9999,"position":"Orphan"}
                ],"metadata":{"current_page":1,"total_pages":1}}
                """));
        server.always(COMPENSATIONS, StubResponse.json(200, """
                {"data":[
                  {"employee_id":1002,"type":"base_salary","amount":60000},
                  {"employee_id":1003,"type":"base_salary","amount":80000}
                ],"metadata":{"current_page":1,"total_pages":1}}
                """));
        server.always("/v1/company/employees/1001/documents", StubResponse.json(200, "{\"data\":[]}"));
        server.always("/v1/company/employees/1003/documents", StubResponse.json(200, "{\"data\":[]}"));
        server.always("/v1/company/employees/1002/documents", StubResponse.json(200, """
                {"data":[
                  {"id":11,"title":"Contract","extension":"pdf"},
                  {"id":12,"title":"Payslip","extension":"pdf"}
                ],"metadata":{"current_page":1,"total_pages":1}}
                """));
        server.always("/v1/company/employees/1002/documents/11/download", StubResponse.bytes(200, PdfFixtures.pdf(1)));
    }

    private String employeesJson() {
        return """
                {"success":true,"data":[
                  {"type":"Employee","attributes":{"id":{"value":1001},"first_name":{"value":"Jonas"},
                    "last_name":{"value":"Weber"},"department":{"value":{"attributes":{"name":"Sales"}}}}},
                  {"type":"Employee","attributes":{"id":{"value":1002},"first_name":{"value":"Anna"},
                    "last_name":{"value":"Schmidt"},"department":{"value":{"attributes":{"name":"Engineering"}}}}},
                  {"type":"Employee","attributes":{"id":{"value":1003},"first_name":{"value":"Lena"},
                    "last_name":{"value":"Koch"},"department":{"value":{"attributes":{"name":"Engineering"}}}}}
                ],"metadata":{"current_page":1,"total_pages":1}}
                """;
    }
}
