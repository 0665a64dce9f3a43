package com.example.personioexport.config;

import com.example.personioexport.application.exception.InvalidConfigurationException;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration properties for the Personio export.
 * Bound once at startup and treated as immutable for the lifetime of the process.
 */
@ConfigurationProperties(prefix = "personio")
public record PersonioProperties(
        Api api,
        @DefaultValue Export export,
        @DefaultValue Schedule schedule
) {

    public PersonioProperties {
        if (api == null) {
            throw new InvalidConfigurationException("Missing personio.api configuration section");
        }
    }

    /**
     * Connection settings for the Personio API.
     *
     * @param clientId          API client id (PERSONIO_CLIENT_ID)
     * @param clientSecret      API client secret (PERSONIO_CLIENT_SECRET)
     * @param baseUrl           API root, without trailing slash
     * @param httpTimeout       connect and read timeout of a single HTTP attempt
     * @param retryMaxAttempts  maximum physical attempts per call for transient failures
     * @param retryBaseDelay    first backoff delay, doubled per failed attempt
     * @param retryMaxDelay     upper bound of a computed backoff delay
     * @param tokenLifetime     credential lifetime when the auth response does not state one
     * @param tokenSafetyMargin how long before expiry a credential is refreshed
     * @param pageSize          {@code limit} sent with paginated requests
     * @param maxPages          hard stop for a single paginated fetch
     * @param endpoints         resource paths
     */
    public record Api(
            String clientId,
            String clientSecret,
            @DefaultValue("https://api.personio.de") String baseUrl,
            @DefaultValue("30s") Duration httpTimeout,
            @DefaultValue("5") int retryMaxAttempts,
            @DefaultValue("1s") Duration retryBaseDelay,
            @DefaultValue("60s") Duration retryMaxDelay,
            @DefaultValue("1h") Duration tokenLifetime,
            @DefaultValue("100s") Duration tokenSafetyMargin,
            @DefaultValue("100") int pageSize,
            @DefaultValue("1000") int maxPages,
            @DefaultValue Endpoints endpoints
    ) {

        public Api {
            if (clientId == null || clientId.isBlank()) {
                throw new InvalidConfigurationException("Missing mandatory setting personio.api.client-id (PERSONIO_CLIENT_ID)");
            }
            if (clientSecret == null || clientSecret.isBlank()) {
                throw new InvalidConfigurationException("Missing mandatory setting personio.api.client-secret (PERSONIO_CLIENT_SECRET)");
            }
            if (baseUrl == null || baseUrl.isBlank()) {
                throw new InvalidConfigurationException("Missing mandatory setting personio.api.base-url");
            }
            if (retryMaxAttempts < 1) {
                throw new InvalidConfigurationException("personio.api.retry-max-attempts must be at least 1");
            }
            if (pageSize < 1 || maxPages < 1) {
                throw new InvalidConfigurationException("personio.api.page-size and max-pages must be positive");
            }
            baseUrl = baseUrl.strip().replaceAll("/+$", "");
        }

        @Override
        public String toString() {
            return "Api[clientId=" + clientId + ", clientSecret=***, baseUrl=" + baseUrl + "]";
        }
    }

    /**
     * Paths of the Personio resources read by the export.
     * Document paths may contain {@code {employeeId}} and {@code {documentId}} placeholders.
     */
    public record Endpoints(
            @DefaultValue("v1/auth") String auth,
            @DefaultValue("company/employees") String employees,
            @DefaultValue("company/employments") String employments,
            @DefaultValue("company/compensations") String compensations,
            @DefaultValue("company/employees/{employeeId}/documents") String documents,
            @DefaultValue("company/employees/{employeeId}/documents/{documentId}/download") String documentDownload
    ) {
    }

    /**
     * Output settings.
     *
     * @param outputPath         directory receiving the CSV files and the documents tree
     * @param includeDocuments   whether document metadata is read and payloads downloaded
     * @param verifyPdfDocuments whether {@code .pdf} payloads are checked with PDFBox before being kept
     * @param documentWorkers    size of the document download pool
     * @param runOnStartup       whether one export runs as soon as the application is ready
     */
    public record Export(
            @DefaultValue("./output") Path outputPath,
            @DefaultValue("true") boolean includeDocuments,
            @DefaultValue("true") boolean verifyPdfDocuments,
            @DefaultValue("4") int documentWorkers,
            @DefaultValue("true") boolean runOnStartup
    ) {

        public Export {
            if (documentWorkers < 1) {
                throw new InvalidConfigurationException("personio.export.document-workers must be at least 1");
            }
        }
    }

    /**
     * Scheduling settings. The cron expression uses Spring's six-field format.
     */
    public record Schedule(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("0 0 2 * * *") String cron
    ) {
    }
}
