package com.example.personioexport.application.service;

import com.example.personioexport.config.PersonioProperties;
import com.example.personioexport.domain.model.DocumentRef;
import com.example.personioexport.domain.model.ExtractionResult;
import com.example.personioexport.domain.model.RawEmployeeRecord;
import com.example.personioexport.infrastructure.exception.PersonioApiException;
import com.example.personioexport.infrastructure.personio.ParsedPage;
import com.example.personioexport.infrastructure.personio.PersonioHttpGateway;
import com.example.personioexport.infrastructure.personio.PersonioJson;
import com.example.personioexport.infrastructure.personio.PersonioPaths;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Application-layer service that pulls every resource needed for one export from Personio.
 * <p>
 * Master data defines the employee universe. Employment and compensation records are joined onto
 * it by employee id; records referencing unknown employees are dropped. Any of the three resources
 * that cannot be fetched fails the whole extraction. Document metadata is listed separately, per
 * employee, once the CSV files are written.
 */
@Service
public class EmployeeExtractor {

    private static final Logger log = LoggerFactory.getLogger(EmployeeExtractor.class);
    private static final Pattern UNSAFE_FILENAME_CHARS = Pattern.compile("[^\\p{Alnum}._\\- ]");

    private final PersonioHttpGateway gateway;
    private final PersonioProperties.Endpoints endpoints;

	/**
	 * Creates the extractor.
	 *
	 * @param gateway    HTTP gateway to Personio
	 * @param properties export configuration holding endpoint paths
	 */
    public EmployeeExtractor(PersonioHttpGateway gateway, PersonioProperties properties) {
        this.gateway = gateway;
        this.endpoints = properties.api().endpoints();
    }

	/**
	 * Fetches employees, employment details and compensation.
	 *
	 * @return joined raw records in master-data order
	 * @throws PersonioApiException when any of the three resources cannot be fetched
	 */
    public ExtractionResult extractAll() {
        log.info("Starting extraction of employee master data...");
        List<JsonNode> masterRecords = fetchAll(endpoints.employees());
        log.info("Successfully fetched {} employee records.", masterRecords.size());

        Map<String, Builder> byId = new LinkedHashMap<>();
        List<Builder> ordered = new ArrayList<>(masterRecords.size());
        for (JsonNode master : masterRecords) {
            String employeeId = PersonioJson.employeeId(master);
            Builder builder = new Builder(employeeId, master);
            if (employeeId.isEmpty()) {
                ordered.add(builder);
            } else if (byId.putIfAbsent(employeeId, builder) == null) {
                ordered.add(builder);
            } else {
                log.warn("Duplicate master record for employee {} ignored", employeeId);
            }
        }

        int orphanEmployments = join(endpoints.employments(), byId, Builder::addEmployment);
        int orphanCompensations = join(endpoints.compensations(), byId, Builder::addCompensation);
        if (orphanEmployments > 0 || orphanCompensations > 0) {
            log.debug("Dropped {} employment and {} compensation records without master data",
                    orphanEmployments, orphanCompensations);
        }

        List<RawEmployeeRecord> records = ordered.stream().map(Builder::build).toList();
        return new ExtractionResult(records);
    }

	/**
	 * Lists the documents of one employee. File names are unique within the employee: a repeated
	 * name gets the document id appended before its extension.
	 *
	 * @param employeeId employee whose documents are listed
	 * @return document references in server order
	 * @throws PersonioApiException when the listing cannot be fetched
	 */
    public List<DocumentRef> listDocuments(String employeeId) {
        log.debug("Fetching document metadata for employee {}...", employeeId);
        String endpoint = PersonioPaths.expand(endpoints.documents(), Map.of("employeeId", employeeId));
        List<DocumentRef> refs = new ArrayList<>();
        Set<String> usedNames = new HashSet<>();
        for (JsonNode document : fetchAll(endpoint)) {
            DocumentRef ref = toDocumentRef(employeeId, document, usedNames);
            if (ref != null) {
                refs.add(ref);
            }
        }
        return refs;
    }

    private List<JsonNode> fetchAll(String endpoint) {
        try (Stream<ParsedPage> pages = gateway.paginate(HttpMethod.GET, endpoint, Map.of())) {
            return pages.flatMap(page -> page.records().stream()).toList();
        }
    }

    private int join(String endpoint, Map<String, Builder> byId, SubRecordSink sink) {
        log.info("Fetching {}...", endpoint);
        int orphans = 0;
        List<JsonNode> records = fetchAll(endpoint);
        for (JsonNode record : records) {
            Builder builder = byId.get(PersonioJson.referencedEmployeeId(record));
            if (builder == null) {
                orphans++;
            } else {
                sink.accept(builder, record);
            }
        }
        log.info("Fetched {} records from {}", records.size(), endpoint);
        return orphans;
    }

    private DocumentRef toDocumentRef(String employeeId, JsonNode document, Set<String> usedNames) {
        String documentId = PersonioJson.text(PersonioJson.attribute(document, "id"));
        if (documentId.isEmpty()) {
            log.warn("Skipping document without id for employee {}", employeeId);
            return null;
        }
        String downloadUrl = PersonioJson.text(PersonioJson.attribute(document, "download_url"));
        String endpoint = downloadUrl.isEmpty()
                ? PersonioPaths.expand(endpoints.documentDownload(),
                        Map.of("employeeId", employeeId, "documentId", documentId))
                : downloadUrl;
        String name = uniqueName(filename(document, documentId), documentId, usedNames);
        return new DocumentRef(employeeId, documentId, name, endpoint);
    }

    static String uniqueName(String filename, String documentId, Set<String> usedNames) {
        String candidate = filename;
        int dot = filename.lastIndexOf('.');
        String stem = dot > 0 ? filename.substring(0, dot) : filename;
        String extension = dot > 0 ? filename.substring(dot) : "";
        int suffix = 1;
        // compared case-insensitively
        while (!usedNames.add(candidate.toLowerCase(Locale.ROOT))) {
            String tag = suffix == 1 ? documentId : documentId + "_" + suffix;
            candidate = stem + "_" + tag + extension;
            suffix++;
        }
        return candidate;
    }

	/**
	 * Builds a file name from the document title and extension, keeping only letters, digits,
	 * dots, underscores, dashes and spaces.
	 */
    static String filename(JsonNode document, String documentId) {
        String title = PersonioJson.text(PersonioJson.attribute(document, "title"));
        String extension = PersonioJson.text(PersonioJson.attribute(document, "extension")).replaceAll("^\\.+", "");
        String base = title.isEmpty() ? "document_" + documentId : title;
        String candidate = extension.isEmpty() || base.toLowerCase(Locale.ROOT).endsWith("." + extension.toLowerCase(Locale.ROOT))
                ? base
                : base + "." + extension;
        String cleaned = UNSAFE_FILENAME_CHARS.matcher(candidate).replaceAll("").strip();
        if (cleaned.isEmpty() || cleaned.chars().allMatch(c -> c == '.')) {
            return "document_" + documentId;
        }
        return cleaned;
    }

    @FunctionalInterface
    private interface SubRecordSink {
        void accept(Builder builder, JsonNode record);
    }

    private static final class Builder {

        private final String employeeId;
        private final JsonNode masterData;
        private final List<JsonNode> employments = new ArrayList<>();
        private final List<JsonNode> compensations = new ArrayList<>();

        private Builder(String employeeId, JsonNode masterData) {
            this.employeeId = employeeId;
            this.masterData = masterData;
        }

        private void addEmployment(JsonNode record) {
            employments.add(record);
        }

        private void addCompensation(JsonNode record) {
            compensations.add(record);
        }

        private RawEmployeeRecord build() {
            return new RawEmployeeRecord(employeeId, masterData, employments, compensations);
        }
    }
}
