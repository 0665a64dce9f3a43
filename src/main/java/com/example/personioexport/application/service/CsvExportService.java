package com.example.personioexport.application.service;

import com.example.personioexport.domain.model.DepartmentStat;
import com.example.personioexport.domain.model.EmployeeRow;
import com.example.personioexport.infrastructure.exception.FileWriteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Application-layer service that writes the export CSV files.
 * Files are written to a temporary sibling and moved into place, so a reader never sees a
 * truncated file under the final name.
 */
@Service
public class CsvExportService {

    public static final String EMPLOYEE_FILE = "personio_employee_export.csv";
    public static final String DEPARTMENT_FILE = "department_summary.csv";

    private static final Logger log = LoggerFactory.getLogger(CsvExportService.class);

	/**
	 * Creates the output directory when missing and checks it can be written.
	 *
	 * @param outputDir export output directory
	 * @throws FileWriteException when the directory cannot be created or written
	 */
    public void prepareOutputDirectory(Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException ex) {
            throw new FileWriteException(outputDir, ex);
        }
        if (!Files.isWritable(outputDir)) {
            throw new FileWriteException(outputDir, "directory is not writable");
        }
    }

	/**
	 * Writes {@value #EMPLOYEE_FILE}.
	 *
	 * @param outputDir export output directory
	 * @param rows      flattened employee rows
	 * @return path of the written file
	 */
    public Path writeEmployees(Path outputDir, List<EmployeeRow> rows) {
        log.debug("Writing employee rows with schema version {}", EmployeeRow.SCHEMA_VERSION);
        return writeCsv(outputDir.resolve(EMPLOYEE_FILE), EmployeeRow.HEADERS,
                rows.stream().map(EmployeeRow::values).toList());
    }

	/**
	 * Writes {@value #DEPARTMENT_FILE}.
	 *
	 * @param outputDir export output directory
	 * @param stats     department statistics
	 * @return path of the written file
	 */
    public Path writeDepartmentSummary(Path outputDir, List<DepartmentStat> stats) {
        return writeCsv(outputDir.resolve(DEPARTMENT_FILE), DepartmentStat.HEADERS,
                stats.stream().map(DepartmentStat::values).toList());
    }

	/**
	 * Writes a UTF-8 CSV file atomically.
	 *
	 * @param target  final file path
	 * @param headers header row
	 * @param rows    data rows, each with one value per header
	 * @return {@code target}
	 * @throws FileWriteException when the file cannot be written or moved into place
	 */
    public Path writeCsv(Path target, List<String> headers, List<List<String>> rows) {
        log.info("Saving data to {}...", target);
        Path directory = target.toAbsolutePath().getParent();
        Path temp = null;
        try {
            temp = Files.createTempFile(directory, "." + target.getFileName(), ".tmp");
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                writeLine(writer, headers);
                for (List<String> row : rows) {
                    writeLine(writer, row);
                }
            }
            moveIntoPlace(temp, target);
        } catch (IOException ex) {
            deleteQuietly(temp);
            throw new FileWriteException(target, ex);
        }
        log.info("Successfully saved {} rows to {}", rows.size(), target.getFileName());
        return target;
    }

    private void writeLine(Writer writer, List<String> values) throws IOException {
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                writer.write(',');
            }
            writer.write(escape(values.get(i)));
        }
        writer.write("\r\n");
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            log.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException ex) {
            log.warn("Could not remove temporary file {}: {}", temp, ex.getMessage());
        }
    }

	/**
	 * Escapes CSV values by quoting entries containing commas, quotes, or line breaks.
	 *
	 * @param value raw column value
	 * @return sanitized CSV-safe token
	 */
    private String escape(String value) {
        if (value == null) {
            return "";
        }
        String sanitized = value.replace("\"", "\"\"");
        if (sanitized.contains(",") || sanitized.contains("\"") || sanitized.contains("\n") || sanitized.contains("\r")) {
            return "\"" + sanitized + "\"";
        }
        return sanitized;
    }
}
