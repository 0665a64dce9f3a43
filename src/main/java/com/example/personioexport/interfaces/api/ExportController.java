package com.example.personioexport.interfaces.api;

import com.example.personioexport.application.service.ExportJobService;
import com.example.personioexport.domain.model.ExportRunSummary;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Interfaces-layer REST controller that triggers an export run on demand.
 */
@RestController
public class ExportController {

    private final ExportJobService exportJobService;

	/**
	 * Creates the controller with the export orchestration service.
	 *
	 * @param exportJobService service running the export
	 */
    public ExportController(ExportJobService exportJobService) {
        this.exportJobService = exportJobService;
    }

	/**
	 * Runs an export synchronously. Failures are mapped by
	 * {@link com.example.personioexport.interfaces.api.error.GlobalExceptionHandler}.
	 *
	 * @return summary of the completed run
	 */
    @PostMapping(value = "/api/exports", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ExportRunSummary> runExport() {
        return ResponseEntity.ok(exportJobService.runExport());
    }
}
