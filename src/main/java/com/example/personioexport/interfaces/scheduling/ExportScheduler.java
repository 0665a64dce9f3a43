package com.example.personioexport.interfaces.scheduling;

import com.example.personioexport.application.exception.ExportAlreadyRunningException;
import com.example.personioexport.application.service.ExportJobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Triggers the export on the configured cron schedule.
 * Each run starts a fresh full extraction; failures are logged and the next run proceeds normally.
 */
@Component
@ConditionalOnProperty(prefix = "personio.schedule", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ExportScheduler {

    private static final Logger log = LoggerFactory.getLogger(ExportScheduler.class);

    private final ExportJobService exportJobService;

    public ExportScheduler(ExportJobService exportJobService) {
        this.exportJobService = exportJobService;
    }

    /**
     * Runs the export. Defaults to daily at 02:00.
     */
    @Scheduled(cron = "${personio.schedule.cron:0 0 2 * * *}")
    public void runScheduledExport() {
        log.info("=== Scheduled Job: Personio Export ===");
        try {
            exportJobService.runExport();
        } catch (ExportAlreadyRunningException e) {
            log.warn("Skipping scheduled export: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Scheduled export failed: {}", e.getMessage(), e);
        }
    }
}
