package com.example.personioexport.interfaces.scheduling;

import com.example.personioexport.application.service.ExportJobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs one export as soon as the application has started.
 * In one-shot mode the exit code of the process reflects the outcome of this run.
 */
@Component
@ConditionalOnProperty(prefix = "personio.export", name = "run-on-startup", havingValue = "true", matchIfMissing = true)
public class ExportStartupRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(ExportStartupRunner.class);

    private final ExportJobService exportJobService;
    private volatile int exitCode;

    public ExportStartupRunner(ExportJobService exportJobService) {
        this.exportJobService = exportJobService;
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            exportJobService.runExport();
            exitCode = 0;
        } catch (RuntimeException e) {
            log.error("Export job failed with error: {}", e.getMessage(), e);
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
