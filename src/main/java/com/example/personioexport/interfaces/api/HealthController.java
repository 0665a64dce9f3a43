package com.example.personioexport.interfaces.api;

import com.example.personioexport.application.service.ExportJobService;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Liveness endpoints used by container health checks.
 */
@RestController
public class HealthController {

    private final ExportJobService exportJobService;
    private final Clock clock;
    private final Instant startedAt;

    public HealthController(ExportJobService exportJobService, Clock clock) {
        this.exportJobService = exportJobService;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    @GetMapping(value = "/", produces = MediaType.TEXT_PLAIN_VALUE)
    public String index() {
        return "Personio export service is running.";
    }

	/**
	 * Reports process uptime and the outcome of the last export run.
	 *
	 * @return health payload, always with status {@code up} while the process serves requests
	 */
    @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public HealthResponse health() {
        Instant now = clock.instant();
        double uptimeSeconds = Duration.between(startedAt, now).toMillis() / 1000.0;
        return new HealthResponse("up", uptimeSeconds, now, exportJobService.lastOutcome().orElse(null));
    }
}
