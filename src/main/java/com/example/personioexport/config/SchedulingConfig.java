package com.example.personioexport.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Turns on Spring scheduling unless the export schedule is disabled.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "personio.schedule", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
